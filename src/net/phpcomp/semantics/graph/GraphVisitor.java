/*
 * Copyright 2026 The PHP Flow Diagnostics Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.phpcomp.semantics.graph;

import static com.google.common.base.Preconditions.checkState;

import java.util.BitSet;
import net.phpcomp.semantics.BoundArgument;
import net.phpcomp.semantics.BoundArrayEx;
import net.phpcomp.semantics.BoundArrayItemEx;
import net.phpcomp.semantics.BoundAssertEx;
import net.phpcomp.semantics.BoundAssignEx;
import net.phpcomp.semantics.BoundBinaryEx;
import net.phpcomp.semantics.BoundDeclareStatement;
import net.phpcomp.semantics.BoundEvalEx;
import net.phpcomp.semantics.BoundExpressionStatement;
import net.phpcomp.semantics.BoundGlobalFunctionCall;
import net.phpcomp.semantics.BoundInstanceFunctionCall;
import net.phpcomp.semantics.BoundLiteral;
import net.phpcomp.semantics.BoundNewEx;
import net.phpcomp.semantics.BoundOperation;
import net.phpcomp.semantics.BoundReturnStatement;
import net.phpcomp.semantics.BoundRoutineCall;
import net.phpcomp.semantics.BoundRoutineName;
import net.phpcomp.semantics.BoundStatement;
import net.phpcomp.semantics.BoundStaticFunctionCall;
import net.phpcomp.semantics.BoundTemporalVariableRef;
import net.phpcomp.semantics.BoundTypeRef;
import net.phpcomp.semantics.BoundVariableRef;
import net.phpcomp.semantics.BoundYieldStatement;
import org.jspecify.annotations.Nullable;

/**
 * Depth-first walk over a {@link ControlFlowGraph} and the bound tree of its blocks.
 *
 * <p>Every node kind has exactly one {@code visit} method; the default implementation of each
 * recurses into the node's children left to right. Subclasses override the methods for the node
 * kinds they inspect and call {@code super} to keep descending.
 *
 * <p>Blocks are entered at most once per traversal. A block's statements are visited before its
 * outgoing edge, and the edge's targets in the order the edge declares them: the true target
 * before the false one, and the try body before the catch clauses, the finally clause and the
 * continuation.
 */
public abstract class GraphVisitor {

  private final BitSet visitedBlocks = new BitSet();
  private @Nullable BoundBlock currentBlock;

  /** Clears the visited marks so that every block counts as unreached. */
  protected void resetVisitedBlocks() {
    visitedBlocks.clear();
  }

  /** Whether the current traversal entered the block. */
  protected boolean isVisited(BoundBlock block) {
    return visitedBlocks.get(block.getOrdinal());
  }

  /** The block whose statements or edge are being visited. */
  protected @Nullable BoundBlock getCurrentBlock() {
    return currentBlock;
  }

  protected final void accept(@Nullable BoundOperation node) {
    if (node != null) {
      node.accept(this);
    }
  }

  private void acceptBlock(@Nullable BoundBlock block) {
    if (block != null) {
      block.accept(this);
    }
  }

  // Graph

  public void visitCFG(ControlFlowGraph graph) {
    BoundBlock start = graph.getStart();
    checkState(start != null, "control flow graph has no start block");
    start.accept(this);
  }

  public void visitCFGBlock(BoundBlock block) {
    if (visitedBlocks.get(block.getOrdinal())) {
      return;
    }
    visitedBlocks.set(block.getOrdinal());

    BoundBlock previous = currentBlock;
    currentBlock = block;
    try {
      visitCFGBlockInternal(block);
    } finally {
      currentBlock = previous;
    }
  }

  public void visitCFGCatchBlock(CatchBlock block) {
    visitCFGBlock(block);
  }

  public void visitCFGCaseBlock(CaseBlock block) {
    visitCFGBlock(block);
  }

  /** Visits the statements of a block that is entered for the first time, then its edge. */
  protected void visitCFGBlockInternal(BoundBlock block) {
    if (block instanceof CatchBlock) {
      CatchBlock catchBlock = (CatchBlock) block;
      accept(catchBlock.getTypeRef());
      accept(catchBlock.getVariable());
    } else if (block instanceof CaseBlock) {
      accept(((CaseBlock) block).getCaseValue());
    }

    for (BoundStatement statement : block.getStatements()) {
      statement.accept(this);
    }

    Edge edge = block.getNextEdge();
    if (edge != null) {
      edge.accept(this);
    }
  }

  public void visitCFGSimpleEdge(SimpleEdge edge) {
    acceptBlock(edge.getTarget());
  }

  public void visitCFGConditionalEdge(ConditionalEdge edge) {
    accept(edge.getCondition());
    acceptBlock(edge.getTrueTarget());
    acceptBlock(edge.getFalseTarget());
  }

  public void visitCFGTryCatchEdge(TryCatchEdge edge) {
    acceptBlock(edge.getBodyBlock());
    for (CatchBlock catchBlock : edge.getCatchBlocks()) {
      acceptBlock(catchBlock);
    }
    acceptBlock(edge.getFinallyBlock());
    acceptBlock(edge.getNextBlock());
  }

  public void visitCFGSwitchEdge(SwitchEdge edge) {
    accept(edge.getSwitchValue());
    for (CaseBlock caseBlock : edge.getCaseBlocks()) {
      acceptBlock(caseBlock);
    }
    acceptBlock(edge.getNextBlock());
  }

  // Statements

  public void visitExpressionStatement(BoundExpressionStatement x) {
    accept(x.getExpression());
  }

  public void visitReturn(BoundReturnStatement x) {
    accept(x.getReturned());
  }

  public void visitYieldStatement(BoundYieldStatement x) {
    accept(x.getKey());
    accept(x.getValue());
  }

  public void visitDeclareStatement(BoundDeclareStatement x) {}

  // Expressions

  public void visitLiteral(BoundLiteral x) {}

  public void visitArray(BoundArrayEx x) {
    for (BoundArrayEx.Item item : x.getItems()) {
      accept(item.key());
      accept(item.value());
    }
  }

  public void visitVariableRef(BoundVariableRef x) {
    accept(x.getName().getNameExpression());
  }

  public void visitTemporalVariableRef(BoundTemporalVariableRef x) {}

  public void visitArrayItem(BoundArrayItemEx x) {
    accept(x.getArray());
    accept(x.getIndex());
  }

  public void visitAssign(BoundAssignEx x) {
    accept(x.getTarget());
    accept(x.getValue());
  }

  public void visitBinaryExpression(BoundBinaryEx x) {
    accept(x.getLeft());
    accept(x.getRight());
  }

  public void visitEval(BoundEvalEx x) {
    accept(x.getCodeExpression());
  }

  public void visitTypeRef(BoundTypeRef x) {
    accept(x.getTypeExpression());
  }

  public void visitArgument(BoundArgument x) {
    accept(x.getValue());
  }

  public void visitGlobalFunctionCall(BoundGlobalFunctionCall x) {
    visitRoutineName(x.getName());
    visitArguments(x);
  }

  public void visitInstanceFunctionCall(BoundInstanceFunctionCall x) {
    accept(x.getInstance());
    visitRoutineName(x.getName());
    visitArguments(x);
  }

  public void visitStaticFunctionCall(BoundStaticFunctionCall x) {
    accept(x.getTypeRef());
    visitRoutineName(x.getName());
    visitArguments(x);
  }

  public void visitNew(BoundNewEx x) {
    accept(x.getTypeRef());
    visitArguments(x);
  }

  public void visitAssert(BoundAssertEx x) {
    visitArguments(x);
  }

  protected void visitRoutineName(BoundRoutineName name) {
    accept(name.getNameExpression());
  }

  protected void visitArguments(BoundRoutineCall call) {
    for (BoundArgument argument : call.getArgumentsInSourceOrder()) {
      argument.accept(this);
    }
  }
}
