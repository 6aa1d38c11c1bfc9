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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.phpcomp.semantics.BoundExpressionStatement;
import net.phpcomp.semantics.BoundLiteral;
import net.phpcomp.semantics.BoundLocal;
import net.phpcomp.semantics.BoundTypeRef;
import net.phpcomp.semantics.BoundVariableName;
import net.phpcomp.semantics.BoundVariableRef;
import net.phpcomp.semantics.QualifiedName;
import net.phpcomp.semantics.SourceSpan;
import net.phpcomp.semantics.TypeRefSyntax;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link GraphVisitor}. */
@RunWith(JUnit4.class)
public final class GraphVisitorTest {

  /** Records blocks as they are entered and the literals and variables it meets. */
  private static final class RecordingVisitor extends GraphVisitor {
    final List<String> events = new ArrayList<>();

    @Override
    protected void visitCFGBlockInternal(BoundBlock block) {
      events.add(block.toString());
      super.visitCFGBlockInternal(block);
    }

    @Override
    public void visitLiteral(BoundLiteral x) {
      events.add(x.toString());
    }

    @Override
    public void visitVariableRef(BoundVariableRef x) {
      events.add(x.toString());
      super.visitVariableRef(x);
    }

    @Override
    public void visitTypeRef(BoundTypeRef x) {
      events.add(x.toString());
      super.visitTypeRef(x);
    }

    boolean visited(BoundBlock block) {
      return isVisited(block);
    }
  }

  private final ControlFlowGraph.Builder builder = ControlFlowGraph.builder();
  private final RecordingVisitor visitor = new RecordingVisitor();

  private static BoundExpressionStatement literal(Object value) {
    return new BoundExpressionStatement(new BoundLiteral(value, SourceSpan.of(0, 1)));
  }

  private static BoundVariableRef variable(String name) {
    return new BoundVariableRef(
        BoundVariableName.direct(name), new BoundLocal(name), SourceSpan.of(0, 1));
  }

  @Test
  public void testStatementsBeforeEdge() {
    BoundBlock entry = builder.newBlock();
    BoundBlock next = builder.newBlock();
    entry.add(literal(1L));
    entry.add(literal(2L));
    next.add(literal(3L));
    new SimpleEdge(entry, next);

    visitor.visitCFG(builder.build());

    assertThat(visitor.events).containsExactly("#0", "1", "2", "#1", "3").inOrder();
  }

  @Test
  public void testConditionalEdgeOrder() {
    BoundBlock entry = builder.newBlock();
    BoundBlock whenFalse = builder.newBlock();
    BoundBlock whenTrue = builder.newBlock();
    new ConditionalEdge(entry, variable("c"), whenTrue, whenFalse);

    visitor.visitCFG(builder.build());

    assertThat(visitor.events).containsExactly("#0", "$c", "#2", "#1").inOrder();
  }

  @Test
  public void testTryCatchEdgeOrder() {
    BoundBlock entry = builder.newBlock();
    BoundBlock next = builder.newBlock();
    BoundBlock finallyBlock = builder.newBlock();
    CatchBlock catchBlock =
        builder.newCatchBlock(
            BoundTypeRef.direct(
                TypeRefSyntax.named(QualifiedName.of("Exception"), SourceSpan.of(0, 9)),
                true,
                null),
            variable("e"));
    BoundBlock body = builder.newBlock();
    new TryCatchEdge(entry, body, ImmutableList.of(catchBlock), finallyBlock, next);

    visitor.visitCFG(builder.build());

    assertThat(visitor.events)
        .containsExactly("#0", "#4", "#3", "Exception", "$e", "#2", "#1")
        .inOrder();
  }

  @Test
  public void testSwitchEdgeOrder() {
    BoundBlock entry = builder.newBlock();
    CaseBlock first = builder.newCaseBlock(new BoundLiteral(1L, null));
    CaseBlock byDefault = builder.newCaseBlock(null);
    BoundBlock next = builder.newBlock();
    new SwitchEdge(entry, variable("v"), ImmutableList.of(first, byDefault), next);

    visitor.visitCFG(builder.build());

    assertThat(byDefault.isDefault()).isTrue();
    assertThat(visitor.events).containsExactly("#0", "$v", "#1", "1", "#2", "#3").inOrder();
  }

  @Test
  public void testBlocksAreEnteredOnce() {
    BoundBlock entry = builder.newBlock();
    BoundBlock loop = builder.newBlock();
    BoundBlock exit = builder.newBlock();
    new SimpleEdge(entry, loop);
    new ConditionalEdge(loop, variable("more"), entry, exit);
    new SimpleEdge(exit, loop);

    visitor.visitCFG(builder.build());

    assertThat(visitor.events).containsExactly("#0", "#1", "$more", "#2").inOrder();
  }

  @Test
  public void testUnreachableBlocksAreNotVisited() {
    BoundBlock entry = builder.newBlock();
    BoundBlock orphan = builder.newBlock();
    orphan.add(literal(9L));

    visitor.visitCFG(builder.build());

    assertThat(visitor.visited(entry)).isTrue();
    assertThat(visitor.visited(orphan)).isFalse();
    assertThat(visitor.events).containsExactly("#0");
  }

  @Test
  public void testCurrentBlockIsRestored() {
    BoundBlock entry = builder.newBlock();
    BoundBlock next = builder.newBlock();
    List<BoundBlock> seen = new ArrayList<>();
    GraphVisitor tracking =
        new GraphVisitor() {
          @Override
          public void visitLiteral(BoundLiteral x) {
            seen.add(getCurrentBlock());
          }
        };
    entry.add(literal(1L));
    next.add(literal(2L));
    new SimpleEdge(entry, next);

    tracking.visitCFG(builder.build());

    assertThat(seen).containsExactly(entry, next).inOrder();
    assertThat(tracking.getCurrentBlock()).isNull();
  }

  @Test
  public void testGraphWithoutBlocks() {
    ControlFlowGraph graph = builder.build();

    assertThrows(IllegalStateException.class, () -> visitor.visitCFG(graph));
  }
}
