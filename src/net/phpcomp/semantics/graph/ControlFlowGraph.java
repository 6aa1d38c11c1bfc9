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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import net.phpcomp.semantics.BoundExpression;
import net.phpcomp.semantics.BoundTypeRef;
import net.phpcomp.semantics.BoundVariableRef;
import org.jspecify.annotations.Nullable;

/**
 * The bound control flow graph of a routine body.
 *
 * <p>The graph is produced once by the binder and is not modified by the passes that consume it.
 */
public final class ControlFlowGraph {

  private final @Nullable BoundBlock start;
  private final @Nullable BoundBlock exit;
  private final ImmutableList<BoundBlock> blocks;
  private final ImmutableList<LabelBlockState> labels;

  private ControlFlowGraph(Builder builder) {
    this.blocks = ImmutableList.copyOf(builder.blocks);
    this.start = builder.start != null || blocks.isEmpty() ? builder.start : blocks.get(0);
    this.exit = builder.exit;
    this.labels = ImmutableList.copyOf(builder.labels);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** The entry block. Only a graph with no blocks at all has none. */
  public @Nullable BoundBlock getStart() {
    return start;
  }

  public @Nullable BoundBlock getExit() {
    return exit;
  }

  /** All blocks of the graph, ordered by ordinal. */
  public ImmutableList<BoundBlock> getBlocks() {
    return blocks;
  }

  /** The label table, in the order labels were first seen. */
  public ImmutableList<LabelBlockState> getLabels() {
    return labels;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("CFG:\n");
    for (BoundBlock block : blocks) {
      sb.append(block);
      Edge edge = block.getNextEdge();
      if (edge != null) {
        sb.append(" -> ").append(edge.getTargets());
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  /** Creates blocks, numbering them in creation order, and assembles the graph. */
  public static final class Builder {
    private final List<BoundBlock> blocks = new ArrayList<>();
    private final List<LabelBlockState> labels = new ArrayList<>();
    private @Nullable BoundBlock start;
    private @Nullable BoundBlock exit;

    private Builder() {}

    public BoundBlock newBlock() {
      return register(new BoundBlock(blocks.size()));
    }

    public CatchBlock newCatchBlock(BoundTypeRef typeRef, @Nullable BoundVariableRef variable) {
      return register(new CatchBlock(blocks.size(), typeRef, variable));
    }

    public CaseBlock newCaseBlock(@Nullable BoundExpression caseValue) {
      return register(new CaseBlock(blocks.size(), caseValue));
    }

    private <B extends BoundBlock> B register(B block) {
      checkState(block.getOrdinal() == blocks.size());
      blocks.add(block);
      return block;
    }

    /** Sets the entry block. Defaults to the first block created. */
    @CanIgnoreReturnValue
    public Builder setStart(BoundBlock start) {
      checkArgument(blocks.contains(start), "%s does not belong to this graph", start);
      this.start = start;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setExit(BoundBlock exit) {
      checkArgument(blocks.contains(exit), "%s does not belong to this graph", exit);
      this.exit = exit;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addLabel(LabelBlockState label) {
      labels.add(label);
      return this;
    }

    public ControlFlowGraph build() {
      return new ControlFlowGraph(this);
    }
  }
}
