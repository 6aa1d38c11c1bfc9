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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import net.phpcomp.semantics.BoundExpression;

/** A multi-way branch of a {@code switch} statement. */
public final class SwitchEdge extends Edge {

  private final BoundExpression switchValue;
  private final ImmutableList<CaseBlock> caseBlocks;
  private final BoundBlock nextBlock;

  public SwitchEdge(
      BoundBlock source,
      BoundExpression switchValue,
      ImmutableList<CaseBlock> caseBlocks,
      BoundBlock nextBlock) {
    super(source);
    this.switchValue = checkNotNull(switchValue);
    this.caseBlocks = checkNotNull(caseBlocks);
    this.nextBlock = checkNotNull(nextBlock);
  }

  public BoundExpression getSwitchValue() {
    return switchValue;
  }

  public ImmutableList<CaseBlock> getCaseBlocks() {
    return caseBlocks;
  }

  public BoundBlock getNextBlock() {
    return nextBlock;
  }

  @Override
  public ImmutableList<BoundBlock> getTargets() {
    return ImmutableList.<BoundBlock>builder().addAll(caseBlocks).add(nextBlock).build();
  }

  @Override
  public void accept(GraphVisitor visitor) {
    visitor.visitCFGSwitchEdge(this);
  }
}
