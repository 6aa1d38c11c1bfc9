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
import org.jspecify.annotations.Nullable;

/**
 * Entry into a {@code try} statement. Carries the first block of the protected body, of every
 * catch clause and of the finally clause, and the block control resumes at after the statement.
 */
public final class TryCatchEdge extends Edge {

  private final BoundBlock bodyBlock;
  private final ImmutableList<CatchBlock> catchBlocks;
  private final @Nullable BoundBlock finallyBlock;
  private final BoundBlock nextBlock;

  public TryCatchEdge(
      BoundBlock source,
      BoundBlock bodyBlock,
      ImmutableList<CatchBlock> catchBlocks,
      @Nullable BoundBlock finallyBlock,
      BoundBlock nextBlock) {
    super(source);
    this.bodyBlock = checkNotNull(bodyBlock);
    this.catchBlocks = checkNotNull(catchBlocks);
    this.finallyBlock = finallyBlock;
    this.nextBlock = checkNotNull(nextBlock);
  }

  public BoundBlock getBodyBlock() {
    return bodyBlock;
  }

  public ImmutableList<CatchBlock> getCatchBlocks() {
    return catchBlocks;
  }

  public @Nullable BoundBlock getFinallyBlock() {
    return finallyBlock;
  }

  public BoundBlock getNextBlock() {
    return nextBlock;
  }

  @Override
  public ImmutableList<BoundBlock> getTargets() {
    ImmutableList.Builder<BoundBlock> targets = ImmutableList.builder();
    targets.add(bodyBlock).addAll(catchBlocks);
    if (finallyBlock != null) {
      targets.add(finallyBlock);
    }
    return targets.add(nextBlock).build();
  }

  @Override
  public void accept(GraphVisitor visitor) {
    visitor.visitCFGTryCatchEdge(this);
  }
}
