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

/** An unconditional jump. */
public final class SimpleEdge extends Edge {

  private final BoundBlock target;

  public SimpleEdge(BoundBlock source, BoundBlock target) {
    super(source);
    this.target = checkNotNull(target);
  }

  public BoundBlock getTarget() {
    return target;
  }

  @Override
  public ImmutableList<BoundBlock> getTargets() {
    return ImmutableList.of(target);
  }

  @Override
  public void accept(GraphVisitor visitor) {
    visitor.visitCFGSimpleEdge(this);
  }
}
