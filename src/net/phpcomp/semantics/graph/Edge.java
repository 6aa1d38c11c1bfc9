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

import com.google.common.collect.ImmutableList;

/**
 * The outgoing control transfer of a block. Creating an edge attaches it to its source block.
 */
public abstract class Edge {

  protected Edge(BoundBlock source) {
    source.setNextEdge(this);
  }

  /** The successor blocks, in the order the traversal visits them. */
  public abstract ImmutableList<BoundBlock> getTargets();

  public abstract void accept(GraphVisitor visitor);
}
