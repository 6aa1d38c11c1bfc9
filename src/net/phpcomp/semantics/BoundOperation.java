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

package net.phpcomp.semantics;

import net.phpcomp.semantics.graph.GraphVisitor;
import org.jspecify.annotations.Nullable;

/**
 * Base class of the bound tree: statements, expressions and the auxiliary nodes they own.
 *
 * <p>Every node kind dispatches to exactly one {@code visit} method of {@link GraphVisitor}.
 */
public abstract class BoundOperation {

  private final @Nullable SourceSpan syntax;

  protected BoundOperation(@Nullable SourceSpan syntax) {
    this.syntax = syntax;
  }

  /** The span of the syntax the node was bound from; null for synthesized nodes. */
  public @Nullable SourceSpan getSyntax() {
    return syntax;
  }

  public abstract void accept(GraphVisitor visitor);
}
