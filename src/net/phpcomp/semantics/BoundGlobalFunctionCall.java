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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import net.phpcomp.semantics.graph.GraphVisitor;
import org.jspecify.annotations.Nullable;

/** A call to a global function, {@code foo($a)} or {@code $callback($a)}. */
public final class BoundGlobalFunctionCall extends BoundRoutineCall {

  private final BoundRoutineName name;
  private final @Nullable SourceSpan nameSpan;

  /**
   * @param nameSpan the span of the function name alone, or null to fall back to the whole call
   */
  public BoundGlobalFunctionCall(
      BoundRoutineName name,
      @Nullable SourceSpan nameSpan,
      ImmutableList<BoundArgument> arguments,
      @Nullable MethodSymbol targetMethod,
      @Nullable SourceSpan syntax) {
    super(arguments, targetMethod, syntax);
    this.name = checkNotNull(name);
    this.nameSpan = nameSpan;
  }

  public BoundRoutineName getName() {
    return name;
  }

  public @Nullable SourceSpan getNameSpan() {
    return nameSpan;
  }

  @Override
  public void accept(GraphVisitor visitor) {
    visitor.visitGlobalFunctionCall(this);
  }
}
