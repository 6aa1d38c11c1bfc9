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

/** A method call on an instance, {@code $obj->foo()}. */
public final class BoundInstanceFunctionCall extends BoundRoutineCall {

  private final @Nullable BoundExpression instance;
  private final BoundRoutineName name;

  /** @param instance the receiver, or null when the syntax was erroneous */
  public BoundInstanceFunctionCall(
      @Nullable BoundExpression instance,
      BoundRoutineName name,
      ImmutableList<BoundArgument> arguments,
      @Nullable MethodSymbol targetMethod,
      @Nullable SourceSpan syntax) {
    super(arguments, targetMethod, syntax);
    this.instance = instance;
    this.name = checkNotNull(name);
  }

  public @Nullable BoundExpression getInstance() {
    return instance;
  }

  public BoundRoutineName getName() {
    return name;
  }

  @Override
  public void accept(GraphVisitor visitor) {
    visitor.visitInstanceFunctionCall(this);
  }
}
