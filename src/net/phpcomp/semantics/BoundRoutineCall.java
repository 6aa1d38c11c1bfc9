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
import org.jspecify.annotations.Nullable;

/** Base class of calls. */
public abstract class BoundRoutineCall extends BoundExpression {

  private final ImmutableList<BoundArgument> arguments;
  private final @Nullable MethodSymbol targetMethod;

  protected BoundRoutineCall(
      ImmutableList<BoundArgument> arguments,
      @Nullable MethodSymbol targetMethod,
      @Nullable SourceSpan syntax) {
    super(syntax);
    this.arguments = checkNotNull(arguments);
    this.targetMethod = targetMethod;
  }

  /** The arguments, in the order they are written. */
  public ImmutableList<BoundArgument> getArgumentsInSourceOrder() {
    return arguments;
  }

  /** The resolved target, an error method, or null if the target is unknown statically. */
  public @Nullable MethodSymbol getTargetMethod() {
    return targetMethod;
  }
}
