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

/** A static method call, {@code T::foo()}. */
public final class BoundStaticFunctionCall extends BoundRoutineCall {

  private final BoundTypeRef typeRef;
  private final BoundRoutineName name;

  public BoundStaticFunctionCall(
      BoundTypeRef typeRef,
      BoundRoutineName name,
      ImmutableList<BoundArgument> arguments,
      @Nullable MethodSymbol targetMethod,
      @Nullable SourceSpan syntax) {
    super(arguments, targetMethod, syntax);
    this.typeRef = checkNotNull(typeRef);
    this.name = checkNotNull(name);
  }

  public BoundTypeRef getTypeRef() {
    return typeRef;
  }

  public BoundRoutineName getName() {
    return name;
  }

  @Override
  public void accept(GraphVisitor visitor) {
    visitor.visitStaticFunctionCall(this);
  }
}
