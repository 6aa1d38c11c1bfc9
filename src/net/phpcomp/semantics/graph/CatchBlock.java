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

import net.phpcomp.semantics.BoundTypeRef;
import net.phpcomp.semantics.BoundVariableRef;
import org.jspecify.annotations.Nullable;

/** The first block of a {@code catch (T $e)} clause. */
public final class CatchBlock extends BoundBlock {

  private final BoundTypeRef typeRef;
  private final @Nullable BoundVariableRef variable;

  CatchBlock(int ordinal, BoundTypeRef typeRef, @Nullable BoundVariableRef variable) {
    super(ordinal);
    this.typeRef = checkNotNull(typeRef);
    this.variable = variable;
  }

  /** The caught exception type. */
  public BoundTypeRef getTypeRef() {
    return typeRef;
  }

  /** The variable receiving the exception; null for catch clauses without one. */
  public @Nullable BoundVariableRef getVariable() {
    return variable;
  }

  @Override
  public void accept(GraphVisitor visitor) {
    visitor.visitCFGCatchBlock(this);
  }
}
