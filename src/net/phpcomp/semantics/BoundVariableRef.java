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

import net.phpcomp.semantics.graph.GraphVisitor;
import org.jspecify.annotations.Nullable;

/** A use of a variable. */
public class BoundVariableRef extends BoundExpression {

  private final BoundVariableName name;
  private final @Nullable BoundVariable variable;
  private boolean maybeUninitialized;

  /**
   * @param variable The variable the name binds to, or null for indirect names that cannot be
   *     bound statically
   */
  public BoundVariableRef(
      BoundVariableName name, @Nullable BoundVariable variable, @Nullable SourceSpan syntax) {
    super(syntax);
    this.name = checkNotNull(name);
    this.variable = variable;
  }

  public BoundVariableName getName() {
    return name;
  }

  public @Nullable BoundVariable getVariable() {
    return variable;
  }

  /** Whether flow analysis found a path on which the variable is read before it is assigned. */
  public boolean isMaybeUninitialized() {
    return maybeUninitialized;
  }

  public void setMaybeUninitialized(boolean maybeUninitialized) {
    this.maybeUninitialized = maybeUninitialized;
  }

  @Override
  public void accept(GraphVisitor visitor) {
    visitor.visitVariableRef(this);
  }

  @Override
  public String toString() {
    return "$" + name;
  }
}
