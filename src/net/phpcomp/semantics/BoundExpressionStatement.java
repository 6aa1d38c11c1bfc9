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

/** An expression evaluated for its side effects. */
public final class BoundExpressionStatement extends BoundStatement {

  private final BoundExpression expression;

  public BoundExpressionStatement(BoundExpression expression) {
    super(expression.getSyntax());
    this.expression = checkNotNull(expression);
  }

  public BoundExpression getExpression() {
    return expression;
  }

  @Override
  public void accept(GraphVisitor visitor) {
    visitor.visitExpressionStatement(this);
  }
}
