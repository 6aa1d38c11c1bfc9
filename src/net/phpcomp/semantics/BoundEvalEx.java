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

/** {@code eval(code)}. */
public final class BoundEvalEx extends BoundExpression {

  private final BoundExpression codeExpression;

  public BoundEvalEx(BoundExpression codeExpression, @Nullable SourceSpan syntax) {
    super(syntax);
    this.codeExpression = checkNotNull(codeExpression);
  }

  public BoundExpression getCodeExpression() {
    return codeExpression;
  }

  @Override
  public void accept(GraphVisitor visitor) {
    visitor.visitEval(this);
  }
}
