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

/** A literal value: number, string, boolean or {@code null}. */
public final class BoundLiteral extends BoundExpression {

  public BoundLiteral(@Nullable Object value, @Nullable SourceSpan syntax) {
    super(syntax);
    setConstantValue(value);
  }

  @Override
  public void accept(GraphVisitor visitor) {
    visitor.visitLiteral(this);
  }

  @Override
  public String toString() {
    Object value = getConstantValue();
    return value instanceof String ? "'" + value + "'" : String.valueOf(value);
  }
}
