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

/** An array element access, {@code $a[i]}, or an append target, {@code $a[]}. */
public final class BoundArrayItemEx extends BoundExpression {

  private final BoundExpression array;
  private final @Nullable BoundExpression index;

  public BoundArrayItemEx(
      BoundExpression array, @Nullable BoundExpression index, @Nullable SourceSpan syntax) {
    super(syntax);
    this.array = checkNotNull(array);
    this.index = index;
  }

  public BoundExpression getArray() {
    return array;
  }

  public @Nullable BoundExpression getIndex() {
    return index;
  }

  @Override
  public void accept(GraphVisitor visitor) {
    visitor.visitArrayItem(this);
  }
}
