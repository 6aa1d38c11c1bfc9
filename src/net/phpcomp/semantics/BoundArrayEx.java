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

/** An array literal, {@code [k => v, ...]}. */
public final class BoundArrayEx extends BoundExpression {

  /** One entry of the literal. The key is null for positional entries. */
  public record Item(@Nullable BoundExpression key, BoundExpression value) {
    public Item {
      checkNotNull(value);
    }
  }

  private final ImmutableList<Item> items;

  public BoundArrayEx(ImmutableList<Item> items, @Nullable SourceSpan syntax) {
    super(syntax);
    this.items = checkNotNull(items);
  }

  public ImmutableList<Item> getItems() {
    return items;
  }

  @Override
  public void accept(GraphVisitor visitor) {
    visitor.visitArray(this);
  }
}
