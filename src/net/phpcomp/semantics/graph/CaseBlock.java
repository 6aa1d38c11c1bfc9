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

import net.phpcomp.semantics.BoundExpression;
import org.jspecify.annotations.Nullable;

/** The first block of a {@code case} or {@code default} clause of a switch. */
public final class CaseBlock extends BoundBlock {

  private final @Nullable BoundExpression caseValue;

  CaseBlock(int ordinal, @Nullable BoundExpression caseValue) {
    super(ordinal);
    this.caseValue = caseValue;
  }

  /** The value compared against; null for {@code default}. */
  public @Nullable BoundExpression getCaseValue() {
    return caseValue;
  }

  public boolean isDefault() {
    return caseValue == null;
  }

  @Override
  public void accept(GraphVisitor visitor) {
    visitor.visitCFGCaseBlock(this);
  }
}
