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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import org.jspecify.annotations.Nullable;

/** The name of a variable reference: written directly ({@code $x}) or computed ({@code $$x}). */
public final class BoundVariableName {

  private final @Nullable String nameValue;
  private final @Nullable BoundExpression nameExpression;

  private BoundVariableName(@Nullable String nameValue, @Nullable BoundExpression nameExpression) {
    checkArgument((nameValue == null) != (nameExpression == null));
    this.nameValue = nameValue;
    this.nameExpression = nameExpression;
  }

  public static BoundVariableName direct(String name) {
    return new BoundVariableName(checkNotNull(name), null);
  }

  public static BoundVariableName indirect(BoundExpression nameExpression) {
    return new BoundVariableName(null, checkNotNull(nameExpression));
  }

  public boolean isDirect() {
    return nameValue != null;
  }

  public @Nullable String getNameValue() {
    return nameValue;
  }

  public @Nullable BoundExpression getNameExpression() {
    return nameExpression;
  }

  @Override
  public String toString() {
    return nameValue != null ? nameValue : "{" + nameExpression + "}";
  }
}
