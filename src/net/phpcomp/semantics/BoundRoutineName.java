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

/**
 * The name of a called routine: written directly ({@code foo()}) or computed at runtime ({@code
 * $callback()}).
 */
public final class BoundRoutineName {

  private final @Nullable QualifiedName nameValue;
  private final @Nullable BoundExpression nameExpression;

  private BoundRoutineName(
      @Nullable QualifiedName nameValue, @Nullable BoundExpression nameExpression) {
    checkArgument((nameValue == null) != (nameExpression == null));
    this.nameValue = nameValue;
    this.nameExpression = nameExpression;
  }

  public static BoundRoutineName direct(QualifiedName name) {
    return new BoundRoutineName(checkNotNull(name), null);
  }

  public static BoundRoutineName direct(String name) {
    return direct(QualifiedName.of(name));
  }

  public static BoundRoutineName indirect(BoundExpression nameExpression) {
    return new BoundRoutineName(null, checkNotNull(nameExpression));
  }

  public boolean isDirect() {
    return nameValue != null;
  }

  /** The written name; null for indirect names. */
  public @Nullable QualifiedName getNameValue() {
    return nameValue;
  }

  /** The expression computing the name; null for direct names. */
  public @Nullable BoundExpression getNameExpression() {
    return nameExpression;
  }

  @Override
  public String toString() {
    return nameValue != null ? nameValue.toString() : "{" + nameExpression + "}";
  }
}
