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
import static com.google.common.base.Preconditions.checkState;

import org.jspecify.annotations.Nullable;

/**
 * An expression of the bound tree.
 *
 * <p>The type fact, access, result type and constant value are filled in by binding and type
 * inference and do not change afterwards.
 */
public abstract class BoundExpression extends BoundOperation {

  private TypeRefMask typeRefMask = TypeRefMask.ANY_TYPE;
  private BoundAccess access = BoundAccess.READ;
  private @Nullable TypeSymbol resultType;
  private boolean hasConstantValue;
  private @Nullable Object constantValue;

  protected BoundExpression(@Nullable SourceSpan syntax) {
    super(syntax);
  }

  /** The flow-sensitive type fact; {@link TypeRefMask#ANY_TYPE} until inference runs. */
  public TypeRefMask getTypeRefMask() {
    return typeRefMask;
  }

  public void setTypeRefMask(TypeRefMask typeRefMask) {
    this.typeRefMask = checkNotNull(typeRefMask);
  }

  public BoundAccess getAccess() {
    return access;
  }

  public void setAccess(BoundAccess access) {
    this.access = checkNotNull(access);
  }

  /** The statically known runtime type of the value, or null if only the fact is known. */
  public @Nullable TypeSymbol getResultType() {
    return resultType;
  }

  public void setResultType(@Nullable TypeSymbol resultType) {
    this.resultType = resultType;
  }

  /** Whether the expression evaluates to a value known at compile time. */
  public boolean isConstant() {
    return hasConstantValue;
  }

  /** The compile-time value; only valid when {@link #isConstant()}. May be null for {@code null}. */
  public @Nullable Object getConstantValue() {
    checkState(hasConstantValue, "not a constant: %s", this);
    return constantValue;
  }

  public void setConstantValue(@Nullable Object constantValue) {
    this.hasConstantValue = true;
    this.constantValue = constantValue;
  }

  /** Whether the expression is the constant {@code false}. */
  public boolean isConstantFalse() {
    return hasConstantValue && Boolean.FALSE.equals(constantValue);
  }

  /** Whether the expression is a numeric constant equal to zero. */
  public boolean isConstantZero() {
    if (!hasConstantValue || !(constantValue instanceof Number)) {
      return false;
    }
    Number number = (Number) constantValue;
    if (number instanceof Double || number instanceof Float) {
      return number.doubleValue() == 0.0;
    }
    return number.longValue() == 0L;
  }
}
