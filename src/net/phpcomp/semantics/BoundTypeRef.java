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

import net.phpcomp.semantics.graph.GraphVisitor;
import org.jspecify.annotations.Nullable;

/**
 * A reference to a type together with the symbol it resolved to.
 *
 * <p>A direct reference names the type in source. An indirect one computes the class name at
 * runtime ({@code new $className}), so its target cannot be known statically.
 */
public final class BoundTypeRef extends BoundOperation {

  private final @Nullable TypeRefSyntax typeRef;
  private final @Nullable BoundExpression typeExpression;
  private final boolean hasClassNameRestriction;
  private final @Nullable TypeSymbol resolvedType;

  private BoundTypeRef(
      @Nullable TypeRefSyntax typeRef,
      @Nullable BoundExpression typeExpression,
      boolean hasClassNameRestriction,
      @Nullable TypeSymbol resolvedType) {
    super(typeRef != null ? typeRef.getSpan() : typeExpression.getSyntax());
    checkArgument((typeRef == null) != (typeExpression == null));
    this.typeRef = typeRef;
    this.typeExpression = typeExpression;
    this.hasClassNameRestriction = hasClassNameRestriction;
    this.resolvedType = resolvedType;
  }

  /**
   * Creates a direct reference.
   *
   * @param hasClassNameRestriction whether the context only allows class names, as in {@code new
   *     T}, {@code T::method()} or {@code catch (T $e)}
   * @param resolvedType the resolved type, an error type, or null if resolution did not run
   */
  public static BoundTypeRef direct(
      TypeRefSyntax typeRef, boolean hasClassNameRestriction, @Nullable TypeSymbol resolvedType) {
    return new BoundTypeRef(typeRef, null, hasClassNameRestriction, resolvedType);
  }

  public static BoundTypeRef indirect(
      BoundExpression typeExpression, @Nullable TypeSymbol resolvedType) {
    return new BoundTypeRef(null, checkNotNull(typeExpression), true, resolvedType);
  }

  public boolean isDirect() {
    return typeRef != null;
  }

  /** The written type; null for indirect references. */
  public @Nullable TypeRefSyntax getTypeRef() {
    return typeRef;
  }

  /** The expression computing the class name; null for direct references. */
  public @Nullable BoundExpression getTypeExpression() {
    return typeExpression;
  }

  public boolean hasClassNameRestriction() {
    return hasClassNameRestriction;
  }

  public @Nullable TypeSymbol getResolvedType() {
    return resolvedType;
  }

  @Override
  public void accept(GraphVisitor visitor) {
    visitor.visitTypeRef(this);
  }

  @Override
  public String toString() {
    return typeRef != null ? typeRef.toString() : "{" + typeExpression + "}";
  }
}
