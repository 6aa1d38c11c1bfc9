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

import com.google.common.base.Ascii;
import org.jspecify.annotations.Nullable;

/**
 * The syntax of a type written in source: a type hint, the class of a {@code new} expression, or
 * the type of a catch clause.
 */
public final class TypeRefSyntax {

  /** The syntactic form of the reference. */
  public enum Form {
    /** A built-in type keyword such as {@code int} or {@code void}. */
    PRIMITIVE,
    /** {@code self}, {@code parent} or {@code static}, bound by the enclosing class. */
    RESERVED,
    /** A class, interface or trait name. */
    NAMED,
  }

  /** The built-in type keywords. */
  public enum PrimitiveType {
    INT,
    FLOAT,
    STRING,
    BOOL,
    ARRAY,
    CALLABLE,
    ITERABLE,
    OBJECT,
    MIXED,
    VOID,
  }

  /** The keywords referring to the enclosing class. */
  public enum ReservedType {
    SELF,
    PARENT,
    STATIC,
  }

  private final Form form;
  private final @Nullable PrimitiveType primitiveType;
  private final @Nullable ReservedType reservedType;
  private final @Nullable QualifiedName qualifiedName;
  private final SourceSpan span;

  private TypeRefSyntax(
      Form form,
      @Nullable PrimitiveType primitiveType,
      @Nullable ReservedType reservedType,
      @Nullable QualifiedName qualifiedName,
      SourceSpan span) {
    this.form = form;
    this.primitiveType = primitiveType;
    this.reservedType = reservedType;
    this.qualifiedName = qualifiedName;
    this.span = checkNotNull(span);
  }

  public static TypeRefSyntax primitive(PrimitiveType type, SourceSpan span) {
    return new TypeRefSyntax(Form.PRIMITIVE, checkNotNull(type), null, null, span);
  }

  public static TypeRefSyntax reserved(ReservedType type, SourceSpan span) {
    return new TypeRefSyntax(Form.RESERVED, null, checkNotNull(type), null, span);
  }

  public static TypeRefSyntax named(QualifiedName name, SourceSpan span) {
    return new TypeRefSyntax(Form.NAMED, null, null, checkNotNull(name), span);
  }

  public Form getForm() {
    return form;
  }

  public boolean isPrimitive() {
    return form == Form.PRIMITIVE;
  }

  public boolean isReserved() {
    return form == Form.RESERVED;
  }

  /** Whether this is the {@code void} keyword. */
  public boolean isVoid() {
    return primitiveType == PrimitiveType.VOID;
  }

  public @Nullable PrimitiveType getPrimitiveType() {
    return primitiveType;
  }

  public @Nullable ReservedType getReservedType() {
    return reservedType;
  }

  /** The written name of a {@link Form#NAMED} reference; null for keywords. */
  public @Nullable QualifiedName getQualifiedName() {
    return qualifiedName;
  }

  public SourceSpan getSpan() {
    return span;
  }

  @Override
  public String toString() {
    switch (form) {
      case PRIMITIVE:
        return Ascii.toLowerCase(primitiveType.name());
      case RESERVED:
        return Ascii.toLowerCase(reservedType.name());
      default:
        return qualifiedName.toString();
    }
  }
}
