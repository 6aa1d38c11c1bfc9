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

import com.google.common.collect.ImmutableSet;

/**
 * The platform types the runtime library provides. Instances are compared by identity, so every
 * routine of a compilation must use the types of that compilation's {@code CoreTypes}.
 */
public final class CoreTypes {

  private final TypeSymbol voidType = valueType("System.Void", SpecialType.VOID, "void");
  private final TypeSymbol int32 = valueType("System.Int32", SpecialType.INT32, "int");
  private final TypeSymbol int64 = valueType("System.Int64", SpecialType.INT64, "int");
  private final TypeSymbol doubleType = valueType("System.Double", SpecialType.DOUBLE, "float");
  private final TypeSymbol booleanType = valueType("System.Boolean", SpecialType.BOOLEAN, "bool");
  private final TypeSymbol string = valueType("System.String", SpecialType.STRING, "string");
  private final TypeSymbol object =
      TypeSymbol.builder(QualifiedName.of("System.Object"), TypeSymbol.TypeKind.CLASS)
          .setSpecialType(SpecialType.OBJECT)
          .build();

  private final TypeSymbol phpString = valueType("PhpString", SpecialType.NONE, "string");
  private final TypeSymbol phpArray = valueType("PhpArray", SpecialType.NONE, "array");
  private final TypeSymbol phpNumber = valueType("PhpNumber", SpecialType.NONE, "number");
  private final TypeSymbol phpResource = valueType("PhpResource", SpecialType.NONE, "resource");
  private final TypeSymbol iPhpArray = valueType("IPhpArray", SpecialType.NONE, "array");
  private final TypeSymbol iPhpCallable = valueType("IPhpCallable", SpecialType.NONE, "callable");
  private final TypeSymbol closure = TypeSymbol.classType("Closure");

  private final ImmutableSet<TypeSymbol> nonObjectValueTypes =
      ImmutableSet.of(phpString, phpArray, phpNumber, phpResource, iPhpArray, iPhpCallable);

  private static TypeSymbol valueType(String name, SpecialType specialType, String phpName) {
    return TypeSymbol.builder(QualifiedName.of(name), TypeSymbol.TypeKind.VALUE)
        .setSpecialType(specialType)
        .setPhpTypeName(phpName)
        .build();
  }

  public TypeSymbol getVoid() {
    return voidType;
  }

  public TypeSymbol getInt32() {
    return int32;
  }

  public TypeSymbol getInt64() {
    return int64;
  }

  public TypeSymbol getDouble() {
    return doubleType;
  }

  public TypeSymbol getBoolean() {
    return booleanType;
  }

  public TypeSymbol getString() {
    return string;
  }

  public TypeSymbol getObject() {
    return object;
  }

  public TypeSymbol getPhpString() {
    return phpString;
  }

  public TypeSymbol getPhpArray() {
    return phpArray;
  }

  public TypeSymbol getPhpNumber() {
    return phpNumber;
  }

  public TypeSymbol getPhpResource() {
    return phpResource;
  }

  public TypeSymbol getIPhpArray() {
    return iPhpArray;
  }

  public TypeSymbol getIPhpCallable() {
    return iPhpCallable;
  }

  /** The class of anonymous functions. It cannot be instantiated with {@code new}. */
  public TypeSymbol getClosure() {
    return closure;
  }

  /**
   * Whether {@code type} is one of the runtime library's non-object value types: strings, arrays,
   * numbers, resources and callables.
   */
  public boolean isNonObjectValueType(TypeSymbol type) {
    return nonObjectValueTypes.contains(type);
  }
}
