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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * The table of types referenced by the type facts of a single routine, together with the queries
 * the diagnostics run against those facts.
 *
 * <p>The binder and the type inference populate the table; once inference is complete the
 * context is read-only. The {@code is*} predicates answer whether a fact explicitly includes a
 * type of the given kind, so they are {@code false} for the {@link TypeRefMask#ANY_TYPE any
 * type} sentinel. Callers that must stay conservative test {@link TypeRefMask#isAnyType()} and
 * {@link TypeRefMask#isRef()} themselves.
 */
public final class TypeRefContext {

  /** The kind of an entry in the type table. */
  public enum Kind {
    STRING,
    LONG,
    DOUBLE,
    BOOLEAN,
    NULL,
    ARRAY,
    CALLABLE,
    RESOURCE,
    OBJECT,
    /** An instance of the platform {@code Closure} class. */
    LAMBDA,
  }

  /** An entry of the type table. Object entries carry the class name. */
  public record TypeRef(Kind kind, String name) {
    public TypeRef {
      checkNotNull(kind);
      checkNotNull(name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  private final List<TypeRef> types = new ArrayList<>();

  /** Returns the fact for a single type, adding the type to the table if needed. */
  public TypeRefMask getTypeMask(TypeRef type) {
    int index = types.indexOf(type);
    if (index < 0) {
      checkState(types.size() < TypeRefMask.MAX_TYPES, "too many types in routine");
      types.add(type);
      index = types.size() - 1;
    }
    return TypeRefMask.forIndex(index);
  }

  public TypeRefMask getStringTypeMask() {
    return getTypeMask(new TypeRef(Kind.STRING, "string"));
  }

  public TypeRefMask getLongTypeMask() {
    return getTypeMask(new TypeRef(Kind.LONG, "int"));
  }

  public TypeRefMask getDoubleTypeMask() {
    return getTypeMask(new TypeRef(Kind.DOUBLE, "float"));
  }

  public TypeRefMask getBooleanTypeMask() {
    return getTypeMask(new TypeRef(Kind.BOOLEAN, "bool"));
  }

  public TypeRefMask getNullTypeMask() {
    return getTypeMask(new TypeRef(Kind.NULL, "null"));
  }

  public TypeRefMask getArrayTypeMask() {
    return getTypeMask(new TypeRef(Kind.ARRAY, "array"));
  }

  public TypeRefMask getCallableTypeMask() {
    return getTypeMask(new TypeRef(Kind.CALLABLE, "callable"));
  }

  public TypeRefMask getResourceTypeMask() {
    return getTypeMask(new TypeRef(Kind.RESOURCE, "resource"));
  }

  public TypeRefMask getClosureTypeMask() {
    return getTypeMask(new TypeRef(Kind.LAMBDA, "Closure"));
  }

  public TypeRefMask getObjectTypeMask(QualifiedName className) {
    return getTypeMask(new TypeRef(Kind.OBJECT, className.toString()));
  }

  /** Whether the fact includes a string type. */
  public boolean isAString(TypeRefMask mask) {
    return includesKind(mask, Kind.STRING);
  }

  /** Whether the fact includes an object type, closures included. */
  public boolean isObject(TypeRefMask mask) {
    return includesKind(mask, Kind.OBJECT) || includesKind(mask, Kind.LAMBDA);
  }

  public boolean isArray(TypeRefMask mask) {
    return includesKind(mask, Kind.ARRAY);
  }

  public boolean isLambda(TypeRefMask mask) {
    return includesKind(mask, Kind.LAMBDA);
  }

  /** Whether the fact is a single, known type. */
  public boolean isExactlyOneType(TypeRefMask mask) {
    return !mask.isAnyType() && mask.typeCount() == 1;
  }

  /**
   * Whether a value of this fact may be used as a callback: a string, an array, an object, a
   * closure or a {@code callable}. Unknown and by-reference facts may always be callable.
   */
  public boolean canBeCallable(TypeRefMask mask) {
    return mask.isAnyType()
        || mask.isRef()
        || isAString(mask)
        || isArray(mask)
        || isObject(mask)
        || includesKind(mask, Kind.CALLABLE);
  }

  /** Renders the fact for use as a diagnostic argument, e.g. {@code int|string}. */
  public String toString(TypeRefMask mask) {
    String prefix = mask.isRef() ? "&" : "";
    if (mask.isAnyType()) {
      return prefix + "mixed";
    }
    if (mask.isUninitialized()) {
      return prefix + "void";
    }
    return prefix + Joiner.on('|').join(getTypes(mask));
  }

  /** Returns the entries of the table the fact refers to, in table order. */
  public ImmutableList<TypeRef> getTypes(TypeRefMask mask) {
    ImmutableList.Builder<TypeRef> result = ImmutableList.builder();
    for (int i = 0; i < types.size(); i++) {
      if (mask.hasType(i)) {
        result.add(types.get(i));
      }
    }
    return result.build();
  }

  private boolean includesKind(TypeRefMask mask, Kind kind) {
    if (mask.isAnyType()) {
      return false;
    }
    for (int i = 0; i < types.size(); i++) {
      if (mask.hasType(i) && types.get(i).kind() == kind) {
        return true;
      }
    }
    return false;
  }
}
