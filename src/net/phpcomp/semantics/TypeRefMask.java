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

import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.errorprone.annotations.Immutable;

/**
 * The flow-sensitive type fact of an expression: the set of every type the expression may hold on
 * any path reaching it.
 *
 * <p>Each bit below {@link #MAX_TYPES} refers to an entry of the routine's {@link TypeRefContext}.
 * A mask with every type bit set is the "any type" sentinel; a mask with no type bit set has not
 * been computed yet. An additional flag marks values flowing through a PHP reference.
 */
@Immutable
public final class TypeRefMask {

  /** Number of distinct types a single routine's type context can hold. */
  public static final int MAX_TYPES = 62;

  private static final long TYPES_MASK = (1L << MAX_TYPES) - 1;
  private static final long REF_FLAG = 1L << MAX_TYPES;

  public static final TypeRefMask UNINITIALIZED = new TypeRefMask(0L);
  public static final TypeRefMask ANY_TYPE = new TypeRefMask(TYPES_MASK);

  private final long mask;

  private TypeRefMask(long mask) {
    this.mask = mask;
  }

  /** Returns the fact consisting of the single type at {@code index} in the type context. */
  static TypeRefMask forIndex(int index) {
    checkElementIndex(index, MAX_TYPES);
    return new TypeRefMask(1L << index);
  }

  public TypeRefMask union(TypeRefMask other) {
    return new TypeRefMask(mask | other.mask);
  }

  /** Returns the same set of types, marked as flowing through a reference. */
  public TypeRefMask asRef() {
    return new TypeRefMask(mask | REF_FLAG);
  }

  public boolean isAnyType() {
    return (mask & TYPES_MASK) == TYPES_MASK;
  }

  public boolean isRef() {
    return (mask & REF_FLAG) != 0;
  }

  public boolean isUninitialized() {
    return (mask & TYPES_MASK) == 0;
  }

  boolean hasType(int index) {
    return (mask & (1L << index)) != 0;
  }

  int typeCount() {
    return Long.bitCount(mask & TYPES_MASK);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof TypeRefMask && ((TypeRefMask) o).mask == mask;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(mask);
  }

  @Override
  public String toString() {
    return "TypeRefMask(0x" + Long.toHexString(mask) + ")";
  }
}
