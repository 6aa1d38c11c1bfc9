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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link TypeRefContext} and {@link TypeRefMask}. */
@RunWith(JUnit4.class)
public final class TypeRefContextTest {

  private final TypeRefContext ctx = new TypeRefContext();

  @Test
  public void testTypesAreInterned() {
    TypeRefMask first = ctx.getStringTypeMask();
    TypeRefMask second = ctx.getStringTypeMask();

    assertThat(second).isEqualTo(first);
    assertThat(ctx.getLongTypeMask()).isNotEqualTo(first);
  }

  @Test
  public void testAnyTypeIsNotAnyKind() {
    TypeRefMask any = TypeRefMask.ANY_TYPE;
    ctx.getStringTypeMask();

    assertThat(any.isAnyType()).isTrue();
    assertThat(ctx.isAString(any)).isFalse();
    assertThat(ctx.isObject(any)).isFalse();
    assertThat(ctx.isArray(any)).isFalse();
    assertThat(ctx.isExactlyOneType(any)).isFalse();
    assertThat(ctx.canBeCallable(any)).isTrue();
  }

  @Test
  public void testKindPredicates() {
    TypeRefMask mixed = ctx.getStringTypeMask().union(ctx.getArrayTypeMask());

    assertThat(ctx.isAString(mixed)).isTrue();
    assertThat(ctx.isArray(mixed)).isTrue();
    assertThat(ctx.isObject(mixed)).isFalse();
    assertThat(ctx.isExactlyOneType(mixed)).isFalse();
    assertThat(ctx.isExactlyOneType(ctx.getArrayTypeMask())).isTrue();
  }

  @Test
  public void testClosureIsAnObject() {
    TypeRefMask closure = ctx.getClosureTypeMask();

    assertThat(ctx.isLambda(closure)).isTrue();
    assertThat(ctx.isObject(closure)).isTrue();
    assertThat(ctx.isLambda(ctx.getObjectTypeMask(QualifiedName.of("Foo")))).isFalse();
  }

  @Test
  public void testCanBeCallable() {
    assertThat(ctx.canBeCallable(ctx.getStringTypeMask())).isTrue();
    assertThat(ctx.canBeCallable(ctx.getArrayTypeMask())).isTrue();
    assertThat(ctx.canBeCallable(ctx.getCallableTypeMask())).isTrue();
    assertThat(ctx.canBeCallable(ctx.getObjectTypeMask(QualifiedName.of("Invokable")))).isTrue();
    assertThat(ctx.canBeCallable(ctx.getLongTypeMask())).isFalse();
    assertThat(ctx.canBeCallable(ctx.getNullTypeMask().union(ctx.getDoubleTypeMask()))).isFalse();
    assertThat(ctx.canBeCallable(ctx.getLongTypeMask().asRef())).isTrue();
  }

  @Test
  public void testToString() {
    TypeRefMask intOrNull = ctx.getLongTypeMask().union(ctx.getNullTypeMask());

    assertThat(ctx.toString(intOrNull)).isEqualTo("int|null");
    assertThat(ctx.toString(intOrNull.asRef())).isEqualTo("&int|null");
    assertThat(ctx.toString(TypeRefMask.ANY_TYPE)).isEqualTo("mixed");
    assertThat(ctx.toString(TypeRefMask.UNINITIALIZED)).isEqualTo("void");
    assertThat(ctx.toString(ctx.getObjectTypeMask(QualifiedName.of("App\\User"))))
        .isEqualTo("App\\User");
  }

  @Test
  public void testRefFlagIsKeptByUnion() {
    TypeRefMask ref = ctx.getStringTypeMask().asRef();

    assertThat(ref.union(ctx.getLongTypeMask()).isRef()).isTrue();
    assertThat(ctx.getLongTypeMask().isRef()).isFalse();
    assertThat(TypeRefMask.UNINITIALIZED.isUninitialized()).isTrue();
  }
}
