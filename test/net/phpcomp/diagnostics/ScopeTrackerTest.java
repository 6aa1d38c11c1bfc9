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

package net.phpcomp.diagnostics;

import static com.google.common.truth.Truth.assertThat;

import net.phpcomp.diagnostics.ScopeTracker.Kind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ScopeTracker}. */
@RunWith(JUnit4.class)
public final class ScopeTrackerTest {

  private final ScopeTracker scopes = new ScopeTracker();

  @Test
  public void testEmpty() {
    assertThat(scopes.isInside(0, Kind.TRY)).isFalse();
    assertThat(scopes.isInsideAnyTryOrCatchOrFinally(0)).isFalse();
    assertThat(scopes.getScopes()).isEmpty();
  }

  @Test
  public void testIntervalsAreHalfOpen() {
    scopes.push(Kind.FINALLY, 3, 5);

    assertThat(scopes.isInside(2, Kind.FINALLY)).isFalse();
    assertThat(scopes.isInside(3, Kind.FINALLY)).isTrue();
    assertThat(scopes.isInside(4, Kind.FINALLY)).isTrue();
    assertThat(scopes.isInside(5, Kind.FINALLY)).isFalse();
  }

  @Test
  public void testKindIsMatched() {
    scopes.push(Kind.TRY, 1, 4);
    scopes.push(Kind.CATCH, 2, 3);

    assertThat(scopes.isInside(2, Kind.TRY)).isTrue();
    assertThat(scopes.isInside(2, Kind.CATCH)).isTrue();
    assertThat(scopes.isInside(2, Kind.FINALLY)).isFalse();
    assertThat(scopes.isInside(3, Kind.CATCH)).isFalse();
  }

  @Test
  public void testAnyKind() {
    scopes.push(Kind.TRY, 1, 2);
    scopes.push(Kind.FINALLY, 6, 8);

    assertThat(scopes.isInsideAnyTryOrCatchOrFinally(1)).isTrue();
    assertThat(scopes.isInsideAnyTryOrCatchOrFinally(4)).isFalse();
    assertThat(scopes.isInsideAnyTryOrCatchOrFinally(7)).isTrue();
  }

  @Test
  public void testNestedScopesAreKept() {
    scopes.push(Kind.TRY, 1, 10);
    scopes.push(Kind.TRY, 2, 4);

    assertThat(scopes.getScopes())
        .containsExactly(
            new ScopeTracker.Scope(Kind.TRY, 1, 10), new ScopeTracker.Scope(Kind.TRY, 2, 4))
        .inOrder();
    assertThat(scopes.isInside(8, Kind.TRY)).isTrue();
  }

  @Test
  public void testEmptyInterval() {
    scopes.push(Kind.CATCH, 4, 4);
    scopes.push(Kind.FINALLY, 6, 2);

    assertThat(scopes.isInside(4, Kind.CATCH)).isFalse();
    assertThat(scopes.isInsideAnyTryOrCatchOrFinally(3)).isFalse();
  }
}
