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

import net.phpcomp.semantics.SourceSpan;
import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ComposeWarningsGuard} and the guards it is usually composed of. */
@RunWith(JUnit4.class)
public final class ComposeWarningsGuardTest {

  private static final PhpError UNREACHABLE =
      PhpError.make("f", "a.php", SourceSpan.of(0, 1), PhpDiagnostics.UNREACHABLE_CODE);
  private static final PhpError DIVISION =
      PhpError.make("f", "a.php", SourceSpan.of(2, 1), PhpDiagnostics.DIVISION_BY_ZERO);
  private static final PhpError EVAL =
      PhpError.make("f", "a.php", SourceSpan.of(4, 4), PhpDiagnostics.EVAL_DISCOURAGED);
  private static final PhpError CLOSURE =
      PhpError.make(
          "f", "a.php", SourceSpan.of(8, 7), PhpDiagnostics.CLOSURE_INSTANTIATED, "Closure");

  private static WarningsGuard fixed(CheckLevel level, int priority) {
    return new WarningsGuard() {
      @Override
      public @Nullable CheckLevel level(PhpError error) {
        return level;
      }

      @Override
      protected int getPriority() {
        return priority;
      }
    };
  }

  @Test
  public void testEmptyGuardHasNoOpinion() {
    assertThat(new ComposeWarningsGuard().level(UNREACHABLE)).isNull();
  }

  @Test
  public void testDiagnosticGroupGuard() {
    WarningsGuard guard =
        new DiagnosticGroupWarningsGuard(DiagnosticGroups.DEAD_CODE, CheckLevel.OFF);

    assertThat(guard.level(UNREACHABLE)).isEqualTo(CheckLevel.OFF);
    assertThat(guard.level(DIVISION)).isNull();
  }

  @Test
  public void testStrictGuardPromotesWarningsOnly() {
    WarningsGuard guard = new StrictWarningsGuard();

    assertThat(guard.level(DIVISION)).isEqualTo(CheckLevel.ERROR);
    assertThat(guard.level(EVAL)).isNull();
    assertThat(guard.level(CLOSURE)).isNull();
  }

  @Test
  public void testLowerPriorityAppliesFirst() {
    ComposeWarningsGuard guard =
        new ComposeWarningsGuard(fixed(CheckLevel.ERROR, 80), fixed(CheckLevel.INFO, 20));

    assertThat(guard.level(DIVISION)).isEqualTo(CheckLevel.INFO);
  }

  @Test
  public void testLastAddedWinsAtEqualPriority() {
    ComposeWarningsGuard guard =
        new ComposeWarningsGuard(
            new DiagnosticGroupWarningsGuard(DiagnosticGroups.SUSPICIOUS_CODE, CheckLevel.OFF),
            new DiagnosticGroupWarningsGuard(DiagnosticGroups.SUSPICIOUS_CODE, CheckLevel.ERROR));

    assertThat(guard.level(DIVISION)).isEqualTo(CheckLevel.ERROR);
  }

  @Test
  public void testGroupLevelsApplyBeforeStrictMode() {
    ComposeWarningsGuard guard =
        new ComposeWarningsGuard(
            new StrictWarningsGuard(),
            new DiagnosticGroupWarningsGuard(DiagnosticGroups.DEAD_CODE, CheckLevel.OFF));

    assertThat(guard.level(UNREACHABLE)).isEqualTo(CheckLevel.OFF);
    assertThat(guard.level(DIVISION)).isEqualTo(CheckLevel.ERROR);
    assertThat(guard.level(EVAL)).isNull();
  }

  @Test
  public void testNestedGuardsAreFlattened() {
    WarningsGuard first = new DiagnosticGroupWarningsGuard(DiagnosticGroups.EVAL, CheckLevel.OFF);
    WarningsGuard second =
        new DiagnosticGroupWarningsGuard(DiagnosticGroups.LEGALITY, CheckLevel.WARNING);
    ComposeWarningsGuard inner = new ComposeWarningsGuard(first, second);

    ComposeWarningsGuard outer = new ComposeWarningsGuard(inner);

    assertThat(outer.getGuards()).containsExactly(first, second);
    assertThat(outer.level(EVAL)).isEqualTo(CheckLevel.OFF);
    assertThat(outer.level(CLOSURE)).isEqualTo(CheckLevel.WARNING);
  }
}
