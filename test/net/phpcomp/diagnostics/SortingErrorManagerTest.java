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
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import net.phpcomp.diagnostics.SortingErrorManager.ErrorWithLevel;
import net.phpcomp.diagnostics.SortingErrorManager.LeveledPhpErrorComparator;
import net.phpcomp.semantics.SourceSpan;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link SortingErrorManager}. */
@RunWith(JUnit4.class)
public final class SortingErrorManagerTest {
  private static final String NULL_SOURCE = null;

  private final LeveledPhpErrorComparator comparator = new LeveledPhpErrorComparator();

  private static final DiagnosticType FOO_TYPE = DiagnosticType.error("TEST_FOO", "Foo");

  private static final DiagnosticType JOO_TYPE = DiagnosticType.error("TEST_JOO", "Joo");

  private static final DiagnosticType BAR_WARNING = DiagnosticType.warning("TEST_BAR", "Bar");

  private static PhpError make(String sourceName, int start, int length, DiagnosticType type) {
    SourceSpan span = start < 0 ? SourceSpan.INVALID : SourceSpan.of(start, length);
    return PhpError.make("f", sourceName, span, type);
  }

  @Test
  public void testOrderingSourceName1() {
    PhpError e1 = make(NULL_SOURCE, -1, 0, FOO_TYPE);
    PhpError e2 = make("a", -1, 0, FOO_TYPE);

    assertSmaller(error(e1), error(e2));
  }

  @Test
  public void testOrderingSourceName2() {
    PhpError e1 = make("a", -1, 0, FOO_TYPE);
    PhpError e2 = make("b", -1, 0, FOO_TYPE);

    assertSmaller(error(e1), error(e2));
  }

  @Test
  public void testOrderingStart1() {
    PhpError e1 = make(NULL_SOURCE, -1, 0, FOO_TYPE);
    PhpError e2 = make(NULL_SOURCE, 2, 0, FOO_TYPE);

    assertSmaller(error(e1), error(e2));
  }

  @Test
  public void testOrderingStart2() {
    PhpError e1 = make(NULL_SOURCE, 8, 0, FOO_TYPE);
    PhpError e2 = make(NULL_SOURCE, 56, 0, FOO_TYPE);

    assertSmaller(error(e1), error(e2));
  }

  @Test
  public void testOrderingCheckLevel() {
    PhpError e1 = make(NULL_SOURCE, -1, 0, FOO_TYPE);
    PhpError e2 = make(NULL_SOURCE, -1, 0, FOO_TYPE);

    assertSmaller(error(e1), warning(e2));
  }

  @Test
  public void testOrderingLength() {
    PhpError e1 = make(NULL_SOURCE, 5, 1, FOO_TYPE);
    PhpError e2 = make(NULL_SOURCE, 5, 2, FOO_TYPE);

    assertSmaller(error(e1), error(e2));
    // CheckLevel preempts length comparison
    assertSmaller(error(e2), warning(e1));
  }

  @Test
  public void testOrderingDescription() {
    PhpError e1 = make(NULL_SOURCE, -1, 0, FOO_TYPE);
    PhpError e2 = make(NULL_SOURCE, -1, 0, JOO_TYPE);

    assertSmaller(error(e1), error(e2));
  }

  @Test
  public void testDeduplicatedErrors() {
    SortingErrorManager manager = new SortingErrorManager();
    manager.report(CheckLevel.ERROR, make(NULL_SOURCE, -1, 0, FOO_TYPE));
    manager.report(CheckLevel.ERROR, make(NULL_SOURCE, -1, 0, FOO_TYPE));

    assertThat(manager.getErrorCount()).isEqualTo(1);
    assertThat(manager.getSortedDiagnostics()).hasSize(1);
  }

  @Test
  public void testErrorsAtUnknownPositionsOfDifferentRoutinesAreKept() {
    SortingErrorManager manager = new SortingErrorManager();
    PhpError inF = PhpError.make("f", "a.php", SourceSpan.INVALID, BAR_WARNING);
    PhpError inG = PhpError.make("g", "a.php", SourceSpan.INVALID, BAR_WARNING);
    manager.report(CheckLevel.WARNING, inF);
    manager.report(CheckLevel.WARNING, inG);
    manager.report(CheckLevel.WARNING, inF);

    assertThat(manager.getWarningCount()).isEqualTo(2);
    assertThat(manager.getWarnings()).containsExactly(inF, inG).inOrder();
  }

  @Test
  public void testOrderingRoutineName() {
    PhpError e1 = PhpError.make("f", "a.php", SourceSpan.of(1, 2), FOO_TYPE);
    PhpError e2 = PhpError.make("g", "a.php", SourceSpan.of(1, 2), FOO_TYPE);

    assertSmaller(error(e1), error(e2));
  }

  @Test
  public void testSameErrorAtDifferentLevelsIsKept() {
    SortingErrorManager manager = new SortingErrorManager();
    PhpError e = make("a.php", 3, 4, FOO_TYPE);
    manager.report(CheckLevel.ERROR, e);
    manager.report(CheckLevel.WARNING, e);

    assertThat(manager.getErrors()).containsExactly(e);
    assertThat(manager.getWarnings()).containsExactly(e);
  }

  @Test
  public void testCounts() {
    SortingErrorManager manager = new SortingErrorManager();
    manager.report(CheckLevel.ERROR, make("a.php", 1, 1, FOO_TYPE));
    manager.report(CheckLevel.WARNING, make("a.php", 2, 1, BAR_WARNING));
    manager.report(CheckLevel.WARNING, make("a.php", 3, 1, BAR_WARNING));
    manager.report(CheckLevel.INFO, make("a.php", 4, 1, BAR_WARNING));

    assertThat(manager.getErrorCount()).isEqualTo(1);
    assertThat(manager.getWarningCount()).isEqualTo(2);
    assertThat(manager.getInfoCount()).isEqualTo(1);
    assertThat(manager.getInfos()).hasSize(1);
    assertThat(manager.hasHaltingErrors()).isTrue();
  }

  @Test
  public void testPromotedWarningsAreNotHalting() {
    SortingErrorManager manager = new SortingErrorManager();
    manager.report(CheckLevel.ERROR, make("a.php", 1, 1, BAR_WARNING));

    assertThat(manager.getErrorCount()).isEqualTo(1);
    assertThat(manager.hasHaltingErrors()).isFalse();
  }

  @Test
  public void testErrorsAreSorted() {
    SortingErrorManager manager = new SortingErrorManager();
    PhpError late = make("a.php", 90, 1, BAR_WARNING);
    PhpError early = make("a.php", 10, 1, BAR_WARNING);
    PhpError otherFile = make("0.php", 50, 1, BAR_WARNING);
    manager.report(CheckLevel.WARNING, late);
    manager.report(CheckLevel.WARNING, early);
    manager.report(CheckLevel.WARNING, otherFile);

    assertThat(manager.getWarnings()).containsExactly(otherFile, early, late).inOrder();
  }

  @Test
  public void testReportGenerators() {
    List<Integer> generated = new ArrayList<>();
    SortingErrorManager manager =
        new SortingErrorManager(
            ImmutableSet.<SortingErrorManager.ErrorReportGenerator>of(
                m -> generated.add(m.getErrorCount() + m.getWarningCount())));
    manager.report(CheckLevel.ERROR, make("a.php", 1, 1, FOO_TYPE));
    manager.report(CheckLevel.WARNING, make("a.php", 1, 1, BAR_WARNING));

    manager.generateReport();

    assertThat(generated).containsExactly(2);
  }

  @Test
  public void testOffIsRecordedButNotCounted() {
    SortingErrorManager manager = new SortingErrorManager();
    manager.report(CheckLevel.OFF, make("a.php", 1, 1, FOO_TYPE));

    assertThat(manager.getErrorCount()).isEqualTo(0);
    assertThat(manager.getWarningCount()).isEqualTo(0);
    assertThat(manager.getErrors()).isEmpty();
  }

  private ErrorWithLevel error(PhpError e) {
    return new ErrorWithLevel(e, CheckLevel.ERROR);
  }

  private ErrorWithLevel warning(PhpError e) {
    return new ErrorWithLevel(e, CheckLevel.WARNING);
  }

  private void assertSmaller(ErrorWithLevel p1, ErrorWithLevel p2) {
    int p1p2 = comparator.compare(p1, p2);
    assertWithMessage(Integer.toString(p1p2)).that(p1p2).isLessThan(0);
    int p2p1 = comparator.compare(p2, p1);
    assertWithMessage(Integer.toString(p2p1)).that(p2p1).isGreaterThan(0);
  }
}
