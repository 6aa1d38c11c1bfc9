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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import net.phpcomp.semantics.BoundBinaryEx;
import net.phpcomp.semantics.BoundEvalEx;
import net.phpcomp.semantics.Operations;
import net.phpcomp.semantics.SourceRoutineSymbol;
import net.phpcomp.semantics.graph.ControlFlowGraph;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link DiagnosticsRunner}. */
@RunWith(JUnit4.class)
public final class DiagnosticsRunnerTest {

  private final DiagnosticOptions options = new DiagnosticOptions();
  private final SortingErrorManager errorManager = new SortingErrorManager();

  /** A function dividing by zero once and calling eval once, declared in its own file. */
  private static SourceRoutineSymbol routine(String name) {
    RoutineFixture fixture = new RoutineFixture();
    fixture.add(
        new BoundBinaryEx(
            Operations.DIV, fixture.local("a"), fixture.literal(0L), fixture.span()));
    fixture.add(new BoundEvalEx(fixture.literal("1;"), fixture.span()));
    return fixture
        .routine(name, SourceRoutineSymbol.Kind.FUNCTION)
        .setSourceFileName(name + ".php")
        .setControlFlowGraph(fixture.graph.build())
        .build();
  }

  private static ImmutableList<SourceRoutineSymbol> routines(int count) {
    ImmutableList.Builder<SourceRoutineSymbol> routines = ImmutableList.builder();
    for (int i = 0; i < count; i++) {
      routines.add(routine("fn" + i));
    }
    return routines.build();
  }

  @Test
  public void testDefaultLevels() {
    new DiagnosticsRunner(options, errorManager).analyze(routines(1));

    assertThat(errorManager.getWarningCount()).isEqualTo(1);
    assertThat(errorManager.getInfoCount()).isEqualTo(1);
    assertThat(errorManager.getErrorCount()).isEqualTo(0);
  }

  @Test
  public void testGroupTurnedOff() {
    options.setWarningLevel(DiagnosticGroups.SUSPICIOUS_CODE, CheckLevel.OFF);

    new DiagnosticsRunner(options, errorManager).analyze(routines(1));

    assertThat(errorManager.getWarningCount()).isEqualTo(0);
    assertThat(errorManager.getSortedDiagnostics()).hasSize(1);
  }

  @Test
  public void testGroupRaisedToError() {
    options.setWarningLevel("eval", CheckLevel.ERROR);

    new DiagnosticsRunner(options, errorManager).analyze(routines(1));

    assertThat(RoutineFixture.typesOf(errorManager.getErrors()))
        .containsExactly(PhpDiagnostics.EVAL_DISCOURAGED);
    assertThat(errorManager.hasHaltingErrors()).isFalse();
  }

  @Test
  public void testTreatWarningsAsErrors() {
    options.setTreatWarningsAsErrors(true);

    new DiagnosticsRunner(options, errorManager).analyze(routines(1));

    assertThat(RoutineFixture.typesOf(errorManager.getErrors()))
        .containsExactly(PhpDiagnostics.DIVISION_BY_ZERO);
    assertThat(errorManager.getInfoCount()).isEqualTo(1);
  }

  @Test
  public void testParallelAnalysis() {
    options.setNumParallelThreads(4);

    DiagnosticsRunner runner = new DiagnosticsRunner(options, errorManager);
    runner.analyze(routines(20));

    assertThat(errorManager.getWarningCount()).isEqualTo(20);
    assertThat(errorManager.getInfoCount()).isEqualTo(20);
    assertThat(runner.getErrorManager().getWarningCount()).isEqualTo(20);
  }

  @Test
  public void testParallelAnalysisMatchesSequential() {
    new DiagnosticsRunner(options, errorManager).analyze(routines(8));

    DiagnosticOptions parallel = new DiagnosticOptions();
    parallel.setNumParallelThreads(3);
    SortingErrorManager parallelManager = new SortingErrorManager();
    new DiagnosticsRunner(parallel, parallelManager).analyze(routines(8));

    assertThat(parallelManager.getWarnings())
        .containsExactlyElementsIn(errorManager.getWarnings())
        .inOrder();
  }

  @Test
  public void testRoutinesWithoutBodyAreSkipped() {
    SourceRoutineSymbol routine =
        new RoutineFixture().routine("abstractMethod", SourceRoutineSymbol.Kind.METHOD).build();

    new DiagnosticsRunner(options, errorManager).analyze(ImmutableList.of(routine));

    assertThat(errorManager.getSortedDiagnostics()).isEmpty();
  }

  @Test
  public void testFailureIsPropagated() {
    SourceRoutineSymbol broken =
        new RoutineFixture()
            .routine("broken", SourceRoutineSymbol.Kind.FUNCTION)
            .setControlFlowGraph(ControlFlowGraph.builder().build())
            .build();

    DiagnosticsRunner runner = new DiagnosticsRunner(options, errorManager);
    assertThrows(IllegalStateException.class, () -> runner.analyze(ImmutableList.of(broken)));
  }

  @Test
  public void testFailureInWorkerIsPropagated() {
    options.setNumParallelThreads(2);
    SourceRoutineSymbol broken =
        new RoutineFixture()
            .routine("broken", SourceRoutineSymbol.Kind.FUNCTION)
            .setControlFlowGraph(ControlFlowGraph.builder().build())
            .build();

    DiagnosticsRunner runner = new DiagnosticsRunner(options, errorManager);
    IllegalStateException e =
        assertThrows(
            IllegalStateException.class,
            () -> runner.analyze(ImmutableList.of(routine("ok"), broken)));
    assertThat(e).hasMessageThat().isEqualTo("Diagnosing a routine failed");
    assertThat(e).hasCauseThat().isInstanceOf(IllegalStateException.class);
  }
}
