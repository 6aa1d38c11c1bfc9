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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Options for a {@link DiagnosticsRunner}: the levels diagnostics are reported at, and how many
 * routines are analyzed concurrently.
 */
public class DiagnosticOptions {

  private ComposeWarningsGuard warningsGuard = new ComposeWarningsGuard();

  private int numParallelThreads = 1;

  /** Configure the given type of warning to the given level. */
  public void setWarningLevel(DiagnosticGroup type, CheckLevel level) {
    addWarningsGuard(new DiagnosticGroupWarningsGuard(type, level));
  }

  /** Configure the group registered under {@code name} in {@link DiagnosticGroups}. */
  public void setWarningLevel(String name, CheckLevel level) {
    DiagnosticGroup group = DiagnosticGroups.forName(name);
    checkNotNull(group, "No warning class for name: %s", name);
    setWarningLevel(group, level);
  }

  /** Report every warning as an error. */
  public void setTreatWarningsAsErrors(boolean treatWarningsAsErrors) {
    if (treatWarningsAsErrors) {
      addWarningsGuard(new StrictWarningsGuard());
    }
  }

  /** Add a guard to the set of warnings guards. */
  public void addWarningsGuard(WarningsGuard guard) {
    this.warningsGuard.addGuard(guard);
  }

  /** Reset the warnings guard. */
  public void resetWarningsGuard() {
    this.warningsGuard = new ComposeWarningsGuard();
  }

  public WarningsGuard getWarningsGuard() {
    return this.warningsGuard;
  }

  /** Sets the number of routines analyzed concurrently. One analyzes on the calling thread. */
  public void setNumParallelThreads(int parallelThreads) {
    checkArgument(parallelThreads > 0, "Invalid number of threads: %s", parallelThreads);
    this.numParallelThreads = parallelThreads;
  }

  public int getNumParallelThreads() {
    return numParallelThreads;
  }
}
