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

import com.google.common.collect.ImmutableList;

/**
 * The error manager is in charge of storing, organizing and displaying errors and warnings
 * reported by the analysis.
 */
public interface ErrorManager extends ErrorHandler {

  /** Writes a report to an implementation-specific medium. */
  void generateReport();

  /** Whether any error was reported at its default ERROR level. */
  boolean hasHaltingErrors();

  int getErrorCount();

  int getWarningCount();

  int getInfoCount();

  ImmutableList<PhpError> getErrors();

  ImmutableList<PhpError> getWarnings();

  ImmutableList<PhpError> getInfos();
}
