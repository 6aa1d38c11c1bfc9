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

import static com.google.common.base.Preconditions.checkNotNull;

import net.phpcomp.semantics.BoundOperation;
import net.phpcomp.semantics.SourceRoutineSymbol;
import net.phpcomp.semantics.SourceSpan;
import org.jspecify.annotations.Nullable;

/**
 * Creates the errors of one routine and hands them to an {@link ErrorHandler} at their default
 * level.
 */
final class RoutineErrorReporter {

  private final ErrorHandler errorHandler;
  private final SourceRoutineSymbol routine;

  RoutineErrorReporter(ErrorHandler errorHandler, SourceRoutineSymbol routine) {
    this.errorHandler = checkNotNull(errorHandler);
    this.routine = checkNotNull(routine);
  }

  void report(SourceSpan span, DiagnosticType type, String... arguments) {
    PhpError error =
        PhpError.make(routine.toString(), routine.getSourceFileName(), span, type, arguments);
    errorHandler.report(error.getDefaultLevel(), error);
  }

  void report(@Nullable BoundOperation node, DiagnosticType type, String... arguments) {
    report(spanOf(node), type, arguments);
  }

  static SourceSpan spanOf(@Nullable BoundOperation node) {
    if (node == null || node.getSyntax() == null) {
      return SourceSpan.INVALID;
    }
    return node.getSyntax();
  }
}
