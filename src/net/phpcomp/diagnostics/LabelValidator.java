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

import java.util.List;
import net.phpcomp.semantics.graph.LabelBlockFlags;
import net.phpcomp.semantics.graph.LabelBlockState;

/**
 * Checks the label table of a routine once the whole graph has been seen, so that a label
 * defined after the {@code goto} using it counts as defined.
 */
final class LabelValidator {

  private final RoutineErrorReporter reporter;

  LabelValidator(RoutineErrorReporter reporter) {
    this.reporter = reporter;
  }

  void validate(List<LabelBlockState> labels) {
    for (LabelBlockState label : labels) {
      if (!label.hasFlag(LabelBlockFlags.DEFINED)) {
        reporter.report(label.getLabelSpan(), PhpDiagnostics.UNDEFINED_LABEL, label.getLabel());
      }
      // Labels without USED are not reported.
      if (label.hasFlag(LabelBlockFlags.REDEFINED)) {
        reporter.report(label.getLabelSpan(), PhpDiagnostics.LABEL_REDECLARED, label.getLabel());
      }
    }
  }
}
