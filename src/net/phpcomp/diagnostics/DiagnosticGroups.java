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

import static net.phpcomp.diagnostics.PhpDiagnostics.ASSERT_ALWAYS_FAIL;
import static net.phpcomp.diagnostics.PhpDiagnostics.ASSIGNING_SAME_VARIABLE;
import static net.phpcomp.diagnostics.PhpDiagnostics.CANNOT_INSTANTIATE_TYPE;
import static net.phpcomp.diagnostics.PhpDiagnostics.CLOSURE_INSTANTIATED;
import static net.phpcomp.diagnostics.PhpDiagnostics.DIVISION_BY_ZERO;
import static net.phpcomp.diagnostics.PhpDiagnostics.EVAL_DISCOURAGED;
import static net.phpcomp.diagnostics.PhpDiagnostics.EXPRESSION_NOT_READ;
import static net.phpcomp.diagnostics.PhpDiagnostics.INVALID_FUNCTION_NAME;
import static net.phpcomp.diagnostics.PhpDiagnostics.LABEL_REDECLARED;
import static net.phpcomp.diagnostics.PhpDiagnostics.METHOD_CALLED_ON_NON_OBJECT;
import static net.phpcomp.diagnostics.PhpDiagnostics.MISSING_ARGUMENTS;
import static net.phpcomp.diagnostics.PhpDiagnostics.NOT_YET_IMPLEMENTED;
import static net.phpcomp.diagnostics.PhpDiagnostics.NOT_YET_IMPLEMENTED_IGNORED;
import static net.phpcomp.diagnostics.PhpDiagnostics.PRIMITIVE_TYPE_NAME_MISUSED;
import static net.phpcomp.diagnostics.PhpDiagnostics.STRING_ASSERTION_DEPRECATED;
import static net.phpcomp.diagnostics.PhpDiagnostics.SYMBOL_DEPRECATED;
import static net.phpcomp.diagnostics.PhpDiagnostics.TOO_MANY_ARGUMENTS;
import static net.phpcomp.diagnostics.PhpDiagnostics.TO_STRING_MUST_RETURN_STRING;
import static net.phpcomp.diagnostics.PhpDiagnostics.UNDEFINED_FUNCTION_CALL;
import static net.phpcomp.diagnostics.PhpDiagnostics.UNDEFINED_LABEL;
import static net.phpcomp.diagnostics.PhpDiagnostics.UNDEFINED_TYPE;
import static net.phpcomp.diagnostics.PhpDiagnostics.UNINITIALIZED_VARIABLE_USE;
import static net.phpcomp.diagnostics.PhpDiagnostics.UNREACHABLE_CODE;
import static net.phpcomp.diagnostics.PhpDiagnostics.VOID_FUNCTION_CANNOT_RETURN_VALUE;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Named groups of DiagnosticTypes reported by the diagnostics pass.
 */
public final class DiagnosticGroups {

  private DiagnosticGroups() {}

  private static final Map<String, DiagnosticGroup> groupsByName = new LinkedHashMap<>();

  static DiagnosticGroup registerGroup(String name, DiagnosticType... types) {
    DiagnosticGroup group = new DiagnosticGroup(name, types);
    groupsByName.put(name, group);
    return group;
  }

  /** Get the registered diagnostic groups, indexed by name. */
  public static ImmutableMap<String, DiagnosticGroup> getRegisteredGroups() {
    return ImmutableMap.copyOf(groupsByName);
  }

  /** Find the diagnostic group registered under the given name. */
  public static @Nullable DiagnosticGroup forName(String name) {
    return groupsByName.get(name);
  }

  public static final DiagnosticGroup EVAL = registerGroup("eval", EVAL_DISCOURAGED);

  public static final DiagnosticGroup DEAD_CODE =
      registerGroup("deadCode", UNREACHABLE_CODE, EXPRESSION_NOT_READ);

  public static final DiagnosticGroup DEPRECATED =
      registerGroup("deprecated", SYMBOL_DEPRECATED, STRING_ASSERTION_DEPRECATED);

  public static final DiagnosticGroup UNDEFINED_NAMES =
      registerGroup("undefinedNames", UNDEFINED_TYPE, UNDEFINED_FUNCTION_CALL);

  public static final DiagnosticGroup UNINITIALIZED =
      registerGroup("uninitialized", UNINITIALIZED_VARIABLE_USE);

  public static final DiagnosticGroup TYPE_CHECKS =
      registerGroup(
          "typeChecks",
          TO_STRING_MUST_RETURN_STRING,
          VOID_FUNCTION_CANNOT_RETURN_VALUE,
          INVALID_FUNCTION_NAME,
          METHOD_CALLED_ON_NON_OBJECT,
          PRIMITIVE_TYPE_NAME_MISUSED);

  public static final DiagnosticGroup UNSUPPORTED =
      registerGroup("unsupported", NOT_YET_IMPLEMENTED, NOT_YET_IMPLEMENTED_IGNORED);

  public static final DiagnosticGroup SUSPICIOUS_CODE =
      registerGroup(
          "suspiciousCode",
          ASSIGNING_SAME_VARIABLE,
          ASSERT_ALWAYS_FAIL,
          MISSING_ARGUMENTS,
          TOO_MANY_ARGUMENTS,
          DIVISION_BY_ZERO);

  public static final DiagnosticGroup LABELS =
      registerGroup("labels", UNDEFINED_LABEL, LABEL_REDECLARED);

  public static final DiagnosticGroup LEGALITY =
      registerGroup("legality", CANNOT_INSTANTIATE_TYPE, CLOSURE_INSTANTIATED);
}
