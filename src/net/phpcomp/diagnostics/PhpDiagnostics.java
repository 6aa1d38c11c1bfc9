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

/** The diagnostics reported by {@link DiagnosingVisitor}. */
public final class PhpDiagnostics {

  static final DiagnosticType EVAL_DISCOURAGED =
      DiagnosticType.info("PHP_EVAL_DISCOURAGED", "Use of eval is discouraged");

  static final DiagnosticType EXPRESSION_NOT_READ =
      DiagnosticType.warning(
          "PHP_EXPRESSION_NOT_READ",
          "The expression is not being read. Did you mean to assign it somewhere?");

  static final DiagnosticType PRIMITIVE_TYPE_NAME_MISUSED =
      DiagnosticType.error(
          "PHP_PRIMITIVE_TYPE_NAME_MISUSED", "Primitive type {0} cannot be used as a class name");

  static final DiagnosticType UNDEFINED_TYPE =
      DiagnosticType.warning("PHP_UNDEFINED_TYPE", "Type {0} not found");

  static final DiagnosticType CANNOT_INSTANTIATE_TYPE =
      DiagnosticType.error("PHP_CANNOT_INSTANTIATE_TYPE", "Cannot instantiate {0} {1}");

  static final DiagnosticType CLOSURE_INSTANTIATED =
      DiagnosticType.error("PHP_CLOSURE_INSTANTIATED", "Instantiation of {0} is not allowed");

  static final DiagnosticType TO_STRING_MUST_RETURN_STRING =
      DiagnosticType.error(
          "PHP_TO_STRING_MUST_RETURN_STRING", "Method {0}::__toString() must return a string value");

  static final DiagnosticType VOID_FUNCTION_CANNOT_RETURN_VALUE =
      DiagnosticType.error(
          "PHP_VOID_FUNCTION_CANNOT_RETURN_VALUE", "A void function must not return a value");

  static final DiagnosticType NOT_YET_IMPLEMENTED =
      DiagnosticType.error("PHP_NOT_YET_IMPLEMENTED", "Not yet implemented: {0}");

  static final DiagnosticType NOT_YET_IMPLEMENTED_IGNORED =
      DiagnosticType.warning(
          "PHP_NOT_YET_IMPLEMENTED_IGNORED", "Not yet implemented, the construct is ignored: {0}");

  static final DiagnosticType ASSIGNING_SAME_VARIABLE =
      DiagnosticType.warning("PHP_ASSIGNING_SAME_VARIABLE", "Assignment made to same variable");

  static final DiagnosticType UNDEFINED_FUNCTION_CALL =
      DiagnosticType.warning("PHP_UNDEFINED_FUNCTION_CALL", "Call to undefined function {0}()");

  static final DiagnosticType INVALID_FUNCTION_NAME =
      DiagnosticType.error(
          "PHP_INVALID_FUNCTION_NAME", "A value of type {0} cannot be called as a function");

  static final DiagnosticType SYMBOL_DEPRECATED =
      DiagnosticType.warning("PHP_SYMBOL_DEPRECATED", "The {0} {1} is deprecated: {2}");

  static final DiagnosticType UNINITIALIZED_VARIABLE_USE =
      DiagnosticType.warning(
          "PHP_UNINITIALIZED_VARIABLE_USE", "Variable ${0} might not have been initialized");

  static final DiagnosticType MISSING_ARGUMENTS =
      DiagnosticType.warning(
          "PHP_MISSING_ARGUMENTS", "{0}() expects at least {1} parameter(s), {2} given");

  static final DiagnosticType TOO_MANY_ARGUMENTS =
      DiagnosticType.warning("PHP_TOO_MANY_ARGUMENTS", "Too many arguments");

  static final DiagnosticType ASSERT_ALWAYS_FAIL =
      DiagnosticType.warning("PHP_ASSERT_ALWAYS_FAIL", "Assertion will always fail");

  static final DiagnosticType STRING_ASSERTION_DEPRECATED =
      DiagnosticType.warning(
          "PHP_STRING_ASSERTION_DEPRECATED", "Calling assert() with a string argument is deprecated");

  static final DiagnosticType DIVISION_BY_ZERO =
      DiagnosticType.warning("PHP_DIVISION_BY_ZERO", "Division by zero");

  static final DiagnosticType METHOD_CALLED_ON_NON_OBJECT =
      DiagnosticType.error(
          "PHP_METHOD_CALLED_ON_NON_OBJECT", "Call to a member function {0}() on {1}");

  static final DiagnosticType UNREACHABLE_CODE =
      DiagnosticType.warning("PHP_UNREACHABLE_CODE", "Unreachable code detected");

  static final DiagnosticType UNDEFINED_LABEL =
      DiagnosticType.error("PHP_UNDEFINED_LABEL", "goto to undefined label {0}");

  static final DiagnosticType LABEL_REDECLARED =
      DiagnosticType.error("PHP_LABEL_REDECLARED", "Label {0} already defined");

  private PhpDiagnostics() {}
}
