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

import java.util.Optional;
import net.phpcomp.semantics.BoundGlobalFunctionCall;
import net.phpcomp.semantics.BoundTypeRef;
import net.phpcomp.semantics.CandidateReason;
import net.phpcomp.semantics.MethodSymbol;
import net.phpcomp.semantics.ObsoleteData;
import net.phpcomp.semantics.Symbol;
import net.phpcomp.semantics.TypeRefSyntax;
import net.phpcomp.semantics.TypeSymbol;
import org.jspecify.annotations.Nullable;

/**
 * Queries over the symbol resolution results attached to the bound tree. Only directly named
 * references can be undefined; the target of a computed name is unknown statically.
 */
final class SymbolResolution {

  private SymbolResolution() {}

  /** Whether a directly named function call resolved to a missing function. */
  static boolean isUndefinedFunctionCall(BoundGlobalFunctionCall call) {
    if (!call.getName().isDirect()) {
      return false;
    }
    MethodSymbol target = call.getTargetMethod();
    return target != null
        && target.isErrorMethod()
        && target.getErrorKind() == MethodSymbol.ErrorKind.MISSING;
  }

  /**
   * Whether a directly named type reference did not resolve. Ambiguous declarations are reported
   * where they are declared, and {@code self}, {@code parent} and {@code static} may legitimately
   * stay unresolved, so neither counts.
   */
  static boolean isUndefinedType(BoundTypeRef typeRef) {
    if (!typeRef.isDirect()) {
      return false;
    }
    TypeSymbol resolved = typeRef.getResolvedType();
    if (resolved != null && !resolved.isErrorType()) {
      return false;
    }
    if (resolved != null && resolved.getCandidateReason() == CandidateReason.AMBIGUOUS) {
      return false;
    }
    TypeRefSyntax syntax = typeRef.getTypeRef();
    return syntax != null && !syntax.isReserved();
  }

  static Optional<ObsoleteData> getObsoleteData(@Nullable Symbol symbol) {
    return symbol == null ? Optional.empty() : symbol.getObsoleteData();
  }
}
