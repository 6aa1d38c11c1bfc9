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

package net.phpcomp.semantics;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * The compilation a routine belongs to. Resolves names through its {@link SymbolProvider},
 * returning error sentinels rather than null for names that cannot be found.
 */
public final class Compilation {

  private final SymbolProvider symbolProvider;
  private final CoreTypes coreTypes = new CoreTypes();

  public Compilation(SymbolProvider symbolProvider) {
    this.symbolProvider = checkNotNull(symbolProvider);
  }

  public CoreTypes getCoreTypes() {
    return coreTypes;
  }

  public SymbolProvider getSymbolProvider() {
    return symbolProvider;
  }

  /** Resolves a type; unknown names yield a {@link CandidateReason#NOT_FOUND} error type. */
  public TypeSymbol resolveType(QualifiedName name) {
    if (name.isSimple() && name.getName().equalsIgnoreCase(coreTypes.getClosure().getName())) {
      return coreTypes.getClosure();
    }
    TypeSymbol type = symbolProvider.resolveType(name);
    return type != null ? type : TypeSymbol.error(name, CandidateReason.NOT_FOUND);
  }

  /** Resolves a global function; unknown names yield a {@code MISSING} error method. */
  public MethodSymbol resolveFunction(QualifiedName name) {
    MethodSymbol function = symbolProvider.resolveFunction(name);
    return function != null
        ? function
        : MethodSymbol.error(name.toString(), MethodSymbol.ErrorKind.MISSING);
  }

  public @Nullable ScriptSymbol resolveFile(String path) {
    return symbolProvider.resolveFile(path);
  }

  public Optional<Object> resolveConstant(String name) {
    return symbolProvider.resolveConstant(name);
  }
}
