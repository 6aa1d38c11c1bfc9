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

import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Answers name lookups against the declarations known to the compilation. Used to query semantic
 * questions about the compilation in a specific context.
 */
public interface SymbolProvider {

  /** Gets a file by its path relative to the current context, or null if there is none. */
  @Nullable ScriptSymbol resolveFile(String path);

  /** Gets a type by its name in the current context, or null if it cannot be found. */
  @Nullable TypeSymbol resolveType(QualifiedName name);

  /** Gets a global function by its name in the current context, or null if it cannot be found. */
  @Nullable MethodSymbol resolveFunction(QualifiedName name);

  /** Resolves the value of a global constant visible in the current context. */
  Optional<Object> resolveConstant(String name);

  /** Names of the extensions the compilation references. */
  Iterable<String> getExtensions();
}
