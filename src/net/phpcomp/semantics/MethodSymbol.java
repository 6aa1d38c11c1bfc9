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
 * A global function or a class method a call resolves to, or the error sentinel standing in for a
 * call target that could not be resolved.
 */
public final class MethodSymbol implements Symbol {

  /** Whether the routine is a global function or a method. */
  public enum Kind {
    FUNCTION,
    METHOD,
  }

  /** Why a call target is an error sentinel. */
  public enum ErrorKind {
    /** No declaration with the name exists. */
    MISSING,
    AMBIGUOUS,
    INACCESSIBLE,
  }

  private final String name;
  private final Kind kind;
  private final @Nullable TypeSymbol containingType;
  private final @Nullable ErrorKind errorKind;
  private final @Nullable ObsoleteData obsoleteData;

  private MethodSymbol(
      String name,
      Kind kind,
      @Nullable TypeSymbol containingType,
      @Nullable ErrorKind errorKind,
      @Nullable ObsoleteData obsoleteData) {
    this.name = checkNotNull(name);
    this.kind = checkNotNull(kind);
    this.containingType = containingType;
    this.errorKind = errorKind;
    this.obsoleteData = obsoleteData;
  }

  public static MethodSymbol function(String name) {
    return new MethodSymbol(name, Kind.FUNCTION, null, null, null);
  }

  public static MethodSymbol method(TypeSymbol containingType, String name) {
    return new MethodSymbol(name, Kind.METHOD, checkNotNull(containingType), null, null);
  }

  /** Creates the sentinel for a call target that could not be resolved. */
  public static MethodSymbol error(String name, ErrorKind errorKind) {
    return new MethodSymbol(name, Kind.FUNCTION, null, checkNotNull(errorKind), null);
  }

  /** Returns a copy of this symbol carrying the given deprecation metadata. */
  public MethodSymbol withObsoleteData(ObsoleteData obsoleteData) {
    return new MethodSymbol(name, kind, containingType, errorKind, checkNotNull(obsoleteData));
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public String getKindName() {
    return kind == Kind.METHOD ? "method" : "function";
  }

  public Kind getKind() {
    return kind;
  }

  public @Nullable TypeSymbol getContainingType() {
    return containingType;
  }

  public boolean isErrorMethod() {
    return errorKind != null;
  }

  /** Why resolution failed, or null for a resolved routine. */
  public @Nullable ErrorKind getErrorKind() {
    return errorKind;
  }

  @Override
  public Optional<ObsoleteData> getObsoleteData() {
    return Optional.ofNullable(obsoleteData);
  }

  @Override
  public String toString() {
    return containingType == null ? name : containingType + "::" + name;
  }
}
