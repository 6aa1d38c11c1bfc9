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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Records the block ranges covered by exception handling regions of a routine.
 *
 * <p>A block is inside a region when its ordinal falls in the region's half-open interval, no
 * matter how many other regions also cover it. Scopes are never removed, so nested and
 * overlapping try statements need no stack discipline.
 */
final class ScopeTracker {

  /** The kind of an exception handling region. */
  enum Kind {
    TRY,
    CATCH,
    FINALLY,
  }

  /** The blocks {@code [from, to)} covered by one region. Empty when {@code to <= from}. */
  record Scope(Kind kind, int from, int to) {
    Scope {
      checkNotNull(kind);
    }

    boolean contains(int ordinal) {
      return ordinal >= from && ordinal < to;
    }
  }

  private @Nullable List<Scope> scopes;

  void push(Kind kind, int from, int to) {
    if (scopes == null) {
      scopes = new ArrayList<>();
    }
    scopes.add(new Scope(kind, from, to));
  }

  boolean isInside(int ordinal, Kind kind) {
    if (scopes == null) {
      return false;
    }
    for (Scope scope : scopes) {
      if (scope.kind() == kind && scope.contains(ordinal)) {
        return true;
      }
    }
    return false;
  }

  boolean isInsideAnyTryOrCatchOrFinally(int ordinal) {
    if (scopes == null) {
      return false;
    }
    for (Scope scope : scopes) {
      if (scope.contains(ordinal)) {
        return true;
      }
    }
    return false;
  }

  ImmutableList<Scope> getScopes() {
    return scopes == null ? ImmutableList.of() : ImmutableList.copyOf(scopes);
  }
}
