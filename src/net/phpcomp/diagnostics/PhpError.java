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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import net.phpcomp.semantics.SourceSpan;
import org.jspecify.annotations.Nullable;

/**
 * A reported diagnostic.
 *
 * @param type A type of the error.
 * @param description Description of the error, the type's format applied to the arguments.
 * @param routineName Name of the routine being analyzed, if any.
 * @param sourceName Name of the source file.
 * @param start Zero-based offset of the error region in the source file, or -1 if unknown.
 * @param length Length of the error region.
 * @param defaultLevel The default level, before any of the {@code WarningsGuard}s are applied.
 * @param arguments The message arguments, in order.
 */
public record PhpError(
    DiagnosticType type,
    String description,
    @Nullable String routineName,
    @Nullable String sourceName,
    int start,
    int length,
    CheckLevel defaultLevel,
    ImmutableList<String> arguments) {
  public PhpError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
    requireNonNull(arguments, "arguments");
  }

  private static final int DEFAULT_START = -1;
  private static final int DEFAULT_LENGTH = 0;

  /**
   * Creates a PhpError with no source information
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static PhpError make(DiagnosticType type, String... arguments) {
    return new PhpError(
        type,
        type.format((Object[]) arguments),
        null,
        null,
        DEFAULT_START,
        DEFAULT_LENGTH,
        type.level,
        ImmutableList.copyOf(arguments));
  }

  /**
   * Creates a PhpError at a given source location.
   *
   * @param routineName The routine being analyzed
   * @param sourceName The source file name
   * @param span The error region; an invalid span leaves the location unknown
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static PhpError make(
      @Nullable String routineName,
      @Nullable String sourceName,
      SourceSpan span,
      DiagnosticType type,
      String... arguments) {
    boolean known = span.isValid();
    return new PhpError(
        type,
        type.format((Object[]) arguments),
        routineName,
        sourceName,
        known ? span.start() : DEFAULT_START,
        known ? span.length() : DEFAULT_LENGTH,
        type.level,
        ImmutableList.copyOf(arguments));
  }

  public DiagnosticType getType() {
    return type;
  }

  public String getDescription() {
    return description;
  }

  public CheckLevel getDefaultLevel() {
    return defaultLevel;
  }

  /** The error region, or {@link SourceSpan#INVALID} if the location is unknown. */
  public SourceSpan getSpan() {
    return start < 0 ? SourceSpan.INVALID : SourceSpan.of(start, length);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (sourceName != null) {
      sb.append(sourceName);
      if (start >= 0) {
        sb.append('@').append(start).append('+').append(length);
      }
      sb.append(": ");
    }
    if (routineName != null) {
      sb.append(routineName).append(": ");
    }
    return sb.append(type.key).append(". ").append(description).toString();
  }
}
