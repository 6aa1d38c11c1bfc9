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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A region of source text, expressed as a start offset and a length.
 *
 * @param start Zero-indexed character offset of the region, or -1 if unknown.
 * @param length Length of the region in characters.
 */
public record SourceSpan(int start, int length) {

  /** The span of synthesized code with no source position. */
  public static final SourceSpan INVALID = new SourceSpan(-1, 0);

  public SourceSpan {
    checkArgument(length >= 0, "negative length %s", length);
  }

  public static SourceSpan of(int start, int length) {
    return new SourceSpan(start, length);
  }

  public boolean isValid() {
    return start >= 0;
  }

  /** Offset of the first character after the span. */
  public int end() {
    return start + length;
  }

  /** Returns a span starting where this one does, truncated to {@code newLength}. */
  public SourceSpan withLength(int newLength) {
    return new SourceSpan(start, Math.min(length, newLength));
  }

  @Override
  public String toString() {
    return isValid() ? "[" + start + ".." + end() + ")" : "[unknown]";
  }
}
