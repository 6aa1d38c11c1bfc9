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

import com.google.errorprone.annotations.Immutable;

/** How the value of an expression is used by its context. */
@Immutable
public final class BoundAccess {

  private static final int READ_FLAG = 1;
  private static final int WRITE_FLAG = 2;
  private static final int QUIET_FLAG = 4;

  /** The value is computed and discarded. */
  public static final BoundAccess NONE = new BoundAccess(0);

  public static final BoundAccess READ = new BoundAccess(READ_FLAG);

  public static final BoundAccess WRITE = new BoundAccess(WRITE_FLAG);

  /** A read that must not report undefined values, as inside {@code isset()} or after {@code @}. */
  public static final BoundAccess READ_QUIET = new BoundAccess(READ_FLAG | QUIET_FLAG);

  private final int flags;

  private BoundAccess(int flags) {
    this.flags = flags;
  }

  public boolean isNone() {
    return flags == 0;
  }

  public boolean isRead() {
    return (flags & READ_FLAG) != 0;
  }

  public boolean isWrite() {
    return (flags & WRITE_FLAG) != 0;
  }

  public boolean isQuiet() {
    return (flags & QUIET_FLAG) != 0;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof BoundAccess && ((BoundAccess) o).flags == flags;
  }

  @Override
  public int hashCode() {
    return flags;
  }

  @Override
  public String toString() {
    if (isNone()) {
      return "none";
    }
    StringBuilder sb = new StringBuilder();
    if (isRead()) {
      sb.append("read");
    }
    if (isWrite()) {
      sb.append(sb.length() > 0 ? "|write" : "write");
    }
    if (isQuiet()) {
      sb.append("|quiet");
    }
    return sb.toString();
  }
}
