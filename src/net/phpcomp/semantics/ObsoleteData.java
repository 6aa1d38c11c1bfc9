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

/**
 * Deprecation metadata attached to a declaration.
 *
 * @param message Free-form text explaining the deprecation. May be empty.
 * @param isError Whether the declaration asks for uses to be rejected rather than warned about.
 */
public record ObsoleteData(String message, boolean isError) {
  public ObsoleteData {
    checkNotNull(message);
  }

  public static ObsoleteData of(String message) {
    return new ObsoleteData(message, false);
  }
}
