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

import org.jspecify.annotations.Nullable;

/**
 * All warnings should be reported as errors. Informational diagnostics keep their level.
 */
public final class StrictWarningsGuard extends WarningsGuard {

  @Override
  public @Nullable CheckLevel level(PhpError error) {
    return error.getDefaultLevel() == CheckLevel.WARNING ? CheckLevel.ERROR : null;
  }

  @Override
  protected int getPriority() {
    return WarningsGuard.Priority.STRICT.value; // applied last
  }
}
