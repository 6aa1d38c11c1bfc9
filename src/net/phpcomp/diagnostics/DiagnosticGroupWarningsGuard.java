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

import org.jspecify.annotations.Nullable;

/**
 * Sets the level for a particular DiagnosticGroup.
 */
public class DiagnosticGroupWarningsGuard extends WarningsGuard {

  private final DiagnosticGroup group;
  private final CheckLevel level;

  public DiagnosticGroupWarningsGuard(DiagnosticGroup group, CheckLevel level) {
    this.group = checkNotNull(group);
    this.level = checkNotNull(level);
  }

  @Override
  public @Nullable CheckLevel level(PhpError error) {
    return group.matches(error) ? level : null;
  }

  @Override
  public String toString() {
    return group + "(" + level + ")";
  }
}
