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

/**
 * Controls how a diagnostic is reported. Warnings guards map a diagnostic's default level to the
 * level it is reported at, so that teams can decide which checks are off, which only inform,
 * which produce warnings and which produce errors.
 */
public enum CheckLevel {
  ERROR,
  WARNING,
  INFO,
  OFF;

  boolean isOn() {
    return this != OFF;
  }
}
