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

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import net.phpcomp.semantics.SourceSpan;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link LoggerErrorManager}. */
@RunWith(JUnit4.class)
public final class LoggerErrorManagerTest {

  private static final DiagnosticType FOO_TYPE = DiagnosticType.error("TEST_FOO", "Foo {0}");

  private final List<LogRecord> records = new ArrayList<>();
  private LoggerErrorManager manager;

  @Before
  public void setUp() {
    Logger logger = Logger.getAnonymousLogger();
    logger.setUseParentHandlers(false);
    logger.setLevel(Level.ALL);
    logger.addHandler(
        new Handler() {
          @Override
          public void publish(LogRecord record) {
            records.add(record);
          }

          @Override
          public void flush() {}

          @Override
          public void close() {}
        });
    manager = new LoggerErrorManager(logger);
  }

  @Test
  public void testLevelsAreMapped() {
    PhpError error = PhpError.make("f", "a.php", SourceSpan.of(1, 2), FOO_TYPE, "x");
    PhpError warning = PhpError.make("f", "a.php", SourceSpan.of(5, 2), FOO_TYPE, "y");
    PhpError info = PhpError.make("f", "a.php", SourceSpan.of(9, 2), FOO_TYPE, "z");
    manager.report(CheckLevel.INFO, info);
    manager.report(CheckLevel.WARNING, warning);
    manager.report(CheckLevel.ERROR, error);

    manager.generateReport();

    assertThat(records).hasSize(4);
    assertThat(records.get(0).getLevel()).isEqualTo(Level.SEVERE);
    assertThat(records.get(0).getMessage()).isEqualTo("a.php@1+2: f: TEST_FOO. Foo x");
    assertThat(records.get(1).getLevel()).isEqualTo(Level.WARNING);
    assertThat(records.get(2).getLevel()).isEqualTo(Level.INFO);
    assertThat(records.get(3).getLevel()).isEqualTo(Level.WARNING);
    assertThat(records.get(3).getParameters()).asList().containsExactly(1, 1).inOrder();
  }

  @Test
  public void testNoSummaryWithoutErrorsOrWarnings() {
    manager.report(
        CheckLevel.INFO, PhpError.make("f", "a.php", SourceSpan.of(1, 2), FOO_TYPE, "x"));

    manager.generateReport();

    assertThat(records).hasSize(1);
    assertThat(records.get(0).getLevel()).isEqualTo(Level.INFO);
  }
}
