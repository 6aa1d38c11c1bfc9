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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;
import net.phpcomp.semantics.SourceRoutineSymbol;

/**
 * Runs the diagnostics pass over the routines of a compilation and reports the results to an
 * {@link ErrorManager}, after the configured warnings guards have set their levels.
 *
 * <p>Each routine is analyzed by its own {@link DiagnosingVisitor}. With more than one thread the
 * routines are analyzed concurrently and the error manager is accessed through a {@link
 * ThreadSafeDelegatingErrorManager}.
 */
public final class DiagnosticsRunner {

  private static final Logger logger = Logger.getLogger(DiagnosticsRunner.class.getName());

  private final DiagnosticOptions options;
  private final ErrorManager errorManager;

  public DiagnosticsRunner(DiagnosticOptions options, ErrorManager errorManager) {
    this.options = checkNotNull(options);
    this.errorManager = new ThreadSafeDelegatingErrorManager(checkNotNull(errorManager));
  }

  public ErrorManager getErrorManager() {
    return errorManager;
  }

  /**
   * Analyzes every routine of {@code routines}.
   *
   * @throws IllegalStateException if the analysis of a routine failed
   */
  public void analyze(List<SourceRoutineSymbol> routines) {
    logger.fine("Diagnosing " + routines.size() + " routine(s)");
    ErrorHandler handler = new GuardedErrorHandler(options.getWarningsGuard(), errorManager);

    int numThreads = options.getNumParallelThreads();
    if (numThreads <= 1 || routines.size() <= 1) {
      for (SourceRoutineSymbol routine : routines) {
        DiagnosingVisitor.analyze(handler, routine);
      }
    } else {
      analyzeInParallel(handler, routines, numThreads);
    }

    logger.fine(
        "Diagnosed "
            + routines.size()
            + " routine(s): "
            + errorManager.getErrorCount()
            + " error(s), "
            + errorManager.getWarningCount()
            + " warning(s)");
  }

  private static void analyzeInParallel(
      ErrorHandler handler, List<SourceRoutineSymbol> routines, int numThreads) {
    ExecutorService poolExecutor =
        Executors.newFixedThreadPool(
            numThreads,
            new ThreadFactoryBuilder()
                .setNameFormat("php-diagnostics-%d")
                .setDaemon(true) // Do not prevent the JVM from exiting.
                .build());
    ListeningExecutorService executorService = MoreExecutors.listeningDecorator(poolExecutor);
    List<ListenableFuture<?>> futureList = new ArrayList<>(routines.size());
    for (final SourceRoutineSymbol routine : routines) {
      futureList.add(executorService.submit(() -> DiagnosingVisitor.analyze(handler, routine)));
    }

    executorService.shutdown();
    try {
      Futures.allAsList(futureList).get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while diagnosing routines", e);
    } catch (ExecutionException e) {
      throw new IllegalStateException("Diagnosing a routine failed", e.getCause());
    }
  }

  /** Applies the warnings guard to each error and drops the ones it turns off. */
  private static final class GuardedErrorHandler implements ErrorHandler {
    private final WarningsGuard warningsGuard;
    private final ErrorHandler delegate;

    GuardedErrorHandler(WarningsGuard warningsGuard, ErrorHandler delegate) {
      this.warningsGuard = warningsGuard;
      this.delegate = delegate;
    }

    @Override
    public void report(CheckLevel level, PhpError error) {
      CheckLevel newLevel = warningsGuard.level(error);
      if (newLevel == null) {
        newLevel = level;
      }
      if (newLevel.isOn()) {
        delegate.report(newLevel, error);
      }
    }
  }
}
