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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Comparator;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A customizable error manager that sorts all errors and warnings reported to it, and has
 * customizable output through the {@link ErrorReportGenerator} interface.
 *
 * <p>Reporting the same message at the same level and location of the same routine twice records
 * it once. Errors without a known position all sit at offset -1, so repeats of one message within
 * a routine at unknown positions are recorded once.
 */
public class SortingErrorManager implements ErrorManager {

  private final TreeSet<ErrorWithLevel> messages = new TreeSet<>(new LeveledPhpErrorComparator());
  private int originalErrorCount = 0;
  private int promotedErrorCount = 0;
  private int warningCount = 0;
  private int infoCount = 0;

  /** Responsible for generating the report of the errors at the end of the analysis */
  private final ImmutableSet<ErrorReportGenerator> errorReportGenerators;

  public SortingErrorManager(Set<ErrorReportGenerator> errorReportGenerators) {
    this.errorReportGenerators = ImmutableSet.copyOf(errorReportGenerators);
  }

  public SortingErrorManager() {
    this(ImmutableSet.of());
  }

  @Override
  public void report(CheckLevel level, PhpError error) {
    ErrorWithLevel e = new ErrorWithLevel(error, level);
    if (messages.add(e)) {
      switch (level) {
        case ERROR:
          if (error.getType().level == CheckLevel.ERROR) {
            originalErrorCount++;
          } else {
            promotedErrorCount++;
          }
          break;
        case WARNING:
          warningCount++;
          break;
        case INFO:
          infoCount++;
          break;
        case OFF:
          break;
      }
    }
  }

  @Override
  public boolean hasHaltingErrors() {
    return originalErrorCount != 0;
  }

  @Override
  public int getErrorCount() {
    return originalErrorCount + promotedErrorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public int getInfoCount() {
    return infoCount;
  }

  @Override
  public ImmutableList<PhpError> getErrors() {
    return toList(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<PhpError> getWarnings() {
    return toList(CheckLevel.WARNING);
  }

  @Override
  public ImmutableList<PhpError> getInfos() {
    return toList(CheckLevel.INFO);
  }

  /** All recorded diagnostics, errors first, then by file and position. */
  public ImmutableList<ErrorWithLevel> getSortedDiagnostics() {
    return ImmutableList.copyOf(messages);
  }

  private ImmutableList<PhpError> toList(CheckLevel level) {
    ImmutableList.Builder<PhpError> errors = ImmutableList.builder();
    for (ErrorWithLevel p : messages) {
      if (p.level == level) {
        errors.add(p.error);
      }
    }
    return errors.build();
  }

  @Override
  public void generateReport() {
    for (ErrorReportGenerator generator : this.errorReportGenerators) {
      generator.generateReport(this);
    }
  }

  /** Strategy for customizing the output format of the error report */
  public interface ErrorReportGenerator {
    void generateReport(SortingErrorManager manager);
  }

  /**
   * Comparator of {@link PhpError} with an associated {@link CheckLevel}. The ordering is the
   * standard lexical ordering on the tuple (level, file name, start offset, length, description,
   * routine name), most severe level first.
   *
   * <p>Note: this comparator imposes orderings that are inconsistent with {@link
   * PhpError#equals(Object)}.
   */
  static final class LeveledPhpErrorComparator implements Comparator<ErrorWithLevel> {
    private static final int P1_LT_P2 = -1;
    private static final int P1_GT_P2 = 1;

    @Override
    public int compare(ErrorWithLevel p1, ErrorWithLevel p2) {
      // check level
      if (p1.level != p2.level) {
        return p1.level.compareTo(p2.level);
      }

      // sourceName comparison
      String source1 = p1.error.sourceName();
      String source2 = p2.error.sourceName();
      if (source1 != null && source2 != null) {
        int sourceCompare = source1.compareTo(source2);
        if (sourceCompare != 0) {
          return sourceCompare;
        }
      } else if (source1 == null && source2 != null) {
        return P1_LT_P2;
      } else if (source1 != null && source2 == null) {
        return P1_GT_P2;
      }

      // position comparison, unknown positions first
      int start1 = p1.error.start();
      int start2 = p2.error.start();
      if (start1 != start2) {
        return Integer.compare(start1, start2);
      }
      int length1 = p1.error.length();
      int length2 = p2.error.length();
      if (length1 != length2) {
        return Integer.compare(length1, length2);
      }

      // description
      int descriptionCompare = p1.error.description().compareTo(p2.error.description());
      if (descriptionCompare != 0) {
        return descriptionCompare;
      }

      String routine1 = p1.error.routineName();
      String routine2 = p2.error.routineName();
      if (routine1 == null || routine2 == null) {
        return Boolean.compare(routine1 != null, routine2 != null);
      }
      return routine1.compareTo(routine2);
    }
  }

  /** A recorded diagnostic and the level it was reported at. */
  public static final class ErrorWithLevel {
    final PhpError error;
    final CheckLevel level;

    ErrorWithLevel(PhpError error, CheckLevel level) {
      this.error = error;
      this.level = level;
    }

    public PhpError getError() {
      return error;
    }

    public CheckLevel getLevel() {
      return level;
    }

    @Override
    public int hashCode() {
      return Objects.hash(
          level,
          error.description(),
          error.sourceName(),
          error.start(),
          error.length(),
          error.routineName());
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof ErrorWithLevel)) {
        return false;
      }
      ErrorWithLevel e = (ErrorWithLevel) obj;
      return Objects.equals(level, e.level)
          && Objects.equals(error.description(), e.error.description())
          && Objects.equals(error.sourceName(), e.error.sourceName())
          && error.start() == e.error.start()
          && error.length() == e.error.length()
          && Objects.equals(error.routineName(), e.error.routineName());
    }
  }
}
