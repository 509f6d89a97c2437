/*
 * Copyright 2026 The Closure Compiler Authors.
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
package com.google.javascript.transpiler;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Ordering;
import java.util.Comparator;
import java.util.Set;
import java.util.TreeSet;

/**
 * Collects the diagnostics of a run in display order and hands them to its {@link
 * ErrorReportGenerator}s when the run ends. A diagnostic reported twice is counted once.
 */
public class SortingErrorManager implements ErrorManager {

  private final TreeSet<ErrorWithLevel> messages = new TreeSet<>(new LeveledErrorComparator());
  private int originalErrorCount = 0;
  private int promotedErrorCount = 0;
  private int warningCount = 0;

  /** Responsible for generating the report of the errors at the end of translation */
  private final ImmutableSet<ErrorReportGenerator> errorReportGenerators;

  public SortingErrorManager(Set<ErrorReportGenerator> errorReportGenerators) {
    this.errorReportGenerators = ImmutableSet.copyOf(errorReportGenerators);
  }

  @Override
  public void report(CheckLevel level, TranspilerError error) {
    ErrorWithLevel e = new ErrorWithLevel(error, level);
    if (messages.add(e)) {
      if (level == CheckLevel.ERROR) {
        if (error.type().level == CheckLevel.ERROR) {
          originalErrorCount++;
        } else {
          promotedErrorCount++;
        }
      } else if (level == CheckLevel.WARNING) {
        warningCount++;
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
  public ImmutableList<TranspilerError> getErrors() {
    return toList(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<TranspilerError> getWarnings() {
    return toList(CheckLevel.WARNING);
  }

  ImmutableList<ErrorWithLevel> getSortedDiagnostics() {
    return ImmutableList.copyOf(messages);
  }

  private ImmutableList<TranspilerError> toList(CheckLevel level) {
    ImmutableList.Builder<TranspilerError> errors = ImmutableList.builder();
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
   * Orders reported diagnostics for display: warnings before errors, then by source (unnamed
   * sources first), line, column and message. Diagnostics equal on all of these are kept once.
   */
  static final class LeveledErrorComparator implements Comparator<ErrorWithLevel> {
    private static final Ordering<String> SOURCE_ORDER = Ordering.<String>natural().nullsFirst();

    @Override
    public int compare(ErrorWithLevel p1, ErrorWithLevel p2) {
      return ComparisonChain.start()
          .compare(p2.level, p1.level)
          .compare(p1.error.sourceName(), p2.error.sourceName(), SOURCE_ORDER)
          .compare(p1.error.lineno(), p2.error.lineno())
          .compare(p1.error.charno(), p2.error.charno())
          .compare(p1.error.description(), p2.error.description())
          .result();
    }
  }

  static final class ErrorWithLevel {
    final TranspilerError error;
    final CheckLevel level;

    ErrorWithLevel(TranspilerError error, CheckLevel level) {
      this.error = error;
      this.level = level;
    }
  }
}
