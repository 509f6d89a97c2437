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

import com.google.common.collect.ImmutableList;

/**
 * The error manager is in charge of storing, organizing and displaying errors and warnings
 * reported while translating a program.
 */
public interface ErrorManager extends ErrorHandler {

  /**
   * Writes a report to an implementation-specific medium. The transpiler calls this method after
   * any and all errors have been reported.
   */
  void generateReport();

  /** Gets the number of errors. */
  int getErrorCount();

  /** Gets the number of warnings. */
  int getWarningCount();

  /** Gets all the errors, sorted by position. */
  ImmutableList<TranspilerError> getErrors();

  /** Gets all the warnings, sorted by position. */
  ImmutableList<TranspilerError> getWarnings();

  /**
   * Returns true if there are errors that were reported at their default level of ERROR, as
   * opposed to warnings promoted to errors by the caller.
   */
  default boolean hasHaltingErrors() {
    return getErrorCount() > 0;
  }
}
