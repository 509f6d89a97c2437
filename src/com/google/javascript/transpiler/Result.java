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

/** Translation results */
public class Result {
  public final boolean success;
  public final ImmutableList<TranspilerError> errors;
  public final ImmutableList<TranspilerError> warnings;

  /**
   * The generated JavaScript. Empty when the run stopped at its first error; partial, with the
   * failing statements left out, when it continued past errors.
   */
  public final String code;

  Result(
      ImmutableList<TranspilerError> errors, ImmutableList<TranspilerError> warnings, String code) {
    this.success = errors.isEmpty();
    this.errors = errors;
    this.warnings = warnings;
    this.code = code;
  }
}
