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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;

/** Options for a translation run. */
public class TranspilerOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /**
   * Emit every value binding as a tagged record ({@code { value, type, ... }}) read through a
   * {@code .value} accessor, for a runtime layer that inspects bindings.
   */
  private boolean managedRuntime = false;

  /**
   * Keep translating after an unsupported node. The failing statement or member is left out of the
   * output and reported; otherwise the run stops at the first error.
   */
  private boolean continueAfterErrors = false;

  /** Leave the runtime prelude out of the output, for callers that load it separately. */
  private boolean preventLibraryInjection = false;

  private final Map<String, CheckLevel> warningLevels = new HashMap<>();

  public TranspilerOptions() {}

  public void setManagedRuntime(boolean managedRuntime) {
    this.managedRuntime = managedRuntime;
  }

  public boolean isManagedRuntime() {
    return managedRuntime;
  }

  public void setContinueAfterErrors(boolean continueAfterErrors) {
    this.continueAfterErrors = continueAfterErrors;
  }

  public boolean canContinueAfterErrors() {
    return continueAfterErrors;
  }

  public void setPreventLibraryInjection(boolean preventLibraryInjection) {
    this.preventLibraryInjection = preventLibraryInjection;
  }

  public boolean shouldPreventLibraryInjection() {
    return preventLibraryInjection;
  }

  /**
   * Overrides the default level of a warning. {@link CheckLevel#OFF} suppresses it.
   *
   * @throws IllegalArgumentException if {@code type} is an error
   */
  @CanIgnoreReturnValue
  public TranspilerOptions setWarningLevel(DiagnosticType type, CheckLevel level) {
    checkArgument(
        type.level != CheckLevel.ERROR, "%s is an error and cannot be reconfigured", type.key);
    warningLevels.put(type.key, level);
    return this;
  }

  /** The level {@code error} is reported at under these options. */
  CheckLevel getWarningLevel(TranspilerError error) {
    return warningLevels.getOrDefault(error.type().key, error.defaultLevel());
  }
}
