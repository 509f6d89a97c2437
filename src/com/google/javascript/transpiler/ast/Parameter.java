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
package com.google.javascript.transpiler.ast;

import static com.google.common.base.Preconditions.checkArgument;

import org.jspecify.annotations.Nullable;

/**
 * A function parameter.
 *
 * @param internalName the name used inside the function body
 * @param externalName the call-site label; {@code "_"} for a positional parameter and null when
 *     the label is the internal name
 * @param defaultValue the value used when the caller omits the argument
 * @param isVariadic whether the parameter collects the trailing positional arguments
 */
public record Parameter(
    String internalName,
    @Nullable String externalName,
    @Nullable Expression defaultValue,
    boolean isVariadic) {

  public static final String POSITIONAL_LABEL = "_";

  public Parameter {
    checkArgument(!internalName.isEmpty(), "empty parameter name");
  }

  /** Whether callers pass this parameter without a label. */
  public boolean isPositional() {
    return POSITIONAL_LABEL.equals(externalName);
  }

  /** The label callers write, or the internal name for an unlabelled declaration. */
  public String label() {
    return externalName == null ? internalName : externalName;
  }
}
