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
import org.jspecify.annotations.Nullable;

/** The diagnostics the transpiler reports. */
public final class TranspilerErrors {

  public static final DiagnosticType UNSUPPORTED_NODE =
      DiagnosticType.error(
          "TRANSPILER_UNSUPPORTED_NODE", "{0} cannot be translated in {1} position.");

  public static final DiagnosticType UNSUPPORTED_OPERATOR =
      DiagnosticType.error(
          "TRANSPILER_UNSUPPORTED_OPERATOR",
          "Operator {0} has no JavaScript equivalent as a {1} operator.");

  public static final DiagnosticType UNCHECKED_TYPE_TEST =
      DiagnosticType.warning(
          "TRANSPILER_UNCHECKED_TYPE_TEST",
          "Type test against {0} is not checked at runtime and always evaluates to true.");

  public static final DiagnosticType STRUCT_CONFORMANCE_DROPPED =
      DiagnosticType.warning(
          "TRANSPILER_STRUCT_CONFORMANCE_DROPPED",
          "Conformance of struct {0} to {1} is not emitted.");

  public static final DiagnosticType CATCH_BINDING_IGNORED =
      DiagnosticType.warning(
          "TRANSPILER_CATCH_BINDING_IGNORED",
          "Catch binding {0} is not supported; the caught error is bound to {1}.");

  public static final ImmutableList<DiagnosticType> ALL =
      ImmutableList.of(
          UNSUPPORTED_NODE,
          UNSUPPORTED_OPERATOR,
          UNCHECKED_TYPE_TEST,
          STRUCT_CONFORMANCE_DROPPED,
          CATCH_BINDING_IGNORED);

  /** Looks a diagnostic up by its key, for command line suppression. */
  public static @Nullable DiagnosticType forKey(String key) {
    for (DiagnosticType type : ALL) {
      if (type.key.equals(key)) {
        return type;
      }
    }
    return null;
  }

  private TranspilerErrors() {}
}
