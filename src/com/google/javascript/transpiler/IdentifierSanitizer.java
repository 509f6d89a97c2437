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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Renames source identifiers that are not usable as JavaScript bindings. Applied to every name the
 * generators emit: declarations, references, parameters and member names alike, so that a
 * declaration and its uses stay in agreement.
 */
public final class IdentifierSanitizer {

  /** Renames with a conventional short form. */
  private static final ImmutableMap<String, String> RENAMED =
      ImmutableMap.of(
          "function", "func",
          "arguments", "args");

  /**
   * JavaScript reserved words, plus names with special meaning in a class body, that the source
   * language accepts as ordinary identifiers. These get a trailing underscore.
   */
  private static final ImmutableSet<String> RESERVED =
      ImmutableSet.of(
          "await",
          "const",
          "constructor",
          "debugger",
          "delete",
          "eval",
          "export",
          "implements",
          "instanceof",
          "interface",
          "new",
          "package",
          "this",
          "typeof",
          "void",
          "with",
          "yield");

  /** Prefix of the anonymous closure parameters {@code $0}, {@code $1}, ... */
  private static final String ANONYMOUS_PARAMETER_SIGIL = "$";

  private IdentifierSanitizer() {}

  public static String sanitize(String name) {
    String renamed = RENAMED.get(name);
    if (renamed != null) {
      return renamed;
    }
    if (RESERVED.contains(name)) {
      return name + "_";
    }
    if (name.startsWith(ANONYMOUS_PARAMETER_SIGIL)) {
      return "arg_" + name.substring(ANONYMOUS_PARAMETER_SIGIL.length());
    }
    return name;
  }

  /** Whether {@link #sanitize} changes {@code name}. */
  public static boolean isRenamed(String name) {
    return !sanitize(name).equals(name);
  }
}
