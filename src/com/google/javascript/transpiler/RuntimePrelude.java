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

import com.google.common.base.CharMatcher;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Supplies the helper functions translated code calls into ({@code isUndefinedOrNull},
 * {@code tryOptional}, {@code tryForce}, ...). One variant exists per generation mode; the
 * text is loaded from the {@code js/} resources next to this class.
 */
final class RuntimePrelude {

  static final String NATIVE_RESOURCE = "js/native_runtime.js";
  static final String MANAGED_RESOURCE = "js/managed_runtime.js";

  private static final ConcurrentMap<String, String> cache = new ConcurrentHashMap<>();

  private RuntimePrelude() {}

  /** Returns the prelude for the mode {@code bindings} implements, without a trailing newline. */
  static String forBindings(BindingStrategy bindings) {
    return load(bindings.getPreludeResource());
  }

  static String load(String resource) {
    return cache.computeIfAbsent(
        resource,
        path ->
            CharMatcher.whitespace()
                .trimTrailingFrom(ResourceLoader.loadTextResource(RuntimePrelude.class, path)));
  }
}
