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

import java.util.HashMap;
import java.util.Map;

/**
 * Names the hidden temporaries that hold an unwrapped value before it is bound. The first
 * temporary for {@code x} is {@code __x}; later ones get a numeric suffix, so two sibling
 * constructs binding the same name never declare the same constant twice. One supplier serves one
 * top-level declaration, which keeps the names a function of that declaration alone.
 */
final class TempNameSupplier {
  private static final String PREFIX = "__";

  private final Map<String, Integer> counts = new HashMap<>();

  String next(String name) {
    int count = counts.merge(name, 1, Integer::sum) - 1;
    return count == 0 ? PREFIX + name : PREFIX + name + "$" + count;
  }
}
