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

import org.jspecify.annotations.Nullable;

/**
 * Where a node came from in the original source. Lines are 1-based, columns 0-based; both are -1
 * when the position is unknown.
 */
public record SourcePosition(@Nullable String sourceName, int lineno, int charno) {

  public static final SourcePosition UNKNOWN = new SourcePosition(null, -1, -1);

  public static SourcePosition of(@Nullable String sourceName, int lineno, int charno) {
    return new SourcePosition(sourceName, lineno, charno);
  }

  public boolean isKnown() {
    return lineno >= 0;
  }

  @Override
  public String toString() {
    return (sourceName == null ? "<unknown>" : sourceName) + ":" + lineno + ":" + charno;
  }
}
