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

/**
 * A node of the source program. The tree is produced by an external front end and is read-only
 * here: every node is an immutable record, and the set of node kinds is closed so that a new kind
 * cannot be added without teaching every generator about it.
 */
public sealed interface Node permits Declaration, Statement, Expression {

  SourcePosition position();

  /** The kind of this node, as used in diagnostics and in the JSON interchange format. */
  default String kind() {
    return getClass().getSimpleName();
  }
}
