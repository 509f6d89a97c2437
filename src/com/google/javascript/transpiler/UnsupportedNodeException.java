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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.javascript.transpiler.ast.Node;
import com.google.javascript.transpiler.ast.Operator;

/**
 * Thrown by the generators when a node, or an operator inside it, has no translation. Caught at
 * the nearest statement or member boundary, where the partial output is discarded.
 */
final class UnsupportedNodeException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final TranspilerError error;

  UnsupportedNodeException(TranspilerError error) {
    super(error.toString());
    this.error = checkNotNull(error);
  }

  /** {@code n} has no translation where it appears, e.g. "statement" or "member" position. */
  static UnsupportedNodeException forNode(Node n, String position) {
    return new UnsupportedNodeException(
        TranspilerError.make(n, TranspilerErrors.UNSUPPORTED_NODE, n.kind(), position));
  }

  /** {@code op} inside {@code n} has no JavaScript equivalent with the given arity. */
  static UnsupportedNodeException forOperator(Node n, Operator op, String arity) {
    return new UnsupportedNodeException(
        TranspilerError.make(n, TranspilerErrors.UNSUPPORTED_OPERATOR, op.getSymbol(), arity));
  }

  TranspilerError getError() {
    return error;
  }
}
