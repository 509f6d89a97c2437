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

import com.google.javascript.transpiler.ast.AssignmentOperator;
import com.google.javascript.transpiler.ast.Operator;
import org.jspecify.annotations.Nullable;

/**
 * Maps source operators to JavaScript operator tokens. The lookups return null for operators that
 * have no faithful JavaScript counterpart in the given position: the wrapping arithmetic
 * operators, the bitwise operators (JavaScript truncates their operands to 32 bits), and any
 * operator used with the wrong arity.
 */
public final class OperatorMapper {

  private OperatorMapper() {}

  /** The JavaScript spelling of {@code op} between two operands, or null. */
  public static @Nullable String binaryOpToStr(Operator op) {
    switch (op) {
      case ADD:
        return "+";
      case SUBTRACT:
        return "-";
      case MULTIPLY:
        return "*";
      case DIVIDE:
        return "/";
      case REMAINDER:
        return "%";
      case EQUAL:
      case IDENTICAL:
        return "===";
      case NOT_EQUAL:
      case NOT_IDENTICAL:
        return "!==";
      case LESS:
        return "<";
      case LESS_EQUAL:
        return "<=";
      case GREATER:
        return ">";
      case GREATER_EQUAL:
        return ">=";
      case AND:
      case OR:
      case NIL_COALESCING:
        // Also accepted in binary position; the front end may not split them out.
        return logicalOpToStr(op);
      case NOT:
      case BITWISE_AND:
      case BITWISE_OR:
      case BITWISE_XOR:
      case BITWISE_NOT:
      case SHIFT_LEFT:
      case SHIFT_RIGHT:
      case OVERFLOW_ADD:
      case OVERFLOW_SUBTRACT:
      case OVERFLOW_MULTIPLY:
        return null;
    }
    throw new IllegalStateException("Unexpected operator: " + op);
  }

  /** The JavaScript spelling of a short-circuiting {@code op}, or null. */
  public static @Nullable String logicalOpToStr(Operator op) {
    switch (op) {
      case AND:
        return "&&";
      case OR:
        return "||";
      case NIL_COALESCING:
        return "??";
      default:
        return null;
    }
  }

  /** The JavaScript spelling of {@code op} as a prefix operator, or null. */
  public static @Nullable String unaryOpToStr(Operator op) {
    switch (op) {
      case NOT:
        return "!";
      case SUBTRACT:
        return "-";
      case ADD:
        return "+";
      default:
        return null;
    }
  }

  public static String assignmentOpToStr(AssignmentOperator op) {
    switch (op) {
      case ASSIGN:
        return "=";
      case ADD_ASSIGN:
        return "+=";
      case SUBTRACT_ASSIGN:
        return "-=";
      case MULTIPLY_ASSIGN:
        return "*=";
      case DIVIDE_ASSIGN:
        return "/=";
      case REMAINDER_ASSIGN:
        return "%=";
    }
    throw new IllegalStateException("Unexpected assignment operator: " + op);
  }
}
