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

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * The operators of the source language that may appear in binary, logical and unary expressions.
 * Whether a given operator is meaningful in a given position, and how it is spelled in
 * JavaScript, is decided by the generator.
 */
public enum Operator {
  ADD("+"),
  SUBTRACT("-"),
  MULTIPLY("*"),
  DIVIDE("/"),
  REMAINDER("%"),
  EQUAL("=="),
  NOT_EQUAL("!="),
  IDENTICAL("==="),
  NOT_IDENTICAL("!=="),
  LESS("<"),
  LESS_EQUAL("<="),
  GREATER(">"),
  GREATER_EQUAL(">="),
  AND("&&"),
  OR("||"),
  NIL_COALESCING("??"),
  NOT("!"),
  BITWISE_AND("&"),
  BITWISE_OR("|"),
  BITWISE_XOR("^"),
  BITWISE_NOT("~"),
  SHIFT_LEFT("<<"),
  SHIFT_RIGHT(">>"),
  OVERFLOW_ADD("&+"),
  OVERFLOW_SUBTRACT("&-"),
  OVERFLOW_MULTIPLY("&*");

  private static final ImmutableMap<String, Operator> BY_SYMBOL;

  static {
    ImmutableMap.Builder<String, Operator> builder = ImmutableMap.builder();
    for (Operator op : values()) {
      builder.put(op.symbol, op);
    }
    BY_SYMBOL = builder.buildOrThrow();
  }

  private final String symbol;

  Operator(String symbol) {
    this.symbol = symbol;
  }

  /** The operator as spelled in the source language. */
  public String getSymbol() {
    return symbol;
  }

  /** Returns the operator spelled {@code symbol} in the source language, or null. */
  public static @Nullable Operator fromSymbol(String symbol) {
    return BY_SYMBOL.get(symbol);
  }
}
