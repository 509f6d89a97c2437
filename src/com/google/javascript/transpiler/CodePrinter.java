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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.CharMatcher;

/**
 * Accumulates generated JavaScript, one line at a time, indenting two spaces per open block.
 *
 * <p>The generators write statements through this class and build expressions as strings. A
 * {@link Mark} taken before a statement lets the caller drop whatever that statement printed if
 * it turns out to be untranslatable.
 */
final class CodePrinter {
  static final String INDENT = "  ";

  private final StringBuilder code = new StringBuilder(1024);
  private int indent = 0;
  private int lineLength = 0;

  /** Printer state to return to with {@link #rollback}. */
  record Mark(int length, int indent, int lineLength) {}

  /**
   * Appends a string to the code, keeping track of the current line length. Text that begins a
   * line is indented; newlines inside {@code str} are copied verbatim.
   */
  void add(String str) {
    if (str.isEmpty()) {
      return;
    }
    if (lineLength == 0) {
      for (int i = 0; i < indent; i++) {
        code.append(INDENT);
        lineLength += INDENT.length();
      }
    }
    code.append(str);
    lineLength += str.length();
    // Correct lineLength if there were newlines in the string.
    if (CharMatcher.is('\n').matchesAnyOf(str)) {
      lineLength = str.length() - str.lastIndexOf('\n') - 1;
    }
  }

  /** Adds {@code line} and ends the line. */
  void addLine(String line) {
    add(line);
    endLine();
  }

  /** Adds a newline to the code unless the current line is empty. */
  void startNewLine() {
    if (lineLength > 0) {
      code.append('\n');
      lineLength = 0;
    }
  }

  void endLine() {
    startNewLine();
  }

  /** Separates two members or declarations with one blank line. */
  void emptyLine() {
    startNewLine();
    int length = code.length();
    if (length > 0 && !(length >= 2 && code.charAt(length - 2) == '\n')) {
      code.append('\n');
    }
  }

  /** Opens a block on the current line with {@code "{"}, then indents the following lines. */
  void beginBlock() {
    maybeInsertSpace();
    add("{");
    indent++;
    endLine();
  }

  /** Closes the innermost block with {@code "}"}, leaving the line open for a suffix. */
  void endBlock() {
    endLine();
    unindent();
    add("}");
  }

  void indent() {
    indent++;
  }

  void unindent() {
    checkState(indent > 0, "unbalanced block");
    indent--;
  }

  private void maybeInsertSpace() {
    if (lineLength > 0) {
      char last = code.charAt(code.length() - 1);
      if (last != ' ' && last != '(') {
        add(" ");
      }
    }
  }

  Mark mark() {
    return new Mark(code.length(), indent, lineLength);
  }

  /** Discards everything printed since {@code mark} was taken. */
  void rollback(Mark mark) {
    checkState(mark.length() <= code.length(), "mark is ahead of the printer");
    code.setLength(mark.length());
    indent = mark.indent();
    lineLength = mark.lineLength();
  }

  /** The code printed so far, without trailing newlines. */
  String getCode() {
    return CharMatcher.is('\n').trimTrailingFrom(code);
  }
}
