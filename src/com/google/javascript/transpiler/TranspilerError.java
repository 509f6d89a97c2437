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

import static com.google.common.base.Strings.emptyToNull;
import static java.util.Objects.requireNonNull;

import com.google.javascript.transpiler.ast.Node;
import com.google.javascript.transpiler.ast.SourcePosition;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * A diagnostic raised while translating a node.
 *
 * @param type the kind of problem
 * @param description the formatted message
 * @param sourceName the source the offending node came from, if known
 * @param lineno 1-based line, or -1
 * @param charno 0-based column, or -1
 * @param nodeKind the kind of the offending node, if the diagnostic is about a node
 * @param defaultLevel the level of {@code type}
 */
public record TranspilerError(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    int lineno,
    int charno,
    @Nullable String nodeKind,
    CheckLevel defaultLevel)
    implements Serializable {

  private static final int DEFAULT_LINENO = -1;
  private static final int DEFAULT_CHARNO = -1;

  public TranspilerError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  /**
   * Creates a TranspilerError that is not tied to a node.
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static TranspilerError make(DiagnosticType type, String... arguments) {
    return new TranspilerError(
        type, type.format(arguments), null, DEFAULT_LINENO, DEFAULT_CHARNO, null, type.level);
  }

  /**
   * Creates a TranspilerError at the position of a node.
   *
   * @param n Determines the position of the error
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static TranspilerError make(Node n, DiagnosticType type, String... arguments) {
    SourcePosition position = n.position();
    return new TranspilerError(
        type,
        type.format(arguments),
        position.sourceName(),
        position.lineno(),
        position.charno(),
        n.kind(),
        type.level);
  }

  /** @return the default rendering of an error as text. */
  @Override
  public String toString() {
    String source = emptyToNull(sourceName) != null ? sourceName : "(unknown source)";
    String line = lineno != DEFAULT_LINENO ? String.valueOf(lineno) : "(unknown line)";
    String column = charno != DEFAULT_CHARNO ? String.valueOf(charno) : "(unknown column)";
    return type.key + ". " + description + " at " + source + " line " + line + " : " + column;
  }

  /**
   * Format a message at the given level, in the {@code source:line:column: LEVEL - [KEY] message}
   * layout.
   *
   * @return the formatted message or {@code null} for {@link CheckLevel#OFF}
   */
  public @Nullable String format(CheckLevel level) {
    String label;
    switch (level) {
      case ERROR:
        label = "ERROR";
        break;
      case WARNING:
        label = "WARNING";
        break;
      default:
        return null;
    }
    StringBuilder b = new StringBuilder();
    if (sourceName != null) {
      b.append(sourceName);
      if (lineno > 0) {
        b.append(':').append(lineno);
        if (charno >= 0) {
          b.append(':').append(charno);
        }
      }
      b.append(": ");
    }
    b.append(label).append(" - [").append(type.key).append("] ").append(description);
    return b.toString();
  }
}
