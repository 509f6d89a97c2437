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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CodePrinterTest {

  private static String lines(String... lines) {
    return String.join("\n", lines);
  }

  @Test
  public void testBlocksIndent() {
    CodePrinter cp = new CodePrinter();
    cp.add("if (a)");
    cp.beginBlock();
    cp.addLine("b();");
    cp.endBlock();
    cp.endLine();
    assertThat(cp.getCode()).isEqualTo(lines("if (a) {", "  b();", "}"));
  }

  @Test
  public void testNoSpaceAfterOpenParen() {
    CodePrinter cp = new CodePrinter();
    cp.add("Object.freeze(");
    cp.beginBlock();
    cp.endBlock();
    cp.add(")");
    assertThat(cp.getCode()).isEqualTo(lines("Object.freeze({", "})"));
  }

  @Test
  public void testEmptyLineIsNotDoubled() {
    CodePrinter cp = new CodePrinter();
    cp.addLine("a;");
    cp.emptyLine();
    cp.emptyLine();
    cp.addLine("b;");
    assertThat(cp.getCode()).isEqualTo(lines("a;", "", "b;"));
  }

  @Test
  public void testEmbeddedNewlinesAreCopied() {
    CodePrinter cp = new CodePrinter();
    cp.indent();
    cp.addLine("x = `one\ntwo`;");
    assertThat(cp.getCode()).isEqualTo("  x = `one\ntwo`;");
  }

  @Test
  public void testRollback() {
    CodePrinter cp = new CodePrinter();
    cp.addLine("kept;");
    CodePrinter.Mark mark = cp.mark();
    cp.add("while (x)");
    cp.beginBlock();
    cp.addLine("dropped;");
    cp.rollback(mark);
    cp.addLine("next;");
    assertThat(cp.getCode()).isEqualTo(lines("kept;", "next;"));
  }

  @Test
  public void testUnbalancedBlockIsRejected() {
    CodePrinter cp = new CodePrinter();
    assertThrows(IllegalStateException.class, cp::unindent);
  }
}
