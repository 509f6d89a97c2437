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
import static com.google.javascript.transpiler.ast.IR.arg;
import static com.google.javascript.transpiler.ast.IR.blank;
import static com.google.javascript.transpiler.ast.IR.block;
import static com.google.javascript.transpiler.ast.IR.breakStatement;
import static com.google.javascript.transpiler.ast.IR.call;
import static com.google.javascript.transpiler.ast.IR.continueStatement;
import static com.google.javascript.transpiler.ast.IR.doCatch;
import static com.google.javascript.transpiler.ast.IR.exprResult;
import static com.google.javascript.transpiler.ast.IR.forIn;
import static com.google.javascript.transpiler.ast.IR.guard;
import static com.google.javascript.transpiler.ast.IR.guardLet;
import static com.google.javascript.transpiler.ast.IR.ifLet;
import static com.google.javascript.transpiler.ast.IR.ifStatement;
import static com.google.javascript.transpiler.ast.IR.name;
import static com.google.javascript.transpiler.ast.IR.number;
import static com.google.javascript.transpiler.ast.IR.range;
import static com.google.javascript.transpiler.ast.IR.repeat;
import static com.google.javascript.transpiler.ast.IR.returnStatement;
import static com.google.javascript.transpiler.ast.IR.switchCase;
import static com.google.javascript.transpiler.ast.IR.switchStatement;
import static com.google.javascript.transpiler.ast.IR.throwStatement;
import static com.google.javascript.transpiler.ast.IR.whileLoop;

import com.google.common.collect.ImmutableList;
import com.google.javascript.transpiler.ast.ExpressionStatement;
import com.google.javascript.transpiler.ast.Node;
import com.google.javascript.transpiler.ast.RangeOperator;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class StatementGeneratorTest extends TranspilerTestCase {

  private static ExpressionStatement callStatement(String callee) {
    return exprResult(call(name(callee)));
  }

  @Test
  public void testIf() {
    test(
        ifStatement(name("c"), block(callStatement("f"))),
        lines(
            "if (c) {", //
            "  f();",
            "}"));
  }

  @Test
  public void testElseIfChains() {
    test(
        ifStatement(
            name("a"),
            block(callStatement("x")),
            ifStatement(name("b"), block(callStatement("y")), block(callStatement("z")))),
        lines(
            "if (a) {",
            "  x();",
            "} else if (b) {",
            "  y();",
            "} else {",
            "  z();",
            "}"));
  }

  @Test
  public void testNonBlockElseIsBraced() {
    test(
        ifStatement(name("a"), block(callStatement("x")), callStatement("y")),
        lines(
            "if (a) {", //
            "  x();",
            "} else {",
            "  y();",
            "}"));
  }

  @Test
  public void testIfLetEvaluatesValueOnce() {
    test(
        ifLet(
            "user",
            call(name("fetch")),
            block(exprResult(call(name("greet"), arg(name("user")))))),
        lines(
            "const __user = fetch();",
            "if (!isUndefinedOrNull(__user)) {",
            "  const user = __user;",
            "  greet({ _1: user });",
            "}"));
  }

  @Test
  public void testIfLetWithElse() {
    test(
        ifLet("v", call(name("load")), block(callStatement("use")), block(callStatement("skip"))),
        lines(
            "const __v = load();",
            "if (!isUndefinedOrNull(__v)) {",
            "  const v = __v;",
            "  use();",
            "} else {",
            "  skip();",
            "}"));
  }

  @Test
  public void testIfLetSelfBindingTestsInPlace() {
    String expected =
        lines(
            "if (!isUndefinedOrNull(x)) {", //
            "  use();",
            "}");
    test(ifLet("x", null, block(callStatement("use"))), expected);
    test(ifLet("x", name("x"), block(callStatement("use"))), expected);
  }

  @Test
  public void testSiblingIfLetsGetDistinctTemporaries() {
    String code =
        generate(
            block(
                ifLet("x", call(name("a")), block()),
                ifLet("x", call(name("b")), block())));
    assertThat(code).contains("const __x = a();");
    assertThat(code).contains("const __x$1 = b();");
  }

  @Test
  public void testGuard() {
    test(
        guard(name("ok"), block(returnStatement())),
        lines(
            "if (!(ok)) {", //
            "  return;",
            "}"));
  }

  @Test
  public void testGuardLet() {
    test(
        guardLet("v", call(name("load")), block(callStatement("log"))),
        lines(
            "const __v = load();",
            "if (isUndefinedOrNull(__v)) {",
            "  log();",
            "  return;",
            "}",
            "const v = __v;"));
  }

  @Test
  public void testGuardLetSelfBinding() {
    test(
        guardLet("v", name("v"), block()),
        lines(
            "if (isUndefinedOrNull(v)) {", //
            "  return;",
            "}"));
  }

  @Test
  public void testSwitchSharedCaseAndDefault() {
    test(
        switchStatement(
            name("n"),
            ImmutableList.of(callStatement("other")),
            switchCase(ImmutableList.of(number("1"), number("2")), callStatement("small")),
            switchCase(ImmutableList.of(number("3")), callStatement("three"))),
        lines(
            "switch (n) {",
            "  case 1:",
            "  case 2: {",
            "    small();",
            "    break;",
            "  }",
            "  case 3: {",
            "    three();",
            "    break;",
            "  }",
            "  default: {",
            "    other();",
            "  }",
            "}"));
  }

  @Test
  public void testForOverClosedRange() {
    test(
        forIn(
            "i",
            range(number("1"), RangeOperator.CLOSED, name("n")),
            block(exprResult(call(name("f"), arg(name("i")))))),
        lines(
            "for (let i = 1; i <= n; i++) {", //
            "  f({ _1: i });",
            "}"));
  }

  @Test
  public void testForOverHalfOpenRange() {
    assertThat(generate(forIn("i", range(number("0"), RangeOperator.HALF_OPEN, name("n")), block())))
        .startsWith("for (let i = 0; i < n; i++) {");
  }

  @Test
  public void testForOverSequence() {
    test(
        forIn("x", name("xs"), block(callStatement("f"))),
        lines(
            "for (const x of xs) {", //
            "  f();",
            "}"));
  }

  @Test
  public void testLoops() {
    test(
        whileLoop(name("c"), block(breakStatement())),
        lines(
            "while (c) {", //
            "  break;",
            "}"));
    test(
        repeat(block(continueStatement()), name("c")),
        lines(
            "do {", //
            "  continue;",
            "} while (c);"));
  }

  @Test
  public void testSimpleStatements() {
    test(returnStatement(number("1")), "return 1;");
    test(returnStatement(), "return;");
    test(throwStatement(name("e")), "throw e;");
    test(blank(), "");
  }

  @Test
  public void testNestedBlockIsInlined() {
    test(
        block(callStatement("a"), block(callStatement("b"))),
        lines(
            "a();", //
            "b();"));
  }

  @Test
  public void testDoCatch() {
    test(
        doCatch(
            block(callStatement("f")), block(exprResult(call(name("log"), arg(name("error")))))),
        lines(
            "try {",
            "  f();",
            "} catch (error) {",
            "  log({ _1: error });",
            "}"));
  }

  @Test
  public void testCatchBindingIsAlwaysError() {
    assertThat(generate(doCatch(block(), "e", block()))).contains("catch (error)");
    assertThat(warningKeys()).containsExactly("TRANSPILER_CATCH_BINDING_IGNORED");
  }

  @Test
  public void testExpressionInStatementPositionIsUnsupported() {
    testError(name("x"), TranspilerErrors.UNSUPPORTED_NODE);
  }

  @Test
  public void testUnsupportedStatementStopsByDefault() {
    testError(
        block(callStatement("f"), exprResult(range(number("1"), RangeOperator.CLOSED, number("2")))),
        TranspilerErrors.UNSUPPORTED_NODE);
  }

  @Test
  public void testContinueAfterErrorsDropsOnlyTheFailingStatement() {
    enableContinueAfterErrors();
    Node program =
        ifStatement(
            name("c"),
            block(
                callStatement("f"),
                exprResult(range(number("1"), RangeOperator.CLOSED, number("2"))),
                callStatement("g")));
    assertThat(generate(program))
        .isEqualTo(
            lines(
                "if (c) {", //
                "  f();",
                "  g();",
                "}"));
    assertThat(errorManager.getErrorCount()).isEqualTo(1);
    assertThat(errorManager.getErrors().get(0).type())
        .isEqualTo(TranspilerErrors.UNSUPPORTED_NODE);
  }
}
