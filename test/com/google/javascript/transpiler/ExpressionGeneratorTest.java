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
import static com.google.javascript.transpiler.ast.IR.arrayLiteral;
import static com.google.javascript.transpiler.ast.IR.assign;
import static com.google.javascript.transpiler.ast.IR.binary;
import static com.google.javascript.transpiler.ast.IR.call;
import static com.google.javascript.transpiler.ast.IR.cast;
import static com.google.javascript.transpiler.ast.IR.construct;
import static com.google.javascript.transpiler.ast.IR.decimal;
import static com.google.javascript.transpiler.ast.IR.dictionaryLiteral;
import static com.google.javascript.transpiler.ast.IR.entry;
import static com.google.javascript.transpiler.ast.IR.exprResult;
import static com.google.javascript.transpiler.ast.IR.forceUnwrap;
import static com.google.javascript.transpiler.ast.IR.getprop;
import static com.google.javascript.transpiler.ast.IR.index;
import static com.google.javascript.transpiler.ast.IR.literal;
import static com.google.javascript.transpiler.ast.IR.logical;
import static com.google.javascript.transpiler.ast.IR.multiLineString;
import static com.google.javascript.transpiler.ast.IR.name;
import static com.google.javascript.transpiler.ast.IR.number;
import static com.google.javascript.transpiler.ast.IR.optionalChain;
import static com.google.javascript.transpiler.ast.IR.paren;
import static com.google.javascript.transpiler.ast.IR.range;
import static com.google.javascript.transpiler.ast.IR.self;
import static com.google.javascript.transpiler.ast.IR.string;
import static com.google.javascript.transpiler.ast.IR.ternary;
import static com.google.javascript.transpiler.ast.IR.tryExpression;
import static com.google.javascript.transpiler.ast.IR.typeTest;
import static com.google.javascript.transpiler.ast.IR.unary;
import static com.google.javascript.transpiler.ast.TypeIdentifier.named;

import com.google.javascript.transpiler.ast.AssignmentOperator;
import com.google.javascript.transpiler.ast.Expression;
import com.google.javascript.transpiler.ast.Operator;
import com.google.javascript.transpiler.ast.RangeOperator;
import com.google.javascript.transpiler.ast.TryExpression;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ExpressionGeneratorTest extends TranspilerTestCase {

  private void testExpr(Expression e, String expected) {
    test(exprResult(e), expected + ";");
  }

  @Test
  public void testAssignment() {
    testExpr(assign(name("x"), number("1")), "x = 1");
    testExpr(assign(name("x"), AssignmentOperator.REMAINDER_ASSIGN, number("2")), "x %= 2");
  }

  @Test
  public void testOperators() {
    testExpr(binary(Operator.EQUAL, name("a"), name("b")), "a === b");
    testExpr(binary(Operator.REMAINDER, name("a"), number("2")), "a % 2");
    testExpr(logical(Operator.NIL_COALESCING, name("a"), number("0")), "a ?? 0");
    testExpr(unary(Operator.NOT, paren(name("done"))), "!(done)");
    testExpr(ternary(name("c"), number("1"), number("2")), "c ? 1 : 2");
  }

  @Test
  public void testUnsupportedOperators() {
    testError(
        exprResult(binary(Operator.BITWISE_AND, name("a"), name("b"))),
        TranspilerErrors.UNSUPPORTED_OPERATOR);
    testError(
        exprResult(binary(Operator.OVERFLOW_ADD, name("a"), name("b"))),
        TranspilerErrors.UNSUPPORTED_OPERATOR);
    testError(
        exprResult(unary(Operator.BITWISE_NOT, name("a"))), TranspilerErrors.UNSUPPORTED_OPERATOR);
    testError(
        exprResult(logical(Operator.ADD, name("a"), name("b"))),
        TranspilerErrors.UNSUPPORTED_OPERATOR);
  }

  @Test
  public void testCallArguments() {
    testExpr(call(name("f")), "f()");
    testExpr(
        call(name("f"), arg(number("1")), arg("to", name("x")), arg(number("3"))),
        "f({ _1: 1, to: x, _3: 3 })");
  }

  @Test
  public void testInitializerCall() {
    testExpr(construct(name("Point"), arg("x", number("1"))), "(new Point({ x: 1 }))");
    testExpr(construct(name("Point")), "(new Point())");
  }

  @Test
  public void testMemberAccess() {
    testExpr(getprop(self(), "count"), "this.count");
    testExpr(getprop(name("o"), "new"), "o.new_");
    testExpr(index(name("xs"), number("0")), "xs[0]");
  }

  @Test
  public void testRangeSubscript() {
    testExpr(
        index(name("xs"), range(number("1"), RangeOperator.CLOSED, number("3"))),
        "xs.slice(1, 3 + 1)");
    testExpr(
        index(name("xs"), range(number("1"), RangeOperator.HALF_OPEN, number("3"))),
        "xs.slice(1, 3)");
  }

  @Test
  public void testOptionalChaining() {
    testExpr(getprop(optionalChain(name("a")), "b"), "a?.b");
    testExpr(index(optionalChain(name("a")), number("0")), "a?.[0]");
    testExpr(call(optionalChain(name("f"))), "f?.()");
    testExpr(optionalChain(name("a")), "a");
  }

  @Test
  public void testForceUnwrap() {
    testExpr(getprop(forceUnwrap(name("a")), "b"), "a.b");
    testExpr(forceUnwrap(name("a")), "a");
  }

  @Test
  public void testCastIsPassthrough() {
    testExpr(cast(name("x"), named("Int")), "x");
  }

  @Test
  public void testTypeTestIsUncheckedAndWarns() {
    assertThat(generate(exprResult(typeTest(name("x"), named("Int")))))
        .isEqualTo("/* unchecked type test: x is number */ true;");
    assertThat(warningKeys()).containsExactly("TRANSPILER_UNCHECKED_TYPE_TEST");
    assertThat(errorManager.getErrors()).isEmpty();
  }

  @Test
  public void testTry() {
    testExpr(tryExpression(TryExpression.Flavor.PLAIN, call(name("f"))), "f()");
    testExpr(
        tryExpression(TryExpression.Flavor.OPTIONAL, call(name("f"))), "tryOptional(() => f())");
    testExpr(tryExpression(TryExpression.Flavor.FORCED, call(name("f"))), "tryForce(() => f())");
  }

  @Test
  public void testLiterals() {
    testExpr(literal("nil"), "null");
    testExpr(literal(null), "null");
    testExpr(literal("true"), "true");
    testExpr(number("42"), "42");
    testExpr(decimal("2.5"), "2.5");
    testExpr(string("hi"), "\"hi\"");
  }

  @Test
  public void testMultiLineStringIsTemplate() {
    testExpr(multiLineString("a`b\n${c}"), "`a\\`b\n\\${c}`");
  }

  @Test
  public void testCollections() {
    testExpr(arrayLiteral(number("1"), number("2")), "[1, 2]");
    testExpr(arrayLiteral(), "[]");
    testExpr(dictionaryLiteral(), "({})");
    testExpr(
        dictionaryLiteral(entry(string("a"), number("1")), entry(name("k"), number("2"))),
        "({ \"a\": 1, [k]: 2 })");
  }

  @Test
  public void testRangeOutsideLoopOrSubscript() {
    testError(
        exprResult(range(number("1"), RangeOperator.CLOSED, number("2"))),
        TranspilerErrors.UNSUPPORTED_NODE);
  }

  @Test
  public void testManagedReadsThroughValue() {
    enableManagedRuntime();
    testExpr(binary(Operator.ADD, name("x"), number("1")), "x.value + 1");
    testExpr(call(name("f"), arg(name("y"))), "f.value({ _1: y.value })");
    testExpr(construct(name("Point")), "(new Point())");
    testExpr(getprop(self(), "x"), "this.x");
  }
}
