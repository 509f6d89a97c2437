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
import static com.google.javascript.transpiler.ast.IR.assign;
import static com.google.javascript.transpiler.ast.IR.binary;
import static com.google.javascript.transpiler.ast.IR.block;
import static com.google.javascript.transpiler.ast.IR.call;
import static com.google.javascript.transpiler.ast.IR.classDeclaration;
import static com.google.javascript.transpiler.ast.IR.construct;
import static com.google.javascript.transpiler.ast.IR.enumeration;
import static com.google.javascript.transpiler.ast.IR.exprResult;
import static com.google.javascript.transpiler.ast.IR.function;
import static com.google.javascript.transpiler.ast.IR.getprop;
import static com.google.javascript.transpiler.ast.IR.labeledParam;
import static com.google.javascript.transpiler.ast.IR.let;
import static com.google.javascript.transpiler.ast.IR.name;
import static com.google.javascript.transpiler.ast.IR.number;
import static com.google.javascript.transpiler.ast.IR.param;
import static com.google.javascript.transpiler.ast.IR.positionalParam;
import static com.google.javascript.transpiler.ast.IR.protocol;
import static com.google.javascript.transpiler.ast.IR.requirement;
import static com.google.javascript.transpiler.ast.IR.returnStatement;
import static com.google.javascript.transpiler.ast.IR.self;
import static com.google.javascript.transpiler.ast.IR.staticFunction;
import static com.google.javascript.transpiler.ast.IR.string;
import static com.google.javascript.transpiler.ast.IR.struct;
import static com.google.javascript.transpiler.ast.IR.typeAlias;
import static com.google.javascript.transpiler.ast.IR.var;
import static com.google.javascript.transpiler.ast.IR.variable;
import static com.google.javascript.transpiler.ast.IR.variadicParam;
import static com.google.javascript.transpiler.ast.TypeIdentifier.arrayOf;
import static com.google.javascript.transpiler.ast.TypeIdentifier.named;

import com.google.common.collect.ImmutableList;
import com.google.javascript.transpiler.ast.Operator;
import com.google.javascript.transpiler.ast.Parameter;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DeclarationGeneratorTest extends TranspilerTestCase {

  private static final String VARIADIC_PREFIX =
      lines(
          "  const values = Object.entries(params)",
          "    .filter(([key]) => /^_\\d+$/.test(key))",
          "    .map(([key, value]) => ({ position: Number(key.slice(1)), value }))");

  private static final String VARIADIC_SUFFIX =
      lines(
          "    .sort((a, b) => a.position - b.position)", //
          "    .map(({ value }) => value);");

  @Test
  public void testConstantWithInitializer() {
    test(let("x", number("1")), "const x = 1;");
  }

  @Test
  public void testConstantWithoutInitializerIsMutable() {
    test(let("z", null), "let z;");
    test(var("y", null), "let y;");
    test(var("y", number("2")), "let y = 2;");
  }

  @Test
  public void testReservedNameIsSanitized() {
    test(let("new", number("1")), "const new_ = 1;");
  }

  @Test
  public void testStructSynthesizesConstructor() {
    test(
        struct(
            "Point",
            ImmutableList.of(),
            variable("x", named("Int"), null, false, false),
            variable("y", named("Int"), null, false, false)),
        lines(
            "class Point {",
            "  constructor(params = {}) {",
            "    Object.assign(this, params);",
            "  }",
            "",
            "  x;",
            "  y;",
            "}"));
  }

  @Test
  public void testStructWithInitializer() {
    test(
        struct(
            "S",
            ImmutableList.of(),
            var("x", null),
            function(
                "init",
                ImmutableList.of(param("x")),
                block(exprResult(assign(getprop(self(), "x"), name("x")))))),
        lines(
            "class S {",
            "  x;",
            "",
            "  constructor(params = {}) {",
            "    const { x } = params;",
            "    this.x = x;",
            "  }",
            "}"));
  }

  @Test
  public void testStructConformanceIsDroppedWithWarning() {
    assertThat(generate(struct("P", ImmutableList.of("Equatable")))).startsWith("class P {");
    assertThat(warningKeys()).containsExactly("TRANSPILER_STRUCT_CONFORMANCE_DROPPED");
  }

  @Test
  public void testNestedType() {
    test(
        struct("Outer", ImmutableList.of(), struct("Inner", ImmutableList.of())),
        lines(
            "class Outer {",
            "  constructor(params = {}) {",
            "    Object.assign(this, params);",
            "  }",
            "",
            "  static Inner = class Inner {",
            "    constructor(params = {}) {",
            "      Object.assign(this, params);",
            "    }",
            "  };",
            "}"));
  }

  @Test
  public void testClass() {
    test(
        classDeclaration(
            "Dog",
            "Animal",
            ImmutableList.of(var("name", string("Rex"))),
            ImmutableList.of(
                function("bark", ImmutableList.of(), block(returnStatement(string("woof")))),
                staticFunction(
                    "make", ImmutableList.of(), block(returnStatement(construct(name("Dog"))))))),
        lines(
            "class Dog extends Animal {",
            "  name = \"Rex\";",
            "",
            "  bark() {",
            "    return \"woof\";",
            "  }",
            "",
            "  static make() {",
            "    return (new Dog());",
            "  }",
            "}"));
  }

  @Test
  public void testFunctionDestructuresParams() {
    test(
        function(
            "add",
            ImmutableList.of(positionalParam("a"), labeledParam("to", "b")),
            block(returnStatement(binary(Operator.ADD, name("a"), name("b"))))),
        lines(
            "function add(params = {}) {",
            "  const { _1: a, to: b } = params;",
            "  return a + b;",
            "}"));
  }

  @Test
  public void testFunctionWithoutParameters() {
    test(
        function("f", ImmutableList.of(), block()),
        lines(
            "function f() {", //
            "}"));
  }

  @Test
  public void testDefaultAndVariadic() {
    test(
        function(
            "sum",
            ImmutableList.of(param("start", number("0")), variadicParam("values")),
            block(returnStatement(name("values")))),
        lines(
            "function sum(params = {}) {",
            "  const { start = 0 } = params;",
            VARIADIC_PREFIX,
            "    .filter(({ position }) => position > 0)",
            VARIADIC_SUFFIX,
            "  return values;",
            "}"));
  }

  @Test
  public void testVariadicAfterPositionalParameters() {
    test(
        function(
            "log",
            ImmutableList.of(positionalParam("level"), variadicParam("values")),
            block()),
        lines(
            "function log(params = {}) {",
            "  const { _1: level } = params;",
            VARIADIC_PREFIX,
            "    .filter(({ position }) => position > 1)",
            VARIADIC_SUFFIX,
            "}"));
  }

  @Test
  public void testLabelledVariadicTakesItsLabelledValueFirst() {
    test(
        function("f", ImmutableList.of(new Parameter("values", null, null, true)), block()),
        lines(
            "function f(params = {}) {",
            VARIADIC_PREFIX,
            "    .filter(({ position }) => position > 0)",
            VARIADIC_SUFFIX,
            "  if (params.values !== undefined) {",
            "    values.unshift(params.values);",
            "  }",
            "}"));
  }

  @Test
  public void testEnum() {
    test(
        enumeration("Color", "red", "green"),
        lines(
            "const Color = Object.freeze({", //
            "  red: \"red\",",
            "  green: \"green\"",
            "});"));
    test(enumeration("Empty"), "const Empty = Object.freeze({});");
  }

  @Test
  public void testEnumMember() {
    assertThat(generate(struct("S", ImmutableList.of(), enumeration("Kind", "a"))))
        .contains("  static Kind = Object.freeze({\n    a: \"a\"\n  });");
  }

  @Test
  public void testProtocolRequirementsThrow() {
    test(
        protocol("Shape", requirement("area", ImmutableList.of())),
        lines(
            "class Shape {",
            "  area() {",
            "    throw new Error(\"Protocol requirement area is not implemented\");",
            "  }",
            "}"));
  }

  @Test
  public void testTypeAlias() {
    test(typeAlias("Ids", arrayOf(named("Int"))), "const Ids = \"number[]\";");
  }

  @Test
  public void testStatementInMemberPositionIsUnsupported() {
    testError(
        struct("S", ImmutableList.of(), exprResult(call(name("f")))),
        TranspilerErrors.UNSUPPORTED_NODE);
  }

  @Test
  public void testFailingMemberIsLeftOut() {
    enableContinueAfterErrors();
    assertThat(
            generate(
                protocol(
                    "P",
                    exprResult(call(name("f"))),
                    requirement("g", ImmutableList.of()))))
        .isEqualTo(
            lines(
                "class P {",
                "  g() {",
                "    throw new Error(\"Protocol requirement g is not implemented\");",
                "  }",
                "}"));
    assertThat(errorManager.getErrorCount()).isEqualTo(1);
  }
}
