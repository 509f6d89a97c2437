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
import static com.google.javascript.transpiler.ast.IR.binary;
import static com.google.javascript.transpiler.ast.IR.block;
import static com.google.javascript.transpiler.ast.IR.call;
import static com.google.javascript.transpiler.ast.IR.doCatch;
import static com.google.javascript.transpiler.ast.IR.enumeration;
import static com.google.javascript.transpiler.ast.IR.exprResult;
import static com.google.javascript.transpiler.ast.IR.forIn;
import static com.google.javascript.transpiler.ast.IR.function;
import static com.google.javascript.transpiler.ast.IR.ifLet;
import static com.google.javascript.transpiler.ast.IR.labeledParam;
import static com.google.javascript.transpiler.ast.IR.let;
import static com.google.javascript.transpiler.ast.IR.name;
import static com.google.javascript.transpiler.ast.IR.number;
import static com.google.javascript.transpiler.ast.IR.positionalParam;
import static com.google.javascript.transpiler.ast.IR.range;
import static com.google.javascript.transpiler.ast.IR.returnStatement;
import static com.google.javascript.transpiler.ast.IR.struct;
import static com.google.javascript.transpiler.ast.IR.variable;
import static com.google.javascript.transpiler.ast.TypeIdentifier.named;
import static com.google.javascript.transpiler.ast.TypeIdentifier.optionalOf;

import com.google.common.collect.ImmutableList;
import com.google.javascript.transpiler.ast.Operator;
import com.google.javascript.transpiler.ast.RangeOperator;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Bindings in managed mode are records read through {@code .value}. */
@RunWith(JUnit4.class)
public final class ManagedRuntimeTest extends TranspilerTestCase {

  @Override
  @Before
  public void setUp() throws Exception {
    super.setUp();
    enableManagedRuntime();
  }

  @Test
  public void testConstant() {
    test(
        let("x", number("1")),
        lines(
            "const x = {", //
            "  value: 1,",
            "  type: \"any\",",
            "  isConstant: true",
            "};"));
  }

  @Test
  public void testUninitializedPrivateVariable() {
    test(
        variable("y", optionalOf(named("Int")), null, false, true),
        lines(
            "let y = {",
            "  value: null,",
            "  type: \"number | null | undefined\",",
            "  isPrivate: true,",
            "  isUndefined: true",
            "};"));
  }

  @Test
  public void testFreeFunction() {
    test(
        function(
            "add",
            ImmutableList.of(positionalParam("a"), labeledParam("to", "b")),
            block(returnStatement(binary(Operator.ADD, name("a"), name("b"))))),
        lines(
            "const add = {",
            "  value: function add(params = {}) {",
            "    const { _1: __a, to: __b } = params;",
            "    const a = { value: __a };",
            "    const b = { value: __b };",
            "    return a.value + b.value;",
            "  },",
            "  type: \"function\"",
            "};"));
  }

  @Test
  public void testEnum() {
    test(
        enumeration("Color", "red"),
        lines(
            "const Color = {",
            "  value: Object.freeze({",
            "    red: \"red\"",
            "  }),",
            "  type: \"enum\"",
            "};"));
  }

  @Test
  public void testIfLetTemporaryIsARecord() {
    test(
        ifLet("user", call(name("fetch")), block(exprResult(call(name("greet"), arg(name("user")))))),
        lines(
            "const __user = { value: fetch.value() };",
            "if (!isUndefinedOrNull(__user)) {",
            "  const user = __user;",
            "  greet.value({ _1: user.value });",
            "}"));
  }

  @Test
  public void testLoopVariableIsRebound() {
    test(
        forIn(
            "i",
            range(number("1"), RangeOperator.CLOSED, name("n")),
            block(exprResult(call(name("f"), arg(name("i")))))),
        lines(
            "for (let __i = 1; __i <= n.value; __i++) {",
            "  const i = { value: __i };",
            "  f.value({ _1: i.value });",
            "}"));
  }

  @Test
  public void testCaughtErrorIsRebound() {
    test(
        doCatch(block(), block(exprResult(call(name("log"), arg(name("error")))))),
        lines(
            "try {",
            "} catch (__error) {",
            "  const error = { value: __error };",
            "  log.value({ _1: error.value });",
            "}"));
  }

  @Test
  public void testTypesStayPlainClasses() {
    String code = generate(struct("Point", ImmutableList.of(), variable("x", null, null, false, false)));
    assertThat(code).startsWith("class Point {");
    assertThat(code).contains("  x = {\n    value: null,");
  }
}
