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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeTest {

  @Test
  public void testKindIsSimpleClassName() {
    assertThat(IR.name("x").kind()).isEqualTo("VariableExpression");
    assertThat(IR.breakStatement().kind()).isEqualTo("BreakStatement");
  }

  @Test
  public void testVariadicParameterMustBeLast() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            IR.function(
                "f",
                ImmutableList.of(IR.variadicParam("xs"), IR.param("y")),
                IR.block()));
    FunctionDeclaration f =
        IR.function("f", ImmutableList.of(IR.param("y"), IR.variadicParam("xs")), IR.block());
    assertThat(f.variadicParameter().internalName()).isEqualTo("xs");
  }

  @Test
  public void testSwitchCaseNeedsAPattern() {
    assertThrows(IllegalArgumentException.class, () -> IR.switchCase(ImmutableList.of()));
  }

  @Test
  public void testIfLetSelfBinding() {
    assertThat(IR.ifLet("x", null, IR.block()).isSelfBinding()).isTrue();
    assertThat(IR.ifLet("x", IR.name("x"), IR.block()).isSelfBinding()).isTrue();
    assertThat(IR.ifLet("x", IR.name("y"), IR.block()).isSelfBinding()).isFalse();
    assertThat(IR.ifLet("x", IR.call(IR.name("x")), IR.block()).isSelfBinding()).isFalse();
  }

  @Test
  public void testParameterLabels() {
    assertThat(IR.param("x").label()).isEqualTo("x");
    assertThat(IR.labeledParam("to", "x").label()).isEqualTo("to");
    assertThat(IR.positionalParam("x").isPositional()).isTrue();
    assertThat(IR.labeledParam("to", "x").isPositional()).isFalse();
  }

  @Test
  public void testChildListsAreImmutableCopies() {
    List<Node> statements = new ArrayList<>();
    statements.add(IR.breakStatement());
    BlockStatement block = new BlockStatement(statements, SourcePosition.UNKNOWN);
    statements.add(IR.continueStatement());
    assertThat(block.statements()).hasSize(1);
    assertThrows(
        UnsupportedOperationException.class, () -> block.statements().add(IR.blank()));
  }

  @Test
  public void testStructInitializerDetection() {
    assertThat(IR.struct("S", ImmutableList.of()).declaresInitializer()).isFalse();
    assertThat(
            IR.struct("S", ImmutableList.of(), IR.function("init", ImmutableList.of(), IR.block()))
                .declaresInitializer())
        .isTrue();
  }

  @Test
  public void testClassSuperclassIsFirstInheritedType() {
    assertThat(
            IR.classDeclaration("A", "B", ImmutableList.of(), ImmutableList.of()).superclass())
        .isEqualTo("B");
    assertThat(IR.classDeclaration("A", null, ImmutableList.of(), ImmutableList.of()).superclass())
        .isNull();
  }

  @Test
  public void testOperatorSymbols() {
    assertThat(Operator.fromSymbol("??")).isEqualTo(Operator.NIL_COALESCING);
    assertThat(RangeOperator.fromSymbol("..<")).isEqualTo(RangeOperator.HALF_OPEN);
    assertThat(AssignmentOperator.fromSymbol("%=")).isEqualTo(AssignmentOperator.REMAINDER_ASSIGN);
    assertThat(Operator.fromSymbol("<=>")).isNull();
  }

  @Test
  public void testUnknownPosition() {
    assertThat(IR.name("x").position().isKnown()).isFalse();
    assertThat(SourcePosition.of("a.swift", 1, 0).isKnown()).isTrue();
  }
}
