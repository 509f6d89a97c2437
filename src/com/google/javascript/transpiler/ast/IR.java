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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * An AST construction helper class. Every node it builds has an unknown source position; front
 * ends that track positions construct the records directly.
 */
public final class IR {

  private static final SourcePosition NO_POSITION = SourcePosition.UNKNOWN;

  private IR() {}

  // Declarations

  /** A constant binding. */
  public static VariableDeclaration let(String name, @Nullable Expression initializer) {
    return variable(name, null, initializer, true, false);
  }

  /** A mutable binding. */
  public static VariableDeclaration var(String name, @Nullable Expression initializer) {
    return variable(name, null, initializer, false, false);
  }

  public static VariableDeclaration variable(
      String name,
      @Nullable TypeIdentifier type,
      @Nullable Expression initializer,
      boolean isConstant,
      boolean isPrivate) {
    return new VariableDeclaration(name, type, initializer, isConstant, isPrivate, NO_POSITION);
  }

  public static StructDeclaration struct(
      String name, List<String> inheritedTypes, Node... members) {
    return new StructDeclaration(name, inheritedTypes, ImmutableList.copyOf(members), NO_POSITION);
  }

  public static ClassDeclaration classDeclaration(
      String name,
      @Nullable String superclass,
      List<VariableDeclaration> properties,
      List<FunctionDeclaration> methods) {
    List<String> inheritedTypes =
        superclass == null ? ImmutableList.of() : ImmutableList.of(superclass);
    return new ClassDeclaration(name, inheritedTypes, properties, methods, NO_POSITION);
  }

  public static FunctionDeclaration function(
      String name, List<Parameter> parameters, BlockStatement body) {
    return new FunctionDeclaration(name, parameters, null, body, false, NO_POSITION);
  }

  public static FunctionDeclaration staticFunction(
      String name, List<Parameter> parameters, BlockStatement body) {
    return new FunctionDeclaration(name, parameters, null, body, true, NO_POSITION);
  }

  /** A protocol method requirement: a function without a body. */
  public static FunctionDeclaration requirement(String name, List<Parameter> parameters) {
    return new FunctionDeclaration(name, parameters, null, null, false, NO_POSITION);
  }

  public static EnumDeclaration enumeration(String name, String... cases) {
    return new EnumDeclaration(name, ImmutableList.copyOf(cases), NO_POSITION);
  }

  public static ProtocolDeclaration protocol(String name, Node... members) {
    return new ProtocolDeclaration(
        name, ImmutableList.of(), ImmutableList.copyOf(members), NO_POSITION);
  }

  public static TypeAliasDeclaration typeAlias(String name, TypeIdentifier type) {
    return new TypeAliasDeclaration(name, type, NO_POSITION);
  }

  /** A parameter whose call-site label is its name. */
  public static Parameter param(String name) {
    return new Parameter(name, null, null, false);
  }

  public static Parameter param(String name, Expression defaultValue) {
    return new Parameter(name, null, defaultValue, false);
  }

  public static Parameter labeledParam(String label, String name) {
    return new Parameter(name, label, null, false);
  }

  /** A parameter passed without a label, {@code _ name}. */
  public static Parameter positionalParam(String name) {
    return new Parameter(name, Parameter.POSITIONAL_LABEL, null, false);
  }

  /** A trailing variadic parameter passed without a label, {@code _ name: T...}. */
  public static Parameter variadicParam(String name) {
    return new Parameter(name, Parameter.POSITIONAL_LABEL, null, true);
  }

  // Statements

  public static BlockStatement block(Node... statements) {
    return new BlockStatement(ImmutableList.copyOf(statements), NO_POSITION);
  }

  public static IfStatement ifStatement(Expression condition, BlockStatement thenBranch) {
    return new IfStatement(condition, thenBranch, null, NO_POSITION);
  }

  public static IfStatement ifStatement(
      Expression condition, BlockStatement thenBranch, Statement elseBranch) {
    return new IfStatement(condition, thenBranch, elseBranch, NO_POSITION);
  }

  public static IfLetStatement ifLet(
      String name, @Nullable Expression value, BlockStatement thenBranch) {
    return new IfLetStatement(name, value, thenBranch, null, NO_POSITION);
  }

  public static IfLetStatement ifLet(
      String name, @Nullable Expression value, BlockStatement thenBranch, Statement elseBranch) {
    return new IfLetStatement(name, value, thenBranch, elseBranch, NO_POSITION);
  }

  public static GuardStatement guard(Expression condition, BlockStatement body) {
    return new GuardStatement(condition, body, NO_POSITION);
  }

  public static GuardLetStatement guardLet(String name, Expression value, BlockStatement body) {
    return new GuardLetStatement(name, value, body, NO_POSITION);
  }

  public static SwitchStatement switchStatement(
      Expression subject, @Nullable List<Node> defaultCase, SwitchCase... cases) {
    return new SwitchStatement(subject, ImmutableList.copyOf(cases), defaultCase, NO_POSITION);
  }

  public static SwitchCase switchCase(List<Expression> expressions, Node... statements) {
    return new SwitchCase(expressions, ImmutableList.copyOf(statements));
  }

  public static ForStatement forIn(String variable, Expression iterable, BlockStatement body) {
    return new ForStatement(variable, iterable, body, NO_POSITION);
  }

  public static WhileStatement whileLoop(Expression condition, BlockStatement body) {
    return new WhileStatement(condition, body, NO_POSITION);
  }

  public static RepeatStatement repeat(BlockStatement body, Expression condition) {
    return new RepeatStatement(body, condition, NO_POSITION);
  }

  public static ReturnStatement returnStatement() {
    return new ReturnStatement(null, NO_POSITION);
  }

  public static ReturnStatement returnStatement(Expression value) {
    return new ReturnStatement(value, NO_POSITION);
  }

  public static BreakStatement breakStatement() {
    return new BreakStatement(NO_POSITION);
  }

  public static ContinueStatement continueStatement() {
    return new ContinueStatement(NO_POSITION);
  }

  public static BlankStatement blank() {
    return new BlankStatement(NO_POSITION);
  }

  public static DoCatchStatement doCatch(BlockStatement body, BlockStatement catchBody) {
    return new DoCatchStatement(body, null, catchBody, NO_POSITION);
  }

  public static DoCatchStatement doCatch(
      BlockStatement body, String catchBinding, BlockStatement catchBody) {
    return new DoCatchStatement(body, catchBinding, catchBody, NO_POSITION);
  }

  public static ThrowStatement throwStatement(Expression value) {
    return new ThrowStatement(value, NO_POSITION);
  }

  public static ExpressionStatement exprResult(Expression expression) {
    return new ExpressionStatement(expression, NO_POSITION);
  }

  // Expressions

  public static VariableExpression name(String name) {
    return new VariableExpression(name, NO_POSITION);
  }

  public static SelfExpression self() {
    return new SelfExpression(NO_POSITION);
  }

  public static IntLiteralExpression number(String value) {
    return new IntLiteralExpression(value, NO_POSITION);
  }

  public static DoubleLiteralExpression decimal(String value) {
    return new DoubleLiteralExpression(value, NO_POSITION);
  }

  public static StringLiteralExpression string(String value) {
    return new StringLiteralExpression(value, false, NO_POSITION);
  }

  public static StringLiteralExpression multiLineString(String value) {
    return new StringLiteralExpression(value, true, NO_POSITION);
  }

  /** A boolean, nil or other literal kept as source text; null for a missing literal. */
  public static LiteralExpression literal(@Nullable String value) {
    return new LiteralExpression(value, NO_POSITION);
  }

  public static AssignmentExpression assign(Expression target, Expression value) {
    return assign(target, AssignmentOperator.ASSIGN, value);
  }

  public static AssignmentExpression assign(
      Expression target, AssignmentOperator operator, Expression value) {
    return new AssignmentExpression(target, operator, value, NO_POSITION);
  }

  public static TernaryExpression ternary(
      Expression condition, Expression thenValue, Expression elseValue) {
    return new TernaryExpression(condition, thenValue, elseValue, NO_POSITION);
  }

  public static BinaryExpression binary(Operator operator, Expression left, Expression right) {
    return new BinaryExpression(left, operator, right, NO_POSITION);
  }

  public static LogicalExpression logical(Operator operator, Expression left, Expression right) {
    return new LogicalExpression(left, operator, right, NO_POSITION);
  }

  public static UnaryExpression unary(Operator operator, Expression operand) {
    return new UnaryExpression(operator, operand, NO_POSITION);
  }

  public static CallExpression call(Expression callee, Argument... arguments) {
    return new CallExpression(callee, ImmutableList.copyOf(arguments), false, NO_POSITION);
  }

  /** A call of a type's initializer. */
  public static CallExpression construct(Expression callee, Argument... arguments) {
    return new CallExpression(callee, ImmutableList.copyOf(arguments), true, NO_POSITION);
  }

  public static Argument arg(Expression value) {
    return new Argument(null, value);
  }

  public static Argument arg(String label, Expression value) {
    return new Argument(label, value);
  }

  public static GetExpression getprop(Expression object, String name) {
    return new GetExpression(object, name, NO_POSITION);
  }

  public static IndexExpression index(Expression object, Expression index) {
    return new IndexExpression(object, index, NO_POSITION);
  }

  /** {@code object?} */
  public static OptionalChainingExpression optionalChain(Expression object) {
    return new OptionalChainingExpression(object, false, NO_POSITION);
  }

  /** {@code object!} */
  public static OptionalChainingExpression forceUnwrap(Expression object) {
    return new OptionalChainingExpression(object, true, NO_POSITION);
  }

  public static AsExpression cast(Expression expression, TypeIdentifier type) {
    return new AsExpression(expression, type, NO_POSITION);
  }

  public static IsExpression typeTest(Expression expression, TypeIdentifier type) {
    return new IsExpression(expression, type, NO_POSITION);
  }

  public static TryExpression tryExpression(TryExpression.Flavor flavor, Expression expression) {
    return new TryExpression(expression, flavor, NO_POSITION);
  }

  public static GroupingExpression paren(Expression expression) {
    return new GroupingExpression(expression, NO_POSITION);
  }

  public static ArrayLiteralExpression arrayLiteral(Expression... elements) {
    return new ArrayLiteralExpression(ImmutableList.copyOf(elements), NO_POSITION);
  }

  public static DictionaryLiteralExpression dictionaryLiteral(DictionaryEntry... entries) {
    return new DictionaryLiteralExpression(ImmutableList.copyOf(entries), NO_POSITION);
  }

  public static DictionaryEntry entry(Expression key, Expression value) {
    return new DictionaryEntry(key, value);
  }

  public static BinaryRangeExpression range(
      Expression lower, RangeOperator operator, Expression upper) {
    return new BinaryRangeExpression(lower, operator, upper, NO_POSITION);
  }
}
