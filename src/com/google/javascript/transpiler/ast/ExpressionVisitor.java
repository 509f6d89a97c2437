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

/** Visits the expression kinds. */
public interface ExpressionVisitor<R> {
  R visitAssignment(AssignmentExpression expression);

  R visitTernary(TernaryExpression expression);

  R visitBinary(BinaryExpression expression);

  R visitLogical(LogicalExpression expression);

  R visitUnary(UnaryExpression expression);

  R visitCall(CallExpression expression);

  R visitGet(GetExpression expression);

  R visitIndex(IndexExpression expression);

  R visitOptionalChaining(OptionalChainingExpression expression);

  R visitAs(AsExpression expression);

  R visitIs(IsExpression expression);

  R visitTry(TryExpression expression);

  R visitLiteral(LiteralExpression expression);

  R visitStringLiteral(StringLiteralExpression expression);

  R visitIntLiteral(IntLiteralExpression expression);

  R visitDoubleLiteral(DoubleLiteralExpression expression);

  R visitSelf(SelfExpression expression);

  R visitVariable(VariableExpression expression);

  R visitGrouping(GroupingExpression expression);

  R visitArrayLiteral(ArrayLiteralExpression expression);

  R visitDictionaryLiteral(DictionaryLiteralExpression expression);

  R visitBinaryRange(BinaryRangeExpression expression);
}
