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

/** Visits the statement kinds. */
public interface StatementVisitor<R> {
  R visitIf(IfStatement statement);

  R visitIfLet(IfLetStatement statement);

  R visitGuard(GuardStatement statement);

  R visitGuardLet(GuardLetStatement statement);

  R visitSwitch(SwitchStatement statement);

  R visitFor(ForStatement statement);

  R visitWhile(WhileStatement statement);

  R visitRepeat(RepeatStatement statement);

  R visitReturn(ReturnStatement statement);

  R visitBreak(BreakStatement statement);

  R visitContinue(ContinueStatement statement);

  R visitBlank(BlankStatement statement);

  R visitDoCatch(DoCatchStatement statement);

  R visitThrow(ThrowStatement statement);

  R visitBlock(BlockStatement statement);

  R visitExpression(ExpressionStatement statement);
}
