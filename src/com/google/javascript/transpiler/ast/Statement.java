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

/** A node that executes for its effect and produces no value. */
public sealed interface Statement extends Node
    permits IfStatement,
        IfLetStatement,
        GuardStatement,
        GuardLetStatement,
        SwitchStatement,
        ForStatement,
        WhileStatement,
        RepeatStatement,
        ReturnStatement,
        BreakStatement,
        ContinueStatement,
        BlankStatement,
        DoCatchStatement,
        ThrowStatement,
        BlockStatement,
        ExpressionStatement {

  <R> R accept(StatementVisitor<R> visitor);
}
