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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/** {@code guard let name = value else { ... }}; the binding stays visible after the guard. */
public record GuardLetStatement(
    String name, Expression value, BlockStatement body, SourcePosition position)
    implements Statement {

  public GuardLetStatement {
    checkArgument(!name.isEmpty(), "empty binding name");
    checkNotNull(value, "guard-let without a value");
    checkNotNull(body);
    checkNotNull(position);
  }

  public boolean isSelfBinding() {
    return value instanceof VariableExpression && ((VariableExpression) value).name().equals(name);
  }

  @Override
  public <R> R accept(StatementVisitor<R> visitor) {
    return visitor.visitGuardLet(this);
  }
}
