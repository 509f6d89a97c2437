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

import static com.google.common.base.Preconditions.checkNotNull;

import org.jspecify.annotations.Nullable;

/**
 * {@code do { ... } catch { ... }}. {@code catchBinding} is the name of an explicit
 * {@code catch let name} pattern, or null for the implicit {@code error}.
 */
public record DoCatchStatement(
    BlockStatement body,
    @Nullable String catchBinding,
    BlockStatement catchBody,
    SourcePosition position)
    implements Statement {

  public static final String IMPLICIT_ERROR_NAME = "error";

  public DoCatchStatement {
    checkNotNull(body);
    checkNotNull(catchBody);
    checkNotNull(position);
  }

  @Override
  public <R> R accept(StatementVisitor<R> visitor) {
    return visitor.visitDoCatch(this);
  }
}
