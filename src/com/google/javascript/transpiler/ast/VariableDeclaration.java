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

import org.jspecify.annotations.Nullable;

/** {@code let}/{@code var} bindings, both local and stored properties. */
public record VariableDeclaration(
    String name,
    @Nullable TypeIdentifier type,
    @Nullable Expression initializer,
    boolean isConstant,
    boolean isPrivate,
    SourcePosition position)
    implements Declaration {

  public VariableDeclaration {
    checkArgument(!name.isEmpty(), "empty variable name");
    checkNotNull(position);
  }

  public boolean hasInitializer() {
    return initializer != null;
  }

  @Override
  public <R, P> R accept(DeclarationVisitor<R, P> visitor, P param) {
    return visitor.visitVariable(this, param);
  }
}
