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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A free function, method or initializer. The body is absent only for protocol requirements.
 */
public record FunctionDeclaration(
    String name,
    List<Parameter> parameters,
    @Nullable TypeIdentifier returnType,
    @Nullable BlockStatement body,
    boolean isStatic,
    SourcePosition position)
    implements Declaration {

  public static final String INITIALIZER_NAME = "init";

  public FunctionDeclaration {
    checkArgument(!name.isEmpty(), "empty function name");
    parameters = ImmutableList.copyOf(parameters);
    for (int i = 0; i < parameters.size() - 1; i++) {
      checkArgument(
          !parameters.get(i).isVariadic(), "variadic parameter must be last in %s", name);
    }
    checkNotNull(position);
  }

  public boolean isInitializer() {
    return INITIALIZER_NAME.equals(name);
  }

  public @Nullable Parameter variadicParameter() {
    if (parameters.isEmpty()) {
      return null;
    }
    Parameter last = parameters.get(parameters.size() - 1);
    return last.isVariadic() ? last : null;
  }

  @Override
  public <R, P> R accept(DeclarationVisitor<R, P> visitor, P param) {
    return visitor.visitFunction(this, param);
  }
}
