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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** A reference type. The first inherited type, if any, is the superclass. */
public record ClassDeclaration(
    String name,
    List<String> inheritedTypes,
    List<VariableDeclaration> properties,
    List<FunctionDeclaration> methods,
    SourcePosition position)
    implements Declaration {

  public ClassDeclaration {
    checkNotNull(name);
    inheritedTypes = ImmutableList.copyOf(inheritedTypes);
    properties = ImmutableList.copyOf(properties);
    methods = ImmutableList.copyOf(methods);
    checkNotNull(position);
  }

  public @Nullable String superclass() {
    return inheritedTypes.isEmpty() ? null : inheritedTypes.get(0);
  }

  @Override
  public <R, P> R accept(DeclarationVisitor<R, P> visitor, P param) {
    return visitor.visitClass(this, param);
  }
}
