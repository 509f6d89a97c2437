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

/** A value type. Members are stored properties, methods and nested types. */
public record StructDeclaration(
    String name, List<String> inheritedTypes, List<Node> members, SourcePosition position)
    implements Declaration {

  public StructDeclaration {
    checkNotNull(name);
    inheritedTypes = ImmutableList.copyOf(inheritedTypes);
    members = ImmutableList.copyOf(members);
    checkNotNull(position);
  }

  /** Whether the struct spells out its own initializer. */
  public boolean declaresInitializer() {
    for (Node member : members) {
      if (member instanceof FunctionDeclaration
          && ((FunctionDeclaration) member).isInitializer()) {
        return true;
      }
    }
    return false;
  }

  @Override
  public <R, P> R accept(DeclarationVisitor<R, P> visitor, P param) {
    return visitor.visitStruct(this, param);
  }
}
