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

/**
 * Visits the declaration kinds.
 *
 * @param <R> the result type
 * @param <P> an extra parameter threaded through every visit
 */
public interface DeclarationVisitor<R, P> {
  R visitVariable(VariableDeclaration declaration, P param);

  R visitStruct(StructDeclaration declaration, P param);

  R visitClass(ClassDeclaration declaration, P param);

  R visitFunction(FunctionDeclaration declaration, P param);

  R visitEnum(EnumDeclaration declaration, P param);

  R visitProtocol(ProtocolDeclaration declaration, P param);

  R visitTypeAlias(TypeAliasDeclaration declaration, P param);
}
