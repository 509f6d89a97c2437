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
package com.google.javascript.transpiler;

import com.google.javascript.transpiler.ast.VariableDeclaration;
import org.jspecify.annotations.Nullable;

/** Plain JavaScript bindings: {@code const x = 1;}, {@code x}. */
final class NativeBindingStrategy extends BindingStrategy {

  @Override
  String getPreludeResource() {
    return RuntimePrelude.NATIVE_RESOURCE;
  }

  @Override
  String reference(String name) {
    return name;
  }

  @Override
  String wrap(String value) {
    return value;
  }

  @Override
  String rawName(String name, TempNameSupplier temps) {
    return name;
  }

  @Override
  void bindRaw(CodePrinter cp, String name, String rawName) {}

  @Override
  void declareVariable(
      CodePrinter cp,
      String keyword,
      String name,
      String type,
      @Nullable String initializer,
      VariableDeclaration declaration) {
    cp.add(keywordPrefix(keyword) + name);
    if (initializer != null) {
      cp.add(" = " + initializer);
    }
    cp.add(";");
    cp.endLine();
  }

  @Override
  void declareEnum(CodePrinter cp, String prefix, String name, Runnable cases) {
    cp.add(prefix + name + " = ");
    cases.run();
    cp.add(";");
    cp.endLine();
  }

  @Override
  void declareFunction(CodePrinter cp, String name, Runnable function) {
    function.run();
    cp.endLine();
  }
}
