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

import com.google.common.collect.ImmutableList;
import com.google.javascript.transpiler.ast.VariableDeclaration;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Tagged-record bindings for a managed runtime. A declared variable becomes
 *
 * <pre>
 * let x = {
 *   value: 1,
 *   type: "number"
 * };
 * </pre>
 *
 * and every read goes through {@code x.value}. Enums and free functions get the same record shape
 * with the type tags {@code "enum"} and {@code "function"}; parameters, loop variables, caught
 * errors and unwrapped optionals are rebound as {@code { value: ... }}.
 */
final class ManagedBindingStrategy extends BindingStrategy {

  static final String VALUE_FIELD = "value";

  @Override
  String getPreludeResource() {
    return RuntimePrelude.MANAGED_RESOURCE;
  }

  @Override
  String reference(String name) {
    return name + "." + VALUE_FIELD;
  }

  @Override
  String wrap(String value) {
    return "{ " + VALUE_FIELD + ": " + value + " }";
  }

  @Override
  String rawName(String name, TempNameSupplier temps) {
    return temps.next(name);
  }

  @Override
  void bindRaw(CodePrinter cp, String name, String rawName) {
    cp.addLine("const " + name + " = " + wrap(rawName) + ";");
  }

  @Override
  void declareVariable(
      CodePrinter cp,
      String keyword,
      String name,
      String type,
      @Nullable String initializer,
      VariableDeclaration declaration) {
    ImmutableList.Builder<String> fields = ImmutableList.builder();
    fields.add(VALUE_FIELD + ": " + (initializer == null ? "null" : initializer));
    fields.add("type: \"" + type + "\"");
    if (declaration.isConstant()) {
      fields.add("isConstant: true");
    }
    if (declaration.isPrivate()) {
      fields.add("isPrivate: true");
    }
    if (initializer == null) {
      fields.add("isUndefined: true");
    }
    cp.add(keywordPrefix(keyword) + name + " = ");
    printRecord(cp, fields.build());
    cp.add(";");
    cp.endLine();
  }

  @Override
  void declareEnum(CodePrinter cp, String prefix, String name, Runnable cases) {
    cp.add(prefix + name + " = ");
    printTaggedValue(cp, cases, "enum");
    cp.add(";");
    cp.endLine();
  }

  @Override
  void declareFunction(CodePrinter cp, String name, Runnable function) {
    cp.add("const " + name + " = ");
    printTaggedValue(cp, function, "function");
    cp.add(";");
    cp.endLine();
  }

  private static void printRecord(CodePrinter cp, List<String> fields) {
    cp.beginBlock();
    for (int i = 0; i < fields.size(); i++) {
      cp.addLine(fields.get(i) + (i < fields.size() - 1 ? "," : ""));
    }
    cp.endBlock();
  }

  private static void printTaggedValue(CodePrinter cp, Runnable value, String type) {
    cp.beginBlock();
    cp.add(VALUE_FIELD + ": ");
    value.run();
    cp.addLine(",");
    cp.addLine("type: \"" + type + "\"");
    cp.endBlock();
  }
}
