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

/**
 * Decides the shape of every value binding the generators emit. The generators hand each
 * binding site to the strategy instead of branching on the generation mode, so the two modes
 * differ in exactly the places this class names.
 *
 * <p>{@link NativeBindingStrategy} emits plain JavaScript bindings. {@link
 * ManagedBindingStrategy} emits records that a runtime layer can inspect, and reads them back
 * through {@code .value}.
 */
abstract class BindingStrategy {

  static BindingStrategy forOptions(TranspilerOptions options) {
    return options.isManagedRuntime() ? new ManagedBindingStrategy() : new NativeBindingStrategy();
  }

  /** The resource holding the runtime helpers this mode's output calls. */
  abstract String getPreludeResource();

  /** A read of the binding {@code name}, which is already sanitized. */
  abstract String reference(String name);

  /** {@code value} in the form the hidden temporary of an if-let or guard-let holds it. */
  abstract String wrap(String value);

  /**
   * The name under which a construct receives the raw value of the binding {@code name}: a loop
   * variable, a parameter or a caught error. {@link #bindRaw} then binds {@code name} itself.
   */
  abstract String rawName(String name, TempNameSupplier temps);

  /** Binds {@code name} to the raw value received as {@code rawName}, at the top of its scope. */
  abstract void bindRaw(CodePrinter cp, String name, String rawName);

  /**
   * Prints a variable declaration or stored property.
   *
   * @param keyword {@code const}, {@code let}, or empty for a class field
   * @param name the sanitized name
   * @param type the mapped type of the declaration
   * @param initializer the translated initializer, if any
   */
  abstract void declareVariable(
      CodePrinter cp,
      String keyword,
      String name,
      String type,
      @Nullable String initializer,
      VariableDeclaration declaration);

  /**
   * Prints an enum binding.
   *
   * @param prefix {@code "const "} or {@code "static "}
   * @param cases prints the frozen case table, leaving the line open
   */
  abstract void declareEnum(CodePrinter cp, String prefix, String name, Runnable cases);

  /**
   * Prints a free function.
   *
   * @param function prints {@code function name(...) { ... }}, leaving the line open
   */
  abstract void declareFunction(CodePrinter cp, String name, Runnable function);

  static String keywordPrefix(String keyword) {
    return keyword.isEmpty() ? "" : keyword + " ";
  }
}
