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

import com.google.common.collect.ImmutableMap;
import com.google.javascript.transpiler.ast.TypeIdentifier;
import com.google.javascript.transpiler.ast.TypeIdentifier.ArrayOf;
import com.google.javascript.transpiler.ast.TypeIdentifier.DictionaryOf;
import com.google.javascript.transpiler.ast.TypeIdentifier.Named;
import com.google.javascript.transpiler.ast.TypeIdentifier.OptionalOf;
import org.jspecify.annotations.Nullable;

/**
 * Renders source type annotations as TypeScript-style type strings. The result is only ever used
 * as data: the {@code type} tag of a managed binding, a type alias descriptor, or a comment.
 */
public final class TypeMapper {

  static final String ANY = "any";

  private static final ImmutableMap<String, String> PRIMITIVES =
      ImmutableMap.<String, String>builder()
          .put("Int", "number")
          .put("Int8", "number")
          .put("Int16", "number")
          .put("Int32", "number")
          .put("Int64", "number")
          .put("UInt", "number")
          .put("UInt8", "number")
          .put("UInt16", "number")
          .put("UInt32", "number")
          .put("UInt64", "number")
          .put("Double", "number")
          .put("Float", "number")
          .put("Float32", "number")
          .put("Float64", "number")
          .put("String", "string")
          .put("Character", "string")
          .put("Bool", "boolean")
          .put("Any", "any")
          .put("Void", "void")
          .buildOrThrow();

  private TypeMapper() {}

  /** Maps {@code type}; a missing annotation maps to {@code any}. */
  public static String toTypeString(@Nullable TypeIdentifier type) {
    if (type == null) {
      return ANY;
    }
    if (type instanceof Named) {
      String name = ((Named) type).name();
      return PRIMITIVES.getOrDefault(name, name);
    } else if (type instanceof ArrayOf) {
      TypeIdentifier element = ((ArrayOf) type).element();
      String elementType = toTypeString(element);
      return (element instanceof OptionalOf ? "(" + elementType + ")" : elementType) + "[]";
    } else if (type instanceof DictionaryOf) {
      DictionaryOf dictionary = (DictionaryOf) type;
      return "{ [key: "
          + toTypeString(dictionary.key())
          + "]: "
          + toTypeString(dictionary.value())
          + " }";
    } else if (type instanceof OptionalOf) {
      TypeIdentifier wrapped = ((OptionalOf) type).wrapped();
      while (wrapped instanceof OptionalOf) {
        wrapped = ((OptionalOf) wrapped).wrapped();
      }
      return toTypeString(wrapped) + " | null | undefined";
    }
    throw new IllegalStateException("Unexpected type identifier: " + type);
  }
}
