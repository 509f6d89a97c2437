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

/** A type annotation as written in the source: a name, or an array, dictionary or optional. */
public sealed interface TypeIdentifier
    permits TypeIdentifier.Named,
        TypeIdentifier.ArrayOf,
        TypeIdentifier.DictionaryOf,
        TypeIdentifier.OptionalOf {

  /** A nominal type such as {@code Int} or a user-defined struct. */
  record Named(String name) implements TypeIdentifier {
    public Named {
      checkArgument(!name.isEmpty(), "empty type name");
    }
  }

  /** {@code [Element]} */
  record ArrayOf(TypeIdentifier element) implements TypeIdentifier {
    public ArrayOf {
      checkNotNull(element);
    }
  }

  /** {@code [Key: Value]} */
  record DictionaryOf(TypeIdentifier key, TypeIdentifier value) implements TypeIdentifier {
    public DictionaryOf {
      checkNotNull(key);
      checkNotNull(value);
    }
  }

  /** {@code Wrapped?} */
  record OptionalOf(TypeIdentifier wrapped) implements TypeIdentifier {
    public OptionalOf {
      checkNotNull(wrapped);
    }
  }

  static TypeIdentifier named(String name) {
    return new Named(name);
  }

  static TypeIdentifier arrayOf(TypeIdentifier element) {
    return new ArrayOf(element);
  }

  static TypeIdentifier dictionaryOf(TypeIdentifier key, TypeIdentifier value) {
    return new DictionaryOf(key, value);
  }

  static TypeIdentifier optionalOf(TypeIdentifier wrapped) {
    return new OptionalOf(wrapped);
  }
}
