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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/** Thrown by {@link Transpiler#toSource} when a program could not be translated. */
public class TranspilerException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ImmutableList<TranspilerError> errors;

  public TranspilerException(ImmutableList<TranspilerError> errors) {
    super(Joiner.on('\n').join(errors));
    this.errors = errors;
  }

  public ImmutableList<TranspilerError> getErrors() {
    return errors;
  }
}
