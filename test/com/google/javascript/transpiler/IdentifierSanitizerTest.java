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

import static com.google.common.truth.Truth.assertThat;
import static com.google.javascript.transpiler.IdentifierSanitizer.isRenamed;
import static com.google.javascript.transpiler.IdentifierSanitizer.sanitize;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class IdentifierSanitizerTest {

  @Test
  public void testConventionalRenames() {
    assertThat(sanitize("function")).isEqualTo("func");
    assertThat(sanitize("arguments")).isEqualTo("args");
  }

  @Test
  public void testReservedWordsGetTrailingUnderscore() {
    assertThat(sanitize("new")).isEqualTo("new_");
    assertThat(sanitize("typeof")).isEqualTo("typeof_");
    assertThat(sanitize("constructor")).isEqualTo("constructor_");
    assertThat(sanitize("yield")).isEqualTo("yield_");
  }

  @Test
  public void testAnonymousClosureParameters() {
    assertThat(sanitize("$0")).isEqualTo("arg_0");
    assertThat(sanitize("$12")).isEqualTo("arg_12");
  }

  @Test
  public void testOrdinaryNamesUnchanged() {
    assertThat(sanitize("count")).isEqualTo("count");
    assertThat(sanitize("Function")).isEqualTo("Function");
    assertThat(isRenamed("count")).isFalse();
    assertThat(isRenamed("delete")).isTrue();
  }
}
