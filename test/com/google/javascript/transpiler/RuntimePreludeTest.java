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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RuntimePreludeTest {

  @Test
  public void testNativePrelude() {
    String prelude = RuntimePrelude.forBindings(new NativeBindingStrategy());
    assertThat(prelude).contains("function isUndefinedOrNull(value)");
    assertThat(prelude).contains("return value === undefined || value === null;");
    assertThat(prelude).contains("function tryOptional(body)");
    assertThat(prelude).contains("function tryForce(body)");
    assertThat(prelude).doesNotContain("binding.value");
  }

  @Test
  public void testManagedPreludeLooksInsideRecords() {
    String prelude = RuntimePrelude.forBindings(new ManagedBindingStrategy());
    assertThat(prelude).contains("return binding.value === undefined || binding.value === null;");
    assertThat(prelude).contains("function unwrap(binding)");
    assertThat(prelude).contains("function tryForce(body)");
  }

  @Test
  public void testNoTrailingWhitespace() {
    assertThat(RuntimePrelude.load(RuntimePrelude.NATIVE_RESOURCE)).endsWith("}");
    assertThat(RuntimePrelude.load(RuntimePrelude.MANAGED_RESOURCE)).endsWith("}");
  }

  @Test
  public void testResourcesExist() {
    assertThat(ResourceLoader.resourceExists(RuntimePrelude.class, RuntimePrelude.NATIVE_RESOURCE))
        .isTrue();
    assertThat(ResourceLoader.resourceExists(RuntimePrelude.class, "js/missing.js")).isFalse();
  }
}
