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
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.io.Files;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CommandLineRunnerTest {

  private static final String PROGRAM =
      "[{\"kind\": \"VariableDeclaration\", \"name\": \"x\", \"isConstant\": true,"
          + " \"initializer\": {\"kind\": \"IntLiteralExpression\", \"value\": \"1\"}}]";

  private static final String UNSUPPORTED =
      "{\"sourceName\": \"bad.swift\", \"program\": [{\"kind\": \"ExpressionStatement\","
          + " \"line\": 2, \"column\": 1, \"expression\": {\"kind\": \"BinaryExpression\","
          + " \"operator\": \"&\", \"line\": 2, \"column\": 3,"
          + " \"left\": {\"kind\": \"VariableExpression\", \"name\": \"a\"},"
          + " \"right\": {\"kind\": \"VariableExpression\", \"name\": \"b\"}}}]}";

  private static final String TYPE_TEST =
      "[{\"kind\": \"ExpressionStatement\", \"expression\": {\"kind\": \"IsExpression\","
          + " \"type\": \"Int\", \"expression\": {\"kind\": \"VariableExpression\","
          + " \"name\": \"v\"}}}]";

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private ByteArrayOutputStream out;
  private ByteArrayOutputStream err;

  @Before
  public void setUp() {
    out = new ByteArrayOutputStream();
    err = new ByteArrayOutputStream();
  }

  private CommandLineRunner createRunner(String... args) {
    return new CommandLineRunner(
        args, new PrintStream(out, true, UTF_8), new PrintStream(err, true, UTF_8));
  }

  private String writeInput(String name, String contents) throws IOException {
    File file = tmp.newFile(name);
    Files.asCharSink(file, UTF_8).write(contents);
    return file.getPath();
  }

  @Test
  public void testWritesOutputFile() throws Exception {
    String input = writeInput("program.json", PROGRAM);
    File output = new File(tmp.getRoot(), "program.js");
    CommandLineRunner runner =
        createRunner("--ast", input, "--js_output_file", output.getPath());
    assertThat(runner.shouldRunTranspiler()).isTrue();
    assertThat(runner.doRun()).isEqualTo(0);
    String code = Files.asCharSource(output, UTF_8).read();
    assertThat(code).contains("function isUndefinedOrNull(value)");
    assertThat(code).endsWith("// Compiled code\n\nconst x = 1;\n");
  }

  @Test
  public void testBareArgumentsAndStdout() throws Exception {
    String input = writeInput("program.json", PROGRAM);
    CommandLineRunner runner = createRunner("--prevent_library_injection", input);
    assertThat(runner.doRun()).isEqualTo(0);
    assertThat(out.toString(UTF_8)).isEqualTo("// Compiled code\n\nconst x = 1;\n");
  }

  @Test
  public void testManagedRuntimeFlag() throws Exception {
    String input = writeInput("program.json", PROGRAM);
    CommandLineRunner runner =
        createRunner("--managed_runtime", "--prevent_library_injection", input);
    assertThat(runner.doRun()).isEqualTo(0);
    assertThat(out.toString(UTF_8)).contains("const x = {\n  value: 1,");
  }

  @Test
  public void testErrorsSetExitStatus() throws Exception {
    String input = writeInput("bad.json", UNSUPPORTED);
    CommandLineRunner runner = createRunner(input);
    assertThat(runner.doRun()).isEqualTo(1);
    assertThat(out.toString(UTF_8)).isEmpty();
    assertThat(err.toString(UTF_8))
        .contains("bad.swift:2:3: ERROR - [TRANSPILER_UNSUPPORTED_OPERATOR]");
  }

  @Test
  public void testContinueAfterErrorsStillWritesCode() throws Exception {
    String program = writeInput("program.json", PROGRAM);
    String bad = writeInput("bad.json", UNSUPPORTED);
    CommandLineRunner runner =
        createRunner("--continue_after_errors", "--prevent_library_injection", program, bad);
    assertThat(runner.doRun()).isEqualTo(1);
    assertThat(out.toString(UTF_8)).isEqualTo("// Compiled code\n\nconst x = 1;\n");
  }

  @Test
  public void testJsonErrorFormat() throws Exception {
    String input = writeInput("bad.json", UNSUPPORTED);
    CommandLineRunner runner = createRunner("--error_format", "JSON", input);
    runner.doRun();
    assertThat(err.toString(UTF_8)).contains("\"key\":\"TRANSPILER_UNSUPPORTED_OPERATOR\"");
  }

  @Test
  public void testSuppressDiagnostic() throws Exception {
    String input = writeInput("test.json", TYPE_TEST);
    CommandLineRunner runner =
        createRunner("--suppress_diagnostic", "TRANSPILER_UNCHECKED_TYPE_TEST", input);
    assertThat(runner.doRun()).isEqualTo(0);
    assertThat(err.toString(UTF_8)).doesNotContain("TRANSPILER_UNCHECKED_TYPE_TEST");
  }

  @Test
  public void testWarningIsPrinted() throws Exception {
    String input = writeInput("test.json", TYPE_TEST);
    CommandLineRunner runner = createRunner(input);
    assertThat(runner.doRun()).isEqualTo(0);
    assertThat(err.toString(UTF_8)).contains("WARNING - [TRANSPILER_UNCHECKED_TYPE_TEST]");
    assertThat(err.toString(UTF_8)).contains("0 error(s), 1 warning(s)");
  }

  @Test
  public void testMalformedInput() throws Exception {
    String input = writeInput("broken.json", "[{\"kind\": \"Nope\"}]");
    CommandLineRunner runner = createRunner(input);
    assertThat(runner.doRun()).isEqualTo(1);
    assertThat(err.toString(UTF_8)).contains("Unknown node kind Nope");
  }

  @Test
  public void testUnknownDiagnosticIsRejected() {
    CommandLineRunner runner = createRunner("--suppress_diagnostic", "NOPE", "x.json");
    assertThat(runner.shouldRunTranspiler()).isFalse();
    assertThat(runner.hasErrors()).isTrue();
    assertThat(err.toString(UTF_8)).contains("NOPE");
  }

  @Test
  public void testErrorDiagnosticCannotBeSuppressed() {
    CommandLineRunner runner =
        createRunner("--suppress_diagnostic", "TRANSPILER_UNSUPPORTED_NODE", "x.json");
    assertThat(runner.shouldRunTranspiler()).isFalse();
    assertThat(runner.hasErrors()).isTrue();
    assertThat(err.toString(UTF_8)).contains("Errors cannot be suppressed");
  }

  @Test
  public void testNoInputIsAnError() {
    CommandLineRunner runner = createRunner();
    assertThat(runner.shouldRunTranspiler()).isFalse();
    assertThat(runner.hasErrors()).isTrue();
  }

  @Test
  public void testHelp() {
    CommandLineRunner runner = createRunner("--help");
    assertThat(runner.shouldRunTranspiler()).isFalse();
    assertThat(runner.hasErrors()).isFalse();
    assertThat(out.toString(UTF_8)).contains("--managed_runtime");
  }
}
