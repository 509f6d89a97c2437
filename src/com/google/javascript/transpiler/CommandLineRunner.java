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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.Files;
import com.google.javascript.transpiler.ast.Node;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.spi.BooleanOptionHandler;

/**
 * Transpiles AST documents from the command line.
 *
 * <pre>
 * java -jar js-transpiler.jar --ast program.json --js_output_file program.js
 * </pre>
 *
 * Inputs are JSON documents in the form {@link AstJsonParser} reads; their top-level nodes are
 * translated in order, as one program. Without {@code --js_output_file} the code goes to standard
 * output. The exit status is the number of errors, capped at 127.
 *
 * <p>This class is not thread-safe.
 */
public class CommandLineRunner {

  private static final String ROOT_LOGGER = "com.google.javascript.transpiler";

  private static final int MAX_EXIT_STATUS = 127;

  /** How diagnostics are printed. */
  enum ErrorFormat {
    TEXT,
    JSON
  }

  private static class Flags {
    @Option(
        name = "--help",
        handler = BooleanOptionHandler.class,
        usage = "Displays this message on stdout and exit")
    private boolean displayHelp = false;

    @Option(
        name = "--ast",
        usage =
            "A JSON AST document to transpile. You may specify multiple. The flag name is"
                + " optional, because args are interpreted as files by default.")
    private List<String> ast = new ArrayList<>();

    @Option(
        name = "--js_output_file",
        usage = "Primary output filename. If not specified, output is written to stdout")
    private String jsOutputFile = "";

    @Option(
        name = "--managed_runtime",
        handler = BooleanOptionHandler.class,
        usage =
            "Emit every value binding as a tagged record read through .value, for a runtime"
                + " that inspects bindings")
    private boolean managedRuntime = false;

    @Option(
        name = "--continue_after_errors",
        handler = BooleanOptionHandler.class,
        usage =
            "Leave out statements that cannot be translated and keep going, instead of"
                + " stopping at the first error")
    private boolean continueAfterErrors = false;

    @Option(
        name = "--prevent_library_injection",
        handler = BooleanOptionHandler.class,
        usage = "Do not emit the runtime helper library ahead of the compiled code")
    private boolean preventLibraryInjection = false;

    @Option(name = "--error_format", usage = "Specifies format for error messages.")
    private ErrorFormat errorFormat = ErrorFormat.TEXT;

    @Option(
        name = "--suppress_diagnostic",
        usage = "Turn off the named diagnostic, for example TRANSPILER_UNCHECKED_TYPE_TEST")
    private List<String> suppressDiagnostic = new ArrayList<>();

    @Option(
        name = "--logging_level",
        hidden = true,
        usage =
            "The logging level (standard java.util.logging.Level values) for transpiler"
                + " progress. Does not control errors or warnings for the program")
    private String loggingLevel = Level.WARNING.getName();

    @Argument private List<String> arguments = new ArrayList<>();

    private final CmdLineParser parser;

    Flags() {
      parser = new CmdLineParser(this);
    }

    private void parse(String[] args) throws CmdLineException {
      parser.parseArgument(args);
      for (String key : suppressDiagnostic) {
        DiagnosticType type = TranspilerErrors.forKey(key);
        if (type == null) {
          throw new CmdLineException(parser, "Unknown diagnostic for --suppress_diagnostic: " + key);
        }
        if (type.level == CheckLevel.ERROR) {
          throw new CmdLineException(parser, "Errors cannot be suppressed: " + key);
        }
      }
      try {
        Level.parse(loggingLevel);
      } catch (IllegalArgumentException e) {
        throw new CmdLineException(parser, "Bad value for --logging_level: " + loggingLevel, e);
      }
    }

    private List<String> getAstFiles() {
      List<String> files = new ArrayList<>(ast);
      files.addAll(arguments);
      return files;
    }

    private void printUsage(PrintStream out) {
      parser.printUsage(out);
      out.flush();
    }
  }

  private final Flags flags = new Flags();
  private final PrintStream out;
  private final PrintStream err;
  private boolean runTranspiler = false;
  private boolean errors = false;

  protected CommandLineRunner(String[] args) {
    this(args, System.out, System.err);
  }

  protected CommandLineRunner(String[] args, PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
    initConfigFromFlags(args);
  }

  private void initConfigFromFlags(String[] args) {
    try {
      flags.parse(args);
    } catch (CmdLineException e) {
      reportError(e.getMessage());
    }
    if (!errors && !flags.displayHelp && flags.getAstFiles().isEmpty()) {
      reportError("ERROR - no AST input given; pass --ast or a file name.");
    }
    if (errors) {
      err.println("Sample usage: --ast program.json --js_output_file program.js");
      err.println("Run with --help for all options.");
    } else if (flags.displayHelp) {
      flags.printUsage(out);
    } else {
      runTranspiler = true;
    }
  }

  private void reportError(String message) {
    errors = true;
    err.println(message);
    err.flush();
  }

  public boolean shouldRunTranspiler() {
    return runTranspiler;
  }

  public boolean hasErrors() {
    return errors;
  }

  protected TranspilerOptions createOptions() {
    TranspilerOptions options = new TranspilerOptions();
    options.setManagedRuntime(flags.managedRuntime);
    options.setContinueAfterErrors(flags.continueAfterErrors);
    options.setPreventLibraryInjection(flags.preventLibraryInjection);
    for (String key : flags.suppressDiagnostic) {
      options.setWarningLevel(TranspilerErrors.forKey(key), CheckLevel.OFF);
    }
    return options;
  }

  private ErrorManager createErrorManager() {
    if (flags.errorFormat == ErrorFormat.JSON) {
      return new SortingErrorManager(ImmutableSet.of(new JsonErrorReportGenerator(err)));
    }
    return new PrintStreamErrorManager(err);
  }

  /**
   * Reads the inputs, transpiles them and writes the code.
   *
   * @return the exit status: the number of errors, capped at {@value #MAX_EXIT_STATUS}
   * @throws IOException if an input cannot be read or the output cannot be written
   */
  protected int doRun() throws IOException {
    Logger.getLogger(ROOT_LOGGER).setLevel(Level.parse(flags.loggingLevel));

    ImmutableList.Builder<Node> program = ImmutableList.builder();
    for (String path : flags.getAstFiles()) {
      String contents = Files.asCharSource(new File(path), UTF_8).read();
      try {
        program.addAll(AstJsonParser.parse(contents, path));
      } catch (AstParseException e) {
        err.println("ERROR - " + e.getMessage());
        return 1;
      }
    }

    Transpiler transpiler = new Transpiler(createOptions(), createErrorManager());
    Result result = transpiler.transpile(program.build());

    if (!result.code.isEmpty()) {
      if (flags.jsOutputFile.isEmpty()) {
        out.println(result.code);
        out.flush();
      } else {
        Files.asCharSink(new File(flags.jsOutputFile), UTF_8).write(result.code + "\n");
      }
    }
    return Math.min(result.errors.size(), MAX_EXIT_STATUS);
  }

  /** Runs the transpiler and exits with its status. */
  public void run() {
    int result;
    try {
      result = doRun();
    } catch (IOException e) {
      err.println("ERROR - " + e.getMessage());
      result = 1;
    }
    System.exit(result);
  }

  public static void main(String[] args) {
    CommandLineRunner runner = new CommandLineRunner(args);
    if (runner.shouldRunTranspiler()) {
      runner.run();
    }
    if (runner.hasErrors()) {
      System.exit(-1);
    }
  }
}
