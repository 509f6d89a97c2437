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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import com.google.javascript.transpiler.ast.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Translates a program, given as its top-level nodes, into JavaScript.
 *
 * <p>The output is the runtime prelude for the chosen mode, a {@link #COMPILED_CODE_HEADER}
 * separator, and the translation of each top-level node in source order. Each node is generated
 * with its own printer and temporaries, so the translation of one node never depends on its
 * siblings.
 *
 * <p>A Transpiler reports into one {@link ErrorManager} and is meant for a single run.
 */
public final class Transpiler implements ErrorHandler {

  private static final Logger logger = Logger.getLogger(Transpiler.class.getName());

  static final String COMPILED_CODE_HEADER = "// Compiled code";

  private static final Joiner LINE_JOINER = Joiner.on('\n');

  private final TranspilerOptions options;
  private final ErrorManager errorManager;
  private final BindingStrategy bindings;

  /** Creates a transpiler that logs its diagnostics through {@code java.util.logging}. */
  public Transpiler(TranspilerOptions options) {
    this(options, new LoggerErrorManager(logger));
  }

  public Transpiler(TranspilerOptions options, ErrorManager errorManager) {
    this.options = checkNotNull(options);
    this.errorManager = checkNotNull(errorManager);
    this.bindings = BindingStrategy.forOptions(options);
  }

  /**
   * Translates {@code program}. When a construct has no translation and the options do not allow
   * continuing, the returned result carries the error and no code.
   */
  public Result transpile(List<? extends Node> program) {
    logger.log(
        Level.FINE,
        "Transpiling {0} top-level nodes in {1} mode",
        new Object[] {program.size(), options.isManagedRuntime() ? "managed" : "native"});
    List<String> translations = new ArrayList<>(program.size());
    String code;
    try {
      for (Node node : program) {
        String translation = generate(node);
        if (!translation.isEmpty()) {
          translations.add(translation);
        }
      }
      code = assemble(LINE_JOINER.join(translations));
    } catch (UnsupportedNodeException e) {
      logger.fine("Stopping at the first untranslatable construct");
      report(CheckLevel.ERROR, e.getError());
      code = "";
    }
    errorManager.generateReport();
    return new Result(errorManager.getErrors(), errorManager.getWarnings(), code);
  }

  /** Translates one top-level node, without the prelude. */
  @VisibleForTesting
  String generate(Node node) {
    CodePrinter cp = new CodePrinter();
    new StatementGenerator(cp, bindings, options, this).generateChild(node, false);
    return cp.getCode();
  }

  private String assemble(String body) {
    String header = COMPILED_CODE_HEADER + "\n\n" + body;
    if (options.shouldPreventLibraryInjection()) {
      return header;
    }
    return RuntimePrelude.forBindings(bindings) + "\n\n" + header;
  }

  /** Applies the levels configured in the options before handing the diagnostic on. */
  @Override
  public void report(CheckLevel level, TranspilerError error) {
    CheckLevel configured = options.getWarningLevel(error);
    if (configured.isOn()) {
      errorManager.report(configured, error);
    }
  }

  public ErrorManager getErrorManager() {
    return errorManager;
  }

  /**
   * Translates {@code program} with default options, stopping at the first error.
   *
   * @throws TranspilerException listing the errors when some construct has no translation
   */
  public static String toSource(List<? extends Node> program, boolean managedRuntime) {
    TranspilerOptions options = new TranspilerOptions();
    options.setManagedRuntime(managedRuntime);
    Transpiler transpiler = new Transpiler(options, new SortingErrorManager(ImmutableSet.of()));
    Result result = transpiler.transpile(program);
    if (!result.success) {
      throw new TranspilerException(result.errors);
    }
    return result.code;
  }
}
