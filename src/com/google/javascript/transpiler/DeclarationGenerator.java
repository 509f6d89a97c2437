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
import com.google.javascript.transpiler.ast.BlockStatement;
import com.google.javascript.transpiler.ast.ClassDeclaration;
import com.google.javascript.transpiler.ast.Declaration;
import com.google.javascript.transpiler.ast.DeclarationVisitor;
import com.google.javascript.transpiler.ast.EnumDeclaration;
import com.google.javascript.transpiler.ast.FunctionDeclaration;
import com.google.javascript.transpiler.ast.Node;
import com.google.javascript.transpiler.ast.Parameter;
import com.google.javascript.transpiler.ast.ProtocolDeclaration;
import com.google.javascript.transpiler.ast.StructDeclaration;
import com.google.javascript.transpiler.ast.TypeAliasDeclaration;
import com.google.javascript.transpiler.ast.VariableDeclaration;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Prints declarations. Types become classes; functions receive their arguments as one {@code
 * params} object and destructure it on entry.
 */
final class DeclarationGenerator implements DeclarationVisitor<Void, DeclarationGenerator.Scope> {

  /** Where a declaration appears. */
  enum Scope {
    /** Top level or inside a block. */
    STATEMENT,
    /** Inside a struct, class or protocol body. */
    MEMBER
  }

  static final String PARAMS = "params";

  private static final Joiner COMMA_JOINER = Joiner.on(", ");

  private final CodePrinter cp;
  private final StatementGenerator statements;
  private final ExpressionGenerator expressions;
  private final BindingStrategy bindings;
  private final TempNameSupplier temps;
  private final ErrorHandler errorHandler;

  DeclarationGenerator(
      CodePrinter cp,
      StatementGenerator statements,
      ExpressionGenerator expressions,
      BindingStrategy bindings,
      TempNameSupplier temps,
      ErrorHandler errorHandler) {
    this.cp = cp;
    this.statements = statements;
    this.expressions = expressions;
    this.bindings = bindings;
    this.temps = temps;
    this.errorHandler = errorHandler;
  }

  void generate(Declaration declaration, Scope scope) {
    declaration.accept(this, scope);
  }

  @Override
  public Void visitVariable(VariableDeclaration d, Scope scope) {
    String keyword;
    if (scope == Scope.MEMBER) {
      keyword = "";
    } else {
      keyword = d.isConstant() && d.hasInitializer() ? "const" : "let";
    }
    String initializer = d.hasInitializer() ? expressions.generate(d.initializer()) : null;
    bindings.declareVariable(
        cp,
        keyword,
        IdentifierSanitizer.sanitize(d.name()),
        TypeMapper.toTypeString(d.type()),
        initializer,
        d);
    return null;
  }

  @Override
  public Void visitStruct(StructDeclaration d, Scope scope) {
    if (!d.inheritedTypes().isEmpty()) {
      report(
          TranspilerError.make(
              d,
              TranspilerErrors.STRUCT_CONFORMANCE_DROPPED,
              d.name(),
              COMMA_JOINER.join(d.inheritedTypes())));
    }
    openType(d.name(), null, scope);
    boolean synthesizeConstructor = !d.declaresInitializer();
    if (synthesizeConstructor) {
      cp.add("constructor(" + PARAMS + " = {})");
      cp.beginBlock();
      cp.addLine("Object.assign(this, " + PARAMS + ");");
      cp.endBlock();
      cp.endLine();
    }
    generateMembers(d.members(), synthesizeConstructor);
    closeType(scope);
    return null;
  }

  @Override
  public Void visitClass(ClassDeclaration d, Scope scope) {
    openType(d.name(), d.superclass(), scope);
    List<Node> members = new ArrayList<>(d.properties());
    members.addAll(d.methods());
    generateMembers(members, false);
    closeType(scope);
    return null;
  }

  /** A protocol has no runtime counterpart, so it becomes a class its requirements throw from. */
  @Override
  public Void visitProtocol(ProtocolDeclaration d, Scope scope) {
    openType(d.name(), null, scope);
    generateMembers(d.members(), false);
    closeType(scope);
    return null;
  }

  private void openType(String name, @Nullable String superclass, Scope scope) {
    String sanitized = IdentifierSanitizer.sanitize(name);
    if (scope == Scope.MEMBER) {
      cp.add("static " + sanitized + " = ");
    }
    cp.add("class " + sanitized);
    if (superclass != null) {
      cp.add(" extends " + IdentifierSanitizer.sanitize(superclass));
    }
    cp.beginBlock();
  }

  private void closeType(Scope scope) {
    cp.endBlock();
    if (scope == Scope.MEMBER) {
      cp.add(";");
    }
    cp.endLine();
  }

  /**
   * Stored properties sit on consecutive lines; every other pair of members is spaced. A member
   * left out after an error takes its spacing with it.
   */
  private void generateMembers(List<? extends Node> members, boolean afterConstructor) {
    Node previous = null;
    for (Node member : members) {
      boolean spaced =
          previous == null
              ? afterConstructor
              : !(previous instanceof VariableDeclaration && member instanceof VariableDeclaration);
      CodePrinter.Mark beforeSpacing = cp.mark();
      if (spaced) {
        cp.emptyLine();
      }
      int start = cp.mark().length();
      statements.generateChild(member, true);
      if (cp.mark().length() == start) {
        cp.rollback(beforeSpacing);
      } else {
        previous = member;
      }
    }
  }

  @Override
  public Void visitFunction(FunctionDeclaration d, Scope scope) {
    String name =
        d.isInitializer() ? "constructor" : IdentifierSanitizer.sanitize(d.name());
    String signature = name + (d.parameters().isEmpty() ? "()" : "(" + PARAMS + " = {})");
    if (scope == Scope.MEMBER) {
      cp.add((d.isStatic() ? "static " : "") + signature);
      generateFunctionBody(d);
      cp.endLine();
    } else {
      bindings.declareFunction(
          cp,
          name,
          () -> {
            cp.add("function " + signature);
            generateFunctionBody(d);
          });
    }
    return null;
  }

  private void generateFunctionBody(FunctionDeclaration d) {
    cp.beginBlock();
    generateParameters(d.parameters());
    BlockStatement body = d.body();
    if (body == null) {
      cp.addLine(
          "throw new Error(\"Protocol requirement " + d.name() + " is not implemented\");");
    } else {
      statements.generateBlock(body);
    }
    cp.endBlock();
  }

  /**
   * Destructures the {@code params} object: each parameter is keyed by its call-site label, or by
   * {@code _<position>} when callers pass it without one.
   */
  private void generateParameters(List<Parameter> parameters) {
    List<String> entries = new ArrayList<>();
    ImmutableList.Builder<Rebinding> rebindings = ImmutableList.builder();
    int lastPositional = 0;
    Parameter variadic = null;
    for (int i = 0; i < parameters.size(); i++) {
      Parameter parameter = parameters.get(i);
      if (parameter.isVariadic()) {
        variadic = parameter;
        continue;
      }
      String key;
      if (parameter.isPositional()) {
        key = ExpressionGenerator.positionalKey(i + 1);
        lastPositional = i + 1;
      } else {
        key = IdentifierSanitizer.sanitize(parameter.label());
      }
      String name = IdentifierSanitizer.sanitize(parameter.internalName());
      String raw = bindings.rawName(name, temps);
      String entry = key.equals(raw) ? raw : key + ": " + raw;
      if (parameter.defaultValue() != null) {
        entry += " = " + expressions.generate(parameter.defaultValue());
      }
      entries.add(entry);
      rebindings.add(new Rebinding(name, raw));
    }
    if (!entries.isEmpty()) {
      cp.addLine("const { " + COMMA_JOINER.join(entries) + " } = " + PARAMS + ";");
    }
    if (variadic != null) {
      String name = IdentifierSanitizer.sanitize(variadic.internalName());
      String raw = bindings.rawName(name, temps);
      generateVariadic(raw, lastPositional);
      if (!variadic.isPositional()) {
        String label = IdentifierSanitizer.sanitize(variadic.label());
        cp.add("if (" + PARAMS + "." + label + " !== undefined)");
        cp.beginBlock();
        cp.addLine(raw + ".unshift(" + PARAMS + "." + label + ");");
        cp.endBlock();
        cp.endLine();
      }
      rebindings.add(new Rebinding(name, raw));
    }
    for (Rebinding rebinding : rebindings.build()) {
      bindings.bindRaw(cp, rebinding.name(), rebinding.raw());
    }
  }

  private record Rebinding(String name, String raw) {}

  /**
   * Collects the unlabelled arguments after position {@code lastPositional} into an array, in
   * call order.
   */
  private void generateVariadic(String raw, int lastPositional) {
    cp.addLine("const " + raw + " = Object.entries(" + PARAMS + ")");
    cp.indent();
    cp.addLine(".filter(([key]) => /^_\\d+$/.test(key))");
    cp.addLine(".map(([key, value]) => ({ position: Number(key.slice(1)), value }))");
    cp.addLine(".filter(({ position }) => position > " + lastPositional + ")");
    cp.addLine(".sort((a, b) => a.position - b.position)");
    cp.addLine(".map(({ value }) => value);");
    cp.unindent();
  }

  @Override
  public Void visitEnum(EnumDeclaration d, Scope scope) {
    String prefix = scope == Scope.MEMBER ? "static " : "const ";
    bindings.declareEnum(
        cp,
        prefix,
        IdentifierSanitizer.sanitize(d.name()),
        () -> {
          cp.add("Object.freeze(");
          if (d.cases().isEmpty()) {
            cp.add("{})");
            return;
          }
          cp.beginBlock();
          List<String> cases = d.cases();
          for (int i = 0; i < cases.size(); i++) {
            cp.addLine(
                cases.get(i) + ": \"" + cases.get(i) + "\"" + (i < cases.size() - 1 ? "," : ""));
          }
          cp.endBlock();
          cp.add(")");
        });
    return null;
  }

  /** Aliases survive only as a string describing the aliased type. */
  @Override
  public Void visitTypeAlias(TypeAliasDeclaration d, Scope scope) {
    String prefix = scope == Scope.MEMBER ? "static " : "const ";
    cp.addLine(
        prefix
            + IdentifierSanitizer.sanitize(d.name())
            + " = \""
            + TypeMapper.toTypeString(d.type())
            + "\";");
    return null;
  }

  private void report(TranspilerError error) {
    errorHandler.report(error.defaultLevel(), error);
  }
}
