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

import com.google.javascript.transpiler.DeclarationGenerator.Scope;
import com.google.javascript.transpiler.ast.BinaryRangeExpression;
import com.google.javascript.transpiler.ast.BlankStatement;
import com.google.javascript.transpiler.ast.BlockStatement;
import com.google.javascript.transpiler.ast.BreakStatement;
import com.google.javascript.transpiler.ast.ContinueStatement;
import com.google.javascript.transpiler.ast.Declaration;
import com.google.javascript.transpiler.ast.DoCatchStatement;
import com.google.javascript.transpiler.ast.Expression;
import com.google.javascript.transpiler.ast.ExpressionStatement;
import com.google.javascript.transpiler.ast.ForStatement;
import com.google.javascript.transpiler.ast.GuardLetStatement;
import com.google.javascript.transpiler.ast.GuardStatement;
import com.google.javascript.transpiler.ast.IfLetStatement;
import com.google.javascript.transpiler.ast.IfStatement;
import com.google.javascript.transpiler.ast.Node;
import com.google.javascript.transpiler.ast.RangeOperator;
import com.google.javascript.transpiler.ast.RepeatStatement;
import com.google.javascript.transpiler.ast.ReturnStatement;
import com.google.javascript.transpiler.ast.Statement;
import com.google.javascript.transpiler.ast.StatementVisitor;
import com.google.javascript.transpiler.ast.SwitchCase;
import com.google.javascript.transpiler.ast.SwitchStatement;
import com.google.javascript.transpiler.ast.ThrowStatement;
import com.google.javascript.transpiler.ast.WhileStatement;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Prints statements and dispatches every node that appears in statement or member position.
 *
 * <p>Each child statement or member is generated under a {@link CodePrinter.Mark}. When the child
 * contains a construct without a translation and the options allow continuing, whatever the child
 * printed is rolled back, the error is reported, and generation moves on to the next sibling.
 * Otherwise the {@link UnsupportedNodeException} propagates to the {@link Transpiler}.
 *
 * <p>One instance generates one top-level node.
 */
final class StatementGenerator implements StatementVisitor<Void> {

  private final CodePrinter cp;
  private final BindingStrategy bindings;
  private final ExpressionGenerator expressions;
  private final DeclarationGenerator declarations;
  private final TempNameSupplier temps = new TempNameSupplier();
  private final ErrorHandler errorHandler;
  private final boolean continueAfterErrors;

  StatementGenerator(
      CodePrinter cp,
      BindingStrategy bindings,
      TranspilerOptions options,
      ErrorHandler errorHandler) {
    this.cp = cp;
    this.bindings = bindings;
    this.errorHandler = errorHandler;
    this.continueAfterErrors = options.canContinueAfterErrors();
    this.expressions = new ExpressionGenerator(bindings, errorHandler);
    this.declarations =
        new DeclarationGenerator(cp, this, expressions, bindings, temps, errorHandler);
  }

  /**
   * Prints {@code n} as a statement, or as a class member when {@code member} is set, recovering
   * from an unsupported construct inside it if the options allow.
   */
  void generateChild(Node n, boolean member) {
    CodePrinter.Mark mark = cp.mark();
    try {
      generate(n, member);
    } catch (UnsupportedNodeException e) {
      if (!continueAfterErrors) {
        throw e;
      }
      cp.rollback(mark);
      TranspilerError error = e.getError();
      errorHandler.report(error.defaultLevel(), error);
    }
  }

  private void generate(Node n, boolean member) {
    if (n instanceof Declaration) {
      declarations.generate((Declaration) n, member ? Scope.MEMBER : Scope.STATEMENT);
    } else if (n instanceof Statement && !member) {
      ((Statement) n).accept(this);
    } else {
      // An expression must be wrapped in an ExpressionStatement; a class body holds no statements.
      throw UnsupportedNodeException.forNode(n, member ? "member" : "statement");
    }
  }

  void generateStatements(List<Node> statements) {
    for (Node statement : statements) {
      generateChild(statement, false);
    }
  }

  void generateBlock(BlockStatement block) {
    generateStatements(block.statements());
  }

  /** Prints {@code " {", block, "}"} on the current line. */
  private void generateBracedBlock(BlockStatement block) {
    cp.beginBlock();
    generateBlock(block);
    cp.endBlock();
  }

  @Override
  public Void visitIf(IfStatement s) {
    cp.add("if (" + expressions.generate(s.condition()) + ")");
    generateBracedBlock(s.thenBranch());
    generateElse(s.elseBranch());
    cp.endLine();
    return null;
  }

  private void generateElse(@Nullable Statement elseBranch) {
    if (elseBranch == null) {
      return;
    }
    if (elseBranch instanceof IfStatement) {
      cp.add(" else ");
      elseBranch.accept(this);
      return;
    }
    cp.add(" else");
    cp.beginBlock();
    if (elseBranch instanceof BlockStatement) {
      generateBlock((BlockStatement) elseBranch);
    } else {
      generateChild(elseBranch, false);
    }
    cp.endBlock();
  }

  /**
   * The unwrapped value is evaluated once, into a temporary that is tested and then bound inside
   * the branch. Unwrapping a variable into a binding of the same name tests the variable in place.
   */
  @Override
  public Void visitIfLet(IfLetStatement s) {
    String name = IdentifierSanitizer.sanitize(s.name());
    if (s.isSelfBinding()) {
      cp.add("if (!isUndefinedOrNull(" + name + "))");
      generateBracedBlock(s.thenBranch());
    } else {
      String temp = temps.next(name);
      cp.addLine(
          "const " + temp + " = " + bindings.wrap(expressions.generate(s.value())) + ";");
      cp.add("if (!isUndefinedOrNull(" + temp + "))");
      cp.beginBlock();
      cp.addLine("const " + name + " = " + temp + ";");
      generateBlock(s.thenBranch());
      cp.endBlock();
    }
    generateElse(s.elseBranch());
    cp.endLine();
    return null;
  }

  @Override
  public Void visitGuard(GuardStatement s) {
    cp.add("if (!(" + expressions.generate(s.condition()) + "))");
    generateBracedBlock(s.body());
    cp.endLine();
    return null;
  }

  /** Like if-let, but the binding follows the guard and the failure branch returns. */
  @Override
  public Void visitGuardLet(GuardLetStatement s) {
    String name = IdentifierSanitizer.sanitize(s.name());
    String tested = name;
    if (!s.isSelfBinding()) {
      tested = temps.next(name);
      cp.addLine(
          "const " + tested + " = " + bindings.wrap(expressions.generate(s.value())) + ";");
    }
    cp.add("if (isUndefinedOrNull(" + tested + "))");
    cp.beginBlock();
    generateBlock(s.body());
    cp.addLine("return;");
    cp.endBlock();
    cp.endLine();
    if (!s.isSelfBinding()) {
      cp.addLine("const " + name + " = " + tested + ";");
    }
    return null;
  }

  @Override
  public Void visitSwitch(SwitchStatement s) {
    cp.add("switch (" + expressions.generate(s.subject()) + ")");
    cp.beginBlock();
    for (SwitchCase switchCase : s.cases()) {
      List<Expression> patterns = switchCase.expressions();
      for (int i = 0; i < patterns.size(); i++) {
        cp.add("case " + expressions.generate(patterns.get(i)) + ":");
        if (i < patterns.size() - 1) {
          cp.endLine();
        }
      }
      cp.beginBlock();
      generateStatements(switchCase.statements());
      cp.addLine("break;");
      cp.endBlock();
      cp.endLine();
    }
    if (s.defaultCase() != null) {
      cp.add("default:");
      cp.beginBlock();
      generateStatements(s.defaultCase());
      cp.endBlock();
      cp.endLine();
    }
    cp.endBlock();
    cp.endLine();
    return null;
  }

  @Override
  public Void visitFor(ForStatement s) {
    String variable = IdentifierSanitizer.sanitize(s.variable());
    String counter = bindings.rawName(variable, temps);
    if (s.iterable() instanceof BinaryRangeExpression) {
      BinaryRangeExpression range = (BinaryRangeExpression) s.iterable();
      String comparison = range.operator() == RangeOperator.CLOSED ? " <= " : " < ";
      cp.add(
          "for (let "
              + counter
              + " = "
              + expressions.generate(range.lower())
              + "; "
              + counter
              + comparison
              + expressions.generate(range.upper())
              + "; "
              + counter
              + "++)");
    } else {
      cp.add("for (const " + counter + " of " + expressions.generate(s.iterable()) + ")");
    }
    cp.beginBlock();
    bindings.bindRaw(cp, variable, counter);
    generateBlock(s.body());
    cp.endBlock();
    cp.endLine();
    return null;
  }

  @Override
  public Void visitWhile(WhileStatement s) {
    cp.add("while (" + expressions.generate(s.condition()) + ")");
    generateBracedBlock(s.body());
    cp.endLine();
    return null;
  }

  @Override
  public Void visitRepeat(RepeatStatement s) {
    cp.add("do");
    generateBracedBlock(s.body());
    cp.add(" while (" + expressions.generate(s.condition()) + ");");
    cp.endLine();
    return null;
  }

  @Override
  public Void visitReturn(ReturnStatement s) {
    if (s.value() == null) {
      cp.addLine("return;");
    } else {
      cp.addLine("return " + expressions.generate(s.value()) + ";");
    }
    return null;
  }

  @Override
  public Void visitBreak(BreakStatement s) {
    cp.addLine("break;");
    return null;
  }

  @Override
  public Void visitContinue(ContinueStatement s) {
    cp.addLine("continue;");
    return null;
  }

  @Override
  public Void visitBlank(BlankStatement s) {
    return null;
  }

  @Override
  public Void visitDoCatch(DoCatchStatement s) {
    String error = DoCatchStatement.IMPLICIT_ERROR_NAME;
    if (s.catchBinding() != null && !s.catchBinding().equals(error)) {
      TranspilerError warning =
          TranspilerError.make(s, TranspilerErrors.CATCH_BINDING_IGNORED, s.catchBinding(), error);
      errorHandler.report(warning.defaultLevel(), warning);
    }
    cp.add("try");
    generateBracedBlock(s.body());
    String caught = bindings.rawName(error, temps);
    cp.add(" catch (" + caught + ")");
    cp.beginBlock();
    bindings.bindRaw(cp, error, caught);
    generateBlock(s.catchBody());
    cp.endBlock();
    cp.endLine();
    return null;
  }

  @Override
  public Void visitThrow(ThrowStatement s) {
    cp.addLine("throw " + expressions.generate(s.value()) + ";");
    return null;
  }

  /** A nested block adds no braces of its own. */
  @Override
  public Void visitBlock(BlockStatement s) {
    generateBlock(s);
    return null;
  }

  @Override
  public Void visitExpression(ExpressionStatement s) {
    cp.addLine(expressions.generate(s.expression()) + ";");
    return null;
  }
}
