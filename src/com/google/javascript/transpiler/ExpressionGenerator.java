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
import com.google.javascript.transpiler.ast.Argument;
import com.google.javascript.transpiler.ast.ArrayLiteralExpression;
import com.google.javascript.transpiler.ast.AsExpression;
import com.google.javascript.transpiler.ast.AssignmentExpression;
import com.google.javascript.transpiler.ast.BinaryExpression;
import com.google.javascript.transpiler.ast.BinaryRangeExpression;
import com.google.javascript.transpiler.ast.CallExpression;
import com.google.javascript.transpiler.ast.DictionaryEntry;
import com.google.javascript.transpiler.ast.DictionaryLiteralExpression;
import com.google.javascript.transpiler.ast.DoubleLiteralExpression;
import com.google.javascript.transpiler.ast.Expression;
import com.google.javascript.transpiler.ast.ExpressionVisitor;
import com.google.javascript.transpiler.ast.GetExpression;
import com.google.javascript.transpiler.ast.GroupingExpression;
import com.google.javascript.transpiler.ast.IndexExpression;
import com.google.javascript.transpiler.ast.IntLiteralExpression;
import com.google.javascript.transpiler.ast.IsExpression;
import com.google.javascript.transpiler.ast.LiteralExpression;
import com.google.javascript.transpiler.ast.LogicalExpression;
import com.google.javascript.transpiler.ast.OptionalChainingExpression;
import com.google.javascript.transpiler.ast.RangeOperator;
import com.google.javascript.transpiler.ast.SelfExpression;
import com.google.javascript.transpiler.ast.StringLiteralExpression;
import com.google.javascript.transpiler.ast.TernaryExpression;
import com.google.javascript.transpiler.ast.TryExpression;
import com.google.javascript.transpiler.ast.UnaryExpression;
import com.google.javascript.transpiler.ast.VariableExpression;
import java.util.ArrayList;
import java.util.List;

/**
 * Translates expressions to JavaScript source text. Expressions contain no statements, so unlike
 * the statement and declaration generators this one returns strings instead of printing.
 */
final class ExpressionGenerator implements ExpressionVisitor<String> {

  private static final Joiner COMMA_JOINER = Joiner.on(", ");

  private final BindingStrategy bindings;
  private final ErrorHandler errorHandler;

  ExpressionGenerator(BindingStrategy bindings, ErrorHandler errorHandler) {
    this.bindings = bindings;
    this.errorHandler = errorHandler;
  }

  String generate(Expression expression) {
    return expression.accept(this);
  }

  @Override
  public String visitAssignment(AssignmentExpression e) {
    return generate(e.target())
        + " "
        + OperatorMapper.assignmentOpToStr(e.operator())
        + " "
        + generate(e.value());
  }

  @Override
  public String visitTernary(TernaryExpression e) {
    return generate(e.condition())
        + " ? "
        + generate(e.thenValue())
        + " : "
        + generate(e.elseValue());
  }

  @Override
  public String visitBinary(BinaryExpression e) {
    String op = OperatorMapper.binaryOpToStr(e.operator());
    if (op == null) {
      throw UnsupportedNodeException.forOperator(e, e.operator(), "binary");
    }
    return generate(e.left()) + " " + op + " " + generate(e.right());
  }

  @Override
  public String visitLogical(LogicalExpression e) {
    String op = OperatorMapper.logicalOpToStr(e.operator());
    if (op == null) {
      throw UnsupportedNodeException.forOperator(e, e.operator(), "logical");
    }
    return generate(e.left()) + " " + op + " " + generate(e.right());
  }

  @Override
  public String visitUnary(UnaryExpression e) {
    String op = OperatorMapper.unaryOpToStr(e.operator());
    if (op == null) {
      throw UnsupportedNodeException.forOperator(e, e.operator(), "unary");
    }
    return op + generate(e.operand());
  }

  @Override
  public String visitCall(CallExpression e) {
    String arguments = generateArguments(e.arguments());
    if (e.isInitializer()) {
      // Types are plain classes in both modes, so the callee is never read through an accessor.
      String callee =
          e.callee() instanceof VariableExpression
              ? IdentifierSanitizer.sanitize(((VariableExpression) e.callee()).name())
              : generate(e.callee());
      return "(new " + callee + "(" + arguments + "))";
    }
    return receiver(e.callee()) + (isOptionalChain(e.callee()) ? "?.(" : "(") + arguments + ")";
  }

  /**
   * Arguments travel as one object: labelled arguments under their sanitized label, unlabelled ones under
   * {@code _<position>}, counting from 1 across all arguments.
   */
  private String generateArguments(List<Argument> arguments) {
    if (arguments.isEmpty()) {
      return "";
    }
    List<String> entries = new ArrayList<>(arguments.size());
    for (int i = 0; i < arguments.size(); i++) {
      Argument argument = arguments.get(i);
      String key =
          argument.isPositional()
              ? positionalKey(i + 1)
              : IdentifierSanitizer.sanitize(argument.label());
      entries.add(key + ": " + generate(argument.value()));
    }
    return "{ " + COMMA_JOINER.join(entries) + " }";
  }

  static String positionalKey(int position) {
    return "_" + position;
  }

  @Override
  public String visitGet(GetExpression e) {
    return receiver(e.object())
        + (isOptionalChain(e.object()) ? "?." : ".")
        + IdentifierSanitizer.sanitize(e.name());
  }

  @Override
  public String visitIndex(IndexExpression e) {
    boolean chained = isOptionalChain(e.object());
    String object = receiver(e.object());
    if (e.index() instanceof BinaryRangeExpression) {
      BinaryRangeExpression range = (BinaryRangeExpression) e.index();
      String upper = generate(range.upper());
      if (range.operator() == RangeOperator.CLOSED) {
        upper += " + 1";
      }
      return object
          + (chained ? "?." : ".")
          + "slice("
          + generate(range.lower())
          + ", "
          + upper
          + ")";
    }
    return object + (chained ? "?.[" : "[") + generate(e.index()) + "]";
  }

  /**
   * A standalone optional. When it is the object of a member access, subscript or call, those
   * render the {@code ?.} themselves.
   */
  @Override
  public String visitOptionalChaining(OptionalChainingExpression e) {
    return generate(e.object());
  }

  private static boolean isOptionalChain(Expression e) {
    return e instanceof OptionalChainingExpression
        && !((OptionalChainingExpression) e).forceUnwrap();
  }

  /** The object of an access, with a trailing optional-chain marker removed. */
  private String receiver(Expression object) {
    return isOptionalChain(object)
        ? generate(((OptionalChainingExpression) object).object())
        : generate(object);
  }

  @Override
  public String visitAs(AsExpression e) {
    return generate(e.expression());
  }

  @Override
  public String visitIs(IsExpression e) {
    String type = TypeMapper.toTypeString(e.type());
    TranspilerError warning =
        TranspilerError.make(e, TranspilerErrors.UNCHECKED_TYPE_TEST, type);
    errorHandler.report(warning.defaultLevel(), warning);
    return "/* unchecked type test: " + generate(e.expression()) + " is " + type + " */ true";
  }

  @Override
  public String visitTry(TryExpression e) {
    String expression = generate(e.expression());
    switch (e.flavor()) {
      case PLAIN:
        return expression;
      case OPTIONAL:
        return "tryOptional(() => " + expression + ")";
      case FORCED:
        return "tryForce(() => " + expression + ")";
    }
    throw new IllegalStateException("Unexpected try flavor: " + e.flavor());
  }

  @Override
  public String visitLiteral(LiteralExpression e) {
    String value = e.value();
    return value == null || value.equals("nil") ? "null" : value;
  }

  @Override
  public String visitStringLiteral(StringLiteralExpression e) {
    if (e.isMultiLine()) {
      return "`" + e.value().replace("`", "\\`").replace("${", "\\${") + "`";
    }
    return "\"" + e.value() + "\"";
  }

  @Override
  public String visitIntLiteral(IntLiteralExpression e) {
    return e.value();
  }

  @Override
  public String visitDoubleLiteral(DoubleLiteralExpression e) {
    return e.value();
  }

  @Override
  public String visitSelf(SelfExpression e) {
    return "this";
  }

  @Override
  public String visitVariable(VariableExpression e) {
    return bindings.reference(IdentifierSanitizer.sanitize(e.name()));
  }

  @Override
  public String visitGrouping(GroupingExpression e) {
    return "(" + generate(e.expression()) + ")";
  }

  @Override
  public String visitArrayLiteral(ArrayLiteralExpression e) {
    List<String> elements = new ArrayList<>(e.elements().size());
    for (Expression element : e.elements()) {
      elements.add(generate(element));
    }
    return "[" + COMMA_JOINER.join(elements) + "]";
  }

  @Override
  public String visitDictionaryLiteral(DictionaryLiteralExpression e) {
    if (e.entries().isEmpty()) {
      return "({})";
    }
    List<String> entries = new ArrayList<>(e.entries().size());
    for (DictionaryEntry entry : e.entries()) {
      entries.add(generateKey(entry.key()) + ": " + generate(entry.value()));
    }
    return "({ " + COMMA_JOINER.join(entries) + " })";
  }

  /** Literal keys are written as is; any other key is computed. */
  private String generateKey(Expression key) {
    boolean literal =
        (key instanceof StringLiteralExpression && !((StringLiteralExpression) key).isMultiLine())
            || key instanceof IntLiteralExpression
            || key instanceof DoubleLiteralExpression;
    return literal ? generate(key) : "[" + generate(key) + "]";
  }

  @Override
  public String visitBinaryRange(BinaryRangeExpression e) {
    // Ranges only translate as a for-in iterable or a subscript, which handle them directly.
    throw UnsupportedNodeException.forNode(e, "expression");
  }
}
