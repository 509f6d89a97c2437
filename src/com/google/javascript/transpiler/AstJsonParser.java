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

import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.javascript.transpiler.ast.Argument;
import com.google.javascript.transpiler.ast.ArrayLiteralExpression;
import com.google.javascript.transpiler.ast.AsExpression;
import com.google.javascript.transpiler.ast.AssignmentExpression;
import com.google.javascript.transpiler.ast.AssignmentOperator;
import com.google.javascript.transpiler.ast.BinaryExpression;
import com.google.javascript.transpiler.ast.BinaryRangeExpression;
import com.google.javascript.transpiler.ast.BlankStatement;
import com.google.javascript.transpiler.ast.BlockStatement;
import com.google.javascript.transpiler.ast.BreakStatement;
import com.google.javascript.transpiler.ast.CallExpression;
import com.google.javascript.transpiler.ast.ClassDeclaration;
import com.google.javascript.transpiler.ast.ContinueStatement;
import com.google.javascript.transpiler.ast.DictionaryEntry;
import com.google.javascript.transpiler.ast.DictionaryLiteralExpression;
import com.google.javascript.transpiler.ast.DoCatchStatement;
import com.google.javascript.transpiler.ast.DoubleLiteralExpression;
import com.google.javascript.transpiler.ast.EnumDeclaration;
import com.google.javascript.transpiler.ast.Expression;
import com.google.javascript.transpiler.ast.ExpressionStatement;
import com.google.javascript.transpiler.ast.ForStatement;
import com.google.javascript.transpiler.ast.FunctionDeclaration;
import com.google.javascript.transpiler.ast.GetExpression;
import com.google.javascript.transpiler.ast.GroupingExpression;
import com.google.javascript.transpiler.ast.GuardLetStatement;
import com.google.javascript.transpiler.ast.GuardStatement;
import com.google.javascript.transpiler.ast.IfLetStatement;
import com.google.javascript.transpiler.ast.IfStatement;
import com.google.javascript.transpiler.ast.IndexExpression;
import com.google.javascript.transpiler.ast.IntLiteralExpression;
import com.google.javascript.transpiler.ast.IsExpression;
import com.google.javascript.transpiler.ast.LiteralExpression;
import com.google.javascript.transpiler.ast.LogicalExpression;
import com.google.javascript.transpiler.ast.Node;
import com.google.javascript.transpiler.ast.Operator;
import com.google.javascript.transpiler.ast.OptionalChainingExpression;
import com.google.javascript.transpiler.ast.Parameter;
import com.google.javascript.transpiler.ast.ProtocolDeclaration;
import com.google.javascript.transpiler.ast.RangeOperator;
import com.google.javascript.transpiler.ast.RepeatStatement;
import com.google.javascript.transpiler.ast.ReturnStatement;
import com.google.javascript.transpiler.ast.SelfExpression;
import com.google.javascript.transpiler.ast.SourcePosition;
import com.google.javascript.transpiler.ast.Statement;
import com.google.javascript.transpiler.ast.StringLiteralExpression;
import com.google.javascript.transpiler.ast.StructDeclaration;
import com.google.javascript.transpiler.ast.SwitchCase;
import com.google.javascript.transpiler.ast.SwitchStatement;
import com.google.javascript.transpiler.ast.TernaryExpression;
import com.google.javascript.transpiler.ast.ThrowStatement;
import com.google.javascript.transpiler.ast.TryExpression;
import com.google.javascript.transpiler.ast.TypeAliasDeclaration;
import com.google.javascript.transpiler.ast.TypeIdentifier;
import com.google.javascript.transpiler.ast.UnaryExpression;
import com.google.javascript.transpiler.ast.VariableDeclaration;
import com.google.javascript.transpiler.ast.VariableExpression;
import com.google.javascript.transpiler.ast.WhileStatement;
import org.jspecify.annotations.Nullable;

/**
 * Reads a program from its JSON interchange form.
 *
 * <p>The document is either an array of top-level nodes or an object {@code {"sourceName": ...,
 * "program": [...]}}. Every node is an object whose {@code "kind"} is the simple name of its AST
 * class, with optional {@code "line"} and {@code "column"} fields; the remaining fields are named
 * after the record components. Blocks are written as arrays of nodes.
 */
public final class AstJsonParser {

  private static final String KIND = "kind";

  private final String sourceName;

  private AstJsonParser(String sourceName) {
    this.sourceName = sourceName;
  }

  /**
   * Parses {@code contents}.
   *
   * @param sourceName the name recorded in node positions, unless the document names its own
   */
  public static ImmutableList<Node> parse(String contents, String sourceName)
      throws AstParseException {
    try {
      JsonElement root = new Gson().fromJson(contents, JsonElement.class);
      if (root == null) {
        throw new AstParseException("Empty AST document: " + sourceName);
      }
      if (root.isJsonArray()) {
        return new AstJsonParser(sourceName).nodes(root.getAsJsonArray());
      }
      JsonObject document = asObject(root, "document");
      String name =
          document.has("sourceName") ? document.get("sourceName").getAsString() : sourceName;
      return new AstJsonParser(name).nodes(array(document, "program"));
    } catch (JsonParseException
        | IllegalStateException
        | IllegalArgumentException
        | UnsupportedOperationException
        | NullPointerException ex) {
      // Gson reports a value of the wrong JSON type with an unchecked exception; the node
      // constructors reject structurally invalid nodes the same way.
      throw new AstParseException("Malformed AST in " + sourceName + ": " + ex.getMessage(), ex);
    }
  }

  private ImmutableList<Node> nodes(JsonArray array) throws AstParseException {
    ImmutableList.Builder<Node> builder = ImmutableList.builder();
    for (JsonElement element : array) {
      builder.add(node(asObject(element, "node")));
    }
    return builder.build();
  }

  private Node node(JsonObject object) throws AstParseException {
    String kind = string(object, KIND);
    SourcePosition pos = position(object);
    switch (kind) {
      case "VariableDeclaration":
        return new VariableDeclaration(
            string(object, "name"),
            optionalType(object, "type"),
            optionalExpression(object, "initializer"),
            flag(object, "isConstant"),
            flag(object, "isPrivate"),
            pos);
      case "StructDeclaration":
        return new StructDeclaration(
            string(object, "name"), strings(object, "inheritedTypes"), children(object, "members"),
            pos);
      case "ClassDeclaration":
        {
          ImmutableList.Builder<VariableDeclaration> properties = ImmutableList.builder();
          for (Node property : children(object, "properties")) {
            properties.add(cast(property, VariableDeclaration.class, "properties"));
          }
          ImmutableList.Builder<FunctionDeclaration> methods = ImmutableList.builder();
          for (Node method : children(object, "methods")) {
            methods.add(cast(method, FunctionDeclaration.class, "methods"));
          }
          return new ClassDeclaration(
              string(object, "name"),
              strings(object, "inheritedTypes"),
              properties.build(),
              methods.build(),
              pos);
        }
      case "FunctionDeclaration":
        return new FunctionDeclaration(
            string(object, "name"),
            parameters(object),
            optionalType(object, "returnType"),
            object.has("body") ? block(object, "body") : null,
            flag(object, "isStatic"),
            pos);
      case "EnumDeclaration":
        return new EnumDeclaration(string(object, "name"), strings(object, "cases"), pos);
      case "ProtocolDeclaration":
        return new ProtocolDeclaration(
            string(object, "name"), strings(object, "inheritedTypes"), children(object, "members"),
            pos);
      case "TypeAliasDeclaration":
        return new TypeAliasDeclaration(string(object, "name"), type(object.get("type")), pos);
      case "IfStatement":
        return new IfStatement(
            expression(object, "condition"),
            block(object, "thenBranch"),
            elseBranch(object),
            pos);
      case "IfLetStatement":
        return new IfLetStatement(
            string(object, "name"),
            optionalExpression(object, "value"),
            block(object, "thenBranch"),
            elseBranch(object),
            pos);
      case "GuardStatement":
        return new GuardStatement(expression(object, "condition"), block(object, "body"), pos);
      case "GuardLetStatement":
        return new GuardLetStatement(
            string(object, "name"), expression(object, "value"), block(object, "body"), pos);
      case "SwitchStatement":
        return new SwitchStatement(
            expression(object, "subject"),
            switchCases(object),
            object.has("defaultCase") ? children(object, "defaultCase") : null,
            pos);
      case "ForStatement":
        return new ForStatement(
            string(object, "variable"),
            expression(object, "iterable"),
            block(object, "body"),
            pos);
      case "WhileStatement":
        return new WhileStatement(expression(object, "condition"), block(object, "body"), pos);
      case "RepeatStatement":
        return new RepeatStatement(block(object, "body"), expression(object, "condition"), pos);
      case "ReturnStatement":
        return new ReturnStatement(optionalExpression(object, "value"), pos);
      case "BreakStatement":
        return new BreakStatement(pos);
      case "ContinueStatement":
        return new ContinueStatement(pos);
      case "BlankStatement":
        return new BlankStatement(pos);
      case "DoCatchStatement":
        return new DoCatchStatement(
            block(object, "body"),
            optionalString(object, "catchBinding"),
            block(object, "catchBody"),
            pos);
      case "ThrowStatement":
        return new ThrowStatement(expression(object, "value"), pos);
      case "BlockStatement":
        return new BlockStatement(children(object, "statements"), pos);
      case "ExpressionStatement":
        return new ExpressionStatement(expression(object, "expression"), pos);
      default:
        return expressionNode(kind, object, pos);
    }
  }

  private Expression expressionNode(String kind, JsonObject object, SourcePosition pos)
      throws AstParseException {
    switch (kind) {
      case "AssignmentExpression":
        return new AssignmentExpression(
            expression(object, "target"),
            assignmentOperator(object),
            expression(object, "value"),
            pos);
      case "TernaryExpression":
        return new TernaryExpression(
            expression(object, "condition"),
            expression(object, "thenValue"),
            expression(object, "elseValue"),
            pos);
      case "BinaryExpression":
        return new BinaryExpression(
            expression(object, "left"), operator(object), expression(object, "right"), pos);
      case "LogicalExpression":
        return new LogicalExpression(
            expression(object, "left"), operator(object), expression(object, "right"), pos);
      case "UnaryExpression":
        return new UnaryExpression(operator(object), expression(object, "operand"), pos);
      case "CallExpression":
        return new CallExpression(
            expression(object, "callee"), arguments(object), flag(object, "isInitializer"), pos);
      case "GetExpression":
        return new GetExpression(expression(object, "object"), string(object, "name"), pos);
      case "IndexExpression":
        return new IndexExpression(expression(object, "object"), expression(object, "index"), pos);
      case "OptionalChainingExpression":
        return new OptionalChainingExpression(
            expression(object, "object"), flag(object, "forceUnwrap"), pos);
      case "AsExpression":
        return new AsExpression(expression(object, "expression"), type(object.get("type")), pos);
      case "IsExpression":
        return new IsExpression(expression(object, "expression"), type(object.get("type")), pos);
      case "TryExpression":
        return new TryExpression(expression(object, "expression"), tryFlavor(object), pos);
      case "LiteralExpression":
        return new LiteralExpression(optionalString(object, "value"), pos);
      case "StringLiteralExpression":
        return new StringLiteralExpression(
            string(object, "value"), flag(object, "isMultiLine"), pos);
      case "IntLiteralExpression":
        return new IntLiteralExpression(string(object, "value"), pos);
      case "DoubleLiteralExpression":
        return new DoubleLiteralExpression(string(object, "value"), pos);
      case "SelfExpression":
        return new SelfExpression(pos);
      case "VariableExpression":
        return new VariableExpression(string(object, "name"), pos);
      case "GroupingExpression":
        return new GroupingExpression(expression(object, "expression"), pos);
      case "ArrayLiteralExpression":
        return new ArrayLiteralExpression(expressions(array(object, "elements")), pos);
      case "DictionaryLiteralExpression":
        {
          ImmutableList.Builder<DictionaryEntry> entries = ImmutableList.builder();
          for (JsonElement element : array(object, "entries")) {
            JsonObject entry = asObject(element, "entries");
            entries.add(new DictionaryEntry(expression(entry, "key"), expression(entry, "value")));
          }
          return new DictionaryLiteralExpression(entries.build(), pos);
        }
      case "BinaryRangeExpression":
        return new BinaryRangeExpression(
            expression(object, "lower"), rangeOperator(object), expression(object, "upper"), pos);
      default:
        throw new AstParseException("Unknown node kind " + kind + " at " + pos);
    }
  }

  private SourcePosition position(JsonObject object) {
    return SourcePosition.of(
        sourceName,
        object.has("line") ? object.get("line").getAsInt() : -1,
        object.has("column") ? object.get("column").getAsInt() : -1);
  }

  private @Nullable Statement elseBranch(JsonObject object) throws AstParseException {
    if (!object.has("elseBranch")) {
      return null;
    }
    JsonElement element = object.get("elseBranch");
    if (element.isJsonArray()) {
      return new BlockStatement(nodes(element.getAsJsonArray()), position(object));
    }
    return cast(node(asObject(element, "elseBranch")), Statement.class, "elseBranch");
  }

  /** A block, written either as an array of nodes or as a BlockStatement object. */
  private BlockStatement block(JsonObject object, String key) throws AstParseException {
    JsonElement element = required(object, key);
    if (element.isJsonArray()) {
      return new BlockStatement(nodes(element.getAsJsonArray()), position(object));
    }
    return cast(node(asObject(element, key)), BlockStatement.class, key);
  }

  private ImmutableList<Node> children(JsonObject object, String key) throws AstParseException {
    return object.has(key) ? nodes(array(object, key)) : ImmutableList.of();
  }

  private Expression expression(JsonObject object, String key) throws AstParseException {
    return cast(node(asObject(required(object, key), key)), Expression.class, key);
  }

  private @Nullable Expression optionalExpression(JsonObject object, String key)
      throws AstParseException {
    if (!object.has(key) || object.get(key).isJsonNull()) {
      return null;
    }
    return expression(object, key);
  }

  private ImmutableList<Expression> expressions(JsonArray array) throws AstParseException {
    ImmutableList.Builder<Expression> builder = ImmutableList.builder();
    for (JsonElement element : array) {
      builder.add(cast(node(asObject(element, "expression")), Expression.class, "expression"));
    }
    return builder.build();
  }

  private ImmutableList<Parameter> parameters(JsonObject object) throws AstParseException {
    ImmutableList.Builder<Parameter> builder = ImmutableList.builder();
    if (!object.has("parameters")) {
      return builder.build();
    }
    for (JsonElement element : array(object, "parameters")) {
      JsonObject parameter = asObject(element, "parameters");
      builder.add(
          new Parameter(
              string(parameter, "internalName"),
              optionalString(parameter, "externalName"),
              optionalExpression(parameter, "defaultValue"),
              flag(parameter, "isVariadic")));
    }
    return builder.build();
  }

  private ImmutableList<Argument> arguments(JsonObject object) throws AstParseException {
    ImmutableList.Builder<Argument> builder = ImmutableList.builder();
    if (!object.has("arguments")) {
      return builder.build();
    }
    for (JsonElement element : array(object, "arguments")) {
      JsonObject argument = asObject(element, "arguments");
      builder.add(
          new Argument(optionalString(argument, "label"), expression(argument, "value")));
    }
    return builder.build();
  }

  private ImmutableList<SwitchCase> switchCases(JsonObject object) throws AstParseException {
    ImmutableList.Builder<SwitchCase> builder = ImmutableList.builder();
    for (JsonElement element : array(object, "cases")) {
      JsonObject switchCase = asObject(element, "cases");
      builder.add(
          new SwitchCase(
              expressions(array(switchCase, "expressions")),
              children(switchCase, "statements")));
    }
    return builder.build();
  }

  private static @Nullable TypeIdentifier optionalType(JsonObject object, String key)
      throws AstParseException {
    if (!object.has(key) || object.get(key).isJsonNull()) {
      return null;
    }
    return type(object.get(key));
  }

  private static TypeIdentifier type(@Nullable JsonElement element) throws AstParseException {
    if (element == null || element.isJsonNull()) {
      throw new AstParseException("Missing type");
    }
    if (element.isJsonPrimitive()) {
      return TypeIdentifier.named(element.getAsString());
    }
    JsonObject object = asObject(element, "type");
    if (object.has("array")) {
      return TypeIdentifier.arrayOf(type(object.get("array")));
    }
    if (object.has("optional")) {
      return TypeIdentifier.optionalOf(type(object.get("optional")));
    }
    if (object.has("dictionary")) {
      JsonObject dictionary = asObject(object.get("dictionary"), "dictionary");
      return TypeIdentifier.dictionaryOf(type(dictionary.get("key")), type(dictionary.get("value")));
    }
    throw new AstParseException("Unrecognized type " + object);
  }

  private static Operator operator(JsonObject object) throws AstParseException {
    String value = string(object, "operator");
    Operator op = Operator.fromSymbol(value);
    if (op == null) {
      op = enumValue(Operator.class, value);
    }
    return op;
  }

  private static AssignmentOperator assignmentOperator(JsonObject object)
      throws AstParseException {
    if (!object.has("operator")) {
      return AssignmentOperator.ASSIGN;
    }
    String value = string(object, "operator");
    AssignmentOperator op = AssignmentOperator.fromSymbol(value);
    return op != null ? op : enumValue(AssignmentOperator.class, value);
  }

  private static RangeOperator rangeOperator(JsonObject object) throws AstParseException {
    String value = string(object, "operator");
    RangeOperator op = RangeOperator.fromSymbol(value);
    return op != null ? op : enumValue(RangeOperator.class, value);
  }

  private static TryExpression.Flavor tryFlavor(JsonObject object) throws AstParseException {
    if (!object.has("mode")) {
      return TryExpression.Flavor.PLAIN;
    }
    String mode = string(object, "mode");
    switch (mode) {
      case "try":
        return TryExpression.Flavor.PLAIN;
      case "try?":
        return TryExpression.Flavor.OPTIONAL;
      case "try!":
        return TryExpression.Flavor.FORCED;
      default:
        return enumValue(TryExpression.Flavor.class, mode);
    }
  }

  private static <E extends Enum<E>> E enumValue(Class<E> type, String value)
      throws AstParseException {
    try {
      return Enum.valueOf(type, value);
    } catch (IllegalArgumentException e) {
      throw new AstParseException("Unknown " + type.getSimpleName() + " " + value, e);
    }
  }

  private static <T> T cast(Node node, Class<T> type, String key) throws AstParseException {
    if (!type.isInstance(node)) {
      throw new AstParseException(
          "Expected " + type.getSimpleName() + " for " + key + ", found " + node.kind());
    }
    return type.cast(node);
  }

  private static JsonElement required(JsonObject object, String key) throws AstParseException {
    JsonElement element = object.get(key);
    if (element == null || element.isJsonNull()) {
      throw new AstParseException("Missing field " + key + " in " + object.get(KIND));
    }
    return element;
  }

  private static JsonObject asObject(JsonElement element, String key) throws AstParseException {
    if (!element.isJsonObject()) {
      throw new AstParseException("Expected an object for " + key + ", found " + element);
    }
    return element.getAsJsonObject();
  }

  private static JsonArray array(JsonObject object, String key) throws AstParseException {
    JsonElement element = required(object, key);
    if (!element.isJsonArray()) {
      throw new AstParseException("Expected an array for " + key + ", found " + element);
    }
    return element.getAsJsonArray();
  }

  private static String string(JsonObject object, String key) throws AstParseException {
    return required(object, key).getAsString();
  }

  private static @Nullable String optionalString(JsonObject object, String key) {
    return object.has(key) && !object.get(key).isJsonNull() ? object.get(key).getAsString() : null;
  }

  private static boolean flag(JsonObject object, String key) {
    return object.has(key) && object.get(key).getAsBoolean();
  }

  private static ImmutableList<String> strings(JsonObject object, String key)
      throws AstParseException {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    if (object.has(key)) {
      for (JsonElement element : array(object, key)) {
        builder.add(element.getAsString());
      }
    }
    return builder.build();
  }
}
