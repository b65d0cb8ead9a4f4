/*
 * Copyright 2026 The Blink Authors
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

package org.blinklang.compiler;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.List;
import org.blinklang.compiler.Ast.AssignOp;
import org.blinklang.compiler.Ast.BinaryOp;
import org.blinklang.compiler.Ast.Block;
import org.blinklang.compiler.Ast.BoundFunctionDef;
import org.blinklang.compiler.Ast.ComponentInit;
import org.blinklang.compiler.Ast.Expr;
import org.blinklang.compiler.Ast.FieldDef;
import org.blinklang.compiler.Ast.FieldInit;
import org.blinklang.compiler.Ast.Item;
import org.blinklang.compiler.Ast.LiteralKind;
import org.blinklang.compiler.Ast.Param;
import org.blinklang.compiler.Ast.Statement;
import org.blinklang.compiler.Ast.TypeExpr;
import org.blinklang.compiler.Ast.TypeKind;
import org.blinklang.compiler.Ast.UnaryOp;
import org.jspecify.annotations.Nullable;

/**
 * A recursive-descent parser for BRL, BCL and BDL (the three languages share one grammar).
 *
 * <p>The parser needs one token of lookahead, with a few two- or three-token peeks to tell
 * constructs apart (e.g. a named rule is {@code rule name on ...}, while an anonymous one is {@code
 * rule on ...}). It stops at the first error by throwing a {@link ParseError}; there is no
 * recovery.
 *
 * <p>Binary operators are parsed by precedence climbing, from loosest to tightest: {@code ||},
 * {@code &&}, equality, comparison, additive, multiplicative. Unary {@code !} and {@code -} bind
 * tighter than any binary operator, and postfix forms ({@code .field}, {@code .method(...)}, {@code
 * [index]}, {@code has Component}) tighter still.
 */
public class Parser {

  private static final String ENTITY_FORM = "let name: id = new entity { ... }";

  private final List<Token> tokens;
  private final Grammar grammar;
  private int pos;

  private Parser(List<Token> tokens, Grammar grammar) {
    Preconditions.checkArgument(
        !tokens.isEmpty() && tokens.get(tokens.size() - 1).is(TokenKind.EOF),
        "Token list must end with EOF");
    this.tokens = tokens;
    this.grammar = grammar;
  }

  /**
   * Parses a complete source file, given the tokens returned by {@link Lexer#tokenize}. Throws a
   * {@link ParseError} if the tokens don't form a valid program.
   */
  public static Ast.Module parse(List<Token> tokens, Grammar grammar) {
    return new Parser(tokens, grammar).parseModule();
  }

  private Ast.Module parseModule() {
    ImmutableList.Builder<Item> items = ImmutableList.builder();
    while (!atEnd()) {
      items.add(parseItem());
    }
    return new Ast.Module(items.build(), new Span(0, peek().span().end()));
  }

  // ===== Token access =====

  private Token peek() {
    return tokens.get(pos);
  }

  /** Returns the token {@code n} positions ahead of the current one, or EOF. */
  private Token peek(int n) {
    return tokens.get(Math.min(pos + n, tokens.size() - 1));
  }

  private boolean atEnd() {
    return peek().is(TokenKind.EOF);
  }

  private boolean check(TokenKind kind) {
    return peek().is(kind);
  }

  /** Returns the current token and moves past it, unless it is EOF. */
  @CanIgnoreReturnValue
  private Token advance() {
    Token result = peek();
    if (!atEnd()) {
      pos++;
    }
    return result;
  }

  /** The most recently consumed token. */
  private Token previous() {
    Preconditions.checkState(pos > 0);
    return tokens.get(pos - 1);
  }

  /** If the current token has the given kind, consumes it and returns true. */
  private boolean match(TokenKind kind) {
    if (check(kind)) {
      advance();
      return true;
    }
    return false;
  }

  /**
   * Consumes and returns the current token if it has the given kind; otherwise throws a ParseError
   * describing what was expected.
   */
  @CanIgnoreReturnValue
  private Token consume(TokenKind kind, String expected) {
    if (check(kind)) {
      return advance();
    }
    throw expected(expected);
  }

  /** Returns a ParseError reporting that {@code what} was expected at the current token. */
  private ParseError expected(String what) {
    Token token = peek();
    return error(
        token, "Expected %s, got '%s' at position %s", what, token.text(), token.span().start());
  }

  @FormatMethod
  private static ParseError error(Token token, String format, Object... args) {
    return new ParseError(String.format(format, args), token.span().start());
  }

  private Span spanFrom(int start) {
    return new Span(start, previous().span().end());
  }

  // ===== Items =====

  private Item parseItem() {
    Token token = peek();
    switch (token.kind()) {
      case COMPONENT:
        return parseComponent();
      case RULE:
        return parseRule();
      case FN:
        return parseFunction();
      case CHOICE:
        return parseChoiceFunction();
      case IMPORT:
        return parseImport();
      case MODULE:
        return parseModuleDef();
      case LET:
        return parseEntityDeclaration();
      case ENTITY:
        if (grammar == Grammar.PERMISSIVE) {
          return parseBareEntity();
        }
        break;
      case IDENTIFIER:
        if (grammar == Grammar.PERMISSIVE && peek(1).is(TokenKind.EQ)) {
          return parseAssignedEntity();
        }
        break;
      default:
        break;
    }
    throw error(
        token,
        "Unexpected token '%s' at position %s. Entities must be declared with: %s",
        token.text(),
        token.span().start(),
        ENTITY_FORM);
  }

  private Ast.ComponentDef parseComponent() {
    int start = consume(TokenKind.COMPONENT, "component").span().start();
    String name = consume(TokenKind.IDENTIFIER, "component name").text();
    consume(TokenKind.LBRACE, "{");
    ImmutableList.Builder<FieldDef> fields = ImmutableList.builder();
    while (!check(TokenKind.RBRACE) && !atEnd()) {
      fields.add(parseFieldDef());
    }
    consume(TokenKind.RBRACE, "}");
    return new Ast.ComponentDef(name, fields.build(), spanFrom(start));
  }

  private FieldDef parseFieldDef() {
    Token name = parseFieldName();
    consume(TokenKind.COLON, ":");
    TypeExpr type = parseType();
    boolean optional = match(TokenKind.QUESTION);
    Span span = spanFrom(name.span().start());
    return new FieldDef(
        name.text(), optional ? TypeExpr.optional(type, span) : type, optional, span);
  }

  /**
   * Consumes a field name. Besides identifiers, the keywords {@code entity}, {@code event} and
   * {@code id} are allowed as field names.
   */
  private Token parseFieldName() {
    Token token = peek();
    return switch (token.kind()) {
      case IDENTIFIER, ENTITY, EVENT, TYPE_ID -> advance();
      default -> throw expected("field name");
    };
  }

  private TypeExpr parseType() {
    Token token = advance();
    Span span = token.span();
    return switch (token.kind()) {
      case TYPE_STRING -> TypeExpr.simple(TypeKind.STRING, span);
      case TYPE_BOOLEAN -> TypeExpr.simple(TypeKind.BOOLEAN, span);
      case TYPE_INTEGER -> TypeExpr.simple(TypeKind.INTEGER, span);
      case TYPE_FLOAT -> TypeExpr.simple(TypeKind.FLOAT, span);
      case TYPE_DECIMAL -> TypeExpr.simple(TypeKind.DECIMAL, span);
      case TYPE_NUMBER -> TypeExpr.simple(TypeKind.NUMBER, span);
      case TYPE_ID -> TypeExpr.simple(TypeKind.ID, span);
      case TYPE_LIST -> {
        if (match(TokenKind.LT)) {
          TypeExpr element = parseType();
          consume(TokenKind.GT, ">");
          yield TypeExpr.list(element, spanFrom(span.start()));
        }
        // A bare "list" is a list of entity ids
        yield TypeExpr.list(TypeExpr.simple(TypeKind.ID, span), span);
      }
      case IDENTIFIER -> TypeExpr.component(token.text(), span);
      default ->
          throw error(
              token, "Expected type, got '%s' at position %s", token.text(), span.start());
    };
  }

  /** Parses a type that may be an intersection of component types, {@code A & B & ...}. */
  private TypeExpr parseCompositeType() {
    TypeExpr first = parseType();
    if (!check(TokenKind.AND)) {
      return first;
    }
    checkCompositeMember(first);
    ImmutableList.Builder<TypeExpr> members = ImmutableList.<TypeExpr>builder().add(first);
    while (match(TokenKind.AND)) {
      members.add(checkCompositeMember(parseType()));
    }
    return TypeExpr.composite(members.build(), spanFrom(first.span().start()));
  }

  /** Only component types may be combined with '&'. */
  @CanIgnoreReturnValue
  private static TypeExpr checkCompositeMember(TypeExpr type) {
    if (type.kind() != TypeKind.COMPONENT) {
      throw new ParseError(
          String.format(
              "Expected component type in '&' type, got '%s' at position %s",
              type,
              type.span().start()),
          type.span().start());
    }
    return type;
  }

  private Ast.RuleDef parseRule() {
    int start = consume(TokenKind.RULE, "rule").span().start();
    String name = null;
    if (check(TokenKind.IDENTIFIER) && peek(1).is(TokenKind.ON)) {
      name = advance().text();
    }
    consume(TokenKind.ON, "on");
    String event = consume(TokenKind.IDENTIFIER, "event name").text();
    consume(TokenKind.LPAREN, "(");
    int paramStart = peek().span().start();
    String paramName = consume(TokenKind.IDENTIFIER, "event parameter name").text();
    consume(TokenKind.COLON, ":");
    TypeExpr paramType = parseType();
    consume(TokenKind.RPAREN, ")");
    Param eventParam = new Param(paramName, paramType, spanFrom(paramStart));

    Expr condition = match(TokenKind.WHEN) ? parseExpression() : null;
    Long priority = null;
    if (match(TokenKind.LBRACKET)) {
      Token key = consume(TokenKind.IDENTIFIER, "priority");
      if (!key.text().equals("priority")) {
        throw error(
            key, "Expected priority, got '%s' at position %s", key.text(), key.span().start());
      }
      consume(TokenKind.COLON, ":");
      priority = parseInteger(consume(TokenKind.INTEGER_LITERAL, "priority value"));
      consume(TokenKind.RBRACKET, "]");
    }
    Block body = parseBlock();
    return new Ast.RuleDef(name, event, eventParam, condition, priority, body, spanFrom(start));
  }

  private Ast.FunctionDef parseFunction() {
    int start = consume(TokenKind.FN, "fn").span().start();
    String name = consume(TokenKind.IDENTIFIER, "function name").text();
    ImmutableList<Param> params = parseParams(false);
    TypeExpr returnType = parseOptionalReturnType();
    Block body = parseBlock();
    return new Ast.FunctionDef(name, params, returnType, body, false, spanFrom(start));
  }

  private Ast.FunctionDef parseChoiceFunction() {
    int start = consume(TokenKind.CHOICE, "choice").span().start();
    consume(TokenKind.FN, "fn");
    String name = consume(TokenKind.IDENTIFIER, "function name").text();
    ImmutableList<Param> params = parseParams(true);
    TypeExpr returnType = parseOptionalReturnType();
    Block body = parseBlock();
    return new Ast.FunctionDef(name, params, returnType, body, true, spanFrom(start));
  }

  private @Nullable TypeExpr parseOptionalReturnType() {
    return match(TokenKind.COLON) ? parseType() : null;
  }

  /**
   * Parses a parenthesized parameter list. Commas between parameters are optional. If {@code
   * allowComposite} is true (choice functions), parameter types may be intersections.
   */
  private ImmutableList<Param> parseParams(boolean allowComposite) {
    consume(TokenKind.LPAREN, "(");
    ImmutableList.Builder<Param> params = ImmutableList.builder();
    while (!check(TokenKind.RPAREN) && !atEnd()) {
      int paramStart = peek().span().start();
      String name = consume(TokenKind.IDENTIFIER, "parameter name").text();
      consume(TokenKind.COLON, ":");
      TypeExpr type = allowComposite ? parseCompositeType() : parseType();
      params.add(new Param(name, type, spanFrom(paramStart)));
      match(TokenKind.COMMA);
    }
    consume(TokenKind.RPAREN, ")");
    return params.build();
  }

  private Ast.ImportDef parseImport() {
    int start = consume(TokenKind.IMPORT, "import").span().start();
    ImmutableList.Builder<String> path = ImmutableList.builder();
    path.add(consume(TokenKind.IDENTIFIER, "module path").text());
    while (match(TokenKind.DOT)) {
      path.add(consume(TokenKind.IDENTIFIER, "module path segment").text());
    }
    ImmutableList<String> names = null;
    if (match(TokenKind.LBRACE)) {
      ImmutableList.Builder<String> builder = ImmutableList.builder();
      while (!check(TokenKind.RBRACE) && !atEnd()) {
        builder.add(consume(TokenKind.IDENTIFIER, "import item").text());
        match(TokenKind.COMMA);
      }
      consume(TokenKind.RBRACE, "}");
      names = builder.build();
    }
    return new Ast.ImportDef(path.build(), names, spanFrom(start));
  }

  private Ast.ModuleDef parseModuleDef() {
    int start = consume(TokenKind.MODULE, "module").span().start();
    String name = consume(TokenKind.IDENTIFIER, "module name").text();
    consume(TokenKind.LBRACE, "{");
    ImmutableList.Builder<Item> items = ImmutableList.builder();
    while (!check(TokenKind.RBRACE) && !atEnd()) {
      items.add(parseItem());
    }
    consume(TokenKind.RBRACE, "}");
    return new Ast.ModuleDef(name, items.build(), spanFrom(start));
  }

  // ===== Entities =====

  /** {@code let name: id = new entity [{ ... }]} */
  private Ast.EntityDef parseEntityDeclaration() {
    int start = consume(TokenKind.LET, "let").span().start();
    String variable = consume(TokenKind.IDENTIFIER, "entity name").text();
    consume(TokenKind.COLON, ":");
    Token type = peek();
    if (!type.is(TokenKind.TYPE_ID)) {
      throw error(type, "Entity declarations must have type 'id', got '%s'", type.text());
    }
    advance();
    consume(TokenKind.EQ, "=");
    consume(TokenKind.NEW, "new");
    consume(TokenKind.ENTITY, "entity");
    return parseEntityBody(start, variable);
  }

  /** {@code entity [@name] { ... }}; only with {@link Grammar#PERMISSIVE}. */
  private Ast.EntityDef parseBareEntity() {
    int start = consume(TokenKind.ENTITY, "entity").span().start();
    String variable = null;
    if (check(TokenKind.ENTITY_REF)) {
      variable = advance().text().substring(1);
    }
    return parseEntityBody(start, variable);
  }

  /** {@code name = new entity { ... }}; only with {@link Grammar#PERMISSIVE}. */
  private Ast.EntityDef parseAssignedEntity() {
    Token name = consume(TokenKind.IDENTIFIER, "entity name");
    consume(TokenKind.EQ, "=");
    consume(TokenKind.NEW, "new");
    consume(TokenKind.ENTITY, "entity");
    return parseEntityBody(name.span().start(), name.text());
  }

  /**
   * Parses the optional braced body of an entity: component initializers, and bound functions
   * (which start with '.').
   */
  private Ast.EntityDef parseEntityBody(int start, @Nullable String variable) {
    ImmutableList.Builder<ComponentInit> components = ImmutableList.builder();
    ImmutableList.Builder<BoundFunctionDef> boundFunctions = ImmutableList.builder();
    if (match(TokenKind.LBRACE)) {
      while (!check(TokenKind.RBRACE) && !atEnd()) {
        if (check(TokenKind.DOT)) {
          boundFunctions.add(parseBoundFunction());
        } else {
          components.add(parseComponentInit());
        }
      }
      consume(TokenKind.RBRACE, "}");
    }
    return new Ast.EntityDef(
        variable, components.build(), boundFunctions.build(), spanFrom(start));
  }

  /** {@code .name = choice(params): T { body }} */
  private BoundFunctionDef parseBoundFunction() {
    int start = consume(TokenKind.DOT, ".").span().start();
    String name = consume(TokenKind.IDENTIFIER, "function name").text();
    consume(TokenKind.EQ, "=");
    consume(TokenKind.CHOICE, "choice");
    ImmutableList<Param> params = parseParams(true);
    TypeExpr returnType = parseOptionalReturnType();
    Block body = parseBlock();
    return new BoundFunctionDef(name, params, returnType, body, spanFrom(start));
  }

  private ComponentInit parseComponentInit() {
    int start = consume(TokenKind.IDENTIFIER, "component name").span().start();
    String name = previous().text();
    return new ComponentInit(name, parseFieldInits(), spanFrom(start));
  }

  /** Parses {@code { name: value ... }}. */
  private ImmutableList<FieldInit> parseFieldInits() {
    consume(TokenKind.LBRACE, "{");
    ImmutableList.Builder<FieldInit> fields = ImmutableList.builder();
    while (!check(TokenKind.RBRACE) && !atEnd()) {
      Token name = parseFieldName();
      consume(TokenKind.COLON, ":");
      Expr value = parseExpression();
      fields.add(new FieldInit(name.text(), value, spanFrom(name.span().start())));
    }
    consume(TokenKind.RBRACE, "}");
    return fields.build();
  }

  // ===== Statements =====

  private Block parseBlock() {
    int start = consume(TokenKind.LBRACE, "{").span().start();
    ImmutableList.Builder<Statement> statements = ImmutableList.builder();
    while (!check(TokenKind.RBRACE) && !atEnd()) {
      statements.add(parseStatement());
    }
    consume(TokenKind.RBRACE, "}");
    return new Block(statements.build(), spanFrom(start));
  }

  private Statement parseStatement() {
    return switch (peek().kind()) {
      case LET -> parseLet();
      case IF -> parseIf();
      case FOR -> parseFor();
      case WHILE -> parseWhile();
      case RETURN -> parseReturn();
      case SCHEDULE -> parseSchedule();
      case CANCEL -> parseCancel();
      case CREATE -> parseCreate();
      case DELETE -> parseDelete();
      default -> parseExpressionOrAssignment();
    };
  }

  private static boolean isStatementStart(TokenKind kind) {
    return switch (kind) {
      case LET, IF, FOR, WHILE, RETURN, SCHEDULE, CANCEL, CREATE, DELETE -> true;
      default -> false;
    };
  }

  private Ast.Let parseLet() {
    int start = consume(TokenKind.LET, "let").span().start();
    String name = consume(TokenKind.IDENTIFIER, "variable name").text();
    TypeExpr type = match(TokenKind.COLON) ? parseType() : null;
    consume(TokenKind.EQ, "=");
    Expr value = parseExpression();
    return new Ast.Let(name, type, value, spanFrom(start));
  }

  private Ast.If parseIf() {
    int start = consume(TokenKind.IF, "if").span().start();
    Expr condition = parseExpression();
    Block thenBlock = parseBlock();
    Ast.If elseIf = null;
    Block elseBlock = null;
    if (match(TokenKind.ELSE)) {
      if (check(TokenKind.IF)) {
        elseIf = parseIf();
      } else {
        elseBlock = parseBlock();
      }
    }
    return new Ast.If(condition, thenBlock, elseIf, elseBlock, spanFrom(start));
  }

  private Ast.For parseFor() {
    int start = consume(TokenKind.FOR, "for").span().start();
    String variable = consume(TokenKind.IDENTIFIER, "loop variable").text();
    consume(TokenKind.IN, "in");
    Expr iterable = parseExpression();
    Block body = parseBlock();
    return new Ast.For(variable, iterable, body, spanFrom(start));
  }

  private Ast.While parseWhile() {
    int start = consume(TokenKind.WHILE, "while").span().start();
    Expr condition = parseExpression();
    Block body = parseBlock();
    return new Ast.While(condition, body, spanFrom(start));
  }

  /**
   * {@code return [value]}. There are no statement terminators, so the value is omitted only if
   * the next token closes the block or starts another statement.
   */
  private Ast.Return parseReturn() {
    int start = consume(TokenKind.RETURN, "return").span().start();
    Expr value = null;
    if (!check(TokenKind.RBRACE) && !atEnd() && !isStatementStart(peek().kind())) {
      value = parseExpression();
    }
    return new Ast.Return(value, spanFrom(start));
  }

  private Ast.Schedule parseSchedule() {
    int start = consume(TokenKind.SCHEDULE, "schedule").span().start();
    boolean recurring = match(TokenKind.RECURRING);
    Expr delay = null;
    Expr interval = null;
    if (match(TokenKind.LBRACKET)) {
      Token key = consume(TokenKind.IDENTIFIER, "delay or interval");
      consume(TokenKind.COLON, ":");
      Expr value = parseExpression();
      switch (key.text()) {
        case "delay" -> delay = value;
        case "interval" -> interval = value;
        default ->
            throw error(
                key,
                "Expected delay or interval, got '%s' at position %s",
                key.text(),
                key.span().start());
      }
      consume(TokenKind.RBRACKET, "]");
    }
    String event = consume(TokenKind.IDENTIFIER, "event name").text();
    ImmutableList<FieldInit> fields = parseFieldInits();
    return new Ast.Schedule(recurring, delay, interval, event, fields, spanFrom(start));
  }

  private Ast.Cancel parseCancel() {
    int start = consume(TokenKind.CANCEL, "cancel").span().start();
    Expr target = parseExpression();
    return new Ast.Cancel(target, spanFrom(start));
  }

  private Ast.Create parseCreate() {
    int start = consume(TokenKind.CREATE, "create").span().start();
    consume(TokenKind.ENTITY, "entity");
    consume(TokenKind.LBRACE, "{");
    ImmutableList.Builder<ComponentInit> components = ImmutableList.builder();
    while (!check(TokenKind.RBRACE) && !atEnd()) {
      components.add(parseComponentInit());
    }
    consume(TokenKind.RBRACE, "}");
    return new Ast.Create(components.build(), spanFrom(start));
  }

  private Ast.Delete parseDelete() {
    int start = consume(TokenKind.DELETE, "delete").span().start();
    Expr entity = parseExpression();
    return new Ast.Delete(entity, spanFrom(start));
  }

  private Statement parseExpressionOrAssignment() {
    Expr expr = parseExpression();
    AssignOp op =
        switch (peek().kind()) {
          case EQ -> AssignOp.SET;
          case PLUS_EQ -> AssignOp.ADD;
          case MINUS_EQ -> AssignOp.SUBTRACT;
          case STAR_EQ -> AssignOp.MULTIPLY;
          case SLASH_EQ -> AssignOp.DIVIDE;
          default -> null;
        };
    if (op == null) {
      return new Ast.ExpressionStatement(expr, expr.span());
    }
    advance();
    Expr value = parseExpression();
    return new Ast.Assign(expr, op, value, Span.covering(expr.span(), value.span()));
  }

  // ===== Expressions =====

  private Expr parseExpression() {
    return parseOr();
  }

  private Expr parseOr() {
    Expr left = parseAnd();
    while (match(TokenKind.OR_OR)) {
      left = binary(BinaryOp.OR, left, parseAnd());
    }
    return left;
  }

  private Expr parseAnd() {
    Expr left = parseEquality();
    while (match(TokenKind.AND_AND)) {
      left = binary(BinaryOp.AND, left, parseEquality());
    }
    return left;
  }

  private Expr parseEquality() {
    Expr left = parseComparison();
    for (; ; ) {
      BinaryOp op =
          switch (peek().kind()) {
            case EQ_EQ -> BinaryOp.EQ;
            case NOT_EQ -> BinaryOp.NOT_EQ;
            default -> null;
          };
      if (op == null) {
        return left;
      }
      advance();
      left = binary(op, left, parseComparison());
    }
  }

  private Expr parseComparison() {
    Expr left = parseAdditive();
    for (; ; ) {
      BinaryOp op =
          switch (peek().kind()) {
            case LT -> BinaryOp.LT;
            case LT_EQ -> BinaryOp.LT_EQ;
            case GT -> BinaryOp.GT;
            case GT_EQ -> BinaryOp.GT_EQ;
            default -> null;
          };
      if (op == null) {
        return left;
      }
      advance();
      left = binary(op, left, parseAdditive());
    }
  }

  private Expr parseAdditive() {
    Expr left = parseMultiplicative();
    for (; ; ) {
      BinaryOp op =
          switch (peek().kind()) {
            case PLUS -> BinaryOp.ADD;
            case MINUS -> BinaryOp.SUBTRACT;
            default -> null;
          };
      if (op == null) {
        return left;
      }
      advance();
      left = binary(op, left, parseMultiplicative());
    }
  }

  private Expr parseMultiplicative() {
    Expr left = parseUnary();
    for (; ; ) {
      BinaryOp op =
          switch (peek().kind()) {
            case STAR -> BinaryOp.MULTIPLY;
            case SLASH -> BinaryOp.DIVIDE;
            case PERCENT -> BinaryOp.MODULO;
            default -> null;
          };
      if (op == null) {
        return left;
      }
      advance();
      left = binary(op, left, parseUnary());
    }
  }

  private static Expr binary(BinaryOp op, Expr left, Expr right) {
    return new Ast.Binary(op, left, right, Span.covering(left.span(), right.span()));
  }

  private Expr parseUnary() {
    UnaryOp op =
        switch (peek().kind()) {
          case NOT -> UnaryOp.NOT;
          case MINUS -> UnaryOp.NEGATE;
          default -> null;
        };
    if (op == null) {
      return parsePostfix();
    }
    int start = advance().span().start();
    Expr operand = parseUnary();
    return new Ast.Unary(op, operand, new Span(start, operand.span().end()));
  }

  private Expr parsePostfix() {
    Expr expr = parsePrimary();
    for (; ; ) {
      int start = expr.span().start();
      if (match(TokenKind.DOT)) {
        String name = parseFieldName().text();
        if (check(TokenKind.LPAREN)) {
          ImmutableList<Expr> args = parseArguments();
          expr = new Ast.MethodCall(expr, name, args, spanFrom(start));
        } else {
          expr = new Ast.FieldAccess(expr, name, spanFrom(start));
        }
      } else if (check(TokenKind.LBRACKET) && !startsBracketOption()) {
        advance();
        Expr index = parseExpression();
        consume(TokenKind.RBRACKET, "]");
        expr = new Ast.Index(expr, index, spanFrom(start));
      } else if (match(TokenKind.HAS)) {
        String component = consume(TokenKind.IDENTIFIER, "component name").text();
        expr = new Ast.HasComponent(expr, component, spanFrom(start));
      } else {
        return expr;
      }
    }
  }

  /**
   * True if the current token starts a bracketed option such as {@code [priority: 1]}, which can
   * follow a rule's {@code when} condition and must not be read as an index.
   */
  private boolean startsBracketOption() {
    return peek(1).is(TokenKind.IDENTIFIER) && peek(2).is(TokenKind.COLON);
  }

  /** Parses {@code (arg, ...)}; commas between arguments are optional. */
  private ImmutableList<Expr> parseArguments() {
    consume(TokenKind.LPAREN, "(");
    ImmutableList.Builder<Expr> args = ImmutableList.builder();
    while (!check(TokenKind.RPAREN) && !atEnd()) {
      args.add(parseExpression());
      match(TokenKind.COMMA);
    }
    consume(TokenKind.RPAREN, ")");
    return args.build();
  }

  private Expr parsePrimary() {
    Token token = advance();
    Span span = token.span();
    String text = token.text();
    switch (token.kind()) {
      case INTEGER_LITERAL:
        return new Ast.Literal(LiteralKind.INTEGER, parseInteger(token), span);
      case FLOAT_LITERAL:
        return new Ast.Literal(LiteralKind.FLOAT, Double.parseDouble(text), span);
      case DECIMAL_LITERAL:
        // Kept as text so that no precision is lost
        return new Ast.Literal(LiteralKind.DECIMAL, text.substring(0, text.length() - 1), span);
      case STRING_LITERAL:
        return new Ast.Literal(LiteralKind.STRING, text.substring(1, text.length() - 1), span);
      case TRUE:
        return new Ast.Literal(LiteralKind.BOOLEAN, true, span);
      case FALSE:
        return new Ast.Literal(LiteralKind.BOOLEAN, false, span);
      case NULL:
        return new Ast.Literal(LiteralKind.NULL, null, span);
      case ENTITIES:
        {
          consume(TokenKind.HAVING, "having");
          String component = consume(TokenKind.IDENTIFIER, "component name").text();
          return new Ast.EntitiesHaving(component, spanFrom(span.start()));
        }
      case CLONE:
        {
          Expr source = parsePostfix();
          ImmutableList.Builder<ComponentInit> overrides = ImmutableList.builder();
          if (match(TokenKind.LBRACE)) {
            while (!check(TokenKind.RBRACE) && !atEnd()) {
              overrides.add(parseComponentInit());
            }
            consume(TokenKind.RBRACE, "}");
          }
          return new Ast.Clone(source, overrides.build(), spanFrom(span.start()));
        }
      case ENTITY:
      case EVENT:
        // Keywords that may also be used as variable names
        return new Ast.Identifier(text, span);
      case IDENTIFIER:
        if (check(TokenKind.LPAREN)) {
          ImmutableList<Expr> args = parseArguments();
          return new Ast.Call(text, args, spanFrom(span.start()));
        }
        return new Ast.Identifier(text, span);
      case ENTITY_REF:
        return new Ast.EntityRef(text.substring(1), span);
      case LPAREN:
        {
          Expr inner = parseExpression();
          consume(TokenKind.RPAREN, ")");
          return new Ast.Paren(inner, spanFrom(span.start()));
        }
      case LBRACKET:
        {
          ImmutableList.Builder<Expr> elements = ImmutableList.builder();
          while (!check(TokenKind.RBRACKET) && !atEnd()) {
            elements.add(parseExpression());
            match(TokenKind.COMMA);
          }
          consume(TokenKind.RBRACKET, "]");
          return new Ast.ListLiteral(elements.build(), spanFrom(span.start()));
        }
      default:
        throw error(
            token, "Unexpected token '%s' in expression at position %s", text, span.start());
    }
  }

  /** Integer literals are 64-bit; anything larger is an error. */
  private static long parseInteger(Token token) {
    try {
      return Long.parseLong(token.text());
    } catch (NumberFormatException e) {
      throw error(
          token,
          "Integer literal '%s' out of range at position %s",
          token.text(),
          token.span().start());
    }
  }
}
