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
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * The syntax tree produced by {@link Parser}. Ast is just a namespace for the node types; every
 * node is an immutable record carrying the {@link Span} of the source text it was parsed from.
 *
 * <p>There are three families of node (items, statements and expressions), each with a visitor
 * interface. Passes that need to handle every variant implement the visitor, so adding a variant
 * is a compile error until each pass handles it.
 */
public final class Ast {

  // Statics only
  private Ast() {}

  /** Implemented by every node. */
  public interface Node {
    Span span();
  }

  /** The items parsed from one source file. */
  public record Module(ImmutableList<Item> items, Span span) implements Node {}

  // ===== Types =====

  /** The kinds of type expression. */
  public enum TypeKind {
    STRING("string"),
    BOOLEAN("boolean"),
    INTEGER("integer"),
    FLOAT("float"),
    DECIMAL("decimal"),
    NUMBER("number"),
    ID("id"),
    /** {@code list<T>}; the element type is the only argument. */
    LIST("list"),
    /** {@code T?}; the wrapped type is the only argument. */
    OPTIONAL("optional"),
    /** A named component type; {@link TypeExpr#name} is the component. */
    COMPONENT("component"),
    /** {@code A & B & ...}; every argument is a COMPONENT type. */
    COMPOSITE("composite");

    public final String keyword;

    TypeKind(String keyword) {
      this.keyword = keyword;
    }
  }

  /** A type as written in a field, parameter, let or return position. */
  public record TypeExpr(
      TypeKind kind, @Nullable String name, ImmutableList<TypeExpr> args, Span span)
      implements Node {

    public static TypeExpr simple(TypeKind kind, Span span) {
      Preconditions.checkArgument(kind.compareTo(TypeKind.ID) <= 0, kind);
      return new TypeExpr(kind, null, ImmutableList.of(), span);
    }

    public static TypeExpr list(TypeExpr element, Span span) {
      return new TypeExpr(TypeKind.LIST, null, ImmutableList.of(element), span);
    }

    public static TypeExpr optional(TypeExpr inner, Span span) {
      return new TypeExpr(TypeKind.OPTIONAL, null, ImmutableList.of(inner), span);
    }

    public static TypeExpr component(String name, Span span) {
      return new TypeExpr(TypeKind.COMPONENT, name, ImmutableList.of(), span);
    }

    public static TypeExpr composite(ImmutableList<TypeExpr> members, Span span) {
      Preconditions.checkArgument(members.size() >= 2);
      return new TypeExpr(TypeKind.COMPOSITE, null, members, span);
    }

    /** The element type of a LIST or the wrapped type of an OPTIONAL. */
    public TypeExpr inner() {
      Preconditions.checkState(kind == TypeKind.LIST || kind == TypeKind.OPTIONAL, kind);
      return args.get(0);
    }

    /**
     * Returns the names of the components an argument of this type must carry: every member of a
     * composite, the component itself for a named component type, and nothing otherwise.
     */
    public ImmutableList<String> requiredComponents() {
      return switch (kind) {
        case COMPONENT -> ImmutableList.of(name);
        case COMPOSITE ->
            args.stream()
                .filter(t -> t.kind == TypeKind.COMPONENT)
                .map(TypeExpr::name)
                .collect(ImmutableList.toImmutableList());
        default -> ImmutableList.of();
      };
    }

    /** Returns the type as it would be written in source. */
    @Override
    public String toString() {
      return switch (kind) {
        case LIST -> "list<" + inner() + ">";
        case OPTIONAL -> inner() + "?";
        case COMPONENT -> name;
        case COMPOSITE -> args.stream().map(TypeExpr::toString).collect(Collectors.joining(" & "));
        default -> kind.keyword;
      };
    }
  }

  // ===== Items =====

  /** A top-level declaration, or a declaration inside a {@code module} block. */
  public interface Item extends Node {
    <T> T accept(ItemVisitor<T> visitor);
  }

  public interface ItemVisitor<T> {
    T visitComponent(ComponentDef item);

    T visitRule(RuleDef item);

    T visitFunction(FunctionDef item);

    T visitImport(ImportDef item);

    T visitModule(ModuleDef item);

    T visitEntity(EntityDef item);
  }

  /** {@code component Name { field: type ... }} */
  public record ComponentDef(String name, ImmutableList<FieldDef> fields, Span span)
      implements Item {
    @Override
    public <T> T accept(ItemVisitor<T> visitor) {
      return visitor.visitComponent(this);
    }
  }

  /**
   * One field of a component. If {@code optional} is true, {@code type} is the OPTIONAL wrapper of
   * the declared type.
   */
  public record FieldDef(String name, TypeExpr type, boolean optional, Span span) implements Node {}

  /** {@code rule [name] on Event(param: Type) [when condition] [[priority: N]] { body }} */
  public record RuleDef(
      @Nullable String name,
      String event,
      Param eventParam,
      @Nullable Expr condition,
      @Nullable Long priority,
      Block body,
      Span span)
      implements Item {
    @Override
    public <T> T accept(ItemVisitor<T> visitor) {
      return visitor.visitRule(this);
    }
  }

  /** A named, typed parameter of a rule, function or bound function. */
  public record Param(String name, TypeExpr type, Span span) implements Node {}

  /** {@code fn name(params): T { body }} or {@code choice fn name(params): T { body }}. */
  public record FunctionDef(
      String name,
      ImmutableList<Param> params,
      @Nullable TypeExpr returnType,
      Block body,
      boolean isChoice,
      Span span)
      implements Item {
    @Override
    public <T> T accept(ItemVisitor<T> visitor) {
      return visitor.visitFunction(this);
    }
  }

  /**
   * {@code import a.b.c [{ x, y }]}. {@code names} is null if no braces were given. Imports are
   * resolved by external tooling; the compiler records them and otherwise ignores them.
   */
  public record ImportDef(
      ImmutableList<String> path, @Nullable ImmutableList<String> names, Span span)
      implements Item {
    @Override
    public <T> T accept(ItemVisitor<T> visitor) {
      return visitor.visitImport(this);
    }
  }

  /** {@code module name { items }} */
  public record ModuleDef(String name, ImmutableList<Item> items, Span span) implements Item {
    @Override
    public <T> T accept(ItemVisitor<T> visitor) {
      return visitor.visitModule(this);
    }
  }

  /**
   * An entity in the initial state, e.g. {@code let hero: id = new entity { Health { ... } }}.
   * {@code variable} is null for an anonymous entity (only possible with {@link
   * Grammar#PERMISSIVE}).
   */
  public record EntityDef(
      @Nullable String variable,
      ImmutableList<ComponentInit> components,
      ImmutableList<BoundFunctionDef> boundFunctions,
      Span span)
      implements Item {
    @Override
    public <T> T accept(ItemVisitor<T> visitor) {
      return visitor.visitEntity(this);
    }
  }

  /** {@code .name = choice(params): T { body }} inside an entity body. */
  public record BoundFunctionDef(
      String name,
      ImmutableList<Param> params,
      @Nullable TypeExpr returnType,
      Block body,
      Span span)
      implements Node {}

  /** {@code Component { field: value ... }}, in an entity, a create statement or a clone. */
  public record ComponentInit(String name, ImmutableList<FieldInit> fields, Span span)
      implements Node {}

  /** {@code name: value}, in a component initializer or a schedule statement. */
  public record FieldInit(String name, Expr value, Span span) implements Node {}

  // ===== Statements =====

  /** A braced sequence of statements. */
  public record Block(ImmutableList<Statement> statements, Span span) implements Node {}

  public interface Statement extends Node {
    <T> T accept(StatementVisitor<T> visitor);
  }

  public interface StatementVisitor<T> {
    T visitLet(Let stmt);

    T visitAssign(Assign stmt);

    T visitIf(If stmt);

    T visitFor(For stmt);

    T visitWhile(While stmt);

    T visitReturn(Return stmt);

    T visitSchedule(Schedule stmt);

    T visitCancel(Cancel stmt);

    T visitCreate(Create stmt);

    T visitDelete(Delete stmt);

    T visitExpression(ExpressionStatement stmt);
  }

  /** {@code let name [: type] = value} */
  public record Let(String name, @Nullable TypeExpr type, Expr value, Span span)
      implements Statement {
    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
      return visitor.visitLet(this);
    }
  }

  /** The assignment operators, with the name of the corresponding IR modify op. */
  public enum AssignOp {
    SET("=", "set"),
    ADD("+=", "add"),
    SUBTRACT("-=", "subtract"),
    MULTIPLY("*=", "multiply"),
    DIVIDE("/=", "divide");

    public final String symbol;
    public final String irName;

    AssignOp(String symbol, String irName) {
      this.symbol = symbol;
      this.irName = irName;
    }
  }

  /** {@code target op value} */
  public record Assign(Expr target, AssignOp op, Expr value, Span span) implements Statement {
    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
      return visitor.visitAssign(this);
    }
  }

  /**
   * {@code if condition { then } [else ...]}. At most one of {@code elseIf} and {@code elseBlock}
   * is non-null.
   */
  public record If(
      Expr condition, Block thenBlock, @Nullable If elseIf, @Nullable Block elseBlock, Span span)
      implements Statement {

    public If {
      Preconditions.checkArgument(elseIf == null || elseBlock == null);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
      return visitor.visitIf(this);
    }
  }

  /** {@code for variable in iterable { body }} */
  public record For(String variable, Expr iterable, Block body, Span span) implements Statement {
    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
      return visitor.visitFor(this);
    }
  }

  /** {@code while condition { body }} */
  public record While(Expr condition, Block body, Span span) implements Statement {
    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
      return visitor.visitWhile(this);
    }
  }

  /** {@code return [value]} */
  public record Return(@Nullable Expr value, Span span) implements Statement {
    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
      return visitor.visitReturn(this);
    }
  }

  /** {@code schedule [recurring] [[delay: e] | [interval: e]] Event { field: value ... }} */
  public record Schedule(
      boolean recurring,
      @Nullable Expr delay,
      @Nullable Expr interval,
      String event,
      ImmutableList<FieldInit> fields,
      Span span)
      implements Statement {
    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
      return visitor.visitSchedule(this);
    }
  }

  /** {@code cancel target} */
  public record Cancel(Expr target, Span span) implements Statement {
    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
      return visitor.visitCancel(this);
    }
  }

  /** {@code create entity { Component { ... } ... }} */
  public record Create(ImmutableList<ComponentInit> components, Span span) implements Statement {
    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
      return visitor.visitCreate(this);
    }
  }

  /** {@code delete entity} */
  public record Delete(Expr entity, Span span) implements Statement {
    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
      return visitor.visitDelete(this);
    }
  }

  /** An expression evaluated for its effect, e.g. a call. */
  public record ExpressionStatement(Expr expr, Span span) implements Statement {
    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
      return visitor.visitExpression(this);
    }
  }

  // ===== Expressions =====

  public interface Expr extends Node {
    <T> T accept(ExprVisitor<T> visitor);
  }

  public interface ExprVisitor<T> {
    T visitLiteral(Literal expr);

    T visitIdentifier(Identifier expr);

    T visitEntityRef(EntityRef expr);

    T visitFieldAccess(FieldAccess expr);

    T visitIndex(Index expr);

    T visitUnary(Unary expr);

    T visitBinary(Binary expr);

    T visitCall(Call expr);

    T visitMethodCall(MethodCall expr);

    T visitHasComponent(HasComponent expr);

    T visitEntitiesHaving(EntitiesHaving expr);

    T visitClone(Clone expr);

    T visitList(ListLiteral expr);

    T visitParen(Paren expr);
  }

  public enum LiteralKind {
    STRING,
    INTEGER,
    FLOAT,
    DECIMAL,
    BOOLEAN,
    NULL
  }

  /**
   * A literal. {@code value} is a String for STRING (the text between the quotes, escapes left as
   * written) and DECIMAL (the digits without the trailing {@code d}), a Long for INTEGER, a Double
   * for FLOAT, a Boolean for BOOLEAN, and null for NULL.
   */
  public record Literal(LiteralKind kind, @Nullable Object value, Span span) implements Expr {
    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
      return visitor.visitLiteral(this);
    }
  }

  public record Identifier(String name, Span span) implements Expr {
    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
      return visitor.visitIdentifier(this);
    }
  }

  /** {@code @name}; {@code name} does not include the {@code @}. */
  public record EntityRef(String name, Span span) implements Expr {
    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
      return visitor.visitEntityRef(this);
    }
  }

  /** {@code base.field} */
  public record FieldAccess(Expr base, String field, Span span) implements Expr {
    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
      return visitor.visitFieldAccess(this);
    }
  }

  /** {@code base[index]} */
  public record Index(Expr base, Expr index, Span span) implements Expr {
    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
      return visitor.visitIndex(this);
    }
  }

  /** The unary operators, with the name of the corresponding IR op. */
  public enum UnaryOp {
    NOT("!", "not"),
    NEGATE("-", "negate");

    public final String symbol;
    public final String irName;

    UnaryOp(String symbol, String irName) {
      this.symbol = symbol;
      this.irName = irName;
    }
  }

  public record Unary(UnaryOp op, Expr operand, Span span) implements Expr {
    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
      return visitor.visitUnary(this);
    }
  }

  /** The binary operators, with the name of the corresponding IR op. */
  public enum BinaryOp {
    OR("||", "or"),
    AND("&&", "and"),
    EQ("==", "eq"),
    NOT_EQ("!=", "neq"),
    LT("<", "lt"),
    LT_EQ("<=", "lte"),
    GT(">", "gt"),
    GT_EQ(">=", "gte"),
    ADD("+", "add"),
    SUBTRACT("-", "subtract"),
    MULTIPLY("*", "multiply"),
    DIVIDE("/", "divide"),
    MODULO("%", "modulo");

    public final String symbol;
    public final String irName;

    BinaryOp(String symbol, String irName) {
      this.symbol = symbol;
      this.irName = irName;
    }
  }

  public record Binary(BinaryOp op, Expr left, Expr right, Span span) implements Expr {
    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
      return visitor.visitBinary(this);
    }
  }

  /** {@code name(args)} */
  public record Call(String name, ImmutableList<Expr> args, Span span) implements Expr {
    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
      return visitor.visitCall(this);
    }
  }

  /** {@code base.method(args)} */
  public record MethodCall(Expr base, String method, ImmutableList<Expr> args, Span span)
      implements Expr {
    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
      return visitor.visitMethodCall(this);
    }
  }

  /** {@code entity has Component} */
  public record HasComponent(Expr entity, String component, Span span) implements Expr {
    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
      return visitor.visitHasComponent(this);
    }
  }

  /** {@code entities having Component} */
  public record EntitiesHaving(String component, Span span) implements Expr {
    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
      return visitor.visitEntitiesHaving(this);
    }
  }

  /** {@code clone source [{ Component { ... } ... }]} */
  public record Clone(Expr source, ImmutableList<ComponentInit> overrides, Span span)
      implements Expr {
    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
      return visitor.visitClone(this);
    }
  }

  /** {@code [a, b, c]} */
  public record ListLiteral(ImmutableList<Expr> elements, Span span) implements Expr {
    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
      return visitor.visitList(this);
    }
  }

  /** {@code (inner)} */
  public record Paren(Expr inner, Span span) implements Expr {
    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
      return visitor.visitParen(this);
    }
  }
}
