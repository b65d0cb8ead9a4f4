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

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.FormatMethod;
import java.util.List;
import org.blinklang.compiler.Ast.Assign;
import org.blinklang.compiler.Ast.Binary;
import org.blinklang.compiler.Ast.Block;
import org.blinklang.compiler.Ast.BoundFunctionDef;
import org.blinklang.compiler.Ast.Call;
import org.blinklang.compiler.Ast.Cancel;
import org.blinklang.compiler.Ast.Clone;
import org.blinklang.compiler.Ast.ComponentDef;
import org.blinklang.compiler.Ast.ComponentInit;
import org.blinklang.compiler.Ast.Create;
import org.blinklang.compiler.Ast.Delete;
import org.blinklang.compiler.Ast.EntitiesHaving;
import org.blinklang.compiler.Ast.EntityDef;
import org.blinklang.compiler.Ast.EntityRef;
import org.blinklang.compiler.Ast.Expr;
import org.blinklang.compiler.Ast.ExprVisitor;
import org.blinklang.compiler.Ast.ExpressionStatement;
import org.blinklang.compiler.Ast.FieldAccess;
import org.blinklang.compiler.Ast.FieldInit;
import org.blinklang.compiler.Ast.For;
import org.blinklang.compiler.Ast.FunctionDef;
import org.blinklang.compiler.Ast.HasComponent;
import org.blinklang.compiler.Ast.Identifier;
import org.blinklang.compiler.Ast.If;
import org.blinklang.compiler.Ast.ImportDef;
import org.blinklang.compiler.Ast.Index;
import org.blinklang.compiler.Ast.ItemVisitor;
import org.blinklang.compiler.Ast.Let;
import org.blinklang.compiler.Ast.ListLiteral;
import org.blinklang.compiler.Ast.Literal;
import org.blinklang.compiler.Ast.MethodCall;
import org.blinklang.compiler.Ast.ModuleDef;
import org.blinklang.compiler.Ast.Param;
import org.blinklang.compiler.Ast.Paren;
import org.blinklang.compiler.Ast.Return;
import org.blinklang.compiler.Ast.RuleDef;
import org.blinklang.compiler.Ast.Schedule;
import org.blinklang.compiler.Ast.StatementVisitor;
import org.blinklang.compiler.Ast.Unary;
import org.blinklang.compiler.Ast.While;
import org.blinklang.compiler.Scope.Entry;
import org.blinklang.compiler.Scope.Kind;

/**
 * The second semantic pass checks every rule, function and entity of one module against the
 * program's {@link Symbols} and the local scopes, appending a {@link SemanticError} for each
 * problem found. It never stops early: all errors in the module are reported.
 *
 * <p>The checks are existence and shape checks only:
 *
 * <ul>
 *   <li>every identifier is a variable in scope (a {@code let} variable is in scope only after its
 *       initializer, and a loop variable only in the loop body);
 *   <li>every {@code @name} is a variable in scope or a named entity;
 *   <li>every {@code x.Component.field} names a known component and one of its fields, and a
 *       {@code x.name} on a plain variable names a component;
 *   <li>every called function is a builtin or user-defined; and
 *   <li>every component named in an initializer, {@code has}, {@code entities having} or an
 *       {@code &} type is known.
 * </ul>
 *
 * Field paths that start at an event alias are not checked unless their first step names a
 * component, since event payloads have no declared schema.
 */
class PassTwo implements ItemVisitor<Void>, StatementVisitor<Void>, ExprVisitor<Void> {

  /** Runs the second pass over the given module, adding any errors found to {@code errors}. */
  static void apply(
      Symbols symbols, Ast.Module module, int moduleIndex, List<SemanticError> errors) {
    PassTwo pass = new PassTwo(symbols, moduleIndex, errors);
    module.items().forEach(item -> item.accept(pass));
  }

  private final Symbols symbols;
  private final int moduleIndex;
  private final List<SemanticError> errors;

  /** The scope for the node currently being checked. */
  private Scope scope = Scope.root();

  private PassTwo(Symbols symbols, int moduleIndex, List<SemanticError> errors) {
    this.symbols = symbols;
    this.moduleIndex = moduleIndex;
    this.errors = errors;
  }

  @FormatMethod
  private void error(Ast.Node node, String format, Object... args) {
    errors.add(new SemanticError(String.format(format, args), node.span(), moduleIndex));
  }

  /** Checks {@code block} in a new child of {@code parent}. */
  private void checkBlock(Block block, Scope parent) {
    Scope saved = scope;
    scope = parent.newChild();
    try {
      block.statements().forEach(stmt -> stmt.accept(this));
    } finally {
      scope = saved;
    }
  }

  private void check(Expr expr) {
    expr.accept(this);
  }

  /** Checks each parameter's composite type, and defines the parameters in a new root scope. */
  private Scope paramScope(List<Param> params) {
    Scope result = Scope.root();
    for (Param param : params) {
      if (param.type().kind() == Ast.TypeKind.COMPOSITE) {
        for (String component : param.type().requiredComponents()) {
          if (!symbols.hasComponent(component)) {
            error(param, "Unknown component '%s'", component);
          }
        }
      }
      result.define(param.name(), Kind.VARIABLE);
    }
    return result;
  }

  /**
   * Checks that {@code init} names a known component and that each of its fields belongs to that
   * component; the field values are checked in the current scope.
   */
  private void checkComponentInit(ComponentInit init) {
    ImmutableMap<String, String> fields = symbols.fields(init.name());
    if (fields == null) {
      error(init, "Unknown component '%s'", init.name());
    }
    for (FieldInit field : init.fields()) {
      if (fields != null && !fields.containsKey(field.name())) {
        unknownField(field, field.name(), init.name(), fields);
      }
      check(field.value());
    }
  }

  private void unknownField(
      Ast.Node node, String field, String component, ImmutableMap<String, String> fields) {
    error(
        node,
        "Unknown field '%s' in component '%s'. Available fields: %s",
        field,
        component,
        String.join(", ", fields.keySet()));
  }

  // ===== Items =====

  @Override
  public Void visitComponent(ComponentDef item) {
    return null;
  }

  @Override
  public Void visitRule(RuleDef item) {
    Scope root = Scope.root();
    root.define("entity", Kind.VARIABLE);
    root.define("event", Kind.EVENT_ALIAS);
    root.define(item.eventParam().name(), Kind.EVENT_ALIAS);
    scope = root;
    if (item.condition() != null) {
      check(item.condition());
    }
    checkBlock(item.body(), root);
    return null;
  }

  @Override
  public Void visitFunction(FunctionDef item) {
    checkBlock(item.body(), paramScope(item.params()));
    return null;
  }

  @Override
  public Void visitImport(ImportDef item) {
    return null;
  }

  @Override
  public Void visitModule(ModuleDef item) {
    item.items().forEach(nested -> nested.accept(this));
    return null;
  }

  @Override
  public Void visitEntity(EntityDef item) {
    // Initial values can't refer to any variables.
    scope = Scope.root();
    item.components().forEach(this::checkComponentInit);
    for (BoundFunctionDef function : item.boundFunctions()) {
      checkBlock(function.body(), paramScope(function.params()));
    }
    return null;
  }

  // ===== Statements =====

  @Override
  public Void visitLet(Let stmt) {
    check(stmt.value());
    scope.define(stmt.name(), Kind.VARIABLE);
    return null;
  }

  @Override
  public Void visitAssign(Assign stmt) {
    check(stmt.target());
    check(stmt.value());
    return null;
  }

  @Override
  public Void visitIf(If stmt) {
    check(stmt.condition());
    checkBlock(stmt.thenBlock(), scope);
    if (stmt.elseIf() != null) {
      visitIf(stmt.elseIf());
    } else if (stmt.elseBlock() != null) {
      checkBlock(stmt.elseBlock(), scope);
    }
    return null;
  }

  @Override
  public Void visitFor(For stmt) {
    check(stmt.iterable());
    Scope loopScope = scope.newChild();
    loopScope.define(stmt.variable(), Kind.VARIABLE);
    checkBlock(stmt.body(), loopScope);
    return null;
  }

  @Override
  public Void visitWhile(While stmt) {
    check(stmt.condition());
    checkBlock(stmt.body(), scope);
    return null;
  }

  @Override
  public Void visitReturn(Return stmt) {
    if (stmt.value() != null) {
      check(stmt.value());
    }
    return null;
  }

  @Override
  public Void visitSchedule(Schedule stmt) {
    if (stmt.delay() != null) {
      check(stmt.delay());
    }
    if (stmt.interval() != null) {
      check(stmt.interval());
    }
    stmt.fields().forEach(field -> check(field.value()));
    return null;
  }

  @Override
  public Void visitCancel(Cancel stmt) {
    check(stmt.target());
    return null;
  }

  @Override
  public Void visitCreate(Create stmt) {
    stmt.components().forEach(this::checkComponentInit);
    return null;
  }

  @Override
  public Void visitDelete(Delete stmt) {
    check(stmt.entity());
    return null;
  }

  @Override
  public Void visitExpression(ExpressionStatement stmt) {
    check(stmt.expr());
    return null;
  }

  // ===== Expressions =====

  @Override
  public Void visitLiteral(Literal expr) {
    return null;
  }

  @Override
  public Void visitIdentifier(Identifier expr) {
    if (scope.lookup(expr.name()) == null) {
      error(expr, "Undeclared variable '%s'", expr.name());
    }
    return null;
  }

  @Override
  public Void visitEntityRef(EntityRef expr) {
    if (scope.lookup(expr.name()) == null && !symbols.hasEntity(expr.name())) {
      error(expr, "Undeclared entity '%s'", expr.name());
    }
    return null;
  }

  @Override
  public Void visitFieldAccess(FieldAccess expr) {
    if (expr.base() instanceof FieldAccess inner) {
      // base.Component.field
      String component = inner.field();
      ImmutableMap<String, String> fields = symbols.fields(component);
      if (fields != null) {
        check(inner.base());
        if (!fields.containsKey(expr.field())) {
          unknownField(expr, expr.field(), component, fields);
        }
      } else if (!startsAtEventAlias(inner)) {
        check(inner.base());
        error(inner, "Unknown component '%s'", component);
      }
    } else if (expr.base() instanceof Identifier id) {
      Entry entry = scope.lookup(id.name());
      if (entry == null) {
        error(id, "Undeclared variable '%s'", id.name());
      } else if (!entry.isEventAlias() && !symbols.hasComponent(expr.field())) {
        error(
            expr,
            "Invalid field access '%1$s.%2$s'. Use '%1$s.Component.field' to access component"
                + " fields, or '%1$s' directly for entity references",
            id.name(),
            expr.field());
      }
    } else {
      check(expr.base());
    }
    return null;
  }

  /** True if the leftmost element of a chain of field accesses is an event alias. */
  private boolean startsAtEventAlias(FieldAccess expr) {
    Expr base = expr.base();
    while (base instanceof FieldAccess access) {
      base = access.base();
    }
    if (base instanceof Identifier id) {
      Entry entry = scope.lookup(id.name());
      return entry != null && entry.isEventAlias();
    }
    return false;
  }

  @Override
  public Void visitIndex(Index expr) {
    check(expr.base());
    check(expr.index());
    return null;
  }

  @Override
  public Void visitUnary(Unary expr) {
    check(expr.operand());
    return null;
  }

  @Override
  public Void visitBinary(Binary expr) {
    check(expr.left());
    check(expr.right());
    return null;
  }

  @Override
  public Void visitCall(Call expr) {
    if (!symbols.hasFunction(expr.name())) {
      error(expr, "Unknown function '%s'", expr.name());
    }
    expr.args().forEach(this::check);
    return null;
  }

  @Override
  public Void visitMethodCall(MethodCall expr) {
    check(expr.base());
    expr.args().forEach(this::check);
    return null;
  }

  @Override
  public Void visitHasComponent(HasComponent expr) {
    check(expr.entity());
    if (!symbols.hasComponent(expr.component())) {
      error(expr, "Unknown component '%s'", expr.component());
    }
    return null;
  }

  @Override
  public Void visitEntitiesHaving(EntitiesHaving expr) {
    if (!symbols.hasComponent(expr.component())) {
      error(expr, "Unknown component '%s'", expr.component());
    }
    return null;
  }

  @Override
  public Void visitClone(Clone expr) {
    check(expr.source());
    expr.overrides().forEach(this::checkComponentInit);
    return null;
  }

  @Override
  public Void visitList(ListLiteral expr) {
    expr.elements().forEach(this::check);
    return null;
  }

  @Override
  public Void visitParen(Paren expr) {
    check(expr.inner());
    return null;
  }
}
