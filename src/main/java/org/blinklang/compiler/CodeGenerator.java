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
import com.google.common.collect.ImmutableMap;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
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
import org.blinklang.compiler.Ast.LiteralKind;
import org.blinklang.compiler.Ast.MethodCall;
import org.blinklang.compiler.Ast.ModuleDef;
import org.blinklang.compiler.Ast.Param;
import org.blinklang.compiler.Ast.Paren;
import org.blinklang.compiler.Ast.Return;
import org.blinklang.compiler.Ast.RuleDef;
import org.blinklang.compiler.Ast.Schedule;
import org.blinklang.compiler.Ast.Statement;
import org.blinklang.compiler.Ast.StatementVisitor;
import org.blinklang.compiler.Ast.TypeExpr;
import org.blinklang.compiler.Ast.Unary;
import org.blinklang.compiler.Ast.UnaryOp;
import org.blinklang.compiler.Ast.While;
import org.blinklang.ir.IrAction;
import org.blinklang.ir.IrChoicePoint;
import org.blinklang.ir.IrComponent;
import org.blinklang.ir.IrComponentInit;
import org.blinklang.ir.IrEntity;
import org.blinklang.ir.IrExpr;
import org.blinklang.ir.IrFunction;
import org.blinklang.ir.IrModule;
import org.blinklang.ir.IrParam;
import org.blinklang.ir.IrRule;
import org.blinklang.ir.IrType;
import org.blinklang.util.StringUtil;
import org.jspecify.annotations.Nullable;

/**
 * Translates parsed (and already checked) modules into an {@link IrModule}.
 *
 * <p>A CodeGenerator is used for a single call to {@link #generate}. Its id counters start at zero,
 * and nested modules share them with their parent, so ids are unique across the whole output.
 *
 * <p>Generation doesn't validate; given a program that fails {@link SemanticAnalyzer} it produces
 * IR that the runtime probably can't use.
 */
public class CodeGenerator
    implements ItemVisitor<Void>, StatementVisitor<@Nullable IrAction>, ExprVisitor<IrExpr> {

  private final CompileOptions options;
  private final List<IrModule.SourceFile> sourceFiles = new ArrayList<>();

  private int componentId;
  private int ruleId;
  private int functionId;
  private int entityId;

  private final ImmutableList.Builder<IrComponent> components = ImmutableList.builder();
  private final ImmutableList.Builder<IrRule> rules = ImmutableList.builder();
  private final ImmutableList.Builder<IrFunction> functions = ImmutableList.builder();
  private final ImmutableList.Builder<IrEntity> entities = ImmutableList.builder();
  private final List<IrChoicePoint> choicePoints = new ArrayList<>();

  private boolean generated;

  public CodeGenerator(CompileOptions options) {
    this.options = options;
  }

  /**
   * Records an input file. The files are hashed into the module's metadata, and included in its
   * source map if the options ask for one.
   */
  public void addSourceFile(SourceFile file) {
    sourceFiles.add(new IrModule.SourceFile(file.path(), file.content(), file.language().tag));
  }

  /** Returns the IR for {@code modules}, in order. May only be called once. */
  public IrModule generate(List<Ast.Module> modules) {
    Preconditions.checkState(!generated, "CodeGenerator is single-use");
    generated = true;
    for (Ast.Module module : modules) {
      module.items().forEach(item -> item.accept(this));
    }
    ImmutableList<IrEntity> entityList = entities.build();
    return new IrModule(
        IrModule.VERSION,
        options.moduleName(),
        metadata(),
        components.build(),
        rules.build(),
        functions.build(),
        entityList.isEmpty() ? null : new IrModule.InitialState(entityList),
        choicePoints.isEmpty() ? null : sortedChoicePoints(),
        (options.includeSourceMap() && !sourceFiles.isEmpty())
            ? new IrModule.SourceMap(ImmutableList.copyOf(sourceFiles))
            : null);
  }

  private IrModule.Metadata metadata() {
    String hash = null;
    if (!sourceFiles.isEmpty()) {
      Hasher hasher = Hashing.sha256().newHasher();
      sourceFiles.forEach(f -> hasher.putString(f.content(), StandardCharsets.UTF_8));
      hash = hasher.hash().toString();
    }
    return new IrModule.Metadata(
        Instant.now(options.clock()).toString(), Compiler.VERSION, hash);
  }

  /**
   * Keeps the first choice point with each id and orders them by id, ignoring case (ties broken
   * by exact comparison).
   */
  private ImmutableList<IrChoicePoint> sortedChoicePoints() {
    Map<String, IrChoicePoint> unique = new LinkedHashMap<>();
    choicePoints.forEach(cp -> unique.putIfAbsent(cp.id(), cp));
    return unique.values().stream()
        .sorted(
            Comparator.comparing(IrChoicePoint::id, String.CASE_INSENSITIVE_ORDER)
                .thenComparing(IrChoicePoint::id))
        .collect(ImmutableList.toImmutableList());
  }

  // ===== Types =====

  static IrType convertType(TypeExpr type) {
    return switch (type.kind()) {
      case STRING -> IrType.STRING;
      case BOOLEAN -> IrType.BOOLEAN;
      case INTEGER, FLOAT, DECIMAL, NUMBER -> IrType.NUMBER;
      // The component requirements of a composite type aren't represented in the IR.
      case ID, COMPONENT, COMPOSITE -> IrType.ENTITY;
      case LIST -> IrType.list(convertType(type.inner()));
      case OPTIONAL -> convertType(type.inner());
    };
  }

  private static ImmutableList<IrParam> params(List<Param> params) {
    return params.stream()
        .map(p -> new IrParam(p.name(), convertType(p.type())))
        .collect(ImmutableList.toImmutableList());
  }

  private static IrType returnType(@Nullable TypeExpr type) {
    return (type == null) ? IrType.NUMBER : convertType(type);
  }

  // ===== Items =====

  @Override
  public Void visitComponent(ComponentDef item) {
    ImmutableList<IrComponent.Field> fields =
        item.fields().stream()
            .map(f -> new IrComponent.Field(f.name(), convertType(f.type())))
            .collect(ImmutableList.toImmutableList());
    components.add(new IrComponent(componentId++, item.name(), fields));
    return null;
  }

  @Override
  public Void visitRule(RuleDef item) {
    rules.add(
        new IrRule(
            ruleId++,
            item.name(),
            IrRule.Trigger.event(item.event()),
            (item.condition() == null) ? null : expr(item.condition()),
            item.priority(),
            actions(item.body())));
    return null;
  }

  @Override
  public Void visitFunction(FunctionDef item) {
    IrFunction function =
        new IrFunction(
            functionId++,
            item.name(),
            params(item.params()),
            returnType(item.returnType()),
            functionBody(item.body()));
    functions.add(function);
    if (item.isChoice()) {
      choicePoints.add(
          choicePoint(item.name(), function.params(), function.returnType(), null));
    }
    return null;
  }

  @Override
  public Void visitImport(ImportDef item) {
    // Imports are resolved by whoever assembles the source files.
    return null;
  }

  @Override
  public Void visitModule(ModuleDef item) {
    item.items().forEach(nested -> nested.accept(this));
    return null;
  }

  @Override
  public Void visitEntity(EntityDef item) {
    Map<String, Map<String, Object>> initialComponents = new LinkedHashMap<>();
    for (ComponentInit init : item.components()) {
      Map<String, Object> fields = new LinkedHashMap<>();
      for (FieldInit field : init.fields()) {
        fields.put(field.name(), initialValue(field.value()));
      }
      initialComponents.put(init.name(), fields);
    }
    Map<String, IrEntity.BoundFunction> bound = null;
    if (!item.boundFunctions().isEmpty()) {
      bound = new LinkedHashMap<>();
      @Nullable List<String> classes = characterClass(item);
      for (BoundFunctionDef fn : item.boundFunctions()) {
        IrEntity.BoundFunction irFn =
            new IrEntity.BoundFunction(
                params(fn.params()), returnType(fn.returnType()), functionBody(fn.body()));
        bound.put(fn.name(), irFn);
        choicePoints.add(choicePoint(fn.name(), irFn.params(), irFn.returnType(), classes));
      }
    }
    entities.add(new IrEntity(entityId++, item.variable(), initialComponents, bound));
    return null;
  }

  /**
   * Returns the value stored in an entity's initial state for a field initializer: the value of
   * a literal (or negated numeric literal), a list of such values, or null for anything that
   * would need evaluating.
   */
  private static @Nullable Object initialValue(Expr expr) {
    if (expr instanceof Literal literal) {
      return literalValue(literal);
    } else if (expr instanceof Paren paren) {
      return initialValue(paren.inner());
    } else if (expr instanceof ListLiteral list) {
      List<Object> values = new ArrayList<>();
      list.elements().forEach(e -> values.add(initialValue(e)));
      return values;
    } else if (expr instanceof Unary unary
        && unary.op() == UnaryOp.NEGATE
        && initialValue(unary.operand()) instanceof Number n) {
      return (n instanceof Long l) ? (Object) (-l) : (Object) (-n.doubleValue());
    }
    return null;
  }

  private static @Nullable Object literalValue(Literal literal) {
    if (literal.kind() == LiteralKind.DECIMAL) {
      return Double.parseDouble((String) literal.value());
    }
    return literal.value();
  }

  /**
   * If the entity has a {@code Character} component whose {@code class} is a string literal,
   * returns a singleton list of that class; otherwise returns null.
   */
  private static @Nullable List<String> characterClass(EntityDef entity) {
    for (ComponentInit init : entity.components()) {
      if (init.name().equals("Character")) {
        for (FieldInit field : init.fields()) {
          if (field.name().equals("class")
              && field.value() instanceof Literal literal
              && literal.kind() == LiteralKind.STRING) {
            return ImmutableList.of((String) literal.value());
          }
        }
        break;
      }
    }
    return null;
  }

  /**
   * A function's IR body is the value of the first {@code return} among the top-level statements
   * of its body, or 0 if there is none. Returns nested in {@code if} or loops are not seen.
   */
  private IrExpr functionBody(Block body) {
    for (Statement stmt : body.statements()) {
      if (stmt instanceof Return ret && ret.value() != null) {
        return expr(ret.value());
      }
    }
    return IrExpr.Literal.of(0L);
  }

  private static IrChoicePoint choicePoint(
      String name,
      List<IrParam> params,
      IrType returnType,
      @Nullable List<String> applicableClasses) {
    String signature =
        String.format(
            "choice fn %s(%s): %s",
            name,
            params.stream()
                .map(p -> p.name() + ": " + p.type().signature())
                .collect(Collectors.joining(", ")),
            returnType.signature());
    return new IrChoicePoint(
        name,
        StringUtil.humanize(name),
        signature,
        params,
        returnType,
        category(name),
        applicableClasses);
  }

  /** Guesses a choice point's category from its name. */
  static @Nullable String category(String name) {
    if (name.contains("target")) {
      return "targeting";
    } else if (name.contains("skill")) {
      return "skills";
    } else if (name.contains("flee") || name.contains("retreat")) {
      return "strategy";
    }
    return null;
  }

  // ===== Statements =====

  private ImmutableList<IrAction> actions(Block block) {
    ImmutableList.Builder<IrAction> result = ImmutableList.builder();
    for (Statement stmt : block.statements()) {
      IrAction action = stmt.accept(this);
      if (action != null) {
        result.add(action);
      }
    }
    return result.build();
  }

  private IrComponentInit componentInit(ComponentInit init) {
    return new IrComponentInit(init.name(), fieldExprs(init.fields()));
  }

  private ImmutableMap<String, IrExpr> fieldExprs(List<FieldInit> fields) {
    ImmutableMap.Builder<String, IrExpr> result = ImmutableMap.builder();
    fields.forEach(f -> result.put(f.name(), expr(f.value())));
    return result.buildKeepingLast();
  }

  @Override
  public IrAction visitLet(Let stmt) {
    return new IrAction.Let(stmt.name(), expr(stmt.value()));
  }

  /**
   * Only {@code x.Component.field} targets can be assigned. Other targets, such as {@code e.hp},
   * produce no action rather than a modify of a placeholder "Unknown" component.
   */
  @Override
  public @Nullable IrAction visitAssign(Assign stmt) {
    if (stmt.target() instanceof FieldAccess access
        && access.base() instanceof FieldAccess component) {
      return new IrAction.Modify(
          expr(component.base()),
          component.field(),
          access.field(),
          stmt.op().irName,
          expr(stmt.value()));
    }
    return null;
  }

  @Override
  public IrAction visitIf(If stmt) {
    List<IrAction> elseActions = null;
    if (stmt.elseIf() != null) {
      elseActions = ImmutableList.of(visitIf(stmt.elseIf()));
    } else if (stmt.elseBlock() != null) {
      elseActions = actions(stmt.elseBlock());
    }
    return new IrAction.Conditional(
        expr(stmt.condition()), actions(stmt.thenBlock()), elseActions);
  }

  @Override
  public IrAction visitFor(For stmt) {
    return new IrAction.Loop(stmt.variable(), expr(stmt.iterable()), actions(stmt.body()));
  }

  @Override
  public IrAction visitWhile(While stmt) {
    return new IrAction.While(expr(stmt.condition()), actions(stmt.body()));
  }

  @Override
  public @Nullable IrAction visitReturn(Return stmt) {
    return null;
  }

  @Override
  public IrAction visitSchedule(Schedule stmt) {
    return new IrAction.Schedule(
        stmt.event(),
        (stmt.delay() == null) ? null : expr(stmt.delay()),
        (stmt.interval() == null) ? null : expr(stmt.interval()),
        stmt.recurring() ? Boolean.TRUE : null,
        stmt.fields().isEmpty() ? null : fieldExprs(stmt.fields()));
  }

  @Override
  public @Nullable IrAction visitCancel(Cancel stmt) {
    return null;
  }

  @Override
  public IrAction visitCreate(Create stmt) {
    return new IrAction.Spawn(
        stmt.components().stream()
            .map(this::componentInit)
            .collect(ImmutableList.toImmutableList()));
  }

  @Override
  public IrAction visitDelete(Delete stmt) {
    return new IrAction.Despawn(expr(stmt.entity()));
  }

  @Override
  public @Nullable IrAction visitExpression(ExpressionStatement stmt) {
    return null;
  }

  // ===== Expressions =====

  private IrExpr expr(Expr expr) {
    return expr.accept(this);
  }

  private ImmutableList<IrExpr> exprs(List<Expr> exprs) {
    return exprs.stream().map(this::expr).collect(ImmutableList.toImmutableList());
  }

  @Override
  public IrExpr visitLiteral(Literal expr) {
    return IrExpr.Literal.of(literalValue(expr));
  }

  @Override
  public IrExpr visitIdentifier(Identifier expr) {
    return new IrExpr.Var(expr.name());
  }

  @Override
  public IrExpr visitEntityRef(EntityRef expr) {
    return new IrExpr.Var("@" + expr.name());
  }

  /**
   * {@code x.Component.field} with a variable {@code x} becomes a field read; any other access
   * is passed on as a variable named by its last step.
   */
  @Override
  public IrExpr visitFieldAccess(FieldAccess expr) {
    if (expr.base() instanceof FieldAccess component
        && component.base() instanceof Identifier entity) {
      return new IrExpr.Field(entity.name(), component.field(), expr.field());
    }
    return new IrExpr.Var(expr.field());
  }

  @Override
  public IrExpr visitIndex(Index expr) {
    return new IrExpr.Call("get", ImmutableList.of(expr(expr.base()), expr(expr.index())));
  }

  @Override
  public IrExpr visitUnary(Unary expr) {
    return new IrExpr.Unary(expr.op().irName, expr(expr.operand()));
  }

  @Override
  public IrExpr visitBinary(Binary expr) {
    return new IrExpr.Binary(expr.op().irName, expr(expr.left()), expr(expr.right()));
  }

  @Override
  public IrExpr visitCall(Call expr) {
    return new IrExpr.Call(expr.name(), exprs(expr.args()));
  }

  /** {@code x.m(a, b)} is compiled as {@code m(x, a, b)}. */
  @Override
  public IrExpr visitMethodCall(MethodCall expr) {
    return new IrExpr.Call(
        expr.method(),
        ImmutableList.<IrExpr>builder().add(expr(expr.base())).addAll(exprs(expr.args())).build());
  }

  @Override
  public IrExpr visitHasComponent(HasComponent expr) {
    return new IrExpr.HasComponent(expr(expr.entity()), expr.component());
  }

  @Override
  public IrExpr visitEntitiesHaving(EntitiesHaving expr) {
    return new IrExpr.Call(
        "entities_having", ImmutableList.of(IrExpr.Literal.of(expr.component())));
  }

  @Override
  public IrExpr visitClone(Clone expr) {
    return new IrExpr.Clone(
        expr(expr.source()),
        expr.overrides().stream()
            .map(this::componentInit)
            .collect(ImmutableList.toImmutableList()));
  }

  @Override
  public IrExpr visitList(ListLiteral expr) {
    return new IrExpr.Call("list", exprs(expr.elements()));
  }

  @Override
  public IrExpr visitParen(Paren expr) {
    return expr(expr.inner());
  }
}
