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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.blinklang.compiler.Ast.BinaryOp;
import org.blinklang.compiler.Ast.TypeKind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ParserTest {

  private static Ast.Module parse(String source) {
    return Compiler.parse(source, Grammar.STRICT);
  }

  private static <T> T onlyItem(String source, Class<T> type) {
    Ast.Module module = parse(source);
    assertThat(module.items()).hasSize(1);
    return type.cast(module.items().get(0));
  }

  /** Parses {@code expr} as the value of a let in a rule body. */
  private static Ast.Expr expr(String expr) {
    Ast.RuleDef rule = onlyItem("rule r on E(e: id) { let v = " + expr + " }", Ast.RuleDef.class);
    return ((Ast.Let) rule.body().statements().get(0)).value();
  }

  @Test
  public void precedence() {
    Ast.Binary or = (Ast.Binary) expr("a || b && c == d + e * f");
    assertThat(or.op()).isEqualTo(BinaryOp.OR);
    Ast.Binary and = (Ast.Binary) or.right();
    assertThat(and.op()).isEqualTo(BinaryOp.AND);
    Ast.Binary eq = (Ast.Binary) and.right();
    assertThat(eq.op()).isEqualTo(BinaryOp.EQ);
    Ast.Binary add = (Ast.Binary) eq.right();
    assertThat(add.op()).isEqualTo(BinaryOp.ADD);
    assertThat(((Ast.Binary) add.right()).op()).isEqualTo(BinaryOp.MULTIPLY);
  }

  @Test
  public void leftAssociative() {
    Ast.Binary sub = (Ast.Binary) expr("a - b - c");
    assertThat(sub.op()).isEqualTo(BinaryOp.SUBTRACT);
    assertThat(sub.left()).isInstanceOf(Ast.Binary.class);
    assertThat(sub.right()).isInstanceOf(Ast.Identifier.class);
  }

  @Test
  public void postfix() {
    Ast.Expr e = expr("-h.target.items[0].count(1, 2) has Health");
    assertThat(e).isInstanceOf(Ast.Unary.class);
    Ast.HasComponent has = (Ast.HasComponent) ((Ast.Unary) e).operand();
    assertThat(has.component()).isEqualTo("Health");
    Ast.MethodCall call = (Ast.MethodCall) has.entity();
    assertThat(call.method()).isEqualTo("count");
    assertThat(call.args()).hasSize(2);
    assertThat(call.base()).isInstanceOf(Ast.Index.class);
  }

  @Test
  public void literals() {
    assertThat(((Ast.Literal) expr("12")).value()).isEqualTo(12L);
    assertThat(((Ast.Literal) expr("1.5")).value()).isEqualTo(1.5);
    Ast.Literal decimal = (Ast.Literal) expr("1.50d");
    assertThat(decimal.kind()).isEqualTo(Ast.LiteralKind.DECIMAL);
    assertThat(decimal.value()).isEqualTo("1.50");
    assertThat(((Ast.Literal) expr("'it\\'s'")).value()).isEqualTo("it\\'s");
    assertThat(((Ast.Literal) expr("null")).value()).isNull();
  }

  @Test
  public void ruleHeader() {
    Ast.RuleDef rule =
        onlyItem(
            "rule hurt on Hit(h: id) when h.amount > 0 [priority: 5] { }", Ast.RuleDef.class);
    assertThat(rule.name()).isEqualTo("hurt");
    assertThat(rule.event()).isEqualTo("Hit");
    assertThat(rule.eventParam().name()).isEqualTo("h");
    assertThat(rule.condition()).isInstanceOf(Ast.Binary.class);
    assertThat(rule.priority()).isEqualTo(5L);

    Ast.RuleDef anonymous = onlyItem("rule on Tick(t: id) {}", Ast.RuleDef.class);
    assertThat(anonymous.name()).isNull();
    assertThat(anonymous.priority()).isNull();
  }

  @Test
  public void types() {
    Ast.ComponentDef component =
        onlyItem(
            "component C { a: list b: list<float> c: Health? d: number }", Ast.ComponentDef.class);
    assertThat(component.fields().get(0).type().toString()).isEqualTo("list<id>");
    assertThat(component.fields().get(1).type().toString()).isEqualTo("list<float>");
    Ast.FieldDef c = component.fields().get(2);
    assertThat(c.optional()).isTrue();
    assertThat(c.type().kind()).isEqualTo(TypeKind.OPTIONAL);
    assertThat(c.type().toString()).isEqualTo("Health?");
    assertThat(component.fields().get(3).type().kind()).isEqualTo(TypeKind.NUMBER);
  }

  @Test
  public void compositeTypes() {
    Ast.FunctionDef fn =
        onlyItem("choice fn f(x: A & B & C, y: id): id { return x }", Ast.FunctionDef.class);
    assertThat(fn.isChoice()).isTrue();
    Ast.TypeExpr type = fn.params().get(0).type();
    assertThat(type.kind()).isEqualTo(TypeKind.COMPOSITE);
    assertThat(type.requiredComponents()).containsExactly("A", "B", "C").inOrder();
    assertThat(type.toString()).isEqualTo("A & B & C");

    ParseError e =
        assertThrows(ParseError.class, () -> parse("choice fn f(x: A & id) { return x }"));
    assertThat(e.msg).startsWith("Expected component type in '&' type, got 'id'");
    // Plain functions don't take composite types.
    assertThrows(ParseError.class, () -> parse("fn f(x: A & B) { return x }"));
  }

  @Test
  public void returnWithoutValue() {
    Ast.FunctionDef fn =
        onlyItem("fn f() { if true { return } return let x = 1 }", Ast.FunctionDef.class);
    assertThat(fn.body().statements()).hasSize(3);
    assertThat(((Ast.Return) fn.body().statements().get(1)).value()).isNull();
    assertThat(fn.returnType()).isNull();
  }

  @Test
  public void assignments() {
    Ast.RuleDef rule =
        onlyItem(
            "rule r on E(e: id) { e.A.x = 1 e.A.x += 1 e.A.x -= 1 e.A.x *= 1 e.A.x /= 1 }",
            Ast.RuleDef.class);
    assertThat(
            rule.body().statements().stream().map(s -> ((Ast.Assign) s).op()).toList())
        .containsExactly(
            Ast.AssignOp.SET,
            Ast.AssignOp.ADD,
            Ast.AssignOp.SUBTRACT,
            Ast.AssignOp.MULTIPLY,
            Ast.AssignOp.DIVIDE)
        .inOrder();
  }

  @Test
  public void scheduleOptions() {
    Ast.RuleDef rule =
        onlyItem(
            "rule r on E(e: id) { schedule recurring [interval: 2] Tick { n: 1 } }",
            Ast.RuleDef.class);
    Ast.Schedule schedule = (Ast.Schedule) rule.body().statements().get(0);
    assertThat(schedule.recurring()).isTrue();
    assertThat(schedule.delay()).isNull();
    assertThat(schedule.interval()).isNotNull();
    assertThat(schedule.event()).isEqualTo("Tick");
    assertThat(schedule.fields()).hasSize(1);
  }

  @Test
  public void entities() {
    Ast.EntityDef entity =
        onlyItem(
            "let hero: id = new entity {\n"
                + "  Health { current: 10 }\n"
                + "  .pick = choice(xs: list): id { return xs[0] }\n"
                + "}",
            Ast.EntityDef.class);
    assertThat(entity.variable()).isEqualTo("hero");
    assertThat(entity.components()).hasSize(1);
    assertThat(entity.boundFunctions()).hasSize(1);
    assertThat(entity.boundFunctions().get(0).name()).isEqualTo("pick");
  }

  @Test
  public void permissiveEntities() {
    String source = "entity { } entity @boss { } minion = new entity { }";
    Ast.Module module = Compiler.parse(source, Grammar.PERMISSIVE);
    assertThat(module.items()).hasSize(3);
    assertThat(((Ast.EntityDef) module.items().get(0)).variable()).isNull();
    assertThat(((Ast.EntityDef) module.items().get(1)).variable()).isEqualTo("boss");
    assertThat(((Ast.EntityDef) module.items().get(2)).variable()).isEqualTo("minion");

    ParseError e = assertThrows(ParseError.class, () -> parse(source));
    assertThat(e.msg)
        .isEqualTo(
            "Unexpected token 'entity' at position 0. Entities must be declared with:"
                + " let name: id = new entity { ... }");
  }

  @Test
  public void importsAndModules() {
    Ast.Module module = parse("import a.b.c { x, y } module m { module n { } }");
    Ast.ImportDef imp = (Ast.ImportDef) module.items().get(0);
    assertThat(imp.path()).containsExactly("a", "b", "c").inOrder();
    assertThat(imp.names()).containsExactly("x", "y").inOrder();
    Ast.ModuleDef m = (Ast.ModuleDef) module.items().get(1);
    assertThat(m.name()).isEqualTo("m");
    assertThat(m.items()).hasSize(1);
  }

  @Test
  public void errors() {
    ParseError e = assertThrows(ParseError.class, () -> parse("rule r on E(e: id { }"));
    assertThat(e.msg).isEqualTo("Expected ), got '{' at position 18");
    assertThat(e.position).isEqualTo(18);

    e = assertThrows(ParseError.class, () -> expr("99999999999999999999"));
    assertThat(e.msg).startsWith("Integer literal '99999999999999999999' out of range");

    e = assertThrows(ParseError.class, () -> expr(")"));
    assertThat(e.msg).startsWith("Unexpected token ')' in expression");
  }
}
