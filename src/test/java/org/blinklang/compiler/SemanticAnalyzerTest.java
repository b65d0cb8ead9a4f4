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

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SemanticAnalyzerTest {

  private static final String HEALTH = "component Health { current: integer max: integer }\n";

  private static ImmutableList<SemanticError> analyze(String... sources) {
    return SemanticAnalyzer.analyze(
        Arrays.stream(sources)
            .map(s -> Compiler.parse(s, Grammar.STRICT))
            .collect(ImmutableList.toImmutableList()));
  }

  private static ImmutableList<String> messages(String... sources) {
    return analyze(sources).stream()
        .map(SemanticError::message)
        .collect(ImmutableList.toImmutableList());
  }

  @Test
  public void letScoping() {
    assertThat(messages("rule r on E(e: id) { let y = x }"))
        .containsExactly("Undeclared variable 'x'");
    assertThat(messages("rule r on E(e: id) { let x = 1 \n let y = x }")).isEmpty();
    // A let isn't visible in its own initializer.
    assertThat(messages("rule r on E(e: id) { let x = x + 1 }"))
        .containsExactly("Undeclared variable 'x'");
  }

  @Test
  public void blockScoping() {
    assertThat(
            messages(
                "rule r on E(e: id) {\n"
                    + "  let a = 1\n"
                    + "  while a > 0 { let b = a }\n"
                    + "  for c in e.items { let d = c + a }\n"
                    + "  let f = b + c + d\n"
                    + "}"))
        .containsExactly(
            "Undeclared variable 'b'", "Undeclared variable 'c'", "Undeclared variable 'd'")
        .inOrder();
  }

  @Test
  public void fieldValidation() {
    ImmutableList<SemanticError> errors =
        analyze(HEALTH + "rule r on E(e: id) { let a = entity.Health.hp }");
    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).message())
        .isEqualTo("Unknown field 'hp' in component 'Health'. Available fields: current, max");
    assertThat(messages(HEALTH + "rule r on E(e: id) { let a = entity.Health.current }"))
        .isEmpty();
  }

  @Test
  public void errorSpans() {
    String source = HEALTH + "rule r on E(e: id) { let a = entity.Health.hp }";
    SemanticError error = analyze(source).get(0);
    assertThat(source.substring(error.span().start(), error.span().end()))
        .isEqualTo("entity.Health.hp");
    assertThat(error.moduleIndex()).isEqualTo(0);
  }

  @Test
  public void eventAliases() {
    assertThat(
            messages(
                HEALTH
                    + "rule r on Hit(h: id) {\n"
                    + "  let a = h.amount + event.amount\n"
                    + "  let b = h.source.Mana.points\n"
                    + "  h.target.Health.current -= 1\n"
                    + "}"))
        .isEmpty();
    // A known component after an alias is still checked.
    assertThat(messages(HEALTH + "rule r on Hit(h: id) { let a = h.target.Health.hp }"))
        .containsExactly(
            "Unknown field 'hp' in component 'Health'. Available fields: current, max");
  }

  @Test
  public void invalidAccess() {
    assertThat(messages("fn f(x: id) { return x.hp }"))
        .containsExactly(
            "Invalid field access 'x.hp'. Use 'x.Component.field' to access component fields,"
                + " or 'x' directly for entity references");
    assertThat(messages("fn f(x: id) { return x.Missing.hp }"))
        .containsExactly("Unknown component 'Missing'");
    assertThat(messages(HEALTH + "fn f(x: id) { return x.Health }")).isEmpty();
  }

  @Test
  public void functionsAndComponents() {
    assertThat(
            messages(
                HEALTH
                    + "fn helper(n: number): number { return abs(n) }\n"
                    + "rule r on E(e: id) when e has Health && e has Armor {\n"
                    + "  let a = helper(random_range(1, 2)) + nope(1)\n"
                    + "  let b = entities having Shield\n"
                    + "}"))
        .containsExactly(
            "Unknown component 'Armor'", "Unknown function 'nope'", "Unknown component 'Shield'")
        .inOrder();
  }

  @Test
  public void initializers() {
    assertThat(
            messages(
                HEALTH
                    + "let hero: id = new entity { Health { current: 1 hp: 2 } Mana { points: 3 } }"
                    + "\nrule r on E(e: id) {\n"
                    + "  create entity { Health { max: x } }\n"
                    + "  let c = clone e { Health { speed: 1 } }\n"
                    + "}"))
        .containsExactly(
            "Unknown field 'hp' in component 'Health'. Available fields: current, max",
            "Unknown component 'Mana'",
            "Undeclared variable 'x'",
            "Unknown field 'speed' in component 'Health'. Available fields: current, max")
        .inOrder();
  }

  @Test
  public void entityReferences() {
    assertThat(
            messages(
                "let hero: id = new entity\n"
                    + "rule r on E(e: id) { let a = @hero \n let b = @villain }"))
        .containsExactly("Undeclared entity 'villain'");
  }

  @Test
  public void boundAndChoiceFunctions() {
    assertThat(
            messages(
                HEALTH
                    + "let hero: id = new entity {\n"
                    + "  .pick = choice(xs: list, me: Health & Armor): id { return ys[0] }\n"
                    + "}\n"
                    + "choice fn choose(me: Health & Health): id { return me }"))
        .containsExactly("Unknown component 'Armor'", "Undeclared variable 'ys'")
        .inOrder();
  }

  @Test
  public void declarationsAreGlobal() {
    ImmutableList<SemanticError> errors =
        analyze(
            "rule r on E(e: id) { e.target.Health.current = later(1) }",
            "module m { fn later(n: number) { return n } }\n" + HEALTH,
            "rule s on E(e: id) { let z = q }");
    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).message()).isEqualTo("Undeclared variable 'q'");
    assertThat(errors.get(0).moduleIndex()).isEqualTo(2);
  }

  @Test
  public void nestedModulesAreChecked() {
    assertThat(messages("module a { module b { rule r on E(e: id) { let v = w } } }"))
        .containsExactly("Undeclared variable 'w'");
  }
}
