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
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.blinklang.ir.IrEntity;
import org.blinklang.ir.IrModule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link Compiler#compile} across multiple files, and of its diagnostics. */
@RunWith(JUnit4.class)
public class CompilerDriverTest {

  private static final CompileOptions OPTIONS =
      CompileOptions.DEFAULT
          .withModuleName("game")
          .withClock(Clock.fixed(Instant.parse("2026-05-01T12:00:00Z"), ZoneOffset.UTC));

  private static final SourceFile RULES =
      new SourceFile(
          "rules.brl",
          "component Health { current: integer max: integer }\n"
              + "rule dmg on Hit(h: id) { h.Health.current -= 10 }\n",
          Language.BRL);

  @Test
  public void twoFileProgram() {
    SourceFile data =
        new SourceFile(
            "hero.bdl", "entity { Health { current: 100 max: 100 } }\n", Language.BDL);
    CompileResult result =
        Compiler.compile(
            ImmutableList.of(RULES, data), OPTIONS.withGrammar(Grammar.PERMISSIVE));
    assertThat(result.diagnostics()).isEmpty();
    assertThat(result.ok()).isTrue();
    IrModule ir = result.ir();
    assertThat(ir.module()).isEqualTo("game");
    assertThat(ir.components()).hasSize(1);
    assertThat(ir.rules()).hasSize(1);
    assertThat(ir.entities()).hasSize(1);
    IrEntity entity = ir.entities().get(0);
    assertThat(entity.components().get("Health")).containsEntry("current", 100L);
  }

  @Test
  public void strictEntityForm() {
    SourceFile data =
        new SourceFile(
            "hero.bdl",
            "let hero: id = new entity { Health { current: 100 max: 100 } }\n",
            Language.BDL);
    CompileResult result = Compiler.compile(ImmutableList.of(RULES, data), OPTIONS);
    assertThat(result.diagnostics()).isEmpty();
    assertThat(result.ir().entities().get(0).variable()).isEqualTo("hero");
  }

  @Test
  public void semanticErrorsBlockGeneration() {
    SourceFile bad =
        new SourceFile(
            "bad.brl", "rule r on E(e: id) {\n  let y = missing\n}\n", Language.BRL);
    CompileResult result = Compiler.compile(ImmutableList.of(RULES, bad), OPTIONS);
    assertThat(result.ok()).isFalse();
    assertThat(result.ir()).isEqualTo(IrModule.empty("game"));
    assertThat(result.ir().components()).isEmpty();
    assertThat(result.ir().rules()).isEmpty();
    assertThat(result.ir().functions()).isEmpty();

    // The error is reported against the file that contains it.
    Diagnostic diagnostic = result.diagnostics().get(0);
    assertThat(diagnostic.kind()).isEqualTo(Diagnostic.Kind.SEMANTIC);
    assertThat(diagnostic.message()).isEqualTo("Undeclared variable 'missing'");
    assertThat(diagnostic.file()).isEqualTo("bad.brl");
    assertThat(diagnostic.position()).isEqualTo(31);
    assertThat(diagnostic.line()).isEqualTo(2);
    assertThat(diagnostic.column()).isEqualTo(11);
    assertThat(diagnostic.toString())
        .isEqualTo("bad.brl:2:11: semantic error: Undeclared variable 'missing'");
  }

  @Test
  public void allSemanticErrorsReported() {
    SourceFile bad =
        new SourceFile(
            "bad.brl",
            "rule r on Hit(h: id) { let a = x \n let b = h.Health.hp \n let c = f(1) }",
            Language.BRL);
    CompileResult result = Compiler.compile(ImmutableList.of(RULES, bad), OPTIONS);
    assertThat(result.diagnostics()).hasSize(3);
  }

  @Test
  public void oneSyntaxErrorPerFile() {
    SourceFile lexError = new SourceFile("a.brl", "\n\n  let s = 'open", Language.BRL);
    SourceFile parseError =
        new SourceFile("b.brl", "component A { x: }\ncomponent {", Language.BRL);
    SourceFile semanticError = new SourceFile("c.brl", "fn f() { return q }", Language.BRL);
    CompileResult result =
        Compiler.compile(ImmutableList.of(lexError, parseError, semanticError), OPTIONS);
    // Semantic analysis doesn't run if any file failed to parse.
    assertThat(result.diagnostics()).hasSize(2);
    Diagnostic lexer = result.diagnostics().get(0);
    assertThat(lexer.kind()).isEqualTo(Diagnostic.Kind.LEXER);
    assertThat(lexer.file()).isEqualTo("a.brl");
    assertThat(lexer.line()).isEqualTo(3);
    assertThat(lexer.column()).isEqualTo(11);
    Diagnostic parser = result.diagnostics().get(1);
    assertThat(parser.kind()).isEqualTo(Diagnostic.Kind.PARSER);
    assertThat(parser.file()).isEqualTo("b.brl");
    assertThat(parser.message()).isEqualTo("Expected type, got '}' at position 17");
    assertThat(result.ir()).isEqualTo(IrModule.empty("game"));
  }

  @Test
  public void compileSingle() {
    CompileResult result =
        Compiler.compileSingle("fn f() { return nope }", Language.BCL, OPTIONS);
    assertThat(result.diagnostics().get(0).file()).isEqualTo("input.bcl");

    IrModule ir =
        Compiler.compileSingle(
                "component A { x: integer }", Language.BDL, OPTIONS.withSourceMap(true))
            .ir();
    assertThat(ir.sourceFiles())
        .containsExactly(
            new IrModule.SourceFile("input.bdl", "component A { x: integer }", "bdl"));
  }

  @Test
  public void metadata() {
    IrModule ir = Compiler.compile(ImmutableList.of(RULES), OPTIONS).ir();
    assertThat(ir.metadata().compiledAt()).isEqualTo("2026-05-01T12:00:00Z");
    assertThat(ir.metadata().compilerVersion()).isEqualTo(Compiler.VERSION);
    assertThat(ir.metadata().sourceHash()).matches("[0-9a-f]{64}");
    assertThat(ir.sourceMap()).isNull();
    assertThat(CompileOptions.DEFAULT.moduleName()).isEqualTo("unnamed");
  }

  @Test
  public void emptyProgram() {
    CompileResult result = Compiler.compile(ImmutableList.of(), CompileOptions.DEFAULT);
    assertThat(result.ok()).isTrue();
    assertThat(result.ir().components()).isEmpty();
    assertThat(result.ir().module()).isEqualTo("unnamed");
  }

  @Test
  public void languageFromPath() {
    assertThat(Language.fromPath("x/y.bcl")).isEqualTo(Language.BCL);
    assertThat(Language.fromPath("DATA.BDL")).isEqualTo(Language.BDL);
    assertThat(Language.fromPath("rules.brl")).isEqualTo(Language.BRL);
    assertThat(Language.fromPath("notes.txt")).isEqualTo(Language.BRL);
    assertThat(SourceFile.of("a.bdl", "").language()).isEqualTo(Language.BDL);
  }
}
