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
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.blinklang.ir.IrModule;
import org.jspecify.annotations.Nullable;

/**
 * Compiles Blink source files into an {@link IrModule}.
 *
 * <p>Each file is tokenized and parsed on its own; the first lexer or parser error in a file ends
 * that file's compilation, but the remaining files are still parsed so that each reports its own
 * first error. If every file parsed, the whole program is checked by {@link SemanticAnalyzer}, and
 * only if that finds nothing is IR generated. Compilation is all-or-nothing: whenever there are
 * diagnostics, the returned IR is {@link IrModule#empty}.
 *
 * <p>Compilation holds no state between calls, so concurrent calls are safe.
 */
public final class Compiler {

  // Static methods only
  private Compiler() {}

  private static final Logger logger = Logger.getLogger(Compiler.class.getName());

  /** The version recorded in the metadata of every module this compiler produces. */
  public static final String VERSION = "1.0.0-java";

  /** Compiles {@code sources}, which together make up a single program. */
  public static CompileResult compile(List<SourceFile> sources, CompileOptions options) {
    Preconditions.checkNotNull(sources);
    List<Diagnostic> diagnostics = new ArrayList<>();
    List<Ast.Module> modules = new ArrayList<>();
    for (SourceFile source : sources) {
      try {
        ImmutableList<Token> tokens = Lexer.tokenize(source.content());
        Ast.Module module = Parser.parse(tokens, options.grammar());
        logger.fine(
            () ->
                String.format(
                    "%s: %d tokens, %d items",
                    source.path(), tokens.size(), module.items().size()));
        modules.add(module);
      } catch (LexerError e) {
        diagnostics.add(Diagnostic.create(Diagnostic.Kind.LEXER, e.msg, source, e.position));
      } catch (ParseError e) {
        diagnostics.add(Diagnostic.create(Diagnostic.Kind.PARSER, e.msg, source, e.position));
      }
    }
    if (diagnostics.isEmpty()) {
      for (SemanticError error : SemanticAnalyzer.analyze(modules)) {
        // Every file parsed, so module indices match source indices.
        SourceFile source = sources.get(error.moduleIndex());
        diagnostics.add(
            Diagnostic.create(
                Diagnostic.Kind.SEMANTIC, error.message(), source, error.span().start()));
      }
    }
    if (!diagnostics.isEmpty()) {
      if (logger.isLoggable(Level.WARNING)) {
        logger.warning(
            String.format(
                "%s: %d error(s), first is %s",
                options.moduleName(), diagnostics.size(), diagnostics.get(0)));
      }
      return new CompileResult(
          IrModule.empty(options.moduleName()), ImmutableList.copyOf(diagnostics));
    }
    CodeGenerator generator = new CodeGenerator(options);
    sources.forEach(generator::addSourceFile);
    IrModule ir = generator.generate(modules);
    logger.fine(
        () ->
            String.format(
                "%s: %d components, %d rules, %d functions, %d entities",
                ir.module(),
                ir.components().size(),
                ir.rules().size(),
                ir.functions().size(),
                ir.entities().size()));
    return new CompileResult(ir, ImmutableList.of());
  }

  /** Compiles a single in-memory source, named {@code input.<tag>} in diagnostics. */
  public static CompileResult compileSingle(
      String source, Language language, CompileOptions options) {
    return compile(
        ImmutableList.of(new SourceFile("input." + language.tag, source, language)), options);
  }

  /** Returns the tokens of {@code source}, ending with an EOF token. */
  public static ImmutableList<Token> tokenize(String source) {
    return Lexer.tokenize(source);
  }

  /** Parses {@code source}, throwing a {@link CompileError} if it is malformed. */
  public static Ast.Module parse(String source, Grammar grammar) {
    return Parser.parse(Lexer.tokenize(source), grammar);
  }

  /** Merges separately compiled modules; see {@link ModuleMerger}. */
  public static IrModule mergeModules(List<IrModule> fragments, @Nullable String name) {
    return ModuleMerger.merge(fragments, name);
  }
}
