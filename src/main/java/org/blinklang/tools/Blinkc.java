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

package org.blinklang.tools;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.blinklang.compiler.CompileError;
import org.blinklang.compiler.CompileOptions;
import org.blinklang.compiler.CompileResult;
import org.blinklang.compiler.Compiler;
import org.blinklang.compiler.Diagnostic;
import org.blinklang.compiler.Grammar;
import org.blinklang.compiler.ModuleMerger;
import org.blinklang.compiler.SourceFile;
import org.blinklang.compiler.Token;
import org.blinklang.ir.IrJson;
import org.blinklang.ir.IrModule;
import org.jspecify.annotations.Nullable;

/**
 * A command-line front end for the Blink compiler.
 *
 * <pre>
 * blinkc compile &lt;file&gt;... [--output FILE] [--pretty] [--source-map] [--module NAME]
 *     [--permissive] [--verbose]
 * blinkc check &lt;file&gt;... [--permissive]
 * blinkc tokens &lt;file&gt;
 * blinkc merge &lt;ir.json&gt;... [--output FILE] [--module NAME] [--pretty]
 * </pre>
 *
 * The system properties {@code blink.grammar} and {@code blink.moduleName} supply defaults for
 * {@code --permissive} and {@code --module}. Exits with 0 on success, 1 if there were
 * diagnostics, and 2 for a usage or I/O error.
 */
public class Blinkc {
  private Blinkc() {}

  private static final Logger logger = Logger.getLogger(Blinkc.class.getName());

  private static final String USAGE =
      "Use: blinkc (compile | check | tokens | merge) <file>... [--output FILE] [--pretty]"
          + " [--source-map] [--module NAME] [--permissive] [--verbose]";

  /** Thrown when the command line can't be understood. */
  private static class UsageError extends RuntimeException {
    UsageError(String msg) {
      super(msg);
    }
  }

  private static void checkUsage(boolean condition, String msg) {
    if (!condition) {
      throw new UsageError(msg);
    }
  }

  /** The parsed command line. */
  private static class Args {
    String command;
    final List<Path> files = new ArrayList<>();
    @Nullable Path output;
    boolean pretty;
    boolean sourceMap;
    boolean verbose;
    String moduleName = System.getProperty("blink.moduleName", "");
    Grammar grammar = Grammar.parse(System.getProperty("blink.grammar", "strict"));

    Args(String[] args) {
      checkUsage(args.length != 0, "No command given");
      command = args[0];
      for (int i = 1; i < args.length; i++) {
        String arg = args[i];
        switch (arg) {
          case "--output", "-o" -> {
            checkUsage(i + 1 < args.length, arg + " needs a file name");
            output = Path.of(args[++i]);
          }
          case "--module" -> {
            checkUsage(i + 1 < args.length, "--module needs a name");
            moduleName = args[++i];
          }
          case "--pretty" -> pretty = true;
          case "--source-map" -> sourceMap = true;
          case "--permissive" -> grammar = Grammar.PERMISSIVE;
          case "--verbose", "-v" -> verbose = true;
          default -> {
            checkUsage(!arg.startsWith("-"), "Unknown option " + arg);
            files.add(Path.of(arg));
          }
        }
      }
      checkUsage(!files.isEmpty(), "No input files");
    }

    CompileOptions options() {
      CompileOptions result =
          CompileOptions.DEFAULT.withGrammar(grammar).withSourceMap(sourceMap);
      return moduleName.isEmpty() ? result : result.withModuleName(moduleName);
    }
  }

  public static void main(String[] args) {
    if (System.getProperty("java.util.logging.SimpleFormatter.format") == null) {
      System.setProperty("java.util.logging.SimpleFormatter.format", "%4$s: %5$s%6$s%n");
    }
    System.exit(run(args, System.out, System.err));
  }

  /** Runs one command, returning the process exit status. */
  static int run(String[] argv, PrintStream out, PrintStream err) {
    Args args;
    try {
      args = new Args(argv);
    } catch (UsageError | IllegalArgumentException e) {
      err.println(e.getMessage());
      err.println(USAGE);
      return 2;
    }
    if (args.verbose) {
      enableVerboseLogging();
    }
    try {
      return switch (args.command) {
        case "compile" -> compile(args, out, err, true);
        case "check" -> compile(args, out, err, false);
        case "tokens" -> tokens(args, out, err);
        case "merge" -> merge(args, out);
        default -> {
          err.println("Unknown command " + args.command);
          err.println(USAGE);
          yield 2;
        }
      };
    } catch (UsageError e) {
      err.println(e.getMessage());
      err.println(USAGE);
      return 2;
    } catch (IOException e) {
      err.println("I/O error: " + e.getMessage());
      return 2;
    } catch (UncheckedIOException e) {
      err.println(e.getMessage());
      return 2;
    }
  }

  private static void enableVerboseLogging() {
    Logger root = Logger.getLogger("org.blinklang");
    root.setLevel(Level.FINE);
    ConsoleHandler handler = new ConsoleHandler();
    handler.setLevel(Level.FINE);
    root.addHandler(handler);
  }

  private static ImmutableList<SourceFile> readSources(List<Path> files) throws IOException {
    ImmutableList.Builder<SourceFile> result = ImmutableList.builder();
    for (Path file : files) {
      result.add(SourceFile.of(file.toString(), Files.readString(file)));
    }
    return result.build();
  }

  private static int compile(Args args, PrintStream out, PrintStream err, boolean emit)
      throws IOException {
    CompileResult result = Compiler.compile(readSources(args.files), args.options());
    for (Diagnostic diagnostic : result.diagnostics()) {
      err.println(diagnostic);
    }
    if (!result.ok()) {
      return 1;
    }
    IrModule ir = result.ir();
    logger.info(
        () ->
            String.format(
                "Compiled %d file(s): %d components, %d rules, %d functions, %d entities",
                args.files.size(),
                ir.components().size(),
                ir.rules().size(),
                ir.functions().size(),
                ir.entities().size()));
    if (emit) {
      write(IrJson.write(ir, args.pretty), args.output, out);
    } else {
      out.println("OK");
    }
    return 0;
  }

  private static int tokens(Args args, PrintStream out, PrintStream err) throws IOException {
    checkUsage(args.files.size() == 1, "tokens takes exactly one file");
    try {
      for (Token token : Compiler.tokenize(Files.readString(args.files.get(0)))) {
        out.println(token);
      }
    } catch (CompileError e) {
      err.println(args.files.get(0) + ": " + e.getMessage());
      return 1;
    }
    return 0;
  }

  private static int merge(Args args, PrintStream out) throws IOException {
    List<IrModule> fragments = new ArrayList<>();
    for (Path file : args.files) {
      fragments.add(IrJson.read(Files.readString(file)));
    }
    IrModule merged =
        ModuleMerger.merge(fragments, args.moduleName.isEmpty() ? null : args.moduleName);
    write(IrJson.write(merged, args.pretty), args.output, out);
    return 0;
  }

  private static void write(String json, @Nullable Path output, PrintStream out)
      throws IOException {
    if (output == null) {
      out.println(json);
    } else {
      Files.writeString(output, json);
    }
  }
}
