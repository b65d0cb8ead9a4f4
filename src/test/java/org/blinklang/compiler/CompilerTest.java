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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.base.Splitter;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.blinklang.ir.IrJson;
import org.blinklang.ir.IrModule;
import org.blinklang.testing.TestdataScanner;
import org.blinklang.testing.TestdataScanner.TestProgram;
import org.junit.Test;
import org.junit.runner.RunWith;

/**
 * Compiles Blink source code from each of the .blink files in the testdata directory, based on
 * comments in the files.
 */
@RunWith(TestParameterInjector.class)
public class CompilerTest {

  private static final Path TESTDATA = Path.of("src/test/java/org/blinklang/compiler/testdata");

  /**
   * Each .blink file is expected to have source code followed by a comment that begins "{@code /*
   * COMPILE}", optionally followed by {@code PERMISSIVE} to select {@link Grammar#PERMISSIVE}.
   *
   * <p>There are two variants for the COMPILE comment:
   *
   * <ul>
   *   <li>{@code OK}, optionally followed by counts such as {@code rules=2 entities=1}: the test
   *       passes if the program compiles without diagnostics and the IR has the given number of
   *       each kind of item. The IR must also survive a trip through JSON unchanged.
   *   <li>{@code ERROR:} followed by a message: the test passes if the first diagnostic's message
   *       starts with the given message and the IR is empty.
   * </ul>
   *
   * <p>A single file may contain multiple programs, each followed by a COMPILE comment; each is
   * compiled independently.
   */
  private static final Pattern COMMENT_PATTERN =
      Pattern.compile("\n/\\* COMPILE (.*?)\\*/\\n*", Pattern.DOTALL);

  /** Parses a COMPILE comment (beginning immediately after the "/* COMPILE "). */
  private static final Pattern EXPECTATION_PATTERN =
      Pattern.compile("(PERMISSIVE )?(OK|ERROR:)(.*)", Pattern.DOTALL);

  private static final Splitter.MapSplitter COUNTS =
      Splitter.on(' ').trimResults().omitEmptyStrings().withKeyValueSeparator('=');

  private static final CompileOptions OPTIONS =
      CompileOptions.DEFAULT
          .withModuleName("test")
          .withClock(Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));

  @Test
  public void compileTestProgram(
      @TestParameter(valuesProvider = AllPrograms.class) TestProgram testProgram) {
    checkNotNull(testProgram.comment(), "No COMPILE comment found");
    Matcher matcher = EXPECTATION_PATTERN.matcher(testProgram.comment().trim());
    assertWithMessage("Bad COMPILE comment").that(matcher.matches()).isTrue();
    CompileOptions options =
        OPTIONS.withGrammar(matcher.group(1) == null ? Grammar.STRICT : Grammar.PERMISSIVE);
    CompileResult result = Compiler.compileSingle(testProgram.code(), Language.BRL, options);
    IrModule ir = result.ir();
    if (matcher.group(2).equals("OK")) {
      assertWithMessage("Unexpected diagnostics").that(result.diagnostics()).isEmpty();
      System.out.format("** %s:\n%s\n", testProgram.name(), IrJson.write(ir, true));
      for (Map.Entry<String, String> count : COUNTS.split(matcher.group(3)).entrySet()) {
        assertWithMessage("Number of %s", count.getKey())
            .that(count(ir, count.getKey()))
            .isEqualTo(Integer.parseInt(count.getValue()));
      }
      assertWithMessage("IR changed by JSON round trip")
          .that(IrJson.read(IrJson.write(ir, false)))
          .isEqualTo(ir);
    } else {
      String errMsg = matcher.group(3).trim();
      assertWithMessage("Expected error, compiled OK").that(result.diagnostics()).isNotEmpty();
      assertWithMessage("Unexpected error %s", result.diagnostics().get(0))
          .that(result.diagnostics().get(0).message())
          .startsWith(errMsg);
      assertWithMessage("IR produced despite errors")
          .that(ir)
          .isEqualTo(IrModule.empty(options.moduleName()));
    }
  }

  private static int count(IrModule ir, String kind) {
    return switch (kind) {
      case "components" -> ir.components().size();
      case "rules" -> ir.rules().size();
      case "functions" -> ir.functions().size();
      case "entities" -> ir.entities().size();
      case "choice_points" -> ir.choicePointList().size();
      default -> throw new IllegalArgumentException("Unknown count " + kind);
    };
  }

  /** Returns a TestProgram for each code chunk from a ".blink" file in our testdata directory. */
  public static final class AllPrograms extends TestdataScanner {
    public AllPrograms() {
      super(TESTDATA, ".blink", COMMENT_PATTERN);
    }
  }
}
