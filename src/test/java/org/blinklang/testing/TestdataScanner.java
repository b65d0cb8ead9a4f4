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

package org.blinklang.testing;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;

/**
 * Provides the programs in a testdata directory as test parameters.
 *
 * <p>Each file with the given extension is split into programs by {@code commentPattern}: the
 * text before each match is a program, and the pattern's first group is the comment describing
 * what the test should expect of it. Text after the last match that isn't blank becomes a program
 * with a null comment, so that a missing comment fails loudly instead of being skipped.
 */
public class TestdataScanner implements TestParameter.TestParameterValuesProvider {

  /**
   * One program from a testdata file. {@code name} is the file name, followed by the program's
   * index if the file holds more than one.
   */
  public record TestProgram(String name, String code, @Nullable String comment) {
    @Override
    public String toString() {
      return name;
    }
  }

  private final Path directory;
  private final String extension;
  private final Pattern commentPattern;

  protected TestdataScanner(Path directory, String extension, Pattern commentPattern) {
    this.directory = directory;
    this.extension = extension;
    this.commentPattern = commentPattern;
  }

  @Override
  public List<TestProgram> provideValues() {
    ImmutableList.Builder<TestProgram> result = ImmutableList.builder();
    try (Stream<Path> files = Files.list(directory)) {
      for (Path file : files.filter(f -> f.toString().endsWith(extension)).sorted().toList()) {
        scan(file, result);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return result.build();
  }

  private void scan(Path file, ImmutableList.Builder<TestProgram> result) throws IOException {
    String text = Files.readString(file);
    String fileName = file.getFileName().toString();
    Matcher matcher = commentPattern.matcher(text);
    ImmutableList.Builder<TestProgram> programs = ImmutableList.builder();
    int start = 0;
    while (matcher.find()) {
      programs.add(
          new TestProgram(fileName, text.substring(start, matcher.start()), matcher.group(1)));
      start = matcher.end();
    }
    if (!text.substring(start).isBlank()) {
      programs.add(new TestProgram(fileName, text.substring(start), null));
    }
    ImmutableList<TestProgram> found = programs.build();
    if (found.size() == 1) {
      result.add(found.get(0));
    } else {
      for (int i = 0; i < found.size(); i++) {
        TestProgram p = found.get(i);
        result.add(new TestProgram(fileName + "_" + (i + 1), p.code(), p.comment()));
      }
    }
  }
}
