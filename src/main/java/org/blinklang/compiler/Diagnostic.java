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

import com.google.common.base.Ascii;
import org.blinklang.util.SourcePosition;

/**
 * A problem reported by {@link Compiler}, located in one of its input files.
 *
 * @param position the character offset of the problem in {@code file}
 * @param line the 1-based line containing {@code position}
 * @param column the 1-based column of {@code position}
 */
public record Diagnostic(
    Kind kind, String message, String file, int position, int line, int column) {

  /** Which phase of the compiler found the problem. */
  public enum Kind {
    LEXER,
    PARSER,
    SEMANTIC
  }

  static Diagnostic create(Kind kind, String message, SourceFile file, int position) {
    SourcePosition lineAndColumn = SourcePosition.of(file.content(), position);
    return new Diagnostic(
        kind, message, file.path(), position, lineAndColumn.line(), lineAndColumn.column());
  }

  /** Returns the diagnostic in the conventional {@code file:line:column: message} form. */
  @Override
  public String toString() {
    return String.format(
        "%s:%d:%d: %s error: %s", file, line, column, Ascii.toLowerCase(kind.name()), message);
  }
}
