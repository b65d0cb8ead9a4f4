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

package org.blinklang.util;

import com.google.common.base.Preconditions;

/**
 * A 1-based line and column in a source text, computed from a character offset.
 *
 * <p>Offsets count UTF-16 chars, the same unit the lexer uses for spans.
 */
public record SourcePosition(int line, int column) {

  /**
   * Returns the position of {@code offset} in {@code text}. An offset equal to {@code
   * text.length()} (the end-of-input position) is allowed.
   */
  public static SourcePosition of(String text, int offset) {
    Preconditions.checkPositionIndex(offset, text.length());
    int line = 1;
    int lineStart = 0;
    for (int i = 0; i < offset; i++) {
      if (text.charAt(i) == '\n') {
        line++;
        lineStart = i + 1;
      }
    }
    return new SourcePosition(line, offset - lineStart + 1);
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
