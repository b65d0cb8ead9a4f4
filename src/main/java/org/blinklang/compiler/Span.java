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

/**
 * A half-open range {@code [start, end)} of character offsets in a source file. Every token and
 * AST node carries one so that diagnostics can point back at the text that produced them.
 */
public record Span(int start, int end) {

  public Span {
    Preconditions.checkArgument(
        start >= 0 && start <= end, "Bad span [%s, %s)", start, end);
  }

  /** Returns a span that starts where {@code first} starts and ends where {@code last} ends. */
  public static Span covering(Span first, Span last) {
    return new Span(first.start, last.end);
  }

  /** Returns an empty span at {@code offset}. */
  public static Span at(int offset) {
    return new Span(offset, offset);
  }

  @Override
  public String toString() {
    return start + ".." + end;
  }
}
