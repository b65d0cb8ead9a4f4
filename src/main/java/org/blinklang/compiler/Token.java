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

import org.blinklang.util.StringUtil;

/**
 * A single lexical token. {@code text} is always the exact slice of the source covered by {@code
 * span}, including the quotes of a string literal and the {@code @} of an entity reference.
 */
public record Token(TokenKind kind, String text, Span span) {

  /** Returns true if this token has the given kind. */
  public boolean is(TokenKind k) {
    return kind == k;
  }

  @Override
  public String toString() {
    return String.format("%s \"%s\" %s", kind, StringUtil.escape(text), span);
  }
}
