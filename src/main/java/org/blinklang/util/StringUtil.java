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

import com.google.common.base.Ascii;
import com.google.common.base.Splitter;
import java.util.stream.Collectors;

/** A statics-only class with string helpers used when building IR metadata. */
public class StringUtil {

  private StringUtil() {}

  private static final Splitter UNDERSCORE = Splitter.on('_');

  /**
   * Converts a snake_case identifier into a display name by capitalizing the first letter of each
   * underscore-separated word, e.g. {@code "select_target"} becomes {@code "Select Target"}. Empty
   * words (from doubled or trailing underscores) are kept, so the result has one space per
   * underscore.
   */
  public static String humanize(String name) {
    return UNDERSCORE
        .splitToStream(name)
        .map(StringUtil::capitalize)
        .collect(Collectors.joining(" "));
  }

  /** Returns {@code word} with its first character converted to upper case. */
  public static String capitalize(String word) {
    if (word.isEmpty()) {
      return word;
    }
    return Ascii.toUpperCase(word.charAt(0)) + word.substring(1);
  }

  /**
   * Returns {@code s} with control characters and quotes escaped so that it can be printed on a
   * single line, e.g. in token dumps.
   */
  public static String escape(String s) {
    StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        default -> sb.append(c);
      }
    }
    return sb.toString();
  }
}
