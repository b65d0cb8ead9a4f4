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
import com.google.common.io.Files;

/** The three Blink source languages. They share one grammar. */
public enum Language {
  /** The rule language: components, rules, functions and entities. */
  BRL("brl"),
  /** The choice language, for strategy functions a player may customize. */
  BCL("bcl"),
  /** The data language, for entity definitions. */
  BDL("bdl");

  /** The file extension, also used as the language tag in source maps. */
  public final String tag;

  Language(String tag) {
    this.tag = tag;
  }

  /** Returns the language of a file from its extension; unrecognized extensions are BRL. */
  public static Language fromPath(String path) {
    String extension = Ascii.toLowerCase(Files.getFileExtension(path));
    for (Language language : values()) {
      if (language.tag.equals(extension)) {
        return language;
      }
    }
    return BRL;
  }
}
