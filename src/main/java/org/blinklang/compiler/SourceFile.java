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

/** One input to {@link Compiler#compile}: a file's path, its full text and its language. */
public record SourceFile(String path, String content, Language language) {

  public SourceFile {
    Preconditions.checkNotNull(path);
    Preconditions.checkNotNull(content);
    Preconditions.checkNotNull(language);
  }

  /** Returns a source file whose language is determined by the extension of {@code path}. */
  public static SourceFile of(String path, String content) {
    return new SourceFile(path, content, Language.fromPath(path));
  }
}
