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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SourcePositionTest {

  private static final String TEXT = "ab\ncd\n\nef";

  @Test
  public void lineAndColumn() {
    assertThat(SourcePosition.of(TEXT, 0)).isEqualTo(new SourcePosition(1, 1));
    assertThat(SourcePosition.of(TEXT, 1)).isEqualTo(new SourcePosition(1, 2));
    // A newline belongs to the line it ends.
    assertThat(SourcePosition.of(TEXT, 2)).isEqualTo(new SourcePosition(1, 3));
    assertThat(SourcePosition.of(TEXT, 3)).isEqualTo(new SourcePosition(2, 1));
    assertThat(SourcePosition.of(TEXT, 6)).isEqualTo(new SourcePosition(3, 1));
    assertThat(SourcePosition.of(TEXT, 8)).isEqualTo(new SourcePosition(4, 2));
  }

  @Test
  public void endOfText() {
    assertThat(SourcePosition.of(TEXT, TEXT.length())).isEqualTo(new SourcePosition(4, 3));
    assertThat(SourcePosition.of("", 0)).isEqualTo(new SourcePosition(1, 1));
  }

  @Test
  public void printsAsLineColon() {
    assertThat(new SourcePosition(12, 4).toString()).isEqualTo("12:4");
  }
}
