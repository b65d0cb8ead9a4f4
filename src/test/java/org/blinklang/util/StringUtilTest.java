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
public class StringUtilTest {

  @Test
  public void humanize() {
    assertThat(StringUtil.humanize("select_target")).isEqualTo("Select Target");
    assertThat(StringUtil.humanize("pick")).isEqualTo("Pick");
    assertThat(StringUtil.humanize("a__b_")).isEqualTo("A  B ");
    assertThat(StringUtil.humanize("")).isEmpty();
  }

  @Test
  public void capitalize() {
    assertThat(StringUtil.capitalize("hero")).isEqualTo("Hero");
    assertThat(StringUtil.capitalize("Hero")).isEqualTo("Hero");
    assertThat(StringUtil.capitalize("9lives")).isEqualTo("9lives");
  }

  @Test
  public void escape() {
    assertThat(StringUtil.escape("plain")).isEqualTo("plain");
    assertThat(StringUtil.escape("a\nb\tc\r")).isEqualTo("a\\nb\\tc\\r");
    assertThat(StringUtil.escape("\"q\" \\")).isEqualTo("\\\"q\\\" \\\\");
  }
}
