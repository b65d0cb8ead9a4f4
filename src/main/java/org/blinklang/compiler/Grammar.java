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

/** Selects which top-level entity forms {@link Parser} accepts. */
public enum Grammar {
  /** Entities must be declared as {@code let name: id = new entity { ... }}. */
  STRICT,

  /**
   * In addition to the strict form, accepts {@code entity { ... }}, {@code entity @name { ... }}
   * and {@code name = new entity { ... }} at the top level.
   */
  PERMISSIVE;

  /** Parses a grammar name, ignoring case. */
  public static Grammar parse(String name) {
    return valueOf(Ascii.toUpperCase(name.trim()));
  }
}
