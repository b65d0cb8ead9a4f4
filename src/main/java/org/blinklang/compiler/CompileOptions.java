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
import java.time.Clock;

/**
 * Options controlling a compilation.
 *
 * @param moduleName the name recorded in the IR
 * @param includeSourceMap if true, the IR carries the text of every input file
 * @param grammar which top-level entity forms are accepted
 * @param clock the source of the IR's {@code compiled_at} timestamp
 */
public record CompileOptions(
    String moduleName, boolean includeSourceMap, Grammar grammar, Clock clock) {

  public static final CompileOptions DEFAULT =
      new CompileOptions("unnamed", false, Grammar.STRICT, Clock.systemUTC());

  public CompileOptions {
    Preconditions.checkNotNull(moduleName);
    Preconditions.checkNotNull(grammar);
    Preconditions.checkNotNull(clock);
  }

  public CompileOptions withModuleName(String moduleName) {
    return new CompileOptions(moduleName, includeSourceMap, grammar, clock);
  }

  public CompileOptions withSourceMap(boolean includeSourceMap) {
    return new CompileOptions(moduleName, includeSourceMap, grammar, clock);
  }

  public CompileOptions withGrammar(Grammar grammar) {
    return new CompileOptions(moduleName, includeSourceMap, grammar, clock);
  }

  public CompileOptions withClock(Clock clock) {
    return new CompileOptions(moduleName, includeSourceMap, grammar, clock);
  }
}
