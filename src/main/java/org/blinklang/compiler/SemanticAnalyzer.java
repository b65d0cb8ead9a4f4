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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks a parsed program for references to undeclared variables, components, fields and
 * functions.
 *
 * <p>Analysis sees all modules of a program at once: {@link PassOne} collects the declarations of
 * every module, then {@link PassTwo} checks each module against them.
 */
public class SemanticAnalyzer {

  // Statics only
  private SemanticAnalyzer() {}

  /**
   * Returns all the semantic errors in {@code modules}, in module order and then source order.
   * Never throws for a well-formed AST; an empty result means the program is valid.
   */
  public static ImmutableList<SemanticError> analyze(List<Ast.Module> modules) {
    Symbols symbols = new Symbols();
    for (Ast.Module module : modules) {
      PassOne.apply(symbols, module);
    }
    List<SemanticError> errors = new ArrayList<>();
    for (int i = 0; i < modules.size(); i++) {
      PassTwo.apply(symbols, modules.get(i), i, errors);
    }
    return ImmutableList.copyOf(errors);
  }
}
