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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The global declarations visible to every file of a program: the component schemas, the names of
 * user-defined functions, and the variables of named entities (referenced as {@code @variable}).
 * A new Symbols is created for each call to {@link SemanticAnalyzer#analyze}, so nothing is shared
 * between compilations.
 */
class Symbols {

  /** Functions that every program may call without declaring them. */
  static final ImmutableSet<String> BUILTIN_FUNCTIONS =
      ImmutableSet.of(
          "min",
          "max",
          "floor",
          "ceil",
          "round",
          "abs",
          "random",
          "random_range",
          "len",
          "list",
          "get",
          "entities_having");

  /**
   * Maps each component name to its fields (in declaration order), each mapped to its type as
   * written in source.
   */
  private final Map<String, ImmutableMap<String, String>> components = new LinkedHashMap<>();

  /** The names of all user-defined functions, including choice functions. */
  private final Set<String> functions = new HashSet<>();

  /** The variables of all named entities in the initial state. */
  private final Set<String> entities = new HashSet<>();

  /** Records a component; a later definition with the same name replaces an earlier one. */
  void addComponent(Ast.ComponentDef def) {
    ImmutableMap.Builder<String, String> fields = ImmutableMap.builder();
    for (Ast.FieldDef field : def.fields()) {
      fields.put(field.name(), field.type().toString());
    }
    components.put(def.name(), fields.buildKeepingLast());
  }

  void addFunction(String name) {
    functions.add(name);
  }

  void addEntity(String variable) {
    entities.add(variable);
  }

  boolean hasEntity(String variable) {
    return entities.contains(variable);
  }

  boolean hasComponent(String name) {
    return components.containsKey(name);
  }

  /** Returns the fields of the named component, or null if there is no such component. */
  @Nullable ImmutableMap<String, String> fields(String component) {
    return components.get(component);
  }

  /** True if {@code name} is a builtin or a user-defined function. */
  boolean hasFunction(String name) {
    return BUILTIN_FUNCTIONS.contains(name) || functions.contains(name);
  }
}
