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
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.blinklang.ir.IrChoicePoint;
import org.blinklang.ir.IrComponent;
import org.blinklang.ir.IrEntity;
import org.blinklang.ir.IrFunction;
import org.blinklang.ir.IrModule;
import org.blinklang.ir.IrRule;
import org.jspecify.annotations.Nullable;

/**
 * Combines separately compiled IR modules into one, e.g. to add rules to a running game.
 *
 * <p>Components, rules, functions and entities are concatenated in fragment order and renumbered
 * from zero; their original ids are discarded, so references between fragments by id are not
 * preserved. Choice points are concatenated keeping the first with each id, without sorting.
 * Source maps are concatenated unchanged.
 */
public class ModuleMerger {

  // Statics only
  private ModuleMerger() {}

  /** The module name used when none is given. */
  public static final String DEFAULT_NAME = "merged";

  public static IrModule merge(List<IrModule> fragments, @Nullable String name) {
    return merge(fragments, name, Clock.systemUTC());
  }

  /** Merges {@code fragments}, stamping the result with the current time from {@code clock}. */
  public static IrModule merge(List<IrModule> fragments, @Nullable String name, Clock clock) {
    ImmutableList.Builder<IrComponent> components = ImmutableList.builder();
    ImmutableList.Builder<IrRule> rules = ImmutableList.builder();
    ImmutableList.Builder<IrFunction> functions = ImmutableList.builder();
    ImmutableList.Builder<IrEntity> entities = ImmutableList.builder();
    ImmutableList.Builder<IrChoicePoint> choicePoints = ImmutableList.builder();
    ImmutableList.Builder<IrModule.SourceFile> sourceFiles = ImmutableList.builder();
    Set<String> seenChoicePoints = new HashSet<>();
    int componentId = 0;
    int ruleId = 0;
    int functionId = 0;
    int entityId = 0;
    for (IrModule fragment : fragments) {
      for (IrComponent component : fragment.components()) {
        components.add(component.withId(componentId++));
      }
      for (IrRule rule : fragment.rules()) {
        rules.add(rule.withId(ruleId++));
      }
      for (IrFunction function : fragment.functions()) {
        functions.add(function.withId(functionId++));
      }
      for (IrEntity entity : fragment.entities()) {
        entities.add(entity.withId(entityId++));
      }
      for (IrChoicePoint choicePoint : fragment.choicePointList()) {
        if (seenChoicePoints.add(choicePoint.id())) {
          choicePoints.add(choicePoint);
        }
      }
      sourceFiles.addAll(fragment.sourceFiles());
    }
    ImmutableList<IrEntity> entityList = entities.build();
    ImmutableList<IrChoicePoint> choicePointList = choicePoints.build();
    ImmutableList<IrModule.SourceFile> sourceFileList = sourceFiles.build();
    return new IrModule(
        IrModule.VERSION,
        (name == null) ? DEFAULT_NAME : name,
        new IrModule.Metadata(Instant.now(clock).toString(), Compiler.VERSION, null),
        components.build(),
        rules.build(),
        functions.build(),
        entityList.isEmpty() ? null : new IrModule.InitialState(entityList),
        choicePointList.isEmpty() ? null : choicePointList,
        sourceFileList.isEmpty() ? null : new IrModule.SourceMap(sourceFileList));
  }
}
