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

import org.blinklang.compiler.Ast.ComponentDef;
import org.blinklang.compiler.Ast.EntityDef;
import org.blinklang.compiler.Ast.FunctionDef;
import org.blinklang.compiler.Ast.ImportDef;
import org.blinklang.compiler.Ast.ItemVisitor;
import org.blinklang.compiler.Ast.ModuleDef;
import org.blinklang.compiler.Ast.RuleDef;

/**
 * The first semantic pass records every component schema, function name and named entity in the
 * program's {@link Symbols}. It runs over all modules before {@link PassTwo} starts, so
 * declarations are visible regardless of file or declaration order.
 *
 * <p>Nested {@code module} blocks are collected too; their declarations are global like all
 * others.
 */
class PassOne implements ItemVisitor<Void> {

  /** Runs the first pass over the given module. */
  static void apply(Symbols symbols, Ast.Module module) {
    PassOne pass = new PassOne(symbols);
    module.items().forEach(item -> item.accept(pass));
  }

  private final Symbols symbols;

  private PassOne(Symbols symbols) {
    this.symbols = symbols;
  }

  @Override
  public Void visitComponent(ComponentDef item) {
    symbols.addComponent(item);
    return null;
  }

  @Override
  public Void visitFunction(FunctionDef item) {
    symbols.addFunction(item.name());
    return null;
  }

  @Override
  public Void visitModule(ModuleDef item) {
    item.items().forEach(nested -> nested.accept(this));
    return null;
  }

  @Override
  public Void visitRule(RuleDef item) {
    return null;
  }

  @Override
  public Void visitImport(ImportDef item) {
    return null;
  }

  @Override
  public Void visitEntity(EntityDef item) {
    if (item.variable() != null) {
      symbols.addEntity(item.variable());
    }
    return null;
  }
}
