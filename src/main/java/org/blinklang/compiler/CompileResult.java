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
import org.blinklang.ir.IrModule;

/**
 * The outcome of a compilation. If {@code diagnostics} is non-empty, {@code ir} is the empty
 * skeleton returned by {@link IrModule#empty} and must not be run.
 */
public record CompileResult(IrModule ir, ImmutableList<Diagnostic> diagnostics) {

  /** Returns true if compilation produced no diagnostics. */
  public boolean ok() {
    return diagnostics.isEmpty();
  }
}
