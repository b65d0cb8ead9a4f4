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

/**
 * All Blink lexer and parser errors throw a CompileError.
 *
 * <p>{@code position} is the character offset in the source file where the problem was detected;
 * {@link Compiler} turns it into a line and column when it reports the error.
 */
public class CompileError extends RuntimeException {
  public final String msg;
  public final int position;

  public CompileError(String msg, int position) {
    super(msg);
    this.msg = msg;
    this.position = position;
  }

  @Override
  public String getMessage() {
    return String.format("%s (at %s)", msg, position);
  }
}
