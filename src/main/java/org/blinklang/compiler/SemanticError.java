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
 * A problem found by {@link SemanticAnalyzer}. Unlike lexer and parser errors these are not
 * thrown; the analyzer collects all of them.
 *
 * @param moduleIndex the index, in the list passed to {@link SemanticAnalyzer#analyze}, of the
 *     module containing {@code span}
 */
public record SemanticError(String message, Span span, int moduleIndex) {}
