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

package org.blinklang.ir;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * A plain or choice function. {@code body} is a single expression: the value of the function's
 * first top-level {@code return}, or the literal 0 if there is none.
 */
public record IrFunction(
    @JsonProperty("id") int id,
    @JsonProperty("name") String name,
    @JsonProperty("params") List<IrParam> params,
    @JsonProperty("return_type") IrType returnType,
    @JsonProperty("body") IrExpr body) {

  /** Returns a copy of this function with a different id. */
  public IrFunction withId(int newId) {
    return new IrFunction(newId, name, params, returnType, body);
  }
}
