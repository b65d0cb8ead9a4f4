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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * An entity in the initial state.
 *
 * <p>{@code components} maps each component name to its field values. Values are plain data
 * (Long, Double, String, Boolean, null, or a List of those); a field initialized with anything
 * other than a literal or a list of literals has a null value. The maps may contain nulls, so they
 * are never Guava immutable maps.
 *
 * <p>{@code boundFunctions} maps the name of each choice function attached to this entity to its
 * definition; the runtime resolves calls through this table.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IrEntity(
    @JsonProperty("id") int id,
    @JsonProperty("variable") @Nullable String variable,
    @JsonProperty("components") Map<String, Map<String, Object>> components,
    @JsonProperty("bound_functions") @Nullable Map<String, BoundFunction> boundFunctions) {

  /** A choice function attached to one entity. */
  public record BoundFunction(
      @JsonProperty("params") List<IrParam> params,
      @JsonProperty("return_type") IrType returnType,
      @JsonProperty("body") IrExpr body) {}

  /** Returns a copy of this entity with a different id. */
  public IrEntity withId(int newId) {
    return new IrEntity(newId, variable, components, boundFunctions);
  }
}
