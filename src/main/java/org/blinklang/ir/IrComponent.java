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

/** A component schema: its name and ordered, typed fields. */
public record IrComponent(
    @JsonProperty("id") int id,
    @JsonProperty("name") String name,
    @JsonProperty("fields") List<Field> fields) {

  public record Field(@JsonProperty("name") String name, @JsonProperty("type") IrType type) {}

  /** Returns a copy of this component with a different id. */
  public IrComponent withId(int newId) {
    return new IrComponent(newId, name, fields);
  }
}
