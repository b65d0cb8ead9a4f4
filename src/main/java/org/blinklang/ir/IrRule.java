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
import org.jspecify.annotations.Nullable;

/**
 * A rule: when its trigger fires and its condition (if any) holds, the runtime executes its
 * actions in order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IrRule(
    @JsonProperty("id") int id,
    @JsonProperty("name") @Nullable String name,
    @JsonProperty("trigger") Trigger trigger,
    @JsonProperty("condition") @Nullable IrExpr condition,
    @JsonProperty("priority") @Nullable Long priority,
    @JsonProperty("actions") List<IrAction> actions) {

  /** What causes a rule to fire; the compiler only produces event triggers. */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Trigger(@JsonProperty("type") String type, @JsonProperty("event") String event) {

    public static Trigger event(String event) {
      return new Trigger("event", event);
    }
  }

  /** Returns a copy of this rule with a different id. */
  public IrRule withId(int newId) {
    return new IrRule(newId, name, trigger, condition, priority, actions);
  }
}
