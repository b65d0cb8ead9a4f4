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
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** One step of a rule's action list. The {@code type} property selects the variant. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = IrAction.Modify.class, name = "modify"),
  @JsonSubTypes.Type(value = IrAction.Schedule.class, name = "schedule"),
  @JsonSubTypes.Type(value = IrAction.Spawn.class, name = "spawn"),
  @JsonSubTypes.Type(value = IrAction.Despawn.class, name = "despawn"),
  @JsonSubTypes.Type(value = IrAction.Conditional.class, name = "conditional"),
  @JsonSubTypes.Type(value = IrAction.Loop.class, name = "loop"),
  @JsonSubTypes.Type(value = IrAction.Let.class, name = "let"),
  @JsonSubTypes.Type(value = IrAction.While.class, name = "while")
})
public interface IrAction {

  /**
   * Updates {@code entity.component.field}; {@code op} is one of set, add, subtract, multiply and
   * divide.
   */
  @JsonTypeName("modify")
  record Modify(
      @JsonProperty("entity") IrExpr entity,
      @JsonProperty("component") String component,
      @JsonProperty("field") String field,
      @JsonProperty("op") String op,
      @JsonProperty("value") IrExpr value)
      implements IrAction {}

  /**
   * Schedules an event. {@code recurring} is either null or true; a recurring event repeats every
   * {@code interval}.
   */
  @JsonTypeName("schedule")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  record Schedule(
      @JsonProperty("event") String event,
      @JsonProperty("delay") @Nullable IrExpr delay,
      @JsonProperty("interval") @Nullable IrExpr interval,
      @JsonProperty("recurring") @Nullable Boolean recurring,
      @JsonProperty("fields") @Nullable Map<String, IrExpr> fields)
      implements IrAction {}

  /** Creates an entity with the given components. */
  @JsonTypeName("spawn")
  record Spawn(@JsonProperty("components") List<IrComponentInit> components) implements IrAction {}

  @JsonTypeName("despawn")
  record Despawn(@JsonProperty("entity") IrExpr entity) implements IrAction {}

  /** An if/else; an else-if chain is a Conditional nested as the only else action. */
  @JsonTypeName("conditional")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  record Conditional(
      @JsonProperty("condition") IrExpr condition,
      @JsonProperty("then_actions") List<IrAction> thenActions,
      @JsonProperty("else_actions") @Nullable List<IrAction> elseActions)
      implements IrAction {}

  /** Runs {@code body} once for each element of {@code iterable}, bound to {@code variable}. */
  @JsonTypeName("loop")
  record Loop(
      @JsonProperty("variable") String variable,
      @JsonProperty("iterable") IrExpr iterable,
      @JsonProperty("body") List<IrAction> body)
      implements IrAction {}

  @JsonTypeName("let")
  record Let(@JsonProperty("name") String name, @JsonProperty("value") IrExpr value)
      implements IrAction {}

  @JsonTypeName("while")
  record While(
      @JsonProperty("condition") IrExpr condition, @JsonProperty("body") List<IrAction> body)
      implements IrAction {}
}
