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
import org.jspecify.annotations.Nullable;

/** An expression in the IR. The {@code type} property selects the variant. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = IrExpr.Literal.class, name = "literal"),
  @JsonSubTypes.Type(value = IrExpr.Field.class, name = "field"),
  @JsonSubTypes.Type(value = IrExpr.Var.class, name = "var"),
  @JsonSubTypes.Type(value = IrExpr.Binary.class, name = "binary"),
  @JsonSubTypes.Type(value = IrExpr.Unary.class, name = "unary"),
  @JsonSubTypes.Type(value = IrExpr.Call.class, name = "call"),
  @JsonSubTypes.Type(value = IrExpr.Clone.class, name = "clone"),
  @JsonSubTypes.Type(value = IrExpr.HasComponent.class, name = "has_component")
})
public interface IrExpr {

  /**
   * A constant. {@code value} is a Long, Double, String, Boolean or null; null is written
   * explicitly rather than omitted.
   */
  @JsonTypeName("literal")
  record Literal(
      @JsonProperty("value") @JsonInclude(JsonInclude.Include.ALWAYS) @Nullable Object value)
      implements IrExpr {

    public static Literal of(@Nullable Object value) {
      return new Literal(value);
    }
  }

  /** {@code entity.component.field}, where {@code entity} is the name of a variable. */
  @JsonTypeName("field")
  record Field(
      @JsonProperty("entity") String entity,
      @JsonProperty("component") String component,
      @JsonProperty("field") String field)
      implements IrExpr {}

  /** A variable; entity references are variables whose names start with {@code @}. */
  @JsonTypeName("var")
  record Var(@JsonProperty("name") String name) implements IrExpr {}

  @JsonTypeName("binary")
  record Binary(
      @JsonProperty("op") String op,
      @JsonProperty("left") IrExpr left,
      @JsonProperty("right") IrExpr right)
      implements IrExpr {}

  @JsonTypeName("unary")
  record Unary(@JsonProperty("op") String op, @JsonProperty("expr") IrExpr expr)
      implements IrExpr {}

  /** A call of a builtin or user-defined function; method calls pass the receiver first. */
  @JsonTypeName("call")
  record Call(@JsonProperty("function") String function, @JsonProperty("args") List<IrExpr> args)
      implements IrExpr {}

  @JsonTypeName("clone")
  record Clone(
      @JsonProperty("source") IrExpr source,
      @JsonProperty("overrides") List<IrComponentInit> overrides)
      implements IrExpr {}

  @JsonTypeName("has_component")
  record HasComponent(
      @JsonProperty("entity") IrExpr entity, @JsonProperty("component") String component)
      implements IrExpr {}
}
