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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;

/**
 * A field, parameter or return type in the IR. The source language's numeric types all become
 * {@code number}, and entity ids, component types and {@code &} types all become {@code entity}.
 *
 * <p>{@code element} is set only for lists.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IrType(
    @JsonProperty("type") String type,
    @JsonProperty("element") @Nullable IrType element) {

  public static final IrType NUMBER = simple("number");
  public static final IrType STRING = simple("string");
  public static final IrType BOOLEAN = simple("boolean");
  public static final IrType ENTITY = simple("entity");

  private static IrType simple(String type) {
    return new IrType(type, null);
  }

  public static IrType list(IrType element) {
    return new IrType("list", element);
  }

  /**
   * Returns this type as it is written in a choice point signature: {@code entity} is shown as
   * {@code id} and lists as {@code list<T>}.
   */
  @JsonIgnore
  public String signature() {
    return switch (type) {
      case "entity" -> "id";
      case "list" -> "list<" + Preconditions.checkNotNull(element).signature() + ">";
      default -> type;
    };
  }
}
