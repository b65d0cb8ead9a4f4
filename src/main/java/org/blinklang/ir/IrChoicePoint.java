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
 * Describes a decision that players or authors may customize by supplying their own choice
 * function. {@code id} is the function's name and is unique within a module.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IrChoicePoint(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("signature") String signature,
    @JsonProperty("params") List<IrParam> params,
    @JsonProperty("return_type") IrType returnType,
    @JsonProperty("category") @Nullable String category,
    @JsonProperty("applicable_classes") @Nullable List<String> applicableClasses) {}
