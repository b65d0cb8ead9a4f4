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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.UncheckedIOException;

/**
 * Reads and writes {@link IrModule}s as JSON.
 *
 * <p>Property names are snake_case, absent optional members are omitted, and actions and
 * expressions are tagged with a {@code type} property. Untyped integers (literal values and
 * initial entity values) are read back as Longs, so reading a written module gives an equal one.
 */
public class IrJson {

  // Statics only
  private IrJson() {}

  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          // Null map values (non-literal initial entity fields) are kept.
          .setDefaultPropertyInclusion(
              JsonInclude.Value.construct(
                  JsonInclude.Include.NON_NULL, JsonInclude.Include.ALWAYS))
          .enable(DeserializationFeature.USE_LONG_FOR_INTS)
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
          .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

  /** Returns the JSON form of {@code module}, indented if {@code pretty} is true. */
  public static String write(IrModule module, boolean pretty) {
    try {
      return pretty
          ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(module)
          : MAPPER.writeValueAsString(module);
    } catch (JsonProcessingException e) {
      // The IR is plain data, so this indicates a bug.
      throw new IllegalStateException("Unable to serialize IR module " + module.module(), e);
    }
  }

  /**
   * Parses a module written by {@link #write} (or by another Blink compiler). Unknown properties
   * are ignored.
   *
   * @throws UncheckedIOException if {@code json} is malformed or isn't an IR module, including when
   *     a required member ({@code version}, {@code module}, {@code components}, {@code rules} or
   *     {@code functions}) is missing
   */
  public static IrModule read(String json) {
    try {
      return MAPPER.readValue(json, IrModule.class);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Invalid IR module: " + e.getOriginalMessage(), e);
    }
  }
}
