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
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A compiled Blink program: the only artifact handed to the runtime. It is plain data (no cycles
 * or handles) and serializes to JSON with {@link IrJson}.
 *
 * <p>Components, rules, functions and entities each have their own sequence of ids, starting at
 * zero and assigned in declaration order. The optional members are omitted (null) rather than
 * empty: {@code initialState} when there are no entities, {@code choicePoints} when there are no
 * choice functions, and {@code sourceMap} unless it was requested.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IrModule(
    @JsonProperty("version") String version,
    @JsonProperty("module") String module,
    @JsonProperty("metadata") @Nullable Metadata metadata,
    @JsonProperty("components") List<IrComponent> components,
    @JsonProperty("rules") List<IrRule> rules,
    @JsonProperty("functions") List<IrFunction> functions,
    @JsonProperty("initial_state") @Nullable InitialState initialState,
    @JsonProperty("choice_points") @Nullable List<IrChoicePoint> choicePoints,
    @JsonProperty("source_map") @Nullable SourceMap sourceMap) {

  public IrModule {
    Preconditions.checkNotNull(version, "version");
    Preconditions.checkNotNull(module, "module");
    Preconditions.checkNotNull(components, "components");
    Preconditions.checkNotNull(rules, "rules");
    Preconditions.checkNotNull(functions, "functions");
  }

  /** The IR format version written by this compiler. */
  public static final String VERSION = "1.0";

  /**
   * Returns the module returned in place of a real one when compilation fails: no metadata and
   * empty components, rules and functions.
   */
  public static IrModule empty(String module) {
    return new IrModule(
        VERSION,
        module,
        null,
        ImmutableList.of(),
        ImmutableList.of(),
        ImmutableList.of(),
        null,
        null,
        null);
  }

  /** Returns the entities of the initial state, or an empty list if there is none. */
  @JsonIgnore
  public List<IrEntity> entities() {
    return (initialState == null) ? ImmutableList.of() : initialState.entities();
  }

  /** Returns the choice points, or an empty list if there are none. */
  @JsonIgnore
  public List<IrChoicePoint> choicePointList() {
    return (choicePoints == null) ? ImmutableList.of() : choicePoints;
  }

  /** Returns the source files, or an empty list if there is no source map. */
  @JsonIgnore
  public List<SourceFile> sourceFiles() {
    return (sourceMap == null) ? ImmutableList.of() : sourceMap.files();
  }

  /**
   * When and by what the module was produced. {@code sourceHash} is the SHA-256 of the sources it
   * was compiled from; merged modules have none.
   */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Metadata(
      @JsonProperty("compiled_at") String compiledAt,
      @JsonProperty("compiler_version") String compilerVersion,
      @JsonProperty("source_hash") @Nullable String sourceHash) {}

  public record InitialState(@JsonProperty("entities") List<IrEntity> entities) {
    public InitialState {
      Preconditions.checkNotNull(entities, "entities");
    }
  }

  public record SourceMap(@JsonProperty("files") List<SourceFile> files) {
    public SourceMap {
      Preconditions.checkNotNull(files, "files");
    }
  }

  /** One input file, with {@code language} one of brl, bcl and bdl. */
  public record SourceFile(
      @JsonProperty("path") String path,
      @JsonProperty("content") String content,
      @JsonProperty("language") String language) {}
}
