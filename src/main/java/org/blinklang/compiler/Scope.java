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

package org.blinklang.compiler;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Maps the names visible at some point of a rule, function or entity to their Entries. A Scope
 * created by {@link #newChild} sees everything in its parent; names defined in the child are
 * dropped when the child is.
 */
class Scope {

  /** Maps each name defined directly in this scope to its Entry. */
  private final Map<String, Entry> entries = new HashMap<>();

  final @Nullable Scope parent;

  private Scope(@Nullable Scope parent) {
    this.parent = parent;
  }

  /** Returns a new, empty scope with no parent. */
  static Scope root() {
    return new Scope(null);
  }

  /** Returns a new, empty scope whose parent is this one. */
  Scope newChild() {
    return new Scope(this);
  }

  /** How a name may be used. */
  enum Kind {
    /** A let, loop or parameter variable, or the builtin {@code entity}. */
    VARIABLE,

    /**
     * A name bound to the triggering event of a rule (the rule's parameter, and the legacy {@code
     * event}). Events have no declared schema, so any field path through an alias is accepted.
     */
    EVENT_ALIAS
  }

  /** An Entry holds the information recorded for one name in a Scope. */
  static class Entry {
    final String name;
    final Kind kind;

    Entry(String name, Kind kind) {
      this.name = name;
      this.kind = kind;
    }

    boolean isEventAlias() {
      return kind == Kind.EVENT_ALIAS;
    }

    @Override
    public String toString() {
      return name + ":" + kind;
    }
  }

  /** Defines {@code name} in this scope, replacing any previous definition here. */
  @CanIgnoreReturnValue
  Entry define(String name, Kind kind) {
    Entry entry = new Entry(name, kind);
    entries.put(name, entry);
    return entry;
  }

  /** Returns the Entry for {@code name} in this scope or the nearest ancestor that has one. */
  @Nullable Entry lookup(String name) {
    for (Scope s = this; s != null; s = s.parent) {
      Entry entry = s.entries.get(name);
      if (entry != null) {
        return entry;
      }
    }
    return null;
  }
}
