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

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * The kinds of token produced by {@link Lexer}.
 *
 * <p>Kinds with fixed text (keywords, delimiters and operators) record that text; {@link
 * #KEYWORDS} maps each keyword spelling to its kind, and {@link #OPERATORS} does the same for
 * delimiters and operators.
 */
public enum TokenKind {
  // Keywords
  COMPONENT("component", true),
  RULE("rule", true),
  ON("on", true),
  TRIGGER("trigger", true),
  EVENT("event", true),
  ENTITY("entity", true),
  IF("if", true),
  ELSE("else", true),
  FOR("for", true),
  WHILE("while", true),
  FN("fn", true),
  RETURN("return", true),
  TRUE("true", true),
  FALSE("false", true),
  NULL("null", true),
  SCHEDULE("schedule", true),
  CANCEL("cancel", true),
  RECURRING("recurring", true),
  MODULE("module", true),
  IMPORT("import", true),
  WHEN("when", true),
  CREATE("create", true),
  DELETE("delete", true),
  HAS("has", true),
  LET("let", true),
  IN("in", true),
  CHOICE("choice", true),
  NEW("new", true),
  CLONE("clone", true),
  HAVING("having", true),
  ENTITIES("entities", true),

  // Type keywords
  TYPE_STRING("string", true),
  TYPE_BOOLEAN("boolean", true),
  TYPE_INTEGER("integer", true),
  TYPE_FLOAT("float", true),
  TYPE_DECIMAL("decimal", true),
  TYPE_NUMBER("number", true),
  TYPE_ID("id", true),
  TYPE_LIST("list", true),

  // Literals and names
  INTEGER_LITERAL,
  FLOAT_LITERAL,
  DECIMAL_LITERAL,
  STRING_LITERAL,
  IDENTIFIER,
  ENTITY_REF,

  // Delimiters
  LBRACE("{"),
  RBRACE("}"),
  LPAREN("("),
  RPAREN(")"),
  LBRACKET("["),
  RBRACKET("]"),
  COMMA(","),
  COLON(":"),
  SEMICOLON(";"),
  DOT("."),
  QUESTION("?"),

  // Operators
  PLUS("+"),
  MINUS("-"),
  STAR("*"),
  SLASH("/"),
  PERCENT("%"),
  EQ("="),
  EQ_EQ("=="),
  NOT_EQ("!="),
  LT("<"),
  LT_EQ("<="),
  GT(">"),
  GT_EQ(">="),
  AND_AND("&&"),
  OR_OR("||"),
  NOT("!"),
  AND("&"),
  PLUS_EQ("+="),
  MINUS_EQ("-="),
  STAR_EQ("*="),
  SLASH_EQ("/="),
  ARROW("->"),

  EOF;

  /** The fixed text of this kind, or null for literals, identifiers and EOF. */
  public final @Nullable String text;

  /** True for keywords (including the type keywords). */
  public final boolean isKeyword;

  TokenKind() {
    this(null, false);
  }

  TokenKind(String text) {
    this(text, false);
  }

  TokenKind(@Nullable String text, boolean isKeyword) {
    this.text = text;
    this.isKeyword = isKeyword;
  }

  /** Maps each keyword's spelling to its kind. */
  public static final ImmutableMap<String, TokenKind> KEYWORDS;

  /** Maps the text of each delimiter and operator to its kind. */
  public static final ImmutableMap<String, TokenKind> OPERATORS;

  static {
    ImmutableMap.Builder<String, TokenKind> keywords = ImmutableMap.builder();
    ImmutableMap.Builder<String, TokenKind> operators = ImmutableMap.builder();
    for (TokenKind kind : values()) {
      if (kind.text == null) {
        continue;
      }
      if (kind.isKeyword) {
        keywords.put(kind.text, kind);
      } else {
        operators.put(kind.text, kind);
      }
    }
    KEYWORDS = keywords.buildOrThrow();
    OPERATORS = operators.buildOrThrow();
  }
}
