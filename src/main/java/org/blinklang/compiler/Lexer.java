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

import com.google.common.collect.ImmutableList;

/**
 * Splits Blink source text into tokens.
 *
 * <p>Whitespace, {@code //} line comments and {@code /* ... *}{@code /} block comments are
 * skipped; an unterminated block comment runs to the end of the input. Keywords take priority over
 * identifiers, and two-character operators are matched before their one-character prefixes. The
 * result always ends with a single {@link TokenKind#EOF} token whose span is empty and sits at the
 * end of the input.
 *
 * <p>Positions are offsets in UTF-16 chars.
 */
public class Lexer {

  private final String source;
  private int pos;
  private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();

  private Lexer(String source) {
    this.source = source;
  }

  /** Returns the tokens of {@code source}, or throws a {@link LexerError}. */
  public static ImmutableList<Token> tokenize(String source) {
    return new Lexer(source).run();
  }

  private ImmutableList<Token> run() {
    for (; ; ) {
      skipWhitespaceAndComments();
      if (atEnd()) {
        break;
      }
      tokens.add(scanToken());
    }
    tokens.add(new Token(TokenKind.EOF, "", Span.at(pos)));
    return tokens.build();
  }

  private boolean atEnd() {
    return pos >= source.length();
  }

  /** Returns the char {@code offset} positions ahead, or 0 if that is past the end. */
  private char peek(int offset) {
    int i = pos + offset;
    return i < source.length() ? source.charAt(i) : 0;
  }

  private void skipWhitespaceAndComments() {
    while (!atEnd()) {
      char c = peek(0);
      if (c == ' ' || c == '\t' || c == '\n' || c == '\r') {
        pos++;
      } else if (c == '/' && peek(1) == '/') {
        while (!atEnd() && peek(0) != '\n') {
          pos++;
        }
      } else if (c == '/' && peek(1) == '*') {
        int end = source.indexOf("*/", pos + 2);
        pos = (end < 0) ? source.length() : end + 2;
      } else {
        return;
      }
    }
  }

  private Token scanToken() {
    int start = pos;
    char c = peek(0);
    if (isDigit(c)) {
      return scanNumber(start);
    } else if (isIdentifierStart(c)) {
      while (isIdentifierPart(peek(0))) {
        pos++;
      }
      String text = source.substring(start, pos);
      return new Token(
          TokenKind.KEYWORDS.getOrDefault(text, TokenKind.IDENTIFIER), text, new Span(start, pos));
    } else if (c == '"' || c == '\'') {
      return scanString(start, c);
    } else if (c == '@') {
      pos++;
      if (!isIdentifierStart(peek(0))) {
        throw new LexerError(
            String.format("Expected entity name after '@' at position %s", start), start);
      }
      while (isIdentifierPart(peek(0))) {
        pos++;
      }
      return makeToken(TokenKind.ENTITY_REF, start);
    }
    // Operators and delimiters; try the two-character form first.
    if (pos + 2 <= source.length()) {
      TokenKind kind = TokenKind.OPERATORS.get(source.substring(pos, pos + 2));
      if (kind != null) {
        pos += 2;
        return makeToken(kind, start);
      }
    }
    TokenKind kind = TokenKind.OPERATORS.get(String.valueOf(c));
    if (kind == null) {
      // This includes a lone '|', since there is no bitwise or.
      throw new LexerError(
          String.format("Unexpected character '%s' at position %s", c, start), start);
    }
    pos++;
    return makeToken(kind, start);
  }

  /**
   * Scans an integer, float ({@code 1.5}) or decimal ({@code 1.50d}) literal. A '.' is only part of
   * the number if a digit follows it, so {@code 3.x} lexes as {@code 3 . x}.
   */
  private Token scanNumber(int start) {
    while (isDigit(peek(0))) {
      pos++;
    }
    if (peek(0) != '.' || !isDigit(peek(1))) {
      return makeToken(TokenKind.INTEGER_LITERAL, start);
    }
    pos++;
    while (isDigit(peek(0))) {
      pos++;
    }
    if (peek(0) == 'd') {
      pos++;
      return makeToken(TokenKind.DECIMAL_LITERAL, start);
    }
    return makeToken(TokenKind.FLOAT_LITERAL, start);
  }

  /**
   * Scans a string literal delimited by {@code quote}. A backslash skips the following char
   * without checking that it forms a valid escape.
   */
  private Token scanString(int start, char quote) {
    pos++;
    while (!atEnd() && peek(0) != quote) {
      pos += (peek(0) == '\\') ? 2 : 1;
    }
    if (atEnd()) {
      throw new LexerError(
          String.format("Unterminated string literal starting at position %s", start), start);
    }
    pos++;
    return makeToken(TokenKind.STRING_LITERAL, start);
  }

  private Token makeToken(TokenKind kind, int start) {
    return new Token(kind, source.substring(start, pos), new Span(start, pos));
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentifierStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || isDigit(c);
  }
}
