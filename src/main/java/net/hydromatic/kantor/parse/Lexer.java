/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.kantor.parse;

import net.hydromatic.kantor.ast.Pos;

import com.google.common.collect.ImmutableList;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/** Converts Kantor source text into a list of tokens.
 *
 * <p>The lexer never fails. A character that cannot start a token becomes
 * an {@link TokenType#ILLEGAL} token, and the parser reports it. The list
 * always ends with exactly one {@link TokenType#EOF} token. */
public class Lexer {
  /** Name of the file used in positions when source is not read from a
   * file. */
  public static final String STDIN = "stdIn";

  /** A number may not be followed by '.', a letter or '_'; so "5.x" is not
   * lexed as a number. */
  private static final Pattern NUMBER =
      Pattern.compile("\\d+(\\.\\d+)?(?![.a-zA-Z_])");
  private static final Pattern IDENTIFIER =
      Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

  private final String file;
  private final String s;
  private int i = 0;
  private int line = 1;
  private int column = 1;

  /** Creates a Lexer. */
  public Lexer(String file, String s) {
    this.file = requireNonNull(file);
    this.s = requireNonNull(s);
  }

  /** Converts a string to tokens, with positions in file "stdIn". */
  public static ImmutableList<Token> tokenize(String s) {
    return new Lexer(STDIN, s).tokenize();
  }

  /** Reads all tokens, up to and including end of input. */
  public ImmutableList<Token> tokenize() {
    final ImmutableList.Builder<Token> b = ImmutableList.builder();
    for (;;) {
      final Token token = next();
      b.add(token);
      if (token.type == TokenType.EOF) {
        return b.build();
      }
    }
  }

  /** Reads the next token. */
  Token next() {
    skipWhitespaceAndComments();
    if (i >= s.length()) {
      return new Token(TokenType.EOF, "",
          new Pos(file, line, column, line, column + 1));
    }
    final char c = s.charAt(i);
    switch (c) {
    case '{':
      return token(TokenType.SET_OPEN, 1);
    case '}':
      return token(TokenType.SET_CLOSE, 1);
    case '(':
      return token(TokenType.LPAREN, 1);
    case ')':
      return token(TokenType.RPAREN, 1);
    case ',':
      return token(TokenType.COMMA, 1);
    case ':':
      return token(TokenType.COLON, 1);
    case '|':
      return token(TokenType.PIPE, 1);
    case '&':
      return token(TokenType.AMPERSAND, 1);
    case '*':
      return token(TokenType.CROSS, 1);
    case '.':
      return token(TokenType.DOT, 1);
    case '=':
      return peek() == '='
          ? token(TokenType.EQUALS_EQUALS, 2)
          : token(TokenType.EQUALS, 1);
    case '<':
      return peek() == '='
          ? token(TokenType.LESS_EQUAL, 2)
          : token(TokenType.LESS, 1);
    case '>':
      return peek() == '='
          ? token(TokenType.GREATER_EQUAL, 2)
          : token(TokenType.GREATER, 1);
    case '!':
      if (peek() == '=') {
        return token(TokenType.NOT_EQUAL, 2);
      }
      return token(TokenType.ILLEGAL, 1);
    case '"':
      final int end = s.indexOf('"', i + 1);
      if (end < 0) {
        // Unterminated string; the quote is illegal, and lexing resumes
        // after it.
        return token(TokenType.ILLEGAL, 1);
      }
      final int startLine = line;
      final int startColumn = column;
      final String content = s.substring(i + 1, end);
      advance(end + 1 - i);
      return new Token(TokenType.STRING, content,
          new Pos(file, startLine, startColumn, line, column));
    default:
      break;
    }
    final Matcher number = NUMBER.matcher(s).region(i, s.length());
    if (number.lookingAt()) {
      return token(TokenType.NUMBER, number.end() - i);
    }
    final Matcher identifier = IDENTIFIER.matcher(s).region(i, s.length());
    if (identifier.lookingAt()) {
      final String word = identifier.group();
      final TokenType keyword = TokenType.KEYWORDS.get(word);
      return token(keyword != null ? keyword : TokenType.IDENTIFIER,
          word.length());
    }
    return token(TokenType.ILLEGAL, 1);
  }

  /** Creates a token from the next {@code length} characters, and moves
   * past them. */
  private Token token(TokenType type, int length) {
    final int startLine = line;
    final int startColumn = column;
    final String text = s.substring(i, i + length);
    advance(length);
    return new Token(type, text,
        new Pos(file, startLine, startColumn, line, column));
  }

  /** Returns the character after the current one, or 0 at end of input. */
  private char peek() {
    return i + 1 < s.length() ? s.charAt(i + 1) : 0;
  }

  private void advance(int n) {
    for (int j = 0; j < n; j++) {
      if (s.charAt(i++) == '\n') {
        ++line;
        column = 1;
      } else {
        ++column;
      }
    }
  }

  private void skipWhitespaceAndComments() {
    while (i < s.length()) {
      final char c = s.charAt(i);
      if (Character.isWhitespace(c)) {
        advance(1);
      } else if (s.startsWith("//", i)) {
        while (i < s.length() && s.charAt(i) != '\n') {
          advance(1);
        }
      } else {
        return;
      }
    }
  }
}

// End Lexer.java
