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

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

/** Type of a lexical token. */
public enum TokenType {
  IDENTIFIER,
  NUMBER,
  STRING,

  // keywords
  LET("let"),
  /** Reserved; not used by the grammar. */
  FILTER("filter"),
  OF("of"),
  TYPE("type"),
  RECORD("Record"),

  // punctuation
  EQUALS("="),
  PIPE("|"),
  AMPERSAND("&"),
  CROSS("*"),
  SET_OPEN("{"),
  SET_CLOSE("}"),
  LPAREN("("),
  RPAREN(")"),
  COMMA(","),
  COLON(":"),
  DOT("."),

  // comparison operators
  EQUALS_EQUALS("=="),
  NOT_EQUAL("!="),
  LESS("<"),
  LESS_EQUAL("<="),
  GREATER(">"),
  GREATER_EQUAL(">="),

  /** End of input. */
  EOF,
  /** A character that does not start any valid token. */
  ILLEGAL;

  /** Fixed text of a keyword or punctuation token; null for tokens whose
   * text varies. */
  public final @Nullable String text;

  /** Keyword token types, keyed by their text. */
  public static final ImmutableMap<String, TokenType> KEYWORDS =
      ImmutableMap.of("let", LET, "filter", FILTER, "of", OF, "type", TYPE,
          "Record", RECORD);

  TokenType() {
    this(null);
  }

  TokenType(@Nullable String text) {
    this.text = text;
  }

  /** Returns whether this is one of the six comparison operators. */
  public boolean isComparison() {
    switch (this) {
    case EQUALS_EQUALS:
    case NOT_EQUAL:
    case LESS:
    case LESS_EQUAL:
    case GREATER:
    case GREATER_EQUAL:
      return true;
    default:
      return false;
    }
  }

  /** Returns whether this is one of the binary set operators. */
  public boolean isSetOp() {
    return this == PIPE || this == AMPERSAND || this == CROSS;
  }

  /** Describes this token type for an error message, e.g. "'{'" or
   * "IDENTIFIER". */
  public String describe() {
    return text == null ? name() : "'" + text + "'";
  }
}

// End TokenType.java
