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

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/** Lexical token.
 *
 * <p>For a string token, {@link #text} is the content without the
 * enclosing quotes; for any other token, it is the text as written. */
public class Token {
  public final TokenType type;
  public final String text;
  public final Pos pos;

  public Token(TokenType type, String text, Pos pos) {
    this.type = requireNonNull(type);
    this.text = requireNonNull(text);
    this.pos = requireNonNull(pos);
  }

  @Override public int hashCode() {
    return Objects.hash(type, text, pos);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Token
        && type == ((Token) o).type
        && text.equals(((Token) o).text)
        && pos.equals(((Token) o).pos);
  }

  @Override public String toString() {
    return type + "(" + text + ")";
  }

  /** Describes this token for an error message, e.g. "'}'" or
   * "IDENTIFIER 'foo'". */
  public String describe() {
    switch (type) {
    case EOF:
      return "end of input";
    case IDENTIFIER:
    case NUMBER:
    case ILLEGAL:
      return type + " '" + text + "'";
    case STRING:
      return "STRING \"" + text + "\"";
    default:
      return type.describe();
    }
  }
}

// End Token.java
