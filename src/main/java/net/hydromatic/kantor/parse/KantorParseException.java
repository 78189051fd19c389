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
import net.hydromatic.kantor.util.KantorException;

import com.google.common.collect.ImmutableSet;

import java.util.Set;

import static java.util.Objects.requireNonNull;

/** Exception caused by a parse error.
 *
 * <p>Usually of kind {@link Kind#SYNTAX}; a numeric literal too large to
 * represent is of kind {@link Kind#VALUE}. */
public class KantorParseException extends RuntimeException
    implements KantorException {
  private final Kind kind;
  private final Pos pos;
  /** The token that could not be matched. */
  public final Token token;
  /** The token types that would have been accepted; may be empty. */
  public final ImmutableSet<TokenType> expected;

  KantorParseException(Kind kind, String message, Token token,
      Set<TokenType> expected) {
    super(message);
    this.kind = requireNonNull(kind);
    this.token = requireNonNull(token);
    this.pos = token.pos;
    this.expected = ImmutableSet.copyOf(expected);
  }

  /** Creates a syntax error. */
  static KantorParseException syntax(String message, Token token,
      Set<TokenType> expected) {
    return new KantorParseException(Kind.SYNTAX, message, token, expected);
  }

  @Override public Kind kind() {
    return kind;
  }

  @Override public Pos pos() {
    return pos;
  }
}

// End KantorParseException.java
