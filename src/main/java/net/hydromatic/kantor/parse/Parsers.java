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

import net.hydromatic.kantor.ast.Ast;
import net.hydromatic.kantor.util.KantorException;

import com.google.common.collect.ImmutableSet;

import static net.hydromatic.kantor.ast.AstBuilder.ast;

import static com.google.common.base.Preconditions.checkArgument;

/** Utilities for parsing. */
public final class Parsers {
  private Parsers() {}

  /**
   * Converts a number token to a literal.
   *
   * <p>A lexeme that contains '.' is a {@code real}, otherwise an
   * {@code int}. An integer that does not fit in 64 bits is a
   * {@link KantorException.Kind#VALUE} error.
   */
  public static Ast.Literal numberLiteral(Token token) {
    checkArgument(token.type == TokenType.NUMBER);
    try {
      if (token.text.indexOf('.') >= 0) {
        return ast.realLiteral(token.pos, Double.parseDouble(token.text));
      }
      return ast.intLiteral(token.pos, Long.parseLong(token.text));
    } catch (NumberFormatException e) {
      throw new KantorParseException(KantorException.Kind.VALUE,
          "malformed numeric literal: " + token.text, token,
          ImmutableSet.of());
    }
  }
}

// End Parsers.java
