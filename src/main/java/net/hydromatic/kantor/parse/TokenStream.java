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

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/** Sequential, replayable stream of tokens.
 *
 * <p>The stream never moves past its final {@link TokenType#EOF} token. */
public class TokenStream {
  private final ImmutableList<Token> tokens;
  private int i = 0;

  /** Creates a TokenStream. The list must end with exactly one EOF
   * token. */
  public TokenStream(List<Token> tokens) {
    this.tokens = ImmutableList.copyOf(tokens);
    checkArgument(!this.tokens.isEmpty()
            && this.tokens.get(this.tokens.size() - 1).type == TokenType.EOF,
        "token list must end with EOF");
    for (int j = 0; j < this.tokens.size() - 1; j++) {
      checkArgument(this.tokens.get(j).type != TokenType.EOF,
          "EOF must be the last token");
    }
  }

  /** Creates a stream by tokenizing a string. */
  public static TokenStream of(String s) {
    return new TokenStream(Lexer.tokenize(s));
  }

  /** Returns the current token. */
  public Token peek() {
    return tokens.get(i);
  }

  /** Returns the token {@code n} places ahead of the current token, or the
   * EOF token if that is beyond the end. */
  public Token peek(int n) {
    return tokens.get(Math.min(i + n, tokens.size() - 1));
  }

  /** Returns the current token and moves to the next one. Does not move
   * past EOF. */
  public Token advance() {
    final Token token = tokens.get(i);
    if (token.type != TokenType.EOF) {
      ++i;
    }
    return token;
  }

  /** Returns the index of the current token. */
  public int index() {
    return i;
  }

  /** Moves back to a previously returned index. */
  public void reset(int index) {
    checkArgument(index >= 0 && index < tokens.size());
    this.i = index;
  }
}

// End TokenStream.java
