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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests {@link Lexer} and {@link TokenStream}. */
public class LexerTest {
  /** Returns the tokens of a string, as a string such as
   * "[LET(let), IDENTIFIER(A), EOF()]". */
  private static String tokens(String s) {
    return Lexer.tokenize(s).toString();
  }

  private static String types(String s) {
    final List<TokenType> types =
        Lexer.tokenize(s).stream().map(t -> t.type)
            .collect(Collectors.toList());
    return types.toString();
  }

  @Test void testDeclaration() {
    assertThat(tokens("let A = {1, 2.5, \"x y\"}"),
        is("[LET(let), IDENTIFIER(A), EQUALS(=), SET_OPEN({), NUMBER(1), "
            + "COMMA(,), NUMBER(2.5), COMMA(,), STRING(x y), "
            + "SET_CLOSE(}), EOF()]"));
  }

  @Test void testKeywords() {
    assertThat(types("type P: Record(a: int) let filter of record"),
        is("[TYPE, IDENTIFIER, COLON, RECORD, LPAREN, IDENTIFIER, COLON, "
            + "IDENTIFIER, RPAREN, LET, FILTER, OF, IDENTIFIER, EOF]"));
  }

  @Test void testOperators() {
    assertThat(types("| & * . = == != < <= > >="),
        is("[PIPE, AMPERSAND, CROSS, DOT, EQUALS, EQUALS_EQUALS, NOT_EQUAL, "
            + "LESS, LESS_EQUAL, GREATER, GREATER_EQUAL, EOF]"));
    // no space needed between operators and operands
    assertThat(types("a<=b"), is("[IDENTIFIER, LESS_EQUAL, IDENTIFIER, EOF]"));
    assertThat(types("a==b"),
        is("[IDENTIFIER, EQUALS_EQUALS, IDENTIFIER, EOF]"));
  }

  @Test void testComment() {
    final List<Token> tokens =
        Lexer.tokenize("// a comment\nlet // another\n  A");
    assertThat(tokens.size(), is(3));
    assertThat(tokens.get(0).type, is(TokenType.LET));
    assertThat(tokens.get(0).pos,
        is(new Pos(Lexer.STDIN, 2, 1, 2, 4)));
    assertThat(tokens.get(1).pos,
        is(new Pos(Lexer.STDIN, 3, 3, 3, 4)));
  }

  @Test void testPositions() {
    final List<Token> tokens = Lexer.tokenize("let Ab = {\"xy\"}");
    assertThat(tokens.get(0).pos.toString(), is("stdIn:1.1-1.4"));
    assertThat(tokens.get(1).pos.toString(), is("stdIn:1.5-1.7"));
    assertThat(tokens.get(2).pos.toString(), is("stdIn:1.8"));
    // a string's position includes its quotes
    assertThat(tokens.get(4).pos.toString(), is("stdIn:1.11-1.15"));
    // end of input is just past the last character
    assertThat(tokens.get(6).type, is(TokenType.EOF));
    assertThat(tokens.get(6).pos.toString(), is("stdIn:1.16"));
  }

  @Test void testFile() {
    final List<Token> tokens = new Lexer("a.kan", "\n  x").tokenize();
    assertThat(tokens.get(0).pos.toString(), is("a.kan:2.3"));
  }

  /** A number followed by '.' or a letter is not a number; "5.x" must be
   * written "(5).x". */
  @Test void testNumber() {
    assertThat(tokens("12 3.25 0.5"),
        is("[NUMBER(12), NUMBER(3.25), NUMBER(0.5), EOF()]"));
    assertThat(types("5.x"), is("[ILLEGAL, DOT, IDENTIFIER, EOF]"));
    assertThat(types("(5).x"),
        is("[LPAREN, NUMBER, RPAREN, DOT, IDENTIFIER, EOF]"));
    assertThat(types("5a"), is("[ILLEGAL, IDENTIFIER, EOF]"));
  }

  @Test void testIllegal() {
    assertThat(tokens("a ! b"),
        is("[IDENTIFIER(a), ILLEGAL(!), IDENTIFIER(b), EOF()]"));
    assertThat(tokens("a # b"),
        is("[IDENTIFIER(a), ILLEGAL(#), IDENTIFIER(b), EOF()]"));
    // an unterminated string gives an illegal quote, then lexing resumes
    assertThat(tokens("\"abc"), is("[ILLEGAL(\"), IDENTIFIER(abc), EOF()]"));
  }

  @Test void testDescribe() {
    final List<Token> tokens = Lexer.tokenize("x 5 \"s\" } ?");
    assertThat(tokens.get(0).describe(), is("IDENTIFIER 'x'"));
    assertThat(tokens.get(1).describe(), is("NUMBER '5'"));
    assertThat(tokens.get(2).describe(), is("STRING \"s\""));
    assertThat(tokens.get(3).describe(), is("'}'"));
    assertThat(tokens.get(4).describe(), is("ILLEGAL '?'"));
    assertThat(tokens.get(5).describe(), is("end of input"));
  }

  @Test void testTokenStream() {
    final TokenStream tokens = TokenStream.of("a b");
    assertThat(tokens.peek().text, is("a"));
    assertThat(tokens.peek(1).text, is("b"));
    assertThat(tokens.peek(5).type, is(TokenType.EOF));
    final int start = tokens.index();
    assertThat(tokens.advance().text, is("a"));
    assertThat(tokens.advance().text, is("b"));
    assertThat(tokens.advance().type, is(TokenType.EOF));
    // never moves past end of input
    assertThat(tokens.advance().type, is(TokenType.EOF));
    assertThat(tokens.index(), is(2));
    tokens.reset(start);
    assertThat(tokens.peek().text, is("a"));
  }

  @Test void testTokenStreamRequiresEof() {
    assertThrows(IllegalArgumentException.class,
        () -> new TokenStream(Lexer.tokenize("a").subList(0, 1)));
  }
}

// End LexerTest.java
