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
package net.hydromatic.kantor;

import net.hydromatic.kantor.ast.Ast;
import net.hydromatic.kantor.ast.Op;
import net.hydromatic.kantor.ast.Pos;
import net.hydromatic.kantor.parse.KantorParseException;
import net.hydromatic.kantor.parse.KantorParser;
import net.hydromatic.kantor.parse.Lexer;
import net.hydromatic.kantor.parse.TokenType;
import net.hydromatic.kantor.util.KantorException;
import net.hydromatic.kantor.util.Outcome;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Test;

import static net.hydromatic.kantor.Ml.ml;
import static net.hydromatic.kantor.Ml.mlE;
import static net.hydromatic.kantor.ast.AstBuilder.ast;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

/** Tests the parser. */
public class ParserTest {
  @Test void testParseDecls() {
    ml("let A = {1, 2, 3}").assertParseSame();
    ml("let A = {}").assertParseSame();
    ml("let A: Person = B").assertParseSame();
    ml("type Person: Record(name: string, age: int)").assertParseSame();
    ml("type Empty: Record()").assertParseSame();
    ml("type P: Record(a: int)\nlet A: P = {(a: 1)}\nlet B = A")
        .assertParseSame();
    ml("").assertParse("");
  }

  @Test void testParseLiterals() {
    ml("let A = {1, 2.5, 2.0, \"a b\"}").assertParseSame();
    // a trailing comma is allowed
    ml("let A = {1, 2,}").assertParse("let A = {1, 2}");
    ml("let A = {12345678.5, 10000000.0}").assertParseSame();
    ml("let A = {(name: \"a\", age: 1)}").assertParseSame();
    ml("let A = {(1, 2), (1,), ()}").assertParseSame();
    ml("let A = {(1, 2,)}").assertParse("let A = {(1, 2)}");
    // parentheses around a single expression are not a tuple
    ml("let A = {(1)}").assertParse("let A = {1}");
    ml("let A = {{1, 2}, {}}").assertParseSame();
  }

  @Test void testParseSetOperators() {
    ml("let A = B | C").assertParseSame();
    // set operators are left-associative and share a precedence level
    ml("let A = B | C & D * E").assertParseSame();
    ml("let A = {1} * {2} | B").assertParseSame();
  }

  @Test void testParseComprehension() {
    ml("let A = {p | p of Users}").assertParseSame();
    ml("let A = {p.name | p of Users, p.age >= 18}").assertParseSame();
    ml("let A = {(p.name, p.age) | p of Users}").assertParseSame();
    ml("let A = {x | (x, y) of Coords, x != y}").assertParseSame();
    ml("let A = {(y, x) | (x, y) of Coords}").assertParseSame();
  }

  @Test void testParseExpressions() {
    ml("1 < 2 < 3").assertParseExp("1 < 2 < 3");
    ml("a.b.c").assertParseExp("a.b.c");
    ml("(5).x").assertParseExp("(5).x");
    ml("(a: 1).a").assertParseExp("(a: 1).a");
    ml("x == \"a\"").assertParseExp("x == \"a\"");
    ml("{p | p of S} == {}").assertParseExp("{p | p of S} == {}");
  }

  /** Tests unparsing trees that the parser cannot produce, where
   * parentheses are needed. */
  @Test void testUnparse() {
    final Pos pos = Pos.ZERO;
    final Ast.Exp b = ast.id(pos, "B");
    final Ast.Exp c = ast.id(pos, "C");
    final Ast.Exp d = ast.id(pos, "D");
    assertThat(ast.union(b, ast.intersect(c, d)).toString(),
        is("B | (C & D)"));
    assertThat(ast.cross(ast.union(b, c), d).toString(), is("B | C * D"));
    final Ast.Exp one = ast.intLiteral(pos, 1);
    final Ast.Exp lt = ast.comparison(Op.LT, one,
        ast.comparison(Op.LT, one, one));
    assertThat(lt.toString(), is("1 < (1 < 1)"));
    assertThat(ast.select(pos, lt, "x").toString(), is("(1 < (1 < 1)).x"));
    assertThat(ast.tuple(pos, ImmutableList.of(one)).toString(), is("(1,)"));
  }

  @Test void testParseErrors() {
    mlE("let A = {1} $5$")
        .assertParseThrows("Unexpected token at top level: NUMBER '5'");
    mlE("let A = $5$")
        .assertParseThrows("Expected set expression (set literal or "
            + "identifier) but got NUMBER '5'");
    mlE("type P: $Tuple$(a, b)")
        .assertParseThrows("unsupported type shape: IDENTIFIER 'Tuple'");
    mlE("let A = {1, $|$}")
        .assertParseThrows("Unexpected token in expression: '|'");
    mlE("let A = {x | (x $y$) of S}")
        .assertParseThrows("Expected ',' or ')' in comprehension variables "
            + "but got IDENTIFIER 'y'");
    mlE("let $=$ {}")
        .assertParseThrows("Expected IDENTIFIER but got '='");
    mlE("let A = {\"a\" $!$ \"b\"}")
        .assertParseThrows("Expected '}' but got ILLEGAL '!'");
    // the source of a comprehension must be an identifier
    mlE("let A = {x | x of $($a: 1)}")
        .assertParseThrows("Expected IDENTIFIER but got '('");
    ml("let A = {1")
        .assertParseThrows("Expected '}' but got end of input");
  }

  @Test void testParseNumberTooLarge() {
    mlE("let A = {$99999999999999999999$}")
        .assertParseThrows(KantorException.Kind.VALUE,
            "malformed numeric literal: 99999999999999999999");
  }

  @Test void testTryParse() {
    final Outcome<Ast.Program> ok =
        KantorParser.tryParse(Lexer.tokenize("let A = {}"));
    assertThat(ok.isOk(), is(true));
    assertThat(ok.get().decls.size(), is(1));

    final Outcome<Ast.Program> failed =
        KantorParser.tryParse(Lexer.tokenize("let A ="));
    assertThat(failed.isOk(), is(false));
    assertThat(failed.error(), instanceOf(KantorParseException.class));
    final KantorParseException e = (KantorParseException) failed.error();
    assertThat(e.token.type, is(TokenType.EOF));
    assertThat(e.expected.contains(TokenType.SET_OPEN), is(true));
    assertThat(e.describeTo(new StringBuilder()).toString(),
        is("stdIn:1.8 Syntax error: Expected set expression (set literal "
            + "or identifier) but got end of input"));
  }
}

// End ParserTest.java
