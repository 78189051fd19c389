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
import net.hydromatic.kantor.ast.Op;
import net.hydromatic.kantor.ast.Pos;
import net.hydromatic.kantor.util.Outcome;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static net.hydromatic.kantor.ast.AstBuilder.ast;

import static java.util.Objects.requireNonNull;

/**
 * Recursive-descent parser for Kantor.
 *
 * <p>Grammar:
 *
 * <pre>{@code
 * program    ::= decl* EOF
 * decl       ::= 'type' id ':' 'Record' '(' [ field { ',' field } ] ')'
 *              | 'let' id [ ':' id ] '=' setExp
 * setExp     ::= setPrimary { ( '|' | '&' | '*' ) setPrimary }
 * setPrimary ::= brace | id
 * brace      ::= '{' '}'
 *              | '{' exp { ',' exp } [ ',' ] '}'
 *              | '{' exp '|' vars 'of' id [ ',' exp ] '}'
 * exp        ::= term { compOp term }
 * term       ::= primary { '.' id }
 * primary    ::= number | string | id | brace
 *              | '(' id ':' exp { ',' id ':' exp } ')'
 *              | '(' ')' | '(' exp ')' | '(' exp ',' [ exp { ',' exp } ]
 *                [ ',' ] ')'
 * }</pre>
 *
 * <p>Set operators are left-associative and share one precedence level, as
 * do comparison operators.
 */
public class KantorParser {
  private static final ImmutableSet<TokenType> DECL_START =
      ImmutableSet.of(TokenType.TYPE, TokenType.LET, TokenType.EOF);
  private static final ImmutableSet<TokenType> SET_START =
      ImmutableSet.of(TokenType.SET_OPEN, TokenType.IDENTIFIER);
  private static final ImmutableSet<TokenType> EXP_START =
      ImmutableSet.of(TokenType.NUMBER, TokenType.STRING,
          TokenType.IDENTIFIER, TokenType.LPAREN, TokenType.SET_OPEN);

  private final TokenStream tokens;
  /** The most recently consumed token; its position ends a node. */
  private @Nullable Token previous;

  /** Creates a KantorParser. */
  public KantorParser(TokenStream tokens) {
    this.tokens = requireNonNull(tokens);
  }

  /** Parses a list of tokens as a program. */
  public static Ast.Program parse(List<Token> tokens) {
    return new KantorParser(new TokenStream(tokens)).program();
  }

  /** Parses a string as a program. */
  public static Ast.Program parse(String s) {
    return parse(Lexer.tokenize(s));
  }

  /** Parses a list of tokens as a program, returning a failed outcome
   * rather than throwing if there is a syntax error. */
  public static Outcome<Ast.Program> tryParse(List<Token> tokens) {
    try {
      return Outcome.ok(parse(tokens));
    } catch (KantorParseException e) {
      return Outcome.error(e);
    }
  }

  /** Parses a string as a single expression (such as may occur as an
   * element of a set literal) followed by end of input. */
  public static Ast.Exp parseExp(String s) {
    final KantorParser parser = new KantorParser(TokenStream.of(s));
    final Ast.Exp exp = parser.expression();
    parser.expect(TokenType.EOF);
    return exp;
  }

  /** Parses a program. */
  public Ast.Program program() {
    final Pos start = tokens.peek().pos;
    final List<Ast.Decl> decls = new ArrayList<>();
    for (;;) {
      final Token token = tokens.peek();
      switch (token.type) {
      case TYPE:
        decls.add(typeDecl());
        break;
      case LET:
        decls.add(setDecl());
        break;
      case EOF:
        return ast.program(decls.isEmpty() ? start : since(start), decls);
      default:
        throw KantorParseException.syntax(
            "Unexpected token at top level: " + token.describe(), token,
            DECL_START);
      }
    }
  }

  /** Parses a type declaration,
   * "type Person: Record(name: string, age: int)". */
  public Ast.TypeDecl typeDecl() {
    final Pos start = expect(TokenType.TYPE).pos;
    final String name = expect(TokenType.IDENTIFIER).text;
    expect(TokenType.COLON);
    final Token shape = tokens.peek();
    if (shape.type != TokenType.RECORD) {
      throw KantorParseException.syntax(
          "unsupported type shape: " + shape.describe(), shape,
          ImmutableSet.of(TokenType.RECORD));
    }
    advance();
    expect(TokenType.LPAREN);
    final List<Ast.Field> fields = new ArrayList<>();
    if (tokens.peek().type != TokenType.RPAREN) {
      for (;;) {
        final Token fieldName = expect(TokenType.IDENTIFIER);
        expect(TokenType.COLON);
        final Token typeName = expect(TokenType.IDENTIFIER);
        fields.add(
            ast.field(fieldName.pos.plus(typeName.pos), fieldName.text,
                typeName.text));
        if (tokens.peek().type != TokenType.COMMA) {
          break;
        }
        advance();
      }
    }
    expect(TokenType.RPAREN);
    return ast.typeDecl(since(start), name, fields);
  }

  /** Parses a set declaration, "let Adults: Person = ...". */
  public Ast.SetDecl setDecl() {
    final Pos start = expect(TokenType.LET).pos;
    final String name = expect(TokenType.IDENTIFIER).text;
    String typeName = null;
    if (tokens.peek().type == TokenType.COLON) {
      advance();
      typeName = expect(TokenType.IDENTIFIER).text;
    }
    expect(TokenType.EQUALS);
    final Ast.Exp exp = setExpression();
    return ast.setDecl(since(start), name, typeName, exp);
  }

  /** Parses a set expression: set literals, comprehensions and
   * identifiers combined with set operators. */
  public Ast.Exp setExpression() {
    Ast.Exp e = setPrimary();
    while (tokens.peek().type.isSetOp()) {
      final Token opToken = advance();
      final Ast.Exp e2 = setPrimary();
      e = ast.setOp(requireNonNull(Op.BY_SYMBOL.get(opToken.text)), e, e2);
    }
    return e;
  }

  private Ast.Exp setPrimary() {
    final Token token = tokens.peek();
    switch (token.type) {
    case SET_OPEN:
      return brace();
    case IDENTIFIER:
      return identifier();
    default:
      throw KantorParseException.syntax(
          "Expected set expression (set literal or identifier) but got "
              + token.describe(), token, SET_START);
    }
  }

  /** Parses a set literal or set comprehension, starting with '{'. */
  private Ast.Exp brace() {
    final Pos start = expect(TokenType.SET_OPEN).pos;
    if (tokens.peek().type == TokenType.SET_CLOSE) {
      advance();
      return ast.set(since(start), ImmutableList.of());
    }
    final Ast.Exp first = expression();
    if (tokens.peek().type == TokenType.PIPE) {
      advance();
      return comprehension(start, first);
    }
    final List<Ast.Exp> elements = new ArrayList<>();
    elements.add(first);
    while (tokens.peek().type == TokenType.COMMA) {
      advance();
      if (tokens.peek().type == TokenType.SET_CLOSE) {
        break; // trailing comma
      }
      elements.add(expression());
    }
    expect(TokenType.SET_CLOSE);
    return ast.set(since(start), elements);
  }

  /** Parses the remainder of a comprehension, after the output expression
   * and '|'. */
  private Ast.Comprehension comprehension(Pos start, Ast.Exp first) {
    final List<String> vars = new ArrayList<>();
    if (tokens.peek().type == TokenType.LPAREN) {
      advance();
      for (;;) {
        vars.add(expect(TokenType.IDENTIFIER).text);
        final Token token = advance();
        if (token.type == TokenType.RPAREN) {
          break;
        }
        if (token.type != TokenType.COMMA) {
          throw KantorParseException.syntax(
              "Expected ',' or ')' in comprehension variables but got "
                  + token.describe(), token,
              ImmutableSet.of(TokenType.COMMA, TokenType.RPAREN));
        }
      }
    } else {
      vars.add(expect(TokenType.IDENTIFIER).text);
    }
    expect(TokenType.OF);
    final Ast.Id source = identifier();
    Ast.Exp predicate = null;
    if (tokens.peek().type == TokenType.COMMA) {
      advance();
      predicate = expression();
    }
    expect(TokenType.SET_CLOSE);
    final List<Ast.Exp> outputs =
        first instanceof Ast.Tuple
            ? ((Ast.Tuple) first).args
            : ImmutableList.of(first);
    return ast.comprehension(since(start), outputs, vars, source,
        predicate);
  }

  /** Parses an expression: terms joined by comparison operators. */
  public Ast.Exp expression() {
    final Pos start = tokens.peek().pos;
    Ast.Exp e = term();
    while (tokens.peek().type.isComparison()) {
      final Token opToken = advance();
      final Ast.Exp e2 = term();
      e = ast.comparison(since(start),
          requireNonNull(Op.BY_SYMBOL.get(opToken.text)), e, e2);
    }
    return e;
  }

  /** Parses a primary expression followed by zero or more attribute
   * accesses. */
  private Ast.Exp term() {
    final Pos start = tokens.peek().pos;
    Ast.Exp e = primary();
    while (tokens.peek().type == TokenType.DOT) {
      advance();
      final Token field = expect(TokenType.IDENTIFIER);
      e = ast.select(since(start), e, field.text);
    }
    return e;
  }

  private Ast.Exp primary() {
    final Token token = tokens.peek();
    switch (token.type) {
    case NUMBER:
      advance();
      return Parsers.numberLiteral(token);
    case STRING:
      advance();
      return ast.stringLiteral(token.pos, token.text);
    case IDENTIFIER:
      return identifier();
    case SET_OPEN:
      return brace();
    case LPAREN:
      if (tokens.peek(1).type == TokenType.IDENTIFIER
          && tokens.peek(2).type == TokenType.COLON) {
        return record();
      }
      return parenthesized();
    default:
      throw KantorParseException.syntax(
          "Unexpected token in expression: " + token.describe(), token,
          EXP_START);
    }
  }

  /** Parses a record instance, "(name: "Alice", age: 30)". */
  private Ast.Record record() {
    final Pos start = expect(TokenType.LPAREN).pos;
    final List<Map.Entry<String, Ast.Exp>> fields = new ArrayList<>();
    for (;;) {
      final String name = expect(TokenType.IDENTIFIER).text;
      expect(TokenType.COLON);
      fields.add(Maps.immutableEntry(name, expression()));
      if (tokens.peek().type != TokenType.COMMA) {
        break;
      }
      advance();
    }
    expect(TokenType.RPAREN);
    return ast.record(since(start), fields);
  }

  /** Parses "()", a parenthesized expression "(e)", or a tuple
   * "(e1, e2, ...)". */
  private Ast.Exp parenthesized() {
    final Pos start = expect(TokenType.LPAREN).pos;
    if (tokens.peek().type == TokenType.RPAREN) {
      advance();
      return ast.tuple(since(start), ImmutableList.of());
    }
    final Ast.Exp first = expression();
    if (tokens.peek().type != TokenType.COMMA) {
      expect(TokenType.RPAREN);
      return first;
    }
    final List<Ast.Exp> elements = new ArrayList<>();
    elements.add(first);
    while (tokens.peek().type == TokenType.COMMA) {
      advance();
      if (tokens.peek().type == TokenType.RPAREN) {
        break; // trailing comma
      }
      elements.add(expression());
    }
    expect(TokenType.RPAREN);
    return ast.tuple(since(start), elements);
  }

  private Ast.Id identifier() {
    final Token token = expect(TokenType.IDENTIFIER);
    return ast.id(token.pos, token.text);
  }

  /** Consumes the current token if it has the given type, otherwise
   * throws. */
  private Token expect(TokenType type) {
    final Token token = tokens.peek();
    if (token.type != type) {
      throw KantorParseException.syntax(
          "Expected " + type.describe() + " but got " + token.describe(),
          token, ImmutableSet.of(type));
    }
    return advance();
  }

  /** Consumes the current token. */
  private Token advance() {
    previous = tokens.advance();
    return previous;
  }

  /** Returns a position from {@code start} to the end of the most recently
   * consumed token. */
  private Pos since(Pos start) {
    return previous == null ? start : start.plus(previous.pos);
  }
}

// End KantorParser.java
