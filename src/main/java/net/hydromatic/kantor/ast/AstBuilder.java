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
package net.hydromatic.kantor.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

/** Builds parse tree nodes. */
public enum AstBuilder {
  INSTANCE;

  /** The singleton instance of the AST builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  public static final AstBuilder ast = INSTANCE;

  /** Creates an {@code int} literal. */
  public Ast.Literal intLiteral(Pos pos, long value) {
    return new Ast.Literal(pos, Op.INT_LITERAL, value);
  }

  /** Creates a {@code real} literal. */
  public Ast.Literal realLiteral(Pos pos, double value) {
    return new Ast.Literal(pos, Op.REAL_LITERAL, value);
  }

  /** Creates a string literal. */
  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, value);
  }

  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, name);
  }

  public Ast.SetLiteral set(Pos pos, Iterable<? extends Ast.Exp> args) {
    return new Ast.SetLiteral(pos, ImmutableList.copyOf(args));
  }

  public Ast.Tuple tuple(Pos pos, Iterable<? extends Ast.Exp> args) {
    return new Ast.Tuple(pos, ImmutableList.copyOf(args));
  }

  /** Creates a record instance. Field order is retained, as are
   * repeated field names. */
  public Ast.Record record(Pos pos,
      Iterable<? extends Map.Entry<String, ? extends Ast.Exp>> args) {
    final ImmutableList.Builder<Map.Entry<String, Ast.Exp>> b =
        ImmutableList.builder();
    for (Map.Entry<String, ? extends Ast.Exp> arg : args) {
      b.add(Maps.immutableEntry(arg.getKey(), arg.getValue()));
    }
    return new Ast.Record(pos, b.build());
  }

  /** Creates a call to a set operator. */
  public Ast.SetOp setOp(Op op, Ast.Exp a0, Ast.Exp a1) {
    return new Ast.SetOp(a0.pos.plus(a1.pos), op, a0, a1);
  }

  public Ast.SetOp union(Ast.Exp a0, Ast.Exp a1) {
    return setOp(Op.UNION, a0, a1);
  }

  public Ast.SetOp intersect(Ast.Exp a0, Ast.Exp a1) {
    return setOp(Op.INTERSECT, a0, a1);
  }

  public Ast.SetOp cross(Ast.Exp a0, Ast.Exp a1) {
    return setOp(Op.CROSS, a0, a1);
  }

  /** Creates a comparison. */
  public Ast.Comparison comparison(Op op, Ast.Exp a0, Ast.Exp a1) {
    return comparison(a0.pos.plus(a1.pos), op, a0, a1);
  }

  /** Creates a comparison whose position includes text, such as
   * parentheses, outside its operands. */
  public Ast.Comparison comparison(Pos pos, Op op, Ast.Exp a0, Ast.Exp a1) {
    return new Ast.Comparison(pos, op, a0, a1);
  }

  public Ast.Select select(Pos pos, Ast.Exp exp, String field) {
    return new Ast.Select(pos, exp, field);
  }

  public Ast.Comprehension comprehension(Pos pos,
      List<? extends Ast.Exp> outputs, List<String> vars, Ast.Id source,
      Ast.@Nullable Exp predicate) {
    return new Ast.Comprehension(pos, ImmutableList.copyOf(outputs),
        ImmutableList.copyOf(vars), source, predicate);
  }

  public Ast.Field field(Pos pos, String name, String typeName) {
    return new Ast.Field(pos, name, typeName);
  }

  public Ast.TypeDecl typeDecl(Pos pos, String name,
      Iterable<? extends Ast.Field> fields) {
    return new Ast.TypeDecl(pos, name, ImmutableList.copyOf(fields));
  }

  public Ast.SetDecl setDecl(Pos pos, String name, @Nullable String typeName,
      Ast.Exp exp) {
    return new Ast.SetDecl(pos, name, typeName, exp);
  }

  public Ast.Program program(Pos pos, Iterable<? extends Ast.Decl> decls) {
    return new Ast.Program(pos, ImmutableList.copyOf(decls));
  }
}

// End AstBuilder.java
