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

/** Visits expressions.
 *
 * <p>There is one method per sub-class of {@link Ast.Exp}, so an
 * implementation that compiles handles every kind of expression.
 *
 * @param <R> Result type
 *
 * @see DeclVisitor */
public interface Visitor<R> {
  R visit(Ast.Id id);

  R visit(Ast.Literal literal);

  R visit(Ast.SetLiteral setLiteral);

  R visit(Ast.Tuple tuple);

  R visit(Ast.Record record);

  R visit(Ast.SetOp setOp);

  R visit(Ast.Comprehension comprehension);

  R visit(Ast.Select select);

  R visit(Ast.Comparison comparison);
}

// End Visitor.java
