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

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // identifiers
  ID(true),

  // literals
  INT_LITERAL(true),
  REAL_LITERAL(true),
  STRING_LITERAL(true),

  // value constructors
  SET(true),
  TUPLE(true),
  RECORD(true),
  /** Set comprehension, "{e | x of s, p}". */
  FROM(true),

  /** Attribute access, "e.field". Binds tighter than any infix operator. */
  SELECT(".", 9),

  // comparisons; all on one level, left-associative
  EQ(" == ", 4),
  NE(" != ", 4),
  LT(" < ", 4),
  LE(" <= ", 4),
  GT(" > ", 4),
  GE(" >= ", 4),

  // set operators; all on one level, left-associative
  UNION(" | ", 3),
  INTERSECT(" & ", 3),
  CROSS(" * ", 3),

  // declarations
  FIELD(": "),
  TYPE_DECL,
  SET_DECL(" = "),
  PROGRAM;

  /** Padded name, e.g. " | ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;
  /** Operator symbol, e.g. "|", or null if this is not an operator. */
  public final @Nullable String symbol;

  /** Operators of binary nodes, keyed by symbol. Used to map tokens to
   * operators. */
  public static final ImmutableMap<String, Op> BY_SYMBOL;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      if (op.isComparison() || op.isSetOp()) {
        b.put(op.symbol, op);
      }
    }
    BY_SYMBOL = b.build();
  }

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded) {
    this(padded, 0, 0);
  }

  Op(String padded, int leftPrecedence) {
    this(padded, leftPrecedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
    this.symbol = padded == null || padded.trim().isEmpty()
        ? null
        : padded.trim();
  }

  /** Returns whether this is one of the six comparison operators. */
  public boolean isComparison() {
    switch (this) {
    case EQ:
    case NE:
    case LT:
    case LE:
    case GT:
    case GE:
      return true;
    default:
      return false;
    }
  }

  /** Returns whether this is a binary set operator. */
  public boolean isSetOp() {
    switch (this) {
    case UNION:
    case INTERSECT:
    case CROSS:
      return true;
    default:
      return false;
    }
  }
}

// End Op.java
