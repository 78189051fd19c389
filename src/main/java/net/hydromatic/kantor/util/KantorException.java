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
package net.hydromatic.kantor.util;

import net.hydromatic.kantor.ast.Pos;

/** Exception that has a position, a kind, and can be described to the
 * user.
 *
 * <p>Every error raised while parsing or evaluating a Kantor program
 * implements this interface. */
public interface KantorException {
  /** Returns the kind of error. */
  Kind kind();

  /** Returns the position in the source where the error occurred. */
  Pos pos();

  /** Returns the message, without position or kind. */
  String getMessage();

  /** Writes a description of this exception, including its position and
   * kind, to a buffer. */
  default StringBuilder describeTo(StringBuilder buf) {
    return pos().describeTo(buf)
        .append(' ')
        .append(kind().label)
        .append(": ")
        .append(getMessage());
  }

  /** Kind of error. */
  enum Kind {
    /** The parser could not match the expected grammar. */
    SYNTAX("Syntax error"),
    /** An identifier is unresolved, or resolves to the wrong namespace. */
    NAME("Name error"),
    /** An operand or element has the wrong kind, arity or fields, or a set
     * definition references an undeclared type. */
    TYPE("Type error"),
    /** A record does not have the requested field. */
    ATTRIBUTE("Attribute error"),
    /** A literal is malformed, or an operator is not recognized. */
    VALUE("Value error");

    /** Label used when describing an error, e.g. "Type error". */
    public final String label;

    Kind(String label) {
      this.label = label;
    }
  }
}

// End KantorException.java
