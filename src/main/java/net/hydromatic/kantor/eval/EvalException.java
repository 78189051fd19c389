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
package net.hydromatic.kantor.eval;

import net.hydromatic.kantor.ast.Pos;
import net.hydromatic.kantor.util.KantorException;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/** An error that occurs while evaluating a declaration. */
public class EvalException extends RuntimeException
    implements KantorException {
  private final Kind kind;
  private final Pos pos;

  public EvalException(Kind kind, String message, Pos pos) {
    super(message);
    this.kind = requireNonNull(kind);
    this.pos = requireNonNull(pos);
    checkArgument(kind != Kind.SYNTAX, "syntax errors come from the parser");
  }

  @Override public Kind kind() {
    return kind;
  }

  @Override public Pos pos() {
    return pos;
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }
}

// End EvalException.java
