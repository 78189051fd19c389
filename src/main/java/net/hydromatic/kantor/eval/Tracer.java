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

import net.hydromatic.kantor.ast.Ast;
import net.hydromatic.kantor.type.Binding;
import net.hydromatic.kantor.util.KantorException;

/** Called on various events during parsing and evaluation. */
public interface Tracer {
  /** Called when a program has been parsed. */
  void onParse(Ast.Program program);

  /** Called with the result of evaluating a declaration. */
  void onBinding(Binding binding);

  /** Called when a comprehension skips an element of its source because
   * the element cannot be bound to the comprehension's variables. */
  void onSkip(Ast.Comprehension comprehension, Value element);

  /** Called with the exception thrown while parsing or evaluating. Returns
   * whether a handler was found. */
  boolean onException(KantorException e);
}

// End Tracer.java
