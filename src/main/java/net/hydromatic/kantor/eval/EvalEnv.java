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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/** Evaluation environment.
 *
 * <p>Whereas {@link Environment} contains both types and values, and
 * lives for the whole session, EvalEnv contains only values, and a
 * sub-environment lives only while a comprehension is being evaluated.
 * Bindings in a sub-environment hide bindings of the same name in its
 * parent; the parent is never modified. */
public interface EvalEnv {
  /** Returns the binding of {@code name} if bound, null if not. */
  @Nullable Value getOpt(String name);

  /** Creates an evaluation environment that has the same content as this
   * one, plus a mutable slot. */
  default MutableEvalEnv bindMutable(String name) {
    return new EvalEnvs.MutableSubEvalEnv(this, name);
  }

  /** Creates an evaluation environment that has the same content as this
   * one, plus a mutable slot or slots.
   *
   * <p>If {@code names} has one element, calling
   * {@link MutableEvalEnv#setOpt(Value)} binds it to the whole value; if
   * {@code names} has more than one element, {@code setOpt} succeeds only
   * if given a tuple with the same number of elements. */
  default MutableEvalEnv bindMutableArray(List<String> names) {
    if (names.size() == 1) {
      return bindMutable(names.get(0));
    }
    return new EvalEnvs.MutableArraySubEvalEnv(this, names);
  }
}

// End EvalEnv.java
