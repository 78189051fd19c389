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

/** An evaluation environment whose last entry is mutable.
 *
 * <p>A comprehension creates one, and sets it once per element of its
 * source. */
public interface MutableEvalEnv extends EvalEnv {
  /** Puts a value into this environment in a way that may not succeed.
   *
   * <p>For example, if this environment binds the names (x, y), then the
   * tuple (1, 2) will succeed and will bind x to 1 and y to 2, but the
   * tuple (1, 2, 3) and the string "a" will fail. */
  boolean setOpt(Value value);
}

// End MutableEvalEnv.java
