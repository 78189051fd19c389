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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/** Helpers for {@link EvalEnv}. */
public class EvalEnvs {
  private EvalEnvs() {}

  /** Evaluation environment that inherits from a parent environment and
   * adds one binding. */
  static class SubEvalEnv implements EvalEnv {
    protected final EvalEnv parentEnv;
    protected final String name;
    protected @Nullable Value value;

    SubEvalEnv(EvalEnv parentEnv, String name, @Nullable Value value) {
      this.parentEnv = requireNonNull(parentEnv);
      this.name = requireNonNull(name);
      this.value = value;
    }

    @Override public @Nullable Value getOpt(String name) {
      for (SubEvalEnv e = this;;) {
        if (name.equals(e.name)) {
          return e.value;
        }
        if (e.parentEnv instanceof SubEvalEnv) {
          e = (SubEvalEnv) e.parentEnv;
        } else {
          return e.parentEnv.getOpt(name);
        }
      }
    }
  }

  /** Similar to {@link SubEvalEnv} but mutable. */
  static class MutableSubEvalEnv extends SubEvalEnv
      implements MutableEvalEnv {
    MutableSubEvalEnv(EvalEnv parentEnv, String name) {
      super(parentEnv, name, null);
    }

    @Override public boolean setOpt(Value value) {
      this.value = requireNonNull(value);
      return true;
    }
  }

  /** Evaluation environment that binds several names. */
  static class ArraySubEvalEnv implements EvalEnv {
    protected final EvalEnv parentEnv;
    protected final ImmutableList<String> names;
    protected @Nullable List<Value> values;

    ArraySubEvalEnv(EvalEnv parentEnv, ImmutableList<String> names,
        @Nullable List<Value> values) {
      this.parentEnv = requireNonNull(parentEnv);
      this.names = requireNonNull(names);
      this.values = values; // may be null
    }

    @Override public @Nullable Value getOpt(String name) {
      // Search from the end, so that in "(x, x)" the last x wins
      final int i = names.lastIndexOf(name);
      if (i >= 0 && values != null) {
        return values.get(i);
      }
      return parentEnv.getOpt(name);
    }
  }

  /** Similar to {@link ArraySubEvalEnv} but mutable. Accepts only tuples
   * whose arity matches the number of names. */
  static class MutableArraySubEvalEnv extends ArraySubEvalEnv
      implements MutableEvalEnv {
    MutableArraySubEvalEnv(EvalEnv parentEnv, List<String> names) {
      super(parentEnv, ImmutableList.copyOf(names), null);
    }

    @Override public boolean setOpt(Value value) {
      if (!(value instanceof Value.TupleValue)
          || ((Value.TupleValue) value).size() != names.size()) {
        return false;
      }
      values = ((Value.TupleValue) value).elements;
      return true;
    }
  }
}

// End EvalEnvs.java
