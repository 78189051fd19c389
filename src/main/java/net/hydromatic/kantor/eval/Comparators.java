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

import java.util.Comparator;
import java.util.List;

import static java.util.Objects.requireNonNull;

/** Ordering of values.
 *
 * <p>Numbers (bool, int and real) are ordered by numeric value; strings
 * lexicographically; tuples lexicographically by element, a tuple that is
 * a prefix of another being less. No other pairs of values are ordered. */
public class Comparators {
  private Comparators() {}

  /** Comparator that throws {@link NotOrderedException} if two values are
   * not mutually ordered. */
  public static final Comparator<Value> NATURAL = Comparators::compare;

  /** Compares two values.
   *
   * @throws NotOrderedException if the values are not mutually ordered
   */
  public static int compare(Value v0, Value v1) {
    if (v0 instanceof Value.NumberValue && v1 instanceof Value.NumberValue) {
      return ((Value.NumberValue) v0).compareTo((Value.NumberValue) v1);
    }
    if (v0 instanceof Value.StringValue && v1 instanceof Value.StringValue) {
      return ((Value.StringValue) v0).compareTo((Value.StringValue) v1);
    }
    if (v0 instanceof Value.TupleValue && v1 instanceof Value.TupleValue) {
      return compareLists(((Value.TupleValue) v0).elements,
          ((Value.TupleValue) v1).elements);
    }
    throw new NotOrderedException(v0, v1);
  }

  /** Compares lists element by element. Only the first pair of unequal
   * elements needs to be ordered. */
  private static int compareLists(List<Value> list0, List<Value> list1) {
    final int n0 = list0.size();
    final int n1 = list1.size();
    final int n = Math.min(n0, n1);
    for (int i = 0; i < n; i++) {
      final Value e0 = list0.get(i);
      final Value e1 = list1.get(i);
      if (!e0.equals(e1)) {
        return compare(e0, e1);
      }
    }
    return Integer.compare(n0, n1);
  }

  /** Thrown when comparing two values that are not ordered. */
  public static class NotOrderedException extends RuntimeException {
    /** The innermost values that could not be compared. */
    public final Value left;
    public final Value right;

    NotOrderedException(Value left, Value right) {
      super("not ordered: " + left.kind().typeName + " and "
          + right.kind().typeName);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }
  }
}

// End Comparators.java
