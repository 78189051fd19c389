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

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Test;

import static net.hydromatic.kantor.eval.Value.of;
import static net.hydromatic.kantor.eval.Value.record;
import static net.hydromatic.kantor.eval.Value.set;
import static net.hydromatic.kantor.eval.Value.tuple;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests for {@link Value} and {@link Comparators}. */
public class ValueTest {
  @Test void testNumericEquality() {
    assertThat(of(1), is(of(1.0)));
    assertThat(of(1).hashCode(), is(of(1.0).hashCode()));
    assertThat(of(true), is(of(1)));
    assertThat(of(false), is(of(0.0)));
    assertThat(of(false).hashCode(), is(of(0).hashCode()));
    assertThat(of(0.0), is(of(-0.0)));
    assertThat(of(0.0).hashCode(), is(of(-0.0).hashCode()));
    assertThat(of(2), not(of(2.5)));
    assertThat(of(Long.MAX_VALUE), not(of(Long.MAX_VALUE - 1)));

    // Numbers never equal strings
    assertThat(of(1), not(of("1")));
    assertThat(of("1"), not(of(1)));
  }

  /** Integers and reals beyond 2<sup>53</sup> are compared exactly, so
   * that equality remains transitive. */
  @Test void testLargeNumericEquality() {
    final Value a = of(9007199254740993L);
    final Value b = of(9007199254740992.0);
    final Value c = of(9007199254740992L);
    assertThat(a, not(b));
    assertThat(b, not(a));
    assertThat(b, is(c));
    assertThat(b.hashCode(), is(c.hashCode()));
    assertThat(a, not(c));
    assertThat(Comparators.compare(a, b), greaterThan(0));
    assertThat(Comparators.compare(b, a), lessThan(0));
    assertThat(Comparators.compare(b, c), is(0));
    assertThat(set(a, b, c).size(), is(2));
    assertThat(set(c, b, a).size(), is(2));
    assertThat(of(Long.MAX_VALUE), not(of((double) Long.MAX_VALUE)));
  }

  @Test void testSetDedup() {
    final Value.SetValue s = set(of(1), of(1.0), of(true), of(2));
    assertThat(s.size(), is(2));
    assertThat(s.contains(of(2.0)), is(true));
    assertThat(s.contains(of("2")), is(false));

    // Order does not matter for equality
    assertThat(set(of(1), of(2)), is(set(of(2), of(1))));
    assertThat(set(of(1), of(2)).hashCode(),
        is(set(of(2), of(1)).hashCode()));
    assertThat(set(), is(Value.SetValue.EMPTY));
  }

  @Test void testTupleAndRecordEquality() {
    assertThat(tuple(of(1), of("a")), is(tuple(of(1.0), of("a"))));
    assertThat(tuple(of(1), of(2)), not(tuple(of(2), of(1))));
    assertThat(tuple(of(1)), not(of(1)));

    final Value.RecordValue r1 =
        record(ImmutableMap.of("name", of("Bob"), "age", of(25)));
    final Value.RecordValue r2 =
        record(ImmutableMap.of("age", of(25), "name", of("Bob")));
    assertThat(r1, is(r2));
    assertThat(r1.hashCode(), is(r2.hashCode()));
    assertThat(r1.get("age"), is(of(25)));
    assertThat(r1.get("city") == null, is(true));
  }

  @Test void testRecordAsPairs() {
    final Value.RecordValue r =
        record(ImmutableMap.of("name", of("Bob"), "age", of(25)));
    assertThat(r.asPairs(),
        is(set(tuple(of("age"), of(25)), tuple(of("name"), of("Bob")))));
    assertThat(record(ImmutableMap.of()).asPairs(), is(Value.SetValue.EMPTY));
  }

  @Test void testTruthy() {
    assertThat(of(true).isTruthy(), is(true));
    assertThat(of(false).isTruthy(), is(false));
    assertThat(of(0).isTruthy(), is(false));
    assertThat(of(-3).isTruthy(), is(true));
    assertThat(of(0.0).isTruthy(), is(false));
    assertThat(of(0.1).isTruthy(), is(true));
    assertThat(of("").isTruthy(), is(false));
    assertThat(of(" ").isTruthy(), is(true));
    assertThat(set().isTruthy(), is(false));
    assertThat(set(of(0)).isTruthy(), is(true));
    assertThat(tuple().isTruthy(), is(false));
    assertThat(tuple(of(false)).isTruthy(), is(true));
    assertThat(record(ImmutableMap.of()).isTruthy(), is(false));
    assertThat(record(ImmutableMap.of("x", of(0))).isTruthy(), is(true));
  }

  @Test void testKind() {
    assertThat(of(true).kind().typeName, is("bool"));
    assertThat(of(1).kind().typeName, is("int"));
    assertThat(of(1.5).kind().typeName, is("real"));
    assertThat(of("x").kind().typeName, is("string"));
    assertThat(set().kind().typeName, is("set"));
    assertThat(tuple().kind().typeName, is("tuple"));
    assertThat(record(ImmutableMap.of()).kind().typeName, is("record"));
    assertThat(of(true).isNumeric(), is(true));
    assertThat(of("1").isNumeric(), is(false));
    assertThat(tuple(of(1)).isNumeric(), is(false));
  }

  @Test void testCompare() {
    assertThat(Comparators.compare(of(1), of(2.5)), lessThan(0));
    assertThat(Comparators.compare(of(true), of(0)), greaterThan(0));
    assertThat(Comparators.compare(of(2), of(2.0)), is(0));
    assertThat(Comparators.compare(of("apple"), of("banana")), lessThan(0));
    assertThat(Comparators.compare(of("b"), of("B")), greaterThan(0));

    // Tuples compare lexicographically, then by length
    assertThat(
        Comparators.compare(tuple(of(1), of(9)), tuple(of(2), of(0))),
        lessThan(0));
    assertThat(
        Comparators.compare(tuple(of(1), of(2)), tuple(of(1), of(2), of(0))),
        lessThan(0));
    assertThat(Comparators.compare(tuple(), tuple()), is(0));

    // Only the first unequal pair has to be ordered
    assertThat(
        Comparators.compare(tuple(of(1), of("a")), tuple(of(2), of(5))),
        lessThan(0));
  }

  @Test void testCompareNotOrdered() {
    final Comparators.NotOrderedException e =
        assertThrows(Comparators.NotOrderedException.class, () ->
            Comparators.compare(of(1), of("1")));
    assertThat(e.getMessage(), is("not ordered: int and string"));

    final Comparators.NotOrderedException e2 =
        assertThrows(Comparators.NotOrderedException.class, () ->
            Comparators.compare(tuple(of(1), of("a")), tuple(of(1), of(5))));
    assertThat(e2.left, is(of("a")));
    assertThat(e2.right, is(of(5)));

    assertThrows(Comparators.NotOrderedException.class, () ->
        Comparators.compare(set(of(1)), set(of(2))));
    assertThrows(Comparators.NotOrderedException.class, () ->
        Comparators.compare(record(ImmutableMap.of()),
            record(ImmutableMap.of())));
  }

  @Test void testToString() {
    assertThat(set(of(3), of(1), of(2)).toString(), is("{1, 2, 3}"));
    assertThat(tuple(of(1), of("a")).toString(), is("(1, \"a\")"));
    assertThat(of(2.0).toString(), is("2.0"));
  }
}

// End ValueTest.java
