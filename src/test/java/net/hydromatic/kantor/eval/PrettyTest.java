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

import net.hydromatic.kantor.type.Binding;
import net.hydromatic.kantor.type.TypeShape;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import org.junit.jupiter.api.Test;

import static net.hydromatic.kantor.eval.Value.of;
import static net.hydromatic.kantor.eval.Value.record;
import static net.hydromatic.kantor.eval.Value.set;
import static net.hydromatic.kantor.eval.Value.tuple;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

/** Tests for {@link Pretty}. */
public class PrettyTest {
  private static final TypeShape PERSON =
      TypeShape.record(
          ImmutableList.of(Maps.immutableEntry("name", "string"),
              Maps.immutableEntry("age", "int")));

  private static final Value.RecordValue BOB =
      record(
          ImmutableMap.of("age", of(25), "email", of("bob@example.com"),
              "name", of("Bob")));

  /** Printer that knows the type "Person". */
  private static final Pretty PERSON_PRETTY =
      new Pretty(name -> name.equals("Person") ? PERSON : null, -1, -1);

  @Test void testScalars() {
    final Pretty pretty = Pretty.DEFAULT;
    assertThat(pretty.format(of(true)), is("true"));
    assertThat(pretty.format(of(-7)), is("-7"));
    assertThat(pretty.format(of(0.5)), is("0.5"));
    assertThat(pretty.format(of(2.0)), is("2.0"));
    // Large and small reals are printed without an exponent
    assertThat(pretty.format(of(12345678.5)), is("12345678.5"));
    assertThat(pretty.format(of(1e7)), is("10000000.0"));
    assertThat(pretty.format(of(-3e20)), is("-300000000000000000000.0"));
    assertThat(pretty.format(of(0.0001)), is("0.0001"));
    assertThat(pretty.format(of("a b")), is("\"a b\""));
    assertThat(pretty.format(of("")), is("\"\""));
  }

  @Test void testSetOrder() {
    final Pretty pretty = Pretty.DEFAULT;
    assertThat(pretty.format(set(of(3), of(1.5), of(2))),
        is("{1.5, 2, 3}"));
    assertThat(pretty.format(set(of("b"), of("a"))), is("{\"a\", \"b\"}"));
    assertThat(pretty.format(set(tuple(of(2), of(1)), tuple(of(1), of(3)))),
        is("{(1, 3), (2, 1)}"));
    assertThat(pretty.format(set()), is("{}"));

    // Not mutually ordered; insertion order
    assertThat(pretty.format(set(of("b"), of(1), of("a"))),
        is("{\"b\", 1, \"a\"}"));
    assertThat(pretty.format(set(set(of(2)), set(of(1)))),
        is("{{2}, {1}}"));
  }

  @Test void testTuple() {
    final Pretty pretty = Pretty.DEFAULT;
    assertThat(pretty.format(tuple(of(2), of("x"), set(of(1)))),
        is("(2, \"x\", {1})"));
    assertThat(pretty.format(tuple(of(1))), is("(1)"));
    assertThat(pretty.format(tuple()), is("()"));
  }

  @Test void testRecord() {
    // Without a type, fields are alphabetical
    assertThat(Pretty.DEFAULT.format(BOB),
        is("(age: 25, email: \"bob@example.com\", name: \"Bob\")"));
    assertThat(Pretty.DEFAULT.format(BOB, "Person"),
        is("(age: 25, email: \"bob@example.com\", name: \"Bob\")"));

    // With a type, declared fields first, then the rest alphabetically
    assertThat(PERSON_PRETTY.format(BOB, "Person"),
        is("(name: \"Bob\", age: 25, email: \"bob@example.com\")"));
    assertThat(PERSON_PRETTY.format(set(BOB), "Person"),
        is("{(name: \"Bob\", age: 25, email: \"bob@example.com\")}"));
    assertThat(PERSON_PRETTY.format(BOB, "Unknown"),
        is("(age: 25, email: \"bob@example.com\", name: \"Bob\")"));
    assertThat(PERSON_PRETTY.format(record(ImmutableMap.of())), is("()"));
  }

  @Test void testPrintLength() {
    final Pretty pretty = new Pretty(name -> null, 2, -1);
    assertThat(pretty.format(set(of(3), of(1), of(2))), is("{1, 2, ...}"));
    assertThat(pretty.format(set(of(1), of(2))), is("{1, 2}"));
    assertThat(pretty.format(tuple(of(1), of(2), of(3))), is("(1, 2, ...)"));

    final Pretty pretty0 = new Pretty(name -> null, 0, -1);
    assertThat(pretty0.format(set(of(1))), is("{...}"));
    assertThat(pretty0.format(set()), is("{}"));
  }

  @Test void testStringDepth() {
    final Pretty pretty = new Pretty(name -> null, -1, 3);
    assertThat(pretty.format(of("abcdef")), is("\"abc...\""));
    assertThat(pretty.format(of("abc")), is("\"abc\""));
    assertThat(pretty.format(set(of("hello"))), is("{\"hel...\"}"));
  }

  @Test void testFormatBinding() {
    assertThat(PERSON_PRETTY.format(Binding.of("A", set(of(2), of(1)), null)),
        is("let A = {1, 2}"));
    assertThat(PERSON_PRETTY.format(Binding.of("Person", PERSON)),
        is("type Person = Record(name: string, age: int)"));
    assertThat(PERSON_PRETTY.format(Binding.of("Users", set(BOB), "Person")),
        is("let Users : Person = "
            + "{(name: \"Bob\", age: 25, email: \"bob@example.com\")}"));
    assertThat(
        PERSON_PRETTY.format(
            Binding.of("Pairs",
                TypeShape.tuple(ImmutableList.of("int", "string")))),
        is("type Pairs = Tuple(int, string)"));
  }
}

// End PrettyTest.java
