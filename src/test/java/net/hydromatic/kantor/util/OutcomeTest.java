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
import net.hydromatic.kantor.eval.EvalException;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests for {@link Outcome}. */
public class OutcomeTest {
  private static final EvalException ERROR =
      new EvalException(KantorException.Kind.NAME,
          "Identifier 'X' not found", new Pos("stdIn", 2, 9, 2, 10));

  @Test void testSuccess() {
    final Outcome<String> outcome = Outcome.ok("abc");
    assertThat(outcome.isOk(), is(true));
    assertThat(outcome.get(), is("abc"));
    assertThat(outcome.toString(), is("ok(abc)"));
    final Outcome<Integer> mapped = outcome.map(String::length);
    assertThat(mapped.get(), is(3));
    assertThrows(IllegalStateException.class, outcome::error);
  }

  @Test void testFailure() {
    final Outcome<String> outcome = Outcome.error(ERROR);
    assertThat(outcome.isOk(), is(false));
    assertThat(outcome.error(), sameInstance(ERROR));
    assertThat(outcome.toString(),
        is("error(stdIn:2.9 Name error: Identifier 'X' not found)"));

    // Getting the value rethrows the original exception
    final EvalException e = assertThrows(EvalException.class, outcome::get);
    assertThat(e, sameInstance(ERROR));

    final Outcome<Integer> mapped = outcome.map(String::length);
    assertThat(mapped.isOk(), is(false));
    assertThat(mapped.error(), sameInstance(ERROR));
  }
}

// End OutcomeTest.java
