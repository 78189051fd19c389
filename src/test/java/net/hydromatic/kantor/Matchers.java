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
package net.hydromatic.kantor;

import net.hydromatic.kantor.ast.AstNode;
import net.hydromatic.kantor.ast.Pos;
import net.hydromatic.kantor.eval.Pretty;
import net.hydromatic.kantor.eval.Value;
import net.hydromatic.kantor.util.KantorException;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

/** Matchers for use in Kantor tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches an AST node by its string representation. */
  static <T extends AstNode> Matcher<T> isAst(Class<? extends T> clazz,
      String expected) {
    return new CustomTypeSafeMatcher<T>("ast with value " + expected) {
      @Override protected boolean matchesSafely(T t) {
        assertThat(clazz.isInstance(t), is(true));
        final String s = t.toString();
        return s.equals(expected) && s.equals(t.toString());
      }
    };
  }

  /** Matches a value by its printed form. */
  static Matcher<Value> isValue(String expected) {
    return new TypeSafeMatcher<Value>() {
      @Override protected boolean matchesSafely(Value value) {
        return Pretty.DEFAULT.format(value).equals(expected);
      }

      @Override public void describeTo(Description description) {
        description.appendText("value ").appendValue(expected);
      }

      @Override protected void describeMismatchSafely(Value value,
          Description description) {
        description.appendText("was ")
            .appendValue(Pretty.DEFAULT.format(value));
      }
    };
  }

  /** Matches a throwable by its class and message. */
  static <T extends Throwable> Matcher<Throwable> throwsA(Class<T> clazz,
      Matcher<?> messageMatcher) {
    return new CustomTypeSafeMatcher<Throwable>(clazz + " with message "
        + messageMatcher) {
      @Override protected boolean matchesSafely(Throwable item) {
        return clazz.isInstance(item)
            && messageMatcher.matches(item.getMessage());
      }
    };
  }

  /** Matches a Kantor exception by its kind, its message, and optionally
   * its position. */
  static Matcher<Throwable> throwsKantor(KantorException.Kind kind,
      String message, @Nullable Pos pos) {
    return new TypeSafeMatcher<Throwable>() {
      @Override protected boolean matchesSafely(Throwable item) {
        if (!(item instanceof KantorException)) {
          return false;
        }
        final KantorException e = (KantorException) item;
        return e.kind() == kind
            && e.getMessage().equals(message)
            && (pos == null || e.pos().equals(pos));
      }

      @Override public void describeTo(Description description) {
        description.appendText(kind.label + ": " + message);
        if (pos != null) {
          description.appendText(" at " + pos);
        }
      }

      @Override protected void describeMismatchSafely(Throwable item,
          Description description) {
        if (item instanceof KantorException) {
          description.appendText("was ").appendText(
              ((KantorException) item).describeTo(new StringBuilder())
                  .toString());
        } else {
          description.appendText("was ").appendValue(item);
        }
      }
    };
  }
}

// End Matchers.java
