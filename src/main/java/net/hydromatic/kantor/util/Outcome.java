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

import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Result of an operation that either succeeded with a value or failed with
 * a {@link KantorException}.
 *
 * <p>A success is {@link Success}; a failure is {@link Failure}.
 *
 * @param <T> Type of value
 */
public abstract class Outcome<T> {
  private Outcome() {}

  /** Creates a successful outcome. */
  public static <T> Outcome<T> ok(T value) {
    return new Success<>(value);
  }

  /** Creates a failed outcome. The exception must implement
   * {@link KantorException}. */
  public static <T, E extends RuntimeException & KantorException>
      Outcome<T> error(E e) {
    return new Failure<>(e);
  }

  /** Returns whether this outcome is a success. */
  public abstract boolean isOk();

  /** Returns the value; throws the original exception if this is a
   * failure. */
  public abstract T get();

  /** Returns the error; throws {@link IllegalStateException} if this is a
   * success. */
  public abstract KantorException error();

  /** Applies a function to the value of a successful outcome. A failure is
   * returned unchanged. */
  public abstract <R> Outcome<R> map(Function<? super T, ? extends R> f);

  /** Successful outcome. */
  public static final class Success<T> extends Outcome<T> {
    public final T value;

    private Success(T value) {
      this.value = requireNonNull(value);
    }

    @Override public boolean isOk() {
      return true;
    }

    @Override public T get() {
      return value;
    }

    @Override public KantorException error() {
      throw new IllegalStateException("not an error: " + value);
    }

    @Override public <R> Outcome<R> map(Function<? super T, ? extends R> f) {
      return new Success<>(f.apply(value));
    }

    @Override public String toString() {
      return "ok(" + value + ")";
    }
  }

  /** Failed outcome. */
  public static final class Failure<T> extends Outcome<T> {
    private final RuntimeException e;

    private <E extends RuntimeException & KantorException> Failure(E e) {
      this.e = requireNonNull(e);
    }

    @Override public boolean isOk() {
      return false;
    }

    @Override public T get() {
      throw e;
    }

    @Override public KantorException error() {
      return (KantorException) e;
    }

    @SuppressWarnings("unchecked")
    @Override public <R> Outcome<R> map(Function<? super T, ? extends R> f) {
      return (Outcome<R>) this;
    }

    @Override public String toString() {
      return "error(" + error().describeTo(new StringBuilder()) + ")";
    }
  }
}

// End Outcome.java
