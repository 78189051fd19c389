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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Value produced by evaluating a Kantor expression.
 *
 * <p>Every value is immutable, and has value semantics for
 * {@link #equals(Object)} and {@link #hashCode()}; so any value, including
 * a set, tuple or record, can be an element of a set.
 *
 * <p>Numbers ({@link BoolValue}, {@link IntValue} and {@link RealValue})
 * are equal if they have the same numeric value, regardless of kind; so
 * {@code {1, 1.0}} has one element, and {@code true == 1}.
 */
public abstract class Value {
  /** Kind of value. */
  public enum Kind {
    BOOL("bool"),
    INT("int"),
    REAL("real"),
    STRING("string"),
    SET("set"),
    TUPLE("tuple"),
    RECORD("record");

    /** Name of the kind, as it appears in error messages. */
    public final String typeName;

    Kind(String typeName) {
      this.typeName = typeName;
    }
  }

  Value() {}

  /** Returns the kind of this value. */
  public abstract Kind kind();

  /** Returns whether this value counts as true in a predicate.
   * False, zero, the empty string and empty collections are false. */
  public abstract boolean isTruthy();

  /** Returns whether this value is a bool, int or real. */
  public boolean isNumeric() {
    return false;
  }

  @Override public String toString() {
    return Pretty.DEFAULT.format(this);
  }

  public static BoolValue of(boolean b) {
    return b ? BoolValue.TRUE : BoolValue.FALSE;
  }

  public static IntValue of(long i) {
    return new IntValue(i);
  }

  public static RealValue of(double d) {
    return new RealValue(d);
  }

  public static StringValue of(String s) {
    return new StringValue(s);
  }

  /** Creates a set. Duplicate elements are removed; the first occurrence
   * determines the position of an element. */
  public static SetValue set(Iterable<? extends Value> elements) {
    return new SetValue(ImmutableSet.copyOf(elements));
  }

  public static SetValue set(Value... elements) {
    return set(Arrays.asList(elements));
  }

  public static TupleValue tuple(Iterable<? extends Value> elements) {
    return new TupleValue(ImmutableList.copyOf(elements));
  }

  public static TupleValue tuple(Value... elements) {
    return tuple(Arrays.asList(elements));
  }

  /** Creates a record. */
  public static RecordValue record(Map<String, ? extends Value> fields) {
    return new RecordValue(ImmutableMap.copyOf(fields));
  }

  /** Value that is a number; bool, int or real. */
  public abstract static class NumberValue extends Value {
    NumberValue() {}

    /** Returns whether this number has no fractional part by
     * construction; true for bool and int, false for real. */
    public abstract boolean isIntegral();

    /** Returns the value as a long; valid only if {@link #isIntegral()}. */
    public abstract long longValue();

    public abstract double doubleValue();

    @Override public boolean isNumeric() {
      return true;
    }

    @Override public boolean isTruthy() {
      return doubleValue() != 0d;
    }

    @Override public final int hashCode() {
      final double d = doubleValue();
      return Double.hashCode(d == 0d ? 0d : d);
    }

    @Override public final boolean equals(Object o) {
      if (o == this) {
        return true;
      }
      if (!(o instanceof NumberValue)) {
        return false;
      }
      return compareTo((NumberValue) o) == 0;
    }

    /** Compares two numbers by numeric value.
     *
     * <p>An integer and a real are compared exactly, not by converting the
     * integer to a real; so 2<sup>53</sup> + 1 is greater than the real
     * 2<sup>53</sup>. */
    public int compareTo(NumberValue that) {
      if (isIntegral()) {
        return that.isIntegral()
            ? Long.compare(longValue(), that.longValue())
            : compareExact(longValue(), that.doubleValue());
      }
      if (that.isIntegral()) {
        return -compareExact(that.longValue(), doubleValue());
      }
      final double d0 = doubleValue();
      final double d1 = that.doubleValue();
      return d0 < d1 ? -1 : d0 > d1 ? 1 : 0;
    }

    private static int compareExact(long l, double d) {
      if (Double.isInfinite(d)) {
        return d > 0 ? -1 : 1;
      }
      return BigDecimal.valueOf(l).compareTo(new BigDecimal(d));
    }
  }

  /** Boolean value; the result of a comparison. Orders and compares as 0
   * or 1. */
  public static final class BoolValue extends NumberValue {
    public static final BoolValue TRUE = new BoolValue(true);
    public static final BoolValue FALSE = new BoolValue(false);

    public final boolean b;

    private BoolValue(boolean b) {
      this.b = b;
    }

    @Override public Kind kind() {
      return Kind.BOOL;
    }

    @Override public boolean isIntegral() {
      return true;
    }

    @Override public long longValue() {
      return b ? 1L : 0L;
    }

    @Override public double doubleValue() {
      return b ? 1d : 0d;
    }
  }

  /** Integer value, 64 bits. */
  public static final class IntValue extends NumberValue {
    public final long i;

    IntValue(long i) {
      this.i = i;
    }

    @Override public Kind kind() {
      return Kind.INT;
    }

    @Override public boolean isIntegral() {
      return true;
    }

    @Override public long longValue() {
      return i;
    }

    @Override public double doubleValue() {
      return i;
    }
  }

  /** Floating-point value. */
  public static final class RealValue extends NumberValue {
    public final double d;

    RealValue(double d) {
      this.d = d;
    }

    @Override public Kind kind() {
      return Kind.REAL;
    }

    @Override public boolean isIntegral() {
      return false;
    }

    @Override public long longValue() {
      throw new UnsupportedOperationException();
    }

    @Override public double doubleValue() {
      return d;
    }
  }

  /** String value. */
  public static final class StringValue extends Value
      implements Comparable<StringValue> {
    public final String s;

    StringValue(String s) {
      this.s = requireNonNull(s);
    }

    @Override public Kind kind() {
      return Kind.STRING;
    }

    @Override public boolean isTruthy() {
      return !s.isEmpty();
    }

    @Override public int hashCode() {
      return s.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof StringValue
          && s.equals(((StringValue) o).s);
    }

    @Override public int compareTo(StringValue o) {
      return s.compareTo(o.s);
    }
  }

  /** Set of unique values.
   *
   * <p>Equality ignores order; iteration follows the order in which
   * elements were first added. */
  public static final class SetValue extends Value {
    public static final SetValue EMPTY = new SetValue(ImmutableSet.of());

    public final ImmutableSet<Value> elements;

    SetValue(ImmutableSet<Value> elements) {
      this.elements = requireNonNull(elements);
    }

    @Override public Kind kind() {
      return Kind.SET;
    }

    @Override public boolean isTruthy() {
      return !elements.isEmpty();
    }

    public int size() {
      return elements.size();
    }

    public boolean contains(Value value) {
      return elements.contains(value);
    }

    @Override public int hashCode() {
      return elements.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof SetValue
          && elements.equals(((SetValue) o).elements);
    }
  }

  /** Fixed-length sequence of values. */
  public static final class TupleValue extends Value {
    public static final TupleValue EMPTY =
        new TupleValue(ImmutableList.of());

    public final ImmutableList<Value> elements;

    TupleValue(ImmutableList<Value> elements) {
      this.elements = requireNonNull(elements);
    }

    @Override public Kind kind() {
      return Kind.TUPLE;
    }

    @Override public boolean isTruthy() {
      return !elements.isEmpty();
    }

    public int size() {
      return elements.size();
    }

    public Value get(int i) {
      return elements.get(i);
    }

    @Override public int hashCode() {
      return elements.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof TupleValue
          && elements.equals(((TupleValue) o).elements);
    }
  }

  /** Record; a map from unique field names to values.
   *
   * <p>Equality ignores the order of fields. */
  public static final class RecordValue extends Value {
    public final ImmutableMap<String, Value> fields;

    RecordValue(ImmutableMap<String, Value> fields) {
      this.fields = requireNonNull(fields);
    }

    @Override public Kind kind() {
      return Kind.RECORD;
    }

    @Override public boolean isTruthy() {
      return !fields.isEmpty();
    }

    /** Returns the value of a field, or null if there is no such field. */
    public @Nullable Value get(String name) {
      return fields.get(name);
    }

    /** Returns this record as a set of (name, value) pairs. */
    public SetValue asPairs() {
      final ImmutableSet.Builder<Value> b = ImmutableSet.builder();
      fields.forEach((name, value) -> b.add(tuple(of(name), value)));
      return new SetValue(b.build());
    }

    @Override public int hashCode() {
      return fields.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof RecordValue
          && fields.equals(((RecordValue) o).fields);
    }
  }
}

// End Value.java
