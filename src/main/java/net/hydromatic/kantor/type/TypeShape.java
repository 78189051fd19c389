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
package net.hydromatic.kantor.type;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Shape of the elements of a typed set.
 *
 * <p>A {@link RecordShape} lists named fields, and validates records; a
 * {@link TupleShape} lists positional types, and validates tuples.
 *
 * <p>Type names are not checked; they are kept for display.
 */
public abstract class TypeShape {
  TypeShape() {}

  /** Creates a record shape. */
  public static RecordShape record(
      Iterable<? extends Map.Entry<String, String>> fields) {
    final ImmutableList.Builder<Map.Entry<String, String>> b =
        ImmutableList.builder();
    for (Map.Entry<String, String> field : fields) {
      b.add(Maps.immutableEntry(field.getKey(), field.getValue()));
    }
    return new RecordShape(b.build());
  }

  /** Creates a tuple shape. */
  public static TupleShape tuple(Iterable<String> typeNames) {
    return new TupleShape(ImmutableList.copyOf(typeNames));
  }

  /** Returns a description such as "Record(name: string, age: int)". */
  public abstract String moniker();

  @Override public String toString() {
    return moniker();
  }

  /** Shape whose elements are records with named fields. */
  public static class RecordShape extends TypeShape {
    /** Field names and type names, in declaration order. */
    public final List<Map.Entry<String, String>> fields;

    RecordShape(ImmutableList<Map.Entry<String, String>> fields) {
      this.fields = requireNonNull(fields);
    }

    /** Returns the field names, in declaration order. */
    public List<String> fieldNames() {
      return Lists.transform(fields, Map.Entry::getKey);
    }

    @Override public String moniker() {
      final StringBuilder b = new StringBuilder("Record(");
      for (int i = 0; i < fields.size(); i++) {
        final Map.Entry<String, String> field = fields.get(i);
        b.append(i == 0 ? "" : ", ")
            .append(field.getKey())
            .append(": ")
            .append(field.getValue());
      }
      return b.append(')').toString();
    }

    @Override public int hashCode() {
      return fields.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof RecordShape
          && fields.equals(((RecordShape) o).fields);
    }
  }

  /** Shape whose elements are tuples of a given arity. */
  public static class TupleShape extends TypeShape {
    public final List<String> typeNames;

    TupleShape(ImmutableList<String> typeNames) {
      this.typeNames = requireNonNull(typeNames);
    }

    public int arity() {
      return typeNames.size();
    }

    @Override public String moniker() {
      return "Tuple(" + String.join(", ", typeNames) + ")";
    }

    @Override public int hashCode() {
      return typeNames.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof TupleShape
          && typeNames.equals(((TupleShape) o).typeNames);
    }
  }
}

// End TypeShape.java
