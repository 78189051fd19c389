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

import net.hydromatic.kantor.ast.AstWriter;
import net.hydromatic.kantor.type.Binding;
import net.hydromatic.kantor.type.TypeShape;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/** Prints values.
 *
 * <p>A set whose elements are all mutually ordered is printed in sorted
 * order; otherwise its elements are printed in the order they were first
 * added. If a type name is given for a set, its record elements are
 * printed with their fields in the order the type declares them. */
public class Pretty {
  /** Printer that knows no types and does not truncate. */
  public static final Pretty DEFAULT = new Pretty(name -> null, -1, -1);

  private final Function<String, @Nullable TypeShape> typeLookup;
  private final int printLength;
  private final int stringDepth;

  /** Creates a Pretty.
   *
   * @param typeLookup Looks up a type shape by name
   * @param printLength Number of elements of a set or tuple at which
   *                    ellipsis begins, or -1 for no limit
   * @param stringDepth Length of a string at which ellipsis begins,
   *                    or -1 for no limit
   */
  public Pretty(Function<String, @Nullable TypeShape> typeLookup,
      int printLength, int stringDepth) {
    this.typeLookup = requireNonNull(typeLookup);
    this.printLength = printLength;
    this.stringDepth = stringDepth;
  }

  /** Formats a value. */
  public String format(Value value) {
    return pretty(new StringBuilder(), value, null).toString();
  }

  /** Formats a value, with a type name for the elements of a set or for a
   * record. */
  public String format(Value value, @Nullable String typeName) {
    return pretty(new StringBuilder(), value, typeName).toString();
  }

  /** Formats the result of a declaration, for example
   * "let Users : Person = {(name: "Bob", age: 25)}" or
   * "type Person = Record(name: string, age: int)". */
  public String format(Binding binding) {
    final StringBuilder buf = new StringBuilder();
    if (binding.shape != null) {
      return buf.append("type ").append(binding.name).append(" = ")
          .append(binding.shape.moniker()).toString();
    }
    buf.append("let ").append(binding.name);
    if (binding.typeName != null) {
      buf.append(" : ").append(binding.typeName);
    }
    buf.append(" = ");
    return pretty(buf, requireNonNull(binding.value), binding.typeName)
        .toString();
  }

  /** Prints a value to a buffer. */
  public StringBuilder pretty(StringBuilder buf, Value value,
      @Nullable String typeName) {
    switch (value.kind()) {
    case BOOL:
      return buf.append(((Value.BoolValue) value).b);
    case INT:
      return buf.append(((Value.IntValue) value).i);
    case REAL:
      return buf.append(AstWriter.realToString(((Value.RealValue) value).d));
    case STRING:
      final String s = ((Value.StringValue) value).s;
      buf.append('"');
      if (stringDepth >= 0 && s.length() > stringDepth) {
        buf.append(s, 0, stringDepth).append("...");
      } else {
        buf.append(s);
      }
      return buf.append('"');
    case SET:
      return list(buf, "{", sorted(((Value.SetValue) value).elements), "}",
          typeName);
    case TUPLE:
      return list(buf, "(", ((Value.TupleValue) value).elements, ")", null);
    case RECORD:
      return record(buf, (Value.RecordValue) value, typeName);
    default:
      throw new AssertionError("unknown kind " + value.kind());
    }
  }

  /** Returns the elements of a set in sorted order if they are mutually
   * ordered, otherwise in their original order. */
  private static List<Value> sorted(Iterable<Value> elements) {
    try {
      return Ordering.from(Comparators.NATURAL).sortedCopy(elements);
    } catch (Comparators.NotOrderedException e) {
      return ImmutableList.copyOf(elements);
    }
  }

  private StringBuilder list(StringBuilder buf, String open,
      List<Value> elements, String close, @Nullable String typeName) {
    buf.append(open);
    for (int i = 0; i < elements.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      if (printLength >= 0 && i >= printLength) {
        buf.append("...");
        break;
      }
      pretty(buf, elements.get(i), typeName);
    }
    return buf.append(close);
  }

  /** Prints a record. Fields declared by the type come first, in declared
   * order; other fields follow in alphabetical order. */
  private StringBuilder record(StringBuilder buf, Value.RecordValue record,
      @Nullable String typeName) {
    final List<String> names = new ArrayList<>();
    final TypeShape shape =
        typeName == null ? null : typeLookup.apply(typeName);
    if (shape instanceof TypeShape.RecordShape) {
      for (String name : ((TypeShape.RecordShape) shape).fieldNames()) {
        if (record.fields.containsKey(name) && !names.contains(name)) {
          names.add(name);
        }
      }
    }
    for (String name
        : Ordering.<String>natural().sortedCopy(record.fields.keySet())) {
      if (!names.contains(name)) {
        names.add(name);
      }
    }
    buf.append('(');
    for (int i = 0; i < names.size(); i++) {
      final String name = names.get(i);
      buf.append(i == 0 ? "" : ", ").append(name).append(": ");
      pretty(buf, requireNonNull(record.fields.get(name)), null);
    }
    return buf.append(')');
  }
}

// End Pretty.java
