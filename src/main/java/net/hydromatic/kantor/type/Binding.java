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

import net.hydromatic.kantor.eval.Value;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/**
 * Binding of a name to a set value or to a type shape.
 *
 * <p>Produced by evaluating a declaration. A set binding may carry the
 * name of the type that its elements were validated against; the
 * formatter uses it to order fields.
 */
public class Binding {
  public final String name;
  /** Value, if this is a set binding. */
  public final @Nullable Value value;
  /** Shape, if this is a type binding. */
  public final @Nullable TypeShape shape;
  /** Declared element type of a set binding, or null. */
  public final @Nullable String typeName;

  private Binding(String name, @Nullable Value value,
      @Nullable TypeShape shape, @Nullable String typeName) {
    this.name = requireNonNull(name);
    this.value = value;
    this.shape = shape;
    this.typeName = typeName;
    checkArgument((value == null) != (shape == null));
  }

  /** Creates a binding of a name to a value. */
  public static Binding of(String name, Value value,
      @Nullable String typeName) {
    return new Binding(name, requireNonNull(value), null, typeName);
  }

  /** Creates a binding of a name to a type shape. */
  public static Binding of(String name, TypeShape shape) {
    return new Binding(name, null, requireNonNull(shape), null);
  }

  /** Returns whether this binds a type, as opposed to a value. */
  public boolean isType() {
    return shape != null;
  }

  @Override public int hashCode() {
    return Objects.hash(name, value, shape, typeName);
  }

  @Override public boolean equals(Object o) {
    return this == o
        || o instanceof Binding
        && name.equals(((Binding) o).name)
        && Objects.equals(value, ((Binding) o).value)
        && Objects.equals(shape, ((Binding) o).shape)
        && Objects.equals(typeName, ((Binding) o).typeName);
  }

  @Override public String toString() {
    if (shape != null) {
      return "type " + name + " = " + shape;
    } else if (typeName != null) {
      return "let " + name + " : " + typeName + " = " + value;
    } else {
      return "let " + name + " = " + value;
    }
  }
}

// End Binding.java
