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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Top-level environment of a session.
 *
 * <p>Holds two namespaces: one maps names to set values, the other maps
 * names to type shapes. A name may be bound in both. Redefining a name
 * replaces its previous binding in that namespace.
 *
 * <p>As an {@link EvalEnv} it exposes only the set values; it is the
 * root of every chain of comprehension scopes.
 */
public class Environment implements EvalEnv {
  private final Map<String, Value> values = new LinkedHashMap<>();
  /** Declared element type of each set that has one. */
  private final Map<String, String> valueTypeNames = new LinkedHashMap<>();
  private final Map<String, TypeShape> types = new LinkedHashMap<>();

  @Override public @Nullable Value getOpt(String name) {
    return values.get(name);
  }

  /** Returns the shape of a type, or null if not defined. */
  public @Nullable TypeShape getType(String name) {
    return types.get(name);
  }

  /** Returns the declared element type of a set, or null. */
  public @Nullable String getTypeName(String name) {
    return valueTypeNames.get(name);
  }

  /** Binds a name to a value, replacing any previous value. */
  public void putValue(String name, Value value, @Nullable String typeName) {
    values.put(requireNonNull(name), requireNonNull(value));
    if (typeName == null) {
      valueTypeNames.remove(name);
    } else {
      valueTypeNames.put(name, typeName);
    }
  }

  /** Binds a name to a type shape, replacing any previous shape. */
  public void putType(String name, TypeShape shape) {
    types.put(requireNonNull(name), requireNonNull(shape));
  }

  /** Returns the types, in the order they were first defined. */
  public ImmutableMap<String, TypeShape> typeMap() {
    return ImmutableMap.copyOf(types);
  }

  /** Returns all bindings; first sets, then types, each in the order they
   * were first defined. */
  public ImmutableList<Binding> bindings() {
    final ImmutableList.Builder<Binding> b = ImmutableList.builder();
    values.forEach((name, value) ->
        b.add(Binding.of(name, value, valueTypeNames.get(name))));
    types.forEach((name, shape) -> b.add(Binding.of(name, shape)));
    return b.build();
  }
}

// End Environment.java
