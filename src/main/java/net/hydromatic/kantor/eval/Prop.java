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

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/** Property of a session.
 *
 * @see Session#map */
public enum Prop {
  /** Boolean property "continueOnError" controls whether, after a
   * declaration fails, the following declarations are evaluated. Default
   * is true. */
  CONTINUE_ON_ERROR("continueOnError", Boolean.class, true),

  /** Boolean property "echo" controls whether each declaration is printed,
   * as it was parsed, before its result. Default is false. */
  ECHO("echo", Boolean.class, false),

  /** Integer property "printLength" is the number of elements of a set or
   * tuple at which ellipsis begins. Negative means no limit, and is the
   * default. */
  PRINT_LENGTH("printLength", Integer.class, -1),

  /** Integer property "stringDepth" is the length of strings at which
   * ellipsis begins. Negative means no limit, and is the default. */
  STRING_DEPTH("stringDepth", Integer.class, -1),

  /** Boolean property "summary" controls whether, after all declarations
   * have been evaluated, every bound set and defined type is listed.
   * Default is false. */
  SUMMARY("summary", Boolean.class, false);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /** Map of all properties, keyed by both {@link #name()} and
   * {@link #camelName}. */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(CaseFormat.LOWER_CAMEL
        .to(CaseFormat.UPPER_UNDERSCORE, camelName)
        .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns
   * null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(type == requestedType,
        "invalid type %s for property %s", type, camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /** Sets the value of a property, converting from a string if necessary;
   * for example, "true" for a boolean property or "10" for an integer
   * property. */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String) {
      final String s = ((String) value).trim();
      if (type == Boolean.class) {
        switch (s.toLowerCase(Locale.ROOT)) {
        case "true":
          set(map, true);
          return;
        case "false":
          set(map, false);
          return;
        default:
          throw new IllegalArgumentException("value for property "
              + camelName + " must be true or false: " + s);
        }
      }
      if (type == Integer.class) {
        try {
          set(map, Integer.parseInt(s));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("value for property "
              + camelName + " must be an integer: " + s, e);
        }
        return;
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. A null
   * value reverts the property to its default. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException("value for property "
            + camelName + " must have type " + type.getSimpleName());
      }
      map.put(this, value);
    }
  }
}

// End Prop.java
