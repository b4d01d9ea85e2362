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
package net.hydromatic.flatcase.compile;

import com.google.common.collect.ImmutableMap;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import javax.annotation.Nullable;

/** Property that controls the behavior of the compiler. */
public enum Prop {
  /** Whether to complete a {@code case} expression that does not cover all
   * constructors of a type with a single wildcard alternative whose body is
   * {@code undefined}, rather than one alternative per missing
   * constructor. */
  TRIVIAL_CASE_COMPLETION("trivialCaseCompletion", Boolean.class, false),

  /** Whether to remove redundant nested {@code case} expressions after
   * pattern matching has been compiled. */
  OPTIMIZE_CASE("optimizeCase", Boolean.class, true);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  private static final ImmutableMap<String, Prop> BY_CAMEL_NAME;

  static {
    final ImmutableMap.Builder<String, Prop> b = ImmutableMap.builder();
    for (Prop prop : values()) {
      b.put(prop.camelName, prop);
    }
    BY_CAMEL_NAME = b.build();
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    assert type.isInstance(defaultValue);
  }

  /** Looks up a property by its camel-case name, returning null if not
   * found. */
  public static @Nullable Prop lookup(String camelName) {
    return BY_CAMEL_NAME.get(camelName);
  }

  /** Returns the value of this property in a map, or its default value if
   * the map does not contain it. */
  public Object get(Map<Prop, Object> map) {
    final Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    assert type == Boolean.class;
    return (Boolean) get(map);
  }

  /** Parses properties. Keys are camel-case property names, for example
   * "{@code trivialCaseCompletion=true}". Keys that are not properties are
   * ignored.
   *
   * @throws IllegalArgumentException if a value is not valid for the type
   *   of its property
   */
  public static Map<Prop, Object> fromProperties(Properties properties) {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    for (String key : properties.stringPropertyNames()) {
      final Prop prop = lookup(key);
      if (prop != null) {
        map.put(prop, prop.parse(properties.getProperty(key)));
      }
    }
    return map;
  }

  /** Reads properties from a stream in {@link Properties} format. */
  public static Map<Prop, Object> load(InputStream in) throws IOException {
    final Properties properties = new Properties();
    properties.load(Objects.requireNonNull(in, "in"));
    return fromProperties(properties);
  }

  private Object parse(String value) {
    if (type == Boolean.class) {
      switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true":
        return true;
      case "false":
        return false;
      default:
        throw new IllegalArgumentException("property '" + camelName
            + "' requires a boolean value, got '" + value + "'");
      }
    }
    throw new AssertionError("unknown type " + type);
  }
}

// End Prop.java
