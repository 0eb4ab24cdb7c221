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
package net.hydromatic.grapl.compile;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls how programs are parsed, normalized and resolved.
 *
 * <p>Properties are held in a {@code Map<Prop, Object>}; a property that is
 * not in the map has its default value.
 */
public enum Prop {
  /**
   * Boolean property "shadowing" controls whether a program may define the
   * same name more than once. If true, a reference denotes the nearest
   * preceding definition of its name, or the last definition if none
   * precedes it; if false (the default), a second definition is an error.
   */
  SHADOWING("shadowing", Boolean.class, false),

  /**
   * Integer property "maxDepth" is the maximum nesting depth of an
   * expression. The parser, canonicalizer and normalizer fail with a {@link
   * net.hydromatic.grapl.util.ResourceLimitException} rather than recurse
   * deeper. Default is 200.
   */
  MAX_DEPTH("maxDepth", Integer.class, 200),

  /**
   * Integer property "maxCliques" is the maximum number of cliques that
   * distributing one clique over its disconnected members may produce.
   * Default is 100,000.
   */
  MAX_CLIQUES("maxCliques", Integer.class, 100_000),

  /**
   * Integer property "maxNodes" is the maximum number of group members that
   * canonicalization and normalization may create while compiling one
   * program. A member shared by several groups counts once for each group.
   * Default is 10,000,000.
   */
  MAX_NODES("maxNodes", Integer.class, 10_000_000),

  /**
   * Boolean property "parallel" controls whether the members of a group, and
   * the definitions of a program, are processed in parallel. The result is
   * the same either way. Default is false.
   */
  PARALLEL("parallel", Boolean.class, false);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.immutableSortedCopy(Arrays.asList(values()));

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
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName + " not found");
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
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
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

  /**
   * Sets the value of a property, converting a string to the property's
   * type; for example, "true" for a boolean property or "50" for an integer
   * property.
   */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String && type != String.class) {
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
            throw new IllegalArgumentException(
                "value for property " + camelName + " must be true or false");
        }
      }
      if (type == Integer.class) {
        try {
          set(map, Integer.valueOf(s));
          return;
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException(
              "value for property " + camelName + " must be an integer", e);
        }
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
      return;
    }
    if (!type.isInstance(value)) {
      throw new IllegalArgumentException(
          "value for property " + camelName + " must have type " + type);
    }
    if (type == Integer.class && (Integer) value < 1) {
      throw new IllegalArgumentException(
          "value for property " + camelName + " must be positive");
    }
    map.put(this, value);
  }

  /**
   * Creates a property map from string values keyed by property name, such
   * as the contents of a {@link java.util.Properties}.
   */
  public static Map<Prop, Object> parse(Map<?, ?> values) {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    values.forEach(
        (name, value) -> lookup(String.valueOf(name)).setLenient(map, value));
    return map;
  }
}

// End Prop.java
