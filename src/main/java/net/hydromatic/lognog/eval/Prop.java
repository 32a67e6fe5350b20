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
package net.hydromatic.lognog.eval;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;
import net.hydromatic.lognog.compile.Dialect;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property.
 *
 * @see Session#map
 */
public enum Prop {
  /**
   * Property "dialect" is the SQL dialect of the backend store, and
   * determines which stages and functions can be pushed down. Default is
   * {@link Dialect#CLICKHOUSE}.
   */
  DIALECT("dialect", Dialect.class, true, Dialect.CLICKHOUSE),

  /** String property "tableName" is the qualified name of the table that
   * holds log events. Default is "lognog.logs". */
  TABLE_NAME("tableName", String.class, true, "lognog.logs"),

  /**
   * Integer property "defaultLimit" is the number of events returned by a
   * query that lists raw events and has no {@code head}. Default is 1000.
   */
  DEFAULT_LIMIT("defaultLimit", Integer.class, true, 1000),

  /**
   * Integer property "maxRows" is the maximum number of rows that the backend
   * returns when stages run in the row pipeline after the backend query.
   * Default is 10000.
   */
  MAX_ROWS("maxRows", Integer.class, true, 10_000),

  /**
   * Boolean property "pushDown" controls whether stages are translated to
   * SQL. If false, the backend query only scans the time range and every
   * stage runs in the row pipeline. Default is true.
   */
  PUSH_DOWN("pushDown", Boolean.class, true, true),

  /** Integer property "queryTimeoutMillis" is the default timeout of a query;
   * 0 means no timeout. Default is 30000. */
  QUERY_TIMEOUT_MILLIS("queryTimeoutMillis", Integer.class, true, 30_000),

  /** Property "severityFormat" controls how the severity field is
   * displayed. Default is {@link SeverityFormat#NUMBER}. */
  SEVERITY_FORMAT("severityFormat", SeverityFormat.class, true,
      SeverityFormat.NUMBER);

  /** Prefix of keys in a properties file, e.g. "lognog.maxRows". */
  public static final String PREFIX = "lognog.";

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
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

  Prop(String camelName, Class<?> type, boolean required,
      Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    if (defaultValue == null) {
      checkArgument(
          !required, "required property %s must have default value",
          camelName);
    } else {
      checkArgument(type.isInstance(defaultValue));
    }
  }

  /** Looks up a property by name. Throws if not found; never returns
   * null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException(
          "property " + propName + " not found");
    }
    return prop;
  }

  /**
   * Reads properties whose keys start with {@link #PREFIX}, such as
   * "lognog.dialect", into a map. Values are strings, converted to the type
   * of the property; enum values ignore case. Other keys are ignored.
   */
  public static void load(Map<Prop, Object> map, Properties properties) {
    for (String key : properties.stringPropertyNames()) {
      if (key.startsWith(PREFIX)) {
        final Prop prop = lookup(key.substring(PREFIX.length()));
        prop.setLenient(map, properties.getProperty(key).trim());
      }
    }
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
    Object o = map.get(this);
    return this.<Boolean>typeValue(o);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    Object o = map.get(this);
    return this.<Integer>typeValue(o);
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    Object o = map.get(this);
    return this.typeValue(o);
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map,
      Class<E> type) {
    checkType(type);
    Object o = map.get(this);
    return this.typeValue(o);
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    if (o == null) {
      return (T) defaultValue;
    }
    return (T) o;
  }

  /** Sets the value of a property, allowing strings for enum, integer and
   * boolean types. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String) {
      final String s = (String) value;
      if (type.isEnum()) {
        Optional<Enum> optional =
            Enums.getIfPresent((Class<Enum>) type,
                s.toUpperCase(Locale.ROOT));
        if (!optional.isPresent()) {
          String values =
              Arrays.stream((Enum[]) type.getEnumConstants())
                  .map(Enum::name)
                  .collect(Collectors.joining("', '", "'", "'"));
          throw new IllegalArgumentException("value of property "
              + camelName + " must be one of: " + values);
        }
        set(map, optional.get());
        return;
      }
      if (type == Integer.class) {
        try {
          set(map, Integer.valueOf(s));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("value of property "
              + camelName + " must be an integer: " + s, e);
        }
        return;
      }
      if (type == Boolean.class) {
        if (!s.equalsIgnoreCase("true") && !s.equalsIgnoreCase("false")) {
          throw new IllegalArgumentException("value of property "
              + camelName + " must be true or false: " + s);
        }
        set(map, Boolean.valueOf(s));
        return;
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException(
            "property " + camelName + " is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException("value for property "
            + camelName + " must have type " + type.getSimpleName());
      }
      map.put(this, value);
    }
  }

  /**
   * Removes the value of this property from a map, returning the previous
   * value or null.
   */
  public @Nullable Object remove(Map<Prop, Object> map) {
    return map.remove(this);
  }

  /** Allowed values for {@link #SEVERITY_FORMAT} property. */
  public enum SeverityFormat {
    /** Severity is displayed as its numeric level, 0 to 7. The default. */
    NUMBER,
    /** Severity is displayed as a name, such as "Warning". */
    NAME
  }
}

// End Prop.java
