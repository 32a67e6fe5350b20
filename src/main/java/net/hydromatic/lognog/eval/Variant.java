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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A value in a row, with an explicit kind.
 *
 * <p>Values of log fields are not known until a row is inspected, so every
 * operator and function switches on {@link #kind} and applies explicit
 * coercion rules.
 *
 * <p>{@link Kind#NULL} means that a field is absent or null;
 * {@link Kind#UNDEFINED} is the result of an operation that has no value,
 * such as division by zero or a function applied to an argument of the wrong
 * kind. Both behave like SQL NULL: comparisons with them are not true, and
 * they participate in no aggregate.
 */
public final class Variant {
  public static final Variant NULL = new Variant(Kind.NULL, null);
  public static final Variant UNDEFINED = new Variant(Kind.UNDEFINED, null);
  public static final Variant TRUE = new Variant(Kind.BOOL, true);
  public static final Variant FALSE = new Variant(Kind.BOOL, false);

  public final Kind kind;
  /** Boolean, Double, String, Instant, {@code ImmutableList<Variant>}, or
   * null. */
  private final @Nullable Object value;

  private Variant(Kind kind, @Nullable Object value) {
    this.kind = requireNonNull(kind);
    this.value = value;
  }

  /** Returns a boolean variant. */
  public static Variant ofBool(boolean b) {
    return b ? TRUE : FALSE;
  }

  /** Returns a boolean variant, or {@link #NULL} if {@code b} is null. */
  public static Variant ofBool(@Nullable Boolean b) {
    return b == null ? NULL : ofBool(b.booleanValue());
  }

  /** Returns a number variant; {@link #UNDEFINED} if the value is not
   * finite. */
  public static Variant ofNumber(double d) {
    if (Double.isNaN(d) || Double.isInfinite(d)) {
      return UNDEFINED;
    }
    return new Variant(Kind.NUMBER, d == 0d ? 0d : d);
  }

  public static Variant ofString(String s) {
    return new Variant(Kind.STRING, requireNonNull(s));
  }

  public static Variant ofTimestamp(Instant instant) {
    return new Variant(Kind.TIMESTAMP, requireNonNull(instant));
  }

  public static Variant ofList(List<Variant> list) {
    return new Variant(Kind.LIST, ImmutableList.copyOf(list));
  }

  /** Returns a variant that holds JSON text. */
  public static Variant ofJson(String json) {
    return new Variant(Kind.JSON, requireNonNull(json));
  }

  /** Converts a Java value to a variant. */
  public static Variant of(@Nullable Object o) {
    if (o == null) {
      return NULL;
    }
    if (o instanceof Variant) {
      return (Variant) o;
    }
    if (o instanceof Boolean) {
      return ofBool((Boolean) o);
    }
    if (o instanceof Number) {
      return ofNumber(((Number) o).doubleValue());
    }
    if (o instanceof String) {
      return ofString((String) o);
    }
    if (o instanceof Instant) {
      return ofTimestamp((Instant) o);
    }
    if (o instanceof List) {
      return ofList(
          ((List<?>) o).stream().map(Variant::of)
              .collect(Collectors.toList()));
    }
    return ofString(o.toString());
  }

  /** Whether this value is null or undefined. */
  public boolean isNull() {
    return kind == Kind.NULL || kind == Kind.UNDEFINED;
  }

  /** Whether this value is the boolean {@code true}. */
  public boolean isTrue() {
    return this.equals(TRUE);
  }

  /**
   * Returns the truth value: a boolean as is, a number is true if not zero,
   * the strings "true" and "false" (ignoring case); otherwise null.
   */
  public @Nullable Boolean truth() {
    switch (kind) {
    case BOOL:
      return (Boolean) value;
    case NUMBER:
      return (Double) requireNonNull(value) != 0d;
    case STRING:
      final String s = (String) requireNonNull(value);
      return s.equalsIgnoreCase("true") ? Boolean.TRUE
          : s.equalsIgnoreCase("false") ? Boolean.FALSE
          : null;
    default:
      return null;
    }
  }

  /**
   * Returns the value as a number, or null if it cannot be converted.
   *
   * <p>A string converts if it is a decimal number, ignoring surrounding
   * white space; a timestamp converts to seconds since the epoch.
   */
  public @Nullable Double toNumber() {
    switch (kind) {
    case NUMBER:
      return (Double) value;
    case STRING:
      return parseNumber((String) requireNonNull(value));
    case TIMESTAMP:
      final Instant instant = (Instant) requireNonNull(value);
      return instant.getEpochSecond() + instant.getNano() / 1e9d;
    default:
      return null;
    }
  }

  /** Parses a decimal number; returns null if the string is not one. */
  static @Nullable Double parseNumber(String s) {
    final String t = s.trim();
    if (t.isEmpty()) {
      return null;
    }
    for (int i = 0; i < t.length(); i++) {
      final char c = t.charAt(i);
      if (!(c >= '0' && c <= '9'
          || c == '.' || c == '-' || c == '+' || c == 'e' || c == 'E')) {
        return null;
      }
    }
    try {
      return new BigDecimal(t).doubleValue();
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /** Returns the value as text, or null if it is null or undefined. */
  public @Nullable String toStr() {
    switch (kind) {
    case NULL:
    case UNDEFINED:
      return null;
    case NUMBER:
      return formatNumber((Double) requireNonNull(value));
    case LIST:
      return asList().stream().map(Variant::toString)
          .collect(Collectors.joining(","));
    default:
      return requireNonNull(value).toString();
    }
  }

  /** Returns the instant of a timestamp value. */
  public Instant asInstant() {
    if (kind != Kind.TIMESTAMP) {
      throw new IllegalStateException("not a timestamp: " + this);
    }
    return (Instant) requireNonNull(value);
  }

  /** Returns the elements of a list value. */
  @SuppressWarnings("unchecked")
  public ImmutableList<Variant> asList() {
    if (kind != Kind.LIST) {
      throw new IllegalStateException("not a list: " + this);
    }
    return (ImmutableList<Variant>) requireNonNull(value);
  }

  /**
   * Converts to a plain Java value for display: null, Boolean, Long (for an
   * integral number), Double, String, a {@code List}, or, for a timestamp,
   * an ISO-8601 string in UTC.
   */
  public @Nullable Object toJava() {
    switch (kind) {
    case NULL:
    case UNDEFINED:
      return null;
    case NUMBER:
      final double d = (Double) requireNonNull(value);
      if (d == Math.rint(d) && Math.abs(d) < 1e15) {
        return (long) d;
      }
      return d;
    case TIMESTAMP:
      return value.toString();
    case LIST:
      return asList().stream().map(Variant::toJava)
          .collect(Collectors.toList());
    default:
      return value;
    }
  }

  /** Formats a number without a trailing ".0" if it is integral. */
  static String formatNumber(double d) {
    if (d == Math.rint(d) && Math.abs(d) < 1e15) {
      return Long.toString((long) d);
    }
    return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, value);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Variant
            && kind == ((Variant) o).kind
            && Objects.equals(value, ((Variant) o).value);
  }

  @Override
  public String toString() {
    switch (kind) {
    case NULL:
      return "null";
    case UNDEFINED:
      return "undefined";
    case LIST:
      return asList().toString();
    default:
      return requireNonNull(toStr());
    }
  }

  /** Kind of value. */
  public enum Kind {
    NULL,
    UNDEFINED,
    BOOL,
    NUMBER,
    STRING,
    TIMESTAMP,
    LIST,
    JSON
  }
}

// End Variant.java
