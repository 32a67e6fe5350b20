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
package net.hydromatic.lognog.util;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Width of a bucket, as used by {@code timechart} and {@code bin}.
 *
 * <p>A span with a unit, such as {@code 5m}, is a time span; a span without a
 * unit, such as {@code 100}, buckets numbers.
 */
public class Span {
  private static final Pattern PATTERN =
      Pattern.compile("([0-9]+(?:\\.[0-9]+)?)([a-zA-Z]*)");

  /** Default span of {@code timechart}. */
  public static final Span ONE_HOUR = new Span(BigDecimal.ONE, Unit.HOUR);

  public final BigDecimal amount;
  public final @Nullable Unit unit;

  private Span(BigDecimal amount, @Nullable Unit unit) {
    this.amount = requireNonNull(amount);
    this.unit = unit;
  }

  /** Creates a time span. */
  public static Span of(long amount, Unit unit) {
    return new Span(BigDecimal.valueOf(amount), requireNonNull(unit));
  }

  /**
   * Parses a span such as "30s", "5m", "1h", "1d", "1w" or "100". Returns
   * null if the string is not a valid span.
   */
  public static @Nullable Span parse(String s) {
    final Matcher matcher = PATTERN.matcher(s.trim());
    if (!matcher.matches()) {
      return null;
    }
    final BigDecimal amount = new BigDecimal(matcher.group(1));
    if (amount.signum() <= 0) {
      return null;
    }
    final String unitName = matcher.group(2);
    if (unitName.isEmpty()) {
      return new Span(amount, null);
    }
    final Unit unit = Unit.BY_NAME.get(unitName.toLowerCase(Locale.ROOT));
    if (unit == null || amount.stripTrailingZeros().scale() > 0) {
      // Time spans must be a whole number of units.
      return null;
    }
    return new Span(amount, unit);
  }

  /** Whether this span buckets timestamps. */
  public boolean isTime() {
    return unit != null;
  }

  /** Returns the length of this time span in seconds. */
  public long seconds() {
    if (unit == null) {
      throw new IllegalStateException("not a time span: " + this);
    }
    return amount.longValueExact() * unit.seconds;
  }

  /** Truncates an instant to the start of its bucket, aligned to the epoch. */
  public Instant truncate(Instant instant) {
    final long width = seconds();
    final long s = Math.floorDiv(instant.getEpochSecond(), width) * width;
    return Instant.ofEpochSecond(s);
  }

  /** Rounds a number down to the start of its bucket. */
  public double floor(double value) {
    final double width = amount.doubleValue();
    return Math.floor(value / width) * width;
  }

  @Override
  public int hashCode() {
    return Objects.hash(amount, unit);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Span
            && amount.compareTo(((Span) o).amount) == 0
            && unit == ((Span) o).unit;
  }

  @Override
  public String toString() {
    return amount.toPlainString() + (unit == null ? "" : unit.shortName);
  }

  /** Unit of a time span. */
  public enum Unit {
    SECOND("s", 1, "sec", "secs", "second", "seconds"),
    MINUTE("m", 60, "min", "mins", "minute", "minutes"),
    HOUR("h", 3_600, "hr", "hrs", "hour", "hours"),
    DAY("d", 86_400, "day", "days"),
    WEEK("w", 604_800, "week", "weeks");

    public final String shortName;
    public final long seconds;
    private final String[] synonyms;

    /** Units keyed by short name and synonyms. */
    static final ImmutableMap<String, Unit> BY_NAME;

    static {
      final Map<String, Unit> map = new LinkedHashMap<>();
      for (Unit unit : values()) {
        map.put(unit.shortName, unit);
        for (String synonym : unit.synonyms) {
          map.put(synonym, unit);
        }
      }
      BY_NAME = ImmutableMap.copyOf(map);
    }

    Unit(String shortName, long seconds, String... synonyms) {
      this.shortName = shortName;
      this.seconds = seconds;
      this.synonyms = synonyms;
    }

    /** Looks up a unit by name; returns null if not found. */
    public static @Nullable Unit lookup(String name) {
      return BY_NAME.get(name.toLowerCase(Locale.ROOT));
    }
  }
}

// End Span.java
