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

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.lognog.compile.AggFunction;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Implementations of aggregate functions.
 *
 * <p>Each call to {@link #accumulator(AggFunction)} returns a fresh
 * {@link Accumulator} that holds the state of one group.
 */
public abstract class Aggregates {
  private Aggregates() {}

  /** Creates an accumulator for an aggregate function. */
  public static Accumulator accumulator(AggFunction function) {
    switch (function) {
    case COUNT:
      return new CountAccumulator();
    case DC:
      return new DistinctCountAccumulator();
    case SUM:
    case AVG:
    case MIN:
    case MAX:
    case RANGE:
    case STDDEV:
    case VARIANCE:
      return new MomentAccumulator(function);
    case P50:
    case P90:
    case P95:
    case P99:
    case MEDIAN:
      return new PercentileAccumulator(requireNonNull(function.percentile));
    case MODE:
      return new ModeAccumulator();
    case EARLIEST:
    case LATEST:
      return new TimeAccumulator(function == AggFunction.LATEST);
    case FIRST:
    case LAST:
      return new OrderAccumulator(function == AggFunction.LAST);
    case VALUES:
    case LIST:
      return new ListAccumulator(function == AggFunction.VALUES);
    default:
      throw new AssertionError("unknown aggregate " + function);
    }
  }

  /**
   * Converts a value to an instant: a timestamp as is; a number as seconds
   * since the epoch; a string in ISO-8601 format, in UTC if it has no
   * offset. Returns null if the value cannot be converted.
   */
  public static @Nullable Instant toInstant(Variant v) {
    switch (v.kind) {
    case TIMESTAMP:
      return v.asInstant();
    case NUMBER:
      final double d = requireNonNull(v.toNumber());
      final long seconds = (long) Math.floor(d);
      return Instant.ofEpochSecond(seconds,
          Math.round((d - seconds) * 1_000_000_000d));
    case STRING:
      final String s = requireNonNull(v.toStr()).trim();
      try {
        // A value with no offset, such as "2024-01-15 10:00:00", is UTC
        final TemporalAccessor t =
            DateTimeFormatter.ISO_DATE_TIME.parseBest(
                s.indexOf('T') < 0 ? s.replace(' ', 'T') : s,
                ZonedDateTime::from, LocalDateTime::from);
        return t instanceof ZonedDateTime
            ? ((ZonedDateTime) t).toInstant()
            : ((LocalDateTime) t).toInstant(ZoneOffset.UTC);
      } catch (DateTimeParseException e) {
        return null;
      }
    default:
      return null;
    }
  }

  /** State of an aggregate function for one group. */
  public interface Accumulator {
    /** Adds a value. {@code timestamp} is the timestamp of the row, used by
     * {@code earliest} and {@code latest}. */
    void add(Variant value, Variant timestamp);

    /** Returns the result. */
    Variant result();
  }

  /** Accumulator for {@code count}. The caller passes {@link Variant#TRUE}
   * for each row if the function has no argument. */
  private static class CountAccumulator implements Accumulator {
    long count;

    @Override
    public void add(Variant value, Variant timestamp) {
      if (!value.isNull()) {
        ++count;
      }
    }

    @Override
    public Variant result() {
      return Variant.ofNumber(count);
    }
  }

  /** Accumulator for {@code dc}. Values are distinct if their text
   * differs. */
  private static class DistinctCountAccumulator implements Accumulator {
    final Set<String> values = new LinkedHashSet<>();

    @Override
    public void add(Variant value, Variant timestamp) {
      final String s = value.toStr();
      if (s != null) {
        values.add(s);
      }
    }

    @Override
    public Variant result() {
      return Variant.ofNumber(values.size());
    }
  }

  /**
   * Accumulator for functions that need only running totals: {@code sum},
   * {@code avg}, {@code range}, {@code stddev} and {@code variance}, and
   * {@code min} and {@code max} over numbers.
   *
   * <p>{@code min} and {@code max} also accept values that are not numbers;
   * then they compare using {@link Comparators#ASCENDING}.
   */
  private static class MomentAccumulator implements Accumulator {
    final AggFunction function;
    long n;
    double sum;
    double mean;
    double m2;
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    @Nullable Variant minValue;
    @Nullable Variant maxValue;

    MomentAccumulator(AggFunction function) {
      this.function = function;
    }

    @Override
    public void add(Variant value, Variant timestamp) {
      if (value.isNull()) {
        return;
      }
      if (minValue == null
          || Comparators.ASCENDING.compare(value, minValue) < 0) {
        minValue = value;
      }
      if (maxValue == null
          || Comparators.ASCENDING.compare(value, maxValue) > 0) {
        maxValue = value;
      }
      final Double d = value.toNumber();
      if (d == null) {
        return;
      }
      ++n;
      sum += d;
      // Welford's algorithm
      final double delta = d - mean;
      mean += delta / n;
      m2 += delta * (d - mean);
      min = Math.min(min, d);
      max = Math.max(max, d);
    }

    @Override
    public Variant result() {
      switch (function) {
      case MIN:
        return minValue == null ? Variant.NULL : minValue;
      case MAX:
        return maxValue == null ? Variant.NULL : maxValue;
      default:
        break;
      }
      if (n == 0) {
        return Variant.NULL;
      }
      switch (function) {
      case SUM:
        return Variant.ofNumber(sum);
      case AVG:
        return Variant.ofNumber(sum / n);
      case RANGE:
        return Variant.ofNumber(max - min);
      case VARIANCE:
        return Variant.ofNumber(m2 / n);
      case STDDEV:
        return Variant.ofNumber(Math.sqrt(m2 / n));
      default:
        throw new AssertionError(function);
      }
    }
  }

  /** Accumulator for percentiles; interpolates linearly between the two
   * nearest values. */
  private static class PercentileAccumulator implements Accumulator {
    final double fraction;
    final List<Double> values = new ArrayList<>();

    PercentileAccumulator(double fraction) {
      this.fraction = fraction;
    }

    @Override
    public void add(Variant value, Variant timestamp) {
      final Double d = value.toNumber();
      if (d != null) {
        values.add(d);
      }
    }

    @Override
    public Variant result() {
      if (values.isEmpty()) {
        return Variant.NULL;
      }
      Collections.sort(values);
      final double rank = fraction * (values.size() - 1);
      final int lower = (int) Math.floor(rank);
      final int upper = (int) Math.ceil(rank);
      final double v0 = values.get(lower);
      final double v1 = values.get(upper);
      return Variant.ofNumber(v0 + (v1 - v0) * (rank - lower));
    }
  }

  /** Accumulator for {@code mode}. */
  private static class ModeAccumulator implements Accumulator {
    /** Count and first value for each distinct text, in order of first
     * appearance. */
    final Map<String, long[]> counts = new LinkedHashMap<>();
    final Map<String, Variant> firstValues = new LinkedHashMap<>();

    @Override
    public void add(Variant value, Variant timestamp) {
      final String s = value.toStr();
      if (s == null) {
        return;
      }
      counts.computeIfAbsent(s, k -> new long[1])[0]++;
      firstValues.putIfAbsent(s, value);
    }

    @Override
    public Variant result() {
      @Nullable String best = null;
      long bestCount = 0;
      for (Map.Entry<String, long[]> e : counts.entrySet()) {
        if (e.getValue()[0] > bestCount) {
          best = e.getKey();
          bestCount = e.getValue()[0];
        }
      }
      return best == null ? Variant.NULL
          : requireNonNull(firstValues.get(best));
    }
  }

  /** Accumulator for {@code earliest} and {@code latest}. Rows with no
   * timestamp are ignored; of several rows with the same timestamp, the
   * first wins. */
  private static class TimeAccumulator implements Accumulator {
    final boolean latest;
    @Nullable Instant instant;
    Variant value = Variant.NULL;

    TimeAccumulator(boolean latest) {
      this.latest = latest;
    }

    @Override
    public void add(Variant value, Variant timestamp) {
      if (value.isNull()) {
        return;
      }
      final Instant t = toInstant(timestamp);
      if (t == null) {
        return;
      }
      if (instant == null
          || (latest ? t.isAfter(instant) : t.isBefore(instant))) {
        instant = t;
        this.value = value;
      }
    }

    @Override
    public Variant result() {
      return value;
    }
  }

  /** Accumulator for {@code first} and {@code last}. */
  private static class OrderAccumulator implements Accumulator {
    final boolean last;
    Variant value = Variant.NULL;

    OrderAccumulator(boolean last) {
      this.last = last;
    }

    @Override
    public void add(Variant value, Variant timestamp) {
      if (!value.isNull() && (last || this.value.isNull())) {
        this.value = value;
      }
    }

    @Override
    public Variant result() {
      return value;
    }
  }

  /** Accumulator for {@code values} (distinct, sorted) and {@code list} (all,
   * in input order). */
  private static class ListAccumulator implements Accumulator {
    final boolean distinct;
    final List<Variant> values = new ArrayList<>();

    ListAccumulator(boolean distinct) {
      this.distinct = distinct;
    }

    @Override
    public void add(Variant value, Variant timestamp) {
      if (!value.isNull()) {
        values.add(value);
      }
    }

    @Override
    public Variant result() {
      if (!distinct) {
        return Variant.ofList(values);
      }
      final Map<String, Variant> map = new LinkedHashMap<>();
      for (Variant value : values) {
        map.putIfAbsent(requireNonNull(value.toStr()), value);
      }
      final List<Variant> list = new ArrayList<>(map.values());
      list.sort(Comparators.ASCENDING);
      return Variant.ofList(list);
    }
  }
}

// End Aggregates.java
