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

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Range of event times that a query scans; either bound may be open.
 *
 * <p>A bound is written as one of:
 *
 * <ul>
 *   <li>{@code now};
 *   <li>a relative time, such as {@code -24h} or {@code -15m}, optionally
 *       snapped to the start of a unit, such as {@code -1d@d};
 *   <li>an ISO-8601 date-time, such as {@code 2024-01-15T10:00:00Z} or
 *       {@code 2024-01-15 10:00:00} (UTC if there is no offset), or a date;
 *   <li>seconds since the epoch.
 * </ul>
 */
public class TimeRange {
  private static final Pattern RELATIVE =
      Pattern.compile("-([0-9]+)([a-z]+)(?:@([a-z]+))?");
  private static final Pattern SNAP = Pattern.compile("@([a-z]+)");
  private static final Pattern EPOCH = Pattern.compile("[0-9]{9,}");
  private static final Pattern DATE =
      Pattern.compile("[0-9]{4}-[0-9]{2}-[0-9]{2}");

  /** Range with no bounds. */
  public static final TimeRange ALL = new TimeRange(null, null);

  public final @Nullable Instant earliest;
  public final @Nullable Instant latest;

  private TimeRange(@Nullable Instant earliest, @Nullable Instant latest) {
    this.earliest = earliest;
    this.latest = latest;
  }

  /** Creates a range from two instants. */
  public static TimeRange of(@Nullable Instant earliest,
      @Nullable Instant latest) {
    if (earliest != null && latest != null && earliest.isAfter(latest)) {
      throw new IllegalArgumentException("earliest time " + earliest
          + " is after latest time " + latest);
    }
    return earliest == null && latest == null ? ALL
        : new TimeRange(earliest, latest);
  }

  /** Parses a range; either bound may be null. Throws
   * {@link IllegalArgumentException} if a bound is invalid. */
  public static TimeRange parse(@Nullable String earliest,
      @Nullable String latest, Clock clock) {
    final Instant now = clock.instant();
    return of(earliest == null ? null : parseBound(earliest, now),
        latest == null ? null : parseBound(latest, now));
  }

  /** Parses one bound of a range, relative to a given current time. */
  public static Instant parseBound(String s, Instant now) {
    final String t = s.trim().toLowerCase(Locale.ROOT);
    if (t.equals("now")) {
      return now;
    }
    Matcher matcher = RELATIVE.matcher(t);
    if (matcher.matches()) {
      final Span.Unit unit = unit(matcher.group(2), s);
      final Instant instant =
          now.minusSeconds(Long.parseLong(matcher.group(1)) * unit.seconds);
      return matcher.group(3) == null ? instant
          : snap(instant, unit(matcher.group(3), s));
    }
    matcher = SNAP.matcher(t);
    if (matcher.matches()) {
      return snap(now, unit(matcher.group(1), s));
    }
    if (EPOCH.matcher(t).matches()) {
      return Instant.ofEpochSecond(Long.parseLong(t));
    }
    final String u = s.trim();
    try {
      if (DATE.matcher(u).matches()) {
        return LocalDateTime.parse(u + "T00:00:00").toInstant(ZoneOffset.UTC);
      }
      final TemporalAccessor accessor =
          DateTimeFormatter.ISO_DATE_TIME.parseBest(
              u.indexOf('T') < 0 ? u.replace(' ', 'T') : u,
              ZonedDateTime::from, LocalDateTime::from);
      return accessor instanceof ZonedDateTime
          ? ((ZonedDateTime) accessor).toInstant()
          : ((LocalDateTime) accessor).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid time '" + s + "'", e);
    }
  }

  private static Span.Unit unit(String name, String s) {
    final Span.Unit unit = Span.Unit.lookup(name);
    if (unit == null) {
      throw new IllegalArgumentException("Invalid time unit '" + name
          + "' in '" + s + "'");
    }
    return unit;
  }

  /** Rounds an instant down to the start of a unit, in UTC. Weeks start on
   * Monday. */
  static Instant snap(Instant instant, Span.Unit unit) {
    switch (unit) {
    case SECOND:
      return instant.truncatedTo(ChronoUnit.SECONDS);
    case MINUTE:
      return instant.truncatedTo(ChronoUnit.MINUTES);
    case HOUR:
      return instant.truncatedTo(ChronoUnit.HOURS);
    case DAY:
      return instant.truncatedTo(ChronoUnit.DAYS);
    case WEEK:
      final ZonedDateTime day =
          instant.atZone(ZoneOffset.UTC).truncatedTo(ChronoUnit.DAYS);
      return day.minusDays(day.getDayOfWeek().getValue()
          - DayOfWeek.MONDAY.getValue()).toInstant();
    default:
      throw new AssertionError(unit);
    }
  }

  /** Whether this range has no bounds. */
  public boolean isAll() {
    return earliest == null && latest == null;
  }

  /** Whether an instant is within this range, bounds inclusive. */
  public boolean contains(Instant instant) {
    return (earliest == null || !instant.isBefore(earliest))
        && (latest == null || !instant.isAfter(latest));
  }

  @Override
  public int hashCode() {
    return Objects.hash(earliest, latest);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof TimeRange
            && Objects.equals(earliest, ((TimeRange) o).earliest)
            && Objects.equals(latest, ((TimeRange) o).latest);
  }

  @Override
  public String toString() {
    return "[" + (earliest == null ? "" : earliest) + ", "
        + (latest == null ? "" : latest) + "]";
  }
}

// End TimeRange.java
