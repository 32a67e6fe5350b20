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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

/** Tests {@link TimeRange}. */
public class TimeRangeTest {
  /** A Wednesday. */
  private static final Instant NOW = Instant.parse("2024-01-17T12:34:56Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  private static void checkBound(String s, String expected) {
    assertThat(s, TimeRange.parseBound(s, NOW),
        is(Instant.parse(expected)));
  }

  private static void checkInvalid(String s, String message) {
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> TimeRange.parseBound(s, NOW));
    assertThat(e.getMessage(), is(message));
  }

  @Test void testRelative() {
    checkBound("now", "2024-01-17T12:34:56Z");
    checkBound(" NOW ", "2024-01-17T12:34:56Z");
    checkBound("-24h", "2024-01-16T12:34:56Z");
    checkBound("-15m", "2024-01-17T12:19:56Z");
    checkBound("-30sec", "2024-01-17T12:34:26Z");
    checkBound("-2days", "2024-01-15T12:34:56Z");
    checkBound("-1w", "2024-01-10T12:34:56Z");
  }

  /** A snap rounds down to the start of a unit; weeks start on Monday. */
  @Test void testSnap() {
    checkBound("@h", "2024-01-17T12:00:00Z");
    checkBound("@d", "2024-01-17T00:00:00Z");
    checkBound("-1d@d", "2024-01-16T00:00:00Z");
    checkBound("-1h@m", "2024-01-17T11:34:00Z");
    checkBound("@w", "2024-01-15T00:00:00Z");
    checkBound("-2w@w", "2024-01-01T00:00:00Z");
    assertThat(
        TimeRange.snap(Instant.parse("2024-01-15T00:00:00Z"), Span.Unit.WEEK),
        is(Instant.parse("2024-01-15T00:00:00Z")));
    assertThat(
        TimeRange.snap(Instant.parse("2024-01-14T23:59:59Z"), Span.Unit.WEEK),
        is(Instant.parse("2024-01-08T00:00:00Z")));
  }

  @Test void testAbsolute() {
    checkBound("1705312800", "2024-01-15T10:00:00Z");
    checkBound("2024-01-15", "2024-01-15T00:00:00Z");
    checkBound("2024-01-15 10:00:00", "2024-01-15T10:00:00Z");
    checkBound("2024-01-15T10:00:00", "2024-01-15T10:00:00Z");
    checkBound("2024-01-15T10:00:00Z", "2024-01-15T10:00:00Z");
    checkBound("2024-01-15T10:00:00+01:00", "2024-01-15T09:00:00Z");
  }

  @Test void testInvalid() {
    checkInvalid("yesterday", "Invalid time 'yesterday'");
    checkInvalid("12345", "Invalid time '12345'");
    checkInvalid("2024-13-01", "Invalid time '2024-13-01'");
    checkInvalid("-5y", "Invalid time unit 'y' in '-5y'");
    checkInvalid("-1d@y", "Invalid time unit 'y' in '-1d@y'");
  }

  @Test void testParse() {
    assertThat(TimeRange.parse(null, null, CLOCK), is(TimeRange.ALL));
    assertThat(TimeRange.parse(null, null, CLOCK).isAll(), is(true));

    final TimeRange range = TimeRange.parse("-1h", "now", CLOCK);
    assertThat(range.isAll(), is(false));
    assertThat(range.toString(),
        is("[2024-01-17T11:34:56Z, 2024-01-17T12:34:56Z]"));
    assertThat(range.contains(NOW), is(true));
    assertThat(range.contains(NOW.minusSeconds(3600)), is(true));
    assertThat(range.contains(NOW.minusSeconds(3601)), is(false));
    assertThat(range.contains(NOW.plusSeconds(1)), is(false));

    final TimeRange open = TimeRange.parse("-1h", null, CLOCK);
    assertThat(open.toString(), is("[2024-01-17T11:34:56Z, ]"));
    assertThat(open.contains(NOW.plusSeconds(86_400)), is(true));

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> TimeRange.parse("now", "-1h", CLOCK));
    assertThat(e.getMessage(),
        is("earliest time 2024-01-17T12:34:56Z is after latest time "
            + "2024-01-17T11:34:56Z"));
  }
}

// End TimeRangeTest.java
