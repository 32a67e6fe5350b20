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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import java.time.Instant;
import net.hydromatic.lognog.compile.AggFunction;
import org.junit.jupiter.api.Test;

/** Tests {@link Aggregates}. */
public class AggregatesTest {
  /** Applies an aggregate function to values that have no timestamp. */
  private static String agg(AggFunction function, Object... values) {
    final Aggregates.Accumulator accumulator =
        Aggregates.accumulator(function);
    for (Object value : values) {
      accumulator.add(Variant.of(value), Variant.NULL);
    }
    return accumulator.result().toString();
  }

  private static Variant at(String time) {
    return Variant.ofTimestamp(Instant.parse("2024-01-15T" + time + "Z"));
  }

  @Test void testCount() {
    assertThat(agg(AggFunction.COUNT, 1, null, "x"), is("2"));
    assertThat(agg(AggFunction.COUNT), is("0"));
    assertThat(agg(AggFunction.DC, "a", "b", "a", null, 1, "1"), is("3"));
  }

  /** Numeric aggregates convert strings that look like numbers, and ignore
   * other values. */
  @Test void testMoments() {
    assertThat(agg(AggFunction.SUM, 1, 2, "3", null, "x"), is("6"));
    assertThat(agg(AggFunction.AVG, 1, 2, "3", null, "x"), is("2"));
    assertThat(agg(AggFunction.SUM), is("null"));
    assertThat(agg(AggFunction.AVG, "x"), is("null"));
    assertThat(agg(AggFunction.RANGE, 1, 5, 3), is("4"));
    assertThat(agg(AggFunction.VARIANCE, 1, 3, "x", null), is("1"));
    assertThat(agg(AggFunction.STDDEV, 1, 3), is("1"));
    assertThat(agg(AggFunction.STDDEV, 7), is("0"));
  }

  /** Min and max also work on values that are not numbers. */
  @Test void testMinMax() {
    assertThat(agg(AggFunction.MIN, 3, 1, 2), is("1"));
    assertThat(agg(AggFunction.MAX, 3, null, 2), is("3"));
    assertThat(agg(AggFunction.MIN, 2, "10"), is("2"));
    assertThat(agg(AggFunction.MAX, "b", "a", "c"), is("c"));
    assertThat(agg(AggFunction.MIN), is("null"));
  }

  @Test void testPercentile() {
    assertThat(agg(AggFunction.P50, 4, 1, 3, 2), is("2.5"));
    assertThat(agg(AggFunction.MEDIAN, 5, 1, 3), is("3"));
    assertThat(agg(AggFunction.P90, 0, 10), is("9"));
    assertThat(agg(AggFunction.P95, 100, 0), is("95"));
    assertThat(agg(AggFunction.P99, 42), is("42"));
    assertThat(agg(AggFunction.P50), is("null"));
  }

  /** Of equally frequent values, mode returns the one seen first. */
  @Test void testMode() {
    assertThat(agg(AggFunction.MODE, "a", "b", "b", "a", "c"), is("a"));
    assertThat(agg(AggFunction.MODE, 2, 1, "1"), is("1"));
    assertThat(agg(AggFunction.MODE, null, null), is("null"));
  }

  @Test void testEarliestLatest() {
    final Aggregates.Accumulator earliest =
        Aggregates.accumulator(AggFunction.EARLIEST);
    final Aggregates.Accumulator latest =
        Aggregates.accumulator(AggFunction.LATEST);
    for (Aggregates.Accumulator a : new Aggregates.Accumulator[] {
        earliest, latest}) {
      a.add(Variant.ofString("x"), at("10:00:00"));
      a.add(Variant.ofString("y"), at("09:00:00"));
      a.add(Variant.ofString("y2"), at("09:00:00"));
      a.add(Variant.ofString("z"), at("11:00:00"));
      a.add(Variant.NULL, at("12:00:00"));
      a.add(Variant.ofString("w"), Variant.NULL);
    }
    assertThat(earliest.result().toString(), is("y"));
    assertThat(latest.result().toString(), is("z"));
  }

  @Test void testFirstLast() {
    assertThat(agg(AggFunction.FIRST, null, "a", "b", null), is("a"));
    assertThat(agg(AggFunction.LAST, null, "a", "b", null), is("b"));
    assertThat(agg(AggFunction.LAST), is("null"));
  }

  @Test void testValuesList() {
    assertThat(agg(AggFunction.VALUES, "b", "a", "b", 1, null),
        is("[1, a, b]"));
    assertThat(agg(AggFunction.LIST, "b", "a", "b", 1, null),
        is("[b, a, b, 1]"));
    assertThat(agg(AggFunction.LIST), is("[]"));
  }

  @Test void testToInstant() {
    assertThat(Aggregates.toInstant(Variant.ofNumber(1705312800)),
        is(Instant.parse("2024-01-15T10:00:00Z")));
    assertThat(Aggregates.toInstant(Variant.ofNumber(1.5)),
        is(Instant.parse("1970-01-01T00:00:01.500Z")));
    assertThat(Aggregates.toInstant(at("10:00:00")),
        is(Instant.parse("2024-01-15T10:00:00Z")));
    assertThat(
        Aggregates.toInstant(Variant.ofString("2024-01-15T10:00:00+01:00")),
        is(Instant.parse("2024-01-15T09:00:00Z")));
    assertThat(Aggregates.toInstant(Variant.ofString("2024-01-15 10:00:00")),
        is(Instant.parse("2024-01-15T10:00:00Z")));
    assertThat(Aggregates.toInstant(Variant.ofString("yesterday")),
        nullValue());
    assertThat(Aggregates.toInstant(Variant.TRUE), nullValue());
    assertThat(Aggregates.toInstant(Variant.NULL), nullValue());
  }
}

// End AggregatesTest.java
