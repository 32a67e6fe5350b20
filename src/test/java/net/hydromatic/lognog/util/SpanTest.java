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
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import org.junit.jupiter.api.Test;

/** Tests {@link Span}. */
public class SpanTest {
  @Test void testParse() {
    assertThat(String.valueOf(Span.parse("30s")), is("30s"));
    assertThat(String.valueOf(Span.parse("5m")), is("5m"));
    assertThat(String.valueOf(Span.parse("2hours")), is("2h"));
    assertThat(String.valueOf(Span.parse("1D")), is("1d"));
    assertThat(String.valueOf(Span.parse(" 1w ")), is("1w"));
    assertThat(Span.parse("1h"), is(Span.ONE_HOUR));
    assertThat(Span.parse("60m"), not(Span.ONE_HOUR));
    assertThat(Span.parse("1h").isTime(), is(true));

    assertThat(String.valueOf(Span.parse("100")), is("100"));
    assertThat(String.valueOf(Span.parse("1.5")), is("1.5"));
    assertThat(Span.parse("1.50"), is(Span.parse("1.5")));
    assertThat(Span.parse("100").isTime(), is(false));
  }

  @Test void testParseInvalid() {
    assertThat(Span.parse("0"), nullValue());
    assertThat(Span.parse("0h"), nullValue());
    assertThat(Span.parse("-5"), nullValue());
    assertThat(Span.parse("1.5h"), nullValue());
    assertThat(Span.parse("5y"), nullValue());
    assertThat(Span.parse("h"), nullValue());
    assertThat(Span.parse(""), nullValue());
  }

  @Test void testSeconds() {
    assertThat(Span.of(5, Span.Unit.MINUTE).seconds(), is(300L));
    assertThat(Span.parse("1w").seconds(), is(604_800L));
    final Span span = Span.parse("100");
    assertThrows(IllegalStateException.class, span::seconds);
  }

  /** Buckets are aligned to the epoch, so weeks start on Thursday. */
  @Test void testTruncate() {
    final Instant t = Instant.parse("2024-01-15T10:07:30Z");
    assertThat(Span.of(5, Span.Unit.MINUTE).truncate(t),
        is(Instant.parse("2024-01-15T10:05:00Z")));
    assertThat(Span.ONE_HOUR.truncate(t),
        is(Instant.parse("2024-01-15T10:00:00Z")));
    assertThat(Span.of(1, Span.Unit.DAY).truncate(t),
        is(Instant.parse("2024-01-15T00:00:00Z")));
    assertThat(Span.of(1, Span.Unit.WEEK).truncate(t),
        is(Instant.parse("2024-01-11T00:00:00Z")));
    assertThat(Span.of(1, Span.Unit.HOUR)
            .truncate(Instant.parse("1969-12-31T23:30:00Z")),
        is(Instant.parse("1969-12-31T23:00:00Z")));
  }

  @Test void testFloor() {
    final Span span = Span.parse("100");
    assertThat(span.floor(250), is(200d));
    assertThat(span.floor(200), is(200d));
    assertThat(span.floor(-1), is(-100d));
    assertThat(Span.parse("0.5").floor(1.7), is(1.5d));
  }

  @Test void testUnit() {
    assertThat(Span.Unit.lookup("Minutes"), is(Span.Unit.MINUTE));
    assertThat(Span.Unit.lookup("hr"), is(Span.Unit.HOUR));
    assertThat(Span.Unit.lookup("y"), nullValue());
  }
}

// End SpanTest.java
