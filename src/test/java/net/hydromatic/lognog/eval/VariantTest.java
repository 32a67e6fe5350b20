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

import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

/** Tests {@link Variant}. */
public class VariantTest {
  private static final Instant T = Instant.parse("2024-01-15T10:00:00Z");

  @Test void testOf() {
    assertThat(Variant.of(null), is(Variant.NULL));
    assertThat(Variant.of(3).kind, is(Variant.Kind.NUMBER));
    assertThat(Variant.of(3L), is(Variant.ofNumber(3)));
    assertThat(Variant.of(true), is(Variant.TRUE));
    assertThat(Variant.of("x"), is(Variant.ofString("x")));
    assertThat(Variant.of(T), is(Variant.ofTimestamp(T)));
    assertThat(Variant.of(Arrays.asList(1, "a", null)).toString(),
        is("[1, a, null]"));
    assertThat(Variant.of(Variant.UNDEFINED), is(Variant.UNDEFINED));
  }

  /** Values that are not finite numbers are undefined; negative zero is
   * zero. */
  @Test void testOfNumber() {
    assertThat(Variant.ofNumber(Double.NaN), is(Variant.UNDEFINED));
    assertThat(Variant.ofNumber(Double.POSITIVE_INFINITY),
        is(Variant.UNDEFINED));
    assertThat(Variant.ofNumber(-0d), is(Variant.ofNumber(0)));
    assertThat(Variant.ofNumber(-0d).toString(), is("0"));
  }

  @Test void testNull() {
    assertThat(Variant.NULL.isNull(), is(true));
    assertThat(Variant.UNDEFINED.isNull(), is(true));
    assertThat(Variant.NULL.equals(Variant.UNDEFINED), is(false));
    assertThat(Variant.NULL.toString(), is("null"));
    assertThat(Variant.UNDEFINED.toString(), is("undefined"));
    assertThat(Variant.NULL.toStr(), nullValue());
    assertThat(Variant.UNDEFINED.toJava(), nullValue());
    assertThat(Variant.ofString("").isNull(), is(false));
  }

  @Test void testTruth() {
    assertThat(Variant.TRUE.truth(), is(true));
    assertThat(Variant.ofNumber(0).truth(), is(false));
    assertThat(Variant.ofNumber(-2).truth(), is(true));
    assertThat(Variant.ofString("TRUE").truth(), is(true));
    assertThat(Variant.ofString("False").truth(), is(false));
    assertThat(Variant.ofString("yes").truth(), nullValue());
    assertThat(Variant.NULL.truth(), nullValue());
    assertThat(Variant.ofTimestamp(T).truth(), nullValue());

    // only the boolean true is true
    assertThat(Variant.TRUE.isTrue(), is(true));
    assertThat(Variant.ofString("true").isTrue(), is(false));
    assertThat(Variant.ofNumber(1).isTrue(), is(false));
  }

  @Test void testToNumber() {
    assertThat(Variant.ofString(" 42 ").toNumber(), is(42d));
    assertThat(Variant.ofString("-1.5").toNumber(), is(-1.5d));
    assertThat(Variant.ofString("1e3").toNumber(), is(1000d));
    assertThat(Variant.ofString("0x10").toNumber(), nullValue());
    assertThat(Variant.ofString("--1").toNumber(), nullValue());
    assertThat(Variant.ofString("NaN").toNumber(), nullValue());
    assertThat(Variant.ofString("").toNumber(), nullValue());
    assertThat(Variant.ofString("web01").toNumber(), nullValue());
    assertThat(Variant.ofTimestamp(Instant.ofEpochMilli(1500)).toNumber(),
        is(1.5d));
    assertThat(Variant.TRUE.toNumber(), nullValue());
  }

  @Test void testFormatNumber() {
    assertThat(Variant.formatNumber(3d), is("3"));
    assertThat(Variant.formatNumber(-3d), is("-3"));
    assertThat(Variant.formatNumber(2.5d), is("2.5"));
    assertThat(Variant.formatNumber(0.1d + 0.2d), is("0.30000000000000004"));
    assertThat(Variant.formatNumber(1e15), is("1000000000000000"));
    assertThat(Variant.formatNumber(1e-7), is("0.0000001"));
  }

  @Test void testToStr() {
    assertThat(Variant.ofNumber(512).toStr(), is("512"));
    assertThat(Variant.FALSE.toStr(), is("false"));
    assertThat(Variant.ofTimestamp(T).toStr(), is("2024-01-15T10:00:00Z"));
    assertThat(
        Variant.ofList(
            ImmutableList.of(Variant.ofNumber(1), Variant.ofString("a")))
            .toStr(),
        is("1,a"));
    assertThat(Variant.ofJson("{\"a\":1}").toStr(), is("{\"a\":1}"));
  }

  @Test void testToJava() {
    assertThat(Variant.ofNumber(3).toJava(), is(3L));
    assertThat(Variant.ofNumber(2.5).toJava(), is(2.5d));
    assertThat(Variant.ofString("x").toJava(), is("x"));
    assertThat(Variant.TRUE.toJava(), is(true));
    assertThat(Variant.ofTimestamp(T).toJava(), is("2024-01-15T10:00:00Z"));
    assertThat(Variant.of(Arrays.asList(1, "a", null)).toJava(),
        is(Arrays.asList(1L, "a", null)));
  }

  @Test void testEquals() {
    assertThat(Variant.ofNumber(1).equals(Variant.ofString("1")), is(false));
    assertThat(Variant.ofNumber(1).hashCode(),
        is(Variant.ofNumber(1d).hashCode()));
    assertThat(Variant.ofTimestamp(T).asInstant(), is(T));
  }
}

// End VariantTest.java
