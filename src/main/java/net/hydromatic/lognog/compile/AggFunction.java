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
package net.hydromatic.lognog.compile;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Aggregate functions allowed in {@code stats} and {@code timechart}.
 *
 * <p>Null and undefined values never participate. Numeric aggregates
 * convert strings that look like numbers, and ignore other values.
 */
public enum AggFunction {
  /** Number of rows; with a field, number of rows where it is not null. */
  COUNT("count", false, null, "c"),
  /** Number of distinct values. */
  DC("dc", true, null, "distinct_count"),
  SUM("sum", true, null),
  AVG("avg", true, null, "mean"),
  MIN("min", true, null),
  MAX("max", true, null),
  P50("p50", true, 0.5d),
  P90("p90", true, 0.9d),
  P95("p95", true, 0.95d),
  P99("p99", true, 0.99d),
  MEDIAN("median", true, 0.5d),
  /** Most frequent value; ties go to the value seen first. */
  MODE("mode", true, null),
  /** Population standard deviation. */
  STDDEV("stddev", true, null, "stdev"),
  /** Population variance. */
  VARIANCE("variance", true, null, "var"),
  /** Maximum minus minimum. */
  RANGE("range", true, null),
  /** Value at the earliest timestamp. */
  EARLIEST("earliest", true, null),
  /** Value at the latest timestamp. */
  LATEST("latest", true, null),
  /** First value in input order. */
  FIRST("first", true, null),
  /** Last value in input order. */
  LAST("last", true, null),
  /** Distinct values, sorted. */
  VALUES("values", true, null),
  /** All values, in input order. */
  LIST("list", true, null);

  /** Name in the query language. */
  public final String name;
  /** Whether the function must be applied to a field. */
  public final boolean fieldRequired;
  /** For a percentile function, the fraction; otherwise null. */
  public final @Nullable Double percentile;
  private final String[] synonyms;

  private static final ImmutableMap<String, AggFunction> BY_NAME;

  static {
    final Map<String, AggFunction> map = new LinkedHashMap<>();
    for (AggFunction f : values()) {
      map.put(f.name, f);
      for (String synonym : f.synonyms) {
        map.put(synonym, f);
      }
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  AggFunction(
      String name,
      boolean fieldRequired,
      @Nullable Double percentile,
      String... synonyms) {
    this.name = name;
    this.fieldRequired = fieldRequired;
    this.percentile = percentile;
    this.synonyms = synonyms;
  }

  /** Looks up a function by name or synonym, ignoring case; returns null if
   * not found. */
  public static @Nullable AggFunction lookup(String name) {
    return BY_NAME.get(name.toLowerCase(Locale.ROOT));
  }

  /** Returns whether the result is always a number, whatever the type of the
   * input. */
  public boolean isNumeric() {
    switch (this) {
    case MIN:
    case MAX:
    case MODE:
    case EARLIEST:
    case LATEST:
    case FIRST:
    case LAST:
    case VALUES:
    case LIST:
      return false;
    default:
      return true;
    }
  }

  /** Returns the name of the output column if the user does not give an
   * alias; for example "count" or "avg_bytes". */
  public String defaultAlias(@Nullable String field) {
    return field == null ? name : name + "_" + field;
  }
}

// End AggFunction.java
