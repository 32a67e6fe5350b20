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

import java.util.Comparator;
import java.util.List;

/**
 * Comparators for values and rows.
 *
 * <p>Values sort in this order: numbers (including strings that are
 * numbers), timestamps, booleans, strings, lists and JSON; null and undefined
 * values are last, in both ascending and descending order.
 */
public class Comparators {
  private Comparators() {}

  /** Comparator that sorts values ascending, nulls last. */
  public static final Comparator<Variant> ASCENDING =
      Comparators::compareNullsLast;

  /** Comparator that sorts values descending, nulls last. */
  public static final Comparator<Variant> DESCENDING =
      (v0, v1) -> v0.isNull() || v1.isNull()
          ? compareNullsLast(v0, v1)
          : compare(v1, v0);

  /** Returns a comparator for rows that compares the given fields in
   * turn. */
  public static Comparator<Row> rowComparator(List<String> names,
      List<Boolean> descending) {
    Comparator<Row> comparator = null;
    for (int i = 0; i < names.size(); i++) {
      final String name = names.get(i);
      final Comparator<Variant> c =
          descending.get(i) ? DESCENDING : ASCENDING;
      final Comparator<Row> c2 = (r0, r1) -> c.compare(r0.get(name),
          r1.get(name));
      comparator = comparator == null ? c2 : comparator.thenComparing(c2);
    }
    return requireNonNull(comparator, "no sort keys");
  }

  private static int compareNullsLast(Variant v0, Variant v1) {
    if (v0.isNull()) {
      return v1.isNull() ? 0 : 1;
    }
    if (v1.isNull()) {
      return -1;
    }
    return compare(v0, v1);
  }

  /** Compares two values that are not null. */
  public static int compare(Variant v0, Variant v1) {
    final int r0 = rank(v0);
    final int r1 = rank(v1);
    if (r0 != r1) {
      return Integer.compare(r0, r1);
    }
    switch (r0) {
    case 0:
      return Double.compare(requireNonNull(v0.toNumber()),
          requireNonNull(v1.toNumber()));
    case 1:
      return v0.asInstant().compareTo(v1.asInstant());
    case 2:
      return Boolean.compare(requireNonNull(v0.truth()),
          requireNonNull(v1.truth()));
    default:
      return requireNonNull(v0.toStr()).compareTo(requireNonNull(v1.toStr()));
    }
  }

  private static int rank(Variant v) {
    switch (v.kind) {
    case NUMBER:
      return 0;
    case STRING:
      return v.toNumber() != null ? 0 : 3;
    case TIMESTAMP:
      return 1;
    case BOOL:
      return 2;
    case LIST:
      return 4;
    case JSON:
      return 5;
    default:
      return 6;
    }
  }
}

// End Comparators.java
