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
package net.hydromatic.lognog.foreign;

import com.google.common.collect.ImmutableList;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TimeZone;
import net.hydromatic.lognog.eval.Aggregates;
import net.hydromatic.lognog.eval.Variant;
import org.apache.calcite.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Converter}. */
public class Converters {
  private Converters() {
  }

  /** Returns a calendar in UTC. Timestamps are read and written in UTC,
   * whatever the time zone of the JVM. Calendars are mutable, so each call
   * returns a new instance. */
  static Calendar utcCalendar() {
    return Calendar.getInstance(TimeZone.getTimeZone("UTC"), Locale.ROOT);
  }

  /** Creates a converter for each column of a result set; returns a list of
   * (column name, converter) pairs. */
  public static List<Pair<String, Converter>> ofResultSet(
      ResultSetMetaData metaData, Set<String> datetimeColumns)
      throws SQLException {
    final ImmutableList.Builder<Pair<String, Converter>> list =
        ImmutableList.builder();
    for (int i = 1; i <= metaData.getColumnCount(); i++) {
      final String name = metaData.getColumnLabel(i);
      list.add(
          Pair.of(name,
              ofColumn(i, metaData.getColumnType(i),
                  datetimeColumns.contains(name))));
    }
    return list.build();
  }

  /** Creates a converter for a column.
   *
   * @param ordinal Column ordinal, 1-based
   * @param sqlType Type code from {@link Types}
   * @param datetime Whether to parse string values as timestamps
   */
  public static Converter ofColumn(int ordinal, int sqlType,
      boolean datetime) {
    switch (sqlType) {
    case Types.TIMESTAMP:
    case Types.TIMESTAMP_WITH_TIMEZONE:
    case Types.DATE:
      return resultSet -> {
        final Timestamp timestamp =
            resultSet.getTimestamp(ordinal, utcCalendar());
        return timestamp == null ? Variant.NULL
            : Variant.ofTimestamp(timestamp.toInstant());
      };

    case Types.ARRAY:
      return resultSet -> {
        final Array array = resultSet.getArray(ordinal);
        if (array == null) {
          return Variant.NULL;
        }
        final List<Variant> list = new ArrayList<>();
        for (Object o : (Object[]) array.getArray()) {
          list.add(toVariant(o, false));
        }
        return Variant.ofList(list);
      };

    default:
      return resultSet -> toVariant(resultSet.getObject(ordinal), datetime);
    }
  }

  /** Converts a value returned by a JDBC driver. */
  static Variant toVariant(@Nullable Object o, boolean datetime) {
    if (o instanceof Timestamp) {
      return Variant.ofTimestamp(((Timestamp) o).toInstant());
    }
    if (o instanceof LocalDateTime) {
      return Variant.ofTimestamp(
          ((LocalDateTime) o).toInstant(ZoneOffset.UTC));
    }
    if (o instanceof OffsetDateTime) {
      return Variant.ofTimestamp(((OffsetDateTime) o).toInstant());
    }
    if (o instanceof ZonedDateTime) {
      return Variant.ofTimestamp(((ZonedDateTime) o).toInstant());
    }
    if (o instanceof Object[]) {
      final List<Variant> list = new ArrayList<>();
      for (Object e : (Object[]) o) {
        list.add(toVariant(e, false));
      }
      return Variant.ofList(list);
    }
    final Variant v = Variant.of(o);
    if (datetime && v.kind == Variant.Kind.STRING) {
      // SQLite stores timestamps as text
      final Instant instant = Aggregates.toInstant(v);
      return instant == null ? v : Variant.ofTimestamp(instant);
    }
    return v;
  }
}

// End Converters.java
