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
package net.hydromatic.lognog;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import net.hydromatic.lognog.eval.Row;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Result of executing a query. */
public class QueryResult {
  public final ImmutableList<Row> rows;
  /** SQL sent to the backend, with {@code ?} placeholders. */
  public final String sql;
  public final ImmutableList<Object> parameters;
  public final long executionTimeMs;
  /** Whether the backend stopped at an engine-imposed row limit, so that
   * rows may be missing. */
  public final boolean truncated;

  QueryResult(List<Row> rows, String sql, List<Object> parameters,
      long executionTimeMs, boolean truncated) {
    this.rows = ImmutableList.copyOf(rows);
    this.sql = requireNonNull(sql);
    this.parameters = ImmutableList.copyOf(parameters);
    this.executionTimeMs = executionTimeMs;
    this.truncated = truncated;
  }

  /** Returns the rows as maps of display values: timestamps are ISO-8601
   * strings in UTC, integral numbers are {@link Long}. */
  public List<Map<String, @Nullable Object>> maps() {
    final ImmutableList.Builder<Map<String, @Nullable Object>> list =
        ImmutableList.builder();
    rows.forEach(row -> list.add(row.toMap()));
    return list.build();
  }

  @Override
  public String toString() {
    return "QueryResult{rows=" + rows.size() + ", sql=" + sql
        + ", executionTimeMs=" + executionTimeMs + ", truncated=" + truncated
        + "}";
  }
}

// End QueryResult.java
