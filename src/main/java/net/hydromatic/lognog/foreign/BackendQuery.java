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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Set;

/**
 * Query to be executed by a {@link Backend}: SQL text with {@code ?}
 * placeholders, the values to bind to them, and the names of the result
 * columns.
 */
public class BackendQuery {
  public final String sql;
  public final ImmutableList<Object> parameters;
  /** Names of the result columns, in order. */
  public final ImmutableList<String> columns;
  /** Columns whose values are timestamps, even if the store returns them as
   * strings. */
  public final ImmutableSet<String> datetimeColumns;
  /** Maximum number of rows the query returns, or -1 if unlimited. */
  public final int limit;
  /** Whether {@link #limit} was imposed by the engine, rather than asked for
   * by {@code head}; if so, a result of {@code limit} rows may have been
   * truncated. */
  public final boolean capped;

  public BackendQuery(String sql, List<Object> parameters,
      List<String> columns, Set<String> datetimeColumns, int limit,
      boolean capped) {
    this.sql = requireNonNull(sql);
    this.parameters = ImmutableList.copyOf(parameters);
    this.columns = ImmutableList.copyOf(columns);
    this.datetimeColumns = ImmutableSet.copyOf(datetimeColumns);
    this.limit = limit;
    this.capped = capped;
  }

  /** Returns whether a result with a given number of rows may be missing
   * rows. */
  public boolean isTruncated(int rowCount) {
    return capped && limit >= 0 && rowCount >= limit;
  }

  @Override
  public String toString() {
    return parameters.isEmpty() ? sql : sql + " " + parameters;
  }
}

// End BackendQuery.java
