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

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Timestamp;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import javax.sql.DataSource;
import net.hydromatic.lognog.eval.CancellationToken;
import net.hydromatic.lognog.eval.Row;
import net.hydromatic.lognog.eval.Session;
import org.apache.calcite.adapter.jdbc.JdbcSchema;
import org.apache.calcite.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backend that executes queries over JDBC.
 *
 * <p>Each query borrows a connection from the data source and returns it
 * when done. While the statement runs, a hook registered with the
 * session's {@link CancellationToken} cancels it.
 */
public class JdbcBackend implements Backend {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(JdbcBackend.class);

  /** How often, in rows, to check for cancellation while reading. */
  private static final int CHECK_INTERVAL = 1024;

  private final DataSource dataSource;

  public JdbcBackend(DataSource dataSource) {
    this.dataSource = requireNonNull(dataSource);
  }

  /** Creates a backend for a JDBC URL, with a pooled data source. */
  public static JdbcBackend of(String url, @Nullable String driverClassName,
      @Nullable String user, @Nullable String password) {
    return new JdbcBackend(
        JdbcSchema.dataSource(url, driverClassName, user, password));
  }

  @Override
  public List<Row> execute(BackendQuery query, Session session) {
    final CancellationToken token = session.cancellationToken;
    token.check();
    LOGGER.debug("Executing {} with parameters {}", query.sql,
        query.parameters);
    final long start = System.nanoTime();
    try (Connection connection = dataSource.getConnection();
         PreparedStatement statement = connection.prepareStatement(query.sql)) {
      final Runnable hook = () -> cancel(statement);
      token.onCancel(hook);
      try {
        final Duration timeout = session.statementTimeout();
        if (timeout != null) {
          // JDBC timeouts are whole seconds; round up so that 0 does not
          // mean "no timeout"
          statement.setQueryTimeout(
              (int) Math.max(1L, (timeout.toMillis() + 999L) / 1000L));
        }
        bind(statement, query.parameters);
        final List<Row> rows = read(statement, query, token);
        LOGGER.debug("Fetched {} rows in {} ms", rows.size(),
            (System.nanoTime() - start) / 1_000_000L);
        return rows;
      } finally {
        token.removeHook(hook);
      }
    } catch (SQLException e) {
      throw toBackendException(e, token);
    }
  }

  private static void bind(PreparedStatement statement, List<Object> params)
      throws SQLException {
    for (int i = 0; i < params.size(); i++) {
      final Object param = params.get(i);
      if (param instanceof Timestamp) {
        statement.setTimestamp(i + 1, (Timestamp) param,
            Converters.utcCalendar());
      } else {
        statement.setObject(i + 1, param);
      }
    }
  }

  private static List<Row> read(PreparedStatement statement,
      BackendQuery query, CancellationToken token) throws SQLException {
    final List<Row> rows = new ArrayList<>();
    try (ResultSet resultSet = statement.executeQuery()) {
      final List<Pair<String, Converter>> converters =
          Converters.ofResultSet(resultSet.getMetaData(),
              query.datetimeColumns);
      while (resultSet.next()) {
        final Row.Builder b = Row.builder();
        for (Pair<String, Converter> pair : converters) {
          b.set(pair.left, pair.right.convert(resultSet));
        }
        rows.add(b.build());
        if (rows.size() % CHECK_INTERVAL == 0) {
          token.check();
        }
      }
    }
    token.check();
    return rows;
  }

  private static void cancel(PreparedStatement statement) {
    try {
      statement.cancel();
    } catch (SQLException e) {
      // The statement will still be closed when the query returns
      LOGGER.warn("Failed to cancel statement", e);
    }
  }

  /** Converts a JDBC error to a backend error; the reason depends on whether
   * the query was cancelled or timed out. */
  private static BackendException toBackendException(SQLException e,
      CancellationToken token) {
    if (token.isCancelled()) {
      return new BackendException(BackendException.Reason.CANCELLED,
          "Query cancelled", e);
    }
    if (token.isExpired() || e instanceof SQLTimeoutException) {
      return new BackendException(BackendException.Reason.TIMEOUT,
          "Query timed out", e);
    }
    LOGGER.warn("Query failed: {}", e.getMessage());
    return new BackendException(BackendException.Reason.ERROR,
        "Query failed", e);
  }
}

// End JdbcBackend.java
