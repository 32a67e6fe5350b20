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

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import javax.sql.DataSource;
import net.hydromatic.lognog.QueryEngine;
import net.hydromatic.lognog.QueryOptions;
import net.hydromatic.lognog.QueryResult;
import net.hydromatic.lognog.compile.Dialect;
import net.hydromatic.lognog.compile.FieldSchema;
import net.hydromatic.lognog.eval.CancellationToken;
import net.hydromatic.lognog.eval.Prop;
import net.hydromatic.lognog.eval.Row;
import net.hydromatic.lognog.eval.Session;
import org.apache.calcite.adapter.jdbc.JdbcSchema;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

/** Tests {@link JdbcBackend} against an in-memory HSQLDB database. */
public class JdbcBackendTest {
  private static final String URL = "jdbc:hsqldb:mem:lognogtest";
  private static final String USER = "SA";
  private static final String PASSWORD = "";

  private static final FieldSchema SCHEMA =
      FieldSchema.DEFAULT.toBuilder()
          .add("bytes", FieldSchema.FieldType.NUMBER)
          .build();

  private static final Map<Prop, Object> PROPS =
      ImmutableMap.of(Prop.DIALECT, Dialect.ANSI, Prop.TABLE_NAME, "logs");

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-01-15T12:00:00Z"), ZoneOffset.UTC);

  private static DataSource dataSource;

  @BeforeAll static void populate() throws SQLException {
    dataSource = JdbcSchema.dataSource(URL, null, USER, PASSWORD);
    try (Connection connection = dataSource.getConnection()) {
      try (Statement statement = connection.createStatement()) {
        statement.execute("DROP TABLE \"logs\" IF EXISTS");
        statement.execute("CREATE TABLE \"logs\" ("
            + "\"timestamp\" TIMESTAMP NOT NULL, "
            + "\"hostname\" VARCHAR(64), "
            + "\"app_name\" VARCHAR(64), "
            + "\"severity\" INTEGER, "
            + "\"message\" VARCHAR(256), "
            + "\"bytes\" INTEGER)");
      }
      try (PreparedStatement statement =
               connection.prepareStatement(
                   "INSERT INTO \"logs\" VALUES (?, ?, ?, ?, ?, ?)")) {
        insert(statement, "10:00", "web01", "nginx", 6,
            "GET /index.html 200", 512);
        insert(statement, "10:05", "web02", "nginx", 3,
            "GET /api/users 500 error", 128);
        insert(statement, "10:20", "web01", "nginx", 6,
            "GET /about.html 200", 1024);
        insert(statement, "10:45", "db01", "postgres", 4,
            "slow query took 1500ms", null);
      }
    }
  }

  private static void insert(PreparedStatement statement, String time,
      String hostname, String appName, int severity, String message,
      Integer bytes) throws SQLException {
    final Instant instant = Instant.parse("2024-01-15T" + time + ":00Z");
    statement.setTimestamp(1, Timestamp.from(instant),
        Converters.utcCalendar());
    statement.setString(2, hostname);
    statement.setString(3, appName);
    statement.setInt(4, severity);
    statement.setString(5, message);
    if (bytes == null) {
      statement.setNull(6, Types.INTEGER);
    } else {
      statement.setInt(6, bytes);
    }
    statement.executeUpdate();
  }

  private static QueryEngine engine(Map<Prop, Object> props) {
    return new QueryEngine(new JdbcBackend(dataSource), SCHEMA, props, CLOCK);
  }

  private static QueryResult execute(String query) {
    return engine(PROPS).execute(query, QueryOptions.DEFAULT);
  }

  /** Executes a query entirely in the row pipeline, after a backend query
   * that only selects events. */
  private static QueryResult executeLocally(String query) {
    final Map<Prop, Object> props =
        ImmutableMap.<Prop, Object>builder().putAll(PROPS)
            .put(Prop.PUSH_DOWN, false)
            .build();
    return engine(props).execute(query, QueryOptions.DEFAULT);
  }

  @Test void testCount() {
    final QueryResult result = execute("host=web01 | stats count");
    assertThat(result.rows.toString(), is("[{count=2}]"));
    assertThat(result.parameters.toString(), is("[web01]"));
    assertThat(result.truncated, is(false));
  }

  /** Stats run in the database, and come back ordered by group key. */
  @Test void testStats() {
    final QueryResult result =
        execute("app=nginx | stats count, avg(bytes) by host");
    assertThat(result.rows.toString(),
        is("[{hostname=web01, count=2, avg_bytes=768}, "
            + "{hostname=web02, count=1, avg_bytes=128}]"));
    assertThat(result.maps().get(0).get("count"), is(2L));
  }

  /** Timestamps are read in UTC, newest first. */
  @Test void testEvents() {
    final QueryResult result = execute("host=web01 | head 5");
    assertThat(result.rows.size(), is(2));
    final Row row = result.rows.get(0);
    assertThat(row.get("timestamp").asInstant(),
        is(Instant.parse("2024-01-15T10:20:00Z")));
    assertThat(row.get("message").toString(), is("GET /about.html 200"));
    assertThat(row.toMap().get("timestamp"), is("2024-01-15T10:20:00Z"));
  }

  /** A stage that the dialect cannot translate runs after the backend
   * query. */
  @Test void testResidual() {
    final QueryResult result = execute("* | top 2 app");
    assertThat(result.rows.toString(),
        is("[{app_name=nginx, count=3, percent=75}, "
            + "{app_name=postgres, count=1, percent=25}]"));
  }

  @Test void testTimeRange() {
    final QueryResult result =
        engine(PROPS).execute("* | stats count",
            QueryOptions.DEFAULT.withEarliest("2024-01-15T10:05:00Z")
                .withLatest("2024-01-15T10:30:00Z"));
    assertThat(result.rows.toString(), is("[{count=2}]"));
  }

  @Test void testError() {
    final Map<Prop, Object> props =
        ImmutableMap.of(Prop.DIALECT, Dialect.ANSI,
            Prop.TABLE_NAME, "no_such_table");
    final BackendException e =
        assertThrows(BackendException.class,
            () -> engine(props).execute("* | stats count"));
    assertThat(e.reason, is(BackendException.Reason.ERROR));
    assertThat(e.describeTo(new StringBuilder()).toString(),
        startsWith("Backend error (ERROR): Query failed: "));
  }

  @Test void testCancelled() {
    final CancellationToken token = CancellationToken.create();
    token.cancel();
    final BackendException e =
        assertThrows(BackendException.class,
            () -> engine(PROPS).execute("* | stats count",
                QueryOptions.DEFAULT.withCancellationToken(token)));
    assertThat(e.reason, is(BackendException.Reason.CANCELLED));
  }

  /** Executes SQL directly; a string column named as a datetime column is
   * parsed as a timestamp. */
  @Test void testExecute() {
    final BackendQuery query =
        new BackendQuery("SELECT \"hostname\", "
            + "CAST('2024-01-15 10:00:00' AS VARCHAR(20)) AS \"t\" "
            + "FROM \"logs\" WHERE \"bytes\" > ? ORDER BY \"hostname\"",
            ImmutableList.of(500), ImmutableList.of("hostname", "t"),
            ImmutableSet.of("t"), -1, false);
    final Session session =
        new Session(PROPS, CancellationToken.create(), null);
    final List<Row> rows = new JdbcBackend(dataSource).execute(query, session);
    assertThat(rows.toString(),
        is("[{hostname=web01, t=2024-01-15T10:00:00Z}, "
            + "{hostname=web01, t=2024-01-15T10:00:00Z}]"));
  }

  /** String values of a conditional have a type, so that the database
   * accepts them in the select list. */
  @Test void testEvalConditional() {
    final String query =
        "* | eval x=if(bytes>500, \"big\", \"small\") | table x";
    final QueryResult result = execute(query);
    assertThat(result.sql, containsString("CAST(? AS VARCHAR(3))"));
    assertThat(result.sql, containsString("CAST(? AS VARCHAR(5))"));
    assertThat(result.rows.toString(),
        is("[{x=small}, {x=big}, {x=small}, {x=big}]"));
    assertThat(result.rows, is(executeLocally(query).rows));

    final String query2 = "* | eval x=case(bytes>500, \"big\", "
        + "bytes>0, \"small\", \"none\") | table x";
    final QueryResult result2 = execute(query2);
    assertThat(result2.sql, containsString("CASE WHEN"));
    assertThat(result2.sql, containsString("CAST(? AS VARCHAR(4))"));
    assertThat(result2.rows.toString(),
        is("[{x=none}, {x=big}, {x=small}, {x=big}]"));
    assertThat(result2.rows, is(executeLocally(query2).rows));
  }

  /** Division by a non-zero literal runs in the database, and gives the
   * same values as the row pipeline. */
  @Test void testEvalDivide() {
    final String query = "* | eval kb=bytes/1024 | table hostname, kb";
    final QueryResult result = execute(query);
    assertThat(result.sql, containsString("NULLIF(1024, 0)"));
    assertThat(result.rows.toString(),
        is("[{hostname=db01, kb=null}, {hostname=web01, kb=1}, "
            + "{hostname=web02, kb=0.125}, {hostname=web01, kb=0.5}]"));
    assertThat(result.rows, is(executeLocally(query).rows));
  }

  /** In the row pipeline, division by zero, and a numeric function of
   * null, are undefined, not null; such expressions run there. */
  @Test void testEvalUndefined() {
    for (String query
        : ImmutableList.of("* | eval z=bytes/0 | table hostname, z",
            "* | eval z=bytes%severity | table hostname, z",
            "* | eval z=abs(0-bytes) | table hostname, z",
            "* | eval z=floor(bytes/1000) | table hostname, z",
            "* | eval z=lower(hostname) | table hostname, z")) {
      final QueryResult result = execute(query);
      assertThat(query, result.sql, not(containsString("AS \"z\"")));
      assertThat(query, result.rows, is(executeLocally(query).rows));
    }
  }

  /** Creates a backend from a URL, as the command line does. */
  @Test void testOf() {
    final QueryEngine engine =
        new QueryEngine(JdbcBackend.of(URL, null, USER, PASSWORD), SCHEMA,
            PROPS, CLOCK);
    assertThat(engine.execute("app=postgres | stats count").rows.toString(),
        is("[{count=1}]"));
  }
}

// End JdbcBackendTest.java
