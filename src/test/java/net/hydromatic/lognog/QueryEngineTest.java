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

import static net.hydromatic.lognog.Dsl.dsl;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import net.hydromatic.lognog.compile.ValidationException;
import net.hydromatic.lognog.eval.CancellationToken;
import net.hydromatic.lognog.eval.Prop;
import net.hydromatic.lognog.foreign.BackendException;
import net.hydromatic.lognog.foreign.BackendQuery;
import net.hydromatic.lognog.util.LogNogException;
import org.junit.jupiter.api.Test;

/** Tests {@link QueryEngine}, running queries over in-memory events. */
public class QueryEngineTest {
  @Test void testFreeText() {
    dsl("error | table host, message")
        .assertRows("{hostname=web01, message=POST /login 500 Error: timeout}",
            "{hostname=web02, message=GET /api/users 500 error}");
  }

  @Test void testStatsByHost() {
    dsl("level=error | stats count by host")
        .assertRows("{hostname=db01, count=1}",
            "{hostname=web01, count=1}",
            "{hostname=web02, count=1}");
  }

  @Test void testStatsEvalSort() {
    final String query = "app=nginx "
        + "| stats count, avg(bytes) as avg_bytes, max(bytes) by host "
        + "| eval avg_bytes=round(avg_bytes, 1) "
        + "| sort -count";
    dsl(query)
        .assertRows(
            "{hostname=web01, count=3, avg_bytes=533.3, max_bytes=1024}",
            "{hostname=web02, count=2, avg_bytes=64, max_bytes=128}");
  }

  /** Division by zero is undefined; it is displayed as null. */
  @Test void testDivideByZero() {
    final String query = "host=web02 "
        + "| eval ratio=bytes/(status-status), kb=bytes/1024 "
        + "| table time, ratio, kb";
    dsl(query)
        .assertRows("{timestamp=2024-01-15T11:30:00Z, ratio=undefined, kb=0}",
            "{timestamp=2024-01-15T10:05:00Z, ratio=undefined, kb=0.125}")
        .assertResult(result -> {
          final Map<String, Object> map = result.maps().get(1);
          assertThat(map.get("ratio"), nullValue());
          assertThat(map.get("kb"), is(0.125d));
          assertThat(map.get("timestamp"), is("2024-01-15T10:05:00Z"));
        });
  }

  @Test void testRex() {
    final String query = "app=postgres "
        + "| rex field=message \"user=(?<user_name>[a-z]+)\" "
        + "| table host, user_name";
    dsl(query)
        .assertRows("{hostname=db01, user_name=admin}",
            "{hostname=db01, user_name=null}");
  }

  @Test void testDedup() {
    dsl("* | dedup host | table host, app")
        .assertRows("{hostname=web01, app_name=sshd}",
            "{hostname=db01, app_name=postgres}",
            "{hostname=web02, app_name=nginx}");
  }

  @Test void testSortDescending() {
    final String[] rows = {
        "{bytes=1024}", "{bytes=512}", "{bytes=128}", "{bytes=64}",
        "{bytes=0}"
    };
    dsl("app=nginx | sort -bytes | table bytes").assertRows(rows);
    dsl("app=nginx | sort desc bytes | table bytes").assertRows(rows);
    dsl("app=nginx | sort bytes desc | table bytes").assertRows(rows);
  }

  /** Nulls sort last, even in ascending order. */
  @Test void testSortNullsLast() {
    dsl("* | sort bytes | table host, bytes | head 6")
        .assertResult(result -> {
          assertThat(result.rows.size(), is(6));
          assertThat(result.rows.get(0).toString(),
              is("{hostname=web02, bytes=0}"));
          assertThat(result.rows.get(5).toString(),
              is("{hostname=web01, bytes=null}"));
        });
  }

  @Test void testTop() {
    dsl("* | top 2 host")
        .assertRows("{hostname=web01, count=4, percent=50}",
            "{hostname=db01, count=2, percent=25}");
  }

  @Test void testRare() {
    dsl("* | rare host limit=3")
        .assertRows("{hostname=db01, count=2, percent=25}",
            "{hostname=web02, count=2, percent=25}",
            "{hostname=web01, count=4, percent=50}");
  }

  @Test void testTimechart() {
    dsl("app=nginx | timechart span=1h count by host")
        .assertRows(
            "{time_bucket=2024-01-15T10:00:00Z, hostname=web01, count=2}",
            "{time_bucket=2024-01-15T10:00:00Z, hostname=web02, count=1}",
            "{time_bucket=2024-01-15T11:00:00Z, hostname=web01, count=1}",
            "{time_bucket=2024-01-15T11:00:00Z, hostname=web02, count=1}");
  }

  @Test void testBin() {
    dsl("* | bin span=1h time | stats count by time")
        .assertRows("{timestamp=2024-01-15T12:00:00Z, count=1}",
            "{timestamp=2024-01-15T11:00:00Z, count=3}",
            "{timestamp=2024-01-15T10:00:00Z, count=4}");
  }

  @Test void testRename() {
    dsl("level<=3 | stats count by host | rename host as server, count as n")
        .assertRows("{server=db01, n=1}",
            "{server=web01, n=1}",
            "{server=web02, n=1}");
  }

  @Test void testSeverityName() {
    dsl("host=db01 | table host, level")
        .withProp(Prop.SEVERITY_FORMAT, "name")
        .assertRows("{hostname=db01, severity=Error}",
            "{hostname=db01, severity=Warning}");
  }

  @Test void testHeadTail() {
    dsl("* | head 3 | tail 1 | table host")
        .assertRows("{hostname=web02}");
    dsl("* | tail 3 | head 1 | table host")
        .assertRows("{hostname=web01}");
  }

  @Test void testWhereOnEval() {
    dsl("* | eval kb=bytes/1024 | where kb > 0.1 | table host, kb")
        .assertRows("{hostname=web01, kb=1}",
            "{hostname=web02, kb=0.125}",
            "{hostname=web01, kb=0.5}");
  }

  @Test void testQuotedWildcard() {
    dsl("\"get /index*\" | table host")
        .assertRows("{hostname=web02}", "{hostname=web01}");
  }

  @Test void testBooleanSearch() {
    dsl("host=web01 (status=500 OR app=sshd) | table host, app, status")
        .assertRows("{hostname=web01, app_name=sshd, status=null}",
            "{hostname=web01, app_name=nginx, status=500}");
    dsl("NOT host=web* | dedup host | table host")
        .assertRows("{hostname=db01}");
  }

  @Test void testPresent() {
    dsl("source_ip=* | stats count").assertRows("{count=6}");
  }

  /** Stats with no group keys returns one row even if there are no
   * events. */
  @Test void testStatsNoRows() {
    dsl("host=nothing | stats count").assertRows("{count=0}");
  }

  @Test void testClassifyIp() {
    final String query = "source_ip=* "
        + "| eval class=classify_ip(source_ip) "
        + "| stats count by class";
    dsl(query)
        .assertRows("{class=private, count=4}",
            "{class=public, count=1}",
            "{class=reserved, count=1}");
  }

  @Test void testMaxRows() {
    dsl("* | stats count")
        .withProp(Prop.MAX_ROWS, 3)
        .assertRows("{count=3}")
        .assertResult(result -> assertThat(result.truncated, is(true)));
  }

  @Test void testNotTruncated() {
    dsl("* | stats count")
        .assertResult(result -> {
          assertThat(result.truncated, is(false));
          assertThat(result.sql, notNullValue());
          assertThat(result.executionTimeMs >= 0, is(true));
        });
  }

  /** The backend sees a scan of the columns that the query uses. */
  @Test void testBackendQuery() {
    final InMemoryBackend backend = new InMemoryBackend(LogEvents.EVENTS);
    dsl("").withProp(Prop.PUSH_DOWN, false).engine(backend)
        .execute("* | stats sum(bytes) by host");
    final BackendQuery query = backend.lastQuery;
    assertThat(query, notNullValue());
    assertThat(query.columns.toString(),
        is("[timestamp, hostname, app_name, severity, message, bytes]"));
    assertThat(query.limit, is(10_000));
    assertThat(query.capped, is(true));
  }

  @Test void testRepeatable() {
    final String query = "* | stats count, dc(app) by host";
    final QueryResult result1 = dsl(query).execute();
    final QueryResult result2 = dsl(query).execute();
    assertThat(result1.rows, is(result2.rows));
  }

  @Test void testCancel() {
    final CancellationToken token = CancellationToken.create();
    token.cancel();
    final BackendException e =
        assertThrows(BackendException.class, () ->
            dsl("* | stats count")
                .withOptions(o -> o.withCancellationToken(token))
                .execute());
    assertThat(e.reason, is(BackendException.Reason.CANCELLED));
    assertThat(e.kind(), is(LogNogException.Kind.BACKEND));
  }

  @Test void testTimeout() {
    final BackendException e =
        assertThrows(BackendException.class, () ->
            dsl("* | stats count")
                .withOptions(o ->
                    o.withCancellationToken(
                        CancellationToken.withTimeout(Duration.ZERO)))
                .execute());
    assertThat(e.reason, is(BackendException.Reason.TIMEOUT));
  }

  @Test void testValidate() {
    final QueryEngine engine =
        dsl("").engine(new InMemoryBackend(LogEvents.EVENTS));
    assertThat(engine.validate("foo | bar"),
        is(Optional.of("1.7-1.10 Error: Unknown command 'bar'")));
    assertThat(engine.validate("host=web01 | stats count by app"),
        is(Optional.empty()));
  }

  @Test void testInvalidTimeRange() {
    final ValidationException e =
        assertThrows(ValidationException.class, () ->
            dsl("* | stats count")
                .withOptions(o -> o.withEarliest("yesterday"))
                .compile());
    assertThat(e.getMessage(), is("Invalid time 'yesterday'"));
  }

  @Test void testEngineProperties() {
    final QueryEngine engine =
        QueryEngine.of(new InMemoryBackend(LogEvents.EVENTS),
            ImmutableMap.of(Prop.PUSH_DOWN, false));
    final QueryResult result = engine.execute("host=web01 | stats count");
    assertThat(result.rows.get(0).toString(), is("{count=4}"));
  }
}

// End QueryEngineTest.java
