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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.lognog.compile.Dialect;
import net.hydromatic.lognog.eval.Prop;
import net.hydromatic.lognog.foreign.Backend;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/**
 * Kick the tires.
 */
public class MainTest {
  private static final String EXPLAIN = "sql: SELECT count() AS `count` "
      + "FROM `lognog`.`logs` AS t0 WHERE (t0.`hostname` = 'web01')\n"
      + "pushed: 2 stage(s)\n"
      + "  search hostname = \"web01\"\n"
      + "  stats count as count\n"
      + "residual: 0 stage(s)\n";

  /** Runs {@link Main} and returns its output. */
  private static String run(List<String> args, String in,
      Map<Prop, Object> propMap, @Nullable Backend backend, int failures) {
    final StringWriter out = new StringWriter();
    final Main main =
        new Main(args, new StringReader(in), out, propMap, backend);
    assertThat(main.run(), is(failures));
    return out.toString();
  }

  @Test void testEmpty() {
    final String out =
        run(ImmutableList.of(), "", new LinkedHashMap<>(), null, 0);
    assertThat(out, is(""));
  }

  /** Without a backend, prints the plan. */
  @Test void testExplain() {
    final String out =
        run(ImmutableList.of("host=web01", "|", "stats", "count"), "",
            new LinkedHashMap<>(), null, 0);
    assertThat(out, is(EXPLAIN));
  }

  /** Properties come from "lognog.properties" and the command line. */
  @Test void testProperties() {
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    run(ImmutableList.of("--maxRows=50", "--DIALECT=sqlite", "*"), "",
        propMap, null, 0);
    assertThat(Prop.MAX_ROWS.intValue(propMap), is(50));
    assertThat(Prop.DIALECT.enumValue(propMap, Dialect.class),
        is(Dialect.SQLITE));
    assertThat(Prop.TABLE_NAME.stringValue(propMap), is("lognog.logs"));
    assertThat(Prop.PUSH_DOWN.booleanValue(propMap), is(true));
  }

  @Test void testBadProperty() {
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () ->
            new Main(ImmutableList.of("--maxRows=lots", "*"),
                new StringReader(""), new StringWriter(),
                new LinkedHashMap<>(), null));
    assertThat(e.getMessage(),
        is("value of property maxRows must be an integer: lots"));
  }

  /** Reads queries from the input, one per line, skipping blank lines;
   * reports errors and carries on. */
  @Test void testInput() {
    final String in = "host=web01 | stats count\n"
        + "\n"
        + "foo | bar\n";
    final String out =
        run(ImmutableList.of(), in, new LinkedHashMap<>(), null, 1);
    assertThat(out,
        is(EXPLAIN + "1.7-1.10 Error: Unknown command 'bar'\n"));
  }

  /** With a backend, prints rows. */
  @Test void testRows() {
    final String out =
        run(ImmutableList.of("--pushDown=false", "host=web01", "|", "stats",
                "count", "by", "app"), "",
            new LinkedHashMap<>(), new InMemoryBackend(LogEvents.EVENTS), 0);
    assertThat(out,
        startsWith("{app_name=sshd, count=1}\n"
            + "{app_name=nginx, count=3}\n"
            + "(2 rows, "));
  }

  @Test void testExplainWithBackend() {
    final String out =
        run(ImmutableList.of("--explain", "host=web01 | stats count"), "",
            new LinkedHashMap<>(), new InMemoryBackend(LogEvents.EVENTS), 0);
    assertThat(out, is(EXPLAIN));
  }
}

// End MainTest.java
