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
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import net.hydromatic.lognog.compile.Dialect;
import org.junit.jupiter.api.Test;

/** Tests {@link Prop}. */
public class PropTest {
  @Test void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.DIALECT.enumValue(map, Dialect.class),
        is(Dialect.CLICKHOUSE));
    assertThat(Prop.TABLE_NAME.stringValue(map), is("lognog.logs"));
    assertThat(Prop.DEFAULT_LIMIT.intValue(map), is(1000));
    assertThat(Prop.MAX_ROWS.intValue(map), is(10_000));
    assertThat(Prop.PUSH_DOWN.booleanValue(map), is(true));
    assertThat(Prop.QUERY_TIMEOUT_MILLIS.intValue(map), is(30_000));
    assertThat(Prop.SEVERITY_FORMAT.enumValue(map, Prop.SeverityFormat.class),
        is(Prop.SeverityFormat.NUMBER));
    assertThat(Prop.MAX_ROWS.get(map), is(10_000));
  }

  @Test void testLookup() {
    assertThat(Prop.lookup("maxRows"), is(Prop.MAX_ROWS));
    assertThat(Prop.lookup("MAX_ROWS"), is(Prop.MAX_ROWS));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.lookup("maxrows"));
    assertThat(e.getMessage(), is("property maxrows not found"));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.DEFAULT_LIMIT));
    assertThat(Prop.BY_CAMEL_NAME.get(Prop.BY_CAMEL_NAME.size() - 1),
        is(Prop.TABLE_NAME));
  }

  @Test void testSetLenient() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.DIALECT.setLenient(map, "sqlite");
    Prop.MAX_ROWS.setLenient(map, "50");
    Prop.PUSH_DOWN.setLenient(map, "FALSE");
    Prop.SEVERITY_FORMAT.setLenient(map, "Name");
    Prop.TABLE_NAME.setLenient(map, "logs");
    assertThat(Prop.DIALECT.enumValue(map, Dialect.class),
        is(Dialect.SQLITE));
    assertThat(Prop.MAX_ROWS.intValue(map), is(50));
    assertThat(Prop.PUSH_DOWN.booleanValue(map), is(false));
    assertThat(Prop.SEVERITY_FORMAT.enumValue(map, Prop.SeverityFormat.class),
        is(Prop.SeverityFormat.NAME));
    assertThat(Prop.TABLE_NAME.stringValue(map), is("logs"));

    assertThat(Prop.MAX_ROWS.remove(map), is(50));
    assertThat(Prop.MAX_ROWS.intValue(map), is(10_000));
  }

  @Test void testInvalid() {
    final Map<Prop, Object> map = new HashMap<>();
    assertInvalid(() -> Prop.DIALECT.setLenient(map, "oracle"),
        "value of property dialect must be one of: "
            + "'CLICKHOUSE', 'SQLITE', 'ANSI'");
    assertInvalid(() -> Prop.MAX_ROWS.setLenient(map, "lots"),
        "value of property maxRows must be an integer: lots");
    assertInvalid(() -> Prop.PUSH_DOWN.setLenient(map, "yes"),
        "value of property pushDown must be true or false: yes");
    assertInvalid(() -> Prop.DIALECT.set(map, null),
        "property dialect is required");
    assertInvalid(() -> Prop.MAX_ROWS.set(map, "50"),
        "value for property maxRows must have type Integer");
    assertInvalid(() -> Prop.PUSH_DOWN.intValue(map),
        "invalid type class java.lang.Boolean for property pushDown");
    assertThat(map.isEmpty(), is(true));
  }

  private static void assertInvalid(Runnable runnable, String message) {
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, runnable::run);
    assertThat(e.getMessage(), is(message));
  }

  /** Keys without the prefix are ignored; values are trimmed. */
  @Test void testLoad() {
    final Properties properties = new Properties();
    properties.setProperty("lognog.maxRows", "50");
    properties.setProperty("lognog.DIALECT", " ansi ");
    properties.setProperty("other.maxRows", "60");
    final Map<Prop, Object> map = new HashMap<>();
    Prop.load(map, properties);
    assertThat(map.size(), is(2));
    assertThat(Prop.MAX_ROWS.intValue(map), is(50));
    assertThat(Prop.DIALECT.enumValue(map, Dialect.class), is(Dialect.ANSI));

    properties.setProperty("lognog.bogus", "1");
    assertInvalid(() -> Prop.load(map, properties),
        "property bogus not found");
    assertThat(map.get(Prop.TABLE_NAME), nullValue());
  }
}

// End PropTest.java
