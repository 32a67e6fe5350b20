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

import com.google.common.collect.ImmutableList;
import java.time.Instant;
import net.hydromatic.lognog.compile.FieldSchema;
import net.hydromatic.lognog.eval.Row;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Log events used by tests. */
abstract class LogEvents {
  private LogEvents() {}

  /** Schema of the test table: the standard columns plus "bytes" and
   * "status". */
  static final FieldSchema SCHEMA =
      FieldSchema.DEFAULT.toBuilder()
          .add("bytes", FieldSchema.FieldType.NUMBER)
          .add("status", FieldSchema.FieldType.NUMBER)
          .build();

  /** Eight events between 10:00 and 12:00 on 2024-01-15, oldest first. */
  static final ImmutableList<Row> EVENTS =
      ImmutableList.of(
          event("10:00", "web01", "nginx", 6, "GET /index.html 200", 512,
              200, "192.168.1.10"),
          event("10:05", "web02", "nginx", 3, "GET /api/users 500 error", 128,
              500, "203.0.113.7"),
          event("10:20", "web01", "nginx", 6, "GET /about.html 200", 1024,
              200, "192.168.1.11"),
          event("10:45", "db01", "postgres", 4, "slow query took 1500ms",
              null, null, null),
          event("11:10", "web01", "nginx", 3, "POST /login 500 Error: timeout",
              64, 500, "8.8.8.8"),
          event("11:30", "web02", "nginx", 6, "GET /index.html 304", 0, 304,
              "192.168.1.10"),
          event("11:50", "db01", "postgres", 3,
              "connection refused user=admin", null, null, null),
          event("12:00", "web01", "sshd", 5,
              "Accepted password for admin from 10.0.0.5", null, null,
              "10.0.0.5"));

  private static Row event(String time, String hostname, String appName,
      int severity, String message, @Nullable Integer bytes,
      @Nullable Integer status, @Nullable String sourceIp) {
    return Row.of(FieldSchema.TIMESTAMP,
        Instant.parse("2024-01-15T" + time + ":00Z"),
        "hostname", hostname,
        "app_name", appName,
        FieldSchema.SEVERITY, severity,
        FieldSchema.MESSAGE, message,
        "bytes", bytes,
        "status", status,
        "source_ip", sourceIp);
  }
}

// End LogEvents.java
