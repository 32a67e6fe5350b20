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

import java.time.Duration;
import net.hydromatic.lognog.eval.CancellationToken;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Options for executing a query. Immutable; each {@code with} method returns
 * a copy.
 */
public class QueryOptions {
  /** Options with no time range, the configured timeout, and no
   * cancellation token. */
  public static final QueryOptions DEFAULT =
      new QueryOptions(null, null, null, null);

  /** Start of the time range, such as "-24h"; null means unbounded. */
  public final @Nullable String earliest;
  /** End of the time range, such as "now"; null means unbounded. */
  public final @Nullable String latest;
  /** Timeout; null means use the "queryTimeoutMillis" property. */
  public final @Nullable Duration timeout;
  /** Token with which the caller may cancel the query, or null. */
  public final @Nullable CancellationToken cancellationToken;

  private QueryOptions(@Nullable String earliest, @Nullable String latest,
      @Nullable Duration timeout,
      @Nullable CancellationToken cancellationToken) {
    this.earliest = earliest;
    this.latest = latest;
    this.timeout = timeout;
    this.cancellationToken = cancellationToken;
  }

  public QueryOptions withEarliest(@Nullable String earliest) {
    return new QueryOptions(earliest, latest, timeout, cancellationToken);
  }

  public QueryOptions withLatest(@Nullable String latest) {
    return new QueryOptions(earliest, latest, timeout, cancellationToken);
  }

  public QueryOptions withTimeout(@Nullable Duration timeout) {
    return new QueryOptions(earliest, latest, timeout, cancellationToken);
  }

  public QueryOptions withCancellationToken(
      @Nullable CancellationToken cancellationToken) {
    return new QueryOptions(earliest, latest, timeout, cancellationToken);
  }
}

// End QueryOptions.java
