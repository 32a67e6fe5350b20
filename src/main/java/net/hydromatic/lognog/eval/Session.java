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

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** State of one query while it executes.
 *
 * <p>A session is used by one thread at a time; only its
 * {@link #cancellationToken} may be accessed from other threads. */
public class Session {
  /** Property values. */
  public final Map<Prop, Object> map;
  /** Token that the backend and the row pipeline check. */
  public final CancellationToken cancellationToken;
  /** Timeout for the backend statement, or null if there is none beyond the
   * token's deadline. */
  public final @Nullable Duration timeout;

  /** Creates a Session.
   *
   * <p>The {@code map} parameter, that becomes the property map, is used as
   * is, not copied. Otherwise, it should probably be a {@link LinkedHashMap}
   * to provide deterministic iteration order.
   *
   * @param map Map that contains property values
   * @param cancellationToken Cancellation token
   * @param timeout Statement timeout, or null
   */
  public Session(Map<Prop, Object> map, CancellationToken cancellationToken,
      @Nullable Duration timeout) {
    this.map = requireNonNull(map);
    this.cancellationToken = requireNonNull(cancellationToken);
    this.timeout = timeout;
  }

  /** Returns the time that the backend may spend on a statement, the lesser
   * of {@link #timeout} and the time left before the token's deadline; or
   * null if there is no limit. */
  public @Nullable Duration statementTimeout() {
    final Duration remaining = cancellationToken.remaining();
    if (remaining == null) {
      return timeout;
    }
    if (timeout == null) {
      return remaining;
    }
    return remaining.compareTo(timeout) < 0 ? remaining : timeout;
  }
}

// End Session.java
