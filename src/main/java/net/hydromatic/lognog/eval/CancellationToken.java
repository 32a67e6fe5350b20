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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.lognog.foreign.BackendException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Allows a running query to be cancelled, explicitly by calling
 * {@link #cancel()}, or implicitly when a deadline passes.
 *
 * <p>A backend registers a hook with {@link #onCancel(Runnable)} so that it
 * can abort a statement that is executing; the row pipeline calls
 * {@link #check()} periodically.
 *
 * <p>Thread-safe: {@code cancel} is usually called from a different thread
 * than the one running the query.
 */
public class CancellationToken {
  private final Clock clock;
  private final @Nullable Instant deadline;
  private volatile boolean cancelled;
  private final List<Runnable> hooks = new ArrayList<>();

  private CancellationToken(Clock clock, @Nullable Instant deadline) {
    this.clock = clock;
    this.deadline = deadline;
  }

  /** Creates a token with no deadline. */
  public static CancellationToken create() {
    return new CancellationToken(Clock.systemUTC(), null);
  }

  /** Creates a token that expires after a given duration. */
  public static CancellationToken withTimeout(Duration timeout) {
    final Clock clock = Clock.systemUTC();
    return new CancellationToken(clock, clock.instant().plus(timeout));
  }

  /** Creates a token that expires at a given instant, as measured by a
   * given clock. */
  public static CancellationToken withDeadline(Clock clock, Instant deadline) {
    return new CancellationToken(clock, deadline);
  }

  /** Cancels the query, and runs the registered hooks. */
  public void cancel() {
    final List<Runnable> hooksToRun;
    synchronized (hooks) {
      if (cancelled) {
        return;
      }
      cancelled = true;
      hooksToRun = new ArrayList<>(hooks);
    }
    hooksToRun.forEach(Runnable::run);
  }

  /** Registers an action to run when the query is cancelled. If the query
   * has already been cancelled, runs it immediately. */
  public void onCancel(Runnable hook) {
    synchronized (hooks) {
      if (!cancelled) {
        hooks.add(hook);
        return;
      }
    }
    hook.run();
  }

  /** Removes a hook registered by {@link #onCancel(Runnable)}. */
  public void removeHook(Runnable hook) {
    synchronized (hooks) {
      hooks.remove(hook);
    }
  }

  public boolean isCancelled() {
    return cancelled;
  }

  /** Whether the deadline, if any, has passed. */
  public boolean isExpired() {
    return deadline != null && !clock.instant().isBefore(deadline);
  }

  /** Returns the time remaining until the deadline, or null if there is no
   * deadline. */
  public @Nullable Duration remaining() {
    if (deadline == null) {
      return null;
    }
    final Duration d = Duration.between(clock.instant(), deadline);
    return d.isNegative() ? Duration.ZERO : d;
  }

  /** Throws if the query has been cancelled or its deadline has passed. */
  public void check() {
    if (cancelled) {
      throw new BackendException(BackendException.Reason.CANCELLED,
          "Query cancelled", null);
    }
    if (isExpired()) {
      throw new BackendException(BackendException.Reason.TIMEOUT,
          "Query timed out", null);
    }
  }
}

// End CancellationToken.java
