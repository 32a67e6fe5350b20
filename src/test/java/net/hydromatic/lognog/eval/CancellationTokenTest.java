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

import com.google.common.collect.ImmutableMap;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.lognog.foreign.BackendException;
import org.junit.jupiter.api.Test;

/** Tests {@link CancellationToken} and {@link Session}. */
public class CancellationTokenTest {
  private static final Instant NOW = Instant.parse("2024-01-15T12:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  @Test void testCancel() {
    final CancellationToken token = CancellationToken.create();
    token.check();
    assertThat(token.isCancelled(), is(false));
    assertThat(token.remaining(), nullValue());

    final AtomicInteger count = new AtomicInteger();
    final Runnable hook = count::incrementAndGet;
    final Runnable removed = () -> count.addAndGet(100);
    token.onCancel(hook);
    token.onCancel(removed);
    token.removeHook(removed);
    token.cancel();
    token.cancel();
    assertThat(token.isCancelled(), is(true));
    assertThat(count.get(), is(1));

    // A hook registered after cancellation runs at once
    token.onCancel(hook);
    assertThat(count.get(), is(2));

    final BackendException e =
        assertThrows(BackendException.class, token::check);
    assertThat(e.reason, is(BackendException.Reason.CANCELLED));
    assertThat(e.describeTo(new StringBuilder()).toString(),
        is("Backend error (CANCELLED): Query cancelled"));
  }

  @Test void testDeadline() {
    final CancellationToken token =
        CancellationToken.withDeadline(CLOCK, NOW.plusSeconds(5));
    assertThat(token.isExpired(), is(false));
    assertThat(token.remaining(), is(Duration.ofSeconds(5)));
    token.check();

    final CancellationToken expired =
        CancellationToken.withDeadline(CLOCK, NOW.minusSeconds(5));
    assertThat(expired.isExpired(), is(true));
    assertThat(expired.remaining(), is(Duration.ZERO));
    final BackendException e =
        assertThrows(BackendException.class, expired::check);
    assertThat(e.reason, is(BackendException.Reason.TIMEOUT));
  }

  @Test void testTimeout() {
    assertThat(CancellationToken.withTimeout(Duration.ZERO).isExpired(),
        is(true));
    assertThat(CancellationToken.withTimeout(Duration.ofHours(1)).isExpired(),
        is(false));
  }

  /** The statement timeout is the lesser of the session's timeout and the
   * time left before the deadline. */
  @Test void testStatementTimeout() {
    final CancellationToken token =
        CancellationToken.withDeadline(CLOCK, NOW.plusSeconds(5));
    assertThat(
        new Session(ImmutableMap.of(), token, Duration.ofSeconds(10))
            .statementTimeout(),
        is(Duration.ofSeconds(5)));
    assertThat(
        new Session(ImmutableMap.of(), token, Duration.ofSeconds(2))
            .statementTimeout(),
        is(Duration.ofSeconds(2)));
    assertThat(new Session(ImmutableMap.of(), token, null).statementTimeout(),
        is(Duration.ofSeconds(5)));
    assertThat(
        new Session(ImmutableMap.of(), CancellationToken.create(), null)
            .statementTimeout(),
        nullValue());
  }
}

// End CancellationTokenTest.java
