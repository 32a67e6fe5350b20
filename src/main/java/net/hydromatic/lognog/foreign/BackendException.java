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

import net.hydromatic.lognog.ast.Pos;
import net.hydromatic.lognog.util.LogNogException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Error executing a query in the backend, including timeout and
 * cancellation. */
public class BackendException extends RuntimeException
    implements LogNogException {
  public final Reason reason;

  public BackendException(Reason reason, String message,
      @Nullable Throwable cause) {
    super(message, cause);
    this.reason = requireNonNull(reason);
  }

  @Override
  public Kind kind() {
    return Kind.BACKEND;
  }

  @Override
  public @Nullable Pos pos() {
    return null;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append("Backend error (").append(reason).append("): ")
        .append(getMessage());
    final Throwable cause = getCause();
    if (cause != null && cause.getMessage() != null) {
      buf.append(": ").append(cause.getMessage());
    }
    return buf;
  }

  /** Why the query failed. */
  public enum Reason {
    /** Connectivity failure or SQL error. */
    ERROR,
    /** The deadline passed. */
    TIMEOUT,
    /** The query was cancelled. */
    CANCELLED
  }
}

// End BackendException.java
