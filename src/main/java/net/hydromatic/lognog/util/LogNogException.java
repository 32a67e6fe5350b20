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
package net.hydromatic.lognog.util;

import net.hydromatic.lognog.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Exception that aborts a query and is reported to the caller.
 *
 * <p>Every implementation is a {@link RuntimeException}. The {@link #kind()}
 * is machine-readable; {@link #describeTo(StringBuilder)} produces the
 * human-readable message, prefixed with the position in the query text if
 * the error has one.
 */
public interface LogNogException {
  /** Returns the category of this error. */
  Kind kind();

  /** Returns the position in the query text, or null. */
  @Nullable Pos pos();

  /** Writes a description of this error to a buffer. */
  StringBuilder describeTo(StringBuilder buf);

  /** Category of error. */
  enum Kind {
    /** Malformed syntax, unknown command or function, invalid regex. */
    PARSE,
    /** Unknown field, wrong number of arguments to a function. */
    VALIDATION,
    /** Connectivity failure, SQL error, timeout or cancellation. */
    BACKEND
  }
}

// End LogNogException.java
