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
package net.hydromatic.lognog.parse;

import static java.util.Objects.requireNonNull;

import net.hydromatic.lognog.ast.Pos;
import net.hydromatic.lognog.util.LogNogException;

/**
 * Exception caused by a parse error: malformed syntax, an unknown command or
 * function, or a regular expression that does not compile.
 */
public class LogNogParseException extends RuntimeException
    implements LogNogException {
  private final Pos pos;

  public LogNogParseException(String message, Pos pos) {
    super(message);
    this.pos = requireNonNull(pos);
  }

  public LogNogParseException(String message, Pos pos, Throwable cause) {
    super(message, cause);
    this.pos = requireNonNull(pos);
  }

  @Override
  public String toString() {
    return super.toString() + " at " + pos;
  }

  @Override
  public Kind kind() {
    return Kind.PARSE;
  }

  @Override
  public Pos pos() {
    return pos;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf).append(" Error: ").append(getMessage());
  }
}

// End LogNogParseException.java
