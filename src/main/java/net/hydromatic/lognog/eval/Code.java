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

/** A compiled expression, that can be evaluated against a row. */
public interface Code {
  /** Evaluates this code against a row. Never throws
   * {@link RowPipelineException}; a failure yields
   * {@link Variant#UNDEFINED}. */
  Variant eval(Row row);

  /** Whether this code always returns the same value. */
  default boolean isConstant() {
    return false;
  }
}

// End Code.java
