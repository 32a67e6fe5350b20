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

/**
 * Error evaluating an expression against one row, for example applying a
 * numeric function to a string.
 *
 * <p>It is caught where the expression is evaluated, and the value becomes
 * {@link Variant#UNDEFINED}; it never aborts a query.
 */
public class RowPipelineException extends RuntimeException {
  public RowPipelineException(String message) {
    super(message);
  }
}

// End RowPipelineException.java
