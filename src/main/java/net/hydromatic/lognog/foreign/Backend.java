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

import java.util.List;
import net.hydromatic.lognog.eval.Row;
import net.hydromatic.lognog.eval.Session;

/**
 * Store of log events that can execute SQL.
 *
 * <p>An implementation must honor the session's cancellation token: if the
 * query is cancelled or its deadline passes, it throws
 * {@link BackendException} and returns no rows.
 *
 * @see JdbcBackend
 */
public interface Backend {
  /** Executes a query and returns its rows, with values converted to
   * {@link net.hydromatic.lognog.eval.Variant}. */
  List<Row> execute(BackendQuery query, Session session);
}

// End Backend.java
