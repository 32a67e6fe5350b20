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

import java.util.List;

/**
 * Accepts rows from a stage of the row pipeline and forwards them, possibly
 * transformed, to the next stage.
 *
 * <p>The caller calls {@link #start()} once, {@link #accept(Row)} for each
 * input row, then {@link #result()}. Stages that need all of their input,
 * such as sort and stats, emit rows to their successor in
 * {@code result()}.
 */
public interface RowSink {
  /** Prepares to receive rows. */
  void start();

  /** Accepts a row. */
  void accept(Row row);

  /** Signals that there are no more rows, and returns the rows collected
   * by the last sink in the chain. */
  List<Row> result();
}

// End RowSink.java
