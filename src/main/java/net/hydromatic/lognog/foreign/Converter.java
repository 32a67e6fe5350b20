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

import java.sql.ResultSet;
import java.sql.SQLException;
import net.hydromatic.lognog.eval.Variant;

/** Reads a column of the current row of a JDBC result set as a
 * {@link Variant}.
 *
 * @see Converters */
@FunctionalInterface
public interface Converter {
  Variant convert(ResultSet resultSet) throws SQLException;
}

// End Converter.java
