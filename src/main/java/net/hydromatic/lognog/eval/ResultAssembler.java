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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.lognog.compile.FieldSchema;
import net.hydromatic.lognog.util.Severity;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts the rows that come out of the row pipeline into the rows that are
 * returned to the caller.
 *
 * <p>Applies, in order: the final projection (the fields and field order
 * established by {@code table}, {@code fields} or an aggregation); the
 * renames of {@code rename} stages; and display formatting of severity.
 */
public class ResultAssembler {
  private final @Nullable ImmutableList<String> outputFields;
  private final ImmutableMap<String, String> renames;
  private final Prop.SeverityFormat severityFormat;

  /**
   * Creates a ResultAssembler.
   *
   * @param outputFields Fields to return, in order; or null to return the
   *   fields of each row as they are
   * @param renames Renames, old name to new name
   * @param severityFormat How to display severity
   */
  public ResultAssembler(@Nullable List<String> outputFields,
      Map<String, String> renames, Prop.SeverityFormat severityFormat) {
    this.outputFields =
        outputFields == null ? null : ImmutableList.copyOf(outputFields);
    this.renames = ImmutableMap.copyOf(renames);
    this.severityFormat = requireNonNull(severityFormat);
  }

  /** Assembles a list of rows. */
  public List<Row> assemble(List<Row> rows) {
    final ImmutableList.Builder<Row> list = ImmutableList.builder();
    final Set<String> targets = new HashSet<>(renames.values());
    for (Row row : rows) {
      list.add(assemble(row, targets));
    }
    return list.build();
  }

  private Row assemble(Row row, Set<String> targets) {
    final Iterable<String> names =
        outputFields != null ? outputFields : row.names();
    final Row.Builder b = Row.builder();
    for (String name : names) {
      final String newName = renames.get(name);
      if (newName == null && targets.contains(name)) {
        // Another field is renamed to this name, and replaces it
        continue;
      }
      b.set(newName == null ? name : newName, display(name, row.get(name)));
    }
    return b.build();
  }

  private Variant display(String name, Variant value) {
    if (severityFormat == Prop.SeverityFormat.NAME
        && name.equals(FieldSchema.SEVERITY)
        && value.kind == Variant.Kind.NUMBER) {
      final Severity severity =
          Severity.ofLevel(requireNonNull(value.toNumber()).longValue());
      if (severity != null) {
        return Variant.ofString(severity.displayName);
      }
    }
    return value;
  }
}

// End ResultAssembler.java
