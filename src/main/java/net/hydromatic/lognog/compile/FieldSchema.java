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
package net.hydromatic.lognog.compile;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Table of the columns of the log store, their types and aliases.
 *
 * <p>Lookup by canonical name is case-sensitive; an alias maps to exactly one
 * canonical name. The schema is immutable, so that one instance may be
 * shared by concurrent queries.
 */
public class FieldSchema {
  /** Name of the column that holds the time of each event. */
  public static final String TIMESTAMP = "timestamp";

  /** Name of the column searched by free-text terms. */
  public static final String MESSAGE = "message";

  /** Name of the column that holds the syslog severity. */
  public static final String SEVERITY = "severity";

  /** Columns returned by a query that does not aggregate or project. */
  public static final List<String> DEFAULT_FIELDS =
      ImmutableList.of(TIMESTAMP, "hostname", "app_name", SEVERITY, MESSAGE);

  /** The schema of the standard log table. */
  public static final FieldSchema DEFAULT =
      builder()
          .add(TIMESTAMP, FieldType.DATETIME, "_time", "time")
          .add("received_at", FieldType.DATETIME)
          .add("facility", FieldType.NUMBER)
          .add(SEVERITY, FieldType.NUMBER, "level")
          .add("priority", FieldType.NUMBER)
          .add("hostname", FieldType.STRING, "host", "source")
          .add("app_name", FieldType.STRING, "app", "program", "sourcetype")
          .add("proc_id", FieldType.STRING)
          .add("msg_id", FieldType.STRING)
          .add(MESSAGE, FieldType.STRING, "msg")
          .add("raw", FieldType.STRING, "_raw")
          .add("structured_data", FieldType.JSON)
          .add("source_ip", FieldType.STRING)
          .add("dest_ip", FieldType.STRING)
          .add("source_port", FieldType.NUMBER)
          .add("dest_port", FieldType.NUMBER)
          .add("protocol", FieldType.STRING)
          .add("action", FieldType.STRING)
          .add("user", FieldType.STRING)
          .add("index_name", FieldType.STRING, "index")
          .build();

  /** Entries, keyed by canonical name, in declaration order. */
  public final ImmutableMap<String, Entry> entries;

  /** Canonical names, keyed by alias. */
  private final ImmutableMap<String, String> aliases;

  private FieldSchema(ImmutableMap<String, Entry> entries) {
    this.entries = requireNonNull(entries);
    final ImmutableMap.Builder<String, String> b = ImmutableMap.builder();
    entries.values()
        .forEach(e -> e.aliases.forEach(alias -> b.put(alias, e.name)));
    this.aliases = b.build();
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns a builder that contains the entries of this schema. */
  public Builder toBuilder() {
    final Builder builder = new Builder();
    builder.entries.putAll(entries);
    return builder;
  }

  /** Looks up a field by canonical name or alias; returns null if there is
   * no such field. */
  public @Nullable Entry lookup(String name) {
    final Entry entry = entries.get(name);
    if (entry != null) {
      return entry;
    }
    final String canonicalName = aliases.get(name);
    return canonicalName == null ? null : entries.get(canonicalName);
  }

  /** Returns the canonical name of a field, or null. */
  public @Nullable String canonicalName(String name) {
    final Entry entry = lookup(name);
    return entry == null ? null : entry.name;
  }

  /** Returns whether there is a column with the given canonical name. */
  public boolean isColumn(String name) {
    return entries.containsKey(name);
  }

  /** Returns the type of a column, or null if it is not a column. */
  public @Nullable FieldType typeOf(String name) {
    final Entry entry = entries.get(name);
    return entry == null ? null : entry.type;
  }

  @Override
  public String toString() {
    return entries.values().toString();
  }

  /** Type of a field. */
  public enum FieldType {
    STRING,
    NUMBER,
    DATETIME,
    JSON
  }

  /** Field in a schema. */
  public static class Entry {
    public final String name;
    public final FieldType type;
    public final ImmutableList<String> aliases;

    Entry(String name, FieldType type, ImmutableList<String> aliases) {
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
      this.aliases = requireNonNull(aliases);
    }

    @Override
    public String toString() {
      return aliases.isEmpty()
          ? name + ":" + type
          : name + ":" + type + aliases;
    }
  }

  /** Builder for a {@link FieldSchema}. */
  public static class Builder {
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    /** Adds a field, or replaces a field of the same name. */
    public Builder add(String name, FieldType type, String... aliases) {
      entries.put(name, new Entry(name, type, ImmutableList.copyOf(aliases)));
      return this;
    }

    public FieldSchema build() {
      final Map<String, String> seen = new LinkedHashMap<>();
      for (Entry entry : entries.values()) {
        for (String alias : entry.aliases) {
          checkArgument(!entries.containsKey(alias),
              "alias %s of %s is a field", alias, entry.name);
          final String previous = seen.put(alias, entry.name);
          checkArgument(previous == null,
              "alias %s is used by %s and %s", alias, previous, entry.name);
        }
      }
      return new FieldSchema(ImmutableMap.copyOf(entries));
    }
  }
}

// End FieldSchema.java
