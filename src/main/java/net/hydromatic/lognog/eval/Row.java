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

import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A row: an ordered mapping from field name to value.
 *
 * <p>Rows are immutable; methods such as {@link #with} return a new row.
 */
public final class Row {
  public static final Row EMPTY = new Row(ImmutableMap.of());

  private final ImmutableMap<String, Variant> map;

  private Row(ImmutableMap<String, Variant> map) {
    this.map = requireNonNull(map);
  }

  /** Creates a row from a map of values. */
  public static Row of(Map<String, Variant> map) {
    return new Row(ImmutableMap.copyOf(map));
  }

  /** Creates a row from alternating names and Java values; for tests. */
  public static Row of(Object... namesAndValues) {
    final Builder b = builder();
    for (int i = 0; i < namesAndValues.length; i += 2) {
      b.set((String) namesAndValues[i], Variant.of(namesAndValues[i + 1]));
    }
    return b.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the value of a field; {@link Variant#NULL} if absent. */
  public Variant get(String name) {
    final Variant v = map.get(name);
    return v == null ? Variant.NULL : v;
  }

  public boolean containsKey(String name) {
    return map.containsKey(name);
  }

  /** Names of the fields, in order. */
  public Set<String> names() {
    return map.keySet();
  }

  public Collection<Variant> values() {
    return map.values();
  }

  public int size() {
    return map.size();
  }

  /** Returns a row with a field set; an existing field keeps its position,
   * a new field goes last. */
  public Row with(String name, Variant value) {
    final Builder b = new Builder(map);
    b.set(name, value);
    return b.build();
  }

  /** Returns a builder that starts with the fields of this row. */
  public Builder toBuilder() {
    return new Builder(map);
  }

  /** Returns the row as a map of display values; see
   * {@link Variant#toJava()}. */
  public Map<String, @Nullable Object> toMap() {
    final Map<String, @Nullable Object> m = new LinkedHashMap<>();
    map.forEach((name, value) -> m.put(name, value.toJava()));
    return m;
  }

  /** Returns the row as a map of variants. */
  public ImmutableMap<String, Variant> asMap() {
    return map;
  }

  @Override
  public int hashCode() {
    return map.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Row && map.equals(((Row) o).map);
  }

  @Override
  public String toString() {
    return map.toString();
  }

  /** Builder for a {@link Row}. */
  public static class Builder {
    private final Map<String, Variant> map;

    Builder() {
      this.map = new LinkedHashMap<>();
    }

    Builder(Map<String, Variant> map) {
      this.map = new LinkedHashMap<>(map);
    }

    public Builder set(String name, Variant value) {
      map.put(name, requireNonNull(value));
      return this;
    }

    public Builder remove(String name) {
      map.remove(name);
      return this;
    }

    public Row build() {
      return new Row(ImmutableMap.copyOf(map));
    }
  }
}

// End Row.java
