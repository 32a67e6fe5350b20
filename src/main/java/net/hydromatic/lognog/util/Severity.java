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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Syslog severity level, 0 (Emergency) through 7 (Debug). */
public enum Severity {
  EMERGENCY("Emergency", "emerg"),
  ALERT("Alert"),
  CRITICAL("Critical", "crit"),
  ERROR("Error", "err"),
  WARNING("Warning", "warn"),
  NOTICE("Notice"),
  INFO("Info", "informational"),
  DEBUG("Debug");

  /** Display name, e.g. "Warning". */
  public final String displayName;
  private final String[] synonyms;

  private static final ImmutableMap<String, Severity> BY_NAME;

  static {
    final Map<String, Severity> map = new LinkedHashMap<>();
    for (Severity severity : values()) {
      map.put(severity.name().toLowerCase(Locale.ROOT), severity);
      for (String synonym : severity.synonyms) {
        map.put(synonym, severity);
      }
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Severity(String displayName, String... synonyms) {
    this.displayName = displayName;
    this.synonyms = synonyms;
  }

  /** Returns the numeric level; equal to the ordinal. */
  public int level() {
    return ordinal();
  }

  /** Looks up a severity by name (case-insensitive), or returns null. */
  public static @Nullable Severity lookup(String name) {
    return BY_NAME.get(name.toLowerCase(Locale.ROOT));
  }

  /** Returns the severity with a given level, or null if out of range. */
  public static @Nullable Severity ofLevel(long level) {
    return level >= 0 && level < values().length
        ? values()[(int) level]
        : null;
  }
}

// End Severity.java
