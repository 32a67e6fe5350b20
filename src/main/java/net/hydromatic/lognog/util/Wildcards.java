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

import java.util.regex.Pattern;

/** Utilities for values that contain the {@code *} wildcard. */
public abstract class Wildcards {
  /** Escape character used in generated LIKE patterns. */
  public static final char LIKE_ESCAPE = '\\';

  private Wildcards() {}

  /** Returns whether a value contains a wildcard. */
  public static boolean hasWildcard(String value) {
    return value.indexOf('*') >= 0;
  }

  /** Classifies a value by where its wildcards are. */
  public static Shape shape(String value) {
    final int first = value.indexOf('*');
    if (first < 0) {
      return Shape.EXACT;
    }
    final String stripped = strip(value);
    if (stripped.isEmpty()) {
      return Shape.ANY;
    }
    if (stripped.indexOf('*') >= 0) {
      return Shape.GENERAL;
    }
    final boolean leading = value.charAt(0) == '*';
    final boolean trailing = value.charAt(value.length() - 1) == '*';
    return leading && trailing ? Shape.CONTAINS
        : leading ? Shape.SUFFIX
        : Shape.PREFIX;
  }

  /** Removes leading and trailing wildcards. */
  public static String strip(String value) {
    int start = 0;
    int end = value.length();
    while (start < end && value.charAt(start) == '*') {
      ++start;
    }
    while (end > start && value.charAt(end - 1) == '*') {
      --end;
    }
    return value.substring(start, end);
  }

  /**
   * Converts a wildcard value to a regular expression that matches the whole
   * of a string. Characters other than {@code *} match literally.
   */
  public static Pattern toPattern(String value, boolean caseInsensitive) {
    final StringBuilder b = new StringBuilder();
    int start = 0;
    for (int i = 0; i < value.length(); i++) {
      if (value.charAt(i) == '*') {
        if (i > start) {
          b.append(Pattern.quote(value.substring(start, i)));
        }
        b.append(".*");
        start = i + 1;
      }
    }
    if (start < value.length()) {
      b.append(Pattern.quote(value.substring(start)));
    }
    return Pattern.compile(
        b.toString(),
        Pattern.DOTALL
            | (caseInsensitive
                ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
                : 0));
  }

  /**
   * Converts a wildcard value to a SQL LIKE pattern, escaping {@code %},
   * {@code _} and the escape character with {@link #LIKE_ESCAPE}.
   */
  public static String toLike(String value) {
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      switch (c) {
      case '*':
        b.append('%');
        break;
      case '%':
      case '_':
      case LIKE_ESCAPE:
        b.append(LIKE_ESCAPE).append(c);
        break;
      default:
        b.append(c);
      }
    }
    return b.toString();
  }

  /** Where the wildcards occur in a value. */
  public enum Shape {
    /** No wildcard; "abc". */
    EXACT,
    /** Only wildcards; "*". */
    ANY,
    /** Trailing wildcard; "abc*". */
    PREFIX,
    /** Leading wildcard; "*abc". */
    SUFFIX,
    /** Leading and trailing wildcard; "*abc*". */
    CONTAINS,
    /** Wildcard in the middle; "a*c". */
    GENERAL
  }
}

// End Wildcards.java
