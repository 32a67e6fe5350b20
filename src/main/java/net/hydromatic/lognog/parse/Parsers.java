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
package net.hydromatic.lognog.parse;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Utilities for parsing. */
public final class Parsers {
  private static final Pattern GROUP_NAME =
      Pattern.compile("\\(\\?P?<([a-zA-Z_][a-zA-Z0-9_]*)>");

  private Parsers() {}

  /**
   * Given quoted text, returns the string value.
   *
   * <p>The text must start and end with the same quote character, either
   * {@code "} or {@code '}. A backslash followed by the quote character or by
   * another backslash is an escape; any other backslash is kept, so that
   * {@code "\w+"} is the three characters {@code \w+}.
   */
  public static String unquote(String s) {
    checkArgument(s.length() >= 2, "too short: %s", s);
    final char quote = s.charAt(0);
    checkArgument(
        (quote == '"' || quote == '\'') && s.charAt(s.length() - 1) == quote,
        "not quoted: %s", s);
    final StringBuilder b = new StringBuilder();
    for (int i = 1; i < s.length() - 1; i++) {
      final char c = s.charAt(i);
      if (c == '\\' && i + 1 < s.length() - 1) {
        final char next = s.charAt(i + 1);
        if (next == quote || next == '\\') {
          b.append(next);
          ++i;
          continue;
        }
      }
      b.append(c);
    }
    return b.toString();
  }

  /**
   * Returns the offset at which each line of a piece of text starts.
   *
   * <p>Lines are numbered the way the generated token manager numbers them:
   * a line ends after {@code \n}, or after a {@code \r} that is not followed
   * by {@code \n}.
   */
  public static int[] lineStarts(String s) {
    final List<Integer> starts = new ArrayList<>();
    starts.add(0);
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c == '\n'
          || c == '\r' && (i + 1 == s.length() || s.charAt(i + 1) != '\n')) {
        starts.add(i + 1);
      }
    }
    return Ints.toArray(starts);
  }

  /** Removes the delimiting slashes from a regular expression literal, and
   * un-escapes any slashes inside it. */
  public static String unslash(String s) {
    checkArgument(s.length() >= 2 && s.startsWith("/") && s.endsWith("/"),
        "not a regular expression: %s", s);
    return s.substring(1, s.length() - 1).replace("\\/", "/");
  }

  /** Converts a string to a double-quoted literal that {@link #unquote}
   * converts back. */
  public static String quote(String s) {
    final StringBuilder b = new StringBuilder("\"");
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c == '"' || c == '\\') {
        b.append('\\');
      }
      b.append(c);
    }
    return b.append('"').toString();
  }

  /**
   * Removes the names from the named groups of a regular expression.
   *
   * <p>Both {@code (?<name>...)} and the Python form {@code (?P<name>...)}
   * are recognized. Each becomes a plain capturing group, so that names may
   * contain characters, such as {@code _}, that Java does not allow in group
   * names. Returns the rewritten expression and, for each name, the number of
   * its capturing group.
   */
  public static NamedGroups namedGroups(String regex) {
    final StringBuilder b = new StringBuilder();
    final Map<String, Integer> groups = new LinkedHashMap<>();
    int groupCount = 0;
    boolean inClass = false;
    for (int i = 0; i < regex.length(); i++) {
      final char c = regex.charAt(i);
      if (c == '\\' && i + 1 < regex.length()) {
        b.append(c).append(regex.charAt(++i));
        continue;
      }
      if (inClass) {
        inClass = c != ']';
        b.append(c);
        continue;
      }
      if (c == '[') {
        inClass = true;
      } else if (c == '(') {
        final Matcher matcher =
            GROUP_NAME.matcher(regex).region(i, regex.length());
        if (matcher.lookingAt()) {
          ++groupCount;
          if (groups.put(matcher.group(1), groupCount) != null) {
            throw new IllegalArgumentException("duplicate group name '"
                + matcher.group(1) + "'");
          }
          b.append('(');
          i = matcher.end() - 1;
          continue;
        }
        if (i + 1 >= regex.length() || regex.charAt(i + 1) != '?') {
          ++groupCount;
        }
      }
      b.append(c);
    }
    return new NamedGroups(b.toString(), groups);
  }

  /** Result of {@link #namedGroups(String)}. */
  public static class NamedGroups {
    public final String regex;
    public final ImmutableMap<String, Integer> groups;

    NamedGroups(String regex, Map<String, Integer> groups) {
      this.regex = regex;
      this.groups = ImmutableMap.copyOf(groups);
    }
  }
}

// End Parsers.java
