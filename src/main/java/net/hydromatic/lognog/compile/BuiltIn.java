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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Built-in functions that may be called in {@code eval} expressions and in
 * predicates.
 *
 * <p>The implementations are in {@code Codes}; the SQL translations are in
 * {@link SqlRenderer}.
 */
public enum BuiltIn {
  /** Function "abs", of type "number &rarr; number". */
  ABS("abs", Family.MATH, 1, 1),

  /** Function "round", of type "number [, int] &rarr; number"; rounds half
   * away from zero to the given number of decimal places. */
  ROUND("round", Family.MATH, 1, 2),

  /** Function "floor", of type "number &rarr; number". */
  FLOOR("floor", Family.MATH, 1, 1),

  /** Function "ceil", of type "number &rarr; number". */
  CEIL("ceil", Family.MATH, 1, 1, "ceiling"),

  /** Function "sqrt", of type "number &rarr; number"; undefined if the
   * argument is negative. */
  SQRT("sqrt", Family.MATH, 1, 1),

  /** Function "pow", of type "number * number &rarr; number". */
  POW("pow", Family.MATH, 2, 2, "power"),

  /** Function "log", the natural logarithm; undefined unless the argument is
   * positive. */
  LOG("log", Family.MATH, 1, 1, "ln"),

  /** Function "log10", the base 10 logarithm. */
  LOG10("log10", Family.MATH, 1, 1),

  /** Function "exp", of type "number &rarr; number". */
  EXP("exp", Family.MATH, 1, 1),

  /** Function "len", the number of characters in a string. */
  LEN("len", Family.STRING, 1, 1, "length"),

  LOWER("lower", Family.STRING, 1, 1),

  UPPER("upper", Family.STRING, 1, 1),

  /** Function "substr", of type "string * int [* int] &rarr; string";
   * positions are 1-based. */
  SUBSTR("substr", Family.STRING, 2, 3, "substring"),

  TRIM("trim", Family.STRING, 1, 1),

  LTRIM("ltrim", Family.STRING, 1, 1),

  RTRIM("rtrim", Family.STRING, 1, 1),

  /** Function "replace", of type "string * string * string &rarr; string";
   * replaces every occurrence of the second argument, literally. */
  REPLACE("replace", Family.STRING, 3, 3),

  /** Function "split"; with two arguments, returns a list of strings; with
   * three, returns the element at a 0-based index. */
  SPLIT("split", Family.STRING, 2, 3),

  /** Function "concat"; null arguments are treated as empty strings. */
  CONCAT("concat", Family.STRING, 1, Integer.MAX_VALUE),

  /** Function "if", of type "bool * 'a * 'a &rarr; 'a". */
  IF("if", Family.CONDITIONAL, 3, 3),

  /** Function "coalesce"; returns the first argument that is not null. */
  COALESCE("coalesce", Family.CONDITIONAL, 1, Integer.MAX_VALUE),

  /** Function "nullif"; returns null if the arguments are equal, otherwise
   * the first argument. */
  NULLIF("nullif", Family.CONDITIONAL, 2, 2),

  /**
   * Function "case"; arguments are condition/value pairs, evaluated
   * left-to-right, and the value of the first true condition is returned. A
   * trailing unpaired argument is the default; if there is none, the result
   * is null.
   */
  CASE("case", Family.CONDITIONAL, 2, Integer.MAX_VALUE),

  /** Function "classify_ip"; returns one of "private", "public", "loopback",
   * "link_local", "multicast", "reserved", or null if the argument is not an
   * IPv4 address. */
  CLASSIFY_IP("classify_ip", Family.IP, 1, 1),

  IS_PUBLIC_IP("is_public_ip", Family.IP, 1, 1),

  IS_PRIVATE_IP("is_private_ip", Family.IP, 1, 1),

  IS_INTERNAL_IP("is_internal_ip", Family.IP, 1, 1),

  IS_LOOPBACK_IP("is_loopback_ip", Family.IP, 1, 1),

  IS_LINK_LOCAL_IP("is_link_local_ip", Family.IP, 1, 1),

  IS_MULTICAST_IP("is_multicast_ip", Family.IP, 1, 1),

  IS_RESERVED_IP("is_reserved_ip", Family.IP, 1, 1),

  /** Function "tonumber"; undefined if the argument is not numeric. */
  TONUMBER("tonumber", Family.CONVERSION, 1, 1),

  TOSTRING("tostring", Family.CONVERSION, 1, 1),

  ISNULL("isnull", Family.CONVERSION, 1, 1),

  ISNOTNULL("isnotnull", Family.CONVERSION, 1, 1);

  /** Name of the function in the query language, e.g. "classify_ip". */
  public final String name;
  public final Family family;
  public final int minArgs;
  public final int maxArgs;
  private final String[] synonyms;

  /** Map of functions by name and synonym, all lower case. */
  public static final ImmutableMap<String, BuiltIn> BY_NAME;

  static {
    final Map<String, BuiltIn> map = new LinkedHashMap<>();
    for (BuiltIn builtIn : values()) {
      map.put(builtIn.name, builtIn);
      for (String synonym : builtIn.synonyms) {
        map.put(synonym, builtIn);
      }
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  BuiltIn(
      String name,
      Family family,
      int minArgs,
      int maxArgs,
      String... synonyms) {
    this.name = name;
    this.family = family;
    this.minArgs = minArgs;
    this.maxArgs = maxArgs;
    this.synonyms = synonyms;
  }

  /** Looks up a function by name, ignoring case; returns null if not
   * found. */
  public static @Nullable BuiltIn lookup(String name) {
    return BY_NAME.get(name.toLowerCase(Locale.ROOT));
  }

  /** Returns whether a call with a given number of arguments is valid. */
  public boolean acceptsArgCount(int n) {
    return n >= minArgs && n <= maxArgs;
  }

  /** Describes the valid number of arguments, e.g. "2 or 3". */
  public String describeArgCount() {
    if (minArgs == maxArgs) {
      return Integer.toString(minArgs);
    } else if (maxArgs == Integer.MAX_VALUE) {
      return "at least " + minArgs;
    } else if (maxArgs == minArgs + 1) {
      return minArgs + " or " + maxArgs;
    } else {
      return "between " + minArgs + " and " + maxArgs;
    }
  }

  /** Family of functions. */
  public enum Family {
    MATH,
    STRING,
    CONDITIONAL,
    IP,
    CONVERSION
  }
}

// End BuiltIn.java
