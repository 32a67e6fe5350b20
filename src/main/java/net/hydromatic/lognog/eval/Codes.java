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
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import net.hydromatic.lognog.ast.Op;
import net.hydromatic.lognog.compile.BuiltIn;
import net.hydromatic.lognog.util.IpClassifier;
import net.hydromatic.lognog.util.Wildcards;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Helpers for {@link Code}, and implementations of built-in functions. */
public abstract class Codes {
  private static final Logger LOGGER = LoggerFactory.getLogger(Codes.class);

  private Codes() {}

  /** Returns a Code that returns a constant value. */
  public static Code constant(Variant value) {
    return new ConstantCode(value);
  }

  /** Returns a Code that returns the value of a field. */
  public static Code field(String name) {
    requireNonNull(name);
    return row -> row.get(name);
  }

  /** Returns a Code that implements three-valued {@code NOT}. */
  public static Code not(Code code) {
    return row -> not(code.eval(row));
  }

  /** Returns a Code that implements three-valued {@code AND}. A false left
   * operand short-circuits. */
  public static Code andAlso(Code code0, Code code1) {
    return row -> {
      final Boolean b0 = code0.eval(row).truth();
      if (b0 != null && !b0) {
        return Variant.FALSE;
      }
      final Boolean b1 = code1.eval(row).truth();
      if (b1 != null && !b1) {
        return Variant.FALSE;
      }
      return b0 != null && b1 != null ? Variant.TRUE : Variant.NULL;
    };
  }

  /** Returns a Code that implements three-valued {@code OR}. A true left
   * operand short-circuits. */
  public static Code orElse(Code code0, Code code1) {
    return row -> {
      final Boolean b0 = code0.eval(row).truth();
      if (b0 != null && b0) {
        return Variant.TRUE;
      }
      final Boolean b1 = code1.eval(row).truth();
      if (b1 != null && b1) {
        return Variant.TRUE;
      }
      return b0 != null && b1 != null ? Variant.FALSE : Variant.NULL;
    };
  }

  /** Returns a Code that negates a number. */
  public static Code negate(Code code) {
    return row -> {
      final Variant v = code.eval(row);
      if (v.isNull()) {
        return v;
      }
      final Double d = v.toNumber();
      return d == null ? Variant.UNDEFINED : Variant.ofNumber(-d);
    };
  }

  /** Returns a Code for an arithmetic operator. */
  public static Code arithmetic(Op op, Code code0, Code code1) {
    return row -> arithmetic(op, code0.eval(row), code1.eval(row));
  }

  /** Applies an arithmetic operator.
   *
   * <p>If either operand is null or undefined, so is the result. If either
   * is not a number, or the operator is division or modulo and the divisor
   * is zero, the result is undefined. */
  public static Variant arithmetic(Op op, Variant v0, Variant v1) {
    if (v0.isNull() || v1.isNull()) {
      return v0.kind == Variant.Kind.UNDEFINED ? v0
          : v1.kind == Variant.Kind.UNDEFINED ? v1
          : Variant.NULL;
    }
    final Double d0 = v0.toNumber();
    final Double d1 = v1.toNumber();
    if (d0 == null || d1 == null) {
      return Variant.UNDEFINED;
    }
    switch (op) {
    case PLUS:
      return Variant.ofNumber(d0 + d1);
    case MINUS:
      return Variant.ofNumber(d0 - d1);
    case TIMES:
      return Variant.ofNumber(d0 * d1);
    case DIVIDE:
      return d1 == 0d ? Variant.UNDEFINED : Variant.ofNumber(d0 / d1);
    case MOD:
      return d1 == 0d ? Variant.UNDEFINED : Variant.ofNumber(d0 % d1);
    default:
      throw new AssertionError("not arithmetic: " + op);
    }
  }

  /** Returns a Code for a comparison operator other than
   * {@link Op#MATCH}. */
  public static Code compare(Op op, Code code0, Code code1) {
    return row -> compare(op, code0.eval(row), code1.eval(row));
  }

  /**
   * Compares two values.
   *
   * <p>If either value is null or undefined, the result is null. If both are
   * numbers, or one is a number and the other converts to a number, the
   * comparison is numeric; otherwise the values are compared as strings,
   * case-sensitively.
   */
  public static Variant compare(Op op, Variant v0, Variant v1) {
    if (v0.isNull() || v1.isNull()) {
      return Variant.NULL;
    }
    final int c;
    final Double d0 = v0.toNumber();
    final Double d1 = v1.toNumber();
    if (d0 != null
        && d1 != null
        && (v0.kind == Variant.Kind.NUMBER || v1.kind == Variant.Kind.NUMBER
            || op != Op.EQ && op != Op.NE)) {
      c = Double.compare(d0, d1);
    } else if (v0.kind == Variant.Kind.TIMESTAMP
        && v1.kind == Variant.Kind.TIMESTAMP) {
      c = v0.asInstant().compareTo(v1.asInstant());
    } else if (v0.kind == Variant.Kind.BOOL
        && v1.kind == Variant.Kind.BOOL) {
      c = Boolean.compare(v0.isTrue(), v1.isTrue());
    } else {
      c = requireNonNull(v0.toStr()).compareTo(requireNonNull(v1.toStr()));
    }
    switch (op) {
    case EQ:
      return Variant.ofBool(c == 0);
    case NE:
      return Variant.ofBool(c != 0);
    case LT:
      return Variant.ofBool(c < 0);
    case LE:
      return Variant.ofBool(c <= 0);
    case GT:
      return Variant.ofBool(c > 0);
    case GE:
      return Variant.ofBool(c >= 0);
    default:
      throw new AssertionError("not a comparison: " + op);
    }
  }

  /** Returns a Code that tests whether a value contains a match for a
   * regular expression. */
  public static Code regex(Code code, Pattern pattern) {
    return row -> {
      final String s = code.eval(row).toStr();
      return s == null ? Variant.NULL
          : Variant.ofBool(pattern.matcher(s).find());
    };
  }

  /** Returns a Code that tests whether a value matches a pattern that
   * contains {@code *} wildcards. */
  public static Code wildcard(Code code, String value,
      boolean caseInsensitive) {
    final Pattern pattern = Wildcards.toPattern(value, caseInsensitive);
    return row -> {
      final String s = code.eval(row).toStr();
      return s == null ? Variant.NULL
          : Variant.ofBool(pattern.matcher(s).matches());
    };
  }

  /** Returns a Code that tests, ignoring case, whether one value contains
   * another. */
  public static Code contains(Code code0, Code code1) {
    return row -> {
      final String s0 = code0.eval(row).toStr();
      final String s1 = code1.eval(row).toStr();
      if (s0 == null || s1 == null) {
        return Variant.NULL;
      }
      return Variant.ofBool(
          s0.toLowerCase(Locale.ROOT).contains(s1.toLowerCase(Locale.ROOT)));
    };
  }

  /** Returns a Code that tests whether a value is present and not empty;
   * implements {@code field=*}. Never returns null. */
  public static Code present(Code code) {
    return row -> {
      final String s = code.eval(row).toStr();
      return Variant.ofBool(s != null && !s.isEmpty());
    };
  }

  /** Returns a Code that calls a built-in function. */
  public static Code apply(BuiltIn builtIn, List<Code> args) {
    final Applicable applicable =
        requireNonNull(BUILT_IN_VALUES.get(builtIn), builtIn.name);
    final ImmutableList<Code> argCodes = ImmutableList.copyOf(args);
    return row -> {
      final List<Variant> values = new ArrayList<>(argCodes.size());
      for (Code argCode : argCodes) {
        values.add(argCode.eval(row));
      }
      try {
        return applicable.apply(values);
      } catch (RowPipelineException e) {
        LOGGER.trace("{} is undefined for {}: {}", builtIn.name, values,
            e.getMessage());
        return Variant.UNDEFINED;
      }
    };
  }

  static Variant not(Variant v) {
    final Boolean b = v.truth();
    return b == null ? Variant.NULL : Variant.ofBool(!b);
  }

  /** Converts an argument to a number, or throws. */
  private static double num(BuiltIn builtIn, Variant v) {
    final Double d = v.toNumber();
    if (d == null) {
      throw new RowPipelineException(
          builtIn.name + " requires a number, got " + v);
    }
    return d;
  }

  /** Converts an argument to an integer, or throws. */
  private static int intArg(BuiltIn builtIn, Variant v) {
    final double d = num(builtIn, v);
    if (d != Math.rint(d)) {
      throw new RowPipelineException(
          builtIn.name + " requires an integer, got " + v);
    }
    return (int) d;
  }

  /** Converts an argument to a string, or throws if it is null. */
  private static String str(BuiltIn builtIn, Variant v) {
    final String s = v.toStr();
    if (s == null) {
      throw new RowPipelineException(
          builtIn.name + " requires a string, got " + v);
    }
    return s;
  }

  private static Applicable math1(BuiltIn builtIn,
      java.util.function.DoubleUnaryOperator f) {
    return args -> Variant.ofNumber(f.applyAsDouble(num(builtIn, args.get(0))));
  }

  private static Applicable string1(BuiltIn builtIn,
      java.util.function.UnaryOperator<String> f) {
    return args -> Variant.ofString(f.apply(str(builtIn, args.get(0))));
  }

  private static Applicable ipPredicate(BuiltIn builtIn,
      java.util.function.Predicate<IpClassifier.IpClass> predicate) {
    return args -> {
      final Variant v = args.get(0);
      if (v.isNull()) {
        return Variant.NULL;
      }
      final IpClassifier.IpClass ipClass =
          IpClassifier.classify(str(builtIn, v));
      return ipClass == null ? Variant.NULL
          : Variant.ofBool(predicate.test(ipClass));
    };
  }

  /** @see BuiltIn#ROUND */
  private static Variant round(List<Variant> args) {
    final double d = num(BuiltIn.ROUND, args.get(0));
    final int scale = args.size() > 1 ? intArg(BuiltIn.ROUND, args.get(1)) : 0;
    return Variant.ofNumber(
        BigDecimal.valueOf(d).setScale(scale, RoundingMode.HALF_UP)
            .doubleValue());
  }

  /** @see BuiltIn#SUBSTR */
  private static Variant substr(List<Variant> args) {
    final String s = str(BuiltIn.SUBSTR, args.get(0));
    final int start = intArg(BuiltIn.SUBSTR, args.get(1));
    // Positions are 1-based; a negative start counts from the end.
    int begin = start > 0 ? start - 1
        : start < 0 ? Math.max(0, s.length() + start)
        : 0;
    begin = Math.min(begin, s.length());
    int end = s.length();
    if (args.size() > 2) {
      final int length = intArg(BuiltIn.SUBSTR, args.get(2));
      if (length < 0) {
        throw new RowPipelineException("substr length must not be negative");
      }
      end = (int) Math.min((long) begin + length, s.length());
    }
    return Variant.ofString(s.substring(begin, end));
  }

  /** @see BuiltIn#REPLACE */
  private static Variant replace(List<Variant> args) {
    final String s = str(BuiltIn.REPLACE, args.get(0));
    final String from = str(BuiltIn.REPLACE, args.get(1));
    final String to = str(BuiltIn.REPLACE, args.get(2));
    return Variant.ofString(from.isEmpty() ? s : s.replace(from, to));
  }

  /** @see BuiltIn#SPLIT */
  private static Variant split(List<Variant> args) {
    final String s = str(BuiltIn.SPLIT, args.get(0));
    final String delimiter = str(BuiltIn.SPLIT, args.get(1));
    final List<Variant> parts = new ArrayList<>();
    if (delimiter.isEmpty()) {
      s.codePoints()
          .forEach(c -> parts.add(Variant.ofString(new String(
              Character.toChars(c)))));
    } else {
      for (String part : s.split(Pattern.quote(delimiter), -1)) {
        parts.add(Variant.ofString(part));
      }
    }
    if (args.size() < 3) {
      return Variant.ofList(parts);
    }
    final int index = intArg(BuiltIn.SPLIT, args.get(2));
    return index >= 0 && index < parts.size() ? parts.get(index)
        : Variant.NULL;
  }

  /** @see BuiltIn#CONCAT */
  private static Variant concat(List<Variant> args) {
    final StringBuilder b = new StringBuilder();
    for (Variant arg : args) {
      final String s = arg.toStr();
      if (s != null) {
        b.append(s);
      }
    }
    return Variant.ofString(b.toString());
  }

  /** @see BuiltIn#CASE */
  private static Variant caseOf(List<Variant> args) {
    int i = 0;
    for (; i + 1 < args.size(); i += 2) {
      if (args.get(i).isTrue()) {
        return args.get(i + 1);
      }
    }
    return i < args.size() ? args.get(i) : Variant.NULL;
  }

  /** @see BuiltIn#COALESCE */
  private static Variant coalesce(List<Variant> args) {
    for (Variant arg : args) {
      if (!arg.isNull()) {
        return arg;
      }
    }
    return Variant.NULL;
  }

  /** @see BuiltIn#NULLIF */
  private static Variant nullIf(List<Variant> args) {
    final Variant v0 = args.get(0);
    return compare(Op.EQ, v0, args.get(1)).isTrue() ? Variant.NULL : v0;
  }

  /** @see BuiltIn#TONUMBER */
  private static Variant toNumber(List<Variant> args) {
    final Variant v = args.get(0);
    if (v.isNull()) {
      return v;
    }
    final @Nullable Double d = v.toNumber();
    return d == null ? Variant.UNDEFINED : Variant.ofNumber(d);
  }

  /** @see BuiltIn#TOSTRING */
  private static Variant toStringFn(List<Variant> args) {
    final String s = args.get(0).toStr();
    return s == null ? args.get(0) : Variant.ofString(s);
  }

  /** Implementations of built-in functions. */
  public static final ImmutableMap<BuiltIn, Applicable> BUILT_IN_VALUES;

  static {
    final Map<BuiltIn, Applicable> map = new EnumMap<>(BuiltIn.class);
    map.put(BuiltIn.ABS, math1(BuiltIn.ABS, Math::abs));
    map.put(BuiltIn.ROUND, Codes::round);
    map.put(BuiltIn.FLOOR, math1(BuiltIn.FLOOR, Math::floor));
    map.put(BuiltIn.CEIL, math1(BuiltIn.CEIL, Math::ceil));
    map.put(BuiltIn.SQRT, math1(BuiltIn.SQRT, Math::sqrt));
    map.put(BuiltIn.POW, args ->
        Variant.ofNumber(
            Math.pow(num(BuiltIn.POW, args.get(0)),
                num(BuiltIn.POW, args.get(1)))));
    map.put(BuiltIn.LOG, math1(BuiltIn.LOG, Math::log));
    map.put(BuiltIn.LOG10, math1(BuiltIn.LOG10, Math::log10));
    map.put(BuiltIn.EXP, math1(BuiltIn.EXP, Math::exp));
    map.put(BuiltIn.LEN, args ->
        Variant.ofNumber(str(BuiltIn.LEN, args.get(0)).length()));
    map.put(BuiltIn.LOWER,
        string1(BuiltIn.LOWER, s -> s.toLowerCase(Locale.ROOT)));
    map.put(BuiltIn.UPPER,
        string1(BuiltIn.UPPER, s -> s.toUpperCase(Locale.ROOT)));
    map.put(BuiltIn.SUBSTR, Codes::substr);
    map.put(BuiltIn.TRIM, string1(BuiltIn.TRIM, String::strip));
    map.put(BuiltIn.LTRIM, string1(BuiltIn.LTRIM, String::stripLeading));
    map.put(BuiltIn.RTRIM, string1(BuiltIn.RTRIM, String::stripTrailing));
    map.put(BuiltIn.REPLACE, Codes::replace);
    map.put(BuiltIn.SPLIT, Codes::split);
    map.put(BuiltIn.CONCAT, Codes::concat);
    map.put(BuiltIn.IF, args ->
        args.get(0).isTrue() ? args.get(1) : args.get(2));
    map.put(BuiltIn.COALESCE, Codes::coalesce);
    map.put(BuiltIn.NULLIF, Codes::nullIf);
    map.put(BuiltIn.CASE, Codes::caseOf);
    map.put(BuiltIn.CLASSIFY_IP, args -> {
      final Variant v = args.get(0);
      if (v.isNull()) {
        return Variant.NULL;
      }
      final IpClassifier.IpClass ipClass =
          IpClassifier.classify(str(BuiltIn.CLASSIFY_IP, v));
      return ipClass == null ? Variant.NULL
          : Variant.ofString(ipClass.label());
    });
    map.put(BuiltIn.IS_PUBLIC_IP,
        ipPredicate(BuiltIn.IS_PUBLIC_IP,
            c -> c == IpClassifier.IpClass.PUBLIC));
    map.put(BuiltIn.IS_PRIVATE_IP,
        ipPredicate(BuiltIn.IS_PRIVATE_IP,
            c -> c == IpClassifier.IpClass.PRIVATE));
    map.put(BuiltIn.IS_INTERNAL_IP,
        ipPredicate(BuiltIn.IS_INTERNAL_IP,
            IpClassifier.IpClass::isInternal));
    map.put(BuiltIn.IS_LOOPBACK_IP,
        ipPredicate(BuiltIn.IS_LOOPBACK_IP,
            c -> c == IpClassifier.IpClass.LOOPBACK));
    map.put(BuiltIn.IS_LINK_LOCAL_IP,
        ipPredicate(BuiltIn.IS_LINK_LOCAL_IP,
            c -> c == IpClassifier.IpClass.LINK_LOCAL));
    map.put(BuiltIn.IS_MULTICAST_IP,
        ipPredicate(BuiltIn.IS_MULTICAST_IP,
            c -> c == IpClassifier.IpClass.MULTICAST));
    map.put(BuiltIn.IS_RESERVED_IP,
        ipPredicate(BuiltIn.IS_RESERVED_IP,
            c -> c == IpClassifier.IpClass.RESERVED));
    map.put(BuiltIn.TONUMBER, Codes::toNumber);
    map.put(BuiltIn.TOSTRING, Codes::toStringFn);
    map.put(BuiltIn.ISNULL, args -> Variant.ofBool(args.get(0).isNull()));
    map.put(BuiltIn.ISNOTNULL,
        args -> Variant.ofBool(!args.get(0).isNull()));
    for (BuiltIn builtIn : BuiltIn.values()) {
      if (!map.containsKey(builtIn)) {
        throw new AssertionError("no implementation for " + builtIn);
      }
    }
    BUILT_IN_VALUES = ImmutableMap.copyOf(map);
  }

  /** Code that returns a constant value. */
  private static class ConstantCode implements Code {
    private final Variant value;

    ConstantCode(Variant value) {
      this.value = requireNonNull(value);
    }

    @Override
    public Variant eval(Row row) {
      return value;
    }

    @Override
    public boolean isConstant() {
      return true;
    }

    @Override
    public String toString() {
      return "constant(" + value + ")";
    }
  }
}

// End Codes.java
