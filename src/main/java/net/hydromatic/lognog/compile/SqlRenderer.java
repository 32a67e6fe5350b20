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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import net.hydromatic.lognog.ast.Ast;
import net.hydromatic.lognog.ast.Op;
import net.hydromatic.lognog.util.IpClassifier;
import net.hydromatic.lognog.util.Span;
import net.hydromatic.lognog.util.Wildcards;
import org.apache.calcite.util.ControlFlowException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Translates resolved expressions and aggregate calls to SQL fragments in a
 * particular {@link Dialect}.
 *
 * <p>Field references are looked up in an environment that maps each
 * visible field to the SQL expression that computes it; so a field defined
 * by {@code eval} is inlined wherever it is used.
 *
 * <p>User strings are never written into the SQL text; each becomes a
 * {@code ?} parameter. Numbers are inlined.
 *
 * <p>An expression that the dialect cannot evaluate with the same semantics
 * as the row pipeline is not translated; the methods return null, and the
 * stage that contains it runs in the row pipeline.
 */
public class SqlRenderer {
  /** Built-in functions that are undefined, rather than null, if an argument
   * is null. */
  private static final Set<BuiltIn> NULL_STRICT =
      Sets.immutableEnumSet(BuiltIn.ABS, BuiltIn.ROUND, BuiltIn.FLOOR,
          BuiltIn.CEIL, BuiltIn.LEN, BuiltIn.LOWER, BuiltIn.UPPER,
          BuiltIn.SUBSTR, BuiltIn.TRIM, BuiltIn.LTRIM, BuiltIn.RTRIM,
          BuiltIn.REPLACE);

  /** Built-in functions that are undefined for some numbers, such as the
   * logarithm of a negative number. */
  private static final Set<BuiltIn> PARTIAL =
      Sets.immutableEnumSet(BuiltIn.SQRT, BuiltIn.POW, BuiltIn.LOG,
          BuiltIn.LOG10, BuiltIn.EXP);

  private final Dialect dialect;
  /** Whether to refuse expressions whose value in SQL would be null where
   * the row pipeline gives undefined. */
  private final boolean strict;

  public SqlRenderer(Dialect dialect) {
    this(dialect, false);
  }

  private SqlRenderer(Dialect dialect, boolean strict) {
    this.dialect = requireNonNull(dialect);
    this.strict = strict;
  }

  /** Translates a predicate; returns null if it cannot be translated. */
  public @Nullable Fragment predicate(Ast.Exp exp,
      Map<String, Fragment> env) {
    try {
      final Fragment fragment = exp(exp, env);
      if (fragment.type != SqlType.BOOLEAN) {
        return null;
      }
      return fragment;
    } catch (NotPushable e) {
      return null;
    }
  }

  /** Translates an expression; returns null if it cannot be translated. */
  public @Nullable Fragment expression(Ast.Exp exp,
      Map<String, Fragment> env) {
    try {
      return exp(exp, env);
    } catch (NotPushable e) {
      return null;
    }
  }

  /**
   * Translates an expression whose value is a column of the result, such as
   * an {@code eval} assignment; returns null if it cannot be translated.
   *
   * <p>In a predicate, null and undefined both fail to match; in a value they
   * differ. The row pipeline gives undefined for division or modulo by zero
   * and for a {@link #NULL_STRICT} function of null, where SQL gives null, so
   * such expressions are not translated unless the divisor is a non-zero
   * literal and the arguments cannot be null. A string parameter gets a
   * type, because some databases cannot infer the type of a bare parameter
   * in the {@code SELECT} list.
   */
  public @Nullable Fragment value(Ast.Exp exp, Map<String, Fragment> env) {
    final SqlRenderer renderer = new SqlRenderer(dialect, true);
    try {
      final Fragment fragment = renderer.exp(exp, env);
      if (fragment.type == SqlType.NULL) {
        return null;
      }
      return renderer.typed(fragment);
    } catch (NotPushable e) {
      return null;
    }
  }

  /**
   * Translates a call to an aggregate function; returns null if it cannot be
   * translated.
   *
   * @param function Aggregate function
   * @param arg Argument, or null for {@code count}
   * @param timestamp Expression for the timestamp, or null if the timestamp
   *   is not available
   */
  public @Nullable Fragment aggregate(AggFunction function,
      @Nullable Fragment arg, @Nullable Fragment timestamp) {
    if (!dialect.supports(function)) {
      return null;
    }
    final boolean ch = dialect == Dialect.CLICKHOUSE;
    if (arg == null) {
      if (function != AggFunction.COUNT) {
        return null;
      }
      return Fragment.of(SqlType.NUMBER, ch ? "count()" : "COUNT(*)");
    }
    switch (function) {
    case COUNT:
      return Fragment.of(SqlType.NUMBER, ch ? "count(" : "COUNT(", arg, ")");
    case DC:
      return Fragment.of(SqlType.NUMBER,
          ch ? "uniqExact(" : "COUNT(DISTINCT ", arg, ")");
    case SUM:
      return numeric(arg)
          ? Fragment.of(SqlType.NUMBER, ch ? "sumOrNull(" : "SUM(", arg, ")")
          : null;
    case AVG:
      if (!numeric(arg)) {
        return null;
      }
      return ch
          ? Fragment.of(SqlType.NUMBER, "avgOrNull(", arg, ")")
          : Fragment.of(SqlType.NUMBER, "AVG(", toDouble(arg), ")");
    case MIN:
    case MAX:
      if (!comparable(arg)) {
        return null;
      }
      final String name = function == AggFunction.MIN ? "min" : "max";
      return Fragment.of(arg.type,
          ch ? name + "OrNull(" : name.toUpperCase(Locale.ROOT) + "(", arg,
          ")");
    case RANGE:
      if (!numeric(arg)) {
        return null;
      }
      return ch
          ? Fragment.of(SqlType.NUMBER, "(maxOrNull(", arg, ") - minOrNull(",
              arg, "))")
          : Fragment.of(SqlType.NUMBER, "(MAX(", arg, ") - MIN(", arg, "))");
    case P50:
    case P90:
    case P95:
    case P99:
    case MEDIAN:
      // quantileExactInclusive interpolates linearly, as the row pipeline
      // does
      return numeric(arg)
          ? Fragment.of(SqlType.NUMBER,
              "quantileExactInclusiveOrNull("
                  + requireNonNull(function.percentile) + ")(",
              arg, ")")
          : null;
    case STDDEV:
    case VARIANCE:
      if (!numeric(arg)) {
        return null;
      }
      if (ch) {
        return Fragment.of(SqlType.NUMBER,
            function == AggFunction.STDDEV ? "stddevPopOrNull("
                : "varPopOrNull(",
            arg, ")");
      }
      return Fragment.of(SqlType.NUMBER,
          function == AggFunction.STDDEV ? "STDDEV_POP(" : "VAR_POP(",
          toDouble(arg), ")");
    case EARLIEST:
    case LATEST:
      if (timestamp == null || timestamp.type != SqlType.DATETIME) {
        return null;
      }
      return Fragment.of(arg.type,
          function == AggFunction.EARLIEST ? "argMinOrNull(" : "argMaxOrNull(",
          arg, ", ", timestamp, ")");
    case VALUES:
      return Fragment.of(SqlType.LIST, "arraySort(groupUniqArray(", arg,
          "))");
    default:
      return null;
    }
  }

  /** Returns an expression that truncates a timestamp to the start of its
   * bucket; or null if the dialect cannot. */
  public @Nullable Fragment timeBucket(Fragment timestamp,
      Span span) {
    if (timestamp.type != SqlType.DATETIME || !span.isTime()) {
      return null;
    }
    final String sql = dialect.timeBucket(timestamp.sql, span);
    return sql == null ? null
        : new Fragment(sql, SqlType.DATETIME, timestamp.params);
  }

  private Fragment exp(Ast.Exp exp, Map<String, Fragment> env) {
    switch (exp.op) {
    case FIELD_REF:
      final Fragment fragment = env.get(((Ast.FieldRef) exp).name);
      if (fragment == null) {
        throw NotPushable.INSTANCE;
      }
      return fragment;

    case LITERAL:
      return literal(((Ast.Literal) exp).value);

    case REGEX:
      final Fragment message = env.get(FieldSchema.MESSAGE);
      if (message == null) {
        throw NotPushable.INSTANCE;
      }
      return regex(message, (Ast.Regex) exp);

    case NOT:
      return Fragment.of(SqlType.BOOLEAN, "NOT (",
          bool(exp(((Ast.PrefixCall) exp).a, env)), ")");

    case AND:
    case OR:
      final Ast.InfixCall logic = (Ast.InfixCall) exp;
      return Fragment.of(SqlType.BOOLEAN, "(", bool(exp(logic.a0, env)),
          exp.op == Op.AND ? " AND " : " OR ", bool(exp(logic.a1, env)), ")");

    case NEGATE:
      final Fragment negated = number(exp(((Ast.PrefixCall) exp).a, env));
      return Fragment.of(SqlType.NUMBER, "(- ", negated, ")")
          .withNullable(negated.nullable);

    case PLUS:
    case MINUS:
    case TIMES:
    case DIVIDE:
    case MOD:
      return arithmetic((Ast.InfixCall) exp, env);

    case EQ:
    case NE:
    case LT:
    case LE:
    case GT:
    case GE:
      return comparison((Ast.InfixCall) exp, env);

    case MATCH:
      return match((Ast.InfixCall) exp, env);

    case APPLY:
      return apply((Ast.Apply) exp, env);

    default:
      throw NotPushable.INSTANCE;
    }
  }

  private Fragment literal(@Nullable Object value) {
    if (value == null) {
      return Fragment.of(SqlType.NULL, "NULL");
    }
    if (value instanceof String) {
      return Fragment.param(value);
    }
    if (value instanceof BigDecimal) {
      final String s = ((BigDecimal) value).toPlainString();
      return Fragment.of(SqlType.NUMBER, s.startsWith("-") ? "(" + s + ")" : s)
          .withNullable(false);
    }
    return Fragment.of(SqlType.BOOLEAN, (Boolean) value ? "TRUE" : "FALSE")
        .withNullable(false);
  }

  private Fragment arithmetic(Ast.InfixCall call, Map<String, Fragment> env) {
    if (!dialect.supports(call.op)) {
      throw NotPushable.INSTANCE;
    }
    final Fragment a0 = number(exp(call.a0, env));
    final Fragment a1 = number(exp(call.a1, env));
    final boolean nullable = a0.nullable || a1.nullable;
    switch (call.op) {
    case DIVIDE:
    case MOD:
      if (strict && !nonZeroLiteral(call.a1)) {
        throw NotPushable.INSTANCE;
      }
      if (call.op == Op.MOD) {
        return Fragment.of(SqlType.NUMBER, "(", a0, " % NULLIF(", a1,
            ", 0))");
      }
      // Division by zero yields null, and never integer division
      return Fragment.of(SqlType.NUMBER, "(", toDouble(a0), " / NULLIF(", a1,
          ", 0))");
    default:
      return Fragment.of(SqlType.NUMBER, "(", a0, call.op.padded, a1, ")")
          .withNullable(nullable);
    }
  }

  private Fragment comparison(Ast.InfixCall call, Map<String, Fragment> env) {
    final Fragment a0 = exp(call.a0, env);
    final String wildcard = Compiler.wildcardLiteral(call.a1);
    if (wildcard != null && (call.op == Op.EQ || call.op == Op.NE)) {
      final Fragment f = Wildcards.shape(wildcard) == Wildcards.Shape.ANY
          ? present(a0)
          : like(a0, wildcard, false);
      return call.op == Op.EQ ? f
          : Fragment.of(SqlType.BOOLEAN, "NOT (", f, ")");
    }
    final Fragment a1 = exp(call.a1, env);
    if (a0.type != a1.type
        || a0.type != SqlType.STRING
            && a0.type != SqlType.NUMBER
            && a0.type != SqlType.DATETIME) {
      throw NotPushable.INSTANCE;
    }
    final String op;
    switch (call.op) {
    case EQ:
      op = " = ";
      break;
    case NE:
      op = " <> ";
      break;
    default:
      op = call.op.padded;
    }
    return Fragment.of(SqlType.BOOLEAN, "(", a0, op, a1, ")");
  }

  /** Translates {@code field=*}; true if the value is present and, if it is
   * a string, not empty. */
  private Fragment present(Fragment a) {
    switch (a.type) {
    case STRING:
      return Fragment.of(SqlType.BOOLEAN, "(", a, " IS NOT NULL AND ", a,
          " <> '')");
    case NUMBER:
    case DATETIME:
      return Fragment.of(SqlType.BOOLEAN, "(", a, " IS NOT NULL)");
    default:
      throw NotPushable.INSTANCE;
    }
  }

  /** Translates a wildcard match. */
  private Fragment like(Fragment a, String wildcard, boolean ignoreCase) {
    if (a.type != SqlType.STRING) {
      throw NotPushable.INSTANCE;
    }
    switch (dialect) {
    case CLICKHOUSE:
      // ClickHouse LIKE escapes with backslash, and has no ESCAPE clause
      return Fragment.of(SqlType.BOOLEAN, ignoreCase ? "ilike(" : "like(", a,
          ", ", Fragment.param(Wildcards.toLike(wildcard)), ")");
    case SQLITE:
      if (ignoreCase) {
        return Fragment.of(SqlType.BOOLEAN, "(", a, " LIKE ",
            Fragment.param(Wildcards.toLike(wildcard)), " ESCAPE '\\')");
      }
      // SQLite LIKE ignores case; GLOB does not
      return Fragment.of(SqlType.BOOLEAN, "(", a, " GLOB ",
          Fragment.param(toGlob(wildcard)), ")");
    default:
      if (ignoreCase) {
        return Fragment.of(SqlType.BOOLEAN, "(LOWER(", a, ") LIKE ",
            Fragment.param(
                Wildcards.toLike(wildcard).toLowerCase(Locale.ROOT)),
            " ESCAPE '\\')");
      }
      return Fragment.of(SqlType.BOOLEAN, "(", a, " LIKE ",
          Fragment.param(Wildcards.toLike(wildcard)), " ESCAPE '\\')");
    }
  }

  /** Converts a wildcard value to a SQLite GLOB pattern. */
  static String toGlob(String wildcard) {
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < wildcard.length(); i++) {
      final char c = wildcard.charAt(i);
      switch (c) {
      case '?':
      case '[':
        b.append('[').append(c).append(']');
        break;
      default:
        b.append(c);
      }
    }
    return b.toString();
  }

  private Fragment regex(Fragment a, Ast.Regex regex) {
    if (!dialect.supportsRegex || a.type != SqlType.STRING) {
      throw NotPushable.INSTANCE;
    }
    return Fragment.of(SqlType.BOOLEAN, "match(", a, ", ",
        Fragment.param(regex.regex), ")");
  }

  private Fragment match(Ast.InfixCall call, Map<String, Fragment> env) {
    final Fragment a0 = exp(call.a0, env);
    if (call.a1.op == Op.REGEX) {
      return regex(a0, (Ast.Regex) call.a1);
    }
    final String wildcard = Compiler.wildcardLiteral(call.a1);
    if (wildcard != null) {
      return like(a0, wildcard, true);
    }
    final Fragment a1 = exp(call.a1, env);
    if (a0.type != SqlType.STRING || a1.type != SqlType.STRING) {
      throw NotPushable.INSTANCE;
    }
    switch (dialect) {
    case CLICKHOUSE:
      return Fragment.of(SqlType.BOOLEAN, "(positionCaseInsensitiveUTF8(", a0,
          ", ", a1, ") > 0)");
    case SQLITE:
      return Fragment.of(SqlType.BOOLEAN, "(instr(lower(", a0, "), lower(",
          a1, ")) > 0)");
    default:
      return Fragment.of(SqlType.BOOLEAN, "(POSITION(LOWER(", a1,
          ") IN LOWER(", a0, ")) > 0)");
    }
  }

  private Fragment apply(Ast.Apply apply, Map<String, Fragment> env) {
    final BuiltIn builtIn = requireNonNull(BuiltIn.lookup(apply.name));
    if (!dialect.supports(builtIn)) {
      throw NotPushable.INSTANCE;
    }
    final List<Fragment> args = new ArrayList<>();
    for (Ast.Exp arg : apply.args) {
      args.add(exp(arg, env));
    }
    if (strict && PARTIAL.contains(builtIn)) {
      throw NotPushable.INSTANCE;
    }
    final boolean nullable = nullable(builtIn, args);
    if (strict && nullable && NULL_STRICT.contains(builtIn)) {
      throw NotPushable.INSTANCE;
    }
    return function(builtIn, apply, args).withNullable(nullable);
  }

  /** Returns whether a call to a built-in function may return null. */
  private static boolean nullable(BuiltIn builtIn, List<Fragment> args) {
    switch (builtIn) {
    case CONCAT:
    case ISNULL:
    case ISNOTNULL:
      return false;
    case COALESCE:
      for (Fragment arg : args) {
        if (!arg.nullable) {
          return false;
        }
      }
      return true;
    case IF:
      return args.get(1).nullable || args.get(2).nullable;
    case CASE:
      if (args.size() % 2 == 0) {
        return true; // no default
      }
      for (int i = 1; i < args.size(); i += 2) {
        if (args.get(i).nullable) {
          return true;
        }
      }
      return args.get(args.size() - 1).nullable;
    case TOSTRING:
    case LOWER:
    case UPPER:
    case LEN:
    case ABS:
    case FLOOR:
    case CEIL:
    case ROUND:
    case SUBSTR:
    case TRIM:
    case LTRIM:
    case RTRIM:
    case REPLACE:
      for (Fragment arg : args) {
        if (arg.nullable) {
          return true;
        }
      }
      return false;
    default:
      return true;
    }
  }

  private Fragment function(BuiltIn builtIn, Ast.Apply apply,
      List<Fragment> args) {
    final boolean ch = dialect == Dialect.CLICKHOUSE;
    switch (builtIn) {
    case ABS:
      return call(SqlType.NUMBER, "ABS", number(args.get(0)));
    case ROUND:
      final Fragment digits;
      if (args.size() == 1) {
        digits = Fragment.of(SqlType.NUMBER, "0");
      } else if (apply.args.get(1).op == Op.LITERAL) {
        digits = number(args.get(1));
      } else {
        throw NotPushable.INSTANCE;
      }
      if (ch) {
        // Decimal rounds half away from zero; Float64 would round half to
        // even
        return Fragment.of(SqlType.NUMBER, "toFloat64(round(toDecimal128(",
            number(args.get(0)), ", 10), ", digits, "))");
      }
      return Fragment.of(SqlType.NUMBER, "ROUND(", number(args.get(0)), ", ",
          digits, ")");
    case FLOOR:
      return call(SqlType.NUMBER, "FLOOR", number(args.get(0)));
    case CEIL:
      return call(SqlType.NUMBER, ch ? "ceil" : "CEILING",
          number(args.get(0)));
    case SQRT:
      return call(SqlType.NUMBER, "sqrt", number(args.get(0)));
    case POW:
      return call(SqlType.NUMBER, "pow", number(args.get(0)),
          number(args.get(1)));
    case LOG:
      return call(SqlType.NUMBER, "log", number(args.get(0)));
    case LOG10:
      return call(SqlType.NUMBER, "log10", number(args.get(0)));
    case EXP:
      return call(SqlType.NUMBER, "exp", number(args.get(0)));
    case LEN:
      return call(SqlType.NUMBER,
          ch ? "lengthUTF8" : dialect == Dialect.SQLITE ? "length"
              : "CHAR_LENGTH",
          string(args.get(0)));
    case LOWER:
      return call(SqlType.STRING, ch ? "lowerUTF8" : "LOWER",
          string(args.get(0)));
    case UPPER:
      return call(SqlType.STRING, ch ? "upperUTF8" : "UPPER",
          string(args.get(0)));
    case SUBSTR:
      final List<Fragment> substrArgs = new ArrayList<>();
      substrArgs.add(string(args.get(0)));
      for (Fragment arg : args.subList(1, args.size())) {
        substrArgs.add(number(arg));
      }
      return call(SqlType.STRING, ch ? "substringUTF8" : "substr",
          substrArgs.toArray(new Fragment[0]));
    case TRIM:
    case LTRIM:
    case RTRIM:
      return trim(builtIn, string(args.get(0)));
    case REPLACE:
      return call(SqlType.STRING, ch ? "replaceAll" : "replace",
          string(args.get(0)), string(args.get(1)), string(args.get(2)));
    case CONCAT:
      return concat(args);
    case IF:
      final SqlType ifType = join(args.get(1).type, args.get(2).type);
      if (ch) {
        return Fragment.of(ifType, "if(", bool(args.get(0)), ", ",
            args.get(1), ", ", args.get(2), ")");
      }
      return Fragment.of(ifType, "CASE WHEN ", bool(args.get(0)), " THEN ",
          typed(args.get(1)), " ELSE ", typed(args.get(2)), " END");
    case COALESCE:
      SqlType coalesceType = SqlType.NULL;
      for (Fragment arg : args) {
        coalesceType = join(coalesceType, arg.type);
      }
      final List<Fragment> coalesceArgs = new ArrayList<>();
      for (Fragment arg : args) {
        coalesceArgs.add(typed(arg));
      }
      return call(coalesceType, "COALESCE",
          coalesceArgs.toArray(new Fragment[0]));
    case NULLIF:
      join(args.get(0).type, args.get(1).type);
      return call(args.get(0).type, "NULLIF", typed(args.get(0)),
          args.get(1));
    case CASE:
      return caseOf(args);
    case CLASSIFY_IP:
    case IS_PUBLIC_IP:
    case IS_PRIVATE_IP:
    case IS_INTERNAL_IP:
    case IS_LOOPBACK_IP:
    case IS_LINK_LOCAL_IP:
    case IS_MULTICAST_IP:
    case IS_RESERVED_IP:
      return ip(builtIn, string(args.get(0)));
    case TONUMBER:
      return Fragment.of(SqlType.NUMBER, "toFloat64OrNull(toString(",
          scalar(args.get(0)), "))");
    case TOSTRING:
      return call(SqlType.STRING, "toString", scalar(args.get(0)));
    case ISNULL:
      return Fragment.of(SqlType.BOOLEAN, "(", args.get(0), " IS NULL)");
    case ISNOTNULL:
      return Fragment.of(SqlType.BOOLEAN, "(", args.get(0), " IS NOT NULL)");
    default:
      throw NotPushable.INSTANCE;
    }
  }

  private Fragment trim(BuiltIn builtIn, Fragment arg) {
    switch (dialect) {
    case CLICKHOUSE:
      return call(SqlType.STRING,
          builtIn == BuiltIn.TRIM ? "trimBoth"
              : builtIn == BuiltIn.LTRIM ? "trimLeft"
              : "trimRight",
          arg);
    case SQLITE:
      return call(SqlType.STRING, builtIn.name, arg);
    default:
      return Fragment.of(SqlType.STRING, "TRIM(",
          builtIn == BuiltIn.TRIM ? "BOTH"
              : builtIn == BuiltIn.LTRIM ? "LEADING"
              : "TRAILING",
          " FROM ", arg, ")");
    }
  }

  private Fragment concat(List<Fragment> args) {
    final List<Object> parts = new ArrayList<>();
    if (dialect == Dialect.CLICKHOUSE) {
      parts.add("concat(");
      for (Fragment arg : args) {
        parts.add("ifNull(toString(");
        parts.add(scalar(arg));
        parts.add("), ''), ");
      }
      // concat requires at least two arguments
      parts.add("'')");
    } else {
      parts.add("(");
      for (int i = 0; i < args.size(); i++) {
        parts.add(i == 0 ? "COALESCE(" : " || COALESCE(");
        parts.add(string(args.get(i)));
        parts.add(", '')");
      }
      parts.add(")");
    }
    return Fragment.of(SqlType.STRING, parts.toArray());
  }

  private Fragment caseOf(List<Fragment> args) {
    final List<Object> parts = new ArrayList<>();
    SqlType type = SqlType.NULL;
    final boolean ch = dialect == Dialect.CLICKHOUSE;
    parts.add(ch ? "multiIf(" : "CASE");
    int i = 0;
    for (; i + 1 < args.size(); i += 2) {
      type = join(type, args.get(i + 1).type);
      if (ch) {
        parts.add(bool(args.get(i)));
        parts.add(", ");
        parts.add(args.get(i + 1));
        parts.add(", ");
      } else {
        parts.add(" WHEN ");
        parts.add(bool(args.get(i)));
        parts.add(" THEN ");
        parts.add(typed(args.get(i + 1)));
      }
    }
    final Fragment otherwise =
        i < args.size() ? args.get(i) : Fragment.of(SqlType.NULL, "NULL");
    type = join(type, otherwise.type);
    if (ch) {
      parts.add(otherwise);
      parts.add(")");
    } else {
      parts.add(" ELSE ");
      parts.add(typed(otherwise));
      parts.add(" END");
    }
    return Fragment.of(type, parts.toArray());
  }

  /** Translates an IP function. Only ClickHouse supports these. */
  private Fragment ip(BuiltIn builtIn, Fragment arg) {
    final Fragment ip = Fragment.of(SqlType.UNKNOWN, "toIPv4OrNull(", arg, ")");
    if (builtIn == BuiltIn.CLASSIFY_IP) {
      final List<Object> parts = new ArrayList<>();
      parts.add("multiIf(");
      parts.add(ip);
      parts.add(" IS NULL, NULL, ");
      for (IpClassifier.Range range : IpClassifier.RANGES) {
        parts.add(between(ip, range));
        parts.add(", '" + range.ipClass.label() + "', ");
      }
      parts.add("'" + IpClassifier.IpClass.PUBLIC.label() + "')");
      return Fragment.of(SqlType.STRING, parts.toArray());
    }
    final Predicate<IpClassifier.IpClass> predicate;
    boolean negate = false;
    switch (builtIn) {
    case IS_PUBLIC_IP:
      predicate = c -> true;
      negate = true;
      break;
    case IS_PRIVATE_IP:
      predicate = c -> c == IpClassifier.IpClass.PRIVATE;
      break;
    case IS_INTERNAL_IP:
      predicate = IpClassifier.IpClass::isInternal;
      break;
    case IS_LOOPBACK_IP:
      predicate = c -> c == IpClassifier.IpClass.LOOPBACK;
      break;
    case IS_LINK_LOCAL_IP:
      predicate = c -> c == IpClassifier.IpClass.LINK_LOCAL;
      break;
    case IS_MULTICAST_IP:
      predicate = c -> c == IpClassifier.IpClass.MULTICAST;
      break;
    case IS_RESERVED_IP:
      predicate = c -> c == IpClassifier.IpClass.RESERVED;
      break;
    default:
      throw new AssertionError(builtIn);
    }
    final List<Object> parts = new ArrayList<>();
    parts.add("if(");
    parts.add(ip);
    parts.add(" IS NULL, NULL, ");
    parts.add(negate ? "NOT (" : "(");
    boolean first = true;
    for (IpClassifier.Range range : IpClassifier.RANGES) {
      if (predicate.test(range.ipClass)) {
        if (!first) {
          parts.add(" OR ");
        }
        parts.add(between(ip, range));
        first = false;
      }
    }
    parts.add("))");
    return Fragment.of(SqlType.BOOLEAN, parts.toArray());
  }

  private static Fragment between(Fragment ip, IpClassifier.Range range) {
    return Fragment.of(SqlType.BOOLEAN, "(", ip, " BETWEEN toIPv4('",
        range.low, "') AND toIPv4('", range.high, "'))");
  }

  /** If a fragment is a bare string parameter, gives it a type. */
  private Fragment typed(Fragment f) {
    if (!f.sql.equals("?")) {
      return f;
    }
    final String value = String.valueOf(f.params.get(0));
    return new Fragment(dialect.typedParam(value.length()), f.type, f.params,
        f.nullable);
  }

  private static boolean nonZeroLiteral(Ast.Exp exp) {
    if (exp.op == Op.NEGATE) {
      return nonZeroLiteral(((Ast.PrefixCall) exp).a);
    }
    return exp.op == Op.LITERAL
        && ((Ast.Literal) exp).value instanceof BigDecimal
        && ((BigDecimal) ((Ast.Literal) exp).value).signum() != 0;
  }

  private Fragment toDouble(Fragment f) {
    return new Fragment(dialect.toDouble(f.sql), SqlType.NUMBER, f.params,
        f.nullable);
  }

  private static Fragment call(SqlType type, String name, Fragment... args) {
    final List<Object> parts = new ArrayList<>();
    parts.add(name);
    parts.add("(");
    for (int i = 0; i < args.length; i++) {
      if (i > 0) {
        parts.add(", ");
      }
      parts.add(args[i]);
    }
    parts.add(")");
    return Fragment.of(type, parts.toArray());
  }

  /** Returns the type of an expression that may have either of two types;
   * throws if they are incompatible. */
  private static SqlType join(SqlType t0, SqlType t1) {
    if (t0 == t1 || t1 == SqlType.NULL) {
      return t0;
    }
    if (t0 == SqlType.NULL) {
      return t1;
    }
    throw NotPushable.INSTANCE;
  }

  private static boolean numeric(Fragment f) {
    return f.type == SqlType.NUMBER;
  }

  private static boolean comparable(Fragment f) {
    return f.type == SqlType.NUMBER || f.type == SqlType.STRING
        || f.type == SqlType.DATETIME;
  }

  private static Fragment number(Fragment f) {
    return check(f, SqlType.NUMBER);
  }

  private static Fragment string(Fragment f) {
    return check(f, SqlType.STRING);
  }

  private static Fragment bool(Fragment f) {
    return check(f, SqlType.BOOLEAN);
  }

  private static Fragment scalar(Fragment f) {
    if (f.type != SqlType.STRING && f.type != SqlType.NUMBER) {
      throw NotPushable.INSTANCE;
    }
    return f;
  }

  private static Fragment check(Fragment f, SqlType type) {
    if (f.type != type) {
      throw NotPushable.INSTANCE;
    }
    return f;
  }

  /** Type of a SQL expression, as far as translation needs to know. */
  public enum SqlType {
    STRING,
    NUMBER,
    DATETIME,
    BOOLEAN,
    JSON,
    LIST,
    /** Type of the {@code NULL} literal; compatible with every type. */
    NULL,
    UNKNOWN;

    /** Returns the SQL type of a column of the schema. */
    public static SqlType of(FieldSchema.@Nullable FieldType type) {
      if (type == null) {
        return UNKNOWN;
      }
      switch (type) {
      case STRING:
        return STRING;
      case NUMBER:
        return NUMBER;
      case DATETIME:
        return DATETIME;
      default:
        return JSON;
      }
    }
  }

  /** Fragment of SQL, with the values of the {@code ?} parameters it
   * contains, in order. */
  public static class Fragment {
    public final String sql;
    public final SqlType type;
    public final ImmutableList<Object> params;
    /** Whether the expression may evaluate to null. */
    public final boolean nullable;

    Fragment(String sql, SqlType type, List<Object> params) {
      this(sql, type, params, true);
    }

    Fragment(String sql, SqlType type, List<Object> params,
        boolean nullable) {
      this.sql = requireNonNull(sql);
      this.type = requireNonNull(type);
      this.params = ImmutableList.copyOf(params);
      this.nullable = nullable;
    }

    /** Creates a fragment that is a parameter holding a string. */
    static Fragment param(Object value) {
      return new Fragment("?", SqlType.STRING, ImmutableList.of(value), false);
    }

    /** Creates a fragment from a sequence of strings and fragments. */
    public static Fragment of(SqlType type, Object... parts) {
      final StringBuilder b = new StringBuilder();
      final ImmutableList.Builder<Object> params = ImmutableList.builder();
      for (Object part : parts) {
        if (part instanceof Fragment) {
          b.append(((Fragment) part).sql);
          params.addAll(((Fragment) part).params);
        } else {
          b.append(part);
        }
      }
      return new Fragment(b.toString(), type, params.build());
    }

    /** Returns a copy of this fragment with a different type. */
    public Fragment withType(SqlType type) {
      return new Fragment(sql, type, params, nullable);
    }

    /** Returns a copy of this fragment that may or may not be null. */
    public Fragment withNullable(boolean nullable) {
      return nullable == this.nullable ? this
          : new Fragment(sql, type, params, nullable);
    }

    @Override
    public String toString() {
      return params.isEmpty() ? sql : sql + " " + params;
    }
  }

  /** Thrown when an expression cannot be translated. */
  private static class NotPushable extends ControlFlowException {
    static final NotPushable INSTANCE = new NotPushable();
  }
}

// End SqlRenderer.java
