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

import com.google.common.collect.ImmutableSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.EnumSet;
import java.util.Set;
import net.hydromatic.lognog.ast.Op;
import net.hydromatic.lognog.util.Span;
import org.apache.calcite.sql.SqlDialect;
import org.apache.calcite.sql.dialect.AnsiSqlDialect;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * SQL dialect of a backend store.
 *
 * <p>A dialect knows how to quote identifiers and literals (delegating to a
 * Calcite {@link SqlDialect}), and which functions, aggregates and operators
 * it can evaluate with the same semantics as the row pipeline. Anything else
 * stays in the row pipeline.
 */
public enum Dialect {
  /** ClickHouse, the default store. */
  CLICKHOUSE(SqlDialect.DatabaseProduct.CLICKHOUSE.getDialect(),
      EnumSet.complementOf(EnumSet.of(BuiltIn.SPLIT)),
      EnumSet.of(AggFunction.COUNT, AggFunction.DC, AggFunction.SUM,
          AggFunction.AVG, AggFunction.MIN, AggFunction.MAX, AggFunction.P50,
          AggFunction.P90, AggFunction.P95, AggFunction.P99,
          AggFunction.MEDIAN, AggFunction.STDDEV,
          AggFunction.VARIANCE, AggFunction.RANGE, AggFunction.EARLIEST,
          AggFunction.LATEST, AggFunction.VALUES),
      EnumSet.of(Op.PLUS, Op.MINUS, Op.TIMES, Op.DIVIDE, Op.MOD),
      true, true, true),

  /** SQLite, used by the single-node "lite" deployment. Timestamps are
   * stored as text. */
  SQLITE(standard(),
      EnumSet.of(BuiltIn.ABS, BuiltIn.ROUND, BuiltIn.LEN, BuiltIn.LOWER,
          BuiltIn.UPPER, BuiltIn.SUBSTR, BuiltIn.TRIM, BuiltIn.LTRIM,
          BuiltIn.RTRIM, BuiltIn.REPLACE, BuiltIn.CONCAT, BuiltIn.IF,
          BuiltIn.COALESCE, BuiltIn.NULLIF, BuiltIn.CASE, BuiltIn.ISNULL,
          BuiltIn.ISNOTNULL),
      EnumSet.of(AggFunction.COUNT, AggFunction.DC, AggFunction.SUM,
          AggFunction.AVG, AggFunction.MIN, AggFunction.MAX,
          AggFunction.RANGE),
      EnumSet.of(Op.PLUS, Op.MINUS, Op.TIMES, Op.DIVIDE),
      false, true, false),

  /** Standard SQL, for other JDBC stores. Has no time bucketing, so
   * {@code timechart} and {@code bin} run in the row pipeline. */
  ANSI(standard(),
      EnumSet.of(BuiltIn.ABS, BuiltIn.FLOOR, BuiltIn.CEIL, BuiltIn.LEN,
          BuiltIn.LOWER, BuiltIn.UPPER, BuiltIn.TRIM, BuiltIn.LTRIM,
          BuiltIn.RTRIM, BuiltIn.CONCAT, BuiltIn.IF, BuiltIn.COALESCE,
          BuiltIn.NULLIF, BuiltIn.CASE, BuiltIn.ISNULL, BuiltIn.ISNOTNULL),
      EnumSet.of(AggFunction.COUNT, AggFunction.DC, AggFunction.SUM,
          AggFunction.AVG, AggFunction.MIN, AggFunction.MAX,
          AggFunction.STDDEV, AggFunction.VARIANCE, AggFunction.RANGE),
      EnumSet.of(Op.PLUS, Op.MINUS, Op.TIMES, Op.DIVIDE),
      false, false, false);

  private static final DateTimeFormatter SQLITE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
          .withZone(ZoneOffset.UTC);

  /** Calcite dialect, used to quote identifiers and strings. */
  public final SqlDialect sqlDialect;
  private final ImmutableSet<BuiltIn> functions;
  private final ImmutableSet<AggFunction> aggregates;
  private final ImmutableSet<Op> arithmetic;
  /** Whether the dialect has a regular expression match function. */
  public final boolean supportsRegex;
  /** Whether the dialect can truncate timestamps to a bucket. */
  public final boolean supportsTimeBucket;
  /** Whether the dialect supports {@code LIMIT n BY column}, so that
   * single-field {@code dedup} can be pushed down. */
  public final boolean supportsLimitBy;

  Dialect(SqlDialect sqlDialect, Set<BuiltIn> functions,
      Set<AggFunction> aggregates, Set<Op> arithmetic, boolean supportsRegex,
      boolean supportsTimeBucket, boolean supportsLimitBy) {
    this.sqlDialect = sqlDialect;
    this.functions = ImmutableSet.copyOf(functions);
    this.aggregates = ImmutableSet.copyOf(aggregates);
    this.arithmetic = ImmutableSet.copyOf(arithmetic);
    this.supportsRegex = supportsRegex;
    this.supportsTimeBucket = supportsTimeBucket;
    this.supportsLimitBy = supportsLimitBy;
  }

  /** Returns a Calcite dialect that quotes identifiers with double quotes,
   * as standard SQL and SQLite do. */
  private static SqlDialect standard() {
    return new AnsiSqlDialect(
        AnsiSqlDialect.DEFAULT_CONTEXT.withIdentifierQuoteString("\""));
  }

  /** Returns whether this dialect can evaluate a function. */
  public boolean supports(BuiltIn builtIn) {
    return functions.contains(builtIn);
  }

  /** Returns whether this dialect can evaluate an aggregate function. */
  public boolean supports(AggFunction function) {
    return aggregates.contains(function);
  }

  /** Returns whether this dialect can evaluate an arithmetic operator. */
  public boolean supports(Op op) {
    return arithmetic.contains(op);
  }

  /** Quotes an identifier, e.g. {@code `message`} or {@code "message"}. */
  public String quoteIdentifier(String name) {
    return sqlDialect.quoteIdentifier(name);
  }

  /** Quotes a string literal, e.g. {@code 'it''s'}. */
  public String quoteString(String value) {
    final StringBuilder buf = new StringBuilder();
    sqlDialect.quoteStringLiteral(buf, null, value);
    return buf.toString();
  }

  /** Returns the value to bind to a parameter that is compared with the
   * timestamp column. */
  public Object timestampParameter(Instant instant) {
    if (this == SQLITE) {
      return SQLITE_TIMESTAMP.format(instant);
    }
    return Timestamp.from(instant);
  }

  /** Returns an expression that truncates a timestamp to the start of its
   * bucket, aligned to the epoch; or null if not supported. */
  public @Nullable String timeBucket(String exp, Span span) {
    final long seconds = span.seconds();
    switch (this) {
    case CLICKHOUSE:
      return "toDateTime(intDiv(toUnixTimestamp(" + exp + "), " + seconds
          + ") * " + seconds + ", 'UTC')";
    case SQLITE:
      return "datetime((CAST(strftime('%s', " + exp + ") AS INTEGER) / "
          + seconds + ") * " + seconds + ", 'unixepoch')";
    default:
      return null;
    }
  }

  /** Returns an expression that converts a number to floating point, so that
   * division is not integer division. */
  public String toDouble(String exp) {
    switch (this) {
    case CLICKHOUSE:
      return "toFloat64(" + exp + ")";
    case SQLITE:
      return "CAST(" + exp + " AS REAL)";
    default:
      return "CAST(" + exp + " AS DOUBLE PRECISION)";
    }
  }

  /** Returns an expression that gives a string parameter a type, or the
   * parameter itself if the dialect can infer its type. */
  public String typedParam(int length) {
    switch (this) {
    case CLICKHOUSE:
      return "?";
    case SQLITE:
      return "CAST(? AS TEXT)";
    default:
      return "CAST(? AS VARCHAR(" + Math.max(1, length) + "))";
    }
  }
}

// End Dialect.java
