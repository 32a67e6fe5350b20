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
import java.sql.Timestamp;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.lognog.ast.Ast;
import net.hydromatic.lognog.ast.Op;
import net.hydromatic.lognog.compile.SqlRenderer.Fragment;
import net.hydromatic.lognog.compile.SqlRenderer.SqlType;
import net.hydromatic.lognog.foreign.BackendQuery;
import net.hydromatic.lognog.util.Span;
import net.hydromatic.lognog.util.TimeRange;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds the SQL query that a backend executes, one stage at a time.
 *
 * <p>Each method that adds a stage returns whether it succeeded. If it
 * returns false, the state of the builder is unchanged, and the stage (and
 * every stage after it) must run in the row pipeline.
 *
 * <p>A stage that cannot be combined with the stages already in the current
 * {@code SELECT} (for example, a filter after a {@code LIMIT}) wraps the
 * current query in a derived table. Columns of each level are qualified with
 * the table alias of that level ({@code t0}, {@code t1}, ...), so that an
 * output column never hides a source column of the same name.
 */
public class QueryBuilder {
  private static final DateTimeFormatter DISPLAY_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
          .withZone(ZoneOffset.UTC);

  private final Dialect dialect;
  private final SqlRenderer renderer;
  private int nextAlias;
  private Select select;

  /**
   * Creates a builder whose initial query scans a table.
   *
   * @param dialect SQL dialect
   * @param schema Schema of the table
   * @param tableName Table name, possibly qualified, such as "lognog.logs"
   * @param columns Columns to return
   * @param timeRange Range of timestamps to scan
   */
  public QueryBuilder(Dialect dialect, FieldSchema schema, String tableName,
      Collection<String> columns, TimeRange timeRange) {
    this.dialect = requireNonNull(dialect);
    this.renderer = new SqlRenderer(dialect);
    final String alias = newAlias();
    this.select =
        new Select(alias,
            Fragment.of(SqlType.UNKNOWN, quoteTable(tableName), " AS ", alias));
    schema.entries.values().forEach(entry ->
        select.env.put(entry.name,
            Fragment.of(SqlType.of(entry.type),
                alias + "." + dialect.quoteIdentifier(entry.name))));
    for (String column : columns) {
      select.outputs.put(column, requireNonNull(select.env.get(column)));
    }
    final Fragment timestamp = select.env.get(FieldSchema.TIMESTAMP);
    if (timestamp != null) {
      if (timeRange.earliest != null) {
        select.where.add(
            Fragment.of(SqlType.BOOLEAN, timestamp, " >= ",
                timestampParameter(timeRange.earliest)));
      }
      if (timeRange.latest != null) {
        select.where.add(
            Fragment.of(SqlType.BOOLEAN, timestamp, " <= ",
                timestampParameter(timeRange.latest)));
      }
      // Newest events first, unless a stage says otherwise
      select.orderBy.add(new OrderKey(FieldSchema.TIMESTAMP, timestamp, true));
    }
  }

  private String newAlias() {
    return "t" + nextAlias++;
  }

  private String quoteTable(String tableName) {
    final List<String> parts = new ArrayList<>();
    for (String part : tableName.split("\\.")) {
      parts.add(dialect.quoteIdentifier(part));
    }
    return String.join(".", parts);
  }

  private Fragment timestampParameter(Instant instant) {
    return new Fragment("?", SqlType.DATETIME,
        ImmutableList.of(dialect.timestampParameter(instant)));
  }

  /** Adds a stage to the query; returns false if the stage cannot be
   * translated. {@code rename} stages do not reach the builder. */
  public boolean add(Ast.Stage stage) {
    final Select saved = select.copy();
    final int savedAlias = nextAlias;
    final boolean ok = add2(stage);
    if (!ok) {
      select = saved;
      nextAlias = savedAlias;
    }
    return ok;
  }

  private boolean add2(Ast.Stage stage) {
    switch (stage.op) {
    case SEARCH:
    case WHERE:
      return filter(((Ast.Filter) stage).predicate);

    case EVAL:
      return eval((Ast.Eval) stage);

    case STATS:
      final Ast.Stats stats = (Ast.Stats) stage;
      return aggregate(null, stats.groupBy, stats.aggregates);

    case TIMECHART:
      final Ast.Timechart timechart = (Ast.Timechart) stage;
      return aggregate(timechart.span,
          timechart.splitBy == null ? ImmutableList.of()
              : ImmutableList.of(timechart.splitBy),
          timechart.aggregates);

    case SORT:
      return sort(((Ast.Sort) stage).keys);

    case HEAD:
    case LIMIT:
      final int count = ((Ast.Head) stage).count;
      select.limit = select.limit < 0 ? count : Math.min(select.limit, count);
      return true;

    case DEDUP:
      return dedup(((Ast.FieldList) stage).fields);

    case TABLE:
      return project(((Ast.FieldList) stage).fields);

    case FIELDS:
      final Ast.FieldList fieldList = (Ast.FieldList) stage;
      return fieldList.exclude
          ? exclude(fieldList.fields)
          : project(fieldList.fields);

    case BIN:
      return bin((Ast.Bin) stage);

    default:
      // tail, top, rare and rex need the whole stream or Java regex
      return false;
    }
  }

  private boolean filter(Ast.Exp predicate) {
    if (predicate.op == Op.LITERAL
        && Boolean.TRUE.equals(((Ast.Literal) predicate).value)) {
      return true;
    }
    if ((select.limit >= 0 || select.limitBy != null) && !nest(true)) {
      return false;
    }
    final Fragment fragment = renderer.predicate(predicate, select.env);
    if (fragment == null) {
      return false;
    }
    (select.aggregated ? select.having : select.where).add(fragment);
    return true;
  }

  private boolean eval(Ast.Eval eval) {
    for (Ast.Assignment assignment : eval.assignments) {
      final Fragment fragment = renderer.value(assignment.exp, select.env);
      if (fragment == null) {
        return false;
      }
      select.env.put(assignment.name, fragment);
      select.outputs.put(assignment.name, fragment);
    }
    return true;
  }

  /** Translates {@code stats}, or {@code timechart} if {@code span} is not
   * null. */
  private boolean aggregate(@Nullable Span span, List<Ast.FieldRef> groupBy,
      List<Ast.Aggregate> aggregates) {
    if ((select.aggregated || select.limit >= 0 || select.limitBy != null)
        && !nest(false)) {
      return false;
    }
    final Map<String, Fragment> keys = new LinkedHashMap<>();
    if (span != null) {
      final Fragment timestamp = select.env.get(FieldSchema.TIMESTAMP);
      if (timestamp == null || !dialect.supportsTimeBucket) {
        return false;
      }
      final Fragment bucket = renderer.timeBucket(timestamp, span);
      if (bucket == null) {
        return false;
      }
      // Events with no timestamp belong to no bucket
      select.where.add(
          Fragment.of(SqlType.BOOLEAN, "(", timestamp, " IS NOT NULL)"));
      keys.put(Resolver.TIME_BUCKET, bucket);
    }
    for (Ast.FieldRef field : groupBy) {
      final Fragment key = select.env.get(field.name);
      if (key == null || !isGroupable(key.type)) {
        return false;
      }
      keys.put(field.name, key);
    }
    final Fragment timestamp = select.env.get(FieldSchema.TIMESTAMP);
    final Map<String, Fragment> calls = new LinkedHashMap<>();
    for (Ast.Aggregate aggregate : aggregates) {
      final AggFunction function =
          requireNonNull(AggFunction.lookup(aggregate.function));
      final Fragment arg;
      if (aggregate.field == null) {
        arg = null;
      } else {
        arg = select.env.get(aggregate.field.name);
        if (arg == null) {
          return false;
        }
      }
      final Fragment call = renderer.aggregate(function, arg, timestamp);
      if (call == null) {
        return false;
      }
      calls.put(requireNonNull(aggregate.alias), call);
    }
    select.aggregated = true;
    select.groupBy.addAll(keys.values());
    select.outputs.clear();
    select.outputs.putAll(keys);
    select.outputs.putAll(calls);
    select.env.clear();
    select.env.putAll(select.outputs);
    // Groups are returned in key order, so that results are deterministic
    select.orderBy.clear();
    keys.forEach((name, key) ->
        select.orderBy.add(new OrderKey(name, key, false)));
    return true;
  }

  private static boolean isGroupable(SqlType type) {
    return type != SqlType.LIST && type != SqlType.JSON;
  }

  private boolean sort(List<Ast.SortKey> sortKeys) {
    if ((select.limit >= 0 || select.limitBy != null) && !nest(true)) {
      return false;
    }
    final List<OrderKey> keys = new ArrayList<>();
    for (Ast.SortKey sortKey : sortKeys) {
      final Fragment fragment = select.env.get(sortKey.field.name);
      if (fragment == null || !isGroupable(fragment.type)) {
        return false;
      }
      keys.add(new OrderKey(sortKey.field.name, fragment, sortKey.descending));
    }
    // Sort is stable: the previous order breaks ties
    for (OrderKey key : select.orderBy) {
      if (keys.stream().noneMatch(k -> k.exp.sql.equals(key.exp.sql))) {
        keys.add(key);
      }
    }
    select.orderBy.clear();
    select.orderBy.addAll(keys);
    return true;
  }

  private boolean dedup(List<Ast.FieldRef> fields) {
    if (!dialect.supportsLimitBy || fields.size() != 1) {
      return false;
    }
    if ((select.limit >= 0 || select.limitBy != null) && !nest(true)) {
      return false;
    }
    final Fragment fragment = select.env.get(fields.get(0).name);
    if (fragment == null || !isGroupable(fragment.type)) {
      return false;
    }
    select.limitBy = fragment;
    return true;
  }

  private boolean project(List<Ast.FieldRef> fields) {
    final Map<String, Fragment> outputs = new LinkedHashMap<>();
    for (Ast.FieldRef field : fields) {
      Fragment fragment = select.outputs.get(field.name);
      if (fragment == null) {
        fragment = select.env.get(field.name);
      }
      if (fragment == null) {
        return false;
      }
      outputs.put(field.name, fragment);
    }
    if (outputs.isEmpty()) {
      return false;
    }
    select.outputs.clear();
    select.outputs.putAll(outputs);
    return true;
  }

  private boolean exclude(List<Ast.FieldRef> fields) {
    final Set<String> names = new LinkedHashSet<>(select.outputs.keySet());
    fields.forEach(field -> names.remove(field.name));
    if (names.isEmpty()) {
      return false;
    }
    select.outputs.keySet().retainAll(names);
    return true;
  }

  private boolean bin(Ast.Bin bin) {
    if (!bin.span.isTime()
        || !bin.field.name.equals(FieldSchema.TIMESTAMP)) {
      return false;
    }
    final Fragment timestamp = select.env.get(FieldSchema.TIMESTAMP);
    if (timestamp == null) {
      return false;
    }
    final Fragment bucket = renderer.timeBucket(timestamp, bin.span);
    if (bucket == null) {
      return false;
    }
    select.env.put(FieldSchema.TIMESTAMP, bucket);
    if (select.outputs.containsKey(FieldSchema.TIMESTAMP)) {
      select.outputs.put(FieldSchema.TIMESTAMP, bucket);
    }
    return true;
  }

  /**
   * Makes the current query a derived table, and starts a new query that
   * reads from it.
   *
   * @param keepOrder Whether the new query must return rows in the same
   *   order; if so, fails unless every sort key is an output column
   */
  private boolean nest(boolean keepOrder) {
    if (keepOrder) {
      for (OrderKey key : select.orderBy) {
        if (!isOutput(select, key)) {
          return false;
        }
      }
    }
    final boolean innerOrder = select.limit >= 0 || select.limitBy != null;
    final Fragment inner = toSql(select, innerOrder, select.limit);
    final String alias = newAlias();
    final Select outer =
        new Select(alias,
            Fragment.of(SqlType.UNKNOWN, "(", inner, ") AS ", alias));
    select.outputs.forEach((name, fragment) -> {
      final Fragment ref =
          Fragment.of(fragment.type,
              alias + "." + dialect.quoteIdentifier(name));
      outer.env.put(name, ref);
      outer.outputs.put(name, ref);
    });
    if (keepOrder) {
      for (OrderKey key : select.orderBy) {
        outer.orderBy.add(
            new OrderKey(key.name, requireNonNull(outer.env.get(key.name)),
                key.descending));
      }
    }
    select = outer;
    return true;
  }

  /** Whether a sort key is an output column of a query, with the same
   * value; if so, it survives nesting. */
  private static boolean isOutput(Select select, OrderKey key) {
    final Fragment output = select.outputs.get(key.name);
    return output != null && output.sql.equals(key.exp.sql);
  }

  /**
   * Returns the backend query.
   *
   * @param residual Whether stages will run in the row pipeline after the
   *   backend query
   * @param defaultLimit Number of raw events to return if there are no
   *   residual stages and no {@code head}
   * @param maxRows Maximum number of rows to return if there are residual
   *   stages
   */
  public BackendQuery build(boolean residual, int defaultLimit, int maxRows) {
    int limit = select.limit;
    boolean capped = false;
    if (residual) {
      if (limit < 0 || limit > maxRows) {
        limit = maxRows;
        capped = true;
      }
    } else if (limit < 0 && !select.aggregated) {
      limit = defaultLimit;
      capped = true;
    }
    final Fragment sql = toSql(select, true, limit);
    final Set<String> datetimeColumns = new LinkedHashSet<>();
    select.outputs.forEach((name, fragment) -> {
      if (fragment.type == SqlType.DATETIME) {
        datetimeColumns.add(name);
      }
    });
    return new BackendQuery(sql.sql, sql.params,
        ImmutableList.copyOf(select.outputs.keySet()), datetimeColumns, limit,
        capped);
  }

  /** Renders a query as SQL. */
  private Fragment toSql(Select select, boolean withOrder, int limit) {
    final List<Object> parts = new ArrayList<>();
    parts.add("SELECT ");
    String sep = "";
    for (Map.Entry<String, Fragment> output : select.outputs.entrySet()) {
      parts.add(sep);
      parts.add(output.getValue());
      parts.add(" AS ");
      parts.add(dialect.quoteIdentifier(output.getKey()));
      sep = ", ";
    }
    parts.add(" FROM ");
    parts.add(select.from);
    list(parts, " WHERE ", " AND ", select.where);
    list(parts, " GROUP BY ", ", ", select.groupBy);
    list(parts, " HAVING ", " AND ", select.having);
    if (withOrder && !select.orderBy.isEmpty()) {
      parts.add(" ORDER BY ");
      sep = "";
      for (OrderKey key : select.orderBy) {
        parts.add(sep);
        if (isOutput(select, key)) {
          parts.add(dialect.quoteIdentifier(key.name));
        } else {
          parts.add(key.exp);
        }
        parts.add(key.descending ? " DESC NULLS LAST" : " ASC NULLS LAST");
        sep = ", ";
      }
    }
    if (select.limitBy != null) {
      parts.add(" LIMIT 1 BY ");
      parts.add(select.limitBy);
    }
    if (limit >= 0) {
      parts.add(dialect == Dialect.ANSI
          ? " FETCH FIRST " + limit + " ROWS ONLY"
          : " LIMIT " + limit);
    }
    return Fragment.of(SqlType.UNKNOWN, parts.toArray());
  }

  private static void list(List<Object> parts, String prefix, String sep,
      List<Fragment> fragments) {
    for (int i = 0; i < fragments.size(); i++) {
      parts.add(i == 0 ? prefix : sep);
      parts.add(fragments.get(i));
    }
  }

  /**
   * Returns SQL with each {@code ?} replaced by the literal value of its
   * parameter, for display. Question marks inside quoted strings and
   * identifiers are left alone.
   */
  public static String displaySql(Dialect dialect, String sql,
      List<Object> params) {
    final StringBuilder b = new StringBuilder();
    char quote = 0;
    int p = 0;
    for (int i = 0; i < sql.length(); i++) {
      final char c = sql.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
        b.append(c);
      } else if (c == '\'' || c == '"' || c == '`') {
        quote = c;
        b.append(c);
      } else if (c == '?' && p < params.size()) {
        b.append(literal(dialect, params.get(p++)));
      } else {
        b.append(c);
      }
    }
    return b.toString();
  }

  private static String literal(Dialect dialect, @Nullable Object o) {
    if (o == null) {
      return "NULL";
    }
    if (o instanceof Timestamp) {
      return dialect.quoteString(
          DISPLAY_TIMESTAMP.format(((Timestamp) o).toInstant()));
    }
    if (o instanceof Number || o instanceof Boolean) {
      return o.toString();
    }
    return dialect.quoteString(o.toString());
  }

  /** Sort key of a query. */
  private static class OrderKey {
    final String name;
    final Fragment exp;
    final boolean descending;

    OrderKey(String name, Fragment exp, boolean descending) {
      this.name = requireNonNull(name);
      this.exp = requireNonNull(exp);
      this.descending = descending;
    }
  }

  /** State of one level of the query. */
  private static class Select {
    final String alias;
    final Fragment from;
    /** Fields visible to the next stage, and the expressions that compute
     * them. */
    final Map<String, Fragment> env = new LinkedHashMap<>();
    /** Columns returned by the query. */
    final Map<String, Fragment> outputs = new LinkedHashMap<>();
    final List<Fragment> where = new ArrayList<>();
    final List<Fragment> groupBy = new ArrayList<>();
    boolean aggregated;
    final List<Fragment> having = new ArrayList<>();
    final List<OrderKey> orderBy = new ArrayList<>();
    /** Key of {@code LIMIT 1 BY}, or null. */
    @Nullable Fragment limitBy;
    int limit = -1;

    Select(String alias, Fragment from) {
      this.alias = requireNonNull(alias);
      this.from = requireNonNull(from);
    }

    Select copy() {
      final Select s = new Select(alias, from);
      s.env.putAll(env);
      s.outputs.putAll(outputs);
      s.where.addAll(where);
      s.groupBy.addAll(groupBy);
      s.aggregated = aggregated;
      s.having.addAll(having);
      s.orderBy.addAll(orderBy);
      s.limitBy = limitBy;
      s.limit = limit;
      return s;
    }
  }
}

// End QueryBuilder.java
