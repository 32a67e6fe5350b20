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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.hydromatic.lognog.compile.AggFunction;
import net.hydromatic.lognog.compile.FieldSchema;
import net.hydromatic.lognog.compile.Resolver;
import net.hydromatic.lognog.util.Span;
import org.apache.calcite.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Implementations of {@link RowSink}. */
public abstract class RowSinks {
  /** Number of rows between checks of the cancellation token. */
  static final int CHECK_INTERVAL = 1024;

  private RowSinks() {}

  /** Creates a {@link RowSink} that starts the chain and checks for
   * cancellation as rows flow through it. */
  public static RowSink first(RowSink rowSink,
      CancellationToken cancellationToken) {
    return new FirstRowSink(rowSink, cancellationToken);
  }

  /** Creates a {@link RowSink} for a {@code search} or {@code where} stage.
   * A row passes only if the condition is true. */
  public static RowSink where(Code filterCode, RowSink rowSink) {
    return new WhereRowSink(filterCode, rowSink);
  }

  /** Creates a {@link RowSink} for an {@code eval} stage. Each assignment
   * sees the fields set by earlier assignments. */
  public static RowSink eval(List<Pair<String, Code>> assignments,
      RowSink rowSink) {
    return new EvalRowSink(ImmutableList.copyOf(assignments), rowSink);
  }

  /** Creates a {@link RowSink} for a {@code stats} stage. */
  public static RowSink stats(List<String> groupBy,
      List<AggregateCall> aggregates, RowSink rowSink) {
    return new StatsRowSink(ImmutableList.copyOf(groupBy),
        ImmutableList.copyOf(aggregates), rowSink);
  }

  /** Creates a {@link RowSink} for a {@code timechart} stage. */
  public static RowSink timechart(Span span, @Nullable String splitBy,
      List<AggregateCall> aggregates, RowSink rowSink) {
    return new TimechartRowSink(span, splitBy,
        ImmutableList.copyOf(aggregates), rowSink);
  }

  /** Creates a {@link RowSink} for a {@code sort} stage; the sort is
   * stable. */
  public static RowSink sort(List<String> names, List<Boolean> descending,
      RowSink rowSink) {
    return new SortRowSink(Comparators.rowComparator(names, descending),
        rowSink);
  }

  /** Creates a {@link RowSink} for a {@code head} or {@code limit}
   * stage. */
  public static RowSink head(int count, RowSink rowSink) {
    return new HeadRowSink(count, rowSink);
  }

  /** Creates a {@link RowSink} for a {@code tail} stage. */
  public static RowSink tail(int count, RowSink rowSink) {
    return new TailRowSink(count, rowSink);
  }

  /** Creates a {@link RowSink} for a {@code dedup} stage. */
  public static RowSink dedup(List<String> names, RowSink rowSink) {
    return new DedupRowSink(ImmutableList.copyOf(names), rowSink);
  }

  /** Creates a {@link RowSink} for a {@code table} or {@code fields +}
   * stage. */
  public static RowSink project(List<String> names, RowSink rowSink) {
    return new ProjectRowSink(ImmutableList.copyOf(names), rowSink);
  }

  /** Creates a {@link RowSink} for a {@code fields -} stage. */
  public static RowSink exclude(List<String> names, RowSink rowSink) {
    return new ExcludeRowSink(ImmutableList.copyOf(names), rowSink);
  }

  /** Creates a {@link RowSink} for a {@code top} or {@code rare} stage. */
  public static RowSink top(boolean top, int count, String name,
      RowSink rowSink) {
    return new TopRowSink(top, count, name, rowSink);
  }

  /** Creates a {@link RowSink} for a {@code bin} stage. */
  public static RowSink bin(Span span, String name, RowSink rowSink) {
    return new BinRowSink(span, name, rowSink);
  }

  /** Creates a {@link RowSink} for a {@code rex} stage. */
  public static RowSink rex(String name, Pattern pattern,
      Map<String, Integer> groups, RowSink rowSink) {
    return new RexRowSink(name, pattern, ImmutableMap.copyOf(groups),
        rowSink);
  }

  /** Creates a {@link RowSink} that collects rows; the last in a chain. */
  public static RowSink collect() {
    return new CollectRowSink();
  }

  /** Call to an aggregate function in {@code stats} or {@code timechart}. */
  public static class AggregateCall {
    public final AggFunction function;
    /** Field that is aggregated, or null for {@code count}. */
    public final @Nullable String field;
    public final String alias;

    public AggregateCall(AggFunction function, @Nullable String field,
        String alias) {
      this.function = requireNonNull(function);
      this.field = field;
      this.alias = requireNonNull(alias);
    }

    @Override
    public String toString() {
      return function.name + (field == null ? "" : "(" + field + ")")
          + " as " + alias;
    }
  }

  /** Abstract implementation for row sinks that have one successor. */
  private abstract static class BaseRowSink implements RowSink {
    final RowSink rowSink;

    BaseRowSink(RowSink rowSink) {
      this.rowSink = requireNonNull(rowSink);
    }

    @Override
    public void start() {
      rowSink.start();
    }

    @Override
    public void accept(Row row) {
      rowSink.accept(row);
    }

    @Override
    public List<Row> result() {
      return rowSink.result();
    }
  }

  /** First row sink in the chain. */
  private static class FirstRowSink extends BaseRowSink {
    final CancellationToken cancellationToken;
    int count;

    FirstRowSink(RowSink rowSink, CancellationToken cancellationToken) {
      super(rowSink);
      this.cancellationToken = requireNonNull(cancellationToken);
    }

    @Override
    public void start() {
      cancellationToken.check();
      count = 0;
      super.start();
    }

    @Override
    public void accept(Row row) {
      if (++count % CHECK_INTERVAL == 0) {
        cancellationToken.check();
      }
      rowSink.accept(row);
    }

    @Override
    public List<Row> result() {
      cancellationToken.check();
      return rowSink.result();
    }
  }

  /** Implementation of {@link RowSink} for a {@code where} stage. */
  private static class WhereRowSink extends BaseRowSink {
    final Code filterCode;

    WhereRowSink(Code filterCode, RowSink rowSink) {
      super(rowSink);
      this.filterCode = requireNonNull(filterCode);
    }

    @Override
    public void accept(Row row) {
      if (filterCode.eval(row).isTrue()) {
        rowSink.accept(row);
      }
    }
  }

  /** Implementation of {@link RowSink} for an {@code eval} stage. */
  private static class EvalRowSink extends BaseRowSink {
    final ImmutableList<Pair<String, Code>> assignments;

    EvalRowSink(ImmutableList<Pair<String, Code>> assignments,
        RowSink rowSink) {
      super(rowSink);
      this.assignments = assignments;
    }

    @Override
    public void accept(Row row) {
      Row row2 = row;
      for (Pair<String, Code> assignment : assignments) {
        row2 = row2.with(assignment.left, assignment.right.eval(row2));
      }
      rowSink.accept(row2);
    }
  }

  /** Accumulators for one group. */
  private static class Group {
    final List<Variant> key;
    final List<Aggregates.Accumulator> accumulators = new ArrayList<>();

    Group(List<Variant> key, List<AggregateCall> aggregates) {
      this.key = key;
      aggregates.forEach(a ->
          accumulators.add(Aggregates.accumulator(a.function)));
    }

    void add(List<AggregateCall> aggregates, Row row) {
      final Variant timestamp = row.get(FieldSchema.TIMESTAMP);
      for (int i = 0; i < aggregates.size(); i++) {
        final AggregateCall call = aggregates.get(i);
        final Variant value =
            call.field == null ? Variant.TRUE : row.get(call.field);
        accumulators.get(i).add(value, timestamp);
      }
    }

    void emit(List<String> keyNames, List<AggregateCall> aggregates,
        RowSink rowSink) {
      final Row.Builder b = Row.builder();
      for (int i = 0; i < keyNames.size(); i++) {
        b.set(keyNames.get(i), key.get(i));
      }
      for (int i = 0; i < aggregates.size(); i++) {
        b.set(aggregates.get(i).alias, accumulators.get(i).result());
      }
      rowSink.accept(b.build());
    }
  }

  /** Implementation of {@link RowSink} for a {@code stats} stage. Groups
   * are emitted in the order they are first seen. */
  private static class StatsRowSink extends BaseRowSink {
    final ImmutableList<String> groupBy;
    final ImmutableList<AggregateCall> aggregates;
    final Map<List<Variant>, Group> groups = new LinkedHashMap<>();

    StatsRowSink(ImmutableList<String> groupBy,
        ImmutableList<AggregateCall> aggregates, RowSink rowSink) {
      super(rowSink);
      this.groupBy = groupBy;
      this.aggregates = aggregates;
    }

    @Override
    public void start() {
      groups.clear();
      super.start();
    }

    @Override
    public void accept(Row row) {
      final List<Variant> key = new ArrayList<>(groupBy.size());
      groupBy.forEach(name -> key.add(row.get(name)));
      groups.computeIfAbsent(key, k -> new Group(k, aggregates))
          .add(aggregates, row);
    }

    @Override
    public List<Row> result() {
      if (groups.isEmpty() && groupBy.isEmpty()) {
        // With no group keys, there is always one output row.
        new Group(ImmutableList.of(), aggregates)
            .emit(groupBy, aggregates, rowSink);
      }
      for (Group group : groups.values()) {
        group.emit(groupBy, aggregates, rowSink);
      }
      return rowSink.result();
    }
  }

  /** Implementation of {@link RowSink} for a {@code timechart} stage.
   * Rows with no timestamp are ignored. Output is sorted by bucket, then
   * by the split field. */
  private static class TimechartRowSink extends BaseRowSink {
    final Span span;
    final @Nullable String splitBy;
    final ImmutableList<AggregateCall> aggregates;
    final ImmutableList<String> keyNames;
    final Map<List<Variant>, Group> groups = new LinkedHashMap<>();

    TimechartRowSink(Span span, @Nullable String splitBy,
        ImmutableList<AggregateCall> aggregates, RowSink rowSink) {
      super(rowSink);
      checkArgument(span.isTime(), "not a time span: %s", span);
      this.span = span;
      this.splitBy = splitBy;
      this.aggregates = aggregates;
      this.keyNames = splitBy == null
          ? ImmutableList.of(Resolver.TIME_BUCKET)
          : ImmutableList.of(Resolver.TIME_BUCKET, splitBy);
    }

    @Override
    public void start() {
      groups.clear();
      super.start();
    }

    @Override
    public void accept(Row row) {
      final Instant instant =
          Aggregates.toInstant(row.get(FieldSchema.TIMESTAMP));
      if (instant == null) {
        return;
      }
      final List<Variant> key = new ArrayList<>(2);
      key.add(Variant.ofTimestamp(span.truncate(instant)));
      if (splitBy != null) {
        key.add(row.get(splitBy));
      }
      groups.computeIfAbsent(key, k -> new Group(k, aggregates))
          .add(aggregates, row);
    }

    @Override
    public List<Row> result() {
      final List<Group> list = new ArrayList<>(groups.values());
      Comparator<Group> comparator =
          Comparator.comparing(g -> g.key.get(0), Comparators.ASCENDING);
      if (splitBy != null) {
        comparator =
            comparator.thenComparing(g -> g.key.get(1), Comparators.ASCENDING);
      }
      list.sort(comparator);
      for (Group group : list) {
        group.emit(keyNames, aggregates, rowSink);
      }
      return rowSink.result();
    }
  }

  /** Implementation of {@link RowSink} for a {@code sort} stage. */
  private static class SortRowSink extends BaseRowSink {
    final Comparator<Row> comparator;
    final List<Row> rows = new ArrayList<>();

    SortRowSink(Comparator<Row> comparator, RowSink rowSink) {
      super(rowSink);
      this.comparator = requireNonNull(comparator);
    }

    @Override
    public void start() {
      rows.clear();
      super.start();
    }

    @Override
    public void accept(Row row) {
      rows.add(row);
    }

    @Override
    public List<Row> result() {
      // List.sort is a stable merge sort
      rows.sort(comparator);
      rows.forEach(rowSink::accept);
      return rowSink.result();
    }
  }

  /** Implementation of {@link RowSink} for a {@code head} stage. */
  private static class HeadRowSink extends BaseRowSink {
    final int count;
    int remaining;

    HeadRowSink(int count, RowSink rowSink) {
      super(rowSink);
      this.count = count;
    }

    @Override
    public void start() {
      remaining = count;
      super.start();
    }

    @Override
    public void accept(Row row) {
      if (remaining > 0) {
        --remaining;
        rowSink.accept(row);
      }
    }
  }

  /** Implementation of {@link RowSink} for a {@code tail} stage. Holds at
   * most {@code count} rows. */
  private static class TailRowSink extends BaseRowSink {
    final int count;
    final Deque<Row> rows = new ArrayDeque<>();

    TailRowSink(int count, RowSink rowSink) {
      super(rowSink);
      this.count = count;
    }

    @Override
    public void start() {
      rows.clear();
      super.start();
    }

    @Override
    public void accept(Row row) {
      if (count == 0) {
        return;
      }
      if (rows.size() == count) {
        rows.removeFirst();
      }
      rows.addLast(row);
    }

    @Override
    public List<Row> result() {
      rows.forEach(rowSink::accept);
      return rowSink.result();
    }
  }

  /** Implementation of {@link RowSink} for a {@code dedup} stage. The first
   * row with each combination of values wins. */
  private static class DedupRowSink extends BaseRowSink {
    final ImmutableList<String> names;
    final Set<List<Variant>> seen = new HashSet<>();

    DedupRowSink(ImmutableList<String> names, RowSink rowSink) {
      super(rowSink);
      this.names = names;
    }

    @Override
    public void start() {
      seen.clear();
      super.start();
    }

    @Override
    public void accept(Row row) {
      final List<Variant> key = new ArrayList<>(names.size());
      names.forEach(name -> key.add(row.get(name)));
      if (seen.add(key)) {
        rowSink.accept(row);
      }
    }
  }

  /** Implementation of {@link RowSink} for a {@code table} stage. Missing
   * fields are null. */
  private static class ProjectRowSink extends BaseRowSink {
    final ImmutableList<String> names;

    ProjectRowSink(ImmutableList<String> names, RowSink rowSink) {
      super(rowSink);
      this.names = names;
    }

    @Override
    public void accept(Row row) {
      final Row.Builder b = Row.builder();
      names.forEach(name -> b.set(name, row.get(name)));
      rowSink.accept(b.build());
    }
  }

  /** Implementation of {@link RowSink} for a {@code fields -} stage. */
  private static class ExcludeRowSink extends BaseRowSink {
    final ImmutableList<String> names;

    ExcludeRowSink(ImmutableList<String> names, RowSink rowSink) {
      super(rowSink);
      this.names = names;
    }

    @Override
    public void accept(Row row) {
      final Row.Builder b = row.toBuilder();
      names.forEach(b::remove);
      rowSink.accept(b.build());
    }
  }

  /** Implementation of {@link RowSink} for {@code top} and {@code rare}.
   *
   * <p>Counts each non-null value; emits at most {@code count} rows, ordered
   * by count (descending for top, ascending for rare), ties in the order
   * values were first seen. */
  private static class TopRowSink extends BaseRowSink {
    final boolean top;
    final int count;
    final String name;
    final Map<Variant, long[]> counts = new LinkedHashMap<>();
    long total;

    TopRowSink(boolean top, int count, String name, RowSink rowSink) {
      super(rowSink);
      this.top = top;
      this.count = count;
      this.name = requireNonNull(name);
    }

    @Override
    public void start() {
      counts.clear();
      total = 0;
      super.start();
    }

    @Override
    public void accept(Row row) {
      final Variant value = row.get(name);
      if (value.isNull()) {
        return;
      }
      counts.computeIfAbsent(value, k -> new long[1])[0]++;
      ++total;
    }

    @Override
    public List<Row> result() {
      final List<Map.Entry<Variant, long[]>> entries =
          new ArrayList<>(counts.entrySet());
      final Comparator<Map.Entry<Variant, long[]>> byCount =
          Comparator.comparingLong(e -> e.getValue()[0]);
      entries.sort(top ? byCount.reversed() : byCount);
      for (Map.Entry<Variant, long[]> e
          : entries.subList(0, Math.min(count, entries.size()))) {
        final long n = e.getValue()[0];
        rowSink.accept(
            Row.builder()
                .set(name, e.getKey())
                .set(Resolver.COUNT, Variant.ofNumber(n))
                .set(Resolver.PERCENT, Variant.ofNumber(n * 100d / total))
                .build());
      }
      return rowSink.result();
    }
  }

  /** Implementation of {@link RowSink} for a {@code bin} stage. Replaces
   * the value of the field with the start of its bucket. */
  private static class BinRowSink extends BaseRowSink {
    final Span span;
    final String name;

    BinRowSink(Span span, String name, RowSink rowSink) {
      super(rowSink);
      this.span = requireNonNull(span);
      this.name = requireNonNull(name);
    }

    @Override
    public void accept(Row row) {
      final Variant value = row.get(name);
      if (value.isNull()) {
        rowSink.accept(row);
        return;
      }
      final Variant bucket;
      if (span.isTime()) {
        final Instant instant = Aggregates.toInstant(value);
        bucket = instant == null ? Variant.UNDEFINED
            : Variant.ofTimestamp(span.truncate(instant));
      } else {
        final Double d = value.toNumber();
        bucket = d == null ? Variant.UNDEFINED
            : Variant.ofNumber(span.floor(d));
      }
      rowSink.accept(row.with(name, bucket));
    }
  }

  /** Implementation of {@link RowSink} for a {@code rex} stage. Rows that
   * do not match pass through unchanged. */
  private static class RexRowSink extends BaseRowSink {
    final String name;
    final Pattern pattern;
    final ImmutableMap<String, Integer> groups;

    RexRowSink(String name, Pattern pattern,
        ImmutableMap<String, Integer> groups, RowSink rowSink) {
      super(rowSink);
      this.name = requireNonNull(name);
      this.pattern = requireNonNull(pattern);
      this.groups = requireNonNull(groups);
    }

    @Override
    public void accept(Row row) {
      final String s = row.get(name).toStr();
      if (s == null) {
        rowSink.accept(row);
        return;
      }
      final Matcher matcher = pattern.matcher(s);
      if (!matcher.find()) {
        rowSink.accept(row);
        return;
      }
      final Row.Builder b = row.toBuilder();
      groups.forEach((group, i) -> {
        final String value = matcher.group(i);
        if (value != null) {
          b.set(group, Variant.ofString(value));
        }
      });
      rowSink.accept(b.build());
    }
  }

  /** Implementation of {@link RowSink} that collects rows. */
  private static class CollectRowSink implements RowSink {
    final List<Row> rows = new ArrayList<>();

    @Override
    public void start() {
      rows.clear();
    }

    @Override
    public void accept(Row row) {
      rows.add(row);
    }

    @Override
    public List<Row> result() {
      return rows;
    }
  }
}

// End RowSinks.java
