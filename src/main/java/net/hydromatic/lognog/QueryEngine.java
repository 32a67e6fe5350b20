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
package net.hydromatic.lognog;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.hydromatic.lognog.ast.Ast;
import net.hydromatic.lognog.ast.Pos;
import net.hydromatic.lognog.compile.CompiledQuery;
import net.hydromatic.lognog.compile.Compiler;
import net.hydromatic.lognog.compile.FieldSchema;
import net.hydromatic.lognog.compile.Planner;
import net.hydromatic.lognog.compile.Resolver;
import net.hydromatic.lognog.compile.ValidationException;
import net.hydromatic.lognog.eval.CancellationToken;
import net.hydromatic.lognog.eval.Prop;
import net.hydromatic.lognog.eval.ResultAssembler;
import net.hydromatic.lognog.eval.Row;
import net.hydromatic.lognog.eval.RowSink;
import net.hydromatic.lognog.eval.RowSinks;
import net.hydromatic.lognog.eval.Session;
import net.hydromatic.lognog.foreign.Backend;
import net.hydromatic.lognog.parse.DslParser;
import net.hydromatic.lognog.parse.LogNogParseException;
import net.hydromatic.lognog.util.TimeRange;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes queries written in the LogNog pipe language.
 *
 * <p>A query goes through these phases: parse, resolve (validate field
 * names and functions against the schema), plan (choose which stages run in
 * the backend, and generate SQL), execute the SQL, run the remaining stages
 * in the row pipeline, and assemble the result.
 *
 * <p>An engine is immutable and may be shared by threads; each call to
 * {@link #execute} is independent.
 */
public class QueryEngine {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(QueryEngine.class);

  private final Backend backend;
  private final FieldSchema schema;
  private final ImmutableMap<Prop, Object> map;
  private final Clock clock;

  /**
   * Creates a QueryEngine.
   *
   * @param backend Store that executes SQL
   * @param schema Columns of the log table
   * @param map Property values
   * @param clock Clock used to evaluate relative times such as "-24h"
   */
  public QueryEngine(Backend backend, FieldSchema schema,
      Map<Prop, Object> map, Clock clock) {
    this.backend = requireNonNull(backend);
    this.schema = requireNonNull(schema);
    this.map = ImmutableMap.copyOf(map);
    this.clock = requireNonNull(clock);
  }

  /** Creates a QueryEngine with the default schema and the system clock. */
  public static QueryEngine of(Backend backend, Map<Prop, Object> map) {
    return new QueryEngine(backend, FieldSchema.DEFAULT, map,
        Clock.systemUTC());
  }

  /** Parses a query; throws {@link LogNogParseException} if it is invalid. */
  public Ast.Pipeline parse(String query) {
    return DslParser.parse(query);
  }

  /** Checks a query without executing it; returns a description of the
   * first error, or empty if the query is valid. */
  public Optional<String> validate(String query) {
    try {
      Resolver.of(schema).resolve(parse(query));
      return Optional.empty();
    } catch (LogNogParseException | ValidationException e) {
      return Optional.of(e.describeTo(new StringBuilder()).toString());
    }
  }

  /** Parses, validates and plans a query, without executing it. */
  public CompiledQuery compile(String query, QueryOptions options) {
    final Ast.Pipeline pipeline = parse(query);
    final Resolver.Resolved resolved = Resolver.of(schema).resolve(pipeline);
    final TimeRange timeRange;
    try {
      timeRange = TimeRange.parse(options.earliest, options.latest, clock);
    } catch (IllegalArgumentException e) {
      throw new ValidationException(requireNonNull(e.getMessage()),
          Pos.ZERO);
    }
    return Planner.of(schema, map).plan(resolved, timeRange);
  }

  /** Executes a query. */
  public QueryResult execute(String query, QueryOptions options) {
    final long start = System.nanoTime();
    final CompiledQuery compiled = compile(query, options);
    LOGGER.debug("Compiled {} to {}", query, compiled.backendQuery);

    final Duration timeout = timeout(options);
    final CancellationToken token;
    if (options.cancellationToken != null) {
      token = options.cancellationToken;
    } else if (timeout != null) {
      token = CancellationToken.withTimeout(timeout);
    } else {
      token = CancellationToken.create();
    }
    final Session session = new Session(map, token, timeout);
    final List<Row> backendRows =
        backend.execute(compiled.backendQuery, session);

    final RowSink rowSink =
        Compiler.compileStages(compiled.residualStages, token,
            RowSinks.collect());
    rowSink.start();
    backendRows.forEach(rowSink::accept);
    final List<Row> rows =
        new ResultAssembler(compiled.resolved.outputFields,
            compiled.resolved.renames,
            Prop.SEVERITY_FORMAT.enumValue(map, Prop.SeverityFormat.class))
            .assemble(rowSink.result());

    final long executionTimeMs = (System.nanoTime() - start) / 1_000_000L;
    LOGGER.debug("Executed query in {} ms; {} backend rows, {} result rows",
        executionTimeMs, backendRows.size(), rows.size());
    return new QueryResult(rows, compiled.sql(), compiled.parameters(),
        executionTimeMs,
        compiled.backendQuery.isTruncated(backendRows.size()));
  }

  /** Executes a query with default options. */
  public QueryResult execute(String query) {
    return execute(query, QueryOptions.DEFAULT);
  }

  private @Nullable Duration timeout(QueryOptions options) {
    if (options.timeout != null) {
      return options.timeout;
    }
    final int millis = Prop.QUERY_TIMEOUT_MILLIS.intValue(map);
    return millis > 0 ? Duration.ofMillis(millis) : null;
  }
}

// End QueryEngine.java
