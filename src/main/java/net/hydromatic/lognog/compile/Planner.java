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

import static net.hydromatic.lognog.ast.AstBuilder.ast;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.lognog.ast.Ast;
import net.hydromatic.lognog.ast.Op;
import net.hydromatic.lognog.eval.Prop;
import net.hydromatic.lognog.foreign.BackendQuery;
import net.hydromatic.lognog.util.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which stages of a pipeline run in the backend and which in the
 * row pipeline.
 *
 * <p>The planner translates the longest prefix of stages that the dialect
 * can evaluate with the same semantics as the row pipeline. A filter that
 * can only partly be translated is split into its top-level conjuncts: those
 * that can be translated are pushed, and the rest become the first residual
 * stage. Every stage after the first residual stage is residual too, so the
 * order of stages is preserved.
 */
public class Planner {
  private static final Logger LOGGER = LoggerFactory.getLogger(Planner.class);

  private final FieldSchema schema;
  private final Map<Prop, Object> map;

  private Planner(FieldSchema schema, Map<Prop, Object> map) {
    this.schema = requireNonNull(schema);
    this.map = requireNonNull(map);
  }

  /** Creates a planner. */
  public static Planner of(FieldSchema schema, Map<Prop, Object> map) {
    return new Planner(schema, map);
  }

  /** Plans a resolved pipeline. */
  public CompiledQuery plan(Resolver.Resolved resolved, TimeRange timeRange) {
    final Dialect dialect = Prop.DIALECT.enumValue(map, Dialect.class);
    final QueryBuilder builder =
        new QueryBuilder(dialect, schema, Prop.TABLE_NAME.stringValue(map),
            rawColumns(resolved), timeRange);
    final List<Ast.Stage> stages = resolved.pipeline.stages;
    final List<Ast.Stage> pushed = new ArrayList<>();
    final List<Ast.Stage> residual = new ArrayList<>();
    int i = 0;
    if (Prop.PUSH_DOWN.booleanValue(map)) {
      for (; i < stages.size(); i++) {
        final Ast.Stage stage = stages.get(i);
        if (stage.op == Op.SEARCH || stage.op == Op.WHERE) {
          final Ast.Filter filter = (Ast.Filter) stage;
          final List<Ast.Exp> accepted = new ArrayList<>();
          final List<Ast.Exp> rejected = new ArrayList<>();
          for (Ast.Exp conjunct : conjuncts(filter.predicate)) {
            if (builder.add(ast.where(filter.pos, conjunct))) {
              accepted.add(conjunct);
            } else {
              rejected.add(conjunct);
            }
          }
          if (rejected.isEmpty()) {
            pushed.add(stage);
            continue;
          }
          if (!accepted.isEmpty()) {
            pushed.add(filterOf(filter, accepted));
          }
          residual.add(filterOf(filter, rejected));
          ++i;
          break;
        }
        if (!builder.add(stage)) {
          break;
        }
        pushed.add(stage);
      }
    }
    residual.addAll(stages.subList(i, stages.size()));
    final BackendQuery backendQuery =
        builder.build(!residual.isEmpty(),
            Prop.DEFAULT_LIMIT.intValue(map), Prop.MAX_ROWS.intValue(map));
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Pushed {} of {} stages to {}; residual {}", pushed.size(),
          stages.size(), dialect, residual);
    }
    return new CompiledQuery(resolved, dialect, backendQuery, pushed,
        residual);
  }

  /** Returns the columns that a scan returns: the default columns, and every
   * column that the pipeline references. */
  private Set<String> rawColumns(Resolver.Resolved resolved) {
    final Set<String> columns = new LinkedHashSet<>();
    for (String name : FieldSchema.DEFAULT_FIELDS) {
      if (schema.isColumn(name)) {
        columns.add(name);
      }
    }
    columns.addAll(resolved.columns);
    return columns;
  }

  /** Splits a predicate into its top-level conjuncts. */
  static List<Ast.Exp> conjuncts(Ast.Exp exp) {
    final List<Ast.Exp> list = new ArrayList<>();
    addConjuncts(exp, list);
    return list;
  }

  private static void addConjuncts(Ast.Exp exp, List<Ast.Exp> list) {
    if (exp.op == Op.AND) {
      final Ast.InfixCall call = (Ast.InfixCall) exp;
      addConjuncts(call.a0, list);
      addConjuncts(call.a1, list);
    } else {
      list.add(exp);
    }
  }

  /** Creates a filter stage whose predicate is the conjunction of a list of
   * predicates. */
  private static Ast.Filter filterOf(Ast.Filter filter,
      List<Ast.Exp> predicates) {
    Ast.Exp predicate = predicates.get(0);
    for (Ast.Exp p : predicates.subList(1, predicates.size())) {
      predicate = ast.and(predicate, p);
    }
    return filter.op == Op.SEARCH
        ? ast.search(filter.pos, predicate)
        : ast.where(filter.pos, predicate);
  }
}

// End Planner.java
