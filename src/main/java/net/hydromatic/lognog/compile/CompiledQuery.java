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
import java.util.List;
import net.hydromatic.lognog.ast.Ast;
import net.hydromatic.lognog.foreign.BackendQuery;

/**
 * Plan of a query: the SQL that the backend executes, and the stages that
 * then run in the row pipeline.
 */
public class CompiledQuery {
  public final Resolver.Resolved resolved;
  public final Dialect dialect;
  public final BackendQuery backendQuery;
  /** Stages translated to SQL. A filter that was split appears here with
   * only the conjuncts that were translated. */
  public final ImmutableList<Ast.Stage> pushedStages;
  /** Stages that run in the row pipeline, in order. */
  public final ImmutableList<Ast.Stage> residualStages;

  CompiledQuery(Resolver.Resolved resolved, Dialect dialect,
      BackendQuery backendQuery, List<Ast.Stage> pushedStages,
      List<Ast.Stage> residualStages) {
    this.resolved = requireNonNull(resolved);
    this.dialect = requireNonNull(dialect);
    this.backendQuery = requireNonNull(backendQuery);
    this.pushedStages = ImmutableList.copyOf(pushedStages);
    this.residualStages = ImmutableList.copyOf(residualStages);
  }

  /** Returns the SQL, with {@code ?} placeholders. */
  public String sql() {
    return backendQuery.sql;
  }

  /** Returns the values of the placeholders. */
  public List<Object> parameters() {
    return backendQuery.parameters;
  }

  /** Returns the SQL with parameter values inlined as escaped literals.
   * For display only; never executed. */
  public String displaySql() {
    return QueryBuilder.displaySql(dialect, backendQuery.sql,
        backendQuery.parameters);
  }

  /** Returns a description of the plan, for "explain". */
  public String explain() {
    final StringBuilder b = new StringBuilder();
    b.append("sql: ").append(displaySql()).append('\n');
    b.append("pushed: ").append(pushedStages.size()).append(" stage(s)");
    for (Ast.Stage stage : pushedStages) {
      b.append("\n  ").append(stage);
    }
    b.append("\nresidual: ").append(residualStages.size())
        .append(" stage(s)");
    for (Ast.Stage stage : residualStages) {
      b.append("\n  ").append(stage);
    }
    return b.toString();
  }

  @Override
  public String toString() {
    return displaySql();
  }
}

// End CompiledQuery.java
