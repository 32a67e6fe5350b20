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
package net.hydromatic.lognog.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import net.hydromatic.lognog.util.Span;
import org.apache.calcite.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /** The singleton instance of the AST builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates a reference to a field. */
  public Ast.FieldRef fieldRef(Pos pos, String name) {
    return new Ast.FieldRef(pos, name);
  }

  /** Creates a string literal. */
  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, value);
  }

  /** Creates a numeric literal. */
  public Ast.Literal numberLiteral(Pos pos, BigDecimal value) {
    return new Ast.Literal(pos, value);
  }

  /** Creates a boolean literal. */
  public Ast.Literal boolLiteral(Pos pos, boolean value) {
    return new Ast.Literal(pos, value);
  }

  /** Creates the null literal. */
  public Ast.Literal nullLiteral(Pos pos) {
    return new Ast.Literal(pos, null);
  }

  /** Creates a regular expression literal. */
  public Ast.Regex regex(Pos pos, String regex, Pattern pattern) {
    return new Ast.Regex(pos, regex, pattern);
  }

  /** Creates a call to an infix operator. */
  public Ast.InfixCall infix(Op op, Ast.Exp a0, Ast.Exp a1) {
    return new Ast.InfixCall(a0.pos.plus(a1.pos), op, a0, a1);
  }

  /** Creates a call to a prefix operator. */
  public Ast.PrefixCall prefix(Pos pos, Op op, Ast.Exp a) {
    return new Ast.PrefixCall(pos.plus(a.pos), op, a);
  }

  /** Creates {@code a0 AND a1}. */
  public Ast.InfixCall and(Ast.Exp a0, Ast.Exp a1) {
    return infix(Op.AND, a0, a1);
  }

  /** Creates {@code a0 OR a1}. */
  public Ast.InfixCall or(Ast.Exp a0, Ast.Exp a1) {
    return infix(Op.OR, a0, a1);
  }

  /** Creates a call to a named function. */
  public Ast.Apply apply(Pos pos, String name, List<? extends Ast.Exp> args) {
    return new Ast.Apply(pos, name, ImmutableList.copyOf(args));
  }

  /** Creates a {@code search} stage. */
  public Ast.Filter search(Pos pos, Ast.Exp predicate) {
    return new Ast.Filter(pos, Op.SEARCH, predicate);
  }

  /** Creates a {@code where} stage. */
  public Ast.Filter where(Pos pos, Ast.Exp predicate) {
    return new Ast.Filter(pos, Op.WHERE, predicate);
  }

  /** Creates an aggregate function call. */
  public Ast.Aggregate aggregate(
      Pos pos,
      String function,
      Ast.@Nullable FieldRef field,
      @Nullable String alias) {
    return new Ast.Aggregate(pos, function, field, alias);
  }

  /** Creates a {@code stats} stage. */
  public Ast.Stats stats(
      Pos pos,
      List<Ast.Aggregate> aggregates,
      List<Ast.FieldRef> groupBy) {
    return new Ast.Stats(
        pos, ImmutableList.copyOf(aggregates), ImmutableList.copyOf(groupBy));
  }

  /** Creates a {@code timechart} stage. */
  public Ast.Timechart timechart(
      Pos pos,
      Span span,
      List<Ast.Aggregate> aggregates,
      Ast.@Nullable FieldRef splitBy) {
    return new Ast.Timechart(
        pos, span, ImmutableList.copyOf(aggregates), splitBy);
  }

  /** Creates a key of a {@code sort} stage. */
  public Ast.SortKey sortKey(Pos pos, Ast.FieldRef field, boolean descending) {
    return new Ast.SortKey(pos, field, descending);
  }

  /** Creates a {@code sort} stage. */
  public Ast.Sort sort(Pos pos, List<Ast.SortKey> keys) {
    return new Ast.Sort(pos, ImmutableList.copyOf(keys));
  }

  /** Creates a {@code head}, {@code limit} or {@code tail} stage. */
  public Ast.Head head(Pos pos, Op op, int count) {
    return new Ast.Head(pos, op, count);
  }

  /** Creates a {@code dedup} stage. */
  public Ast.FieldList dedup(Pos pos, List<Ast.FieldRef> fields) {
    return new Ast.FieldList(
        pos, Op.DEDUP, ImmutableList.copyOf(fields), false);
  }

  /** Creates a {@code table} stage. */
  public Ast.FieldList table(Pos pos, List<Ast.FieldRef> fields) {
    return new Ast.FieldList(
        pos, Op.TABLE, ImmutableList.copyOf(fields), false);
  }

  /** Creates a {@code fields} stage. */
  public Ast.FieldList fields(
      Pos pos,
      boolean exclude,
      List<Ast.FieldRef> fields) {
    return new Ast.FieldList(
        pos, Op.FIELDS, ImmutableList.copyOf(fields), exclude);
  }

  /** Creates a {@code rename} stage. */
  public Ast.Rename rename(
      Pos pos,
      List<Pair<Ast.FieldRef, String>> pairs) {
    return new Ast.Rename(pos, ImmutableList.copyOf(pairs));
  }

  /** Creates an assignment in an {@code eval} stage. */
  public Ast.Assignment assignment(Pos pos, String name, Ast.Exp exp) {
    return new Ast.Assignment(pos, name, exp);
  }

  /** Creates an {@code eval} stage. */
  public Ast.Eval eval(Pos pos, List<Ast.Assignment> assignments) {
    return new Ast.Eval(pos, ImmutableList.copyOf(assignments));
  }

  /** Creates a {@code top} or {@code rare} stage. */
  public Ast.Top top(Pos pos, Op op, int count, Ast.FieldRef field) {
    return new Ast.Top(pos, op, count, field);
  }

  /** Creates a {@code bin} stage. */
  public Ast.Bin bin(Pos pos, Span span, Ast.FieldRef field) {
    return new Ast.Bin(pos, span, field);
  }

  /** Creates a {@code rex} stage. */
  public Ast.Rex rex(
      Pos pos,
      Ast.@Nullable FieldRef field,
      String regex,
      Pattern pattern,
      Map<String, Integer> groups) {
    return new Ast.Rex(
        pos, field, regex, pattern, ImmutableMap.copyOf(groups));
  }

  /** Creates a pipeline. */
  public Ast.Pipeline pipeline(Pos pos, List<Ast.Stage> stages) {
    return new Ast.Pipeline(pos, ImmutableList.copyOf(stages));
  }
}

// End AstBuilder.java
