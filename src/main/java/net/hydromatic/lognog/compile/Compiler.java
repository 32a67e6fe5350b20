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
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.lognog.ast.Ast;
import net.hydromatic.lognog.ast.Op;
import net.hydromatic.lognog.eval.CancellationToken;
import net.hydromatic.lognog.eval.Code;
import net.hydromatic.lognog.eval.Codes;
import net.hydromatic.lognog.eval.RowSink;
import net.hydromatic.lognog.eval.RowSinks;
import net.hydromatic.lognog.eval.Variant;
import net.hydromatic.lognog.util.Wildcards;
import org.apache.calcite.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts resolved expressions to {@link Code}, and resolved stages to a
 * chain of {@link RowSink}.
 *
 * <p>The input must be in the canonical form produced by {@link Resolver}.
 */
public class Compiler {
  private Compiler() {}

  /** Compiles an expression. */
  public static Code compile(Ast.Exp exp) {
    switch (exp.op) {
    case FIELD_REF:
      return Codes.field(((Ast.FieldRef) exp).name);

    case LITERAL:
      return Codes.constant(toVariant(((Ast.Literal) exp).value));

    case REGEX:
      // A regex on its own matches the message.
      return Codes.regex(Codes.field(FieldSchema.MESSAGE),
          ((Ast.Regex) exp).pattern);

    case NOT:
      return Codes.not(compile(((Ast.PrefixCall) exp).a));

    case NEGATE:
      return Codes.negate(compile(((Ast.PrefixCall) exp).a));

    case AND:
    case OR:
      final Ast.InfixCall logic = (Ast.InfixCall) exp;
      return exp.op == Op.AND
          ? Codes.andAlso(compile(logic.a0), compile(logic.a1))
          : Codes.orElse(compile(logic.a0), compile(logic.a1));

    case APPLY:
      final Ast.Apply apply = (Ast.Apply) exp;
      final BuiltIn builtIn = requireNonNull(BuiltIn.lookup(apply.name));
      final List<Code> args = new ArrayList<>();
      apply.args.forEach(arg -> args.add(compile(arg)));
      return Codes.apply(builtIn, args);

    case MATCH:
      return compileMatch((Ast.InfixCall) exp);

    case EQ:
    case NE:
      final Ast.InfixCall eq = (Ast.InfixCall) exp;
      final String wildcard = wildcardLiteral(eq.a1);
      if (wildcard != null) {
        final Code code0 = compile(eq.a0);
        final Code code = Wildcards.shape(wildcard) == Wildcards.Shape.ANY
            ? Codes.present(code0)
            : Codes.wildcard(code0, wildcard, false);
        return exp.op == Op.EQ ? code : Codes.not(code);
      }
      return Codes.compare(exp.op, compile(eq.a0), compile(eq.a1));

    case LT:
    case LE:
    case GT:
    case GE:
      final Ast.InfixCall comparison = (Ast.InfixCall) exp;
      return Codes.compare(exp.op, compile(comparison.a0),
          compile(comparison.a1));

    case PLUS:
    case MINUS:
    case TIMES:
    case DIVIDE:
    case MOD:
      final Ast.InfixCall arithmetic = (Ast.InfixCall) exp;
      return Codes.arithmetic(exp.op, compile(arithmetic.a0),
          compile(arithmetic.a1));

    default:
      throw new AssertionError("unknown expression " + exp.op);
    }
  }

  private static Code compileMatch(Ast.InfixCall call) {
    final Code code0 = compile(call.a0);
    if (call.a1.op == Op.REGEX) {
      return Codes.regex(code0, ((Ast.Regex) call.a1).pattern);
    }
    final String wildcard = wildcardLiteral(call.a1);
    if (wildcard != null) {
      return Codes.wildcard(code0, wildcard, true);
    }
    return Codes.contains(code0, compile(call.a1));
  }

  /** If an expression is a string literal that contains a wildcard, returns
   * the string; otherwise null. */
  static @Nullable String wildcardLiteral(Ast.Exp exp) {
    if (exp.op == Op.LITERAL
        && ((Ast.Literal) exp).value instanceof String) {
      final String s = (String) ((Ast.Literal) exp).value;
      return Wildcards.hasWildcard(s) ? s : null;
    }
    return null;
  }

  /** Converts the value of a literal to a variant. */
  public static Variant toVariant(@Nullable Object value) {
    if (value instanceof BigDecimal) {
      return Variant.ofNumber(((BigDecimal) value).doubleValue());
    }
    return Variant.of(value);
  }

  /**
   * Converts a list of stages to a chain of row sinks that ends in
   * {@code rowSink}.
   *
   * <p>The chain is built from the last stage backwards, so the first stage
   * is the head of the chain.
   */
  public static RowSink compileStages(List<Ast.Stage> stages,
      CancellationToken cancellationToken, RowSink rowSink) {
    RowSink sink = rowSink;
    for (Ast.Stage stage : ImmutableList.copyOf(stages).reverse()) {
      sink = compileStage(stage, sink);
    }
    return RowSinks.first(sink, cancellationToken);
  }

  private static RowSink compileStage(Ast.Stage stage, RowSink rowSink) {
    switch (stage.op) {
    case SEARCH:
    case WHERE:
      return RowSinks.where(compile(((Ast.Filter) stage).predicate), rowSink);

    case EVAL:
      final List<Pair<String, Code>> assignments = new ArrayList<>();
      for (Ast.Assignment assignment : ((Ast.Eval) stage).assignments) {
        assignments.add(Pair.of(assignment.name, compile(assignment.exp)));
      }
      return RowSinks.eval(assignments, rowSink);

    case STATS:
      final Ast.Stats stats = (Ast.Stats) stage;
      return RowSinks.stats(names(stats.groupBy), aggregates(stats.aggregates),
          rowSink);

    case TIMECHART:
      final Ast.Timechart timechart = (Ast.Timechart) stage;
      return RowSinks.timechart(timechart.span,
          timechart.splitBy == null ? null : timechart.splitBy.name,
          aggregates(timechart.aggregates), rowSink);

    case SORT:
      final List<String> keys = new ArrayList<>();
      final List<Boolean> descending = new ArrayList<>();
      for (Ast.SortKey key : ((Ast.Sort) stage).keys) {
        keys.add(key.field.name);
        descending.add(key.descending);
      }
      return RowSinks.sort(keys, descending, rowSink);

    case HEAD:
    case LIMIT:
      return RowSinks.head(((Ast.Head) stage).count, rowSink);

    case TAIL:
      return RowSinks.tail(((Ast.Head) stage).count, rowSink);

    case DEDUP:
      return RowSinks.dedup(names(((Ast.FieldList) stage).fields), rowSink);

    case TABLE:
      return RowSinks.project(names(((Ast.FieldList) stage).fields), rowSink);

    case FIELDS:
      final Ast.FieldList fields = (Ast.FieldList) stage;
      return fields.exclude
          ? RowSinks.exclude(names(fields.fields), rowSink)
          : RowSinks.project(names(fields.fields), rowSink);

    case TOP:
    case RARE:
      final Ast.Top top = (Ast.Top) stage;
      return RowSinks.top(top.op == Op.TOP, top.count, top.field.name,
          rowSink);

    case BIN:
      final Ast.Bin bin = (Ast.Bin) stage;
      return RowSinks.bin(bin.span, bin.field.name, rowSink);

    case REX:
      final Ast.Rex rex = (Ast.Rex) stage;
      return RowSinks.rex(
          rex.field == null ? FieldSchema.MESSAGE : rex.field.name,
          rex.pattern, rex.groups, rowSink);

    default:
      throw new AssertionError("cannot execute stage " + stage.op);
    }
  }

  private static List<String> names(List<Ast.FieldRef> fields) {
    final List<String> names = new ArrayList<>();
    fields.forEach(f -> names.add(f.name));
    return names;
  }

  private static List<RowSinks.AggregateCall> aggregates(
      List<Ast.Aggregate> aggregates) {
    final List<RowSinks.AggregateCall> list = new ArrayList<>();
    for (Ast.Aggregate aggregate : aggregates) {
      list.add(
          new RowSinks.AggregateCall(
              requireNonNull(AggFunction.lookup(aggregate.function)),
              aggregate.field == null ? null : aggregate.field.name,
              requireNonNull(aggregate.alias)));
    }
    return list;
  }
}

// End Compiler.java
