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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.lognog.ast.Ast;
import net.hydromatic.lognog.ast.Op;
import net.hydromatic.lognog.ast.Pos;
import net.hydromatic.lognog.util.Severity;
import net.hydromatic.lognog.util.Wildcards;
import org.apache.calcite.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Validates a pipeline and converts it to canonical form.
 *
 * <p>In the canonical form:
 *
 * <ul>
 *   <li>every field reference uses the canonical name of a column, or the
 *       name of a field introduced by an earlier stage;
 *   <li>{@code rename} stages are removed, and references to a new name
 *       refer to the old name; the renames are returned separately and
 *       applied to the final rows;
 *   <li>a free-text term becomes a case-insensitive match on
 *       {@code message}, and {@code *} becomes {@code true};
 *   <li>in a comparison between a field and a literal, the literal has the
 *       type of the field, and severity names are converted to levels;
 *   <li>every aggregate has its canonical function name and an alias.
 * </ul>
 */
public class Resolver {
  /** Name of the bucket column produced by {@code timechart}. */
  public static final String TIME_BUCKET = "time_bucket";

  /** Names of the columns produced by {@code top} and {@code rare}. */
  public static final String COUNT = "count";
  public static final String PERCENT = "percent";

  private final FieldSchema schema;

  private Resolver(FieldSchema schema) {
    this.schema = requireNonNull(schema);
  }

  /** Creates a resolver. */
  public static Resolver of(FieldSchema schema) {
    return new Resolver(schema);
  }

  /** Validates a pipeline and returns its canonical form. */
  public Resolved resolve(Ast.Pipeline pipeline) {
    final Context cx = new Context();
    final List<Ast.Stage> stages = new ArrayList<>();
    for (Ast.Stage stage : pipeline.stages) {
      final Ast.Stage stage2 = resolveStage(cx, stage);
      if (stage2 != null) {
        stages.add(stage2);
      }
    }
    return new Resolved(pipeline, pipeline.copy(stages),
        ImmutableMap.copyOf(cx.renames), ImmutableSet.copyOf(cx.columns),
        cx.scope.open ? null : ImmutableList.copyOf(cx.scope.fields.keySet()));
  }

  private Ast.@Nullable Stage resolveStage(Context cx, Ast.Stage stage) {
    switch (stage.op) {
    case SEARCH:
    case WHERE:
      final Ast.Filter filter = (Ast.Filter) stage;
      final Ast.Exp predicate = resolvePredicate(cx, filter.predicate);
      return stage.op == Op.SEARCH
          ? ast.search(stage.pos, predicate)
          : ast.where(stage.pos, predicate);

    case STATS:
      final Ast.Stats stats = (Ast.Stats) stage;
      final List<Ast.FieldRef> groupBy = resolveFields(cx, stats.groupBy);
      final List<Ast.Aggregate> aggregates =
          resolveAggregates(cx, stats.aggregates);
      cx.scope = cx.scope.closed(groupBy, null, aggregates);
      return ast.stats(stage.pos, aggregates, groupBy);

    case TIMECHART:
      final Ast.Timechart timechart = (Ast.Timechart) stage;
      cx.column(FieldSchema.TIMESTAMP, timechart.pos);
      final Ast.FieldRef splitBy = timechart.splitBy == null ? null
          : resolveField(cx, timechart.splitBy);
      final List<Ast.Aggregate> aggregates2 =
          resolveAggregates(cx, timechart.aggregates);
      cx.scope = cx.scope.closed(
          splitBy == null ? ImmutableList.of() : ImmutableList.of(splitBy),
          TIME_BUCKET, aggregates2);
      return ast.timechart(stage.pos, timechart.span, aggregates2, splitBy);

    case SORT:
      final List<Ast.SortKey> keys = new ArrayList<>();
      for (Ast.SortKey key : ((Ast.Sort) stage).keys) {
        keys.add(
            ast.sortKey(key.pos, resolveField(cx, key.field), key.descending));
      }
      return ast.sort(stage.pos, keys);

    case HEAD:
    case LIMIT:
    case TAIL:
      return stage;

    case DEDUP:
      return ast.dedup(stage.pos,
          resolveFields(cx, ((Ast.FieldList) stage).fields));

    case TABLE:
      final List<Ast.FieldRef> tableFields =
          resolveFields(cx, ((Ast.FieldList) stage).fields);
      cx.scope = cx.scope.project(tableFields);
      return ast.table(stage.pos, tableFields);

    case FIELDS:
      final Ast.FieldList fieldList = (Ast.FieldList) stage;
      final List<Ast.FieldRef> fields = resolveFields(cx, fieldList.fields);
      cx.scope = fieldList.exclude
          ? cx.scope.exclude(fields)
          : cx.scope.project(fields);
      return ast.fields(stage.pos, fieldList.exclude, fields);

    case RENAME:
      for (Pair<Ast.FieldRef, String> pair : ((Ast.Rename) stage).pairs) {
        final String from = resolveField(cx, pair.left).name;
        cx.renames.put(from, pair.right);
        if (!pair.right.equals(from)) {
          cx.renamedFrom.put(pair.right, from);
        }
      }
      return null;

    case EVAL:
      final List<Ast.Assignment> assignments = new ArrayList<>();
      for (Ast.Assignment assignment : ((Ast.Eval) stage).assignments) {
        final Ast.Exp exp = resolveExp(cx, assignment.exp);
        final String name = cx.targetName(assignment.name);
        cx.scope = cx.scope.plus(name, null);
        assignments.add(ast.assignment(assignment.pos, name, exp));
      }
      return ast.eval(stage.pos, assignments);

    case TOP:
    case RARE:
      final Ast.Top top = (Ast.Top) stage;
      final Ast.FieldRef topField = resolveField(cx, top.field);
      final Map<String, FieldSchema.@Nullable FieldType> topFields =
          new LinkedHashMap<>();
      topFields.put(topField.name, cx.scope.typeOf(topField.name));
      topFields.put(COUNT, FieldSchema.FieldType.NUMBER);
      topFields.put(PERCENT, FieldSchema.FieldType.NUMBER);
      cx.scope = new Scope(false, topFields, ImmutableSet.of());
      return ast.top(stage.pos, stage.op, top.count, topField);

    case BIN:
      final Ast.Bin bin = (Ast.Bin) stage;
      final Ast.FieldRef binField = resolveField(cx, bin.field);
      if (bin.span.isTime()) {
        final FieldSchema.FieldType type = cx.scope.typeOf(binField.name);
        if (type != null && type != FieldSchema.FieldType.DATETIME) {
          throw new ValidationException("Cannot bin field '"
              + bin.field.name + "' by time span " + bin.span, bin.field.pos);
        }
      }
      return ast.bin(stage.pos, bin.span, binField);

    case REX:
      final Ast.Rex rex = (Ast.Rex) stage;
      final Ast.FieldRef rexField = rex.field == null
          ? resolveField(cx, ast.fieldRef(rex.pos, FieldSchema.MESSAGE))
          : resolveField(cx, rex.field);
      for (String name : rex.groups.keySet()) {
        cx.scope = cx.scope.plus(name, FieldSchema.FieldType.STRING);
      }
      return ast.rex(stage.pos, rexField, rex.regex, rex.pattern, rex.groups);

    default:
      throw new AssertionError("unknown stage " + stage.op);
    }
  }

  private List<Ast.FieldRef> resolveFields(Context cx,
      List<Ast.FieldRef> fields) {
    final List<Ast.FieldRef> list = new ArrayList<>();
    for (Ast.FieldRef field : fields) {
      list.add(resolveField(cx, field));
    }
    return list;
  }

  private Ast.FieldRef resolveField(Context cx, Ast.FieldRef field) {
    final String name = cx.resolve(field.name, field.pos);
    return name.equals(field.name) ? field : ast.fieldRef(field.pos, name);
  }

  private List<Ast.Aggregate> resolveAggregates(Context cx,
      List<Ast.Aggregate> aggregates) {
    final List<Ast.Aggregate> list = new ArrayList<>();
    final Set<String> aliases = new HashSet<>();
    for (Ast.Aggregate aggregate : aggregates) {
      final AggFunction function = AggFunction.lookup(aggregate.function);
      if (function == null) {
        throw new ValidationException(
            "Unknown aggregate function '" + aggregate.function + "'",
            aggregate.pos);
      }
      final Ast.FieldRef field = aggregate.field == null ? null
          : resolveField(cx, aggregate.field);
      if (function == AggFunction.EARLIEST
          || function == AggFunction.LATEST) {
        cx.column(FieldSchema.TIMESTAMP, aggregate.pos);
      }
      final String alias = aggregate.alias != null
          ? aggregate.alias
          : function.defaultAlias(field == null ? null : field.name);
      if (!aliases.add(alias)) {
        throw new ValidationException(
            "Duplicate aggregate name '" + alias + "'", aggregate.pos);
      }
      list.add(ast.aggregate(aggregate.pos, function.name, field, alias));
    }
    return list;
  }

  /** Resolves an expression that is used as a condition. */
  private Ast.Exp resolvePredicate(Context cx, Ast.Exp exp) {
    switch (exp.op) {
    case LITERAL:
      final Object value = ((Ast.Literal) exp).value;
      if (!(value instanceof String)) {
        return exp;
      }
      final String s = (String) value;
      if (Wildcards.shape(s) == Wildcards.Shape.ANY) {
        return ast.boolLiteral(exp.pos, true);
      }
      // Free-text term.
      final Ast.FieldRef message =
          resolveField(cx, ast.fieldRef(exp.pos, FieldSchema.MESSAGE));
      final String pattern = Wildcards.hasWildcard(s) ? "*" + s + "*" : s;
      return ast.infix(Op.MATCH, message,
          ast.stringLiteral(exp.pos, pattern));

    case AND:
    case OR:
      final Ast.InfixCall call = (Ast.InfixCall) exp;
      return ast.infix(exp.op, resolvePredicate(cx, call.a0),
          resolvePredicate(cx, call.a1));

    case NOT:
      return ast.prefix(exp.pos, Op.NOT,
          resolvePredicate(cx, ((Ast.PrefixCall) exp).a));

    default:
      return resolveExp(cx, exp);
    }
  }

  private Ast.Exp resolveExp(Context cx, Ast.Exp exp) {
    switch (exp.op) {
    case FIELD_REF:
      return resolveField(cx, (Ast.FieldRef) exp);

    case LITERAL:
    case REGEX:
      return exp;

    case NOT:
    case NEGATE:
      final Ast.PrefixCall prefixCall = (Ast.PrefixCall) exp;
      return ast.prefix(exp.pos, exp.op, resolveExp(cx, prefixCall.a));

    case APPLY:
      final Ast.Apply apply = (Ast.Apply) exp;
      final BuiltIn builtIn = BuiltIn.lookup(apply.name);
      if (builtIn == null) {
        throw new ValidationException(
            "Unknown function '" + apply.name + "'", apply.pos);
      }
      if (!builtIn.acceptsArgCount(apply.args.size())) {
        throw new ValidationException("Function '" + builtIn.name
            + "' requires " + builtIn.describeArgCount() + " argument"
            + (builtIn.minArgs == 1 && builtIn.maxArgs == 1 ? "" : "s")
            + ", got " + apply.args.size(), apply.pos);
      }
      final List<Ast.Exp> args = new ArrayList<>();
      for (Ast.Exp arg : apply.args) {
        args.add(resolveExp(cx, arg));
      }
      return ast.apply(apply.pos, builtIn.name, args);

    default:
      final Ast.InfixCall call = (Ast.InfixCall) exp;
      final Ast.Exp a0 = resolveExp(cx, call.a0);
      final Ast.Exp a1 = resolveExp(cx, call.a1);
      if (Op.COMPARISONS.contains(exp.op)
          && a0.op == Op.FIELD_REF
          && a1.op == Op.LITERAL) {
        final Ast.FieldRef field = (Ast.FieldRef) a0;
        return ast.infix(exp.op, field,
            coerce(cx.scope.typeOf(field.name), field, exp.op,
                (Ast.Literal) a1));
      }
      return ast.infix(exp.op, a0, a1);
    }
  }

  /** Converts a literal that is compared with a field to the field's
   * type. */
  private static Ast.Literal coerce(FieldSchema.@Nullable FieldType type,
      Ast.FieldRef field, Op op, Ast.Literal literal) {
    if (type == null || literal.value == null) {
      return literal;
    }
    switch (type) {
    case STRING:
      if (literal.value instanceof BigDecimal) {
        return ast.stringLiteral(literal.pos,
            ((BigDecimal) literal.value).toPlainString());
      }
      return literal;

    case NUMBER:
      if (!(literal.value instanceof String) || op == Op.MATCH) {
        return literal;
      }
      final String s = (String) literal.value;
      if (Wildcards.hasWildcard(s)) {
        return literal;
      }
      try {
        return ast.numberLiteral(literal.pos, new BigDecimal(s.trim()));
      } catch (NumberFormatException e) {
        if (field.name.equals(FieldSchema.SEVERITY)) {
          final Severity severity = Severity.lookup(s);
          if (severity != null) {
            return ast.numberLiteral(literal.pos,
                BigDecimal.valueOf(severity.level()));
          }
        }
        throw new ValidationException("Cannot compare numeric field '"
            + field.name + "' with '" + s + "'", literal.pos);
      }

    default:
      return literal;
    }
  }

  /** The fields that are visible at a point in the pipeline. */
  private class Scope {
    /** Whether every column of the schema is visible. */
    final boolean open;
    /** Fields introduced by stages, or, if the scope is closed, all visible
     * fields; with their type, if known. */
    final Map<String, FieldSchema.@Nullable FieldType> fields;
    /** Columns removed by {@code fields -}. */
    final ImmutableSet<String> excluded;

    Scope(boolean open, Map<String, FieldSchema.@Nullable FieldType> fields,
        ImmutableSet<String> excluded) {
      this.open = open;
      this.fields = fields;
      this.excluded = excluded;
    }

    Scope plus(String name, FieldSchema.@Nullable FieldType type) {
      final Map<String, FieldSchema.@Nullable FieldType> map =
          new LinkedHashMap<>(fields);
      map.put(name, type);
      final Set<String> excluded2 = new LinkedHashSet<>(excluded);
      excluded2.remove(name);
      return new Scope(open, map, ImmutableSet.copyOf(excluded2));
    }

    Scope closed(List<Ast.FieldRef> keys, @Nullable String bucket,
        List<Ast.Aggregate> aggregates) {
      final Map<String, FieldSchema.@Nullable FieldType> map =
          new LinkedHashMap<>();
      if (bucket != null) {
        map.put(bucket, FieldSchema.FieldType.DATETIME);
      }
      keys.forEach(key -> map.put(key.name, typeOf(key.name)));
      for (Ast.Aggregate aggregate : aggregates) {
        final AggFunction function =
            requireNonNull(AggFunction.lookup(aggregate.function));
        map.put(requireNonNull(aggregate.alias),
            function.isNumeric() ? FieldSchema.FieldType.NUMBER
                : aggregate.field == null ? null
                : typeOf(aggregate.field.name));
      }
      return new Scope(false, map, ImmutableSet.of());
    }

    Scope project(List<Ast.FieldRef> projection) {
      final Map<String, FieldSchema.@Nullable FieldType> map =
          new LinkedHashMap<>();
      projection.forEach(f -> map.put(f.name, typeOf(f.name)));
      return new Scope(false, map, ImmutableSet.of());
    }

    Scope exclude(List<Ast.FieldRef> excludedFields) {
      final Map<String, FieldSchema.@Nullable FieldType> map =
          new LinkedHashMap<>(fields);
      final Set<String> excluded2 = new LinkedHashSet<>(excluded);
      for (Ast.FieldRef f : excludedFields) {
        map.remove(f.name);
        excluded2.add(f.name);
      }
      return new Scope(open, map, ImmutableSet.copyOf(excluded2));
    }

    /** Returns the type of a field, or null if not known. Only valid for a
     * field that has been resolved. */
    FieldSchema.@Nullable FieldType typeOf(String name) {
      if (fields.containsKey(name)) {
        return fields.get(name);
      }
      return open ? schema.typeOf(name) : null;
    }
  }

  /** State of a call to {@link #resolve}. */
  private class Context {
    Scope scope = new Scope(true, new LinkedHashMap<>(), ImmutableSet.of());
    /** Renames to apply to the final rows; old name to new name. */
    final Map<String, String> renames = new LinkedHashMap<>();
    /** New name to old name. */
    final Map<String, String> renamedFrom = new LinkedHashMap<>();
    /** Columns of the schema that are referenced. */
    final Set<String> columns = new LinkedHashSet<>();

    /** Resolves a field name, or throws. */
    String resolve(String name, Pos pos) {
      String n = name;
      for (int i = 0; i < renamedFrom.size() && renamedFrom.containsKey(n);
           i++) {
        n = renamedFrom.get(n);
      }
      if (scope.fields.containsKey(n)) {
        return n;
      }
      final String canonicalName = schema.canonicalName(n);
      if (canonicalName != null) {
        if (scope.fields.containsKey(canonicalName)) {
          return canonicalName;
        }
        if (scope.open && !scope.excluded.contains(canonicalName)) {
          columns.add(canonicalName);
          return canonicalName;
        }
      }
      throw new ValidationException("Unknown field '" + name + "'", pos);
    }

    /** Records that a column is needed, whether or not the user names
     * it. */
    void column(String name, Pos pos) {
      if (scope.open) {
        columns.add(resolve(name, pos));
      }
    }

    /** Returns the name of the field assigned by {@code eval}. An existing
     * field keeps its name; otherwise the name is as written. */
    String targetName(String name) {
      String n = name;
      for (int i = 0; i < renamedFrom.size() && renamedFrom.containsKey(n);
           i++) {
        n = renamedFrom.get(n);
      }
      if (scope.fields.containsKey(n)) {
        return n;
      }
      final String canonicalName = schema.canonicalName(n);
      if (canonicalName != null && scope.open) {
        return canonicalName;
      }
      return n;
    }
  }

  /** Result of resolving a pipeline. */
  public static class Resolved {
    /** The pipeline as parsed. */
    public final Ast.Pipeline original;
    /** The pipeline in canonical form. */
    public final Ast.Pipeline pipeline;
    /** Renames to apply to the final rows, old name to new name. */
    public final ImmutableMap<String, String> renames;
    /** Columns of the store that the pipeline references, in order of first
     * reference. */
    public final ImmutableSet<String> columns;
    /** Names of the output fields, if known; null if the output has the
     * columns of the store plus fields added by stages. */
    public final @Nullable ImmutableList<String> outputFields;

    Resolved(Ast.Pipeline original, Ast.Pipeline pipeline,
        ImmutableMap<String, String> renames, ImmutableSet<String> columns,
        @Nullable ImmutableList<String> outputFields) {
      this.original = requireNonNull(original);
      this.pipeline = requireNonNull(pipeline);
      this.renames = requireNonNull(renames);
      this.columns = requireNonNull(columns);
      this.outputFields = outputFields;
    }

    @Override
    public String toString() {
      return pipeline.toString();
    }
  }
}

// End Resolver.java
