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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import net.hydromatic.lognog.util.Span;
import org.apache.calcite.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Base class for an expression. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Reference to a field, by the name the user wrote. */
  public static class FieldRef extends Exp {
    public final String name;

    FieldRef(Pos pos, String name) {
      super(pos, Op.FIELD_REF);
      this.name = requireNonNull(name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof FieldRef && name.equals(((FieldRef) o).name);
    }
  }

  /**
   * Literal value.
   *
   * <p>The value is a {@link String}, {@link BigDecimal}, {@link Boolean} or
   * null.
   */
  public static class Literal extends Exp {
    public final @Nullable Object value;

    Literal(Pos pos, @Nullable Object value) {
      super(pos, Op.LITERAL);
      checkArgument(
          value == null
              || value instanceof String
              || value instanceof BigDecimal
              || value instanceof Boolean,
          "invalid literal %s",
          value);
      this.value = value;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendLiteral(value);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal && Objects.equals(value, ((Literal) o).value);
    }
  }

  /** Regular expression literal, written {@code /pattern/}. */
  public static class Regex extends Exp {
    public final String regex;
    public final Pattern pattern;

    Regex(Pos pos, String regex, Pattern pattern) {
      super(pos, Op.REGEX);
      this.regex = requireNonNull(regex);
      this.pattern = requireNonNull(pattern);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("/").append(regex.replace("/", "\\/")).append("/");
    }
  }

  /** Call to an infix operator, such as {@code a + b} or {@code x AND y}. */
  public static class InfixCall extends Exp {
    public final Exp a0;
    public final Exp a1;

    InfixCall(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }
  }

  /** Call to a prefix operator, {@code NOT x} or {@code -x}. */
  public static class PrefixCall extends Exp {
    public final Exp a;

    PrefixCall(Pos pos, Op op, Exp a) {
      super(pos, op);
      this.a = requireNonNull(a);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, a, right);
    }
  }

  /** Call to a named function, such as {@code round(x, 2)}. */
  public static class Apply extends Exp {
    public final String name;
    public final ImmutableList<Exp> args;

    Apply(Pos pos, String name, ImmutableList<Exp> args) {
      super(pos, Op.APPLY);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name).append("(").appendAll(args, ", ").append(")");
    }
  }

  /** Base class for a pipeline stage. */
  public abstract static class Stage extends AstNode {
    Stage(Pos pos, Op op) {
      super(pos, op);
      checkArgument(op.isStage(), "not a stage: %s", op);
    }
  }

  /** {@code search} or {@code where} stage. */
  public static class Filter extends Stage {
    public final Exp predicate;

    Filter(Pos pos, Op op, Exp predicate) {
      super(pos, op);
      checkArgument(op == Op.SEARCH || op == Op.WHERE);
      this.predicate = requireNonNull(predicate);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(op.padded).append(" ").append(predicate, 0, 0);
    }
  }

  /** Aggregate function call in a {@code stats} or {@code timechart}. */
  public static class Aggregate extends AstNode {
    public final String function;
    public final @Nullable FieldRef field;
    public final @Nullable String alias;

    Aggregate(
        Pos pos,
        String function,
        @Nullable FieldRef field,
        @Nullable String alias) {
      super(pos, Op.AGGREGATE);
      this.function = requireNonNull(function);
      this.field = field;
      this.alias = alias;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(function);
      if (field != null) {
        w.append("(").append(field, 0, 0).append(")");
      }
      if (alias != null) {
        w.append(" as ").append(alias);
      }
      return w;
    }
  }

  /** {@code stats} stage. */
  public static class Stats extends Stage {
    public final ImmutableList<Aggregate> aggregates;
    public final ImmutableList<FieldRef> groupBy;

    Stats(
        Pos pos,
        ImmutableList<Aggregate> aggregates,
        ImmutableList<FieldRef> groupBy) {
      super(pos, Op.STATS);
      this.aggregates = requireNonNull(aggregates);
      this.groupBy = requireNonNull(groupBy);
      checkArgument(!aggregates.isEmpty());
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("stats ").appendAll(aggregates, ", ");
      if (!groupBy.isEmpty()) {
        w.append(" by ").appendAll(groupBy, ", ");
      }
      return w;
    }
  }

  /** {@code timechart} stage. */
  public static class Timechart extends Stage {
    public final Span span;
    public final ImmutableList<Aggregate> aggregates;
    public final @Nullable FieldRef splitBy;

    Timechart(
        Pos pos,
        Span span,
        ImmutableList<Aggregate> aggregates,
        @Nullable FieldRef splitBy) {
      super(pos, Op.TIMECHART);
      this.span = requireNonNull(span);
      this.aggregates = requireNonNull(aggregates);
      this.splitBy = splitBy;
      checkArgument(!aggregates.isEmpty());
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("timechart span=")
          .append(span.toString())
          .append(" ")
          .appendAll(aggregates, ", ");
      if (splitBy != null) {
        w.append(" by ").append(splitBy, 0, 0);
      }
      return w;
    }
  }

  /** Key in a {@code sort} stage. */
  public static class SortKey extends AstNode {
    public final FieldRef field;
    public final boolean descending;

    SortKey(Pos pos, FieldRef field, boolean descending) {
      super(pos, Op.SORT_KEY);
      this.field = requireNonNull(field);
      this.descending = descending;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(descending ? "-" : "").append(field, 0, 0);
    }
  }

  /** {@code sort} stage. */
  public static class Sort extends Stage {
    public final ImmutableList<SortKey> keys;

    Sort(Pos pos, ImmutableList<SortKey> keys) {
      super(pos, Op.SORT);
      this.keys = requireNonNull(keys);
      checkArgument(!keys.isEmpty());
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("sort ").appendAll(keys, ", ");
    }
  }

  /** {@code head}, {@code limit} or {@code tail} stage. */
  public static class Head extends Stage {
    public final int count;

    Head(Pos pos, Op op, int count) {
      super(pos, op);
      checkArgument(op == Op.HEAD || op == Op.LIMIT || op == Op.TAIL);
      checkArgument(count >= 0);
      this.count = count;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(op.padded).append(" ").append(Integer.toString(count));
    }
  }

  /**
   * Stage whose argument is a list of fields: {@code dedup}, {@code table} or
   * {@code fields}.
   */
  public static class FieldList extends Stage {
    public final ImmutableList<FieldRef> fields;
    /** Whether this is a {@code fields - ...} stage. */
    public final boolean exclude;

    FieldList(
        Pos pos,
        Op op,
        ImmutableList<FieldRef> fields,
        boolean exclude) {
      super(pos, op);
      checkArgument(op == Op.DEDUP || op == Op.TABLE || op == Op.FIELDS);
      checkArgument(!exclude || op == Op.FIELDS);
      checkArgument(!fields.isEmpty());
      this.fields = requireNonNull(fields);
      this.exclude = exclude;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(op.padded).append(" ");
      if (exclude) {
        w.append("- ");
      }
      return w.appendAll(fields, ", ");
    }
  }

  /** {@code rename} stage. */
  public static class Rename extends Stage {
    public final ImmutableList<Pair<FieldRef, String>> pairs;

    Rename(Pos pos, ImmutableList<Pair<FieldRef, String>> pairs) {
      super(pos, Op.RENAME);
      this.pairs = requireNonNull(pairs);
      checkArgument(!pairs.isEmpty());
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("rename ");
      for (int i = 0; i < pairs.size(); i++) {
        if (i > 0) {
          w.append(", ");
        }
        w.append(pairs.get(i).left, 0, 0).append(" as ")
            .append(pairs.get(i).right);
      }
      return w;
    }
  }

  /** Assignment in an {@code eval} stage. */
  public static class Assignment extends AstNode {
    public final String name;
    public final Exp exp;

    Assignment(Pos pos, String name, Exp exp) {
      super(pos, Op.ASSIGN);
      this.name = requireNonNull(name);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name).append(op.padded).append(exp, 0, 0);
    }
  }

  /** {@code eval} stage. */
  public static class Eval extends Stage {
    public final ImmutableList<Assignment> assignments;

    Eval(Pos pos, ImmutableList<Assignment> assignments) {
      super(pos, Op.EVAL);
      this.assignments = requireNonNull(assignments);
      checkArgument(!assignments.isEmpty());
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("eval ").appendAll(assignments, ", ");
    }
  }

  /** {@code top} or {@code rare} stage. */
  public static class Top extends Stage {
    public final int count;
    public final FieldRef field;

    Top(Pos pos, Op op, int count, FieldRef field) {
      super(pos, op);
      checkArgument(op == Op.TOP || op == Op.RARE);
      this.count = count;
      this.field = requireNonNull(field);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(op.padded)
          .append(" ")
          .append(Integer.toString(count))
          .append(" ")
          .append(field, 0, 0);
    }
  }

  /** {@code bin} stage. */
  public static class Bin extends Stage {
    public final Span span;
    public final FieldRef field;

    Bin(Pos pos, Span span, FieldRef field) {
      super(pos, Op.BIN);
      this.span = requireNonNull(span);
      this.field = requireNonNull(field);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("bin span=")
          .append(span.toString())
          .append(" ")
          .append(field, 0, 0);
    }
  }

  /** {@code rex} stage. */
  public static class Rex extends Stage {
    public final @Nullable FieldRef field;
    /** Pattern as the user wrote it. */
    public final String regex;
    /** Compiled pattern; {@code (?P<name>} groups are accepted. */
    public final Pattern pattern;
    /** Names of the named groups, in order of appearance, and the number
     * of the capturing group in {@link #pattern}. */
    public final ImmutableMap<String, Integer> groups;

    Rex(
        Pos pos,
        @Nullable FieldRef field,
        String regex,
        Pattern pattern,
        ImmutableMap<String, Integer> groups) {
      super(pos, Op.REX);
      this.field = field;
      this.regex = requireNonNull(regex);
      this.pattern = requireNonNull(pattern);
      this.groups = requireNonNull(groups);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("rex ");
      if (field != null) {
        w.append("field=").append(field, 0, 0).append(" ");
      }
      return w.appendLiteral(regex);
    }
  }

  /** A pipeline: a non-empty list of stages, the first of which is a
   * {@code search}. */
  public static class Pipeline extends AstNode {
    public final ImmutableList<Stage> stages;

    Pipeline(Pos pos, ImmutableList<Stage> stages) {
      super(pos, Op.PIPELINE);
      this.stages = requireNonNull(stages);
      checkArgument(!stages.isEmpty(), "empty pipeline");
      checkArgument(
          stages.get(0).op == Op.SEARCH, "first stage must be search");
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(stages, op.padded);
    }

    /** Returns a copy of this pipeline with a different list of stages. */
    public Pipeline copy(List<Stage> stages) {
      return new Pipeline(pos, ImmutableList.copyOf(stages));
    }
  }
}

// End Ast.java
