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

import com.google.common.collect.ImmutableMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // expressions
  FIELD_REF(true),
  LITERAL(true),
  REGEX(true),
  APPLY(" ", 18),
  NEGATE("-", 16),
  TIMES(" * ", 14),
  DIVIDE(" / ", 14),
  MOD(" % ", 14),
  PLUS(" + ", 12),
  MINUS(" - ", 12),
  EQ(" = ", 10, false),
  NE(" != ", 10, false),
  LT(" < ", 10, false),
  LE(" <= ", 10, false),
  GT(" > ", 10, false),
  GE(" >= ", 10, false),
  MATCH(" ~ ", 10, false),
  NOT("NOT ", 8),
  AND(" AND ", 6),
  OR(" OR ", 4),

  // stages
  SEARCH("search"),
  WHERE("where"),
  STATS("stats"),
  TIMECHART("timechart"),
  SORT("sort"),
  HEAD("head"),
  LIMIT("limit"),
  TAIL("tail"),
  DEDUP("dedup"),
  TABLE("table"),
  FIELDS("fields"),
  RENAME("rename"),
  EVAL("eval"),
  TOP("top"),
  RARE("rare"),
  BIN("bin"),
  REX("rex"),

  // other nodes
  AGGREGATE,
  SORT_KEY,
  ASSIGN(" = "),
  PIPELINE(" | ");

  /** Padded name, e.g. " AND "; for a stage, the command keyword. */
  public final String padded;
  /** Left precedence. */
  public final int left;
  /** Right precedence. */
  public final int right;

  /** Operators that compare two values. */
  public static final Set<Op> COMPARISONS =
      EnumSet.of(EQ, NE, LT, LE, GT, GE, MATCH);

  /** Operators that compute a number from two numbers. */
  public static final Set<Op> ARITHMETIC =
      EnumSet.of(PLUS, MINUS, TIMES, DIVIDE, MOD);

  /** Operators that are pipeline stages. */
  public static final Set<Op> STAGES = EnumSet.range(SEARCH, REX);

  /**
   * Stage operators by command keyword; includes the synonyms "filter" (for
   * {@link #WHERE}) and "bucket" (for {@link #BIN}).
   */
  public static final ImmutableMap<String, Op> BY_KEYWORD;

  static {
    final Map<String, Op> map = new LinkedHashMap<>();
    for (Op op : STAGES) {
      map.put(op.padded, op);
    }
    map.put("filter", WHERE);
    map.put("bucket", BIN);
    BY_KEYWORD = ImmutableMap.copyOf(map);
  }

  Op() {
    this("", 0, 0);
  }

  Op(boolean atom) {
    this("", 99, 99);
  }

  Op(String padded) {
    this(padded, 0, 0);
  }

  Op(String padded, int precedence) {
    this(padded, precedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(
        padded,
        precedence + (leftAssociative ? 0 : 1),
        precedence + 1);
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns whether this operator is a pipeline stage. */
  public boolean isStage() {
    return STAGES.contains(this);
  }

  /**
   * Returns the operator that compares the operands in reverse order, for
   * example {@code LT} for {@code GT}, or null if this is not a comparison.
   */
  public Op reverse() {
    switch (this) {
    case LT:
      return GT;
    case LE:
      return GE;
    case GT:
      return LT;
    case GE:
      return LE;
    case EQ:
    case NE:
      return this;
    default:
      throw new AssertionError("cannot reverse " + this);
    }
  }
}

// End Op.java
