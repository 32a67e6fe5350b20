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

import java.util.List;
import java.util.Objects;
import org.apache.calcite.util.mapping.IntPair;

/**
 * Position of a token or parse-tree node in the query text.
 *
 * <p>Offsets are 0-based; lines and columns are 1-based. The end is
 * exclusive.
 */
public class Pos {
  public static final Pos ZERO = new Pos(0, 0, 1, 1, 1, 1);

  public final int startOffset;
  public final int endOffset;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;

  /** Creates a Pos. */
  public Pos(
      int startOffset,
      int endOffset,
      int startLine,
      int startColumn,
      int endLine,
      int endColumn) {
    this.startOffset = startOffset;
    this.endOffset = endOffset;
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  /** Creates a Pos from two offsets into a query string. */
  public static Pos of(String text, int startOffset, int endOffset) {
    final IntPair start = lineCol(text, startOffset);
    final IntPair end = lineCol(text, endOffset);
    return new Pos(
        startOffset,
        endOffset,
        start.source,
        start.target,
        end.source,
        end.target);
  }

  @Override
  public int hashCode() {
    return Objects.hash(startOffset, endOffset);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
            && startOffset == ((Pos) o).startOffset
            && endOffset == ((Pos) o).endOffset
            && startLine == ((Pos) o).startLine
            && startColumn == ((Pos) o).startColumn;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /** Writes this position as "line.column" or "line.column-line.column". */
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(startLine).append('.').append(startColumn);
    if (endColumn != startColumn + 1 || endLine != startLine) {
      buf.append('-').append(endLine).append('.').append(endColumn);
    }
    return buf;
  }

  /** Returns a position that spans this and another position. */
  public Pos plus(Pos pos) {
    final Pos start = pos.startOffset < startOffset ? pos : this;
    final Pos end = pos.endOffset > endOffset ? pos : this;
    return new Pos(
        start.startOffset,
        end.endOffset,
        start.startLine,
        start.startColumn,
        end.endLine,
        end.endColumn);
  }

  /**
   * Combines the positions of a non-empty list of nodes to create a position
   * which spans from the beginning of the first to the end of the last.
   */
  public static Pos sum(List<? extends AstNode> nodes) {
    if (nodes.isEmpty()) {
      throw new IllegalArgumentException("empty");
    }
    Pos pos = nodes.get(0).pos;
    for (AstNode node : nodes) {
      pos = pos.plus(node.pos);
    }
    return pos;
  }

  /** Returns the 1-based line and column of an offset. */
  private static IntPair lineCol(String s, int offset) {
    if (offset < 0 || offset > s.length()) {
      throw new IllegalArgumentException("offset " + offset + " out of range");
    }
    int line = 1;
    int lineStart = 0;
    for (int i = 0; i < offset; i++) {
      if (s.charAt(i) == '\n') {
        ++line;
        lineStart = i + 1;
      }
    }
    return IntPair.of(line, offset - lineStart + 1);
  }
}

// End Pos.java
