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

import static java.util.Objects.requireNonNull;

/** Abstract syntax tree node. */
public abstract class AstNode {
  public final Pos pos;
  public final Op op;

  public AstNode(Pos pos, Op op) {
    this.pos = requireNonNull(pos);
    this.op = requireNonNull(op);
  }

  /**
   * Converts this node into a query string.
   *
   * <p>The string is canonical: field names are as written, keywords are
   * lower case, string literals are double-quoted, and parentheses appear
   * only where precedence requires them. Parsing the result yields an
   * equivalent tree.
   */
  @Override
  public final String toString() {
    return unparse(new AstWriter(), 0, 0).toString();
  }

  /**
   * Writes this node to a writer.
   *
   * @param w Writer
   * @param left Precedence of the operator to the left
   * @param right Precedence of the operator to the right
   * @return Writer
   */
  abstract AstWriter unparse(AstWriter w, int left, int right);
}

// End AstNode.java
