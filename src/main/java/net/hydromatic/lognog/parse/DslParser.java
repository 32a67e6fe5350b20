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
package net.hydromatic.lognog.parse;

import java.io.StringReader;
import net.hydromatic.lognog.ast.Ast;

/**
 * Parser for the pipeline query language.
 *
 * <p>The grammar is in {@code DslParser.jj}; JavaCC generates
 * {@link DslParserImpl} from it. This class runs the generated parser and
 * converts its errors into {@link LogNogParseException}.
 *
 * <p>The first stage is always a search; if it begins with some other
 * command keyword, or is empty, an implicit {@code search *} is inserted
 * before it. Each later stage begins with a command keyword.
 *
 * <p>Search and {@code where} predicates use this grammar, in increasing
 * order of precedence:
 *
 * <pre>{@code
 * orExp       := implicitAnd ( OR implicitAnd )*
 * implicitAnd := andExp andExp*
 * andExp      := notExp ( AND notExp )*
 * notExp      := NOT notExp | term
 * term        := '(' orExp ')'
 *              | operand op value
 *              | value
 * operand     := field | function '(' args ')'
 * }</pre>
 *
 * <p>A value with no operator is a free-text term; it is represented as a
 * string literal, and the resolver turns it into a match on the message.
 *
 * <p>The right side of a comparison is always a value, never a field: in
 * {@code host=web01}, {@code web01} is a string.
 */
public class DslParser {
  private DslParser() {}

  /** Parses a query. */
  public static Ast.Pipeline parse(String text) {
    final DslParserImpl parser = new DslParserImpl(new StringReader(text));
    parser.zero(text);
    try {
      return parser.pipeline();
    } catch (ParseException e) {
      final Token token =
          e.currentToken == null || e.currentToken.next == null
              ? parser.getToken(1)
              : e.currentToken.next;
      throw parser.unexpected(token, null, e);
    } catch (TokenMgrError e) {
      throw new LogNogParseException(e.getMessage(),
          parser.pos(parser.token), e);
    }
  }
}

// End DslParser.java
