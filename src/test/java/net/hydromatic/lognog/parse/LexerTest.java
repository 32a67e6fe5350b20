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

import static net.hydromatic.lognog.parse.DslParserImplConstants.AND;
import static net.hydromatic.lognog.parse.DslParserImplConstants.COMMA;
import static net.hydromatic.lognog.parse.DslParserImplConstants.COMMAND;
import static net.hydromatic.lognog.parse.DslParserImplConstants.COMMAND_NAME;
import static net.hydromatic.lognog.parse.DslParserImplConstants.DEFAULT;
import static net.hydromatic.lognog.parse.DslParserImplConstants.EQ;
import static net.hydromatic.lognog.parse.DslParserImplConstants.EXPRESSION;
import static net.hydromatic.lognog.parse.DslParserImplConstants.GE;
import static net.hydromatic.lognog.parse.DslParserImplConstants.IDENT;
import static net.hydromatic.lognog.parse.DslParserImplConstants.ILLEGAL;
import static net.hydromatic.lognog.parse.DslParserImplConstants.LPAREN;
import static net.hydromatic.lognog.parse.DslParserImplConstants.LT;
import static net.hydromatic.lognog.parse.DslParserImplConstants.MATCH;
import static net.hydromatic.lognog.parse.DslParserImplConstants.MINUS;
import static net.hydromatic.lognog.parse.DslParserImplConstants.NE;
import static net.hydromatic.lognog.parse.DslParserImplConstants.NOT;
import static net.hydromatic.lognog.parse.DslParserImplConstants.NUMBER;
import static net.hydromatic.lognog.parse.DslParserImplConstants.PERCENT;
import static net.hydromatic.lognog.parse.DslParserImplConstants.PIPE;
import static net.hydromatic.lognog.parse.DslParserImplConstants.PLUS;
import static net.hydromatic.lognog.parse.DslParserImplConstants.REGEX;
import static net.hydromatic.lognog.parse.DslParserImplConstants.RPAREN;
import static net.hydromatic.lognog.parse.DslParserImplConstants.SEARCH_NUMBER;
import static net.hydromatic.lognog.parse.DslParserImplConstants.SLASH;
import static net.hydromatic.lognog.parse.DslParserImplConstants.STAR;
import static net.hydromatic.lognog.parse.DslParserImplConstants.STATS;
import static net.hydromatic.lognog.parse.DslParserImplConstants.STRING;
import static net.hydromatic.lognog.parse.DslParserImplConstants.UNTERMINATED_STRING;
import static net.hydromatic.lognog.parse.DslParserImplConstants.WHERE;
import static net.hydromatic.lognog.parse.DslParserImplConstants.WORD;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Ints;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests the token manager generated from {@code DslParser.jj}, and
 * {@link Parsers}. */
public class LexerTest {
  /** Tokenizes text, starting in a given lexical state, and returns the
   * tokens before the end of input. */
  private static List<Token> tokens(String text, int state) {
    final DslParserImplTokenManager tokenManager =
        new DslParserImplTokenManager(
            new SimpleCharStream(new StringReader(text)), state);
    final List<Token> tokens = new ArrayList<>();
    for (;;) {
      final Token token = tokenManager.getNextToken();
      if (token.kind == DslParserImplConstants.EOF) {
        return tokens;
      }
      tokens.add(token);
    }
  }

  private static String images(List<Token> tokens) {
    final List<String> images = new ArrayList<>();
    for (Token token : tokens) {
      images.add(token.image);
    }
    return images.toString();
  }

  private static List<Integer> kinds(List<Token> tokens) {
    final List<Integer> kinds = new ArrayList<>();
    for (Token token : tokens) {
      kinds.add(token.kind);
    }
    return kinds;
  }

  private static List<Integer> kinds(int... kinds) {
    return Ints.asList(kinds);
  }

  @Test void testSearchTokens() {
    final List<Token> tokens = tokens("host=web-* AND bytes>=100", DEFAULT);
    assertThat(images(tokens), is("[host, =, web-*, AND, bytes, >=, 100]"));
    assertThat(kinds(tokens),
        is(kinds(WORD, EQ, WORD, AND, WORD, GE, SEARCH_NUMBER)));

    final List<Token> tokens2 = tokens("status!=200 x==-1.5 a!b", DEFAULT);
    assertThat(images(tokens2), is("[status, !=, 200, x, ==, -1.5, a!b]"));
    assertThat(kinds(tokens2),
        is(kinds(WORD, NE, SEARCH_NUMBER, WORD, EQ, SEARCH_NUMBER, WORD)));

    final List<Token> tokens3 = tokens("ip=10.0.0.1 not (x<3)", DEFAULT);
    assertThat(images(tokens3), is("[ip, =, 10.0.0.1, not, (, x, <, 3, )]"));
    assertThat(kinds(tokens3),
        is(kinds(WORD, EQ, WORD, NOT, LPAREN, WORD, LT, SEARCH_NUMBER,
            RPAREN)));
  }

  @Test void testNumberTokens() {
    assertThat(kinds(tokens("1e3 -2.5E-2 1e", DEFAULT)),
        is(kinds(SEARCH_NUMBER, SEARCH_NUMBER, WORD)));
    final List<Token> tokens = tokens("bytes*1e308 2.5e+3 5m 1e", EXPRESSION);
    assertThat(images(tokens), is("[bytes, *, 1e308, 2.5e+3, 5m, 1e]"));
    assertThat(kinds(tokens),
        is(kinds(IDENT, STAR, NUMBER, NUMBER, IDENT, IDENT)));
  }

  /** A slash starts a regular expression only after a match operator. */
  @Test void testRegexToken() {
    final List<Token> tokens = tokens("msg~/err.*\\/x/", DEFAULT);
    assertThat(images(tokens), is("[msg, ~, /err.*\\/x/]"));
    assertThat(kinds(tokens), is(kinds(WORD, MATCH, REGEX)));

    assertThat(kinds(tokens("msg: /a|b/ x", DEFAULT)),
        is(kinds(WORD, MATCH, REGEX, WORD)));

    final List<Token> tokens2 = tokens("GET /index.html", DEFAULT);
    assertThat(images(tokens2), is("[GET, /index.html]"));
    assertThat(kinds(tokens2), is(kinds(WORD, WORD)));

    // After the value, a slash is part of a word again
    assertThat(kinds(tokens("a~b /x/ | c", DEFAULT)),
        is(kinds(WORD, MATCH, WORD, WORD, PIPE, COMMAND_NAME)));
  }

  @Test void testStringTokens() {
    final List<Token> tokens = tokens("\"a \\\"b\\\"\" 'c d'", DEFAULT);
    assertThat(kinds(tokens), is(kinds(STRING, STRING)));
    assertThat(Parsers.unquote(tokens.get(0).image), is("a \"b\""));
    assertThat(Parsers.unquote(tokens.get(1).image), is("c d"));

    assertThat(kinds(tokens("host=\"web01", DEFAULT)),
        is(kinds(WORD, EQ, UNTERMINATED_STRING)));
  }

  @Test void testExpressionTokens() {
    final List<Token> tokens = tokens("kb=bytes/1024 + 5m", EXPRESSION);
    assertThat(images(tokens), is("[kb, =, bytes, /, 1024, +, 5m]"));
    assertThat(kinds(tokens),
        is(kinds(IDENT, EQ, IDENT, SLASH, NUMBER, PLUS, IDENT)));

    final List<Token> tokens2 = tokens("a.b_c@d, -2.5*x%3", EXPRESSION);
    assertThat(images(tokens2), is("[a.b_c@d, ,, -, 2.5, *, x, %, 3]"));
    assertThat(kinds(tokens2),
        is(kinds(IDENT, COMMA, MINUS, NUMBER, STAR, IDENT, PERCENT,
            NUMBER)));
  }

  /** A pipe switches to the command state, and the command keyword chooses
   * the state of the rest of the stage. */
  @Test void testCommandTokens() {
    final List<Token> tokens =
        tokens("a-b | STATS count | where x-y | foo-1", DEFAULT);
    assertThat(images(tokens),
        is("[a-b, |, STATS, count, |, where, x-y, |, foo, -, 1]"));
    assertThat(kinds(tokens),
        is(kinds(WORD, PIPE, STATS, IDENT, PIPE, WHERE, WORD, PIPE,
            COMMAND_NAME, ILLEGAL, COMMAND_NAME)));
    assertThat(kinds(tokens("statsx", COMMAND)), is(kinds(COMMAND_NAME)));
  }

  @Test void testComments() {
    assertThat(images(tokens("x # comment\ny", EXPRESSION)), is("[x, y]"));
    assertThat(tokens("# all comment", DEFAULT).isEmpty(), is(true));
  }

  @Test void testUnexpectedCharacter() {
    final List<Token> tokens = tokens("a ; b", EXPRESSION);
    assertThat(kinds(tokens), is(kinds(IDENT, ILLEGAL, IDENT)));
    final LogNogParseException e =
        assertThrows(LogNogParseException.class, () ->
            DslParser.parse("* | eval x = a ; b"));
    assertThat(e.getMessage(), is("Unexpected character ';'"));
    assertThat(e.pos().toString(), is("1.16"));
  }

  /** Token positions count a tab as one column, and lines may end with
   * "\r\n". */
  @Test void testPositions() {
    final LogNogParseException e =
        assertThrows(LogNogParseException.class, () ->
            DslParser.parse("*\t|\tbar"));
    assertThat(e.describeTo(new StringBuilder()).toString(),
        is("1.5-1.8 Error: Unknown command 'bar'"));
    final LogNogParseException e2 =
        assertThrows(LogNogParseException.class, () ->
            DslParser.parse("x\r\n|\tbar"));
    assertThat(e2.pos().toString(), is("2.3-2.6"));
    assertThat(e2.pos().startOffset, is(5));
  }

  @Test void testLineStarts() {
    assertThat(Ints.asList(Parsers.lineStarts("")), is(Ints.asList(0)));
    assertThat(Ints.asList(Parsers.lineStarts("ab\ncd\r\nef\rg")),
        is(Ints.asList(0, 3, 7, 10)));
  }

  @Test void testUnslash() {
    assertThat(Parsers.unslash("/a\\/b/"), is("a/b"));
    assertThat(Parsers.unslash("//"), is(""));
    assertThrows(IllegalArgumentException.class, () ->
        Parsers.unslash("/a"));
  }

  @Test void testUnquote() {
    assertThat(Parsers.unquote("\"a\\\"b\""), is("a\"b"));
    assertThat(Parsers.unquote("'it\\'s'"), is("it's"));
    assertThat(Parsers.unquote("\"\\w+\""), is("\\w+"));
    assertThat(Parsers.quote("say \"hi\""), is("\"say \\\"hi\\\"\""));
    assertThat(Parsers.unquote(Parsers.quote("a\\b\"c")), is("a\\b\"c"));
  }

  @Test void testNamedGroups() {
    final Parsers.NamedGroups g =
        Parsers.namedGroups("(?<user_name>\\w+)@(x|y)(?P<domain>[a-z(]+)");
    assertThat(g.regex, is("(\\w+)@(x|y)([a-z(]+)"));
    assertThat(g.groups, is(ImmutableMap.of("user_name", 1, "domain", 3)));

    final Parsers.NamedGroups g2 = Parsers.namedGroups("(?:a)(?<b>c)");
    assertThat(g2.regex, is("(?:a)(c)"));
    assertThat(g2.groups, is(ImmutableMap.of("b", 1)));

    assertThrows(IllegalArgumentException.class, () ->
        Parsers.namedGroups("(?<a>x)(?<a>y)"));
  }
}

// End LexerTest.java
