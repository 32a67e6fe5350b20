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
package net.hydromatic.lognog.util;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

/** Tests {@link Wildcards}. */
public class WildcardsTest {
  @Test void testShape() {
    assertThat(Wildcards.shape("abc"), is(Wildcards.Shape.EXACT));
    assertThat(Wildcards.shape("*"), is(Wildcards.Shape.ANY));
    assertThat(Wildcards.shape("**"), is(Wildcards.Shape.ANY));
    assertThat(Wildcards.shape("abc*"), is(Wildcards.Shape.PREFIX));
    assertThat(Wildcards.shape("abc**"), is(Wildcards.Shape.PREFIX));
    assertThat(Wildcards.shape("*abc"), is(Wildcards.Shape.SUFFIX));
    assertThat(Wildcards.shape("*abc*"), is(Wildcards.Shape.CONTAINS));
    assertThat(Wildcards.shape("a*c"), is(Wildcards.Shape.GENERAL));
    assertThat(Wildcards.shape("*a*c"), is(Wildcards.Shape.GENERAL));
  }

  @Test void testStrip() {
    assertThat(Wildcards.strip("**ab*c**"), is("ab*c"));
    assertThat(Wildcards.strip("abc"), is("abc"));
    assertThat(Wildcards.strip("***"), is(""));
    assertThat(Wildcards.hasWildcard("a*"), is(true));
    assertThat(Wildcards.hasWildcard("a?"), is(false));
  }

  /** The pattern matches the whole string; other characters, including
   * regex metacharacters, match literally. */
  @Test void testToPattern() {
    final Pattern web = Wildcards.toPattern("web*", false);
    assertThat(web.matcher("web01").matches(), is(true));
    assertThat(web.matcher("web").matches(), is(true));
    assertThat(web.matcher("WEB01").matches(), is(false));
    assertThat(web.matcher("myweb01").matches(), is(false));
    assertThat(Wildcards.toPattern("web*", true).matcher("WEB01").matches(),
        is(true));

    final Pattern dot = Wildcards.toPattern("a.c*", false);
    assertThat(dot.matcher("abcd").matches(), is(false));
    assertThat(dot.matcher("a.cd").matches(), is(true));

    final Pattern middle = Wildcards.toPattern("GET*500", false);
    assertThat(middle.matcher("GET /x\n500").matches(), is(true));
    assertThat(middle.matcher("GET /x 200").matches(), is(false));
  }

  @Test void testToLike() {
    assertThat(Wildcards.toLike("web*"), is("web%"));
    assertThat(Wildcards.toLike("*err*"), is("%err%"));
    assertThat(Wildcards.toLike("50%_*"), is("50\\%\\_%"));
    assertThat(Wildcards.toLike("a\\b"), is("a\\\\b"));
  }
}

// End WildcardsTest.java
