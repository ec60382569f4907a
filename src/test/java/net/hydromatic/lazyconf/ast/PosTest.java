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
package net.hydromatic.lazyconf.ast;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;

import org.junit.jupiter.api.Test;

/** Tests for {@link Pos}. */
public class PosTest {
  @Test void testOf() {
    final String source = "let x = 1\nin x + 2";
    final Pos pos = Pos.of(source, "a.ncl", 4, 5);
    assertThat(pos, hasToString("a.ncl:1.5"));
    final Pos pos2 = Pos.of(source, "a.ncl", 10, 18);
    assertThat(pos2, hasToString("a.ncl:2.1-2.9"));
  }

  @Test void testZero() {
    assertThat(Pos.ZERO.isZero(), is(true));
    assertThat(new Pos("a.ncl", 0, 0, 0, 0).isZero(), is(false));
    assertThat(Pos.ZERO, hasToString("0.0-0.0"));
  }

  @Test void testEqualsIncludesFile() {
    final Pos a = new Pos("a.ncl", 1, 1, 1, 5);
    final Pos b = new Pos("b.ncl", 1, 1, 1, 5);
    assertThat(a.equals(b), is(false));
    assertThat(a.equals(new Pos("a.ncl", 1, 1, 1, 5)), is(true));
  }

  @Test void testPlus() {
    final Pos a = new Pos("a.ncl", 1, 5, 1, 8);
    final Pos b = new Pos("a.ncl", 2, 1, 2, 4);
    assertThat(a.plus(b), hasToString("a.ncl:1.5-2.4"));
    assertThat(b.plus(a), hasToString("a.ncl:1.5-2.4"));
    assertThat(a.plus(Pos.ZERO), sameInstance(a));
    assertThat(Pos.ZERO.plus(a), sameInstance(a));
  }
}

// End PosTest.java
