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
package net.hydromatic.lazyconf.type;

import static net.hydromatic.lazyconf.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.lazyconf.ast.Ast;
import net.hydromatic.lazyconf.ast.Ident;
import net.hydromatic.lazyconf.ast.Op;
import net.hydromatic.lazyconf.ast.Pos;
import org.junit.jupiter.api.Test;

/** Tests for {@link Types} and {@link Label}. */
public class TypesTest {
  @Test void testToString() {
    assertThat(Types.NUM, hasToString("Num"));
    assertThat(Types.list(Types.STR), hasToString("List Str"));
    final Types fn = Types.arrow(Types.NUM, Types.BOOL);
    assertThat(fn, hasToString("Num -> Bool"));
    assertThat(Types.arrow(fn, Types.NUM), hasToString("(Num -> Bool) -> Num"));
    assertThat(Types.arrow(Types.NUM, fn), hasToString("Num -> Num -> Bool"));
    assertThat(Types.list(fn), hasToString("List (Num -> Bool)"));
    assertThat(Types.flat(ast.var(Ident.of("Port"))), hasToString("#Port"));
  }

  @Test void testContract() {
    assertThat(Types.DYN.contract(), hasToString("$dyn"));
    assertThat(Types.SYM.contract(), hasToString("$sym"));
    assertThat(Types.list(Types.NUM).contract(), hasToString("$list $num"));
    assertThat(Types.arrow(Types.NUM, Types.list(Types.BOOL)).contract(),
        hasToString("$func $num ($list $bool)"));
    final Ast.Term port = ast.var(Ident.of("Port"));
    assertThat(Types.flat(port).contract(), sameInstance(port));
    assertThrows(AssertionError.class,
        () -> Types.builtInContract(Op.FLAT_TYPE));
  }

  @Test void testEquals() {
    assertThat(Types.list(Types.NUM).equals(Types.list(Types.NUM)),
        is(true));
    assertThat(Types.list(Types.NUM).equals(Types.list(Types.STR)),
        is(false));
  }

  @Test void testLabel() {
    final Pos pos = new Pos("a.ncl", 1, 1, 1, 4);
    final Label label = Label.of("port", pos);
    assertThat(label.polarity, is(true));
    assertThat(label, hasToString("port+@a.ncl:1.1-1.4"));
    assertThat(label.flip(), hasToString("port-@a.ncl:1.1-1.4"));
    assertThat(label.flip().flip(), is(label));
  }
}

// End TypesTest.java
