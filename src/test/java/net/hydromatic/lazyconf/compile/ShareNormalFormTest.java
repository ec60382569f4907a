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
package net.hydromatic.lazyconf.compile;

import static net.hydromatic.lazyconf.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.lazyconf.ast.Ast;
import net.hydromatic.lazyconf.ast.Ident;
import net.hydromatic.lazyconf.ast.Op;
import net.hydromatic.lazyconf.ast.Pos;
import net.hydromatic.lazyconf.type.Label;
import net.hydromatic.lazyconf.type.Types;
import org.junit.jupiter.api.Test;

/** Tests for {@link ShareNormalForm}. */
public class ShareNormalFormTest {
  private static Ast.Term num(long n) {
    return ast.numLiteral(Pos.ZERO, n);
  }

  private static Ast.Term plus(long a, long b) {
    return ast.infixCall(Op.PLUS, num(a), num(b));
  }

  private static Ast.Term record(String name, Ast.Term value) {
    return ast.record(Pos.ZERO, ImmutableMap.of(Ident.of(name), value));
  }

  @Test void testRecord() {
    final NameGenerator nameGenerator = new NameGenerator();
    final Ast.Term term = record("a", plus(1, 1));
    assertThat(ShareNormalForm.transformOne(nameGenerator, term),
        hasToString("let %0 = 1 + 1 in {a = %0}"));
  }

  /** Tests a list. The first element is bound innermost; only the top node
   * is transformed, so the nested list is bound but not itself rewritten. */
  @Test void testList() {
    final NameGenerator nameGenerator = new NameGenerator();
    final Ast.Term term =
        ast.list(Pos.ZERO,
            ImmutableList.of(plus(1, 1),
                ast.list(Pos.ZERO, ImmutableList.of(plus(1, 2)))));
    assertThat(ShareNormalForm.transformOne(nameGenerator, term),
        hasToString("let %1 = [1 + 2] in let %0 = 1 + 1 in [%0, %1]"));
  }

  @Test void testRecordWithSeveralFields() {
    final NameGenerator nameGenerator = new NameGenerator();
    final Ast.Term term = ast.record(Pos.ZERO,
        ImmutableMap.of(Ident.of("x"), plus(1, 2),
            Ident.of("y"), num(3),
            Ident.of("z"), ast.var(Ident.of("w")),
            Ident.of("b"), record("c", plus(2, 2))));
    assertThat(ShareNormalForm.transformOne(nameGenerator, term),
        hasToString("let %1 = 1 + 2 in let %0 = {c = 2 + 2} in "
            + "{b = %0, x = %1, y = 3, z = w}"));
  }

  /** Tests that a term with nothing to share is returned unchanged. */
  @Test void testNothingToShare() {
    final NameGenerator nameGenerator = new NameGenerator();
    final Ast.Term record = ast.record(Pos.ZERO,
        ImmutableMap.of(Ident.of("a"), num(1),
            Ident.of("b"), ast.var(Ident.of("x")),
            Ident.of("c"), ast.fn(Pos.ZERO, Ident.of("y"), plus(1, 1))));
    assertThat(ShareNormalForm.transformOne(nameGenerator, record),
        sameInstance(record));

    final Ast.Term sum = plus(1, 1);
    assertThat(ShareNormalForm.transformOne(nameGenerator, sum),
        sameInstance(sum));

    final Ast.Term contract = ast.contract(Pos.ZERO, Types.NUM,
        Label.of("x", Pos.ZERO), plus(1, 1));
    assertThat(ShareNormalForm.transformOne(nameGenerator, contract),
        sameInstance(contract));
    assertThat(nameGenerator.fresh(), hasToString("%0"));
  }

  /** Tests that transforming a term twice does not change it further:
   * the shared sub-terms are now variables. */
  @Test void testIdempotent() {
    final NameGenerator nameGenerator = new NameGenerator();
    final Ast.Let let = (Ast.Let)
        ShareNormalForm.transformOne(nameGenerator, record("a", plus(1, 1)));
    assertThat(ShareNormalForm.transformOne(nameGenerator, let.body),
        sameInstance(let.body));
  }

  /** Tests that a list is idempotent too. */
  @Test void testIdempotentList() {
    final NameGenerator nameGenerator = new NameGenerator();
    final Ast.Term list =
        ast.list(Pos.ZERO, ImmutableList.of(plus(1, 1), plus(2, 2)));
    final Ast.Let let =
        (Ast.Let) ShareNormalForm.transformOne(nameGenerator, list);
    final Ast.Let let2 = (Ast.Let) let.body;
    assertThat(let2.body, hasToString("[%0, %1]"));
    assertThat(ShareNormalForm.transformOne(nameGenerator, let2.body),
        sameInstance(let2.body));
  }

  /** Tests that a wrapper that is the value of a record field is bound as a
   * whole; its contents are left for when the traversal reaches it. */
  @Test void testWrapperInRecord() {
    final NameGenerator nameGenerator = new NameGenerator();
    final Label label = Label.of("port", Pos.ZERO);
    final Ast.Term term = ast.record(Pos.ZERO,
        ImmutableMap.of(Ident.of("a"), ast.defaultValue(Pos.ZERO, plus(1, 1)),
            Ident.of("b"),
            ast.contract(Pos.ZERO, Types.NUM, label, num(8080)),
            Ident.of("c"), ast.docstring(Pos.ZERO, "doc", num(1))));
    final Ast.Term result =
        ShareNormalForm.transformOne(nameGenerator, term);
    assertThat(result,
        hasToString("let %2 = (1 | doc \"doc\") in "
            + "let %1 = (8080 | Num) in "
            + "let %0 = (default 1 + 1) in {a = %0, b = %1, c = %2}"));

    // Binding the inner "1 + 1" is the job of the next step.
    final Ast.Let let = (Ast.Let) ((Ast.Let) ((Ast.Let) result).body).body;
    assertThat(ShareNormalForm.transformOne(nameGenerator, let.exp),
        hasToString("let %3 = 1 + 1 in (default %3)"));
  }

  @Test void testWrappers() {
    final NameGenerator nameGenerator = new NameGenerator();
    final Label label = Label.of("port", Pos.ZERO);
    assertThat(
        ShareNormalForm.transformOne(nameGenerator,
            ast.defaultValue(Pos.ZERO, plus(1, 1))),
        hasToString("let %0 = 1 + 1 in (default %0)"));
    assertThat(
        ShareNormalForm.transformOne(nameGenerator,
            ast.contractWithDefault(Pos.ZERO, Types.NUM, label, plus(1, 2))),
        hasToString("let %1 = 1 + 2 in (default %1 | Num)"));
    assertThat(
        ShareNormalForm.transformOne(nameGenerator,
            ast.docstring(Pos.ZERO, "port", plus(1, 3))),
        hasToString("let %2 = 1 + 3 in (%2 | doc \"port\")"));
    assertThat(
        ShareNormalForm.transformOne(nameGenerator,
            ast.docstring(Pos.ZERO, "port", num(80))),
        hasToString("(80 | doc \"port\")"));
  }

  /** Tests that generated variables carry the position of the term they
   * replace, and the "let" carries the position of the record. */
  @Test void testPositions() {
    final NameGenerator nameGenerator = new NameGenerator();
    final Pos recordPos = new Pos("a.ncl", 1, 1, 1, 12);
    final Pos fieldPos = new Pos("a.ncl", 1, 6, 1, 11);
    final Ast.Term term = ast.record(recordPos,
        ImmutableMap.of(Ident.of("a"),
            ast.infixCall(fieldPos, Op.PLUS, num(1), num(1))));
    final Ast.Let let =
        (Ast.Let) ShareNormalForm.transformOne(nameGenerator, term);
    assertThat(let.pos, is(recordPos));
    assertThat(let.body.pos, is(recordPos));
    final Ast.Term a = ((Ast.Record) let.body).fields.get(Ident.of("a"));
    assertThat(a.op, is(Op.VAR));
    assertThat(a.pos, is(fieldPos));
    assertThat(((Ast.Var) a).id.isGenerated(), is(true));
  }

  @Test void testShouldShare() {
    final Pos pos = Pos.ZERO;
    assertThat(ShareNormalForm.shouldShare(num(1)), is(false));
    assertThat(ShareNormalForm.shouldShare(ast.boolLiteral(pos, true)),
        is(false));
    assertThat(ShareNormalForm.shouldShare(ast.stringLiteral(pos, "s")),
        is(false));
    assertThat(
        ShareNormalForm.shouldShare(ast.label(pos, Label.of("l", pos))),
        is(false));
    assertThat(ShareNormalForm.shouldShare(ast.sym(pos, 1)), is(false));
    assertThat(ShareNormalForm.shouldShare(ast.var(Ident.of("x"))),
        is(false));
    assertThat(ShareNormalForm.shouldShare(ast.enumTag(pos, Ident.of("A"))),
        is(false));
    assertThat(
        ShareNormalForm.shouldShare(ast.fn(pos, Ident.of("x"), plus(1, 1))),
        is(false));

    assertThat(ShareNormalForm.shouldShare(plus(1, 1)), is(true));
    assertThat(
        ShareNormalForm.shouldShare(
            ast.let(pos, Ident.of("x"), num(1), ast.var(Ident.of("x")))),
        is(true));
    assertThat(ShareNormalForm.shouldShare(ast.defaultValue(pos, num(1))),
        is(true));
    assertThat(
        ShareNormalForm.shouldShare(
            ast.contract(pos, Types.NUM, Label.of("l", pos), num(1))),
        is(true));
    assertThat(
        ShareNormalForm.shouldShare(
            ast.contractWithDefault(pos, Types.NUM, Label.of("l", pos),
                num(1))),
        is(true));
    assertThat(ShareNormalForm.shouldShare(ast.docstring(pos, "d", num(1))),
        is(true));
    assertThat(ShareNormalForm.shouldShare(record("a", num(1))), is(true));
    assertThat(
        ShareNormalForm.shouldShare(ast.list(pos, ImmutableList.of())),
        is(true));
    assertThat(ShareNormalForm.shouldShare(ast.importOf(pos, "a.ncl")),
        is(true));
    assertThat(
        ShareNormalForm.shouldShare(ast.apply(pos, ast.var(Ident.of("f")),
            num(1))),
        is(true));
  }
}

// End ShareNormalFormTest.java
