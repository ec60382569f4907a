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
package net.hydromatic.lazyconf.eval;

import static net.hydromatic.lazyconf.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;

import net.hydromatic.lazyconf.ast.Ast;
import net.hydromatic.lazyconf.ast.Ident;
import net.hydromatic.lazyconf.ast.Op;
import net.hydromatic.lazyconf.ast.Pos;
import net.hydromatic.lazyconf.compile.NameGenerator;
import net.hydromatic.lazyconf.type.Types;
import org.junit.jupiter.api.Test;

/** Tests for {@link Closurizable}. */
public class ClosurizableTest {
  @Test void testClosurizeTerm() {
    final NameGenerator nameGenerator = new NameGenerator();
    final EvalEnv env = EvalEnv.empty();
    env.insert(Ident.of("a"), Thunk.evaluated(1), IdentKind.LET);
    final EvalEnv withEnv = EvalEnv.empty();
    withEnv.insert(Ident.of("y"), Thunk.evaluated(2), IdentKind.LET);

    final Pos pos = new Pos("a.ncl", 1, 1, 1, 6);
    final Ast.Term term = ast.infixCall(pos, Op.PLUS,
        ast.var(Ident.of("y")), ast.numLiteral(Pos.ZERO, 1));
    final Ast.Term result = term.closurize(nameGenerator, env, withEnv);

    // The result is a fresh variable, at the position of the term.
    assertThat(result, hasToString("%0"));
    assertThat(result.op, is(Op.VAR));
    assertThat(result.pos, is(pos));

    // Exactly one binding was added to "env", and none to "withEnv".
    assertThat(env.size(), is(2));
    assertThat(withEnv.size(), is(1));
    final EvalEnv.Binding binding = env.getOpt(((Ast.Var) result).id);
    assertThat(binding.kind, is(IdentKind.RECORD));
    assertThat(binding.thunk.state(), is(Thunk.State.UNEVALUATED));
    assertThat(binding.thunk.closure().body, sameInstance(term));
    assertThat(binding.thunk.closure().env, sameInstance(withEnv));
  }

  /** Tests that two closurizations generate distinct names. */
  @Test void testClosurizeTwice() {
    final NameGenerator nameGenerator = new NameGenerator();
    final EvalEnv env = EvalEnv.empty();
    final Ast.Term term = ast.numLiteral(Pos.ZERO, 1);
    final Ast.Term r1 = term.closurize(nameGenerator, env, EvalEnv.empty());
    final Ast.Term r2 = term.closurize(nameGenerator, env, EvalEnv.empty());
    assertThat(r1, hasToString("%0"));
    assertThat(r2, hasToString("%1"));
    assertThat(env.size(), is(2));
  }

  @Test void testClosurizeWithSharedGenerator() {
    final EvalEnv env = EvalEnv.empty();
    final Ast.Term result =
        ast.numLiteral(Pos.ZERO, 1).closurize(env, EvalEnv.empty());
    assertThat(((Ast.Var) result).id.isGenerated(), is(true));
    assertThat(env.size(), is(1));
  }

  /** Tests that closurizing a type closurizes its contract and returns an
   * opaque type whose contract is a variable. */
  @Test void testClosurizeType() {
    final NameGenerator nameGenerator = new NameGenerator();
    final EvalEnv env = EvalEnv.empty();
    final EvalEnv withEnv = EvalEnv.empty();
    final Types type = Types.list(Types.NUM);
    final Types result = type.closurize(nameGenerator, env, withEnv);
    assertThat(result.op, is(Op.FLAT_TYPE));
    assertThat(result.flat, hasToString("%0"));
    assertThat(result, hasToString("#%0"));
    assertThat(env.size(), is(1));
    assertThat(env.getOpt(Ident.of("%0")).thunk.closure().body,
        hasToString("$list $num"));
    assertThat(env.getOpt(Ident.of("%0")).thunk.closure().env,
        sameInstance(withEnv));
  }
}

// End ClosurizableTest.java
