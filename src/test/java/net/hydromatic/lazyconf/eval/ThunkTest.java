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
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.lazyconf.ast.Pos;
import org.junit.jupiter.api.Test;

/** Tests for {@link Thunk}. */
public class ThunkTest {
  private static Closure closure() {
    return new Closure(ast.numLiteral(Pos.ZERO, 42), EvalEnv.empty());
  }

  @Test void testLifecycle() {
    final Closure closure = closure();
    final Thunk thunk = new Thunk(closure);
    assertThat(thunk.state(), is(Thunk.State.UNEVALUATED));
    assertThat(thunk, hasToString("Thunk(UNEVALUATED, 42)"));
    assertThrows(IllegalStateException.class, thunk::value);

    assertThat(thunk.begin(), sameInstance(closure));
    assertThat(thunk.state(), is(Thunk.State.IN_PROGRESS));

    thunk.update(42);
    assertThat(thunk.state(), is(Thunk.State.EVALUATED));
    assertThat(thunk.value(), is(42));
    assertThat(thunk, hasToString("Thunk(42)"));
    assertThrows(IllegalStateException.class, thunk::closure);
    assertThrows(IllegalStateException.class, thunk::begin);
  }

  /** Tests that forcing a thunk that is already being forced is detected as
   * infinite recursion. */
  @Test void testInfiniteRecursion() {
    final Thunk thunk = new Thunk(closure());
    thunk.begin();
    final IllegalStateException e =
        assertThrows(IllegalStateException.class, thunk::begin);
    assertThat(e.getMessage(), is("infinite recursion"));
  }

  @Test void testAbandon() {
    final Thunk thunk = new Thunk(closure());
    assertThrows(IllegalStateException.class, thunk::abandon);
    thunk.begin();
    thunk.abandon();
    assertThat(thunk.state(), is(Thunk.State.UNEVALUATED));
    thunk.begin();
    thunk.update("done");
    assertThat(thunk.value(), is("done"));
    assertThrows(IllegalStateException.class, () -> thunk.update("again"));
  }

  @Test void testEvaluated() {
    final Thunk thunk = Thunk.evaluated(true);
    assertThat(thunk.state(), is(Thunk.State.EVALUATED));
    assertThat(thunk.value(), is(true));
  }
}

// End ThunkTest.java
