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

import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Shared, mutable slot that holds a closure until it is evaluated, and the
 * value afterwards.
 *
 * <p>A thunk moves through the states {@link State#UNEVALUATED},
 * {@link State#IN_PROGRESS}, {@link State#EVALUATED}, each at most once. Any
 * number of environments may refer to the same thunk; whichever forces it
 * first does the work, and the others see the value.
 *
 * <p>Forcing is the evaluator's job: it calls {@link #begin()} to obtain the
 * closure, evaluates it, then calls {@link #update(Object)}. If evaluation
 * fails, it calls {@link #abandon()} so that the thunk may be forced again.
 */
public class Thunk {
  private State state;
  private @Nullable Closure closure;
  private @Nullable Object value;

  /** Creates an unevaluated thunk. */
  public Thunk(Closure closure) {
    this(State.UNEVALUATED, requireNonNull(closure), null);
  }

  private Thunk(State state, @Nullable Closure closure,
      @Nullable Object value) {
    this.state = state;
    this.closure = closure;
    this.value = value;
  }

  /** Creates a thunk that has already been evaluated. */
  public static Thunk evaluated(Object value) {
    return new Thunk(State.EVALUATED, null, requireNonNull(value));
  }

  public State state() {
    return state;
  }

  /** Returns the closure of an unevaluated or in-progress thunk. */
  public Closure closure() {
    if (closure == null) {
      throw new IllegalStateException("thunk has been evaluated");
    }
    return closure;
  }

  /** Returns the value of an evaluated thunk. */
  public Object value() {
    if (state != State.EVALUATED) {
      throw new IllegalStateException("thunk is " + state);
    }
    return requireNonNull(value);
  }

  /** Marks this thunk as being evaluated, and returns its closure.
   *
   * <p>Throws if the thunk is already being evaluated; that means that its
   * value depends on itself. */
  public Closure begin() {
    switch (state) {
    case UNEVALUATED:
      state = State.IN_PROGRESS;
      return closure();
    case IN_PROGRESS:
      throw new IllegalStateException("infinite recursion");
    default:
      throw new IllegalStateException("thunk has been evaluated");
    }
  }

  /** Stores the value of a thunk that is being evaluated. The closure is
   * released. */
  public void update(Object value) {
    if (state != State.IN_PROGRESS) {
      throw new IllegalStateException("thunk is " + state);
    }
    this.value = requireNonNull(value);
    this.closure = null;
    this.state = State.EVALUATED;
  }

  /** Returns a thunk that is being evaluated to the unevaluated state. */
  public void abandon() {
    if (state != State.IN_PROGRESS) {
      throw new IllegalStateException("thunk is " + state);
    }
    state = State.UNEVALUATED;
  }

  @Override
  public String toString() {
    switch (state) {
    case EVALUATED:
      return "Thunk(" + value + ")";
    default:
      return "Thunk(" + state + ", " + closure().body + ")";
    }
  }

  /** State of a thunk. */
  public enum State {
    UNEVALUATED,
    IN_PROGRESS,
    EVALUATED
  }
}

// End Thunk.java
