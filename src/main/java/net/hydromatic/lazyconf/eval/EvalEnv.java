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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import net.hydromatic.lazyconf.ast.Ident;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluation environment.
 *
 * <p>Maps each identifier to a {@link Thunk} and the {@link IdentKind} of the
 * construct that bound it. Unlike the environments used during compilation,
 * an evaluation environment is mutable: {@link #insert} adds a binding in
 * place. Several closures may capture the same environment, and all of them
 * see bindings added later.
 *
 * @see Closure
 */
public class EvalEnv {
  private final Map<Ident, Binding> map;

  private EvalEnv(Map<Ident, Binding> map) {
    this.map = map;
  }

  /** Creates an empty environment. */
  public static EvalEnv empty() {
    return new EvalEnv(new LinkedHashMap<>());
  }

  /** Adds a binding, replacing any existing binding of the same name. */
  public void insert(Ident id, Thunk thunk, IdentKind kind) {
    map.put(requireNonNull(id), new Binding(thunk, kind));
  }

  /** Returns the binding of {@code id} if bound, null if not. */
  public @Nullable Binding getOpt(Ident id) {
    return map.get(id);
  }

  /** Returns the number of bindings. */
  public int size() {
    return map.size();
  }

  /**
   * Creates an environment with the same bindings as this one.
   *
   * <p>The thunks are shared, not copied; but bindings subsequently inserted
   * into one environment are not seen by the other.
   */
  public EvalEnv copy() {
    return new EvalEnv(new LinkedHashMap<>(map));
  }

  /** Visits every binding in this environment, in insertion order. */
  public void visit(BiConsumer<Ident, Binding> consumer) {
    map.forEach(consumer);
  }

  /** Returns an immutable copy of the bindings. */
  public ImmutableMap<Ident, Binding> valueMap() {
    return ImmutableMap.copyOf(map);
  }

  /**
   * Converts this environment to a string.
   *
   * <p>This method does not override the {@link #toString()} method; if we
   * did, debuggers would invoke it automatically, and closures that capture
   * their own environment would print forever. Only names and kinds are
   * printed.
   */
  public String asString() {
    final StringBuilder b = new StringBuilder("{");
    visit((id, binding) ->
        b.append(b.length() > 1 ? ", " : "")
            .append(id)
            .append(": ")
            .append(binding.kind));
    return b.append("}").toString();
  }

  /** A thunk and the kind of construct that bound it. */
  public static class Binding {
    public final Thunk thunk;
    public final IdentKind kind;

    Binding(Thunk thunk, IdentKind kind) {
      this.thunk = requireNonNull(thunk);
      this.kind = requireNonNull(kind);
    }

    @Override
    public String toString() {
      return kind + ": " + thunk;
    }
  }
}

// End EvalEnv.java
