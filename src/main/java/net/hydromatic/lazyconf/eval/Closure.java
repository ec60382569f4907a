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

import net.hydromatic.lazyconf.ast.Ast;

/** A term together with the environment that is sufficient to evaluate it.
 *
 * <p>A closure is immutable. The environment is not copied; it is shared with
 * any other closure that captured it. */
public class Closure {
  public final Ast.Term body;

  /** Environment for evaluation. Contains the variables "captured" from the
   * environment when the closure was created. */
  public final EvalEnv env;

  public Closure(Ast.Term body, EvalEnv env) {
    this.body = requireNonNull(body);
    this.env = requireNonNull(env);
  }

  @Override
  public String toString() {
    return "Closure(body = " + body + ", env = " + env.asString() + ")";
  }
}

// End Closure.java
