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

import net.hydromatic.lazyconf.compile.NameGenerator;

/**
 * Structure that can be packed, together with an environment, as a closure.
 *
 * <p>The typical implementer is {@link net.hydromatic.lazyconf.ast.Ast.Term},
 * but structures that contain terms can also be closurizable, such as the
 * contract of a {@link net.hydromatic.lazyconf.type.Types}. In that case, the
 * inner term is closurized.
 *
 * @param <T> Type of the structure
 */
public interface Closurizable<T> {
  /**
   * Packs this structure, together with its environment {@code withEnv}, as a
   * closure in the main environment {@code env}.
   *
   * <p>Adds exactly one binding to {@code env}, under a fresh name generated
   * by {@code nameGenerator}, and returns a structure that refers to it.
   * Does not modify {@code withEnv}.
   */
  T closurize(NameGenerator nameGenerator, EvalEnv env, EvalEnv withEnv);

  /**
   * Packs this structure as a closure, generating the binding's name from the
   * {@link NameGenerator#shared() shared} name generator.
   *
   * <p>Use this method only for terms that were transformed using the shared
   * generator, such as by
   * {@link net.hydromatic.lazyconf.compile.Transformer#create()}. If the
   * term was transformed with another generator, call
   * {@link #closurize(NameGenerator, EvalEnv, EvalEnv)} with that generator,
   * so that the new name cannot clash with a name already bound in
   * {@code env}.
   */
  default T closurize(EvalEnv env, EvalEnv withEnv) {
    return closurize(NameGenerator.shared(), env, withEnv);
  }
}

// End Closurizable.java
