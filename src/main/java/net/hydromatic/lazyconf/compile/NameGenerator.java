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

import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.lazyconf.ast.Ident;

/**
 * Generates unique names.
 *
 * <p>Names are unique within a generator; they begin with
 * {@link Ident#GENERATED_SIGIL} and so never clash with user-defined names.
 * Use {@link #shared()} for names that must be unique across the process.
 * Tests create their own generator, so that the names they see are
 * predictable.
 */
public class NameGenerator {
  private static final NameGenerator SHARED = new NameGenerator();

  private final AtomicInteger id = new AtomicInteger();

  /** Returns the generator shared by every pipeline in this process. */
  public static NameGenerator shared() {
    return SHARED;
  }

  /** Generates an identifier that is unique in this generator. */
  public Ident fresh() {
    return Ident.of(Ident.GENERATED_SIGIL
        + Integer.toString(id.getAndIncrement()));
  }
}

// End NameGenerator.java
