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

import static java.util.Objects.requireNonNull;

import net.hydromatic.lazyconf.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Result of resolving an import.
 *
 * <p>Either the file was already in the resolver's cache ({@link #FROM_CACHE},
 * no term), or it has just been loaded ({@link #fromFile}, with the parsed
 * term, which has not yet been transformed).
 */
public final class ResolvedTerm {
  /** The file had already been resolved. */
  public static final ResolvedTerm FROM_CACHE = new ResolvedTerm(null);

  /** Term that was loaded from the file; null if it came from the cache. */
  public final Ast.@Nullable Term term;

  private ResolvedTerm(Ast.@Nullable Term term) {
    this.term = term;
  }

  /** Creates a result for a file that has just been loaded. */
  public static ResolvedTerm fromFile(Ast.Term term) {
    return new ResolvedTerm(requireNonNull(term));
  }

  /** Returns whether the file had already been resolved. */
  public boolean isFromCache() {
    return term == null;
  }

  @Override
  public String toString() {
    return term == null ? "FROM_CACHE" : "FROM_FILE(" + term + ")";
  }
}

// End ResolvedTerm.java
