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
package net.hydromatic.lazyconf.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.Interner;
import com.google.common.collect.Interners;
import com.google.common.collect.Ordering;

/**
 * Identifier.
 *
 * <p>Identifiers are interned: two identifiers with the same name are the same
 * object, so they can be compared using {@code ==} as well as
 * {@link #equals}.
 *
 * <p>Identifiers generated by the compiler (see
 * {@link net.hydromatic.lazyconf.compile.NameGenerator}) begin with
 * {@link #GENERATED_SIGIL}, a character that the grammar does not allow in
 * user-defined identifiers.
 */
public final class Ident implements Comparable<Ident> {
  /** Character that starts every generated identifier. */
  public static final char GENERATED_SIGIL = '%';

  /** Ordering that compares identifiers by name. */
  public static final Ordering<Ident> ORDERING = Ordering.natural();

  private static final Interner<Ident> INTERNER = Interners.newWeakInterner();

  public final String name;

  private Ident(String name) {
    this.name = requireNonNull(name, "name");
    checkArgument(!name.isEmpty(), "empty name");
  }

  /** Returns the identifier with the given name. */
  public static Ident of(String name) {
    return INTERNER.intern(new Ident(name));
  }

  /** Returns whether this identifier was generated by the compiler. */
  public boolean isGenerated() {
    return name.charAt(0) == GENERATED_SIGIL;
  }

  @Override
  public int compareTo(Ident o) {
    return name.compareTo(o.name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Ident
        && name.equals(((Ident) o).name);
  }

  @Override
  public String toString() {
    return name;
  }
}

// End Ident.java
