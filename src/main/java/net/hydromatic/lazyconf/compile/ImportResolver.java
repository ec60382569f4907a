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
import net.hydromatic.lazyconf.ast.Pos;

/**
 * Locates, loads and caches imported files.
 *
 * <p>The resolver owns the file identifiers and the cache; the
 * {@link Transformer} only calls {@link #resolve} and {@link #insert}.
 * A resolver that returns {@link ResolvedTerm#FROM_CACHE} for a file it has
 * already loaded guarantees that each file is transformed once.
 *
 * <p>Resolvers are not thread-safe unless they say otherwise.
 */
public interface ImportResolver {
  /**
   * Resolves an import.
   *
   * @param path Path, as written in the import
   * @param pos  Position of the import
   * @return The file's identifier, and its contents if it was loaded now
   * @throws ImportException if the file cannot be located, read or parsed
   */
  Resolution resolve(String path, Pos pos);

  /** Stores the transformed term of a file, replacing its parsed term. */
  void insert(FileId fileId, Ast.Term term);

  /** Result of {@link #resolve}: a resolved term and a file identifier. */
  class Resolution {
    public final ResolvedTerm resolvedTerm;
    public final FileId fileId;

    public Resolution(ResolvedTerm resolvedTerm, FileId fileId) {
      this.resolvedTerm = requireNonNull(resolvedTerm);
      this.fileId = requireNonNull(fileId);
    }
  }
}

// End ImportResolver.java
