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
import static net.hydromatic.lazyconf.ast.AstBuilder.ast;

import net.hydromatic.lazyconf.ast.Ast;
import net.hydromatic.lazyconf.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Resolves imports. */
public class ImportResolution {
  private ImportResolution() {}

  /**
   * Resolves the top node of a term if it is an unresolved import, or returns
   * the term unchanged.
   *
   * <p>A resolved import is replaced by an {@link Ast.ResolvedImport} at the
   * same position, whether or not the resolver had already loaded the file.
   * If the file was loaded by this call, its term is returned as
   * {@link Result#pending}, to be transformed later; if it came from the
   * resolver's cache, or if {@code term} was not an import, {@code pending}
   * is null.
   *
   * <p>Like {@link ShareNormalForm#transformOne}, this method is not
   * recursive.
   *
   * @throws ImportException if the resolver cannot resolve the import
   */
  public static Result transformOne(Ast.Term term, ImportResolver resolver) {
    if (term.op != Op.IMPORT) {
      return new Result(term, null);
    }
    final Ast.Import importTerm = (Ast.Import) term;
    final ImportResolver.Resolution resolution =
        resolver.resolve(importTerm.path, importTerm.pos);
    final Ast.Term resolved =
        ast.resolvedImport(importTerm.pos, resolution.fileId);
    final Ast.Term loaded = resolution.resolvedTerm.term;
    return new Result(resolved,
        loaded == null ? null : new Pending(loaded, resolution.fileId));
  }

  /** Result of {@link #transformOne}. */
  public static class Result {
    public final Ast.Term term;
    public final @Nullable Pending pending;

    Result(Ast.Term term, @Nullable Pending pending) {
      this.term = requireNonNull(term);
      this.pending = pending;
    }
  }

  /** Term of a newly loaded file, waiting to be transformed. */
  public static class Pending {
    public final Ast.Term term;
    public final FileId fileId;

    Pending(Ast.Term term, FileId fileId) {
      this.term = requireNonNull(term);
      this.fileId = requireNonNull(fileId);
    }

    @Override
    public String toString() {
      return fileId + ": " + term;
    }
  }
}

// End ImportResolution.java
