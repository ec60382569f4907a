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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.lazyconf.ast.Ast;
import net.hydromatic.lazyconf.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Import resolver whose files are terms held in memory, keyed by path.
 *
 * <p>Paths are matched exactly; there is no notion of a directory. Each path
 * is given a {@link FileId} the first time it is resolved; subsequent
 * resolutions return {@link ResolvedTerm#FROM_CACHE}.
 *
 * <p>Useful for tests, and for embedding programs whose imports are known in
 * advance.
 */
public class MapImportResolver implements ImportResolver {
  private final ImmutableMap<String, Ast.Term> sources;
  private final Map<String, FileId> fileIds = new HashMap<>();
  private final Map<FileId, Ast.Term> cache = new HashMap<>();
  private final List<FileId> insertions = new ArrayList<>();

  private MapImportResolver(ImmutableMap<String, Ast.Term> sources) {
    this.sources = sources;
  }

  /** Creates a resolver over a map from path to parsed term. */
  public static MapImportResolver of(Map<String, ? extends Ast.Term> sources) {
    return new MapImportResolver(ImmutableMap.copyOf(sources));
  }

  @Override
  public Resolution resolve(String path, Pos pos) {
    final FileId fileId = fileIds.get(path);
    if (fileId != null) {
      return new Resolution(ResolvedTerm.FROM_CACHE, fileId);
    }
    final Ast.Term term = sources.get(path);
    if (term == null) {
      throw new ImportException(ImportException.Kind.NOT_FOUND, path, pos,
          "file not found: " + path);
    }
    final FileId newFileId = FileId.of(fileIds.size(), path);
    fileIds.put(path, newFileId);
    cache.put(newFileId, term);
    return new Resolution(ResolvedTerm.fromFile(term), newFileId);
  }

  @Override
  public void insert(FileId fileId, Ast.Term term) {
    checkArgument(cache.containsKey(fileId), "unknown file %s", fileId);
    cache.put(fileId, term);
    insertions.add(fileId);
  }

  /** Returns the identifier of a path that has been resolved, or null. */
  public @Nullable FileId fileId(String path) {
    return fileIds.get(path);
  }

  /** Returns the term of a file: the transformed term if it has been
   * inserted, otherwise the parsed term. */
  public Ast.@Nullable Term get(FileId fileId) {
    return cache.get(fileId);
  }

  /** Returns the files that have been inserted, in the order of the calls to
   * {@link #insert}. */
  public List<FileId> insertions() {
    return ImmutableList.copyOf(insertions);
  }
}

// End MapImportResolver.java
