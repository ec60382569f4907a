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
import static java.util.Objects.requireNonNull;

import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.lazyconf.ast.Ast;
import net.hydromatic.lazyconf.ast.Pos;
import net.hydromatic.lazyconf.eval.Prop;
import net.hydromatic.lazyconf.parse.ParseException;
import net.hydromatic.lazyconf.parse.SourceParser;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Import resolver that reads files from the file system.
 *
 * <p>A relative path is resolved against the directory of the file that
 * contains the import (taken from the import's {@link Pos#file}), or against
 * {@link Prop#DIRECTORY} if the import is not in a file. If no file exists at
 * the path, and the path does not end with {@link Prop#EXTENSION}, the
 * resolver tries again with the extension appended.
 *
 * <p>Files are identified by their canonical path, so two imports that reach
 * the same file by different paths share a {@link FileId}.
 */
public class FileImportResolver implements ImportResolver {
  private final SourceParser parser;
  private final File directory;
  private final String extension;
  private final Map<File, FileId> fileIds = new HashMap<>();
  private final List<File> files = new ArrayList<>();
  private final Map<FileId, Ast.Term> cache = new HashMap<>();

  private FileImportResolver(SourceParser parser, File directory,
      String extension) {
    this.parser = requireNonNull(parser);
    this.directory = requireNonNull(directory);
    this.extension = requireNonNull(extension);
  }

  /** Creates a FileImportResolver. */
  public static FileImportResolver create(SourceParser parser,
      Map<Prop, Object> propMap) {
    return new FileImportResolver(parser,
        Prop.DIRECTORY.fileValue(propMap),
        Prop.EXTENSION.stringValue(propMap));
  }

  @Override
  public Resolution resolve(String path, Pos pos) {
    final File file = canonical(locate(path, pos), path, pos);
    final FileId fileId = fileIds.get(file);
    if (fileId != null) {
      return new Resolution(ResolvedTerm.FROM_CACHE, fileId);
    }

    final String source;
    try {
      source = Files.asCharSource(file, StandardCharsets.UTF_8).read();
    } catch (IOException e) {
      throw new ImportException(ImportException.Kind.IO, path, pos,
          "error reading " + file + ": " + e.getMessage(), e);
    }

    final Ast.Term term;
    try {
      term = parser.parse(file.getPath(), source);
    } catch (ParseException e) {
      throw new ImportException(ImportException.Kind.PARSE, path, pos,
          "error parsing " + file + ": "
              + e.describeTo(new StringBuilder()),
          e);
    }

    final FileId newFileId = FileId.of(files.size(), file.getPath());
    files.add(file);
    fileIds.put(file, newFileId);
    cache.put(newFileId, term);
    return new Resolution(ResolvedTerm.fromFile(term), newFileId);
  }

  @Override
  public void insert(FileId fileId, Ast.Term term) {
    checkArgument(cache.containsKey(fileId), "unknown file %s", fileId);
    cache.put(fileId, term);
  }

  /** Returns the term of a file that has been resolved, or null. */
  public Ast.@Nullable Term get(FileId fileId) {
    return cache.get(fileId);
  }

  /** Returns the file that a file identifier refers to. */
  public File file(FileId fileId) {
    return files.get(fileId.id);
  }

  /** Finds the file that an import refers to. */
  private File locate(String path, Pos pos) {
    final File file = resolveAgainst(baseDirectory(pos), path);
    if (file.isFile()) {
      return file;
    }
    if (!extension.isEmpty() && !path.endsWith(extension)) {
      final File file2 = new File(file.getPath() + extension);
      if (file2.isFile()) {
        return file2;
      }
    }
    throw new ImportException(ImportException.Kind.NOT_FOUND, path, pos,
        "file not found: " + file);
  }

  /** Returns the directory against which relative imports at a given
   * position are resolved. */
  private @Nullable File baseDirectory(Pos pos) {
    if (!pos.file.isEmpty()) {
      return new File(pos.file).getAbsoluteFile().getParentFile();
    }
    return directory.getPath().isEmpty() ? null : directory;
  }

  private static File resolveAgainst(@Nullable File base, String path) {
    final File file = new File(path);
    if (file.isAbsolute() || base == null) {
      return file;
    }
    return new File(base, path);
  }

  private static File canonical(File file, String path, Pos pos) {
    try {
      return file.getCanonicalFile();
    } catch (IOException e) {
      throw new ImportException(ImportException.Kind.IO, path, pos,
          "cannot resolve " + file + ": " + e.getMessage(), e);
    }
  }
}

// End FileImportResolver.java
