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

import net.hydromatic.lazyconf.ast.Ast;
import net.hydromatic.lazyconf.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events during transformation. */
public interface Tracer {
  /** Called when an import has been resolved. {@code fromCache} is true if
   * the resolver had already loaded the file. */
  void onImport(String path, Pos pos, FileId fileId, boolean fromCache);

  /** Called when a pass over a term has finished. {@code fileId} is null
   * for the pass over the root term. */
  void onPass(@Nullable FileId fileId, Ast.Term term);

  /** Called when the transformed term of a file has been stored in the
   * resolver. */
  void onInsert(FileId fileId, Ast.Term term);

  /** Called with the exception that aborted a transformation. The exception
   * is re-thrown after this method returns. */
  void onException(ImportException e);
}

// End Tracer.java
