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
package net.hydromatic.lazyconf.parse;

import net.hydromatic.lazyconf.ast.Ast;

/**
 * Converts the text of a source file into a term.
 *
 * <p>The positions of the nodes in the term must refer to {@code file}, so
 * that imports within the file can be resolved relative to it.
 */
@FunctionalInterface
public interface SourceParser {
  /** Parses a source file.
   *
   * @param file   Path of the file
   * @param source Contents of the file
   * @return Term
   * @throws ParseException if the source is not valid
   */
  Ast.Term parse(String file, String source);
}

// End SourceParser.java
