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
package net.hydromatic.lazyconf.util;

import net.hydromatic.lazyconf.ast.Pos;

/** Exception that has a position in the source code.
 *
 * <p>Implemented by the unchecked exceptions that this library throws when a
 * program is invalid, as opposed to when the library itself is broken. */
public interface LazyconfException {
  /** Returns the position in the source code that caused the error. */
  Pos pos();

  /** Describes this exception, prefixed by its position. */
  StringBuilder describeTo(StringBuilder buf);
}

// End LazyconfException.java
