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

import net.hydromatic.lazyconf.ast.Pos;
import net.hydromatic.lazyconf.util.LazyconfException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An import could not be resolved.
 *
 * <p>Thrown by an {@link ImportResolver}. The {@link Kind} is for the benefit
 * of whoever reports the error; the {@link Transformer} does not look at it.
 */
public class ImportException extends RuntimeException
    implements LazyconfException {
  public final Kind kind;
  public final String path;
  private final Pos pos;

  public ImportException(Kind kind, String path, Pos pos, String message) {
    this(kind, path, pos, message, null);
  }

  public ImportException(Kind kind, String path, Pos pos, String message,
      @Nullable Throwable cause) {
    super(message, cause);
    this.kind = requireNonNull(kind);
    this.path = requireNonNull(path);
    this.pos = requireNonNull(pos);
  }

  @Override
  public String toString() {
    return super.toString() + " at " + pos;
  }

  @Override
  public Pos pos() {
    return pos;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf)
        .append(" Error: ")
        .append(getMessage());
  }

  /** Reason that an import failed. */
  public enum Kind {
    /** The file does not exist. */
    NOT_FOUND,
    /** The file exists but could not be read. */
    IO,
    /** The file could not be parsed. */
    PARSE
  }
}

// End ImportException.java
