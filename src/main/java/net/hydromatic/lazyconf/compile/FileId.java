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

/**
 * Identifier of a file.
 *
 * <p>File identifiers are created by an {@link ImportResolver}, which uses them
 * as keys of its cache. Other code treats them as opaque handles.
 */
public final class FileId {
  public final int id;
  public final String name;

  private FileId(int id, String name) {
    this.id = id;
    this.name = requireNonNull(name, "name");
  }

  /** Creates a file identifier. Only resolvers should call this method. */
  public static FileId of(int id, String name) {
    return new FileId(id, name);
  }

  @Override
  public int hashCode() {
    return id;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof FileId
        && id == ((FileId) o).id
        && name.equals(((FileId) o).name);
  }

  @Override
  public String toString() {
    return name + "#" + id;
  }
}

// End FileId.java
