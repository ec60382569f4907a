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
package net.hydromatic.lazyconf.type;

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.lazyconf.ast.Pos;

/**
 * Blame label of a contract.
 *
 * <p>When a contract fails, the label says which contract it was, where it
 * was declared, and which party (the term or its context) is to blame.
 */
public class Label {
  public final String tag;
  public final Pos pos;
  /** If true, the term is to blame; if false, its context. */
  public final boolean polarity;

  private Label(String tag, Pos pos, boolean polarity) {
    this.tag = requireNonNull(tag, "tag");
    this.pos = requireNonNull(pos, "pos");
    this.polarity = polarity;
  }

  /** Creates a label with positive polarity. */
  public static Label of(String tag, Pos pos) {
    return new Label(tag, pos, true);
  }

  /** Returns a copy of this label with opposite polarity. */
  public Label flip() {
    return new Label(tag, pos, !polarity);
  }

  @Override
  public int hashCode() {
    return Objects.hash(tag, pos, polarity);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Label
        && tag.equals(((Label) o).tag)
        && pos.equals(((Label) o).pos)
        && polarity == ((Label) o).polarity;
  }

  @Override
  public String toString() {
    return tag + (polarity ? "+" : "-") + "@" + pos;
  }
}

// End Label.java
