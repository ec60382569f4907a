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
package net.hydromatic.lazyconf.ast;

import java.math.BigDecimal;

/** Context for writing an AST out as a string. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an identifier to the output. */
  public AstWriter id(Ident id) {
    b.append(id.name);
    return this;
  }

  /** Appends a call to an infix operator. */
  public AstWriter infix(int left, AstNode a0, Op op, AstNode a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    a0.unparse(this, left, op.left);
    append(op.padded);
    a1.unparse(this, op.right, right);
    return this;
  }

  /** Appends a call to a binary operator (e.g. "let ... in ..."),
   * parenthesized if it is an operand of an operator that binds more
   * tightly. */
  public AstWriter binary(int left, String start, AstNode a0, String mid,
      AstNode a1, int right) {
    if (left > 0 || right > 0) {
      return append("(").binary(0, start, a0, mid, a1, 0).append(")");
    }
    append(start);
    a0.unparse(this, 0, 0);
    append(mid);
    a1.unparse(this, 0, 0);
    return this;
  }

  /** Appends a literal value. */
  public AstWriter appendLiteral(Comparable<?> value) {
    if (value instanceof String) {
      b.append('"');
      final String s = (String) value;
      for (int i = 0; i < s.length(); i++) {
        final char c = s.charAt(i);
        switch (c) {
        case '"':
          b.append("\\\"");
          break;
        case '\\':
          b.append("\\\\");
          break;
        case '\n':
          b.append("\\n");
          break;
        default:
          b.append(c);
        }
      }
      b.append('"');
    } else if (value instanceof BigDecimal) {
      b.append(((BigDecimal) value).toPlainString());
    } else {
      b.append(value);
    }
    return this;
  }

  @Override
  public String toString() {
    return b.toString();
  }

  public AstWriter append(AstNode node, int left, int right) {
    return node.unparse(this, left, right);
  }
}

// End AstWriter.java
