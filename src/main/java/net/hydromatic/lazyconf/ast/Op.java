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

import com.google.common.collect.ImmutableMap;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // identifiers
  VAR(true),

  // literals
  BOOL_LITERAL(true),
  NUM_LITERAL(true),
  STRING_LITERAL(true),
  LABEL(true),
  SYMBOL(true),
  ENUM_TAG(true),

  // value constructors
  RECORD(true),
  LIST(true),
  FN(" => ", 1, false),

  // wrappers
  DEFAULT_VALUE,
  CONTRACT,
  CONTRACT_WITH_DEFAULT,
  DOCSTRING,

  // imports
  IMPORT(true),
  RESOLVED_IMPORT(true),

  // types
  DYN_TYPE(true),
  NUM_TYPE(true),
  BOOL_TYPE(true),
  STR_TYPE(true),
  SYM_TYPE(true),
  LIST_TYPE(" list", 8),
  ARROW_TYPE(" -> ", 6, false),
  FLAT_TYPE(true),

  TIMES(" * ", 7),
  DIVIDE(" / ", 7),
  MOD(" % ", 7),
  PLUS(" + ", 6),
  MINUS(" - ", 6),
  CONCAT(" ++ ", 5),
  MERGE(" & ", 5),
  LE(" <= ", 4),
  LT(" < ", 4),
  GE(" >= ", 4),
  GT(" > ", 4),
  EQ(" == ", 4),
  NE(" != ", 4),
  AND(" && ", 3),
  OR(" || ", 2),
  SELECT(".", 9),
  APPLY(" ", 8),
  LET,
  IF;

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;
  /** Operator name. Sometimes null, sometimes something like "op +". */
  public final String opName;

  public static final ImmutableMap<String, Op> BY_OP_NAME;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      if (op.opName != null
          && op.isInfix()
          && !op.name().endsWith("_TYPE")) {
        b.put(op.opName, op);
      }
    }
    BY_OP_NAME = b.build();
  }

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded, int leftPrecedence) {
    this(padded, leftPrecedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
    this.opName = padded == null || padded.trim().isEmpty()
        ? null
        : "op " + padded.trim();
  }

  /** Returns whether this is a binary operator that may occur in an
   * {@link Ast.InfixCall}. */
  public boolean isInfix() {
    return ordinal() >= TIMES.ordinal() && ordinal() <= OR.ordinal();
  }
}

// End Op.java
