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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import net.hydromatic.lazyconf.compile.FileId;
import net.hydromatic.lazyconf.type.Label;
import net.hydromatic.lazyconf.type.Types;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates a reference to a variable. */
  public Ast.Var var(Pos pos, Ident id) {
    return new Ast.Var(pos, id);
  }

  /** Creates a reference to a variable, with no position. */
  public Ast.Var var(Ident id) {
    return var(Pos.ZERO, id);
  }

  /** Creates a {@code boolean} literal. */
  public Ast.Literal boolLiteral(Pos pos, boolean b) {
    return new Ast.Literal(pos, Op.BOOL_LITERAL, b);
  }

  /** Creates a numeric literal. */
  public Ast.Literal numLiteral(Pos pos, BigDecimal value) {
    return new Ast.Literal(pos, Op.NUM_LITERAL, value);
  }

  /** Creates a numeric literal from a {@code long} value. */
  public Ast.Literal numLiteral(Pos pos, long value) {
    return numLiteral(pos, BigDecimal.valueOf(value));
  }

  /** Creates a string literal. */
  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, value);
  }

  /** Creates a label. */
  public Ast.Lbl label(Pos pos, Label label) {
    return new Ast.Lbl(pos, label);
  }

  /** Creates a symbol. */
  public Ast.Sym sym(Pos pos, int id) {
    return new Ast.Sym(pos, id);
  }

  /** Creates an enum tag. */
  public Ast.EnumTag enumTag(Pos pos, Ident tag) {
    return new Ast.EnumTag(pos, tag);
  }

  /** Creates a function literal. */
  public Ast.Fn fn(Pos pos, Ident param, Ast.Term body) {
    return new Ast.Fn(pos, param, body);
  }

  /** Creates a record. */
  public Ast.Record record(Pos pos, Map<Ident, ? extends Ast.Term> fields) {
    return new Ast.Record(pos,
        ImmutableSortedMap.copyOf(fields, Ident.ORDERING));
  }

  /** Creates a list. */
  public Ast.ListTerm list(Pos pos, List<? extends Ast.Term> elements) {
    return new Ast.ListTerm(pos, ImmutableList.copyOf(elements));
  }

  /** Creates a "let" expression. */
  public Ast.Let let(Pos pos, Ident id, Ast.Term exp, Ast.Term body) {
    return new Ast.Let(pos, id, exp, body);
  }

  /** Creates a default value. */
  public Ast.DefaultValue defaultValue(Pos pos, Ast.Term exp) {
    return new Ast.DefaultValue(pos, exp);
  }

  /** Creates a term annotated with a contract. */
  public Ast.Contract contract(Pos pos, Types types, Label label,
      Ast.Term exp) {
    return new Ast.Contract(pos, types, label, exp);
  }

  /** Creates a default value annotated with a contract. */
  public Ast.ContractWithDefault contractWithDefault(Pos pos, Types types,
      Label label, Ast.Term exp) {
    return new Ast.ContractWithDefault(pos, types, label, exp);
  }

  /** Creates a documented term. */
  public Ast.Docstring docstring(Pos pos, String doc, Ast.Term exp) {
    return new Ast.Docstring(pos, doc, exp);
  }

  /** Creates an unresolved import. */
  public Ast.Import importOf(Pos pos, String path) {
    return new Ast.Import(pos, path);
  }

  /** Creates a resolved import. */
  public Ast.ResolvedImport resolvedImport(Pos pos, FileId fileId) {
    return new Ast.ResolvedImport(pos, fileId);
  }

  /** Creates a function application. */
  public Ast.Apply apply(Pos pos, Ast.Term fn, Ast.Term arg) {
    return new Ast.Apply(pos, fn, arg);
  }

  /** Creates a call to an infix operator. */
  public Ast.InfixCall infixCall(Pos pos, Op op, Ast.Term a0, Ast.Term a1) {
    return new Ast.InfixCall(pos, op, a0, a1);
  }

  /** Creates a call to an infix operator, whose position spans its
   * arguments. */
  public Ast.InfixCall infixCall(Op op, Ast.Term a0, Ast.Term a1) {
    return infixCall(a0.pos.plus(a1.pos), op, a0, a1);
  }

  /** Creates an "if ... then ... else" expression. */
  public Ast.If ifThenElse(Pos pos, Ast.Term condition, Ast.Term ifTrue,
      Ast.Term ifFalse) {
    return new Ast.If(pos, condition, ifTrue, ifFalse);
  }

  /** Creates an access to a record field. */
  public Ast.Select select(Pos pos, Ast.Term exp, Ident field) {
    return new Ast.Select(pos, exp, field);
  }
}

// End AstBuilder.java
