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

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Visits and transforms syntax trees.
 *
 * <p>Each {@code visit} method rebuilds a node from its transformed children,
 * returning the original node if no child changed. Children are transformed
 * by calling {@link #apply(Ast.Term)}, which sub-classes may override to
 * intercept every node of the tree.
 */
public class Shuttle {
  /** Creates a Shuttle. */
  public Shuttle() {
  }

  /**
   * Transforms a term and, recursively, its children.
   *
   * <p>The default implementation dispatches to the {@code visit} method
   * appropriate to the type of {@code term}.
   */
  public Ast.Term apply(Ast.Term term) {
    return term.accept(this);
  }

  /**
   * Applies a single-step transformation to every node of a tree.
   *
   * <p>The step is applied to a node before the node's children are
   * traversed; the traversal then descends into the children of the node that
   * the step returned. Therefore nodes that the step introduces are themselves
   * visited, and a step must be idempotent on its own output if the traversal
   * is to terminate. A step may therefore see a node more than once: if it
   * wraps a node in a "let", it sees the node again as the body of the
   * "let".
   *
   * <p>Children are traversed left to right: a "let" before its body, and
   * record fields in name order. When the step binds sibling terms to
   * "let"s whose first binding is innermost (as
   * {@link net.hydromatic.lazyconf.compile.ShareNormalForm} does), the
   * outermost binding is traversed first, so the siblings are reached in
   * reverse order.
   *
   * <p>The first exception thrown by the step aborts the traversal.
   *
   * @param term  Root of the tree
   * @param step  Single-step transformation
   * @param state Mutable state passed to each invocation of the step
   * @param <S>   Type of state
   * @return Transformed tree
   */
  public static <S> Ast.Term traverse(Ast.Term term, Step<S> step, S state) {
    return new StepShuttle<>(step, state).apply(term);
  }

  protected List<Ast.Term> visitList(List<Ast.Term> terms) {
    final List<Ast.Term> list = new ArrayList<>();
    for (Ast.Term term : terms) {
      list.add(apply(term));
    }
    return list;
  }

  protected <K> Map<K, Ast.Term> visitMap(Map<K, Ast.Term> terms) {
    final Map<K, Ast.Term> map = new TreeMap<>();
    terms.forEach((k, v) -> map.put(k, apply(v)));
    return map;
  }

  // leaves

  protected Ast.Term visit(Ast.Literal literal) {
    return literal; // leaf
  }

  protected Ast.Term visit(Ast.Lbl lbl) {
    return lbl; // leaf
  }

  protected Ast.Term visit(Ast.Sym sym) {
    return sym; // leaf
  }

  protected Ast.Term visit(Ast.EnumTag enumTag) {
    return enumTag; // leaf
  }

  protected Ast.Term visit(Ast.Var var) {
    return var; // leaf
  }

  protected Ast.Term visit(Ast.Import importTerm) {
    return importTerm; // leaf
  }

  protected Ast.Term visit(Ast.ResolvedImport resolvedImport) {
    return resolvedImport; // leaf
  }

  // value constructors

  protected Ast.Term visit(Ast.Fn fn) {
    return fn.copy(apply(fn.body));
  }

  protected Ast.Term visit(Ast.Record record) {
    return record.copy(visitMap(record.fields));
  }

  protected Ast.Term visit(Ast.ListTerm list) {
    return list.copy(visitList(list.elements));
  }

  // wrappers

  protected Ast.Term visit(Ast.DefaultValue defaultValue) {
    return defaultValue.copy(apply(defaultValue.exp));
  }

  protected Ast.Term visit(Ast.Contract contract) {
    return contract.copy(apply(contract.exp));
  }

  protected Ast.Term visit(Ast.ContractWithDefault contractWithDefault) {
    return contractWithDefault.copy(apply(contractWithDefault.exp));
  }

  protected Ast.Term visit(Ast.Docstring docstring) {
    return docstring.copy(apply(docstring.exp));
  }

  // expressions

  protected Ast.Term visit(Ast.Let let) {
    return let.copy(apply(let.exp), apply(let.body));
  }

  protected Ast.Term visit(Ast.Apply apply) {
    return apply.copy(apply(apply.fn), apply(apply.arg));
  }

  protected Ast.Term visit(Ast.InfixCall infixCall) {
    return infixCall.copy(apply(infixCall.a0), apply(infixCall.a1));
  }

  protected Ast.Term visit(Ast.If ifThenElse) {
    return ifThenElse.copy(apply(ifThenElse.condition),
        apply(ifThenElse.ifTrue), apply(ifThenElse.ifFalse));
  }

  protected Ast.Term visit(Ast.Select select) {
    return select.copy(apply(select.exp));
  }

  /**
   * Single step of a transformation.
   *
   * <p>Applies to the top node of a term only; use
   * {@link #traverse(Ast.Term, Step, Object)} to apply it to a whole tree.
   *
   * @param <S> Type of state
   */
  @FunctionalInterface
  public interface Step<S> {
    Ast.Term apply(Ast.Term term, S state);
  }

  /** Shuttle that applies a {@link Step} to each node before visiting the
   * node's children. */
  private static class StepShuttle<S> extends Shuttle {
    private final Step<S> step;
    private final S state;

    StepShuttle(Step<S> step, S state) {
      this.step = requireNonNull(step);
      this.state = state;
    }

    @Override
    public Ast.Term apply(Ast.Term term) {
      return step.apply(term, state).accept(this);
    }
  }
}

// End Shuttle.java
