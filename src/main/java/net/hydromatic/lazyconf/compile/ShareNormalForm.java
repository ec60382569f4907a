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

import static net.hydromatic.lazyconf.ast.AstBuilder.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import net.hydromatic.lazyconf.ast.Ast;
import net.hydromatic.lazyconf.ast.Ident;

/**
 * Converts terms to share normal form.
 *
 * <p>A record or list is in weak head normal form as soon as it is built, so
 * the thunk that holds it is never updated with the values of its fields or
 * elements. In
 *
 * <blockquote><pre>
 * let x = {a = 1 + 1} in x.a + x.a
 * </pre></blockquote>
 *
 * <p>{@code 1 + 1} would be evaluated twice. Share normal form binds each such
 * sub-term to a fresh variable in a "let" that encloses the record:
 *
 * <blockquote><pre>
 * let x = (let %0 = 1 + 1 in {a = %0}) in x.a + x.a
 * </pre></blockquote>
 *
 * <p>Now {@code a} refers to the thunk of {@code %0}, which is updated the
 * first time it is forced.
 */
public class ShareNormalForm {
  private ShareNormalForm() {}

  /**
   * Converts the top node of a term to share normal form.
   *
   * <p>Not recursive: {@code [1 + 1, [1 + 2]]} becomes
   * {@code let %1 = [1 + 2] in let %0 = 1 + 1 in [%0, %1]}, and the inside
   * of the nested {@code [1 + 2]} is left as it was. Use this method as the
   * step of a {@link net.hydromatic.lazyconf.ast.Shuttle#traverse traversal}
   * to convert a whole tree.
   *
   * <p>Returns {@code term} itself if there is nothing to share.
   */
  public static Ast.Term transformOne(NameGenerator nameGenerator,
      Ast.Term term) {
    switch (term.op) {
    case RECORD:
      final Ast.Record record = (Ast.Record) term;
      final List<Binding> fieldBindings = new ArrayList<>();
      final Map<Ident, Ast.Term> fields = new TreeMap<>();
      record.fields.forEach((name, value) ->
          fields.put(name, share(nameGenerator, fieldBindings, value)));
      return wrap(record.copy(fields), fieldBindings);

    case LIST:
      final Ast.ListTerm list = (Ast.ListTerm) term;
      final List<Binding> elementBindings = new ArrayList<>();
      final List<Ast.Term> elements = new ArrayList<>();
      list.elements.forEach(element ->
          elements.add(share(nameGenerator, elementBindings, element)));
      return wrap(list.copy(elements), elementBindings);

    case DEFAULT_VALUE:
    case CONTRACT_WITH_DEFAULT:
    case DOCSTRING:
      final Ast.Wrapper wrapper = (Ast.Wrapper) term;
      final List<Binding> bindings = new ArrayList<>();
      final Ast.Term exp = share(nameGenerator, bindings, wrapper.exp);
      return wrap(wrapper.copy(exp), bindings);

    default:
      return term;
    }
  }

  /**
   * Returns whether a sub-term of a weak head normal form should be bound to
   * a variable so that it can be shared.
   *
   * <p>Sharing is useless if the sub-term is a value that can be copied
   * without duplicating any work. A value that may contain shareable
   * sub-terms, such as a record, should be shared.
   */
  public static boolean shouldShare(Ast.Term term) {
    switch (term.op) {
    case BOOL_LITERAL:
    case NUM_LITERAL:
    case STRING_LITERAL:
    case LABEL:
    case SYMBOL:
    case VAR:
    case ENUM_TAG:
    case FN:
      return false;
    default:
      return true;
    }
  }

  /** If {@code term} should be shared, binds it to a fresh variable and
   * returns a reference to the variable; otherwise returns {@code term}. */
  private static Ast.Term share(NameGenerator nameGenerator,
      List<Binding> bindings, Ast.Term term) {
    if (!shouldShare(term)) {
      return term;
    }
    final Ident id = nameGenerator.fresh();
    bindings.add(new Binding(id, term));
    return ast.var(term.pos, id);
  }

  /** Wraps a term in a "let" for each binding. The first binding is
   * innermost. */
  private static Ast.Term wrap(Ast.Term term, List<Binding> bindings) {
    Ast.Term result = term;
    for (Binding binding : bindings) {
      result = ast.let(term.pos, binding.id, binding.exp, result);
    }
    return result;
  }

  /** Sub-term that has been replaced by a fresh variable. */
  private static class Binding {
    final Ident id;
    final Ast.Term exp;

    Binding(Ident id, Ast.Term exp) {
      this.id = id;
      this.exp = exp;
    }
  }
}

// End ShareNormalForm.java
