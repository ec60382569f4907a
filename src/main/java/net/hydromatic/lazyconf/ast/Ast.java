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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.lazyconf.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import net.hydromatic.lazyconf.compile.FileId;
import net.hydromatic.lazyconf.compile.NameGenerator;
import net.hydromatic.lazyconf.eval.Closurizable;
import net.hydromatic.lazyconf.eval.Closure;
import net.hydromatic.lazyconf.eval.EvalEnv;
import net.hydromatic.lazyconf.eval.IdentKind;
import net.hydromatic.lazyconf.eval.Thunk;
import net.hydromatic.lazyconf.type.Label;
import net.hydromatic.lazyconf.type.Types;

/**
 * Terms of the configuration language.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short. Every term carries its source position; there is no separate
 * "term plus position" wrapper.
 */
public class Ast {
  private Ast() {}

  /** Base class of terms. */
  public abstract static class Term extends AstNode
      implements Closurizable<Term> {
    Term(Pos pos, Op op) {
      super(pos, op);
    }

    @Override
    public abstract Term accept(Shuttle shuttle);

    /**
     * {@inheritDoc}
     *
     * <p>Generates a fresh variable, binds it in {@code env} to the closure
     * of this term and {@code withEnv}, and returns a reference to the
     * variable.
     */
    @Override
    public Term closurize(NameGenerator nameGenerator, EvalEnv env,
        EvalEnv withEnv) {
      final Ident id = nameGenerator.fresh();
      final Closure closure = new Closure(this, withEnv);
      env.insert(id, new Thunk(closure), IdentKind.RECORD);
      return ast.var(pos, id);
    }
  }

  /** Literal: a boolean, number or string. */
  public static class Literal extends Term {
    public final Comparable<?> value;

    Literal(Pos pos, Op op, Comparable<?> value) {
      super(pos, op);
      this.value = requireNonNull(value);
      checkArgument(op == Op.BOOL_LITERAL && value instanceof Boolean
          || op == Op.NUM_LITERAL && value instanceof BigDecimal
          || op == Op.STRING_LITERAL && value instanceof String,
          "bad literal %s", value);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendLiteral(value);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Blame label of a contract. */
  public static class Lbl extends Term {
    public final Label label;

    Lbl(Pos pos, Label label) {
      super(pos, Op.LABEL);
      this.label = requireNonNull(label);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("<label ").append(label.tag).append(">");
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Symbol, an opaque value that can only be compared for equality. */
  public static class Sym extends Term {
    public final int id;

    Sym(Pos pos, int id) {
      super(pos, Op.SYMBOL);
      this.id = id;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("<sym ").append(Integer.toString(id)).append(">");
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Enum tag, for example {@code `Debug}. */
  public static class EnumTag extends Term {
    public final Ident tag;

    EnumTag(Pos pos, Ident tag) {
      super(pos, Op.ENUM_TAG);
      this.tag = requireNonNull(tag);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("`").id(tag);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Reference to a variable. */
  public static class Var extends Term {
    public final Ident id;

    Var(Pos pos, Ident id) {
      super(pos, Op.VAR);
      this.id = requireNonNull(id);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(id);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Function literal, for example {@code fun x => x + 1}. */
  public static class Fn extends Term {
    public final Ident param;
    public final Term body;

    Fn(Pos pos, Ident param, Term body) {
      super(pos, Op.FN);
      this.param = requireNonNull(param);
      this.body = requireNonNull(body);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append("fun ").id(param).append(op.padded)
          .append(body, op.right, right);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy of this {@code Fn} with given contents,
     * or {@code this} if the contents are the same. */
    public Fn copy(Term body) {
      return body == this.body ? this : ast.fn(pos, param, body);
    }
  }

  /** Record, for example {@code {a = 1, b = "x"}}.
   *
   * <p>Fields are sorted by name; names are unique. */
  public static class Record extends Term {
    public final ImmutableSortedMap<Ident, Term> fields;

    Record(Pos pos, ImmutableSortedMap<Ident, Term> fields) {
      super(pos, Op.RECORD);
      this.fields = requireNonNull(fields);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("{");
      int i = 0;
      for (Map.Entry<Ident, Term> field : fields.entrySet()) {
        w.append(i++ > 0 ? ", " : "")
            .id(field.getKey())
            .append(" = ")
            .append(field.getValue(), 0, 0);
      }
      return w.append("}");
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy of this {@code Record} with given contents,
     * or {@code this} if the contents are the same. */
    public Record copy(Map<Ident, Term> fields) {
      return fields.equals(this.fields) ? this : ast.record(pos, fields);
    }
  }

  /** List, for example {@code [1, 2, 3]}. */
  public static class ListTerm extends Term {
    public final ImmutableList<Term> elements;

    ListTerm(Pos pos, ImmutableList<Term> elements) {
      super(pos, Op.LIST);
      this.elements = requireNonNull(elements);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("[");
      for (int i = 0; i < elements.size(); i++) {
        w.append(i > 0 ? ", " : "").append(elements.get(i), 0, 0);
      }
      return w.append("]");
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy of this {@code ListTerm} with given contents,
     * or {@code this} if the contents are the same. */
    public ListTerm copy(List<Term> elements) {
      return elements.equals(this.elements) ? this
          : ast.list(pos, elements);
    }
  }

  /** "Let" expression, for example {@code let x = 1 + 1 in x * x}. */
  public static class Let extends Term {
    public final Ident id;
    public final Term exp;
    public final Term body;

    Let(Pos pos, Ident id, Term exp, Term body) {
      super(pos, Op.LET);
      this.id = requireNonNull(id);
      this.exp = requireNonNull(exp);
      this.body = requireNonNull(body);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.binary(left, "let " + id.name + " = ", exp, " in ", body,
          right);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy of this {@code Let} with given contents,
     * or {@code this} if the contents are the same. */
    public Let copy(Term exp, Term body) {
      return exp == this.exp && body == this.body ? this
          : ast.let(pos, id, exp, body);
    }
  }

  /** Abstract base class of terms that wrap a single term and attach some
   * meta-data to it, such as a default value or a documentation string. */
  public abstract static class Wrapper extends Term {
    public final Term exp;

    Wrapper(Pos pos, Op op, Term exp) {
      super(pos, op);
      this.exp = requireNonNull(exp);
    }

    /** Creates a copy of this wrapper around a different term,
     * or {@code this} if the term is the same. */
    public abstract Wrapper copy(Term exp);
  }

  /** Default value of a record field, for example {@code default 8080}. */
  public static class DefaultValue extends Wrapper {
    DefaultValue(Pos pos, Term exp) {
      super(pos, Op.DEFAULT_VALUE, exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(default ").append(exp, 0, 0).append(")");
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public DefaultValue copy(Term exp) {
      return exp == this.exp ? this : ast.defaultValue(pos, exp);
    }
  }

  /** Term annotated with a contract, for example {@code 8080 | Num}. */
  public static class Contract extends Wrapper {
    public final Types types;
    public final Label label;

    Contract(Pos pos, Types types, Label label, Term exp) {
      super(pos, Op.CONTRACT, exp);
      this.types = requireNonNull(types);
      this.label = requireNonNull(label);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(").append(exp, 0, 0)
          .append(" | ").append(types.toString()).append(")");
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public Contract copy(Term exp) {
      return exp == this.exp ? this : ast.contract(pos, types, label, exp);
    }
  }

  /** Default value annotated with a contract, for example
   * {@code default 8080 | Num}. */
  public static class ContractWithDefault extends Wrapper {
    public final Types types;
    public final Label label;

    ContractWithDefault(Pos pos, Types types, Label label, Term exp) {
      super(pos, Op.CONTRACT_WITH_DEFAULT, exp);
      this.types = requireNonNull(types);
      this.label = requireNonNull(label);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(default ").append(exp, 0, 0)
          .append(" | ").append(types.toString()).append(")");
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public ContractWithDefault copy(Term exp) {
      return exp == this.exp ? this
          : ast.contractWithDefault(pos, types, label, exp);
    }
  }

  /** Term with a documentation string. */
  public static class Docstring extends Wrapper {
    public final String doc;

    Docstring(Pos pos, String doc, Term exp) {
      super(pos, Op.DOCSTRING, exp);
      this.doc = requireNonNull(doc);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(").append(exp, 0, 0)
          .append(" | doc ").appendLiteral(doc).append(")");
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public Docstring copy(Term exp) {
      return exp == this.exp ? this : ast.docstring(pos, doc, exp);
    }
  }

  /** Import of another file, not yet resolved;
   * for example {@code import "lib.ncl"}. */
  public static class Import extends Term {
    public final String path;

    Import(Pos pos, String path) {
      super(pos, Op.IMPORT);
      this.path = requireNonNull(path);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("import ").appendLiteral(path);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Import that has been resolved.
   *
   * <p>The content of the file is not held in the tree; it is stored by the
   * {@link net.hydromatic.lazyconf.compile.ImportResolver} under
   * {@link #fileId}. */
  public static class ResolvedImport extends Term {
    public final FileId fileId;

    ResolvedImport(Pos pos, FileId fileId) {
      super(pos, Op.RESOLVED_IMPORT);
      this.fileId = requireNonNull(fileId);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("import ").append(fileId.toString());
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Application of a function to an argument. */
  public static class Apply extends Term {
    public final Term fn;
    public final Term arg;

    Apply(Pos pos, Term fn, Term arg) {
      super(pos, Op.APPLY);
      this.fn = requireNonNull(fn);
      this.arg = requireNonNull(arg);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, fn, op, arg, right);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy of this {@code Apply} with given contents,
     * or {@code this} if the contents are the same. */
    public Apply copy(Term fn, Term arg) {
      return fn == this.fn && arg == this.arg ? this
          : ast.apply(pos, fn, arg);
    }
  }

  /** Call to an infix operator, for example {@code 1 + 1}. */
  public static class InfixCall extends Term {
    public final Term a0;
    public final Term a1;

    InfixCall(Pos pos, Op op, Term a0, Term a1) {
      super(pos, op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      checkArgument(op.isInfix(), "not infix: %s", op);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy of this {@code InfixCall} with given contents,
     * or {@code this} if the contents are the same. */
    public InfixCall copy(Term a0, Term a1) {
      return a0 == this.a0 && a1 == this.a1 ? this
          : ast.infixCall(pos, op, a0, a1);
    }
  }

  /** "If ... then ... else" expression. */
  public static class If extends Term {
    public final Term condition;
    public final Term ifTrue;
    public final Term ifFalse;

    If(Pos pos, Term condition, Term ifTrue, Term ifFalse) {
      super(pos, Op.IF);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > 0 || right > 0) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append("if ").append(condition, 0, 0)
          .append(" then ").append(ifTrue, 0, 0)
          .append(" else ").append(ifFalse, 0, 0);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy of this {@code If} with given contents,
     * or {@code this} if the contents are the same. */
    public If copy(Term condition, Term ifTrue, Term ifFalse) {
      return condition == this.condition
          && ifTrue == this.ifTrue
          && ifFalse == this.ifFalse
          ? this
          : ast.ifThenElse(pos, condition, ifTrue, ifFalse);
    }
  }

  /** Access to a field of a record, for example {@code server.port}. */
  public static class Select extends Term {
    public final Term exp;
    public final Ident field;

    Select(Pos pos, Term exp, Ident field) {
      super(pos, Op.SELECT);
      this.exp = requireNonNull(exp);
      this.field = requireNonNull(field);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, left, op.left).append(".").id(field);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy of this {@code Select} with given contents,
     * or {@code this} if the contents are the same. */
    public Select copy(Term exp) {
      return exp == this.exp ? this : ast.select(pos, exp, field);
    }
  }
}

// End Ast.java
