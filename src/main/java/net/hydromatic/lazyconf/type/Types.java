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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.lazyconf.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.Objects;
import net.hydromatic.lazyconf.ast.Ast;
import net.hydromatic.lazyconf.ast.Ident;
import net.hydromatic.lazyconf.ast.Op;
import net.hydromatic.lazyconf.ast.Pos;
import net.hydromatic.lazyconf.compile.NameGenerator;
import net.hydromatic.lazyconf.eval.Closurizable;
import net.hydromatic.lazyconf.eval.EvalEnv;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Type.
 *
 * <p>Every type can be checked at run time by its {@link #contract()}, a term
 * that the evaluator applies to a label and a value.
 */
public class Types implements Closurizable<Types> {
  public static final Types DYN = new Types(Op.DYN_TYPE, ImmutableList.of());
  public static final Types NUM = new Types(Op.NUM_TYPE, ImmutableList.of());
  public static final Types BOOL = new Types(Op.BOOL_TYPE, ImmutableList.of());
  public static final Types STR = new Types(Op.STR_TYPE, ImmutableList.of());
  public static final Types SYM = new Types(Op.SYM_TYPE, ImmutableList.of());

  public final Op op;
  /** Type arguments; for example, the element type of a list type. */
  public final ImmutableList<Types> args;
  /** Contract of an opaque type; null unless {@link #op} is
   * {@link Op#FLAT_TYPE}. */
  public final Ast.@Nullable Term flat;

  private Types(Op op, ImmutableList<Types> args) {
    this(op, args, null);
  }

  private Types(Op op, ImmutableList<Types> args,
      Ast.@Nullable Term flat) {
    this.op = requireNonNull(op);
    this.args = requireNonNull(args);
    this.flat = flat;
    checkArgument((op == Op.FLAT_TYPE) == (flat != null));
  }

  /** Creates a list type. */
  public static Types list(Types elementType) {
    return new Types(Op.LIST_TYPE, ImmutableList.of(elementType));
  }

  /** Creates a function type. */
  public static Types arrow(Types paramType, Types resultType) {
    return new Types(Op.ARROW_TYPE, ImmutableList.of(paramType, resultType));
  }

  /** Creates an opaque type, defined only by its contract. */
  public static Types flat(Ast.Term contract) {
    return new Types(Op.FLAT_TYPE, ImmutableList.of(),
        requireNonNull(contract));
  }

  /** Returns the name of the built-in contract for a primitive or composite
   * type. */
  static Ident builtInContract(Op op) {
    switch (op) {
    case DYN_TYPE:
      return Ident.of("$dyn");
    case NUM_TYPE:
      return Ident.of("$num");
    case BOOL_TYPE:
      return Ident.of("$bool");
    case STR_TYPE:
      return Ident.of("$str");
    case SYM_TYPE:
      return Ident.of("$sym");
    case LIST_TYPE:
      return Ident.of("$list");
    case ARROW_TYPE:
      return Ident.of("$func");
    default:
      throw new AssertionError("no built-in contract for " + op);
    }
  }

  /** Returns the term that checks this type at run time. */
  public Ast.Term contract() {
    switch (op) {
    case FLAT_TYPE:
      return requireNonNull(flat);
    case LIST_TYPE:
      return ast.apply(Pos.ZERO, ast.var(builtInContract(op)),
          args.get(0).contract());
    case ARROW_TYPE:
      return ast.apply(Pos.ZERO,
          ast.apply(Pos.ZERO, ast.var(builtInContract(op)),
              args.get(0).contract()),
          args.get(1).contract());
    default:
      return ast.var(builtInContract(op));
    }
  }

  /**
   * {@inheritDoc}
   *
   * <p>Extracts the underlying contract, closurizes it, and wraps it back as
   * an opaque type.
   */
  @Override
  public Types closurize(NameGenerator nameGenerator, EvalEnv env,
      EvalEnv withEnv) {
    return flat(contract().closurize(nameGenerator, env, withEnv));
  }

  @Override
  public int hashCode() {
    return Objects.hash(op, args, flat);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Types
        && op == ((Types) o).op
        && args.equals(((Types) o).args)
        && Objects.equals(flat, ((Types) o).flat);
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder(), 0).toString();
  }

  private StringBuilder describeTo(StringBuilder buf, int left) {
    switch (op) {
    case DYN_TYPE:
      return buf.append("Dyn");
    case NUM_TYPE:
      return buf.append("Num");
    case BOOL_TYPE:
      return buf.append("Bool");
    case STR_TYPE:
      return buf.append("Str");
    case SYM_TYPE:
      return buf.append("Sym");
    case LIST_TYPE:
      buf.append("List ");
      return args.get(0).describeTo(buf, op.right);
    case ARROW_TYPE:
      if (left > op.left) {
        buf.append("(");
        return describeTo(buf, 0).append(")");
      }
      args.get(0).describeTo(buf, op.left + 1);
      buf.append(op.padded);
      return args.get(1).describeTo(buf, op.right);
    case FLAT_TYPE:
      return buf.append("#").append(flat);
    default:
      throw new AssertionError("unknown type " + op);
    }
  }
}

// End Types.java
