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

import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import net.hydromatic.lazyconf.ast.Ast;
import net.hydromatic.lazyconf.ast.Op;
import net.hydromatic.lazyconf.ast.Shuttle;
import net.hydromatic.lazyconf.eval.Prop;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Applies all program transformations: conversion to
 * {@link ShareNormalForm share normal form}, and
 * {@link ImportResolution import resolution}.
 *
 * <p>Both transformations are applied, one node at a time, in a single
 * traversal of the tree. Files that are loaded while resolving imports are
 * pushed onto a stack. When the tree has been traversed, the files on the
 * stack are transformed in the same way (which may push further files), and
 * each transformed term is stored in the resolver.
 */
public class Transformer {
  private final NameGenerator nameGenerator;
  private final Tracer tracer;
  private final boolean shareNormalForm;

  private Transformer(NameGenerator nameGenerator, Tracer tracer,
      boolean shareNormalForm) {
    this.nameGenerator = requireNonNull(nameGenerator);
    this.tracer = requireNonNull(tracer);
    this.shareNormalForm = shareNormalForm;
  }

  /** Creates a Transformer with default properties, that uses the shared
   * name generator and does not trace.
   *
   * <p>Its names do not clash with those generated by
   * {@link net.hydromatic.lazyconf.eval.Closurizable#closurize(
   * net.hydromatic.lazyconf.eval.EvalEnv,
   * net.hydromatic.lazyconf.eval.EvalEnv)}, which uses the same
   * generator. */
  public static Transformer create() {
    return of(NameGenerator.shared(), Tracers.empty(), ImmutableMap.of());
  }

  /** Creates a Transformer.
   *
   * <p>Generated names are unique only within {@code nameGenerator}. The
   * evaluator that runs the transformed term must closurize with the same
   * generator; otherwise a closurized binding may get the name of a "let"
   * that this transformer introduced, and replace it in the environment. */
  public static Transformer of(NameGenerator nameGenerator, Tracer tracer,
      Map<Prop, Object> propMap) {
    return new Transformer(nameGenerator, tracer,
        Prop.SHARE_NORMAL_FORM.booleanValue(propMap));
  }

  /**
   * Transforms a term, and every file that it imports, directly or
   * indirectly, that the resolver has not loaded before.
   *
   * <p>Files are processed last-discovered-first, so the imports of a file
   * are stored in the resolver before the files it was discovered alongside.
   *
   * <p>With share normal form enabled, sibling imports in a record or list
   * are resolved in reverse order (for {@code {a = import "a", b = import
   * "b"}}, "b" is resolved before "a") and, being popped from the stack,
   * transformed and stored in field order. Nothing depends on this order;
   * the resolver's cache makes the result the same either way.
   *
   * <p>The first exception aborts the transformation, and no term is
   * returned. If the root term cannot be transformed, no imported file is
   * transformed or stored; files stored before a later failure remain
   * stored.
   *
   * @throws ImportException if an import cannot be resolved
   */
  public Ast.Term transform(Ast.Term term, ImportResolver resolver) {
    final TransformState state = new TransformState(resolver);
    try {
      final Ast.Term result = pass(term, null, state);
      while (!state.stack.isEmpty()) {
        final ImportResolution.Pending pending = state.stack.pop();
        final Ast.Term transformed =
            pass(pending.term, pending.fileId, state);
        resolver.insert(pending.fileId, transformed);
        tracer.onInsert(pending.fileId, transformed);
      }
      return result;
    } catch (ImportException e) {
      tracer.onException(e);
      throw e;
    }
  }

  /** Performs one full pass over a term. Pushes files that are imported for
   * the first time onto the stack, but does not process them. */
  private Ast.Term pass(Ast.Term term, @Nullable FileId fileId,
      TransformState state) {
    final Ast.Term result = Shuttle.traverse(term, this::step, state);
    tracer.onPass(fileId, result);
    return result;
  }

  /** Applies one step of each transformation to the top node of a term. */
  private Ast.Term step(Ast.Term term, TransformState state) {
    final Ast.Term shared =
        shareNormalForm
            ? ShareNormalForm.transformOne(nameGenerator, term)
            : term;
    final ImportResolution.Result result =
        ImportResolution.transformOne(shared, state.resolver);
    if (shared.op == Op.IMPORT) {
      final Ast.ResolvedImport resolvedImport =
          (Ast.ResolvedImport) result.term;
      tracer.onImport(((Ast.Import) shared).path, shared.pos,
          resolvedImport.fileId, result.pending == null);
    }
    if (result.pending != null) {
      state.stack.push(result.pending);
    }
    return result.term;
  }

  /** State of a transformation: the resolver, and the stack of loaded files
   * that are waiting to be transformed. */
  private static class TransformState {
    final ImportResolver resolver;
    final Deque<ImportResolution.Pending> stack = new ArrayDeque<>();

    TransformState(ImportResolver resolver) {
      this.resolver = requireNonNull(resolver);
    }
  }
}

// End Transformer.java
