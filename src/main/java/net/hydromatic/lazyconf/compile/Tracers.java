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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.lazyconf.ast.Ast;
import net.hydromatic.lazyconf.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each import,
   * then calls the underlying tracer. The action receives the path and
   * whether the file came from the resolver's cache. */
  public static Tracer withOnImport(Tracer tracer,
      BiConsumer<String, Boolean> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onImport(String path, Pos pos, FileId fileId,
          boolean fromCache) {
        consumer.accept(path, fromCache);
        super.onImport(path, pos, fileId, fromCache);
      }
    };
  }

  /** Returns a tracer that performs the given action on the result of each
   * pass, then calls the underlying tracer. */
  public static Tracer withOnPass(Tracer tracer,
      BiConsumer<@Nullable FileId, Ast.Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onPass(@Nullable FileId fileId, Ast.Term term) {
        consumer.accept(fileId, term);
        super.onPass(fileId, term);
      }
    };
  }

  /** Returns a tracer that performs the given action each time a file is
   * stored in the resolver, then calls the underlying tracer. */
  public static Tracer withOnInsert(Tracer tracer,
      BiConsumer<FileId, Ast.Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onInsert(FileId fileId, Ast.Term term) {
        consumer.accept(fileId, term);
        super.onInsert(fileId, term);
      }
    };
  }

  /** Returns a tracer that performs the given action on the exception that
   * aborts a transformation, then calls the underlying tracer. */
  public static Tracer withOnException(Tracer tracer,
      Consumer<ImportException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onException(ImportException e) {
        consumer.accept(e);
        super.onException(e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onImport(String path, Pos pos, FileId fileId,
        boolean fromCache) {
    }

    @Override
    public void onPass(@Nullable FileId fileId, Ast.Term term) {
    }

    @Override
    public void onInsert(FileId fileId, Ast.Term term) {
    }

    @Override
    public void onException(ImportException e) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onImport(String path, Pos pos, FileId fileId,
        boolean fromCache) {
      tracer.onImport(path, pos, fileId, fromCache);
    }

    @Override
    public void onPass(@Nullable FileId fileId, Ast.Term term) {
      tracer.onPass(fileId, term);
    }

    @Override
    public void onInsert(FileId fileId, Ast.Term term) {
      tracer.onInsert(fileId, term);
    }

    @Override
    public void onException(ImportException e) {
      tracer.onException(e);
    }
  }
}

// End Tracers.java
