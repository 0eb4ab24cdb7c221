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
package net.hydromatic.grapl.compile;

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.grapl.ast.Ast;
import net.hydromatic.grapl.graph.NormalForm;
import net.hydromatic.grapl.util.GraplException;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on each rewrite, then
   * calls the underlying tracer.
   */
  public static Tracer withOnRewrite(
      Tracer tracer, BiConsumer<Ast.Exp, Ast.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onRewrite(Ast.Exp before, Ast.Exp after) {
        consumer.accept(before, after);
        super.onRewrite(before, after);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each resolved
   * definition, then calls the underlying tracer.
   */
  public static Tracer withOnResolve(
      Tracer tracer, BiConsumer<String, Ast.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onResolve(String name, Ast.Exp exp) {
        consumer.accept(name, exp);
        super.onResolve(name, exp);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the result, then
   * calls the underlying tracer.
   */
  public static Tracer withOnResult(
      Tracer tracer, Consumer<NormalForm> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onResult(NormalForm normalForm) {
        consumer.accept(normalForm);
        super.onResult(normalForm);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on an error, then calls
   * the underlying tracer.
   */
  public static Tracer withOnException(
      Tracer tracer, Consumer<GraplException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onException(GraplException e) {
        consumer.accept(e);
        super.onException(e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onParse(Ast.Program program) {}

    @Override
    public void onCanonical(Ast.Exp exp) {}

    @Override
    public void onRewrite(Ast.Exp before, Ast.Exp after) {}

    @Override
    public void onNormal(Ast.Exp exp) {}

    @Override
    public void onResolve(String name, Ast.Exp exp) {}

    @Override
    public void onResult(NormalForm normalForm) {}

    @Override
    public void onException(GraplException e) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    private final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onParse(Ast.Program program) {
      tracer.onParse(program);
    }

    @Override
    public void onCanonical(Ast.Exp exp) {
      tracer.onCanonical(exp);
    }

    @Override
    public void onRewrite(Ast.Exp before, Ast.Exp after) {
      tracer.onRewrite(before, after);
    }

    @Override
    public void onNormal(Ast.Exp exp) {
      tracer.onNormal(exp);
    }

    @Override
    public void onResolve(String name, Ast.Exp exp) {
      tracer.onResolve(name, exp);
    }

    @Override
    public void onResult(NormalForm normalForm) {
      tracer.onResult(normalForm);
    }

    @Override
    public void onException(GraplException e) {
      tracer.onException(e);
    }
  }
}

// End Tracers.java
