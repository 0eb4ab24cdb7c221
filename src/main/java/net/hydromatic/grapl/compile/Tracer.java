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

import net.hydromatic.grapl.ast.Ast;
import net.hydromatic.grapl.graph.NormalForm;
import net.hydromatic.grapl.util.GraplException;

/**
 * Called on various events during compilation.
 *
 * <p>If {@link Prop#PARALLEL} is set, {@link #onCanonical}, {@link
 * #onRewrite}, {@link #onNormal} and {@link #onResolve} may be called from
 * several threads at once, and implementations must be thread-safe. The
 * other methods are always called on the thread that called {@link
 * Compiles}.
 */
public interface Tracer {
  /** Called when a program has been parsed. */
  void onParse(Ast.Program program);

  /** Called after an expression has been canonicalized. */
  void onCanonical(Ast.Exp exp);

  /**
   * Called each time the distributive law rewrites a clique into a union of
   * cliques.
   *
   * <p>With {@link Prop#PARALLEL}, called from fork-join worker threads.
   */
  void onRewrite(Ast.Exp before, Ast.Exp after);

  /** Called after an expression has been normalized. */
  void onNormal(Ast.Exp exp);

  /** Called when a definition has been resolved to its normal form. */
  void onResolve(String name, Ast.Exp exp);

  /** Called with the final normal form of a program. */
  void onResult(NormalForm normalForm);

  /**
   * Called with an error, just before it is thrown to the caller of {@link
   * Compiles}.
   */
  void onException(GraplException e);
}

// End Tracer.java
