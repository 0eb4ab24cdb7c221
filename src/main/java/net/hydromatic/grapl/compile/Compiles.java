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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.function.Supplier;
import net.hydromatic.grapl.ast.Ast;
import net.hydromatic.grapl.graph.NormalForm;
import net.hydromatic.grapl.parse.Parsers;
import net.hydromatic.grapl.util.GraplException;

/**
 * Entry points that run the whole pipeline: parse, canonicalize, normalize,
 * resolve references, then canonicalize and normalize again.
 *
 * <p>Every {@link GraplException} is passed to {@link Tracer#onException}
 * before it is thrown.
 */
public abstract class Compiles {
  private Compiles() {}

  /** Compiles a program using default properties. */
  public static NormalForm compile(String text) {
    return compile(text, ImmutableMap.of(), Tracers.empty());
  }

  /** Compiles a program to its normal form. */
  public static NormalForm compile(
      String text, Map<Prop, Object> propMap, Tracer tracer) {
    return trace(
        tracer,
        () ->
            compileProgram(Parsers.parseProgram(text, propMap), propMap,
                tracer));
  }

  /** Compiles a program, given as UTF-8 bytes, to its normal form. */
  public static NormalForm compile(
      byte[] bytes, Map<Prop, Object> propMap, Tracer tracer) {
    return trace(
        tracer,
        () ->
            compileProgram(Parsers.parseProgram(bytes, propMap), propMap,
                tracer));
  }

  /** Compiles a parsed program to its normal form. */
  public static NormalForm compile(
      Ast.Program program, Map<Prop, Object> propMap, Tracer tracer) {
    return trace(tracer, () -> compileProgram(program, propMap, tracer));
  }

  private static NormalForm compileProgram(
      Ast.Program program, Map<Prop, Object> propMap, Tracer tracer) {
    tracer.onParse(program);
    final Ast.Exp exp = new Resolver(propMap, tracer).resolve(program);
    final NormalForm normalForm = NormalForm.of(exp);
    tracer.onResult(normalForm);
    return normalForm;
  }

  /**
   * Compiles every definition of a program, returning the normal form of
   * each, in the order they were defined.
   */
  public static ImmutableMap<String, NormalForm> compileDefinitions(
      String text, Map<Prop, Object> propMap, Tracer tracer) {
    return trace(
        tracer,
        () -> {
          final Ast.Program program = Parsers.parseProgram(text, propMap);
          tracer.onParse(program);
          final ImmutableMap.Builder<String, NormalForm> b =
              ImmutableMap.builder();
          new Resolver(propMap, tracer)
              .resolveDefinitions(program)
              .forEach((name, exp) -> b.put(name, NormalForm.of(exp)));
          return b.build();
        });
  }

  /**
   * Parses and normalizes an expression that contains no references.
   *
   * <p>Unlike {@link #compile(String)}, returns the expression, not the
   * {@link NormalForm}.
   */
  public static Ast.Exp normalize(String text, Map<Prop, Object> propMap) {
    final Ast.Exp exp = Parsers.parseExpression(text, propMap);
    return new Normalizer(propMap, Tracers.empty()).apply(exp);
  }

  private static <T> T trace(Tracer tracer, Supplier<T> supplier) {
    try {
      return supplier.get();
    } catch (RuntimeException e) {
      if (e instanceof GraplException) {
        tracer.onException((GraplException) e);
      }
      throw e;
    }
  }
}

// End Compiles.java
