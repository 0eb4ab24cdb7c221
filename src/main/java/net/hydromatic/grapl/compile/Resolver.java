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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ContiguousSet;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import net.hydromatic.grapl.ast.Ast;
import net.hydromatic.grapl.ast.Pos;
import net.hydromatic.grapl.ast.Shuttle;

/**
 * Replaces references to definitions by the normal form of those
 * definitions.
 *
 * <p>For example, given
 *
 * <pre>{@code
 * G1 = [A, B]
 * G2 = {X, G1}
 * }</pre>
 *
 * <p>{@code G2} resolves to {@code {X, [A, B]}}, which normalizes to {@code
 * [{X, A}, {X, B}]}.
 *
 * <p>A definition that refers to itself, directly or via other definitions,
 * is an error; so is defining the same name twice, unless {@link
 * Prop#SHADOWING} is enabled. With shadowing, a reference denotes the
 * nearest preceding definition of its name, so {@code G = A; G = {G, B}}
 * defines {@code G} as {@code {A, B}}; a reference with no preceding
 * definition denotes the last definition of its name.
 */
public class Resolver {
  private final Normalizer normalizer;
  private final Tracer tracer;
  private final boolean shadowing;
  private final boolean parallel;

  public Resolver(Map<Prop, Object> propMap, Tracer tracer) {
    this.normalizer = new Normalizer(propMap, tracer);
    this.tracer = requireNonNull(tracer);
    this.shadowing = Prop.SHADOWING.booleanValue(propMap);
    this.parallel = Prop.PARALLEL.booleanValue(propMap);
  }

  /**
   * Resolves the target of a program, returning an expression in normal form
   * that contains no references.
   */
  public Ast.Exp resolve(Ast.Program program) {
    final Resolution resolution =
        new Resolution(program, index(program), new ConcurrentHashMap<>());
    final Ast.Exp target = normalizer.apply(program.target);
    return normalizer.apply(
        resolution.expand(target, program.definitions.size()));
  }

  /**
   * Resolves every definition of a program, returning the normal form of
   * each name, in the order the names were first defined. If a name is
   * defined more than once, the map holds its last definition.
   */
  public ImmutableMap<String, Ast.Exp> resolveDefinitions(Ast.Program program) {
    final ImmutableListMultimap<String, Integer> index = index(program);
    final Map<Integer, Ast.Exp> resolved = new ConcurrentHashMap<>();
    final List<Integer> ordinals =
        ContiguousSet.closedOpen(0, program.definitions.size()).asList();
    if (parallel) {
      // Each task has its own stack of definitions in progress.
      ordinals.parallelStream()
          .forEach(i ->
              new Resolution(program, index, resolved)
                  .definition(i, program.definitions.get(i).pos));
    } else {
      final Resolution resolution = new Resolution(program, index, resolved);
      ordinals.forEach(i ->
          resolution.definition(i, program.definitions.get(i).pos));
    }
    final ImmutableMap.Builder<String, Ast.Exp> b = ImmutableMap.builder();
    index.asMap().forEach((name, list) ->
        b.put(name, resolved.get(Iterables.getLast(list))));
    return b.build();
  }

  /**
   * Builds a map from each name to the ordinals of its definitions, checking
   * for duplicates.
   */
  private ImmutableListMultimap<String, Integer> index(Ast.Program program) {
    final ImmutableListMultimap.Builder<String, Integer> b =
        ImmutableListMultimap.builder();
    final Set<String> names = new HashSet<>();
    for (int i = 0; i < program.definitions.size(); i++) {
      final Ast.Definition definition = program.definitions.get(i);
      if (!names.add(definition.name) && !shadowing) {
        throw new DuplicateDefinitionException(definition.name, definition.pos);
      }
      b.put(definition.name, i);
    }
    return b.build();
  }

  /**
   * State of a depth-first expansion of definitions.
   *
   * <p>Not thread-safe; the map of resolved definitions may be shared
   * between resolutions.
   */
  private class Resolution {
    final Ast.Program program;
    final ImmutableListMultimap<String, Integer> index;
    /** Normal form of each definition, keyed by its ordinal. */
    final Map<Integer, Ast.Exp> resolved;
    /** Ordinals of the definitions being expanded, outermost first. */
    final List<Integer> inProgress = new ArrayList<>();

    Resolution(Ast.Program program,
        ImmutableListMultimap<String, Integer> index,
        Map<Integer, Ast.Exp> resolved) {
      this.program = program;
      this.index = index;
      this.resolved = resolved;
    }

    /**
     * Replaces each reference in an expression by the definition it
     * denotes.
     *
     * @param exp Expression
     * @param ordinal Ordinal of the definition that contains the expression,
     *     or the number of definitions if the expression is the target
     */
    Ast.Exp expand(Ast.Exp exp, int ordinal) {
      return exp.accept(
          new Shuttle() {
            @Override
            protected Ast.Exp visit(Ast.VarRef varRef) {
              return definition(lookup(varRef, ordinal), varRef.pos);
            }
          });
    }

    /**
     * Returns the ordinal of the definition that a reference denotes: the
     * nearest definition of that name before {@code ordinal}, or if there is
     * none, the last definition of that name.
     *
     * <p>Without {@link Prop#SHADOWING} each name has one definition.
     */
    int lookup(Ast.VarRef varRef, int ordinal) {
      final ImmutableList<Integer> ordinals = index.get(varRef.name);
      if (ordinals.isEmpty()) {
        throw new UndefinedVariableException(varRef.name, varRef.pos);
      }
      for (int i : Lists.reverse(ordinals)) {
        if (i < ordinal) {
          return i;
        }
      }
      return Iterables.getLast(ordinals);
    }

    /**
     * Returns the normal form of a definition.
     *
     * @param ordinal Ordinal of the definition
     * @param pos Position of the reference, for error messages
     */
    Ast.Exp definition(int ordinal, Pos pos) {
      final Ast.Exp exp = resolved.get(ordinal);
      if (exp != null) {
        return exp;
      }
      final Ast.Definition definition = program.definitions.get(ordinal);
      final int i = inProgress.indexOf(ordinal);
      if (i >= 0) {
        final List<String> chain = new ArrayList<>();
        inProgress.subList(i, inProgress.size())
            .forEach(o -> chain.add(program.definitions.get(o).name));
        throw new CyclicDefinitionException(chain, pos);
      }
      inProgress.add(ordinal);
      final Ast.Exp normal =
          normalizer.apply(
              expand(normalizer.apply(definition.exp), ordinal));
      inProgress.remove(inProgress.size() - 1);
      resolved.putIfAbsent(ordinal, normal);
      tracer.onResolve(definition.name, normal);
      return normal;
    }
  }

  /** Error when a reference has no definition. */
  public static class UndefinedVariableException extends CompileException {
    private final String name;

    UndefinedVariableException(String name, Pos pos) {
      super("undefined variable " + name, pos);
      this.name = name;
    }

    /** Returns the name that has no definition. */
    public String name() {
      return name;
    }
  }

  /**
   * Error when a definition refers to itself, directly or via other
   * definitions.
   */
  public static class CyclicDefinitionException extends CompileException {
    private final ImmutableList<String> chain;

    CyclicDefinitionException(List<String> chain, Pos pos) {
      super(
          "cyclic definition: "
              + String.join(" -> ", chain)
              + " -> "
              + chain.get(0),
          pos);
      this.chain = ImmutableList.copyOf(chain);
    }

    /**
     * Returns the names in the cycle, in the order they were reached; for
     * example, [G1, G2] if G1 refers to G2 and G2 refers to G1.
     */
    public ImmutableList<String> chain() {
      return chain;
    }
  }

  /** Error when a name is defined more than once. */
  public static class DuplicateDefinitionException extends CompileException {
    private final String name;

    DuplicateDefinitionException(String name, Pos pos) {
      super("duplicate definition of " + name, pos);
      this.name = name;
    }

    /** Returns the name that is defined more than once. */
    public String name() {
      return name;
    }
  }
}

// End Resolver.java
