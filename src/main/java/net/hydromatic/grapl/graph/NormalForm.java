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
package net.hydromatic.grapl.graph;

import static net.hydromatic.grapl.ast.AstBuilder.ast;
import static net.hydromatic.grapl.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Ordering;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import net.hydromatic.grapl.ast.Ast;
import net.hydromatic.grapl.ast.Pos;

/**
 * Canonical value of a graph: a union of cliques.
 *
 * <p>Each clique is a non-empty set of vertex names; a clique with one
 * member is an isolated vertex. Two graph expressions are equivalent if and
 * only if their normal forms are equal.
 *
 * <p>Iteration is deterministic. Names within a clique are sorted, and
 * cliques are sorted by their sequence of names, a shorter sequence before
 * any sequence it is a prefix of. So "[{B, A}, C, {A, C}]" is written
 * "[{A, B}, {A, C}, C]".
 */
public final class NormalForm {
  /** Orders cliques by their sorted sequence of vertex names. */
  public static final Ordering<Iterable<String>> CLIQUE_ORDERING =
      Ordering.<String>natural().lexicographical();

  private final ImmutableSortedSet<ImmutableSortedSet<String>> cliques;

  private NormalForm(ImmutableSortedSet<ImmutableSortedSet<String>> cliques) {
    this.cliques = cliques;
  }

  /** Creates a normal form from a collection of cliques. */
  public static NormalForm ofCliques(
      Iterable<? extends Iterable<String>> cliques) {
    final List<ImmutableSortedSet<String>> list = new ArrayList<>();
    for (Iterable<String> clique : cliques) {
      final ImmutableSortedSet<String> names =
          ImmutableSortedSet.copyOf(clique);
      if (names.isEmpty()) {
        throw new IllegalArgumentException("empty clique");
      }
      list.add(names);
    }
    if (list.isEmpty()) {
      throw new IllegalArgumentException("graph has no cliques");
    }
    return new NormalForm(ImmutableSortedSet.copyOf(CLIQUE_ORDERING, list));
  }

  /**
   * Converts an expression in normal form to a {@code NormalForm}.
   *
   * <p>The expression must be a vertex, a clique of vertices, or a
   * disconnected group whose members are vertices and cliques of vertices.
   * Throws {@link IllegalArgumentException} otherwise, including if the
   * expression contains an unresolved reference.
   */
  public static NormalForm of(Ast.Exp exp) {
    final List<Set<String>> cliques = new ArrayList<>();
    switch (exp.op) {
      case DISCONNECTED:
        for (Ast.Exp member : ((Ast.Group) exp).members) {
          cliques.add(clique(member));
        }
        break;
      default:
        cliques.add(clique(exp));
    }
    return ofCliques(cliques);
  }

  private static Set<String> clique(Ast.Exp exp) {
    final Set<String> names = new TreeSet<>();
    switch (exp.op) {
      case VERTEX:
        names.add(((Ast.Vertex) exp).name);
        return names;
      case CONNECTED:
        for (Ast.Exp member : ((Ast.Group) exp).members) {
          if (!(member instanceof Ast.Vertex)) {
            throw new IllegalArgumentException("not in normal form: " + exp);
          }
          names.add(((Ast.Vertex) member).name);
        }
        return names;
      case VAR_REF:
        throw new IllegalArgumentException("unresolved reference: " + exp);
      default:
        throw new IllegalArgumentException("not in normal form: " + exp);
    }
  }

  /** Returns the cliques, in canonical order. */
  public ImmutableSortedSet<ImmutableSortedSet<String>> cliques() {
    return cliques;
  }

  /** Returns the names of all vertices, sorted. */
  public ImmutableSortedSet<String> nodes() {
    final ImmutableSortedSet.Builder<String> b =
        ImmutableSortedSet.naturalOrder();
    cliques.forEach(b::addAll);
    return b.build();
  }

  /** Returns all edges, sorted. */
  public ImmutableSortedSet<Edge> edges() {
    final ImmutableSortedSet.Builder<Edge> b =
        ImmutableSortedSet.naturalOrder();
    for (ImmutableSortedSet<String> clique : cliques) {
      final ImmutableList<String> names = clique.asList();
      for (int i = 0; i < names.size(); i++) {
        for (int j = i + 1; j < names.size(); j++) {
          b.add(Edge.of(names.get(i), names.get(j)));
        }
      }
    }
    return b.build();
  }

  /**
   * Returns the names of vertices that have no edges, sorted.
   *
   * <p>A vertex that is a clique of its own but also a member of a larger
   * clique is not isolated.
   */
  public ImmutableSortedSet<String> isolatedNodes() {
    final Set<String> connected = new TreeSet<>();
    for (ImmutableSortedSet<String> clique : cliques) {
      if (clique.size() > 1) {
        connected.addAll(clique);
      }
    }
    final ImmutableSortedSet.Builder<String> b =
        ImmutableSortedSet.naturalOrder();
    for (String node : nodes()) {
      if (!connected.contains(node)) {
        b.add(node);
      }
    }
    return b.build();
  }

  /**
   * Converts this normal form to an expression whose members are in
   * canonical order.
   */
  public Ast.Exp toExp() {
    final List<Ast.Exp> members =
        transformEager(
            cliques,
            clique ->
                clique.size() == 1
                    ? ast.vertex(clique.first())
                    : ast.connected(
                        Pos.ZERO, transformEager(clique, ast::vertex)));
    return members.size() == 1
        ? members.get(0)
        : ast.disconnected(Pos.ZERO, members);
  }

  @Override
  public int hashCode() {
    return cliques.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof NormalForm && cliques.equals(((NormalForm) o).cliques);
  }

  /**
   * Returns the canonical text of this graph.
   *
   * @see GraphWriter#serialize(NormalForm)
   */
  @Override
  public String toString() {
    return toExp().toString();
  }
}

// End NormalForm.java
