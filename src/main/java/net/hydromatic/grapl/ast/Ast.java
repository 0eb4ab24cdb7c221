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
package net.hydromatic.grapl.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.grapl.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import net.hydromatic.grapl.graph.Edge;

/** Various sub-classes of AST nodes. */
public class Ast {
  private static final HashFunction HASH_FUNCTION = Hashing.murmur3_32_fixed();

  private Ast() {}

  /**
   * Base class for a graph expression.
   *
   * <p>An expression is a {@link Vertex}, a {@link VarRef}, or a {@link Group}
   * ({@link Connected} or {@link Disconnected}) of expressions.
   */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    @Override
    public abstract Exp accept(Shuttle shuttle);

    /** Returns the names of the vertices in this graph, sorted. */
    public ImmutableSortedSet<String> nodes() {
      final Set<String> names = new TreeSet<>();
      addNodes(names);
      return ImmutableSortedSet.copyOf(names);
    }

    /**
     * Returns the edges of this graph, sorted.
     *
     * <p>Self-loops are not edges: in {@code {A, [A, B]}} the only edge is
     * {@code A -- B}.
     */
    public ImmutableSortedSet<Edge> edges() {
      final Set<Edge> edges = new TreeSet<>();
      addEdges(edges);
      return ImmutableSortedSet.copyOf(edges);
    }

    abstract void addNodes(Set<String> names);

    abstract void addEdges(Set<Edge> edges);
  }

  /** Base class for an atom, {@link Vertex} or {@link VarRef}. */
  public abstract static class Atom extends Exp {
    public final String name;
    private final int hash;

    Atom(Pos pos, Op op, String name) {
      super(pos, op);
      this.name = requireNonNull(name);
      // Group hashes are sums of member hashes, so atom hashes must be well
      // mixed.
      this.hash =
          HASH_FUNCTION.newHasher()
              .putInt(op.ordinal())
              .putString(name, StandardCharsets.UTF_8)
              .hash()
              .asInt();
    }

    @Override
    public int hashCode() {
      return hash;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Atom
              && this.op == ((Atom) o).op
              && this.name.equals(((Atom) o).name);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.id(name);
    }

    @Override
    void addEdges(Set<Edge> edges) {
      // an atom has no edges
    }
  }

  /**
   * A single vertex.
   *
   * <p>For example, "A" in "{A, B}". Two vertices with the same name denote
   * the same vertex of the graph.
   */
  public static class Vertex extends Atom {
    Vertex(Pos pos, String name) {
      super(pos, Op.VERTEX, name);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    void addNodes(Set<String> names) {
      names.add(name);
    }
  }

  /**
   * Reference to a named definition.
   *
   * <p>For example, "G1" in "G1 = [A, B]; {X, G1}". References are replaced
   * by the definition's normal form during resolution.
   */
  public static class VarRef extends Atom {
    VarRef(Pos pos, String name) {
      super(pos, Op.VAR_REF, name);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    void addNodes(Set<String> names) {
      throw new IllegalStateException("unresolved reference " + name);
    }
  }

  /**
   * Base class for an expression with a set of members.
   *
   * <p>The members are a set: order is not significant, and structurally
   * equal members occur once. A group always has at least one member.
   */
  public abstract static class Group extends Exp {
    public final ImmutableSet<Exp> members;
    private final int hash;

    Group(Pos pos, Op op, ImmutableSet<Exp> members) {
      super(pos, op);
      this.members = requireNonNull(members);
      checkArgument(!members.isEmpty(), "empty group");
      this.hash =
          HASH_FUNCTION.newHasher()
              .putInt(op.ordinal())
              .putInt(members.hashCode())
              .hash()
              .asInt();
    }

    @Override
    public int hashCode() {
      return hash;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Group
              && this.hash == ((Group) o).hash
              && this.op == ((Group) o).op
              && this.members.equals(((Group) o).members);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.list(op.open, members, ", ", op.close);
    }

    @Override
    void addNodes(Set<String> names) {
      members.forEach(member -> member.addNodes(names));
    }

    @Override
    void addEdges(Set<Edge> edges) {
      members.forEach(member -> member.addEdges(edges));
    }

    /**
     * Creates a copy of this group with given members and the same operator,
     * or {@code this} if the members are the same.
     */
    public Group copy(Iterable<? extends Exp> members) {
      final ImmutableSet<Exp> set = ImmutableSet.copyOf(members);
      return set.equals(this.members) ? this : ast.group(op, pos, set);
    }
  }

  /**
   * Fully connected group.
   *
   * <p>For example, "{A, B, C}" is a triangle, and "{S, [A, B]}" connects
   * "S" to both "A" and "B".
   */
  public static class Connected extends Group {
    Connected(Pos pos, ImmutableSet<Exp> members) {
      super(pos, Op.CONNECTED, members);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    void addEdges(Set<Edge> edges) {
      super.addEdges(edges);
      // Every vertex of each member is connected to every vertex of each
      // other member.
      final List<ImmutableSortedSet<String>> nodeSets = new ArrayList<>();
      members.forEach(member -> nodeSets.add(member.nodes()));
      for (int i = 0; i < nodeSets.size(); i++) {
        for (int j = i + 1; j < nodeSets.size(); j++) {
          for (String left : nodeSets.get(i)) {
            for (String right : nodeSets.get(j)) {
              if (!left.equals(right)) {
                edges.add(Edge.of(left, right));
              }
            }
          }
        }
      }
    }
  }

  /**
   * Fully disconnected group.
   *
   * <p>For example, "[A, B]" is two isolated vertices, and "[{A, B}, C]" is
   * an edge and an isolated vertex.
   */
  public static class Disconnected extends Group {
    Disconnected(Pos pos, ImmutableSet<Exp> members) {
      super(pos, Op.DISCONNECTED, members);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Assignment of an expression to a name.
   *
   * <p>For example, "G1 = [A, B]".
   */
  public static class Definition extends AstNode {
    public final String name;
    public final Exp exp;

    Definition(Pos pos, String name, Exp exp) {
      super(pos, Op.DEFINITION);
      this.name = requireNonNull(name);
      this.exp = requireNonNull(exp);
    }

    @Override
    public int hashCode() {
      return name.hashCode() * 31 + exp.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Definition
              && this.name.equals(((Definition) o).name)
              && this.exp.equals(((Definition) o).exp);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.binary(name, op.open, exp);
    }

    @Override
    public Definition accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /**
     * Creates a copy of this {@code Definition} with given expression, or
     * {@code this} if the expression is the same.
     */
    public Definition copy(Exp exp) {
      return this.exp.equals(exp) ? this : ast.definition(pos, name, exp);
    }
  }

  /**
   * A sequence of definitions followed by a target expression.
   *
   * <p>For example, "G1 = [A, B]; G2 = {X, G1}; G2".
   */
  public static class Program extends AstNode {
    public final ImmutableList<Definition> definitions;
    public final Exp target;

    Program(Pos pos, ImmutableList<Definition> definitions, Exp target) {
      super(pos, Op.PROGRAM);
      this.definitions = requireNonNull(definitions);
      this.target = requireNonNull(target);
    }

    @Override
    public int hashCode() {
      return definitions.hashCode() * 31 + target.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Program
              && this.definitions.equals(((Program) o).definitions)
              && this.target.equals(((Program) o).target);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      for (Definition definition : definitions) {
        definition.unparse(w).append(op.open);
      }
      return target.unparse(w);
    }

    @Override
    public Program accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /**
     * Creates a copy of this {@code Program} with given contents, or {@code
     * this} if the contents are the same.
     */
    public Program copy(List<Definition> definitions, Exp target) {
      return this.definitions.equals(definitions) && this.target.equals(target)
          ? this
          : ast.program(pos, definitions, target);
    }
  }
}

// End Ast.java
