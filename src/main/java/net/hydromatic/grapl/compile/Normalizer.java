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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static net.hydromatic.grapl.util.Static.allMatch;
import static net.hydromatic.grapl.util.Static.transformEager;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.Sets;
import com.google.common.math.LongMath;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.grapl.ast.Ast;
import net.hydromatic.grapl.ast.Op;
import net.hydromatic.grapl.ast.Visitor;
import net.hydromatic.grapl.util.ResourceLimitException;

/**
 * Rewrites an expression to normal form, a union of cliques.
 *
 * <p>The rewrite rule is the distributive law, treating a connected group as
 * multiplication and a disconnected group as addition:
 *
 * <ul>
 *   <li>{@code {S, [A, B]}} &rarr; {@code [{S, A}, {S, B}]}
 *   <li>{@code {[A, B], [X, Y]}} &rarr; {@code [{A, X}, {A, Y}, {B, X}, {B,
 *       Y}]}
 *   <li>{@code {A, [{B, C}, D], E}} &rarr; {@code [{A, B, C, E}, {A, D, E}]}
 * </ul>
 *
 * <p>After each rewrite the result is canonicalized, because distribution
 * can produce nested groups of the same operator.
 *
 * <p>Each rewrite reduces the {@link #measure}, the number of disconnected
 * groups beneath a connected group, so normalization terminates. Members of
 * a group are independent, so the order in which rewrites are applied does
 * not affect the result. Children are normalized before their parent, and
 * each connected group is rewritten at most once.
 *
 * <p>References to definitions are treated as vertices.
 */
public class Normalizer {
  private final Canonicalizer canonicalizer;
  private final Tracer tracer;
  private final int maxDepth;
  private final int maxCliques;
  private final boolean parallel;

  public Normalizer(Map<Prop, Object> propMap, Tracer tracer) {
    this.canonicalizer = new Canonicalizer(propMap);
    this.tracer = tracer;
    this.maxDepth = Prop.MAX_DEPTH.intValue(propMap);
    this.maxCliques = Prop.MAX_CLIQUES.intValue(propMap);
    this.parallel = Prop.PARALLEL.booleanValue(propMap);
  }

  /** Normalizes an expression using default properties. */
  public static Ast.Exp normalize(Ast.Exp exp) {
    return new Normalizer(ImmutableMap.of(), Tracers.empty()).apply(exp);
  }

  /** Canonicalizes and normalizes an expression. */
  public Ast.Exp apply(Ast.Exp exp) {
    final Ast.Exp canonical = canonicalizer.canon(exp);
    tracer.onCanonical(canonical);
    final Ast.Exp normal;
    try {
      normal = norm(canonical, 0);
    } catch (StackOverflowError e) {
      throw Canonicalizer.tooDeep(canonical, maxDepth, e);
    }
    tracer.onNormal(normal);
    return normal;
  }

  private Ast.Exp norm(Ast.Exp exp, int depth) {
    if (depth > maxDepth) {
      throw new ResourceLimitException("maxDepth", maxDepth, depth, exp.pos);
    }
    switch (exp.op) {
      case VERTEX:
      case VAR_REF:
        return exp;

      case DISCONNECTED:
        return combine((Ast.Group) exp, depth);

      case CONNECTED:
        final Ast.Exp e = combine((Ast.Group) exp, depth);
        return e.op == Op.CONNECTED ? distribute((Ast.Group) e) : e;

      default:
        throw new AssertionError("unexpected " + exp.op);
    }
  }

  /**
   * Normalizes the members of a canonical group, and returns a canonical
   * group of the same operator with those members; or the group itself if no
   * member changed.
   */
  private Ast.Exp combine(Ast.Group group, int depth) {
    final List<Ast.Exp> members = normMembers(group, depth);
    if (Canonicalizer.isUnchanged(group, members)) {
      return group;
    }
    canonicalizer.allocate(Canonicalizer.width(group.op, members), group.pos);
    return Canonicalizer.combine(group.op, group.pos, members);
  }

  private List<Ast.Exp> normMembers(Ast.Group group, int depth) {
    if (parallel && group.members.size() > 1) {
      return group.members.parallelStream()
          .map(member -> norm(member, depth + 1))
          .collect(toImmutableList());
    }
    return transformEager(group.members, member -> norm(member, depth + 1));
  }

  /**
   * Applies the distributive law to a canonical connected group whose
   * members are in normal form.
   *
   * <p>Each member is an atom or a disconnected group of atoms and cliques.
   * The result is a disconnected group with one clique for each combination
   * of one member from each disconnected group, plus all atoms.
   */
  private Ast.Exp distribute(Ast.Group connected) {
    final List<Ast.Exp> atoms = new ArrayList<>();
    final List<ImmutableSet<Ast.Exp>> factors = new ArrayList<>();
    for (Ast.Exp member : connected.members) {
      if (member.op == Op.DISCONNECTED) {
        factors.add(((Ast.Group) member).members);
      } else {
        atoms.add(member);
      }
    }
    if (factors.isEmpty()) {
      return connected;
    }

    long count = 1;
    for (ImmutableSet<Ast.Exp> factor : factors) {
      count = LongMath.saturatedMultiply(count, factor.size());
    }
    if (count > maxCliques) {
      throw new ResourceLimitException(
          "maxCliques", maxCliques, count, connected.pos);
    }

    // Each clique has the atoms plus at most the widest member of each
    // factor; the union has one more member per clique.
    long width = atoms.size() + 1;
    for (ImmutableSet<Ast.Exp> factor : factors) {
      int widest = 1;
      for (Ast.Exp member : factor) {
        if (member.op == Op.CONNECTED) {
          widest = Math.max(widest, ((Ast.Group) member).members.size());
        }
      }
      width += widest;
    }
    canonicalizer.allocate(
        LongMath.saturatedMultiply(count, width), connected.pos);

    final List<Ast.Exp> cliques = new ArrayList<>();
    for (List<Ast.Exp> tuple : Sets.cartesianProduct(factors)) {
      cliques.add(
          Canonicalizer.combine(
              Op.CONNECTED, connected.pos, Iterables.concat(atoms, tuple)));
    }
    final Ast.Exp result =
        Canonicalizer.combine(Op.DISCONNECTED, connected.pos, cliques);
    tracer.onRewrite(connected, result);
    return result;
  }

  /**
   * Returns the number of disconnected groups that are beneath a connected
   * group. It is zero for an expression in normal form.
   */
  public static int measure(Ast.Exp exp) {
    final MeasureVisitor visitor = new MeasureVisitor();
    exp.accept(visitor);
    return visitor.count;
  }

  /**
   * Returns whether an expression is in normal form: an atom, a connected
   * group of atoms, or a disconnected group of atoms and connected groups of
   * atoms.
   */
  public static boolean isNormal(Ast.Exp exp) {
    switch (exp.op) {
      case DISCONNECTED:
        return allMatch(((Ast.Group) exp).members, Normalizer::isClique);
      default:
        return isClique(exp);
    }
  }

  private static boolean isClique(Ast.Exp exp) {
    switch (exp.op) {
      case CONNECTED:
        return allMatch(((Ast.Group) exp).members, e -> e.op.isAtom());
      default:
        return exp.op.isAtom();
    }
  }

  /** Visitor that counts disconnected groups beneath connected groups. */
  private static class MeasureVisitor extends Visitor {
    int connectedDepth = 0;
    int count = 0;

    @Override
    protected void visit(Ast.Connected connected) {
      ++connectedDepth;
      super.visit(connected);
      --connectedDepth;
    }

    @Override
    protected void visit(Ast.Disconnected disconnected) {
      if (connectedDepth > 0) {
        ++count;
      }
      super.visit(disconnected);
    }
  }
}

// End Normalizer.java
