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

import static net.hydromatic.grapl.ast.AstBuilder.ast;
import static net.hydromatic.grapl.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.math.LongMath;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import net.hydromatic.grapl.ast.Ast;
import net.hydromatic.grapl.ast.Op;
import net.hydromatic.grapl.ast.Pos;
import net.hydromatic.grapl.util.ResourceLimitException;

/**
 * Simplifies an expression without changing its meaning.
 *
 * <ul>
 *   <li>Flattening: {@code {{A, B}, C}} &rarr; {@code {A, B, C}} and
 *       {@code [[A, B], C]} &rarr; {@code [A, B, C]}
 *   <li>Deduplication: {@code [A, A, {B, C}, {C, B}]} &rarr; {@code [A, {B,
 *       C}]}
 *   <li>Collapse: {@code {A}} &rarr; {@code A} and {@code [[{{A}}]]} &rarr;
 *       {@code A}
 * </ul>
 *
 * <p>Canonicalization is idempotent.
 *
 * <p>A canonicalizer counts the group members it creates, over its whole
 * life, against {@link Prop#MAX_NODES}.
 */
public class Canonicalizer {
  private final int maxDepth;
  private final int maxNodes;
  private final AtomicLong nodeCount = new AtomicLong();

  public Canonicalizer(Map<Prop, Object> propMap) {
    this.maxDepth = Prop.MAX_DEPTH.intValue(propMap);
    this.maxNodes = Prop.MAX_NODES.intValue(propMap);
  }

  /** Canonicalizes an expression using default properties. */
  public static Ast.Exp canonicalize(Ast.Exp exp) {
    return new Canonicalizer(ImmutableMap.of()).canon(exp);
  }

  /** Canonicalizes an expression. */
  public Ast.Exp canon(Ast.Exp exp) {
    try {
      return canon(exp, 0);
    } catch (StackOverflowError e) {
      throw tooDeep(exp, maxDepth, e);
    }
  }

  private Ast.Exp canon(Ast.Exp exp, int depth) {
    if (depth > maxDepth) {
      throw new ResourceLimitException("maxDepth", maxDepth, depth, exp.pos);
    }
    switch (exp.op) {
      case VERTEX:
      case VAR_REF:
        return exp;

      case CONNECTED:
      case DISCONNECTED:
        final Ast.Group group = (Ast.Group) exp;
        final List<Ast.Exp> members =
            transformEager(group.members, member -> canon(member, depth + 1));
        if (isUnchanged(group, members)) {
          return group;
        }
        allocate(width(group.op, members), group.pos);
        return combine(group.op, group.pos, members);

      default:
        throw new AssertionError("unexpected " + exp.op);
    }
  }

  /**
   * Records that {@code count} group members are about to be created, and
   * throws if the total exceeds {@link Prop#MAX_NODES}.
   */
  void allocate(long count, Pos pos) {
    final long total =
        nodeCount.accumulateAndGet(count, LongMath::saturatedAdd);
    if (total > maxNodes) {
      throw new ResourceLimitException("maxNodes", maxNodes, total, pos);
    }
  }

  /**
   * Returns whether a canonical group with the given members would be the
   * same as {@code group}: each member is the same object as before, and
   * none needs to be spliced in.
   */
  static boolean isUnchanged(Ast.Group group, List<Ast.Exp> members) {
    if (members.size() < 2) {
      return false;
    }
    final ImmutableList<Ast.Exp> originals = group.members.asList();
    for (int i = 0; i < members.size(); i++) {
      final Ast.Exp member = members.get(i);
      if (member != originals.get(i) || member.op == group.op) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the number of members that {@link #combine} would create, before
   * removing duplicates.
   */
  static long width(Op op, Iterable<? extends Ast.Exp> canonicalMembers) {
    long width = 0;
    for (Ast.Exp member : canonicalMembers) {
      width += member.op == op ? ((Ast.Group) member).members.size() : 1;
    }
    return width;
  }

  /**
   * Creates a canonical group from members that are already canonical.
   *
   * <p>Members with the same operator as the group are spliced in; a group
   * with one member collapses to that member.
   */
  public static Ast.Exp combine(
      Op op, Pos pos, Iterable<? extends Ast.Exp> canonicalMembers) {
    final ImmutableSet.Builder<Ast.Exp> members = ImmutableSet.builder();
    for (Ast.Exp member : canonicalMembers) {
      if (member.op == op) {
        // The member is canonical, so none of its members has this operator.
        members.addAll(((Ast.Group) member).members);
      } else {
        members.add(member);
      }
    }
    final ImmutableSet<Ast.Exp> set = members.build();
    return set.size() == 1 ? set.iterator().next() : ast.group(op, pos, set);
  }

  /**
   * Converts a stack overflow, which can happen if {@link Prop#MAX_DEPTH} is
   * set very high, into a {@link ResourceLimitException}.
   */
  static ResourceLimitException tooDeep(Ast.Exp exp, int maxDepth,
      StackOverflowError e) {
    final int depth = depth(exp);
    return new ResourceLimitException(
        "expression is too deeply nested: depth is " + depth
            + ", maxDepth is " + maxDepth,
        "maxDepth", maxDepth, depth, exp.pos, e);
  }

  /** Returns the nesting depth of an expression; 0 for an atom. */
  static int depth(Ast.Exp exp) {
    int depth = -1;
    List<Ast.Exp> level = ImmutableList.of(exp);
    while (!level.isEmpty()) {
      ++depth;
      final List<Ast.Exp> next = new ArrayList<>();
      for (Ast.Exp e : level) {
        if (e instanceof Ast.Group) {
          next.addAll(((Ast.Group) e).members);
        }
      }
      level = next;
    }
    return depth;
  }
}

// End Canonicalizer.java
