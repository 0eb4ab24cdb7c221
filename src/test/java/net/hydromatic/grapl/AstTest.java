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
package net.hydromatic.grapl;

import static net.hydromatic.grapl.Matchers.equalsOrdered;
import static net.hydromatic.grapl.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.grapl.ast.Ast;
import net.hydromatic.grapl.ast.Op;
import net.hydromatic.grapl.ast.Pos;
import net.hydromatic.grapl.graph.Edge;
import net.hydromatic.grapl.parse.Parsers;
import org.junit.jupiter.api.Test;

/** Tests for the abstract syntax tree and its builder. */
public class AstTest {
  @Test
  void testVertex() {
    final Ast.Vertex a = ast.vertex("A");
    assertThat(a.op, is(Op.VERTEX));
    assertThat(a.toString(), is("A"));
    assertThat(a, is(ast.vertex(new Pos("f", 3, 4, 3, 5), "A")));
    assertThat(a, not(ast.vertex("B")));

    // A vertex is not a reference, even if it has the same name.
    assertThat(a.equals(ast.varRef("A")), is(false));
  }

  @Test
  void testIdentifier() {
    assertThat(ast.isIdentifier("A"), is(true));
    assertThat(ast.isIdentifier("_a_1"), is(true));
    assertThat(ast.isIdentifier("1A"), is(false));
    assertThat(ast.isIdentifier(""), is(false));
    assertThat(ast.isIdentifier("A-B"), is(false));
    assertThat(ast.isIdentifier("é"), is(false));
    assertThrows(IllegalArgumentException.class, () -> ast.vertex("a b"));
    assertThrows(IllegalArgumentException.class,
        () -> ast.definition(Pos.ZERO, "", ast.vertex("A")));
  }

  @Test
  void testEmptyGroup() {
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> ast.connected());
    assertThat(e.getMessage(),
        is("CONNECTED group must have at least one member"));
    assertThrows(IllegalArgumentException.class,
        () -> ast.disconnected(Pos.ZERO, ImmutableList.of()));
    assertThrows(IllegalArgumentException.class,
        () ->
            ast.group(Op.VERTEX, Pos.ZERO,
                ImmutableList.of(ast.vertex("A"))));
  }

  /** Members form a set: order and duplicates do not affect equality. */
  @Test
  void testGroupIsSet() {
    final Ast.Connected abc =
        ast.connected(ast.vertex("A"), ast.vertex("B"), ast.vertex("C"));
    final Ast.Connected cba =
        ast.connected(ast.vertex("C"), ast.vertex("B"), ast.vertex("A"),
            ast.vertex("B"));
    assertThat(abc, is(cba));
    assertThat(abc.hashCode(), is(cba.hashCode()));
    assertThat(cba.members.size(), is(3));
    assertThat(cba.toString(), is("{C, B, A}"));

    // A connected group is never equal to a disconnected group.
    final Ast.Disconnected abc2 =
        ast.disconnected(ast.vertex("A"), ast.vertex("B"), ast.vertex("C"));
    assertThat(abc.equals(abc2), is(false));

    // Positions are ignored.
    final Ast.Exp parsed = Parsers.parseExpression("{B, A, C}");
    assertThat(parsed, is(abc));
  }

  @Test
  void testNestedGroupEquality() {
    final Ast.Exp e1 = Parsers.parseExpression("[{A, B}, {C, [D, E]}]");
    final Ast.Exp e2 = Parsers.parseExpression("[{[E, D], C}, {B, A}]");
    assertThat(e1, is(e2));
    assertThat(e1.hashCode(), is(e2.hashCode()));

    final Ast.Exp e3 = Parsers.parseExpression("[{A, B}, {C, {D, E}}]");
    assertThat(e1, not(e3));
  }

  @Test
  void testProgram() {
    final Ast.Program program =
        ast.program(Pos.ZERO,
            ImmutableList.of(
                ast.definition(Pos.ZERO, "G",
                    ast.disconnected(ast.vertex("A"), ast.vertex("B")))),
            ast.connected(ast.vertex("X"), ast.varRef("G")));
    assertThat(program.toString(), is("G = [A, B]; {X, G}"));
    assertThat(program, is(Parsers.parseProgram("G = [B, A]\n{G, X}")));
    assertThat(ast.program(ast.vertex("A")).toString(), is("A"));
  }

  @Test
  void testNodesAndEdges() {
    final Ast.Exp e = Parsers.parseExpression("{A, [{B, C}, D], E}");
    assertThat(e.nodes(), equalsOrdered("A", "B", "C", "D", "E"));
    assertThat(e.edges(),
        equalsOrdered(Edge.of("A", "B"), Edge.of("A", "C"), Edge.of("A", "D"),
            Edge.of("A", "E"), Edge.of("B", "C"), Edge.of("B", "E"),
            Edge.of("C", "E"), Edge.of("D", "E")));

    // A disconnected group adds no edges of its own.
    final Ast.Exp e2 = Parsers.parseExpression("[A, B, {C, D}]");
    assertThat(e2.edges(), equalsOrdered(Edge.of("C", "D")));

    // A vertex is not connected to itself.
    final Ast.Exp e3 = Parsers.parseExpression("{A, [A, B]}");
    assertThat(e3.nodes(), equalsOrdered("A", "B"));
    assertThat(e3.edges(), equalsOrdered(Edge.of("A", "B")));
  }

  @Test
  void testNodesOfReference() {
    final Ast.Exp e = ast.connected(ast.vertex("A"), ast.varRef("G"));
    final IllegalStateException x =
        assertThrows(IllegalStateException.class, e::nodes);
    assertThat(x.getMessage(), is("unresolved reference G"));
  }
}

// End AstTest.java
