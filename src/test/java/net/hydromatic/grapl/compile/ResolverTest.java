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

import static net.hydromatic.grapl.Gr.gr;
import static net.hydromatic.grapl.Gr.grE;
import static net.hydromatic.grapl.Matchers.equalsOrdered;
import static net.hydromatic.grapl.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.grapl.ast.Ast;
import net.hydromatic.grapl.ast.Pos;
import net.hydromatic.grapl.parse.Parsers;
import org.junit.jupiter.api.Test;

/** Tests for {@link Resolver}. */
public class ResolverTest {
  private static Resolver resolver() {
    return new Resolver(ImmutableMap.of(), Tracers.empty());
  }

  @Test
  void testResolve() {
    gr("G1 = [A, B]\nG2 = {X, G1}\nG2").assertNormal("[{A, X}, {B, X}]");
    gr("G1 = [A, B]; G2 = {X, G1}; G1").assertNormal("[A, B]");
    gr("G = A\nA").assertNormal("A");
    gr("G1 = {A, [B, C]}\n[[{{D}}]]").assertNormal("D");
    gr("G1 = {A, [B, C]}; {G1, Z}")
        .assertNormal("[{A, B, Z}, {A, C, Z}]");

    // A definition may refer to a later definition.
    gr("G2 = {X, G1}; G1 = [A, B]; G2").assertNormal("[{A, X}, {B, X}]");

    // Substituting a disconnected definition into a clique distributes.
    gr("P = [A, B]; Q = [X, Y]; {P, Q}")
        .assertNormal("[{A, X}, {A, Y}, {B, X}, {B, Y}]");
  }

  @Test
  void testResolveExpression() {
    final Ast.Program program =
        Parsers.parseProgram("G1 = [A, B]; G2 = {X, G1}; G2");
    final Ast.Exp exp = resolver().resolve(program);
    assertThat(exp.toString(), is("[{X, A}, {X, B}]"));
  }

  /** A definition used several times is resolved once. */
  @Test
  void testResolveOnce() {
    final List<String> names = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnResolve(Tracers.empty(), (name, exp) -> names.add(name));
    gr("G = [A, B]; H = {G, X}; [{G, H}, G, {Y, G}]")
        .withTracer(tracer)
        .assertNormal("[A, {A, B, X}, {A, X}, {A, Y}, B, {B, X}, {B, Y}]");
    assertThat(names, equalsOrdered("G", "H"));
  }

  @Test
  void testResolveDefinitions() {
    final Ast.Program program =
        Parsers.parseProgram("G1 = [A, B]\nG2 = {X, G1}\nG3 = [[{{D}}]]\nG2");
    final ImmutableMap<String, Ast.Exp> map =
        resolver().resolveDefinitions(program);
    assertThat(map.keySet(), equalsOrdered("G1", "G2", "G3"));
    assertThat(map.get("G1").toString(), is("[A, B]"));
    assertThat(map.get("G2").toString(), is("[{X, A}, {X, B}]"));
    assertThat(map.get("G3").toString(), is("D"));

    final Resolver parallel =
        new Resolver(ImmutableMap.<Prop, Object>of(Prop.PARALLEL, true),
            Tracers.empty());
    assertThat(parallel.resolveDefinitions(program), is(map));

    assertThat(
        Compiles.compileDefinitions("G1 = [A, B]; G2 = {X, G1}; G2",
            ImmutableMap.of(), Tracers.empty()).toString(),
        is("{G1=[A, B], G2=[{A, X}, {B, X}]}"));
  }

  @Test
  void testCycle() {
    final Resolver.CyclicDefinitionException e =
        assertThrows(Resolver.CyclicDefinitionException.class,
            () ->
                resolver()
                    .resolve(
                        Parsers.parseProgram(
                            "G1 = {X, G2}\nG2 = {Y, G1}\nG1")));
    assertThat(e.chain(), equalsOrdered("G1", "G2"));
    assertThat(e.getMessage(), is("cyclic definition: G1 -> G2 -> G1"));

    // The chain starts at the first name in the cycle.
    final Resolver.CyclicDefinitionException e2 =
        assertThrows(Resolver.CyclicDefinitionException.class,
            () -> resolver()
                .resolve(
                    Parsers.parseProgram(
                        "G0 = {G1, W}; G1 = {X, G2}; G2 = {Y, G1}; G0")));
    assertThat(e2.chain(), equalsOrdered("G1", "G2"));

    // A cycle that the target does not use is reported only when resolving
    // every definition.
    gr("G1 = G2; G2 = G1; A").assertNormal("A");
    assertThrows(Resolver.CyclicDefinitionException.class,
        () -> resolver()
            .resolveDefinitions(Parsers.parseProgram("G1 = G2; G2 = G1; A")));
  }

  @Test
  void testSelfCycle() {
    grE("G = {$G$, X}\nG")
        .assertCompileThrows(Resolver.CyclicDefinitionException.class,
            "cyclic definition: G -> G");
  }

  @Test
  void testUndefined() {
    final Ast.Program program =
        ast.program(new Pos("", 1, 1, 1, 2), ImmutableList.of(),
            ast.connected(ast.vertex("A"),
                ast.varRef(new Pos("", 1, 5, 1, 7), "G9")));
    final Resolver.UndefinedVariableException e =
        assertThrows(Resolver.UndefinedVariableException.class,
            () -> resolver().resolve(program));
    assertThat(e.name(), is("G9"));
    assertThat(e.pos().toString(), is("1.5-1.7"));
    assertThat(e.getMessage(), is("undefined variable G9"));
  }

  @Test
  void testDuplicate() {
    grE("G1 = A\n$G1 = B$\nG2 = G1\nG2")
        .assertCompileThrows(Resolver.DuplicateDefinitionException.class,
            "duplicate definition of G1");
  }

  @Test
  void testShadowing() {
    gr("G1 = A\nG1 = B\nG2 = G1\nG2")
        .withProp(Prop.SHADOWING, true)
        .assertNormal("B");

    final Map<Prop, Object> propMap =
        ImmutableMap.<Prop, Object>of(Prop.SHADOWING, true);
    final Ast.Program program =
        Parsers.parseProgram("G1 = A\nG1 = B\nG2 = G1\nG2");
    final ImmutableMap<String, Ast.Exp> map =
        new Resolver(propMap, Tracers.empty()).resolveDefinitions(program);
    assertThat(map.keySet(), equalsOrdered("G1", "G2"));
    assertThat(map.get("G1").toString(), is("B"));
    assertThat(map.get("G2").toString(), is("B"));

    // A reference denotes the nearest preceding definition.
    gr("G = A; H = {G, X}; G = B; H")
        .withProp(Prop.SHADOWING, true)
        .assertNormal("{A, X}");
    gr("G = A; H = {G, X}; G = B; [H, G]")
        .withProp(Prop.SHADOWING, true)
        .assertNormal("[{A, X}, B]");

    // A redefinition may refer to the previous definition.
    gr("G = A; G = {G, B}; G")
        .withProp(Prop.SHADOWING, true)
        .assertNormal("{A, B}");
    gr("G = [A, B]; G = {G, X}; G = [G, Y]; G")
        .withProp(Prop.SHADOWING, true)
        .assertNormal("[{A, X}, {B, X}, Y]");

    // A reference with no preceding definition denotes the last one.
    gr("H = {G, X}; G = A; G = B; H")
        .withProp(Prop.SHADOWING, true)
        .assertNormal("{B, X}");

    // Shadowing does not permit a cycle.
    gr("G1 = G2\nG2 = G1\nG1")
        .withProp(Prop.SHADOWING, true)
        .assertCompileThrows(Resolver.CyclicDefinitionException.class,
            "cyclic definition: G1 -> G2 -> G1");
  }
}

// End ResolverTest.java
