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

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.grapl.ast.Ast;
import net.hydromatic.grapl.compile.Compiles;
import net.hydromatic.grapl.compile.Normalizer;
import net.hydromatic.grapl.graph.NormalForm;
import net.hydromatic.grapl.parse.Parsers;
import net.hydromatic.grapl.util.Generation;
import net.hydromatic.grapl.util.GraplException;
import org.junit.jupiter.api.Test;

/** Runs the parser and compiler on random input. */
public class FuzzTest {
  /** Arbitrary bytes either parse or fail with a {@link GraplException}. */
  @Test
  void testRandomBytes() {
    final Generation generation = new Generation(1234L);
    for (int i = 0; i < 2_000; i++) {
      final byte[] bytes = generation.bytes(40);
      try {
        Parsers.parseProgram(bytes, ImmutableMap.of());
      } catch (RuntimeException e) {
        assertThat(e, instanceOf(GraplException.class));
      }
    }
  }

  /**
   * Normalizing a random expression either fails with a {@link
   * GraplException} or yields an expression in normal form with the same
   * nodes and edges.
   */
  @Test
  void testRandomExpressions() {
    final Generation generation = new Generation(5678L);
    for (int i = 0; i < 500; i++) {
      final String text = generation.exp(5, ImmutableList.of());
      final Ast.Exp exp = Parsers.parseExpression(text);
      final Ast.Exp normal;
      try {
        normal = Normalizer.normalize(exp);
      } catch (RuntimeException e) {
        assertThat(text, e, instanceOf(GraplException.class));
        continue;
      }
      assertThat(text, Normalizer.isNormal(normal), is(true));
      assertThat(text, normal.nodes(), is(exp.nodes()));
      assertThat(text, normal.edges(), is(exp.edges()));
      assertThat(text, Normalizer.normalize(normal), is(normal));

      final NormalForm normalForm = NormalForm.of(normal);
      assertThat(text, normalForm.nodes(), is(exp.nodes()));
      assertThat(text, normalForm.edges(), is(exp.edges()));
    }
  }

  /** Compiling a random program either succeeds or fails cleanly. */
  @Test
  void testRandomPrograms() {
    final Generation generation = new Generation(9012L);
    for (int i = 0; i < 300; i++) {
      final String text = generation.program(i % 5, 3);
      try {
        final NormalForm normalForm = Compiles.compile(text);
        assertThat(text, NormalForm.of(normalForm.toExp()), is(normalForm));
      } catch (RuntimeException e) {
        assertThat(text, e, instanceOf(GraplException.class));
      }
    }
  }
}

// End FuzzTest.java
