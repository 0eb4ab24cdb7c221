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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import net.hydromatic.grapl.compile.Compiles;
import org.junit.jupiter.api.Test;

/** Tests for {@link GraphWriter}. */
public class GraphWriterTest {
  @Test
  void testSerialize() {
    final NormalForm nf = Compiles.compile("{S, [A, B]}");
    assertThat(GraphWriter.serialize(nf), is("[{A, S}, {B, S}]"));

    // Output does not depend on the order of the input.
    for (String s
        : ImmutableList.of("{[B, A], S}", "[{S, B}, {A, S}]",
            "G = [A, B, A]; {G, S}")) {
      assertThat(s, GraphWriter.serialize(Compiles.compile(s)),
          is("[{A, S}, {B, S}]"));
    }
  }

  @Test
  void testEdgeList() {
    final NormalForm nf = Compiles.compile("[{A, [B, C]}, D, {C, E}]");
    assertThat(GraphWriter.edgeList(nf),
        is("A -- B\n"
            + "A -- C\n"
            + "C -- E\n"
            + "D\n"));
    assertThat(GraphWriter.edgeList(Compiles.compile("A")), is("A\n"));
  }

  @Test
  void testDot() {
    final NormalForm nf = Compiles.compile("[{A, B}, C]");
    assertThat(GraphWriter.dot(nf, "G"),
        is("graph G {\n"
            + "  A -- B;\n"
            + "  C;\n"
            + "}\n"));
  }

  @Test
  void testDotQuotesKeywords() {
    final NormalForm nf = Compiles.compile("{node, Edge, x}");
    assertThat(GraphWriter.dot(nf, "my graph"),
        is("graph \"my graph\" {\n"
            + "  \"Edge\" -- \"node\";\n"
            + "  \"Edge\" -- x;\n"
            + "  \"node\" -- x;\n"
            + "}\n"));
  }
}

// End GraphWriterTest.java
