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

import com.google.common.collect.ImmutableSet;
import java.util.Locale;

/**
 * Writes a {@link NormalForm} as text.
 *
 * <p>All output is deterministic: two equal normal forms produce identical
 * text, however the expressions they came from were ordered.
 */
public abstract class GraphWriter {
  /** Words that Graphviz treats as keywords, in any case. */
  private static final ImmutableSet<String> DOT_KEYWORDS =
      ImmutableSet.of("node", "edge", "graph", "digraph", "subgraph", "strict");

  private GraphWriter() {}

  /** Returns the canonical text of a graph, e.g. "[{A, B}, {A, C}, D]". */
  public static String serialize(NormalForm normalForm) {
    return normalForm.toString();
  }

  /**
   * Returns a graph as an edge list: one line "A -- B" per edge, followed by
   * one line per isolated vertex.
   */
  public static String edgeList(NormalForm normalForm) {
    final StringBuilder b = new StringBuilder();
    for (Edge edge : normalForm.edges()) {
      b.append(edge).append('\n');
    }
    for (String node : normalForm.isolatedNodes()) {
      b.append(node).append('\n');
    }
    return b.toString();
  }

  /**
   * Returns a graph in the Graphviz DOT language, suitable for rendering
   * with {@code dot -Tpng}.
   */
  public static String dot(NormalForm normalForm, String name) {
    final StringBuilder b = new StringBuilder();
    b.append("graph ");
    appendDotId(b, name).append(" {\n");
    for (Edge edge : normalForm.edges()) {
      b.append("  ");
      appendDotId(b, edge.left).append(" -- ");
      appendDotId(b, edge.right).append(";\n");
    }
    for (String node : normalForm.isolatedNodes()) {
      b.append("  ");
      appendDotId(b, node).append(";\n");
    }
    return b.append("}\n").toString();
  }

  /**
   * Appends an identifier, quoting it if it is a DOT keyword or is not a
   * plain identifier.
   */
  private static StringBuilder appendDotId(StringBuilder b, String id) {
    if (DOT_KEYWORDS.contains(id.toLowerCase(Locale.ROOT))
        || !ast.isIdentifier(id)) {
      return b.append('"').append(id.replace("\"", "\\\"")).append('"');
    }
    return b.append(id);
  }
}

// End GraphWriter.java
