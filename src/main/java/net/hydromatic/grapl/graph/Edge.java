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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ComparisonChain;

/**
 * Undirected edge between two distinct vertices.
 *
 * <p>The vertex names are stored in sorted order, so that {@code Edge.of("B",
 * "A")} equals {@code Edge.of("A", "B")}.
 */
public final class Edge implements Comparable<Edge> {
  public final String left;
  public final String right;

  private Edge(String left, String right) {
    this.left = requireNonNull(left);
    this.right = requireNonNull(right);
  }

  /** Creates an edge. Throws if the two names are the same. */
  public static Edge of(String a, String b) {
    final int c = a.compareTo(b);
    checkArgument(c != 0, "self-loop on %s", a);
    return c < 0 ? new Edge(a, b) : new Edge(b, a);
  }

  @Override
  public int compareTo(Edge o) {
    return ComparisonChain.start()
        .compare(left, o.left)
        .compare(right, o.right)
        .result();
  }

  @Override
  public int hashCode() {
    return left.hashCode() * 31 + right.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Edge
            && left.equals(((Edge) o).left)
            && right.equals(((Edge) o).right);
  }

  @Override
  public String toString() {
    return left + " -- " + right;
  }
}

// End Edge.java
