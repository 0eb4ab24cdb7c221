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

import static java.util.Objects.requireNonNull;

/**
 * Abstract syntax tree node.
 *
 * <p>Nodes are immutable. Equality is structural and ignores {@link #pos}.
 */
public abstract class AstNode {
  public final Pos pos;
  public final Op op;

  AstNode(Pos pos, Op op) {
    this.pos = requireNonNull(pos);
    this.op = requireNonNull(op);
  }

  /**
   * Converts this node into a Grapl string.
   *
   * <p>The string can be parsed back into an equal node. Members of a group
   * are written in the order they were added, which is not necessarily
   * sorted; use {@link net.hydromatic.grapl.graph.NormalForm} for a
   * deterministic representation.
   */
  @Override
  public final String toString() {
    // Marked final because you should override unparse, not toString
    return unparse(new AstWriter()).toString();
  }

  abstract AstWriter unparse(AstWriter w);

  /**
   * Accepts a shuttle, calling the {@link Shuttle#visit} method appropriate
   * to the type of this node, and returning the result.
   */
  public abstract AstNode accept(Shuttle shuttle);

  /**
   * Accepts a visitor, calling the {@link Visitor#visit} method appropriate
   * to the type of this node.
   */
  public abstract void accept(Visitor visitor);
}

// End AstNode.java
