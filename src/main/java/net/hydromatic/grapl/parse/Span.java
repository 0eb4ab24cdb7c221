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
package net.hydromatic.grapl.parse;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.grapl.ast.AstNode;
import net.hydromatic.grapl.ast.Pos;

/**
 * Builder for {@link Pos}.
 *
 * <p>Because it is mutable, it is convenient for keeping track of the positions
 * of the tokens that go into a non-terminal. Some patterns:
 *
 * <ul>
 *   <li>{@code final Span s;} declaration of a Span at the top of a production
 *   <li>{@code s = span();} initializes s to a Span that includes the token we
 *       just saw; very often occurs immediately after the first token in the
 *       production
 *   <li>{@code s.end(this);} adds the most recent token to span s and evaluates
 *       to a Position that spans from beginning to end
 *   <li>{@code s.end(node);} adds a node's position and evaluates to a
 *       Position that spans from beginning to end
 * </ul>
 */
public final class Span {
  private final List<Pos> posList = new ArrayList<>();

  /** Use one of the {@link #of} methods. */
  private Span() {}

  /** Creates a Span with one position. */
  public static Span of(Pos p) {
    return new Span().add(p);
  }

  /** Adds a node's position to the list, and returns this Span. */
  public Span add(AstNode n) {
    return add(n.pos);
  }

  /** Adds a position to the list, and returns this Span. */
  public Span add(Pos pos) {
    posList.add(pos);
    return this;
  }

  /**
   * Adds the position of the last token emitted by a parser to the list, and
   * returns this Span.
   */
  public Span add(GraplParser parser) {
    return add(parser.pos());
  }

  /**
   * Returns a position spanning the earliest position to the latest. Does not
   * assume that the positions are sorted. Throws if the list is empty.
   */
  public Pos pos() {
    switch (posList.size()) {
      case 0:
        throw new AssertionError();
      case 1:
        return posList.get(0);
      default:
        return Pos.sum(posList);
    }
  }

  /**
   * Adds the position of the last token emitted by a parser to the list, and
   * returns a position that covers the whole range.
   */
  public Pos end(GraplParser parser) {
    return add(parser).pos();
  }

  /**
   * Adds a node's position to the list, and returns a position that covers the
   * whole range.
   */
  public Pos end(AstNode n) {
    return add(n).pos();
  }
}

// End Span.java
