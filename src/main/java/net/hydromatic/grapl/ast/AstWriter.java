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

/** Context for writing an AST out as a string. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an identifier. */
  public AstWriter id(String name) {
    b.append(name);
    return this;
  }

  /**
   * Appends a list of nodes, with an opening string, separator and closing
   * string; for example "{A, B}".
   */
  public AstWriter list(String open, Iterable<? extends AstNode> nodes,
      String sep, String close) {
    append(open);
    String s = "";
    for (AstNode node : nodes) {
      append(s);
      node.unparse(this);
      s = sep;
    }
    return append(close);
  }

  /** Appends a binary construct, such as "G = {A, B}". */
  public AstWriter binary(String a0, String mid, AstNode a1) {
    id(a0).append(mid);
    return a1.unparse(this);
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
