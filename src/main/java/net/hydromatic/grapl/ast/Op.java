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

/** Sub-types of {@link AstNode}. */
public enum Op {
  // atoms
  VERTEX,
  VAR_REF,

  // groups
  /** Clique: every member is connected to every other member. */
  CONNECTED("{", "}"),
  /** Disjoint union: no edges between members. */
  DISCONNECTED("[", "]"),

  // statements
  DEFINITION(" = "),
  PROGRAM("; ");

  /** Opening string, e.g. "{" for {@link #CONNECTED}; or the separator. */
  public final String open;
  /** Closing string, e.g. "}" for {@link #CONNECTED}; may be empty. */
  public final String close;

  Op() {
    this("", "");
  }

  Op(String separator) {
    this(separator, "");
  }

  Op(String open, String close) {
    this.open = open;
    this.close = close;
  }

  /** Returns whether this operator has a set of members. */
  public boolean isGroup() {
    return this == CONNECTED || this == DISCONNECTED;
  }

  /** Returns whether this operator is a leaf of an expression. */
  public boolean isAtom() {
    return this == VERTEX || this == VAR_REF;
  }
}

// End Op.java
