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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.regex.Pattern;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Pattern for a valid identifier; same as the parser's IDENTIFIER token. */
  private static final Pattern IDENTIFIER =
      Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  /** Returns whether a string is a valid identifier. */
  public boolean isIdentifier(String name) {
    return IDENTIFIER.matcher(name).matches();
  }

  private String checkIdentifier(String name) {
    checkArgument(isIdentifier(name), "invalid identifier '%s'", name);
    return name;
  }

  /** Creates a vertex. */
  public Ast.Vertex vertex(Pos pos, String name) {
    return new Ast.Vertex(pos, checkIdentifier(name));
  }

  /** Creates a vertex with no position. */
  public Ast.Vertex vertex(String name) {
    return vertex(Pos.ZERO, name);
  }

  /** Creates a reference to a definition. */
  public Ast.VarRef varRef(Pos pos, String name) {
    return new Ast.VarRef(pos, checkIdentifier(name));
  }

  /** Creates a reference to a definition with no position. */
  public Ast.VarRef varRef(String name) {
    return varRef(Pos.ZERO, name);
  }

  /**
   * Creates a group of a given operator. Duplicate members are removed;
   * throws if there are no members.
   */
  public Ast.Group group(Op op, Pos pos, Iterable<? extends Ast.Exp> members) {
    checkArgument(op.isGroup(), "not a group: %s", op);
    final ImmutableSet<Ast.Exp> set = ImmutableSet.copyOf(members);
    checkArgument(!set.isEmpty(), "%s group must have at least one member", op);
    switch (op) {
      case CONNECTED:
        return new Ast.Connected(pos, set);
      case DISCONNECTED:
        return new Ast.Disconnected(pos, set);
      default:
        throw new AssertionError(op);
    }
  }

  /** Creates a fully connected group. */
  public Ast.Connected connected(Pos pos, Iterable<? extends Ast.Exp> members) {
    return (Ast.Connected) group(Op.CONNECTED, pos, members);
  }

  /** Creates a fully connected group with no position. */
  public Ast.Connected connected(Ast.Exp... members) {
    return connected(Pos.ZERO, ImmutableList.copyOf(members));
  }

  /** Creates a fully disconnected group. */
  public Ast.Disconnected disconnected(
      Pos pos, Iterable<? extends Ast.Exp> members) {
    return (Ast.Disconnected) group(Op.DISCONNECTED, pos, members);
  }

  /** Creates a fully disconnected group with no position. */
  public Ast.Disconnected disconnected(Ast.Exp... members) {
    return disconnected(Pos.ZERO, ImmutableList.copyOf(members));
  }

  /** Creates a definition, "name = exp". */
  public Ast.Definition definition(Pos pos, String name, Ast.Exp exp) {
    return new Ast.Definition(pos, checkIdentifier(name), exp);
  }

  /** Creates a program. */
  public Ast.Program program(
      Pos pos, List<Ast.Definition> definitions, Ast.Exp target) {
    return new Ast.Program(pos, ImmutableList.copyOf(definitions), target);
  }

  /** Creates a program that has no definitions. */
  public Ast.Program program(Ast.Exp target) {
    return program(target.pos, ImmutableList.of(), target);
  }
}

// End AstBuilder.java
