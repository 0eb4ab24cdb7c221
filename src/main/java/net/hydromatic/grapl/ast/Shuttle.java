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

import java.util.ArrayList;
import java.util.List;

/**
 * Visits and transforms syntax trees.
 *
 * <p>The default implementation returns each node unchanged if none of its
 * children changed, otherwise a copy with the new children.
 */
public class Shuttle {
  protected <E extends AstNode> List<E> visitList(Iterable<E> nodes) {
    final List<E> list = new ArrayList<>();
    for (E node : nodes) {
      //noinspection unchecked
      list.add((E) node.accept(this));
    }
    return list;
  }

  // atoms

  protected Ast.Exp visit(Ast.Vertex vertex) {
    return vertex; // leaf
  }

  protected Ast.Exp visit(Ast.VarRef varRef) {
    return varRef; // leaf
  }

  // groups

  protected Ast.Exp visit(Ast.Connected connected) {
    return connected.copy(visitList(connected.members));
  }

  protected Ast.Exp visit(Ast.Disconnected disconnected) {
    return disconnected.copy(visitList(disconnected.members));
  }

  // statements

  protected Ast.Definition visit(Ast.Definition definition) {
    return definition.copy(definition.exp.accept(this));
  }

  protected Ast.Program visit(Ast.Program program) {
    return program.copy(
        visitList(program.definitions), program.target.accept(this));
  }
}

// End Shuttle.java
