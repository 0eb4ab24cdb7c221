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

/** Visits syntax trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  // atoms

  protected void visit(Ast.Vertex vertex) {}

  protected void visit(Ast.VarRef varRef) {}

  // groups

  protected void visit(Ast.Connected connected) {
    connected.members.forEach(this::accept);
  }

  protected void visit(Ast.Disconnected disconnected) {
    disconnected.members.forEach(this::accept);
  }

  // statements

  protected void visit(Ast.Definition definition) {
    definition.exp.accept(this);
  }

  protected void visit(Ast.Program program) {
    program.definitions.forEach(this::accept);
    program.target.accept(this);
  }
}

// End Visitor.java
