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

import net.hydromatic.grapl.ast.Ast;
import net.hydromatic.grapl.ast.Pos;

/**
 * Parser for the Grapl language.
 *
 * <p>The implementation, {@code GraplParserImpl}, is generated by JavaCC
 * from {@code GraplParser.jj}.
 */
public interface GraplParser {
  /** Returns the position of the last token returned by the parser. */
  Pos pos();

  /** Sets the file name that will be used in positions. */
  void zero(String file);

  /**
   * Sets the maximum nesting depth of groups; deeper input fails with a
   * {@link net.hydromatic.grapl.util.ResourceLimitException}.
   */
  void setMaxDepth(int maxDepth);

  /** Parses an expression followed by end-of-file. */
  Ast.Exp expressionEof() throws ParseException;

  /**
   * Parses a program, zero or more definitions then an expression, followed
   * by end-of-file.
   */
  Ast.Program programEof() throws ParseException;
}

// End GraplParser.java
