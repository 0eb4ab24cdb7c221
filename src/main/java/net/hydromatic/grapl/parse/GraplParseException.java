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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.grapl.ast.Pos;
import net.hydromatic.grapl.util.GraplException;

/**
 * Exception caused by a parse error.
 *
 * <p>Carries the position of the offending token and the tokens that would
 * have been valid there.
 */
public class GraplParseException extends RuntimeException
    implements GraplException {
  private final Pos pos;
  private final ImmutableList<String> expected;

  GraplParseException(
      String message, Pos pos, List<String> expected, Throwable cause) {
    super(message, cause);
    this.pos = requireNonNull(pos);
    this.expected = ImmutableList.copyOf(expected);
  }

  @Override
  public Pos pos() {
    return pos;
  }

  /**
   * Returns the tokens that would have been valid at the error position, for
   * example {@code ["<IDENTIFIER>", "\"[\"", "\"{\""]}; empty if not known.
   */
  public ImmutableList<String> expected() {
    return expected;
  }

  @Override
  public String toString() {
    return super.toString() + " at " + pos;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf).append(" Error: ").append(getMessage());
  }
}

// End GraplParseException.java
