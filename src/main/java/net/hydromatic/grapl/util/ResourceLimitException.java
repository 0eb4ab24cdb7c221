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
package net.hydromatic.grapl.util;

import static java.util.Objects.requireNonNull;

import net.hydromatic.grapl.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Thrown when an input exceeds one of the configured limits, such as the
 * maximum nesting depth or the maximum number of cliques a normal form may
 * have.
 *
 * @see net.hydromatic.grapl.compile.Prop#MAX_DEPTH
 * @see net.hydromatic.grapl.compile.Prop#MAX_CLIQUES
 * @see net.hydromatic.grapl.compile.Prop#MAX_NODES
 */
public class ResourceLimitException extends RuntimeException
    implements GraplException {
  private final String limitName;
  private final long limit;
  private final long value;
  private final Pos pos;

  public ResourceLimitException(
      String limitName, long limit, long value, Pos pos) {
    this(
        "resource limit exceeded: "
            + limitName
            + " is "
            + value
            + ", limit is "
            + limit,
        limitName,
        limit,
        value,
        pos,
        null);
  }

  /** Creates a ResourceLimitException with a given message and cause. */
  public ResourceLimitException(String message, String limitName, long limit,
      long value, Pos pos, @Nullable Throwable cause) {
    super(message, cause);
    this.limitName = requireNonNull(limitName);
    this.limit = limit;
    this.value = value;
    this.pos = requireNonNull(pos);
  }

  /** Returns the name of the limit, e.g. "maxDepth". */
  public String limitName() {
    return limitName;
  }

  /** Returns the value of the limit that was exceeded. */
  public long limit() {
    return limit;
  }

  /** Returns the value that exceeded the limit. */
  public long value() {
    return value;
  }

  @Override
  public Pos pos() {
    return pos;
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

// End ResourceLimitException.java
