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

import net.hydromatic.grapl.ast.Pos;

/**
 * Interface implemented by every error that Grapl reports to its caller.
 *
 * <p>Errors are unchecked exceptions; each knows where in the source text it
 * occurred (or {@link Pos#ZERO} if the tree was built programmatically).
 */
public interface GraplException {
  /** Returns the position of the fault. */
  Pos pos();

  /** Writes a description of this error, including its position. */
  StringBuilder describeTo(StringBuilder buf);

  /** Returns this error as a {@link RuntimeException}, for rethrowing. */
  default RuntimeException toRuntimeException() {
    return (RuntimeException) this;
  }
}

// End GraplException.java
