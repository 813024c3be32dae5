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
package net.hydromatic.tensile.compile;

import static java.util.Objects.requireNonNull;

/**
 * An error occurred while composing or compiling a kernel.
 *
 * <p>All errors abort compilation of the current kernel; the caller must
 * correct the expression and compile again.
 */
public class CompileException extends RuntimeException {
  private final Kind kind;

  public CompileException(Kind kind, String message) {
    super(message);
    this.kind = requireNonNull(kind, "kind");
  }

  /** Returns the category of this error. */
  public Kind kind() {
    return kind;
  }

  @Override
  public String toString() {
    return super.toString() + " (" + kind + ")";
  }

  /** Category of compilation error. */
  public enum Kind {
    /** Operands cannot be combined into a valid expression, for example
     * nested scalar multiplications or an assignment to a non-tensor. */
    INVALID_COMPOSITION,

    /** Index sets of operands or of an operand and its target do not
     * agree. */
    INDEX_MISMATCH,

    /** Grouped and ungrouped tensors with the same base name appear in one
     * kernel. */
    GROUPING_CONFLICT
  }
}

// End CompileException.java
