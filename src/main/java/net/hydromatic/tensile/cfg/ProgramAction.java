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
package net.hydromatic.tensile.cfg;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import net.hydromatic.tensile.ast.Scalar;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Step of a kernel: {@code result = term}, or {@code result += term} if
 * {@link #add} is set, with the term optionally multiplied by a scalar.
 */
public class ProgramAction {
  public final Variable result;
  public final Term term;
  public final boolean add;
  /** Scalar factor: a {@link Double}, a {@link Scalar}, or null. */
  public final @Nullable Object scalar;

  public ProgramAction(Variable result, Term term, boolean add,
      @Nullable Object scalar) {
    this.result = requireNonNull(result, "result");
    this.term = requireNonNull(term, "term");
    this.add = add;
    this.scalar = scalar;
    checkArgument(scalar == null || scalar instanceof Double
        || scalar instanceof Scalar, "invalid scalar %s", scalar);
  }

  public ProgramAction(Variable result, Term term, boolean add) {
    this(result, term, add, null);
  }

  /** Returns whether the term is an expression, as opposed to a copy of a
   * variable. */
  public boolean isRhsExpression() {
    return term instanceof Expression;
  }

  public boolean isRhsVariable() {
    return term instanceof Variable;
  }

  /** Returns the variables that this action reads. */
  public ImmutableList<Variable> variables() {
    return ImmutableList.copyOf(term.variables());
  }

  @Override
  public String toString() {
    return result + (add ? " += " : " = ")
        + (scalar == null ? "" : scalar + " * ") + term;
  }
}

// End ProgramAction.java
