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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.tensile.ast.Expr;
import net.hydromatic.tensile.memory.MemoryLayout;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Term that evaluates a node of the expression tree, reading its operands
 * from variables. */
public class Expression implements Term {
  public final Expr.Node node;
  public final @Nullable MemoryLayout memoryLayout;
  private final ImmutableList<Variable> variables;

  public Expression(Expr.Node node, @Nullable MemoryLayout memoryLayout,
      List<Variable> variables) {
    this.node = requireNonNull(node, "node");
    this.memoryLayout = memoryLayout;
    this.variables = ImmutableList.copyOf(variables);
  }

  /** Returns the variables holding the operands, in the order of the
   * node's children. */
  @Override
  public ImmutableList<Variable> variables() {
    return variables;
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder(node.op.opName).append('(');
    for (int i = 0; i < variables.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      b.append(variables.get(i));
    }
    return b.append(')').toString();
  }
}

// End Expression.java
