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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.tensile.ast.Expr;
import net.hydromatic.tensile.cfg.ProgramPoint;

/** Result of compiling a list of statements: the finished trees and the
 * control flow that evaluates them. */
public class Kernel {
  public final String name;
  public final ImmutableList<Expr.Assign> trees;
  public final ImmutableList<ProgramPoint> cfg;

  Kernel(String name, List<Expr.Assign> trees, List<ProgramPoint> cfg) {
    this.name = requireNonNull(name, "name");
    this.trees = ImmutableList.copyOf(trees);
    this.cfg = ImmutableList.copyOf(cfg);
  }

  /** Returns the number of floating-point operations on non-zero
   * entries. */
  public long nonZeroFlops() {
    long flops = 0;
    for (Expr.Assign tree : trees) {
      flops += Expr.nonZeroFlops(tree);
    }
    return flops;
  }

  /** Returns the number of floating-point operations that the primitives
   * perform, counting the zeros that dense primitives multiply. */
  public long hardwareFlops() {
    long flops = 0;
    for (Expr.Assign tree : trees) {
      flops += Expr.hardwareFlops(tree);
    }
    return flops;
  }

  @Override
  public String toString() {
    return name;
  }
}

// End Kernel.java
