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

import net.hydromatic.tensile.ast.Expr;
import net.hydromatic.tensile.sparse.SparsityEngine;

/** Computes the sparsity pattern of every node of a tree, children before
 * parents.
 *
 * <p>Running it twice gives the same patterns. */
public class SparsityPropagator {
  private final SparsityEngine engine;

  public SparsityPropagator(SparsityEngine engine) {
    this.engine = requireNonNull(engine, "engine");
  }

  /** Computes the patterns of a node and its descendants. */
  public void propagate(Expr.Node node) {
    for (Expr.Node child : node.children()) {
      propagate(child);
    }
    node.setPattern(node.computeSparsityPattern(engine));
  }
}

// End SparsityPropagator.java
