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
package net.hydromatic.tensile.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Visits an expression tree bottom-up and builds a new tree.
 *
 * <p>By default each method rewrites the children of a node and returns
 * the node itself if none of them changed, or a copy with the new
 * children. Sub-classes override the methods for the kinds of node that
 * they rewrite.
 */
public class ExprShuttle implements ExprVisitor<Expr.Node> {
  /** Rewrites a tree. */
  public Expr.Node apply(Expr.Node node) {
    return node.accept(this);
  }

  /** Rewrites each child of a node. */
  protected List<Expr.Node> visitChildren(Expr.Node node) {
    final ImmutableList.Builder<Expr.Node> b = ImmutableList.builder();
    for (Expr.Node child : node.children()) {
      b.add(child.accept(this));
    }
    return b.build();
  }

  /** Creates a copy of a node with new children. Sub-classes may override
   * to compute annotations of the copy. */
  protected Expr.Node copy(Expr.Node node, List<Expr.Node> children) {
    return node.copy(children);
  }

  @Override
  public Expr.Node visit(Expr.IndexedTensor indexedTensor) {
    return indexedTensor;
  }

  @Override
  public Expr.Node visit(Expr.Einsum einsum) {
    return copy(einsum, visitChildren(einsum));
  }

  @Override
  public Expr.Node visit(Expr.Add add) {
    return copy(add, visitChildren(add));
  }

  @Override
  public Expr.Node visit(Expr.ScalarMultiplication scalarMultiplication) {
    return copy(scalarMultiplication, visitChildren(scalarMultiplication));
  }

  @Override
  public Expr.Node visit(Expr.IndexSum indexSum) {
    return copy(indexSum, visitChildren(indexSum));
  }

  @Override
  public Expr.Node visit(Expr.Product product) {
    return copy(product, visitChildren(product));
  }

  @Override
  public Expr.Node visit(Expr.Contraction contraction) {
    return copy(contraction, visitChildren(contraction));
  }

  @Override
  public Expr.Node visit(Expr.LoopOverGEMM loopOverGemm) {
    return copy(loopOverGemm, visitChildren(loopOverGemm));
  }

  @Override
  public Expr.Node visit(Expr.Assign assign) {
    return copy(assign, visitChildren(assign));
  }
}

// End ExprShuttle.java
