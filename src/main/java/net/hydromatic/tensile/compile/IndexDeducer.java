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

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.tensile.ast.Expr;
import net.hydromatic.tensile.ast.ExprVisitor;
import net.hydromatic.tensile.ast.Index;
import net.hydromatic.tensile.ast.Indices;

/**
 * Deduces the free indices of the operation nodes of a statement.
 *
 * <p>Nodes below the right side of an assignment are deduced bottom-up: an
 * {@link Expr.Einsum} keeps the indices that occur in exactly one operand
 * (the summation convention), an {@link Expr.Add} takes the indices of its
 * first operand, and a {@link Expr.ScalarMultiplication} those of its term.
 * The right side itself takes the indices of the assignment's target.
 */
public class IndexDeducer implements ExprVisitor<Indices> {
  private IndexDeducer() {}

  /** Deduces the indices of every node of a statement.
   *
   * @throws CompileException if the indices of the value cannot be made to
   * match those of the target */
  public static void deduce(Expr.Assign assign) {
    final IndexDeducer deducer = new IndexDeducer();
    deducer.deduceRoot(assign.value(), assign.target().requireIndices());
  }

  /** Deduces the indices of a node whose indices must be {@code target}. */
  private void deduceRoot(Expr.Node node, Indices target) {
    switch (node.op) {
    case EINSUM:
      final Expr.Einsum einsum = (Expr.Einsum) node;
      Indices union = Indices.EMPTY;
      for (Expr.Node child : einsum.children()) {
        union = union.merge(child.accept(this));
      }
      final Indices missing = target.minus(union);
      if (!missing.isEmpty()) {
        throw new CompileException(CompileException.Kind.INDEX_MISMATCH,
            "indices [" + missing + "] of target [" + target
                + "] do not occur in " + einsum.children());
      }
      if (!union.subShape(target).equals(target.shape())) {
        throw new CompileException(CompileException.Kind.INDEX_MISMATCH,
            "target [" + target + "] has shape " + target.shape()
                + " but operands give " + union.subShape(target));
      }
      einsum.setIndices(target);
      return;

    case ADD:
      final Expr.Add add = (Expr.Add) node;
      for (Expr.Node child : add.children()) {
        deduceRoot(child, target);
      }
      add.setIndices(target);
      return;

    case SCALAR_MULTIPLICATION:
      final Expr.ScalarMultiplication s = (Expr.ScalarMultiplication) node;
      deduceRoot(s.term(), target);
      s.setIndices(target);
      return;

    default:
      node.accept(this);
      conform(node, target);
    }
  }

  /** Permutes the indices of a node, whose indices are known, to a given
   * order. */
  static void conform(Expr.Node node, Indices order) {
    final Indices indices = node.requireIndices();
    if (indices.equals(order)) {
      return;
    }
    if (!indices.sameSet(order) || node.fixedIndexPermutation()) {
      throw new CompileException(CompileException.Kind.INDEX_MISMATCH,
          "cannot use " + node + " where indices [" + order
              + "] are required");
    }
    switch (node.op) {
    case ADD:
      for (Expr.Node child : node.children()) {
        conform(child, order);
      }
      break;
    case SCALAR_MULTIPLICATION:
      conform(((Expr.ScalarMultiplication) node).term(), order);
      break;
    default:
      break;
    }
    ((Expr.Operation) node).setIndices(order);
  }

  @Override
  public Indices visit(Expr.IndexedTensor indexedTensor) {
    return indexedTensor.requireIndices();
  }

  @Override
  public Indices visit(Expr.Einsum einsum) {
    final Multiset<Index> occurrences = HashMultiset.create();
    Indices union = Indices.EMPTY;
    for (Expr.Node child : einsum.children()) {
      final Indices indices = child.accept(this);
      occurrences.addAll(indices.asSet());
      union = union.merge(indices);
    }
    if (einsum.indices() == null) {
      final List<Index> repeated = new ArrayList<>();
      for (Multiset.Entry<Index> entry : occurrences.entrySet()) {
        if (entry.getCount() > 1) {
          repeated.add(entry.getElement());
        }
      }
      einsum.setIndices(union.minus(repeated));
    }
    return einsum.requireIndices();
  }

  @Override
  public Indices visit(Expr.Add add) {
    final Indices first = add.child(0).accept(this);
    for (Expr.Node child : add.children().subList(1, add.children().size())) {
      final Indices indices = child.accept(this);
      if (!indices.sameSet(first)) {
        throw new CompileException(CompileException.Kind.INDEX_MISMATCH,
            "operands of sum have different indices: [" + first + "] and ["
                + indices + "]");
      }
      conform(child, first);
    }
    add.setIndices(first);
    return first;
  }

  @Override
  public Indices visit(Expr.ScalarMultiplication scalarMultiplication) {
    final Indices indices = scalarMultiplication.term().accept(this);
    if (scalarMultiplication.indices() == null) {
      scalarMultiplication.setIndices(indices);
    }
    return scalarMultiplication.requireIndices();
  }

  @Override
  public Indices visit(Expr.IndexSum indexSum) {
    indexSum.term().accept(this);
    return indexSum.requireIndices();
  }

  @Override
  public Indices visit(Expr.Product product) {
    return visitBinary(product);
  }

  @Override
  public Indices visit(Expr.Contraction contraction) {
    return visitBinary(contraction);
  }

  @Override
  public Indices visit(Expr.LoopOverGEMM loopOverGemm) {
    return visitBinary(loopOverGemm);
  }

  private Indices visitBinary(Expr.BinOp binOp) {
    binOp.leftTerm().accept(this);
    binOp.rightTerm().accept(this);
    return binOp.requireIndices();
  }

  @Override
  public Indices visit(Expr.Assign assign) {
    throw new IllegalStateException("nested assignment " + assign);
  }
}

// End IndexDeducer.java
