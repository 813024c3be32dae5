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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.tensile.compile.CompileException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds expression nodes.
 *
 * <p>Composition applies algebraic folding: products and sums are kept
 * flat (n-ary), scalar multiplications are hoisted to the top of a
 * product, and an assignment from a bare tensor is wrapped in an
 * {@link Expr.Einsum}. Folding never modifies an operand; it returns new
 * nodes.
 */
public enum ExprBuilder {
  /** The singleton instance of the expression builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  expr;

  /** Creates a tensor with indices, such as {@code A[ij]}. */
  public Expr.IndexedTensor indexed(Tensor tensor, String indexNames) {
    return new Expr.IndexedTensor(tensor, tensor.indices(indexNames));
  }

  /** Multiplies two expressions.
   *
   * <p>If either operand is a scalar multiplication, the result is a
   * scalar multiplication of the product of the terms. Otherwise the
   * operands are folded into an {@link Expr.Einsum}.
   *
   * @throws CompileException if both are scalar multiplications */
  public Expr.Node times(Expr.Node a, Expr.Node b) {
    if (a instanceof Expr.ScalarMultiplication) {
      checkNotScalarMultiplication(b);
      final Expr.ScalarMultiplication s = (Expr.ScalarMultiplication) a;
      return s.withTerm(times(s.term(), b));
    } else if (b instanceof Expr.ScalarMultiplication) {
      checkNotScalarMultiplication(a);
      final Expr.ScalarMultiplication s = (Expr.ScalarMultiplication) b;
      return s.withTerm(times(a, s.term()));
    }
    return fold(a, b, Op.EINSUM);
  }

  /** Multiplies an expression by a constant.
   *
   * @throws CompileException if the expression is already a scalar
   * multiplication */
  public Expr.ScalarMultiplication times(double scalar, Expr.Node a) {
    checkNotScalarMultiplication(a);
    return new Expr.ScalarMultiplication(scalar, a);
  }

  /** Multiplies an expression by a constant. */
  public Expr.ScalarMultiplication times(Expr.Node a, double scalar) {
    return times(scalar, a);
  }

  /** Multiplies an expression by a scalar whose value is known when the
   * kernel runs. */
  public Expr.ScalarMultiplication times(Scalar scalar, Expr.Node a) {
    checkNotScalarMultiplication(a);
    return new Expr.ScalarMultiplication(requireNonNull(scalar), a);
  }

  /** Adds two expressions, folding them into an {@link Expr.Add}. */
  public Expr.Node plus(Expr.Node a, Expr.@Nullable Node b) {
    if (b == null) {
      throw new CompileException(CompileException.Kind.INVALID_COMPOSITION,
          "Unsupported operation: Cannot add null to " + a);
    }
    return fold(a, b, Op.ADD);
  }

  /** Subtracts one expression from another; equivalent to adding its
   * negation. */
  public Expr.Node minus(Expr.Node a, Expr.Node b) {
    return plus(a, negate(b));
  }

  /** Negates an expression; equivalent to multiplying by -1. */
  public Expr.ScalarMultiplication negate(Expr.Node a) {
    return times(-1d, a);
  }

  /** Assigns a value to a tensor.
   *
   * <p>If the value is a different bare tensor, the assignment is a copy or
   * rename, and the value is wrapped in an {@link Expr.Einsum} so that the
   * right side is always a computation.
   *
   * @throws CompileException if the target is not a tensor or there is no
   * value */
  public Expr.Assign assign(Expr.Node target,
      Expr.@Nullable Node value) {
    if (value == null) {
      throw new CompileException(CompileException.Kind.INVALID_COMPOSITION,
          "Unsupported operation: Cannot assign null to " + target);
    }
    if (value instanceof Expr.Assign) {
      throw new CompileException(CompileException.Kind.INVALID_COMPOSITION,
          "Assignments cannot be nested: " + value);
    }
    if (value instanceof Expr.IndexedTensor && value != target) {
      return new Expr.Assign(target, einsum(ImmutableList.of(value)));
    }
    return new Expr.Assign(target, value);
  }

  /** Creates an {@link Expr.Einsum}. */
  public Expr.Einsum einsum(List<? extends Expr.Node> operands) {
    return new Expr.Einsum(operands);
  }

  /** Creates an {@link Expr.Add}. */
  public Expr.Add add(List<? extends Expr.Node> operands) {
    return new Expr.Add(operands);
  }

  /** Creates an {@link Expr.IndexSum}. */
  public Expr.IndexSum indexSum(Expr.Node term, char sumIndex) {
    return new Expr.IndexSum(term, Index.of(sumIndex));
  }

  /** Creates an {@link Expr.IndexSum}. */
  public Expr.IndexSum indexSum(Expr.Node term, Index sumIndex) {
    return new Expr.IndexSum(term, sumIndex);
  }

  /** Creates an {@link Expr.Product}.
   *
   * @throws CompileException if a shared index has different extents in
   * the operands */
  public Expr.Product product(Expr.Node left, Expr.Node right) {
    return new Expr.Product(left, right);
  }

  /** Creates an {@link Expr.Contraction} with free indices in a given
   * order. */
  public Expr.Contraction contraction(Indices indices, Expr.Node left,
      Expr.Node right, Indices sumIndices) {
    return new Expr.Contraction(indices, left, right, sumIndices);
  }

  /** Creates an {@link Expr.LoopOverGEMM}. */
  public Expr.LoopOverGEMM loopOverGemm(Indices indices, Expr.Node a,
      Expr.Node b, Indices m, Indices n, Indices k) {
    return new Expr.LoopOverGEMM(indices, a, b, m, n, k);
  }

  /** Combines two expressions under an associative n-ary operator.
   *
   * <p>If the left operand is already of that kind, the right operand (or
   * its operands, if it is of that kind too) are appended to its operands;
   * else if the right operand is of that kind, the left operand is
   * prepended to its operands; otherwise the result is a new node with two
   * operands. */
  private Expr.Node fold(Expr.Node a, Expr.Node b, Op op) {
    final ImmutableList.Builder<Expr.Node> operands = ImmutableList.builder();
    if (a.op == op) {
      operands.addAll(a.children());
      if (b.op == op) {
        operands.addAll(b.children());
      } else {
        operands.add(b);
      }
    } else if (b.op == op) {
      operands.add(a);
      operands.addAll(b.children());
    } else {
      operands.add(a, b);
    }
    switch (op) {
    case EINSUM:
      return einsum(operands.build());
    case ADD:
      return add(operands.build());
    default:
      throw new AssertionError("unexpected " + op);
    }
  }

  private static void checkNotScalarMultiplication(Expr.Node node) {
    if (node instanceof Expr.ScalarMultiplication) {
      throw new CompileException(CompileException.Kind.INVALID_COMPOSITION,
          "Multiple multiplications with scalars are not allowed. "
              + "Merge them into a single one.");
    }
  }
}

// End ExprBuilder.java
