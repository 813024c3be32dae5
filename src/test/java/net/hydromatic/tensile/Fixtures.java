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
package net.hydromatic.tensile;

import static net.hydromatic.tensile.ast.ExprBuilder.expr;

import net.hydromatic.tensile.ast.Expr;
import net.hydromatic.tensile.ast.Tensor;

/** Tensors and statements shared by tests.
 *
 * <p>Extents are distinct, so that a mix-up of indices shows up as a
 * shape error: i has extent 3, j 5, k 4, l 2. */
public abstract class Fixtures {
  public static final Tensor A = Tensor.of("A", 3, 4);
  public static final Tensor B = Tensor.of("B", 4, 5);
  public static final Tensor C = Tensor.of("C", 3, 5);
  public static final Tensor D = Tensor.of("D", 3, 5);

  private Fixtures() {}

  /** Returns {@code A[ik]}. */
  public static Expr.IndexedTensor aik() {
    return expr.indexed(A, "ik");
  }

  /** Returns {@code B[kj]}. */
  public static Expr.IndexedTensor bkj() {
    return expr.indexed(B, "kj");
  }

  /** Returns {@code C[ij]}. */
  public static Expr.IndexedTensor cij() {
    return expr.indexed(C, "ij");
  }

  /** Returns {@code D[ij]}. */
  public static Expr.IndexedTensor dij() {
    return expr.indexed(D, "ij");
  }

  /** Returns {@code C[ij] <= A[ik] B[kj]}. */
  public static Expr.Assign matMul() {
    return expr.assign(cij(), expr.times(aik(), bkj()));
  }

  /** Returns {@code C[ij] <= A[ik] B[kj] + D[ij]}. */
  public static Expr.Assign matMulAdd() {
    return expr.assign(cij(), expr.plus(expr.times(aik(), bkj()), dij()));
  }
}

// End Fixtures.java
