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

/** Kinds of {@link Expr.Node}. The set is closed. */
public enum Op {
  /** Leaf: a tensor with an explicit index assignment. */
  INDEXED_TENSOR("IndexedTensor"),
  /** Unresolved product-sum; never present in a finalized tree. */
  EINSUM("Einsum"),
  ADD("Add"),
  SCALAR_MULTIPLICATION("ScalarMultiplication"),
  INDEX_SUM("IndexSum"),
  PRODUCT("Product"),
  CONTRACTION("Contraction"),
  LOOP_OVER_GEMM("LoopOverGEMM"),
  ASSIGN("Assign");

  /** Name used when printing nodes and actions. */
  public final String opName;

  Op(String opName) {
    this.opName = opName;
  }
}

// End Op.java
