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

/**
 * Visits expression trees, with one method per kind of node.
 *
 * <p>There is no fallback method: a visitor must say what it does with
 * every kind of node.
 *
 * @param <R> Result type
 */
public interface ExprVisitor<R> {
  R visit(Expr.IndexedTensor indexedTensor);

  R visit(Expr.Einsum einsum);

  R visit(Expr.Add add);

  R visit(Expr.ScalarMultiplication scalarMultiplication);

  R visit(Expr.IndexSum indexSum);

  R visit(Expr.Product product);

  R visit(Expr.Contraction contraction);

  R visit(Expr.LoopOverGEMM loopOverGemm);

  R visit(Expr.Assign assign);
}

// End ExprVisitor.java
