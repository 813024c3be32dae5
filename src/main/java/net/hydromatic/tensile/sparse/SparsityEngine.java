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
package net.hydromatic.tensile.sparse;

/**
 * Combines {@link SparsityPattern} values.
 *
 * <p>Index sets are passed in their stable string form, one character per
 * index, as in "ijk".
 */
public interface SparsityEngine {
  /** Returns the pattern of the elementwise sum of two patterns of equal
   * shape. */
  SparsityPattern add(SparsityPattern a, SparsityPattern b);

  /** Returns the pattern of an einsum of two operands.
   *
   * <p>The descriptor has the form "ik,kj->ij": the indices of the left
   * operand, of the right operand, and of the result. Indices that do not
   * occur in the result are summed. */
  SparsityPattern einsum(String descriptor, SparsityPattern a,
      SparsityPattern b);

  /** Returns the pattern of a sum over the indices that occur in
   * {@code from} but not in {@code to}.
   *
   * @param from Indices of {@code a}
   * @param to Indices of the result, a subsequence of {@code from}
   * @param a Pattern to reduce */
  SparsityPattern reduce(String from, String to, SparsityPattern a);
}

// End SparsityEngine.java
