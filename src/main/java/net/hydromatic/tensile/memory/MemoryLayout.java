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
package net.hydromatic.tensile.memory;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.tensile.ast.BoundingBox;

/**
 * Storage layout of a tensor.
 *
 * <p>The compiler never computes addresses itself; it asks the layout.
 */
public interface MemoryLayout {
  /** Returns the extent of each dimension of the tensor. */
  ImmutableList<Integer> shape();

  /** Returns the region of the tensor that is stored. */
  BoundingBox boundingBox();

  /** Returns the number of reals that must be allocated. */
  int requiredReals();

  /** Returns the offset, in reals, of an entry. */
  int address(int... entry);

  /** Returns this layout with its dimensions permuted; dimension
   * {@code i} of the result is dimension {@code permutation.get(i)} of
   * this. */
  MemoryLayout permuted(List<Integer> permutation);

  /** Returns whether a kernel may vectorize along a dimension. */
  boolean mayVectorizeDim(int dimension);

  /** Returns whether a group of dimensions may be fused into a single
   * dimension, that is, whether they are adjacent and stored without
   * gaps. */
  boolean mayFuse(List<Integer> positions);
}

// End MemoryLayout.java
