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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Non-zero structure of a tensor.
 *
 * <p>The compiler treats a pattern as opaque: it combines patterns through
 * a {@link SparsityEngine} and only asks a pattern for its shape, its
 * number of non-zero entries, and the range of non-zero entries along each
 * dimension.
 */
public interface SparsityPattern {
  /** Returns the extent of each dimension. */
  ImmutableList<Integer> shape();

  /** Returns the number of non-zero entries. */
  int nonZeroCount();

  /** Returns the smallest half-open range of positions along a dimension
   * that covers every non-zero entry, or null if there are none. */
  @Nullable Range<Integer> nonZeroRange(int dimension);

  /** Returns this pattern with its dimensions permuted; dimension
   * {@code i} of the result is dimension {@code permutation.get(i)} of
   * this. */
  SparsityPattern permuted(List<Integer> permutation);
}

// End SparsityPattern.java
