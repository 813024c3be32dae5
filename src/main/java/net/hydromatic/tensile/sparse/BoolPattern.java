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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.function.Consumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Sparsity pattern that records, for every entry of a dense tensor, whether
 * it may be non-zero.
 *
 * <p>Entries are stored in column-major order: the first dimension varies
 * fastest.
 */
public final class BoolPattern implements SparsityPattern {
  private final ImmutableList<Integer> shape;
  private final int[] strides;
  private final int size;
  private final BitSet bits;

  private BoolPattern(ImmutableList<Integer> shape, BitSet bits) {
    this.shape = shape;
    this.strides = new int[shape.size()];
    int size = 1;
    for (int d = 0; d < shape.size(); d++) {
      checkArgument(shape.get(d) > 0, "invalid shape %s", shape);
      strides[d] = size;
      size *= shape.get(d);
    }
    this.size = size;
    this.bits = bits;
  }

  /** Creates a pattern in which every entry is non-zero. */
  public static BoolPattern dense(int... shape) {
    return dense(Ints.asList(shape));
  }

  /** Creates a pattern in which every entry is non-zero. */
  public static BoolPattern dense(List<Integer> shape) {
    final BoolPattern pattern =
        new BoolPattern(ImmutableList.copyOf(shape), new BitSet());
    pattern.bits.set(0, pattern.size);
    return pattern;
  }

  /** Creates a pattern with no non-zero entries. */
  public static BoolPattern zeros(List<Integer> shape) {
    return new BoolPattern(ImmutableList.copyOf(shape), new BitSet());
  }

  /** Creates a builder for a pattern of a given shape, initially all
   * zero. */
  public static Builder builder(int... shape) {
    return new Builder(zeros(Ints.asList(shape)));
  }

  /** Creates a diagonal pattern of a square matrix. */
  public static BoolPattern diagonal(int n) {
    final Builder b = builder(n, n);
    for (int i = 0; i < n; i++) {
      b.set(i, i);
    }
    return b.build();
  }

  @Override
  public ImmutableList<Integer> shape() {
    return shape;
  }

  @Override
  public int nonZeroCount() {
    return bits.cardinality();
  }

  /** Returns whether an entry may be non-zero. */
  public boolean get(int... entry) {
    return bits.get(offset(entry));
  }

  @Override
  public @Nullable Range<Integer> nonZeroRange(int dimension) {
    checkArgument(dimension >= 0 && dimension < shape.size(),
        "dimension %s out of range for shape %s", dimension, shape);
    int lo = Integer.MAX_VALUE;
    int hi = -1;
    for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
      final int c = (i / strides[dimension]) % shape.get(dimension);
      lo = Math.min(lo, c);
      hi = Math.max(hi, c);
    }
    return hi < 0 ? null : Range.closedOpen(lo, hi + 1);
  }

  @Override
  public BoolPattern permuted(List<Integer> permutation) {
    checkArgument(permutation.size() == shape.size(),
        "permutation %s does not match shape %s", permutation, shape);
    final List<Integer> newShape = new ArrayList<>();
    for (int p : permutation) {
      newShape.add(shape.get(p));
    }
    final BoolPattern result = zeros(newShape);
    final int[] target = new int[shape.size()];
    forEachNonZero(entry -> {
      for (int d = 0; d < target.length; d++) {
        target[d] = entry[permutation.get(d)];
      }
      result.bits.set(result.offset(target));
    });
    return result;
  }

  /** Calls an action for each non-zero entry, in storage order. The array
   * is reused between calls. */
  void forEachNonZero(Consumer<int[]> action) {
    final int[] entry = new int[shape.size()];
    for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
      for (int d = 0; d < entry.length; d++) {
        entry[d] = (i / strides[d]) % shape.get(d);
      }
      action.accept(entry);
    }
  }

  /** Returns the non-zero entries, in storage order. */
  List<int[]> nonZeros() {
    final List<int[]> list = new ArrayList<>();
    forEachNonZero(entry -> list.add(entry.clone()));
    return list;
  }

  int offset(int[] entry) {
    checkArgument(entry.length == shape.size(),
        "entry %s does not match shape %s", Arrays.toString(entry), shape);
    int offset = 0;
    for (int d = 0; d < entry.length; d++) {
      checkArgument(entry[d] >= 0 && entry[d] < shape.get(d),
          "entry %s out of bounds for shape %s", Arrays.toString(entry), shape);
      offset += entry[d] * strides[d];
    }
    return offset;
  }

  void set(int[] entry) {
    bits.set(offset(entry));
  }

  BoolPattern or(BoolPattern other) {
    checkArgument(shape.equals(other.shape),
        "cannot add patterns of shape %s and %s", shape, other.shape);
    final BitSet union = (BitSet) bits.clone();
    union.or(other.bits);
    return new BoolPattern(shape, union);
  }

  @Override
  public int hashCode() {
    return shape.hashCode() * 31 + bits.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof BoolPattern
        && shape.equals(((BoolPattern) o).shape)
        && bits.equals(((BoolPattern) o).bits);
  }

  @Override
  public String toString() {
    return "BoolPattern" + shape + " nnz=" + nonZeroCount();
  }

  /** Builds a {@link BoolPattern} entry by entry. */
  public static class Builder {
    private final BoolPattern pattern;
    private boolean built;

    private Builder(BoolPattern pattern) {
      this.pattern = pattern;
    }

    /** Marks an entry as non-zero. */
    public Builder set(int... entry) {
      checkArgument(!built, "already built");
      pattern.set(entry);
      return this;
    }

    public BoolPattern build() {
      built = true;
      return pattern;
    }
  }
}

// End BoolPattern.java
