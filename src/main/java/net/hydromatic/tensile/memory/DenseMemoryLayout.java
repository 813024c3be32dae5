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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.tensile.ast.BoundingBox;
import net.hydromatic.tensile.sparse.SparsityPattern;

/**
 * Column-major strided layout that stores the entries of a bounding box.
 *
 * <p>If the stride is aligned, the range of the first dimension is widened
 * to whole multiples of the alignment, so that every column starts on a
 * vector boundary.
 */
public final class DenseMemoryLayout implements MemoryLayout {
  private final ImmutableList<Integer> shape;
  private final BoundingBox boundingBox;
  private final ImmutableList<Integer> strides;
  private final boolean alignStride;
  private final int alignment;

  private DenseMemoryLayout(ImmutableList<Integer> shape,
      BoundingBox boundingBox, boolean alignStride, int alignment) {
    checkArgument(alignment > 0, "alignment must be positive");
    checkArgument(shape.size() == boundingBox.rank(),
        "bounding box %s does not match shape %s", boundingBox, shape);
    this.shape = shape;
    this.alignStride = alignStride;
    this.alignment = alignment;
    this.boundingBox =
        alignStride && shape.size() > 0
            ? boundingBox.withRange(0, align(boundingBox.get(0), alignment))
            : boundingBox;
    final ImmutableList.Builder<Integer> b = ImmutableList.builder();
    int stride = 1;
    for (int d = 0; d < shape.size(); d++) {
      b.add(stride);
      stride *= this.boundingBox.size(d);
    }
    this.strides = b.build();
  }

  /** Creates a layout that stores every entry of a shape. */
  public static DenseMemoryLayout of(List<Integer> shape) {
    return new DenseMemoryLayout(ImmutableList.copyOf(shape),
        BoundingBox.ofShape(shape), false, 1);
  }

  /** Creates a layout that stores a given region of a shape. */
  public static DenseMemoryLayout of(List<Integer> shape,
      BoundingBox boundingBox, boolean alignStride, int alignment) {
    return new DenseMemoryLayout(ImmutableList.copyOf(shape),
        requireNonNull(boundingBox, "boundingBox"), alignStride, alignment);
  }

  /** Creates a layout that stores the bounding box of a pattern's non-zero
   * entries. */
  public static DenseMemoryLayout fromPattern(SparsityPattern pattern,
      boolean alignStride, int alignment) {
    return of(pattern.shape(), BoundingBox.of(pattern), alignStride,
        alignment);
  }

  private static Range<Integer> align(Range<Integer> range, int alignment) {
    final int lower = range.lowerEndpoint() / alignment * alignment;
    final int upper =
        (range.upperEndpoint() + alignment - 1) / alignment * alignment;
    return Range.closedOpen(lower, upper);
  }

  @Override
  public ImmutableList<Integer> shape() {
    return shape;
  }

  @Override
  public BoundingBox boundingBox() {
    return boundingBox;
  }

  /** Returns the distance, in reals, between consecutive positions of each
   * dimension. */
  public ImmutableList<Integer> strides() {
    return strides;
  }

  public boolean alignedStride() {
    return alignStride;
  }

  @Override
  public int requiredReals() {
    return boundingBox.size();
  }

  @Override
  public int address(int... entry) {
    checkArgument(boundingBox.contains(entry), "entry %s not in %s",
        Arrays.toString(entry), boundingBox);
    int address = 0;
    for (int d = 0; d < entry.length; d++) {
      address += (entry[d] - boundingBox.start(d)) * strides.get(d);
    }
    return address;
  }

  @Override
  public DenseMemoryLayout permuted(List<Integer> permutation) {
    checkArgument(permutation.size() == shape.size(),
        "permutation %s does not match shape %s", permutation, shape);
    final ImmutableList.Builder<Integer> b = ImmutableList.builder();
    for (int p : permutation) {
      b.add(shape.get(p));
    }
    return new DenseMemoryLayout(b.build(),
        boundingBox.permuted(permutation), alignStride, alignment);
  }

  @Override
  public boolean mayVectorizeDim(int dimension) {
    return dimension == 0
        && shape.size() > 0
        && boundingBox.start(0) % alignment == 0
        && boundingBox.size(0) % alignment == 0;
  }

  @Override
  public boolean mayFuse(List<Integer> positions) {
    for (int i = 1; i < positions.size(); i++) {
      final int p = positions.get(i - 1);
      final int q = positions.get(i);
      if (q != p + 1
          || boundingBox.size(p) != shape.get(p)
          || strides.get(q) != strides.get(p) * shape.get(p)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    return shape.hashCode() * 31 + boundingBox.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof DenseMemoryLayout
        && shape.equals(((DenseMemoryLayout) o).shape)
        && boundingBox.equals(((DenseMemoryLayout) o).boundingBox)
        && strides.equals(((DenseMemoryLayout) o).strides);
  }

  @Override
  public String toString() {
    return "DenseMemoryLayout(shape: " + shape + ", bbox: " + boundingBox
        + ", stride: " + strides + ")";
  }
}

// End DenseMemoryLayout.java
