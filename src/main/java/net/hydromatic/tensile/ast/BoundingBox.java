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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.BoundType;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import java.util.Iterator;
import java.util.List;
import net.hydromatic.tensile.sparse.SparsityPattern;

/**
 * Per-dimension ranges of positions, each half-open and contiguous.
 *
 * <p>The bounding box of a sparsity pattern is the smallest one that
 * covers all non-zero entries; it is used to size dense storage tightly.
 */
public final class BoundingBox implements Iterable<Range<Integer>> {
  public final ImmutableList<Range<Integer>> ranges;

  private BoundingBox(ImmutableList<Range<Integer>> ranges) {
    for (Range<Integer> range : ranges) {
      checkArgument(range.hasLowerBound() && range.hasUpperBound()
              && range.lowerEndpoint() >= 0,
          "invalid range %s", range);
    }
    this.ranges = ranges;
  }

  /** Creates a bounding box from a list of ranges. */
  public static BoundingBox of(List<Range<Integer>> ranges) {
    final ImmutableList.Builder<Range<Integer>> b = ImmutableList.builder();
    for (Range<Integer> range : ranges) {
      b.add(normalize(range));
    }
    return new BoundingBox(b.build());
  }

  /** Creates a bounding box that covers a whole shape. */
  public static BoundingBox ofShape(List<Integer> shape) {
    final ImmutableList.Builder<Range<Integer>> b = ImmutableList.builder();
    for (int extent : shape) {
      b.add(Range.closedOpen(0, extent));
    }
    return new BoundingBox(b.build());
  }

  /** Computes the minimal bounding box of the non-zero entries of a
   * pattern. A dimension without non-zero entries gets an empty range at
   * 0. */
  public static BoundingBox of(SparsityPattern pattern) {
    final ImmutableList.Builder<Range<Integer>> b = ImmutableList.builder();
    for (int d = 0; d < pattern.shape().size(); d++) {
      final Range<Integer> range = pattern.nonZeroRange(d);
      b.add(range == null ? Range.closedOpen(0, 0) : range);
    }
    return new BoundingBox(b.build());
  }

  /** Converts a bounded range to the equivalent half-open range. */
  private static Range<Integer> normalize(Range<Integer> range) {
    int lower = range.lowerEndpoint();
    int upper = range.upperEndpoint();
    if (range.lowerBoundType() == BoundType.OPEN) {
      ++lower;
    }
    if (range.upperBoundType() == BoundType.CLOSED) {
      ++upper;
    }
    return Range.closedOpen(lower, upper);
  }

  public int rank() {
    return ranges.size();
  }

  public Range<Integer> get(int dimension) {
    return ranges.get(dimension);
  }

  /** Returns the first position of a dimension. */
  public int start(int dimension) {
    return ranges.get(dimension).lowerEndpoint();
  }

  /** Returns the number of positions in a dimension. */
  public int size(int dimension) {
    final Range<Integer> range = ranges.get(dimension);
    return range.upperEndpoint() - range.lowerEndpoint();
  }

  /** Returns the number of entries covered. */
  public int size() {
    int size = 1;
    for (int d = 0; d < ranges.size(); d++) {
      size *= size(d);
    }
    return size;
  }

  /** Returns whether an entry lies within this box. */
  public boolean contains(int... entry) {
    if (entry.length != ranges.size()) {
      return false;
    }
    for (int d = 0; d < entry.length; d++) {
      if (!ranges.get(d).contains(entry[d])) {
        return false;
      }
    }
    return true;
  }

  /** Returns this box with its dimensions permuted. */
  public BoundingBox permuted(List<Integer> permutation) {
    checkArgument(permutation.size() == ranges.size(),
        "permutation %s does not match %s", permutation, this);
    final ImmutableList.Builder<Range<Integer>> b = ImmutableList.builder();
    for (int p : permutation) {
      b.add(ranges.get(p));
    }
    return new BoundingBox(b.build());
  }

  /** Returns this box with the range of one dimension replaced. */
  public BoundingBox withRange(int dimension, Range<Integer> range) {
    final ImmutableList.Builder<Range<Integer>> b = ImmutableList.builder();
    for (int d = 0; d < ranges.size(); d++) {
      b.add(d == dimension ? normalize(range)
          : ranges.get(d));
    }
    return new BoundingBox(b.build());
  }

  @Override
  public Iterator<Range<Integer>> iterator() {
    return ranges.iterator();
  }

  @Override
  public int hashCode() {
    return ranges.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof BoundingBox
        && ranges.equals(((BoundingBox) o).ranges);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder("[");
    for (int d = 0; d < ranges.size(); d++) {
      if (d > 0) {
        buf.append(", ");
      }
      buf.append(start(d)).append(':').append(start(d) + size(d));
    }
    return buf.append("]").toString();
  }
}

// End BoundingBox.java
