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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.tensile.compile.CompileException;

/**
 * Ordered sequence of distinct {@link Index} values, each with an extent.
 *
 * <p>Values are immutable; operations such as {@link #permuted} return a
 * new value, and a holder must replace its own reference.
 *
 * <p>The string form concatenates the labels, for example "ijk". It is
 * stable, and is used both in diagnostics and in einsum descriptors.
 */
public final class Indices implements Iterable<Index> {
  /** Indices of a scalar. */
  public static final Indices EMPTY =
      new Indices(ImmutableList.of(), ImmutableMap.of());

  private final ImmutableList<Index> indices;
  private final ImmutableMap<Index, Integer> extents;

  private Indices(ImmutableList<Index> indices,
      ImmutableMap<Index, Integer> extents) {
    this.indices = requireNonNull(indices);
    this.extents = requireNonNull(extents);
  }

  /** Creates indices from a string of labels and a shape.
   *
   * <p>For example, {@code of("ij", 3, 4)} is "i" with extent 3 followed
   * by "j" with extent 4. */
  public static Indices of(String names, int... shape) {
    final ImmutableList.Builder<Integer> b = ImmutableList.builder();
    for (int extent : shape) {
      b.add(extent);
    }
    return of(names, b.build());
  }

  /** Creates indices from a string of labels and a shape. */
  public static Indices of(String names, List<Integer> shape) {
    checkArgument(names.length() == shape.size(),
        "index names '%s' do not match shape %s", names, shape);
    final Map<Index, Integer> map = new LinkedHashMap<>();
    for (int i = 0; i < names.length(); i++) {
      final Index index = Index.of(names.charAt(i));
      final int extent = shape.get(i);
      checkArgument(extent > 0, "extent of index %s must be positive", index);
      if (map.put(index, extent) != null) {
        throw new CompileException(CompileException.Kind.INDEX_MISMATCH,
            "duplicate index '" + index + "' in '" + names + "'");
      }
    }
    return of(map);
  }

  private static Indices of(Map<Index, Integer> map) {
    if (map.isEmpty()) {
      return EMPTY;
    }
    return new Indices(ImmutableList.copyOf(map.keySet()),
        ImmutableMap.copyOf(map));
  }

  /** Returns the number of indices. */
  public int rank() {
    return indices.size();
  }

  public boolean isEmpty() {
    return indices.isEmpty();
  }

  /** Returns the number of entries of a dense tensor with these indices. */
  public int size() {
    int size = 1;
    for (int extent : extents.values()) {
      size *= extent;
    }
    return size;
  }

  /** Returns the extents, in index order. */
  public ImmutableList<Integer> shape() {
    return extents.values().asList();
  }

  public Index get(int i) {
    return indices.get(i);
  }

  /** Returns the extent of an index.
   *
   * @throws IllegalArgumentException if the index is not present */
  public int extent(Index index) {
    final Integer extent = extents.get(index);
    checkArgument(extent != null, "index %s not in %s", index, this);
    return extent;
  }

  public boolean contains(Index index) {
    return extents.containsKey(index);
  }

  /** Returns the position of an index, or -1 if not present. */
  public int indexOf(Index index) {
    return indices.indexOf(index);
  }

  /** Returns the position of each of {@code sub}'s indices in this.
   *
   * @throws IllegalArgumentException if any is not present */
  public ImmutableList<Integer> positions(Indices sub) {
    final ImmutableList.Builder<Integer> b = ImmutableList.builder();
    for (Index index : sub) {
      final int i = indexOf(index);
      checkArgument(i >= 0, "index %s not in %s", index, this);
      b.add(i);
    }
    return b.build();
  }

  /** Returns the indices as a set, preserving order. */
  public ImmutableSet<Index> asSet() {
    return extents.keySet();
  }

  /** Returns whether this contains the same indices as another, in any
   * order. */
  public boolean sameSet(Indices other) {
    return asSet().equals(other.asSet());
  }

  /** Returns the indices of this that also occur in {@code other}, in the
   * order of this. */
  public Indices intersect(Indices other) {
    final Map<Index, Integer> map = new LinkedHashMap<>();
    extents.forEach((index, extent) -> {
      if (other.contains(index)) {
        map.put(index, extent);
      }
    });
    return of(map);
  }

  /** Returns the indices of this that do not occur in {@code other}. */
  public Indices minus(Indices other) {
    return minus(other.asSet());
  }

  /** Returns the indices of this that do not occur in a collection. */
  public Indices minus(Collection<Index> other) {
    final Map<Index, Integer> map = new LinkedHashMap<>();
    extents.forEach((index, extent) -> {
      if (!other.contains(index)) {
        map.put(index, extent);
      }
    });
    return of(map);
  }

  /** Returns the indices of this followed by the indices of {@code other}
   * that are not in this.
   *
   * @throws CompileException if a shared index has different extents */
  public Indices merge(Indices other) {
    final Map<Index, Integer> map = new LinkedHashMap<>(extents);
    other.extents.forEach((index, extent) -> {
      final Integer previous = map.putIfAbsent(index, extent);
      if (previous != null && previous.intValue() != extent) {
        throw new CompileException(CompileException.Kind.INDEX_MISMATCH,
            "index '" + index + "' has extent " + previous + " in " + this
                + " but " + extent + " in " + other);
      }
    });
    return of(map);
  }

  /** Returns the extents that this gives to the indices of {@code sub}, in
   * the order of {@code sub}. */
  public ImmutableList<Integer> subShape(Indices sub) {
    final ImmutableList.Builder<Integer> b = ImmutableList.builder();
    for (Index index : sub) {
      b.add(extent(index));
    }
    return b.build();
  }

  /** Returns the indices at positions {@code from} (inclusive) to
   * {@code to} (exclusive). */
  public Indices slice(int from, int to) {
    final Map<Index, Integer> map = new LinkedHashMap<>();
    for (Index index : indices.subList(from, to)) {
      map.put(index, extents.get(index));
    }
    return of(map);
  }

  /** Returns a value containing a single index of this. */
  public Indices extract(Index index) {
    final Map<Index, Integer> map = new LinkedHashMap<>();
    map.put(index, extent(index));
    return of(map);
  }

  /** Returns these indices in the order of {@code order}, which must
   * contain the same indices. */
  public Indices permuted(Indices order) {
    return permuted(order.indices);
  }

  /** Returns these indices in a given order. */
  public Indices permuted(List<Index> order) {
    checkArgument(order.size() == indices.size()
            && asSet().equals(ImmutableSet.copyOf(order)),
        "%s is not a permutation of %s", order, this);
    final Map<Index, Integer> map = new LinkedHashMap<>();
    for (Index index : order) {
      map.put(index, extents.get(index));
    }
    return of(map);
  }

  /** Returns the permutation that maps these indices to {@code order}:
   * entry {@code i} is the position in this of {@code order.get(i)}. */
  public ImmutableList<Integer> permutationTo(Indices order) {
    checkArgument(sameSet(order), "%s is not a permutation of %s", order,
        this);
    return positions(order);
  }

  @Override
  public Iterator<Index> iterator() {
    return indices.iterator();
  }

  @Override
  public int hashCode() {
    return indices.hashCode() * 31 + extents.values().asList().hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Indices
        && indices.equals(((Indices) o).indices)
        && shape().equals(((Indices) o).shape());
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    for (Index index : indices) {
      buf.append(index.name);
    }
    return buf.toString();
  }
}

// End Indices.java
