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
import com.google.common.primitives.Ints;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.hydromatic.tensile.memory.DenseMemoryLayout;
import net.hydromatic.tensile.memory.MemoryLayout;
import net.hydromatic.tensile.sparse.BoolPattern;
import net.hydromatic.tensile.sparse.SparsityPattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Named source or target of data in a kernel.
 *
 * <p>Tensors that share a base name and differ in group form a family of
 * structurally related tensors; the name of a grouped tensor is
 * {@code base(group)}, for example "Q(2)".
 */
public class Tensor {
  private static final Pattern NAME_PATTERN =
      Pattern.compile("([a-zA-Z_][a-zA-Z0-9_]*)(?:\\((\\d+)\\))?");

  private final String baseName;
  private final @Nullable Integer group;
  private final ImmutableList<Integer> shape;
  private final SparsityPattern pattern;
  private final MemoryLayout memoryLayout;

  private Tensor(String baseName, @Nullable Integer group,
      ImmutableList<Integer> shape, SparsityPattern pattern,
      MemoryLayout memoryLayout) {
    this.baseName = requireNonNull(baseName, "baseName");
    this.group = group;
    this.shape = requireNonNull(shape, "shape");
    this.pattern = requireNonNull(pattern, "pattern");
    this.memoryLayout = requireNonNull(memoryLayout, "memoryLayout");
    checkArgument(pattern.shape().equals(shape),
        "pattern shape %s does not match tensor shape %s", pattern.shape(),
        shape);
  }

  /** Creates a dense tensor.
   *
   * <p>The name may carry a group, as in "Q(2)". */
  public static Tensor of(String name, int... shape) {
    return of(name, BoolPattern.dense(shape));
  }

  /** Creates a tensor whose shape and non-zero structure are given by a
   * sparsity pattern. Storage covers the pattern's bounding box. */
  public static Tensor of(String name, SparsityPattern pattern) {
    final Matcher matcher = NAME_PATTERN.matcher(name);
    checkArgument(matcher.matches(), "invalid tensor name '%s'", name);
    final String group = matcher.group(2);
    return new Tensor(matcher.group(1),
        group == null ? null : Integer.valueOf(group), pattern.shape(),
        pattern, DenseMemoryLayout.fromPattern(pattern, false, 1));
  }

  /** Creates a member of a family of tensors. */
  public static Tensor grouped(String baseName, int group, int... shape) {
    checkArgument(group >= 0, "group must be non-negative");
    final BoolPattern pattern = BoolPattern.dense(shape);
    return new Tensor(baseName, group, ImmutableList.copyOf(Ints.asList(shape)),
        pattern, DenseMemoryLayout.of(pattern.shape()));
  }

  /** Returns a copy of this tensor with a different memory layout. */
  public Tensor withMemoryLayout(MemoryLayout memoryLayout) {
    return new Tensor(baseName, group, shape, pattern, memoryLayout);
  }

  /** Returns the name, including the group if there is one. */
  public String name() {
    return group == null ? baseName : baseName + "(" + group + ")";
  }

  public String baseName() {
    return baseName;
  }

  public @Nullable Integer group() {
    return group;
  }

  public ImmutableList<Integer> shape() {
    return shape;
  }

  public SparsityPattern pattern() {
    return pattern;
  }

  public MemoryLayout memoryLayout() {
    return memoryLayout;
  }

  /** Returns the indices that a string of labels gives to this tensor. */
  public Indices indices(String indexNames) {
    checkArgument(indexNames.length() == shape.size(),
        "tensor %s has rank %s but index names '%s' have length %s", name(),
        shape.size(), indexNames, indexNames.length());
    return Indices.of(indexNames, shape);
  }

  @Override
  public int hashCode() {
    return Objects.hash(baseName, group, shape);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Tensor
        && baseName.equals(((Tensor) o).baseName)
        && Objects.equals(group, ((Tensor) o).group)
        && shape.equals(((Tensor) o).shape);
  }

  @Override
  public String toString() {
    return name();
  }
}

// End Tensor.java
