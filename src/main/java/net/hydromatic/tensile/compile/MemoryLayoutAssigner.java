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
package net.hydromatic.tensile.compile;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.tensile.ast.Expr;
import net.hydromatic.tensile.ast.Index;
import net.hydromatic.tensile.memory.DenseMemoryLayout;
import net.hydromatic.tensile.memory.MemoryLayout;

/**
 * Assigns a memory layout to the temporary result of each operation.
 *
 * <p>The layout is dense, and covers the bounding box of the operation's
 * sparsity pattern unless {@link Prop#SIMPLE_MEMORY_LAYOUT} is set. The
 * leading dimension is padded to a multiple of {@link Prop#ALIGNMENT} if
 * some operand may vectorize along the leading index of the result.
 *
 * <p>Assignments get no layout: they write into their target.
 */
public class MemoryLayoutAssigner {
  private final ImmutableMap<Prop, Object> props;

  public MemoryLayoutAssigner(Map<Prop, Object> props) {
    this.props = ImmutableMap.copyOf(requireNonNull(props, "props"));
  }

  /** Assigns layouts to a node and its descendants. Requires sparsity
   * patterns. */
  public void assign(Expr.Node node) {
    for (Expr.Node child : node.children()) {
      assign(child);
    }
    if (node instanceof Expr.Operation && !(node instanceof Expr.Assign)) {
      final Expr.Operation operation = (Expr.Operation) node;
      operation.setMemoryLayout(layout(operation));
    }
  }

  private MemoryLayout layout(Expr.Operation operation) {
    if (Prop.SIMPLE_MEMORY_LAYOUT.booleanValue(props)) {
      return DenseMemoryLayout.of(operation.shape());
    }
    return DenseMemoryLayout.fromPattern(operation.requirePattern(),
        alignStride(operation), Prop.ALIGNMENT.intValue(props));
  }

  /** Returns whether an operand stores the leading index of the result in
   * an aligned, vectorizable dimension. */
  private static boolean alignStride(Expr.Operation operation) {
    if (operation.requireIndices().isEmpty()) {
      return false;
    }
    final Index leading = operation.requireIndices().get(0);
    for (Expr.Node child : operation.children()) {
      final int position = child.requireIndices().indexOf(leading);
      final MemoryLayout layout = child.memoryLayout();
      if (position >= 0 && layout != null
          && layout.mayVectorizeDim(position)) {
        return true;
      }
    }
    return false;
  }
}

// End MemoryLayoutAssigner.java
