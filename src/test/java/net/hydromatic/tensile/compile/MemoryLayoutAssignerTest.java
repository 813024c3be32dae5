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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.tensile.Fixtures;
import net.hydromatic.tensile.ast.Expr;
import net.hydromatic.tensile.memory.MemoryLayout;
import net.hydromatic.tensile.sparse.BoolPatterns;
import org.junit.jupiter.api.Test;

/** Tests for {@link MemoryLayoutAssigner}. */
public class MemoryLayoutAssignerTest {
  private static Expr.Assign assign(Map<Prop, Object> props) {
    final Expr.Assign assign = Fixtures.matMul();
    IndexDeducer.deduce(assign);
    final Expr.Assign tree = EinsumResolver.resolve(assign);
    new SparsityPropagator(BoolPatterns.INSTANCE).propagate(tree);
    new MemoryLayoutAssigner(props).assign(tree);
    return tree;
  }

  /** The leading dimension of the result is padded, because the left
   * operand is vectorizable along it. */
  @Test
  void testAligned() {
    final Expr.Assign tree = assign(ImmutableMap.of());
    final MemoryLayout layout = tree.value().memoryLayout();
    assertThat(layout.boundingBox(), hasToString("[0:8, 0:5]"));
    assertThat(layout.requiredReals(), is(40));
    assertThat(layout.mayVectorizeDim(0), is(true));
    assertThat(tree.memoryLayout(), nullValue());
  }

  @Test
  void testAlignment() {
    final Expr.Assign tree =
        assign(ImmutableMap.of(Prop.ALIGNMENT, 4));
    assertThat(tree.value().memoryLayout().boundingBox(),
        hasToString("[0:4, 0:5]"));
  }

  @Test
  void testSimple() {
    final Expr.Assign tree =
        assign(ImmutableMap.of(Prop.SIMPLE_MEMORY_LAYOUT, true));
    final MemoryLayout layout = tree.value().memoryLayout();
    assertThat(layout.boundingBox(), hasToString("[0:3, 0:5]"));
    assertThat(layout.requiredReals(), is(15));
  }
}

// End MemoryLayoutAssignerTest.java
