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

import static net.hydromatic.tensile.Fixtures.cij;
import static net.hydromatic.tensile.ast.ExprBuilder.expr;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.tensile.Fixtures;
import net.hydromatic.tensile.ast.Expr;
import net.hydromatic.tensile.ast.Tensor;
import net.hydromatic.tensile.sparse.BoolPattern;
import net.hydromatic.tensile.sparse.BoolPatterns;
import net.hydromatic.tensile.sparse.SparsityPattern;
import org.junit.jupiter.api.Test;

/** Tests for {@link SparsityPropagator}. */
public class SparsityPropagatorTest {
  private static final SparsityPropagator PROPAGATOR =
      new SparsityPropagator(BoolPatterns.INSTANCE);

  /** Diagonal 3x3 matrix embedded in the top-left corner of a 3x4
   * matrix. */
  private static final Tensor S =
      Tensor.of("S",
          BoolPattern.builder(3, 4).set(0, 0).set(1, 1).set(2, 2).build());

  private static void collect(Expr.Node node, List<SparsityPattern> list) {
    for (Expr.Node child : node.children()) {
      collect(child, list);
    }
    list.add(node.requirePattern());
  }

  @Test
  void testSparseProduct() {
    final Expr.Assign assign =
        expr.assign(cij(),
            expr.plus(expr.times(expr.indexed(S, "ik"), Fixtures.bkj()),
                Fixtures.dij()));
    IndexDeducer.deduce(assign);
    final Expr.Assign tree = EinsumResolver.resolve(assign);
    PROPAGATOR.propagate(tree);

    final Expr.Node add = tree.value();
    final Expr.Node contraction = add.child(0);
    // Column 3 of S is zero, so row 3 of B does not contribute
    assertThat(contraction.child(0).boundingBox(), hasToString("[0:3, 0:3]"));
    assertThat(contraction.nonZeroCount(), is(15));
    assertThat(contraction.nonZeroFlops(), is(15L));
    assertThat(add.nonZeroCount(), is(15));
    assertThat(add.nonZeroFlops(), is(15L));
    assertThat(tree.requirePattern(), is(add.requirePattern()));
  }

  /** Propagating twice gives the same patterns. */
  @Test
  void testIdempotent() {
    final Expr.Assign assign = Fixtures.matMulAdd();
    IndexDeducer.deduce(assign);
    final Expr.Assign tree = EinsumResolver.resolve(assign);
    PROPAGATOR.propagate(tree);
    final List<SparsityPattern> first = new ArrayList<>();
    collect(tree, first);

    PROPAGATOR.propagate(tree);
    final List<SparsityPattern> second = new ArrayList<>();
    collect(tree, second);
    assertThat(second, is(first));
  }
}

// End SparsityPropagatorTest.java
