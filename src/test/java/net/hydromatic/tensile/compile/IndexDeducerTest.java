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

import static net.hydromatic.tensile.Fixtures.aik;
import static net.hydromatic.tensile.Fixtures.bkj;
import static net.hydromatic.tensile.Fixtures.cij;
import static net.hydromatic.tensile.Fixtures.dij;
import static net.hydromatic.tensile.Matchers.throwsA;
import static net.hydromatic.tensile.ast.ExprBuilder.expr;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.tensile.Fixtures;
import net.hydromatic.tensile.ast.Expr;
import net.hydromatic.tensile.ast.Tensor;
import org.junit.jupiter.api.Test;

/** Tests for {@link IndexDeducer}. */
public class IndexDeducerTest {
  @Test
  void testMatMul() {
    final Expr.Assign assign = Fixtures.matMul();
    IndexDeducer.deduce(assign);
    assertThat(assign.value(), hasToString("Einsum[ij]"));
  }

  /** Each operand of a sum is deduced against the target. */
  @Test
  void testSum() {
    final Expr.Assign assign =
        expr.assign(cij(),
            expr.plus(expr.times(2d, expr.times(aik(), bkj())), dij()));
    IndexDeducer.deduce(assign);
    final Expr.Node add = assign.value();
    assertThat(add, hasToString("Add[ij]"));
    assertThat(add.child(0), hasToString("ScalarMultiplication[ij]: 2.0"));
    assertThat(((Expr.ScalarMultiplication) add.child(0)).term(),
        hasToString("Einsum[ij]"));
  }

  /** Below the right side, an einsum keeps the indices that occur in only
   * one operand. */
  @Test
  void testNestedEinsum() {
    final Tensor w = Tensor.of("w", 5);
    final Expr.Einsum inner =
        expr.einsum(ImmutableList.of(bkj(), expr.indexed(w, "j")));
    final Expr.Assign assign =
        expr.assign(expr.indexed(Tensor.of("x", 3), "i"),
            expr.einsum(ImmutableList.of(aik(), inner)));
    IndexDeducer.deduce(assign);
    assertThat(inner, hasToString("Einsum[k]"));
    assertThat(assign.value(), hasToString("Einsum[i]"));
  }

  /** Operand of a sum whose indices are in a different order than the
   * target's. */
  @Test
  void testSumOfTranspose() {
    final Tensor e = Tensor.of("E", 5, 3);
    final Expr.Assign assign =
        expr.assign(cij(), expr.plus(dij(), expr.indexed(e, "ji")));
    final CompileException x =
        assertThrows(CompileException.class,
            () -> IndexDeducer.deduce(assign));
    assertThat(x, throwsA(CompileException.Kind.INDEX_MISMATCH,
        "cannot use E[ji] where indices [ij] are required"));
  }

  @Test
  void testMissingIndex() {
    final Tensor f = Tensor.of("F", 4, 5);
    final Expr.Assign assign =
        expr.assign(cij(), expr.times(aik(), expr.indexed(f, "kl")));
    final CompileException x =
        assertThrows(CompileException.class,
            () -> IndexDeducer.deduce(assign));
    assertThat(x, throwsA(CompileException.Kind.INDEX_MISMATCH,
        "indices [j] of target [ij] do not occur"));
  }

  @Test
  void testWrongExtent() {
    final Tensor f = Tensor.of("F", 4, 6);
    final Expr.Assign assign =
        expr.assign(cij(), expr.times(aik(), expr.indexed(f, "kj")));
    final CompileException x =
        assertThrows(CompileException.class,
            () -> IndexDeducer.deduce(assign));
    assertThat(x, throwsA(CompileException.Kind.INDEX_MISMATCH,
        "target [ij] has shape [3, 5] but operands give [3, 6]"));
  }
}

// End IndexDeducerTest.java
