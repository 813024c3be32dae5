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

import static net.hydromatic.tensile.Fixtures.bkj;
import static net.hydromatic.tensile.ast.ExprBuilder.expr;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.tensile.Fixtures;
import net.hydromatic.tensile.ast.Expr;
import net.hydromatic.tensile.ast.GemmCost;
import net.hydromatic.tensile.ast.Indices;
import net.hydromatic.tensile.ast.Tensor;
import net.hydromatic.tensile.sparse.BoolPatterns;
import org.junit.jupiter.api.Test;

/** Tests for {@link GemmSelector}. */
public class GemmSelectorTest {
  private static final Indices I = Indices.of("i", 3);
  private static final Indices J = Indices.of("j", 5);
  private static final Indices K = Indices.of("k", 4);

  /** Runs the passes that precede GEMM selection. */
  private static Expr.Assign prepare(Expr.Assign assign,
      Map<Prop, Object> props) {
    IndexDeducer.deduce(assign);
    final Expr.Assign tree = EinsumResolver.resolve(assign);
    new SparsityPropagator(BoolPatterns.INSTANCE).propagate(tree);
    new MemoryLayoutAssigner(props).assign(tree);
    return tree;
  }

  private static Expr.Assign select(Expr.Assign assign,
      GemmSelector.CandidateSupplier supplier) {
    return new GemmSelector(BoolPatterns.INSTANCE, supplier).select(assign);
  }

  @Test
  void testMatMul() {
    final Expr.Assign tree = prepare(Fixtures.matMul(), ImmutableMap.of());
    final Expr.Node contraction = tree.value();
    final Expr.Assign selected =
        select(tree, GemmSelector.contiguousCandidates());
    assertThat(selected.value(), instanceOf(Expr.LoopOverGEMM.class));
    final Expr.LoopOverGEMM gemm = (Expr.LoopOverGEMM) selected.value();
    assertThat(gemm,
        hasToString("LoopOverGEMM [ij]: C_{ij} = A_{ik} B_{kj}"));
    assertThat(gemm.cost(), is(new GemmCost(0, false, false, 0)));
    assertThat(gemm.memoryLayout(), sameInstance(contraction.memoryLayout()));
    assertThat(gemm.requirePattern(), is(contraction.requirePattern()));
    assertThat(gemm.nonZeroFlops(), is(105L));
  }

  /** If there are no candidates, the contraction stays. */
  @Test
  void testNoCandidates() {
    final Expr.Assign tree = prepare(Fixtures.matMul(), ImmutableMap.of());
    final Expr.Assign selected =
        select(tree, contraction -> ImmutableList.of());
    assertThat(selected, sameInstance(tree));
    assertThat(selected.value(), instanceOf(Expr.Contraction.class));
  }

  /** The cheapest candidate wins; of equal candidates, the first. */
  @Test
  void testCheapest() {
    final Expr.Assign tree = prepare(Fixtures.matMul(), ImmutableMap.of());
    final Expr.Assign selected =
        select(tree,
            contraction -> ImmutableList.of(
                new GemmSelector.Candidate(I, Indices.EMPTY, K),
                new GemmSelector.Candidate(I, J, K),
                new GemmSelector.Candidate(I, J, K)));
    final Expr.LoopOverGEMM gemm = (Expr.LoopOverGEMM) selected.value();
    assertThat(gemm.isGemv(), is(false));
    assertThat(gemm.loopIndices(), is(Indices.EMPTY));
  }

  /** Fusing two indices of the result requires that the result's layout
   * is not padded. */
  @Test
  void testFused() {
    final Tensor a = Tensor.of("A", 3, 2, 4);
    final Tensor c = Tensor.of("C", 3, 2, 5);
    final Expr.Assign assign =
        expr.assign(expr.indexed(c, "ilj"),
            expr.times(expr.indexed(a, "ilk"), bkj()));

    final Expr.Assign padded =
        select(prepare(assign, ImmutableMap.of()),
            GemmSelector.contiguousCandidates());
    assertThat(padded.value(),
        hasToString("LoopOverGEMM [ilj]: C_{i[l]j} = A_{i[l]k} B_{kj}"));

    final Expr.Assign assign2 =
        expr.assign(expr.indexed(c, "ilj"),
            expr.times(expr.indexed(a, "ilk"), bkj()));
    final Expr.Assign unpadded =
        select(prepare(assign2, ImmutableMap.of(Prop.ALIGNMENT, 1)),
            GemmSelector.contiguousCandidates());
    assertThat(unpadded.value(),
        hasToString("LoopOverGEMM [ilj]: C_{(il)j} = A_{(il)k} B_{kj}"));
    assertThat(((Expr.LoopOverGEMM) unpadded.value()).cost(),
        is(new GemmCost(0, false, false, 0)));
  }

  /** The primitive writes {@code C_(m,n)}; if the result stores n before
   * m, the matrix-multiply candidate is dropped and a loop of
   * matrix-vector multiplications remains. */
  @Test
  void testTransposedResult() {
    final Tensor ct = Tensor.of("CT", 5, 3);
    final Expr.Contraction contraction =
        (Expr.Contraction) prepare(
            expr.assign(expr.indexed(ct, "ji"),
                expr.times(Fixtures.aik(), bkj())),
            ImmutableMap.of()).value();
    assertThat(GemmSelector.contiguousCandidates().candidates(contraction),
        hasToString("[m=i, n=, k=k]"));

    final Expr.Assign selected =
        select(
            prepare(
                expr.assign(expr.indexed(ct, "ji"),
                    expr.times(Fixtures.aik(), bkj())),
                ImmutableMap.of()),
            GemmSelector.contiguousCandidates());
    final Expr.LoopOverGEMM gemm = (Expr.LoopOverGEMM) selected.value();
    assertThat(gemm.isGemv(), is(true));
    assertThat(gemm.loopIndices(), hasToString("j"));
    assertThat(gemm,
        hasToString("LoopOverGEMM [ji]: C_{[j]i} = A_{ik} B_{k[j]}"));
  }

  /** Contractions below the root are replaced, and their parents get
   * new patterns. */
  @Test
  void testNested() {
    final Expr.Assign assign = Fixtures.matMulAdd();
    final Expr.Assign tree = prepare(assign, ImmutableMap.of());
    final Expr.Assign selected =
        select(tree, GemmSelector.contiguousCandidates());
    final Expr.Node add = selected.value();
    assertThat(add, hasToString("Add[ij]"));
    assertThat(add.child(0), instanceOf(Expr.LoopOverGEMM.class));
    assertThat(add.requirePattern(), is(tree.value().requirePattern()));
    assertThat(add.memoryLayout(), sameInstance(tree.value().memoryLayout()));
  }
}

// End GemmSelectorTest.java
