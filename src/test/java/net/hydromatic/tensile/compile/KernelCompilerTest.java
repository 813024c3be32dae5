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
import static net.hydromatic.tensile.Matchers.hasActions;
import static net.hydromatic.tensile.Matchers.throwsA;
import static net.hydromatic.tensile.ast.ExprBuilder.expr;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.tensile.Fixtures;
import net.hydromatic.tensile.ast.Expr;
import net.hydromatic.tensile.ast.Tensor;
import net.hydromatic.tensile.cfg.ProgramPoint;
import org.junit.jupiter.api.Test;

/** Tests for {@link KernelCompiler}. */
public class KernelCompilerTest {
  @Test
  void testMatMul() {
    final Kernel kernel =
        KernelCompiler.create()
            .compile("matMul", ImmutableList.of(Fixtures.matMul()));
    assertThat(kernel, hasToString("matMul"));
    assertThat(kernel.cfg,
        hasActions("_tmp0 = LoopOverGEMM(A, B)",
            "C = _tmp0"));
    assertThat(kernel.cfg, hasSize(3));
    assertThat(kernel.cfg.get(2).action, nullValue());
    assertThat(kernel.trees, hasSize(1));
    assertThat(kernel.nonZeroFlops(), is(105L));
    assertThat(kernel.hardwareFlops(), is(120L));
  }

  @Test
  void testWithoutGemmSelection() {
    final Kernel kernel =
        KernelCompiler.create(ImmutableMap.of(Prop.GEMM_SELECTION, false))
            .compile("matMul", ImmutableList.of(Fixtures.matMul()));
    assertThat(kernel.cfg,
        hasActions("_tmp0 = Contraction(A, B)",
            "C = _tmp0"));
    assertThat(kernel.nonZeroFlops(), is(15L));
  }

  @Test
  void testTemporaryPrefix() {
    final Kernel kernel =
        KernelCompiler.create(ImmutableMap.of(Prop.TEMPORARY_PREFIX, "t"))
            .compile("matMulAdd", ImmutableList.of(Fixtures.matMulAdd()));
    assertThat(kernel.cfg,
        hasActions("t0 = LoopOverGEMM(A, B)",
            "t1 = t0",
            "t1 += D",
            "C = t1"));
    // 105 for the product, 15 for the sum
    assertThat(kernel.nonZeroFlops(), is(120L));
  }

  /** Temporaries are numbered across all statements of a kernel. */
  @Test
  void testTwoStatements() {
    final Expr.Assign first = Fixtures.matMul();
    final Expr.Assign second =
        expr.assign(Fixtures.dij(),
            expr.plus(Fixtures.cij(), Fixtures.dij()));
    final Kernel kernel =
        KernelCompiler.create()
            .compile("twoStatements", ImmutableList.of(first, second));
    assertThat(kernel.cfg,
        hasActions("_tmp0 = LoopOverGEMM(A, B)",
            "C = _tmp0",
            "_tmp1 = C",
            "_tmp1 += D",
            "D = _tmp1"));
  }

  @Test
  void testTracer() {
    final List<Expr.Assign> trees = new ArrayList<>();
    final List<List<ProgramPoint>> cfgs = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnCfg(Tracers.withOnTree(Tracers.empty(), trees::add),
            cfgs::add);
    final Kernel kernel =
        KernelCompiler.create()
            .compile("matMul", ImmutableList.of(Fixtures.matMul()), tracer);
    assertThat(trees, hasSize(1));
    assertThat(trees.get(0),
        hasToString("C[ij] <= LoopOverGEMM [ij]: C_{ij} = A_{ik} B_{kj}"));
    assertThat(cfgs, hasSize(1));
    assertThat(cfgs.get(0), is(kernel.cfg));
  }

  @Test
  void testGroupingConflict() {
    final Tensor q0 = Tensor.of("Q(0)", 3, 5);
    final Tensor q = Tensor.of("Q", 3, 5);
    final ImmutableList<Expr.Assign> statements =
        ImmutableList.of(
            expr.assign(expr.indexed(q0, "ij"), expr.times(aik(), bkj())),
            expr.assign(Fixtures.cij(), expr.indexed(q, "ij")));
    final CompileException e =
        assertThrows(CompileException.class,
            () -> KernelCompiler.create().compile("conflict", statements));
    assertThat(e, throwsA(CompileException.Kind.GROUPING_CONFLICT,
        "tensor Q is used both with and without a group"));
  }
}

// End KernelCompilerTest.java
