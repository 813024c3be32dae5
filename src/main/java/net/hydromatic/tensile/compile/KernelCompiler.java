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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.tensile.ast.Expr;
import net.hydromatic.tensile.cfg.Cfgs;
import net.hydromatic.tensile.cfg.Lowering;
import net.hydromatic.tensile.cfg.ProgramPoint;
import net.hydromatic.tensile.sparse.BoolPatterns;
import net.hydromatic.tensile.sparse.SparsityEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles statements into a {@link Kernel}.
 *
 * <p>For each statement, in order: deduces indices, resolves einsums,
 * propagates sparsity patterns, assigns memory layouts and, if
 * {@link Prop#GEMM_SELECTION} is set, maps contractions to GEMMs. Then
 * lowers all statements into one control flow.
 */
public class KernelCompiler {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(KernelCompiler.class);

  private final ImmutableMap<Prop, Object> props;
  private final SparsityEngine engine;
  private final GemmSelector.CandidateSupplier candidateSupplier;

  public KernelCompiler(Map<Prop, Object> props, SparsityEngine engine,
      GemmSelector.CandidateSupplier candidateSupplier) {
    this.props = ImmutableMap.copyOf(requireNonNull(props, "props"));
    this.engine = requireNonNull(engine, "engine");
    this.candidateSupplier =
        requireNonNull(candidateSupplier, "candidateSupplier");
  }

  /** Creates a compiler with the boolean sparsity engine and contiguous
   * GEMM candidates. */
  public static KernelCompiler create(Map<Prop, Object> props) {
    return new KernelCompiler(props, BoolPatterns.INSTANCE,
        GemmSelector.contiguousCandidates());
  }

  /** Creates a compiler with default properties. */
  public static KernelCompiler create() {
    return create(ImmutableMap.of());
  }

  /** Compiles a list of statements.
   *
   * @throws CompileException if a statement is invalid, or if the kernel
   * uses a tensor both with and without a group */
  public Kernel compile(String name, List<Expr.Assign> statements) {
    return compile(name, statements, Tracers.empty());
  }

  /** Compiles a list of statements, reporting intermediate results to a
   * tracer. */
  public Kernel compile(String name, List<Expr.Assign> statements,
      Tracer tracer) {
    LOGGER.debug("compiling kernel {} with {} statement(s)", name,
        statements.size());
    final ImmutableList.Builder<Expr.Assign> trees = ImmutableList.builder();
    final Lowering lowering = new Lowering(props);
    for (Expr.Assign statement : statements) {
      final Expr.Assign tree = prepare(statement);
      LOGGER.debug("finished tree {}", tree);
      tracer.onTree(tree);
      trees.add(tree);
      lowering.lower(tree);
    }
    final ImmutableList<ProgramPoint> cfg = lowering.cfg();
    tracer.onCfg(cfg);
    Cfgs.tensorGroups(cfg);
    final Kernel kernel = new Kernel(name, trees.build(), cfg);
    LOGGER.debug("kernel {}: {} non-zero flops, {} hardware flops", name,
        kernel.nonZeroFlops(), kernel.hardwareFlops());
    return kernel;
  }

  /** Runs the tree passes on one statement. */
  Expr.Assign prepare(Expr.Assign statement) {
    IndexDeducer.deduce(statement);
    Expr.Assign tree = EinsumResolver.resolve(statement);
    new SparsityPropagator(engine).propagate(tree);
    new MemoryLayoutAssigner(props).assign(tree);
    if (Prop.GEMM_SELECTION.booleanValue(props)) {
      tree = new GemmSelector(engine, candidateSupplier).select(tree);
    }
    return tree;
  }
}

// End KernelCompiler.java
