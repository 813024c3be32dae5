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
import static net.hydromatic.tensile.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.tensile.ast.Expr;
import net.hydromatic.tensile.ast.ExprShuttle;
import net.hydromatic.tensile.ast.GemmCost;
import net.hydromatic.tensile.ast.Index;
import net.hydromatic.tensile.ast.Indices;
import net.hydromatic.tensile.memory.MemoryLayout;
import net.hydromatic.tensile.sparse.SparsityEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces each {@link Expr.Contraction} by the cheapest
 * {@link Expr.LoopOverGEMM} that its memory layouts allow.
 *
 * <p>Candidates come from a {@link CandidateSupplier}. A candidate is
 * rejected if the layouts of the operands or of the result cannot fuse
 * its index groups; among the others, the one with the least
 * {@link GemmCost} wins, the first on ties. If no candidate survives the
 * contraction is kept.
 *
 * <p>Requires sparsity patterns and memory layouts.
 */
public class GemmSelector extends ExprShuttle {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(GemmSelector.class);

  private final SparsityEngine engine;
  private final CandidateSupplier supplier;

  public GemmSelector(SparsityEngine engine, CandidateSupplier supplier) {
    this.engine = requireNonNull(engine, "engine");
    this.supplier = requireNonNull(supplier, "supplier");
  }

  /** Returns a supplier that proposes each way of choosing the m, n and k
   * groups as runs of indices that are adjacent, in the same order, in
   * both operands that contain them.
   *
   * <p>The m group must precede the n group in the result, because the
   * primitive writes a column-major {@code C_(m,n)}. */
  public static CandidateSupplier contiguousCandidates() {
    return GemmSelector::contiguous;
  }

  private static List<Candidate> contiguous(Expr.Contraction contraction) {
    final Indices c = contraction.requireIndices();
    final Indices a = contraction.leftTerm().requireIndices();
    final Indices b = contraction.rightTerm().requireIndices();
    final Indices mSet = c.intersect(a).minus(b);
    final Indices nSet = c.intersect(b).minus(a);
    final Indices kSet = contraction.sumIndices.intersect(a).intersect(b);
    final List<Indices> ms = runs(a, mSet, c);
    final List<Indices> ns = new ArrayList<>(runs(b, nSet, c));
    ns.add(Indices.EMPTY);
    final List<Indices> ks = runs(a, kSet, b);
    final ImmutableList.Builder<Candidate> candidates =
        ImmutableList.builder();
    for (Indices m : ms) {
      for (Indices n : ns) {
        if (!n.isEmpty() && c.indexOf(m.get(0)) > c.indexOf(n.get(0))) {
          continue;
        }
        for (Indices k : ks) {
          candidates.add(new Candidate(m, n, k));
        }
      }
    }
    return candidates.build();
  }

  /** Returns the non-empty runs of {@code indices} whose members all
   * belong to {@code allowed} and occupy consecutive positions, in the
   * same order, in {@code other}. */
  private static List<Indices> runs(Indices indices, Indices allowed,
      Indices other) {
    final List<Indices> runs = new ArrayList<>();
    for (int from = 0; from < indices.rank(); from++) {
      final Index first = indices.get(from);
      if (!allowed.contains(first)) {
        continue;
      }
      final int start = other.indexOf(first);
      for (int to = from + 1; to <= indices.rank(); to++) {
        final Index last = indices.get(to - 1);
        if (!allowed.contains(last)
            || other.indexOf(last) != start + to - 1 - from) {
          break;
        }
        runs.add(indices.slice(from, to));
      }
    }
    return runs;
  }

  /** Selects GEMMs in a statement. */
  public Expr.Assign select(Expr.Assign assign) {
    return (Expr.Assign) apply(assign);
  }

  @Override
  protected Expr.Node copy(Expr.Node node, List<Expr.Node> children) {
    final Expr.Node copy = node.copy(children);
    if (copy != node) {
      copy.setPattern(copy.computeSparsityPattern(engine));
      final MemoryLayout layout = node.memoryLayout();
      if (layout != null && copy instanceof Expr.Operation) {
        ((Expr.Operation) copy).setMemoryLayout(layout);
      }
    }
    return copy;
  }

  @Override
  public Expr.Node visit(Expr.Contraction contraction0) {
    final Expr.Contraction contraction = (Expr.Contraction)
        copy(contraction0, visitChildren(contraction0));
    final MemoryLayout layout = contraction.memoryLayout();
    if (layout == null) {
      throw new IllegalStateException("memory layout of " + contraction
          + " has not been assigned");
    }
    final List<MemoryLayout> argumentLayouts = new ArrayList<>();
    for (Expr.Node child : contraction.children()) {
      final MemoryLayout childLayout = child.memoryLayout();
      if (childLayout == null) {
        throw new IllegalStateException("memory layout of " + child
            + " has not been assigned");
      }
      argumentLayouts.add(childLayout);
    }

    Expr.LoopOverGEMM best = null;
    GemmCost bestCost = null;
    for (Candidate candidate : supplier.candidates(contraction)) {
      final Expr.LoopOverGEMM gemm =
          expr.loopOverGemm(contraction.requireIndices(),
              contraction.leftTerm(), contraction.rightTerm(),
              candidate.m, candidate.n, candidate.k);
      if (!gemm.argumentsCompatible(argumentLayouts)
          || !gemm.resultCompatible(layout)) {
        LOGGER.debug("rejected {}", gemm);
        continue;
      }
      final GemmCost cost = gemm.cost();
      if (bestCost == null || cost.compareTo(bestCost) < 0) {
        best = gemm;
        bestCost = cost;
      }
    }
    if (best == null) {
      LOGGER.debug("no GEMM for {}", contraction);
      return contraction;
    }
    LOGGER.debug("selected {} with cost {}", best, bestCost);
    best.setPattern(best.computeSparsityPattern(engine));
    best.setMemoryLayout(layout);
    best.setPrefetch(contraction.prefetch());
    return best;
  }

  /** Choice of the index groups of a {@link Expr.LoopOverGEMM}. */
  public static class Candidate {
    public final Indices m;
    public final Indices n;
    public final Indices k;

    public Candidate(Indices m, Indices n, Indices k) {
      this.m = requireNonNull(m, "m");
      this.n = requireNonNull(n, "n");
      this.k = requireNonNull(k, "k");
    }

    @Override
    public String toString() {
      return "m=" + m + ", n=" + n + ", k=" + k;
    }
  }

  /** Proposes ways to map a contraction onto a matrix multiplication. */
  public interface CandidateSupplier {
    List<Candidate> candidates(Expr.Contraction contraction);
  }
}

// End GemmSelector.java
