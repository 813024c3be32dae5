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
package net.hydromatic.tensile.cfg;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Ordering;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import net.hydromatic.tensile.ast.Expr;
import net.hydromatic.tensile.ast.Scalar;
import net.hydromatic.tensile.ast.Tensor;
import net.hydromatic.tensile.compile.CompileException;

/** Queries over the control flow of a kernel. */
public abstract class Cfgs {
  private static final Comparator<Variable> BY_VARIABLE_NAME =
      Comparator.comparing(v -> v.name);
  private static final Comparator<Tensor> BY_TENSOR_NAME =
      Comparator.comparing(Tensor::name);
  private static final Comparator<Scalar> BY_SCALAR_NAME =
      Comparator.comparing(s -> s.name);

  private Cfgs() {}

  /** Returns the global variables that the actions read or write, sorted
   * by name. */
  public static ImmutableList<Variable> sortedGlobals(List<ProgramPoint> cfg) {
    final SortedSet<Variable> globals = new TreeSet<>(BY_VARIABLE_NAME);
    for (ProgramPoint point : cfg) {
      final ProgramAction action = point.action;
      if (action == null) {
        continue;
      }
      if (action.result.isGlobal()) {
        globals.add(action.result);
      }
      for (Variable variable : action.variables()) {
        if (variable.isGlobal()) {
          globals.add(variable);
        }
      }
    }
    return ImmutableList.copyOf(globals);
  }

  /** Returns the tensors that expressions prefetch, sorted by name. */
  public static ImmutableList<Tensor> sortedPrefetches(List<ProgramPoint> cfg) {
    final SortedSet<Tensor> prefetches = new TreeSet<>(BY_TENSOR_NAME);
    for (ProgramPoint point : cfg) {
      final ProgramAction action = point.action;
      if (action != null && action.isRhsExpression()) {
        final Expr.Node node = ((Expression) action.term).node;
        if (node instanceof Expr.Operation) {
          final Tensor prefetch = ((Expr.Operation) node).prefetch();
          if (prefetch != null) {
            prefetches.add(prefetch);
          }
        }
      }
    }
    return ImmutableList.copyOf(prefetches);
  }

  /** Returns the runtime scalars that actions multiply by, sorted by
   * name. */
  public static ImmutableSortedSet<Scalar> scalars(List<ProgramPoint> cfg) {
    final ImmutableSortedSet.Builder<Scalar> scalars =
        ImmutableSortedSet.orderedBy(BY_SCALAR_NAME);
    for (ProgramPoint point : cfg) {
      if (point.action != null && point.action.scalar instanceof Scalar) {
        scalars.add((Scalar) point.action.scalar);
      }
    }
    return scalars.build();
  }

  /** Returns the groups of each global tensor, keyed by base name. The
   * set is empty for a tensor that has no group.
   *
   * @throws CompileException if a base name is used both with and without
   * a group */
  public static ImmutableSortedMap<String, ImmutableSortedSet<Integer>>
      tensorGroups(List<ProgramPoint> cfg) {
    final Map<String, SortedSet<Integer>> groups = new TreeMap<>();
    final Map<String, Boolean> grouped = new TreeMap<>();
    for (Variable variable : sortedGlobals(cfg)) {
      final Tensor tensor = variable.tensor;
      if (tensor == null) {
        continue;
      }
      final String baseName = tensor.baseName();
      final Integer group = tensor.group();
      final Boolean previous = grouped.put(baseName, group != null);
      if (previous != null && previous.booleanValue() != (group != null)) {
        throw new CompileException(CompileException.Kind.GROUPING_CONFLICT,
            "tensor " + baseName
                + " is used both with and without a group");
      }
      final SortedSet<Integer> set =
          groups.computeIfAbsent(baseName, k -> new TreeSet<>());
      if (group != null) {
        set.add(group);
      }
    }
    final ImmutableSortedMap.Builder<String, ImmutableSortedSet<Integer>> b =
        ImmutableSortedMap.naturalOrder();
    groups.forEach((name, set) ->
        b.put(name, ImmutableSortedSet.copyOf(Ordering.natural(), set)));
    return b.build();
  }

  /** Returns a description of the actions, one per line, such as
   * {@code "_tmp0 = Contraction(A, B)"}. */
  public static String describe(List<ProgramPoint> cfg) {
    final StringBuilder b = new StringBuilder();
    for (ProgramPoint point : cfg) {
      if (point.action != null) {
        b.append(point.action).append('\n');
      }
    }
    return b.toString();
  }
}

// End Cfgs.java
