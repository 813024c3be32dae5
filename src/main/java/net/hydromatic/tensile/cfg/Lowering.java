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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.tensile.ast.Expr;
import net.hydromatic.tensile.ast.ExprVisitor;
import net.hydromatic.tensile.compile.Prop;
import net.hydromatic.tensile.memory.DenseMemoryLayout;
import net.hydromatic.tensile.memory.MemoryLayout;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts finished expression trees into a list of
 * {@link ProgramAction}s.
 *
 * <p>Children are lowered before their parent. Each node that computes a
 * value is assigned to a fresh temporary, except that an {@link Expr.Add}
 * accumulates all of its operands into one temporary, and an
 * {@link Expr.Assign} writes into its target.
 *
 * <p>An instance numbers temporaries, and remembers which tensors have
 * been assigned, across all the statements it lowers. It is not
 * thread-safe; use one instance per kernel.
 */
public class Lowering implements ExprVisitor<Variable> {
  private static final Logger LOGGER = LoggerFactory.getLogger(Lowering.class);

  /** Orders operands of a sum: writable before read-only, then global
   * before temporary. */
  private static final Comparator<Variable> ADD_ORDER =
      Comparator.comparingInt(v ->
          (v.writable ? 0 : 1) + (v.isGlobal() ? 0 : 1));

  private final ImmutableMap<Prop, Object> props;
  private final List<ProgramPoint> points = new ArrayList<>();
  private final Set<String> writable = new HashSet<>();
  private int temporaryCount = 0;

  public Lowering(Map<Prop, Object> props) {
    this.props = ImmutableMap.copyOf(requireNonNull(props, "props"));
  }

  /** Lowers a tree, appending actions, and returns the variable that
   * holds its value. */
  public Variable lower(Expr.Node node) {
    return node.accept(this);
  }

  /** Returns the actions so far, followed by an end point. */
  public ImmutableList<ProgramPoint> cfg() {
    return ImmutableList.<ProgramPoint>builder()
        .addAll(points)
        .add(new ProgramPoint(null))
        .build();
  }

  private @Nullable MemoryLayout layout(Expr.Node node) {
    return Prop.SIMPLE_MEMORY_LAYOUT.booleanValue(props)
        ? DenseMemoryLayout.of(node.shape())
        : node.memoryLayout();
  }

  private Variable nextTemporary(Expr.Node node) {
    final String name =
        Prop.TEMPORARY_PREFIX.stringValue(props) + temporaryCount++;
    return Variable.temporary(name, layout(node), node.pattern());
  }

  private void addAction(ProgramAction action) {
    LOGGER.debug("action {}", action);
    points.add(new ProgramPoint(action));
  }

  private List<Variable> lowerChildren(Expr.Node node) {
    final List<Variable> variables = new ArrayList<>();
    for (Expr.Node child : node.children()) {
      variables.add(child.accept(this));
    }
    return variables;
  }

  /** Lowers a node that has no rule of its own. */
  private Variable lowerGeneric(Expr.Node node) {
    final List<Variable> variables = lowerChildren(node);
    final Variable result = nextTemporary(node);
    addAction(
        new ProgramAction(result,
            new Expression(node, layout(node), variables), false));
    return result;
  }

  @Override
  public Variable visit(Expr.IndexedTensor indexedTensor) {
    final String name = indexedTensor.name();
    return Variable.global(indexedTensor.tensor, writable.contains(name),
        layout(indexedTensor), indexedTensor.pattern());
  }

  @Override
  public Variable visit(Expr.Einsum einsum) {
    throw new IllegalStateException("einsum must be resolved before "
        + "lowering: " + einsum);
  }

  @Override
  public Variable visit(Expr.Add add) {
    final List<Variable> variables = lowerChildren(add);
    variables.sort(ADD_ORDER);
    final Variable result = nextTemporary(add);
    boolean accumulate = false;
    for (Variable variable : variables) {
      addAction(new ProgramAction(result, variable, accumulate));
      accumulate = true;
    }
    return result;
  }

  @Override
  public Variable visit(Expr.ScalarMultiplication scalarMultiplication) {
    final Variable variable = scalarMultiplication.term().accept(this);
    final Variable result = nextTemporary(scalarMultiplication);
    addAction(
        new ProgramAction(result, variable, false,
            scalarMultiplication.scalar()));
    return result;
  }

  @Override
  public Variable visit(Expr.IndexSum indexSum) {
    return lowerGeneric(indexSum);
  }

  @Override
  public Variable visit(Expr.Product product) {
    return lowerGeneric(product);
  }

  @Override
  public Variable visit(Expr.Contraction contraction) {
    return lowerGeneric(contraction);
  }

  @Override
  public Variable visit(Expr.LoopOverGEMM loopOverGemm) {
    return lowerGeneric(loopOverGemm);
  }

  @Override
  public Variable visit(Expr.Assign assign) {
    writable.add(assign.target().name());
    final Variable target = assign.target().accept(this);
    final Variable value = assign.value().accept(this);
    addAction(new ProgramAction(target, value, false));
    return target;
  }
}

// End Lowering.java
