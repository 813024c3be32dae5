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

import static net.hydromatic.tensile.ast.ExprBuilder.expr;

import java.util.List;
import net.hydromatic.tensile.ast.Expr;
import net.hydromatic.tensile.ast.ExprShuttle;
import net.hydromatic.tensile.ast.Index;
import net.hydromatic.tensile.ast.Indices;

/**
 * Replaces each {@link Expr.Einsum} by a left-deep tree of binary
 * {@link Expr.Product} and {@link Expr.Contraction} nodes, in the order of
 * its operands.
 *
 * <p>An index is summed as early as possible: when it occurs in only one
 * operand, by an {@link Expr.IndexSum} over that operand; otherwise by
 * the contraction that combines the last operand that contains it.
 *
 * <p>The indices of the tree must have been deduced.
 */
public class EinsumResolver extends ExprShuttle {
  /** Resolves the einsum nodes in a statement. */
  public static Expr.Assign resolve(Expr.Assign assign) {
    return (Expr.Assign) new EinsumResolver().apply(assign);
  }

  @Override
  public Expr.Node visit(Expr.Einsum einsum) {
    final Indices result = einsum.requireIndices();
    final List<Expr.Node> operands = visitChildren(einsum);
    Expr.Node acc = null;
    for (int i = 0; i < operands.size(); i++) {
      Indices later = result;
      for (Expr.Node operand : operands.subList(i + 1, operands.size())) {
        later = later.merge(operand.requireIndices());
      }
      Expr.Node operand = operands.get(i);
      for (Index index : operand.requireIndices()) {
        if (!later.contains(index)
            && (acc == null || !acc.requireIndices().contains(index))) {
          operand = expr.indexSum(operand, index);
        }
      }
      if (acc == null) {
        acc = operand;
        continue;
      }
      final Indices sum = acc.requireIndices()
          .intersect(operand.requireIndices())
          .minus(later);
      if (sum.isEmpty()) {
        acc = expr.product(acc, operand);
      } else {
        final Indices free = acc.requireIndices()
            .merge(operand.requireIndices())
            .minus(sum);
        acc = expr.contraction(free, acc, operand, sum);
      }
    }
    if (acc instanceof Expr.Operation) {
      final Expr.Operation operation = (Expr.Operation) acc;
      operation.permute(result);
      operation.setPrefetch(einsum.prefetch());
    } else if (!acc.requireIndices().equals(result)) {
      throw new CompileException(CompileException.Kind.INDEX_MISMATCH,
          "cannot copy " + acc + " to indices [" + result
              + "]; transposing copies are not supported");
    }
    return acc;
  }
}

// End EinsumResolver.java
