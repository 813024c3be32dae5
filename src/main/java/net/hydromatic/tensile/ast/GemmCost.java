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
package net.hydromatic.tensile.ast;

import com.google.common.collect.ComparisonChain;
import java.util.Objects;

/**
 * Cost of mapping a contraction onto a loop nest around a matrix-multiply
 * primitive.
 *
 * <p>Costs are totally ordered, lexicographically by: the number of
 * operands whose leading dimension of interest does not have unit stride;
 * whether the left operand is transposed; whether the right operand is
 * transposed; the rank of the loop nest around the primitive.
 *
 * <p>Every candidate for a given contraction covers the same indices, each
 * either fused into m, n or k or looped over. So ordering by ascending
 * loop rank is the same as ordering by descending number of fused
 * indices, {@code |m| + |n| + |k|}.
 */
public final class GemmCost implements Comparable<GemmCost> {
  public final int stridedOperands;
  public final boolean transA;
  public final boolean transB;
  public final int loopRank;

  public GemmCost(int stridedOperands, boolean transA, boolean transB,
      int loopRank) {
    this.stridedOperands = stridedOperands;
    this.transA = transA;
    this.transB = transB;
    this.loopRank = loopRank;
  }

  @Override
  public int compareTo(GemmCost o) {
    return ComparisonChain.start()
        .compare(stridedOperands, o.stridedOperands)
        .compareFalseFirst(transA, o.transA)
        .compareFalseFirst(transB, o.transB)
        .compare(loopRank, o.loopRank)
        .result();
  }

  @Override
  public int hashCode() {
    return Objects.hash(stridedOperands, transA, transB, loopRank);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof GemmCost
        && compareTo((GemmCost) o) == 0;
  }

  @Override
  public String toString() {
    return "(" + stridedOperands + ", " + (transA ? 1 : 0) + ", "
        + (transB ? 1 : 0) + ", " + loopRank + ")";
  }
}

// End GemmCost.java
