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
package net.hydromatic.tensile.sparse;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.List;

/** Sparsity engine over {@link BoolPattern} values. */
public enum BoolPatterns implements SparsityEngine {
  INSTANCE;

  @Override
  public BoolPattern add(SparsityPattern a, SparsityPattern b) {
    return bool(a).or(bool(b));
  }

  @Override
  public BoolPattern einsum(String descriptor, SparsityPattern a,
      SparsityPattern b) {
    final int arrow = descriptor.indexOf("->");
    final int comma = descriptor.indexOf(',');
    checkArgument(comma >= 0 && arrow > comma,
        "invalid einsum descriptor '%s'", descriptor);
    final String aNames = descriptor.substring(0, comma);
    final String bNames = descriptor.substring(comma + 1, arrow);
    final String cNames = descriptor.substring(arrow + 2);
    final BoolPattern aPattern = bool(a);
    final BoolPattern bPattern = bool(b);
    checkArgument(aNames.length() == aPattern.shape().size()
            && bNames.length() == bPattern.shape().size(),
        "descriptor '%s' does not match shapes %s and %s", descriptor,
        aPattern.shape(), bPattern.shape());

    // Pairs of positions, in a and b, of indices that occur in both
    final List<int[]> shared = new ArrayList<>();
    for (int i = 0; i < aNames.length(); i++) {
      final int j = bNames.indexOf(aNames.charAt(i));
      if (j >= 0) {
        checkArgument(aPattern.shape().get(i).equals(bPattern.shape().get(j)),
            "index '%s' has different extents in '%s'", aNames.charAt(i),
            descriptor);
        shared.add(new int[] {i, j});
      }
    }

    // For each result dimension, whether it comes from a, and its position
    final boolean[] fromA = new boolean[cNames.length()];
    final int[] source = new int[cNames.length()];
    final List<Integer> shape = new ArrayList<>();
    for (int k = 0; k < cNames.length(); k++) {
      final char c = cNames.charAt(k);
      final int i = aNames.indexOf(c);
      if (i >= 0) {
        fromA[k] = true;
        source[k] = i;
        shape.add(aPattern.shape().get(i));
      } else {
        final int j = bNames.indexOf(c);
        checkArgument(j >= 0, "result index '%s' not in operands of '%s'", c,
            descriptor);
        source[k] = j;
        shape.add(bPattern.shape().get(j));
      }
    }

    final BoolPattern result = BoolPattern.zeros(shape);
    final List<int[]> bNonZeros = bPattern.nonZeros();
    final int[] entry = new int[cNames.length()];
    aPattern.forEachNonZero(aEntry -> {
      for (int[] bEntry : bNonZeros) {
        if (agree(shared, aEntry, bEntry)) {
          for (int k = 0; k < entry.length; k++) {
            entry[k] = fromA[k] ? aEntry[source[k]] : bEntry[source[k]];
          }
          result.set(entry);
        }
      }
    });
    return result;
  }

  private static boolean agree(List<int[]> shared, int[] aEntry,
      int[] bEntry) {
    for (int[] pair : shared) {
      if (aEntry[pair[0]] != bEntry[pair[1]]) {
        return false;
      }
    }
    return true;
  }

  @Override
  public BoolPattern reduce(String from, String to, SparsityPattern a) {
    final BoolPattern pattern = bool(a);
    checkArgument(from.length() == pattern.shape().size(),
        "indices '%s' do not match shape %s", from, pattern.shape());
    final int[] positions = new int[to.length()];
    final List<Integer> shape = new ArrayList<>();
    for (int k = 0; k < to.length(); k++) {
      positions[k] = from.indexOf(to.charAt(k));
      checkArgument(positions[k] >= 0, "index '%s' not in '%s'",
          to.charAt(k), from);
      shape.add(pattern.shape().get(positions[k]));
    }
    final BoolPattern result = BoolPattern.zeros(shape);
    final int[] entry = new int[to.length()];
    pattern.forEachNonZero(e -> {
      for (int k = 0; k < entry.length; k++) {
        entry[k] = e[positions[k]];
      }
      result.set(entry);
    });
    return result;
  }

  private static BoolPattern bool(SparsityPattern pattern) {
    if (pattern instanceof BoolPattern) {
      return (BoolPattern) pattern;
    }
    throw new IllegalArgumentException("not a BoolPattern: " + pattern);
  }
}

// End BoolPatterns.java
