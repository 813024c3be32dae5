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

import static net.hydromatic.tensile.Matchers.throwsA;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import net.hydromatic.tensile.compile.CompileException;
import net.hydromatic.tensile.sparse.BoolPattern;
import org.junit.jupiter.api.Test;

/** Tests for {@link Indices}, {@link BoundingBox} and {@link GemmCost}. */
public class IndicesTest {
  @Test
  void testOf() {
    final Indices ijk = Indices.of("ijk", 3, 5, 4);
    assertThat(ijk, hasToString("ijk"));
    assertThat(ijk.rank(), is(3));
    assertThat(ijk.size(), is(60));
    assertThat(ijk.shape(), is(ImmutableList.of(3, 5, 4)));
    assertThat(ijk.extent(Index.of('k')), is(4));
    assertThat(ijk.indexOf(Index.of('j')), is(1));
    assertThat(ijk.indexOf(Index.of('x')), is(-1));
    assertThat(Indices.EMPTY.size(), is(1));
    assertThat(Indices.of(""), is(Indices.EMPTY));

    final CompileException e =
        assertThrows(CompileException.class, () -> Indices.of("iji", 1, 2, 3));
    assertThat(e, throwsA(CompileException.Kind.INDEX_MISMATCH,
        "duplicate index 'i'"));
    assertThrows(IllegalArgumentException.class,
        () -> Indices.of("ij", 3));
    assertThrows(IllegalArgumentException.class,
        () -> Indices.of("i1", 3, 3));
  }

  /** Merge is duplicate-free, keeps the receiver's order, and is
   * deterministic; intersection is the same set in either order. */
  @Test
  void testSetOperations() {
    final Indices ik = Indices.of("ik", 3, 4);
    final Indices kj = Indices.of("kj", 4, 5);
    assertThat(ik.merge(kj), hasToString("ikj"));
    assertThat(kj.merge(ik), hasToString("kji"));
    assertThat(ik.merge(kj), is(ik.merge(kj)));
    assertThat(ik.merge(ik), is(ik));
    assertThat(ik.merge(kj).shape(), is(ImmutableList.of(3, 4, 5)));

    final Indices ijk = Indices.of("ijk", 3, 5, 4);
    final Indices kji = Indices.of("kji", 4, 5, 3);
    assertThat(ijk.intersect(kj), hasToString("jk"));
    assertThat(kj.intersect(ijk), hasToString("kj"));
    assertThat(ijk.intersect(kji).sameSet(kji.intersect(ijk)), is(true));
    assertThat(ijk.intersect(Indices.of("x", 1)), is(Indices.EMPTY));

    assertThat(ijk.minus(kj), hasToString("i"));
    assertThat(ijk.minus(ImmutableList.of(Index.of('i'))), hasToString("jk"));
    assertThat(ijk.subShape(kj), is(ImmutableList.of(4, 5)));
    assertThat(ijk.slice(1, 3), hasToString("jk"));
    assertThat(ijk.extract(Index.of('j')), is(Indices.of("j", 5)));
    assertThat(ijk.contains(Index.of('k')), is(true));
    assertThat(ijk.sameSet(kji), is(true));
    assertThat(ijk.equals(kji), is(false));

    final CompileException e =
        assertThrows(CompileException.class,
            () -> ik.merge(Indices.of("kj", 7, 5)));
    assertThat(e, throwsA(CompileException.Kind.INDEX_MISMATCH,
        "index 'k' has extent 4"));
  }

  @Test
  void testPermute() {
    final Indices ijk = Indices.of("ijk", 3, 5, 4);
    final Indices kij = Indices.of("kij", 4, 3, 5);
    assertThat(ijk.permuted(kij), is(kij));
    assertThat(ijk.permutationTo(kij), is(ImmutableList.of(2, 0, 1)));
    assertThat(ijk.positions(Indices.of("ki", 4, 3)),
        is(ImmutableList.of(2, 0)));
    assertThrows(IllegalArgumentException.class,
        () -> ijk.permuted(Indices.of("ij", 3, 5)));
  }

  @Test
  void testBoundingBox() {
    final BoolPattern pattern = BoolPattern.builder(4, 6)
        .set(1, 2)
        .set(2, 4)
        .build();
    final BoundingBox box = BoundingBox.of(pattern);
    assertThat(box, hasToString("[1:3, 2:5]"));
    assertThat(box.size(), is(6));
    assertThat(box.size(1), is(3));
    assertThat(box.contains(1, 4), is(true));
    assertThat(box.contains(0, 4), is(false));
    assertThat(box.permuted(ImmutableList.of(1, 0)),
        hasToString("[2:5, 1:3]"));

    final BoundingBox empty =
        BoundingBox.of(BoolPattern.zeros(ImmutableList.of(2, 2)));
    assertThat(empty, hasToString("[0:0, 0:0]"));
    assertThat(empty.size(), is(0));

    assertThat(BoundingBox.of(ImmutableList.of(Range.closed(1, 3))),
        is(BoundingBox.of(ImmutableList.of(Range.closedOpen(1, 4)))));
    assertThat(BoundingBox.ofShape(ImmutableList.of(3, 2)),
        hasToString("[0:3, 0:2]"));
  }

  @Test
  void testGemmCost() {
    final GemmCost best = new GemmCost(0, false, false, 0);
    assertThat(best, hasToString("(0, 0, 0, 0)"));
    assertThat(best.compareTo(new GemmCost(0, false, false, 1)), lessThan(0));
    assertThat(new GemmCost(0, true, true, 3)
        .compareTo(new GemmCost(1, false, false, 0)), lessThan(0));
    assertThat(new GemmCost(1, false, true, 0)
        .compareTo(new GemmCost(1, true, false, 0)), lessThan(0));
    assertThat(new GemmCost(1, true, false, 2),
        is(new GemmCost(1, true, false, 2)));
  }
}

// End IndicesTest.java
