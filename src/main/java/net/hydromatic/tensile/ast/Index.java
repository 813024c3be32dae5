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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Named dimension label of a tensor expression, such as "i" in
 * {@code A[ij]}.
 *
 * <p>Labels are single characters, so that a sequence of indices has a
 * stable rendering as a string ("ijk") and can be used to build einsum
 * descriptors.
 */
public final class Index implements Comparable<Index> {
  private static final Index[] CACHE = new Index[128];

  static {
    for (char c = 0; c < CACHE.length; c++) {
      if (Character.isLetter(c)) {
        CACHE[c] = new Index(c);
      }
    }
  }

  public final char name;

  private Index(char name) {
    this.name = name;
  }

  /** Returns the index with a given label. */
  public static Index of(char name) {
    checkArgument(Character.isLetter(name), "invalid index name '%s'", name);
    if (name < CACHE.length) {
      return CACHE[name];
    }
    return new Index(name);
  }

  @Override
  public int hashCode() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    return o == this || o instanceof Index && ((Index) o).name == name;
  }

  @Override
  public int compareTo(Index o) {
    return Character.compare(name, o.name);
  }

  @Override
  public String toString() {
    return String.valueOf(name);
  }
}

// End Index.java
