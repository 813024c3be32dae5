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
import java.util.List;
import net.hydromatic.tensile.ast.Tensor;
import net.hydromatic.tensile.memory.MemoryLayout;
import net.hydromatic.tensile.sparse.SparsityPattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Buffer read or written by a {@link ProgramAction}.
 *
 * <p>A global variable refers to a tensor that the caller of the kernel
 * provides; any other variable is a temporary that the compiler
 * allocated. Two variables are equal if they have the same name.
 */
public class Variable implements Term {
  public final String name;
  public final boolean writable;
  public final @Nullable MemoryLayout memoryLayout;
  public final @Nullable SparsityPattern pattern;
  public final @Nullable Tensor tensor;

  private Variable(String name, boolean writable,
      @Nullable MemoryLayout memoryLayout, @Nullable SparsityPattern pattern,
      @Nullable Tensor tensor) {
    this.name = requireNonNull(name, "name");
    this.writable = writable;
    this.memoryLayout = memoryLayout;
    this.pattern = pattern;
    this.tensor = tensor;
  }

  /** Creates a variable that refers to a tensor. */
  public static Variable global(Tensor tensor, boolean writable,
      @Nullable MemoryLayout memoryLayout,
      @Nullable SparsityPattern pattern) {
    return new Variable(tensor.name(), writable, memoryLayout, pattern,
        tensor);
  }

  /** Creates a temporary variable. Temporaries are always writable. */
  public static Variable temporary(String name,
      @Nullable MemoryLayout memoryLayout,
      @Nullable SparsityPattern pattern) {
    return new Variable(name, true, memoryLayout, pattern, null);
  }

  public boolean isGlobal() {
    return tensor != null;
  }

  public boolean isLocal() {
    return tensor == null;
  }

  @Override
  public List<Variable> variables() {
    return ImmutableList.of(this);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Variable
        && name.equals(((Variable) o).name);
  }

  @Override
  public String toString() {
    return name;
  }
}

// End Variable.java
