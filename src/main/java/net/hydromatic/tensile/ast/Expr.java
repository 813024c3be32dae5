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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.tensile.compile.CompileException;
import net.hydromatic.tensile.memory.MemoryLayout;
import net.hydromatic.tensile.sparse.SparsityEngine;
import net.hydromatic.tensile.sparse.SparsityPattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Tensor expressions.
 *
 * <p>This class functions as a namespace for the closed set of node
 * kinds, so that we can keep the class names short. Use
 * {@link ExprBuilder} to compose expressions.
 *
 * <p>The structure of a node (its kind and children) never changes after
 * construction; rewrites build new nodes. The free indices of operation
 * nodes, the sparsity pattern, the memory layout and the prefetch target
 * are annotations that compilation passes fill in.
 */
public class Expr {
  private Expr() {}

  /** Returns the number of non-zero floating-point operations needed to
   * evaluate a tree. */
  public static long nonZeroFlops(Node node) {
    long flops = node.nonZeroFlops();
    for (Node child : node.children) {
      flops += nonZeroFlops(child);
    }
    return flops;
  }

  /** Returns the number of floating-point operations that a dense
   * implementation performs to evaluate a tree. */
  public static long hardwareFlops(Node node) {
    long flops = node.hardwareFlops();
    for (Node child : node.children) {
      flops += hardwareFlops(child);
    }
    return flops;
  }

  /** Abstract base class of expression nodes. */
  public abstract static class Node {
    public final Op op;
    final ImmutableList<Node> children;
    @Nullable Indices indices;
    private @Nullable SparsityPattern pattern;

    Node(Op op, List<? extends Node> children, @Nullable Indices indices) {
      this.op = requireNonNull(op);
      this.children = ImmutableList.copyOf(children);
      this.indices = indices;
    }

    /** Returns the free indices, or null if they have not been deduced. */
    public @Nullable Indices indices() {
      return indices;
    }

    /** Returns the free indices.
     *
     * @throws IllegalStateException if they have not been deduced */
    public Indices requireIndices() {
      if (indices == null) {
        throw new IllegalStateException("indices of " + this
            + " have not been deduced");
      }
      return indices;
    }

    public ImmutableList<Node> children() {
      return children;
    }

    public Node child(int i) {
      return children.get(i);
    }

    /** Returns the number of entries of the dense result. */
    public int size() {
      return requireIndices().size();
    }

    public ImmutableList<Integer> shape() {
      return requireIndices().shape();
    }

    /** Returns the sparsity pattern, or null if not computed. */
    public @Nullable SparsityPattern pattern() {
      return pattern;
    }

    /** Returns the sparsity pattern.
     *
     * @throws IllegalStateException if it has not been computed */
    public SparsityPattern requirePattern() {
      if (pattern == null) {
        throw new IllegalStateException("sparsity pattern of " + this
            + " has not been computed");
      }
      return pattern;
    }

    public void setPattern(SparsityPattern pattern) {
      this.pattern = requireNonNull(pattern, "pattern");
    }

    /** Returns the number of entries of the result that may be
     * non-zero. */
    public int nonZeroCount() {
      return requirePattern().nonZeroCount();
    }

    /** Returns the smallest box that covers the result's non-zero
     * entries. */
    public BoundingBox boundingBox() {
      return BoundingBox.of(requirePattern());
    }

    public abstract @Nullable MemoryLayout memoryLayout();

    /** Returns the number of floating-point operations this node performs
     * on non-zero entries, not counting its children. Requires the
     * sparsity patterns of this node and its children. */
    public abstract long nonZeroFlops();

    /** Returns the number of floating-point operations a dense
     * implementation of this node performs. Same as
     * {@link #nonZeroFlops()} unless the node maps to a primitive that
     * ignores sparsity. */
    public long hardwareFlops() {
      return nonZeroFlops();
    }

    /** Computes this node's sparsity pattern from the patterns already
     * computed for its children. */
    public SparsityPattern computeSparsityPattern(SparsityEngine engine) {
      final List<SparsityPattern> childPatterns = new ArrayList<>();
      for (Node child : children) {
        childPatterns.add(child.requirePattern());
      }
      return computeSparsityPattern(engine, childPatterns);
    }

    /** Computes this node's sparsity pattern from given patterns of its
     * children. */
    public abstract SparsityPattern computeSparsityPattern(
        SparsityEngine engine, List<SparsityPattern> childPatterns);

    /** Returns whether the layouts of the operands allow this operation. */
    public boolean argumentsCompatible(List<MemoryLayout> layouts) {
      return true;
    }

    /** Returns whether the layout of the result allows this operation. */
    public boolean resultCompatible(MemoryLayout layout) {
      return true;
    }

    /** Returns whether the order of the free indices is fixed by the
     * operands, as it is for a tensor. */
    public boolean fixedIndexPermutation() {
      return true;
    }

    /** Returns a node of the same kind with different children, or this
     * node if the children are the same. */
    public abstract Node copy(List<Node> children);

    public abstract <R> R accept(ExprVisitor<R> visitor);

    /** Returns whether a list of nodes is element-wise identical to the
     * children of this node. */
    boolean sameChildren(List<Node> children) {
      if (children.size() != this.children.size()) {
        return false;
      }
      for (int i = 0; i < children.size(); i++) {
        if (children.get(i) != this.children.get(i)) {
          return false;
        }
      }
      return true;
    }

    @Override
    public String toString() {
      return op.opName + "[" + (indices == null ? "<not deduced>" : indices)
          + "]";
    }
  }

  /** Tensor with an explicit assignment of indices to its dimensions, such
   * as {@code A[ij]}. */
  public static class IndexedTensor extends Node {
    public final Tensor tensor;

    IndexedTensor(Tensor tensor, Indices indices) {
      super(Op.INDEXED_TENSOR, ImmutableList.of(), indices);
      this.tensor = requireNonNull(tensor, "tensor");
      checkArgument(indices.shape().equals(tensor.shape()),
          "indices %s do not match shape of %s", indices, tensor);
    }

    public String name() {
      return tensor.name();
    }

    @Override
    public MemoryLayout memoryLayout() {
      return tensor.memoryLayout();
    }

    @Override
    public long nonZeroFlops() {
      return 0;
    }

    @Override
    public SparsityPattern computeSparsityPattern(SparsityEngine engine,
        List<SparsityPattern> childPatterns) {
      return tensor.pattern();
    }

    @Override
    public IndexedTensor copy(List<Node> children) {
      checkArgument(children.isEmpty(), "a tensor has no children");
      return this;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String toString() {
      return tensor.name() + "[" + indices + "]";
    }
  }

  /** Node that computes a result, as opposed to a tensor leaf.
   *
   * <p>Its free indices may be permuted, and it holds the memory layout of
   * the temporary that receives its result. */
  public abstract static class Operation extends Node {
    private @Nullable MemoryLayout memoryLayout;
    private @Nullable Tensor prefetch;

    Operation(Op op, List<? extends Node> children,
        @Nullable Indices indices) {
      super(op, children, indices);
    }

    @Override
    public @Nullable MemoryLayout memoryLayout() {
      return memoryLayout;
    }

    public void setMemoryLayout(MemoryLayout memoryLayout) {
      this.memoryLayout = requireNonNull(memoryLayout, "memoryLayout");
    }

    /** Returns the tensor that a generated kernel should prefetch while
     * evaluating this node, or null. */
    public @Nullable Tensor prefetch() {
      return prefetch;
    }

    public void setPrefetch(@Nullable Tensor prefetch) {
      this.prefetch = prefetch;
    }

    @Override
    public boolean fixedIndexPermutation() {
      return false;
    }

    /** Sets the free indices. If they are already known, permutes them to
     * the new order. */
    public void setIndices(Indices indices) {
      if (this.indices == null) {
        this.indices = requireNonNull(indices);
      } else {
        permute(indices);
      }
    }

    /** Changes the order of the free indices, permuting the sparsity
     * pattern and memory layout to match.
     *
     * @throws CompileException if {@code order} has different indices */
    public void permute(Indices order) {
      final Indices current = requireIndices();
      if (current.equals(order)) {
        return;
      }
      if (!current.sameSet(order)) {
        throw new CompileException(CompileException.Kind.INDEX_MISMATCH,
            "cannot permute " + this + " to [" + order + "]");
      }
      final List<Integer> permutation = current.permutationTo(order);
      final SparsityPattern pattern = pattern();
      if (pattern != null) {
        setPattern(pattern.permuted(permutation));
      }
      if (memoryLayout != null) {
        memoryLayout = memoryLayout.permuted(permutation);
      }
      this.indices = current.permuted(order);
    }

    /** Copies the annotations that do not depend on the children to a new
     * node. */
    <T extends Operation> T copyAnnotations(T node) {
      node.setPrefetch(prefetch);
      if (indices != null) {
        node.setIndices(indices);
      }
      return node;
    }
  }

  /** Unresolved product of operands followed by a sum over indices that do
   * not occur in the result. Compilation replaces it with
   * {@link Product}, {@link IndexSum} and {@link Contraction} nodes. */
  public static class Einsum extends Operation {
    Einsum(List<? extends Node> children) {
      super(Op.EINSUM, children, null);
      checkArgument(!children.isEmpty(), "einsum has no operands");
    }

    @Override
    public long nonZeroFlops() {
      throw new IllegalStateException("unresolved " + this
          + " has no FLOP count");
    }

    @Override
    public SparsityPattern computeSparsityPattern(SparsityEngine engine,
        List<SparsityPattern> childPatterns) {
      throw new IllegalStateException("unresolved " + this
          + " has no sparsity pattern");
    }

    @Override
    public Einsum copy(List<Node> children) {
      return sameChildren(children) ? this
          : copyAnnotations(new Einsum(children));
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** Sum of two or more operands with the same free indices. */
  public static class Add extends Operation {
    Add(List<? extends Node> children) {
      super(Op.ADD, children, null);
      checkArgument(children.size() >= 2, "add needs at least 2 operands");
    }

    @Override
    public SparsityPattern computeSparsityPattern(SparsityEngine engine,
        List<SparsityPattern> childPatterns) {
      SparsityPattern pattern = childPatterns.get(0);
      for (int i = 1; i < childPatterns.size(); i++) {
        pattern = engine.add(pattern, childPatterns.get(i));
      }
      return pattern;
    }

    @Override
    public long nonZeroFlops() {
      long flops = 0;
      for (Node child : children) {
        flops += child.nonZeroCount();
      }
      return flops - nonZeroCount();
    }

    @Override
    public Add copy(List<Node> children) {
      return sameChildren(children) ? this
          : copyAnnotations(new Add(children));
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** Operation with one operand. */
  public abstract static class UnaryOp extends Operation {
    UnaryOp(Op op, Node term, @Nullable Indices indices) {
      super(op, ImmutableList.of(term), indices);
    }

    public Node term() {
      return children.get(0);
    }
  }

  /** Multiplication of an operand by a scalar: either a constant or a
   * {@link Scalar} whose value is known when the kernel runs.
   *
   * <p>Never directly contains another scalar multiplication. */
  public static class ScalarMultiplication extends UnaryOp {
    private final Object scalar;

    ScalarMultiplication(Object scalar, Node term) {
      super(Op.SCALAR_MULTIPLICATION, term,
          term.fixedIndexPermutation() ? term.indices() : null);
      checkArgument(scalar instanceof Double || scalar instanceof Scalar,
          "scalar must be a double or a Scalar: %s", scalar);
      if (term instanceof ScalarMultiplication) {
        throw new CompileException(
            CompileException.Kind.INVALID_COMPOSITION,
            "Multiple multiplications with scalars are not allowed. "
                + "Merge them into a single one.");
      }
      this.scalar = scalar;
    }

    /** Returns the scalar: a {@link Double} or a {@link Scalar}. */
    public Object scalar() {
      return scalar;
    }

    /** Returns whether the scalar is known at compile time. */
    public boolean isConstant() {
      return scalar instanceof Double;
    }

    public String name() {
      return scalar.toString();
    }

    /** Returns a scalar multiplication by the same scalar of a different
     * term. Its indices are those of the new term, if fixed. */
    public ScalarMultiplication withTerm(Node term) {
      final ScalarMultiplication s = new ScalarMultiplication(scalar, term);
      s.setPrefetch(prefetch());
      return s;
    }

    @Override
    public boolean fixedIndexPermutation() {
      return term().fixedIndexPermutation();
    }

    @Override
    public SparsityPattern computeSparsityPattern(SparsityEngine engine,
        List<SparsityPattern> childPatterns) {
      checkArgument(childPatterns.size() == 1);
      return childPatterns.get(0);
    }

    @Override
    public long nonZeroFlops() {
      if (isConstant()) {
        final double value = (Double) scalar;
        if (value == 1d || value == -1d) {
          return 0;
        }
      }
      return nonZeroCount();
    }

    @Override
    public ScalarMultiplication copy(List<Node> children) {
      checkArgument(children.size() == 1,
          "scalar multiplication has exactly 1 operand");
      if (sameChildren(children)) {
        return this;
      }
      return copyAnnotations(
          new ScalarMultiplication(scalar, children.get(0)));
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String toString() {
      return super.toString() + ": " + name();
    }
  }

  /** Sum over one index of an operand. */
  public static class IndexSum extends UnaryOp {
    private final Indices sumIndex;

    IndexSum(Node term, Index sumIndex) {
      super(Op.INDEX_SUM, term, reduced(term, sumIndex));
      this.sumIndex = term.requireIndices().extract(sumIndex);
    }

    private static Indices reduced(Node term, Index sumIndex) {
      final Indices indices = term.requireIndices();
      if (!indices.contains(sumIndex)) {
        throw new CompileException(CompileException.Kind.INDEX_MISMATCH,
            "cannot sum over index '" + sumIndex + "' of " + term);
      }
      return indices.minus(ImmutableList.of(sumIndex));
    }

    /** Returns the summed index, with its extent. */
    public Indices sumIndex() {
      return sumIndex;
    }

    @Override
    public SparsityPattern computeSparsityPattern(SparsityEngine engine,
        List<SparsityPattern> childPatterns) {
      checkArgument(childPatterns.size() == 1);
      return engine.reduce(term().requireIndices().toString(),
          requireIndices().toString(), childPatterns.get(0));
    }

    @Override
    public long nonZeroFlops() {
      return term().nonZeroCount() - nonZeroCount();
    }

    @Override
    public IndexSum copy(List<Node> children) {
      checkArgument(children.size() == 1, "index sum has exactly 1 operand");
      return sameChildren(children) ? this
          : copyAnnotations(new IndexSum(children.get(0), sumIndex.get(0)));
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** Operation with exactly two operands. */
  public abstract static class BinOp extends Operation {
    BinOp(Op op, Node left, Node right, @Nullable Indices indices) {
      super(op, ImmutableList.of(left, right), indices);
    }

    public Node leftTerm() {
      return children.get(0);
    }

    public Node rightTerm() {
      return children.get(1);
    }

    static void checkBinary(Op op, List<Node> children) {
      checkArgument(children.size() == 2,
          "%s node must have exactly 2 children", op.opName);
    }

    /** Returns a descriptor for {@link SparsityEngine#einsum}, such as
     * "ik,kj->ij". */
    String einsumDescriptor() {
      return leftTerm().requireIndices() + "," + rightTerm().requireIndices()
          + "->" + requireIndices();
    }

    /** Throws if an index shared by the operands has different extents in
     * each. */
    static void checkSharedShape(Node left, Node right) {
      final Indices l = left.requireIndices();
      final Indices r = right.requireIndices();
      final Indices shared = l.intersect(r);
      if (!l.subShape(shared).equals(r.subShape(shared))) {
        throw new CompileException(CompileException.Kind.INVALID_COMPOSITION,
            "shared indices [" + shared + "] of " + left + " and " + right
                + " have different extents: " + l.subShape(shared) + " and "
                + r.subShape(shared));
      }
    }
  }

  /** Assignment of a value to a tensor. */
  public static class Assign extends BinOp {
    Assign(Node target, Node value) {
      super(Op.ASSIGN, checkTarget(target), value, target.indices());
    }

    private static Node checkTarget(Node target) {
      if (!(target instanceof IndexedTensor)) {
        throw new CompileException(CompileException.Kind.INVALID_COMPOSITION,
            "First child of Assign node must be an IndexedTensor: "
                + target);
      }
      return target;
    }

    /** Returns the tensor that is assigned to. */
    public IndexedTensor target() {
      return (IndexedTensor) leftTerm();
    }

    /** Returns the value that is assigned. */
    public Node value() {
      return rightTerm();
    }

    @Override
    public long nonZeroFlops() {
      return 0;
    }

    @Override
    public SparsityPattern computeSparsityPattern(SparsityEngine engine,
        List<SparsityPattern> childPatterns) {
      checkArgument(childPatterns.size() == 2);
      return childPatterns.get(1);
    }

    @Override
    public Assign copy(List<Node> children) {
      checkBinary(op, children);
      return sameChildren(children) ? this
          : new Assign(children.get(0), children.get(1));
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public String toString() {
      return target() + " <= " + value();
    }
  }

  /** Product of two operands without summation; the free indices are the
   * union of the operands' indices. */
  public static class Product extends BinOp {
    Product(Node left, Node right) {
      super(Op.PRODUCT, left, right, productIndices(left, right));
    }

    private static Indices productIndices(Node left, Node right) {
      checkSharedShape(left, right);
      final Indices l = left.requireIndices();
      final Indices r = right.requireIndices();
      return l.merge(r.minus(l.intersect(r)));
    }

    @Override
    public long nonZeroFlops() {
      return nonZeroCount();
    }

    @Override
    public SparsityPattern computeSparsityPattern(SparsityEngine engine,
        List<SparsityPattern> childPatterns) {
      checkArgument(childPatterns.size() == 2);
      return engine.einsum(einsumDescriptor(), childPatterns.get(0),
          childPatterns.get(1));
    }

    @Override
    public Product copy(List<Node> children) {
      checkBinary(op, children);
      return sameChildren(children) ? this
          : copyAnnotations(new Product(children.get(0), children.get(1)));
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** Product of two operands immediately summed over a set of indices. */
  public static class Contraction extends BinOp {
    public final Indices sumIndices;

    Contraction(Indices indices, Node left, Node right, Indices sumIndices) {
      super(Op.CONTRACTION, left, right,
          contractionIndices(left, right, sumIndices));
      this.sumIndices = requireNonNull(sumIndices, "sumIndices");
      permute(indices);
    }

    private static Indices contractionIndices(Node left, Node right,
        Indices sumIndices) {
      checkSharedShape(left, right);
      final Indices l = left.requireIndices();
      final Indices r = right.requireIndices();
      for (Index index : sumIndices) {
        checkArgument(l.contains(index) || r.contains(index),
            "summed index %s not in %s or %s", index, left, right);
      }
      final Indices li = l.minus(sumIndices);
      final Indices lr = r.minus(sumIndices).minus(li);
      return li.merge(lr);
    }

    @Override
    public long nonZeroFlops() {
      return nonZeroCount();
    }

    @Override
    public SparsityPattern computeSparsityPattern(SparsityEngine engine,
        List<SparsityPattern> childPatterns) {
      checkArgument(childPatterns.size() == 2);
      return engine.einsum(einsumDescriptor(), childPatterns.get(0),
          childPatterns.get(1));
    }

    @Override
    public Contraction copy(List<Node> children) {
      checkBinary(op, children);
      if (sameChildren(children)) {
        return this;
      }
      final Contraction node = new Contraction(requireIndices(),
          children.get(0), children.get(1), sumIndices);
      node.setPrefetch(prefetch());
      return node;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** Contraction mapped to a loop nest around a matrix multiplication
   * {@code C_(m,n) = A_(m,k) B_(k,n)}, where m, n and k are groups of
   * indices that are fused into single matrix dimensions.
   *
   * <p>If n is empty, the primitive is a matrix-vector multiplication. */
  public static class LoopOverGEMM extends BinOp {
    public final Indices m;
    public final Indices n;
    public final Indices k;
    private final boolean transA;
    private final boolean transB;
    private long productNonZeros = -1;

    LoopOverGEMM(Indices indices, Node a, Node b, Indices m, Indices n,
        Indices k) {
      super(Op.LOOP_OVER_GEMM, a, b, indices);
      checkSharedShape(a, b);
      final Indices aIndices = a.requireIndices();
      final Indices bIndices = b.requireIndices();
      checkArgument(!m.isEmpty() && !k.isEmpty(),
          "m and k must not be empty");
      checkArgument(m.minus(aIndices).isEmpty()
              && m.minus(indices).isEmpty(),
          "m [%s] must be free indices of the left operand", m);
      checkArgument(n.minus(bIndices).isEmpty()
              && n.minus(indices).isEmpty(),
          "n [%s] must be free indices of the right operand", n);
      checkArgument(k.minus(aIndices).isEmpty()
              && k.minus(bIndices).isEmpty(),
          "k [%s] must be indices of both operands", k);
      this.m = m;
      this.n = n;
      this.k = k;
      this.transA = aIndices.indexOf(m.get(0)) > aIndices.indexOf(k.get(0));
      this.transB = !isGemv()
          && bIndices.indexOf(k.get(0)) > bIndices.indexOf(n.get(0));
    }

    /** Returns whether the primitive is a matrix-vector multiplication. */
    public boolean isGemv() {
      return n.isEmpty();
    }

    public boolean transA() {
      return transA;
    }

    public boolean transB() {
      return transB;
    }

    /** Returns the indices of the loops around the primitive: free indices
     * not in m or n, then indices of either operand that are neither
     * fused nor already looped over. */
    public Indices loopIndices() {
      final Indices i1 = requireIndices().minus(m.merge(n));
      final Indices i2 = leftTerm().requireIndices().minus(m.merge(k))
          .minus(i1);
      final Indices i3 = rightTerm().requireIndices().minus(k.merge(n))
          .minus(i1).minus(i2);
      return i1.merge(i2).merge(i3);
    }

    /** Returns the cost of this mapping. */
    public GemmCost cost() {
      final Indices a = leftTerm().requireIndices();
      final Indices b = rightTerm().requireIndices();
      final boolean aStrideOne = transA
          ? a.indexOf(k.get(0)) == 0
          : a.indexOf(m.get(0)) == 0;
      final boolean bStrideOne = transB
          ? b.indexOf(n.get(0)) == 0
          : b.indexOf(k.get(0)) == 0;
      return new GemmCost((aStrideOne ? 0 : 1) + (bStrideOne ? 0 : 1),
          transA, transB, loopIndices().rank());
    }

    @Override
    public boolean argumentsCompatible(List<MemoryLayout> layouts) {
      checkArgument(layouts.size() == 2);
      final Indices a = leftTerm().requireIndices();
      final Indices b = rightTerm().requireIndices();
      return layouts.get(0).mayFuse(a.positions(m))
          && layouts.get(0).mayFuse(a.positions(k))
          && layouts.get(1).mayFuse(b.positions(k))
          && layouts.get(1).mayFuse(b.positions(n));
    }

    @Override
    public boolean resultCompatible(MemoryLayout layout) {
      final Indices c = requireIndices();
      return layout.mayFuse(c.positions(m))
          && layout.mayFuse(c.positions(n));
    }

    /** {@inheritDoc}
     *
     * <p>Also computes, via an unreduced {@link Product} of the operands,
     * the number of multiplications the primitive performs. */
    @Override
    public SparsityPattern computeSparsityPattern(SparsityEngine engine,
        List<SparsityPattern> childPatterns) {
      checkArgument(childPatterns.size() == 2);
      final Product product = new Product(leftTerm(), rightTerm());
      product.setPattern(product.computeSparsityPattern(engine, childPatterns));
      productNonZeros = product.nonZeroFlops();
      return engine.einsum(einsumDescriptor(), childPatterns.get(0),
          childPatterns.get(1));
    }

    /** {@inheritDoc}
     *
     * <p>Counts a multiplication and an addition for each non-zero of the
     * unreduced product, less one addition for each non-zero of the
     * result. */
    @Override
    public long nonZeroFlops() {
      if (productNonZeros < 0) {
        throw new IllegalStateException("sparsity pattern of " + this
            + " has not been computed");
      }
      return 2 * productNonZeros - nonZeroCount();
    }

    /** {@inheritDoc}
     *
     * <p>The primitive multiplies dense {@code m} by {@code k} and
     * {@code k} by {@code n} matrices once per iteration of its loops. */
    @Override
    public long hardwareFlops() {
      return 2L * m.size() * n.size() * k.size() * loopIndices().size();
    }

    @Override
    public LoopOverGEMM copy(List<Node> children) {
      checkBinary(op, children);
      if (sameChildren(children)) {
        return this;
      }
      final LoopOverGEMM node = new LoopOverGEMM(requireIndices(),
          children.get(0), children.get(1), m, n, k);
      node.setPrefetch(prefetch());
      return node;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visit(this);
    }

    /** Renders an operand with fused groups in parentheses and looped
     * indices in brackets, for example {@code A^T_{(kl)[p]i}}. */
    static String indexString(String name, List<Indices> fused,
        Indices indices, boolean transpose) {
      final String s = indices.toString();
      final StringBuilder buf = new StringBuilder();
      int i = 0;
      outer:
      while (i < s.length()) {
        for (Indices group : fused) {
          final int len = group.rank();
          if (len > 1 && i + len <= s.length()
              && allIn(s.substring(i, i + len), group)) {
            buf.append('(').append(s, i, i + len).append(')');
            i += len;
            continue outer;
          }
        }
        final Index index = indices.get(i);
        boolean batched = true;
        for (Indices group : fused) {
          if (group.contains(index)) {
            batched = false;
          }
        }
        if (batched) {
          buf.append('[').append(index).append(']');
        } else {
          buf.append(index);
        }
        ++i;
      }
      return name + (transpose ? "^T" : "") + "_{" + buf + "}";
    }

    private static boolean allIn(String s, Indices group) {
      for (int i = 0; i < s.length(); i++) {
        if (!group.contains(Index.of(s.charAt(i)))) {
          return false;
        }
      }
      return true;
    }

    @Override
    public String toString() {
      final String a = indexString("A", ImmutableList.of(m, k),
          leftTerm().requireIndices(), transA);
      final String b = indexString("B", ImmutableList.of(k, n),
          rightTerm().requireIndices(), transB);
      final String c = indexString("C", ImmutableList.of(m, n),
          requireIndices(), false);
      return op.opName + " [" + indices + "]: " + c + " = " + a + " " + b;
    }
  }
}

// End Expr.java
