// Copyright 2026 The Kernelwss Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.kernelwss.java.syntax;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;
import javax.annotation.Nullable;

/**
 * An ExprTree is an immutable symbolic address expression. Its nodes live in an arena and refer to
 * each other by index, so a tree has no reference cycles, every child's parent is its owner, and
 * the tree may be shared freely between threads.
 *
 * <p>Trees are created by a {@link TreeBuilder} from their serialized token forms, or
 * programmatically through {@link #builder}.
 */
public final class ExprTree {

  private final ImmutableList<ExprNode> nodes;
  private final int root;

  private ExprTree(ImmutableList<ExprNode> nodes, int root) {
    this.nodes = nodes;
    this.root = root;
  }

  /** Returns the root node. */
  public ExprNode root() {
    return nodes.get(root);
  }

  /** Returns the node at the given arena index. */
  public ExprNode node(int index) {
    Preconditions.checkElementIndex(index, nodes.size());
    return nodes.get(index);
  }

  /** Returns all nodes in arena order. */
  public ImmutableList<ExprNode> nodes() {
    return nodes;
  }

  public int size() {
    return nodes.size();
  }

  /** Returns the parent of a node, or null for the root. */
  @Nullable
  public ExprNode parent(ExprNode node) {
    return node.isRoot() ? null : nodes.get(node.parent());
  }

  /** Returns the children of a node in operand order. */
  public ImmutableList<ExprNode> children(ExprNode node) {
    ImmutableList.Builder<ExprNode> result = ImmutableList.builderWithExpectedSize(2);
    for (int child : node.children()) {
      result.add(nodes.get(child));
    }
    return result.build();
  }

  /** Returns the {@code i}th child of a node. */
  public ExprNode child(ExprNode node, int i) {
    return nodes.get(node.children().get(i));
  }

  /** Returns the nodes of the whole tree in post-order, which is reverse Polish order. */
  public ImmutableList<ExprNode> postOrder() {
    return postOrder(root());
  }

  /** Returns the nodes of the subtree rooted at {@code from} in post-order. */
  public ImmutableList<ExprNode> postOrder(ExprNode from) {
    // Two stacks: the first visits in root, right, left order; the second reverses it.
    Deque<ExprNode> pending = new ArrayDeque<>();
    Deque<ExprNode> out = new ArrayDeque<>();
    pending.push(from);
    while (!pending.isEmpty()) {
      ExprNode node = pending.pop();
      out.push(node);
      for (int child : node.children()) {
        pending.push(nodes.get(child));
      }
    }
    return ImmutableList.copyOf(out);
  }

  /** Returns every node with the given tag, in arena order. */
  public ImmutableList<ExprNode> findAll(Op op) {
    ImmutableList.Builder<ExprNode> result = ImmutableList.builder();
    for (ExprNode node : nodes) {
      if (node.op() == op) {
        result.add(node);
      }
    }
    return result.build();
  }

  /** Returns the first node with the given tag in arena order, or null. */
  @Nullable
  public ExprNode findFirst(Op op) {
    for (ExprNode node : nodes) {
      if (node.op() == op) {
        return node;
      }
    }
    return null;
  }

  /** Returns the first reference to kernel argument {@code argIndex}, or null. */
  @Nullable
  public ExprNode findArgument(int argIndex) {
    for (ExprNode node : nodes) {
      if (node.op() == Op.ARG && node.argIndex() == argIndex) {
        return node;
      }
    }
    return null;
  }

  public boolean contains(Op op) {
    return findFirst(op) != null;
  }

  /** Returns the number of nodes with the given tag. */
  public int count(Op op) {
    int n = 0;
    for (ExprNode node : nodes) {
      if (node.op() == op) {
        n++;
      }
    }
    return n;
  }

  /** Reports whether this tree is the sentinel for an expression too large to analyze. */
  public boolean isPointerChase() {
    return root().op() == Op.POINTER_CHASE;
  }

  /** Reports whether this tree is the sentinel for an expression the device pass gave up on. */
  public boolean isIncomplete() {
    return root().op() == Op.INCOMP;
  }

  /**
   * Reports whether the address depends on a value loaded from memory, that is, whether more than
   * one memory operation appears in the tree (the access itself accounts for one).
   */
  public boolean isIndirectAccess() {
    return count(Op.MEMOP) > 1;
  }

  /** Reports whether the tree indexes nothing, in which case an access touches a single element. */
  public boolean isTrivial() {
    return !contains(Op.GEP);
  }

  /** Returns a tree consisting of a single terminal node with the given tag. */
  public static ExprTree sentinel(Op op) {
    Preconditions.checkArgument(op.isTerminal(), "sentinel %s is not a terminal", op);
    Builder b = builder();
    return b.build(b.add(op, op.keyword()));
  }

  /** Returns a tree holding the single constant {@code value}. */
  public static ExprTree constant(long value) {
    Builder b = builder();
    return b.build(b.addLiteral(Op.CONST, value, Long.toString(value)));
  }

  /**
   * Returns a new tree whose root is a binary operation with copies of {@code left} and {@code
   * right} as its operands.
   */
  public static ExprTree combine(Op op, ExprTree left, ExprTree right) {
    Preconditions.checkArgument(
        op.isOperation() && op.arity() == 2, "%s is not a binary operation", op);
    Builder b = builder();
    int l = b.copy(left);
    int r = b.copy(right);
    int root = b.add(op, op.keyword());
    b.link(root, l);
    b.link(root, r);
    return b.build(root);
  }

  /**
   * Returns the tree in fully parenthesized prefix form, {@code ( OP child... )}, where every node
   * including a leaf is parenthesized. The result parses back with {@link
   * TreeBuilder#parsePrefix}.
   */
  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder();
    appendPrefix(buf, root());
    return buf.toString();
  }

  private void appendPrefix(StringBuilder buf, ExprNode node) {
    buf.append("( ").append(node.sourceText()).append(' ');
    for (int child : node.children()) {
      appendPrefix(buf, nodes.get(child));
    }
    buf.append(") ");
    if (node.isRoot()) {
      buf.setLength(buf.length() - 1);
    }
  }

  /** Returns the tree in reverse Polish form. */
  public String toRpnString() {
    List<String> tokens = new ArrayList<>(nodes.size());
    for (ExprNode node : postOrder()) {
      tokens.add(node.sourceText());
    }
    return Joiner.on(' ').join(tokens);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Accumulates nodes and parent/child links. Children are kept in the order they are linked, which
   * is operand order.
   */
  public static final class Builder {

    private static final class Spec {
      final Op op;
      @Nullable final Long literal;
      final int argIndex;
      final int phiId;
      final String sourceText;
      final List<Integer> children = new ArrayList<>(2);
      int parent = ExprNode.NO_PARENT;

      Spec(Op op, @Nullable Long literal, int argIndex, int phiId, String sourceText) {
        this.op = op;
        this.literal = literal;
        this.argIndex = argIndex;
        this.phiId = phiId;
        this.sourceText = sourceText;
      }
    }

    private final List<Spec> specs = new ArrayList<>();

    private Builder() {}

    private int add(Op op, @Nullable Long literal, int argIndex, int phiId, String sourceText) {
      specs.add(new Spec(op, literal, argIndex, phiId, sourceText));
      return specs.size() - 1;
    }

    /** Adds a node with no payload and returns its index. */
    @CanIgnoreReturnValue
    public int add(Op op, String sourceText) {
      return add(op, null, -1, -1, sourceText);
    }

    /** Adds a CONST or INTERM node and returns its index. */
    @CanIgnoreReturnValue
    public int addLiteral(Op op, long value, String sourceText) {
      Preconditions.checkArgument(
          op == Op.CONST || op == Op.INTERM, "%s does not carry a literal", op);
      return add(op, value, -1, -1, sourceText);
    }

    /** Adds a reference to kernel argument {@code argIndex} and returns its index. */
    @CanIgnoreReturnValue
    public int addArgument(int argIndex, String sourceText) {
      return add(Op.ARG, null, argIndex, -1, sourceText);
    }

    /** Adds a PHI or PHI_TERM node and returns its index. */
    @CanIgnoreReturnValue
    public int addPhi(Op op, int phiId, String sourceText) {
      Preconditions.checkArgument(op == Op.PHI || op == Op.PHI_TERM, "%s is not a phi", op);
      return add(op, null, -1, phiId, sourceText);
    }

    /** Appends {@code child} to the operands of {@code parent}. */
    @CanIgnoreReturnValue
    public Builder link(int parent, int child) {
      Spec p = specs.get(parent);
      Spec c = specs.get(child);
      Preconditions.checkArgument(parent != child, "node %s cannot be its own child", parent);
      Preconditions.checkState(
          c.parent == ExprNode.NO_PARENT, "node %s already has parent %s", child, c.parent);
      Preconditions.checkState(p.op.isOperation(), "terminal %s cannot have operands", p.op);
      p.children.add(child);
      c.parent = parent;
      return this;
    }

    /** Copies every node of {@code tree} into this builder and returns the index of its root. */
    int copy(ExprTree tree) {
      int offset = specs.size();
      for (ExprNode node : tree.nodes) {
        add(node.op(), node.literal(), node.argIndex(), node.phiId(), node.sourceText());
      }
      for (ExprNode node : tree.nodes) {
        for (int child : node.children()) {
          link(offset + node.index(), offset + child);
        }
      }
      return offset + tree.root;
    }

    /** Returns the number of nodes added so far. */
    public int size() {
      return specs.size();
    }

    /**
     * Builds the tree rooted at {@code root}.
     *
     * @throws IllegalStateException if the root has a parent or some node is unreachable from it
     */
    public ExprTree build(int root) {
      Preconditions.checkElementIndex(root, specs.size());
      Preconditions.checkState(
          specs.get(root).parent == ExprNode.NO_PARENT, "root %s has a parent", root);
      BitSet seen = new BitSet(specs.size());
      Deque<Integer> pending = new ArrayDeque<>();
      pending.push(root);
      while (!pending.isEmpty()) {
        int i = pending.pop();
        Preconditions.checkState(!seen.get(i), "node %s reached twice", i);
        seen.set(i);
        for (int child : specs.get(i).children) {
          pending.push(child);
        }
      }
      Preconditions.checkState(
          seen.cardinality() == specs.size(),
          "%s of %s nodes are unreachable from the root",
          specs.size() - seen.cardinality(),
          specs.size());

      ImmutableList.Builder<ExprNode> nodes = ImmutableList.builderWithExpectedSize(specs.size());
      for (int i = 0; i < specs.size(); i++) {
        Spec s = specs.get(i);
        nodes.add(
            new ExprNode(
                i,
                s.op,
                s.literal,
                s.argIndex,
                s.phiId,
                s.sourceText,
                ImmutableList.copyOf(s.children),
                s.parent));
      }
      return new ExprTree(nodes.build(), root);
    }
  }
}
