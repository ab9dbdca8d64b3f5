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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * A node of an {@link ExprTree}. Nodes are immutable and refer to their children and parent by
 * index into the owning tree's arena; they are meaningful only together with that tree.
 */
public final class ExprNode {

  /** The parent index of a root node. */
  public static final int NO_PARENT = -1;

  private final int index;
  private final Op op;
  @Nullable private final Long literal;
  private final int argIndex;
  private final int phiId;
  private final String sourceText;
  private final ImmutableList<Integer> children;
  private final int parent;

  ExprNode(
      int index,
      Op op,
      @Nullable Long literal,
      int argIndex,
      int phiId,
      String sourceText,
      ImmutableList<Integer> children,
      int parent) {
    this.index = index;
    this.op = Preconditions.checkNotNull(op);
    this.literal = literal;
    this.argIndex = argIndex;
    this.phiId = phiId;
    this.sourceText = Preconditions.checkNotNull(sourceText);
    this.children = children;
    this.parent = parent;
  }

  /** Returns the position of this node in its tree's arena. */
  public int index() {
    return index;
  }

  public Op op() {
    return op;
  }

  /** Returns the numeric value of a CONST or INTERM node, or null for other nodes. */
  @Nullable
  public Long literal() {
    return literal;
  }

  /** Returns the argument number of an ARG node, or -1. */
  public int argIndex() {
    return argIndex;
  }

  /** Returns the id of a PHI or PHI_TERM node, or -1 if the token carried none. */
  public int phiId() {
    return phiId;
  }

  /** Returns the token this node was built from. */
  public String sourceText() {
    return sourceText;
  }

  /** Returns the arena indices of the children, in operand order. */
  public ImmutableList<Integer> children() {
    return children;
  }

  /** Returns the arena index of the parent, or {@link #NO_PARENT}. */
  public int parent() {
    return parent;
  }

  public boolean isRoot() {
    return parent == NO_PARENT;
  }

  public boolean isLeaf() {
    return children.isEmpty();
  }

  @Override
  public String toString() {
    return sourceText;
  }
}
