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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import javax.annotation.Nullable;

/**
 * The closed set of node tags of an address expression tree.
 *
 * <p>Every tag is either a {@link Kind#TERMINAL}, which needs nothing but an environment to be
 * reduced to a number, or an {@link Kind#OPERATION} over child nodes. The tags mirror the keywords
 * written by the device-side pass that serializes kernel address computations.
 */
public enum Op {
  // Terminals.
  CONST(Kind.TERMINAL, 0),
  ARG(Kind.TERMINAL, 0),
  TIDX(Kind.TERMINAL, 0, "TIDX"),
  TIDY(Kind.TERMINAL, 0, "TIDY"),
  BIDX(Kind.TERMINAL, 0, "BIDX"),
  BIDY(Kind.TERMINAL, 0, "BIDY"),
  BDIMX(Kind.TERMINAL, 0, "BDIMX"),
  BDIMY(Kind.TERMINAL, 0, "BDIMY"),
  /** The incoming value of a loop-carried variable. Only the tree builder creates this tag. */
  PHI_TERM(Kind.TERMINAL, 0),
  /** An already computed value. */
  INTERM(Kind.TERMINAL, 0),
  INCOMP(Kind.TERMINAL, 0, "INCOMP"),
  POINTER_CHASE(Kind.TERMINAL, 0, "PC"),
  UNKNOWN(Kind.TERMINAL, 0, "UNKNOWN", "UNDEF"),

  // Operations.
  ADD(Kind.OPERATION, 2, "ADD"),
  SUB(Kind.OPERATION, 2, "SUB"),
  AND(Kind.OPERATION, 2, "AND"),
  OR(Kind.OPERATION, 2, "OR"),
  MUL(Kind.OPERATION, 2, "MUL"),
  DIV(Kind.OPERATION, 2, "DIV"),
  UDIV(Kind.OPERATION, 2, "UDIV"),
  SDIV(Kind.OPERATION, 2, "SDIV"),
  SREM(Kind.OPERATION, 2, "SREM"),
  FMUL(Kind.OPERATION, 2, "FMUL"),
  FDIV(Kind.OPERATION, 2, "FDIV"),
  /** {@code value << amount}; the first child is the value, the second the shift amount. */
  SHL(Kind.OPERATION, 2, "SHL"),
  LSHR(Kind.OPERATION, 2, "LSHR"),
  /** The merge of a loop-carried variable's two incoming values. */
  PHI(Kind.OPERATION, 2, "PHI"),
  ICMP(Kind.OPERATION, 2, "ICMP"),
  FCMP(Kind.OPERATION, 2, "FCMP"),
  MEMOP(Kind.OPERATION, 1, "LOAD", "STORE"),
  ZEXT(Kind.OPERATION, 1, "ZEXT"),
  SEXT(Kind.OPERATION, 1, "SEXT"),
  FREEZE(Kind.OPERATION, 1, "FREEZE"),
  TRUNC(Kind.OPERATION, 1, "TRUNC"),
  FPTOSI(Kind.OPERATION, 1, "FPTOSI"),
  SITOFP(Kind.OPERATION, 1, "SITOFP"),
  UITOFP(Kind.OPERATION, 1, "UITOFP"),
  DOUBLE(Kind.OPERATION, 1, "double"),
  SELECT(Kind.OPERATION, 3, "SELECT"),
  ATOMICRMW(Kind.OPERATION, 2, "ATOMICRMW"),
  CALL(Kind.OPERATION, Op.VARIADIC, "CALL"),
  GEP(Kind.OPERATION, Op.VARIADIC, "GEP");

  /** Whether a tag needs operands. */
  public enum Kind {
    TERMINAL,
    OPERATION,
  }

  /** Arity of operations that take any number of operands. */
  public static final int VARIADIC = -1;

  private static final ImmutableMap<String, Op> KEYWORDS;

  static {
    ImmutableMap.Builder<String, Op> keywords = ImmutableMap.builder();
    for (Op op : values()) {
      for (String keyword : op.keywords) {
        keywords.put(keyword, op);
      }
    }
    KEYWORDS = keywords.buildOrThrow();
  }

  private final Kind kind;
  private final int arity;
  private final ImmutableList<String> keywords;

  Op(Kind kind, int arity, String... keywords) {
    this.kind = kind;
    this.arity = arity;
    this.keywords = ImmutableList.copyOf(keywords);
  }

  public Kind kind() {
    return kind;
  }

  public boolean isTerminal() {
    return kind == Kind.TERMINAL;
  }

  public boolean isOperation() {
    return kind == Kind.OPERATION;
  }

  /**
   * Returns the number of operands an operation takes, {@link #VARIADIC} if it takes any number,
   * or zero for a terminal.
   */
  public int arity() {
    return arity;
  }

  /** Reports whether this is a thread index or block index terminal. */
  public boolean isIndex() {
    return this == TIDX || this == TIDY || this == BIDX || this == BIDY;
  }

  /** Returns the keyword used to print this tag. */
  public String keyword() {
    return keywords.isEmpty() ? name() : keywords.get(0);
  }

  /**
   * Returns the tag named by a keyword, or null if there is none. Numeric literals, {@code ARG<n>}
   * and {@code PHI<n>} tokens are not keywords; see {@link Tokens#classify}.
   */
  @Nullable
  public static Op forKeyword(String keyword) {
    return KEYWORDS.get(keyword);
  }
}
