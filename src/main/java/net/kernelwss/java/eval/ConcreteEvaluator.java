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
package net.kernelwss.java.eval;

import com.google.common.base.Preconditions;
import com.google.common.flogger.GoogleLogger;
import java.util.BitSet;
import net.kernelwss.java.syntax.ExprNode;
import net.kernelwss.java.syntax.ExprTree;
import net.kernelwss.java.syntax.Op;

/**
 * ConcreteEvaluator reduces an expression tree to a single 64-bit integer.
 *
 * <p>Nodes are visited in reverse Polish order. Terminals take their value from a {@link
 * TerminalResolver}, falling back to the node's literal for constants and to {@link
 * AnalysisOptions#unresolvedBlockIndexValue} for block indices; any other unresolved terminal is an
 * error. Intermediate values are kept in a table private to one call, so a tree may be evaluated by
 * several threads at once.
 *
 * <p>Arithmetic is checked: overflow, division by zero and shift amounts outside {@code [0, 63]}
 * raise {@link EvaluationException} rather than wrapping.
 */
public final class ConcreteEvaluator {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final AnalysisOptions options;
  private final PhiPolicy phiPolicy;

  public ConcreteEvaluator(AnalysisOptions options, PhiPolicy phiPolicy) {
    this.options = Preconditions.checkNotNull(options);
    this.phiPolicy = Preconditions.checkNotNull(phiPolicy);
  }

  /** Returns an evaluator with default options that rejects phi nodes. */
  public static ConcreteEvaluator create() {
    return new ConcreteEvaluator(AnalysisOptions.DEFAULT, PhiPolicy.UNSUPPORTED);
  }

  /** Returns an evaluator like this one but with the given phi policy. */
  public ConcreteEvaluator withPhiPolicy(PhiPolicy phiPolicy) {
    return phiPolicy == this.phiPolicy ? this : new ConcreteEvaluator(options, phiPolicy);
  }

  public PhiPolicy phiPolicy() {
    return phiPolicy;
  }

  /** Evaluates the whole tree. */
  public long evaluate(ExprTree tree, TerminalResolver resolver) throws EvaluationException {
    return evaluate(tree, tree.root(), resolver);
  }

  /** Evaluates the subtree rooted at {@code from}. */
  public long evaluate(ExprTree tree, ExprNode from, TerminalResolver resolver)
      throws EvaluationException {
    long[] values = new long[tree.size()];
    BitSet reduced = new BitSet(tree.size());
    for (ExprNode node : tree.postOrder(from)) {
      long value;
      if (node.op().isTerminal()) {
        value = terminal(node, resolver);
      } else {
        for (int child : node.children()) {
          if (!reduced.get(child)) {
            throw EvaluationException.errorf(
                "operand %s of %s was not reduced", tree.node(child), node);
          }
        }
        value = operation(node, values);
      }
      logger.atFine().log("%s = %d", node, value);
      values[node.index()] = value;
      reduced.set(node.index());
    }
    return values[from.index()];
  }

  private long terminal(ExprNode node, TerminalResolver resolver) throws EvaluationException {
    if (node.op() == Op.PHI_TERM) {
      if (phiPolicy == PhiPolicy.UNSUPPORTED) {
        throw EvaluationException.errorf("phi %s cannot be evaluated here", node);
      }
      if (phiPolicy == PhiPolicy.ITERATION_ZERO) {
        return 0;
      }
    }
    Long value = resolver.resolve(node);
    if (value != null) {
      return value;
    }
    switch (node.op()) {
      case CONST:
      case INTERM:
        if (node.literal() != null) {
          return node.literal();
        }
        break;
      case BIDX:
      case BIDY:
        return options.unresolvedBlockIndexValue();
      default:
        break;
    }
    throw EvaluationException.errorf("no value for terminal %s", node);
  }

  private long operation(ExprNode node, long[] values) throws EvaluationException {
    Op op = node.op();
    switch (op) {
      case ZEXT:
      case SEXT:
      case FREEZE:
        checkOperands(node, 1);
        return values[node.children().get(0)];
      case ADD:
      case SUB:
      case MUL:
      case AND:
      case OR:
      case SHL:
      case LSHR:
      case DIV:
      case UDIV:
      case SDIV:
      case SREM:
      case PHI:
        checkOperands(node, 2);
        long x = values[node.children().get(0)];
        long y = values[node.children().get(1)];
        return binaryOp(node, x, y);
      default:
        throw EvaluationException.errorf("operator %s is not supported by the evaluator", node);
    }
  }

  private static void checkOperands(ExprNode node, int want) throws EvaluationException {
    if (node.children().size() != want) {
      throw EvaluationException.errorf(
          "%s has %d operands, want %d", node, node.children().size(), want);
    }
  }

  private long binaryOp(ExprNode node, long x, long y) throws EvaluationException {
    try {
      switch (node.op()) {
        case ADD:
          return Math.addExact(x, y);
        case SUB:
          return Math.subtractExact(x, y);
        case MUL:
          return Math.multiplyExact(x, y);
        case AND:
          return x & y;
        case OR:
          return x | y;
        case SHL:
          return shiftLeft(x, y);
        case LSHR:
          checkShift(y);
          return x >>> y;
        case DIV:
        case SDIV:
          checkDivisor(node, y);
          if (x == Long.MIN_VALUE && y == -1) {
            throw new ArithmeticException("long overflow");
          }
          return x / y;
        case UDIV:
          checkDivisor(node, y);
          return Long.divideUnsigned(x, y);
        case SREM:
          checkDivisor(node, y);
          return x % y;
        case PHI:
          if (phiPolicy == PhiPolicy.UNSUPPORTED) {
            throw EvaluationException.errorf("phi %s cannot be evaluated here", node);
          }
          return phiPolicy == PhiPolicy.LARGEST ? Math.max(x, y) : Math.min(x, y);
        default:
          throw new IllegalStateException("not a binary arithmetic operator: " + node.op());
      }
    } catch (ArithmeticException ex) {
      throw new EvaluationException(
          String.format("%s of %d and %d overflows", node.op().keyword(), x, y), ex);
    }
  }

  /** Returns {@code value << amount}, failing if bits are shifted out. */
  static long shiftLeft(long value, long amount) throws EvaluationException {
    checkShift(amount);
    long result = value << amount;
    if (result >> amount != value) {
      throw EvaluationException.errorf("%d << %d overflows", value, amount);
    }
    return result;
  }

  private static void checkShift(long amount) throws EvaluationException {
    if (amount < 0 || amount > 63) {
      throw EvaluationException.errorf("shift amount %d is outside [0, 63]", amount);
    }
  }

  private static void checkDivisor(ExprNode node, long divisor) throws EvaluationException {
    if (divisor == 0) {
      throw EvaluationException.errorf("%s: division by zero", node);
    }
  }
}
