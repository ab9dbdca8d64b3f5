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
import net.kernelwss.java.syntax.ExprNode;
import net.kernelwss.java.syntax.ExprTree;
import net.kernelwss.java.syntax.Op;

/**
 * CoefficientExtractor approximates how fast an address expression changes with one of its
 * terminals, its partial difference.
 *
 * <p>The walk goes from the terminal up to the root. Under a multiplication the other operand is a
 * multiplier; under a left shift of the walked value by {@code n} the multiplier is {@code 1 << n};
 * under a division, on either side, the other operand is a divisor. Other operations leave the
 * coefficient unchanged. The coefficient is the product of the multipliers divided by the product
 * of the divisors, exact for expressions affine in the terminal along the walked path.
 */
public final class CoefficientExtractor {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final ConcreteEvaluator evaluator;

  public CoefficientExtractor(ConcreteEvaluator evaluator) {
    this.evaluator = Preconditions.checkNotNull(evaluator);
  }

  /** Returns an extractor that gives loop-carried values their first-iteration value. */
  public static CoefficientExtractor create() {
    return new CoefficientExtractor(
        new ConcreteEvaluator(AnalysisOptions.DEFAULT, PhiPolicy.ITERATION_ZERO));
  }

  /**
   * Returns the coefficient of one occurrence of a terminal. Multipliers and divisors are
   * evaluated with {@code resolver}.
   *
   * @throws EvaluationException if a multiplier or divisor cannot be evaluated, the terminal is a
   *     shift amount, or the divisors multiply to zero
   */
  public long coefficient(ExprTree tree, ExprNode target, TerminalResolver resolver)
      throws EvaluationException {
    long multiplier = 1;
    long divisor = 1;
    ExprNode current = target;
    for (ExprNode parent = tree.parent(current); parent != null; parent = tree.parent(parent)) {
      boolean first = parent.children().get(0) == current.index();
      switch (parent.op()) {
        case MUL:
          multiplier = multiply(multiplier, other(tree, parent, current, resolver));
          break;
        case SHL:
          if (!first) {
            throw EvaluationException.errorf(
                "%s is a shift amount in %s; the expression is not affine in it", target, parent);
          }
          long amount = evaluator.evaluate(tree, tree.child(parent, 1), resolver);
          multiplier = multiply(multiplier, ConcreteEvaluator.shiftLeft(1, amount));
          break;
        case DIV:
        case UDIV:
        case SDIV:
          divisor = multiply(divisor, other(tree, parent, current, resolver));
          break;
        default:
          break;
      }
      current = parent;
    }
    if (divisor == 0) {
      throw EvaluationException.errorf("coefficient of %s divides by zero", target);
    }
    logger.atFine().log("d/d%s = %d / %d", target, multiplier, divisor);
    return multiplier / divisor;
  }

  /**
   * Returns the sum of the coefficients of every occurrence of a terminal tag, or 0 if the tag does
   * not occur.
   */
  public long sumCoefficients(ExprTree tree, Op terminal, TerminalResolver resolver)
      throws EvaluationException {
    long sum = 0;
    for (ExprNode node : tree.findAll(terminal)) {
      long c = coefficient(tree, node, resolver);
      try {
        sum = Math.addExact(sum, c);
      } catch (ArithmeticException ex) {
        throw new EvaluationException("sum of coefficients of " + terminal + " overflows", ex);
      }
    }
    return sum;
  }

  /**
   * Returns the merge of a phi terminal: its nearest {@link Op#PHI} ancestor.
   *
   * @throws EvaluationException if the phi terminal has no merge
   */
  public static ExprNode merge(ExprTree tree, ExprNode phiTerminal) throws EvaluationException {
    Preconditions.checkArgument(phiTerminal.op() == Op.PHI_TERM, "%s is not a phi", phiTerminal);
    for (ExprNode n = tree.parent(phiTerminal); n != null; n = tree.parent(n)) {
      if (n.op() == Op.PHI) {
        return n;
      }
    }
    throw EvaluationException.errorf("phi %s has no merge", phiTerminal);
  }

  /**
   * Returns the amount a loop-carried value grows by in one iteration: the sum of the other addends
   * on the path from the phi terminal up to its merge.
   *
   * @throws EvaluationException if the path contains anything but additions, or an addend cannot be
   *     evaluated
   */
  public long phiStride(ExprTree tree, ExprNode phiTerminal, TerminalResolver resolver)
      throws EvaluationException {
    ExprNode merge = merge(tree, phiTerminal);
    long stride = 0;
    ExprNode current = phiTerminal;
    for (ExprNode parent = tree.parent(current); parent != merge; parent = tree.parent(parent)) {
      if (parent.op() != Op.ADD) {
        throw EvaluationException.errorf(
            "phi %s is updated by %s; only additions are understood", phiTerminal, parent);
      }
      try {
        stride = Math.addExact(stride, other(tree, parent, current, resolver));
      } catch (ArithmeticException ex) {
        throw new EvaluationException("stride of " + phiTerminal + " overflows", ex);
      }
      current = parent;
    }
    return stride;
  }

  /**
   * Returns the rate at which the address moves per iteration of the loop carrying {@code
   * phiTerminal}: the coefficient of its merge times its stride.
   */
  public long phiCoefficient(ExprTree tree, ExprNode phiTerminal, TerminalResolver resolver)
      throws EvaluationException {
    long stride = phiStride(tree, phiTerminal, resolver);
    return multiply(coefficient(tree, merge(tree, phiTerminal), resolver), stride);
  }

  /**
   * Returns how far the address moves over all {@code iterations} of the loop carrying {@code
   * phiTerminal}.
   */
  public Estimate phiContribution(
      ExprTree tree, ExprNode phiTerminal, TerminalResolver resolver, Estimate iterations) {
    try {
      return Estimate.of(phiCoefficient(tree, phiTerminal, resolver)).times(iterations);
    } catch (EvaluationException ex) {
      return Estimate.incomputable(ex);
    }
  }

  private long other(ExprTree tree, ExprNode parent, ExprNode current, TerminalResolver resolver)
      throws EvaluationException {
    int i = parent.children().get(0) == current.index() ? 1 : 0;
    return evaluator.evaluate(tree, tree.child(parent, i), resolver);
  }

  private static long multiply(long x, long y) throws EvaluationException {
    try {
      return Math.multiplyExact(x, y);
    } catch (ArithmeticException ex) {
      throw new EvaluationException(String.format("%d * %d overflows", x, y), ex);
    }
  }
}
