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
import javax.annotation.Nullable;
import net.kernelwss.java.syntax.ExprTree;

/**
 * The extent of a launch grid along one axis: a number known when the kernel is launched, or an
 * expression over host values that is evaluated when the launch is analyzed.
 */
public final class GridDimension {

  private final long constant;
  @Nullable private final ExprTree expression;

  private GridDimension(long constant, @Nullable ExprTree expression) {
    this.constant = constant;
    this.expression = expression;
  }

  public static GridDimension of(long constant) {
    Preconditions.checkArgument(constant > 0, "grid dimension %s is not positive", constant);
    return new GridDimension(constant, null);
  }

  public static GridDimension of(ExprTree expression) {
    return new GridDimension(0, Preconditions.checkNotNull(expression));
  }

  public boolean isConstant() {
    return expression == null;
  }

  public long constant() {
    Preconditions.checkState(expression == null, "grid dimension is computed");
    return constant;
  }

  @Nullable
  public ExprTree expression() {
    return expression;
  }

  /**
   * Returns the number of blocks along this axis, evaluating the expression if there is one.
   * Loop-carried values in the expression take their first-iteration value.
   */
  public long resolve(ConcreteEvaluator evaluator, TerminalResolver resolver)
      throws EvaluationException {
    if (expression == null) {
      return constant;
    }
    long n = evaluator.withPhiPolicy(PhiPolicy.ITERATION_ZERO).evaluate(expression, resolver);
    if (n <= 0) {
      throw EvaluationException.errorf("grid dimension %s evaluates to %d", expression, n);
    }
    return n;
  }

  @Override
  public String toString() {
    return expression == null ? Long.toString(constant) : expression.toString();
  }
}
