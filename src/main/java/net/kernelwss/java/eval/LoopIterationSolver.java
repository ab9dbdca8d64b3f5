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
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.kernelwss.java.syntax.ExprTree;
import net.kernelwss.java.syntax.Op;
import net.kernelwss.java.syntax.ParseError;
import net.kernelwss.java.syntax.TreeBuilder;

/**
 * LoopIterationSolver counts the iterations of kernel loops.
 *
 * <p>A loop runs {@code (Final - Initial) / Step} times, in truncating integer arithmetic. The
 * bounds are evaluated with every thread and block index set to {@link
 * AnalysisOptions#loopBoundIndexValue}, that is, for the first thread of the first block. A loop
 * whose initial or final bound cannot be built or evaluated is incomputable; so is every loop
 * nested in it.
 */
public final class LoopIterationSolver {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final TreeBuilder treeBuilder;
  private final AnalysisOptions options;
  private final ConcreteEvaluator evaluator;

  public LoopIterationSolver(TreeBuilder treeBuilder, AnalysisOptions options) {
    this.treeBuilder = Preconditions.checkNotNull(treeBuilder);
    this.options = Preconditions.checkNotNull(options);
    this.evaluator = new ConcreteEvaluator(options, PhiPolicy.ITERATION_ZERO);
  }

  public static LoopIterationSolver create() {
    return new LoopIterationSolver(TreeBuilder.create(), AnalysisOptions.DEFAULT);
  }

  /**
   * Returns the tree {@code DIV(SUB(Final, Initial), Step)} for a loop. An empty step means {@link
   * AnalysisOptions#defaultLoopStep}.
   *
   * @throws ParseError.Exception if a bound is missing or malformed
   */
  public ExprTree iterationTree(LoopBounds loop) throws ParseError.Exception {
    ExprTree initial = bound("initial", loop.initial());
    ExprTree fin = bound("final", loop.fin());
    ExprTree step =
        loop.step().isEmpty()
            ? ExprTree.constant(options.defaultLoopStep())
            : bound("step", loop.step());
    return ExprTree.combine(Op.DIV, ExprTree.combine(Op.SUB, fin, initial), step);
  }

  private ExprTree bound(String what, List<String> tokens) throws ParseError.Exception {
    ExprTree tree = treeBuilder.parseRpn(tokens);
    if (tree == null) {
      throw new ParseError.Exception(
          ImmutableList.of(new ParseError(-1, "no " + what + " bound")));
    }
    return tree;
  }

  /** Returns the number of iterations of one loop, ignoring the loops around it. */
  public Estimate iterations(LoopBounds loop, TerminalResolver resolver) {
    if (loop.knownIterations() != null) {
      return Estimate.of(loop.knownIterations());
    }
    try {
      long n = evaluator.evaluate(iterationTree(loop), boundResolver(resolver));
      logger.atFine().log("loop %d runs %d times", loop.loopId(), n);
      return Estimate.of(n);
    } catch (ParseError.Exception ex) {
      return incomputable(loop, ParseError.toString(ex.errors()));
    } catch (EvaluationException ex) {
      return incomputable(loop, ex.getMessage());
    }
  }

  /** Returns the value of a loop's final bound. */
  public Estimate finalValue(LoopBounds loop, TerminalResolver resolver) {
    try {
      return Estimate.of(
          evaluator.evaluate(bound("final", loop.fin()), boundResolver(resolver)));
    } catch (ParseError.Exception ex) {
      return incomputable(loop, ParseError.toString(ex.errors()));
    } catch (EvaluationException ex) {
      return incomputable(loop, ex.getMessage());
    }
  }

  /**
   * Returns the number of times the body of loop {@code loopId} runs in one thread: the product of
   * its own iteration count and those of all enclosing loops. Loop id 0, meaning no loop, runs
   * once.
   */
  public Estimate nestedIterations(LoopTable loops, int loopId, TerminalResolver resolver) {
    Estimate total = Estimate.of(1);
    Set<Integer> seen = new HashSet<>();
    for (int id = loopId; id != 0; ) {
      if (!seen.add(id)) {
        return Estimate.incomputable("loop " + id + " encloses itself");
      }
      LoopBounds loop = loops.loop(id);
      if (loop == null) {
        return Estimate.incomputable("unknown loop " + id);
      }
      total = total.times(iterations(loop, resolver));
      if (!total.isComputable()) {
        return total;
      }
      id = loop.parentLoopId();
    }
    return total;
  }

  private TerminalResolver boundResolver(TerminalResolver resolver) {
    long index = options.loopBoundIndexValue();
    TerminalResolver indices = node -> node.op().isIndex() ? index : null;
    return indices.orElse(resolver);
  }

  private static Estimate incomputable(LoopBounds loop, String reason) {
    logger.atWarning().log("loop %d is incomputable: %s", loop.loopId(), reason);
    return Estimate.incomputable("loop " + loop.loopId() + ": " + reason);
  }
}
