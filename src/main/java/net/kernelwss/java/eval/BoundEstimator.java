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
import java.util.HashMap;
import java.util.Map;
import net.kernelwss.java.syntax.ExprNode;
import net.kernelwss.java.syntax.ExprTree;

/**
 * BoundEstimator computes the largest and smallest value an address expression takes over all
 * threads of a launch.
 *
 * <p>Before evaluation every index terminal and phi terminal is given an extremal value:
 *
 * <ul>
 *   <li>for the maximum, a thread index is its block dimension minus one, a block index is its
 *       grid dimension minus one, and a phi terminal is the final bound of the loop that carries
 *       it;
 *   <li>for the minimum, indices are 0 and a phi terminal is {@link
 *       AnalysisOptions#minPhiTerminalValue}.
 * </ul>
 *
 * Everything else, argument references included, resolves through the launch. The results are
 * true bounds only when each index appears with a single sign of multiplicative context; for other
 * expressions they are an approximation.
 */
public final class BoundEstimator {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private enum Direction {
    MAX,
    MIN
  }

  private final AnalysisOptions options;
  private final ConcreteEvaluator evaluator;
  private final LoopIterationSolver loopSolver;

  public BoundEstimator(AnalysisOptions options, LoopIterationSolver loopSolver) {
    this.options = Preconditions.checkNotNull(options);
    this.evaluator = new ConcreteEvaluator(options, PhiPolicy.UNSUPPORTED);
    this.loopSolver = Preconditions.checkNotNull(loopSolver);
  }

  public static BoundEstimator create() {
    return new BoundEstimator(AnalysisOptions.DEFAULT, LoopIterationSolver.create());
  }

  /** Returns the largest value of {@code tree} for an access outside any loop. */
  public Estimate estimateMax(ExprTree tree, KernelInvocation invocation) {
    return estimateMax(tree, invocation, LoopTable.EMPTY, 0);
  }

  /**
   * Returns the largest value of {@code tree}. A phi terminal takes the final bound of its own loop
   * if the phi table knows it, else of {@code loopId}, the loop enclosing the access.
   */
  public Estimate estimateMax(
      ExprTree tree, KernelInvocation invocation, LoopTable loops, int loopId) {
    return estimate(Direction.MAX, tree, invocation, loops, loopId);
  }

  /** Returns the smallest value of {@code tree}. */
  public Estimate estimateMin(ExprTree tree, KernelInvocation invocation) {
    return estimate(Direction.MIN, tree, invocation, LoopTable.EMPTY, 0);
  }

  /** Returns the span of addresses the expression covers in one iteration, max minus min. */
  public Estimate workingSetSize(
      ExprTree tree, KernelInvocation invocation, LoopTable loops, int loopId) {
    return estimateMax(tree, invocation, loops, loopId).minus(estimateMin(tree, invocation));
  }

  private Estimate estimate(
      Direction direction,
      ExprTree tree,
      KernelInvocation invocation,
      LoopTable loops,
      int loopId) {
    if (tree.isPointerChase()) {
      return Estimate.incomputable("pointer chase");
    }
    if (tree.isIncomplete()) {
      return Estimate.incomputable("incomplete expression");
    }
    try {
      Map<Integer, Long> unknowns = unknowns(direction, tree, invocation, loops, loopId);
      TerminalResolver substituted = node -> unknowns.get(node.index());
      PhiPolicy policy = direction == Direction.MAX ? PhiPolicy.LARGEST : PhiPolicy.SMALLEST;
      long value =
          evaluator
              .withPhiPolicy(policy)
              .evaluate(tree, substituted.orElse(invocation.resolver()));
      logger.atFine().log("%s of %s is %d", direction, tree, value);
      return Estimate.of(value);
    } catch (EvaluationException ex) {
      logger.atFine().withCause(ex).log("no %s for %s", direction, tree);
      return Estimate.incomputable(ex);
    }
  }

  /** Assigns extremal values to the index and phi terminals of the tree, by node index. */
  private Map<Integer, Long> unknowns(
      Direction direction, ExprTree tree, KernelInvocation invocation, LoopTable loops, int loopId)
      throws EvaluationException {
    LaunchConfig launch = invocation.launch();
    Map<Integer, Long> unknowns = new HashMap<>();
    for (ExprNode node : tree.nodes()) {
      long value;
      switch (node.op()) {
        case TIDX:
          value = direction == Direction.MAX ? launch.blockX() - 1 : 0;
          break;
        case TIDY:
          value = direction == Direction.MAX ? launch.blockY() - 1 : 0;
          break;
        case BIDX:
          value = direction == Direction.MAX ? lastBlock(launch.gridX(), invocation) : 0;
          break;
        case BIDY:
          value = direction == Direction.MAX ? lastBlock(launch.gridY(), invocation) : 0;
          break;
        case PHI_TERM:
          value =
              direction == Direction.MAX
                  ? phiMax(node, invocation, loops, loopId)
                  : options.minPhiTerminalValue();
          break;
        default:
          continue;
      }
      logger.atFine().log("%s %s := %d", direction, node, value);
      unknowns.put(node.index(), value);
    }
    return unknowns;
  }

  private long lastBlock(GridDimension grid, KernelInvocation invocation)
      throws EvaluationException {
    return grid.resolve(evaluator, invocation.resolver()) - 1;
  }

  private long phiMax(ExprNode phi, KernelInvocation invocation, LoopTable loops, int loopId)
      throws EvaluationException {
    int id = phi.phiId() >= 0 ? loops.loopOfPhi(phi.phiId()) : 0;
    if (id == 0) {
      id = loopId;
    }
    if (id == 0) {
      return options.maxPhiTerminalFallback();
    }
    LoopBounds loop = loops.loop(id);
    if (loop == null) {
      throw EvaluationException.errorf("phi %s belongs to unknown loop %d", phi, id);
    }
    Estimate fin = loopSolver.finalValue(loop, invocation.resolver());
    if (!fin.isComputable()) {
      throw EvaluationException.errorf("phi %s: %s", phi, fin.reason());
    }
    return fin.value();
  }
}
