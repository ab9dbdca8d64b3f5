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
package net.kernelwss.java.analysis;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import net.kernelwss.java.eval.AnalysisOptions;
import net.kernelwss.java.eval.BoundEstimator;
import net.kernelwss.java.eval.CoefficientExtractor;
import net.kernelwss.java.eval.ConcreteEvaluator;
import net.kernelwss.java.eval.Estimate;
import net.kernelwss.java.eval.EvaluationException;
import net.kernelwss.java.eval.KernelInvocation;
import net.kernelwss.java.eval.LaunchConfig;
import net.kernelwss.java.eval.LoopIterationSolver;
import net.kernelwss.java.eval.PhiPolicy;
import net.kernelwss.java.eval.TerminalResolver;
import net.kernelwss.java.syntax.ExprNode;
import net.kernelwss.java.syntax.ExprTree;
import net.kernelwss.java.syntax.Op;
import net.kernelwss.java.syntax.ParseError;
import net.kernelwss.java.syntax.TreeBuilder;
import net.kernelwss.java.syntax.TreeOptions;

/**
 * AccessAnalyzer computes, for every memory access of a launched kernel, how often it executes,
 * how its address moves with the block indices and loop iterations, and how many addresses it
 * spans. Each access is analyzed on its own; a failure is reported for that access only.
 */
public final class AccessAnalyzer {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final AnalysisContext context;
  private final ConcreteEvaluator evaluator;
  private final LoopIterationSolver loopSolver;
  private final BoundEstimator bounds;
  private final CoefficientExtractor coefficients;

  public AccessAnalyzer(
      AnalysisContext context, AnalysisOptions options, TreeOptions treeOptions) {
    this.context = Preconditions.checkNotNull(context);
    this.evaluator = new ConcreteEvaluator(options, PhiPolicy.ITERATION_ZERO);
    this.loopSolver = new LoopIterationSolver(new TreeBuilder(treeOptions), options);
    this.bounds = new BoundEstimator(options, loopSolver);
    this.coefficients = new CoefficientExtractor(evaluator);
  }

  public AccessAnalyzer(AnalysisContext context) {
    this(context, AnalysisOptions.DEFAULT, TreeOptions.DEFAULT);
  }

  /** Analyzes every access of the invoked kernel, in access id order. */
  public ImmutableList<AccessReport> analyze(KernelInvocation invocation) {
    ImmutableList.Builder<AccessReport> reports = ImmutableList.builder();
    int failed = 0;
    for (AccessDescriptor access : context.accesses(invocation.kernel())) {
      AccessReport report = analyze(access, invocation);
      if (report.status() == AccessReport.Status.INCOMPUTABLE) {
        failed++;
      }
      reports.add(report);
    }
    ImmutableList<AccessReport> result = reports.build();
    logger.atInfo().log(
        "%s: %d accesses, %d loops, %d incomputable",
        invocation.kernel(),
        result.size(),
        context.loops(invocation.kernel()).size(),
        failed);
    return result;
  }

  /** Analyzes one access for one launch. */
  public AccessReport analyze(AccessDescriptor access, KernelInvocation invocation) {
    AccessReport.Builder report =
        AccessReport.builder()
            .kernel(access.kernel())
            .accessId(access.accessId())
            .allocArg(access.allocArg());
    if (!access.errors().isEmpty()) {
      return incomputable(report, ParseError.toString(access.errors()));
    }
    ExprTree tree = access.tree();
    if (tree == null) {
      return incomputable(report, "no address expression");
    }
    if (tree.isPointerChase()) {
      return report.status(AccessReport.Status.POINTER_CHASE).build();
    }
    if (tree.isIncomplete()) {
      return incomputable(report, "incomplete address expression");
    }

    TerminalResolver resolver = invocation.resolver();
    Estimate count =
        threads(invocation)
            .times(loopSolver.nestedIterations(context, access.loopId(), resolver));
    if (!count.isComputable()) {
      return incomputable(report, count.reason());
    }
    report.executionCount(count);

    report.pdBidx(sum(tree, Op.BIDX, resolver));
    report.pdBidy(sum(tree, Op.BIDY, resolver));
    report.pdPhi(phiCoefficients(tree, resolver));
    report.phiContribution(phiContributions(tree, access.loopId(), resolver));

    if (!access.advancedErrors().isEmpty()) {
      logger.atWarning().log(
          "%s access %d: n-ary expression did not parse (%s); using the binary bounds",
          access.kernel(), access.accessId(), ParseError.toString(access.advancedErrors()));
    }
    ExprTree advanced = access.advancedTree();
    if (advanced != null && advanced.isIndirectAccess()) {
      report.indirect(true);
    } else if (advanced != null && advanced.isTrivial()) {
      report.workingSetSize(Estimate.of(1));
    } else {
      Estimate wss = bounds.workingSetSize(tree, invocation, context, access.loopId());
      if (!wss.isComputable()) {
        logger.atWarning().log(
            "%s access %d: working set is incomputable: %s",
            access.kernel(), access.accessId(), wss.reason());
      }
      report.workingSetSize(wss);
    }

    Long bytes = invocation.allocationSizes().get(access.allocArg());
    if (bytes != null && bytes > 0) {
      report.density((double) count.value() / bytes);
    }
    return report.build();
  }

  /** Returns the number of threads in the launch grid. */
  private Estimate threads(KernelInvocation invocation) {
    LaunchConfig launch = invocation.launch();
    try {
      long blocks =
          Math.multiplyExact(
              launch.gridX().resolve(evaluator, invocation.resolver()),
              launch.gridY().resolve(evaluator, invocation.resolver()));
      return Estimate.of(Math.multiplyExact(blocks, launch.threadsPerBlock()));
    } catch (EvaluationException ex) {
      return Estimate.incomputable(ex);
    } catch (ArithmeticException ex) {
      return Estimate.incomputable("thread count overflows");
    }
  }

  private Estimate sum(ExprTree tree, Op terminal, TerminalResolver resolver) {
    try {
      return Estimate.of(coefficients.sumCoefficients(tree, terminal, resolver));
    } catch (EvaluationException ex) {
      return Estimate.incomputable(ex);
    }
  }

  private Estimate phiCoefficients(ExprTree tree, TerminalResolver resolver) {
    long total = 0;
    try {
      for (ExprNode phi : tree.findAll(Op.PHI_TERM)) {
        total = Math.addExact(total, coefficients.phiCoefficient(tree, phi, resolver));
      }
    } catch (EvaluationException ex) {
      return Estimate.incomputable(ex);
    } catch (ArithmeticException ex) {
      return Estimate.incomputable("phi coefficients overflow");
    }
    return Estimate.of(total);
  }

  private Estimate phiContributions(ExprTree tree, int loopId, TerminalResolver resolver) {
    long total = 0;
    for (ExprNode phi : tree.findAll(Op.PHI_TERM)) {
      int phiLoop = phi.phiId() >= 0 ? context.loopOfPhi(phi.phiId()) : 0;
      LoopDescriptor loop = context.loop(phiLoop != 0 ? phiLoop : loopId);
      if (loop == null) {
        return Estimate.incomputable("phi " + phi + " is not carried by a known loop");
      }
      Estimate contribution =
          coefficients.phiContribution(tree, phi, resolver, loopSolver.iterations(loop, resolver));
      if (!contribution.isComputable()) {
        return contribution;
      }
      try {
        total = Math.addExact(total, contribution.value());
      } catch (ArithmeticException ex) {
        return Estimate.incomputable("phi contributions overflow");
      }
    }
    return Estimate.of(total);
  }

  private static AccessReport incomputable(AccessReport.Builder report, String reason) {
    AccessReport result = report.status(AccessReport.Status.INCOMPUTABLE).reason(reason).build();
    logger.atWarning().log(
        "%s access %d is incomputable: %s", result.kernel(), result.accessId(), reason);
    return result;
  }
}
