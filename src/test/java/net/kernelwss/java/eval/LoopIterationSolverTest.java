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

import static com.google.common.truth.Truth.assertThat;

import net.kernelwss.java.syntax.TreeBuilder;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link LoopIterationSolver}. */
@RunWith(JUnit4.class)
public final class LoopIterationSolverTest {

  private final LoopIterationSolver solver = LoopIterationSolver.create();

  private final KernelInvocation invocation =
      KernelInvocation.builder()
          .kernel("k")
          .launch(LaunchConfig.of(32, 1, 4, 1))
          .putArgument(1, 100)
          .build();

  private Estimate iterations(String initial, String fin, String step) {
    return solver.iterations(
        FakeLoops.loop(1, 0, initial, fin, step, null), invocation.resolver());
  }

  @Test
  public void testIterationCount() {
    assertThat(iterations("0", "10", "2")).isEqualTo(Estimate.of(5));
    assertThat(iterations("0", "11", "2")).isEqualTo(Estimate.of(5));
    assertThat(iterations("3", "ARG1", "4")).isEqualTo(Estimate.of(24));
  }

  @Test
  public void testIterationTree() throws Exception {
    assertThat(solver.iterationTree(FakeLoops.loop(1, 0, "0", "10", "2", null)).toRpnString())
        .isEqualTo("10 0 SUB 2 DIV");
  }

  @Test
  public void testEmptyStepIsDefault() throws Exception {
    assertThat(iterations("0", "10", "")).isEqualTo(Estimate.of(10));
    LoopIterationSolver coarse =
        new LoopIterationSolver(
            TreeBuilder.create(), AnalysisOptions.builder().defaultLoopStep(5).build());
    assertThat(
            coarse.iterations(FakeLoops.loop(1, 0, "0", "10", "", null), invocation.resolver()))
        .isEqualTo(Estimate.of(2));
  }

  @Test
  public void testIndicesAreZeroInBounds() {
    assertThat(iterations("TIDX", "BIDX 10 ADD", "1")).isEqualTo(Estimate.of(10));
  }

  @Test
  public void testKnownIterations() {
    Estimate n =
        solver.iterations(FakeLoops.loop(1, 0, "", "", "", 7L), invocation.resolver());
    assertThat(n).isEqualTo(Estimate.of(7));
  }

  @Test
  public void testMissingOrMalformedBoundsAreIncomputable() {
    Estimate n = iterations("", "10", "1");
    assertThat(n.isComputable()).isFalse();
    assertThat(n.reason()).isEqualTo("loop 1: no initial bound");

    n = iterations("0", "", "1");
    assertThat(n.reason()).isEqualTo("loop 1: no final bound");

    n = iterations("0", "10 FOO", "1");
    assertThat(n.reason()).isEqualTo("loop 1: token 1: unknown operator 'FOO'");

    n = iterations("0", "ARG9", "1");
    assertThat(n.reason()).isEqualTo("loop 1: no value for terminal ARG9");

    n = iterations("0", "10", "0");
    assertThat(n.reason()).isEqualTo("loop 1: DIV: division by zero");
  }

  @Test
  public void testFinalValue() {
    assertThat(
            solver.finalValue(FakeLoops.loop(1, 0, "0", "ARG1 2 MUL", "1", null),
                invocation.resolver()))
        .isEqualTo(Estimate.of(200));
  }

  @Test
  public void testNestedLoopsMultiply() {
    FakeLoops loops = new FakeLoops().add(1, 0, "0", "3", "1").add(2, 1, "0", "10", "2");
    assertThat(solver.nestedIterations(loops, 2, invocation.resolver()))
        .isEqualTo(Estimate.of(15));
    assertThat(solver.nestedIterations(loops, 1, invocation.resolver()))
        .isEqualTo(Estimate.of(3));
    assertThat(solver.nestedIterations(loops, 0, invocation.resolver()))
        .isEqualTo(Estimate.of(1));
  }

  @Test
  public void testIncomputableAncestor() {
    FakeLoops loops = new FakeLoops().add(1, 0, "", "3", "1").add(2, 1, "0", "10", "2");
    Estimate n = solver.nestedIterations(loops, 2, invocation.resolver());
    assertThat(n.isComputable()).isFalse();
    assertThat(n.reason()).isEqualTo("loop 1: no initial bound");
  }

  @Test
  public void testBrokenParentChains() {
    FakeLoops cycle = new FakeLoops().add(1, 2, "0", "3", "1").add(2, 1, "0", "3", "1");
    assertThat(solver.nestedIterations(cycle, 1, invocation.resolver()).reason())
        .isEqualTo("loop 1 encloses itself");

    FakeLoops orphan = new FakeLoops().add(2, 5, "0", "3", "1");
    assertThat(solver.nestedIterations(orphan, 2, invocation.resolver()).reason())
        .isEqualTo("unknown loop 5");
  }
}
