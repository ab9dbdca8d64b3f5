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

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import net.kernelwss.java.analysis.AccessReport.Status;
import net.kernelwss.java.eval.Estimate;
import net.kernelwss.java.eval.KernelInvocation;
import net.kernelwss.java.eval.LaunchConfig;
import net.kernelwss.java.syntax.Tokens;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link AccessAnalyzer}. */
@RunWith(JUnit4.class)
public final class AccessAnalyzerTest {

  private final AnalysisContext.Builder context = AnalysisContext.builder();
  private final TestLoggingHandler loggingHandler = new TestLoggingHandler();
  private final Logger analyzerLogger = Logger.getLogger(AccessAnalyzer.class.getName());

  @Before
  public void addLoggingHandler() {
    analyzerLogger.addHandler(loggingHandler);
  }

  @After
  public void removeLoggingHandler() {
    analyzerLogger.removeHandler(loggingHandler);
  }

  private static final KernelInvocation LAUNCH =
      KernelInvocation.builder()
          .kernel("k")
          .launch(LaunchConfig.of(32, 1, 10, 1))
          .putArgument(0, 0)
          .putAllocationSize(0, 4096)
          .build();

  private void access(int id, int allocArg, int loopId, String rpn) {
    context.addAccess("k", id, allocArg, loopId, 0, 0, Tokens.split(rpn));
  }

  private void loop(int id, int parent, String in, String fin, String step) {
    context.addLoop(
        LoopDescriptor.create(
            "k", id, parent, Tokens.split(in), Tokens.split(fin), Tokens.split(step), null));
  }

  private AccessReport analyze(int accessId) {
    AnalysisContext built = context.build();
    return new AccessAnalyzer(built).analyze(built.access("k", accessId), LAUNCH);
  }

  @Test
  public void testAccessesAreAnalyzedIndependently() {
    access(1, 0, 0, "BIDX 4 MUL");
    access(2, 1, 0, "3 FOOBAR");
    access(3, 0, 0, "1" + String.join("", Collections.nCopies(25, " 1 ADD")));

    AccessAnalyzer analyzer = new AccessAnalyzer(context.build());
    List<AccessReport> reports = analyzer.analyze(LAUNCH);
    assertThat(reports).hasSize(3);

    AccessReport ok = reports.get(0);
    assertThat(ok.accessId()).isEqualTo(1);
    assertThat(ok.status()).isEqualTo(Status.OK);
    assertThat(ok.executionCount()).isEqualTo(Estimate.of(320));
    assertThat(ok.pdBidx()).isEqualTo(Estimate.of(4));
    assertThat(ok.pdBidy()).isEqualTo(Estimate.of(0));
    assertThat(ok.pdPhi()).isEqualTo(Estimate.of(0));
    assertThat(ok.phiContribution()).isEqualTo(Estimate.of(0));
    assertThat(ok.indirect()).isFalse();
    assertThat(ok.workingSetSize()).isEqualTo(Estimate.of(36));
    assertThat(ok.density()).isWithin(1e-12).of(320.0 / 4096);
    assertThat(ok.format())
        .isEqualTo(
            "k access 1 arg 0 OK count=320 pd_bidx=4 pd_bidy=0 pd_phi=0 phi=0 wss=36"
                + " density=0.078125");

    AccessReport malformed = reports.get(1);
    assertThat(malformed.status()).isEqualTo(Status.INCOMPUTABLE);
    assertThat(malformed.reason()).isEqualTo("token 1: unknown operator 'FOOBAR'");
    assertThat(malformed.executionCount()).isNull();
    assertThat(malformed.format())
        .isEqualTo("k access 2 arg 1 INCOMPUTABLE: token 1: unknown operator 'FOOBAR'");

    AccessReport chase = reports.get(2);
    assertThat(chase.status()).isEqualTo(Status.POINTER_CHASE);
    assertThat(chase.workingSetSize()).isNull();
  }

  @Test
  public void testExecutionCountIncludesNestedLoops() {
    loop(1, 0, "0", "10", "2");
    loop(2, 1, "0", "3", "1");
    access(1, 0, 2, "TIDX 4 MUL");
    access(2, 0, 1, "TIDX 4 MUL");

    assertThat(analyze(1).executionCount()).isEqualTo(Estimate.of(320 * 15));
    assertThat(analyze(2).executionCount()).isEqualTo(Estimate.of(320 * 5));
  }

  @Test
  public void testIncomputableLoopMakesAccessIncomputable() {
    loop(3, 0, "0", "ARG9", "1");
    access(1, 0, 3, "TIDX 4 MUL");

    AccessReport report = analyze(1);
    assertThat(report.status()).isEqualTo(Status.INCOMPUTABLE);
    assertThat(report.reason()).isEqualTo("loop 3: no value for terminal ARG9");
  }

  @Test
  public void testMissingExpression() {
    access(1, 0, 0, "");
    AccessReport report = analyze(1);
    assertThat(report.status()).isEqualTo(Status.INCOMPUTABLE);
    assertThat(report.reason()).isEqualTo("no address expression");
  }

  @Test
  public void testIncompleteExpression() {
    access(1, 0, 0, "INCOMP");
    assertThat(analyze(1).status()).isEqualTo(Status.INCOMPUTABLE);
  }

  @Test
  public void testIndirectAccessHasNoWorkingSet() {
    access(1, 0, 0, "TIDX 4 MUL");
    context.addAccessTree(
        "k", 1, Tokens.split("( GEP ( LOAD ( GEP ( ARG0 ) ( TIDX ) ) ) ( LOAD ( ARG1 ) ) )"));

    AccessReport report = analyze(1);
    assertThat(report.status()).isEqualTo(Status.OK);
    assertThat(report.indirect()).isTrue();
    assertThat(report.workingSetSize()).isNull();
    assertThat(report.format()).contains("wss=indirect");
  }

  @Test
  public void testTrivialAccessTouchesOneElement() {
    access(1, 0, 0, "TIDX 4 MUL");
    context.addAccessTree("k", 1, Tokens.split("( LOAD ( ARG0 ) )"));
    assertThat(analyze(1).workingSetSize()).isEqualTo(Estimate.of(1));
  }

  @Test
  public void testDirectAccessTreeUsesBounds() {
    access(1, 0, 0, "TIDX 4 MUL");
    context.addAccessTree("k", 1, Tokens.split("( LOAD ( GEP ( ARG0 ) ( TIDX ) ) )"));
    assertThat(analyze(1).workingSetSize()).isEqualTo(Estimate.of(124));
  }

  @Test
  public void testUnparsedAccessTreeFallsBackToBounds() {
    access(1, 0, 0, "TIDX 4 MUL");
    context.addAccessTree("k", 1, Tokens.split("( LOAD ( FOOBAR ) )"));

    AccessReport report = analyze(1);
    assertThat(report.status()).isEqualTo(Status.OK);
    assertThat(report.workingSetSize()).isEqualTo(Estimate.of(124));
    assertThat(loggingHandler.warnings).hasSize(1);
    assertThat(loggingHandler.warnings.get(0))
        .startsWith("k access 1: n-ary expression did not parse (");
    assertThat(loggingHandler.warnings.get(0)).endsWith("); using the binary bounds");
  }

  @Test
  public void testLoopCarriedAddress() {
    loop(1, 0, "0", "10", "1");
    context.addPhi(1, 1);
    access(1, 0, 1, "ARG0 PHI1 4 ADD PHI1 8 MUL");

    AccessReport report = analyze(1);
    assertThat(report.status()).isEqualTo(Status.OK);
    assertThat(report.executionCount()).isEqualTo(Estimate.of(3200));
    assertThat(report.pdPhi()).isEqualTo(Estimate.of(32));
    assertThat(report.phiContribution()).isEqualTo(Estimate.of(320));
    // max: PHI1 := 10, (10 + 4) * 8; min: the merge keeps the incoming 0.
    assertThat(report.workingSetSize()).isEqualTo(Estimate.of(112));
  }

  @Test
  public void testPhiOutsideKnownLoop() {
    access(1, 0, 0, "ARG0 PHI1 4 ADD PHI1");
    AccessReport report = analyze(1);
    assertThat(report.status()).isEqualTo(Status.OK);
    assertThat(report.pdPhi()).isEqualTo(Estimate.of(4));
    assertThat(report.phiContribution().isComputable()).isFalse();
  }

  @Test
  public void testUnknownKernelHasNoReports() {
    access(1, 0, 0, "TIDX");
    KernelInvocation other =
        KernelInvocation.builder().kernel("other").launch(LaunchConfig.of(1, 1, 1, 1)).build();
    assertThat(new AccessAnalyzer(context.build()).analyze(other)).isEmpty();
  }

  @Test
  public void testDensityNeedsAllocationSize() {
    access(1, 3, 0, "TIDX");
    assertThat(analyze(1).density()).isNull();
  }

  private static final class TestLoggingHandler extends Handler {
    final List<String> warnings = new ArrayList<>();

    @Override
    public void publish(LogRecord record) {
      if (record.getLevel().equals(Level.WARNING)) {
        warnings.add(record.getMessage());
      }
    }

    @Override
    public void flush() {}

    @Override
    public void close() {}
  }
}
