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
import static org.junit.Assert.assertThrows;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import net.kernelwss.java.syntax.ExprTree;
import net.kernelwss.java.syntax.Op;
import net.kernelwss.java.syntax.ParseError;
import net.kernelwss.java.syntax.TreeBuilder;
import org.junit.Test;
import org.junit.runner.RunWith;

/** Tests of {@link ConcreteEvaluator}. */
@RunWith(TestParameterInjector.class)
public final class ConcreteEvaluatorTest {

  private ConcreteEvaluator evaluator = ConcreteEvaluator.create();

  private static ExprTree rpn(String line) throws ParseError.Exception {
    return TreeBuilder.create().parseRpn(line);
  }

  private long eval(String line) throws Exception {
    return evaluator.evaluate(rpn(line), TerminalResolver.EMPTY);
  }

  private String evalError(String line) throws Exception {
    ExprTree tree = rpn(line);
    return assertThrows(
            EvaluationException.class, () -> evaluator.evaluate(tree, TerminalResolver.EMPTY))
        .getMessage();
  }

  @Test
  public void testAddition() throws Exception {
    assertThat(eval("5 3 ADD")).isEqualTo(8);
  }

  enum Arithmetic {
    SUB("7 2 SUB", 5),
    MUL("6 7 MUL", 42),
    OR("5 2 OR", 7),
    AND("6 3 AND", 2),
    SHL("3 2 SHL", 12),
    LSHR("-1 60 LSHR", 15),
    DIV("7 2 DIV", 3),
    NEGATIVE_DIV("-7 2 DIV", -3),
    SDIV("-7 2 SDIV", -3),
    UDIV("-2 2 UDIV", Long.MAX_VALUE),
    SREM("7 3 SREM", 1),
    CASTS("4 ZEXT SEXT FREEZE", 4),
    NESTED("2 3 ADD 4 MUL 1 SUB", 19);

    final String expr;
    final long value;

    Arithmetic(String expr, long value) {
      this.expr = expr;
      this.value = value;
    }
  }

  @Test
  public void testArithmetic(@TestParameter Arithmetic c) throws Exception {
    assertThat(eval(c.expr)).isEqualTo(c.value);
  }

  @Test
  public void testUnresolvedBlockIndexDefaultsToOne() throws Exception {
    assertThat(eval("BIDX 4 MUL BIDY ADD")).isEqualTo(5);
    evaluator =
        new ConcreteEvaluator(
            AnalysisOptions.builder().unresolvedBlockIndexValue(3).build(), PhiPolicy.UNSUPPORTED);
    assertThat(eval("BIDX 4 MUL")).isEqualTo(12);
  }

  @Test
  public void testResolverTakesPrecedence() throws Exception {
    TerminalResolver resolver =
        node -> {
          switch (node.op()) {
            case BIDX:
              return 9L;
            case TIDX:
              return 31L;
            case CONST:
              return node.literal() + 1;
            default:
              return null;
          }
        };
    assertThat(evaluator.evaluate(rpn("BIDX 32 MUL TIDX ADD"), resolver)).isEqualTo(9 * 33 + 31);
  }

  @Test
  public void testLaunchResolver() throws Exception {
    KernelInvocation invocation =
        KernelInvocation.builder()
            .kernel("k")
            .launch(LaunchConfig.of(128, 2, 4, 1))
            .putArgument(1, 1000)
            .build();
    assertThat(evaluator.evaluate(rpn("ARG1 BDIMX ADD BDIMY MUL"), invocation.resolver()))
        .isEqualTo(2256);
    assertThat(
            assertThrows(
                    EvaluationException.class,
                    () -> evaluator.evaluate(rpn("ARG2"), invocation.resolver()))
                .getMessage())
        .isEqualTo("no value for terminal ARG2");
  }

  @Test
  public void testErrors() throws Exception {
    assertThat(evalError("TIDX")).isEqualTo("no value for terminal TIDX");
    assertThat(evalError("UNDEF 1 ADD")).isEqualTo("no value for terminal UNDEF");
    assertThat(evalError("1 2 ICMP")).isEqualTo("operator ICMP is not supported by the evaluator");
    assertThat(evalError("1 TRUNC")).isEqualTo("operator TRUNC is not supported by the evaluator");
    assertThat(evalError("1 0 DIV")).isEqualTo("DIV: division by zero");
    assertThat(evalError("1 0 SREM")).isEqualTo("SREM: division by zero");
    assertThat(evalError("1 64 SHL")).isEqualTo("shift amount 64 is outside [0, 63]");
    assertThat(evalError("1 -1 SHL")).isEqualTo("shift amount -1 is outside [0, 63]");
  }

  @Test
  public void testOverflowIsAnError() throws Exception {
    assertThat(evalError("9223372036854775807 1 ADD"))
        .isEqualTo("ADD of 9223372036854775807 and 1 overflows");
    assertThat(evalError("4611686018427387904 2 MUL"))
        .isEqualTo("MUL of 4611686018427387904 and 2 overflows");
    assertThat(evalError("3 62 SHL")).isEqualTo("3 << 62 overflows");
  }

  @Test
  public void testWrongOperandCountIsAnError() throws Exception {
    ExprTree tree = TreeBuilder.create().parsePrefix("( ADD ( 1 ) )");
    EvaluationException ex =
        assertThrows(
            EvaluationException.class, () -> evaluator.evaluate(tree, TerminalResolver.EMPTY));
    assertThat(ex).hasMessageThat().isEqualTo("ADD has 1 operands, want 2");
  }

  @Test
  public void testSubtree() throws Exception {
    ExprTree tree = rpn("2 3 MUL 4 ADD");
    assertThat(evaluator.evaluate(tree, tree.child(tree.root(), 0), TerminalResolver.EMPTY))
        .isEqualTo(6);
  }

  @Test
  public void testPhiPolicies() throws Exception {
    ExprTree tree = rpn("ARG0 PHI1 4 ADD PHI1");
    TerminalResolver resolver =
        node -> {
          switch (node.op()) {
            case ARG:
              return 10L;
            case PHI_TERM:
              return 20L;
            default:
              return null;
          }
        };

    assertThrows(EvaluationException.class, () -> evaluator.evaluate(tree, resolver));
    // The phi terminal is 0 at the first iteration whatever the resolver says.
    assertThat(evaluator.withPhiPolicy(PhiPolicy.ITERATION_ZERO).evaluate(tree, resolver))
        .isEqualTo(4);
    assertThat(evaluator.withPhiPolicy(PhiPolicy.LARGEST).evaluate(tree, resolver))
        .isEqualTo(24);
    assertThat(evaluator.withPhiPolicy(PhiPolicy.SMALLEST).evaluate(tree, resolver))
        .isEqualTo(10);
  }

  @Test
  public void testTreesCanBeEvaluatedRepeatedly() throws Exception {
    ExprTree tree = rpn("BIDX 4 MUL");
    assertThat(evaluator.evaluate(tree, node -> node.op() == Op.BIDX ? 2L : null)).isEqualTo(8);
    assertThat(evaluator.evaluate(tree, TerminalResolver.EMPTY)).isEqualTo(4);
  }
}
