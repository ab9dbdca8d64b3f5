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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import net.kernelwss.java.syntax.Op;
import net.kernelwss.java.syntax.Tokens;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link AnalysisContext}. */
@RunWith(JUnit4.class)
public final class AnalysisContextTest {

  private static LoopDescriptor loop(String kernel, int id, int parent) {
    return LoopDescriptor.create(
        kernel,
        id,
        parent,
        ImmutableList.of("0"),
        ImmutableList.of("10"),
        ImmutableList.of(),
        null);
  }

  @Test
  public void testLookups() {
    AnalysisContext context =
        AnalysisContext.builder()
            .addAccess("vecadd", 2, 1, 0, 0, 0, Tokens.split("TIDX"))
            .addAccess("vecadd", 1, 0, 7, 3, 1, Tokens.split("BIDX 4 MUL"))
            .addAccess("gemm", 1, 0, 0, 0, 0, Tokens.split("TIDY"))
            .addLoop(loop("gemm", 7, 0))
            .addLoop(loop("gemm", 8, 7))
            .addLoop(loop("stencil", 9, 0))
            .addPhi(4, 8)
            .build();

    assertThat(context.kernels()).containsExactly("gemm", "stencil", "vecadd").inOrder();
    assertThat(context.accesses("vecadd")).hasSize(2);
    assertThat(context.accesses("vecadd").get(0).accessId()).isEqualTo(1);
    assertThat(context.accesses("nothing")).isEmpty();

    AccessDescriptor access = context.access("vecadd", 1);
    assertThat(access.loopId()).isEqualTo(7);
    assertThat(access.ifId()).isEqualTo(3);
    assertThat(access.ifType()).isEqualTo(1);
    assertThat(access.tree().root().op()).isEqualTo(Op.MUL);
    assertThat(access.errors()).isEmpty();
    assertThat(access.advancedTree()).isNull();
    assertThat(context.access("vecadd", 3)).isNull();

    assertThat(context.loops("gemm")).hasSize(2);
    assertThat(context.loop(8).kernel()).isEqualTo("gemm");
    assertThat(context.parentLoop(8)).isEqualTo(7);
    assertThat(context.parentLoop(7)).isEqualTo(0);
    assertThat(context.parentLoop(99)).isEqualTo(0);
    assertThat(context.loopOfPhi(4)).isEqualTo(8);
    assertThat(context.loopOfPhi(5)).isEqualTo(0);
  }

  @Test
  public void testParseFailuresStayWithTheAccess() {
    AnalysisContext context =
        AnalysisContext.builder()
            .addAccess("k", 1, 0, 0, 0, 0, Tokens.split("3 FOOBAR"))
            .addAccessTree("k", 1, Tokens.split("( ADD ( 1 )"))
            .addAccess("k", 2, 0, 0, 0, 0, Tokens.split("1 2 ADD"))
            .addAccessTree("k", 2, Tokens.split("( ADD ( 1 ) ( 2 ) )"))
            .build();

    AccessDescriptor broken = context.access("k", 1);
    assertThat(broken.tree()).isNull();
    assertThat(broken.errors()).hasSize(1);
    assertThat(broken.advancedTree()).isNull();
    assertThat(broken.advancedErrors().get(0).message())
        .isEqualTo("'(' before ADD is never closed");

    AccessDescriptor fine = context.access("k", 2);
    assertThat(fine.advancedTree().toRpnString()).isEqualTo("1 2 ADD");
  }

  @Test
  public void testTreeWithoutAccessIsIgnored() {
    AnalysisContext context =
        AnalysisContext.builder().addAccessTree("k", 5, Tokens.split("( TIDX )")).build();
    assertThat(context.kernels()).isEmpty();
  }

  @Test
  public void testDuplicatesAreRejected() {
    AnalysisContext.Builder builder =
        AnalysisContext.builder()
            .addAccess("k", 1, 0, 0, 0, 0, Tokens.split("TIDX"))
            .addLoop(loop("k", 1, 0));
    assertThrows(
        IllegalArgumentException.class,
        () -> builder.addAccess("k", 1, 0, 0, 0, 0, Tokens.split("TIDX")));
    assertThrows(IllegalArgumentException.class, () -> builder.addLoop(loop("k", 1, 0)));
    assertThrows(IllegalArgumentException.class, () -> builder.addLoop(loop("k", 0, 0)));
  }
}
