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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import javax.annotation.Nullable;
import net.kernelwss.java.syntax.ExprNode;

/**
 * One launch of a kernel as seen by the host: its launch configuration, the host values of its
 * scalar arguments, and the sizes of the buffers passed as pointer arguments.
 */
@AutoValue
public abstract class KernelInvocation {

  /** The value of {@link #loopInductionArg} when the launch is not driven by a host loop. */
  public static final int NO_INDUCTION_ARG = -1;

  public abstract String kernel();

  public abstract LaunchConfig launch();

  /** Host values of scalar arguments, by argument index. */
  public abstract ImmutableMap<Integer, Long> argumentValues();

  /** Allocation sizes in bytes of pointer arguments, by argument index. */
  public abstract ImmutableMap<Integer, Long> allocationSizes();

  /**
   * The index of the argument that carries the host loop induction variable, or {@link
   * #NO_INDUCTION_ARG}.
   */
  public abstract int loopInductionArg();

  /**
   * Returns a resolver for the terminals this launch determines: argument references and block
   * dimensions.
   */
  public TerminalResolver resolver() {
    return this::resolve;
  }

  @Nullable
  private Long resolve(ExprNode node) {
    switch (node.op()) {
      case ARG:
        return argumentValues().get(node.argIndex());
      case BDIMX:
        return launch().blockX();
      case BDIMY:
        return launch().blockY();
      default:
        return null;
    }
  }

  public static Builder builder() {
    return new AutoValue_KernelInvocation.Builder().loopInductionArg(NO_INDUCTION_ARG);
  }

  /** Builder for {@link KernelInvocation}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder kernel(String value);

    public abstract Builder launch(LaunchConfig value);

    public abstract Builder loopInductionArg(int value);

    abstract ImmutableMap.Builder<Integer, Long> argumentValuesBuilder();

    abstract ImmutableMap.Builder<Integer, Long> allocationSizesBuilder();

    @CanIgnoreReturnValue
    public Builder putArgument(int argIndex, long value) {
      argumentValuesBuilder().put(argIndex, value);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder putAllocationSize(int argIndex, long bytes) {
      allocationSizesBuilder().put(argIndex, bytes);
      return this;
    }

    public abstract KernelInvocation build();
  }
}
