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

/**
 * AnalysisOptions holds the values the evaluators fall back on when the launch configuration and
 * the kernel arguments say nothing about a terminal.
 */
@AutoValue
public abstract class AnalysisOptions {

  /** The default options. */
  public static final AnalysisOptions DEFAULT = builder().build();

  /** The value of a block index terminal that no resolver supplies. */
  public abstract long unresolvedBlockIndexValue();

  /** The value given to thread and block indices while a loop bound is solved. */
  public abstract long loopBoundIndexValue();

  /** The loop step used when a loop descriptor has no step expression. */
  public abstract long defaultLoopStep();

  /** The value of a phi terminal when the smallest address is estimated. */
  public abstract long minPhiTerminalValue();

  /**
   * The value of a phi terminal when the largest address is estimated and its loop is unknown.
   */
  public abstract long maxPhiTerminalFallback();

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_AnalysisOptions.Builder()
        .unresolvedBlockIndexValue(1)
        .loopBoundIndexValue(0)
        .defaultLoopStep(1)
        .minPhiTerminalValue(1)
        .maxPhiTerminalFallback(1);
  }

  public abstract Builder toBuilder();

  /** Builder for {@link AnalysisOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder unresolvedBlockIndexValue(long value);

    public abstract Builder loopBoundIndexValue(long value);

    public abstract Builder defaultLoopStep(long value);

    public abstract Builder minPhiTerminalValue(long value);

    public abstract Builder maxPhiTerminalFallback(long value);

    public abstract AnalysisOptions build();
  }
}
