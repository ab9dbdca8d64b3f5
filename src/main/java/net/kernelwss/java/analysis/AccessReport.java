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

import com.google.auto.value.AutoValue;
import java.util.Locale;
import javax.annotation.Nullable;
import net.kernelwss.java.eval.Estimate;

/** What the analysis of one launch found out about one memory access. */
@AutoValue
public abstract class AccessReport {

  /** How far the analysis of an access got. */
  public enum Status {
    /** The access was analyzed; individual figures may still be incomputable. */
    OK,
    /** The address expression is too large to analyze. */
    POINTER_CHASE,
    /** The expression or its execution count could not be determined; see {@link #reason}. */
    INCOMPUTABLE,
  }

  public abstract String kernel();

  public abstract int accessId();

  public abstract int allocArg();

  public abstract Status status();

  /** Why the access is incomputable, or null. */
  @Nullable
  public abstract String reason();

  /** How many times the access executes in the launch, over all threads and loop iterations. */
  @Nullable
  public abstract Estimate executionCount();

  /** The sum of the coefficients of the block index x occurrences. */
  @Nullable
  public abstract Estimate pdBidx();

  /** The sum of the coefficients of the block index y occurrences. */
  @Nullable
  public abstract Estimate pdBidy();

  /** How far the address moves per iteration of the loops carrying its phis. */
  @Nullable
  public abstract Estimate pdPhi();

  /** How far the address moves over all iterations of the loops carrying its phis. */
  @Nullable
  public abstract Estimate phiContribution();

  /** Whether the address depends on a value loaded from memory. */
  public abstract boolean indirect();

  /** The working-set size in address units, or null for an indirect access. */
  @Nullable
  public abstract Estimate workingSetSize();

  /**
   * Executions per byte of the accessed allocation, or null if the size or count is unknown.
   */
  @Nullable
  public abstract Double density();

  /** Returns a one-line summary. */
  public String format() {
    StringBuilder buf = new StringBuilder();
    buf.append(kernel()).append(" access ").append(accessId()).append(" arg ").append(allocArg());
    buf.append(' ').append(status());
    if (status() != Status.OK) {
      if (reason() != null) {
        buf.append(": ").append(reason());
      }
      return buf.toString();
    }
    buf.append(" count=").append(executionCount());
    buf.append(" pd_bidx=").append(pdBidx());
    buf.append(" pd_bidy=").append(pdBidy());
    buf.append(" pd_phi=").append(pdPhi());
    buf.append(" phi=").append(phiContribution());
    buf.append(" wss=").append(indirect() ? "indirect" : workingSetSize());
    if (density() != null) {
      buf.append(String.format(Locale.ROOT, " density=%.6f", density()));
    }
    return buf.toString();
  }

  public static Builder builder() {
    return new AutoValue_AccessReport.Builder().status(Status.OK).indirect(false);
  }

  /** Builder for {@link AccessReport}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder kernel(String value);

    public abstract Builder accessId(int value);

    public abstract Builder allocArg(int value);

    public abstract Builder status(Status value);

    public abstract Builder reason(@Nullable String value);

    public abstract Builder executionCount(@Nullable Estimate value);

    public abstract Builder pdBidx(@Nullable Estimate value);

    public abstract Builder pdBidy(@Nullable Estimate value);

    public abstract Builder pdPhi(@Nullable Estimate value);

    public abstract Builder phiContribution(@Nullable Estimate value);

    public abstract Builder indirect(boolean value);

    public abstract Builder workingSetSize(@Nullable Estimate value);

    public abstract Builder density(@Nullable Double value);

    public abstract AccessReport build();
  }
}
