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
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * An Estimate is the outcome of a per-access or per-loop computation: either a number, or the
 * reason the number could not be computed. Failures are values so that one access's problem never
 * aborts the analysis of its siblings.
 */
public final class Estimate {

  private final long value;
  @Nullable private final String reason; // non-null iff incomputable

  private Estimate(long value, @Nullable String reason) {
    this.value = value;
    this.reason = reason;
  }

  public static Estimate of(long value) {
    return new Estimate(value, null);
  }

  public static Estimate incomputable(String reason) {
    return new Estimate(0, Preconditions.checkNotNull(reason));
  }

  /** Returns an incomputable estimate describing the given exception. */
  public static Estimate incomputable(Exception ex) {
    return incomputable(ex.getMessage() != null ? ex.getMessage() : ex.toString());
  }

  public boolean isComputable() {
    return reason == null;
  }

  /**
   * Returns the number.
   *
   * @throws IllegalStateException if the estimate is incomputable
   */
  public long value() {
    Preconditions.checkState(reason == null, "incomputable: %s", reason);
    return value;
  }

  /** Returns why the estimate is incomputable, or null if it is not. */
  @Nullable
  public String reason() {
    return reason;
  }

  /** Returns {@code this - other}; incomputable if either is, or if the result overflows. */
  public Estimate minus(Estimate other) {
    if (!isComputable()) {
      return this;
    }
    if (!other.isComputable()) {
      return other;
    }
    try {
      return of(Math.subtractExact(value, other.value));
    } catch (ArithmeticException ex) {
      return incomputable(String.format("%d - %d overflows", value, other.value));
    }
  }

  /** Returns {@code this * other}; incomputable if either is, or if the result overflows. */
  public Estimate times(Estimate other) {
    if (!isComputable()) {
      return this;
    }
    if (!other.isComputable()) {
      return other;
    }
    try {
      return of(Math.multiplyExact(value, other.value));
    } catch (ArithmeticException ex) {
      return incomputable(String.format("%d * %d overflows", value, other.value));
    }
  }

  @Override
  public boolean equals(Object that) {
    if (!(that instanceof Estimate)) {
      return false;
    }
    Estimate e = (Estimate) that;
    return value == e.value && Objects.equals(reason, e.reason);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, reason);
  }

  @Override
  public String toString() {
    return reason == null ? Long.toString(value) : "incomputable(" + reason + ")";
  }
}
