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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import java.util.Map;
import javax.annotation.Nullable;

/** An in-memory {@link LoopTable} for tests. */
final class FakeLoops implements LoopTable {

  private static final Splitter SPACE = Splitter.on(' ').omitEmptyStrings();

  private final Map<Integer, LoopBounds> loops = new HashMap<>();
  private final Map<Integer, Integer> phis = new HashMap<>();

  /** Adds a loop whose bounds are reverse Polish strings; an empty step means the default. */
  @CanIgnoreReturnValue
  FakeLoops add(int loopId, int parentLoopId, String initial, String fin, String step) {
    loops.put(loopId, loop(loopId, parentLoopId, initial, fin, step, null));
    return this;
  }

  @CanIgnoreReturnValue
  FakeLoops addPhi(int phiId, int loopId) {
    phis.put(phiId, loopId);
    return this;
  }

  static LoopBounds loop(
      int loopId,
      int parentLoopId,
      String initial,
      String fin,
      String step,
      @Nullable Long knownIterations) {
    ImmutableList<String> in = ImmutableList.copyOf(SPACE.split(initial));
    ImmutableList<String> f = ImmutableList.copyOf(SPACE.split(fin));
    ImmutableList<String> s = ImmutableList.copyOf(SPACE.split(step));
    return new LoopBounds() {
      @Override
      public int loopId() {
        return loopId;
      }

      @Override
      public int parentLoopId() {
        return parentLoopId;
      }

      @Override
      public ImmutableList<String> initial() {
        return in;
      }

      @Override
      public ImmutableList<String> fin() {
        return f;
      }

      @Override
      public ImmutableList<String> step() {
        return s;
      }

      @Override
      @Nullable
      public Long knownIterations() {
        return knownIterations;
      }
    };
  }

  @Override
  @Nullable
  public LoopBounds loop(int loopId) {
    return loops.get(loopId);
  }

  @Override
  public int loopOfPhi(int phiId) {
    return phis.getOrDefault(phiId, 0);
  }
}
