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
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;
import net.kernelwss.java.eval.LoopBounds;

/** A loop of a kernel as described by the device-side pass. */
@AutoValue
public abstract class LoopDescriptor implements LoopBounds {

  public abstract String kernel();

  @Override
  public abstract int loopId();

  @Override
  public abstract int parentLoopId();

  @Override
  public abstract ImmutableList<String> initial();

  @Override
  public abstract ImmutableList<String> fin();

  @Override
  public abstract ImmutableList<String> step();

  @Override
  @Nullable
  public abstract Long knownIterations();

  public static LoopDescriptor create(
      String kernel,
      int loopId,
      int parentLoopId,
      Iterable<String> initial,
      Iterable<String> fin,
      Iterable<String> step,
      @Nullable Long knownIterations) {
    return new AutoValue_LoopDescriptor(
        kernel,
        loopId,
        parentLoopId,
        ImmutableList.copyOf(initial),
        ImmutableList.copyOf(fin),
        ImmutableList.copyOf(step),
        knownIterations);
  }
}
