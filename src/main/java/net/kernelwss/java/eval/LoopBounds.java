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

import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/** The bounds of one loop inside a kernel, as token lists in reverse Polish form. */
public interface LoopBounds {

  /** The loop id, unique across kernels; never 0. */
  int loopId();

  /** The id of the enclosing loop, or 0 for an outermost loop. */
  int parentLoopId();

  ImmutableList<String> initial();

  ImmutableList<String> fin();

  /** The step; empty when the descriptor has none. */
  ImmutableList<String> step();

  /** The iteration count, if the device pass could determine it statically. */
  @Nullable
  Long knownIterations();
}
