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

/**
 * PhiPolicy says how the concrete evaluator treats the two roles of a loop-carried value.
 *
 * <p>A merge has two operands, the incoming value (which contains the phi terminal) and the value
 * carried around the loop. Picking one of them is sound only for loops with two paths whose
 * carried value changes monotonically; nothing here checks that.
 */
public enum PhiPolicy {
  /** Phi nodes are an error. */
  UNSUPPORTED,

  /** Value at the first iteration: the phi terminal is 0 and a merge takes the smaller operand. */
  ITERATION_ZERO,

  /** The phi terminal comes from the resolver; a merge takes the larger operand. */
  LARGEST,

  /** The phi terminal comes from the resolver; a merge takes the smaller operand. */
  SMALLEST,
}
