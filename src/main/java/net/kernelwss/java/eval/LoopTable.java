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

import javax.annotation.Nullable;

/** Looks up loops by id, and the loop each phi belongs to. */
public interface LoopTable {

  /** A table with no loops. */
  LoopTable EMPTY =
      new LoopTable() {
        @Override
        @Nullable
        public LoopBounds loop(int loopId) {
          return null;
        }

        @Override
        public int loopOfPhi(int phiId) {
          return 0;
        }
      };

  /** Returns the loop with the given id, or null. */
  @Nullable
  LoopBounds loop(int loopId);

  /** Returns the id of the loop that carries the given phi, or 0 if it is unknown. */
  int loopOfPhi(int phiId);
}
