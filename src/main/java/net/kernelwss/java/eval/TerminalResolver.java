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
import net.kernelwss.java.syntax.ExprNode;

/**
 * A TerminalResolver supplies the value of terminal nodes during evaluation. Returning null defers
 * to the evaluator's built-in fallbacks for the node's tag.
 */
@FunctionalInterface
public interface TerminalResolver {

  /** A resolver that knows nothing. */
  TerminalResolver EMPTY = node -> null;

  @Nullable
  Long resolve(ExprNode node) throws EvaluationException;

  /** Returns a resolver that consults this one, then {@code next} if this one has no value. */
  default TerminalResolver orElse(TerminalResolver next) {
    return node -> {
      Long value = resolve(node);
      return value != null ? value : next.resolve(node);
    };
  }
}
