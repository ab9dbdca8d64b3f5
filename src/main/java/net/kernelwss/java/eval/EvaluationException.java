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
import com.google.errorprone.annotations.FormatMethod;
import com.google.errorprone.annotations.FormatString;
import javax.annotation.Nullable;

/**
 * An EvaluationException indicates that an expression tree could not be reduced to a number: a
 * terminal had no value, an operation has no arithmetic meaning here, the tree has the wrong shape,
 * or the arithmetic itself failed (overflow, division by zero, an out of range shift).
 */
public class EvaluationException extends Exception {

  /** Constructs an EvaluationException. Use {@link #errorf} if you want string formatting. */
  public EvaluationException(String message) {
    this(message, /* cause= */ null);
  }

  public EvaluationException(String message, @Nullable Throwable cause) {
    super(Preconditions.checkNotNull(message), cause);
  }

  /** Returns an EvaluationException whose message is formatted with {@link String#format}. */
  @FormatMethod
  public static EvaluationException errorf(@FormatString String format, Object... args) {
    return new EvaluationException(String.format(format, args));
  }
}
