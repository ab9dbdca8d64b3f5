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
package net.kernelwss.java.syntax;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.FormatMethod;
import java.util.List;

/**
 * A ParseError describes a problem found while building an expression tree from its token form,
 * such as an unknown operator keyword or an operation with too few operands. The position is the
 * index of the offending token, or -1 when the problem concerns the token list as a whole.
 */
public final class ParseError {

  private final int position;
  private final String message;

  public ParseError(int position, String message) {
    this.position = position;
    this.message = Preconditions.checkNotNull(message);
  }

  @FormatMethod
  static ParseError of(int position, String format, Object... args) {
    return new ParseError(position, String.format(format, args));
  }

  /** Returns the index of the offending token, or -1. */
  public int position() {
    return position;
  }

  /** Returns a description of the problem. */
  public String message() {
    return message;
  }

  @Override
  public String toString() {
    return position < 0 ? message : "token " + position + ": " + message;
  }

  /**
   * Returns a string joining the errors, one per line, in the form they would be reported to a
   * user.
   */
  public static String toString(List<ParseError> errors) {
    return Joiner.on('\n').join(errors);
  }

  /** A ParseError.Exception is an exception holding one or more parse errors. */
  public static final class Exception extends java.lang.Exception {

    private final ImmutableList<ParseError> errors;

    /** Constructs an exception from a non-empty list of errors. */
    public Exception(List<ParseError> errors) {
      super(errors.isEmpty() ? "no errors" : errors.get(0).toString());
      this.errors = ImmutableList.copyOf(errors);
    }

    Exception(ParseError error) {
      this(ImmutableList.of(error));
    }

    /** Returns an immutable non-empty list of errors. */
    public ImmutableList<ParseError> errors() {
      return errors;
    }
  }
}
