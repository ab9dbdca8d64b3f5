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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/** Helpers for the whitespace-separated token form of serialized expression trees. */
public final class Tokens {

  private static final Splitter WHITESPACE =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings().trimResults();

  static final String OPEN = "(";
  static final String CLOSE = ")";

  private Tokens() {}

  /** Splits a line into tokens, dropping the {@code [} and {@code ]} bracket tokens. */
  public static ImmutableList<String> split(String line) {
    return split(line, true);
  }

  /** Splits a line into tokens, optionally dropping bracket tokens. */
  public static ImmutableList<String> split(String line, boolean stripBrackets) {
    ImmutableList.Builder<String> tokens = ImmutableList.builder();
    for (String token : WHITESPACE.split(line)) {
      if (stripBrackets && isBracket(token)) {
        continue;
      }
      tokens.add(token);
    }
    return tokens.build();
  }

  static boolean isBracket(String token) {
    return token.equals("[") || token.equals("]");
  }

  /** Reports whether the token is a decimal integer literal with an optional leading minus. */
  public static boolean isNumber(String token) {
    int start = token.startsWith("-") ? 1 : 0;
    if (token.length() == start) {
      return false;
    }
    for (int i = start; i < token.length(); i++) {
      char c = token.charAt(i);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the tag denoted by a token, or null if the token names no tag. {@code PHI<n>} tokens
   * classify as {@link Op#PHI}; the builder decides whether an occurrence is a terminal.
   */
  @Nullable
  public static Op classify(String token) {
    if (isNumber(token)) {
      return Op.CONST;
    }
    Op op = Op.forKeyword(token);
    if (op != null) {
      return op;
    }
    if (token.startsWith("ARG")) {
      return Op.ARG;
    }
    if (token.startsWith("PHI")) {
      return Op.PHI;
    }
    return null;
  }

  /**
   * Returns the numeric suffix of an {@code ARG<n>} or {@code PHI<n>} token, or -1 if the token
   * has no suffix.
   *
   * @throws NumberFormatException if the suffix is not a non-negative decimal number
   */
  static int suffix(String token) {
    String digits = token.substring(3);
    if (digits.isEmpty()) {
      return -1;
    }
    if (!CharMatcher.inRange('0', '9').matchesAllOf(digits)) {
      throw new NumberFormatException("invalid numeric suffix in '" + token + "'");
    }
    return Integer.parseInt(digits);
  }
}
