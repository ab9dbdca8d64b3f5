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

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

/**
 * TreeOptions is the set of options that affect how a {@link TreeBuilder} turns token lists into
 * trees. The {@link #DEFAULT} options match the limits of the device-side pass that writes the
 * descriptors.
 */
@AutoValue
public abstract class TreeOptions {

  /** The default options. */
  public static final TreeOptions DEFAULT = builder().build();

  /**
   * The longest reverse Polish token list that is turned into a tree. Longer lists become a
   * pointer-chase sentinel.
   */
  public abstract int maxRpnTokens();

  /**
   * The largest number of nodes read from a parenthesized prefix list. Longer lists become a
   * pointer-chase sentinel.
   */
  public abstract int maxPrefixNodes();

  /** Whether {@code [} and {@code ]} tokens are dropped before building. */
  public abstract boolean stripBrackets();

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_TreeOptions.Builder()
        .maxRpnTokens(50)
        .maxPrefixNodes(100)
        .stripBrackets(true);
  }

  public abstract Builder toBuilder();

  /** Builder for {@link TreeOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder maxRpnTokens(int value);

    public abstract Builder maxPrefixNodes(int value);

    public abstract Builder stripBrackets(boolean value);

    abstract TreeOptions autoBuild();

    public TreeOptions build() {
      TreeOptions options = autoBuild();
      Preconditions.checkArgument(
          options.maxRpnTokens() >= 0 && options.maxPrefixNodes() >= 0,
          "size guards must not be negative");
      return options;
    }
  }
}
