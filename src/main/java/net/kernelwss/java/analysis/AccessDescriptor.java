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
import net.kernelwss.java.syntax.ExprTree;
import net.kernelwss.java.syntax.ParseError;

/**
 * A memory access of a kernel: where it happens, which pointer argument it goes through, and its
 * address expression. If the expression did not parse, the tree is null and {@link #errors} says
 * why.
 */
@AutoValue
public abstract class AccessDescriptor {

  public abstract String kernel();

  public abstract int accessId();

  /** The index of the pointer argument the access goes through. */
  public abstract int allocArg();

  /** The id of the innermost loop around the access, or 0. */
  public abstract int loopId();

  /** The id of the condition guarding the access, or 0. */
  public abstract int ifId();

  public abstract int ifType();

  /** The address expression in binary form, or null if it is missing or did not parse. */
  @Nullable
  public abstract ExprTree tree();

  /** Why the binary expression did not parse; empty if it did. */
  public abstract ImmutableList<ParseError> errors();

  /** The address expression in n-ary form, or null if the descriptors have none. */
  @Nullable
  public abstract ExprTree advancedTree();

  /** Why the n-ary expression did not parse; empty if it did. */
  public abstract ImmutableList<ParseError> advancedErrors();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_AccessDescriptor.Builder()
        .loopId(0)
        .ifId(0)
        .ifType(0)
        .errors(ImmutableList.of())
        .advancedErrors(ImmutableList.of());
  }

  /** Builder for {@link AccessDescriptor}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder kernel(String value);

    public abstract Builder accessId(int value);

    public abstract Builder allocArg(int value);

    public abstract Builder loopId(int value);

    public abstract Builder ifId(int value);

    public abstract Builder ifType(int value);

    public abstract Builder tree(@Nullable ExprTree value);

    public abstract Builder errors(ImmutableList<ParseError> value);

    public abstract Builder advancedTree(@Nullable ExprTree value);

    public abstract Builder advancedErrors(ImmutableList<ParseError> value);

    public abstract AccessDescriptor build();
  }
}
