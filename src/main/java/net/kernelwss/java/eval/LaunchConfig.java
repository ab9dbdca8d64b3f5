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

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

/** The block and grid extents a kernel is launched with. Only the x and y axes are modeled. */
@AutoValue
public abstract class LaunchConfig {

  public abstract long blockX();

  public abstract long blockY();

  public abstract GridDimension gridX();

  public abstract GridDimension gridY();

  /** Returns the number of threads in one block. */
  public long threadsPerBlock() {
    return Math.multiplyExact(blockX(), blockY());
  }

  public static LaunchConfig of(long blockX, long blockY, long gridX, long gridY) {
    return builder()
        .blockX(blockX)
        .blockY(blockY)
        .gridX(GridDimension.of(gridX))
        .gridY(GridDimension.of(gridY))
        .build();
  }

  public static Builder builder() {
    return new AutoValue_LaunchConfig.Builder()
        .blockY(1)
        .gridY(GridDimension.of(1));
  }

  /** Builder for {@link LaunchConfig}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder blockX(long value);

    public abstract Builder blockY(long value);

    public abstract Builder gridX(GridDimension value);

    public abstract Builder gridY(GridDimension value);

    abstract LaunchConfig autoBuild();

    public LaunchConfig build() {
      LaunchConfig config = autoBuild();
      Preconditions.checkArgument(
          config.blockX() > 0 && config.blockY() > 0,
          "block dimensions %sx%s are not positive",
          config.blockX(),
          config.blockY());
      return config;
    }
  }
}
