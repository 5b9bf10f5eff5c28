// Copyright 2019 The Bazel Authors. All rights reserved.
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
//

package dev.assemble.build;

import com.google.common.base.Preconditions;
import dev.assemble.build.fingerprint.FileStoreStrategy;

/** Settings of a {@link BuildSystem} that do not change between builds. */
public final class BuildSystemConfig {
  private final int resourcePoolSize;
  private final FileStoreStrategy fileStoreStrategy;

  private BuildSystemConfig(int resourcePoolSize, FileStoreStrategy fileStoreStrategy) {
    this.resourcePoolSize = resourcePoolSize;
    this.fileStoreStrategy = fileStoreStrategy;
  }

  public static BuildSystemConfig defaults() {
    return builder().build();
  }

  /** The number of targets that may run at the same time. */
  public int getResourcePoolSize() {
    return resourcePoolSize;
  }

  public FileStoreStrategy getFileStoreStrategy() {
    return fileStoreStrategy;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private int resourcePoolSize = Runtime.getRuntime().availableProcessors();
    private FileStoreStrategy fileStoreStrategy = FileStoreStrategy.HASH;

    private Builder() {}

    public Builder setResourcePoolSize(int resourcePoolSize) {
      Preconditions.checkArgument(
          resourcePoolSize > 0, "resource pool size must be positive: %s", resourcePoolSize);
      this.resourcePoolSize = resourcePoolSize;
      return this;
    }

    public Builder setFileStoreStrategy(FileStoreStrategy fileStoreStrategy) {
      this.fileStoreStrategy = Preconditions.checkNotNull(fileStoreStrategy);
      return this;
    }

    public BuildSystemConfig build() {
      return new BuildSystemConfig(resourcePoolSize, fileStoreStrategy);
    }
  }
}
