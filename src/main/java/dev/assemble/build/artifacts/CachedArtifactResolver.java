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

package dev.assemble.build.artifacts;

import com.google.common.base.Preconditions;
import java.nio.file.Path;
import javax.annotation.Nullable;

/**
 * Resolves artifacts inside a downloaded artifact cache.
 *
 * <p>Platform specific artifacts live under {@code artifacts/engine/<platform>[-<mode>]/}; when no
 * platform is given the {@code common} directory is used. Host artifacts live directly under the
 * cache directory.
 */
public class CachedArtifactResolver implements ArtifactResolver {
  private final Path cacheDirectory;

  public CachedArtifactResolver(Path cacheDirectory) {
    this.cacheDirectory = Preconditions.checkNotNull(cacheDirectory);
  }

  @Override
  public Path getArtifactPath(
      ArtifactId artifact, @Nullable TargetPlatform platform, @Nullable BuildMode mode) {
    return getEngineDirectory(platform, mode).resolve(artifact.getFileName());
  }

  @Override
  public Path getHostArtifact(HostArtifactId artifact) {
    return cacheDirectory.resolve(artifact.getFileName());
  }

  private Path getEngineDirectory(@Nullable TargetPlatform platform, @Nullable BuildMode mode) {
    Path engine = cacheDirectory.resolve("artifacts").resolve("engine");
    if (platform == null) {
      return engine.resolve("common");
    }
    // Debug artifacts are shared with the unsuffixed platform directory.
    if (mode == null || mode == BuildMode.DEBUG) {
      return engine.resolve(platform.getName());
    }
    return engine.resolve(platform.getName() + "-" + mode.getName());
  }
}
