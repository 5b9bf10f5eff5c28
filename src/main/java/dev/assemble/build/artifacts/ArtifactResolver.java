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

import java.nio.file.Path;
import javax.annotation.Nullable;

/**
 * Looks up where an artifact lives. Implementations do not need to check that the returned path
 * exists; a directory-valued artifact is expanded by the caller.
 */
public interface ArtifactResolver {
  Path getArtifactPath(
      ArtifactId artifact, @Nullable TargetPlatform platform, @Nullable BuildMode mode);

  Path getHostArtifact(HostArtifactId artifact);
}
