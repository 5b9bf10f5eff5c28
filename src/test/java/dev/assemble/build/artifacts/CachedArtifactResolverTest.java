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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import java.nio.file.FileSystem;
import java.nio.file.Path;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CachedArtifactResolverTest {
  private final FileSystem fileSystem = Jimfs.newFileSystem(Configuration.unix());
  private final Path cache = fileSystem.getPath("/cache");
  private final CachedArtifactResolver resolver = new CachedArtifactResolver(cache);

  @Test
  public void testCommonArtifact() {
    assertThat(resolver.getArtifactPath(ArtifactId.ICU_DATA, null, null).toString())
        .isEqualTo("/cache/artifacts/engine/common/icudtl.dat");
  }

  @Test
  public void testPlatformArtifacts() {
    assertThat(
            resolver
                .getArtifactPath(ArtifactId.GEN_SNAPSHOT, TargetPlatform.ANDROID_ARM, null)
                .toString())
        .isEqualTo("/cache/artifacts/engine/android-arm/gen_snapshot");
    assertThat(
            resolver
                .getArtifactPath(
                    ArtifactId.GEN_SNAPSHOT, TargetPlatform.ANDROID_ARM, BuildMode.DEBUG)
                .toString())
        .isEqualTo("/cache/artifacts/engine/android-arm/gen_snapshot");
    assertThat(
            resolver
                .getArtifactPath(
                    ArtifactId.GEN_SNAPSHOT, TargetPlatform.ANDROID_ARM, BuildMode.RELEASE)
                .toString())
        .isEqualTo("/cache/artifacts/engine/android-arm-release/gen_snapshot");
  }

  @Test
  public void testHostArtifact() {
    assertThat(resolver.getHostArtifact(HostArtifactId.SDK_RUNTIME).toString())
        .isEqualTo("/cache/sdk/bin/runtime");
  }

  @Test
  public void testNames() {
    assertThat(TargetPlatform.fromName("linux-x64")).isEqualTo(TargetPlatform.LINUX_X64);
    assertThat(TargetPlatform.fromName("amiga")).isNull();
    assertThat(BuildMode.fromName("jit-release")).isEqualTo(BuildMode.JIT_RELEASE);
    assertThat(BuildMode.RELEASE.isPrecompiled()).isTrue();
    assertThat(BuildMode.DEBUG.isPrecompiled()).isFalse();
  }
}
