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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.hash.Hashing;
import dev.assemble.build.artifacts.ArtifactResolver;
import dev.assemble.build.events.EventHandler;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * The directories, variables and collaborators a build runs against. Created once per build
 * invocation and never modified afterwards.
 *
 * <p>Directory roots are stored as given. Symbolic links are only resolved when a source is
 * resolved, so a root is allowed to appear on disk after the environment was created.
 */
public final class Environment {
  /** Name of the file that stands in for the whole toolchain when its version is pinned. */
  public static final String VERSION_MARKER = "bin/internal/engine.version";

  /** The symbolic roots a source pattern may start with. */
  public enum Root {
    PROJECT_DIR("{PROJECT_DIR}"),
    BUILD_DIR("{BUILD_DIR}"),
    CACHE_DIR("{CACHE_DIR}"),
    TOOLCHAIN_ROOT("{TOOLCHAIN_ROOT}"),
    OUTPUT_DIR("{OUTPUT_DIR}");

    private final String token;

    Root(String token) {
      this.token = token;
    }

    public String getToken() {
      return token;
    }

    @Nullable
    public static Root fromToken(String token) {
      for (Root root : values()) {
        if (root.token.equals(token)) {
          return root;
        }
      }
      return null;
    }
  }

  private final Path projectDirectory;
  private final Path buildDirectory;
  private final Path cacheDirectory;
  private final Path toolchainRootDirectory;
  private final Path outputDirectory;
  @Nullable private final String engineVersion;
  private final ImmutableSortedMap<String, String> defines;
  private final ArtifactResolver artifacts;
  private final EventHandler reporter;

  private Environment(
      Path projectDirectory,
      Path buildDirectory,
      Path cacheDirectory,
      Path toolchainRootDirectory,
      Path outputDirectory,
      @Nullable String engineVersion,
      ImmutableSortedMap<String, String> defines,
      ArtifactResolver artifacts,
      EventHandler reporter) {
    this.projectDirectory = projectDirectory;
    this.buildDirectory = buildDirectory;
    this.cacheDirectory = cacheDirectory;
    this.toolchainRootDirectory = toolchainRootDirectory;
    this.outputDirectory = outputDirectory;
    this.engineVersion = engineVersion;
    this.defines = defines;
    this.artifacts = artifacts;
    this.reporter = reporter;
  }

  public Path getProjectDirectory() {
    return projectDirectory;
  }

  public Path getBuildDirectory() {
    return buildDirectory;
  }

  public Path getCacheDirectory() {
    return cacheDirectory;
  }

  public Path getToolchainRootDirectory() {
    return toolchainRootDirectory;
  }

  public Path getOutputDirectory() {
    return outputDirectory;
  }

  /** The pinned toolchain version, or null when a locally built toolchain is used. */
  @Nullable
  public String getEngineVersion() {
    return engineVersion;
  }

  public ImmutableSortedMap<String, String> getDefines() {
    return defines;
  }

  public ArtifactResolver getArtifacts() {
    return artifacts;
  }

  public EventHandler getReporter() {
    return reporter;
  }

  public FileSystem getFileSystem() {
    return projectDirectory.getFileSystem();
  }

  public Path getDirectory(Root root) {
    switch (root) {
      case PROJECT_DIR:
        return projectDirectory;
      case BUILD_DIR:
        return buildDirectory;
      case CACHE_DIR:
        return cacheDirectory;
      case TOOLCHAIN_ROOT:
        return toolchainRootDirectory;
      case OUTPUT_DIR:
        return outputDirectory;
    }
    throw new IllegalStateException(root.toString());
  }

  /**
   * Returns the absolute location of {@code root} with symbolic links resolved. A root that does
   * not exist yet is only made absolute and normalized.
   */
  public Path resolveDirectory(Root root) throws IOException {
    Path directory = getDirectory(root);
    if (Files.exists(directory)) {
      return directory.toRealPath();
    }
    return directory.toAbsolutePath().normalize();
  }

  public Path getVersionMarker() {
    return toolchainRootDirectory.resolve(VERSION_MARKER);
  }

  /**
   * A short, stable digest of the defines. Used to keep builds with different configurations in
   * separate build directories.
   */
  public static String buildPrefix(Map<String, String> defines) {
    String joined =
        Joiner.on(';').withKeyValueSeparator("=").join(ImmutableSortedMap.copyOf(defines));
    return Hashing.sha256().hashString(joined, StandardCharsets.UTF_8).toString().substring(0, 16);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private Path projectDirectory;
    private Path buildDirectory;
    private Path cacheDirectory;
    private Path toolchainRootDirectory;
    private Path outputDirectory;
    private String engineVersion;
    private final ImmutableSortedMap.Builder<String, String> definesBuilder =
        ImmutableSortedMap.naturalOrder();
    private ArtifactResolver artifacts;
    private EventHandler reporter;

    private Builder() {}

    public Builder setProjectDirectory(Path projectDirectory) {
      this.projectDirectory = projectDirectory;
      return this;
    }

    /**
     * Optional. Defaults to {@code <project>/.assemble/<build prefix>} so that every set of
     * defines gets its own build directory.
     */
    public Builder setBuildDirectory(Path buildDirectory) {
      this.buildDirectory = buildDirectory;
      return this;
    }

    public Builder setCacheDirectory(Path cacheDirectory) {
      this.cacheDirectory = cacheDirectory;
      return this;
    }

    public Builder setToolchainRootDirectory(Path toolchainRootDirectory) {
      this.toolchainRootDirectory = toolchainRootDirectory;
      return this;
    }

    public Builder setOutputDirectory(Path outputDirectory) {
      this.outputDirectory = outputDirectory;
      return this;
    }

    public Builder setEngineVersion(@Nullable String engineVersion) {
      this.engineVersion = engineVersion;
      return this;
    }

    public Builder addDefine(String key, String value) {
      definesBuilder.put(key, value);
      return this;
    }

    public Builder addDefines(Map<String, String> defines) {
      definesBuilder.putAll(defines);
      return this;
    }

    public Builder setArtifacts(ArtifactResolver artifacts) {
      this.artifacts = artifacts;
      return this;
    }

    public Builder setReporter(EventHandler reporter) {
      this.reporter = reporter;
      return this;
    }

    public Environment build() {
      Preconditions.checkNotNull(projectDirectory, "project directory is required");
      Preconditions.checkNotNull(cacheDirectory, "cache directory is required");
      Preconditions.checkNotNull(toolchainRootDirectory, "toolchain root is required");
      Preconditions.checkNotNull(outputDirectory, "output directory is required");
      Preconditions.checkNotNull(artifacts, "artifact resolver is required");
      Preconditions.checkNotNull(reporter, "reporter is required");
      ImmutableSortedMap<String, String> defines = definesBuilder.build();
      Path build = buildDirectory;
      if (build == null) {
        build = projectDirectory.resolve(".assemble").resolve(buildPrefix(defines));
      }
      return new Environment(
          projectDirectory.toAbsolutePath(),
          build.toAbsolutePath(),
          cacheDirectory.toAbsolutePath(),
          toolchainRootDirectory.toAbsolutePath(),
          outputDirectory.toAbsolutePath(),
          engineVersion,
          defines,
          artifacts,
          reporter);
    }
  }
}
