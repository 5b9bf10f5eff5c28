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

package dev.assemble.build.source;

import com.google.common.base.Preconditions;
import dev.assemble.build.artifacts.ArtifactId;
import dev.assemble.build.artifacts.BuildMode;
import dev.assemble.build.artifacts.HostArtifactId;
import dev.assemble.build.artifacts.TargetPlatform;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A declared input or output of a target. Exactly one of {@link Pattern}, {@link Artifact} and
 * {@link HostArtifact}; switch on {@link #getKind()} to tell them apart.
 */
public abstract class Source {
  /** The variants of {@link Source}. */
  public enum Kind {
    PATTERN,
    ARTIFACT,
    HOST_ARTIFACT
  }

  private Source() {}

  public abstract Kind getKind();

  /**
   * Whether the files of this source can only be known by listing the file system: a wildcard
   * pattern, or an artifact that may turn out to be a directory.
   */
  public abstract boolean isImplicit();

  public static Pattern pattern(String template) {
    return new Pattern(template, false);
  }

  /** A pattern that is silently dropped when the file it names does not exist. */
  public static Pattern optionalPattern(String template) {
    return new Pattern(template, true);
  }

  public static Artifact artifact(ArtifactId id) {
    return new Artifact(id, null, null);
  }

  public static Artifact artifact(
      ArtifactId id, @Nullable TargetPlatform platform, @Nullable BuildMode mode) {
    return new Artifact(id, platform, mode);
  }

  public static HostArtifact hostArtifact(HostArtifactId id) {
    return new HostArtifact(id);
  }

  public Pattern asPattern() {
    throw new IllegalStateException("Not a pattern source: " + this);
  }

  public Artifact asArtifact() {
    throw new IllegalStateException("Not an artifact source: " + this);
  }

  public HostArtifact asHostArtifact() {
    throw new IllegalStateException("Not a host artifact source: " + this);
  }

  /** A path template rooted at one of the environment's directories. */
  public static final class Pattern extends Source {
    private final String template;
    private final boolean optional;

    private Pattern(String template, boolean optional) {
      this.template = Preconditions.checkNotNull(template);
      this.optional = optional;
    }

    public String getTemplate() {
      return template;
    }

    public boolean isOptional() {
      return optional;
    }

    public PatternTemplate parse() throws InvalidPatternException {
      return PatternTemplate.parse(template);
    }

    @Override
    public Kind getKind() {
      return Kind.PATTERN;
    }

    @Override
    public boolean isImplicit() {
      return template.contains("*");
    }

    @Override
    public Pattern asPattern() {
      return this;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      Pattern that = (Pattern) o;
      return optional == that.optional && template.equals(that.template);
    }

    @Override
    public int hashCode() {
      return Objects.hash(template, optional);
    }

    @Override
    public String toString() {
      return optional ? template + " (optional)" : template;
    }
  }

  /** An engine artifact, optionally specific to a platform and build mode. */
  public static final class Artifact extends Source {
    private final ArtifactId id;
    @Nullable private final TargetPlatform platform;
    @Nullable private final BuildMode mode;

    private Artifact(ArtifactId id, @Nullable TargetPlatform platform, @Nullable BuildMode mode) {
      this.id = Preconditions.checkNotNull(id);
      this.platform = platform;
      this.mode = mode;
    }

    public ArtifactId getId() {
      return id;
    }

    @Nullable
    public TargetPlatform getPlatform() {
      return platform;
    }

    @Nullable
    public BuildMode getMode() {
      return mode;
    }

    @Override
    public Kind getKind() {
      return Kind.ARTIFACT;
    }

    @Override
    public boolean isImplicit() {
      return true;
    }

    @Override
    public Artifact asArtifact() {
      return this;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      Artifact that = (Artifact) o;
      return id == that.id && platform == that.platform && mode == that.mode;
    }

    @Override
    public int hashCode() {
      return Objects.hash(id, platform, mode);
    }

    @Override
    public String toString() {
      return "artifact:" + id + (platform == null ? "" : "/" + platform.getName())
          + (mode == null ? "" : "/" + mode.getName());
    }
  }

  /** An artifact of the host toolchain. */
  public static final class HostArtifact extends Source {
    private final HostArtifactId id;

    private HostArtifact(HostArtifactId id) {
      this.id = Preconditions.checkNotNull(id);
    }

    public HostArtifactId getId() {
      return id;
    }

    @Override
    public Kind getKind() {
      return Kind.HOST_ARTIFACT;
    }

    @Override
    public boolean isImplicit() {
      return true;
    }

    @Override
    public HostArtifact asHostArtifact() {
      return this;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      return id == ((HostArtifact) o).id;
    }

    @Override
    public int hashCode() {
      return id.hashCode();
    }

    @Override
    public String toString() {
      return "host-artifact:" + id;
    }
  }
}
