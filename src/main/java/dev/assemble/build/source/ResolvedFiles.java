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

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/** The concrete files a list of {@link Source}s resolved to. */
public final class ResolvedFiles {
  private static final ResolvedFiles EMPTY = new ResolvedFiles(ImmutableList.of(), false);

  private final ImmutableList<Path> sources;
  private final boolean containsNewDepfile;

  private ResolvedFiles(ImmutableList<Path> sources, boolean containsNewDepfile) {
    this.sources = sources;
    this.containsNewDepfile = containsNewDepfile;
  }

  public static ResolvedFiles empty() {
    return EMPTY;
  }

  public static ResolvedFiles of(Path... sources) {
    return builder().addAll(ImmutableList.copyOf(sources)).build();
  }

  /** The resolved files, without duplicates, in the order they were first seen. */
  public ImmutableList<Path> getSources() {
    return sources;
  }

  /**
   * Whether a depfile that should contribute to this result does not exist yet. The owning target
   * has then never produced it and must run before its dependencies are fully known.
   */
  public boolean containsNewDepfile() {
    return containsNewDepfile;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ResolvedFiles that = (ResolvedFiles) o;
    return containsNewDepfile == that.containsNewDepfile && sources.equals(that.sources);
  }

  @Override
  public int hashCode() {
    return Objects.hash(sources, containsNewDepfile);
  }

  @Override
  public String toString() {
    return "ResolvedFiles{sources=" + sources + ", containsNewDepfile=" + containsNewDepfile + '}';
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private final Set<Path> sources = new LinkedHashSet<>();
    private boolean containsNewDepfile;

    private Builder() {}

    public Builder add(Path path) {
      sources.add(path);
      return this;
    }

    public Builder addAll(Iterable<Path> paths) {
      paths.forEach(sources::add);
      return this;
    }

    public Builder merge(ResolvedFiles other) {
      addAll(other.sources);
      containsNewDepfile |= other.containsNewDepfile;
      return this;
    }

    public Builder markNewDepfile() {
      containsNewDepfile = true;
      return this;
    }

    public ResolvedFiles build() {
      if (sources.isEmpty() && !containsNewDepfile) {
        return EMPTY;
      }
      return new ResolvedFiles(ImmutableList.copyOf(sources), containsNewDepfile);
    }
  }
}
