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

package dev.assemble.build.targets;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.nio.file.Path;

/**
 * The assets of an application, keyed by their path relative to the asset output directory, in
 * the order they were added.
 */
public final class AssetManifest {
  private final ImmutableMap<String, AssetContent> entries;

  private AssetManifest(ImmutableMap<String, AssetContent> entries) {
    this.entries = entries;
  }

  public ImmutableMap<String, AssetContent> getEntries() {
    return entries;
  }

  public int size() {
    return entries.size();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private final ImmutableMap.Builder<String, AssetContent> entries = ImmutableMap.builder();

    private Builder() {}

    public Builder add(String relativePath, AssetContent content) {
      Preconditions.checkArgument(!relativePath.isEmpty(), "asset path must not be empty");
      entries.put(relativePath, content);
      return this;
    }

    public Builder addFile(String relativePath, Path file) {
      return add(relativePath, AssetContent.file(file));
    }

    public Builder addText(String relativePath, String text) {
      return add(relativePath, AssetContent.text(text));
    }

    /** Fails on duplicate asset paths. */
    public AssetManifest build() {
      return new AssetManifest(entries.build());
    }
  }
}
