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
import com.google.common.io.ByteSource;
import com.google.common.io.MoreFiles;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import javax.annotation.Nullable;

/** The content of one asset: a file to copy, or bytes to write. */
public final class AssetContent {
  @Nullable private final Path file;
  @Nullable private final ByteSource bytes;

  private AssetContent(@Nullable Path file, @Nullable ByteSource bytes) {
    this.file = file;
    this.bytes = bytes;
  }

  public static AssetContent file(Path file) {
    return new AssetContent(Preconditions.checkNotNull(file), null);
  }

  public static AssetContent bytes(byte[] bytes) {
    return new AssetContent(null, ByteSource.wrap(bytes.clone()));
  }

  public static AssetContent text(String text) {
    return bytes(text.getBytes(StandardCharsets.UTF_8));
  }

  /** The file the asset is copied from, or null if its content is held in memory. */
  @Nullable
  public Path getFile() {
    return file;
  }

  public ByteSource asByteSource() {
    return file != null ? MoreFiles.asByteSource(file) : bytes;
  }

  @Override
  public String toString() {
    return file != null ? file.toString() : "<bytes>";
  }
}
