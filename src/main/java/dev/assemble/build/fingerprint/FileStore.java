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

package dev.assemble.build.fingerprint;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.flogger.GoogleLogger;
import com.google.common.hash.Hashing;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.Nullable;

/**
 * Computes file fingerprints for one build, computing each one at most once. A target's outputs
 * must be {@link #invalidate invalidated} after it ran, since the target may have rewritten them.
 * Thread-safe.
 */
public class FileStore {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final FileStoreStrategy strategy;
  private final Map<Path, String> digests = new ConcurrentHashMap<>();

  public FileStore(FileStoreStrategy strategy) {
    this.strategy = strategy;
  }

  public FileStoreStrategy getStrategy() {
    return strategy;
  }

  /** Returns the fingerprint of {@code file}, or null if it is not a regular file. */
  @Nullable
  public String digest(Path file) throws IOException {
    String cached = digests.get(file);
    if (cached != null) {
      return cached;
    }
    if (!Files.isRegularFile(file)) {
      return null;
    }
    String digest = compute(file);
    digests.put(file, digest);
    return digest;
  }

  /** Fingerprints every file that exists; missing files are left out of the result. */
  public ImmutableSortedMap<String, String> digestAll(Iterable<Path> files) throws IOException {
    ImmutableSortedMap.Builder<String, String> builder = ImmutableSortedMap.naturalOrder();
    for (Path file : files) {
      String digest = digest(file);
      if (digest != null) {
        builder.put(file.toString(), digest);
      }
    }
    return builder.build();
  }

  public void invalidate(Iterable<Path> files) {
    for (Path file : files) {
      digests.remove(file);
    }
  }

  private String compute(Path file) throws IOException {
    logger.atFinest().log("Fingerprinting %s", file);
    switch (strategy) {
      case HASH:
        return MoreFiles.asByteSource(file).hash(Hashing.sha256()).toString();
      case TIMESTAMP:
        return Files.getLastModifiedTime(file).toMillis() + ":" + Files.size(file);
    }
    throw new IllegalStateException("Unknown strategy: " + strategy);
  }

  int size() {
    return digests.size();
  }
}
