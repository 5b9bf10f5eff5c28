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

import java.util.Locale;
import javax.annotation.Nullable;

/** How a file's fingerprint is computed. */
public enum FileStoreStrategy {
  /** SHA-256 of the file contents. Precise, but every input is read on every build. */
  HASH,
  /** Last modification time and size. Misses same-size rewrites within one clock tick. */
  TIMESTAMP;

  @Nullable
  public static FileStoreStrategy fromName(String name) {
    try {
      return valueOf(name.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
