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

import java.util.Locale;
import javax.annotation.Nullable;

/** Compilation mode an artifact was produced with. */
public enum BuildMode {
  DEBUG,
  PROFILE,
  RELEASE,
  JIT_RELEASE;

  public String getName() {
    return name().toLowerCase(Locale.ROOT).replace('_', '-');
  }

  public boolean isPrecompiled() {
    return this == PROFILE || this == RELEASE;
  }

  @Nullable
  public static BuildMode fromName(String name) {
    for (BuildMode mode : values()) {
      if (mode.getName().equals(name)) {
        return mode;
      }
    }
    return null;
  }
}
