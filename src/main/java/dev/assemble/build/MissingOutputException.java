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

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;

/** A target finished its action without producing some of its declared outputs. */
public class MissingOutputException extends BuildActionException {
  private final ImmutableList<Path> missing;

  public MissingOutputException(String targetName, ImmutableList<Path> missing) {
    super(
        String.format(
            "%s missing output(s) from target '%s': %s",
            missing.size(), targetName, missing));
    this.missing = missing;
  }

  public ImmutableList<Path> getMissing() {
    return missing;
  }
}
