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

import dev.assemble.build.BuildActionException;
import java.nio.file.Path;

/** A required input of a target does not exist. */
public class MissingInputException extends BuildActionException {
  private final Path path;

  public MissingInputException(Path path, String declaration) {
    super(String.format("Required input %s (declared as '%s') does not exist", path, declaration));
    this.path = path;
  }

  public Path getPath() {
    return path;
  }
}
