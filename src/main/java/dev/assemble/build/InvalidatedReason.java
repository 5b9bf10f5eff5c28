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

/** Why a target had to run instead of being skipped. */
public enum InvalidatedReason {
  NO_STAMP("the target has not been built before"),
  BUILD_KEY_CHANGED("the build key changed"),
  INPUT_SET_CHANGED("the set of inputs changed"),
  INPUT_CHANGED("an input changed"),
  INPUT_MISSING("an input is missing"),
  OUTPUT_SET_CHANGED("the set of outputs changed"),
  OUTPUT_CHANGED("an output changed"),
  OUTPUT_MISSING("an output is missing"),
  DEPENDENCY_EXECUTED("a dependency ran"),
  NEW_DEPFILE("a depfile has not been written yet");

  private final String description;

  InvalidatedReason(String description) {
    this.description = description;
  }

  public String getDescription() {
    return description;
  }
}
