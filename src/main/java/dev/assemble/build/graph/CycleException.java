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

package dev.assemble.build.graph;

import dev.assemble.build.BuildConfigurationException;

/** The dependencies of the requested target form a cycle. */
public class CycleException extends BuildConfigurationException {
  private final CycleInfo cycleInfo;

  public CycleException(CycleInfo cycleInfo) {
    super(
        cycleInfo.getPathToCycle().isEmpty()
            ? "Dependency cycle detected: " + cycleInfo.describeCycle()
            : String.format(
                "Dependency cycle detected: %s (reached through %s)",
                cycleInfo.describeCycle(), String.join(" -> ", cycleInfo.getPathToCycle())));
    this.cycleInfo = cycleInfo;
  }

  public CycleInfo getCycleInfo() {
    return cycleInfo;
  }
}
