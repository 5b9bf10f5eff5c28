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

/** Artifacts that only exist for the host the build runs on. */
public enum HostArtifactId {
  SDK("sdk"),
  FONT_SUBSET("font-subset"),
  SDK_RUNTIME("sdk/bin/runtime"),
  WEB_SDK("web_sdk");

  private final String fileName;

  HostArtifactId(String fileName) {
    this.fileName = fileName;
  }

  public String getFileName() {
    return fileName;
  }
}
