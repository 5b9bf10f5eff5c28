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

/**
 * Tools and libraries of the engine that are looked up per target platform and build mode through
 * an {@link ArtifactResolver}.
 */
public enum ArtifactId {
  GEN_SNAPSHOT("gen_snapshot"),
  ENGINE_LIBRARY("libengine.so"),
  ICU_DATA("icudtl.dat"),
  PLATFORM_KERNEL_DILL("platform_strong.dill"),
  FRAMEWORK_BUNDLE("Framework.bundle"),
  WINDOWS_CPP_CLIENT_WRAPPER("cpp_client_wrapper");

  private final String fileName;

  ArtifactId(String fileName) {
    this.fileName = fileName;
  }

  public String getFileName() {
    return fileName;
  }
}
