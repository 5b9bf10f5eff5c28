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

/**
 * A problem with the declaration of the build graph: a malformed source pattern, a cyclic
 * dependency or a duplicate target name. Always detected before any target runs.
 */
public class BuildConfigurationException extends Exception {
  public BuildConfigurationException(String message) {
    super(message);
  }

  public BuildConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
