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

import dev.assemble.build.BuildConfigurationException;

/** A source pattern that cannot be resolved: bad root token, misplaced wildcard or variable. */
public class InvalidPatternException extends BuildConfigurationException {
  private final String pattern;

  public InvalidPatternException(String pattern, String reason) {
    super(String.format("The pattern \"%s\" is not valid: %s", pattern, reason));
    this.pattern = pattern;
  }

  public String getPattern() {
    return pattern;
  }
}
