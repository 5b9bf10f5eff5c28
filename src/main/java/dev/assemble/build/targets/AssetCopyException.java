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

package dev.assemble.build.targets;

import com.google.common.collect.ImmutableMap;
import dev.assemble.build.BuildActionException;
import java.util.Map;

/** Some assets could not be copied. The other assets were copied regardless. */
public class AssetCopyException extends BuildActionException {
  private final ImmutableMap<String, Throwable> failures;

  public AssetCopyException(Map<String, Throwable> failures, int total) {
    super(describe(failures, total));
    this.failures = ImmutableMap.copyOf(failures);
  }

  /** The failed assets, by their path relative to the asset directory, with the cause. */
  public ImmutableMap<String, Throwable> getFailures() {
    return failures;
  }

  private static String describe(Map<String, Throwable> failures, int total) {
    StringBuilder message =
        new StringBuilder(
            String.format("Failed to copy %d of %d asset(s):", failures.size(), total));
    for (Map.Entry<String, Throwable> failure : failures.entrySet()) {
      message
          .append("\n  ")
          .append(failure.getKey())
          .append(": ")
          .append(failure.getValue());
    }
    return message.toString();
  }
}
