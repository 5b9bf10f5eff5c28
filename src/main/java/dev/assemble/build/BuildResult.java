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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import java.nio.file.Path;
import javax.annotation.Nullable;

/**
 * The outcome of {@link BuildSystem#build}. Target names are listed in the order the targets were
 * scheduled, dependencies first.
 */
public final class BuildResult {
  private final ImmutableList<String> executedTargets;
  private final ImmutableList<String> skippedTargets;
  private final ImmutableMap<String, Throwable> failures;
  private final ImmutableList<String> blockedTargets;
  private final ImmutableMap<String, PerformanceMeasurement> performance;
  private final ImmutableList<Path> inputFiles;
  private final ImmutableList<Path> outputFiles;

  private BuildResult(Builder builder) {
    this.executedTargets = builder.executedTargets.build();
    this.skippedTargets = builder.skippedTargets.build();
    this.failures = builder.failures.build();
    this.blockedTargets = builder.blockedTargets.build();
    this.performance = builder.performance.build();
    this.inputFiles = ImmutableList.copyOf(builder.inputFiles.build());
    this.outputFiles = ImmutableList.copyOf(builder.outputFiles.build());
  }

  public boolean isSuccess() {
    return failures.isEmpty() && blockedTargets.isEmpty();
  }

  /** Targets whose action ran in this build. */
  public ImmutableList<String> getExecutedTargets() {
    return executedTargets;
  }

  public ImmutableList<String> getSkippedTargets() {
    return skippedTargets;
  }

  public ImmutableMap<String, Throwable> getFailures() {
    return failures;
  }

  /** Targets that did not run because a dependency failed. */
  public ImmutableList<String> getBlockedTargets() {
    return blockedTargets;
  }

  @Nullable
  public Throwable getFirstFailure() {
    return Iterables.getFirst(failures.values(), null);
  }

  public ImmutableMap<String, PerformanceMeasurement> getPerformance() {
    return performance;
  }

  /** Inputs of every target that ran or was skipped. */
  public ImmutableList<Path> getInputFiles() {
    return inputFiles;
  }

  /** Outputs of every target that ran or was skipped. */
  public ImmutableList<Path> getOutputFiles() {
    return outputFiles;
  }

  @Override
  public String toString() {
    return String.format(
        "BuildResult{executed=%s, skipped=%s, failed=%s, blocked=%s}",
        executedTargets, skippedTargets, failures.keySet(), blockedTargets);
  }

  static Builder builder() {
    return new Builder();
  }

  static class Builder {
    private final ImmutableList.Builder<String> executedTargets = ImmutableList.builder();
    private final ImmutableList.Builder<String> skippedTargets = ImmutableList.builder();
    private final ImmutableMap.Builder<String, Throwable> failures = ImmutableMap.builder();
    private final ImmutableList.Builder<String> blockedTargets = ImmutableList.builder();
    private final ImmutableMap.Builder<String, PerformanceMeasurement> performance =
        ImmutableMap.builder();
    private final ImmutableSet.Builder<Path> inputFiles =
        ImmutableSet.builder();
    private final ImmutableSet.Builder<Path> outputFiles =
        ImmutableSet.builder();

    Builder addExecuted(String name) {
      executedTargets.add(name);
      return this;
    }

    Builder addSkipped(String name) {
      skippedTargets.add(name);
      return this;
    }

    Builder addFailure(String name, Throwable failure) {
      failures.put(name, failure);
      return this;
    }

    Builder addBlocked(String name) {
      blockedTargets.add(name);
      return this;
    }

    Builder addPerformance(PerformanceMeasurement measurement) {
      performance.put(measurement.getName(), measurement);
      return this;
    }

    Builder addFiles(Iterable<Path> inputs, Iterable<Path> outputs) {
      inputFiles.addAll(inputs);
      outputFiles.addAll(outputs);
      return this;
    }

    BuildResult build() {
      return new BuildResult(this);
    }
  }
}
