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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListenableFuture;
import dev.assemble.build.source.Source;
import java.io.IOException;
import java.util.List;

/**
 * A named step of the build. A target declares the targets it depends on, the files it reads and
 * writes as {@link Source}s, and the depfiles it writes into the build directory to record files
 * it only discovers while running.
 *
 * <p>Names identify targets and must be unique within a build graph. {@link #build} has to write
 * every declared output and depfile; the build system checks that afterwards.
 */
public abstract class Target {
  public abstract String getName();

  public List<Target> getDependencies() {
    return ImmutableList.of();
  }

  public List<Source> getInputs() {
    return ImmutableList.of();
  }

  public List<Source> getOutputs() {
    return ImmutableList.of();
  }

  /** Depfile names, relative to the build directory. */
  public List<String> getDepfiles() {
    return ImmutableList.of();
  }

  /** An opaque value that forces the target to run again whenever it changes. */
  public String getBuildKey() {
    return "";
  }

  /** Runs the target's action. It may complete synchronously or return a pending future. */
  public abstract ListenableFuture<Void> build(Environment environment)
      throws IOException, BuildActionException, InterruptedException;

  @Override
  public String toString() {
    return "Target{" + getName() + '}';
  }

  /** The action of a target assembled with {@link #builder}. */
  @FunctionalInterface
  public interface Action {
    ListenableFuture<Void> run(Environment environment)
        throws IOException, BuildActionException, InterruptedException;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public static class Builder {
    private final String name;
    private final ImmutableList.Builder<Target> dependenciesBuilder = ImmutableList.builder();
    private final ImmutableList.Builder<Source> inputsBuilder = ImmutableList.builder();
    private final ImmutableList.Builder<Source> outputsBuilder = ImmutableList.builder();
    private final ImmutableList.Builder<String> depfilesBuilder = ImmutableList.builder();
    private String buildKey = "";
    private Action action;

    private Builder(String name) {
      this.name = Preconditions.checkNotNull(name);
    }

    public Builder addDependencies(Target... dependencies) {
      dependenciesBuilder.add(dependencies);
      return this;
    }

    public Builder addInputs(Source... inputs) {
      inputsBuilder.add(inputs);
      return this;
    }

    public Builder addOutputs(Source... outputs) {
      outputsBuilder.add(outputs);
      return this;
    }

    public Builder addDepfiles(String... depfiles) {
      depfilesBuilder.add(depfiles);
      return this;
    }

    public Builder setBuildKey(String buildKey) {
      this.buildKey = Preconditions.checkNotNull(buildKey);
      return this;
    }

    public Builder setAction(Action action) {
      this.action = action;
      return this;
    }

    public Target build() {
      Preconditions.checkArgument(!name.isEmpty(), "target name must not be empty");
      Preconditions.checkNotNull(action, "target %s has no action", name);
      return new SimpleTarget(
          name,
          dependenciesBuilder.build(),
          inputsBuilder.build(),
          outputsBuilder.build(),
          depfilesBuilder.build(),
          buildKey,
          action);
    }
  }

  private static final class SimpleTarget extends Target {
    private final String name;
    private final ImmutableList<Target> dependencies;
    private final ImmutableList<Source> inputs;
    private final ImmutableList<Source> outputs;
    private final ImmutableList<String> depfiles;
    private final String buildKey;
    private final Action action;

    private SimpleTarget(
        String name,
        ImmutableList<Target> dependencies,
        ImmutableList<Source> inputs,
        ImmutableList<Source> outputs,
        ImmutableList<String> depfiles,
        String buildKey,
        Action action) {
      this.name = name;
      this.dependencies = dependencies;
      this.inputs = inputs;
      this.outputs = outputs;
      this.depfiles = depfiles;
      this.buildKey = buildKey;
      this.action = action;
    }

    @Override
    public String getName() {
      return name;
    }

    @Override
    public List<Target> getDependencies() {
      return dependencies;
    }

    @Override
    public List<Source> getInputs() {
      return inputs;
    }

    @Override
    public List<Source> getOutputs() {
      return outputs;
    }

    @Override
    public List<String> getDepfiles() {
      return depfiles;
    }

    @Override
    public String getBuildKey() {
      return buildKey;
    }

    @Override
    public ListenableFuture<Void> build(Environment environment)
        throws IOException, BuildActionException, InterruptedException {
      return action.run(environment);
    }
  }
}
