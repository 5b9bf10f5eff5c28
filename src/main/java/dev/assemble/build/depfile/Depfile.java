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

package dev.assemble.build.depfile;

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.Objects;

/** The input and output files recorded by a build step that discovered them while running. */
public final class Depfile {
  private final ImmutableList<Path> inputs;
  private final ImmutableList<Path> outputs;

  public Depfile(Iterable<Path> inputs, Iterable<Path> outputs) {
    this.inputs = ImmutableList.copyOf(inputs);
    this.outputs = ImmutableList.copyOf(outputs);
  }

  public ImmutableList<Path> getInputs() {
    return inputs;
  }

  public ImmutableList<Path> getOutputs() {
    return outputs;
  }

  /** Returns a copy with {@code extraInputs} appended to the inputs. */
  public Depfile withAdditionalInputs(Iterable<Path> extraInputs) {
    return new Depfile(
        ImmutableList.<Path>builder().addAll(inputs).addAll(extraInputs).build(), outputs);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Depfile depfile = (Depfile) o;
    return inputs.equals(depfile.inputs) && outputs.equals(depfile.outputs);
  }

  @Override
  public int hashCode() {
    return Objects.hash(inputs, outputs);
  }

  @Override
  public String toString() {
    return "Depfile{inputs=" + inputs + ", outputs=" + outputs + '}';
  }
}
