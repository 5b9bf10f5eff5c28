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

package dev.assemble.build.fingerprint;

import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * What a target consumed and produced the last time it ran successfully: its build key and the
 * fingerprints of every input and output, keyed by absolute path.
 */
public final class Stamp {
  private String buildKey;
  private TreeMap<String, String> inputs;
  private TreeMap<String, String> outputs;

  // For Gson.
  private Stamp() {}

  public Stamp(String buildKey, Map<String, String> inputs, Map<String, String> outputs) {
    this.buildKey = buildKey;
    this.inputs = new TreeMap<>(inputs);
    this.outputs = new TreeMap<>(outputs);
  }

  public String getBuildKey() {
    return buildKey == null ? "" : buildKey;
  }

  public ImmutableSortedMap<String, String> getInputs() {
    return inputs == null ? ImmutableSortedMap.of() : ImmutableSortedMap.copyOf(inputs);
  }

  public ImmutableSortedMap<String, String> getOutputs() {
    return outputs == null ? ImmutableSortedMap.of() : ImmutableSortedMap.copyOf(outputs);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Stamp stamp = (Stamp) o;
    return getBuildKey().equals(stamp.getBuildKey())
        && getInputs().equals(stamp.getInputs())
        && getOutputs().equals(stamp.getOutputs());
  }

  @Override
  public int hashCode() {
    return Objects.hash(getBuildKey(), getInputs(), getOutputs());
  }

  @Override
  public String toString() {
    return "Stamp{buildKey='" + getBuildKey() + "', inputs=" + getInputs()
        + ", outputs=" + getOutputs() + '}';
  }
}
