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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.Objects;

/**
 * A dependency cycle together with the path that leads to it from the requested target. The head
 * of the path is the requested target; if the requested target is itself part of the cycle, the
 * path is empty and the cycle starts with it.
 */
public final class CycleInfo {
  private final ImmutableList<String> pathToCycle;
  private final ImmutableList<String> cycle;

  CycleInfo(Iterable<String> pathToCycle, Iterable<String> cycle) {
    this.pathToCycle = ImmutableList.copyOf(pathToCycle);
    this.cycle = ImmutableList.copyOf(cycle);
    checkArgument(!this.cycle.isEmpty(), "Cycle cannot be empty: %s", this);
  }

  public ImmutableList<String> getCycle() {
    return cycle;
  }

  public ImmutableList<String> getPathToCycle() {
    return pathToCycle;
  }

  public String getTopKey() {
    return pathToCycle.isEmpty() ? cycle.get(0) : pathToCycle.get(0);
  }

  /** Renders the cycle closed, for example {@code a -> b -> c -> a}. */
  public String describeCycle() {
    return String.join(" -> ", cycle) + " -> " + cycle.get(0);
  }

  @Override
  public int hashCode() {
    return Objects.hash(cycle, pathToCycle);
  }

  @Override
  public boolean equals(Object that) {
    if (this == that) {
      return true;
    }
    if (!(that instanceof CycleInfo)) {
      return false;
    }
    CycleInfo thatCycle = (CycleInfo) that;
    return thatCycle.cycle.equals(this.cycle) && thatCycle.pathToCycle.equals(this.pathToCycle);
  }

  @Override
  public String toString() {
    return "CycleInfo{pathToCycle=" + pathToCycle + ", cycle=" + cycle + '}';
  }
}
