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

import com.google.common.collect.ImmutableSet;
import java.util.Set;

/** How one target fared in a build, and how long it took. */
public final class PerformanceMeasurement {
  /** The outcome of a target. */
  public enum Status {
    EXECUTED,
    SKIPPED,
    FAILED,
    BLOCKED
  }

  private final String name;
  private final long elapsedMillis;
  private final Status status;
  private final ImmutableSet<InvalidatedReason> reasons;

  public PerformanceMeasurement(
      String name, long elapsedMillis, Status status, Set<InvalidatedReason> reasons) {
    this.name = name;
    this.elapsedMillis = elapsedMillis;
    this.status = status;
    this.reasons = ImmutableSet.copyOf(reasons);
  }

  public String getName() {
    return name;
  }

  public long getElapsedMillis() {
    return elapsedMillis;
  }

  public Status getStatus() {
    return status;
  }

  /** Why the target ran; empty for skipped and blocked targets. */
  public ImmutableSet<InvalidatedReason> getReasons() {
    return reasons;
  }

  @Override
  public String toString() {
    return String.format("%s: %s in %d ms %s", name, status, elapsedMillis, reasons);
  }
}
