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

package dev.assemble.build.events;

import com.google.common.base.Preconditions;
import java.util.Objects;

/** A user-visible message emitted while resolving sources or running targets. */
public final class Event {
  private final EventKind kind;
  private final String message;

  private Event(EventKind kind, String message) {
    this.kind = Preconditions.checkNotNull(kind);
    this.message = Preconditions.checkNotNull(message);
  }

  public static Event of(EventKind kind, String message) {
    return new Event(kind, message);
  }

  public static Event error(String message) {
    return new Event(EventKind.ERROR, message);
  }

  public static Event warn(String message) {
    return new Event(EventKind.WARNING, message);
  }

  public static Event info(String message) {
    return new Event(EventKind.INFO, message);
  }

  public static Event progress(String message) {
    return new Event(EventKind.PROGRESS, message);
  }

  public EventKind getKind() {
    return kind;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Event event = (Event) o;
    return kind == event.kind && message.equals(event.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, message);
  }

  @Override
  public String toString() {
    return kind + ": " + message;
  }
}
