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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/** Keeps every event it receives, in order of arrival. */
public class StoredEventHandler implements EventHandler {
  private final List<Event> events = new ArrayList<>();

  @Override
  public synchronized void handle(Event event) {
    events.add(event);
  }

  public synchronized ImmutableList<Event> getEvents() {
    return ImmutableList.copyOf(events);
  }

  public synchronized boolean hasErrors() {
    return events.stream().anyMatch(event -> event.getKind().isError());
  }

  public synchronized ImmutableList<String> getMessages(EventKind kind) {
    return events.stream()
        .filter(event -> event.getKind() == kind)
        .map(Event::getMessage)
        .collect(ImmutableList.toImmutableList());
  }

  public synchronized void clear() {
    events.clear();
  }
}
