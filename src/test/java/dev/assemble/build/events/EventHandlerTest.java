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

import static com.google.common.truth.Truth.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class EventHandlerTest {
  @Test
  public void testStoredEventsByKind() {
    StoredEventHandler handler = new StoredEventHandler();
    handler.handle(Event.info("one"));
    handler.handle(Event.warn("two"));
    handler.handle(Event.info("three"));
    assertThat(handler.hasErrors()).isFalse();
    assertThat(handler.getMessages(EventKind.INFO)).containsExactly("one", "three").inOrder();

    handler.handle(Event.error("four"));
    assertThat(handler.hasErrors()).isTrue();
    assertThat(handler.getEvents()).hasSize(4);

    handler.clear();
    assertThat(handler.getEvents()).isEmpty();
  }

  @Test
  public void testPrintingSplitsStreams() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ByteArrayOutputStream err = new ByteArrayOutputStream();
    PrintingEventHandler handler =
        new PrintingEventHandler(new PrintStream(out, true), new PrintStream(err, true), false);
    handler.handle(Event.progress("Running a"));
    handler.handle(Event.error("broken"));
    handler.handle(Event.of(EventKind.DEBUG, "hidden"));

    assertThat(new String(out.toByteArray(), StandardCharsets.UTF_8).trim())
        .isEqualTo("Running a");
    assertThat(new String(err.toByteArray(), StandardCharsets.UTF_8).trim())
        .isEqualTo("ERROR: broken");
  }
}
