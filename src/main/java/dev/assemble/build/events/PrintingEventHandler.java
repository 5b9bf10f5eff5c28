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

import java.io.PrintStream;

/**
 * Writes errors and warnings to one stream and everything else to another. {@link
 * EventKind#DEBUG} events are dropped unless verbose output was requested.
 */
public class PrintingEventHandler implements EventHandler {
  private final PrintStream out;
  private final PrintStream err;
  private final boolean verbose;

  public PrintingEventHandler(PrintStream out, PrintStream err, boolean verbose) {
    this.out = out;
    this.err = err;
    this.verbose = verbose;
  }

  @Override
  public synchronized void handle(Event event) {
    switch (event.getKind()) {
      case ERROR:
        err.println("ERROR: " + event.getMessage());
        break;
      case WARNING:
        err.println("WARNING: " + event.getMessage());
        break;
      case INFO:
      case PROGRESS:
        out.println(event.getMessage());
        break;
      case DEBUG:
        if (verbose) {
          out.println("DEBUG: " + event.getMessage());
        }
        break;
      default:
        err.println("Unknown message type: " + event);
    }
  }
}
