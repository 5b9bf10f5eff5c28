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

import com.google.common.flogger.GoogleLogger;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import dev.assemble.build.events.Event;
import dev.assemble.build.events.EventHandler;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.annotation.Nullable;

/** Keeps one JSON {@link Stamp} per target, as {@code <name>.stamp} in the build directory. */
public class StampStore {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();
  private static final String SUFFIX = ".stamp";

  private final Path directory;
  private final EventHandler reporter;
  private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  public StampStore(Path directory, EventHandler reporter) {
    this.directory = directory;
    this.reporter = reporter;
  }

  public Path getStampFile(String targetName) {
    return directory.resolve(targetName + SUFFIX);
  }

  /**
   * Returns the stamp of {@code targetName}, or null if there is none. An unreadable stamp is
   * reported and treated as absent, which makes the target run again.
   */
  @Nullable
  public Stamp read(String targetName) throws IOException {
    Path file = getStampFile(targetName);
    if (!Files.exists(file)) {
      return null;
    }
    String json = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    try {
      Stamp stamp = gson.fromJson(json, Stamp.class);
      if (stamp == null) {
        throw new JsonParseException("empty stamp");
      }
      return stamp;
    } catch (JsonParseException e) {
      logger.atWarning().withCause(e).log("Discarding stamp %s", file);
      reporter.handle(Event.warn("Discarding corrupted stamp file " + file));
      return null;
    }
  }

  public void write(String targetName, Stamp stamp) throws IOException {
    Files.createDirectories(directory);
    Files.write(getStampFile(targetName), gson.toJson(stamp).getBytes(StandardCharsets.UTF_8));
  }

  public void delete(String targetName) throws IOException {
    Files.deleteIfExists(getStampFile(targetName));
  }
}
