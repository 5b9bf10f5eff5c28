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

package dev.assemble.build.targets;

import com.google.common.base.CharMatcher;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import dev.assemble.build.BuildActionException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Reads an asset manifest of the form
 *
 * <pre>
 * {
 *   "assets": {"images/logo.png": "assets/logo.png"},
 *   "strings": {"NOTICES": "Licensed under ..."}
 * }
 * </pre>
 *
 * <p>Keys are paths relative to the asset output directory. Values of {@code assets} are files
 * relative to the project directory; values of {@code strings} are written as UTF-8 text.
 */
public class AssetManifestParser {
  private final Path projectDirectory;

  public AssetManifestParser(Path projectDirectory) {
    this.projectDirectory = projectDirectory;
  }

  public AssetManifest parse(Path manifest) throws IOException, BuildActionException {
    String json = new String(Files.readAllBytes(manifest), StandardCharsets.UTF_8);
    try {
      return parse(json);
    } catch (BuildActionException e) {
      throw new BuildActionException(
          String.format("Invalid asset manifest %s: %s", manifest, e.getMessage()), e);
    }
  }

  public AssetManifest parse(String json) throws BuildActionException {
    JsonObject root;
    try {
      JsonElement element = JsonParser.parseString(json);
      if (!element.isJsonObject()) {
        throw new BuildActionException("expected a JSON object");
      }
      root = element.getAsJsonObject();
    } catch (JsonParseException e) {
      throw new BuildActionException("malformed JSON", e);
    }

    AssetManifest.Builder builder = AssetManifest.builder();
    Set<String> seen = new HashSet<>();
    for (Map.Entry<String, JsonElement> entry : section(root, "assets").entrySet()) {
      String relativePath = checkRelativePath(entry.getKey(), seen);
      builder.addFile(
          relativePath, projectDirectory.resolve(stringValue(entry)).normalize());
    }
    for (Map.Entry<String, JsonElement> entry : section(root, "strings").entrySet()) {
      builder.addText(checkRelativePath(entry.getKey(), seen), stringValue(entry));
    }
    return builder.build();
  }

  private static JsonObject section(JsonObject root, String name) throws BuildActionException {
    JsonElement section = root.get(name);
    if (section == null || section.isJsonNull()) {
      return new JsonObject();
    }
    if (!section.isJsonObject()) {
      throw new BuildActionException(String.format("'%s' must be an object", name));
    }
    return section.getAsJsonObject();
  }

  private static String stringValue(Map.Entry<String, JsonElement> entry)
      throws BuildActionException {
    JsonElement value = entry.getValue();
    if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
      throw new BuildActionException(
          String.format("the value of '%s' must be a string", entry.getKey()));
    }
    return value.getAsString();
  }

  /** Asset paths use '/' and must stay inside the asset directory. */
  private static String checkRelativePath(String path, Set<String> seen)
      throws BuildActionException {
    String trimmed = CharMatcher.is('/').trimLeadingFrom(path);
    if (trimmed.isEmpty() || !trimmed.equals(path)) {
      throw new BuildActionException(String.format("'%s' is not a relative asset path", path));
    }
    for (String segment : trimmed.split("/", -1)) {
      if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
        throw new BuildActionException(String.format("'%s' is not a relative asset path", path));
      }
    }
    if (!seen.add(trimmed)) {
      throw new BuildActionException(String.format("'%s' is listed twice", path));
    }
    return trimmed;
  }
}
