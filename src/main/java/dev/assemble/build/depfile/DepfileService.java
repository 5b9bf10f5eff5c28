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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads and writes depfiles: single make rules of the form {@code out1 out2: in1 in2}.
 *
 * <p>Spaces inside a path are written as {@code \ }, backslashes as {@code \\} and a leading
 * {@code #} as {@code \#}; when reading, any {@code \<char>} becomes {@code <char>}. Depfiles
 * written by compilers are accepted too: lines continued with a trailing backslash are joined, and
 * the empty rules {@code -MP} adds for every header are ignored. Relative paths are resolved
 * against the base directory.
 */
public class DepfileService {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();
  private static final String SEPARATOR = ": ";

  private final Path baseDirectory;

  public DepfileService(Path baseDirectory) {
    this.baseDirectory = Preconditions.checkNotNull(baseDirectory);
  }

  public Depfile parse(Path depfile) throws IOException, DepfileFormatException {
    try (DepfileLineReader reader = DepfileLineReader.open(depfile)) {
      return parse(reader, depfile.toString());
    }
  }

  public Depfile parse(String contents) throws DepfileFormatException {
    try (DepfileLineReader reader = new DepfileLineReader(new StringReader(contents))) {
      return parse(reader, "<string>");
    } catch (IOException e) {
      throw new IllegalStateException("Reading a string can not fail", e);
    }
  }

  private Depfile parse(DepfileLineReader reader, String description)
      throws IOException, DepfileFormatException {
    String rule = null;
    String line;
    while ((line = reader.readLine()) != null) {
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("#")) {
        continue;
      }
      if (rule == null) {
        rule = line;
        continue;
      }
      if (trimmed.endsWith(":") && !trimmed.contains(SEPARATOR)) {
        // Empty rule for a single prerequisite, as emitted by 'gcc -MP'.
        continue;
      }
      throw new DepfileFormatException(
          String.format(
              "Invalid depfile %s: expected a single rule, found '%s'", description, line));
    }
    if (rule == null) {
      throw new DepfileFormatException(
          String.format("Invalid depfile %s: it is empty", description));
    }

    String outputsText;
    String inputsText;
    int idx = rule.indexOf(SEPARATOR);
    if (idx >= 0) {
      outputsText = rule.substring(0, idx);
      inputsText = rule.substring(idx + SEPARATOR.length());
    } else if (rule.trim().endsWith(":")) {
      String trimmed = rule.trim();
      outputsText = trimmed.substring(0, trimmed.length() - 1);
      inputsText = "";
    } else {
      throw new DepfileFormatException(
          String.format("Invalid depfile %s: no ': ' separator in '%s'", description, rule));
    }
    Depfile depfile = new Depfile(toPaths(inputsText), toPaths(outputsText));
    logger.atFine().log(
        "Parsed depfile %s: %d input(s), %d output(s)",
        description, depfile.getInputs().size(), depfile.getOutputs().size());
    return depfile;
  }

  private ImmutableList<Path> toPaths(String text) {
    ImmutableList.Builder<Path> builder = ImmutableList.builder();
    for (String token : tokenize(text)) {
      builder.add(baseDirectory.resolve(token).normalize());
    }
    return builder.build();
  }

  /**
   * Splits on whitespace that is not escaped and reverses escape sequences. Empty and repeated
   * tokens are dropped.
   */
  static ImmutableList<String> tokenize(String text) {
    Set<String> tokens = new LinkedHashSet<>();
    StringBuilder current = new StringBuilder();
    int i = 0;
    while (i < text.length()) {
      char ch = text.charAt(i);
      if (ch == '\\' && i + 1 < text.length()) {
        current.append(text.charAt(i + 1));
        i += 2;
        continue;
      }
      if (Character.isWhitespace(ch)) {
        if (current.length() > 0) {
          tokens.add(current.toString());
          current.setLength(0);
        }
      } else {
        current.append(ch);
      }
      i++;
    }
    if (current.length() > 0) {
      tokens.add(current.toString());
    }
    return ImmutableList.copyOf(tokens);
  }

  public String serialize(Depfile depfile) {
    return join(depfile.getOutputs()) + SEPARATOR + join(depfile.getInputs()) + "\n";
  }

  public void writeToFile(Depfile depfile, Path file) throws IOException {
    Path parent = file.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.write(file, serialize(depfile).getBytes(StandardCharsets.UTF_8));
  }

  private static String join(List<Path> paths) {
    return Joiner.on(' ').join(paths.stream().map(path -> escape(path.toString())).iterator());
  }

  /** A leading {@code #} is escaped too, so that a rule line is never read as a comment. */
  static String escape(String path) {
    String escaped = path.replace("\\", "\\\\").replace(" ", "\\ ");
    return escaped.startsWith("#") ? "\\" + escaped : escaped;
  }
}
