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

package dev.assemble.build.source;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import dev.assemble.build.Environment;
import dev.assemble.build.Environment.Root;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import javax.annotation.Nullable;

/**
 * A parsed source pattern such as {@code {BUILD_DIR}/app.so} or {@code {PROJECT_DIR}/res/*.png}.
 *
 * <p>The first segment must be one of the {@link Root} tokens. At most one {@code *} is allowed,
 * and only in the last segment. The other segments may reference build defines, see {@link
 * PatternVariables}.
 */
public final class PatternTemplate {
  private static final Splitter SEGMENT_SPLITTER = Splitter.on('/').omitEmptyStrings();
  private static final CharMatcher WILDCARD = CharMatcher.is('*');

  private final String pattern;
  private final Root root;
  private final ImmutableList<String> segments;
  @Nullable private final String wildcardSegment;

  private PatternTemplate(
      String pattern,
      Root root,
      ImmutableList<String> segments,
      @Nullable String wildcardSegment) {
    this.pattern = pattern;
    this.root = root;
    this.segments = segments;
    this.wildcardSegment = wildcardSegment;
  }

  public static PatternTemplate parse(String pattern) throws InvalidPatternException {
    Preconditions.checkNotNull(pattern);
    List<String> parts = SEGMENT_SPLITTER.splitToList(pattern);
    if (parts.isEmpty()) {
      throw new InvalidPatternException(pattern, "the pattern is empty");
    }
    Root root = Root.fromToken(parts.get(0));
    if (root == null) {
      throw new InvalidPatternException(
          pattern,
          String.format(
              "it must start with one of %s, but starts with '%s'",
              Joiner.on(", ").join(tokens()), parts.get(0)));
    }
    int wildcards = WILDCARD.countIn(pattern);
    if (wildcards > 1) {
      throw new InvalidPatternException(pattern, "only one wildcard is allowed");
    }
    String last = parts.get(parts.size() - 1);
    if (wildcards == 1 && !last.contains("*")) {
      throw new InvalidPatternException(
          pattern, "a wildcard is only allowed in the last segment");
    }
    if (wildcards == 1 && parts.size() == 1) {
      throw new InvalidPatternException(pattern, "a wildcard can not replace the root");
    }
    List<String> rest = parts.subList(1, parts.size());
    if (wildcards == 1) {
      return new PatternTemplate(
          pattern, root, ImmutableList.copyOf(rest.subList(0, rest.size() - 1)), last);
    }
    return new PatternTemplate(pattern, root, ImmutableList.copyOf(rest), null);
  }

  private static ImmutableList<String> tokens() {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (Root root : Root.values()) {
      builder.add(root.getToken());
    }
    return builder.build();
  }

  public String getPattern() {
    return pattern;
  }

  public Root getRoot() {
    return root;
  }

  public boolean hasWildcard() {
    return wildcardSegment != null;
  }

  /**
   * Substitutes every variable reference with the given defines, without touching the file system.
   * Used to report undefined variables before anything runs.
   */
  public void checkVariables(Map<String, String> defines) throws InvalidPatternException {
    for (String segment : segments) {
      PatternVariables.expand(pattern, segment, defines);
    }
    if (wildcardSegment != null) {
      PatternVariables.expand(pattern, wildcardSegment, defines);
    }
  }

  /**
   * Resolves the pattern to a path. For a wildcard pattern this is the directory that has to be
   * listed.
   */
  public Path resolvePath(Environment environment) throws IOException, InvalidPatternException {
    Path path = environment.resolveDirectory(root);
    for (String segment : segments) {
      path = path.resolve(PatternVariables.expand(pattern, segment, environment.getDefines()));
    }
    return path.normalize();
  }

  /**
   * Returns the file name filter of a wildcard pattern. The text before the {@code *} must be a
   * prefix of the name and the text after it a suffix of what remains, so {@code foo_*_.txt}
   * matches {@code foo_b_.txt} but not {@code foo_.txt}.
   */
  public Predicate<String> wildcardFilter(Map<String, String> defines)
      throws InvalidPatternException {
    Preconditions.checkState(wildcardSegment != null, "not a wildcard pattern: %s", pattern);
    int idx = wildcardSegment.indexOf('*');
    String prefix = PatternVariables.expand(pattern, wildcardSegment.substring(0, idx), defines);
    String suffix = PatternVariables.expand(pattern, wildcardSegment.substring(idx + 1), defines);
    return fileName ->
        fileName.startsWith(prefix) && fileName.substring(prefix.length()).endsWith(suffix);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return pattern.equals(((PatternTemplate) o).pattern);
  }

  @Override
  public int hashCode() {
    return Objects.hash(pattern);
  }

  @Override
  public String toString() {
    return pattern;
  }
}
