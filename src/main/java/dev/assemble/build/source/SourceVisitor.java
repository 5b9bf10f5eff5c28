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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import dev.assemble.build.Environment;
import dev.assemble.build.artifacts.ArtifactId;
import dev.assemble.build.artifacts.BuildMode;
import dev.assemble.build.artifacts.HostArtifactId;
import dev.assemble.build.artifacts.TargetPlatform;
import dev.assemble.build.depfile.Depfile;
import dev.assemble.build.depfile.DepfileFormatException;
import dev.assemble.build.depfile.DepfileService;
import dev.assemble.build.events.Event;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;
import javax.annotation.Nullable;

/**
 * Resolves the {@link Source}s and depfiles of a target into concrete files.
 *
 * <p>A visitor works either on inputs or on outputs. The difference shows for depfiles, which
 * contribute their input or output side, and for missing files: a missing required input is an
 * error, a missing output is returned so that it can be checked after the target ran.
 *
 * <p>The visitor holds no mutable state; every visit returns its own {@link ResolvedFiles}.
 */
public class SourceVisitor {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final Environment environment;
  private final boolean inputs;
  private final DepfileService depfileService;

  public SourceVisitor(Environment environment) {
    this(environment, true);
  }

  public SourceVisitor(Environment environment, boolean inputs) {
    this.environment = Preconditions.checkNotNull(environment);
    this.inputs = inputs;
    this.depfileService = new DepfileService(environment.getProjectDirectory());
  }

  public ResolvedFiles resolve(List<? extends Source> sources)
      throws IOException, InvalidPatternException, MissingInputException {
    return resolve(sources, ImmutableList.of());
  }

  /** Visits {@code sources} and then {@code depfiles}, in declaration order. */
  public ResolvedFiles resolve(List<? extends Source> sources, List<String> depfiles)
      throws IOException, InvalidPatternException, MissingInputException {
    ResolvedFiles.Builder builder = ResolvedFiles.builder();
    for (Source source : sources) {
      builder.merge(visit(source));
    }
    for (String depfile : depfiles) {
      builder.merge(visitDepfile(depfile));
    }
    return builder.build();
  }

  public ResolvedFiles visit(Source source)
      throws IOException, InvalidPatternException, MissingInputException {
    switch (source.getKind()) {
      case PATTERN:
        Source.Pattern pattern = source.asPattern();
        return visitPattern(pattern.getTemplate(), pattern.isOptional());
      case ARTIFACT:
        Source.Artifact artifact = source.asArtifact();
        return visitArtifact(artifact.getId(), artifact.getPlatform(), artifact.getMode());
      case HOST_ARTIFACT:
        return visitHostArtifact(source.asHostArtifact().getId());
    }
    throw new IllegalStateException("Unknown source kind: " + source.getKind());
  }

  /**
   * Resolves a pattern. Without a wildcard this is exactly one file, or none if the pattern is
   * optional and the file is absent. With a wildcard the directory is listed, non-recursively,
   * after creating it if it does not exist yet.
   */
  public ResolvedFiles visitPattern(String template, boolean optional)
      throws IOException, InvalidPatternException, MissingInputException {
    PatternTemplate pattern = PatternTemplate.parse(template);
    Path path = pattern.resolvePath(environment);
    if (!pattern.hasWildcard()) {
      if (Files.isRegularFile(path)) {
        return ResolvedFiles.of(path);
      }
      if (optional) {
        logger.atFine().log("Skipping optional source %s, %s does not exist", template, path);
        return ResolvedFiles.empty();
      }
      if (inputs) {
        throw new MissingInputException(path, template);
      }
      return ResolvedFiles.of(path);
    }

    if (!Files.isDirectory(path)) {
      Files.createDirectories(path);
    }
    Predicate<String> filter = pattern.wildcardFilter(environment.getDefines());
    ResolvedFiles.Builder builder = ResolvedFiles.builder();
    try (Stream<Path> entries = Files.list(path)) {
      entries
          .filter(Files::isRegularFile)
          .filter(entry -> filter.test(entry.getFileName().toString()))
          .sorted()
          .forEach(builder::add);
    }
    return builder.build();
  }

  /**
   * Resolves an engine artifact. When the toolchain version is pinned, the version marker file
   * stands in for every artifact, so a full toolchain does not have to be hashed on each build.
   */
  public ResolvedFiles visitArtifact(
      ArtifactId artifact, @Nullable TargetPlatform platform, @Nullable BuildMode mode)
      throws IOException, MissingInputException {
    if (environment.getEngineVersion() != null) {
      return ResolvedFiles.of(environment.getVersionMarker());
    }
    Path path = environment.getArtifacts().getArtifactPath(artifact, platform, mode);
    return expand(path, artifact.toString());
  }

  public ResolvedFiles visitHostArtifact(HostArtifactId artifact)
      throws IOException, MissingInputException {
    if (environment.getEngineVersion() != null) {
      return ResolvedFiles.of(environment.getVersionMarker());
    }
    Path path = environment.getArtifacts().getHostArtifact(artifact);
    return expand(path, artifact.toString());
  }

  private ResolvedFiles expand(Path path, String declaration)
      throws IOException, MissingInputException {
    if (Files.isDirectory(path)) {
      ResolvedFiles.Builder builder = ResolvedFiles.builder();
      try (Stream<Path> entries = Files.walk(path)) {
        entries.filter(Files::isRegularFile).sorted().forEach(builder::add);
      }
      return builder.build();
    }
    if (inputs && !Files.exists(path)) {
      throw new MissingInputException(path, declaration);
    }
    return ResolvedFiles.of(path);
  }

  /**
   * Adds the files recorded in the depfile {@code name} under the build directory. A depfile that
   * does not exist yet is not an error: the result is only marked as containing a new depfile. An
   * unparsable or undecodable depfile is reported and otherwise ignored.
   */
  public ResolvedFiles visitDepfile(String name) throws IOException {
    Path file = environment.getBuildDirectory().resolve(name);
    if (!Files.exists(file)) {
      return ResolvedFiles.builder().markNewDepfile().build();
    }
    Depfile depfile;
    try {
      depfile = depfileService.parse(file);
    } catch (DepfileFormatException | CharacterCodingException e) {
      logger.atWarning().withCause(e).log("Ignoring depfile %s", file);
      environment.getReporter().handle(Event.error("Invalid depfile: " + file));
      return ResolvedFiles.empty();
    }
    return ResolvedFiles.builder()
        .addAll(inputs ? depfile.getInputs() : depfile.getOutputs())
        .build();
  }
}
