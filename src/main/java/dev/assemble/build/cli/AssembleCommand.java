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

package dev.assemble.build.cli;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import dev.assemble.build.BuildConfigurationException;
import dev.assemble.build.BuildResult;
import dev.assemble.build.BuildSystem;
import dev.assemble.build.BuildSystemConfig;
import dev.assemble.build.Environment;
import dev.assemble.build.Target;
import dev.assemble.build.artifacts.CachedArtifactResolver;
import dev.assemble.build.events.PrintingEventHandler;
import dev.assemble.build.fingerprint.FileStoreStrategy;
import dev.assemble.build.targets.CopyAssets;
import java.io.PrintStream;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.util.function.Function;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;

/**
 * Entry point of the {@code assemble} tool: builds one named target of a project and prints which
 * targets ran and which were up to date.
 */
public class AssembleCommand {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  public static final int EXIT_SUCCESS = 0;
  public static final int EXIT_BUILD_FAILURE = 1;
  public static final int EXIT_USAGE_ERROR = 2;

  private static final ImmutableMap<String, Function<AssembleOptions, Target>> TARGETS =
      ImmutableMap.of(CopyAssets.NAME, options -> new CopyAssets(options.getMaxOpenFiles()));

  private final PrintStream out;
  private final PrintStream err;
  private final FileSystem fileSystem;

  public AssembleCommand(PrintStream out, PrintStream err, FileSystem fileSystem) {
    this.out = out;
    this.err = err;
    this.fileSystem = fileSystem;
  }

  public int run(String... args) throws InterruptedException {
    AssembleOptions options = new AssembleOptions();
    CmdLineParser parser = new CmdLineParser(options);
    ImmutableMap<String, String> defines;
    FileStoreStrategy strategy;
    try {
      parser.parseArgument(args);
      defines = options.getDefines(parser);
      strategy = FileStoreStrategy.fromName(options.getFileStore());
      if (strategy == null) {
        throw new CmdLineException(
            parser, "Unknown file store '" + options.getFileStore() + "'");
      }
      if (options.getJobs() < 1 || options.getMaxOpenFiles() < 1) {
        throw new CmdLineException(
            parser, "--jobs and --max-open-files must be positive");
      }
      if (!TARGETS.containsKey(options.getTarget())) {
        throw new CmdLineException(
            parser,
            String.format(
                "Unknown target '%s', expected one of %s",
                options.getTarget(), TARGETS.keySet()));
      }
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      err.println("Usage: assemble [options] TARGET");
      parser.printUsage(err);
      return EXIT_USAGE_ERROR;
    }

    Environment environment = createEnvironment(options, defines);
    Target target = TARGETS.get(options.getTarget()).apply(options);
    BuildSystem buildSystem =
        new BuildSystem(
            BuildSystemConfig.builder()
                .setResourcePoolSize(options.getJobs())
                .setFileStoreStrategy(strategy)
                .build());

    BuildResult result;
    try {
      result = buildSystem.build(target, environment);
    } catch (BuildConfigurationException e) {
      logger.atFine().withCause(e).log("Invalid build configuration");
      err.println("ERROR: " + e.getMessage());
      return EXIT_USAGE_ERROR;
    }

    out.println("Executed: " + Joiner.on(", ").join(result.getExecutedTargets()));
    out.println("Skipped: " + Joiner.on(", ").join(result.getSkippedTargets()));
    if (!result.isSuccess()) {
      Throwable failure = result.getFirstFailure();
      err.println(
          "Build failed: "
              + (failure != null ? failure.getMessage() : "blocked " + result.getBlockedTargets()));
      return EXIT_BUILD_FAILURE;
    }
    return EXIT_SUCCESS;
  }

  private Environment createEnvironment(
      AssembleOptions options, ImmutableMap<String, String> defines) {
    Path projectDirectory = absolute(options.getProjectDirectory());
    Path toolchainRoot =
        options.getToolchainRoot() != null
            ? absolute(options.getToolchainRoot())
            : projectDirectory;
    Path cacheDirectory =
        options.getCacheDirectory() != null
            ? absolute(options.getCacheDirectory())
            : toolchainRoot.resolve("bin").resolve("cache");
    Environment.Builder builder =
        Environment.builder()
            .setProjectDirectory(projectDirectory)
            .setToolchainRootDirectory(toolchainRoot)
            .setCacheDirectory(cacheDirectory)
            .setOutputDirectory(
                options.getOutputDirectory() != null
                    ? absolute(options.getOutputDirectory())
                    : projectDirectory.resolve("build"))
            .setEngineVersion(options.getEngineVersion())
            .addDefines(defines)
            .setArtifacts(new CachedArtifactResolver(cacheDirectory))
            .setReporter(new PrintingEventHandler(out, err, options.isVerbose()));
    if (options.getBuildDirectory() != null) {
      builder.setBuildDirectory(absolute(options.getBuildDirectory()));
    }
    return builder.build();
  }

  private Path absolute(String path) {
    return fileSystem.getPath(path).toAbsolutePath().normalize();
  }

  public static void main(String[] args) throws InterruptedException {
    System.exit(new AssembleCommand(System.out, System.err, FileSystems.getDefault()).run(args));
  }
}
