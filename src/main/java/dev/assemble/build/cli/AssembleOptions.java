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

import com.google.common.collect.ImmutableMap;
import dev.assemble.build.targets.CopyAssets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/** Command line options of {@link AssembleCommand}. */
public class AssembleOptions {

  @Option(name = "--project-dir", metaVar = "DIR", usage = "project directory (default: .)")
  private String projectDirectory = ".";

  @Option(
      name = "--build-dir",
      metaVar = "DIR",
      usage = "directory for stamps and depfiles (default: <project>/.assemble/<config hash>)")
  @Nullable
  private String buildDirectory;

  @Option(
      name = "--toolchain-root",
      metaVar = "DIR",
      usage = "toolchain installation (default: the project directory)")
  @Nullable
  private String toolchainRoot;

  @Option(
      name = "--cache-dir",
      metaVar = "DIR",
      usage = "artifact cache (default: <toolchain root>/bin/cache)")
  @Nullable
  private String cacheDirectory;

  @Option(
      name = "--output-dir",
      metaVar = "DIR",
      usage = "output directory (default: <project>/build)")
  @Nullable
  private String outputDirectory;

  @Option(
      name = "--engine-version",
      metaVar = "VERSION",
      usage = "pinned engine version; artifacts are fingerprinted by the version marker only")
  @Nullable
  private String engineVersion;

  @Option(name = "-D", metaVar = "KEY=VALUE", usage = "build-wide define, may be repeated")
  private List<String> defines = new ArrayList<>();

  @Option(name = "--jobs", aliases = "-j", metaVar = "N", usage = "targets run in parallel")
  private int jobs = Runtime.getRuntime().availableProcessors();

  @Option(name = "--max-open-files", metaVar = "N", usage = "asset copies in parallel")
  private int maxOpenFiles = CopyAssets.DEFAULT_MAX_OPEN_FILES;

  @Option(
      name = "--file-store",
      metaVar = "hash|timestamp",
      usage = "how files are fingerprinted (default: hash)")
  private String fileStore = "hash";

  @Option(name = "--verbose", aliases = "-v", usage = "print debug messages")
  private boolean verbose;

  @Argument(index = 0, required = true, metaVar = "TARGET", usage = "target to build")
  private String target;

  public String getProjectDirectory() {
    return projectDirectory;
  }

  @Nullable
  public String getBuildDirectory() {
    return buildDirectory;
  }

  @Nullable
  public String getToolchainRoot() {
    return toolchainRoot;
  }

  @Nullable
  public String getCacheDirectory() {
    return cacheDirectory;
  }

  @Nullable
  public String getOutputDirectory() {
    return outputDirectory;
  }

  @Nullable
  public String getEngineVersion() {
    return engineVersion;
  }

  public int getJobs() {
    return jobs;
  }

  public int getMaxOpenFiles() {
    return maxOpenFiles;
  }

  public String getFileStore() {
    return fileStore;
  }

  public boolean isVerbose() {
    return verbose;
  }

  public String getTarget() {
    return target;
  }

  /** Parses the {@code -D} options, later definitions of a key winning. */
  public ImmutableMap<String, String> getDefines(CmdLineParser parser) throws CmdLineException {
    Map<String, String> result = new LinkedHashMap<>();
    for (String define : defines) {
      int idx = define.indexOf('=');
      if (idx <= 0) {
        throw new CmdLineException(
            parser, String.format("-D expects KEY=VALUE, got '%s'", define));
      }
      result.put(define.substring(0, idx), define.substring(idx + 1));
    }
    return ImmutableMap.copyOf(result);
  }
}
