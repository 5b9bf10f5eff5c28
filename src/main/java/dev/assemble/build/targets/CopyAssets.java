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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import dev.assemble.build.BuildActionException;
import dev.assemble.build.Environment;
import dev.assemble.build.Target;
import dev.assemble.build.depfile.Depfile;
import dev.assemble.build.depfile.DepfileService;
import dev.assemble.build.source.Source;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Executors;

/**
 * Copies the assets listed in {@code assets.json} into the {@code assets} directory of the output
 * directory. The copied files are only known after reading the manifest, so they are recorded in
 * the depfile {@code copy_assets.d}.
 */
public class CopyAssets extends Target {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  public static final String NAME = "copy_assets";
  public static final String MANIFEST = "{PROJECT_DIR}/assets.json";
  public static final String DEPFILE = "copy_assets.d";
  public static final String ASSET_DIRECTORY = "assets";
  public static final int DEFAULT_MAX_OPEN_FILES = 64;

  private final int maxOpenFiles;

  public CopyAssets() {
    this(DEFAULT_MAX_OPEN_FILES);
  }

  public CopyAssets(int maxOpenFiles) {
    Preconditions.checkArgument(
        maxOpenFiles > 0, "maxOpenFiles must be positive: %s", maxOpenFiles);
    this.maxOpenFiles = maxOpenFiles;
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public List<Source> getInputs() {
    return ImmutableList.of(Source.pattern(MANIFEST));
  }

  @Override
  public List<String> getDepfiles() {
    return ImmutableList.of(DEPFILE);
  }

  @Override
  public ListenableFuture<Void> build(Environment environment)
      throws IOException, BuildActionException {
    Path manifestFile = environment.getProjectDirectory().resolve("assets.json");
    AssetManifest manifest =
        new AssetManifestParser(environment.getProjectDirectory()).parse(manifestFile);
    Path assetDirectory = environment.getOutputDirectory().resolve(ASSET_DIRECTORY);
    logger.atFine().log("Copying %d asset(s) to %s", manifest.size(), assetDirectory);

    ListeningExecutorService service =
        MoreExecutors.listeningDecorator(
            Executors.newFixedThreadPool(
                Math.min(maxOpenFiles, Runtime.getRuntime().availableProcessors()),
                new ThreadFactoryBuilder()
                    .setNameFormat(CopyAssets.class.getSimpleName() + "-%d")
                    .setDaemon(true)
                    .build()));
    ListenableFuture<Depfile> copied =
        new AssetCopier(service, maxOpenFiles).copy(manifest, assetDirectory);
    copied.addListener(service::shutdown, MoreExecutors.directExecutor());

    DepfileService depfileService = new DepfileService(environment.getProjectDirectory());
    return Futures.transformAsync(
        copied,
        depfile -> {
          depfileService.writeToFile(
              depfile.withAdditionalInputs(ImmutableList.of(manifestFile)),
              environment.getBuildDirectory().resolve(DEPFILE));
          return Futures.immediateVoidFuture();
        },
        MoreExecutors.directExecutor());
  }
}
