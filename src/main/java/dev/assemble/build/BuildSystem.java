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

package dev.assemble.build;

import com.google.common.base.Preconditions;
import com.google.common.flogger.GoogleLogger;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import dev.assemble.build.graph.TargetGraph;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Builds a target and everything it depends on, running only the targets whose inputs, outputs or
 * build key changed since they last succeeded.
 *
 * <p>Configuration errors (duplicate names, dependency cycles, invalid patterns) are thrown before
 * any target runs. Errors of individual targets are collected in the {@link BuildResult}: the
 * targets depending on a failed target are blocked, all others still run.
 */
public class BuildSystem {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final BuildSystemConfig config;

  public BuildSystem() {
    this(BuildSystemConfig.defaults());
  }

  public BuildSystem(BuildSystemConfig config) {
    this.config = Preconditions.checkNotNull(config);
  }

  public BuildResult build(Target target, Environment environment)
      throws BuildConfigurationException, InterruptedException {
    TargetGraph graph = TargetGraph.create(target);
    graph.checkPatterns(environment.getDefines());
    logger.atInfo().log(
        "Building %s: %d target(s), %d thread(s)",
        target.getName(), graph.size(), config.getResourcePoolSize());

    ThreadFactory threadFactory =
        new ThreadFactoryBuilder()
            .setNameFormat(BuildSystem.class.getSimpleName() + "-%d")
            .setDaemon(true)
            .build();
    ListeningExecutorService service =
        MoreExecutors.listeningDecorator(
            Executors.newFixedThreadPool(config.getResourcePoolSize(), threadFactory));
    try {
      return new BuildInstance(graph, environment, config, service).run();
    } finally {
      MoreExecutors.shutdownAndAwaitTermination(service, 10, TimeUnit.SECONDS);
    }
  }
}
