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
import com.google.common.io.MoreFiles;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import dev.assemble.build.depfile.Depfile;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Copies the assets of a manifest into a directory, one task per asset, with at most {@code
 * maxOpenFiles} copies in progress at a time.
 *
 * <p>Every asset is attempted, even if others fail. If the calling thread is interrupted while the
 * copies are being dispatched, no further assets are dispatched; the copies already started run to
 * completion and the returned future is cancelled.
 */
public class AssetCopier {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final ListeningExecutorService executor;
  private final int maxOpenFiles;

  public AssetCopier(ListeningExecutorService executor, int maxOpenFiles) {
    Preconditions.checkArgument(
        maxOpenFiles > 0, "maxOpenFiles must be positive: %s", maxOpenFiles);
    this.executor = Preconditions.checkNotNull(executor);
    this.maxOpenFiles = maxOpenFiles;
  }

  /**
   * Returns a depfile whose inputs are the copied files and whose outputs are the written files.
   * Fails with {@link AssetCopyException} naming every asset that could not be written.
   */
  public ListenableFuture<Depfile> copy(AssetManifest manifest, Path outputDirectory) {
    Semaphore permits = new Semaphore(maxOpenFiles);
    Map<String, ListenableFuture<Path>> tasks = new LinkedHashMap<>();
    boolean interrupted = false;
    for (Map.Entry<String, AssetContent> entry : manifest.getEntries().entrySet()) {
      if (Thread.currentThread().isInterrupted()) {
        logger.atInfo().log(
            "Interrupted after dispatching %d of %d asset(s)", tasks.size(), manifest.size());
        interrupted = true;
        break;
      }
      Path destination = outputDirectory.resolve(entry.getKey());
      AssetContent content = entry.getValue();
      tasks.put(entry.getKey(), executor.submit(() -> copyOne(content, destination, permits)));
    }

    ListenableFuture<Depfile> collected =
        Futures.whenAllComplete(tasks.values())
            .call(() -> collect(manifest, tasks), MoreExecutors.directExecutor());
    if (!interrupted) {
      return collected;
    }
    SettableFuture<Depfile> cancelled = SettableFuture.create();
    collected.addListener(() -> cancelled.cancel(false), MoreExecutors.directExecutor());
    return cancelled;
  }

  private static Path copyOne(AssetContent content, Path destination, Semaphore permits)
      throws IOException, InterruptedException {
    permits.acquire();
    try {
      Path parent = destination.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      content.asByteSource().copyTo(MoreFiles.asByteSink(destination));
      return destination;
    } finally {
      permits.release();
    }
  }

  private static Depfile collect(AssetManifest manifest, Map<String, ListenableFuture<Path>> tasks)
      throws AssetCopyException {
    ImmutableList.Builder<Path> inputs = ImmutableList.builder();
    ImmutableList.Builder<Path> outputs = ImmutableList.builder();
    Map<String, Throwable> failures = new LinkedHashMap<>();
    for (Map.Entry<String, ListenableFuture<Path>> task : tasks.entrySet()) {
      try {
        outputs.add(Futures.getDone(task.getValue()));
        Path source = manifest.getEntries().get(task.getKey()).getFile();
        if (source != null) {
          inputs.add(source);
        }
      } catch (ExecutionException e) {
        failures.put(task.getKey(), e.getCause());
      } catch (CancellationException e) {
        failures.put(task.getKey(), e);
      }
    }
    if (!failures.isEmpty()) {
      logger.atWarning().log("%d of %d asset(s) failed", failures.size(), tasks.size());
      throw new AssetCopyException(failures, tasks.size());
    }
    return new Depfile(inputs.build(), outputs.build());
  }
}
