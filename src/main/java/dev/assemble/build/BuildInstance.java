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

import com.google.common.base.Joiner;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.google.common.flogger.GoogleLogger;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import dev.assemble.build.PerformanceMeasurement.Status;
import dev.assemble.build.events.Event;
import dev.assemble.build.fingerprint.FileStore;
import dev.assemble.build.fingerprint.Stamp;
import dev.assemble.build.fingerprint.StampStore;
import dev.assemble.build.graph.TargetGraph;
import dev.assemble.build.source.InvalidPatternException;
import dev.assemble.build.source.ResolvedFiles;
import dev.assemble.build.source.SourceVisitor;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import javax.annotation.Nullable;

/** One run of the {@link BuildSystem} over a validated target graph. */
final class BuildInstance {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final TargetGraph graph;
  private final Environment environment;
  private final ListeningExecutorService executor;
  private final FileStore fileStore;
  private final StampStore stampStore;
  private final SourceVisitor inputVisitor;
  private final SourceVisitor outputVisitor;

  BuildInstance(
      TargetGraph graph,
      Environment environment,
      BuildSystemConfig config,
      ListeningExecutorService executor) {
    this.graph = graph;
    this.environment = environment;
    this.executor = executor;
    this.fileStore = new FileStore(config.getFileStoreStrategy());
    this.stampStore = new StampStore(environment.getBuildDirectory(), environment.getReporter());
    this.inputVisitor = new SourceVisitor(environment, true);
    this.outputVisitor = new SourceVisitor(environment, false);
  }

  /**
   * Schedules every target once all of its dependencies completed, then waits for the whole graph.
   * Interrupting the calling thread cancels the targets that did not finish yet.
   */
  BuildResult run() throws InterruptedException {
    Map<String, ListenableFuture<TargetOutcome>> futures = Maps.newLinkedHashMap();
    for (Target target : graph.topologicalOrder()) {
      List<ListenableFuture<TargetOutcome>> dependencies = Lists.newArrayList();
      for (Target dependency : target.getDependencies()) {
        dependencies.add(futures.get(dependency.getName()));
      }
      futures.put(
          target.getName(),
          Futures.whenAllComplete(dependencies)
              .callAsync(() -> invoke(target, dependencies), executor));
    }

    try {
      Futures.successfulAsList(futures.values()).get();
    } catch (InterruptedException e) {
      for (Map.Entry<String, ListenableFuture<TargetOutcome>> entry : futures.entrySet()) {
        if (entry.getValue().cancel(true)) {
          forgetStamp(entry.getKey());
        }
      }
      throw e;
    } catch (ExecutionException e) {
      throw new IllegalStateException("successfulAsList does not fail", e);
    }

    BuildResult.Builder result = BuildResult.builder();
    for (Map.Entry<String, ListenableFuture<TargetOutcome>> entry : futures.entrySet()) {
      TargetOutcome outcome = collectOutcome(entry.getKey(), entry.getValue());
      result.addPerformance(outcome.measurement);
      switch (outcome.measurement.getStatus()) {
        case EXECUTED:
          result.addExecuted(outcome.getName()).addFiles(outcome.inputs, outcome.outputs);
          break;
        case SKIPPED:
          result.addSkipped(outcome.getName()).addFiles(outcome.inputs, outcome.outputs);
          break;
        case FAILED:
          result.addFailure(outcome.getName(), outcome.failure);
          break;
        case BLOCKED:
          result.addBlocked(outcome.getName());
          break;
      }
    }
    BuildResult buildResult = result.build();
    logger.atInfo().log("Build finished: %s", buildResult);
    return buildResult;
  }

  private static TargetOutcome getOutcome(String name, ListenableFuture<TargetOutcome> future) {
    try {
      return Futures.getDone(future);
    } catch (ExecutionException e) {
      return TargetOutcome.failed(name, e.getCause(), 0, ImmutableSet.of());
    } catch (CancellationException e) {
      return TargetOutcome.failed(name, e, 0, ImmutableSet.of());
    }
  }

  /**
   * Returns the outcome of a finished target. A future that failed or was cancelled itself, for
   * example because the action threw an {@link Error}, has not gone through {@link #fail} yet.
   */
  private TargetOutcome collectOutcome(String name, ListenableFuture<TargetOutcome> future) {
    try {
      return Futures.getDone(future);
    } catch (ExecutionException e) {
      return fail(name, e.getCause(), 0, ImmutableSet.of());
    } catch (CancellationException e) {
      return fail(name, e, 0, ImmutableSet.of());
    }
  }

  private ListenableFuture<TargetOutcome> invoke(
      Target target, List<ListenableFuture<TargetOutcome>> dependencies) {
    String name = target.getName();
    boolean dependencyExecuted = false;
    for (int i = 0; i < dependencies.size(); i++) {
      TargetOutcome outcome =
          getOutcome(target.getDependencies().get(i).getName(), dependencies.get(i));
      Status status = outcome.measurement.getStatus();
      if (status == Status.FAILED || status == Status.BLOCKED) {
        logger.atFine().log("%s is blocked by %s", name, outcome.getName());
        return Futures.immediateFuture(TargetOutcome.blocked(name));
      }
      dependencyExecuted |= status == Status.EXECUTED;
    }

    Stopwatch stopwatch = Stopwatch.createStarted();
    Set<InvalidatedReason> reasons = EnumSet.noneOf(InvalidatedReason.class);
    Stamp previous;
    ListenableFuture<Void> action;
    try {
      ResolvedFiles inputs = inputVisitor.resolve(target.getInputs(), target.getDepfiles());
      ResolvedFiles outputs = outputVisitor.resolve(target.getOutputs(), target.getDepfiles());
      previous = stampStore.read(name);
      if (dependencyExecuted) {
        reasons.add(InvalidatedReason.DEPENDENCY_EXECUTED);
      }
      computeChanges(target, inputs, outputs, previous, reasons);
      if (reasons.isEmpty()) {
        logger.atFine().log("Skipping %s, nothing changed", name);
        return Futures.immediateFuture(
            TargetOutcome.skipped(
                name,
                stopwatch.elapsed().toMillis(),
                inputs.getSources(),
                outputs.getSources()));
      }
      logger.atInfo().log("Running %s: %s", name, reasons);
      environment.getReporter().handle(Event.progress("Running " + name));
      action = target.build(environment);
      if (action == null) {
        action = Futures.immediateFailedFuture(
            new NullPointerException(name + " returned no future from build()"));
      }
    } catch (IOException | BuildActionException | InvalidPatternException | RuntimeException e) {
      return Futures.immediateFuture(fail(name, e, stopwatch, reasons));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return Futures.immediateFuture(fail(name, e, stopwatch, reasons));
    }

    ListenableFuture<Void> started = action;
    return Futures.whenAllComplete(started)
        .call(() -> finish(target, started, previous, reasons, stopwatch), executor);
  }

  /**
   * Compares what the target would read and write now with its stamp. A file is compared by its
   * fingerprint, so a file that was only touched does not count as changed.
   */
  private void computeChanges(
      Target target,
      ResolvedFiles inputs,
      ResolvedFiles outputs,
      @Nullable Stamp previous,
      Set<InvalidatedReason> reasons)
      throws IOException {
    if (inputs.containsNewDepfile() || outputs.containsNewDepfile()) {
      reasons.add(InvalidatedReason.NEW_DEPFILE);
    }
    if (previous == null) {
      reasons.add(InvalidatedReason.NO_STAMP);
      return;
    }
    if (!previous.getBuildKey().equals(target.getBuildKey())) {
      reasons.add(InvalidatedReason.BUILD_KEY_CHANGED);
    }
    compareFiles(
        inputs.getSources(),
        previous.getInputs(),
        reasons,
        InvalidatedReason.INPUT_SET_CHANGED,
        InvalidatedReason.INPUT_CHANGED,
        InvalidatedReason.INPUT_MISSING);
    compareFiles(
        outputs.getSources(),
        previous.getOutputs(),
        reasons,
        InvalidatedReason.OUTPUT_SET_CHANGED,
        InvalidatedReason.OUTPUT_CHANGED,
        InvalidatedReason.OUTPUT_MISSING);
  }

  private void compareFiles(
      List<Path> current,
      Map<String, String> stamped,
      Set<InvalidatedReason> reasons,
      InvalidatedReason setChanged,
      InvalidatedReason changed,
      InvalidatedReason missing)
      throws IOException {
    Set<String> names = Sets.newHashSetWithExpectedSize(current.size());
    for (Path file : current) {
      String key = file.toString();
      names.add(key);
      String digest = fileStore.digest(file);
      String stampedDigest = stamped.get(key);
      if (digest == null) {
        reasons.add(missing);
      } else if (stampedDigest == null) {
        reasons.add(setChanged);
      } else if (!stampedDigest.equals(digest)) {
        reasons.add(changed);
      }
    }
    if (!names.containsAll(stamped.keySet())) {
      reasons.add(setChanged);
    }
  }

  private TargetOutcome finish(
      Target target,
      ListenableFuture<Void> action,
      @Nullable Stamp previous,
      Set<InvalidatedReason> reasons,
      Stopwatch stopwatch) {
    String name = target.getName();
    try {
      Futures.getDone(action);
    } catch (ExecutionException e) {
      return fail(name, e.getCause(), stopwatch, reasons);
    } catch (CancellationException e) {
      return fail(name, e, stopwatch, reasons);
    }

    try {
      ResolvedFiles inputs = inputVisitor.resolve(target.getInputs(), target.getDepfiles());
      ResolvedFiles outputs = outputVisitor.resolve(target.getOutputs(), target.getDepfiles());
      checkOutputs(target, outputs);
      fileStore.invalidate(outputs.getSources());
      ImmutableSortedMap<String, String> outputDigests = fileStore.digestAll(outputs.getSources());
      stampStore.write(
          name,
          new Stamp(target.getBuildKey(), fileStore.digestAll(inputs.getSources()), outputDigests));
      if (previous != null) {
        deleteStaleOutputs(name, previous.getOutputs().keySet(), outputDigests.keySet());
      }
      return TargetOutcome.executed(
          name,
          stopwatch.elapsed().toMillis(),
          reasons,
          inputs.getSources(),
          outputs.getSources());
    } catch (IOException | BuildActionException | InvalidPatternException | RuntimeException e) {
      return fail(name, e, stopwatch, reasons);
    }
  }

  /** Every declared output and depfile must exist, inside the build or output directory. */
  private void checkOutputs(Target target, ResolvedFiles outputs)
      throws IOException, BuildActionException {
    ImmutableList.Builder<Path> missing = ImmutableList.builder();
    for (Path output : outputs.getSources()) {
      if (!Files.exists(output)) {
        missing.add(output);
      }
    }
    for (String depfile : target.getDepfiles()) {
      Path file = environment.getBuildDirectory().resolve(depfile);
      if (!Files.exists(file)) {
        missing.add(file);
      }
    }
    ImmutableList<Path> missingOutputs = missing.build();
    if (!missingOutputs.isEmpty()) {
      throw new MissingOutputException(target.getName(), missingOutputs);
    }
    ImmutableList<Path> roots = outputRoots();
    for (Path output : outputs.getSources()) {
      if (!isUnder(output, roots)) {
        throw new MisplacedOutputException(target.getName(), output);
      }
    }
  }

  private void deleteStaleOutputs(String name, Set<String> previous, Set<String> current)
      throws IOException {
    ImmutableList<Path> roots = outputRoots();
    for (String stale : Sets.difference(previous, current)) {
      Path file = environment.getFileSystem().getPath(stale);
      if (isUnder(file, roots) && Files.deleteIfExists(file)) {
        logger.atFine().log("Deleted stale output %s of %s", file, name);
      }
    }
  }

  private ImmutableList<Path> outputRoots() throws IOException {
    return ImmutableSet.of(
            environment.getBuildDirectory().toAbsolutePath().normalize(),
            environment.getOutputDirectory().toAbsolutePath().normalize(),
            environment.resolveDirectory(Environment.Root.BUILD_DIR),
            environment.resolveDirectory(Environment.Root.OUTPUT_DIR))
        .asList();
  }

  private static boolean isUnder(Path file, List<Path> roots) {
    Path normalized = file.toAbsolutePath().normalize();
    for (Path root : roots) {
      if (normalized.startsWith(root)) {
        return true;
      }
    }
    return false;
  }

  /** Records a failure and forgets the target's stamp, so that the next build retries it. */
  private TargetOutcome fail(
      String name, Throwable cause, Stopwatch stopwatch, Set<InvalidatedReason> reasons) {
    return fail(name, cause, stopwatch.elapsed().toMillis(), reasons);
  }

  private TargetOutcome fail(
      String name, Throwable cause, long elapsedMillis, Set<InvalidatedReason> reasons) {
    logger.atWarning().withCause(cause).log("Target %s failed", name);
    try {
      stampStore.delete(name);
    } catch (IOException e) {
      cause.addSuppressed(e);
    }
    environment
        .getReporter()
        .handle(Event.error(String.format("Target %s failed: %s", name, describe(cause))));
    return TargetOutcome.failed(name, cause, elapsedMillis, reasons);
  }

  /** A target cancelled mid-build may have rewritten some outputs; its stamp no longer holds. */
  private void forgetStamp(String name) {
    try {
      stampStore.delete(name);
    } catch (IOException e) {
      logger.atWarning().withCause(e).log("Could not delete the stamp of cancelled %s", name);
    }
  }

  private static String describe(Throwable cause) {
    List<String> messages = Lists.newArrayList();
    for (Throwable t = cause; t != null; t = t.getCause()) {
      messages.add(t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName());
    }
    return Joiner.on(": caused by ").join(messages);
  }

  private static final class TargetOutcome {
    private final PerformanceMeasurement measurement;
    @Nullable private final Throwable failure;
    private final ImmutableList<Path> inputs;
    private final ImmutableList<Path> outputs;

    private TargetOutcome(
        PerformanceMeasurement measurement,
        @Nullable Throwable failure,
        ImmutableList<Path> inputs,
        ImmutableList<Path> outputs) {
      this.measurement = measurement;
      this.failure = failure;
      this.inputs = inputs;
      this.outputs = outputs;
    }

    String getName() {
      return measurement.getName();
    }

    static TargetOutcome executed(
        String name,
        long elapsedMillis,
        Set<InvalidatedReason> reasons,
        ImmutableList<Path> inputs,
        ImmutableList<Path> outputs) {
      return new TargetOutcome(
          new PerformanceMeasurement(name, elapsedMillis, Status.EXECUTED, reasons),
          null,
          inputs,
          outputs);
    }

    static TargetOutcome skipped(
        String name, long elapsedMillis, ImmutableList<Path> inputs, ImmutableList<Path> outputs) {
      return new TargetOutcome(
          new PerformanceMeasurement(name, elapsedMillis, Status.SKIPPED, ImmutableSet.of()),
          null,
          inputs,
          outputs);
    }

    static TargetOutcome failed(
        String name, Throwable failure, long elapsedMillis, Set<InvalidatedReason> reasons) {
      return new TargetOutcome(
          new PerformanceMeasurement(name, elapsedMillis, Status.FAILED, reasons),
          failure,
          ImmutableList.of(),
          ImmutableList.of());
    }

    static TargetOutcome blocked(String name) {
      return new TargetOutcome(
          new PerformanceMeasurement(name, 0, Status.BLOCKED, ImmutableSet.of()),
          null,
          ImmutableList.of(),
          ImmutableList.of());
    }
  }
}
