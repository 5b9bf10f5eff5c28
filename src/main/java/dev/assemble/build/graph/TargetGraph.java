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

package dev.assemble.build.graph;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import dev.assemble.build.Target;
import dev.assemble.build.source.InvalidPatternException;
import dev.assemble.build.source.Source;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The targets reachable from a requested target, validated and in dependency order.
 *
 * <p>Creating a graph fails if two distinct targets share a name or the dependencies contain a
 * cycle. {@link #checkPatterns} additionally validates every declared pattern. Both happen before
 * any target runs.
 */
public final class TargetGraph {
  private final Target root;
  private final ImmutableMap<String, Target> targets;
  private final ImmutableListMultimap<String, String> dependents;

  private TargetGraph(
      Target root,
      ImmutableMap<String, Target> targets,
      ImmutableListMultimap<String, String> dependents) {
    this.root = root;
    this.targets = targets;
    this.dependents = dependents;
  }

  public static TargetGraph create(Target root) throws CycleException, DuplicateTargetException {
    Map<String, Target> ordered = Maps.newLinkedHashMap();
    Map<String, Target> seen = Maps.newHashMap();
    visit(root, ordered, seen, new ArrayDeque<>(), Sets.newHashSet());

    ImmutableListMultimap.Builder<String, String> dependents = ImmutableListMultimap.builder();
    for (Target target : ordered.values()) {
      for (Target dependency : target.getDependencies()) {
        dependents.put(dependency.getName(), target.getName());
      }
    }
    return new TargetGraph(root, ImmutableMap.copyOf(ordered), dependents.build());
  }

  private static void visit(
      Target target,
      Map<String, Target> ordered,
      Map<String, Target> seen,
      Deque<String> stack,
      Set<String> onStack)
      throws CycleException, DuplicateTargetException {
    String name = target.getName();
    Target existing = seen.get(name);
    if (existing != null && existing != target) {
      throw new DuplicateTargetException(name);
    }
    if (onStack.contains(name)) {
      throw new CycleException(cycleEndingAt(name, stack));
    }
    if (ordered.containsKey(name)) {
      return;
    }
    seen.put(name, target);
    stack.addLast(name);
    onStack.add(name);
    for (Target dependency : target.getDependencies()) {
      visit(dependency, ordered, seen, stack, onStack);
    }
    onStack.remove(name);
    stack.removeLast();
    ordered.put(name, target);
  }

  // The stack holds the path from the root; the cycle starts at the first occurrence of name.
  private static CycleInfo cycleEndingAt(String name, Deque<String> stack) {
    List<String> path = new ArrayList<>(stack);
    int start = path.indexOf(name);
    return new CycleInfo(path.subList(0, start), path.subList(start, path.size()));
  }

  /** Parses every pattern of every target and checks that its variables are defined. */
  public void checkPatterns(Map<String, String> defines) throws InvalidPatternException {
    for (Target target : targets.values()) {
      for (Source source : Iterables.concat(target.getInputs(), target.getOutputs())) {
        if (source.getKind() == Source.Kind.PATTERN) {
          source.asPattern().parse().checkVariables(defines);
        }
      }
    }
  }

  public Target getRoot() {
    return root;
  }

  /** Every target, dependencies before the targets that depend on them. */
  public ImmutableList<Target> topologicalOrder() {
    return targets.values().asList();
  }

  public Target getTarget(String name) {
    return targets.get(name);
  }

  public ImmutableList<String> getDependents(String name) {
    return dependents.get(name);
  }

  /** Names of every target that directly or transitively depends on {@code name}. */
  public ImmutableSet<String> getTransitiveDependents(String name) {
    Set<String> result = Sets.newLinkedHashSet();
    Deque<String> queue = new ArrayDeque<>(getDependents(name));
    while (!queue.isEmpty()) {
      String next = queue.removeFirst();
      if (result.add(next)) {
        queue.addAll(getDependents(next));
      }
    }
    return ImmutableSet.copyOf(result);
  }

  public int size() {
    return targets.size();
  }
}
