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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import dev.assemble.build.Environment;
import dev.assemble.build.Target;
import dev.assemble.build.source.InvalidPatternException;
import dev.assemble.build.source.Source;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TargetGraphTest {
  @Test
  public void testTopologicalOrder() throws Exception {
    Target a = target("a");
    Target b = target("b", a);
    Target c = target("c", a);
    Target d = target("d", b, c);

    TargetGraph graph = TargetGraph.create(d);
    assertThat(names(graph.topologicalOrder())).containsExactly("a", "b", "c", "d").inOrder();
    assertThat(graph.getRoot()).isSameInstanceAs(d);
    assertThat(graph.size()).isEqualTo(4);
    assertThat(graph.getTarget("c")).isSameInstanceAs(c);
    assertThat(graph.getDependents("a")).containsExactly("b", "c");
    assertThat(graph.getDependents("d")).isEmpty();
    assertThat(graph.getTransitiveDependents("a")).containsExactly("b", "c", "d");
  }

  @Test
  public void testCycleIsDetectedForEveryRotation() {
    for (int rotation = 0; rotation < 3; rotation++) {
      MutableTarget a = new MutableTarget("a");
      MutableTarget b = new MutableTarget("b");
      MutableTarget c = new MutableTarget("c");
      a.dependencies.add(b);
      b.dependencies.add(c);
      c.dependencies.add(a);
      ImmutableList<MutableTarget> targets = ImmutableList.of(a, b, c);
      MutableTarget root = targets.get(rotation);

      CycleException e = assertThrows(CycleException.class, () -> TargetGraph.create(root));
      assertThat(e.getCycleInfo().getCycle()).hasSize(3);
      assertThat(e.getCycleInfo().getCycle().get(0)).isEqualTo(root.getName());
      assertThat(e.getCycleInfo().getPathToCycle()).isEmpty();
    }
  }

  @Test
  public void testCycleMessageShowsThePath() {
    MutableTarget a = new MutableTarget("a");
    MutableTarget b = new MutableTarget("b");
    MutableTarget c = new MutableTarget("c");
    Target top = target("top", a);
    a.dependencies.add(b);
    b.dependencies.add(c);
    c.dependencies.add(a);

    CycleException e = assertThrows(CycleException.class, () -> TargetGraph.create(top));
    assertThat(e.getCycleInfo().getPathToCycle()).containsExactly("top");
    assertThat(e.getCycleInfo().getCycle()).containsExactly("a", "b", "c").inOrder();
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("Dependency cycle detected: a -> b -> c -> a (reached through top)");
  }

  @Test
  public void testSelfDependency() {
    MutableTarget a = new MutableTarget("a");
    a.dependencies.add(a);
    CycleException e = assertThrows(CycleException.class, () -> TargetGraph.create(a));
    assertThat(e.getCycleInfo().describeCycle()).isEqualTo("a -> a");
  }

  @Test
  public void testDuplicateNames() {
    Target first = target("same");
    Target second = target("same");
    Target root = target("root", first, second);
    DuplicateTargetException e =
        assertThrows(DuplicateTargetException.class, () -> TargetGraph.create(root));
    assertThat(e.getName()).isEqualTo("same");
  }

  @Test
  public void testSharedDependencyIsNotADuplicate() throws Exception {
    Target shared = target("shared");
    TargetGraph graph = TargetGraph.create(target("root", target("x", shared), shared));
    assertThat(names(graph.topologicalOrder()))
        .containsExactly("shared", "x", "root")
        .inOrder();
  }

  @Test
  public void testCheckPatterns() throws Exception {
    Target ok =
        Target.builder("ok")
            .addInputs(Source.pattern("{PROJECT_DIR}/$mode/a.txt"))
            .setAction(environment -> Futures.immediateVoidFuture())
            .build();
    Target bad =
        Target.builder("bad")
            .addDependencies(ok)
            .addOutputs(Source.pattern("{NOWHERE}/b.txt"))
            .setAction(environment -> Futures.immediateVoidFuture())
            .build();

    TargetGraph.create(ok).checkPatterns(ImmutableMap.of("mode", "debug"));
    assertThrows(
        InvalidPatternException.class,
        () -> TargetGraph.create(ok).checkPatterns(ImmutableMap.of()));
    InvalidPatternException e =
        assertThrows(
            InvalidPatternException.class,
            () -> TargetGraph.create(bad).checkPatterns(ImmutableMap.of("mode", "debug")));
    assertThat(e.getPattern()).isEqualTo("{NOWHERE}/b.txt");
  }

  private static Target target(String name, Target... dependencies) {
    return Target.builder(name)
        .addDependencies(dependencies)
        .setAction(environment -> Futures.immediateVoidFuture())
        .build();
  }

  private static ImmutableList<String> names(List<Target> targets) {
    return targets.stream().map(Target::getName).collect(ImmutableList.toImmutableList());
  }

  /** A target whose dependencies can be wired after construction, to build cycles. */
  private static class MutableTarget extends Target {
    private final String name;
    private final List<Target> dependencies = new ArrayList<>();

    MutableTarget(String name) {
      this.name = name;
    }

    @Override
    public String getName() {
      return name;
    }

    @Override
    public List<Target> getDependencies() {
      return dependencies;
    }

    @Override
    public ListenableFuture<Void> build(Environment environment) {
      throw new AssertionError("must not run");
    }
  }
}
