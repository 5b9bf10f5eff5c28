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

package dev.assemble.build.fingerprint;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableMap;
import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import dev.assemble.build.events.EventKind;
import dev.assemble.build.events.StoredEventHandler;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class StampStoreTest {
  private final FileSystem fileSystem = Jimfs.newFileSystem(Configuration.unix());
  private final Path directory = fileSystem.getPath("/build");
  private final StoredEventHandler reporter = new StoredEventHandler();
  private final StampStore store = new StampStore(directory, reporter);

  @Test
  public void testWriteAndRead() throws Exception {
    Stamp stamp =
        new Stamp(
            "key-1",
            ImmutableMap.of("/src/b", "2", "/src/a", "1"),
            ImmutableMap.of("/build/out", "3"));
    assertThat(store.read("gen")).isNull();

    store.write("gen", stamp);
    assertThat(Files.exists(directory.resolve("gen.stamp"))).isTrue();
    Stamp read = store.read("gen");
    assertThat(read).isEqualTo(stamp);
    assertThat(read.getBuildKey()).isEqualTo("key-1");
    assertThat(read.getInputs().keySet()).containsExactly("/src/a", "/src/b").inOrder();
    assertThat(read.getOutputs()).containsExactly("/build/out", "3");

    store.delete("gen");
    assertThat(store.read("gen")).isNull();
  }

  @Test
  public void testCorruptStampIsDiscarded() throws Exception {
    Files.createDirectories(directory);
    Files.write(store.getStampFile("gen"), "{not json".getBytes(StandardCharsets.UTF_8));
    assertThat(store.read("gen")).isNull();
    assertThat(reporter.getMessages(EventKind.WARNING)).hasSize(1);

    Files.write(store.getStampFile("gen"), new byte[0]);
    assertThat(store.read("gen")).isNull();
  }

  @Test
  public void testMissingFieldsReadAsEmpty() throws Exception {
    Files.createDirectories(directory);
    Files.write(store.getStampFile("gen"), "{}".getBytes(StandardCharsets.UTF_8));
    Stamp read = store.read("gen");
    assertThat(read.getBuildKey()).isEmpty();
    assertThat(read.getInputs()).isEmpty();
    assertThat(read.getOutputs()).isEmpty();
  }
}
