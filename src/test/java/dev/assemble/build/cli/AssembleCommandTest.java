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

import static com.google.common.truth.Truth.assertThat;
import static dev.assemble.build.testutil.TestEnvironments.readFile;
import static dev.assemble.build.testutil.TestEnvironments.writeFile;
import static java.nio.charset.StandardCharsets.UTF_8;

import dev.assemble.build.testutil.TestEnvironments;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AssembleCommandTest {
  private final FileSystem fileSystem = TestEnvironments.newFileSystem();
  private ByteArrayOutputStream out;
  private ByteArrayOutputStream err;

  @Before
  public void setUp() throws Exception {
    writeFile(fileSystem.getPath("/app/assets.json"), "{\"strings\": {\"VERSION\": \"1.0\"}}");
  }

  @Test
  public void testBuildsAndThenSkips() throws Exception {
    assertThat(run("--project-dir", "/app", "copy_assets")).isEqualTo(0);
    assertThat(out()).contains("Executed: copy_assets");
    assertThat(readFile(fileSystem.getPath("/app/build/assets/VERSION"))).isEqualTo("1.0");

    assertThat(run("--project-dir", "/app", "copy_assets")).isEqualTo(0);
    assertThat(out()).contains("Skipped: copy_assets");
  }

  @Test
  public void testDirectoriesAndDefines() throws Exception {
    int exitCode =
        run(
            "--project-dir", "/app",
            "--build-dir", "/tmp/build",
            "--output-dir", "/dist",
            "-D", "mode=release",
            "--jobs", "2",
            "--file-store", "timestamp",
            "copy_assets");

    assertThat(exitCode).isEqualTo(0);
    assertThat(Files.exists(fileSystem.getPath("/dist/assets/VERSION"))).isTrue();
    assertThat(Files.exists(fileSystem.getPath("/tmp/build/copy_assets.stamp"))).isTrue();
  }

  @Test
  public void testUsageErrors() throws Exception {
    assertThat(run("--project-dir", "/app", "compile")).isEqualTo(2);
    assertThat(err()).contains("Unknown target 'compile'");

    assertThat(run("--project-dir", "/app", "-D", "novalue", "copy_assets")).isEqualTo(2);
    assertThat(err()).contains("-D expects KEY=VALUE, got 'novalue'");

    assertThat(run("--project-dir", "/app", "--file-store", "md5", "copy_assets")).isEqualTo(2);
    assertThat(err()).contains("Unknown file store 'md5'");

    assertThat(run("--project-dir", "/app", "--jobs", "0", "copy_assets")).isEqualTo(2);
    assertThat(run("--project-dir", "/app")).isEqualTo(2);
  }

  @Test
  public void testFailedBuild() throws Exception {
    assertThat(run("--project-dir", "/elsewhere", "copy_assets")).isEqualTo(1);
    assertThat(err()).contains("Build failed: ");
  }

  private int run(String... args) throws InterruptedException {
    out = new ByteArrayOutputStream();
    err = new ByteArrayOutputStream();
    return new AssembleCommand(
            new PrintStream(out, true), new PrintStream(err, true), fileSystem)
        .run(args);
  }

  private String out() {
    return new String(out.toByteArray(), UTF_8);
  }

  private String err() {
    return new String(err.toByteArray(), UTF_8);
  }
}
