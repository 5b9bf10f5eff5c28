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

package dev.assemble.build.depfile;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DepfileServiceTest {
  private final FileSystem fileSystem = Jimfs.newFileSystem(Configuration.unix());
  private final Path base = fileSystem.getPath("/project");
  private final DepfileService service = new DepfileService(base);

  @Test
  public void testRoundTrip() throws Exception {
    Depfile depfile =
        new Depfile(
            ImmutableList.of(path("/project/a"), path("/project/b c")),
            ImmutableList.of(path("/project/out")));
    String text = service.serialize(depfile);
    assertThat(text).isEqualTo("/project/out: /project/a /project/b\\ c\n");
    assertThat(service.parse(text)).isEqualTo(depfile);
  }

  @Test
  public void testBackslashesSurviveTheRoundTrip() throws Exception {
    Depfile depfile =
        new Depfile(ImmutableList.of(path("/project/odd\\name")), ImmutableList.of());
    assertThat(service.serialize(depfile)).isEqualTo(": /project/odd\\\\name\n");
    assertThat(service.parse(service.serialize(depfile))).isEqualTo(depfile);
  }

  @Test
  public void testWriteAndReadFile() throws Exception {
    Depfile depfile =
        new Depfile(
            ImmutableList.of(path("/project/src/main.c")),
            ImmutableList.of(path("/project/out/main.o"), path("/project/out/main.d")));
    Path file = fileSystem.getPath("/project/build/deps/main.d");
    service.writeToFile(depfile, file);
    assertThat(Files.exists(file)).isTrue();
    assertThat(service.parse(file)).isEqualTo(depfile);
  }

  @Test
  public void testDriveLettersAreNotSeparators() throws Exception {
    Depfile depfile = service.parse("C:\\out\\app.dll: C:\\src\\a.c");
    // Only ": " separates the sides. A backslash escapes the character after it.
    assertThat(depfile.getOutputs()).containsExactly(base.resolve("C:out" + "app.dll"));
    assertThat(depfile.getInputs()).containsExactly(base.resolve("C:srca.c"));

    Depfile forwardSlashes = service.parse("C:/out/app.dll: C:/src/a.c D:/b.c");
    assertThat(forwardSlashes.getOutputs()).containsExactly(base.resolve("C:/out/app.dll"));
    assertThat(forwardSlashes.getInputs())
        .containsExactly(base.resolve("C:/src/a.c"), base.resolve("D:/b.c"))
        .inOrder();
  }

  @Test
  public void testCompilerDepfile() throws Exception {
    String text =
        "out/main.o: src/main.c \\\n"
            + "  include/a.h include/b.h \\\r\n"
            + "  include/with\\ space.h\n"
            + "\n"
            + "include/a.h:\n"
            + "include/b.h:\n";
    Depfile depfile = service.parse(text);
    assertThat(depfile.getOutputs()).containsExactly(path("/project/out/main.o"));
    assertThat(depfile.getInputs())
        .containsExactly(
            path("/project/src/main.c"),
            path("/project/include/a.h"),
            path("/project/include/b.h"),
            path("/project/include/with space.h"))
        .inOrder();
  }

  @Test
  public void testEmptySides() throws Exception {
    assertThat(service.parse("out.txt:").getInputs()).isEmpty();
    assertThat(service.parse("out.txt:").getOutputs()).containsExactly(path("/project/out.txt"));
    assertThat(service.parse(": in.txt").getOutputs()).isEmpty();
  }

  @Test
  public void testDuplicatesAreDropped() throws Exception {
    assertThat(service.parse("out: a b a").getInputs())
        .containsExactly(path("/project/a"), path("/project/b"))
        .inOrder();
  }

  @Test
  public void testInvalidDepfiles() {
    assertThrows(DepfileFormatException.class, () -> service.parse(""));
    assertThrows(DepfileFormatException.class, () -> service.parse("a b c"));
    assertThrows(DepfileFormatException.class, () -> service.parse("a: b\nc: d\n"));
  }

  @Test
  public void testLeadingHashIsNotReadAsAComment() throws Exception {
    Depfile depfile =
        new Depfile(ImmutableList.of(path("/project/a")), ImmutableList.of(path("#gen/out.o")));
    String text = service.serialize(depfile);
    assertThat(text).isEqualTo("\\#gen/out.o: /project/a\n");
    assertThat(service.parse(text).getOutputs()).containsExactly(path("/project/#gen/out.o"));
  }

  @Test
  public void testTokenize() {
    assertThat(DepfileService.tokenize("  a\tb\\ c  d\\\\e ")).containsExactly("a", "b c", "d\\e");
    assertThat(DepfileService.escape("a b\\c")).isEqualTo("a\\ b\\\\c");
    assertThat(DepfileService.escape("#x")).isEqualTo("\\#x");
    assertThat(DepfileService.escape("a#x")).isEqualTo("a#x");
  }

  private Path path(String path) {
    return fileSystem.getPath(path);
  }
}
