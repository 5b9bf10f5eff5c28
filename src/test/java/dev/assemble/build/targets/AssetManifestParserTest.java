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

import static com.google.common.truth.Truth.assertThat;
import static dev.assemble.build.testutil.TestEnvironments.writeFile;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import dev.assemble.build.BuildActionException;
import dev.assemble.build.testutil.TestEnvironments;
import java.nio.file.FileSystem;
import java.nio.file.Path;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AssetManifestParserTest {
  private final FileSystem fileSystem = TestEnvironments.newFileSystem();
  private final Path project = fileSystem.getPath("/project");
  private final AssetManifestParser parser = new AssetManifestParser(project);

  @Test
  public void testParsesAssetsAndStrings() throws Exception {
    AssetManifest manifest =
        parser.parse(
            "{\"assets\": {\"images/logo.png\": \"res/../res/logo.png\"},"
                + " \"strings\": {\"NOTICES\": \"Licensed\"}}");

    assertThat(manifest.getEntries().keySet())
        .containsExactly("images/logo.png", "NOTICES")
        .inOrder();
    assertThat(manifest.getEntries().get("images/logo.png").getFile().toString())
        .isEqualTo("/project/res/logo.png");
    assertThat(manifest.getEntries().get("NOTICES").getFile() == null).isTrue();
    assertThat(manifest.getEntries().get("NOTICES").asByteSource().asCharSource(UTF_8).read())
        .isEqualTo("Licensed");
  }

  @Test
  public void testMissingSectionsAreEmpty() throws Exception {
    assertThat(parser.parse("{}").size()).isEqualTo(0);
    assertThat(parser.parse("{\"assets\": null}").size()).isEqualTo(0);
  }

  @Test
  public void testRejectsPathsOutsideTheAssetDirectory() {
    for (String path : new String[] {"/abs", "../up", "a/../../b", "a//b", "./a", "", "a/"}) {
      BuildActionException e =
          assertThrows(
              path,
              BuildActionException.class,
              () -> parser.parse("{\"strings\": {\"" + path + "\": \"x\"}}"));
      assertThat(e).hasMessageThat().contains("is not a relative asset path");
    }
  }

  @Test
  public void testRejectsDuplicates() {
    BuildActionException e =
        assertThrows(
            BuildActionException.class,
            () ->
                parser.parse(
                    "{\"assets\": {\"a.txt\": \"a.txt\"}, \"strings\": {\"a.txt\": \"x\"}}"));
    assertThat(e).hasMessageThat().isEqualTo("'a.txt' is listed twice");
  }

  @Test
  public void testRejectsMalformedInput() {
    assertThrows(BuildActionException.class, () -> parser.parse("{\"assets\": "));
    assertThrows(BuildActionException.class, () -> parser.parse("[]"));
    assertThrows(BuildActionException.class, () -> parser.parse("{\"assets\": []}"));
    assertThrows(BuildActionException.class, () -> parser.parse("{\"assets\": {\"a\": 1}}"));
  }

  @Test
  public void testFileErrorsNameTheManifest() throws Exception {
    Path manifest = writeFile(project.resolve("assets.json"), "{\"strings\": {\"a\": true}}");
    BuildActionException e = assertThrows(BuildActionException.class, () -> parser.parse(manifest));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(
            "Invalid asset manifest /project/assets.json: the value of 'a' must be a string");
  }
}
