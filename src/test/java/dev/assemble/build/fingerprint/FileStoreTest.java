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

import com.google.common.collect.ImmutableList;
import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class FileStoreTest {
  private static final String ABC_SHA256 =
      "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

  private final FileSystem fileSystem = Jimfs.newFileSystem(Configuration.unix());

  @Test
  public void testHashIsComputedOnce() throws Exception {
    Path file = write("/a.txt", "abc");
    FileStore store = new FileStore(FileStoreStrategy.HASH);
    assertThat(store.digest(file)).isEqualTo(ABC_SHA256);

    write("/a.txt", "changed");
    assertThat(store.digest(file)).isEqualTo(ABC_SHA256);
    assertThat(store.size()).isEqualTo(1);

    store.invalidate(ImmutableList.of(file));
    assertThat(store.digest(file)).isNotEqualTo(ABC_SHA256);
  }

  @Test
  public void testMissingFiles() throws Exception {
    Path present = write("/dir/present", "abc");
    Path missing = fileSystem.getPath("/dir/missing");
    FileStore store = new FileStore(FileStoreStrategy.HASH);

    assertThat(store.digest(missing)).isNull();
    assertThat(store.digest(fileSystem.getPath("/dir"))).isNull();
    assertThat(store.digestAll(ImmutableList.of(missing, present)))
        .containsExactly("/dir/present", ABC_SHA256);
  }

  @Test
  public void testTimestampStrategy() throws Exception {
    Path file = write("/a.txt", "abc");
    Files.setLastModifiedTime(file, FileTime.fromMillis(1000));
    FileStore store = new FileStore(FileStoreStrategy.TIMESTAMP);
    assertThat(store.getStrategy()).isEqualTo(FileStoreStrategy.TIMESTAMP);
    assertThat(store.digest(file)).isEqualTo("1000:3");

    // Same size and time: a timestamp store can not tell the difference.
    write("/a.txt", "xyz");
    Files.setLastModifiedTime(file, FileTime.fromMillis(1000));
    assertThat(new FileStore(FileStoreStrategy.TIMESTAMP).digest(file)).isEqualTo("1000:3");
    assertThat(new FileStore(FileStoreStrategy.HASH).digest(file)).isNotEqualTo(ABC_SHA256);
  }

  @Test
  public void testStrategyNames() {
    assertThat(FileStoreStrategy.fromName("hash")).isEqualTo(FileStoreStrategy.HASH);
    assertThat(FileStoreStrategy.fromName("TIMESTAMP")).isEqualTo(FileStoreStrategy.TIMESTAMP);
    assertThat(FileStoreStrategy.fromName("md5")).isNull();
  }

  private Path write(String path, String content) throws Exception {
    Path file = fileSystem.getPath(path);
    Files.createDirectories(file.getParent());
    return Files.write(file, content.getBytes(StandardCharsets.UTF_8));
  }
}
