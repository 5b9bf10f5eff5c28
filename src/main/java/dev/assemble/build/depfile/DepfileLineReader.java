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

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import javax.annotation.Nullable;

/** Reads logical lines of a depfile in fixed size blocks, joining continued lines. */
class DepfileLineReader implements Closeable {
  private static final int BLOCK = 10 * 1024;

  private final Reader reader;
  private final char[] buffer;
  private int position = 0;
  private int limit = 0;
  private boolean atEOF;

  DepfileLineReader(Reader reader) {
    this(reader, BLOCK);
  }

  DepfileLineReader(Reader reader, int blockSize) {
    this.reader = reader;
    this.buffer = new char[blockSize];
  }

  static DepfileLineReader open(Path path) throws IOException {
    FileChannel fch = FileChannel.open(path, StandardOpenOption.READ);
    return new DepfileLineReader(Channels.newReader(fch, StandardCharsets.UTF_8.newDecoder(), -1));
  }

  /** Returns the next logical line without its line break, or null at the end of the input. */
  @Nullable
  public String readLine() throws IOException {
    DepfileLine line = new DepfileLine();
    boolean readAny = false;
    while (!line.isEol()) {
      if (position >= limit && !readNextChunk()) {
        break;
      }
      int lineStart = position;
      while (position < limit) {
        if (buffer[position++] == '\n') {
          break;
        }
      }
      line.append(Arrays.copyOfRange(buffer, lineStart, position));
      readAny = true;
    }
    if (!readAny) {
      return null;
    }
    return line.getLine();
  }

  private boolean readNextChunk() throws IOException {
    if (atEOF) {
      return false;
    }
    int read = reader.read(buffer, 0, buffer.length);
    while (read == 0) {
      read = reader.read(buffer, 0, buffer.length);
    }
    if (read < 0) {
      atEOF = true;
      position = 0;
      limit = 0;
      return false;
    }
    position = 0;
    limit = read;
    return true;
  }

  public boolean isEOF() {
    return atEOF;
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }
}
