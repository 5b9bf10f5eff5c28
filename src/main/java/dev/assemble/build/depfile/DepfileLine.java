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

/**
 * Accumulates one logical depfile line out of the chunks a reader hands it. A backslash before a
 * line break continues the line; the pair is replaced with a space. Other escape sequences are kept
 * as they are, to be reversed when the line is split into paths.
 */
class DepfileLine {
  private final StringBuilder sb = new StringBuilder();
  private boolean eol;
  // The end of the previous chunk, a backslash or a backslash and '\r', whose meaning depends on
  // the next chunk.
  private String pending = "";

  public void append(char[] chars) {
    if (chars.length == 0 || eol) {
      return;
    }
    String line = pending + new String(chars);
    pending = "";

    int i = 0;
    while (i < line.length()) {
      char ch = line.charAt(i);
      if (ch == '\\') {
        if (i + 1 == line.length()) {
          pending = "\\";
          break;
        }
        char next = line.charAt(i + 1);
        if (next == '\n') {
          sb.append(' ');
          i += 2;
        } else if (next == '\r' && i + 2 == line.length()) {
          pending = "\\\r";
          break;
        } else if (next == '\r' && line.charAt(i + 2) == '\n') {
          sb.append(' ');
          i += 3;
        } else {
          sb.append(ch).append(next);
          i += 2;
        }
        continue;
      }
      if (ch == '\n') {
        eol = true;
        if (sb.length() > 0 && sb.charAt(sb.length() - 1) == '\r') {
          sb.setLength(sb.length() - 1);
        }
        break;
      }
      sb.append(ch);
      i++;
    }
  }

  public String getLine() {
    return sb.toString() + pending;
  }

  public boolean isEol() {
    return eol;
  }
}
