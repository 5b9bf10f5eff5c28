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

package dev.assemble.build.source;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Substitutes {@code $name} and {@code ${name}} references in pattern segments with build defines.
 *
 * <p>A define may itself reference other defines. {@code $$} stands for a literal dollar sign. In
 * the short form a name may contain dots; the longest dotted prefix that is defined wins, so with
 * {@code mode=release} the segment {@code $mode.so} becomes {@code release.so}.
 */
final class PatternVariables {
  private PatternVariables() {}

  static String expand(String pattern, String text, Map<String, String> defines)
      throws InvalidPatternException {
    return expand(pattern, text, defines, Sets.newLinkedHashSet());
  }

  private static String expand(
      String pattern, String text, Map<String, String> defines, Set<String> requested)
      throws InvalidPatternException {
    StringBuilder sb = new StringBuilder(text);
    int startIdx = 0;
    while (startIdx < sb.length()) {
      startIdx = sb.indexOf("$", startIdx);
      if (startIdx < 0) {
        break;
      }
      if (startIdx == sb.length() - 1) {
        throw new InvalidPatternException(
            pattern, String.format("dangling '$' in '%s'", text));
      }
      char next = sb.charAt(startIdx + 1);
      if (next == '$') {
        sb.deleteCharAt(startIdx);
        startIdx++;
        continue;
      }

      boolean exact = next == '{';
      int endIdx;
      String name;
      if (exact) {
        endIdx = sb.indexOf("}", startIdx + 2);
        if (endIdx < 0) {
          throw new InvalidPatternException(
              pattern, String.format("unterminated variable reference in '%s'", text));
        }
        name = sb.substring(startIdx + 2, endIdx);
      } else {
        endIdx = startIdx + 1;
        while (endIdx < sb.length() && isNameChar(sb.charAt(endIdx))) {
          endIdx++;
        }
        name = sb.substring(startIdx + 1, endIdx);
      }
      if (name.trim().isEmpty()) {
        throw new InvalidPatternException(
            pattern, String.format("empty variable name in '%s'", text));
      }

      String matched = null;
      for (String possibleName : exact ? ImmutableList.of(name) : possibleNames(name)) {
        if (defines.containsKey(possibleName)) {
          matched = possibleName;
          break;
        }
      }
      if (matched == null) {
        throw new InvalidPatternException(
            pattern, String.format("variable '%s' is not defined", name));
      }
      if (!requested.add(matched)) {
        throw new InvalidPatternException(
            pattern,
            String.format(
                "recursive variable reference: %s -> %s", String.join(" -> ", requested), matched));
      }
      String value = expand(pattern, defines.get(matched), defines, requested);
      // The reference is resolved; adjacent references must not see it on the stack.
      requested.remove(matched);

      int endIdxForReplace = exact ? (endIdx + 1) : (startIdx + matched.length() + 1);
      sb.replace(startIdx, endIdxForReplace, value);
      startIdx += value.length();
    }
    return sb.toString();
  }

  private static boolean isNameChar(char ch) {
    return Character.isLetterOrDigit(ch) || ch == '.' || ch == '-' || ch == '_';
  }

  private static List<String> possibleNames(String name) {
    List<String> result = Lists.newArrayList();
    result.add(name);
    while (!name.isEmpty()) {
      int idx = name.lastIndexOf('.');
      if (idx > 0) {
        name = name.substring(0, idx);
        result.add(name);
      } else {
        name = "";
      }
    }
    return result;
  }
}
