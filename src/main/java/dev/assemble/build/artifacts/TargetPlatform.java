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

package dev.assemble.build.artifacts;

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.function.Function;
import javax.annotation.Nullable;

/** The platform an artifact was built for. */
public enum TargetPlatform {
  ANDROID_ARM("android-arm"),
  ANDROID_ARM64("android-arm64"),
  ANDROID_X64("android-x64"),
  IOS("ios"),
  DARWIN("darwin"),
  LINUX_X64("linux-x64"),
  LINUX_ARM64("linux-arm64"),
  WINDOWS_X64("windows-x64"),
  WEB_JAVASCRIPT("web-javascript"),
  TESTER("tester");

  private static final ImmutableMap<String, TargetPlatform> BY_NAME =
      Arrays.stream(values())
          .collect(ImmutableMap.toImmutableMap(TargetPlatform::getName, Function.identity()));

  private final String name;

  TargetPlatform(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  @Nullable
  public static TargetPlatform fromName(String name) {
    return BY_NAME.get(name);
  }
}
