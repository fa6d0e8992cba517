/*
 * Copyright 2025 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.restyle.rewrite;

import org.jspecify.annotations.Nullable;

/** Container shapes that are sorted without an explicit sort comment when enabled. */
public enum AutosortCategory {
  /** Map literals, struct literals and map updates. */
  MAP("map"),
  /** The field list of {@code defstruct}. */
  DEFSTRUCT("defstruct"),
  /** Field declarations inside schema blocks. */
  SCHEMA("schema");

  private final String configName;

  AutosortCategory(String configName) {
    this.configName = configName;
  }

  public String getConfigName() {
    return configName;
  }

  public static @Nullable AutosortCategory forConfigName(String name) {
    for (AutosortCategory category : values()) {
      if (category.configName.equals(name)) {
        return category;
      }
    }
    return null;
  }
}
