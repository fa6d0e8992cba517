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

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The named groups of styles that configuration can include or exclude. The declaration order is
 * the order in which the styles run.
 */
public enum StyleCategory {
  SINGLE_NODE("single_node"),
  PIPES("pipes"),
  MODULE_DIRECTIVES("module_directives"),
  COMMENT_DIRECTIVES("comment_directives"),
  TESTS("tests"),
  /**
   * Not a style. Naming it in the include list means "only fix line length", which this engine
   * leaves to the printer, so no style runs at all.
   */
  LINE_LENGTH("line_length");

  private final String configName;

  StyleCategory(String configName) {
    this.configName = configName;
  }

  /** The name used for this category in configuration files. */
  public String getConfigName() {
    return configName;
  }

  /** Returns the category with the given configuration name, or null if there is none. */
  public static @Nullable StyleCategory forConfigName(String name) {
    for (StyleCategory category : values()) {
      if (category.configName.equals(name)) {
        return category;
      }
    }
    return null;
  }

  /** Returns a fresh instance of the style for this category, or null for {@link #LINE_LENGTH}. */
  public @Nullable Style createStyle() {
    switch (this) {
      case SINGLE_NODE:
        return new SingleNodeRewrites();
      case PIPES:
        return new PipeChains();
      case MODULE_DIRECTIVES:
        return new AliasLifting();
      case COMMENT_DIRECTIVES:
        return new CommentDirectives();
      case TESTS:
        return new TestAssertions();
      case LINE_LENGTH:
        return null;
    }
    throw new IllegalStateException("Unexpected category " + this);
  }

  /**
   * Returns the categories to run for {@code options}, in running order and without duplicates.
   * An include list that names {@link #LINE_LENGTH} or nothing runnable selects nothing.
   */
  public static ImmutableList<StyleCategory> select(RewriteOptions options) {
    ImmutableList<StyleCategory> only = options.getOnlyStyles();
    if (only.contains(LINE_LENGTH)) {
      return ImmutableList.of();
    }
    Set<StyleCategory> included = new LinkedHashSet<>();
    if (only.isEmpty()) {
      for (StyleCategory category : values()) {
        if (category != LINE_LENGTH) {
          included.add(category);
        }
      }
    } else {
      // An explicit include list is still run in the canonical order.
      for (StyleCategory category : values()) {
        if (only.contains(category)) {
          included.add(category);
        }
      }
    }
    included.removeAll(options.getExcludeStyles());
    return ImmutableList.copyOf(included);
  }
}
