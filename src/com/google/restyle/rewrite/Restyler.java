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
import com.google.restyle.ast.Comment;
import com.google.restyle.ast.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rewrites one parsed file with the styles that the options select.
 *
 * <p>A restyler holds no per-file state and may be shared between threads.
 */
public final class Restyler {

  private static final Logger logger = Logger.getLogger(Restyler.class.getName());

  private final RewriteOptions options;
  private final ImmutableList<StyleCategory> categories;

  public Restyler(RewriteOptions options) {
    this.options = options;
    this.categories = StyleCategory.select(options);
  }

  public RewriteOptions getOptions() {
    return options;
  }

  /** The style categories this restyler runs, in order. */
  public ImmutableList<StyleCategory> getCategories() {
    return categories;
  }

  /**
   * Rewrites {@code root}, a parsed file, and its {@code comments}.
   *
   * @throws StyleException if a style fails; the caller should keep the file as it was
   */
  public RewriteResult rewrite(String fileName, Node root, List<Comment> comments) {
    List<Style> styles = new ArrayList<>(categories.size());
    for (StyleCategory category : categories) {
      Style style = category.createStyle();
      if (style != null) {
        styles.add(style);
      }
    }
    try {
      return new StylePipeline(fileName, options, styles).process(root, comments);
    } catch (StyleException e) {
      logger.log(
          Level.SEVERE,
          "Failed to restyle " + e.getFileName() + " in " + e.getStyleName(),
          e.getCause());
      throw e;
    }
  }
}
