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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.restyle.ast.Comment;
import com.google.restyle.ast.Node;
import com.google.restyle.ast.Zipper;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.logging.Logger;

/**
 * Runs an ordered list of styles over one file, one full traversal per style. Each style sees the
 * tree and comments left behind by the styles before it.
 */
public final class StylePipeline {

  private static final Logger logger = Logger.getLogger(StylePipeline.class.getName());

  private final String fileName;
  private final RewriteOptions options;
  private final ImmutableList<Style> styles;

  public StylePipeline(String fileName, RewriteOptions options, List<? extends Style> styles) {
    this.fileName = fileName;
    this.options = options;
    // The same style instance is never run twice.
    this.styles = ImmutableList.copyOf(new LinkedHashSet<Style>(styles));
  }

  /**
   * Rewrites {@code root} with {@code styles}.
   *
   * @throws StyleException if any style fails; nothing of the partial result is returned
   */
  public static RewriteResult run(
      Node root, List<Comment> comments, RewriteOptions options, List<? extends Style> styles) {
    return new StylePipeline("nofile", options, styles).process(root, comments);
  }

  public RewriteResult process(Node root, List<Comment> comments) {
    checkArgument(root.isScript(), "Expected a SCRIPT root: %s", root);
    StyleContext context = StyleContext.create(fileName, comments, options);
    Node current = root;
    for (Style style : styles) {
      StyleCallback callback = new StyleCallback(style, context);
      try {
        current = Zipper.zip(current).traverseWhile(callback).node();
      } catch (RuntimeException e) {
        throw new StyleException(fileName, styleName(style), e);
      }
      context = callback.context;
      logger.fine("Ran " + styleName(style) + " on " + fileName);
    }
    return RewriteResult.create(current, context.getComments());
  }

  static String styleName(Style style) {
    return style.getClass().getSimpleName();
  }

  /** Adapts a style to the zipper walk, carrying the context from one node to the next. */
  private static class StyleCallback implements Zipper.Visitor {
    private final Style style;
    private StyleContext context;

    StyleCallback(Style style, StyleContext context) {
      this.style = style;
      this.context = context;
    }

    @Override
    public Zipper.Step visit(Zipper zipper) {
      StyleResult result = style.run(zipper, context);
      context = result.getContext();
      return Zipper.Step.of(result.getSignal(), result.getZipper());
    }
  }
}
