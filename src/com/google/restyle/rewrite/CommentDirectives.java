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

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.restyle.ast.Comment;
import com.google.restyle.ast.Node;
import com.google.restyle.ast.Zipper;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Sorts containers on request and, when configured, on its own.
 *
 * <p>A {@code # restyle:sort} comment sorts the first node starting on or after its line, whatever
 * its contents. With autosort enabled every map, struct, {@code defstruct} or schema of an enabled
 * category is sorted too, unless a comment sits inside it, a {@code # restyle:skip-sort} comment
 * sits on its line or the line above, or it is part of an exempt query.
 *
 * <p>The whole file is handled on the first visit, after which the traversal halts.
 */
final class CommentDirectives implements Style {

  private static final Logger logger = Logger.getLogger(CommentDirectives.class.getName());

  static final String SORT = "restyle:sort";
  static final String SKIP_SORT = "restyle:skip-sort";

  private static final CharMatcher COMMENT_MARKER = CharMatcher.is('#');

  @Override
  public StyleResult run(Zipper zipper, StyleContext context) {
    NodeSorter sorter = new NodeSorter(context.getOptions());
    ImmutableList<Comment> comments = context.getComments();
    Zipper root = zipper;

    int requests = 0;
    for (Comment comment : comments) {
      if (isSentinel(comment, SORT)) {
        requests++;
      }
    }
    for (int i = 0; i < requests; i++) {
      // Sorting moves comments, so the request is looked up again each time.
      Comment request = nthSentinel(comments, i);
      if (request == null) {
        break;
      }
      int line = request.getLine();
      Zipper target =
          root.find(
              n -> !n.isScript() && !n.isBlock() && !n.isDoBlock() && n.getLineno() >= line);
      if (target == null) {
        continue;
      }
      NodeSorter.Sorted sorted = sorter.sort(target.node(), comments);
      if (sorted == null) {
        logger.fine("Nothing to sort below line " + line + " of " + context.getFileName());
        continue;
      }
      root = apply(target, sorted).top();
      comments = sorted.getComments();
    }

    if (!context.getOptions().getAutosort().isEmpty()) {
      ImmutableSet<Integer> skipLines = skipLines(comments);
      Zipper z = root;
      while (true) {
        Node n = z.node();
        Zipper next;
        if (sorter.isExemptQuery(n)) {
          next = z.skip();
        } else {
          if (sorter.isAutosortable(n)
              && !skipLines.contains(n.getLineno())
              && !Comments.hasCommentsInside(n, comments)) {
            NodeSorter.Sorted sorted = sorter.sort(n, comments);
            if (sorted != null && !sorted.getNode().isEquivalentTo(n, true)) {
              z = apply(z, sorted);
              comments = sorted.getComments();
            }
          }
          next = z.next();
        }
        if (next == null) {
          root = z.top();
          break;
        }
        z = next;
      }
    }
    return StyleResult.halt(root, context.withComments(comments));
  }

  private static Zipper apply(Zipper target, NodeSorter.Sorted sorted) {
    return target
        .replace(sorted.getNode())
        .shiftLinesAfter(sorted.getAfterLine(), sorted.getLineDelta());
  }

  private static ImmutableSet<Integer> skipLines(ImmutableList<Comment> comments) {
    ImmutableSet.Builder<Integer> lines = ImmutableSet.builder();
    for (Comment comment : comments) {
      if (isSentinel(comment, SKIP_SORT)) {
        lines.add(comment.getLine(), comment.getLine() + 1);
      }
    }
    return lines.build();
  }

  private static @Nullable Comment nthSentinel(ImmutableList<Comment> comments, int n) {
    int seen = 0;
    for (Comment comment : comments) {
      if (isSentinel(comment, SORT)) {
        if (seen == n) {
          return comment;
        }
        seen++;
      }
    }
    return null;
  }

  static boolean isSentinel(Comment comment, String directive) {
    return COMMENT_MARKER.trimLeadingFrom(comment.getText()).trim().equals(directive);
  }
}
