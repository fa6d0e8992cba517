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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Range;
import com.google.restyle.ast.Comment;
import com.google.restyle.ast.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Keeps comments next to the code they were written beside while that code moves between lines.
 *
 * <p>Comments are never linked to nodes. A comment on line L belongs to the first node that
 * starts on or after L, so any edit that changes a node's lines has to move the comments with it.
 * Every method returns a new list, sorted by line; comments on the same line keep their order.
 */
public final class Comments {

  private Comments() {}

  /** Moves every comment whose line is in {@code lines} to {@code anchorLine}. */
  public static ImmutableList<Comment> displace(
      List<Comment> comments, Range<Integer> lines, int anchorLine) {
    List<Comment> result = new ArrayList<>(comments.size());
    boolean changed = false;
    for (Comment comment : comments) {
      if (lines.contains(comment.getLine())) {
        Comment moved = comment.withLine(anchorLine);
        changed |= moved != comment;
        result.add(moved);
      } else {
        result.add(comment);
      }
    }
    return changed ? sorted(result) : ImmutableList.copyOf(comments);
  }

  /** Moves every comment whose line is in {@code lines} to the first line of the range. */
  public static ImmutableList<Comment> displace(List<Comment> comments, Range<Integer> lines) {
    checkArgument(lines.hasLowerBound(), "Range needs a lower bound: %s", lines);
    int anchor = lines.lowerEndpoint();
    return displace(comments, lines, lines.contains(anchor) ? anchor : anchor + 1);
  }

  /** Adds {@code delta} to the line of every comment whose line is in {@code lines}. */
  public static ImmutableList<Comment> shift(
      List<Comment> comments, Range<Integer> lines, int delta) {
    if (delta == 0) {
      return ImmutableList.copyOf(comments);
    }
    List<Comment> result = new ArrayList<>(comments.size());
    for (Comment comment : comments) {
      result.add(
          lines.contains(comment.getLine())
              ? comment.withLine(comment.getLine() + delta)
              : comment);
    }
    return sorted(result);
  }

  /** Adds {@code delta} to the line of every comment strictly after {@code line}. */
  public static ImmutableList<Comment> shiftAfter(List<Comment> comments, int line, int delta) {
    return shift(comments, Range.greaterThan(line), delta);
  }

  /**
   * Returns the comments that belong to code spanning {@code startLine} to {@code lastLine}: those
   * inside the span plus the unbroken run of full-line comments directly above it.
   */
  public static ImmutableList<Comment> commentsForLines(
      List<Comment> comments, int startLine, int lastLine) {
    List<Comment> inside = new ArrayList<>();
    int nearestAbove = comments.size();
    for (int i = 0; i < comments.size(); i++) {
      int line = comments.get(i).getLine();
      if (line >= startLine && line <= lastLine) {
        inside.add(comments.get(i));
      } else if (line < startLine) {
        nearestAbove = i;
      }
    }
    // Walk upwards from the comment nearest the node while each one sits on the line above.
    List<Comment> above = new ArrayList<>();
    int expected = startLine - 1;
    for (int i = nearestAbove; i >= 0 && i < comments.size(); i--) {
      Comment comment = comments.get(i);
      if (comment.getLine() == expected) {
        above.add(0, comment);
        expected--;
      } else if (comment.getLine() < expected) {
        break;
      }
    }
    return ImmutableList.<Comment>builder().addAll(above).addAll(inside).build();
  }

  /** Whether any comment sits strictly between the first and the last line of {@code node}. */
  public static boolean hasCommentsInside(Node node, List<Comment> comments) {
    int first = node.getLineno();
    int last = node.getMaxLine();
    for (Comment comment : comments) {
      if (comment.getLine() > first && comment.getLine() < last) {
        return true;
      }
    }
    return false;
  }

  /** Returns the multiset of comment texts, which no style may change. */
  public static ImmutableMultiset<String> countByText(List<Comment> comments) {
    ImmutableMultiset.Builder<String> builder = ImmutableMultiset.builder();
    for (Comment comment : comments) {
      builder.add(comment.getText());
    }
    return builder.build();
  }

  /** Re-ordered nodes with their comments, as produced by {@link #orderAround}. */
  @AutoValue
  public abstract static class Layout {
    public abstract ImmutableList<Node> getNodes();

    public abstract ImmutableList<Comment> getComments();

    /** The last line used by the laid-out nodes and their comments. */
    public abstract int getLastLine();

    static Layout create(List<Node> nodes, List<Comment> comments, int lastLine) {
      return new AutoValue_Comments_Layout(
          ImmutableList.copyOf(nodes), ImmutableList.copyOf(comments), lastLine);
    }
  }

  /**
   * Lays out {@code nodes}, given in their new order, on consecutive lines starting right after
   * {@code anchorLine}. Each node takes along the comments inside its span and the run of comments
   * directly above it. Comments between the nodes that belong to none of them are moved below the
   * last node, one per line. Comments outside the nodes' original span are untouched.
   */
  public static Layout orderAround(List<Node> nodes, List<Comment> comments, int anchorLine) {
    return orderAround(nodes, comments, anchorLine, ImmutableSet.of());
  }

  /**
   * Like {@link #orderAround(List, List, int)}, leaving one blank line before each node whose
   * index in {@code nodes} is in {@code blankLineBefore}.
   */
  public static Layout orderAround(
      List<Node> nodes, List<Comment> comments, int anchorLine, Set<Integer> blankLineBefore) {
    if (nodes.isEmpty()) {
      return Layout.create(nodes, comments, anchorLine);
    }
    int spanStart = Integer.MAX_VALUE;
    int spanEnd = Integer.MIN_VALUE;
    for (Node node : nodes) {
      spanStart = Math.min(spanStart, node.getLineno());
      spanEnd = Math.max(spanEnd, node.getMaxLine());
    }

    List<Comment> remaining = new ArrayList<>(comments);
    // A comment on a node's own lines stays with that node even if another node starts below it.
    List<List<Comment>> inside = new ArrayList<>(nodes.size());
    for (Node node : nodes) {
      List<Comment> mine = new ArrayList<>();
      for (Comment comment : remaining) {
        if (comment.getLine() >= node.getLineno() && comment.getLine() <= node.getMaxLine()) {
          mine.add(comment);
        }
      }
      remaining.removeAll(mine);
      inside.add(mine);
    }

    List<Comment> moved = new ArrayList<>();
    List<Node> laidOut = new ArrayList<>(nodes.size());
    int moveToLine = anchorLine;
    for (int i = 0; i < nodes.size(); i++) {
      Node node = nodes.get(i);
      if (i > 0 && blankLineBefore.contains(i)) {
        moveToLine++;
      }
      int line = node.getLineno();
      int lastLine = node.getMaxLine();
      List<Comment> mine = new ArrayList<>(commentsForLines(remaining, line, lastLine));
      remaining.removeAll(mine);
      mine.addAll(inside.get(i));
      int firstLine = mine.isEmpty() ? line : Math.min(line, mine.get(0).getLine());
      int shift = moveToLine - firstLine + 1;
      laidOut.add(node.shiftLines(shift));
      for (Comment comment : mine) {
        moved.add(comment.withLine(comment.getLine() + shift));
      }
      moveToLine = lastLine + shift;
    }

    // Whatever is left inside the original span no longer has a node of its own.
    List<Comment> result = new ArrayList<>(comments.size());
    for (Comment comment : remaining) {
      if (comment.getLine() >= spanStart && comment.getLine() <= spanEnd) {
        moveToLine++;
        result.add(comment.withLine(moveToLine));
      } else {
        result.add(comment);
      }
    }
    result.addAll(moved);
    return Layout.create(laidOut, sorted(result), moveToLine);
  }

  private static ImmutableList<Comment> sorted(List<Comment> comments) {
    return ImmutableList.sortedCopyOf(Comment.BY_LINE, comments);
  }
}
