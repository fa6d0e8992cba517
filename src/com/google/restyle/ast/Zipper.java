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

package com.google.restyle.ast;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CheckReturnValue;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import org.jspecify.annotations.Nullable;

/**
 * A cursor over an immutable {@link Node} tree.
 *
 * <p>A zipper is a focused node plus a path back to the root. Each path element (a "crumb")
 * remembers the parent node, the parent's children as they were last seen from this level, the
 * index of the focus among them, and whether anything below the parent has been edited. Edits only
 * touch the focus; parents are rebuilt when the cursor moves {@link #up}, and a parent whose
 * subtree was never edited is returned as-is, so untouched parts of the tree are always shared.
 *
 * <p>Zippers are immutable values. Every movement or edit returns a new zipper. Movements that
 * would leave the tree (above the root, before the first sibling, after the last sibling, below a
 * leaf) return {@code null}; callers treat that as an ordinary "no such node" answer.
 */
@CheckReturnValue
public final class Zipper {

  private final Node focus;
  private final @Nullable Path path;

  /** One level of the trail from the focus back to the root. */
  private static final class Path {
    /** The parent node. Its children are stale when {@link #changed} is set. */
    final Node parent;
    /** The parent's children, with the entry at {@link #index} possibly stale. */
    final ImmutableList<Node> siblings;
    final int index;
    final @Nullable Path parentPath;
    final boolean changed;

    Path(
        Node parent,
        ImmutableList<Node> siblings,
        int index,
        @Nullable Path parentPath,
        boolean changed) {
      this.parent = parent;
      this.siblings = siblings;
      this.index = index;
      this.parentPath = parentPath;
      this.changed = changed;
    }

    Path withIndex(int newIndex, ImmutableList<Node> newSiblings, boolean newChanged) {
      return new Path(parent, newSiblings, newIndex, parentPath, newChanged);
    }

    Path markChanged() {
      return changed ? this : new Path(parent, siblings, index, parentPath, true);
    }
  }

  /** The result of visiting one node during {@link #traverseWhile}. */
  public static final class Step {
    private final TraversalSignal signal;
    private final Zipper zipper;

    private Step(TraversalSignal signal, Zipper zipper) {
      this.signal = checkNotNull(signal);
      this.zipper = checkNotNull(zipper);
    }

    public static Step of(TraversalSignal signal, Zipper zipper) {
      return new Step(signal, zipper);
    }

    public static Step cont(Zipper zipper) {
      return new Step(TraversalSignal.CONTINUE, zipper);
    }

    public static Step skip(Zipper zipper) {
      return new Step(TraversalSignal.SKIP, zipper);
    }

    public static Step halt(Zipper zipper) {
      return new Step(TraversalSignal.HALT, zipper);
    }

    public TraversalSignal getSignal() {
      return signal;
    }

    public Zipper getZipper() {
      return zipper;
    }
  }

  /** Callback for {@link #traverseWhile}. */
  @FunctionalInterface
  public interface Visitor {
    Step visit(Zipper zipper);
  }

  private Zipper(Node focus, @Nullable Path path) {
    this.focus = checkNotNull(focus);
    this.path = path;
  }

  /** Returns a zipper focused on the root of {@code root}. */
  public static Zipper zip(Node root) {
    return new Zipper(root, null);
  }

  public Node node() {
    return focus;
  }

  public boolean isRoot() {
    return path == null;
  }

  /** Returns the index of the focus among its siblings, or -1 at the root. */
  public int childIndex() {
    return path == null ? -1 : path.index;
  }

  /**
   * Returns the parent node as it was when the cursor descended into it, or null at the root. Its
   * token and metadata are current; its children may predate edits made below it.
   */
  public @Nullable Node parentShape() {
    return path == null ? null : path.parent;
  }

  // Movement.

  /** Moves to the first child of the focus. */
  public @Nullable Zipper down() {
    if (!focus.hasChildren()) {
      return null;
    }
    return new Zipper(focus.getChildAtIndex(0), new Path(focus, focus.children(), 0, path, false));
  }

  /** Moves to the parent, rebuilding it if anything below it changed. */
  public @Nullable Zipper up() {
    if (path == null) {
      return null;
    }
    if (!path.changed) {
      return new Zipper(path.parent, path.parentPath);
    }
    Node parent = path.parent.withChildren(committedSiblings());
    Path grandparent = path.parentPath == null ? null : path.parentPath.markChanged();
    return new Zipper(parent, grandparent);
  }

  public @Nullable Zipper left() {
    if (path == null || path.index == 0) {
      return null;
    }
    ImmutableList<Node> siblings = committedSiblings();
    return new Zipper(
        siblings.get(path.index - 1), path.withIndex(path.index - 1, siblings, path.changed));
  }

  public @Nullable Zipper right() {
    if (path == null || path.index == path.siblings.size() - 1) {
      return null;
    }
    ImmutableList<Node> siblings = committedSiblings();
    return new Zipper(
        siblings.get(path.index + 1), path.withIndex(path.index + 1, siblings, path.changed));
  }

  /** Moves to the first sibling, or stays put at the root. */
  public Zipper leftmost() {
    if (path == null || path.index == 0) {
      return this;
    }
    ImmutableList<Node> siblings = committedSiblings();
    return new Zipper(siblings.get(0), path.withIndex(0, siblings, path.changed));
  }

  /** Moves to the last sibling, or stays put at the root. */
  public Zipper rightmost() {
    if (path == null || path.index == path.siblings.size() - 1) {
      return this;
    }
    ImmutableList<Node> siblings = committedSiblings();
    int last = siblings.size() - 1;
    return new Zipper(siblings.get(last), path.withIndex(last, siblings, path.changed));
  }

  /** Moves to the next node in depth-first pre-order, or returns null after the last node. */
  public @Nullable Zipper next() {
    Zipper down = down();
    return down != null ? down : skip();
  }

  /**
   * Moves to the next node in pre-order that is not a descendant of the focus, or returns null if
   * there is none.
   */
  public @Nullable Zipper skip() {
    for (Zipper z = this; z != null; z = z.up()) {
      Zipper right = z.right();
      if (right != null) {
        return right;
      }
    }
    return null;
  }

  /** Moves to the previous node in depth-first pre-order, or returns null at the root. */
  public @Nullable Zipper prev() {
    Zipper left = left();
    if (left == null) {
      return up();
    }
    Zipper z = left;
    for (Zipper child = z.down(); child != null; child = z.down()) {
      z = child.rightmost();
    }
    return z;
  }

  /** Moves all the way up and returns the root zipper. */
  public Zipper top() {
    Zipper z = this;
    for (Zipper parent = z.up(); parent != null; parent = z.up()) {
      z = parent;
    }
    return z;
  }

  /** Returns the root node of the (possibly edited) tree. */
  public Node root() {
    return top().node();
  }

  // Editing.

  /** Replaces the focus. Only the focus subtree changes. */
  public Zipper replace(Node node) {
    if (node == focus) {
      return this;
    }
    return new Zipper(node, path == null ? null : path.markChanged());
  }

  public Zipper update(UnaryOperator<Node> fn) {
    return replace(fn.apply(focus));
  }

  /** Inserts a sibling before the focus; the focus does not move. */
  public Zipper insertLeft(Node node) {
    checkState(path != null, "Can't insert a sibling of the root");
    ImmutableList<Node> siblings = insertAt(committedSiblings(), path.index, node);
    return new Zipper(focus, path.withIndex(path.index + 1, siblings, true));
  }

  /** Inserts a sibling after the focus; the focus does not move. */
  public Zipper insertRight(Node node) {
    checkState(path != null, "Can't insert a sibling of the root");
    ImmutableList<Node> siblings = insertAt(committedSiblings(), path.index + 1, node);
    return new Zipper(focus, path.withIndex(path.index, siblings, true));
  }

  /** Inserts {@code child} as the first child of the focus. */
  public Zipper insertChild(Node child) {
    return replace(focus.withChildren(insertAt(focus.children(), 0, child)));
  }

  /** Inserts {@code child} as the last child of the focus. */
  public Zipper appendChild(Node child) {
    return replace(focus.withChildren(insertAt(focus.children(), focus.getChildCount(), child)));
  }

  /**
   * Removes the focus. The new focus is the left sibling if there is one, otherwise the parent.
   */
  public Zipper remove() {
    checkState(path != null, "Can't remove the root");
    ImmutableList<Node> siblings = committedSiblings();
    ImmutableList.Builder<Node> remaining = ImmutableList.builder();
    for (int i = 0; i < siblings.size(); i++) {
      if (i != path.index) {
        remaining.add(siblings.get(i));
      }
    }
    ImmutableList<Node> newSiblings = remaining.build();
    if (path.index > 0) {
      return new Zipper(
          newSiblings.get(path.index - 1), path.withIndex(path.index - 1, newSiblings, true));
    }
    Node parent = path.parent.withChildren(newSiblings);
    return new Zipper(parent, path.parentPath == null ? null : path.parentPath.markChanged());
  }

  /**
   * Moves every line strictly after {@code line} by {@code delta} in the rest of the tree: all
   * siblings of the focus and of every ancestor, plus the ancestors' own line metadata. The focus
   * subtree itself is left alone; callers adjust it as part of their edit.
   */
  public Zipper shiftLinesAfter(int line, int delta) {
    if (path == null || delta == 0) {
      return this;
    }
    return new Zipper(focus, shiftPath(path, line, delta));
  }

  private static Path shiftPath(Path path, int line, int delta) {
    ImmutableList.Builder<Node> siblings =
        ImmutableList.builderWithExpectedSize(path.siblings.size());
    for (int i = 0; i < path.siblings.size(); i++) {
      Node sibling = path.siblings.get(i);
      siblings.add(i == path.index ? sibling : sibling.shiftLinesAfter(line, delta));
    }
    Path parentPath = path.parentPath == null ? null : shiftPath(path.parentPath, line, delta);
    return new Path(
        path.parent.shiftOwnLinesAfter(line, delta),
        siblings.build(),
        path.index,
        parentPath,
        true);
  }

  // Searching and walking.

  /**
   * Walks forward in pre-order from the focus (inclusive) to the end of the tree and returns a
   * zipper at the first node matching {@code predicate}, or null if there is none.
   */
  public @Nullable Zipper find(Predicate<Node> predicate) {
    for (Zipper z = this; z != null; z = z.next()) {
      if (predicate.test(z.node())) {
        return z;
      }
    }
    return null;
  }

  /** Walks up from the focus (inclusive) and returns the first matching ancestor, or null. */
  public @Nullable Zipper findAncestor(Predicate<Node> predicate) {
    for (Zipper z = this; z != null; z = z.up()) {
      if (predicate.test(z.node())) {
        return z;
      }
    }
    return null;
  }

  /** Whether any node in the focus subtree matches {@code predicate}. */
  public boolean any(Predicate<Node> predicate) {
    return anyNode(focus, predicate);
  }

  private static boolean anyNode(Node n, Predicate<Node> predicate) {
    if (predicate.test(n)) {
      return true;
    }
    for (Node child : n.children()) {
      if (anyNode(child, predicate)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Applies {@code fn} to every node of the focus subtree in pre-order, descending into whatever
   * each call returns. Returns a zipper focused on the rewritten subtree root.
   */
  public Zipper traverse(UnaryOperator<Zipper> fn) {
    return traverseWhile(z -> Step.cont(fn.apply(z)));
  }

  /**
   * Walks the focus subtree in pre-order, letting {@code visitor} edit each node and decide how to
   * proceed. Returns a zipper focused on the rewritten subtree root, in the same position as this
   * zipper.
   */
  public Zipper traverseWhile(Visitor visitor) {
    Zipper detached = new Zipper(focus, null);
    Node result = walk(detached, visitor).node();
    return replace(result);
  }

  private static Zipper walk(Zipper start, Visitor visitor) {
    Zipper current = start;
    while (true) {
      Step step = visitor.visit(current);
      current = step.getZipper();
      Zipper next;
      switch (step.getSignal()) {
        case HALT:
          return current.top();
        case SKIP:
          next = current.skip();
          break;
        case CONTINUE:
          next = current.next();
          break;
        default:
          throw new IllegalStateException("Unexpected signal " + step.getSignal());
      }
      if (next == null) {
        return current.top();
      }
      current = next;
    }
  }

  private ImmutableList<Node> committedSiblings() {
    checkNotNull(path);
    if (path.siblings.get(path.index) == focus) {
      return path.siblings;
    }
    ImmutableList.Builder<Node> builder =
        ImmutableList.builderWithExpectedSize(path.siblings.size());
    for (int i = 0; i < path.siblings.size(); i++) {
      builder.add(i == path.index ? focus : path.siblings.get(i));
    }
    return builder.build();
  }

  private static ImmutableList<Node> insertAt(List<Node> list, int index, Node node) {
    ImmutableList.Builder<Node> builder = ImmutableList.builderWithExpectedSize(list.size() + 1);
    builder.addAll(list.subList(0, index));
    builder.add(node);
    builder.addAll(list.subList(index, list.size()));
    return builder.build();
  }

  @Override
  public String toString() {
    return "Zipper{" + focus + (path == null ? ", root}" : ", index " + path.index + "}");
  }
}
