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

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Sets;
import com.google.restyle.ast.Comment;
import com.google.restyle.ast.Node;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * Sorts the elements of one container node and moves the comments along with them.
 *
 * <p>Containers whose elements all start below the opening line are laid out again with {@link
 * Comments#orderAround}. Containers whose elements are all single-line swap elements between the
 * existing element positions, taking the comments on their lines with them. Other layouts are left
 * alone.
 */
final class NodeSorter {

  static final ImmutableSet<String> SCHEMA_MACROS =
      ImmutableSet.of("schema", "embedded_schema", "typed_schema", "typed_embedded_schema");

  private static final CharMatcher WHITESPACE = CharMatcher.whitespace();
  private static final Splitter WORD_SPLITTER = Splitter.on(WHITESPACE).omitEmptyStrings();

  private static final Comparator<Node> BY_TEXT = Comparator.comparing(CodePrinter::toSource);

  private static final Comparator<Node> BY_KEY = NodeSorter::compareKeys;

  /** A sorted container. */
  @AutoValue
  abstract static class Sorted {
    abstract Node getNode();

    abstract ImmutableList<Comment> getComments();

    /** Lines strictly after this one, outside the container, move by {@link #getLineDelta}. */
    abstract int getAfterLine();

    abstract int getLineDelta();

    static Sorted create(Node node, List<Comment> comments, int afterLine, int lineDelta) {
      return new AutoValue_NodeSorter_Sorted(
          node, ImmutableList.copyOf(comments), afterLine, lineDelta);
    }

    Sorted withNode(Node newNode) {
      return create(newNode, getComments(), getAfterLine(), getLineDelta());
    }
  }

  private final RewriteOptions options;

  NodeSorter(RewriteOptions options) {
    this.options = options;
  }

  /** Whether autosort is enabled for the shape of {@code n}. */
  boolean isAutosortable(Node n) {
    switch (n.getToken()) {
      case MAP:
      case STRUCT:
        return options.isAutosortEnabled(AutosortCategory.MAP);
      case CALL:
        if (n.isLocalCall("defstruct")) {
          return options.isAutosortEnabled(AutosortCategory.DEFSTRUCT);
        }
        return isSchema(n) && options.isAutosortEnabled(AutosortCategory.SCHEMA);
      default:
        return false;
    }
  }

  /**
   * Whether {@code n} builds a query whose maps are exempt from autosort: {@code from(x in Y,
   * ...)} or {@code Query.from(...)}.
   */
  boolean isExemptQuery(Node n) {
    if (!options.getAutosortExcludeQuery() || !n.isCall()) {
      return false;
    }
    if (n.isLocalCall("from")) {
      Node first = NodeUtil.getFirstArg(n);
      return first != null && first.isOperator("in");
    }
    String module = NodeUtil.getRemoteModule(n);
    return module != null
        && (module.equals("Query") || module.endsWith(".Query"))
        && NodeUtil.getCallee(n).hasString("from");
  }

  /** Sorts {@code n}, or returns null if it has no sortable shape. */
  @Nullable Sorted sort(Node n, ImmutableList<Comment> comments) {
    switch (n.getToken()) {
      case LIST:
        return sortElements(n, BY_TEXT, comments);
      case MAP:
        return sortMap(n, comments);
      case STRUCT:
        return sortChild(n, 1, comments);
      case SIGIL:
        return sortWords(n, comments);
      case OPERATOR:
        return n.isOperator("=") ? sortChild(n, 1, comments) : null;
      case ATTRIBUTE:
      case PAIR:
        return n.hasChildren() ? sortChild(n, n.getChildCount() - 1, comments) : null;
      case CALL:
        return sortCall(n, comments);
      default:
        return null;
    }
  }

  private @Nullable Sorted sortChild(Node n, int index, ImmutableList<Comment> comments) {
    Sorted sorted = sort(n.getChildAtIndex(index), comments);
    if (sorted == null) {
      return null;
    }
    Node rebuilt = n.withChildAtIndex(index, sorted.getNode());
    return sorted.withNode(shiftClosingLines(rebuilt, sorted));
  }

  private @Nullable Sorted sortMap(Node map, ImmutableList<Comment> comments) {
    if (map.hasOneChild() && map.getFirstChild().isOperator("|")) {
      Node update = map.getFirstChild();
      Node fields = update.getSecondChild();
      if (!fields.isList()) {
        return null;
      }
      Sorted sorted = sortElements(fields, BY_KEY, comments);
      if (sorted == null) {
        return null;
      }
      Node rebuilt = map.withChildAtIndex(0, update.withChildAtIndex(1, sorted.getNode()));
      return sorted.withNode(shiftClosingLines(rebuilt, sorted));
    }
    return sortElements(map, BY_KEY, comments);
  }

  private @Nullable Sorted sortCall(Node call, ImmutableList<Comment> comments) {
    if (call.isLocalCall("defstruct")) {
      ImmutableList<Node> args = NodeUtil.getArgs(call);
      if (args.size() != 1 || !args.get(0).isList()) {
        return null;
      }
      return sortChild(call, 1, comments);
    }
    Node body = NodeUtil.getDoBody(call);
    if (body == null || body.getChildCount() < 2) {
      return null;
    }
    if (isSchema(call)) {
      return sortSchema(call, body, comments);
    }
    return sortBlock(call, body, BY_TEXT, ImmutableSet.of(), comments);
  }

  private static boolean isSchema(Node n) {
    return NodeUtil.isLocalCall(n)
        && SCHEMA_MACROS.contains(NodeUtil.getCallee(n).getString())
        && NodeUtil.getDoBody(n) != null;
  }

  // Schemas.

  private Sorted sortSchema(Node call, Node body, ImmutableList<Comment> comments) {
    Comparator<Node> byKind = Comparator.comparingInt(this::kindPriority);
    Comparator<Node> order = byKind.thenComparing(BY_TEXT);
    List<Node> sorted = new ArrayList<>(body.children());
    sorted.sort(order);
    Set<Integer> groupStarts = new HashSet<>();
    for (int i = 1; i < sorted.size(); i++) {
      if (kindPriority(sorted.get(i)) != kindPriority(sorted.get(i - 1))) {
        groupStarts.add(i);
      }
    }
    return sortBlock(call, body, order, groupStarts, comments);
  }

  /** Position of the statement's kind in the configured order; unknown kinds share the last. */
  private int kindPriority(Node statement) {
    ImmutableList<String> kinds = options.getSchemaKindOrder();
    String name = NodeUtil.isLocalCall(statement) ? NodeUtil.getCallee(statement).getString() : "";
    int index = kinds.indexOf(name);
    return index >= 0 ? index : kinds.size();
  }

  private Sorted sortBlock(
      Node call,
      Node body,
      Comparator<Node> order,
      Set<Integer> blankLineBefore,
      ImmutableList<Comment> comments) {
    List<Node> statements = new ArrayList<>(body.children());
    statements.sort(order);
    return layOut(
        statements,
        body.children(),
        call.getLineno(),
        blankLineBefore,
        comments,
        laidOut -> NodeUtil.replaceNode(call, body, body.withChildren(laidOut)));
  }

  /**
   * Lays {@code sorted} out below {@code anchorLine} and rebuilds the container with {@code
   * rebuild}. When the layout needs more lines than {@code original} used, the comments after the
   * container move down with the code.
   */
  private static Sorted layOut(
      List<Node> sorted,
      List<Node> original,
      int anchorLine,
      Set<Integer> blankLineBefore,
      ImmutableList<Comment> comments,
      Function<List<Node>, Node> rebuild) {
    int afterLine = lastLine(original);
    List<Comment> within = new ArrayList<>();
    List<Comment> beyond = new ArrayList<>();
    for (Comment comment : comments) {
      (comment.getLine() <= afterLine ? within : beyond).add(comment);
    }
    Comments.Layout layout = Comments.orderAround(sorted, within, anchorLine, blankLineBefore);
    int delta = Math.max(0, layout.getLastLine() - afterLine);
    List<Comment> all = new ArrayList<>(layout.getComments());
    all.addAll(Comments.shiftAfter(beyond, afterLine, delta));
    Sorted result = Sorted.create(rebuild.apply(layout.getNodes()), all, afterLine, delta);
    return result.withNode(shiftClosingLines(result.getNode(), result));
  }

  // Lists and maps.

  private static @Nullable Sorted sortElements(
      Node container, Comparator<Node> order, ImmutableList<Comment> comments) {
    ImmutableList<Node> elements = container.children();
    List<Node> sorted = new ArrayList<>(elements);
    sorted.sort(order);
    if (elements.isEmpty()) {
      return Sorted.create(container, comments, container.getMaxLine(), 0);
    }

    boolean allBelowOpener = true;
    boolean allSingleLine = true;
    for (Node element : elements) {
      allBelowOpener &= element.getLineno() > container.getLineno();
      allSingleLine &= NodeUtil.lineSpan(element) == 1;
    }

    if (allBelowOpener) {
      return layOut(
          sorted,
          elements,
          container.getLineno(),
          ImmutableSet.of(),
          comments,
          container::withChildren);
    }
    if (allSingleLine) {
      return swapInPlace(container, elements, sorted, comments);
    }
    return null;
  }

  /**
   * Moves each element to the line of the element whose position it takes. A comment on a line
   * holding one element moves with that element. Returns null when a comment would be left on
   * another element's line.
   */
  private static @Nullable Sorted swapInPlace(
      Node container,
      List<Node> elements,
      List<Node> sorted,
      ImmutableList<Comment> comments) {
    ListMultimap<Integer, Node> before = ArrayListMultimap.create();
    ListMultimap<Integer, Node> after = ArrayListMultimap.create();
    Map<Node, Integer> newLines = new IdentityHashMap<>();
    List<Node> placed = new ArrayList<>(sorted.size());
    for (int i = 0; i < sorted.size(); i++) {
      Node element = sorted.get(i);
      int line = elements.get(i).getLineno();
      before.put(line, elements.get(i));
      after.put(line, element);
      newLines.put(element, line);
      placed.add(element.shiftLines(line - element.getLineno()));
    }

    int firstLine = container.getLineno();
    int lastLine = lastLine(elements);
    List<Comment> moved = new ArrayList<>(comments.size());
    for (Comment comment : comments) {
      int line = comment.getLine();
      if (line < firstLine || line > lastLine) {
        moved.add(comment);
        continue;
      }
      List<Node> onLine = before.get(line);
      if (onLine.size() == 1) {
        int target = newLines.get(onLine.get(0));
        if (before.get(target).size() != 1) {
          return null;
        }
        moved.add(comment.withLine(target));
      } else if (!onLine.isEmpty() && sameElements(onLine, after.get(line))) {
        moved.add(comment);
      } else {
        return null;
      }
    }
    moved.sort(Comment.BY_LINE);
    return Sorted.create(container.withChildren(placed), moved, container.getMaxLine(), 0);
  }

  private static boolean sameElements(List<Node> a, List<Node> b) {
    Set<Node> identities = Sets.newIdentityHashSet();
    identities.addAll(a);
    return a.size() == b.size() && identities.containsAll(b);
  }

  private static int lastLine(List<Node> nodes) {
    int last = Integer.MIN_VALUE;
    for (Node node : nodes) {
      last = Math.max(last, node.getMaxLine());
    }
    return last;
  }

  /** Moves the closing delimiter and {@code end} of {@code n} down when its contents grew. */
  private static Node shiftClosingLines(Node n, Sorted sorted) {
    int delta = sorted.getLineDelta();
    if (delta == 0) {
      return n;
    }
    Node result = n;
    for (Node.Prop prop : new Node.Prop[] {Node.Prop.CLOSING_LINE, Node.Prop.END_LINE}) {
      if (result.hasProp(prop) && result.getIntProp(prop) > sorted.getAfterLine()) {
        result = result.withProp(prop, result.getIntProp(prop) + delta);
      }
    }
    return result;
  }

  // Word lists.

  private static @Nullable Sorted sortWords(Node sigil, ImmutableList<Comment> comments) {
    if (!sigil.hasString("w") && !sigil.hasString("W")) {
      return null;
    }
    Node contents = sigil.getFirstChild();
    String text = contents.getString();
    List<String> words = new ArrayList<>(WORD_SPLITTER.splitToList(text));
    if (words.size() < 2) {
      return Sorted.create(sigil, comments, sigil.getMaxLine(), 0);
    }
    String trimmedStart = WHITESPACE.trimLeadingFrom(text);
    String prepend = text.substring(0, text.length() - trimmedStart.length());
    String append = trimmedStart.substring(WHITESPACE.trimTrailingFrom(trimmedStart).length());
    int firstWordEnd = trimmedStart.indexOf(words.get(0)) + words.get(0).length();
    String afterFirst = trimmedStart.substring(firstWordEnd);
    String joiner =
        afterFirst.substring(
            0, afterFirst.length() - WHITESPACE.trimLeadingFrom(afterFirst).length());

    words.sort(Comparator.naturalOrder());
    String sortedText = prepend + String.join(joiner, words) + append;
    return Sorted.create(
        sigil.withChildAtIndex(0, contents.withString(sortedText)),
        comments,
        sigil.getMaxLine(),
        0);
  }

  // Map keys.

  private static final int NUMBER_KEY = 0;
  private static final int STRING_KEY = 1;
  private static final int ATOM_KEY = 2;
  private static final int OTHER_KEY = 3;

  /** Numbers (ranges by their lower bound) before strings before atoms before anything else. */
  private static int compareKeys(Node a, Node b) {
    Node keyA = a.isPair() ? a.getFirstChild() : a;
    Node keyB = b.isPair() ? b.getFirstChild() : b;
    int classA = keyClass(keyA);
    int classB = keyClass(keyB);
    if (classA != classB) {
      return Integer.compare(classA, classB);
    }
    int result = 0;
    switch (classA) {
      case NUMBER_KEY:
        result = compareNumbers(numericKey(keyA), numericKey(keyB));
        break;
      case STRING_KEY:
      case ATOM_KEY:
        result = keyA.getString().compareTo(keyB.getString());
        break;
      default:
        break;
    }
    return result != 0 ? result : BY_TEXT.compare(a, b);
  }

  private static int keyClass(Node key) {
    if (key.isNumber() || (key.isOperator("..") && key.getFirstChild().isNumber())) {
      return NUMBER_KEY;
    }
    if (key.isStringLit()) {
      return STRING_KEY;
    }
    if (key.isAtom()) {
      return ATOM_KEY;
    }
    return OTHER_KEY;
  }

  /** Numbers by value; literals without a readable value come last, ordered by text. */
  private static int compareNumbers(@Nullable BigDecimal a, @Nullable BigDecimal b) {
    if (a == null || b == null) {
      return Boolean.compare(a == null, b == null);
    }
    return a.compareTo(b);
  }

  private static @Nullable BigDecimal numericKey(Node key) {
    return key.isNumber() ? key.getNumericValue() : key.getFirstChild().getNumericValue();
  }
}
