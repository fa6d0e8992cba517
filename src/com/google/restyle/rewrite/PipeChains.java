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
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Range;
import com.google.restyle.ast.Comment;
import com.google.restyle.ast.IR;
import com.google.restyle.ast.Node;
import com.google.restyle.ast.Zipper;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Normalizes {@code |>} chains.
 *
 * <p>For every chain this style fixes the head until it is a valid start, cleans up individual
 * links, fuses adjacent links that have a single-call equivalent and, when configured, rewrites a
 * chain of one link as a plain call. Calls whose first argument is a chain are turned inside out
 * so the chain reads left to right.
 *
 * <p>A chain {@code a |> f() |> g()} is the left-leaning tree {@code PIPE(PIPE(a, f()), g())}. It
 * is handled in one go when the walk reaches its outermost {@code PIPE}; the walk then resumes at
 * the innermost one so that the partial chains inside are not treated as chains of their own.
 */
final class PipeChains implements Style {

  private static final Logger logger = Logger.getLogger(PipeChains.class.getName());

  private static final ImmutableSet<String> ENUM_OR_STREAM = ImmutableSet.of("Enum", "Stream");

  private static final ImmutableSet<String> COLLECTABLES =
      ImmutableSet.of("Map", "Keyword", "MapSet");

  /** Calls that keep a chain as their first argument. */
  private static final ImmutableSet<String> NEVER_LIFTED =
      ImmutableSet.of("assert", "refute", "def", "defp", "defmacro", "defmacrop");

  @Override
  public StyleResult run(Zipper zipper, StyleContext context) {
    Node n = zipper.node();
    if (n.isPipe()) {
      return normalizeChain(zipper, context);
    }
    if (canLiftFirstArg(zipper, context.getOptions())) {
      return liftNestedCalls(zipper, context);
    }
    return StyleResult.cont(zipper, context);
  }

  private StyleResult normalizeChain(Zipper zipper, StyleContext context) {
    RewriteOptions options = context.getOptions();
    PipeChainStarts starts = new PipeChainStarts(options);
    Node original = zipper.node();
    List<Node> links = new ArrayList<>();
    Node head = original;
    while (head.isPipe()) {
      links.add(0, head.getSecondChild());
      head = head.getFirstChild();
    }

    while (!starts.isValid(head)) {
      if (NodeUtil.hasDoBlock(head)) {
        StyleResult extracted =
            extractBlockStart(zipper.replace(buildChain(head, links)), head, context);
        if (extracted != null) {
          return extracted;
        }
        break;
      }
      ImmutableList<Node> args = NodeUtil.getArgs(head);
      if (args.isEmpty()) {
        break;
      }
      Node first = args.get(0);
      if (NodeUtil.isKeywordList(first)) {
        first = first.withoutProp(Node.Prop.NO_PARENS);
      }
      Node rest = NodeUtil.withArgs(head, args.subList(1, args.size()));
      links.add(
          0, NodeUtil.withCallStartLine(rest, Math.max(head.getLineno(), first.getMaxLine())));
      head = first;
    }

    for (int i = 0; i < links.size(); i++) {
      links.set(i, fixLink(links.get(i)));
    }

    ImmutableList<Comment> comments = context.getComments();
    int i = 0;
    while (i + 1 < links.size()) {
      Node first = links.get(i);
      Node second = links.get(i + 1);
      Node fused = fuse(first, second);
      if (fused == null) {
        i++;
        continue;
      }
      comments =
          Comments.displace(
              comments,
              Range.openClosed(first.getMaxLine(), second.getMaxLine()),
              first.getMaxLine());
      links.set(i, fused);
      links.remove(i + 1);
    }
    context = context.withComments(comments);

    if (links.size() == 1 && options.getSinglePipeFlag() && isCollapsible(links.get(0))) {
      return collapse(zipper, head, links.get(0), context);
    }

    Node chain = buildChain(head, links);
    if (!chain.isEquivalentTo(original, true)) {
      zipper = zipper.replace(chain);
    }
    for (int level = 1; level < links.size(); level++) {
      zipper = zipper.down();
    }
    return StyleResult.cont(zipper, context);
  }

  private static Node buildChain(Node head, List<Node> links) {
    Node chain = head;
    for (Node link : links) {
      chain = IR.pipe(chain, link);
    }
    return chain;
  }

  // Chain starts.

  /**
   * Moves the {@code do} block heading the chain into a variable assigned right before the
   * statement holding the chain. The walk resumes at the new assignment, so the statement and its
   * chain are visited again with the variable as head.
   */
  private static @Nullable StyleResult extractBlockStart(
      Zipper chain, Node head, StyleContext context) {
    Zipper statement = findStatement(chain);
    if (statement == null) {
      return null;
    }
    int line = head.getLineno();
    int last = head.getMaxLine();
    String name = resultName(head);

    Node rest = statement.node().shiftLinesAfter(last, 1);
    rest = NodeUtil.replaceNode(rest, head, IR.name(name, last + 1));
    rest = NodeUtil.raiseLines(rest, last + 1);
    Node assignment = IR.assign(IR.name(name, line), head);

    statement = statement.shiftLinesAfter(last, 1);
    Zipper result;
    if (statement.parentShape().isArrow()) {
      result = statement.replace(IR.block(line, assignment, rest)).down();
    } else {
      result = statement.replace(rest).insertLeft(assignment).left();
    }
    logger.fine("Extracted " + name + " in " + context.getFileName());
    return StyleResult.cont(
        result, context.withComments(Comments.shiftAfter(context.getComments(), last, 1)));
  }

  /** Returns the enclosing expression that sits directly in a block or clause body. */
  private static @Nullable Zipper findStatement(Zipper zipper) {
    for (Zipper z = zipper; z != null; z = z.up()) {
      Node parent = z.parentShape();
      if (parent == null) {
        return null;
      }
      if (parent.isBlock() || parent.isScript() || (parent.isArrow() && z.childIndex() == 1)) {
        return z;
      }
    }
    return null;
  }

  private static String resultName(Node blockCall) {
    String name = NodeUtil.getFunctionName(blockCall);
    if (name == null) {
      name = "block";
    } else if (name.equals("unless")) {
      name = "if";
    }
    return name + "_result";
  }

  // Links.

  private static Node fixLink(Node link) {
    int line = link.getLineno();
    if (link.isName()) {
      return IR.callWithCallee(link, line, ImmutableList.of())
          .withProp(Node.Prop.CLOSING_LINE, line);
    }
    if (!link.isCall()) {
      return link;
    }
    ImmutableList<Node> args = NodeUtil.getArgs(link);
    if (link.isLocalCall("then") && args.size() == 1 && args.get(0).isCapture()) {
      Node captured = args.get(0).getFirstChild();
      Node unwrapped = unwrapCapture(captured);
      if (unwrapped == null) {
        unwrapped = unwrapCaptureRef(captured);
      }
      return unwrapped != null ? NodeUtil.withCallStartLine(unwrapped, line) : link;
    }
    if (link.getBooleanProp(Node.Prop.ANON_INVOKE) && args.isEmpty()) {
      Node callee = NodeUtil.getCallee(link);
      if (callee.isCapture() || callee.isFunction()) {
        return fixLink(IR.call("then", line, callee));
      }
    }
    return link;
  }

  /** {@code &f(&1, y)} becomes {@code f(y)}; {@code &(&1 + y)} becomes {@code Kernel.+(y)}. */
  private static @Nullable Node unwrapCapture(Node captured) {
    if (captured.isCall() && NodeUtil.getFunctionName(captured) != null) {
      ImmutableList<Node> args = NodeUtil.getArgs(captured);
      if (args.isEmpty() || !isFirstCaptureArg(args.get(0))) {
        return null;
      }
      ImmutableList<Node> rest = args.subList(1, args.size());
      for (Node arg : rest) {
        if (NodeUtil.containsCaptureArg(arg)) {
          return null;
        }
      }
      return NodeUtil.withArgs(captured, rest);
    }
    if (captured.isOperator()
        && NodeUtil.KERNEL_OPERATORS.contains(captured.getString())
        && isFirstCaptureArg(captured.getFirstChild())) {
      List<Node> rest = new ArrayList<>();
      for (int i = 1; i < captured.getChildCount(); i++) {
        Node operand = captured.getChildAtIndex(i);
        if (NodeUtil.containsCaptureArg(operand)) {
          return null;
        }
        rest.add(operand);
      }
      return IR.remoteCall(
          IR.aliases("Kernel", captured.getLineno()),
          captured.getString(),
          captured.getLineno(),
          rest);
    }
    return null;
  }

  /** {@code &f/1} becomes {@code f()}. */
  private static @Nullable Node unwrapCaptureRef(Node captured) {
    if (!captured.isOperator("/") || captured.getChildCount() != 2) {
      return null;
    }
    Node fun = captured.getFirstChild();
    Node arity = captured.getSecondChild();
    if (!arity.isNumber() || !arity.hasString("1")) {
      return null;
    }
    if (fun.isName() || (fun.isGetProp() && fun.getFirstChild().isAliases())) {
      return IR.callWithCallee(fun, fun.getLineno(), ImmutableList.of())
          .withProp(Node.Prop.CLOSING_LINE, fun.getLineno());
    }
    return null;
  }

  private static boolean isFirstCaptureArg(Node n) {
    return n.isCaptureArg() && n.hasString("1");
  }

  // Fusion.

  /** Returns the single link equivalent to {@code first |> second}, or null. */
  private static @Nullable Node fuse(Node first, Node second) {
    if (!first.isCall()
        || !second.isCall()
        || NodeUtil.hasDoBlock(first)
        || NodeUtil.hasDoBlock(second)) {
      return null;
    }
    ImmutableList<Node> a = NodeUtil.getArgs(first);
    ImmutableList<Node> b = NodeUtil.getArgs(second);
    int line = first.getLineno();
    int last = first.getMaxLine();

    if (NodeUtil.isRemoteCall(first, "Enum", "reverse")
        && a.isEmpty()
        && b.size() == 1
        && (NodeUtil.isRemoteCall(second, "Enum", "concat")
            || NodeUtil.isRemoteCall(second, "Kernel", "++"))) {
      return fused(first, "Enum", "reverse", b.get(0).withAllLines(last));
    }

    boolean isFilter = a.size() == 1 && NodeUtil.isRemoteCall(first, ENUM_OR_STREAM, "filter");
    if (isFilter && b.isEmpty() && NodeUtil.isRemoteCall(second, "Enum", "count")) {
      return fused(first, "Enum", "count", a.get(0));
    }
    if (isFilter && b.size() == 1 && NodeUtil.isRemoteCall(second, "Enum", "filter")) {
      return fused(first, "Enum", "filter", combineFilters(a.get(0), b.get(0), line, last));
    }

    if (a.size() == 1
        && b.isEmpty()
        && (NodeUtil.isRemoteCall(first, "Stream", "map")
            || NodeUtil.isRemoteCall(first, "Stream", "each"))
        && NodeUtil.isRemoteCall(second, "Stream", "run")) {
      return fused(first, "Enum", "each", a.get(0));
    }

    if (a.size() != 1 || !NodeUtil.isRemoteCall(first, ENUM_OR_STREAM, "map")) {
      return null;
    }
    Node mapper = a.get(0);
    if (NodeUtil.isRemoteCall(second, "Enum", "join") && b.size() <= 1) {
      return b.isEmpty()
          ? fused(first, "Enum", "map_join", mapper)
          : fused(first, "Enum", "map_join", b.get(0).withAllLines(line), mapper);
    }
    if (NodeUtil.isRemoteCall(second, "Enum", "into") && b.size() == 1) {
      Node collectable = b.get(0);
      if (NodeUtil.isEmptyMap(collectable)
          || (NodeUtil.isRemoteCall(collectable, "Map", "new")
              && NodeUtil.getArgs(collectable).isEmpty())) {
        return fused(first, "Map", "new", mapper);
      }
      return fused(first, "Enum", "into", collectable.withAllLines(line), mapper);
    }
    if (b.isEmpty() && NodeUtil.isRemoteCall(second, COLLECTABLES, "new")) {
      return fused(first, NodeUtil.getRemoteModule(second), "new", mapper);
    }
    return null;
  }

  private static Node fused(Node first, String module, String fun, Node... args) {
    return IR.remoteCall(module, fun, first.getLineno(), args)
        .withProp(Node.Prop.CLOSING_LINE, first.getMaxLine());
  }

  /** Builds {@code fn v -> f(v) && g(v) end}, inlining single-clause functions. */
  private static Node combineFilters(Node f, Node g, int line, int last) {
    String var = singleParam(f);
    if (var == null) {
      var = "val";
    }
    Node left = applyFilter(f, var, line);
    Node right = applyFilter(g, var, last).withAllLines(last);
    return IR.function(
        line, ImmutableList.of(IR.name(var, line)), IR.op("&&", left.getLineno(), left, right));
  }

  private static @Nullable String singleParam(Node fn) {
    if (!fn.isFunction() || !fn.hasOneChild()) {
      return null;
    }
    Node params = fn.getFirstChild().getFirstChild();
    if (params.hasOneChild() && params.getFirstChild().isName()) {
      return params.getFirstChild().getString();
    }
    return null;
  }

  private static Node applyFilter(Node filter, String var, int line) {
    String param = singleParam(filter);
    if (param != null) {
      Node body = filter.getFirstChild().getSecondChild();
      if (!body.isBlock()) {
        return renameVariable(body, param, var);
      }
    }
    if (filter.isCapture() && !filter.getFirstChild().isOperator("/")) {
      return replaceCaptureArg(filter.getFirstChild(), var);
    }
    return IR.anonCall(filter, line, IR.name(var, line));
  }

  private static Node renameVariable(Node n, String from, String to) {
    if (n.isName(from)) {
      return n.withString(to);
    }
    if (n.isFunction() || n.isCapture()) {
      // Nested functions may shadow the variable.
      return n;
    }
    Node result = n;
    for (int i = 0; i < n.getChildCount(); i++) {
      result = result.withChildAtIndex(i, renameVariable(n.getChildAtIndex(i), from, to));
    }
    return result;
  }

  private static Node replaceCaptureArg(Node n, String var) {
    if (n.isCaptureArg()) {
      return IR.name(var, n.getLineno());
    }
    Node result = n;
    for (int i = 0; i < n.getChildCount(); i++) {
      result = result.withChildAtIndex(i, replaceCaptureArg(n.getChildAtIndex(i), var));
    }
    return result;
  }

  // Single links.

  private static boolean isCollapsible(Node link) {
    return link.isCall() && !NodeUtil.hasDoBlock(link) && !link.isLocalCall("unquote");
  }

  /** Rewrites {@code head |> f(y)} as {@code f(head, y)}. */
  private static StyleResult collapse(Zipper zipper, Node head, Node link, StyleContext context) {
    ImmutableList<Comment> comments = context.getComments();
    boolean multiline = false;
    for (Node arg : NodeUtil.getArgs(link)) {
      multiline |= arg.isFunction();
    }

    if (multiline) {
      // The call moves up to the head; the function keeps its own line structure.
      int headLast = head.getMaxLine();
      int shift = headLast - link.getLineno();
      if (shift < 0) {
        comments =
            Comments.displace(
                comments, Range.closedOpen(headLast + 1, link.getLineno()), headLast);
        comments =
            Comments.shift(comments, Range.closed(link.getLineno(), link.getMaxLine()), shift);
      }
      Node moved = link.shiftLines(Math.min(shift, 0));
      Node call =
          NodeUtil.withCallStartLine(withFirstArg(moved, head), head.getLineno());
      return StyleResult.cont(zipper.replace(call), context.withComments(comments));
    }

    Node parent = zipper.parentShape();
    boolean isAssigned =
        parent != null && parent.isOperator("=") && zipper.childIndex() == 1;
    int start = isAssigned ? parent.getLineno() : head.getLineno();
    int oldLast = isAssigned ? parent.getMaxLine() : zipper.node().getMaxLine();
    Node newHead = NodeUtil.lineSpan(head) == 1 ? head.withAllLines(start) : head;
    int rest = Math.max(start, newHead.getMaxLine());
    Node call = NodeUtil.withCallStartLine(withFirstArg(link.withAllLines(rest), newHead), start);
    context =
        context.withComments(Comments.displace(comments, Range.openClosed(rest, oldLast), rest));

    if (isAssigned) {
      Zipper assignment = zipper.replace(call).up();
      Node lhs = assignment.node().getFirstChild();
      return StyleResult.cont(
          assignment.replace(
              assignment.node().withChildAtIndex(0, lhs.withAllLines(start)).withLineno(start)),
          context);
    }
    return StyleResult.cont(zipper.replace(call), context);
  }

  private static Node withFirstArg(Node call, Node first) {
    List<Node> args = new ArrayList<>();
    args.add(first);
    args.addAll(NodeUtil.getArgs(call));
    return NodeUtil.withArgs(call, args);
  }

  // Nested calls.

  /** Whether {@code f(a |> b(), c)} at the focus should read {@code a |> b() |> f(c)}. */
  private static boolean canLiftFirstArg(Zipper zipper, RewriteOptions options) {
    Node call = zipper.node();
    if (!call.isCall() || !NodeUtil.hasParens(call)) {
      return false;
    }
    Node first = NodeUtil.getFirstArg(call);
    String name = NodeUtil.getFunctionName(call);
    if (first == null || !first.isPipe() || name == null) {
      return false;
    }
    if (NodeUtil.isPredicateName(name)
        || NEVER_LIFTED.contains(name)
        || NodeUtil.SPECIAL_FORMS.contains(name)
        || NodeUtil.BLOCK_MACROS.contains(name)) {
      return false;
    }
    String qualifiedName = NodeUtil.getQualifiedCallName(call);
    if (qualifiedName != null && options.getPipedFunctionExclusions().contains(qualifiedName)) {
      return false;
    }
    if (NodeUtil.takesBlock(call)) {
      return false;
    }
    Node parent = zipper.parentShape();
    return parent == null
        || !(parent.isPipe()
            || parent.isAttribute()
            || parent.isOperator("::")
            || parent.isOperator("not")
            || parent.isOperator("!"));
  }

  private StyleResult liftNestedCalls(Zipper zipper, StyleContext context) {
    Zipper current = zipper;
    while (true) {
      Node call = current.node();
      ImmutableList<Node> args = NodeUtil.getArgs(call);
      Node chain = args.get(0);
      Node rest = NodeUtil.withArgs(call, args.subList(1, args.size()));
      int line = Math.max(call.getLineno(), chain.getMaxLine());
      current = current.replace(IR.pipe(chain, NodeUtil.withCallStartLine(rest, line)));

      int index = current.childIndex();
      Zipper parent = current.up();
      if (parent == null
          || index != 1
          || !canLiftFirstArg(parent, context.getOptions())) {
        break;
      }
      current = parent;
    }
    return normalizeChain(current, context);
  }
}
