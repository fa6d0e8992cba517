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
import com.google.restyle.ast.IR;
import com.google.restyle.ast.Node;
import com.google.restyle.ast.Zipper;
import java.math.BigDecimal;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites that look at one node and its immediate children only. Each rule either matches and
 * replaces the focus or leaves it alone; the traversal always continues into the result.
 */
final class SingleNodeRewrites implements Style {

  private static final Logger logger = Logger.getLogger(SingleNodeRewrites.class.getName());

  private static final ImmutableSet<String> COLLECTABLES =
      ImmutableSet.of("Map", "Keyword", "MapSet");

  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

  @Override
  public StyleResult run(Zipper zipper, StyleContext context) {
    Node n = zipper.node();
    RewriteOptions options = context.getOptions();

    if (n.isPipe() && isTimexNow(n.getLastChild(), 0)) {
      // The piped value is the time zone; there is nothing to rewrite inside.
      return StyleResult.skip(zipper, context);
    }

    Node result;
    switch (n.getToken()) {
      case NUMBER:
        result = groupDigits(n, options.getLargeNumbersGt());
        break;
      case OPERATOR:
        result = rewriteOperator(n);
        break;
      case CALL:
        result = rewriteCall(n, options);
        break;
      default:
        result = null;
    }
    if (result == null || result == n) {
      return StyleResult.cont(zipper, context);
    }
    logger.fine("Rewrote " + n.getToken() + " on line " + n.getLineno());
    return StyleResult.cont(zipper.replace(result), context);
  }

  // Numbers.

  /**
   * Separates every three digits of the integer part of a decimal literal with underscores, for
   * values above {@code threshold}. Literals already containing underscores are left alone.
   */
  static Node groupDigits(Node number, long threshold) {
    String text = number.getString();
    if (text.length() < 2
        || text.startsWith("0x")
        || text.startsWith("0b")
        || text.startsWith("0o")
        || text.indexOf('_') >= 0
        || text.startsWith("?")) {
      return number;
    }
    int end = 0;
    while (end < text.length() && DIGITS.matches(text.charAt(end))) {
      end++;
    }
    String integerPart = text.substring(0, end);
    if (integerPart.isEmpty() || !exceeds(number, integerPart, threshold)) {
      return number;
    }
    StringBuilder grouped = new StringBuilder();
    int firstGroup = integerPart.length() % 3;
    if (firstGroup > 0) {
      grouped.append(integerPart, 0, firstGroup);
    }
    for (int i = firstGroup; i < integerPart.length(); i += 3) {
      if (grouped.length() > 0) {
        grouped.append('_');
      }
      grouped.append(integerPart, i, i + 3);
    }
    grouped.append(text.substring(end));
    return number.withString(grouped.toString());
  }

  private static boolean exceeds(Node number, String integerPart, long threshold) {
    if (integerPart.length() > 18) {
      return true;
    }
    long value = Long.parseLong(integerPart);
    if (value != threshold) {
      return value > threshold;
    }
    // 9999.5 is above 9999 even though its integer part is not.
    BigDecimal exact = number.getNumericValue();
    return exact != null && exact.compareTo(BigDecimal.valueOf(threshold)) > 0;
  }

  // Operators.

  private static @Nullable Node rewriteOperator(Node n) {
    if (n.isOperator("++")) {
      return rewriteReverseConcat(n);
    }
    if (n.isOperator("==") && n.getChildCount() == 2) {
      return rewriteEmptinessCheck(n);
    }
    return null;
  }

  /** {@code Enum.reverse(a) ++ b} becomes {@code Enum.reverse(a, b)}. */
  private static @Nullable Node rewriteReverseConcat(Node n) {
    Node lhs = n.getFirstChild();
    if (n.getChildCount() != 2
        || !NodeUtil.isRemoteCall(lhs, "Enum", "reverse")
        || NodeUtil.getArgs(lhs).size() != 1) {
      return null;
    }
    return NodeUtil.withArgs(
        lhs, ImmutableList.of(NodeUtil.getFirstArg(lhs), n.getSecondChild()));
  }

  /** {@code Enum.count(x) == 0} and {@code length(x) == 0}, either way round. */
  private static @Nullable Node rewriteEmptinessCheck(Node n) {
    Node counted = countedValue(n.getFirstChild(), n.getSecondChild());
    if (counted == null) {
      counted = countedValue(n.getSecondChild(), n.getFirstChild());
    }
    if (counted == null) {
      return null;
    }
    return IR.remoteCall("Enum", "empty?", n.getLineno(), counted);
  }

  private static @Nullable Node countedValue(Node count, Node other) {
    if (!NodeUtil.isZero(other) || !other.getString().equals("0") || !count.isCall()) {
      return null;
    }
    List<Node> args = NodeUtil.getArgs(count);
    if (args.size() != 1) {
      return null;
    }
    if (NodeUtil.isRemoteCall(count, "Enum", "count") || count.isLocalCall("length")) {
      return args.get(0);
    }
    return null;
  }

  // Calls.

  private static @Nullable Node rewriteCall(Node call, RewriteOptions options) {
    if (options.getInefficientFunctionRewrites() && isTimexNow(call, 0)) {
      return withParensOf(call, IR.remoteCall("DateTime", "utc_now", call.getLineno()));
    }
    List<Node> args = NodeUtil.getArgs(call);
    if (args.size() != 2 || NodeUtil.hasDoBlock(call)) {
      return null;
    }
    if (NodeUtil.isRemoteCall(call, "Enum", "into")) {
      return rewriteInto(call, args.get(0), args.get(1));
    }
    if (NodeUtil.isRemoteCall(call, "Map", "merge")) {
      return rewriteMerge(call, args.get(0), args.get(1));
    }
    return null;
  }

  private static boolean isTimexNow(@Nullable Node n, int arity) {
    return n != null
        && NodeUtil.isRemoteCall(n, "Timex", "now")
        && NodeUtil.getArgs(n).size() == arity;
  }

  /**
   * {@code Enum.into(x, %{})} becomes {@code Map.new(x)}, {@code Enum.into(x, [])} becomes
   * {@code Enum.to_list(x)} and {@code Enum.into(x, Mod.new())} becomes {@code Mod.new(x)}.
   */
  private static @Nullable Node rewriteInto(Node call, Node enumerable, Node collectable) {
    String module;
    String fun;
    if (NodeUtil.isEmptyMap(collectable)) {
      module = "Map";
      fun = "new";
    } else if (NodeUtil.isEmptyList(collectable)) {
      module = "Enum";
      fun = "to_list";
    } else if (NodeUtil.isRemoteCall(collectable, COLLECTABLES, "new")
        && NodeUtil.getArgs(collectable).isEmpty()) {
      module = NodeUtil.getRemoteModule(collectable);
      fun = "new";
    } else {
      return null;
    }
    return withParensOf(call, IR.remoteCall(module, fun, call.getLineno(), enumerable));
  }

  /** {@code Map.merge(m, %{k: v})} with a single literal key becomes {@code Map.put(m, :k, v)}. */
  private static @Nullable Node rewriteMerge(Node call, Node map, Node merged) {
    if (!merged.isMap() || !merged.hasOneChild() || !merged.getFirstChild().isPair()) {
      return null;
    }
    Node pair = merged.getFirstChild();
    Node key = pair.getFirstChild();
    if (!key.isAtom() && !key.isStringLit()) {
      return null;
    }
    if (pair.getBooleanProp(Node.Prop.KEYWORD_FORMAT)) {
      key = key.withoutProp(Node.Prop.KEYWORD_FORMAT);
    }
    return withParensOf(
        call, IR.remoteCall("Map", "put", call.getLineno(), map, key, pair.getSecondChild()));
  }

  /** Gives {@code replacement} the closing parenthesis of {@code original}, or none. */
  private static Node withParensOf(Node original, Node replacement) {
    return NodeUtil.hasParens(original)
        ? replacement.withProp(Node.Prop.CLOSING_LINE, original.getClosingLine())
        : replacement.withoutProp(Node.Prop.CLOSING_LINE);
  }
}
