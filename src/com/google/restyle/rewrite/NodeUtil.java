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
import com.google.common.collect.ImmutableSet;
import com.google.restyle.ast.Node;
import com.google.restyle.ast.Token;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Shape queries and small rebuilding helpers shared by the styles. */
public final class NodeUtil {

  private NodeUtil() {}

  /** Operators that {@code Kernel} defines as functions. */
  static final ImmutableSet<String> KERNEL_OPERATORS =
      ImmutableSet.of(
          "++", "--", "&&", "||", "in", "-", "*", "+", "/", ">", "<", "<=", ">=", "==", "and",
          "or", "!=", "!==", "===", "<>", "!", "not");

  /** Local calls that build values or are otherwise special forms rather than functions. */
  static final ImmutableSet<String> SPECIAL_FORMS =
      ImmutableSet.of("unquote", "from", "__block__", "__aliases__", "quote", "fn");

  /** Control-flow macros that take a {@code do} block. */
  static final ImmutableSet<String> BLOCK_MACROS =
      ImmutableSet.of("case", "cond", "if", "quote", "unless", "with", "for");

  /** Directive calls that may open a module body. */
  static final ImmutableSet<String> DIRECTIVE_CALLS =
      ImmutableSet.of("alias", "import", "require", "use");

  /** Module attributes that belong with the directives at the top of a module. */
  static final ImmutableSet<String> DIRECTIVE_ATTRIBUTES =
      ImmutableSet.of("moduledoc", "shortdoc", "behaviour");

  static final ImmutableSet<String> MODULE_DEFINITIONS =
      ImmutableSet.of("defmodule", "defprotocol", "defimpl");

  // Calls.

  public static Node getCallee(Node call) {
    checkArgument(call.isCall(), call);
    return call.getChildAtIndex(0);
  }

  /** Returns the arguments of {@code call}, without the callee and without {@code do} blocks. */
  public static ImmutableList<Node> getArgs(Node call) {
    checkArgument(call.isCall(), call);
    ImmutableList.Builder<Node> args = ImmutableList.builder();
    for (int i = 1; i < call.getChildCount(); i++) {
      Node child = call.getChildAtIndex(i);
      if (!child.isDoBlock()) {
        args.add(child);
      }
    }
    return args.build();
  }

  public static @Nullable Node getFirstArg(Node call) {
    ImmutableList<Node> args = getArgs(call);
    return args.isEmpty() ? null : args.get(0);
  }

  public static ImmutableList<Node> getDoBlocks(Node call) {
    checkArgument(call.isCall(), call);
    ImmutableList.Builder<Node> blocks = ImmutableList.builder();
    for (Node child : call.children()) {
      if (child.isDoBlock()) {
        blocks.add(child);
      }
    }
    return blocks.build();
  }

  public static boolean hasDoBlock(Node call) {
    return call.isCall() && !getDoBlocks(call).isEmpty();
  }

  /** Whether {@code call} takes a block, either as {@code do ... end} or as {@code do:}. */
  public static boolean takesBlock(Node call) {
    if (hasDoBlock(call)) {
      return true;
    }
    for (Node arg : getArgs(call)) {
      if (isKeywordList(arg) && arg.getChildAtIndex(0).getFirstChild().hasString("do")) {
        return true;
      }
    }
    return false;
  }

  /** Returns {@code call} with its arguments replaced, keeping the callee and any blocks. */
  public static Node withArgs(Node call, List<Node> args) {
    checkArgument(call.isCall(), call);
    List<Node> children = new ArrayList<>(args.size() + 2);
    children.add(getCallee(call));
    children.addAll(args);
    children.addAll(getDoBlocks(call));
    return call.withChildren(children);
  }

  /** Whether the call was written with parentheses. */
  public static boolean hasParens(Node call) {
    return call.isCall() && call.hasProp(Node.Prop.CLOSING_LINE);
  }

  /** Returns the module of a remote call on a module name, or null. */
  public static @Nullable String getRemoteModule(Node call) {
    if (!call.isCall()) {
      return null;
    }
    Node callee = getCallee(call);
    if (callee.isGetProp() && callee.getFirstChild().isAliases()) {
      return callee.getFirstChild().getString();
    }
    return null;
  }

  /** Returns the function name of a local or remote call, or null for other callees. */
  public static @Nullable String getFunctionName(Node call) {
    if (!call.isCall() || call.getBooleanProp(Node.Prop.ANON_INVOKE)) {
      return null;
    }
    Node callee = getCallee(call);
    if (callee.isName() || callee.isGetProp()) {
      return callee.getString();
    }
    return null;
  }

  /**
   * Returns {@code fun} for a local call and {@code Mod.fun} for a remote call on a module name.
   * Returns null for anything else.
   */
  public static @Nullable String getQualifiedCallName(Node call) {
    String fun = getFunctionName(call);
    if (fun == null) {
      return null;
    }
    String module = getRemoteModule(call);
    if (module != null) {
      return module + "." + fun;
    }
    return getCallee(call).isName() ? fun : null;
  }

  public static boolean isLocalCall(Node n) {
    return n.isCall() && getCallee(n).isName() && !n.getBooleanProp(Node.Prop.ANON_INVOKE);
  }

  public static boolean isRemoteCall(Node n, String module, String fun) {
    return module.equals(getRemoteModule(n)) && getCallee(n).hasString(fun);
  }

  public static boolean isRemoteCall(Node n, ImmutableSet<String> modules, String fun) {
    String module = getRemoteModule(n);
    return module != null && modules.contains(module) && getCallee(n).hasString(fun);
  }

  // Literals.

  /** Whether {@code n} is a keyword list, written with or without brackets. */
  public static boolean isKeywordList(Node n) {
    if (!n.isList() || !n.hasChildren()) {
      return false;
    }
    for (Node child : n.children()) {
      if (!child.isPair() || !child.getBooleanProp(Node.Prop.KEYWORD_FORMAT)) {
        return false;
      }
    }
    return true;
  }

  public static boolean isBooleanLiteral(Node n) {
    return n.isAtom() && (n.getString().equals("true") || n.getString().equals("false"));
  }

  /** Whether {@code n} is the empty map literal {@code %{}}. */
  public static boolean isEmptyMap(Node n) {
    return n.isMap() && !n.hasChildren();
  }

  public static boolean isEmptyList(Node n) {
    return n.isList() && !n.hasChildren();
  }

  public static boolean isZero(Node n) {
    return n.isNumber() && (n.getString().equals("0") || n.getString().equals("0.0"));
  }

  /** Whether {@code n} contains a capture argument such as {@code &1} anywhere. */
  public static boolean containsCaptureArg(Node n) {
    if (n.isCaptureArg()) {
      return true;
    }
    for (Node child : n.children()) {
      if (containsCaptureArg(child)) {
        return true;
      }
    }
    return false;
  }

  // Directives and definitions.

  /** Whether {@code n} is {@code defmodule}, {@code defprotocol} or {@code defimpl}. */
  public static boolean isModuleDefinition(Node n) {
    if (!isLocalCall(n)) {
      return false;
    }
    return MODULE_DEFINITIONS.contains(getCallee(n).getString());
  }

  public static boolean isDefmodule(Node n) {
    return n.isLocalCall("defmodule") && hasDoBlock(n);
  }

  /** Returns the statement block inside the first {@code do} section of {@code call}, or null. */
  public static @Nullable Node getDoBody(Node call) {
    for (Node block : getDoBlocks(call)) {
      if (block.hasString("do") && block.getFirstChild().isBlock()) {
        return block.getFirstChild();
      }
    }
    return null;
  }

  /**
   * Returns the directive kind of a statement: {@code alias}, {@code import}, {@code require},
   * {@code use}, {@code moduledoc}, {@code shortdoc} or {@code behaviour}. Returns null for
   * anything else.
   */
  public static @Nullable String getDirectiveKind(Node n) {
    if (isLocalCall(n) && DIRECTIVE_CALLS.contains(getCallee(n).getString())) {
      Node first = getFirstArg(n);
      return first != null && first.isAliases() ? getCallee(n).getString() : null;
    }
    if (n.isAttribute() && DIRECTIVE_ATTRIBUTES.contains(n.getString())) {
      return n.getString();
    }
    return null;
  }

  /** Returns the value of the {@code as:} option of an alias directive, or null. */
  public static @Nullable Node getAliasAs(Node directive) {
    ImmutableList<Node> args = getArgs(directive);
    if (args.size() < 2 || !args.get(1).isList()) {
      return null;
    }
    for (Node pair : args.get(1).children()) {
      if (pair.isPair() && pair.getFirstChild().isAtom() && pair.getFirstChild().hasString("as")) {
        return pair.getSecondChild();
      }
    }
    return null;
  }

  // Tree edits.

  /**
   * Returns {@code root} with the node {@code target}, found by identity, replaced by {@code
   * replacement}. Subtrees that do not contain {@code target} are shared.
   */
  public static Node replaceNode(Node root, Node target, Node replacement) {
    if (root == target) {
      return replacement;
    }
    Node result = root;
    for (int i = 0; i < root.getChildCount(); i++) {
      Node child = root.getChildAtIndex(i);
      Node newChild = replaceNode(child, target, replacement);
      if (newChild != child) {
        result = result.withChildAtIndex(i, newChild);
      }
    }
    return result;
  }

  /**
   * Returns {@code call} starting on {@code line}: the call and its callee move there, the
   * arguments keep their lines.
   */
  public static Node withCallStartLine(Node call, int line) {
    checkArgument(call.isCall(), call);
    if (call.getLineno() == line && getCallee(call).getLineno() == line) {
      return call;
    }
    return call.withChildAtIndex(0, getCallee(call).withAllLines(line)).withLineno(line);
  }

  /** Returns {@code n} with every known line below {@code minLine} raised to {@code minLine}. */
  public static Node raiseLines(Node n, int minLine) {
    if (n.getLineno() >= minLine && allLinesAtLeast(n, minLine)) {
      return n;
    }
    List<Node> children = new ArrayList<>(n.getChildCount());
    for (Node child : n.children()) {
      children.add(raiseLines(child, minLine));
    }
    Node result = n.withChildren(children);
    if (result.getLineno() != Node.NO_LINE && result.getLineno() < minLine) {
      result = result.withLineno(minLine);
    }
    for (Node.Prop prop : new Node.Prop[] {Node.Prop.CLOSING_LINE, Node.Prop.END_LINE}) {
      if (result.hasProp(prop) && result.getIntProp(prop) < minLine) {
        result = result.withProp(prop, minLine);
      }
    }
    return result;
  }

  private static boolean allLinesAtLeast(Node n, int minLine) {
    if (n.getLineno() != Node.NO_LINE && n.getLineno() < minLine) {
      return false;
    }
    if ((n.hasProp(Node.Prop.CLOSING_LINE) && n.getClosingLine() < minLine)
        || (n.hasProp(Node.Prop.END_LINE) && n.getEndLine() < minLine)) {
      return false;
    }
    for (Node child : n.children()) {
      if (!allLinesAtLeast(child, minLine)) {
        return false;
      }
    }
    return true;
  }

  /** Whether {@code name} reads as a predicate, {@code is_*} or {@code *?}. */
  public static boolean isPredicateName(String name) {
    return name.startsWith("is_") || name.endsWith("?");
  }

  /** Returns the number of lines {@code n} spans. */
  public static int lineSpan(Node n) {
    return n.getMaxLine() - n.getLineno() + 1;
  }

  static boolean isToken(@Nullable Node n, Token token) {
    return n != null && n.getToken() == token;
  }
}
