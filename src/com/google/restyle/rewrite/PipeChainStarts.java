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
import com.google.restyle.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * Decides whether an expression may stand at the head of a {@code |>} chain.
 *
 * <p>Anything that is not a call is a fine start. Calls are judged by name, by their first
 * argument and by whether they carry a {@code do} block, according to the chain options.
 */
final class PipeChainStarts {

  /** Remote calls that read better at the head of a chain than piped into. */
  private static final ImmutableSet<String> VALID_REMOTE_STARTS =
      ImmutableSet.of("Query.from", "Ecto.Query.from", "Access.get", "List.to_charlist");

  private final RewriteOptions options;

  PipeChainStarts(RewriteOptions options) {
    this.options = options;
  }

  boolean isValid(Node head) {
    if (!head.isCall()) {
      return true;
    }
    if (NodeUtil.isLocalCall(head)) {
      return isValidLocalCall(head);
    }
    String module = NodeUtil.getRemoteModule(head);
    if (module != null) {
      return isValidRemoteCall(head, module);
    }
    // Calls on variables, field access and anonymous invocations.
    return true;
  }

  private boolean isValidLocalCall(Node call) {
    String name = NodeUtil.getCallee(call).getString();
    if (NodeUtil.SPECIAL_FORMS.contains(name)) {
      return true;
    }
    if (NodeUtil.BLOCK_MACROS.contains(name)) {
      return !options.getBlockPipeFlag() || options.getBlockPipeExclude().contains(name);
    }
    if (NodeUtil.hasDoBlock(call)) {
      return isValidBlockCall(call, name);
    }
    if (NodeUtil.getArgs(call).isEmpty()) {
      return true;
    }
    return !options.getPipeChainStartFlag()
        || isFirstArgExcluded(call)
        || options.getPipeChainStartExcludedFunctions().contains(name)
        || name.startsWith("sigil_");
  }

  private boolean isValidRemoteCall(Node call, String module) {
    String qualifiedName = module + "." + NodeUtil.getFunctionName(call);
    if (VALID_REMOTE_STARTS.contains(qualifiedName)) {
      return true;
    }
    if (NodeUtil.hasDoBlock(call)) {
      return isValidBlockCall(call, qualifiedName);
    }
    if (NodeUtil.getArgs(call).isEmpty()) {
      return true;
    }
    return !options.getPipeChainStartFlag()
        || isFirstArgExcluded(call)
        || options.getPipeChainStartExcludedFunctions().contains(qualifiedName);
  }

  /** A custom macro taking a {@code do} block only moves when both chain flags are on. */
  private boolean isValidBlockCall(Node call, String name) {
    return !options.getPipeChainStartFlag()
        || !options.getBlockPipeFlag()
        || options.getBlockPipeExclude().contains(name)
        || options.getPipeChainStartExcludedFunctions().contains(name);
  }

  private boolean isFirstArgExcluded(Node call) {
    ImmutableSet<String> excludedTypes = options.getPipeChainStartExcludedArgumentTypes();
    if (excludedTypes.isEmpty()) {
      return false;
    }
    Node first = NodeUtil.getFirstArg(call);
    if (first == null) {
      return false;
    }
    for (String type : argumentTypes(first)) {
      if (excludedTypes.contains(type)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the shape classes of {@code arg} as named in the configuration. A keyword list is
   * both a {@code keyword} and a {@code list}; everything unclassified has no class.
   */
  static ImmutableList<String> argumentTypes(Node arg) {
    String type = argumentType(arg);
    if (type == null) {
      return ImmutableList.of();
    }
    return type.equals("keyword") ? ImmutableList.of("keyword", "list") : ImmutableList.of(type);
  }

  private static @Nullable String argumentType(Node arg) {
    switch (arg.getToken()) {
      case MAP:
      case STRUCT:
        return "map";
      case TUPLE:
        return "tuple";
      case SIGIL:
        return arg.hasString("r") || arg.hasString("R") ? "regex" : null;
      case CAPTURE:
      case FUNCTION:
        return "fn";
      case LIST:
        return NodeUtil.isKeywordList(arg) ? "keyword" : "list";
      case ATOM:
        return NodeUtil.isBooleanLiteral(arg) ? "boolean" : "atom";
      case STRING:
        return "binary";
      case NUMBER:
        return "number";
      case OPERATOR:
        return arg.hasString("<<>>") ? "bitstring" : null;
      default:
        return null;
    }
  }
}
