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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.List;

/** An AST construction helper class. */
public class IR {

  private IR() {}

  public static Node script(Node... exprs) {
    return Node.newNode(Token.SCRIPT, 1, exprs);
  }

  public static Node script(List<Node> exprs) {
    return Node.newNode(Token.SCRIPT, 1, exprs);
  }

  public static Node block(int line, Node... exprs) {
    return Node.newNode(Token.BLOCK, line, exprs);
  }

  public static Node block(int line, List<Node> exprs) {
    return Node.newNode(Token.BLOCK, line, exprs);
  }

  public static Node name(String name, int line) {
    checkArgument(!name.isEmpty());
    return Node.newString(Token.NAME, name, line);
  }

  /** An atom; {@code text} excludes the leading colon. */
  public static Node atom(String text, int line) {
    return Node.newString(Token.ATOM, text, line);
  }

  public static Node string(String value, int line) {
    return Node.newString(Token.STRING, value, line).withProp(Node.Prop.DELIMITER, "\"");
  }

  public static Node number(String token, int line) {
    return Node.newString(Token.NUMBER, token, line);
  }

  public static Node number(long value, int line) {
    return number(Long.toString(value), line);
  }

  public static Node aliases(String dottedName, int line) {
    QualifiedName.of(dottedName);
    return Node.newString(Token.ALIASES, dottedName, line);
  }

  /** A local call written with parentheses, {@code fun(args)}. */
  public static Node call(String fun, int line, Node... args) {
    return callWithCallee(name(fun, line), line, ImmutableList.copyOf(args))
        .withProp(Node.Prop.CLOSING_LINE, line);
  }

  public static Node call(String fun, int line, List<Node> args) {
    return callWithCallee(name(fun, line), line, args).withProp(Node.Prop.CLOSING_LINE, line);
  }

  /** A local call written without parentheses, {@code assert x} or {@code field :a, :b}. */
  public static Node callNoParens(String fun, int line, Node... args) {
    return callWithCallee(name(fun, line), line, ImmutableList.copyOf(args));
  }

  /** A remote call {@code receiver.fun(args)}. */
  public static Node remoteCall(Node receiver, String fun, int line, Node... args) {
    return callWithCallee(getprop(receiver, fun, line), line, ImmutableList.copyOf(args))
        .withProp(Node.Prop.CLOSING_LINE, line);
  }

  public static Node remoteCall(Node receiver, String fun, int line, List<Node> args) {
    return callWithCallee(getprop(receiver, fun, line), line, args)
        .withProp(Node.Prop.CLOSING_LINE, line);
  }

  /** A remote call on a module, {@code Mod.fun(args)}. */
  public static Node remoteCall(String module, String fun, int line, Node... args) {
    return remoteCall(aliases(module, line), fun, line, args);
  }

  /** An anonymous function invocation, {@code fun.(args)}. */
  public static Node anonCall(Node fun, int line, Node... args) {
    return callWithCallee(fun, line, ImmutableList.copyOf(args))
        .withProp(Node.Prop.ANON_INVOKE, true)
        .withProp(Node.Prop.CLOSING_LINE, line);
  }

  public static Node callWithCallee(Node callee, int line, List<Node> args) {
    checkArgument(!callee.isDoBlock());
    List<Node> children = Lists.newArrayListWithCapacity(args.size() + 1);
    children.add(callee);
    children.addAll(args);
    return Node.newNode(Token.CALL, line, children);
  }

  /** Field access without parentheses, {@code user.name}. */
  public static Node getprop(Node receiver, String name, int line) {
    return Node.newString(Token.GETPROP, name, line, receiver);
  }

  /** {@code lhs |> rhs}; the operator sits on the line of its right-hand side. */
  public static Node pipe(Node lhs, Node rhs) {
    return Node.newNode(Token.PIPE, rhs.getLineno(), lhs, rhs);
  }

  public static Node op(String operator, int line, Node... operands) {
    checkArgument(operands.length == 1 || operands.length == 2, operator);
    return Node.newString(Token.OPERATOR, operator, line, operands);
  }

  /** {@code lhs = rhs}. */
  public static Node assign(Node lhs, Node rhs) {
    return op("=", lhs.getLineno(), lhs, rhs);
  }

  /** {@code lo..hi}. */
  public static Node range(Node lo, Node hi) {
    return op("..", lo.getLineno(), lo, hi);
  }

  public static Node list(int line, Node... elements) {
    return Node.newNode(Token.LIST, line, elements).withProp(Node.Prop.CLOSING_LINE, line);
  }

  public static Node list(int line, List<Node> elements) {
    return Node.newNode(Token.LIST, line, elements).withProp(Node.Prop.CLOSING_LINE, line);
  }

  public static Node tuple(int line, Node... elements) {
    return Node.newNode(Token.TUPLE, line, elements).withProp(Node.Prop.CLOSING_LINE, line);
  }

  public static Node map(int line, Node... pairs) {
    for (Node pair : pairs) {
      checkArgument(pair.isPair() || pair.isOperator("|"), pair);
    }
    return Node.newNode(Token.MAP, line, pairs).withProp(Node.Prop.CLOSING_LINE, line);
  }

  public static Node map(int line, List<Node> pairs) {
    return map(line, pairs.toArray(new Node[0]));
  }

  public static Node struct(Node name, Node map) {
    checkArgument(map.isMap());
    return Node.newNode(Token.STRUCT, name.getLineno(), name, map);
  }

  /** {@code key => value}. */
  public static Node pair(Node key, Node value) {
    return Node.newNode(Token.PAIR, key.getLineno(), key, value);
  }

  /** {@code key: value}. */
  public static Node keywordPair(String key, Node value) {
    return pair(atom(key, value.getLineno()), value).withProp(Node.Prop.KEYWORD_FORMAT, true);
  }

  public static Node function(int line, Node... arrows) {
    for (Node arrow : arrows) {
      checkArgument(arrow.isArrow(), arrow);
    }
    return Node.newNode(Token.FUNCTION, line, arrows);
  }

  /** A single-clause {@code fn params -> body end}. */
  public static Node function(int line, List<Node> params, Node body) {
    return function(line, arrow(paramList(line, params), body));
  }

  public static Node arrow(Node params, Node body) {
    checkArgument(params.isParamList());
    return Node.newNode(Token.ARROW, params.getLineno(), params, body);
  }

  public static Node paramList(int line, Node... params) {
    return Node.newNode(Token.PARAM_LIST, line, params);
  }

  public static Node paramList(int line, List<Node> params) {
    return Node.newNode(Token.PARAM_LIST, line, params);
  }

  public static Node capture(Node expr) {
    return Node.newNode(Token.CAPTURE, expr.getLineno(), expr);
  }

  public static Node captureArg(int index, int line) {
    checkArgument(index > 0);
    return Node.newString(Token.CAPTURE_ARG, Integer.toString(index), line);
  }

  /** {@code &fun/arity}. */
  public static Node captureRef(Node fun, int arity) {
    return capture(op("/", fun.getLineno(), fun, number(arity, fun.getLineno())));
  }

  public static Node sigil(String letter, String contents, int line) {
    return Node.newString(Token.SIGIL, letter, line, Node.newString(Token.STRING, contents, line))
        .withProp(Node.Prop.DELIMITER, "(")
        .withProp(Node.Prop.SIGIL_MODIFIERS, "");
  }

  public static Node attribute(String name, Node value) {
    return Node.newString(Token.ATTRIBUTE, name, value.getLineno(), value);
  }

  public static Node doBlock(String keyword, Node body) {
    checkArgument(body.isBlock() || body.isArrow(), body);
    return Node.newString(Token.DO_BLOCK, keyword, body.getLineno(), body);
  }

  /**
   * Attaches a {@code do ... end} section holding {@code body} to {@code call}; the {@code end}
   * keyword sits on {@code endLine}.
   */
  public static Node withDo(Node call, Node body, int endLine) {
    checkState(call.isCall(), call);
    checkArgument(body.isBlock(), body);
    List<Node> children = Lists.newArrayList(call.children());
    children.add(Node.newString(Token.DO_BLOCK, "do", call.getLineno(), body));
    return call.withChildren(children).withProp(Node.Prop.END_LINE, endLine);
  }

  /** {@code defmodule Name do body end}. */
  public static Node defmodule(String name, int line, int endLine, Node... body) {
    return withDo(
        callNoParens("defmodule", line, aliases(name, line)),
        block(line + 1, body),
        endLine);
  }

  /** A directive such as {@code alias Foo.Bar}. */
  public static Node directive(String kind, String module, int line, Node... options) {
    List<Node> args = Lists.newArrayList(aliases(module, line));
    if (options.length > 0) {
      args.add(
          Node.newNode(Token.LIST, line, options).withProp(Node.Prop.NO_PARENS, true));
    }
    return callWithCallee(name(kind, line), line, args);
  }
}
