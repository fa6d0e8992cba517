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

/**
 * The closed set of node shapes produced by the parser.
 *
 * <p>The string payload of a {@link Node} is interpreted per token, see the comment on each
 * constant.
 */
public enum Token {
  /** The root of a file. Children are top-level expressions. */
  SCRIPT,
  /** A sequence of expressions, e.g. the body of a do block. */
  BLOCK,

  /** Variable reference. String: the variable name. */
  NAME,
  /** Atom literal such as {@code :ok}, {@code true} or {@code nil}. String: the atom text. */
  ATOM,
  /** String literal. String: the contents. */
  STRING,
  /** Number literal. String: the source token, e.g. {@code 10_000} or {@code 0x1F}. */
  NUMBER,
  /** Dotted module name such as {@code Foo.Bar}. String: the joined name. */
  ALIASES,

  /**
   * Function call. The first child is the callee ({@link #NAME} for local calls, {@link #GETPROP}
   * for remote calls); the remaining children are arguments, with any {@link #DO_BLOCK} last.
   */
  CALL,
  /** {@code receiver.name}. String: the name. Single child: the receiver. */
  GETPROP,
  /** {@code lhs |> rhs}. */
  PIPE,
  /** Unary or binary operator. String: the operator, e.g. {@code ==}, {@code ..}, {@code =}. */
  OPERATOR,

  LIST,
  TUPLE,
  /** {@code %{...}}. Children are {@link #PAIR}s, or a single {@code |} update operator. */
  MAP,
  /** {@code %Name{...}}. Children: the struct name and a {@link #MAP}. */
  STRUCT,
  /** A key/value entry. Keyword syntax ({@code a: 1}) is flagged with {@code KEYWORD_FORMAT}. */
  PAIR,

  /** {@code fn ... end}. Children are {@link #ARROW} clauses. */
  FUNCTION,
  /** A clause {@code params -> body}. Children: a {@link #PARAM_LIST} and the body. */
  ARROW,
  PARAM_LIST,
  /** {@code &expr}. */
  CAPTURE,
  /** {@code &1}. String: the argument index. */
  CAPTURE_ARG,

  /** {@code ~w(...)}. String: the sigil letter. Single child: the {@link #STRING} contents. */
  SIGIL,
  /** {@code @name value}. String: the attribute name. */
  ATTRIBUTE,
  /** A {@code do}, {@code else}, {@code rescue}, ... section. String: the keyword. */
  DO_BLOCK;
}
