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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.errorprone.annotations.Immutable;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * An immutable syntax tree node.
 *
 * <p>Every node carries a {@link Token}, an optional string payload, a source line, a small map of
 * metadata properties and an ordered list of children. Nodes are never mutated: every {@code with*}
 * method returns a new node that shares all untouched children with the receiver, so a rewrite
 * only pays for the spine it actually changes.
 *
 * <p>Line numbers start at 1; {@link #NO_LINE} marks synthesized nodes that have no position of
 * their own. Line-shifting helpers leave {@link #NO_LINE} untouched.
 */
@Immutable
@SuppressWarnings("Immutable") // The property values are Integer, Boolean and String.
public final class Node {

  /** Line number of nodes that were not produced by the parser. */
  public static final int NO_LINE = 0;

  /** Metadata keys. */
  public enum Prop {
    /** Line of the closing delimiter. On a call, its presence means the call had parentheses. */
    CLOSING_LINE,
    /** Line of the {@code end} keyword of a do block. */
    END_LINE,
    /** Opening delimiter of strings and sigils. */
    DELIMITER,
    /** The pair was written in keyword syntax, {@code key: value}. */
    KEYWORD_FORMAT,
    /** A trailing keyword list written without brackets, {@code foo x, as: y}. */
    NO_PARENS,
    /** The call invokes an anonymous function, {@code fun.(x)}. */
    ANON_INVOKE,
    /** Trailing modifiers of a sigil. */
    SIGIL_MODIFIERS,
  }

  private final Token token;
  private final @Nullable String string;
  private final int lineno;
  private final ImmutableList<Node> children;
  private final ImmutableMap<Prop, Object> props;

  private Node(
      Token token,
      @Nullable String string,
      int lineno,
      ImmutableList<Node> children,
      ImmutableMap<Prop, Object> props) {
    this.token = checkNotNull(token);
    this.string = string;
    this.lineno = lineno;
    this.children = checkNotNull(children);
    this.props = checkNotNull(props);
  }

  public static Node newNode(Token token, int lineno, Node... children) {
    return new Node(token, null, lineno, ImmutableList.copyOf(children), ImmutableMap.of());
  }

  public static Node newNode(Token token, int lineno, List<Node> children) {
    return new Node(token, null, lineno, ImmutableList.copyOf(children), ImmutableMap.of());
  }

  public static Node newString(Token token, String str, int lineno, Node... children) {
    return new Node(
        token, checkNotNull(str), lineno, ImmutableList.copyOf(children), ImmutableMap.of());
  }

  public static Node newString(Token token, String str, int lineno, List<Node> children) {
    return new Node(
        token, checkNotNull(str), lineno, ImmutableList.copyOf(children), ImmutableMap.of());
  }

  public Token getToken() {
    return token;
  }

  /** Returns the string payload. Only valid for tokens that carry one. */
  public String getString() {
    checkState(string != null, "%s has no string payload", token);
    return string;
  }

  public @Nullable String getStringOrNull() {
    return string;
  }

  public boolean hasString(String s) {
    return s.equals(string);
  }

  public int getLineno() {
    return lineno;
  }

  public ImmutableList<Node> children() {
    return children;
  }

  public int getChildCount() {
    return children.size();
  }

  public boolean hasChildren() {
    return !children.isEmpty();
  }

  public boolean hasOneChild() {
    return children.size() == 1;
  }

  public Node getChildAtIndex(int i) {
    return children.get(i);
  }

  public @Nullable Node getFirstChild() {
    return children.isEmpty() ? null : children.get(0);
  }

  public @Nullable Node getSecondChild() {
    return children.size() < 2 ? null : children.get(1);
  }

  public @Nullable Node getLastChild() {
    return children.isEmpty() ? null : children.get(children.size() - 1);
  }

  public boolean hasProp(Prop prop) {
    return props.containsKey(prop);
  }

  public @Nullable Object getProp(Prop prop) {
    return props.get(prop);
  }

  public int getIntProp(Prop prop) {
    Object value = props.get(prop);
    return value == null ? NO_LINE : (Integer) value;
  }

  public boolean getBooleanProp(Prop prop) {
    return Boolean.TRUE.equals(props.get(prop));
  }

  public ImmutableMap<Prop, Object> getProps() {
    return props;
  }

  /** Returns the line of the closing delimiter, or {@link #NO_LINE}. */
  public int getClosingLine() {
    return getIntProp(Prop.CLOSING_LINE);
  }

  /** Returns the line of the {@code end} keyword, or {@link #NO_LINE}. */
  public int getEndLine() {
    return getIntProp(Prop.END_LINE);
  }

  // Shape predicates.

  public boolean isScript() {
    return token == Token.SCRIPT;
  }

  public boolean isBlock() {
    return token == Token.BLOCK;
  }

  public boolean isName() {
    return token == Token.NAME;
  }

  public boolean isName(String name) {
    return token == Token.NAME && name.equals(string);
  }

  public boolean isAtom() {
    return token == Token.ATOM;
  }

  public boolean isStringLit() {
    return token == Token.STRING;
  }

  public boolean isNumber() {
    return token == Token.NUMBER;
  }

  public boolean isAliases() {
    return token == Token.ALIASES;
  }

  public boolean isCall() {
    return token == Token.CALL;
  }

  public boolean isGetProp() {
    return token == Token.GETPROP;
  }

  public boolean isPipe() {
    return token == Token.PIPE;
  }

  public boolean isOperator() {
    return token == Token.OPERATOR;
  }

  public boolean isOperator(String op) {
    return token == Token.OPERATOR && op.equals(string);
  }

  public boolean isList() {
    return token == Token.LIST;
  }

  public boolean isTuple() {
    return token == Token.TUPLE;
  }

  public boolean isMap() {
    return token == Token.MAP;
  }

  public boolean isStruct() {
    return token == Token.STRUCT;
  }

  public boolean isPair() {
    return token == Token.PAIR;
  }

  public boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public boolean isArrow() {
    return token == Token.ARROW;
  }

  public boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public boolean isCapture() {
    return token == Token.CAPTURE;
  }

  public boolean isCaptureArg() {
    return token == Token.CAPTURE_ARG;
  }

  public boolean isSigil() {
    return token == Token.SIGIL;
  }

  public boolean isAttribute() {
    return token == Token.ATTRIBUTE;
  }

  public boolean isDoBlock() {
    return token == Token.DO_BLOCK;
  }

  /** Whether this is a call whose callee is the local name {@code name}. */
  public boolean isLocalCall(String name) {
    return token == Token.CALL && !children.isEmpty() && children.get(0).isName(name);
  }

  /**
   * Returns the value of a {@link Token#NUMBER} node, or null when its text is not a literal this
   * class can read. Character literals such as {@code ?a} evaluate to their code point.
   */
  public @Nullable BigDecimal getNumericValue() {
    checkState(isNumber(), this);
    String text = string.replace("_", "");
    if (text.startsWith("?")) {
      return charLiteralValue(text.substring(1));
    }
    String lower = Ascii.toLowerCase(text);
    try {
      if (lower.startsWith("0x")) {
        return new BigDecimal(new BigInteger(text.substring(2), 16));
      } else if (lower.startsWith("0b")) {
        return new BigDecimal(new BigInteger(text.substring(2), 2));
      } else if (lower.startsWith("0o")) {
        return new BigDecimal(new BigInteger(text.substring(2), 8));
      }
      return new BigDecimal(text);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static @Nullable BigDecimal charLiteralValue(String body) {
    if (body.isEmpty()) {
      return null;
    }
    if (body.charAt(0) == '\\' && body.length() == 2) {
      Character escaped = CHAR_ESCAPES.get(body.charAt(1));
      return BigDecimal.valueOf(escaped != null ? escaped : body.charAt(1));
    }
    if (body.codePointCount(0, body.length()) != 1) {
      return null;
    }
    return BigDecimal.valueOf(body.codePointAt(0));
  }

  private static final ImmutableMap<Character, Character> CHAR_ESCAPES =
      ImmutableMap.<Character, Character>builder()
          .put('0', '\0')
          .put('a', '\u0007')
          .put('b', '\b')
          .put('d', '\u007f')
          .put('e', '\u001b')
          .put('f', '\f')
          .put('n', '\n')
          .put('r', '\r')
          .put('s', ' ')
          .put('t', '\t')
          .put('v', '\u000b')
          .buildOrThrow();

  // Copy-on-write editing.

  public Node withChildren(List<Node> newChildren) {
    return new Node(token, string, lineno, ImmutableList.copyOf(newChildren), props);
  }

  public Node withChildren(Node... newChildren) {
    return withChildren(ImmutableList.copyOf(newChildren));
  }

  public Node withChildAtIndex(int i, Node child) {
    checkArgument(i >= 0 && i < children.size(), "index %s out of %s", i, children.size());
    if (children.get(i) == child) {
      return this;
    }
    ImmutableList.Builder<Node> builder = ImmutableList.builderWithExpectedSize(children.size());
    for (int j = 0; j < children.size(); j++) {
      builder.add(j == i ? child : children.get(j));
    }
    return new Node(token, string, lineno, builder.build(), props);
  }

  public Node withString(String newString) {
    return new Node(token, checkNotNull(newString), lineno, children, props);
  }

  public Node withToken(Token newToken) {
    return new Node(newToken, string, lineno, children, props);
  }

  public Node withLineno(int newLineno) {
    return newLineno == lineno ? this : new Node(token, string, newLineno, children, props);
  }

  public Node withProp(Prop prop, Object value) {
    EnumMap<Prop, Object> copy = new EnumMap<>(Prop.class);
    copy.putAll(props);
    copy.put(prop, checkNotNull(value));
    return new Node(token, string, lineno, children, Maps.immutableEnumMap(copy));
  }

  public Node withoutProp(Prop prop) {
    if (!props.containsKey(prop)) {
      return this;
    }
    EnumMap<Prop, Object> copy = new EnumMap<>(Prop.class);
    copy.putAll(props);
    copy.remove(prop);
    return new Node(token, string, lineno, children, Maps.immutableEnumMap(copy));
  }

  /** Returns a copy carrying the same metadata as {@code other} (line and properties). */
  public Node withMetadataFrom(Node other) {
    return new Node(token, string, other.lineno, children, other.props);
  }

  // Line bookkeeping.

  /** Returns the largest line recorded anywhere in this subtree. */
  public int getMaxLine() {
    int max = Math.max(lineno, Math.max(getClosingLine(), getEndLine()));
    for (Node child : children) {
      max = Math.max(max, child.getMaxLine());
    }
    return max;
  }

  /** Returns a copy of this subtree with every known line moved by {@code delta}. */
  public Node shiftLines(int delta) {
    return delta == 0 ? this : shiftLinesAfter(Integer.MIN_VALUE, delta);
  }

  /**
   * Returns a copy of this subtree in which every known line strictly greater than {@code line}
   * is moved by {@code delta}. Unchanged subtrees are shared.
   */
  public Node shiftLinesAfter(int line, int delta) {
    if (delta == 0 || getMaxLine() <= line) {
      return this;
    }
    ImmutableList.Builder<Node> newChildren =
        ImmutableList.builderWithExpectedSize(children.size());
    for (Node child : children) {
      newChildren.add(child.shiftLinesAfter(line, delta));
    }
    return new Node(
        token,
        string,
        shift(lineno, line, delta),
        newChildren.build(),
        shiftLineProps(props, line, delta));
  }

  /** Returns a copy of this subtree with every known line set to {@code newLine}. */
  public Node withAllLines(int newLine) {
    ImmutableList.Builder<Node> newChildren =
        ImmutableList.builderWithExpectedSize(children.size());
    for (Node child : children) {
      newChildren.add(child.withAllLines(newLine));
    }
    EnumMap<Prop, Object> copy = new EnumMap<>(Prop.class);
    copy.putAll(props);
    for (Prop p : new Prop[] {Prop.CLOSING_LINE, Prop.END_LINE}) {
      if (copy.containsKey(p)) {
        copy.put(p, newLine);
      }
    }
    return new Node(token, string, newLine, newChildren.build(), Maps.immutableEnumMap(copy));
  }

  private static int shift(int value, int after, int delta) {
    return value != NO_LINE && value > after ? value + delta : value;
  }

  private static ImmutableMap<Prop, Object> shiftLineProps(
      ImmutableMap<Prop, Object> props, int after, int delta) {
    if (!props.containsKey(Prop.CLOSING_LINE) && !props.containsKey(Prop.END_LINE)) {
      return props;
    }
    EnumMap<Prop, Object> copy = new EnumMap<>(Prop.class);
    copy.putAll(props);
    for (Prop p : new Prop[] {Prop.CLOSING_LINE, Prop.END_LINE}) {
      Object value = copy.get(p);
      if (value != null) {
        copy.put(p, shift((Integer) value, after, delta));
      }
    }
    return Maps.immutableEnumMap(copy);
  }

  /** Shifts only this node's own line metadata, leaving the children alone. */
  Node shiftOwnLinesAfter(int line, int delta) {
    int newLineno = shift(lineno, line, delta);
    ImmutableMap<Prop, Object> newProps = shiftLineProps(props, line, delta);
    if (newLineno == lineno && newProps.equals(props)) {
      return this;
    }
    return new Node(token, string, newLineno, children, newProps);
  }

  // Comparison.

  /**
   * Returns whether the two trees have the same shape, payloads and non-positional metadata.
   * Line numbers are ignored.
   */
  public boolean isEquivalentTo(Node other) {
    return isEquivalentTo(other, false);
  }

  /** Like {@link #isEquivalentTo(Node)}, optionally also comparing every line. */
  public boolean isEquivalentTo(Node other, boolean compareLines) {
    if (token != other.token
        || !Objects.equals(string, other.string)
        || children.size() != other.children.size()) {
      return false;
    }
    for (Map.Entry<Prop, Object> entry : props.entrySet()) {
      Prop p = entry.getKey();
      if (p == Prop.CLOSING_LINE || p == Prop.END_LINE) {
        continue;
      }
      if (!entry.getValue().equals(other.props.get(p))) {
        return false;
      }
    }
    for (Prop p : other.props.keySet()) {
      if (p != Prop.CLOSING_LINE && p != Prop.END_LINE && !props.containsKey(p)) {
        return false;
      }
    }
    if (compareLines
        && (lineno != other.lineno
            || getClosingLine() != other.getClosingLine()
            || getEndLine() != other.getEndLine())) {
      return false;
    }
    for (int i = 0; i < children.size(); i++) {
      if (!children.get(i).isEquivalentTo(other.children.get(i), compareLines)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (string != null) {
      sb.append(' ').append(string);
    }
    if (lineno != NO_LINE) {
      sb.append(" @").append(lineno);
    }
    for (Map.Entry<Prop, Object> entry : props.entrySet()) {
      sb.append(" [")
          .append(Ascii.toLowerCase(entry.getKey().name()))
          .append(": ")
          .append(entry.getValue())
          .append(']');
    }
    return sb.toString();
  }

  /** Returns an indented, multi-line dump of this subtree. */
  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendStringTree(sb, 0);
    return sb.toString();
  }

  private void appendStringTree(StringBuilder sb, int level) {
    for (int i = 0; i < level; i++) {
      sb.append("    ");
    }
    sb.append(this).append('\n');
    for (Node child : children) {
      child.appendStringTree(sb, level + 1);
    }
  }
}
