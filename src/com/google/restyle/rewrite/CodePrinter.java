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
import com.google.common.collect.ImmutableMap;
import com.google.restyle.ast.Node;
import java.util.List;

/**
 * Renders a subtree as compact single-line source text. The output is what the sort styles
 * compare, so it only has to be deterministic and close to how the code reads; layout is left to
 * the real printer.
 */
public final class CodePrinter {

  private static final ImmutableMap<String, String> CLOSING_DELIMITERS =
      ImmutableMap.<String, String>builder()
          .put("(", ")")
          .put("[", "]")
          .put("{", "}")
          .put("<", ">")
          .put("\"", "\"")
          .put("'", "'")
          .put("/", "/")
          .put("|", "|")
          .buildOrThrow();

  private final StringBuilder code = new StringBuilder();

  private CodePrinter() {}

  public static String toSource(Node n) {
    CodePrinter printer = new CodePrinter();
    printer.add(n);
    return printer.code.toString();
  }

  private void add(Node n) {
    switch (n.getToken()) {
      case SCRIPT:
      case BLOCK:
        addList(n.children(), "\n");
        break;
      case NAME:
      case NUMBER:
      case ALIASES:
        code.append(n.getString());
        break;
      case ATOM:
        if (isLiteralAtom(n.getString())) {
          code.append(n.getString());
        } else {
          code.append(':').append(n.getString());
        }
        break;
      case STRING:
        code.append('"').append(n.getString().replace("\"", "\\\"")).append('"');
        break;
      case CALL:
        addCall(n);
        break;
      case GETPROP:
        add(n.getFirstChild());
        code.append('.').append(n.getString());
        break;
      case PIPE:
        add(n.getFirstChild());
        code.append(" |> ");
        add(n.getSecondChild());
        break;
      case OPERATOR:
        addOperator(n);
        break;
      case LIST:
        if (n.getBooleanProp(Node.Prop.NO_PARENS)) {
          addList(n.children(), ", ");
        } else {
          code.append('[');
          addList(n.children(), ", ");
          code.append(']');
        }
        break;
      case TUPLE:
        code.append('{');
        addList(n.children(), ", ");
        code.append('}');
        break;
      case MAP:
        code.append("%{");
        addList(n.children(), ", ");
        code.append('}');
        break;
      case STRUCT:
        code.append('%');
        add(n.getFirstChild());
        code.append('{');
        addList(n.getSecondChild().children(), ", ");
        code.append('}');
        break;
      case PAIR:
        if (n.getBooleanProp(Node.Prop.KEYWORD_FORMAT)) {
          code.append(n.getFirstChild().getString()).append(": ");
        } else {
          add(n.getFirstChild());
          code.append(" => ");
        }
        add(n.getSecondChild());
        break;
      case FUNCTION:
        code.append("fn ");
        addList(n.children(), "; ");
        code.append(" end");
        break;
      case ARROW:
        add(n.getFirstChild());
        code.append(" -> ");
        add(n.getSecondChild());
        break;
      case PARAM_LIST:
        addList(n.children(), ", ");
        break;
      case CAPTURE:
        code.append('&');
        add(n.getFirstChild());
        break;
      case CAPTURE_ARG:
        code.append('&').append(n.getString());
        break;
      case SIGIL:
        addSigil(n);
        break;
      case ATTRIBUTE:
        code.append('@').append(n.getString());
        if (n.hasChildren()) {
          code.append(' ');
          add(n.getFirstChild());
        }
        break;
      case DO_BLOCK:
        code.append(n.getString()).append('\n');
        add(n.getFirstChild());
        code.append('\n');
        break;
    }
  }

  private void addCall(Node call) {
    Node callee = NodeUtil.getCallee(call);
    add(callee);
    ImmutableList<Node> args = NodeUtil.getArgs(call);
    if (call.getBooleanProp(Node.Prop.ANON_INVOKE)) {
      code.append('.');
    }
    if (NodeUtil.hasParens(call) || call.getBooleanProp(Node.Prop.ANON_INVOKE)) {
      code.append('(');
      addList(args, ", ");
      code.append(')');
    } else if (!args.isEmpty()) {
      code.append(' ');
      addList(args, ", ");
    }
    for (Node block : NodeUtil.getDoBlocks(call)) {
      code.append(block.hasString("do") ? " " : "");
      add(block);
    }
    if (NodeUtil.hasDoBlock(call)) {
      code.append("end");
    }
  }

  private void addOperator(Node n) {
    String op = n.getString();
    if (op.equals("<<>>")) {
      code.append("<<");
      addList(n.children(), ", ");
      code.append(">>");
      return;
    }
    if (n.hasOneChild()) {
      code.append(op);
      if (Character.isLetter(op.charAt(0))) {
        code.append(' ');
      }
      add(n.getFirstChild());
      return;
    }
    add(n.getFirstChild());
    if (op.equals("..") || op.equals("//")) {
      code.append(op);
    } else if (op.equals("/") && n.getSecondChild().isNumber()) {
      code.append(op);
    } else if (op.equals("|")) {
      code.append(" | ");
    } else {
      code.append(' ').append(op).append(' ');
    }
    add(n.getSecondChild());
  }

  private void addSigil(Node n) {
    String open = (String) n.getProp(Node.Prop.DELIMITER);
    if (open == null) {
      open = "(";
    }
    String close = CLOSING_DELIMITERS.getOrDefault(open, open);
    Object modifiers = n.getProp(Node.Prop.SIGIL_MODIFIERS);
    code.append('~')
        .append(n.getString())
        .append(open)
        .append(n.getFirstChild().getString())
        .append(close)
        .append(modifiers == null ? "" : modifiers);
  }

  private void addList(List<Node> nodes, String separator) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        code.append(separator);
      }
      add(nodes.get(i));
    }
  }

  private static boolean isLiteralAtom(String text) {
    return text.equals("true") || text.equals("false") || text.equals("nil");
  }
}
