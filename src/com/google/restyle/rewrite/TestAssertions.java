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
import com.google.restyle.ast.Node;
import com.google.restyle.ast.Zipper;
import java.util.ArrayList;
import java.util.List;

/** Turns negated assertions in test code into their positive counterparts. */
final class TestAssertions implements Style {

  @Override
  public StyleResult run(Zipper zipper, StyleContext context) {
    Node n = zipper.node();
    if (n.isLocalCall("assert")) {
      return StyleResult.cont(zipper.replace(invert(n, "refute")), context);
    } else if (n.isLocalCall("refute")) {
      return StyleResult.cont(zipper.replace(invert(n, "assert")), context);
    }
    return StyleResult.cont(zipper, context);
  }

  /**
   * {@code assert not x} becomes {@code refute x} and {@code assert !x} becomes {@code refute x};
   * any failure message is kept.
   */
  private static Node invert(Node call, String inverse) {
    ImmutableList<Node> args = NodeUtil.getArgs(call);
    if (args.isEmpty() || NodeUtil.hasDoBlock(call) || !isNegation(args.get(0))) {
      return call;
    }
    List<Node> newArgs = new ArrayList<>(args);
    newArgs.set(0, args.get(0).getFirstChild());
    Node callee = NodeUtil.getCallee(call);
    return NodeUtil.withArgs(call, newArgs).withChildAtIndex(0, callee.withString(inverse));
  }

  private static boolean isNegation(Node n) {
    return (n.isOperator("not") || n.isOperator("!")) && n.hasOneChild();
  }
}
