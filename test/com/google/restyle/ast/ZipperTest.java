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

import static com.google.common.truth.Truth.assertThat;
import static com.google.restyle.testing.NodeSubject.assertNode;
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Zipper}. */
@RunWith(JUnit4.class)
public final class ZipperTest {

  // foo(a, b)
  // bar()
  private static final Node A = IR.name("a", 1);
  private static final Node B = IR.name("b", 1);
  private static final Node FOO = IR.call("foo", 1, A, B);
  private static final Node BAR = IR.call("bar", 2);
  private static final Node SCRIPT = IR.script(FOO, BAR);

  @Test
  public void testMovementPastTheEdgesReturnsNull() {
    Zipper root = Zipper.zip(SCRIPT);
    assertThat(root.up()).isNull();
    assertThat(root.left()).isNull();
    assertThat(root.right()).isNull();
    assertThat(root.isRoot()).isTrue();
    assertThat(root.childIndex()).isEqualTo(-1);

    Zipper foo = root.down();
    assertThat(foo.left()).isNull();
    assertThat(foo.right().right()).isNull();
    assertThat(foo.down().node().isName("foo")).isTrue();
    assertThat(foo.down().down()).isNull();
  }

  @Test
  public void testSiblingMovement() {
    Zipper callee = Zipper.zip(FOO).down();
    assertThat(callee.childIndex()).isEqualTo(0);
    assertThat(callee.right().node()).isSameInstanceAs(A);
    assertThat(callee.rightmost().node()).isSameInstanceAs(B);
    assertThat(callee.rightmost().leftmost().node()).isSameInstanceAs(callee.node());
    assertThat(callee.rightmost().up().node()).isSameInstanceAs(FOO);
  }

  @Test
  public void testNextVisitsInPreOrder() {
    List<Node> visited = new ArrayList<>();
    for (Zipper z = Zipper.zip(SCRIPT); z != null; z = z.next()) {
      visited.add(z.node());
    }
    assertThat(visited)
        .containsExactly(SCRIPT, FOO, FOO.getFirstChild(), A, B, BAR, BAR.getFirstChild())
        .inOrder();
  }

  @Test
  public void testPrevIsTheReverseOfNext() {
    Zipper last = Zipper.zip(SCRIPT);
    for (Zipper z = last; z != null; z = z.next()) {
      last = z;
    }
    List<Node> visited = new ArrayList<>();
    for (Zipper z = last; z != null; z = z.prev()) {
      visited.add(z.node());
    }
    assertThat(visited)
        .containsExactly(BAR.getFirstChild(), BAR, B, A, FOO.getFirstChild(), FOO, SCRIPT)
        .inOrder();
  }

  @Test
  public void testSkipLeavesTheSubtree() {
    Zipper foo = Zipper.zip(SCRIPT).down();
    assertThat(foo.skip().node()).isSameInstanceAs(BAR);
    assertThat(foo.right().skip()).isNull();
  }

  @Test
  public void testUntouchedTreeIsShared() {
    Zipper z = Zipper.zip(SCRIPT).down().down().right();
    assertThat(z.root()).isSameInstanceAs(SCRIPT);
  }

  @Test
  public void testReplaceRebuildsOnlyThePath() {
    Node c = IR.name("c", 1);
    Node root = Zipper.zip(SCRIPT).down().down().right().replace(c).root();

    assertNode(root).hasSource("foo(c, b)\nbar()");
    assertThat(root.getSecondChild()).isSameInstanceAs(BAR);
    assertThat(root.getFirstChild().getChildAtIndex(2)).isSameInstanceAs(B);
    // The original is untouched.
    assertNode(SCRIPT).hasSource("foo(a, b)\nbar()");
  }

  @Test
  public void testEditsSurviveSiblingMovement() {
    Zipper a = Zipper.zip(SCRIPT).down().down().right();
    Node root = a.replace(IR.name("x", 1)).right().replace(IR.name("y", 1)).root();
    assertNode(root).hasSource("foo(x, y)\nbar()");
  }

  @Test
  public void testUpdate() {
    Node root = Zipper.zip(SCRIPT).down().right().update(n -> n.withLineno(5)).root();
    assertThat(root.getSecondChild().getLineno()).isEqualTo(5);
  }

  @Test
  public void testInsertLeftKeepsTheFocus() {
    Zipper bar = Zipper.zip(SCRIPT).down().right();
    Zipper inserted = bar.insertLeft(IR.call("baz", 2));

    assertThat(inserted.node()).isSameInstanceAs(BAR);
    assertThat(inserted.childIndex()).isEqualTo(2);
    assertThat(inserted.left().node().isLocalCall("baz")).isTrue();
    assertNode(inserted.root()).hasSource("foo(a, b)\nbaz()\nbar()");
  }

  @Test
  public void testInsertRight() {
    Zipper foo = Zipper.zip(SCRIPT).down();
    Zipper inserted = foo.insertRight(IR.call("baz", 1));
    assertThat(inserted.node()).isSameInstanceAs(FOO);
    assertNode(inserted.root()).hasSource("foo(a, b)\nbaz()\nbar()");
  }

  @Test
  public void testInsertAndAppendChild() {
    Zipper root = Zipper.zip(SCRIPT);
    assertNode(root.insertChild(IR.call("first", 1)).root())
        .hasSource("first()\nfoo(a, b)\nbar()");
    assertNode(root.appendChild(IR.call("last", 3)).root())
        .hasSource("foo(a, b)\nbar()\nlast()");
  }

  @Test
  public void testInsertNextToTheRootFails() {
    Zipper root = Zipper.zip(SCRIPT);
    assertThrows(IllegalStateException.class, () -> root.insertLeft(IR.name("x", 1)));
    assertThrows(IllegalStateException.class, () -> root.remove());
  }

  @Test
  public void testRemoveMovesToTheLeftSibling() {
    Zipper b = Zipper.zip(SCRIPT).down().down().rightmost();
    Zipper removed = b.remove();
    assertThat(removed.node()).isSameInstanceAs(A);
    assertNode(removed.root()).hasSource("foo(a)\nbar()");
  }

  @Test
  public void testRemoveFirstChildMovesToTheParent() {
    Zipper foo = Zipper.zip(SCRIPT).down();
    Zipper removed = foo.remove();
    assertThat(removed.isRoot()).isTrue();
    assertNode(removed.node()).hasSource("bar()");
  }

  @Test
  public void testShiftLinesAfterLeavesTheFocusAlone() {
    // foo(a, b)      line 1
    // bar()          line 2
    // baz(c)         line 3
    Node script = IR.script(FOO, BAR, IR.call("baz", 3, IR.name("c", 3)));
    Zipper bar = Zipper.zip(script).down().right();

    Node root = bar.shiftLinesAfter(1, 10).root();

    assertThat(root.getChildAtIndex(0).getLineno()).isEqualTo(1);
    assertThat(root.getChildAtIndex(1).getLineno()).isEqualTo(2);
    assertThat(root.getChildAtIndex(2).getLineno()).isEqualTo(13);
    assertThat(root.getChildAtIndex(2).getFirstChild().getLineno()).isEqualTo(13);
  }

  @Test
  public void testShiftLinesAfterMovesAncestorEndLines() {
    Node module = IR.defmodule("Foo", 1, 4, IR.call("bar", 2), IR.call("baz", 3));
    Zipper bar = Zipper.zip(IR.script(module)).find(n -> n.isLocalCall("bar"));

    Node root = bar.shiftLinesAfter(2, 1).insertRight(IR.call("qux", 3)).root();

    Node newModule = root.getFirstChild();
    assertThat(newModule.getEndLine()).isEqualTo(5);
    assertNode(root).hasSource("defmodule Foo do\nbar()\nqux()\nbaz()\nend");
    assertThat(Zipper.zip(root).find(n -> n.isLocalCall("baz")).node().getLineno())
        .isEqualTo(4);
  }

  @Test
  public void testFind() {
    Zipper z = Zipper.zip(SCRIPT).find(n -> n.isName("b"));
    assertThat(z.node()).isSameInstanceAs(B);
    assertThat(Zipper.zip(SCRIPT).find(n -> n.isName("nope"))).isNull();
  }

  @Test
  public void testFindAncestor() {
    Zipper b = Zipper.zip(SCRIPT).find(n -> n.isName("b"));
    assertThat(b.findAncestor(Node::isCall).node()).isSameInstanceAs(FOO);
    assertThat(b.findAncestor(Node::isPipe)).isNull();
  }

  @Test
  public void testAnyOnlyLooksAtTheFocusSubtree() {
    Zipper foo = Zipper.zip(SCRIPT).down();
    assertThat(foo.any(n -> n.isName("a"))).isTrue();
    assertThat(foo.any(n -> n.isLocalCall("bar"))).isFalse();
  }

  @Test
  public void testTraverseRewritesEveryNode() {
    Node root =
        Zipper.zip(SCRIPT)
            .traverse(z -> z.node().isName("a") ? z.replace(IR.name("z", 1)) : z)
            .node();
    assertNode(root).hasSource("foo(z, b)\nbar()");
  }

  @Test
  public void testTraverseWhileSkip() {
    List<Node> visited = new ArrayList<>();
    Zipper.zip(SCRIPT)
        .traverseWhile(
            z -> {
              visited.add(z.node());
              return z.node() == FOO ? Zipper.Step.skip(z) : Zipper.Step.cont(z);
            });
    assertThat(visited).containsExactly(SCRIPT, FOO, BAR, BAR.getFirstChild()).inOrder();
  }

  @Test
  public void testTraverseWhileHaltKeepsEdits() {
    List<Node> visited = new ArrayList<>();
    Node root =
        Zipper.zip(SCRIPT)
            .traverseWhile(
                z -> {
                  visited.add(z.node());
                  if (z.node().isName("a")) {
                    return Zipper.Step.halt(z.replace(IR.name("z", 1)));
                  }
                  return Zipper.Step.cont(z);
                })
            .node();
    assertThat(visited).hasSize(4);
    assertNode(root).hasSource("foo(z, b)\nbar()");
  }

  @Test
  public void testTraverseWhileOnASubtreeKeepsThePosition() {
    Zipper foo = Zipper.zip(SCRIPT).down();
    Zipper result =
        foo.traverseWhile(
            z -> Zipper.Step.cont(z.node().isName("b") ? z.replace(IR.name("y", 1)) : z));
    assertThat(result.childIndex()).isEqualTo(0);
    assertNode(result.root()).hasSource("foo(a, y)\nbar()");
  }
}
