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

import static com.google.common.truth.Truth.assertThat;
import static com.google.restyle.testing.NodeSubject.assertNode;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.restyle.ast.Comment;
import com.google.restyle.ast.IR;
import com.google.restyle.ast.Node;
import com.google.restyle.ast.Zipper;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link StylePipeline}. */
@RunWith(JUnit4.class)
public final class StylePipelineTest {

  private static final Node SCRIPT =
      IR.script(IR.call("foo", 1, IR.name("a", 1)), IR.call("bar", 2));

  /** Renames every {@code from} name to {@code to}. */
  private static final class Rename implements Style {
    private final String from;
    private final String to;
    final List<String> visited = new ArrayList<>();

    Rename(String from, String to) {
      this.from = from;
      this.to = to;
    }

    @Override
    public StyleResult run(Zipper zipper, StyleContext context) {
      Node n = zipper.node();
      boolean named = n.hasString(from) || n.hasString(to);
      visited.add(n.getToken() + (named ? " " + n.getString() : ""));
      if (n.isName(from)) {
        return StyleResult.cont(zipper.replace(n.withString(to)), context);
      }
      return StyleResult.cont(zipper, context);
    }
  }

  @Test
  public void testStylesRunInOrderOverTheWholeTree() {
    Rename first = new Rename("a", "b");
    Rename second = new Rename("b", "c");

    RewriteResult result =
        StylePipeline.run(
            SCRIPT,
            ImmutableList.of(),
            RewriteOptions.defaults(),
            ImmutableList.of(first, second));

    assertNode(result.getRoot()).hasSource("foo(c)\nbar()");
    assertThat(first.visited).contains("NAME a");
    assertThat(second.visited).contains("NAME b");
  }

  @Test
  public void testNoStylesReturnsTheInput() {
    ImmutableList<Comment> comments = ImmutableList.of(Comment.create(1, "# hi"));
    RewriteResult result =
        StylePipeline.run(SCRIPT, comments, RewriteOptions.defaults(), ImmutableList.of());
    assertThat(result.getRoot()).isSameInstanceAs(SCRIPT);
    assertThat(result.getComments()).isEqualTo(comments);
  }

  @Test
  public void testTheSameStyleInstanceRunsOnce() {
    Rename rename = new Rename("a", "b");
    StylePipeline.run(
        SCRIPT, ImmutableList.of(), RewriteOptions.defaults(), ImmutableList.of(rename, rename));
    assertThat(rename.visited).hasSize(6);
  }

  @Test
  public void testSkipAndHalt() {
    List<Node> visited = new ArrayList<>();
    Style style =
        (zipper, context) -> {
          visited.add(zipper.node());
          if (zipper.node().isLocalCall("foo")) {
            return StyleResult.skip(zipper, context);
          }
          if (zipper.node().isLocalCall("bar")) {
            return StyleResult.halt(zipper, context);
          }
          return StyleResult.cont(zipper, context);
        };

    StylePipeline.run(
        SCRIPT, ImmutableList.of(), RewriteOptions.defaults(), ImmutableList.of(style));

    assertThat(visited)
        .containsExactly(SCRIPT, SCRIPT.getFirstChild(), SCRIPT.getSecondChild())
        .inOrder();
  }

  @Test
  public void testContextIsThreadedBetweenNodesAndStyles() {
    Style addComment =
        (zipper, context) -> {
          if (!zipper.node().isScript()) {
            return StyleResult.cont(zipper, context);
          }
          List<Comment> comments = new ArrayList<>(context.getComments());
          comments.add(Comment.create(9, "# added"));
          return StyleResult.cont(zipper, context.withComments(comments));
        };
    List<Integer> seen = new ArrayList<>();
    Style countComments =
        (zipper, context) -> {
          seen.add(context.getComments().size());
          return StyleResult.halt(zipper, context);
        };

    RewriteResult result =
        StylePipeline.run(
            SCRIPT,
            ImmutableList.of(),
            RewriteOptions.defaults(),
            ImmutableList.of(addComment, countComments));

    assertThat(seen).containsExactly(1);
    assertThat(result.getComments()).containsExactly(Comment.create(9, "# added"));
  }

  @Test
  public void testCommentsAreSortedOnTheWayIn() {
    Style style = (zipper, context) -> StyleResult.halt(zipper, context);
    RewriteResult result =
        StylePipeline.run(
            SCRIPT,
            ImmutableList.of(Comment.create(3, "# b"), Comment.create(1, "# a")),
            RewriteOptions.defaults(),
            ImmutableList.of(style));
    assertThat(result.getComments())
        .containsExactly(Comment.create(1, "# a"), Comment.create(3, "# b"))
        .inOrder();
  }

  @Test
  public void testFailuresAreWrapped() {
    Style broken =
        (zipper, context) -> {
          throw new IllegalStateException("boom");
        };
    StylePipeline pipeline =
        new StylePipeline("lib/foo.ex", RewriteOptions.defaults(), ImmutableList.of(broken));

    StyleException e =
        assertThrows(StyleException.class, () -> pipeline.process(SCRIPT, ImmutableList.of()));

    assertThat(e.getFileName()).isEqualTo("lib/foo.ex");
    assertThat(e.getCause()).isInstanceOf(IllegalStateException.class);
    assertThat(e).hasMessageThat().contains("lib/foo.ex");
  }

  @Test
  public void testRootMustBeAScript() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            StylePipeline.run(
                IR.call("foo", 1),
                ImmutableList.of(),
                RewriteOptions.defaults(),
                ImmutableList.of()));
  }
}
