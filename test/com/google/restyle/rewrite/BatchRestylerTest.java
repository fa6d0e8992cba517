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
import com.google.restyle.ast.IR;
import com.google.restyle.ast.Node;
import com.google.restyle.ast.Token;
import com.google.restyle.rewrite.BatchRestyler.FileOutcome;
import com.google.restyle.rewrite.BatchRestyler.SourceFile;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link BatchRestyler}. */
@RunWith(JUnit4.class)
public final class BatchRestylerTest {

  private static SourceFile file(String name, Node root) {
    return SourceFile.create(name, root, ImmutableList.of());
  }

  private static Node pipeScript() {
    return IR.script(IR.pipe(IR.name("x", 1), IR.name("foo", 1)));
  }

  @Test
  public void testOutcomesKeepFileOrder() {
    RewriteOptions options =
        RewriteOptions.builder().setDirectoriesExcluded(ImmutableList.of("deps/")).build();
    BatchRestyler batch = new BatchRestyler(options, 2);

    ImmutableList<FileOutcome> outcomes =
        batch.restyleAll(
            ImmutableList.of(
                file("lib/a.ex", pipeScript()),
                file("deps/b.ex", pipeScript()),
                file("lib/bad.ex", IR.script(Node.newNode(Token.CALL, 1)))));

    assertThat(outcomes).hasSize(3);
    assertThat(outcomes.get(0).getFileName()).isEqualTo("lib/a.ex");
    assertThat(outcomes.get(0).isSuccess()).isTrue();
    assertNode(outcomes.get(0).getResult().getRoot()).hasSource("x |> foo()");

    assertThat(outcomes.get(1).isSkipped()).isTrue();
    assertThat(outcomes.get(1).isSuccess()).isFalse();

    assertThat(outcomes.get(2).isSuccess()).isFalse();
    assertThat(outcomes.get(2).isSkipped()).isFalse();
    assertThat(outcomes.get(2).getError().getStyleName()).isEqualTo("SingleNodeRewrites");
  }

  @Test
  public void testIncludedDirectories() {
    RewriteOptions options =
        RewriteOptions.builder().setDirectoriesIncluded(ImmutableList.of("lib/")).build();
    ImmutableList<FileOutcome> outcomes =
        new BatchRestyler(options, 1)
            .restyleAll(
                ImmutableList.of(file("lib/a.ex", pipeScript()), file("test/a.exs", pipeScript())));

    assertThat(outcomes.get(0).isSuccess()).isTrue();
    assertThat(outcomes.get(1).isSkipped()).isTrue();
  }

  @Test
  public void testManyFiles() {
    List<SourceFile> files = new ArrayList<>();
    for (int i = 0; i < 50; i++) {
      files.add(
          file(
              "lib/f" + i + ".ex",
              IR.script(IR.pipe(IR.name("x" + i, 1), IR.name("foo", 1)))));
    }

    ImmutableList<FileOutcome> outcomes =
        new BatchRestyler(RewriteOptions.defaults(), 4).restyleAll(files);

    for (int i = 0; i < 50; i++) {
      assertThat(outcomes.get(i).getFileName()).isEqualTo("lib/f" + i + ".ex");
      assertNode(outcomes.get(i).getResult().getRoot()).hasSource("x" + i + " |> foo()");
    }
  }

  @Test
  public void testNeedsAThread() {
    assertThrows(
        IllegalArgumentException.class, () -> new BatchRestyler(RewriteOptions.defaults(), 0));
  }
}
