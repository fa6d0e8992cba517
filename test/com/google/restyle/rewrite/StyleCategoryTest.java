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

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link StyleCategory}. */
@RunWith(JUnit4.class)
public final class StyleCategoryTest {

  @Test
  public void testEverythingRunsByDefault() {
    assertThat(StyleCategory.select(RewriteOptions.defaults()))
        .containsExactly(
            StyleCategory.SINGLE_NODE,
            StyleCategory.PIPES,
            StyleCategory.MODULE_DIRECTIVES,
            StyleCategory.COMMENT_DIRECTIVES,
            StyleCategory.TESTS)
        .inOrder();
  }

  @Test
  public void testIncludeListRunsInCanonicalOrder() {
    RewriteOptions options =
        RewriteOptions.builder()
            .setOnlyStyles(ImmutableList.of(StyleCategory.TESTS, StyleCategory.PIPES))
            .build();
    assertThat(StyleCategory.select(options))
        .containsExactly(StyleCategory.PIPES, StyleCategory.TESTS)
        .inOrder();
  }

  @Test
  public void testExcludeWinsOverInclude() {
    RewriteOptions options =
        RewriteOptions.builder()
            .setOnlyStyles(ImmutableList.of(StyleCategory.TESTS, StyleCategory.PIPES))
            .setExcludeStyles(ImmutableList.of(StyleCategory.PIPES))
            .build();
    assertThat(StyleCategory.select(options)).containsExactly(StyleCategory.TESTS);
  }

  @Test
  public void testLineLengthOnlySelectsNothing() {
    RewriteOptions options =
        RewriteOptions.builder()
            .setOnlyStyles(ImmutableList.of(StyleCategory.LINE_LENGTH, StyleCategory.PIPES))
            .build();
    assertThat(StyleCategory.select(options)).isEmpty();
  }

  @Test
  public void testCreateStyle() {
    assertThat(StyleCategory.PIPES.createStyle()).isInstanceOf(PipeChains.class);
    assertThat(StyleCategory.MODULE_DIRECTIVES.createStyle()).isInstanceOf(AliasLifting.class);
    assertThat(StyleCategory.COMMENT_DIRECTIVES.createStyle())
        .isInstanceOf(CommentDirectives.class);
    assertThat(StyleCategory.LINE_LENGTH.createStyle()).isNull();
    assertThat(StyleCategory.PIPES.createStyle())
        .isNotSameInstanceAs(StyleCategory.PIPES.createStyle());
  }

  @Test
  public void testConfigNames() {
    assertThat(StyleCategory.forConfigName("module_directives"))
        .isEqualTo(StyleCategory.MODULE_DIRECTIVES);
    assertThat(StyleCategory.forConfigName("nope")).isNull();
    assertThat(StyleCategory.SINGLE_NODE.getConfigName()).isEqualTo("single_node");
  }
}
