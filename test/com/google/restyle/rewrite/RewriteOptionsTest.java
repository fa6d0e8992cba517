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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link RewriteOptions}. */
@RunWith(JUnit4.class)
public final class RewriteOptionsTest {

  @Test
  public void testDefaults() {
    RewriteOptions options = RewriteOptions.defaults();
    assertThat(options.getPipeChainStartFlag()).isFalse();
    assertThat(options.getLiftAlias()).isFalse();
    assertThat(options.getSortOrder()).isEqualTo(RewriteOptions.SortOrder.ALPHA);
    assertThat(options.getInefficientFunctionRewrites()).isTrue();
    assertThat(options.getAutosort()).isEmpty();
    assertThat(options.getStrictModuleLayoutOrder())
        .isEqualTo(RewriteOptions.DEFAULT_MODULE_LAYOUT_ORDER);
    assertThat(options.getSchemaKindOrder()).isEqualTo(RewriteOptions.DEFAULT_SCHEMA_KIND_ORDER);
  }

  @Test
  public void testExclusionsAlwaysIncludeTheStandardLibrary() {
    RewriteOptions options =
        RewriteOptions.builder()
            .setLiftAliasExcludedNamespaces(ImmutableList.of("MyApp"))
            .setLiftAliasExcludedLastnames(ImmutableList.of("Repo"))
            .build();
    assertThat(options.getLiftAliasExcludedNamespaces()).containsAtLeast("MyApp", "Enum", "Ecto");
    assertThat(options.getLiftAliasExcludedLastnames()).containsAtLeast("Repo", "Map", "String");
  }

  @Test
  public void testPartialLayoutOrderIsCompleted() {
    RewriteOptions options =
        RewriteOptions.builder()
            .setStrictModuleLayoutOrder(ImmutableList.of("alias", "use"))
            .build();
    assertThat(options.getStrictModuleLayoutOrder())
        .containsExactly("alias", "use", "shortdoc", "moduledoc", "behaviour", "import", "require")
        .inOrder();
  }

  @Test
  public void testNegativeThresholdsAreRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> RewriteOptions.builder().setLiftAliasDepth(-1).build());
  }

  @Test
  public void testIsAllowedPath() {
    RewriteOptions options =
        RewriteOptions.builder()
            .setDirectoriesIncluded(ImmutableList.of("lib/", "test/"))
            .setDirectoriesExcluded(ImmutableList.of("lib/generated/"))
            .build();
    assertThat(options.isAllowedPath("lib/foo.ex")).isTrue();
    assertThat(options.isAllowedPath("test/foo_test.exs")).isTrue();
    assertThat(options.isAllowedPath("lib/generated/foo.ex")).isFalse();
    assertThat(options.isAllowedPath("config/config.exs")).isFalse();
    assertThat(RewriteOptions.defaults().isAllowedPath("anything.ex")).isTrue();
  }

  @Test
  public void testToBuilderKeepsValues() {
    RewriteOptions options = RewriteOptions.builder().setLiftAlias(true).build();
    RewriteOptions copy = options.toBuilder().setSinglePipeFlag(true).build();
    assertThat(copy.getLiftAlias()).isTrue();
    assertThat(copy.getSinglePipeFlag()).isTrue();
    assertThat(copy.getLiftAliasExcludedLastnames())
        .isEqualTo(options.getLiftAliasExcludedLastnames());
  }
}
