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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.Immutable;
import java.util.ArrayList;
import java.util.List;

/**
 * An immutable snapshot of every option the styles consult. One snapshot is built per run and
 * shared, read-only, by every file.
 */
@AutoValue
@Immutable
public abstract class RewriteOptions {

  /** How directives such as {@code alias} are ordered. */
  public enum SortOrder {
    /** Case-insensitive. */
    ALPHA,
    /** By code point, so upper case sorts before lower case. */
    ASCII
  }

  /**
   * Modules of the standard library and a few ubiquitous packages. Names starting or ending with
   * these are never hoisted.
   */
  public static final ImmutableSet<String> STDLIB_MODULES =
      ImmutableSet.of(
          "Access", "Agent", "Application", "Atom", "Base", "Behaviour", "Bitwise", "Code", "Date",
          "DateTime", "Dict", "Ecto", "Enum", "Exception", "File", "Float", "GenEvent", "GenServer",
          "HashDict", "HashSet", "Integer", "IO", "Kernel", "Keyword", "List", "Macro", "Map",
          "MapSet", "Module", "NaiveDateTime", "Node", "Oban", "OptionParser", "Path", "Port",
          "Process", "Protocol", "Range", "Record", "Regex", "Registry", "Set", "Stream", "String",
          "StringIO", "Supervisor", "System", "Task", "Time", "Tuple", "URI", "Version");

  public static final ImmutableList<String> DEFAULT_MODULE_LAYOUT_ORDER =
      ImmutableList.of("shortdoc", "moduledoc", "behaviour", "use", "import", "alias", "require");

  public static final ImmutableList<String> DEFAULT_SCHEMA_KIND_ORDER =
      ImmutableList.of(
          "field",
          "belongs_to",
          "has_many",
          "has_one",
          "many_to_many",
          "embeds_many",
          "embeds_one");

  // Chain normalization.

  /** Whether invalid chain starts are rewritten. */
  public abstract boolean getPipeChainStartFlag();

  /** Functions, by bare name or {@code Mod.fun}, allowed to start a chain with arguments. */
  public abstract ImmutableSet<String> getPipeChainStartExcludedFunctions();

  /** First-argument shape classes that make an n-ary call a valid chain start. */
  public abstract ImmutableSet<String> getPipeChainStartExcludedArgumentTypes();

  /** Whether block expressions such as {@code case} are extracted from chain starts. */
  public abstract boolean getBlockPipeFlag();

  /** Block macro names never extracted from chain starts. */
  public abstract ImmutableSet<String> getBlockPipeExclude();

  /** Whether single-link chains are rewritten as plain calls. */
  public abstract boolean getSinglePipeFlag();

  /**
   * Functions, by bare name or {@code Mod.fun}, whose first argument is never lifted out into a
   * chain even when it is one.
   */
  public abstract ImmutableSet<String> getPipedFunctionExclusions();

  // Style selection.

  public abstract ImmutableList<StyleCategory> getOnlyStyles();

  public abstract ImmutableSet<StyleCategory> getExcludeStyles();

  // Alias hoisting.

  public abstract boolean getLiftAlias();

  /** Minimum number of segments a module name needs before it is hoisted. */
  public abstract int getLiftAliasDepth();

  /** Minimum number of uses in one scope before a module name is hoisted. */
  public abstract int getLiftAliasFrequency();

  /** First segments never hoisted, always including {@link #STDLIB_MODULES}. */
  public abstract ImmutableSet<String> getLiftAliasExcludedNamespaces();

  /** Last segments never hoisted, always including {@link #STDLIB_MODULES}. */
  public abstract ImmutableSet<String> getLiftAliasExcludedLastnames();

  public abstract SortOrder getSortOrder();

  /** Directive kinds in their canonical order; every default kind is present. */
  public abstract ImmutableList<String> getStrictModuleLayoutOrder();

  // Sorting.

  public abstract ImmutableSet<AutosortCategory> getAutosort();

  /** Schema field kinds in sort priority order. */
  public abstract ImmutableList<String> getSchemaKindOrder();

  /** Whether maps inside query constructors are exempt from autosort. */
  public abstract boolean getAutosortExcludeQuery();

  // Single-node rewrites.

  public abstract boolean getInefficientFunctionRewrites();

  /** Integer literals above this value get underscore digit grouping. */
  public abstract long getLargeNumbersGt();

  // Consumed by file walkers.

  public abstract ImmutableList<String> getDirectoriesIncluded();

  public abstract ImmutableList<String> getDirectoriesExcluded();

  public boolean isAutosortEnabled(AutosortCategory category) {
    return getAutosort().contains(category);
  }

  /**
   * Whether a file at {@code relativePath} should be rewritten. Exclusions win over inclusions;
   * an empty include list includes everything.
   */
  public boolean isAllowedPath(String relativePath) {
    for (String excluded : getDirectoriesExcluded()) {
      if (relativePath.startsWith(excluded)) {
        return false;
      }
    }
    if (getDirectoriesIncluded().isEmpty()) {
      return true;
    }
    for (String included : getDirectoriesIncluded()) {
      if (relativePath.startsWith(included)) {
        return true;
      }
    }
    return false;
  }

  public abstract Builder toBuilder();

  /** Returns the options used when nothing is configured. */
  public static RewriteOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_RewriteOptions.Builder()
        .setPipeChainStartFlag(false)
        .setPipeChainStartExcludedFunctions(ImmutableSet.of())
        .setPipeChainStartExcludedArgumentTypes(ImmutableSet.of())
        .setBlockPipeFlag(false)
        .setBlockPipeExclude(ImmutableSet.of())
        .setSinglePipeFlag(false)
        .setPipedFunctionExclusions(ImmutableSet.of())
        .setOnlyStyles(ImmutableList.of())
        .setExcludeStyles(ImmutableSet.of())
        .setLiftAlias(false)
        .setLiftAliasDepth(3)
        .setLiftAliasFrequency(2)
        .setLiftAliasExcludedNamespaces(ImmutableSet.of())
        .setLiftAliasExcludedLastnames(ImmutableSet.of())
        .setSortOrder(SortOrder.ALPHA)
        .setStrictModuleLayoutOrder(DEFAULT_MODULE_LAYOUT_ORDER)
        .setAutosort(ImmutableSet.of())
        .setSchemaKindOrder(DEFAULT_SCHEMA_KIND_ORDER)
        .setAutosortExcludeQuery(false)
        .setInefficientFunctionRewrites(true)
        .setLargeNumbersGt(9999)
        .setDirectoriesIncluded(ImmutableList.of())
        .setDirectoriesExcluded(ImmutableList.of());
  }

  /** Builder for {@link RewriteOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setPipeChainStartFlag(boolean value);

    public abstract Builder setPipeChainStartExcludedFunctions(Iterable<String> value);

    public abstract Builder setPipeChainStartExcludedArgumentTypes(Iterable<String> value);

    public abstract Builder setBlockPipeFlag(boolean value);

    public abstract Builder setBlockPipeExclude(Iterable<String> value);

    public abstract Builder setSinglePipeFlag(boolean value);

    public abstract Builder setPipedFunctionExclusions(Iterable<String> value);

    public abstract Builder setOnlyStyles(Iterable<StyleCategory> value);

    public abstract Builder setExcludeStyles(Iterable<StyleCategory> value);

    public abstract Builder setLiftAlias(boolean value);

    public abstract Builder setLiftAliasDepth(int value);

    public abstract Builder setLiftAliasFrequency(int value);

    public abstract Builder setLiftAliasExcludedNamespaces(Iterable<String> value);

    public abstract Builder setLiftAliasExcludedLastnames(Iterable<String> value);

    public abstract Builder setSortOrder(SortOrder value);

    public abstract Builder setStrictModuleLayoutOrder(Iterable<String> value);

    public abstract Builder setAutosort(Iterable<AutosortCategory> value);

    public abstract Builder setSchemaKindOrder(Iterable<String> value);

    public abstract Builder setAutosortExcludeQuery(boolean value);

    public abstract Builder setInefficientFunctionRewrites(boolean value);

    public abstract Builder setLargeNumbersGt(long value);

    public abstract Builder setDirectoriesIncluded(Iterable<String> value);

    public abstract Builder setDirectoriesExcluded(Iterable<String> value);

    abstract ImmutableSet<String> getLiftAliasExcludedNamespaces();

    abstract ImmutableSet<String> getLiftAliasExcludedLastnames();

    abstract ImmutableList<String> getStrictModuleLayoutOrder();

    abstract int getLiftAliasDepth();

    abstract int getLiftAliasFrequency();

    abstract RewriteOptions autoBuild();

    public RewriteOptions build() {
      checkArgument(getLiftAliasDepth() >= 0, "liftAliasDepth must not be negative");
      checkArgument(getLiftAliasFrequency() >= 0, "liftAliasFrequency must not be negative");
      setLiftAliasExcludedNamespaces(
          Sets.union(getLiftAliasExcludedNamespaces(), STDLIB_MODULES).immutableCopy());
      setLiftAliasExcludedLastnames(
          Sets.union(getLiftAliasExcludedLastnames(), STDLIB_MODULES).immutableCopy());
      // A partial layout order is completed with the default kinds it leaves out.
      List<String> order = new ArrayList<>(getStrictModuleLayoutOrder());
      for (String kind : DEFAULT_MODULE_LAYOUT_ORDER) {
        if (!order.contains(kind)) {
          order.add(kind);
        }
      }
      setStrictModuleLayoutOrder(order);
      return autoBuild();
    }
  }
}
