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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Reads {@link RewriteOptions} from a JSON object with snake_case keys, for example
 *
 * <pre>
 * {"pipe_chain_start_flag": true, "lift_alias_depth": 3, "autosort": ["map", "schema"]}
 * </pre>
 *
 * <p>An unknown key or a value of the wrong type is reported as a warning and the option keeps its
 * default. Only a document that is not JSON at all is rejected.
 */
public final class RewriteOptionsParser {

  private static final Logger logger = Logger.getLogger(RewriteOptionsParser.class.getName());

  private RewriteOptionsParser() {}

  /**
   * Parses {@code contents}. An empty document yields {@link RewriteOptions#defaults()}.
   *
   * @throws IllegalArgumentException if {@code contents} is not a JSON object
   */
  public static RewriteOptions parse(String contents) {
    JsonObject root;
    try {
      root = new Gson().fromJson(contents, JsonObject.class);
    } catch (JsonParseException ex) {
      throw new IllegalArgumentException("Malformed options: " + ex.getMessage(), ex);
    }
    RewriteOptions.Builder builder = RewriteOptions.builder();
    if (root == null) {
      return builder.build();
    }
    for (Map.Entry<String, JsonElement> entry : root.entrySet()) {
      apply(builder, entry.getKey(), entry.getValue());
    }
    return builder.build();
  }

  private static void apply(RewriteOptions.Builder builder, String key, JsonElement value) {
    switch (key) {
      case "pipe_chain_start_flag":
        readBoolean(key, value, builder::setPipeChainStartFlag);
        break;
      case "pipe_chain_start_excluded_functions":
        readStrings(key, value, builder::setPipeChainStartExcludedFunctions);
        break;
      case "pipe_chain_start_excluded_argument_types":
        readStrings(key, value, builder::setPipeChainStartExcludedArgumentTypes);
        break;
      case "block_pipe_flag":
        readBoolean(key, value, builder::setBlockPipeFlag);
        break;
      case "block_pipe_exclude":
        readStrings(key, value, builder::setBlockPipeExclude);
        break;
      case "single_pipe_flag":
        readBoolean(key, value, builder::setSinglePipeFlag);
        break;
      case "piped_function_exclusions":
        readStrings(key, value, builder::setPipedFunctionExclusions);
        break;
      case "only_styles":
        readEnums(key, value, StyleCategory::forConfigName, builder::setOnlyStyles);
        break;
      case "exclude_styles":
        readEnums(key, value, StyleCategory::forConfigName, builder::setExcludeStyles);
        break;
      case "lift_alias":
        readBoolean(key, value, builder::setLiftAlias);
        break;
      case "lift_alias_depth":
        readCount(key, value, builder::setLiftAliasDepth);
        break;
      case "lift_alias_frequency":
        readCount(key, value, builder::setLiftAliasFrequency);
        break;
      case "lift_alias_excluded_namespaces":
        readStrings(key, value, builder::setLiftAliasExcludedNamespaces);
        break;
      case "lift_alias_excluded_lastnames":
        readStrings(key, value, builder::setLiftAliasExcludedLastnames);
        break;
      case "sort_order":
        readSortOrder(key, value, builder);
        break;
      case "strict_module_layout_order":
        readStrings(key, value, builder::setStrictModuleLayoutOrder);
        break;
      case "autosort":
        readEnums(key, value, AutosortCategory::forConfigName, builder::setAutosort);
        break;
      case "schema_kind_order":
        readStrings(key, value, builder::setSchemaKindOrder);
        break;
      case "autosort_exclude_query":
        readBoolean(key, value, builder::setAutosortExcludeQuery);
        break;
      case "inefficient_function_rewrites":
        readBoolean(key, value, builder::setInefficientFunctionRewrites);
        break;
      case "large_numbers_gt":
        readThreshold(key, value, builder);
        break;
      case "directories_included":
        readStrings(key, value, builder::setDirectoriesIncluded);
        break;
      case "directories_excluded":
        readStrings(key, value, builder::setDirectoriesExcluded);
        break;
      default:
        logger.warning("Ignoring unknown option " + key);
    }
  }

  /** Receives a successfully read value. */
  private interface Setter<T> {
    void set(T value);
  }

  private static void readBoolean(String key, JsonElement value, Setter<Boolean> setter) {
    JsonPrimitive primitive = asPrimitive(value);
    if (primitive != null && primitive.isBoolean()) {
      setter.set(primitive.getAsBoolean());
    } else {
      warnInvalid(key, value);
    }
  }

  private static void readCount(String key, JsonElement value, Setter<Integer> setter) {
    JsonPrimitive primitive = asPrimitive(value);
    if (primitive != null && primitive.isNumber()) {
      double number = primitive.getAsDouble();
      if (number >= 0 && number == Math.rint(number) && number <= Integer.MAX_VALUE) {
        setter.set((int) number);
        return;
      }
    }
    warnInvalid(key, value);
  }

  private static void readThreshold(String key, JsonElement value, RewriteOptions.Builder builder) {
    JsonPrimitive primitive = asPrimitive(value);
    if (primitive != null && primitive.isNumber()) {
      builder.setLargeNumbersGt(primitive.getAsLong());
    } else if (primitive != null
        && primitive.isString()
        && primitive.getAsString().equals("infinity")) {
      builder.setLargeNumbersGt(Long.MAX_VALUE);
    } else {
      warnInvalid(key, value);
    }
  }

  private static void readSortOrder(String key, JsonElement value, RewriteOptions.Builder builder) {
    JsonPrimitive primitive = asPrimitive(value);
    if (primitive != null && primitive.isString()) {
      switch (Ascii.toLowerCase(primitive.getAsString())) {
        case "alpha":
          builder.setSortOrder(RewriteOptions.SortOrder.ALPHA);
          return;
        case "ascii":
          builder.setSortOrder(RewriteOptions.SortOrder.ASCII);
          return;
        default:
          break;
      }
    }
    warnInvalid(key, value);
  }

  private static void readStrings(
      String key, JsonElement value, Setter<ImmutableList<String>> setter) {
    ImmutableList<String> strings = asStrings(value);
    if (strings == null) {
      warnInvalid(key, value);
    } else {
      setter.set(strings);
    }
  }

  private static <E extends Enum<E>> void readEnums(
      String key,
      JsonElement value,
      Function<String, @Nullable E> lookup,
      Setter<ImmutableList<E>> setter) {
    ImmutableList<String> names = asStrings(value);
    if (names == null) {
      warnInvalid(key, value);
      return;
    }
    ImmutableList.Builder<E> values = ImmutableList.builder();
    for (String name : names) {
      E e = lookup.apply(name);
      if (e == null) {
        logger.warning("Ignoring unknown value " + name + " of option " + key);
      } else {
        values.add(e);
      }
    }
    setter.set(values.build());
  }

  private static @Nullable JsonPrimitive asPrimitive(JsonElement value) {
    return value.isJsonPrimitive() ? value.getAsJsonPrimitive() : null;
  }

  private static @Nullable ImmutableList<String> asStrings(JsonElement value) {
    if (!value.isJsonArray()) {
      return null;
    }
    JsonArray array = value.getAsJsonArray();
    ImmutableList.Builder<String> strings = ImmutableList.builder();
    for (JsonElement element : array) {
      JsonPrimitive primitive = asPrimitive(element);
      if (primitive == null || !primitive.isString()) {
        return null;
      }
      strings.add(primitive.getAsString());
    }
    return strings.build();
  }

  private static void warnInvalid(String key, JsonElement value) {
    logger.warning("Invalid value " + value + " for option " + key + "; using the default");
  }
}
