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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.restyle.ast.Comment;
import java.util.List;

/**
 * The per-file state threaded through every style: the file being rewritten, its comments as they
 * stand after the edits made so far, and the shared options.
 */
@AutoValue
public abstract class StyleContext {

  public abstract String getFileName();

  /** The comments of the file, sorted by line. */
  public abstract ImmutableList<Comment> getComments();

  public abstract RewriteOptions getOptions();

  public static StyleContext create(
      String fileName, List<Comment> comments, RewriteOptions options) {
    return new AutoValue_StyleContext(
        fileName, ImmutableList.sortedCopyOf(Comment.BY_LINE, comments), options);
  }

  /** Returns this context with {@code newComments}, which must already be sorted by line. */
  public StyleContext withComments(List<Comment> newComments) {
    if (newComments == getComments()) {
      return this;
    }
    return new AutoValue_StyleContext(
        getFileName(), ImmutableList.copyOf(newComments), getOptions());
  }
}
