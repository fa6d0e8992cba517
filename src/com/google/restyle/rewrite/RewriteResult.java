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
import com.google.restyle.ast.Node;
import java.util.List;

/** A rewritten tree and its relocated comments, ready for the printer. */
@AutoValue
public abstract class RewriteResult {

  public abstract Node getRoot();

  public abstract ImmutableList<Comment> getComments();

  public static RewriteResult create(Node root, List<Comment> comments) {
    return new AutoValue_RewriteResult(root, ImmutableList.copyOf(comments));
  }
}
