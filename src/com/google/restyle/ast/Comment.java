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

import com.google.auto.value.AutoValue;
import java.util.Comparator;

/**
 * A source comment. Comments are not attached to nodes; a comment belongs to whatever code sits on
 * or immediately below its line.
 */
@AutoValue
public abstract class Comment {

  /** Orders comments by line. Ties keep their relative order when used with a stable sort. */
  public static final Comparator<Comment> BY_LINE = Comparator.comparingInt(Comment::getLine);

  public abstract int getLine();

  /** The full comment text, including the leading {@code #}. */
  public abstract String getText();

  public static Comment create(int line, String text) {
    return new AutoValue_Comment(line, text);
  }

  public Comment withLine(int newLine) {
    return newLine == getLine() ? this : create(newLine, getText());
  }
}
