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
import com.google.restyle.ast.TraversalSignal;
import com.google.restyle.ast.Zipper;

/** What a {@link Style} hands back after visiting one node. */
@AutoValue
public abstract class StyleResult {

  public abstract TraversalSignal getSignal();

  public abstract Zipper getZipper();

  public abstract StyleContext getContext();

  public static StyleResult of(TraversalSignal signal, Zipper zipper, StyleContext context) {
    return new AutoValue_StyleResult(signal, zipper, context);
  }

  /** Descend into the children of the focus. */
  public static StyleResult cont(Zipper zipper, StyleContext context) {
    return of(TraversalSignal.CONTINUE, zipper, context);
  }

  /** Leave the focus subtree alone and move on to the next sibling. */
  public static StyleResult skip(Zipper zipper, StyleContext context) {
    return of(TraversalSignal.SKIP, zipper, context);
  }

  /** Stop this style's traversal. */
  public static StyleResult halt(Zipper zipper, StyleContext context) {
    return of(TraversalSignal.HALT, zipper, context);
  }
}
