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

import com.google.restyle.ast.Zipper;

/**
 * A rewrite pass. The pipeline calls {@link #run} once for every node it visits, in pre-order.
 *
 * <p>Styles must be total: a node shape the style does not handle is returned unchanged with
 * {@link com.google.restyle.ast.TraversalSignal#CONTINUE}. A style that moves code between lines
 * must update the comments in the returned context in the same step.
 */
public interface Style {

  /**
   * Visits the focus of {@code zipper}.
   *
   * @return the signal, the zipper positioned at the (possibly replaced) node, and the context
   */
  StyleResult run(Zipper zipper, StyleContext context);
}
