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

/** Tells a {@link Zipper#traverseWhile} walk what to do after visiting a node. */
public enum TraversalSignal {
  /** Descend into the children of the (possibly replaced) current node. */
  CONTINUE,
  /** Do not visit the current node's children; resume at its right sibling. */
  SKIP,
  /** Stop the walk now, keeping every edit made so far. */
  HALT;
}
