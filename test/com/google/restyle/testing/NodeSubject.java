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

package com.google.restyle.testing;

import static com.google.common.truth.Fact.fact;
import static com.google.common.truth.Fact.simpleFact;
import static com.google.common.truth.Truth.assertAbout;

import com.google.common.truth.FailureMetadata;
import com.google.common.truth.Subject;
import com.google.restyle.ast.Node;
import com.google.restyle.ast.Token;
import com.google.restyle.rewrite.CodePrinter;
import org.jspecify.annotations.Nullable;

/**
 * Truth subject for {@link Node} trees.
 *
 * <pre>
 *   assertNode(n).hasToken(Token.CALL);
 *   assertNode(n).hasSource("Enum.map(x, f)");
 *   assertNode(n).isEquivalentTo(expected);
 * </pre>
 */
public final class NodeSubject extends Subject {

  private final @Nullable Node actual;

  public static Subject.Factory<NodeSubject, Node> nodes() {
    return NodeSubject::new;
  }

  public static NodeSubject assertNode(@Nullable Node node) {
    return assertAbout(nodes()).that(node);
  }

  private NodeSubject(FailureMetadata metadata, @Nullable Node node) {
    super(metadata, node);
    this.actual = node;
  }

  /** Compares shape, payloads and properties, ignoring lines. */
  public void isEquivalentTo(Node expected) {
    isEquivalentTo(expected, false);
  }

  /** Compares shape, payloads, properties and every line. */
  public void isEquivalentWithLinesTo(Node expected) {
    isEquivalentTo(expected, true);
  }

  private void isEquivalentTo(Node expected, boolean compareLines) {
    Node node = nonNull();
    if (!node.isEquivalentTo(expected, compareLines)) {
      failWithoutActual(
          simpleFact(compareLines ? "Trees differ (with lines)" : "Trees differ"),
          fact("Expected", "\n" + expected.toStringTree()),
          fact("But was", "\n" + node.toStringTree()));
    }
  }

  public void hasToken(Token token) {
    check("getToken()").that(nonNull().getToken()).isEqualTo(token);
  }

  public void hasLineno(int line) {
    check("getLineno()").that(nonNull().getLineno()).isEqualTo(line);
  }

  public void hasMaxLine(int line) {
    check("getMaxLine()").that(nonNull().getMaxLine()).isEqualTo(line);
  }

  /** Compares the compact source rendering of the tree. */
  public void hasSource(String source) {
    check("toSource()").that(CodePrinter.toSource(nonNull())).isEqualTo(source);
  }

  private Node nonNull() {
    isNotNull();
    return actual;
  }
}
