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

import com.google.restyle.ast.IR;
import com.google.restyle.ast.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link TestAssertions}. */
@RunWith(JUnit4.class)
public final class TestAssertionsTest extends StyleTestCase {

  @Override
  protected Style getStyle() {
    return new TestAssertions();
  }

  private static Node x() {
    return IR.name("x", 1);
  }

  @Test
  public void testAssertNot() {
    testSource(IR.script(IR.callNoParens("assert", 1, IR.op("not", 1, x()))), "refute x");
  }

  @Test
  public void testAssertBang() {
    testSource(IR.script(IR.callNoParens("assert", 1, IR.op("!", 1, x()))), "refute x");
  }

  @Test
  public void testRefuteNot() {
    testSource(IR.script(IR.callNoParens("refute", 1, IR.op("not", 1, x()))), "assert x");
  }

  @Test
  public void testMessageIsKept() {
    Node assertion =
        IR.callNoParens("assert", 1, IR.op("!", 1, x()), IR.string("must not hold", 1));
    testSource(IR.script(assertion), "refute x, \"must not hold\"");
  }

  @Test
  public void testParensAreKept() {
    testSource(IR.script(IR.call("assert", 1, IR.op("not", 1, x()))), "refute(x)");
  }

  @Test
  public void testPositiveAssertionsAreKept() {
    testSame(IR.script(IR.callNoParens("assert", 1, x())));
    testSame(IR.script(IR.callNoParens("refute", 1, IR.op("==", 1, x(), IR.number(1, 1)))));
  }

  @Test
  public void testBinaryNotIsKept() {
    testSame(IR.script(IR.callNoParens("assert", 1, IR.op("!=", 1, x(), IR.number(1, 1)))));
  }

  @Test
  public void testOnlyLocalCallsAreInverted() {
    Node remote = IR.remoteCall("Mod", "assert", 1, IR.op("not", 1, x()));
    testSame(IR.script(remote));
  }
}
