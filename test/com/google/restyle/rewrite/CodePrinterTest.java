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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.restyle.ast.IR;
import com.google.restyle.ast.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link CodePrinter}. */
@RunWith(JUnit4.class)
public final class CodePrinterTest {

  private static void assertPrints(Node n, String expected) {
    assertThat(CodePrinter.toSource(n)).isEqualTo(expected);
  }

  private static Node x() {
    return IR.name("x", 1);
  }

  @Test
  public void testLiterals() {
    assertPrints(IR.atom("ok", 1), ":ok");
    assertPrints(IR.atom("nil", 1), "nil");
    assertPrints(IR.string("say \"hi\"", 1), "\"say \\\"hi\\\"\"");
    assertPrints(IR.number("1_000", 1), "1_000");
    assertPrints(IR.sigil("r", "a+", 1), "~r(a+)");
    assertPrints(
        IR.sigil("w", "a b", 1)
            .withProp(Node.Prop.DELIMITER, "[")
            .withProp(Node.Prop.SIGIL_MODIFIERS, "a"),
        "~w[a b]a");
  }

  @Test
  public void testContainers() {
    assertPrints(IR.tuple(1, IR.atom("ok", 1), x()), "{:ok, x}");
    assertPrints(IR.list(1, IR.keywordPair("a", IR.number(1, 1))), "[a: 1]");
    assertPrints(IR.map(1, IR.pair(IR.string("k", 1), x())), "%{\"k\" => x}");
    assertPrints(
        IR.struct(IR.aliases("User", 1), IR.map(1, IR.keywordPair("name", x()))),
        "%User{name: x}");
    assertPrints(IR.op("<<>>", 1, IR.number(1, 1), IR.number(2, 1)), "<<1, 2>>");
  }

  @Test
  public void testCalls() {
    assertPrints(IR.call("foo", 1, x()), "foo(x)");
    assertPrints(IR.callNoParens("foo", 1, x()), "foo x");
    assertPrints(IR.callNoParens("foo", 1), "foo");
    assertPrints(IR.remoteCall("Foo.Bar", "baz", 1), "Foo.Bar.baz()");
    assertPrints(IR.anonCall(IR.name("f", 1), 1, x()), "f.(x)");
    assertPrints(IR.getprop(x(), "field", 1), "x.field");
    assertPrints(IR.directive("alias", "Foo.Bar", 1, IR.keywordPair("as", IR.aliases("B", 1))),
        "alias Foo.Bar, as: B");
  }

  @Test
  public void testOperators() {
    assertPrints(IR.pipe(x(), IR.call("foo", 1)), "x |> foo()");
    assertPrints(IR.op("not", 1, x()), "not x");
    assertPrints(IR.op("!", 1, x()), "!x");
    assertPrints(IR.range(IR.number(1, 1), IR.number(10, 1)), "1..10");
    assertPrints(IR.captureRef(IR.name("f", 1), 2), "&f/2");
    assertPrints(IR.op("/", 1, x(), IR.name("y", 1)), "x / y");
    assertPrints(IR.capture(IR.op("+", 1, IR.captureArg(1, 1), IR.number(1, 1))), "&&1 + 1");
  }

  @Test
  public void testFunctions() {
    Node fn =
        IR.function(
            1,
            IR.arrow(IR.paramList(1, IR.number(0, 1)), IR.atom("zero", 1)),
            IR.arrow(IR.paramList(1, IR.name("n", 1)), IR.name("n", 1)));
    assertPrints(fn, "fn 0 -> :zero; n -> n end");
  }

  @Test
  public void testBlocks() {
    Node call = IR.withDo(IR.callNoParens("if", 1, x()), IR.block(2, IR.name("a", 2)), 5);
    Node withElse =
        call.withChildren(
            ImmutableList.<Node>builder()
                .addAll(call.children())
                .add(IR.doBlock("else", IR.block(4, IR.name("b", 4))))
                .build());
    assertPrints(withElse, "if x do\na\nelse\nb\nend");
    assertPrints(IR.defmodule("A", 1, 3, IR.attribute("moduledoc", IR.atom("false", 2))),
        "defmodule A do\n@moduledoc false\nend");
  }
}
