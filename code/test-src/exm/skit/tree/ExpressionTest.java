/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.skit.tree;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.skit.common.exceptions.DslMisuseError;

public class ExpressionTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static String expr(ExprConvertible e) {
    return Renderer.renderExpr(e);
  }

  private static VariableExp v(String name) {
    return new VariableExp(name);
  }

  @Test
  public void testScalarLiterals() {
    assertEquals("String content is not escaped",
                 "\"a\\nb\"", expr(Literal.string("a\\nb")));
    assertEquals("-42", expr(Literal.integer(-42)));
    assertEquals("1.5", expr(Literal.floating(1.5)));
    assertEquals("true", expr(Literal.bool(true)));
    assertEquals("nil", expr(Literal.nil()));
    assertEquals(".none", expr(Literal.ref(".none")));
  }

  @Test
  public void testNonFiniteFloats() {
    assertEquals("Double.nan", expr(Literal.floating(Double.NaN)));
    assertEquals("Double.infinity",
                 expr(Literal.floating(Double.POSITIVE_INFINITY)));
    assertEquals("-Double.infinity",
                 expr(Literal.floating(Double.NEGATIVE_INFINITY)));
  }

  @Test
  public void testCollectionLiterals() {
    assertEquals("(1, \"a\")",
        expr(Literal.tuple(Literal.integer(1), Literal.string("a"))));
    assertEquals("[1, 2, 3]", expr(Literal.array(Literal.integer(1),
        Literal.integer(2), Literal.integer(3))));
    assertEquals("[]", expr(Literal.array()));
    assertEquals("[\"a\": 1, \"b\": 2]", expr(Literal.dictionary(
        Arrays.asList(Literal.entry(Literal.string("a"), Literal.integer(1)),
                      Literal.entry(Literal.string("b"), Literal.integer(2))))));
    assertEquals("[:]", expr(Literal.dictionary(
        Collections.<Map.Entry<ExprConvertible, ExprConvertible>>emptyList())));
  }

  @Test
  public void testMemberAccess() {
    assertEquals("self.items.count",
                 expr(v("self").property("items").property("count")));
    assertEquals("!self.isEmpty",
                 expr(new NegatedPropertyAccessExp("self", "isEmpty")));
    assertEquals("user?.name", expr(v("user").optional().property("name")));
    assertEquals("self?.reload()",
                 expr(v("self").optional().call("reload")));
  }

  @Test
  public void testCalls() {
    assertEquals("max(a, b)",
        expr(new Call("max", Argument.of(v("a")), Argument.of(v("b")))));
    assertEquals("items.append(contentsOf: other)",
        expr(v("items").call("append",
                 Argument.labeled("contentsOf", v("other")))));
    assertEquals("URL(string: \"https://example.com\")",
        expr(new Call("URL").arguments(Argument.labeled("string",
                 Literal.string("https://example.com")))));
  }

  @Test
  public void testTrailingClosure() {
    Call c = v("items").call("forEach").trailingClosure(
        new Closure(b -> b.add(new Call("print",
                                        Argument.of(v("item"))))));
    assertEquals("items.forEach {\n" +
                 "    print(item)\n" +
                 "}", expr(c));
  }

  @Test
  public void testOperators() {
    assertEquals("a + b", expr(new Infix("+", v("a"), v("b"))));
    assertEquals("i % 2 == 0", expr(new Infix("==",
        new Infix("%", v("i"), Literal.integer(2)), Literal.integer(0))));
    assertEquals("count > 0", expr(new Infix(">", b -> {
      b.add(v("count"));
      b.add(Literal.integer(0));
    })));
    assertEquals("flag ? 1 : 0", expr(new ConditionalOp(v("flag"),
        Literal.integer(1), Literal.integer(0))));
  }

  @Test
  public void testEscapedString() {
    assertEquals("\"say \\\"hi\\\"\\n\"",
                 expr(Literal.escapedString("say \"hi\"\n")));
    assertEquals("Interpolation is not introduced",
                 "\"\\\\(name)\"", expr(Literal.escapedString("\\(name)")));
    assertEquals("\"a\\tb\\r\\0\\u{1b}\"",
                 expr(Literal.escapedString("a\tb\r\0\u001b")));
    assertEquals("Author text is kept as written",
                 "\"\\(name)\"", expr(Literal.string("\\(name)")));
  }

  @Test
  public void testOperandGroupingFollowsTree() {
    Infix sum = new Infix("+", v("a"), v("b"));
    assertEquals("(a + b) * c", expr(new Infix("*", sum, v("c"))));
    assertEquals("c * (a + b)", expr(new Infix("*", v("c"), sum)));
    assertEquals("a + b + c", expr(new Infix("+", sum, v("c"))));
    assertEquals("c - (a + b)", expr(new Infix("-", v("c"), sum)));
    assertEquals("x * y + c",
        expr(new Infix("+", new Infix("*", v("x"), v("y")), v("c"))));
    assertEquals("(a == b) == c",
        expr(new Infix("==", new Infix("==", v("a"), v("b")), v("c"))));
    assertEquals("a ?? b ?? c",
        expr(new Infix("??", v("a"), new Infix("??", v("b"), v("c")))));
    assertEquals("(a ?? b) ?? c",
        expr(new Infix("??", new Infix("??", v("a"), v("b")), v("c"))));
    assertEquals("(a <*> b) <*> c",
        expr(new Infix("<*>", new Infix("<*>", v("a"), v("b")), v("c"))));
    assertEquals("x + (await load())",
        expr(new Infix("+", v("x"), new Await(new Call("load")))));
  }

  @Test
  public void testPrefixAndTernaryGrouping() {
    assertEquals("!(a == b)", expr(new NegatedPropertyAccessExp(
        new Infix("==", v("a"), v("b")))));
    assertEquals("a > b ? a : b", expr(new ConditionalOp(
        new Infix(">", v("a"), v("b")), v("a"), v("b"))));
    assertEquals("(p ? q : r) ? 1 : 0", expr(new ConditionalOp(
        new ConditionalOp(v("p"), v("q"), v("r")),
        Literal.integer(1), Literal.integer(0))));
    assertEquals("await (f ? g() : h())", expr(new Await(new ConditionalOp(
        v("f"), new Call("g"), new Call("h")))));
  }

  @Test
  public void testInfixNeedsTwoOperands() {
    exception.expect(DslMisuseError.class);
    exception.expectMessage("exactly two operands");
    new Infix("+", b -> b.add(v("a"), v("b"), v("c")));
  }

  @Test
  public void testInfixSingleOperand() {
    exception.expect(DslMisuseError.class);
    new Infix("+", b -> b.add(v("a")));
  }

  @Test
  public void testAssignments() {
    assertEquals("x = 1", expr(new Assignment("x", Literal.integer(1))));
    assertEquals("count += 1", expr(new PlusAssign("count", 1)));
    assertEquals("total += price",
                 expr(new PlusAssign("total", v("price"))));
    assertEquals("await loader.load()",
                 expr(new Await(v("loader").call("load"))));
  }

  @Test
  public void testTask() {
    Task t = new Task(b -> b.add(new Call("refresh").async()))
                 .attribute("MainActor");
    assertEquals("Task { @MainActor in\n" +
                 "    await refresh()\n" +
                 "}", t.generateCode());
    assertEquals("Task {\n}", new Task(b -> {}).generateCode());
  }

  @Test
  public void testOptionalChaining() {
    assertEquals("user?.address.city",
        expr(new OptionalChainingExp(v("user")).property("address")
                 .property("city")));
    assertEquals("delegate?.didFinish()",
        expr(new OptionalChainingExp(v("delegate")).call("didFinish")));
  }

  @Test
  public void testExpressionAsStatementIsOneLine() {
    Function f = new Function("f", b -> {
      b.add(new Assignment("x", Literal.integer(1)));
      b.add(new Call("g"));
    });
    assertEquals("func f() {\n" +
                 "    x = 1\n" +
                 "    g()\n" +
                 "}", f.generateCode());
  }
}
