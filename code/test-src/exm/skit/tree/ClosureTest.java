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
import static org.junit.Assert.assertFalse;

import java.util.Collections;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.skit.common.exceptions.DslMisuseError;
import exm.skit.tree.Capture.CaptureStrength;

public class ClosureTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static String expr(ExprConvertible e) {
    return Renderer.renderExpr(e);
  }

  private static Closure body() {
    return new Closure(b -> b.add(new Call("work")));
  }

  @Test
  public void testNoSignature() {
    Closure c = body();
    assertFalse(c.hasSignature());
    assertEquals("{\n" +
                 "    work()\n" +
                 "}", expr(c));
  }

  @Test
  public void testCaptures() {
    assertEquals("{ [weak self] in\n    work()\n}",
                 expr(body().capture(Capture.weak("self"))));
    assertEquals("{ [unowned owner, count] in\n    work()\n}",
                 expr(body().capture(Capture.unowned("owner"),
                                     Capture.strong("count"))));
  }

  @Test
  public void testCaptureFromReference() {
    ReferenceExp ref = new VariableExp("self")
                             .reference(CaptureStrength.WEAK);
    assertEquals("self", expr(ref));
    assertEquals("{ [weak self] in\n    work()\n}",
                 expr(body().capture(Capture.of(ref))));
  }

  @Test
  public void testCaptureNeedsVariable() {
    exception.expect(DslMisuseError.class);
    Capture.of(new ReferenceExp(new Call("make"), CaptureStrength.WEAK));
  }

  @Test
  public void testParametersAndReturnType() {
    Closure c = new Closure(b -> b.add(new Return(
          new Infix("+", new VariableExp("a"), new VariableExp("b")))))
        .parameter("a", "Int").parameter("b", "Int").returns("Int");
    assertEquals("{ (a: Int, b: Int) -> Int in\n" +
                 "    return a + b\n" +
                 "}", expr(c));
  }

  @Test
  public void testReturnTypeWithoutParameters() {
    Closure c = new Closure(Collections.<Capture>emptyList(),
        Collections.<ClosureParameter>emptyList(), "Int",
        b -> b.add(new Return(Literal.integer(42))));
    assertEquals("{ () -> Int in\n" +
                 "    return 42\n" +
                 "}", expr(c));
  }

  @Test
  public void testEffectsAndAttributes() {
    Closure c = body().async().throwing().returns("Data");
    assertEquals("{ () async throws -> Data in\n    work()\n}", expr(c));

    Closure s = body().attribute("Sendable").capture(Capture.weak("self"));
    assertEquals("{ @Sendable [weak self] in\n    work()\n}", expr(s));
  }

  @Test
  public void testNestedIndentation() {
    Function f = new Function("setup", b -> b.add(
        Variable.constant("handler", new Closure(cb -> cb.add(
            new VariableExp("self").optional().call("reload")))
            .capture(Capture.weak("self")))));
    assertEquals("func setup() {\n" +
                 "    let handler = { [weak self] in\n" +
                 "        self?.reload()\n" +
                 "    }\n" +
                 "}", f.generateCode());
  }
}
