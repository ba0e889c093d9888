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

import org.junit.Test;

import exm.skit.tree.Variable.VariableKind;

/**
 * Small end-to-end trees covering the common authoring shapes
 */
public class ScenarioTest {

  @Test
  public void testRawValueEnum() {
    EnumDecl e = new EnumDecl("HTTPStatus",
        new EnumCase("ok").rawValue(200),
        new EnumCase("notFound").rawValue(404),
        new EnumCase("serverError").rawValue(500))
        .inherits("Int", "CaseIterable");
    assertEquals("enum HTTPStatus: Int, CaseIterable {\n" +
                 "    case ok = 200\n" +
                 "    case notFound = 404\n" +
                 "    case serverError = 500\n" +
                 "}", e.generateCode());
  }

  @Test
  public void testStructWithMethod() {
    Struct s = new Struct("Greeter", b -> {
      b.add(new Variable(VariableKind.LET, "name", "String"));
      b.add(new Function("greet", bb -> bb.add(
          new Call("print",
                   Argument.of(Literal.string("Hello, \\(name)!\\n"))))));
    });
    assertEquals("struct Greeter {\n" +
                 "    let name: String\n" +
                 "    func greet() {\n" +
                 "        print(\"Hello, \\(name)!\\n\")\n" +
                 "    }\n" +
                 "}", s.generateCode());
  }

  @Test
  public void testClosureWithReturnTypeOnly() {
    Closure c = new Closure(b -> b.add(new Return(Literal.integer(42))))
                    .returns("Int");
    assertEquals("{ () -> Int in\n" +
                 "    return 42\n" +
                 "}", c.generateCode());
  }

  @Test
  public void testClosureWithoutSignature() {
    Closure c = new Closure(b -> b.add(new Call("work")));
    assertEquals("{\n    work()\n}", c.generateCode());
  }
}
