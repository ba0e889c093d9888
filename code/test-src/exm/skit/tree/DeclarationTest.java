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

import org.junit.Test;

import exm.skit.tree.PropertyRequirement.Accessors;
import exm.skit.tree.Variable.VariableKind;

public class DeclarationTest {

  @Test
  public void testStruct() {
    Struct s = new Struct("Point",
        new Variable(VariableKind.VAR, "x", "Int"),
        new Variable(VariableKind.VAR, "y", "Int")).inherits("Equatable");
    assertEquals("struct Point: Equatable {\n" +
                 "    var x: Int\n" +
                 "    var y: Int\n" +
                 "}", s.generateCode());
  }

  @Test
  public void testEmptyStruct() {
    assertEquals("struct Empty {\n}", new Struct("Empty").generateCode());
  }

  @Test
  public void testConformancesNotDeduplicated() {
    Struct s = new Struct("S").inherits("A", "B").inherits("A");
    assertEquals("Order and duplicates kept",
                 "struct S: A, B, A {\n}", s.generateCode());
  }

  @Test
  public void testDecoratorsReturnCopies() {
    Struct plain = new Struct("S");
    Struct decorated = plain.inherits("Codable").access(AccessLevel.PUBLIC);
    assertEquals("struct S {\n}", plain.generateCode());
    assertEquals("public struct S: Codable {\n}",
                 decorated.generateCode());
  }

  @Test
  public void testGenericStructWithDocComment() {
    Struct s = new Struct("Stack", b -> b.add(
          new Variable(VariableKind.VAR, "items", "[Element]",
                       Literal.array())))
        .generic("Element")
        .access(AccessLevel.PUBLIC)
        .comment("A last-in first-out collection");
    assertEquals("/// A last-in first-out collection\n" +
                 "public struct Stack<Element> {\n" +
                 "    var items: [Element] = []\n" +
                 "}", s.generateCode());
  }

  @Test
  public void testFinalClass() {
    ClassDecl c = new ClassDecl("Dog").inherits("Animal")
                          .finalClass().access(AccessLevel.PUBLIC);
    assertEquals("public final class Dog: Animal {\n}", c.generateCode());
  }

  @Test
  public void testProtocol() {
    Protocol p = new Protocol("Container", b -> {
      b.add(new AssociatedType("Item").inherits("Hashable", "Identifiable"));
      b.add(new PropertyRequirement("count", "Int", Accessors.GET));
      b.add(new PropertyRequirement("items", "[Item]", Accessors.GET_SET));
      b.add(new FunctionRequirement("append",
          Arrays.asList(Parameter.unlabeled("item", "Item")), null)
          .mutating());
      b.add(new FunctionRequirement("fetch",
          Collections.<Parameter>emptyList(), "Item").async().throwing());
    });
    assertEquals("protocol Container {\n" +
        "    associatedtype Item: Hashable & Identifiable\n" +
        "    var count: Int { get }\n" +
        "    var items: [Item] { get set }\n" +
        "    mutating func append(_ item: Item)\n" +
        "    func fetch() async throws -> Item\n" +
        "}", p.generateCode());
  }

  @Test
  public void testExtension() {
    Extension e = new Extension("Array",
        new ComputedProperty("second", "Element?", b ->
            b.add(new Return(new Call("dropFirst").property("first")))))
        .inherits("Container");
    assertEquals("extension Array: Container {\n" +
                 "    var second: Element? {\n" +
                 "        return dropFirst().first\n" +
                 "    }\n" +
                 "}", e.generateCode());
  }

  @Test
  public void testFunction() {
    Function f = new Function("greet",
        Arrays.asList(Parameter.named("name", "String")), "String",
        b -> b.add(new Return(Literal.string("Hello"))))
        .access(AccessLevel.PUBLIC);
    assertEquals("public func greet(name: String) -> String {\n" +
                 "    return \"Hello\"\n" +
                 "}", f.generateCode());
  }

  @Test
  public void testFunctionModifierOrder() {
    Function f = new Function("reset", b -> {})
        .staticMember().attribute("MainActor").access(AccessLevel.PUBLIC);
    assertEquals("@MainActor public static func reset() {\n}",
                 f.generateCode());

    Function g = new Function("swap", b -> {}).mutating()
                        .generic("T", "U: Equatable");
    assertEquals("mutating func swap<T, U: Equatable>() {\n}",
                 g.generateCode());
  }

  @Test
  public void testParameterForms() {
    Function f = new Function("apply", b -> {}).parameters(
        Parameter.unlabeled("values", "Int").variadic(),
        Parameter.labeled("to", "target", "[Int]").inout(),
        Parameter.labeled("using", "transform", "(Int) -> Int")
                 .attribute("escaping"),
        Parameter.labeled("times", "count", "Int")
                 .defaultValue(Literal.integer(1)));
    assertEquals("func apply(_ values: Int..., to target: inout [Int], " +
        "using transform: @escaping (Int) -> Int, times count: Int = 1) {\n}",
        f.generateCode());
  }

  @Test
  public void testInitializer() {
    Initializer init = new Initializer(
        Arrays.asList(Parameter.named("value", "Int")),
        b -> b.add(new Assignment(new PropertyAccessExp("self", "value"),
                                  new VariableExp("value"))))
        .failable().throwing();
    assertEquals("init?(value: Int) throws {\n" +
                 "    self.value = value\n" +
                 "}", init.generateCode());
  }

  @Test
  public void testVariables() {
    Variable shared = Variable.constant("shared", new Call("Cache"))
                          .type("Cache").staticMember();
    assertEquals("static let shared: Cache = Cache()",
                 shared.generateCode());

    Variable published = new Variable(VariableKind.VAR, "name", "String")
        .attribute("Published").access(AccessLevel.PRIVATE);
    assertEquals("@Published private var name: String",
                 published.generateCode());
  }

  @Test
  public void testTypeAliasAndImport() {
    TypeAlias alias = new TypeAlias("Handler", "(T) -> Void")
                         .generic("T").access(AccessLevel.PUBLIC);
    assertEquals("public typealias Handler<T> = (T) -> Void",
                 alias.generateCode());

    assertEquals("import Foundation",
                 new Import("Foundation").generateCode());
    assertEquals("@testable import App",
                 new Import("App").attribute("testable").generateCode());
  }

  @Test
  public void testGroupWithLines() {
    Group g = new Group(
        Line.comment("MARK: - Models"),
        Line.blank(),
        new Struct("A"),
        Line.raw("#if DEBUG"),
        Line.doc(""),
        Line.raw("#endif"));
    assertEquals("// MARK: - Models\n" +
                 "\n" +
                 "struct A {\n" +
                 "}\n" +
                 "#if DEBUG\n" +
                 "///\n" +
                 "#endif", g.generateCode());
  }

  @Test
  public void testNestingThreeLevels() {
    Struct outer = new Struct("Outer", b -> {
      b.add(new EnumDecl("Inner", new EnumCase("a")));
      b.add(new Function("run", fb ->
          fb.add(new If(new VariableExp("flag"), ib ->
              ib.add(new Call("print", Argument.of(Literal.string("x"))))))));
    });
    String expected = "struct Outer {\n" +
                      "    enum Inner {\n" +
                      "        case a\n" +
                      "    }\n" +
                      "    func run() {\n" +
                      "        if flag {\n" +
                      "            print(\"x\")\n" +
                      "        }\n" +
                      "    }\n" +
                      "}";
    assertEquals(expected, outer.generateCode());

    assertEquals("Indentation width is configurable",
        expected.replace("    ", "  "), Renderer.render(outer, 2));
  }
}
