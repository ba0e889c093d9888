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
package exm.skit.builder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.skit.common.exceptions.DslMisuseError;
import exm.skit.tree.EmptyNode;
import exm.skit.tree.EnumCase;
import exm.skit.tree.EnumDecl;
import exm.skit.tree.ExprConvertible;
import exm.skit.tree.Literal;
import exm.skit.tree.NodeKind;
import exm.skit.tree.PatternConvertible;
import exm.skit.tree.Return;
import exm.skit.tree.SwiftTree;
import exm.skit.tree.VariableExp;

public class SequenceBuilderTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static EnumCase c(String name) {
    return new EnumCase(name);
  }

  private static String names(NodeSequence seq) {
    StringBuilder sb = new StringBuilder();
    for (SwiftTree node: seq) {
      if (sb.length() > 0) {
        sb.append(' ');
      }
      if (node instanceof EnumCase) {
        sb.append(((EnumCase)node).getName());
      } else {
        sb.append(node.kind());
      }
    }
    return sb.toString();
  }

  @Test
  public void testOrderAndDuplicates() {
    NodeSequence seq = Blocks.of(b -> {
      b.add(c("a"));
      b.add(c("b"), c("a"));
      b.addAll(Arrays.asList(c("c"), c("b")));
    });
    assertEquals("a b a c b", names(seq));
  }

  @Test
  public void testOptional() {
    NodeSequence seq = Blocks.of(b -> {
      b.optional(c("a"));
      b.optional(null);
      b.optional(c("b"));
    });
    assertEquals(3, seq.size());
    assertSame(EmptyNode.INSTANCE, seq.get(1));
    assertEquals(2, seq.countContent());
  }

  @Test
  public void testWhenFalseAddsOnePlaceholder() {
    NodeSequence seq = Blocks.of(b -> {
      b.add(c("a"));
      b.when(false, bb -> bb.add(c("x"), c("y")));
      b.add(c("b"));
    });
    assertEquals("a EMPTY b", names(seq));
  }

  @Test
  public void testWhenTrueFlattens() {
    NodeSequence seq = Blocks.of(b -> {
      b.add(c("a"));
      b.when(true, bb -> bb.add(c("x"), c("y")));
      b.add(c("b"));
    });
    assertEquals("a x y b", names(seq));
  }

  @Test
  public void testEither() {
    NodeSequence first = Blocks.of(b -> b.either(true,
        bb -> bb.add(c("yes")), bb -> bb.add(c("no"), c("never"))));
    NodeSequence second = Blocks.of(b -> b.either(false,
        bb -> bb.add(c("yes")), bb -> bb.add(c("no"), c("never"))));
    assertEquals("yes", names(first));
    assertEquals("no never", names(second));
  }

  @Test
  public void testForEach() {
    List<String> items = Arrays.asList("one", "two", "three");
    NodeSequence seq = Blocks.of(b -> {
      b.add(c("start"));
      b.forEach(items, (SequenceBuilder bb, String s) -> {
        bb.add(c(s));
        bb.when(s.equals("two"), bbb -> bbb.add(c("extra")));
      });
      b.add(c("end"));
    });
    assertEquals("start one EMPTY two extra three EMPTY end", names(seq));
  }

  @Test
  public void testAddNullRejected() {
    exception.expect(DslMisuseError.class);
    exception.expectMessage("optional()");
    Blocks.of(b -> b.add((SwiftTree)null));
  }

  @Test
  public void testNullBuilderIsEmpty() {
    assertTrue(Blocks.of(null).isEmpty());
    assertSame(NodeSequence.empty(), Blocks.of(null));
  }

  @Test
  public void testSequencesAreImmutable() {
    NodeSequence seq = NodeSequence.of(c("a"));
    NodeSequence longer = seq.concat(Arrays.asList(c("b")));
    assertEquals("a", names(seq));
    assertEquals("a b", names(longer));
    exception.expect(UnsupportedOperationException.class);
    seq.asList().add(c("c"));
  }

  @Test
  public void testExpressionBlock() {
    ExprConvertible e = Blocks.expression("test",
                                          b -> b.add(Literal.integer(3)));
    assertEquals(NodeKind.LITERAL, ((SwiftTree)e).kind());
  }

  @Test
  public void testExpressionBlockEmpty() {
    exception.expect(DslMisuseError.class);
    exception.expectMessage("got 0 nodes");
    Blocks.expression("test", b -> {});
  }

  @Test
  public void testExpressionBlockPlaceholder() {
    exception.expect(DslMisuseError.class);
    Blocks.expression("test", b -> b.when(false, bb -> {}));
  }

  @Test
  public void testExpressionBlockWrongKind() {
    exception.expect(DslMisuseError.class);
    exception.expectMessage("expected an expression, got RETURN");
    Blocks.expression("test", b -> b.add(new Return()));
  }

  @Test
  public void testPatternBlock() {
    PatternConvertible p = Blocks.pattern("test",
                                          b -> b.add(new VariableExp("x")));
    assertEquals(NodeKind.VARIABLE_REF, ((SwiftTree)p).kind());
  }

  @Test
  public void testPatternBlockTwoNodes() {
    exception.expect(DslMisuseError.class);
    Blocks.pattern("test", b -> b.add(new VariableExp("x"),
                                      new VariableExp("y")));
  }

  @Test
  public void testBuiltEnumRendersInOrder() {
    final List<String> codes = Arrays.asList("b", "a", "b");
    EnumDecl e = new EnumDecl("E", b -> {
      b.forEach(codes, (SequenceBuilder bb, String s) -> bb.add(c(s)));
      b.when(codes.size() > 5, bb -> bb.add(c("many")));
    });
    assertEquals("enum E {\n" +
                 "    case b\n" +
                 "    case a\n" +
                 "    case b\n" +
                 "}", e.generateCode());
  }
}
