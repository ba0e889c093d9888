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
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.skit.common.exceptions.DslMisuseError;

public class TupleAssignmentTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static final List<String> XY = Arrays.asList("x", "y");

  private static Tuple oneTwo() {
    return new Tuple(Literal.integer(1), Literal.integer(2));
  }

  private static Tuple fetches() {
    return new Tuple(new Call("fetchData"), new Call("fetchPosts"));
  }

  @Test
  public void testSync() {
    assertEquals("let (x, y) = (1, 2)",
                 new TupleAssignment(XY, oneTwo()).generateCode());
  }

  @Test
  public void testAllModes() {
    List<String> names = Arrays.asList("data", "posts");
    assertEquals("let (data, posts) = await (fetchData(), fetchPosts())",
        new TupleAssignment(names, fetches(), TupleAssignMode.ASYNC)
            .generateCode());
    assertEquals("let (data, posts) = try (fetchData(), fetchPosts())",
        new TupleAssignment(names, fetches(), TupleAssignMode.THROWING)
            .generateCode());
    assertEquals("let (data, posts) = try await (fetchData(), fetchPosts())",
        new TupleAssignment(names, fetches(),
                            TupleAssignMode.ASYNC_THROWING).generateCode());
    assertEquals(
        "async let (data, posts) = try await (fetchData(), fetchPosts())",
        new TupleAssignment(names, fetches(),
                            TupleAssignMode.CONCURRENT_ASYNC).generateCode());
  }

  @Test
  public void testDecoratorsCombineModes() {
    TupleAssignment t = new TupleAssignment(XY, oneTwo());
    assertEquals(TupleAssignMode.ASYNC, t.async().getMode());
    assertEquals(TupleAssignMode.THROWING, t.throwing().getMode());
    assertEquals(TupleAssignMode.ASYNC_THROWING,
                 t.async().throwing().getMode());
    assertEquals(TupleAssignMode.ASYNC_THROWING,
                 t.throwing().async().getMode());
    assertEquals(TupleAssignMode.CONCURRENT_ASYNC,
                 t.concurrent().throwing().getMode());
    assertEquals("Original unchanged", TupleAssignMode.SYNC, t.getMode());
  }

  @Test
  public void testTooFewNames() {
    exception.expect(DslMisuseError.class);
    new TupleAssignment(Arrays.asList("x"), oneTwo());
  }

  @Test
  public void testTooManyNames() {
    exception.expect(DslMisuseError.class);
    new TupleAssignment(Arrays.asList("x", "y", "z"), oneTwo());
  }

  @Test
  public void testPlaceholdersNotCounted() {
    Tuple t = new Tuple(b -> {
      b.add(Literal.integer(1));
      b.optional(null);
      b.add(Literal.integer(2));
    });
    assertEquals(2, t.arity());
    assertEquals("let (x, y) = (1, 2)",
                 new TupleAssignment(XY, t).generateCode());
  }
}
