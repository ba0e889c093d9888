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
import static org.junit.Assert.assertTrue;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.skit.common.exceptions.DslMisuseError;

public class EffectSpecifierTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static String fn(Function f) {
    return f.generateCode();
  }

  private static Function load() {
    return new Function("load", b -> {});
  }

  @Test
  public void testNoEffects() {
    assertTrue(EffectSpecifier.NONE.isEmpty());
    assertEquals("func load() {\n}", fn(load()));
  }

  @Test
  public void testAsyncPrecedesThrows() {
    assertEquals("func load() async throws {\n}",
                 fn(load().async().throwing()));
    assertEquals("Order of decorators does not matter",
                 "func load() async throws {\n}",
                 fn(load().throwing().async()));
  }

  @Test
  public void testTypedThrows() {
    assertEquals("func load() throws(LoadError) {\n}",
                 fn(load().throwing("LoadError")));
    assertEquals("func load() async throws(LoadError) {\n}",
                 fn(load().throwing("LoadError").async()));
  }

  @Test
  public void testRethrows() {
    assertEquals("func load() rethrows {\n}", fn(load().rethrowing()));
    assertEquals("func load() async rethrows {\n}",
                 fn(load().async().rethrowing()));
  }

  @Test
  public void testTypedRethrowsRejected() {
    exception.expect(DslMisuseError.class);
    load().throwing("LoadError").rethrowing();
  }

  @Test
  public void testToString() {
    assertEquals("async throws(E)",
        EffectSpecifier.NONE.withThrows("E").withAsync().toString());
  }

  @Test
  public void testCallSiteEffects() {
    assertEquals("try await fetch()",
        Renderer.renderExpr(new Call("fetch").async().throwing()));
    assertEquals("await fetch()",
        Renderer.renderExpr(new Call("fetch").async()));
    assertEquals("try fetch()",
        Renderer.renderExpr(new Call("fetch").throwing()));
  }
}
