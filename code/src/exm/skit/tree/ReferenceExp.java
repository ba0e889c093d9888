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

import exm.skit.common.exceptions.DslMisuseError;
import exm.skit.tree.Capture.CaptureStrength;

/**
 * A value marked with a capture strength.  Renders as the base
 * expression; the strength matters when the reference is turned into
 * a closure {@link Capture}.
 */
public class ReferenceExp extends Expression
{
  private final ExprConvertible base;
  private final CaptureStrength strength;

  public ReferenceExp(ExprConvertible base, CaptureStrength strength)
  {
    this.base = base;
    this.strength = strength;
  }

  public CaptureStrength getStrength()
  {
    return strength;
  }

  /**
   * @return name of the captured variable
   * @throws DslMisuseError if the base is not a plain variable
   */
  public String getCapturedName()
  {
    if (!(base instanceof VariableExp)) {
      throw new DslMisuseError("ReferenceExp",
            "only a plain variable can be captured, got " +
            Renderer.renderExpr(base));
    }
    return ((VariableExp)base).getName();
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.REFERENCE;
  }

  @Override
  public void appendExpr(SourceBuilder sb)
  {
    base.appendExpr(sb);
  }
}
