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

import exm.skit.tree.Capture.CaptureStrength;

/**
 * Reference to a named value.  As a pattern it binds the name.
 */
public class VariableExp extends Expression
                         implements PatternConvertible
{
  private final String name;

  public VariableExp(String name)
  {
    this.name = name;
  }

  public String getName()
  {
    return name;
  }

  public OptionalChainingExp optional()
  {
    return new OptionalChainingExp(this);
  }

  public ReferenceExp reference(CaptureStrength strength)
  {
    return new ReferenceExp(this, strength);
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.VARIABLE_REF;
  }

  @Override
  public void appendExpr(SourceBuilder sb)
  {
    sb.append(name);
  }

  @Override
  public void appendPattern(SourceBuilder sb)
  {
    sb.append(name);
  }
}
