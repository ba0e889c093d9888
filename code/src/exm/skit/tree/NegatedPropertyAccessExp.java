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

/**
 * Logical negation of a value: !base
 */
public class NegatedPropertyAccessExp extends Expression
{
  private final ExprConvertible base;

  public NegatedPropertyAccessExp(ExprConvertible base)
  {
    this.base = base;
  }

  public NegatedPropertyAccessExp(String base, String property)
  {
    this(new PropertyAccessExp(base, property));
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.NEGATED_PROPERTY_ACCESS;
  }

  @Override
  public void appendExpr(SourceBuilder sb)
  {
    sb.append('!');
    Renderer.appendOperand(sb, base, true);
  }
}
