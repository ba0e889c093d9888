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
 * Ternary: condition ? then : otherwise
 */
public class ConditionalOp extends Expression
{
  private final ExprConvertible condition;
  private final ExprConvertible then;
  private final ExprConvertible otherwise;

  public ConditionalOp(ExprConvertible condition, ExprConvertible then,
                       ExprConvertible otherwise)
  {
    this.condition = condition;
    this.then = then;
    this.otherwise = otherwise;
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.CONDITIONAL_OP;
  }

  @Override
  public void appendExpr(SourceBuilder sb)
  {
    Renderer.appendOperand(sb, condition, false);
    sb.append(" ? ");
    Renderer.appendOperand(sb, then, false);
    sb.append(" : ");
    Renderer.appendOperand(sb, otherwise, false);
  }
}
