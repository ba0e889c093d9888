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

public class Return extends SwiftTree
{
  /** null for a bare return */
  private final ExprConvertible value;

  public Return()
  {
    this(null);
  }

  public Return(ExprConvertible value)
  {
    this.value = value;
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.RETURN;
  }

  @Override
  public void appendTo(SourceBuilder sb)
  {
    sb.indent();
    sb.append("return");
    if (value != null) {
      sb.append(' ');
      value.appendExpr(sb);
    }
    sb.newline();
  }
}
