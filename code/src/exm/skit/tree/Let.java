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
 * Optional binding condition: let name = value.
 * Written on its own it is a plain constant declaration.
 */
public class Let extends SwiftTree implements ConditionConvertible
{
  private final String name;
  private final ExprConvertible value;

  public Let(String name, ExprConvertible value)
  {
    this.name = name;
    this.value = value;
  }

  /** Shorthand binding of the same name: if let x */
  public Let(String name)
  {
    this(name, null);
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.LET;
  }

  @Override
  public void appendCondition(SourceBuilder sb)
  {
    sb.append("let ").append(name);
    if (value != null) {
      sb.append(" = ");
      value.appendExpr(sb);
    }
  }

  @Override
  public void appendTo(SourceBuilder sb)
  {
    sb.indent();
    appendCondition(sb);
    sb.newline();
  }
}
