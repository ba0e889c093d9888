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
 * Base class for nodes whose primary role is an expression.
 * Used as a statement, an expression takes one line.
 */
public abstract class Expression extends SwiftTree
                                 implements ExprConvertible
{
  /** this.name */
  public PropertyAccessExp property(String name)
  {
    return new PropertyAccessExp(this, name);
  }

  /** this.method(args) */
  public Call call(String method, Argument... args)
  {
    return Call.method(this, method, args);
  }

  @Override
  public void appendTo(SourceBuilder sb)
  {
    sb.indent();
    appendExpr(sb);
    sb.newline();
  }
}
