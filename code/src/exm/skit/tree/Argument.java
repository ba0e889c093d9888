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
 * Call argument, optionally labeled
 */
public class Argument
{
  /** null if unlabeled */
  private final String label;
  private final ExprConvertible value;

  private Argument(String label, ExprConvertible value)
  {
    this.label = label;
    this.value = value;
  }

  public static Argument of(ExprConvertible value)
  {
    return new Argument(null, value);
  }

  public static Argument labeled(String label, ExprConvertible value)
  {
    return new Argument(label, value);
  }

  public String getLabel()
  {
    return label;
  }

  public void appendTo(SourceBuilder sb)
  {
    if (label != null) {
      sb.append(label).append(": ");
    }
    value.appendExpr(sb);
  }
}
