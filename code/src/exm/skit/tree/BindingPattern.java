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
 * Value binding pattern: let x or var x
 */
public class BindingPattern extends SwiftTree
                            implements PatternConvertible
{
  private final String name;
  private final boolean mutable;

  public BindingPattern(String name)
  {
    this(name, false);
  }

  public BindingPattern(String name, boolean mutable)
  {
    this.name = name;
    this.mutable = mutable;
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.BINDING_PATTERN;
  }

  @Override
  public void appendPattern(SourceBuilder sb)
  {
    sb.append(mutable ? "var " : "let ");
    sb.append(name);
  }

  @Override
  public void appendTo(SourceBuilder sb)
  {
    sb.indent();
    appendPattern(sb);
    sb.newline();
  }
}
