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

import exm.skit.builder.Blocks;
import exm.skit.builder.BlockBuilder;
import exm.skit.builder.NodeSequence;

/**
 * Parenthesized, comma separated elements.  Usable as an expression
 * or, when every element is a pattern, as a tuple pattern.
 */
public class Tuple extends Expression implements PatternConvertible
{
  private final NodeSequence elements;

  public Tuple(SwiftTree... elements)
  {
    this(NodeSequence.of(elements));
  }

  public Tuple(BlockBuilder elements)
  {
    this(Blocks.of(elements));
  }

  public Tuple(NodeSequence elements)
  {
    this.elements = elements;
  }

  public NodeSequence getElements()
  {
    return elements;
  }

  /**
   * @return number of elements, not counting placeholders
   */
  public int arity()
  {
    return elements.countContent();
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.TUPLE;
  }

  @Override
  public void appendExpr(SourceBuilder sb)
  {
    sb.append('(');
    Renderer.appendExprList(sb, elements.asList(), "Tuple");
    sb.append(')');
  }

  @Override
  public void appendPattern(SourceBuilder sb)
  {
    sb.append('(');
    Renderer.appendPatternList(sb, elements.asList(), "Tuple");
    sb.append(')');
  }
}
