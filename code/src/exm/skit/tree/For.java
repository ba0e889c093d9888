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
 * for pattern in sequence where guard { ... }
 */
public class For extends SwiftTree
{
  private final SwiftTree pattern;
  private final ExprConvertible sequence;
  /** null if none */
  private final ExprConvertible whereClause;
  private final NodeSequence body;

  public For(SwiftTree pattern, ExprConvertible sequence,
             BlockBuilder body)
  {
    this(pattern, sequence, null, Blocks.of(body));
  }

  public For(String name, ExprConvertible sequence, BlockBuilder body)
  {
    this(new VariableExp(name), sequence, body);
  }

  /**
   * @param pattern must produce exactly one pattern
   */
  public For(BlockBuilder pattern, ExprConvertible sequence,
             BlockBuilder body)
  {
    this(Renderer.asTree(Blocks.pattern("For", pattern), "For"),
         sequence, null, Blocks.of(body));
  }

  private For(SwiftTree pattern, ExprConvertible sequence,
              ExprConvertible whereClause, NodeSequence body)
  {
    this.pattern = pattern;
    this.sequence = sequence;
    this.whereClause = whereClause;
    this.body = body;
  }

  public For where(ExprConvertible condition)
  {
    return new For(pattern, sequence, condition, body);
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.FOR;
  }

  @Override
  public void appendTo(SourceBuilder sb)
  {
    sb.indent();
    sb.append("for ");
    Renderer.appendPattern(sb, pattern, "For");
    sb.append(" in ");
    sequence.appendExpr(sb);
    if (whereClause != null) {
      sb.append(" where ");
      whereClause.appendExpr(sb);
    }
    sb.append(' ');
    sb.appendBlock(body.asList());
    sb.newline();
  }
}
