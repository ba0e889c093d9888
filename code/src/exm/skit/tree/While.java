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
 * while and repeat-while loops
 */
public class While extends SwiftTree
{
  private final SwiftTree condition;
  private final NodeSequence body;
  /** true for repeat { } while c */
  private final boolean repeat;

  public While(SwiftTree condition, BlockBuilder body)
  {
    this(condition, Blocks.of(body), false);
  }

  /**
   * @param condition must produce exactly one expression
   */
  public While(BlockBuilder condition, BlockBuilder body)
  {
    this(singleCondition(condition), Blocks.of(body), false);
  }

  private While(SwiftTree condition, NodeSequence body, boolean repeat)
  {
    this.condition = condition;
    this.body = body;
    this.repeat = repeat;
  }

  public static While repeatWhile(BlockBuilder body, SwiftTree condition)
  {
    return new While(condition, Blocks.of(body), true);
  }

  public static While repeatWhile(BlockBuilder body,
                                  BlockBuilder condition)
  {
    return new While(singleCondition(condition), Blocks.of(body), true);
  }

  private static SwiftTree singleCondition(BlockBuilder condition)
  {
    ExprConvertible expr = Blocks.expression("While", condition);
    return Renderer.asTree(expr, "While");
  }

  @Override
  public NodeKind kind()
  {
    return repeat ? NodeKind.REPEAT_WHILE : NodeKind.WHILE;
  }

  @Override
  public void appendTo(SourceBuilder sb)
  {
    sb.indent();
    if (repeat) {
      sb.append("repeat ");
      sb.appendBlock(body.asList());
      sb.append(" while ");
      Renderer.appendCondition(sb, condition, "While");
    } else {
      sb.append("while ");
      Renderer.appendCondition(sb, condition, "While");
      sb.append(' ');
      sb.appendBlock(body.asList());
    }
    sb.newline();
  }
}
