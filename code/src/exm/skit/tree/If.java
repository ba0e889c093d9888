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
import exm.skit.common.exceptions.DslMisuseError;

/**
 * if c1, c2 { ... } else { ... }
 *
 * An else body made of a single If renders as else if.  An empty else
 * body renders no else clause at all.
 */
public class If extends SwiftTree
{
  private final NodeSequence conditions;
  private final NodeSequence thenBody;
  private final NodeSequence elseBody;

  public If(SwiftTree condition, BlockBuilder thenBody)
  {
    this(NodeSequence.of(condition), thenBody, null);
  }

  public If(SwiftTree condition, BlockBuilder thenBody,
            BlockBuilder elseBody)
  {
    this(NodeSequence.of(condition), thenBody, elseBody);
  }

  /**
   * @param conditions one or more, joined with commas
   * @param elseBody may be null
   */
  public If(NodeSequence conditions, BlockBuilder thenBody,
            BlockBuilder elseBody)
  {
    this(conditions, Blocks.of(thenBody), Blocks.of(elseBody));
  }

  private If(NodeSequence conditions, NodeSequence thenBody,
             NodeSequence elseBody)
  {
    if (conditions.countContent() == 0) {
      throw new DslMisuseError("If", "no conditions given");
    }
    this.conditions = conditions;
    this.thenBody = thenBody;
    this.elseBody = elseBody;
  }

  public If otherwise(BlockBuilder body)
  {
    return new If(conditions, thenBody, Blocks.of(body));
  }

  public NodeSequence getElseBody()
  {
    return elseBody;
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.IF;
  }

  @Override
  public void appendTo(SourceBuilder sb)
  {
    sb.indent();
    appendIf(sb);
    sb.newline();
  }

  /**
   * The if statement without leading indentation or final newline,
   * so it can continue an else clause
   */
  private void appendIf(SourceBuilder sb)
  {
    sb.append("if ");
    Renderer.appendConditionList(sb, conditions.asList(), "If");
    sb.append(' ');
    sb.appendBlock(thenBody.asList());
    if (elseBody.isEmpty()) {
      return;
    }
    sb.append(" else ");
    if (elseBody.size() == 1 && elseBody.get(0) instanceof If) {
      ((If)elseBody.get(0)).appendIf(sb);
    } else {
      sb.appendBlock(elseBody.asList());
    }
  }
}
