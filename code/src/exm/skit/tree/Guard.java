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
 * guard c1, c2 else { ... }
 */
public class Guard extends SwiftTree
{
  private final NodeSequence conditions;
  private final NodeSequence elseBody;

  public Guard(SwiftTree condition, BlockBuilder elseBody)
  {
    this(NodeSequence.of(condition), elseBody);
  }

  public Guard(NodeSequence conditions, BlockBuilder elseBody)
  {
    if (conditions.countContent() == 0) {
      throw new DslMisuseError("Guard", "no conditions given");
    }
    this.conditions = conditions;
    this.elseBody = Blocks.of(elseBody);
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.GUARD;
  }

  @Override
  public void appendTo(SourceBuilder sb)
  {
    sb.indent();
    sb.append("guard ");
    Renderer.appendConditionList(sb, conditions.asList(), "Guard");
    sb.append(" else ");
    sb.appendBlock(elseBody.asList());
    sb.newline();
  }
}
