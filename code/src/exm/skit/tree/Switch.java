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
 * switch subject { case ...: ... default: ... }
 * Case labels align with the switch keyword.
 */
public class Switch extends SwiftTree
{
  private final ExprConvertible subject;
  private final NodeSequence cases;

  public Switch(ExprConvertible subject, BlockBuilder cases)
  {
    this.subject = subject;
    this.cases = Blocks.of(cases);
  }

  public NodeSequence getCases()
  {
    return cases;
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.SWITCH;
  }

  @Override
  public void appendTo(SourceBuilder sb)
  {
    sb.indent();
    sb.append("switch ");
    subject.appendExpr(sb);
    sb.append(" {\n");
    for (SwiftTree c: cases) {
      c.appendTo(sb);
    }
    sb.indent();
    sb.append('}');
    sb.newline();
  }
}
