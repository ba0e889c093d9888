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
 * case p1, p2 where guard:
 */
public class SwitchCase extends SwiftTree
{
  private final NodeSequence patterns;
  /** null if none */
  private final ExprConvertible guard;
  private final NodeSequence body;

  public SwitchCase(SwiftTree pattern, BlockBuilder body)
  {
    this(NodeSequence.of(pattern), body);
  }

  public SwitchCase(NodeSequence patterns, BlockBuilder body)
  {
    this(patterns, null, Blocks.of(body));
  }

  private SwitchCase(NodeSequence patterns, ExprConvertible guard,
                     NodeSequence body)
  {
    if (patterns.countContent() == 0) {
      throw new DslMisuseError("SwitchCase", "no patterns given");
    }
    this.patterns = patterns;
    this.guard = guard;
    this.body = body;
  }

  public SwitchCase where(ExprConvertible condition)
  {
    return new SwitchCase(patterns, condition, body);
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.SWITCH_CASE;
  }

  @Override
  public void appendTo(SourceBuilder sb)
  {
    sb.indent();
    sb.append("case ");
    Renderer.appendPatternList(sb, patterns.asList(), "SwitchCase");
    if (guard != null) {
      sb.append(" where ");
      guard.appendExpr(sb);
    }
    sb.append(':');
    sb.newline();
    sb.appendBody(body.asList());
  }
}
