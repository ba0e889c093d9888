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
 * Catch clause of a {@link Do}.  Without a pattern it catches
 * everything and binds error.
 */
public class Catch extends SwiftTree
{
  /** null for a bare catch */
  private final SwiftTree pattern;
  private final NodeSequence body;

  public Catch(BlockBuilder body)
  {
    this(null, body);
  }

  public Catch(SwiftTree pattern, BlockBuilder body)
  {
    this.pattern = pattern;
    this.body = Blocks.of(body);
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.CATCH;
  }

  /**
   * Append "catch pattern { ... }" continuing the current line
   */
  void appendClause(SourceBuilder sb)
  {
    sb.append("catch");
    if (pattern != null) {
      sb.append(' ');
      Renderer.appendPattern(sb, pattern, "Catch");
    }
    sb.append(' ');
    sb.appendBlock(body.asList());
  }

  @Override
  public void appendTo(SourceBuilder sb)
  {
    sb.indent();
    appendClause(sb);
    sb.newline();
  }
}
