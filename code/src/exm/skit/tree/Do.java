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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.skit.builder.Blocks;
import exm.skit.builder.BlockBuilder;
import exm.skit.builder.NodeSequence;
import exm.skit.common.exceptions.DslMisuseError;

/**
 * do { ... } catch p { ... }
 */
public class Do extends SwiftTree
{
  private final NodeSequence body;
  private final ImmutableList<Catch> catches;

  public Do(BlockBuilder body, Catch... catches)
  {
    this.body = Blocks.of(body);
    this.catches = ImmutableList.copyOf(Arrays.asList(catches));
  }

  /**
   * @param catches must produce only Catch nodes or placeholders
   */
  public Do(BlockBuilder body, BlockBuilder catches)
  {
    this.body = Blocks.of(body);
    List<Catch> cs = new ArrayList<Catch>();
    for (SwiftTree node: Blocks.of(catches)) {
      if (node instanceof Catch) {
        cs.add((Catch)node);
      } else if (node.kind() != NodeKind.EMPTY) {
        throw new DslMisuseError("Do",
            "expected catch clauses, got " + node.kind());
      }
    }
    this.catches = ImmutableList.copyOf(cs);
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.DO;
  }

  @Override
  public void appendTo(SourceBuilder sb)
  {
    sb.indent();
    sb.append("do ");
    sb.appendBlock(body.asList());
    for (Catch c: catches) {
      sb.append(' ');
      c.appendClause(sb);
    }
    sb.newline();
  }
}
