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
 * Sequence of items rendered one after another at the same level,
 * with no surrounding syntax.  A whole generated file is typically
 * one Group.
 */
public class Group extends SwiftTree implements DeclConvertible
{
  private final NodeSequence members;

  public Group(SwiftTree... members)
  {
    this(NodeSequence.of(members));
  }

  public Group(BlockBuilder members)
  {
    this(Blocks.of(members));
  }

  public Group(NodeSequence members)
  {
    this.members = members;
  }

  public NodeSequence getMembers()
  {
    return members;
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.GROUP;
  }

  @Override
  public void appendDecl(SourceBuilder sb)
  {
    for (SwiftTree member: members) {
      member.appendTo(sb);
    }
  }

  @Override
  public void appendTo(SourceBuilder sb)
  {
    appendDecl(sb);
  }
}
