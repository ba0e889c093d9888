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

public class Struct extends TypeDecl<Struct>
{
  public Struct(String name, SwiftTree... members)
  {
    this(name, NodeSequence.of(members), DeclTraits.EMPTY);
  }

  public Struct(String name, BlockBuilder members)
  {
    this(name, Blocks.of(members), DeclTraits.EMPTY);
  }

  private Struct(String name, NodeSequence members, DeclTraits traits)
  {
    super(name, members, traits);
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.STRUCT;
  }

  @Override
  protected String keyword()
  {
    return "struct";
  }

  @Override
  protected Struct withTraits(DeclTraits newTraits)
  {
    return new Struct(name, members, newTraits);
  }

  @Override
  protected Struct withMembers(NodeSequence newMembers)
  {
    return new Struct(name, newMembers, traits);
  }
}
