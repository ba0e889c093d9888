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
 * Protocol declaration.  Members are usually requirements:
 * {@link FunctionRequirement}, {@link PropertyRequirement} and
 * {@link AssociatedType}.
 */
public class Protocol extends TypeDecl<Protocol>
{
  public Protocol(String name, SwiftTree... requirements)
  {
    this(name, NodeSequence.of(requirements), DeclTraits.EMPTY);
  }

  public Protocol(String name, BlockBuilder requirements)
  {
    this(name, Blocks.of(requirements), DeclTraits.EMPTY);
  }

  private Protocol(String name, NodeSequence requirements,
                   DeclTraits traits)
  {
    super(name, requirements, traits);
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.PROTOCOL;
  }

  @Override
  protected String keyword()
  {
    return "protocol";
  }

  @Override
  protected Protocol withTraits(DeclTraits newTraits)
  {
    return new Protocol(name, members, newTraits);
  }

  @Override
  protected Protocol withMembers(NodeSequence newMembers)
  {
    return new Protocol(name, newMembers, traits);
  }
}
