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
 * Extension of an existing type.  Conformances added with
 * inherits() render as extension Name: P.
 */
public class Extension extends TypeDecl<Extension>
{
  public Extension(String extendedType, SwiftTree... members)
  {
    this(extendedType, NodeSequence.of(members), DeclTraits.EMPTY);
  }

  public Extension(String extendedType, BlockBuilder members)
  {
    this(extendedType, Blocks.of(members), DeclTraits.EMPTY);
  }

  private Extension(String extendedType, NodeSequence members,
                    DeclTraits traits)
  {
    super(extendedType, members, traits);
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.EXTENSION;
  }

  @Override
  protected String keyword()
  {
    return "extension";
  }

  @Override
  protected Extension withTraits(DeclTraits newTraits)
  {
    return new Extension(name, members, newTraits);
  }

  @Override
  protected Extension withMembers(NodeSequence newMembers)
  {
    return new Extension(name, newMembers, traits);
  }
}
