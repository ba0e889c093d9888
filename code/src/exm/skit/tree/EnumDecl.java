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
 * Enum declaration.  Raw value type and protocol conformances both
 * go in the inheritance list, in the order given.
 */
public class EnumDecl extends TypeDecl<EnumDecl>
{
  public EnumDecl(String name, SwiftTree... cases)
  {
    this(name, NodeSequence.of(cases), DeclTraits.EMPTY);
  }

  public EnumDecl(String name, BlockBuilder cases)
  {
    this(name, Blocks.of(cases), DeclTraits.EMPTY);
  }

  private EnumDecl(String name, NodeSequence cases, DeclTraits traits)
  {
    super(name, cases, traits);
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.ENUM;
  }

  @Override
  protected String keyword()
  {
    return "enum";
  }

  @Override
  protected EnumDecl withTraits(DeclTraits newTraits)
  {
    return new EnumDecl(name, members, newTraits);
  }

  @Override
  protected EnumDecl withMembers(NodeSequence newMembers)
  {
    return new EnumDecl(name, newMembers, traits);
  }
}
