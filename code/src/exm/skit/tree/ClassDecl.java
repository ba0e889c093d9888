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
 * Swift class declaration.  The first inherited type is by
 * convention the superclass.
 */
public class ClassDecl extends TypeDecl<ClassDecl>
{
  private final boolean isFinal;

  public ClassDecl(String name, SwiftTree... members)
  {
    this(name, NodeSequence.of(members), DeclTraits.EMPTY, false);
  }

  public ClassDecl(String name, BlockBuilder members)
  {
    this(name, Blocks.of(members), DeclTraits.EMPTY, false);
  }

  private ClassDecl(String name, NodeSequence members, DeclTraits traits,
                    boolean isFinal)
  {
    super(name, members, traits);
    this.isFinal = isFinal;
  }

  public ClassDecl finalClass()
  {
    return new ClassDecl(name, members, traits, true);
  }

  public boolean isFinal()
  {
    return isFinal;
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.CLASS;
  }

  @Override
  protected String keyword()
  {
    return "class";
  }

  @Override
  protected String modifiers()
  {
    return isFinal ? "final " : "";
  }

  @Override
  protected ClassDecl withTraits(DeclTraits newTraits)
  {
    return new ClassDecl(name, members, newTraits, isFinal);
  }

  @Override
  protected ClassDecl withMembers(NodeSequence newMembers)
  {
    return new ClassDecl(name, newMembers, traits, isFinal);
  }
}
