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

import java.util.Arrays;

import exm.skit.builder.Blocks;
import exm.skit.builder.BlockBuilder;
import exm.skit.builder.NodeSequence;

/**
 * Nominal type declaration with a member body:
 * struct, class, enum, protocol or extension.
 */
public abstract class TypeDecl<T extends TypeDecl<T>>
                extends Declaration<T>
{
  protected final String name;
  protected final NodeSequence members;

  protected TypeDecl(String name, NodeSequence members,
                     DeclTraits traits)
  {
    super(traits);
    this.name = name;
    this.members = members;
  }

  protected abstract String keyword();

  /** Copy of this declaration with a different member list */
  protected abstract T withMembers(NodeSequence newMembers);

  public String getName()
  {
    return name;
  }

  public NodeSequence getMembers()
  {
    return members;
  }

  public T inherits(String... types)
  {
    return withTraits(traits.withInherited(Arrays.asList(types)));
  }

  public T generic(String... params)
  {
    return withTraits(traits.withGenerics(Arrays.asList(params)));
  }

  /**
   * Append further members after the existing ones
   */
  public T members(BlockBuilder more)
  {
    return withMembers(members.concat(Blocks.of(more)));
  }

  public T members(SwiftTree... more)
  {
    return withMembers(members.concat(Arrays.asList(more)));
  }

  /** Modifiers between access level and keyword, e.g. "final " */
  protected String modifiers()
  {
    return "";
  }

  @Override
  public void appendDecl(SourceBuilder sb)
  {
    traits.appendLeading(sb);
    sb.append(modifiers());
    sb.append(keyword());
    sb.append(' ');
    sb.append(name);
    traits.appendGenerics(sb);
    traits.appendInheritance(sb);
    sb.append(' ');
    Renderer.appendDeclBlock(sb, members.asList(),
                             keyword() + " " + name);
    sb.newline();
  }
}
