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

/**
 * Protocol associated type.  Constraints are joined with " &amp; ".
 */
public class AssociatedType extends Declaration<AssociatedType>
{
  private final String name;

  public AssociatedType(String name)
  {
    this(name, DeclTraits.EMPTY);
  }

  private AssociatedType(String name, DeclTraits traits)
  {
    super(traits);
    this.name = name;
  }

  public AssociatedType inherits(String... types)
  {
    return withTraits(traits.withInherited(Arrays.asList(types)));
  }

  @Override
  protected AssociatedType withTraits(DeclTraits newTraits)
  {
    return new AssociatedType(name, newTraits);
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.ASSOCIATED_TYPE;
  }

  @Override
  public void appendDecl(SourceBuilder sb)
  {
    traits.appendLeading(sb);
    sb.append("associatedtype ").append(name);
    traits.appendInheritance(sb, " & ");
    sb.newline();
  }
}
