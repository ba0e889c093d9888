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

public class TypeAlias extends Declaration<TypeAlias>
{
  private final String name;
  private final String existingType;

  public TypeAlias(String name, String existingType)
  {
    this(name, existingType, DeclTraits.EMPTY);
  }

  private TypeAlias(String name, String existingType, DeclTraits traits)
  {
    super(traits);
    this.name = name;
    this.existingType = existingType;
  }

  public TypeAlias generic(String... params)
  {
    return withTraits(traits.withGenerics(Arrays.asList(params)));
  }

  @Override
  protected TypeAlias withTraits(DeclTraits newTraits)
  {
    return new TypeAlias(name, existingType, newTraits);
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.TYPE_ALIAS;
  }

  @Override
  public void appendDecl(SourceBuilder sb)
  {
    traits.appendLeading(sb);
    sb.append("typealias ").append(name);
    traits.appendGenerics(sb);
    sb.append(" = ").append(existingType);
    sb.newline();
  }
}
