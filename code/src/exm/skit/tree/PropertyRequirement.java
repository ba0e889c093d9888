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

/**
 * Protocol property requirement: var name: T { get } or { get set }
 */
public class PropertyRequirement extends Declaration<PropertyRequirement>
{
  public static enum Accessors
  {
    GET("{ get }"),
    GET_SET("{ get set }");

    private final String text;

    private Accessors(String text)
    {
      this.text = text;
    }
  }

  private final String name;
  private final String type;
  private final Accessors accessors;
  private final boolean isStatic;

  public PropertyRequirement(String name, String type,
                             Accessors accessors)
  {
    this(name, type, accessors, false, DeclTraits.EMPTY);
  }

  private PropertyRequirement(String name, String type,
        Accessors accessors, boolean isStatic, DeclTraits traits)
  {
    super(traits);
    this.name = name;
    this.type = type;
    this.accessors = accessors;
    this.isStatic = isStatic;
  }

  public PropertyRequirement staticMember()
  {
    return new PropertyRequirement(name, type, accessors, true, traits);
  }

  @Override
  protected PropertyRequirement withTraits(DeclTraits newTraits)
  {
    return new PropertyRequirement(name, type, accessors, isStatic,
                                   newTraits);
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.PROPERTY_REQUIREMENT;
  }

  @Override
  public void appendDecl(SourceBuilder sb)
  {
    traits.appendLeading(sb);
    if (isStatic) {
      sb.append("static ");
    }
    sb.append("var ").append(name).append(": ").append(type);
    sb.append(' ').append(accessors.text);
    sb.newline();
  }
}
