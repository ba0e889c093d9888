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
 * Read-only computed property: var name: T { body }
 */
public class ComputedProperty extends Declaration<ComputedProperty>
{
  private final String name;
  private final String type;
  private final NodeSequence body;
  private final boolean isStatic;

  public ComputedProperty(String name, String type, BlockBuilder body)
  {
    this(name, type, Blocks.of(body), false, DeclTraits.EMPTY);
  }

  private ComputedProperty(String name, String type, NodeSequence body,
                           boolean isStatic, DeclTraits traits)
  {
    super(traits);
    this.name = name;
    this.type = type;
    this.body = body;
    this.isStatic = isStatic;
  }

  public ComputedProperty staticMember()
  {
    return new ComputedProperty(name, type, body, true, traits);
  }

  @Override
  protected ComputedProperty withTraits(DeclTraits newTraits)
  {
    return new ComputedProperty(name, type, body, isStatic, newTraits);
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.COMPUTED_PROPERTY;
  }

  @Override
  public void appendDecl(SourceBuilder sb)
  {
    traits.appendLeading(sb);
    if (isStatic) {
      sb.append("static ");
    }
    sb.append("var ").append(name).append(": ").append(type).append(' ');
    sb.appendBlock(body.asList());
    sb.newline();
  }
}
