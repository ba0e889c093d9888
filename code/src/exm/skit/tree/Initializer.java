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
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.skit.builder.Blocks;
import exm.skit.builder.BlockBuilder;
import exm.skit.builder.NodeSequence;

public class Initializer extends Declaration<Initializer>
{
  private final ImmutableList<Parameter> params;
  private final NodeSequence body;
  private final EffectSpecifier effects;
  private final boolean failable;

  public Initializer(List<Parameter> params, BlockBuilder body)
  {
    this(ImmutableList.copyOf(params), Blocks.of(body),
         EffectSpecifier.NONE, false, DeclTraits.EMPTY);
  }

  public Initializer(BlockBuilder body)
  {
    this(ImmutableList.<Parameter>of(), body);
  }

  private Initializer(ImmutableList<Parameter> params, NodeSequence body,
                      EffectSpecifier effects, boolean failable,
                      DeclTraits traits)
  {
    super(traits);
    this.params = params;
    this.body = body;
    this.effects = effects;
    this.failable = failable;
  }

  public Initializer parameters(Parameter... more)
  {
    ImmutableList<Parameter> ps = ImmutableList.<Parameter>builder()
        .addAll(params).addAll(Arrays.asList(more)).build();
    return new Initializer(ps, body, effects, failable, traits);
  }

  /** init? */
  public Initializer failable()
  {
    return new Initializer(params, body, effects, true, traits);
  }

  public Initializer async()
  {
    return new Initializer(params, body, effects.withAsync(), failable,
                           traits);
  }

  public Initializer throwing()
  {
    return new Initializer(params, body, effects.withThrows(), failable,
                           traits);
  }

  public Initializer throwing(String errorType)
  {
    return new Initializer(params, body, effects.withThrows(errorType),
                           failable, traits);
  }

  @Override
  protected Initializer withTraits(DeclTraits newTraits)
  {
    return new Initializer(params, body, effects, failable, newTraits);
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.INITIALIZER;
  }

  @Override
  public void appendDecl(SourceBuilder sb)
  {
    traits.appendLeading(sb);
    sb.append("init");
    if (failable) {
      sb.append('?');
    }
    traits.appendGenerics(sb);
    Parameter.appendClause(sb, params);
    effects.appendTo(sb);
    sb.append(' ');
    sb.appendBlock(body.asList());
    sb.newline();
  }
}
