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

/**
 * Function declaration with a body
 */
public class Function extends Declaration<Function>
{
  private final String name;
  private final ImmutableList<Parameter> params;
  /** null for Void */
  private final String returnType;
  private final NodeSequence body;
  private final EffectSpecifier effects;
  private final boolean isStatic;
  private final boolean isMutating;

  public Function(String name, BlockBuilder body)
  {
    this(name, ImmutableList.<Parameter>of(), null, body);
  }

  public Function(String name, List<Parameter> params,
                  String returnType, BlockBuilder body)
  {
    this(name, ImmutableList.copyOf(params), returnType, Blocks.of(body),
         EffectSpecifier.NONE, false, false, DeclTraits.EMPTY);
  }

  private Function(String name, ImmutableList<Parameter> params,
                   String returnType, NodeSequence body,
                   EffectSpecifier effects, boolean isStatic,
                   boolean isMutating, DeclTraits traits)
  {
    super(traits);
    this.name = name;
    this.params = params;
    this.returnType = returnType;
    this.body = body;
    this.effects = effects;
    this.isStatic = isStatic;
    this.isMutating = isMutating;
  }

  public Function parameters(Parameter... more)
  {
    ImmutableList<Parameter> ps = ImmutableList.<Parameter>builder()
        .addAll(params).addAll(Arrays.asList(more)).build();
    return new Function(name, ps, returnType, body, effects, isStatic,
                        isMutating, traits);
  }

  public Function returns(String type)
  {
    return new Function(name, params, type, body, effects, isStatic,
                        isMutating, traits);
  }

  public Function async()
  {
    return withEffects(effects.withAsync());
  }

  public Function throwing()
  {
    return withEffects(effects.withThrows());
  }

  public Function throwing(String errorType)
  {
    return withEffects(effects.withThrows(errorType));
  }

  public Function rethrowing()
  {
    return withEffects(effects.withRethrows());
  }

  private Function withEffects(EffectSpecifier newEffects)
  {
    return new Function(name, params, returnType, body, newEffects,
                        isStatic, isMutating, traits);
  }

  public Function staticMember()
  {
    return new Function(name, params, returnType, body, effects, true,
                        isMutating, traits);
  }

  public Function mutating()
  {
    return new Function(name, params, returnType, body, effects,
                        isStatic, true, traits);
  }

  public Function generic(String... typeParams)
  {
    return withTraits(traits.withGenerics(Arrays.asList(typeParams)));
  }

  @Override
  protected Function withTraits(DeclTraits newTraits)
  {
    return new Function(name, params, returnType, body, effects,
                        isStatic, isMutating, newTraits);
  }

  public String getName()
  {
    return name;
  }

  public EffectSpecifier getEffects()
  {
    return effects;
  }

  public NodeSequence getBody()
  {
    return body;
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.FUNCTION;
  }

  @Override
  public void appendDecl(SourceBuilder sb)
  {
    traits.appendLeading(sb);
    if (isStatic) {
      sb.append("static ");
    }
    if (isMutating) {
      sb.append("mutating ");
    }
    sb.append("func ");
    sb.append(name);
    traits.appendGenerics(sb);
    Parameter.appendClause(sb, params);
    effects.appendTo(sb);
    if (returnType != null) {
      sb.append(" -> ").append(returnType);
    }
    sb.append(' ');
    sb.appendBlock(body.asList());
    sb.newline();
  }
}
