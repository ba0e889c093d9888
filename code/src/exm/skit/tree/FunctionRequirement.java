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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Function signature without a body, for protocol declarations
 */
public class FunctionRequirement extends Declaration<FunctionRequirement>
{
  private final String name;
  private final ImmutableList<Parameter> params;
  private final String returnType;
  private final EffectSpecifier effects;
  private final boolean isStatic;
  private final boolean isMutating;

  public FunctionRequirement(String name)
  {
    this(name, ImmutableList.<Parameter>of(), null);
  }

  public FunctionRequirement(String name, List<Parameter> params,
                             String returnType)
  {
    this(name, ImmutableList.copyOf(params), returnType,
         EffectSpecifier.NONE, false, false, DeclTraits.EMPTY);
  }

  private FunctionRequirement(String name,
        ImmutableList<Parameter> params, String returnType,
        EffectSpecifier effects, boolean isStatic, boolean isMutating,
        DeclTraits traits)
  {
    super(traits);
    this.name = name;
    this.params = params;
    this.returnType = returnType;
    this.effects = effects;
    this.isStatic = isStatic;
    this.isMutating = isMutating;
  }

  public FunctionRequirement async()
  {
    return new FunctionRequirement(name, params, returnType,
        effects.withAsync(), isStatic, isMutating, traits);
  }

  public FunctionRequirement throwing()
  {
    return new FunctionRequirement(name, params, returnType,
        effects.withThrows(), isStatic, isMutating, traits);
  }

  public FunctionRequirement throwing(String errorType)
  {
    return new FunctionRequirement(name, params, returnType,
        effects.withThrows(errorType), isStatic, isMutating, traits);
  }

  public FunctionRequirement staticMember()
  {
    return new FunctionRequirement(name, params, returnType, effects,
                                   true, isMutating, traits);
  }

  public FunctionRequirement mutating()
  {
    return new FunctionRequirement(name, params, returnType, effects,
                                   isStatic, true, traits);
  }

  @Override
  protected FunctionRequirement withTraits(DeclTraits newTraits)
  {
    return new FunctionRequirement(name, params, returnType, effects,
                                   isStatic, isMutating, newTraits);
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.FUNCTION_REQUIREMENT;
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
    sb.append("func ").append(name);
    traits.appendGenerics(sb);
    Parameter.appendClause(sb, params);
    effects.appendTo(sb);
    if (returnType != null) {
      sb.append(" -> ").append(returnType);
    }
    sb.newline();
  }
}
