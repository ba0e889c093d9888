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
 * Closure expression.
 *
 * The signature clause ({ [attrs] [captures] (params) effects -> T in)
 * is emitted only if at least one of its parts is present.  A return
 * type or effects without parameters get an empty parameter clause.
 */
public class Closure extends Expression
{
  private final ImmutableList<Attribute> attributes;
  private final ImmutableList<Capture> captures;
  private final ImmutableList<ClosureParameter> params;
  private final EffectSpecifier effects;
  /** null if inferred */
  private final String returnType;
  private final NodeSequence body;

  public Closure(BlockBuilder body)
  {
    this(ImmutableList.<Attribute>of(), ImmutableList.<Capture>of(),
         ImmutableList.<ClosureParameter>of(), EffectSpecifier.NONE,
         null, Blocks.of(body));
  }

  public Closure(List<Capture> captures, List<ClosureParameter> params,
                 String returnType, BlockBuilder body)
  {
    this(ImmutableList.<Attribute>of(), ImmutableList.copyOf(captures),
         ImmutableList.copyOf(params), EffectSpecifier.NONE, returnType,
         Blocks.of(body));
  }

  private Closure(ImmutableList<Attribute> attributes,
                  ImmutableList<Capture> captures,
                  ImmutableList<ClosureParameter> params,
                  EffectSpecifier effects, String returnType,
                  NodeSequence body)
  {
    this.attributes = attributes;
    this.captures = captures;
    this.params = params;
    this.effects = effects;
    this.returnType = returnType;
    this.body = body;
  }

  public Closure capture(Capture... more)
  {
    ImmutableList<Capture> cs = ImmutableList.<Capture>builder()
        .addAll(captures).addAll(Arrays.asList(more)).build();
    return new Closure(attributes, cs, params, effects, returnType, body);
  }

  public Closure parameter(String name)
  {
    return parameter(new ClosureParameter(name));
  }

  public Closure parameter(String name, String type)
  {
    return parameter(new ClosureParameter(name, type));
  }

  public Closure parameter(ClosureParameter param)
  {
    ImmutableList<ClosureParameter> ps =
        ImmutableList.<ClosureParameter>builder()
                     .addAll(params).add(param).build();
    return new Closure(attributes, captures, ps, effects, returnType, body);
  }

  public Closure returns(String type)
  {
    return new Closure(attributes, captures, params, effects, type, body);
  }

  public Closure attribute(String name, String... args)
  {
    ImmutableList<Attribute> as = ImmutableList.<Attribute>builder()
        .addAll(attributes).add(new Attribute(name, args)).build();
    return new Closure(as, captures, params, effects, returnType, body);
  }

  public Closure async()
  {
    return new Closure(attributes, captures, params, effects.withAsync(),
                       returnType, body);
  }

  public Closure throwing()
  {
    return new Closure(attributes, captures, params,
                       effects.withThrows(), returnType, body);
  }

  public Closure throwing(String errorType)
  {
    return new Closure(attributes, captures, params,
                       effects.withThrows(errorType), returnType, body);
  }

  public ImmutableList<Capture> getCaptures()
  {
    return captures;
  }

  public boolean hasSignature()
  {
    return !attributes.isEmpty() || !captures.isEmpty() ||
           !params.isEmpty() || !effects.isEmpty() || returnType != null;
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.CLOSURE;
  }

  @Override
  public void appendExpr(SourceBuilder sb)
  {
    sb.append('{');
    if (hasSignature()) {
      appendSignature(sb);
    }
    sb.newline();
    sb.appendBody(body.asList());
    sb.indent();
    sb.append('}');
  }

  private void appendSignature(SourceBuilder sb)
  {
    for (Attribute attr: attributes) {
      sb.append(' ');
      attr.appendTo(sb);
    }
    if (!captures.isEmpty()) {
      sb.append(" [");
      boolean first = true;
      for (Capture c: captures) {
        if (!first) {
          sb.append(", ");
        }
        first = false;
        c.appendTo(sb);
      }
      sb.append(']');
    }
    if (!params.isEmpty() || !effects.isEmpty() || returnType != null) {
      sb.append(" (");
      boolean first = true;
      for (ClosureParameter p: params) {
        if (!first) {
          sb.append(", ");
        }
        first = false;
        p.appendTo(sb);
      }
      sb.append(')');
    }
    effects.appendTo(sb);
    if (returnType != null) {
      sb.append(" -> ").append(returnType);
    }
    sb.append(" in");
  }
}
