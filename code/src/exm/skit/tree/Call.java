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

import com.google.common.collect.ImmutableList;

/**
 * Function or method call.  throwing() and async() mark the call
 * site, rendering try and await in that order.
 */
public class Call extends Expression
{
  /** null for a free function call */
  private final ExprConvertible base;
  private final String name;
  private final ImmutableList<Argument> args;
  /** null if none */
  private final Closure trailingClosure;
  private final boolean isTry;
  private final boolean isAwait;

  public Call(String function, Argument... args)
  {
    this(null, function, ImmutableList.copyOf(args), null, false, false);
  }

  private Call(ExprConvertible base, String name,
               ImmutableList<Argument> args, Closure trailingClosure,
               boolean isTry, boolean isAwait)
  {
    this.base = base;
    this.name = name;
    this.args = args;
    this.trailingClosure = trailingClosure;
    this.isTry = isTry;
    this.isAwait = isAwait;
  }

  /** base.method(args) */
  public static Call method(ExprConvertible base, String method,
                            Argument... args)
  {
    return new Call(base, method, ImmutableList.copyOf(args), null,
                    false, false);
  }

  public Call arguments(Argument... more)
  {
    ImmutableList<Argument> as = ImmutableList.<Argument>builder()
        .addAll(args).addAll(Arrays.asList(more)).build();
    return new Call(base, name, as, trailingClosure, isTry, isAwait);
  }

  public Call trailingClosure(Closure closure)
  {
    return new Call(base, name, args, closure, isTry, isAwait);
  }

  /** Prefix with try */
  public Call throwing()
  {
    return new Call(base, name, args, trailingClosure, true, isAwait);
  }

  /** Prefix with await */
  public Call async()
  {
    return new Call(base, name, args, trailingClosure, isTry, true);
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.CALL;
  }

  @Override
  public void appendExpr(SourceBuilder sb)
  {
    if (isTry) {
      sb.append("try ");
    }
    if (isAwait) {
      sb.append("await ");
    }
    if (base != null) {
      base.appendExpr(sb);
      sb.append('.');
    }
    sb.append(name);
    if (!args.isEmpty() || trailingClosure == null) {
      sb.append('(');
      boolean first = true;
      for (Argument arg: args) {
        if (!first) {
          sb.append(", ");
        }
        first = false;
        arg.appendTo(sb);
      }
      sb.append(')');
    }
    if (trailingClosure != null) {
      sb.append(' ');
      trailingClosure.appendExpr(sb);
    }
  }
}
