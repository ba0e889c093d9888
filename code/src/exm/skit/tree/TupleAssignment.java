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

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

import exm.skit.common.exceptions.DslMisuseError;

/**
 * Destructuring binding of a tuple value:
 * [async ]let (a, b) = [try ][await ](x, y)
 *
 * The number of names must match the tuple arity.
 */
public class TupleAssignment extends SwiftTree
{
  private final ImmutableList<String> names;
  private final Tuple value;
  private final TupleAssignMode mode;

  public TupleAssignment(List<String> names, Tuple value)
  {
    this(names, value, TupleAssignMode.SYNC);
  }

  public TupleAssignment(List<String> names, Tuple value,
                         TupleAssignMode mode)
  {
    if (names.size() != value.arity()) {
      throw new DslMisuseError("TupleAssignment",
          names.size() + " names " + names + " for a tuple of " +
          value.arity() + " elements");
    }
    this.names = ImmutableList.copyOf(names);
    this.value = value;
    this.mode = mode;
  }

  public TupleAssignment async()
  {
    return new TupleAssignment(names, value, mode.withAsync());
  }

  public TupleAssignment throwing()
  {
    return new TupleAssignment(names, value, mode.withThrowing());
  }

  /** async let binding, children run concurrently */
  public TupleAssignment concurrent()
  {
    return new TupleAssignment(names, value,
                               TupleAssignMode.CONCURRENT_ASYNC);
  }

  public TupleAssignMode getMode()
  {
    return mode;
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.TUPLE_ASSIGNMENT;
  }

  @Override
  public void appendTo(SourceBuilder sb)
  {
    sb.indent();
    sb.append(mode.bindingPrefix);
    sb.append("let (");
    sb.append(StringUtils.join(names, ", "));
    sb.append(") = ");
    sb.append(mode.valuePrefix);
    value.appendExpr(sb);
    sb.newline();
  }
}
