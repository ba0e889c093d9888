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

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * Attribute such as @MainActor or @available(iOS 15, *).
 * Arguments are emitted verbatim.
 */
public class Attribute
{
  private final String name;
  private final ImmutableList<String> args;

  public Attribute(String name, String... args)
  {
    this(name, Arrays.asList(args));
  }

  public Attribute(String name, Iterable<String> args)
  {
    this.name = StringUtils.removeStart(name, "@");
    this.args = ImmutableList.copyOf(args);
  }

  public String getName()
  {
    return name;
  }

  public ImmutableList<String> getArgs()
  {
    return args;
  }

  public void appendTo(SourceBuilder sb)
  {
    sb.append('@');
    sb.append(name);
    if (!args.isEmpty()) {
      sb.append('(');
      sb.append(StringUtils.join(args, ", "));
      sb.append(')');
    }
  }

  /**
   * Append each attribute followed by a single space
   */
  static void appendAll(SourceBuilder sb, Iterable<Attribute> attrs)
  {
    for (Attribute attr: attrs) {
      attr.appendTo(sb);
      sb.append(' ');
    }
  }

  @Override
  public String toString()
  {
    SourceBuilder sb = new SourceBuilder(0);
    appendTo(sb);
    return sb.toString();
  }
}
