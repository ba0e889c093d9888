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

/**
 * Decorator facts shared by declarations: access level, attributes,
 * attached comments, inheritance list and generic parameters.
 * Immutable; each with-method returns a copy.
 */
public class DeclTraits
{
  public static final DeclTraits EMPTY = new DeclTraits(null,
      ImmutableList.<Attribute>of(), ImmutableList.<Line>of(),
      ImmutableList.<String>of(), ImmutableList.<String>of());

  /** null if none was given */
  private final AccessLevel access;
  private final ImmutableList<Attribute> attributes;
  private final ImmutableList<Line> comments;
  private final ImmutableList<String> inherited;
  private final ImmutableList<String> generics;

  private DeclTraits(AccessLevel access,
                     ImmutableList<Attribute> attributes,
                     ImmutableList<Line> comments,
                     ImmutableList<String> inherited,
                     ImmutableList<String> generics)
  {
    this.access = access;
    this.attributes = attributes;
    this.comments = comments;
    this.inherited = inherited;
    this.generics = generics;
  }

  public DeclTraits withAccess(AccessLevel access)
  {
    return new DeclTraits(access, attributes, comments, inherited,
                          generics);
  }

  public DeclTraits withAttribute(Attribute attr)
  {
    return new DeclTraits(access, append(attributes, attr), comments,
                          inherited, generics);
  }

  public DeclTraits withComments(List<Line> lines)
  {
    return new DeclTraits(access, attributes, appendAll(comments, lines),
                          inherited, generics);
  }

  /**
   * Append to the inheritance list.  Order and duplicates are kept.
   */
  public DeclTraits withInherited(List<String> types)
  {
    return new DeclTraits(access, attributes, comments,
                          appendAll(inherited, types), generics);
  }

  public DeclTraits withGenerics(List<String> params)
  {
    return new DeclTraits(access, attributes, comments, inherited,
                          appendAll(generics, params));
  }

  private static <T> ImmutableList<T> append(ImmutableList<T> list,
                                             T item)
  {
    return ImmutableList.<T>builder().addAll(list).add(item).build();
  }

  private static <T> ImmutableList<T> appendAll(ImmutableList<T> list,
                                                List<T> items)
  {
    return ImmutableList.<T>builder().addAll(list).addAll(items).build();
  }

  public AccessLevel getAccess()
  {
    return access;
  }

  public ImmutableList<Attribute> getAttributes()
  {
    return attributes;
  }

  public ImmutableList<Line> getComments()
  {
    return comments;
  }

  public ImmutableList<String> getInherited()
  {
    return inherited;
  }

  public ImmutableList<String> getGenerics()
  {
    return generics;
  }

  /**
   * Comment lines, then indentation, attributes and access keyword,
   * leaving the builder positioned for the declaration keyword
   */
  void appendLeading(SourceBuilder sb)
  {
    for (Line line: comments) {
      line.appendTo(sb);
    }
    sb.indent();
    Attribute.appendAll(sb, attributes);
    if (access != null) {
      sb.append(access.keyword());
      sb.append(' ');
    }
  }

  void appendGenerics(SourceBuilder sb)
  {
    if (!generics.isEmpty()) {
      sb.append('<');
      sb.append(StringUtils.join(generics, ", "));
      sb.append('>');
    }
  }

  void appendInheritance(SourceBuilder sb)
  {
    appendInheritance(sb, ", ");
  }

  void appendInheritance(SourceBuilder sb, String separator)
  {
    if (!inherited.isEmpty()) {
      sb.append(": ");
      sb.append(StringUtils.join(inherited, separator));
    }
  }
}
