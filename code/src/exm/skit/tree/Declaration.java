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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Base for declarations carrying {@link DeclTraits}.
 * T is the concrete class, so decorators return the caller's type.
 */
public abstract class Declaration<T extends Declaration<T>>
                extends SwiftTree implements DeclConvertible
{
  protected final DeclTraits traits;

  protected Declaration(DeclTraits traits)
  {
    this.traits = traits;
  }

  /** Copy of this node with different traits */
  protected abstract T withTraits(DeclTraits newTraits);

  public DeclTraits getTraits()
  {
    return traits;
  }

  public T access(AccessLevel level)
  {
    return withTraits(traits.withAccess(level));
  }

  public T attribute(String name, String... args)
  {
    return withTraits(traits.withAttribute(new Attribute(name, args)));
  }

  /**
   * Attach doc comment lines (///) above the declaration
   */
  public T comment(String... docLines)
  {
    List<Line> lines = new ArrayList<Line>(docLines.length);
    for (String text: docLines) {
      lines.add(Line.doc(text));
    }
    return withTraits(traits.withComments(lines));
  }

  public T comment(Line... lines)
  {
    return withTraits(traits.withComments(Arrays.asList(lines)));
  }

  @Override
  public void appendTo(SourceBuilder sb)
  {
    appendDecl(sb);
  }
}
