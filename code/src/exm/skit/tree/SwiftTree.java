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

/**
 * The SwiftTree class hierarchy represents all Swift constructs
 * the generator can emit.
 *
 * Trees are immutable: every decorator returns a new node, so a tree
 * can be shared freely once built.  Rendering is done by
 * {@link #appendTo(SourceBuilder)}, which writes the node as an item
 * of a statement or member list, i.e. as whole indented lines.
 * Nodes that can also play other syntactic roles implement
 * {@link ExprConvertible}, {@link DeclConvertible} or
 * {@link PatternConvertible}; parents ask for the role they need.
 * */
public abstract class SwiftTree
{
  public abstract NodeKind kind();

  /**
   * Append this node as one or more complete lines at the current
   * indentation of sb.
   */
  public abstract void appendTo(SourceBuilder sb);

  /**
   * Render this tree with the configured indentation width.
   * The result carries no trailing newline.
   */
  public String generateCode()
  {
    return Renderer.render(this);
  }

  @Override
  public String toString()
  {
    return generateCode();
  }
}
