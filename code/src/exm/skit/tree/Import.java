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
 * import Module, optionally with attributes (@testable)
 * and an access level
 */
public class Import extends Declaration<Import>
{
  private final String module;

  public Import(String module)
  {
    this(module, DeclTraits.EMPTY);
  }

  private Import(String module, DeclTraits traits)
  {
    super(traits);
    this.module = module;
  }

  @Override
  protected Import withTraits(DeclTraits newTraits)
  {
    return new Import(module, newTraits);
  }

  public String getModule()
  {
    return module;
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.IMPORT;
  }

  @Override
  public void appendDecl(SourceBuilder sb)
  {
    traits.appendLeading(sb);
    sb.append("import ").append(module);
    sb.newline();
  }
}
