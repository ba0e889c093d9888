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
 * Stored property or local variable: let/var name[: T][ = value]
 */
public class Variable extends Declaration<Variable>
{
  public static enum VariableKind
  {
    LET("let"),
    VAR("var");

    private final String keyword;

    private VariableKind(String keyword)
    {
      this.keyword = keyword;
    }

    public String keyword()
    {
      return keyword;
    }
  }

  private final VariableKind variableKind;
  private final String name;
  /** May be null */
  private final String type;
  /** May be null */
  private final ExprConvertible initializer;
  private final boolean isStatic;

  public Variable(VariableKind variableKind, String name, String type)
  {
    this(variableKind, name, type, null, false, DeclTraits.EMPTY);
  }

  public Variable(VariableKind variableKind, String name, String type,
                  ExprConvertible initializer)
  {
    this(variableKind, name, type, initializer, false,
         DeclTraits.EMPTY);
  }

  private Variable(VariableKind variableKind, String name, String type,
                   ExprConvertible initializer, boolean isStatic,
                   DeclTraits traits)
  {
    super(traits);
    this.variableKind = variableKind;
    this.name = name;
    this.type = type;
    this.initializer = initializer;
    this.isStatic = isStatic;
  }

  /** let name = value */
  public static Variable constant(String name, ExprConvertible value)
  {
    return new Variable(VariableKind.LET, name, null, value);
  }

  /** var name = value */
  public static Variable mutable(String name, ExprConvertible value)
  {
    return new Variable(VariableKind.VAR, name, null, value);
  }

  public Variable type(String newType)
  {
    return new Variable(variableKind, name, newType, initializer,
                        isStatic, traits);
  }

  public Variable initializer(ExprConvertible value)
  {
    return new Variable(variableKind, name, type, value, isStatic,
                        traits);
  }

  public Variable staticMember()
  {
    return new Variable(variableKind, name, type, initializer, true,
                        traits);
  }

  @Override
  protected Variable withTraits(DeclTraits newTraits)
  {
    return new Variable(variableKind, name, type, initializer, isStatic,
                        newTraits);
  }

  public String getName()
  {
    return name;
  }

  public VariableKind getVariableKind()
  {
    return variableKind;
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.VARIABLE;
  }

  @Override
  public void appendDecl(SourceBuilder sb)
  {
    traits.appendLeading(sb);
    if (isStatic) {
      sb.append("static ");
    }
    sb.append(variableKind.keyword()).append(' ').append(name);
    if (type != null) {
      sb.append(": ").append(type);
    }
    if (initializer != null) {
      sb.append(" = ");
      initializer.appendExpr(sb);
    }
    sb.newline();
  }
}
