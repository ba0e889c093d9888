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

import com.google.common.collect.ImmutableList;

import exm.skit.common.exceptions.DslMisuseError;

/**
 * An enum case, which renders differently by role:
 * <ul>
 * <li>declaration: case name(a: A, b: B) = raw</li>
 * <li>expression: .name or Base.name, applied to the associated
 *     value names as positional arguments</li>
 * <li>pattern: .name(let a, let b)</li>
 * </ul>
 */
public class EnumCase extends Declaration<EnumCase>
                      implements ExprConvertible, PatternConvertible
{
  public static class AssociatedValue
  {
    /** null if unlabeled */
    public final String name;
    public final String type;

    public AssociatedValue(String name, String type)
    {
      this.name = name;
      this.type = type;
    }
  }

  /** May be qualified, e.g. NetworkError.timeout */
  private final String name;
  /** null if none */
  private final Literal rawValue;
  private final ImmutableList<AssociatedValue> associated;

  public EnumCase(String name)
  {
    this(name, null, ImmutableList.<AssociatedValue>of(),
         DeclTraits.EMPTY);
  }

  private EnumCase(String name, Literal rawValue,
                   ImmutableList<AssociatedValue> associated,
                   DeclTraits traits)
  {
    super(traits);
    if (name == null || name.isEmpty()) {
      throw new DslMisuseError("EnumCase", "empty case name");
    }
    this.name = name;
    this.rawValue = rawValue;
    this.associated = associated;
  }

  /**
   * Set the raw value.  Collection literals are rejected, as is
   * setting a raw value twice.
   */
  public EnumCase rawValue(Literal value)
  {
    if (value.literalKind().isCollection()) {
      throw new DslMisuseError("EnumCase " + name,
          value.literalKind() + " literal cannot be a raw value: " +
          Renderer.renderExpr(value));
    }
    if (rawValue != null) {
      throw new DslMisuseError("EnumCase " + name,
          "raw value already set to " + Renderer.renderExpr(rawValue));
    }
    return new EnumCase(name, value, associated, traits);
  }

  public EnumCase rawValue(String value)
  {
    return rawValue(Literal.string(value));
  }

  public EnumCase rawValue(long value)
  {
    return rawValue(Literal.integer(value));
  }

  public EnumCase associatedValue(String valueName, String type)
  {
    ImmutableList<AssociatedValue> avs =
        ImmutableList.<AssociatedValue>builder().addAll(associated)
                .add(new AssociatedValue(valueName, type)).build();
    return new EnumCase(name, rawValue, avs, traits);
  }

  /**
   * Unlabeled associated value, e.g. case decodingError(DecodingError).
   * Matches as _ in patterns; such a case cannot be used as an
   * expression.
   */
  public EnumCase associatedValue(String type)
  {
    return associatedValue(null, type);
  }

  @Override
  protected EnumCase withTraits(DeclTraits newTraits)
  {
    return new EnumCase(name, rawValue, associated, newTraits);
  }

  public String getName()
  {
    return name;
  }

  public Literal getRawValue()
  {
    return rawValue;
  }

  public ImmutableList<AssociatedValue> getAssociatedValues()
  {
    return associated;
  }

  private String simpleName()
  {
    int dot = name.lastIndexOf('.');
    return (dot < 0) ? name : name.substring(dot + 1);
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.ENUM_CASE;
  }

  @Override
  public void appendDecl(SourceBuilder sb)
  {
    traits.appendLeading(sb);
    sb.append("case ").append(simpleName());
    if (!associated.isEmpty()) {
      sb.append('(');
      boolean first = true;
      for (AssociatedValue av: associated) {
        if (!first) {
          sb.append(", ");
        }
        first = false;
        if (av.name != null) {
          sb.append(av.name).append(": ");
        }
        sb.append(av.type);
      }
      sb.append(')');
    }
    if (rawValue != null) {
      sb.append(" = ");
      rawValue.appendExpr(sb);
    }
    sb.newline();
  }

  private void appendCaseName(SourceBuilder sb)
  {
    if (name.indexOf('.') < 0) {
      sb.append('.');
    }
    sb.append(name);
  }

  @Override
  public void appendExpr(SourceBuilder sb)
  {
    for (AssociatedValue av: associated) {
      if (av.name == null) {
        throw new DslMisuseError("EnumCase " + name, "associated value " +
            "of type " + av.type + " has no name to pass as argument");
      }
    }
    appendCaseName(sb);
    appendAssociated(sb, "");
  }

  @Override
  public void appendPattern(SourceBuilder sb)
  {
    appendCaseName(sb);
    appendAssociated(sb, "let ");
  }

  private void appendAssociated(SourceBuilder sb, String prefix)
  {
    if (associated.isEmpty()) {
      return;
    }
    sb.append('(');
    boolean first = true;
    for (AssociatedValue av: associated) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      if (av.name == null) {
        sb.append('_');
      } else {
        sb.append(prefix).append(av.name);
      }
    }
    sb.append(')');
  }
}
