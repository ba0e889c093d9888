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
 * Function or initializer parameter.
 *
 * Three label forms are supported: named (name: T), labeled
 * (label name: T) and unlabeled (_ name: T).
 */
public class Parameter
{
  /** External label, "_" if unlabeled, null if same as name */
  private final String label;
  private final String name;
  private final String type;
  private final ExprConvertible defaultValue;
  private final boolean isInout;
  private final boolean isVariadic;
  private final ImmutableList<Attribute> attributes;

  private Parameter(String label, String name, String type,
                    ExprConvertible defaultValue, boolean isInout,
                    boolean isVariadic,
                    ImmutableList<Attribute> attributes)
  {
    if (name == null || name.isEmpty()) {
      throw new DslMisuseError("Parameter", "empty parameter name");
    }
    if (type == null || type.isEmpty()) {
      throw new DslMisuseError("Parameter", "parameter " + name +
                               " has no type");
    }
    this.label = label;
    this.name = name;
    this.type = type;
    this.defaultValue = defaultValue;
    this.isInout = isInout;
    this.isVariadic = isVariadic;
    this.attributes = attributes;
  }

  public static Parameter named(String name, String type)
  {
    return new Parameter(null, name, type, null, false, false,
                         ImmutableList.<Attribute>of());
  }

  public static Parameter labeled(String label, String name,
                                  String type)
  {
    return new Parameter(label, name, type, null, false, false,
                         ImmutableList.<Attribute>of());
  }

  public static Parameter unlabeled(String name, String type)
  {
    return labeled("_", name, type);
  }

  public Parameter defaultValue(ExprConvertible value)
  {
    return new Parameter(label, name, type, value, isInout, isVariadic,
                         attributes);
  }

  public Parameter inout()
  {
    return new Parameter(label, name, type, defaultValue, true,
                         isVariadic, attributes);
  }

  public Parameter variadic()
  {
    return new Parameter(label, name, type, defaultValue, isInout, true,
                         attributes);
  }

  /** Type attribute, e.g. escaping or Sendable */
  public Parameter attribute(String attrName, String... args)
  {
    ImmutableList<Attribute> attrs = ImmutableList.<Attribute>builder()
        .addAll(attributes).add(new Attribute(attrName, args)).build();
    return new Parameter(label, name, type, defaultValue, isInout,
                         isVariadic, attrs);
  }

  public String getLabel()
  {
    return label;
  }

  public String getName()
  {
    return name;
  }

  public String getType()
  {
    return type;
  }

  public void appendTo(SourceBuilder sb)
  {
    if (label != null) {
      sb.append(label).append(' ');
    }
    sb.append(name).append(": ");
    Attribute.appendAll(sb, attributes);
    if (isInout) {
      sb.append("inout ");
    }
    sb.append(type);
    if (isVariadic) {
      sb.append("...");
    }
    if (defaultValue != null) {
      sb.append(" = ");
      defaultValue.appendExpr(sb);
    }
  }

  /** Parenthesized, comma separated parameter clause */
  static void appendClause(SourceBuilder sb, Iterable<Parameter> params)
  {
    sb.append('(');
    boolean first = true;
    for (Parameter p: params) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      p.appendTo(sb);
    }
    sb.append(')');
  }
}
