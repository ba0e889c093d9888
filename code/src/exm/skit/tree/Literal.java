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
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

/**
 * Literal values.  String content is emitted between double quotes
 * exactly as given: the author supplies any escapes.
 */
public class Literal extends Expression implements PatternConvertible
{
  public static enum LiteralKind
  {
    STRING,
    INTEGER,
    FLOAT,
    BOOLEAN,
    NIL,
    /** Bare reference emitted verbatim, e.g. a type name or .none */
    REF,
    TUPLE,
    ARRAY,
    DICTIONARY;

    /**
     * Collection literals cannot serve as enum raw values
     */
    public boolean isCollection()
    {
      return this == TUPLE || this == ARRAY || this == DICTIONARY;
    }
  }

  private final LiteralKind literalKind;
  /** Text for scalar kinds */
  private final String text;
  private final ImmutableList<ExprConvertible> elements;
  private final ImmutableList<Map.Entry<ExprConvertible, ExprConvertible>>
                                                          entries;

  private Literal(LiteralKind literalKind, String text)
  {
    this(literalKind, text, ImmutableList.<ExprConvertible>of(),
         ImmutableList.<Map.Entry<ExprConvertible, ExprConvertible>>of());
  }

  private Literal(LiteralKind literalKind, String text,
      ImmutableList<ExprConvertible> elements,
      ImmutableList<Map.Entry<ExprConvertible, ExprConvertible>> entries)
  {
    this.literalKind = literalKind;
    this.text = text;
    this.elements = elements;
    this.entries = entries;
  }

  /**
   * String literal whose text is emitted as given, so any escapes
   * and interpolations in it are the author's
   */
  public static Literal string(String value)
  {
    return new Literal(LiteralKind.STRING, value);
  }

  /**
   * String literal for arbitrary text: backslashes, quotes and
   * control characters are escaped, so the literal's value is
   * exactly value
   */
  public static Literal escapedString(String value)
  {
    return new Literal(LiteralKind.STRING, swiftEscapeString(value));
  }

  /**
   * See the Swift language reference, "String Literals", for the
   * escape sequences
   */
  public static String swiftEscapeString(String unescaped)
  {
    StringBuilder escaped = new StringBuilder(unescaped.length());
    for (int i = 0; i < unescaped.length(); i++) {
      char c = unescaped.charAt(i);
      switch (c) {
      case '\0':
        escaped.append("\\0");
        break;
      case '\n':
        escaped.append("\\n");
        break;
      case '\r':
        escaped.append("\\r");
        break;
      case '\t':
        escaped.append("\\t");
        break;
      case '"':
        escaped.append("\\\"");
        break;
      case '\\':
        escaped.append("\\\\");
        break;
      default:
        if (c < 0x20 || c == 0x7f) {
          escaped.append("\\u{");
          escaped.append(Integer.toHexString(c));
          escaped.append('}');
        } else {
          escaped.append(c);
        }
        break;
      }
    }
    return escaped.toString();
  }

  public static Literal integer(long value)
  {
    return new Literal(LiteralKind.INTEGER, Long.toString(value));
  }

  public static Literal floating(double value)
  {
    String s;
    if (Double.isNaN(value)) {
      s = "Double.nan";
    } else if (Double.isInfinite(value)) {
      s = (value > 0) ? "Double.infinity" : "-Double.infinity";
    } else {
      s = Double.toString(value);
    }
    return new Literal(LiteralKind.FLOAT, s);
  }

  public static Literal bool(boolean value)
  {
    return new Literal(LiteralKind.BOOLEAN, Boolean.toString(value));
  }

  public static Literal nil()
  {
    return new Literal(LiteralKind.NIL, "nil");
  }

  public static Literal ref(String text)
  {
    return new Literal(LiteralKind.REF, text);
  }

  public static Literal tuple(ExprConvertible... elements)
  {
    return new Literal(LiteralKind.TUPLE, null,
        ImmutableList.copyOf(elements),
        ImmutableList.<Map.Entry<ExprConvertible, ExprConvertible>>of());
  }

  public static Literal array(ExprConvertible... elements)
  {
    return array(Arrays.asList(elements));
  }

  public static Literal array(List<? extends ExprConvertible> elements)
  {
    return new Literal(LiteralKind.ARRAY, null,
        ImmutableList.<ExprConvertible>copyOf(elements),
        ImmutableList.<Map.Entry<ExprConvertible, ExprConvertible>>of());
  }

  /**
   * @param entries in output order
   */
  public static Literal dictionary(
        List<Map.Entry<ExprConvertible, ExprConvertible>> entries)
  {
    return new Literal(LiteralKind.DICTIONARY, null,
                       ImmutableList.<ExprConvertible>of(),
                       ImmutableList.copyOf(entries));
  }

  public static Map.Entry<ExprConvertible, ExprConvertible> entry(
                          ExprConvertible key, ExprConvertible value)
  {
    return Maps.immutableEntry(key, value);
  }

  public LiteralKind literalKind()
  {
    return literalKind;
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.LITERAL;
  }

  @Override
  public void appendExpr(SourceBuilder sb)
  {
    switch (literalKind) {
      case STRING:
        sb.append('"').append(text).append('"');
        break;
      case TUPLE:
        sb.append('(');
        appendElements(sb);
        sb.append(')');
        break;
      case ARRAY:
        sb.append('[');
        appendElements(sb);
        sb.append(']');
        break;
      case DICTIONARY:
        appendDictionary(sb);
        break;
      default:
        sb.append(text);
        break;
    }
  }

  private void appendElements(SourceBuilder sb)
  {
    boolean first = true;
    for (ExprConvertible e: elements) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      e.appendExpr(sb);
    }
  }

  private void appendDictionary(SourceBuilder sb)
  {
    if (entries.isEmpty()) {
      sb.append("[:]");
      return;
    }
    sb.append('[');
    boolean first = true;
    for (Map.Entry<ExprConvertible, ExprConvertible> e: entries) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      e.getKey().appendExpr(sb);
      sb.append(": ");
      e.getValue().appendExpr(sb);
    }
    sb.append(']');
  }

  /**
   * Literals match as expression patterns
   */
  @Override
  public void appendPattern(SourceBuilder sb)
  {
    appendExpr(sb);
  }
}
