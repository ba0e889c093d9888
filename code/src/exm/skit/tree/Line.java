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

import exm.skit.common.exceptions.DslMisuseError;

/**
 * A single comment or raw source line.  Only these nodes introduce
 * comments or blank lines into the output.
 */
public class Line extends SwiftTree
{
  public static enum LineKind
  {
    /** // comment */
    LINE("// "),
    /** /// doc comment */
    DOC("/// "),
    /** Emitted verbatim */
    RAW(""),
    BLANK("");

    private final String prefix;

    private LineKind(String prefix)
    {
      this.prefix = prefix;
    }
  }

  private final LineKind lineKind;
  private final String text;

  private Line(LineKind lineKind, String text)
  {
    this.lineKind = lineKind;
    this.text = text;
  }

  public static Line comment(String text)
  {
    return new Line(LineKind.LINE, checkText(text));
  }

  public static Line doc(String text)
  {
    return new Line(LineKind.DOC, checkText(text));
  }

  public static Line raw(String text)
  {
    return new Line(LineKind.RAW, checkText(text));
  }

  public static Line blank()
  {
    return new Line(LineKind.BLANK, "");
  }

  private static String checkText(String text)
  {
    if (text == null) {
      throw new DslMisuseError("Line", "null text");
    }
    if (text.indexOf('\n') >= 0) {
      throw new DslMisuseError("Line",
                  "line text contains a newline: \"" + text + "\"");
    }
    return text;
  }

  public LineKind getLineKind()
  {
    return lineKind;
  }

  public String getText()
  {
    return text;
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.LINE;
  }

  @Override
  public void appendTo(SourceBuilder sb)
  {
    if (lineKind != LineKind.BLANK) {
      sb.indent();
      if (text.isEmpty()) {
        sb.append(lineKind.prefix.trim());
      } else {
        sb.append(lineKind.prefix);
        sb.append(text);
      }
    }
    sb.newline();
  }
}
