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

import exm.skit.common.Settings;

/**
 * Output buffer for one render pass.  Tracks the current
 * indentation so nested nodes can render themselves without knowing
 * their depth.
 *
 * Not thread-safe: confine to the pass that created it.
 */
public class SourceBuilder
{
  private final StringBuilder sb;
  private final int indentWidth;
  private int indentation = 0;

  public SourceBuilder()
  {
    this(Settings.indentWidth());
  }

  public SourceBuilder(int indentWidth)
  {
    assert(indentWidth >= 0);
    this.sb = new StringBuilder(2048);
    this.indentWidth = indentWidth;
  }

  public SourceBuilder append(String s)
  {
    sb.append(s);
    return this;
  }

  public SourceBuilder append(char c)
  {
    sb.append(c);
    return this;
  }

  public SourceBuilder newline()
  {
    sb.append('\n');
    return this;
  }

  public void indent()
  {
    sb.append(StringUtils.repeat(' ', indentation));
  }

  public void increaseIndent()
  {
    indentation += indentWidth;
  }

  public void decreaseIndent()
  {
    indentation -= indentWidth;
    assert(indentation >= 0) : "Unbalanced indentation";
  }

  public int getIndentation()
  {
    return indentation;
  }

  /**
   * Append body inside curly braces: the opening brace goes on the
   * current line, each body item on its own line one level deeper,
   * and the closing brace on its own line.  No newline is written
   * after the closing brace.
   * @param body
   */
  public void appendBlock(List<? extends SwiftTree> body)
  {
    sb.append("{\n");
    appendBody(body);
    indent();
    sb.append('}');
  }

  /**
   * Append body items one level deeper than the current indentation
   */
  public void appendBody(List<? extends SwiftTree> body)
  {
    increaseIndent();
    for (SwiftTree item: body) {
      item.appendTo(this);
    }
    decreaseIndent();
  }

  public int length()
  {
    return sb.length();
  }

  @Override
  public String toString()
  {
    return sb.toString();
  }
}
