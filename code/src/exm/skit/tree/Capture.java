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
 * One entry of a closure capture list
 */
public class Capture
{
  public static enum CaptureStrength
  {
    STRONG(""),
    WEAK("weak "),
    UNOWNED("unowned ");

    private final String prefix;

    private CaptureStrength(String prefix)
    {
      this.prefix = prefix;
    }
  }

  private final CaptureStrength strength;
  private final String name;

  public Capture(CaptureStrength strength, String name)
  {
    if (name == null || name.isEmpty()) {
      throw new DslMisuseError("Capture", "empty capture name");
    }
    this.strength = strength;
    this.name = name;
  }

  public static Capture strong(String name)
  {
    return new Capture(CaptureStrength.STRONG, name);
  }

  public static Capture weak(String name)
  {
    return new Capture(CaptureStrength.WEAK, name);
  }

  public static Capture unowned(String name)
  {
    return new Capture(CaptureStrength.UNOWNED, name);
  }

  /**
   * Capture the variable behind ref with its declared strength
   */
  public static Capture of(ReferenceExp ref)
  {
    return new Capture(ref.getStrength(), ref.getCapturedName());
  }

  public static Capture of(VariableExp var)
  {
    return strong(var.getName());
  }

  public CaptureStrength getStrength()
  {
    return strength;
  }

  public String getName()
  {
    return name;
  }

  public void appendTo(SourceBuilder sb)
  {
    sb.append(strength.prefix);
    sb.append(name);
  }
}
