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
 * Effects on a function, initializer, closure or requirement:
 * async and a throwing clause.  async always renders first.
 */
public class EffectSpecifier
{
  public static enum ThrowsKind
  {
    NONE,
    THROWS,
    RETHROWS;
  }

  public static final EffectSpecifier NONE =
      new EffectSpecifier(false, ThrowsKind.NONE, null);

  private final boolean async;
  private final ThrowsKind throwsKind;
  /** Typed error, only with THROWS.  May be null */
  private final String errorType;

  private EffectSpecifier(boolean async, ThrowsKind throwsKind,
                          String errorType)
  {
    if (errorType != null && throwsKind != ThrowsKind.THROWS) {
      throw new DslMisuseError("EffectSpecifier",
          "typed error " + errorType + " requires plain throws, not " +
          throwsKind.toString().toLowerCase());
    }
    this.async = async;
    this.throwsKind = throwsKind;
    this.errorType = errorType;
  }

  public EffectSpecifier withAsync()
  {
    return new EffectSpecifier(true, throwsKind, errorType);
  }

  public EffectSpecifier withThrows()
  {
    return new EffectSpecifier(async, ThrowsKind.THROWS, null);
  }

  public EffectSpecifier withThrows(String errorType)
  {
    if (errorType == null) {
      throw new DslMisuseError("EffectSpecifier", "null error type");
    }
    return new EffectSpecifier(async, ThrowsKind.THROWS, errorType);
  }

  public EffectSpecifier withRethrows()
  {
    if (errorType != null) {
      throw new DslMisuseError("EffectSpecifier",
          "rethrows cannot carry typed error " + errorType);
    }
    return new EffectSpecifier(async, ThrowsKind.RETHROWS, null);
  }

  public boolean isAsync()
  {
    return async;
  }

  public ThrowsKind getThrowsKind()
  {
    return throwsKind;
  }

  public String getErrorType()
  {
    return errorType;
  }

  public boolean isEmpty()
  {
    return !async && throwsKind == ThrowsKind.NONE;
  }

  /**
   * Append effects with a leading space, e.g. " async throws(E)".
   * Appends nothing if there are no effects.
   */
  public void appendTo(SourceBuilder sb)
  {
    if (async) {
      sb.append(" async");
    }
    switch (throwsKind) {
      case THROWS:
        sb.append(" throws");
        if (errorType != null) {
          sb.append('(').append(errorType).append(')');
        }
        break;
      case RETHROWS:
        sb.append(" rethrows");
        break;
      case NONE:
        break;
      default:
        throw new IllegalStateException("Unknown throws kind " +
                                        throwsKind);
    }
  }

  @Override
  public String toString()
  {
    SourceBuilder sb = new SourceBuilder(0);
    appendTo(sb);
    return sb.toString().trim();
  }
}
