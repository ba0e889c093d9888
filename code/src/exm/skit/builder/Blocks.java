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
package exm.skit.builder;

import exm.skit.common.exceptions.DslMisuseError;
import exm.skit.tree.ExprConvertible;
import exm.skit.tree.NodeKind;
import exm.skit.tree.PatternConvertible;
import exm.skit.tree.SwiftTree;

/**
 * Helpers to run builder callbacks
 */
public class Blocks
{
  /**
   * Run body against a fresh builder.
   * @param body may be null, giving an empty sequence
   */
  public static NodeSequence of(BlockBuilder body)
  {
    if (body == null) {
      return NodeSequence.empty();
    }
    SequenceBuilder b = new SequenceBuilder();
    body.build(b);
    return b.build();
  }

  /**
   * Run a callback that must produce exactly one expression
   * @param context names the slot being filled, for error messages
   */
  public static ExprConvertible expression(String context,
                                           BlockBuilder body)
  {
    SwiftTree node = single(context, "expression", of(body));
    if (!(node instanceof ExprConvertible)) {
      throw new DslMisuseError(context, "expected an expression, got " +
                               node.kind());
    }
    return (ExprConvertible)node;
  }

  /**
   * Run a callback that must produce exactly one pattern
   */
  public static PatternConvertible pattern(String context,
                                           BlockBuilder body)
  {
    SwiftTree node = single(context, "pattern", of(body));
    if (!(node instanceof PatternConvertible)) {
      throw new DslMisuseError(context, "expected a pattern, got " +
                               node.kind());
    }
    return (PatternConvertible)node;
  }

  private static SwiftTree single(String context, String role,
                                  NodeSequence seq)
  {
    if (seq.size() != 1 || seq.get(0).kind() == NodeKind.EMPTY) {
      throw new DslMisuseError(context, "expected exactly one " + role +
                   ", got " + seq.size() + " nodes: " + describe(seq));
    }
    return seq.get(0);
  }

  private static String describe(NodeSequence seq)
  {
    StringBuilder sb = new StringBuilder("[");
    boolean first = true;
    for (SwiftTree node: seq) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      sb.append(node.kind());
    }
    sb.append(']');
    return sb.toString();
  }
}
