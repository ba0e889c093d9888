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

import exm.skit.common.Logging;
import exm.skit.common.Settings;
import exm.skit.common.exceptions.DslMisuseError;
import exm.skit.common.exceptions.SKitRuntimeError;

/**
 * Entry points for turning trees into text, plus the role coercions
 * parents use when a child was supplied as a plain {@link SwiftTree}.
 *
 * A child that cannot play the requested role is replaced with an
 * empty placeholder and a warning is logged once per distinct message.
 * With {@link Settings#RENDER_STRICT} set, the mismatch aborts the
 * render instead.
 */
public class Renderer
{
  public static String render(SwiftTree tree)
  {
    return render(tree, Settings.indentWidth());
  }

  public static String render(SwiftTree tree, int indentWidth)
  {
    SourceBuilder sb = new SourceBuilder(indentWidth);
    tree.appendTo(sb);
    return finish(sb);
  }

  /**
   * Render top-level items one after another, as in a source file
   */
  public static String render(Iterable<? extends SwiftTree> items)
  {
    SourceBuilder sb = new SourceBuilder();
    for (SwiftTree item: items) {
      item.appendTo(sb);
    }
    return finish(sb);
  }

  /**
   * Render an expression inline, as it would appear as an operand
   */
  public static String renderExpr(ExprConvertible expr)
  {
    SourceBuilder sb = new SourceBuilder();
    expr.appendExpr(sb);
    return sb.toString();
  }

  private static String finish(SourceBuilder sb)
  {
    return StringUtils.stripEnd(sb.toString(), "\n");
  }

  public static void appendExpr(SourceBuilder sb, SwiftTree node,
                                String context)
  {
    if (node instanceof ExprConvertible) {
      ((ExprConvertible)node).appendExpr(sb);
    } else {
      mismatch(node, "expression", context);
    }
  }

  public static void appendPattern(SourceBuilder sb, SwiftTree node,
                                   String context)
  {
    if (node instanceof PatternConvertible) {
      ((PatternConvertible)node).appendPattern(sb);
    } else {
      mismatch(node, "pattern", context);
    }
  }

  public static void appendCondition(SourceBuilder sb, SwiftTree node,
                                     String context)
  {
    if (node instanceof ConditionConvertible) {
      ((ConditionConvertible)node).appendCondition(sb);
    } else if (node instanceof ExprConvertible) {
      ((ExprConvertible)node).appendExpr(sb);
    } else {
      mismatch(node, "condition", context);
    }
  }

  /**
   * Append expressions separated by ", ".  Placeholders are skipped,
   * as are mismatched nodes, together with their separator.
   */
  public static void appendExprList(SourceBuilder sb,
        List<? extends SwiftTree> nodes, String context)
  {
    boolean first = true;
    for (SwiftTree node: nodes) {
      if (node.kind() == NodeKind.EMPTY) {
        continue;
      } else if (!(node instanceof ExprConvertible)) {
        mismatch(node, "expression", context);
        continue;
      }
      if (!first) {
        sb.append(", ");
      }
      first = false;
      ((ExprConvertible)node).appendExpr(sb);
    }
  }

  public static void appendPatternList(SourceBuilder sb,
        List<? extends SwiftTree> nodes, String context)
  {
    boolean first = true;
    for (SwiftTree node: nodes) {
      if (node.kind() == NodeKind.EMPTY) {
        continue;
      } else if (!(node instanceof PatternConvertible)) {
        mismatch(node, "pattern", context);
        continue;
      }
      if (!first) {
        sb.append(", ");
      }
      first = false;
      ((PatternConvertible)node).appendPattern(sb);
    }
  }

  public static void appendConditionList(SourceBuilder sb,
        List<? extends SwiftTree> nodes, String context)
  {
    boolean first = true;
    for (SwiftTree node: nodes) {
      if (node.kind() == NodeKind.EMPTY) {
        continue;
      } else if (!(node instanceof ConditionConvertible) &&
                 !(node instanceof ExprConvertible)) {
        mismatch(node, "condition", context);
        continue;
      }
      if (!first) {
        sb.append(", ");
      }
      first = false;
      appendCondition(sb, node, context);
    }
  }

  /**
   * Append a braced member list as {@link SourceBuilder#appendBlock}
   * does.  Members must be declarations; comment lines and
   * placeholders pass through, anything else is a mismatch.
   */
  public static void appendDeclBlock(SourceBuilder sb,
        List<? extends SwiftTree> members, String context)
  {
    sb.append('{').newline();
    sb.increaseIndent();
    for (SwiftTree member: members) {
      if (member instanceof DeclConvertible ||
          member.kind() == NodeKind.LINE ||
          member.kind() == NodeKind.EMPTY) {
        member.appendTo(sb);
      } else {
        mismatch(member, "declaration", context);
      }
    }
    sb.decreaseIndent();
    sb.indent();
    sb.append('}');
  }

  /**
   * Append the operand of a prefix or ternary operator.  Assignments
   * and ternaries are parenthesized, as are binary operations if
   * tight is set, i.e. the operator binds tighter than any infix.
   */
  static void appendOperand(SourceBuilder sb, ExprConvertible operand,
                            boolean tight)
  {
    if (!(operand instanceof SwiftTree)) {
      operand.appendExpr(sb);
      return;
    }
    SwiftTree node = (SwiftTree)operand;
    boolean parens;
    switch (node.kind()) {
      case CONDITIONAL_OP:
      case ASSIGNMENT:
      case PLUS_ASSIGN:
        parens = true;
        break;
      case INFIX:
        Integer level = Infix.precedence(((Infix)node).getOperator());
        parens = tight || level == null || level == 0;
        break;
      case AWAIT:
        parens = tight;
        break;
      default:
        parens = false;
        break;
    }
    if (parens) {
      sb.append('(');
      operand.appendExpr(sb);
      sb.append(')');
    } else {
      operand.appendExpr(sb);
    }
  }

  /**
   * Typed slots hold role interfaces; every implementation is a
   * SwiftTree
   */
  static SwiftTree asTree(Object node, String context)
  {
    if (!(node instanceof SwiftTree)) {
      throw new DslMisuseError(context, "not a tree node: " + node);
    }
    return (SwiftTree)node;
  }

  private static void mismatch(SwiftTree node, String role,
                               String context)
  {
    String msg = context + ": " + node.kind() + " node cannot be used"
               + " as " + role + ", emitting empty placeholder";
    if (Settings.strictRendering()) {
      throw new SKitRuntimeError(context + ": " + node.kind() +
                           " node cannot be used as " + role);
    }
    Logging.uniqueWarn(msg);
  }
}
