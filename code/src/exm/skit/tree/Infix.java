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

import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import exm.skit.builder.Blocks;
import exm.skit.builder.BlockBuilder;
import exm.skit.builder.NodeSequence;
import exm.skit.common.exceptions.DslMisuseError;

/**
 * Binary operator application: lhs op rhs
 *
 * Operands are parenthesized wherever Swift's operator precedence
 * would otherwise group the output differently from the tree.
 * Operators outside the standard library's precedence groups always
 * get parenthesized operands.
 */
public class Infix extends Expression
{
  private static final int ASSIGNMENT_LEVEL = 0;

  /** Standard precedence groups, higher binds tighter */
  private static final Map<String, Integer> PRECEDENCE =
      ImmutableMap.<String, Integer>builder()
      .put("=", ASSIGNMENT_LEVEL).put("*=", ASSIGNMENT_LEVEL)
      .put("/=", ASSIGNMENT_LEVEL).put("%=", ASSIGNMENT_LEVEL)
      .put("+=", ASSIGNMENT_LEVEL).put("-=", ASSIGNMENT_LEVEL)
      .put("<<=", ASSIGNMENT_LEVEL).put(">>=", ASSIGNMENT_LEVEL)
      .put("&=", ASSIGNMENT_LEVEL).put("|=", ASSIGNMENT_LEVEL)
      .put("^=", ASSIGNMENT_LEVEL)
      .put("||", 2)
      .put("&&", 3)
      .put("<", 4).put("<=", 4).put(">", 4).put(">=", 4)
      .put("==", 4).put("!=", 4).put("===", 4).put("!==", 4)
      .put("~=", 4)
      .put("??", 5)
      .put("...", 6).put("..<", 6)
      .put("+", 7).put("-", 7).put("&+", 7).put("&-", 7)
      .put("|", 7).put("^", 7)
      .put("*", 8).put("/", 8).put("%", 8).put("&*", 8).put("&", 8)
      .put("<<", 9).put(">>", 9).put("&<<", 9).put("&>>", 9)
      .build();

  /** Groups that associate to the right; the rest at these levels
   *  are left associative */
  private static final Set<Integer> RIGHT_ASSOCIATIVE =
      ImmutableSet.of(ASSIGNMENT_LEVEL, 5);

  /** Comparison and range formation do not associate */
  private static final Set<Integer> NON_ASSOCIATIVE = ImmutableSet.of(4, 6);

  private final String operator;
  private final SwiftTree lhs;
  private final SwiftTree rhs;

  public Infix(String operator, ExprConvertible lhs, ExprConvertible rhs)
  {
    this.operator = operator;
    this.lhs = Renderer.asTree(lhs, "Infix " + operator);
    this.rhs = Renderer.asTree(rhs, "Infix " + operator);
  }

  /**
   * @param operands must produce exactly two nodes
   */
  public Infix(String operator, BlockBuilder operands)
  {
    NodeSequence seq = Blocks.of(operands);
    if (seq.size() != 2) {
      throw new DslMisuseError("Infix " + operator,
          "expected exactly two operands, got " + seq.size());
    }
    this.operator = operator;
    this.lhs = seq.get(0);
    this.rhs = seq.get(1);
  }

  public String getOperator()
  {
    return operator;
  }

  @Override
  public NodeKind kind()
  {
    return NodeKind.INFIX;
  }

  /**
   * @return precedence level, or null for an operator we don't know
   */
  static Integer precedence(String op)
  {
    return PRECEDENCE.get(op);
  }

  /**
   * Whether operand needs parentheses to keep its grouping as the
   * left (or right) operand of this operator
   */
  boolean needsParens(SwiftTree operand, boolean left)
  {
    switch (operand.kind()) {
      case CONDITIONAL_OP:
      case ASSIGNMENT:
      case PLUS_ASSIGN:
      case AWAIT:
        return true;
      case INFIX:
        break;
      default:
        return false;
    }
    Integer outer = precedence(operator);
    Integer inner = precedence(((Infix)operand).operator);
    if (outer == null || inner == null) {
      return true;
    }
    if (inner.intValue() != outer.intValue()) {
      return inner < outer;
    }
    if (NON_ASSOCIATIVE.contains(outer)) {
      return true;
    } else if (RIGHT_ASSOCIATIVE.contains(outer)) {
      return left;
    } else {
      return !left;
    }
  }

  @Override
  public void appendExpr(SourceBuilder sb)
  {
    appendOperand(sb, lhs, true);
    sb.append(' ').append(operator).append(' ');
    appendOperand(sb, rhs, false);
  }

  private void appendOperand(SourceBuilder sb, SwiftTree operand,
                             boolean left)
  {
    if (needsParens(operand, left)) {
      sb.append('(');
      Renderer.appendExpr(sb, operand, "Infix " + operator);
      sb.append(')');
    } else {
      Renderer.appendExpr(sb, operand, "Infix " + operator);
    }
  }
}
