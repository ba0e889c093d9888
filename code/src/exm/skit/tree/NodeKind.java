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

/**
 * Closed set of node kinds the generator can represent
 */
public enum NodeKind {
  // Declarations
  STRUCT,
  CLASS,
  ENUM,
  PROTOCOL,
  EXTENSION,
  FUNCTION,
  INITIALIZER,
  VARIABLE,
  COMPUTED_PROPERTY,
  ENUM_CASE,
  TYPE_ALIAS,
  ASSOCIATED_TYPE,
  FUNCTION_REQUIREMENT,
  PROPERTY_REQUIREMENT,
  IMPORT,
  GROUP,
  LINE,
  EMPTY,

  // Expressions
  VARIABLE_REF,
  PROPERTY_ACCESS,
  NEGATED_PROPERTY_ACCESS,
  OPTIONAL_CHAINING,
  REFERENCE,
  CALL,
  LITERAL,
  TUPLE,
  INFIX,
  CONDITIONAL_OP,
  ASSIGNMENT,
  PLUS_ASSIGN,
  AWAIT,
  CLOSURE,
  TASK,

  // Statements and patterns
  IF,
  GUARD,
  LET,
  PATTERN_CONDITION,
  BINDING_PATTERN,
  WHILE,
  REPEAT_WHILE,
  FOR,
  SWITCH,
  SWITCH_CASE,
  DEFAULT,
  DO,
  CATCH,
  THROW,
  RETURN,
  BREAK,
  CONTINUE,
  FALLTHROUGH,
  TUPLE_ASSIGNMENT,
  ;
}
