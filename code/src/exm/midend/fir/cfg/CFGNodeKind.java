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

package exm.midend.fir.cfg;

/**
 * Kinds of control flow graph node.  Paired kinds mark entry to and
 * exit from a construct.
 */
public enum CFGNodeKind {
  FUNCTION_ENTER,
  FUNCTION_EXIT,

  BLOCK_ENTER,
  BLOCK_EXIT,

  WHEN_ENTER,
  WHEN_EXIT,
  WHEN_BRANCH_CONDITION_ENTER,
  WHEN_BRANCH_CONDITION_EXIT,
  WHEN_BRANCH_RESULT_ENTER,
  WHEN_BRANCH_RESULT_EXIT,

  LOOP_ENTER,
  LOOP_EXIT,
  LOOP_CONDITION_ENTER,
  LOOP_CONDITION_EXIT,
  LOOP_BLOCK_ENTER,
  LOOP_BLOCK_EXIT,

  TRY_EXPRESSION_ENTER,
  TRY_EXPRESSION_EXIT,
  TRY_MAIN_BLOCK_ENTER,
  TRY_MAIN_BLOCK_EXIT,
  CATCH_CLAUSE_ENTER,
  CATCH_CLAUSE_EXIT,
  FINALLY_PROXY_ENTER,
  FINALLY_PROXY_EXIT,
  FINALLY_BLOCK_ENTER,
  FINALLY_BLOCK_EXIT,

  BINARY_AND_ENTER,
  BINARY_AND_EXIT_LEFT_OPERAND,
  BINARY_AND_ENTER_RIGHT_OPERAND,
  BINARY_AND_EXIT,
  BINARY_OR_ENTER,
  BINARY_OR_EXIT_LEFT_OPERAND,
  BINARY_OR_ENTER_RIGHT_OPERAND,
  BINARY_OR_EXIT,

  TYPE_OPERATOR_CALL,
  QUALIFIED_ACCESS,
  FUNCTION_CALL,
  JUMP,
  THROW_EXCEPTION,
  VARIABLE_DECLARATION,
  VARIABLE_ASSIGNMENT,
  CONST_EXPRESSION,
  STUB;

  /**
   * @return the kind closing this one, or null if this kind
   *      doesn't open a construct
   */
  public CFGNodeKind matchingExit() {
    switch (this) {
      case FUNCTION_ENTER:
        return FUNCTION_EXIT;
      case BLOCK_ENTER:
        return BLOCK_EXIT;
      case WHEN_ENTER:
        return WHEN_EXIT;
      case WHEN_BRANCH_CONDITION_ENTER:
        return WHEN_BRANCH_CONDITION_EXIT;
      case WHEN_BRANCH_RESULT_ENTER:
        return WHEN_BRANCH_RESULT_EXIT;
      case LOOP_ENTER:
        return LOOP_EXIT;
      case LOOP_CONDITION_ENTER:
        return LOOP_CONDITION_EXIT;
      case LOOP_BLOCK_ENTER:
        return LOOP_BLOCK_EXIT;
      case TRY_EXPRESSION_ENTER:
        return TRY_EXPRESSION_EXIT;
      case TRY_MAIN_BLOCK_ENTER:
        return TRY_MAIN_BLOCK_EXIT;
      case CATCH_CLAUSE_ENTER:
        return CATCH_CLAUSE_EXIT;
      case FINALLY_PROXY_ENTER:
        return FINALLY_PROXY_EXIT;
      case FINALLY_BLOCK_ENTER:
        return FINALLY_BLOCK_EXIT;
      case BINARY_AND_ENTER:
        return BINARY_AND_EXIT;
      case BINARY_OR_ENTER:
        return BINARY_OR_EXIT;
      default:
        return null;
    }
  }

  public boolean isEnter() {
    return matchingExit() != null;
  }
}
