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

package exm.midend.fir;

import exm.midend.fir.FirDeclarations.FirFunction;
import exm.midend.fir.FirDeclarations.FirValueParameter;
import exm.midend.fir.FirDeclarations.FirVariable;
import exm.midend.fir.FirExpressions.FirBinaryLogicExpression;
import exm.midend.fir.FirExpressions.FirBlock;
import exm.midend.fir.FirExpressions.FirBreakExpression;
import exm.midend.fir.FirExpressions.FirCatch;
import exm.midend.fir.FirExpressions.FirConstExpression;
import exm.midend.fir.FirExpressions.FirContinueExpression;
import exm.midend.fir.FirExpressions.FirDoWhileLoop;
import exm.midend.fir.FirExpressions.FirFunctionCall;
import exm.midend.fir.FirExpressions.FirQualifiedAccessExpression;
import exm.midend.fir.FirExpressions.FirReturnExpression;
import exm.midend.fir.FirExpressions.FirThrowExpression;
import exm.midend.fir.FirExpressions.FirTryExpression;
import exm.midend.fir.FirExpressions.FirTypeOperatorCall;
import exm.midend.fir.FirExpressions.FirVariableAssignment;
import exm.midend.fir.FirExpressions.FirWhenBranch;
import exm.midend.fir.FirExpressions.FirWhenExpression;
import exm.midend.fir.FirExpressions.FirWhileLoop;

/**
 * Double dispatch over the syntax forest.  Every method defaults to
 * visitElement, so subclasses only override the constructs they handle.
 */
public abstract class FirVisitor<R, D> {

  public abstract R visitElement(FirElement element, D data);

  public R visitFunction(FirFunction function, D data) {
    return visitElement(function, data);
  }

  public R visitVariable(FirVariable variable, D data) {
    return visitElement(variable, data);
  }

  public R visitValueParameter(FirValueParameter valueParameter, D data) {
    return visitVariable(valueParameter, data);
  }

  public R visitBlock(FirBlock block, D data) {
    return visitElement(block, data);
  }

  public R visitWhenExpression(FirWhenExpression whenExpression, D data) {
    return visitElement(whenExpression, data);
  }

  public R visitWhenBranch(FirWhenBranch whenBranch, D data) {
    return visitElement(whenBranch, data);
  }

  public R visitWhileLoop(FirWhileLoop loop, D data) {
    return visitElement(loop, data);
  }

  public R visitDoWhileLoop(FirDoWhileLoop loop, D data) {
    return visitElement(loop, data);
  }

  public R visitTryExpression(FirTryExpression tryExpression, D data) {
    return visitElement(tryExpression, data);
  }

  public R visitCatch(FirCatch catchClause, D data) {
    return visitElement(catchClause, data);
  }

  public R visitBinaryLogicExpression(FirBinaryLogicExpression expression,
                                      D data) {
    return visitElement(expression, data);
  }

  public R visitTypeOperatorCall(FirTypeOperatorCall call, D data) {
    return visitElement(call, data);
  }

  public R visitQualifiedAccessExpression(
                  FirQualifiedAccessExpression expression, D data) {
    return visitElement(expression, data);
  }

  public R visitFunctionCall(FirFunctionCall call, D data) {
    return visitQualifiedAccessExpression(call, data);
  }

  public R visitReturnExpression(FirReturnExpression jump, D data) {
    return visitElement(jump, data);
  }

  public R visitBreakExpression(FirBreakExpression jump, D data) {
    return visitElement(jump, data);
  }

  public R visitContinueExpression(FirContinueExpression jump, D data) {
    return visitElement(jump, data);
  }

  public R visitConstExpression(FirConstExpression expression, D data) {
    return visitElement(expression, data);
  }

  public R visitThrowExpression(FirThrowExpression expression, D data) {
    return visitElement(expression, data);
  }

  public R visitVariableAssignment(FirVariableAssignment assignment, D data) {
    return visitElement(assignment, data);
  }
}
