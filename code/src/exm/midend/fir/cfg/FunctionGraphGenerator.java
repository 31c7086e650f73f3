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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.midend.common.exceptions.UnsupportedInputError;
import exm.midend.fir.FirElement;
import exm.midend.fir.FirVisitor;
import exm.midend.fir.FirDeclarations.FirDeclaration;
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
import exm.midend.fir.FirExpressions.FirExpression;
import exm.midend.fir.FirExpressions.FirFunctionCall;
import exm.midend.fir.FirExpressions.FirQualifiedAccessExpression;
import exm.midend.fir.FirExpressions.FirReturnExpression;
import exm.midend.fir.FirExpressions.FirStatement;
import exm.midend.fir.FirExpressions.FirThrowExpression;
import exm.midend.fir.FirExpressions.FirTryExpression;
import exm.midend.fir.FirExpressions.FirTypeOperatorCall;
import exm.midend.fir.FirExpressions.FirVariableAssignment;
import exm.midend.fir.FirExpressions.FirWhenBranch;
import exm.midend.fir.FirExpressions.FirWhenExpression;
import exm.midend.fir.FirExpressions.FirWhileLoop;
import exm.midend.fir.FirSymbol;
import exm.midend.fir.dfa.DataFlowVariable;
import exm.midend.fir.dfa.DataFlowVariableStorage;

/**
 * Walks a function in evaluation order, raising builder events and
 * registering dataflow variables as it goes.
 *
 * Operands are visited before the node of the expression using them.
 * Local functions are built into graphs of their own.
 */
public class FunctionGraphGenerator extends FirVisitor<Void, Void> {

  private final Logger logger;
  private final boolean validate;
  private final ControlFlowGraphBuilder builder;
  private final DataFlowVariableStorage variables;

  /** Graphs built so far, in order of completion */
  private final Map<FirFunction, ControlFlowGraph> graphs =
                  new LinkedHashMap<FirFunction, ControlFlowGraph>();

  /** Local variables declared in each open block, innermost on top */
  private final Deque<List<FirVariable>> blockScopes =
                  new ArrayDeque<List<FirVariable>>();

  /** Number of functions being walked, 1 inside the outermost */
  private int functionDepth = 0;

  public FunctionGraphGenerator(Logger logger, boolean validate,
                                DataFlowVariableStorage variables) {
    this.logger = logger;
    this.validate = validate;
    this.builder = new ControlFlowGraphBuilder(logger);
    this.variables = variables;
  }

  /**
   * Build graphs for function and any local functions inside it.
   * The variable storage is reset first.
   * @return graph of function
   */
  public ControlFlowGraph generate(FirFunction function) {
    variables.reset();
    blockScopes.clear();
    functionDepth = 0;
    function.accept(this, null);
    return graphs.get(function);
  }

  public Map<FirFunction, ControlFlowGraph> getGraphs() {
    return Collections.unmodifiableMap(graphs);
  }

  public DataFlowVariableStorage getVariables() {
    return variables;
  }

  @Override
  public Void visitElement(FirElement element, Void data) {
    throw new UnsupportedInputError("No control flow rule for " + element);
  }

  @Override
  public Void visitFunction(FirFunction function, Void data) {
    if (function.getBody() == null) {
      throw new UnsupportedInputError("Function " + function.getName()
                                      + " has no body");
    }
    builder.enterFunction(function);
    functionDepth++;
    for (FirValueParameter param: function.getValueParameters()) {
      variables.getOrCreateRealVariable(param.getSymbol());
    }
    function.getBody().accept(this, null);
    ControlFlowGraph graph = builder.exitFunction(function);
    functionDepth--;
    if (functionDepth > 0) {
      // Parameters of a local function go out of scope with it
      for (FirValueParameter param: function.getValueParameters()) {
        DataFlowVariable var = variables.get(param.getSymbol());
        if (var != null) {
          variables.remove(var);
        }
      }
    }

    if (validate) {
      ControlFlowGraphValidator.validate(graph);
    }
    if (logger.isTraceEnabled()) {
      logger.trace(ControlFlowGraphRenderer.render(graph));
    }
    graphs.put(function, graph);
    return null;
  }

  @Override
  public Void visitBlock(FirBlock block, Void data) {
    builder.enterBlock(block);
    blockScopes.push(new ArrayList<FirVariable>());
    for (FirStatement stmt: block.getStatements()) {
      stmt.accept(this, null);
    }
    // Locals go out of scope
    for (FirVariable local: blockScopes.pop()) {
      DataFlowVariable var = variables.get(local.getSymbol());
      if (var != null) {
        variables.remove(var);
      }
    }
    builder.exitBlock(block);
    return null;
  }

  @Override
  public Void visitVariable(FirVariable variable, Void data) {
    visitIfPresent(variable.getInitializer());
    builder.exitVariableDeclaration(variable);
    declareLocal(variable);
    return null;
  }

  private void declareLocal(FirVariable variable) {
    variables.getOrCreateRealVariable(variable.getSymbol());
    List<FirVariable> scope = blockScopes.peek();
    if (scope != null) {
      scope.add(variable);
    }
  }

  @Override
  public Void visitVariableAssignment(FirVariableAssignment assignment,
                                      Void data) {
    assignment.getRValue().accept(this, null);
    builder.exitVariableAssignment(assignment);
    attachIfTracked(assignment, assignment.getLValue());
    return null;
  }

  @Override
  public Void visitWhenExpression(FirWhenExpression when, Void data) {
    builder.enterWhenExpression(when);
    for (FirWhenBranch branch: when.getBranches()) {
      builder.enterWhenBranchCondition(branch);
      branch.getCondition().accept(this, null);
      builder.exitWhenBranchCondition(branch);
      builder.enterWhenBranchResult(branch);
      branch.getResult().accept(this, null);
      builder.exitWhenBranchResult(branch);
    }
    builder.exitWhenExpression(when);
    variables.getOrCreateSyntheticVariable(when);
    return null;
  }

  @Override
  public Void visitWhileLoop(FirWhileLoop loop, Void data) {
    builder.enterWhileLoop(loop);
    loop.getCondition().accept(this, null);
    builder.exitWhileLoopCondition(loop);
    builder.enterWhileLoopBlock(loop);
    loop.getBlock().accept(this, null);
    builder.exitWhileLoop(loop);
    return null;
  }

  @Override
  public Void visitDoWhileLoop(FirDoWhileLoop loop, Void data) {
    builder.enterDoWhileLoop(loop);
    loop.getBlock().accept(this, null);
    builder.enterDoWhileLoopCondition(loop);
    loop.getCondition().accept(this, null);
    builder.exitDoWhileLoop(loop);
    return null;
  }

  @Override
  public Void visitTryExpression(FirTryExpression tryExpr, Void data) {
    builder.enterTryExpression(tryExpr);
    tryExpr.getTryBlock().accept(this, null);
    builder.exitTryMainBlock(tryExpr);
    for (FirCatch catchClause: tryExpr.getCatches()) {
      builder.enterCatchClause(catchClause);
      FirValueParameter param = catchClause.getParameter();
      DataFlowVariable paramVar =
                variables.getOrCreateRealVariable(param.getSymbol());
      catchClause.getBlock().accept(this, null);
      variables.remove(paramVar);
      builder.exitCatchClause(catchClause);
    }
    if (tryExpr.getFinallyBlock() != null) {
      builder.enterFinallyBlock(tryExpr);
      tryExpr.getFinallyBlock().accept(this, null);
      builder.exitFinallyBlock(tryExpr);
    }
    builder.exitTryExpression(tryExpr);
    return null;
  }

  @Override
  public Void visitBinaryLogicExpression(FirBinaryLogicExpression expr,
                                         Void data) {
    builder.enterBinaryLogicExpression(expr);
    expr.getLeftOperand().accept(this, null);
    builder.exitLeftBinaryOperand(expr);
    builder.enterRightBinaryOperand(expr);
    expr.getRightOperand().accept(this, null);
    builder.exitBinaryLogicExpression(expr);
    variables.getOrCreateSyntheticVariable(expr);
    return null;
  }

  @Override
  public Void visitTypeOperatorCall(FirTypeOperatorCall call, Void data) {
    call.getArgument().accept(this, null);
    builder.exitTypeOperatorCall(call);
    variables.getOrCreateSyntheticVariable(call);
    return null;
  }

  @Override
  public Void visitQualifiedAccessExpression(
                    FirQualifiedAccessExpression expr, Void data) {
    visitIfPresent(expr.getExplicitReceiver());
    builder.exitQualifiedAccessExpression(expr);
    attachIfTracked(expr, expr.getCalleeSymbol());
    return null;
  }

  @Override
  public Void visitFunctionCall(FirFunctionCall call, Void data) {
    visitIfPresent(call.getExplicitReceiver());
    for (FirExpression arg: call.getArguments()) {
      arg.accept(this, null);
    }
    builder.exitFunctionCall(call);
    return null;
  }

  @Override
  public Void visitReturnExpression(FirReturnExpression jump, Void data) {
    visitIfPresent(jump.getResult());
    builder.exitJump(jump);
    return null;
  }

  @Override
  public Void visitBreakExpression(FirBreakExpression jump, Void data) {
    builder.exitJump(jump);
    return null;
  }

  @Override
  public Void visitContinueExpression(FirContinueExpression jump, Void data) {
    builder.exitJump(jump);
    return null;
  }

  @Override
  public Void visitConstExpression(FirConstExpression expr, Void data) {
    builder.exitConstExpression(expr);
    return null;
  }

  @Override
  public Void visitThrowExpression(FirThrowExpression expr, Void data) {
    expr.getException().accept(this, null);
    builder.exitThrowExceptionNode(expr);
    return null;
  }

  private void visitIfPresent(FirExpression expr) {
    if (expr != null) {
      expr.accept(this, null);
    }
  }

  /**
   * Map a reference to the variable of the referenced local or
   * parameter, if it is in scope
   */
  private void attachIfTracked(FirElement reference,
                      FirSymbol<? extends FirDeclaration> symbol) {
    DataFlowVariable var = variables.get(symbol);
    if (var != null) {
      variables.attachReference(reference, var);
    } else if (logger.isTraceEnabled()) {
      logger.trace("No variable for " + symbol + " at " + reference);
    }
  }
}
