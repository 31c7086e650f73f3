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
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.midend.common.exceptions.StructuralInvariantError;
import exm.midend.fir.FirElement;
import exm.midend.fir.FirDeclarations.FirFunction;
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
import exm.midend.fir.FirExpressions.FirJump;
import exm.midend.fir.FirExpressions.FirLoop;
import exm.midend.fir.FirExpressions.FirQualifiedAccessExpression;
import exm.midend.fir.FirExpressions.FirReturnExpression;
import exm.midend.fir.FirExpressions.FirThrowExpression;
import exm.midend.fir.FirExpressions.FirTryExpression;
import exm.midend.fir.FirExpressions.FirTypeOperatorCall;
import exm.midend.fir.FirExpressions.FirVariableAssignment;
import exm.midend.fir.FirExpressions.FirWhenBranch;
import exm.midend.fir.FirExpressions.FirWhenExpression;
import exm.midend.fir.FirExpressions.FirWhileLoop;
import exm.midend.fir.FirExpressions.LogicOperationKind;
import exm.midend.fir.cfg.CFGNodes.FunctionCallNode;
import exm.midend.fir.cfg.CFGNodes.QualifiedAccessNode;
import exm.midend.fir.cfg.CFGNodes.StubNode;
import exm.midend.fir.cfg.CFGNodes.ThrowExceptionNode;
import exm.midend.fir.cfg.CFGNodes.WhenBranchConditionExitNode;
import exm.midend.fir.dfa.Condition;

/**
 * Builds control flow graphs from enter/exit events raised during a
 * single traversal of each function.
 *
 * A graph is in progress between enterFunction and exitFunction.
 * Functions may nest: a local function gets its own graph, built while
 * the enclosing one is suspended.
 *
 * Deadness: nodes reached by a simple edge from a dead node are dead.
 * Join nodes are connected without propagation, then marked dead only
 * if every predecessor is dead.
 */
public class ControlFlowGraphBuilder {

  private final Logger logger;

  /** Graphs under construction, innermost function on top */
  private final Deque<GraphState> graphs = new ArrayDeque<GraphState>();

  public ControlFlowGraphBuilder(Logger logger) {
    this.logger = logger;
  }

  /**
   * @return true if no graph is under construction
   */
  public boolean isIdle() {
    return graphs.isEmpty();
  }

  /**
   * @return level that the next node of the current graph will get
   */
  public int currentLevel() {
    return state().level;
  }

  // ----------------------------------------------------------------------
  // Function
  // ----------------------------------------------------------------------

  public CFGNode enterFunction(FirFunction function) {
    ControlFlowGraph graph = new ControlFlowGraph(function);
    GraphState st = new GraphState(graph);
    graphs.push(st);

    CFGNode enter = new CFGNode(graph, CFGNodeKind.FUNCTION_ENTER,
                                function, 0);
    graph.setEnterNode(enter);
    graph.addNode(enter);
    st.exitNode = new CFGNode(graph, CFGNodeKind.FUNCTION_EXIT, function, 0);
    st.lastNode = enter;
    st.level = 1;
    if (logger.isTraceEnabled()) {
      logger.trace("Start graph of " + function.getName() + " ("
                   + graphs.size() + " in progress)");
    }
    return enter;
  }

  /**
   * Finish the innermost graph.
   * @return the completed graph
   */
  public ControlFlowGraph exitFunction(FirFunction function) {
    GraphState st = state();
    if (st.graph.getFunction() != function) {
      throw new StructuralInvariantError("Exit of function "
          + function.getName() + " but building graph of "
          + st.graph.getFunction().getName());
    }
    if (!st.constructs.isEmpty()) {
      throw new StructuralInvariantError("Unclosed construct "
          + st.constructs.peek().fir + " at exit of " + function.getName());
    }
    addEdge(st.lastNode, st.exitNode, false);
    registerJoin(st.exitNode);
    st.graph.setExitNode(st.exitNode);
    graphs.pop();
    logger.trace("Finished graph of " + function.getName() + ": "
                 + st.graph.getNodes().size() + " nodes");
    return st.graph;
  }

  // ----------------------------------------------------------------------
  // Block
  // ----------------------------------------------------------------------

  public CFGNode enterBlock(FirBlock block) {
    GraphState st = state();
    CFGNode node = addNewSimpleNode(CFGNodeKind.BLOCK_ENTER, block);
    st.constructs.push(new Construct(block, node.getLevel()));
    st.level = node.getLevel() + 1;
    return node;
  }

  public CFGNode exitBlock(FirBlock block) {
    GraphState st = state();
    Construct c = popConstruct(Construct.class, block);
    st.level = c.baseLevel;
    return addNewSimpleNode(CFGNodeKind.BLOCK_EXIT, block);
  }

  // ----------------------------------------------------------------------
  // When
  // ----------------------------------------------------------------------

  public CFGNode enterWhenExpression(FirWhenExpression when) {
    GraphState st = state();
    CFGNode node = addNewSimpleNode(CFGNodeKind.WHEN_ENTER, when);
    WhenContext ctx = new WhenContext(when, node.getLevel());
    ctx.exitNode = new CFGNode(st.graph, CFGNodeKind.WHEN_EXIT, when,
                               node.getLevel());
    st.constructs.push(ctx);
    st.level = node.getLevel() + 1;
    return node;
  }

  public CFGNode enterWhenBranchCondition(FirWhenBranch branch) {
    GraphState st = state();
    WhenContext ctx = peekConstruct(WhenContext.class);
    if (ctx.lastConditionExit != null) {
      // Continue along the false edge of the previous condition
      st.lastNode = ctx.lastConditionExit;
    }
    st.level = ctx.baseLevel + 1;
    CFGNode node = addNewSimpleNode(
                      CFGNodeKind.WHEN_BRANCH_CONDITION_ENTER, branch);
    st.level = ctx.baseLevel + 2;
    return node;
  }

  public WhenBranchConditionExitNode exitWhenBranchCondition(
                                          FirWhenBranch branch) {
    GraphState st = state();
    WhenContext ctx = peekConstruct(WhenContext.class);
    WhenBranchConditionExitNode node = new WhenBranchConditionExitNode(
                                    st.graph, branch, ctx.baseLevel + 1);
    node.setConditions(Condition.EQ_TRUE, Condition.EQ_FALSE);
    addNewSimpleNode(node);
    ctx.lastConditionExit = node;
    return node;
  }

  public CFGNode enterWhenBranchResult(FirWhenBranch branch) {
    GraphState st = state();
    WhenContext ctx = peekConstruct(WhenContext.class);
    st.level = ctx.baseLevel + 1;
    CFGNode node = addNewSimpleNode(CFGNodeKind.WHEN_BRANCH_RESULT_ENTER,
                                    branch);
    st.level = ctx.baseLevel + 2;
    return node;
  }

  public CFGNode exitWhenBranchResult(FirWhenBranch branch) {
    GraphState st = state();
    WhenContext ctx = peekConstruct(WhenContext.class);
    st.level = ctx.baseLevel + 1;
    CFGNode node = addNewSimpleNode(CFGNodeKind.WHEN_BRANCH_RESULT_EXIT,
                                    branch);
    addEdge(node, ctx.exitNode, false);
    return node;
  }

  public CFGNode exitWhenExpression(FirWhenExpression when) {
    GraphState st = state();
    WhenContext ctx = popConstruct(WhenContext.class, when);
    st.level = ctx.baseLevel;
    CFGNode falseExit = ctx.lastConditionExit != null ?
                          ctx.lastConditionExit : st.lastNode;
    if (when.isExhaustive() && ctx.lastConditionExit != null) {
      // Falling through every branch is impossible
      CFGNode stub = addStub(falseExit, ctx.baseLevel + 1);
      addEdge(stub, ctx.exitNode, false);
    } else {
      addEdge(falseExit, ctx.exitNode, false);
    }
    registerJoin(ctx.exitNode);
    st.lastNode = ctx.exitNode;
    return ctx.exitNode;
  }

  // ----------------------------------------------------------------------
  // Loops
  // ----------------------------------------------------------------------

  public CFGNode enterWhileLoop(FirWhileLoop loop) {
    GraphState st = state();
    CFGNode enter = addNewSimpleNode(CFGNodeKind.LOOP_ENTER, loop);
    int base = enter.getLevel();
    LoopContext ctx = new LoopContext(loop, base);
    ctx.exitNode = new CFGNode(st.graph, CFGNodeKind.LOOP_EXIT, loop, base);
    st.constructs.push(ctx);
    st.loops.add(ctx);

    st.level = base + 1;
    ctx.conditionEnter = addNewSimpleNode(CFGNodeKind.LOOP_CONDITION_ENTER,
                                          loop);
    st.level = base + 2;
    return enter;
  }

  public CFGNode exitWhileLoopCondition(FirWhileLoop loop) {
    GraphState st = state();
    LoopContext ctx = peekConstruct(LoopContext.class);
    checkSameElement(ctx.fir, loop);
    st.level = ctx.baseLevel + 1;
    CFGNode condExit = addNewSimpleNode(CFGNodeKind.LOOP_CONDITION_EXIT,
                                        loop);
    connectConditionFalseEdge(loop, condExit, ctx);
    return condExit;
  }

  public CFGNode enterWhileLoopBlock(FirWhileLoop loop) {
    GraphState st = state();
    LoopContext ctx = peekConstruct(LoopContext.class);
    checkSameElement(ctx.fir, loop);
    st.level = ctx.baseLevel + 1;
    CFGNode node = addNewSimpleNode(CFGNodeKind.LOOP_BLOCK_ENTER, loop);
    st.level = ctx.baseLevel + 2;
    return node;
  }

  public CFGNode exitWhileLoop(FirWhileLoop loop) {
    GraphState st = state();
    LoopContext ctx = popLoop(loop);
    st.level = ctx.baseLevel + 1;
    CFGNode blockExit = addNewSimpleNode(CFGNodeKind.LOOP_BLOCK_EXIT, loop);
    addEdge(blockExit, ctx.conditionEnter, false);
    st.level = ctx.baseLevel;
    registerJoin(ctx.exitNode);
    st.lastNode = ctx.exitNode;
    return ctx.exitNode;
  }

  public CFGNode enterDoWhileLoop(FirDoWhileLoop loop) {
    GraphState st = state();
    CFGNode enter = addNewSimpleNode(CFGNodeKind.LOOP_ENTER, loop);
    int base = enter.getLevel();
    LoopContext ctx = new LoopContext(loop, base);
    ctx.exitNode = new CFGNode(st.graph, CFGNodeKind.LOOP_EXIT, loop, base);
    // Created early: continue in the block jumps here
    ctx.conditionEnter = new CFGNode(st.graph,
                    CFGNodeKind.LOOP_CONDITION_ENTER, loop, base + 1);
    st.constructs.push(ctx);
    st.loops.add(ctx);

    st.level = base + 1;
    ctx.blockEnter = addNewSimpleNode(CFGNodeKind.LOOP_BLOCK_ENTER, loop);
    st.level = base + 2;
    return enter;
  }

  public CFGNode enterDoWhileLoopCondition(FirDoWhileLoop loop) {
    GraphState st = state();
    LoopContext ctx = peekConstruct(LoopContext.class);
    checkSameElement(ctx.fir, loop);
    st.level = ctx.baseLevel + 1;
    CFGNode blockExit = addNewSimpleNode(CFGNodeKind.LOOP_BLOCK_EXIT, loop);
    addEdge(blockExit, ctx.conditionEnter, false);
    registerJoin(ctx.conditionEnter);
    st.lastNode = ctx.conditionEnter;
    st.level = ctx.baseLevel + 2;
    return ctx.conditionEnter;
  }

  public CFGNode exitDoWhileLoop(FirDoWhileLoop loop) {
    GraphState st = state();
    LoopContext ctx = popLoop(loop);
    st.level = ctx.baseLevel + 1;
    CFGNode condExit = addNewSimpleNode(CFGNodeKind.LOOP_CONDITION_EXIT,
                                        loop);
    addEdge(condExit, ctx.blockEnter, false);
    connectConditionFalseEdge(loop, condExit, ctx);
    st.level = ctx.baseLevel;
    registerJoin(ctx.exitNode);
    st.lastNode = ctx.exitNode;
    return ctx.exitNode;
  }

  /**
   * Leave the loop when the condition is false.  A constant true
   * condition never does, so the edge goes through a dead stub.
   */
  private void connectConditionFalseEdge(FirLoop loop, CFGNode condExit,
                                         LoopContext ctx) {
    FirExpression condition = loop.getCondition();
    if (condition instanceof FirConstExpression &&
        ((FirConstExpression)condition).isBoolean(true)) {
      CFGNode stub = addStub(condExit, ctx.baseLevel + 1);
      addEdge(stub, ctx.exitNode, false);
    } else {
      addEdge(condExit, ctx.exitNode, false);
    }
    state().lastNode = condExit;
  }

  private LoopContext popLoop(FirLoop loop) {
    GraphState st = state();
    LoopContext ctx = popConstruct(LoopContext.class, loop);
    LoopContext last = st.loops.remove(st.loops.size() - 1);
    assert(last == ctx);
    return ctx;
  }

  // ----------------------------------------------------------------------
  // Try / catch / finally
  // ----------------------------------------------------------------------

  public CFGNode enterTryExpression(FirTryExpression tryExpr) {
    GraphState st = state();
    CFGNode enter = addNewSimpleNode(CFGNodeKind.TRY_EXPRESSION_ENTER,
                                     tryExpr);
    int base = enter.getLevel();
    TryContext ctx = new TryContext(tryExpr, base, st.loops.size());
    ctx.exitNode = new CFGNode(st.graph, CFGNodeKind.TRY_EXPRESSION_EXIT,
                               tryExpr, base);

    st.level = base + 1;
    ctx.mainEnter = addNewSimpleNode(CFGNodeKind.TRY_MAIN_BLOCK_ENTER,
                                     tryExpr);
    for (FirCatch catchClause: tryExpr.getCatches()) {
      CFGNode catchEnter = new CFGNode(st.graph,
              CFGNodeKind.CATCH_CLAUSE_ENTER, catchClause, base + 1);
      ctx.catchEnters.put(catchClause, catchEnter);
      addEdge(ctx.mainEnter, catchEnter, false);
    }
    if (tryExpr.getFinallyBlock() != null) {
      ctx.proxyEnter = new CFGNode(st.graph, CFGNodeKind.FINALLY_PROXY_ENTER,
                                   tryExpr, base + 1);
      ctx.proxyExit = new CFGNode(st.graph, CFGNodeKind.FINALLY_PROXY_EXIT,
                                  tryExpr, base + 1);
      // Exception not caught by any catch clause runs the finally block
      addEdge(ctx.mainEnter, ctx.proxyEnter, false);
      ctx.exceptionEscapes = true;
    }
    st.constructs.push(ctx);
    st.tries.push(ctx);
    st.level = base + 2;
    return enter;
  }

  public CFGNode exitTryMainBlock(FirTryExpression tryExpr) {
    GraphState st = state();
    TryContext ctx = peekConstruct(TryContext.class);
    checkSameElement(ctx.fir, tryExpr);
    st.level = ctx.baseLevel + 1;
    CFGNode node = addNewSimpleNode(CFGNodeKind.TRY_MAIN_BLOCK_EXIT, tryExpr);
    ctx.normalExits.add(node);
    return node;
  }

  public CFGNode enterCatchClause(FirCatch catchClause) {
    GraphState st = state();
    TryContext ctx = peekConstruct(TryContext.class);
    CFGNode enter = ctx.catchEnters.get(catchClause);
    if (enter == null) {
      throw new StructuralInvariantError("Catch clause " + catchClause
                  + " does not belong to " + ctx.fir);
    }
    ctx.phase = TryPhase.CATCH;
    registerJoin(enter);
    st.lastNode = enter;
    st.level = ctx.baseLevel + 2;
    return enter;
  }

  public CFGNode exitCatchClause(FirCatch catchClause) {
    GraphState st = state();
    TryContext ctx = peekConstruct(TryContext.class);
    st.level = ctx.baseLevel + 1;
    CFGNode node = addNewSimpleNode(CFGNodeKind.CATCH_CLAUSE_EXIT,
                                    catchClause);
    ctx.normalExits.add(node);
    return node;
  }

  public CFGNode enterFinallyBlock(FirTryExpression tryExpr) {
    GraphState st = state();
    TryContext ctx = peekConstruct(TryContext.class);
    checkSameElement(ctx.fir, tryExpr);
    if (ctx.proxyEnter == null) {
      throw new StructuralInvariantError("No finally block in " + tryExpr);
    }
    ctx.phase = TryPhase.FINALLY;
    for (CFGNode normalExit: ctx.normalExits) {
      addEdge(normalExit, ctx.proxyEnter, false);
    }
    registerJoin(ctx.proxyEnter);
    st.lastNode = ctx.proxyEnter;
    st.level = ctx.baseLevel + 2;
    CFGNode node = addNewSimpleNode(CFGNodeKind.FINALLY_BLOCK_ENTER, tryExpr);
    st.level = ctx.baseLevel + 3;
    return node;
  }

  public CFGNode exitFinallyBlock(FirTryExpression tryExpr) {
    GraphState st = state();
    TryContext ctx = peekConstruct(TryContext.class);
    checkSameElement(ctx.fir, tryExpr);
    st.level = ctx.baseLevel + 2;
    CFGNode node = addNewSimpleNode(CFGNodeKind.FINALLY_BLOCK_EXIT, tryExpr);
    addNewSimpleNode(ctx.proxyExit);
    return node;
  }

  public CFGNode exitTryExpression(FirTryExpression tryExpr) {
    GraphState st = state();
    TryContext ctx = popConstruct(TryContext.class, tryExpr);
    TryContext top = st.tries.pop();
    assert(top == ctx);
    st.level = ctx.baseLevel;

    if (ctx.proxyExit == null) {
      for (CFGNode normalExit: ctx.normalExits) {
        addEdge(normalExit, ctx.exitNode, false);
      }
    } else {
      if (ctx.phase != TryPhase.FINALLY) {
        throw new StructuralInvariantError("Finally block of " + tryExpr
                                           + " was never built");
      }
      if (anyLive(ctx.normalExits)) {
        addEdge(ctx.proxyExit, ctx.exitNode, false);
      } else {
        CFGNode stub = addStub(ctx.proxyExit, ctx.baseLevel + 1);
        addEdge(stub, ctx.exitNode, false);
      }
      // Resume whatever entered the finally block
      for (PendingJump jump: ctx.pendingJumps) {
        routeJump(ctx.proxyExit, jump.destination, jump.loopIndex);
      }
      if (ctx.exceptionEscapes) {
        routeException(ctx.proxyExit);
      }
    }

    registerJoin(ctx.exitNode);
    st.lastNode = ctx.exitNode;
    return ctx.exitNode;
  }

  private static boolean anyLive(List<CFGNode> nodes) {
    for (CFGNode node: nodes) {
      if (!node.isDead()) {
        return true;
      }
    }
    return false;
  }

  // ----------------------------------------------------------------------
  // Binary logic
  // ----------------------------------------------------------------------

  public CFGNode enterBinaryLogicExpression(FirBinaryLogicExpression expr) {
    GraphState st = state();
    boolean and = expr.getKind() == LogicOperationKind.AND;
    CFGNode enter = addNewSimpleNode(and ? CFGNodeKind.BINARY_AND_ENTER :
                                           CFGNodeKind.BINARY_OR_ENTER, expr);
    BinaryContext ctx = new BinaryContext(expr, enter.getLevel());
    ctx.exitNode = new CFGNode(st.graph, and ? CFGNodeKind.BINARY_AND_EXIT :
                          CFGNodeKind.BINARY_OR_EXIT, expr, enter.getLevel());
    st.constructs.push(ctx);
    st.level = enter.getLevel() + 1;
    return enter;
  }

  /**
   * Left operand done: the right operand may be skipped
   */
  public CFGNode exitLeftBinaryOperand(FirBinaryLogicExpression expr) {
    BinaryContext ctx = peekConstruct(BinaryContext.class);
    checkSameElement(ctx.fir, expr);
    boolean and = expr.getKind() == LogicOperationKind.AND;
    state().level = ctx.baseLevel + 1;
    CFGNode node = addNewSimpleNode(and ?
                            CFGNodeKind.BINARY_AND_EXIT_LEFT_OPERAND :
                            CFGNodeKind.BINARY_OR_EXIT_LEFT_OPERAND, expr);
    addEdge(node, ctx.exitNode, false);
    return node;
  }

  public CFGNode enterRightBinaryOperand(FirBinaryLogicExpression expr) {
    BinaryContext ctx = peekConstruct(BinaryContext.class);
    checkSameElement(ctx.fir, expr);
    boolean and = expr.getKind() == LogicOperationKind.AND;
    state().level = ctx.baseLevel + 1;
    return addNewSimpleNode(and ? CFGNodeKind.BINARY_AND_ENTER_RIGHT_OPERAND :
                            CFGNodeKind.BINARY_OR_ENTER_RIGHT_OPERAND, expr);
  }

  public CFGNode exitBinaryLogicExpression(FirBinaryLogicExpression expr) {
    GraphState st = state();
    BinaryContext ctx = popConstruct(BinaryContext.class, expr);
    addEdge(st.lastNode, ctx.exitNode, false);
    st.level = ctx.baseLevel;
    registerJoin(ctx.exitNode);
    st.lastNode = ctx.exitNode;
    return ctx.exitNode;
  }

  // ----------------------------------------------------------------------
  // Single nodes
  // ----------------------------------------------------------------------

  public CFGNode exitTypeOperatorCall(FirTypeOperatorCall call) {
    return addNewSimpleNode(CFGNodeKind.TYPE_OPERATOR_CALL, call);
  }

  public CFGNode exitConstExpression(FirConstExpression expr) {
    return addNewSimpleNode(CFGNodeKind.CONST_EXPRESSION, expr);
  }

  public CFGNode exitVariableDeclaration(FirVariable variable) {
    return addNewSimpleNode(CFGNodeKind.VARIABLE_DECLARATION, variable);
  }

  public CFGNode exitVariableAssignment(FirVariableAssignment assignment) {
    return addNewSimpleNode(CFGNodeKind.VARIABLE_ASSIGNMENT, assignment);
  }

  public QualifiedAccessNode exitQualifiedAccessExpression(
                              FirQualifiedAccessExpression expr) {
    GraphState st = state();
    boolean returnsNothing = expr.getResultType().isNothing();
    QualifiedAccessNode node = new QualifiedAccessNode(st.graph, expr,
                                              returnsNothing, st.level);
    addNewSimpleNode(node);
    if (returnsNothing) {
      routeException(node);
      addStub(node, st.level);
    }
    return node;
  }

  public FunctionCallNode exitFunctionCall(FirFunctionCall call) {
    GraphState st = state();
    boolean returnsNothing = call.getResultType().isNothing();
    FunctionCallNode node = new FunctionCallNode(st.graph, call,
                                            returnsNothing, st.level);
    addNewSimpleNode(node);
    if (returnsNothing) {
      routeException(node);
      addStub(node, st.level);
    }
    return node;
  }

  public ThrowExceptionNode exitThrowExceptionNode(FirThrowExpression expr) {
    GraphState st = state();
    ThrowExceptionNode node = new ThrowExceptionNode(st.graph, expr,
                                                     st.level);
    addNewSimpleNode(node);
    routeException(node);
    addStub(node, st.level);
    return node;
  }

  public CFGNode exitJump(FirJump<?> jump) {
    GraphState st = state();
    CFGNode node = addNewSimpleNode(CFGNodeKind.JUMP, jump);
    if (jump instanceof FirReturnExpression) {
      FirFunction target = ((FirReturnExpression)jump).getTarget();
      if (target != st.graph.getFunction()) {
        throw new StructuralInvariantError("Return from "
            + target.getName() + " inside graph of "
            + st.graph.getFunction().getName());
      }
      routeJump(node, st.exitNode, -1);
    } else if (jump instanceof FirBreakExpression) {
      int loopIndex = findLoop(((FirBreakExpression)jump).getTarget());
      routeJump(node, st.loops.get(loopIndex).exitNode, loopIndex);
    } else if (jump instanceof FirContinueExpression) {
      int loopIndex = findLoop(((FirContinueExpression)jump).getTarget());
      routeJump(node, st.loops.get(loopIndex).conditionEnter, loopIndex);
    } else {
      throw new StructuralInvariantError("Unknown jump " + jump);
    }
    addStub(node, st.level);
    return node;
  }

  private int findLoop(FirLoop loop) {
    List<LoopContext> loops = state().loops;
    for (int i = loops.size() - 1; i >= 0; i--) {
      if (loops.get(i).fir == loop) {
        return i;
      }
    }
    throw new StructuralInvariantError("Jump to loop " + loop.getLabel()
                                       + " which is not being built");
  }

  // ----------------------------------------------------------------------
  // Routing
  // ----------------------------------------------------------------------

  /**
   * Connect a node that may throw to the innermost handler
   */
  private void routeException(CFGNode from) {
    GraphState st = state();
    for (TryContext ctx: st.tries) {
      if (ctx.phase == TryPhase.MAIN && !ctx.catchEnters.isEmpty()) {
        for (CFGNode catchEnter: ctx.catchEnters.values()) {
          addEdge(from, catchEnter, false);
        }
        return;
      } else if (ctx.phase != TryPhase.FINALLY && ctx.proxyEnter != null) {
        addEdge(from, ctx.proxyEnter, false);
        ctx.exceptionEscapes = true;
        return;
      }
    }
    addEdge(from, st.exitNode, false);
  }

  /**
   * Connect a jump to its destination, through the innermost finally
   * block it leaves, if any.
   * @param loopIndex index of target loop, or -1 for a return
   */
  private void routeJump(CFGNode from, CFGNode destination, int loopIndex) {
    TryContext crossed = innermostCrossedFinally(loopIndex);
    if (crossed != null) {
      addEdge(from, crossed.proxyEnter, false);
      crossed.pendingJumps.add(new PendingJump(destination, loopIndex));
    } else {
      addEdge(from, destination, false);
    }
  }

  private TryContext innermostCrossedFinally(int loopIndex) {
    for (TryContext ctx: state().tries) {
      if (loopIndex >= 0 && loopIndex >= ctx.loopDepth) {
        // Loop is inside this try, so the jump stays within it
        return null;
      }
      if (ctx.proxyEnter != null && ctx.phase != TryPhase.FINALLY) {
        return ctx;
      }
    }
    return null;
  }

  // ----------------------------------------------------------------------
  // Node and edge helpers
  // ----------------------------------------------------------------------

  private GraphState state() {
    GraphState st = graphs.peek();
    if (st == null) {
      throw new StructuralInvariantError("No graph under construction");
    }
    return st;
  }

  private static void addEdge(CFGNode from, CFGNode to,
                              boolean propagateDeadness) {
    from.connectTo(to);
    if (propagateDeadness && from.isDead()) {
      to.setDead(true);
    }
  }

  private CFGNode addNewSimpleNode(CFGNodeKind kind, FirElement fir) {
    GraphState st = state();
    return addNewSimpleNode(new CFGNode(st.graph, kind, fir, st.level));
  }

  /**
   * Register node and link it after the last node
   */
  private <T extends CFGNode> T addNewSimpleNode(T node) {
    GraphState st = state();
    st.graph.addNode(node);
    addEdge(st.lastNode, node, true);
    st.lastNode = node;
    return node;
  }

  /**
   * Register a node created earlier as a join point, and compute
   * its deadness from its predecessors
   */
  private void registerJoin(CFGNode node) {
    state().graph.addNode(node);
    markAsDeadIfNecessary(node);
  }

  private static void markAsDeadIfNecessary(CFGNode node) {
    List<CFGNode> prev = node.getPreviousNodes();
    if (prev.isEmpty()) {
      return;
    }
    for (CFGNode p: prev) {
      if (!p.isDead()) {
        node.setDead(false);
        return;
      }
    }
    node.setDead(true);
  }

  private StubNode addStub(CFGNode after, int level) {
    GraphState st = state();
    StubNode stub = new StubNode(st.graph, level);
    st.graph.addNode(stub);
    addEdge(after, stub, true);
    st.lastNode = stub;
    return stub;
  }

  private <T extends Construct> T peekConstruct(Class<T> expected) {
    Construct top = state().constructs.peek();
    if (top == null || top.getClass() != expected) {
      throw new StructuralInvariantError("Expected open "
          + expected.getSimpleName() + " but found " + top);
    }
    return expected.cast(top);
  }

  private <T extends Construct> T popConstruct(Class<T> expected,
                                               FirElement fir) {
    T top = peekConstruct(expected);
    checkSameElement(top.fir, fir);
    state().constructs.pop();
    return top;
  }

  private static void checkSameElement(FirElement open, FirElement closing) {
    if (open != closing) {
      throw new StructuralInvariantError("Exit of " + closing
                  + " does not match enter of " + open);
    }
  }

  // ----------------------------------------------------------------------
  // Builder state
  // ----------------------------------------------------------------------

  private static class GraphState {
    final ControlFlowGraph graph;
    CFGNode exitNode;
    CFGNode lastNode;
    int level;
    final Deque<Construct> constructs = new ArrayDeque<Construct>();
    /** Open loops, outermost first */
    final List<LoopContext> loops = new ArrayList<LoopContext>();
    /** Open try expressions, innermost first */
    final Deque<TryContext> tries = new ArrayDeque<TryContext>();

    GraphState(ControlFlowGraph graph) {
      this.graph = graph;
    }
  }

  private static class Construct {
    final FirElement fir;
    final int baseLevel;

    Construct(FirElement fir, int baseLevel) {
      this.fir = fir;
      this.baseLevel = baseLevel;
    }

    @Override
    public String toString() {
      return getClass().getSimpleName() + "(" + fir + ")";
    }
  }

  private static class WhenContext extends Construct {
    CFGNode exitNode;
    CFGNode lastConditionExit = null;

    WhenContext(FirWhenExpression fir, int baseLevel) {
      super(fir, baseLevel);
    }
  }

  private static class LoopContext extends Construct {
    CFGNode exitNode;
    CFGNode conditionEnter;
    /** Only for do-while */
    CFGNode blockEnter;

    LoopContext(FirLoop fir, int baseLevel) {
      super(fir, baseLevel);
    }
  }

  private static class BinaryContext extends Construct {
    CFGNode exitNode;

    BinaryContext(FirBinaryLogicExpression fir, int baseLevel) {
      super(fir, baseLevel);
    }
  }

  private static enum TryPhase {
    MAIN,
    CATCH,
    FINALLY;
  }

  private static class TryContext extends Construct {
    /** Number of loops open when the try was entered */
    final int loopDepth;
    TryPhase phase = TryPhase.MAIN;
    CFGNode exitNode;
    CFGNode mainEnter;
    final Map<FirCatch, CFGNode> catchEnters =
                    new LinkedHashMap<FirCatch, CFGNode>();
    CFGNode proxyEnter = null;
    CFGNode proxyExit = null;
    /** Exits of main block and catch clauses that complete normally */
    final List<CFGNode> normalExits = new ArrayList<CFGNode>();
    final List<PendingJump> pendingJumps = new ArrayList<PendingJump>();
    boolean exceptionEscapes = false;

    TryContext(FirTryExpression fir, int baseLevel, int loopDepth) {
      super(fir, baseLevel);
      this.loopDepth = loopDepth;
    }
  }

  private static class PendingJump {
    final CFGNode destination;
    final int loopIndex;

    PendingJump(CFGNode destination, int loopIndex) {
      this.destination = destination;
      this.loopIndex = loopIndex;
    }
  }
}
