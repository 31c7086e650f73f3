package exm.midend.fir.cfg;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.midend.common.Logging;
import exm.midend.common.exceptions.StructuralInvariantError;
import exm.midend.fir.FirElement;
import exm.midend.fir.FirTypeRef;
import exm.midend.fir.FirDeclarations.FirFunction;
import exm.midend.fir.FirDeclarations.FirValueParameter;
import exm.midend.fir.FirExpressions.FirBinaryLogicExpression;
import exm.midend.fir.FirExpressions.FirBlock;
import exm.midend.fir.FirExpressions.FirBreakExpression;
import exm.midend.fir.FirExpressions.FirConstExpression;
import exm.midend.fir.FirExpressions.FirContinueExpression;
import exm.midend.fir.FirExpressions.FirDoWhileLoop;
import exm.midend.fir.FirExpressions.FirExpression;
import exm.midend.fir.FirExpressions.FirFunctionCall;
import exm.midend.fir.FirExpressions.FirReturnExpression;
import exm.midend.fir.FirExpressions.FirStatement;
import exm.midend.fir.FirExpressions.FirThrowExpression;
import exm.midend.fir.FirExpressions.FirTryExpression;
import exm.midend.fir.FirExpressions.FirCatch;
import exm.midend.fir.FirExpressions.FirWhenBranch;
import exm.midend.fir.FirExpressions.FirWhenExpression;
import exm.midend.fir.FirExpressions.FirWhileLoop;
import exm.midend.fir.FirExpressions.LogicOperationKind;
import exm.midend.fir.dfa.DataFlowVariableStorage;

public class FunctionGraphGeneratorTest {

  private static final FirFunction EXCEPTION_CTOR =
                      new FirFunction("E", FirTypeRef.of("test.E"));
  private static final FirFunction X = new FirFunction("x", FirTypeRef.UNIT);
  private static final FirFunction Y = new FirFunction("y", FirTypeRef.UNIT);
  private static final FirFunction A =
                      new FirFunction("a", FirTypeRef.BOOLEAN);
  private static final FirFunction B =
                      new FirFunction("b", FirTypeRef.BOOLEAN);

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("FunctionGraphGeneratorTest.midend.log", true);
  }

  @Test
  public void testEmptyFunction() {
    FirFunction f = function("f");
    ControlFlowGraph graph = generate(f);

    List<CFGNodeKind> kinds = new ArrayList<CFGNodeKind>();
    for (CFGNode node: graph.getNodes()) {
      kinds.add(node.getKind());
    }
    assertEquals(Arrays.asList(CFGNodeKind.FUNCTION_ENTER,
        CFGNodeKind.BLOCK_ENTER, CFGNodeKind.BLOCK_EXIT,
        CFGNodeKind.FUNCTION_EXIT), kinds);
    assertEquals(0, graph.getEnterNode().getLevel());
    assertEquals(0, graph.getExitNode().getLevel());
    assertTrue(graph.getEnterNode().getPreviousNodes().isEmpty());
    assertTrue(graph.getExitNode().getFollowingNodes().isEmpty());
    assertFalse(graph.getExitNode().isDead());
  }

  /**
   * { throw E(); x() }: everything after the throw is dead, but the
   * exit is reached through the throw
   */
  @Test
  public void testDeadCodeAfterThrow() {
    FirFunction f = function("f",
        new FirThrowExpression(call(EXCEPTION_CTOR)), call(X));
    ControlFlowGraph graph = generate(f);

    CFGNode throwNode = single(graph, CFGNodeKind.THROW_EXCEPTION);
    assertFalse(throwNode.isDead());
    assertTrue(throwNode.getFollowingNodes().contains(graph.getExitNode()));

    CFGNode xCall = callNode(graph, X);
    assertTrue("call after throw should be dead", xCall.isDead());
    assertTrue(single(graph, CFGNodeKind.BLOCK_EXIT).isDead());
    assertTrue(single(graph, CFGNodeKind.STUB).isDead());
    assertFalse(graph.getExitNode().isDead());

    // Live exit only sees live predecessors
    assertEquals(Collections.singletonList(throwNode),
                 graph.getExitNode().getUsefulPreviousNodes());
  }

  /**
   * a() && b(): the left operand exit skips straight to the exit
   */
  @Test
  public void testShortCircuitAnd() {
    FirFunction f = function("f", new FirBinaryLogicExpression(
                          LogicOperationKind.AND, call(A), call(B)));
    ControlFlowGraph graph = generate(f);

    CFGNode enter = single(graph, CFGNodeKind.BINARY_AND_ENTER);
    CFGNode leftExit = single(graph, CFGNodeKind.BINARY_AND_EXIT_LEFT_OPERAND);
    CFGNode rightEnter = single(graph,
                                CFGNodeKind.BINARY_AND_ENTER_RIGHT_OPERAND);
    CFGNode exit = single(graph, CFGNodeKind.BINARY_AND_EXIT);
    CFGNode bCall = callNode(graph, B);

    assertEquals(Arrays.asList(exit, rightEnter),
                 leftExit.getFollowingNodes());
    assertEquals(Arrays.asList(leftExit, bCall), exit.getPreviousNodes());
    assertEquals(enter.getLevel(), exit.getLevel());
    assertEquals(enter.getLevel() + 1, leftExit.getLevel());
    assertTrue(graph.indexOf(exit) > graph.indexOf(bCall));
  }

  @Test
  public void testShortCircuitOr() {
    FirFunction f = function("f", new FirBinaryLogicExpression(
                          LogicOperationKind.OR, call(A), call(B)));
    ControlFlowGraph graph = generate(f);

    CFGNode leftExit = single(graph, CFGNodeKind.BINARY_OR_EXIT_LEFT_OPERAND);
    CFGNode exit = single(graph, CFGNodeKind.BINARY_OR_EXIT);
    assertTrue(leftExit.getFollowingNodes().contains(exit));
    assertEquals(2, exit.getPreviousNodes().size());
  }

  /**
   * while (a()) { x() }: back edge from block to condition
   */
  @Test
  public void testWhileLoop() {
    FirWhileLoop loop = new FirWhileLoop("l");
    loop.configure(call(A), block(call(X)));
    ControlFlowGraph graph = generate(function("f", loop));

    CFGNode condEnter = single(graph, CFGNodeKind.LOOP_CONDITION_ENTER);
    CFGNode condExit = single(graph, CFGNodeKind.LOOP_CONDITION_EXIT);
    CFGNode blockExit = single(graph, CFGNodeKind.LOOP_BLOCK_EXIT);
    CFGNode loopExit = single(graph, CFGNodeKind.LOOP_EXIT);

    assertTrue(blockExit.getFollowingNodes().contains(condEnter));
    assertTrue(condExit.getFollowingNodes().contains(loopExit));
    assertTrue(condExit.getFollowingNodes().contains(
                        single(graph, CFGNodeKind.LOOP_BLOCK_ENTER)));
    assertFalse(loopExit.isDead());
    assertFalse(graph.getExitNode().isDead());
  }

  @Test
  public void testInfiniteLoopExitIsDead() {
    FirWhileLoop loop = new FirWhileLoop("l");
    loop.configure(FirConstExpression.booleanConst(true), block(call(X)));
    ControlFlowGraph graph = generate(function("f", loop));

    assertTrue(single(graph, CFGNodeKind.LOOP_EXIT).isDead());
    assertTrue(graph.getExitNode().isDead());
  }

  @Test
  public void testBreakMakesLoopExitLive() {
    FirWhileLoop loop = new FirWhileLoop("l");
    loop.configure(FirConstExpression.booleanConst(true),
                   block(new FirBreakExpression(loop)));
    ControlFlowGraph graph = generate(function("f", loop));

    CFGNode jump = single(graph, CFGNodeKind.JUMP);
    CFGNode loopExit = single(graph, CFGNodeKind.LOOP_EXIT);
    assertTrue(jump.getFollowingNodes().contains(loopExit));
    assertFalse(loopExit.isDead());
    assertFalse(graph.getExitNode().isDead());
  }

  /**
   * try { x() } finally { y() }: exceptions and normal completion both
   * go through the finally proxy
   */
  @Test
  public void testTryFinally() {
    FirTryExpression tryExpr = new FirTryExpression(block(call(X)),
        Collections.<FirCatch>emptyList(), block(call(Y)), FirTypeRef.UNIT);
    ControlFlowGraph graph = generate(function("f", tryExpr));

    CFGNode mainEnter = single(graph, CFGNodeKind.TRY_MAIN_BLOCK_ENTER);
    CFGNode mainExit = single(graph, CFGNodeKind.TRY_MAIN_BLOCK_EXIT);
    CFGNode proxyEnter = single(graph, CFGNodeKind.FINALLY_PROXY_ENTER);
    CFGNode proxyExit = single(graph, CFGNodeKind.FINALLY_PROXY_EXIT);
    CFGNode tryExit = single(graph, CFGNodeKind.TRY_EXPRESSION_EXIT);

    assertTrue(mainEnter.getFollowingNodes().contains(proxyEnter));
    assertTrue(mainExit.getFollowingNodes().contains(proxyEnter));
    assertTrue(proxyExit.getFollowingNodes().contains(tryExit));
    assertTrue("uncaught exception leaves the function after finally",
        proxyExit.getFollowingNodes().contains(graph.getExitNode()));
    assertEquals(proxyEnter.getLevel(), proxyExit.getLevel());
    assertFalse(tryExit.isDead());
  }

  /**
   * when { a() -> x(); b() -> y() }: each condition exit leads to its
   * result and to the next condition, the last one to the when exit
   */
  @Test
  public void testWhenBranchEdges() {
    FirWhenExpression when = new FirWhenExpression(Arrays.asList(
          new FirWhenBranch(call(A), block(call(X))),
          new FirWhenBranch(call(B), block(call(Y)))),
        false, FirTypeRef.UNIT);
    ControlFlowGraph graph = generate(function("f", when));

    List<CFGNode> condEnters = all(graph,
                          CFGNodeKind.WHEN_BRANCH_CONDITION_ENTER);
    List<CFGNode> condExits = all(graph,
                          CFGNodeKind.WHEN_BRANCH_CONDITION_EXIT);
    List<CFGNode> resultEnters = all(graph,
                          CFGNodeKind.WHEN_BRANCH_RESULT_ENTER);
    CFGNode whenExit = single(graph, CFGNodeKind.WHEN_EXIT);
    assertEquals(2, condExits.size());

    assertEquals(Arrays.asList(resultEnters.get(0), condEnters.get(1)),
                 condExits.get(0).getFollowingNodes());
    assertEquals(Arrays.asList(resultEnters.get(1), whenExit),
                 condExits.get(1).getFollowingNodes());
    for (CFGNode resultExit: all(graph,
                                 CFGNodeKind.WHEN_BRANCH_RESULT_EXIT)) {
      assertTrue(resultExit.getFollowingNodes().contains(whenExit));
    }
    assertEquals(3, whenExit.getPreviousNodes().size());
    assertFalse(whenExit.isDead());
  }

  /**
   * try { throw E(); x() } catch (e: E) { y() }: the throw goes to the
   * catch clause and the rest of the main block is dead
   */
  @Test
  public void testThrowGoesToCatch() {
    FirCatch catchClause = new FirCatch(
        new FirValueParameter("e", FirTypeRef.of("test.E")), block(call(Y)));
    FirTryExpression tryExpr = new FirTryExpression(
        block(new FirThrowExpression(call(EXCEPTION_CTOR)), call(X)),
        Collections.singletonList(catchClause), null, FirTypeRef.UNIT);
    ControlFlowGraph graph = generate(function("f", tryExpr));

    CFGNode throwNode = single(graph, CFGNodeKind.THROW_EXCEPTION);
    CFGNode catchEnter = single(graph, CFGNodeKind.CATCH_CLAUSE_ENTER);
    CFGNode mainExit = single(graph, CFGNodeKind.TRY_MAIN_BLOCK_EXIT);
    CFGNode tryExit = single(graph, CFGNodeKind.TRY_EXPRESSION_EXIT);

    assertTrue(throwNode.getFollowingNodes().contains(catchEnter));
    assertFalse("throw is caught",
        throwNode.getFollowingNodes().contains(graph.getExitNode()));
    assertTrue(catchEnter.getPreviousNodes().contains(
                        single(graph, CFGNodeKind.TRY_MAIN_BLOCK_ENTER)));
    assertFalse(catchEnter.isDead());
    assertTrue(callNode(graph, X).isDead());
    assertTrue(mainExit.isDead());
    assertFalse(callNode(graph, Y).isDead());
    assertFalse(tryExit.isDead());
    assertEquals(Collections.singletonList(
                    single(graph, CFGNodeKind.CATCH_CLAUSE_EXIT)),
                 tryExit.getUsefulPreviousNodes());
  }

  /**
   * while (true) { try { break } finally { y() } }: the break runs the
   * finally block and resumes at the loop exit
   */
  @Test
  public void testBreakThroughFinally() {
    FirWhileLoop loop = new FirWhileLoop("l");
    FirTryExpression tryExpr = new FirTryExpression(
        block(new FirBreakExpression(loop)),
        Collections.<FirCatch>emptyList(), block(call(Y)), FirTypeRef.UNIT);
    loop.configure(FirConstExpression.booleanConst(true), block(tryExpr));
    ControlFlowGraph graph = generate(function("f", loop));

    CFGNode jump = single(graph, CFGNodeKind.JUMP);
    CFGNode proxyEnter = single(graph, CFGNodeKind.FINALLY_PROXY_ENTER);
    CFGNode proxyExit = single(graph, CFGNodeKind.FINALLY_PROXY_EXIT);
    CFGNode loopExit = single(graph, CFGNodeKind.LOOP_EXIT);

    assertTrue(jump.getFollowingNodes().contains(proxyEnter));
    assertFalse(jump.getFollowingNodes().contains(loopExit));
    assertTrue(proxyExit.getFollowingNodes().contains(loopExit));
    assertTrue(proxyExit.getFollowingNodes().contains(graph.getExitNode()));
    assertTrue("main block never completes normally",
        single(graph, CFGNodeKind.TRY_MAIN_BLOCK_EXIT).isDead());
    assertTrue(single(graph, CFGNodeKind.TRY_EXPRESSION_EXIT).isDead());
    assertFalse(loopExit.isDead());
    assertFalse(graph.getExitNode().isDead());
  }

  /**
   * try { return } finally { y() }: the return reaches the function exit
   * only through the finally block
   */
  @Test
  public void testReturnThroughFinally() {
    FirFunction f = new FirFunction("f", FirTypeRef.UNIT);
    FirTryExpression tryExpr = new FirTryExpression(
        block(new FirReturnExpression(f, null)),
        Collections.<FirCatch>emptyList(), block(call(Y)), FirTypeRef.UNIT);
    f.setBody(block(tryExpr));
    ControlFlowGraph graph = generate(f);

    CFGNode jump = single(graph, CFGNodeKind.JUMP);
    CFGNode proxyEnter = single(graph, CFGNodeKind.FINALLY_PROXY_ENTER);
    CFGNode proxyExit = single(graph, CFGNodeKind.FINALLY_PROXY_EXIT);
    assertTrue(jump.getFollowingNodes().contains(proxyEnter));
    assertFalse(jump.getFollowingNodes().contains(graph.getExitNode()));
    assertTrue(proxyExit.getFollowingNodes().contains(graph.getExitNode()));
    assertFalse(callNode(graph, Y).isDead());
    assertFalse(graph.getExitNode().isDead());
  }

  /**
   * do { continue } while (a()): continue goes to the condition, which
   * loops back to the block
   */
  @Test
  public void testDoWhileContinue() {
    FirDoWhileLoop loop = new FirDoWhileLoop("l");
    loop.configure(call(A), block(new FirContinueExpression(loop)));
    ControlFlowGraph graph = generate(function("f", loop));

    CFGNode jump = single(graph, CFGNodeKind.JUMP);
    CFGNode blockEnter = single(graph, CFGNodeKind.LOOP_BLOCK_ENTER);
    CFGNode blockExit = single(graph, CFGNodeKind.LOOP_BLOCK_EXIT);
    CFGNode condEnter = single(graph, CFGNodeKind.LOOP_CONDITION_ENTER);
    CFGNode condExit = single(graph, CFGNodeKind.LOOP_CONDITION_EXIT);
    CFGNode loopExit = single(graph, CFGNodeKind.LOOP_EXIT);

    assertTrue(jump.getFollowingNodes().contains(condEnter));
    assertTrue(blockExit.isDead());
    assertFalse("reached through continue", condEnter.isDead());
    assertTrue(graph.indexOf(condEnter) > graph.indexOf(blockExit));
    assertTrue(condExit.getFollowingNodes().contains(blockEnter));
    assertTrue(condExit.getFollowingNodes().contains(loopExit));
    assertFalse(loopExit.isDead());
  }

  @Test
  public void testLocalFunctionParametersGoOutOfScope() {
    FirValueParameter outerParam = new FirValueParameter("n", FirTypeRef.INT);
    FirValueParameter localParam = new FirValueParameter("m", FirTypeRef.INT);
    FirFunction local = new FirFunction("local", FirTypeRef.UNIT,
                                        Arrays.asList(localParam));
    local.setBody(block(call(X)));
    FirFunction f = new FirFunction("f", FirTypeRef.UNIT,
                                    Arrays.asList(outerParam));
    f.setBody(block(local, call(Y)));

    DataFlowVariableStorage variables = new DataFlowVariableStorage();
    new FunctionGraphGenerator(Logging.getMidendLogger(), true, variables)
                                                              .generate(f);
    assertNull(variables.get(localParam.getSymbol()));
    assertNotNull(variables.get(outerParam.getSymbol()));
  }

  @Test
  public void testValidatorRejectsLevelMismatch() {
    FirFunction f = new FirFunction("f", FirTypeRef.UNIT);
    ControlFlowGraph graph = new ControlFlowGraph(f);
    CFGNode enter = new CFGNode(graph, CFGNodeKind.FUNCTION_ENTER, f, 0);
    CFGNode exit = new CFGNode(graph, CFGNodeKind.FUNCTION_EXIT, f, 1);
    graph.addNode(enter);
    graph.addNode(exit);
    graph.setEnterNode(enter);
    graph.setExitNode(exit);
    enter.connectTo(exit);

    exception.expect(StructuralInvariantError.class);
    exception.expectMessage("level");
    ControlFlowGraphValidator.validate(graph);
  }

  @Test
  public void testLocalFunctionGetsOwnGraph() {
    FirFunction local = function("local", call(X));
    FirFunction f = function("f", local, call(Y));
    DataFlowVariableStorage variables = new DataFlowVariableStorage();
    FunctionGraphGenerator generator = new FunctionGraphGenerator(
                    Logging.getMidendLogger(), true, variables);
    ControlFlowGraph graph = generator.generate(f);

    assertEquals(2, generator.getGraphs().size());
    assertSame(graph, generator.getGraphs().get(f));
    ControlFlowGraph localGraph = generator.getGraphs().get(local);
    for (CFGNode node: localGraph.getNodes()) {
      assertSame(localGraph, node.getOwner());
    }
  }

  @Test
  public void testMismatchedExit() {
    ControlFlowGraphBuilder builder = new ControlFlowGraphBuilder(
                                              Logging.getMidendLogger());
    FirFunction f = new FirFunction("f", FirTypeRef.UNIT);
    builder.enterFunction(f);
    builder.enterBlock(block());

    exception.expect(StructuralInvariantError.class);
    builder.exitBlock(block());
  }

  @Test
  public void testExitFunctionWithOpenBlock() {
    ControlFlowGraphBuilder builder = new ControlFlowGraphBuilder(
                                              Logging.getMidendLogger());
    FirFunction f = new FirFunction("f", FirTypeRef.UNIT);
    builder.enterFunction(f);
    builder.enterBlock(block());

    exception.expect(StructuralInvariantError.class);
    builder.exitFunction(f);
  }

  @Test
  public void testBuilderIdleAfterFunction() {
    ControlFlowGraphBuilder builder = new ControlFlowGraphBuilder(
                                              Logging.getMidendLogger());
    FirFunction f = new FirFunction("f", FirTypeRef.UNIT);
    assertTrue(builder.isIdle());
    builder.enterFunction(f);
    assertFalse(builder.isIdle());
    assertEquals(1, builder.currentLevel());
    builder.exitFunction(f);
    assertTrue(builder.isIdle());
  }

  private static ControlFlowGraph generate(FirFunction f) {
    FunctionGraphGenerator generator = new FunctionGraphGenerator(
        Logging.getMidendLogger(), true, new DataFlowVariableStorage());
    return generator.generate(f);
  }

  private static FirFunction function(String name,
                                      FirStatement ... statements) {
    FirFunction f = new FirFunction(name, FirTypeRef.UNIT);
    f.setBody(block(statements));
    return f;
  }

  private static FirBlock block(FirStatement ... statements) {
    return new FirBlock(Arrays.asList(statements), FirTypeRef.UNIT);
  }

  private static FirFunctionCall call(FirFunction callee) {
    return new FirFunctionCall(callee.getSymbol(), null,
                               Collections.<FirExpression>emptyList());
  }

  private static CFGNode single(ControlFlowGraph graph, CFGNodeKind kind) {
    CFGNode result = null;
    for (CFGNode node: graph.getNodes()) {
      if (node.getKind() == kind) {
        assertTrue("More than one " + kind, result == null);
        result = node;
      }
    }
    assertTrue("No " + kind + " in " + graph, result != null);
    return result;
  }

  private static List<CFGNode> all(ControlFlowGraph graph,
                                   CFGNodeKind kind) {
    List<CFGNode> result = new ArrayList<CFGNode>();
    for (CFGNode node: graph.getNodes()) {
      if (node.getKind() == kind) {
        result.add(node);
      }
    }
    return result;
  }

  private static CFGNode callNode(ControlFlowGraph graph,
                                  FirFunction callee) {
    for (CFGNode node: graph.getNodes()) {
      FirElement fir = node.getFir();
      if (node.getKind() == CFGNodeKind.FUNCTION_CALL &&
          ((FirFunctionCall)fir).getCalleeSymbol() == callee.getSymbol()) {
        return node;
      }
    }
    throw new AssertionError("No call of " + callee.getName());
  }
}
