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

import exm.midend.fir.FirStub;
import exm.midend.fir.dfa.Condition;
import exm.midend.fir.FirExpressions.FirFunctionCall;
import exm.midend.fir.FirExpressions.FirQualifiedAccessExpression;
import exm.midend.fir.FirExpressions.FirThrowExpression;
import exm.midend.fir.FirExpressions.FirWhenBranch;

/**
 * Node variants carrying data beyond the common node fields
 */
public class CFGNodes {

  /**
   * Node for an expression that may never complete normally
   */
  public interface ReturnableNothingNode {
    public boolean returnsNothing();
  }

  public static class WhenBranchConditionExitNode extends CFGNode {
    private Condition trueCondition = null;
    private Condition falseCondition = null;

    public WhenBranchConditionExitNode(ControlFlowGraph owner,
                                       FirWhenBranch fir, int level) {
      super(owner, CFGNodeKind.WHEN_BRANCH_CONDITION_EXIT, fir, level);
    }

    /**
     * Record outcome markers for the edges into the branch result and
     * onwards to the next branch
     */
    public void setConditions(Condition trueCondition,
                              Condition falseCondition) {
      this.trueCondition = trueCondition;
      this.falseCondition = falseCondition;
    }

    public Condition getTrueCondition() {
      return trueCondition;
    }

    public Condition getFalseCondition() {
      return falseCondition;
    }
  }

  public static class QualifiedAccessNode extends CFGNode
                                implements ReturnableNothingNode {
    private final boolean returnsNothing;

    public QualifiedAccessNode(ControlFlowGraph owner,
          FirQualifiedAccessExpression fir, boolean returnsNothing,
          int level) {
      super(owner, CFGNodeKind.QUALIFIED_ACCESS, fir, level);
      this.returnsNothing = returnsNothing;
    }

    @Override
    public boolean returnsNothing() {
      return returnsNothing;
    }
  }

  public static class FunctionCallNode extends CFGNode
                                implements ReturnableNothingNode {
    private final boolean returnsNothing;

    public FunctionCallNode(ControlFlowGraph owner, FirFunctionCall fir,
                            boolean returnsNothing, int level) {
      super(owner, CFGNodeKind.FUNCTION_CALL, fir, level);
      this.returnsNothing = returnsNothing;
    }

    @Override
    public boolean returnsNothing() {
      return returnsNothing;
    }
  }

  public static class ThrowExceptionNode extends CFGNode
                                implements ReturnableNothingNode {
    public ThrowExceptionNode(ControlFlowGraph owner, FirThrowExpression fir,
                              int level) {
      super(owner, CFGNodeKind.THROW_EXCEPTION, fir, level);
    }

    @Override
    public boolean returnsNothing() {
      return true;
    }
  }

  /**
   * Placeholder following code that can't complete normally.
   * Always created dead.
   */
  public static class StubNode extends CFGNode {
    public StubNode(ControlFlowGraph owner, int level) {
      super(owner, CFGNodeKind.STUB, FirStub.INSTANCE, level);
      setDead(true);
    }
  }
}
