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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.midend.fir.FirDeclarations.FirDeclaration;
import exm.midend.fir.FirDeclarations.FirFunction;
import exm.midend.fir.FirDeclarations.FirValueParameter;
import exm.midend.fir.FirDeclarations.FirVariable;

/**
 * Statements and expressions of the resolved syntax forest.
 *
 * Every expression carries the result type computed by type inference.
 * Loops are statements, not expressions.
 */
public class FirExpressions {

  /** Anything that can appear in a block */
  public interface FirStatement extends FirElement {
  }

  public static abstract class FirExpression implements FirStatement {
    private final FirTypeRef resultType;

    protected FirExpression(FirTypeRef resultType) {
      assert(resultType != null);
      this.resultType = resultType;
    }

    public FirTypeRef getResultType() {
      return resultType;
    }
  }

  public static class FirBlock extends FirExpression {
    private final List<FirStatement> statements;

    public FirBlock(List<? extends FirStatement> statements,
                    FirTypeRef resultType) {
      super(resultType);
      this.statements = new ArrayList<FirStatement>(statements);
    }

    public List<FirStatement> getStatements() {
      return Collections.unmodifiableList(statements);
    }

    @Override
    public <R, D> R accept(FirVisitor<R, D> visitor, D data) {
      return visitor.visitBlock(this, data);
    }
  }

  public static class FirWhenExpression extends FirExpression {
    private final List<FirWhenBranch> branches;
    private final boolean exhaustive;

    /**
     * @param exhaustive if true, one of the branches is always taken
     */
    public FirWhenExpression(List<FirWhenBranch> branches, boolean exhaustive,
                             FirTypeRef resultType) {
      super(resultType);
      this.branches = new ArrayList<FirWhenBranch>(branches);
      this.exhaustive = exhaustive;
    }

    public List<FirWhenBranch> getBranches() {
      return Collections.unmodifiableList(branches);
    }

    public boolean isExhaustive() {
      return exhaustive;
    }

    @Override
    public <R, D> R accept(FirVisitor<R, D> visitor, D data) {
      return visitor.visitWhenExpression(this, data);
    }
  }

  public static class FirWhenBranch implements FirElement {
    private final FirExpression condition;
    private final FirBlock result;

    public FirWhenBranch(FirExpression condition, FirBlock result) {
      this.condition = condition;
      this.result = result;
    }

    public FirExpression getCondition() {
      return condition;
    }

    public FirBlock getResult() {
      return result;
    }

    @Override
    public <R, D> R accept(FirVisitor<R, D> visitor, D data) {
      return visitor.visitWhenBranch(this, data);
    }
  }

  /**
   * Loop condition and block are attached after construction, so that
   * break and continue expressions inside them can refer to the loop.
   */
  public static abstract class FirLoop implements FirStatement {
    private final String label;
    private FirExpression condition;
    private FirBlock block;

    protected FirLoop(String label) {
      this.label = label;
    }

    public void configure(FirExpression condition, FirBlock block) {
      assert(this.condition == null && this.block == null) :
            "Loop " + label + " already configured";
      this.condition = condition;
      this.block = block;
    }

    public String getLabel() {
      return label;
    }

    public FirExpression getCondition() {
      return condition;
    }

    public FirBlock getBlock() {
      return block;
    }
  }

  public static class FirWhileLoop extends FirLoop {
    public FirWhileLoop(String label) {
      super(label);
    }

    @Override
    public <R, D> R accept(FirVisitor<R, D> visitor, D data) {
      return visitor.visitWhileLoop(this, data);
    }
  }

  public static class FirDoWhileLoop extends FirLoop {
    public FirDoWhileLoop(String label) {
      super(label);
    }

    @Override
    public <R, D> R accept(FirVisitor<R, D> visitor, D data) {
      return visitor.visitDoWhileLoop(this, data);
    }
  }

  public static class FirTryExpression extends FirExpression {
    private final FirBlock tryBlock;
    private final List<FirCatch> catches;
    private final FirBlock finallyBlock;

    /**
     * @param finallyBlock null if absent
     */
    public FirTryExpression(FirBlock tryBlock, List<FirCatch> catches,
                            FirBlock finallyBlock, FirTypeRef resultType) {
      super(resultType);
      this.tryBlock = tryBlock;
      this.catches = new ArrayList<FirCatch>(catches);
      this.finallyBlock = finallyBlock;
    }

    public FirBlock getTryBlock() {
      return tryBlock;
    }

    public List<FirCatch> getCatches() {
      return Collections.unmodifiableList(catches);
    }

    public FirBlock getFinallyBlock() {
      return finallyBlock;
    }

    @Override
    public <R, D> R accept(FirVisitor<R, D> visitor, D data) {
      return visitor.visitTryExpression(this, data);
    }
  }

  public static class FirCatch implements FirElement {
    private final FirValueParameter parameter;
    private final FirBlock block;

    public FirCatch(FirValueParameter parameter, FirBlock block) {
      this.parameter = parameter;
      this.block = block;
    }

    public FirValueParameter getParameter() {
      return parameter;
    }

    public FirBlock getBlock() {
      return block;
    }

    @Override
    public <R, D> R accept(FirVisitor<R, D> visitor, D data) {
      return visitor.visitCatch(this, data);
    }
  }

  public enum LogicOperationKind {
    AND("&&"),
    OR("||");

    public final String token;

    private LogicOperationKind(String token) {
      this.token = token;
    }
  }

  public static class FirBinaryLogicExpression extends FirExpression {
    private final LogicOperationKind kind;
    private final FirExpression leftOperand;
    private final FirExpression rightOperand;

    public FirBinaryLogicExpression(LogicOperationKind kind,
              FirExpression leftOperand, FirExpression rightOperand) {
      super(FirTypeRef.BOOLEAN);
      this.kind = kind;
      this.leftOperand = leftOperand;
      this.rightOperand = rightOperand;
    }

    public LogicOperationKind getKind() {
      return kind;
    }

    public FirExpression getLeftOperand() {
      return leftOperand;
    }

    public FirExpression getRightOperand() {
      return rightOperand;
    }

    @Override
    public <R, D> R accept(FirVisitor<R, D> visitor, D data) {
      return visitor.visitBinaryLogicExpression(this, data);
    }
  }

  public enum FirOperation {
    IS,
    NOT_IS,
    AS,
    SAFE_AS;
  }

  public static class FirTypeOperatorCall extends FirExpression {
    private final FirOperation operation;
    private final FirExpression argument;
    private final FirTypeRef conversionTypeRef;

    public FirTypeOperatorCall(FirOperation operation, FirExpression argument,
                               FirTypeRef conversionTypeRef) {
      super(resultType(operation, conversionTypeRef));
      this.operation = operation;
      this.argument = argument;
      this.conversionTypeRef = conversionTypeRef;
    }

    private static FirTypeRef resultType(FirOperation operation,
                                         FirTypeRef conversionTypeRef) {
      switch (operation) {
        case IS:
        case NOT_IS:
          return FirTypeRef.BOOLEAN;
        case AS:
          return conversionTypeRef;
        case SAFE_AS:
          return conversionTypeRef.makeNullable();
        default:
          throw new IllegalArgumentException("Unknown operation " + operation);
      }
    }

    public FirOperation getOperation() {
      return operation;
    }

    public FirExpression getArgument() {
      return argument;
    }

    public FirTypeRef getConversionTypeRef() {
      return conversionTypeRef;
    }

    @Override
    public <R, D> R accept(FirVisitor<R, D> visitor, D data) {
      return visitor.visitTypeOperatorCall(this, data);
    }
  }

  /**
   * Reference to a property, variable or parameter, possibly through
   * an explicit receiver
   */
  public static class FirQualifiedAccessExpression extends FirExpression {
    private final FirSymbol<? extends FirDeclaration> calleeSymbol;
    private final FirExpression explicitReceiver;

    public FirQualifiedAccessExpression(
        FirSymbol<? extends FirDeclaration> calleeSymbol,
        FirExpression explicitReceiver, FirTypeRef resultType) {
      super(resultType);
      this.calleeSymbol = calleeSymbol;
      this.explicitReceiver = explicitReceiver;
    }

    public FirSymbol<? extends FirDeclaration> getCalleeSymbol() {
      return calleeSymbol;
    }

    public FirExpression getExplicitReceiver() {
      return explicitReceiver;
    }

    @Override
    public <R, D> R accept(FirVisitor<R, D> visitor, D data) {
      return visitor.visitQualifiedAccessExpression(this, data);
    }
  }

  public static class FirFunctionCall extends FirQualifiedAccessExpression {
    private final List<FirExpression> arguments;

    public FirFunctionCall(FirSymbol<FirFunction> calleeSymbol,
                           FirExpression explicitReceiver,
                           List<? extends FirExpression> arguments) {
      super(calleeSymbol, explicitReceiver,
            calleeSymbol.getFir().getReturnTypeRef());
      this.arguments = new ArrayList<FirExpression>(arguments);
    }

    public List<FirExpression> getArguments() {
      return Collections.unmodifiableList(arguments);
    }

    @Override
    public <R, D> R accept(FirVisitor<R, D> visitor, D data) {
      return visitor.visitFunctionCall(this, data);
    }
  }

  /**
   * return, break or continue.  Evaluating a jump never completes
   * normally, so its type is Nothing.
   * @param <E> kind of element jumped to
   */
  public static abstract class FirJump<E extends FirElement>
                                       extends FirExpression {
    private final E target;

    protected FirJump(E target) {
      super(FirTypeRef.NOTHING);
      this.target = target;
    }

    public E getTarget() {
      return target;
    }
  }

  public static class FirReturnExpression extends FirJump<FirFunction> {
    private final FirExpression result;

    /**
     * @param result null for a bare return
     */
    public FirReturnExpression(FirFunction target, FirExpression result) {
      super(target);
      this.result = result;
    }

    public FirExpression getResult() {
      return result;
    }

    @Override
    public <R, D> R accept(FirVisitor<R, D> visitor, D data) {
      return visitor.visitReturnExpression(this, data);
    }
  }

  public static class FirBreakExpression extends FirJump<FirLoop> {
    public FirBreakExpression(FirLoop target) {
      super(target);
    }

    @Override
    public <R, D> R accept(FirVisitor<R, D> visitor, D data) {
      return visitor.visitBreakExpression(this, data);
    }
  }

  public static class FirContinueExpression extends FirJump<FirLoop> {
    public FirContinueExpression(FirLoop target) {
      super(target);
    }

    @Override
    public <R, D> R accept(FirVisitor<R, D> visitor, D data) {
      return visitor.visitContinueExpression(this, data);
    }
  }

  public enum ConstKind {
    NULL,
    BOOLEAN,
    INT,
    LONG,
    DOUBLE,
    STRING;
  }

  public static class FirConstExpression extends FirExpression {
    private final ConstKind kind;
    private final Object value;

    public FirConstExpression(ConstKind kind, Object value,
                              FirTypeRef resultType) {
      super(resultType);
      this.kind = kind;
      this.value = value;
    }

    public static FirConstExpression booleanConst(boolean value) {
      return new FirConstExpression(ConstKind.BOOLEAN, value,
                                    FirTypeRef.BOOLEAN);
    }

    public static FirConstExpression intConst(int value) {
      return new FirConstExpression(ConstKind.INT, value, FirTypeRef.INT);
    }

    public static FirConstExpression nullConst() {
      return new FirConstExpression(ConstKind.NULL, null,
                                    FirTypeRef.NOTHING.makeNullable());
    }

    public ConstKind getKind() {
      return kind;
    }

    public Object getValue() {
      return value;
    }

    /**
     * @return true if this is the boolean constant matching value
     */
    public boolean isBoolean(boolean expected) {
      return kind == ConstKind.BOOLEAN && value.equals(expected);
    }

    @Override
    public <R, D> R accept(FirVisitor<R, D> visitor, D data) {
      return visitor.visitConstExpression(this, data);
    }
  }

  public static class FirThrowExpression extends FirExpression {
    private final FirExpression exception;

    public FirThrowExpression(FirExpression exception) {
      super(FirTypeRef.NOTHING);
      this.exception = exception;
    }

    public FirExpression getException() {
      return exception;
    }

    @Override
    public <R, D> R accept(FirVisitor<R, D> visitor, D data) {
      return visitor.visitThrowExpression(this, data);
    }
  }

  public static class FirVariableAssignment implements FirStatement {
    private final FirSymbol<FirVariable> lValue;
    private final FirExpression rValue;

    public FirVariableAssignment(FirSymbol<FirVariable> lValue,
                                 FirExpression rValue) {
      this.lValue = lValue;
      this.rValue = rValue;
    }

    public FirSymbol<FirVariable> getLValue() {
      return lValue;
    }

    public FirExpression getRValue() {
      return rValue;
    }

    @Override
    public <R, D> R accept(FirVisitor<R, D> visitor, D data) {
      return visitor.visitVariableAssignment(this, data);
    }
  }
}
