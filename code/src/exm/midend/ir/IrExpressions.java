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

package exm.midend.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.midend.common.exceptions.StructuralInvariantError;
import exm.midend.ir.IrDeclarations.IrClass;
import exm.midend.ir.IrDeclarations.IrConstructor;
import exm.midend.ir.IrDeclarations.IrEnumEntry;
import exm.midend.ir.IrDeclarations.IrField;
import exm.midend.ir.IrDeclarations.IrFunction;
import exm.midend.ir.IrDeclarations.IrProperty;
import exm.midend.ir.IrDeclarations.IrSimpleFunction;
import exm.midend.ir.IrDeclarations.IrValueDeclaration;
import exm.midend.ir.IrTypes.IrType;

/**
 * Bodies and expressions of the IR tree
 */
public class IrExpressions {

  // --------------------------------------------------------------------
  // Bodies
  // --------------------------------------------------------------------

  public static abstract class IrBody implements IrElement {
    private final int startOffset;
    private final int endOffset;

    protected IrBody(int startOffset, int endOffset) {
      this.startOffset = startOffset;
      this.endOffset = endOffset;
    }

    public int getStartOffset() {
      return startOffset;
    }

    public int getEndOffset() {
      return endOffset;
    }
  }

  public static class IrBlockBody extends IrBody {
    private final List<IrStatement> statements = new ArrayList<IrStatement>();

    public IrBlockBody(int startOffset, int endOffset) {
      super(startOffset, endOffset);
    }

    public List<IrStatement> getStatements() {
      return statements;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
      return visitor.visitBlockBody(this, data);
    }

    @Override
    public <D> void acceptChildren(IrElementVisitor<?, D> visitor, D data) {
      IrTransforms.acceptAll(statements, visitor, data);
    }

    @Override
    public <D> void transformChildren(IrElementTransformer<D> transformer,
                                      D data) {
      IrTransforms.transformList(statements, IrStatement.class,
                                 transformer, data);
    }

    @Override
    public String toString() {
      return "IrBlockBody" + statements;
    }
  }

  /**
   * Body consisting of a single expression, e.g. a default value or
   * field initializer
   */
  public static class IrExpressionBody extends IrBody {
    private IrExpression expression;

    public IrExpressionBody(int startOffset, int endOffset,
                            IrExpression expression) {
      super(startOffset, endOffset);
      this.expression = expression;
    }

    public IrExpressionBody(IrExpression expression) {
      this(expression.getStartOffset(), expression.getEndOffset(),
           expression);
    }

    public IrExpression getExpression() {
      return expression;
    }

    public void setExpression(IrExpression expression) {
      this.expression = expression;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
      return visitor.visitExpressionBody(this, data);
    }

    @Override
    public <D> void acceptChildren(IrElementVisitor<?, D> visitor, D data) {
      expression.accept(visitor, data);
    }

    @Override
    public <D> void transformChildren(IrElementTransformer<D> transformer,
                                      D data) {
      expression = IrTransforms.transform(expression, IrExpression.class,
                                          transformer, data);
    }

    @Override
    public String toString() {
      return "IrExpressionBody(" + expression + ")";
    }
  }

  // --------------------------------------------------------------------
  // Expressions
  // --------------------------------------------------------------------

  public static abstract class IrExpression implements IrStatement {
    private final int startOffset;
    private final int endOffset;
    private IrType type;

    protected IrExpression(int startOffset, int endOffset, IrType type) {
      this.startOffset = startOffset;
      this.endOffset = endOffset;
      this.type = type;
    }

    public int getStartOffset() {
      return startOffset;
    }

    public int getEndOffset() {
      return endOffset;
    }

    public IrType getType() {
      return type;
    }

    public void setType(IrType type) {
      this.type = type;
    }
  }

  /**
   * Expression that accesses a member: a call, a constructor call or
   * a callable reference.  The number of value and type arguments is
   * fixed at construction; unset arguments are null.
   */
  public static abstract class IrMemberAccessExpression extends IrExpression {
    private IrExpression dispatchReceiver = null;
    private IrExpression extensionReceiver = null;
    private final List<IrExpression> valueArguments;
    private final List<IrType> typeArguments;

    protected IrMemberAccessExpression(int startOffset, int endOffset,
                     IrType type, int valueArgumentsCount,
                     int typeArgumentsCount) {
      super(startOffset, endOffset, type);
      this.valueArguments = new ArrayList<IrExpression>(
          Collections.<IrExpression>nCopies(valueArgumentsCount, null));
      this.typeArguments = new ArrayList<IrType>(
          Collections.<IrType>nCopies(typeArgumentsCount, null));
    }

    public abstract IrSymbol<? extends IrSymbolOwner> getSymbol();

    public IrExpression getDispatchReceiver() {
      return dispatchReceiver;
    }

    public void setDispatchReceiver(IrExpression dispatchReceiver) {
      this.dispatchReceiver = dispatchReceiver;
    }

    public IrExpression getExtensionReceiver() {
      return extensionReceiver;
    }

    public void setExtensionReceiver(IrExpression extensionReceiver) {
      this.extensionReceiver = extensionReceiver;
    }

    public int getValueArgumentsCount() {
      return valueArguments.size();
    }

    public IrExpression getValueArgument(int index) {
      checkIndex(index, valueArguments.size());
      return valueArguments.get(index);
    }

    public void putValueArgument(int index, IrExpression arg) {
      checkIndex(index, valueArguments.size());
      valueArguments.set(index, arg);
    }

    public int getTypeArgumentsCount() {
      return typeArguments.size();
    }

    public IrType getTypeArgument(int index) {
      checkIndex(index, typeArguments.size());
      return typeArguments.get(index);
    }

    public void putTypeArgument(int index, IrType type) {
      checkIndex(index, typeArguments.size());
      typeArguments.set(index, type);
    }

    private void checkIndex(int index, int size) {
      if (index < 0 || index >= size) {
        throw new StructuralInvariantError("Argument index " + index +
                        " out of range [0, " + size + ") for " + this);
      }
    }

    @Override
    public <D> void acceptChildren(IrElementVisitor<?, D> visitor, D data) {
      IrTransforms.acceptIfPresent(dispatchReceiver, visitor, data);
      IrTransforms.acceptIfPresent(extensionReceiver, visitor, data);
      IrTransforms.acceptAll(valueArguments, visitor, data);
    }

    @Override
    public <D> void transformChildren(IrElementTransformer<D> transformer,
                                      D data) {
      dispatchReceiver = IrTransforms.transform(dispatchReceiver,
                                IrExpression.class, transformer, data);
      extensionReceiver = IrTransforms.transform(extensionReceiver,
                                IrExpression.class, transformer, data);
      IrTransforms.transformList(valueArguments, IrExpression.class,
                                 transformer, data);
    }

    @Override
    public String toString() {
      return getClass().getSimpleName() + "(" + getSymbol() + ")";
    }
  }

  public static abstract class IrFunctionAccessExpression
                                extends IrMemberAccessExpression {
    protected IrFunctionAccessExpression(int startOffset, int endOffset,
            IrType type, int valueArgumentsCount, int typeArgumentsCount) {
      super(startOffset, endOffset, type, valueArgumentsCount,
            typeArgumentsCount);
    }

    @Override
    public abstract IrSymbol<? extends IrFunction> getSymbol();
  }

  public static class IrCall extends IrFunctionAccessExpression {
    private final IrSymbol<IrSimpleFunction> symbol;
    /** Class named in a super-qualified call, otherwise null */
    private final IrSymbol<IrClass> superQualifierSymbol;

    public IrCall(int startOffset, int endOffset, IrType type,
                  IrSymbol<IrSimpleFunction> symbol, int valueArgumentsCount,
                  int typeArgumentsCount,
                  IrSymbol<IrClass> superQualifierSymbol) {
      super(startOffset, endOffset, type, valueArgumentsCount,
            typeArgumentsCount);
      this.symbol = symbol;
      this.superQualifierSymbol = superQualifierSymbol;
    }

    public IrCall(int startOffset, int endOffset, IrType type,
                  IrSymbol<IrSimpleFunction> symbol, int valueArgumentsCount,
                  int typeArgumentsCount) {
      this(startOffset, endOffset, type, symbol, valueArgumentsCount,
           typeArgumentsCount, null);
    }

    @Override
    public IrSymbol<IrSimpleFunction> getSymbol() {
      return symbol;
    }

    public IrSymbol<IrClass> getSuperQualifierSymbol() {
      return superQualifierSymbol;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
      return visitor.visitCall(this, data);
    }
  }

  public static class IrConstructorCall extends IrFunctionAccessExpression {
    private final IrSymbol<IrConstructor> symbol;

    public IrConstructorCall(int startOffset, int endOffset, IrType type,
                  IrSymbol<IrConstructor> symbol, int valueArgumentsCount,
                  int typeArgumentsCount) {
      super(startOffset, endOffset, type, valueArgumentsCount,
            typeArgumentsCount);
      this.symbol = symbol;
    }

    @Override
    public IrSymbol<IrConstructor> getSymbol() {
      return symbol;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
      return visitor.visitConstructorCall(this, data);
    }
  }

  public static abstract class IrCallableReference
                              extends IrMemberAccessExpression {
    protected IrCallableReference(int startOffset, int endOffset,
            IrType type, int valueArgumentsCount, int typeArgumentsCount) {
      super(startOffset, endOffset, type, valueArgumentsCount,
            typeArgumentsCount);
    }
  }

  public static class IrFunctionReference extends IrCallableReference {
    private final IrSymbol<? extends IrFunction> symbol;

    public IrFunctionReference(int startOffset, int endOffset, IrType type,
                  IrSymbol<? extends IrFunction> symbol,
                  int valueArgumentsCount, int typeArgumentsCount) {
      super(startOffset, endOffset, type, valueArgumentsCount,
            typeArgumentsCount);
      this.symbol = symbol;
    }

    @Override
    public IrSymbol<? extends IrFunction> getSymbol() {
      return symbol;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
      return visitor.visitFunctionReference(this, data);
    }
  }

  /**
   * Reference to a property.  The field and accessor symbols are those
   * the reference reads or writes through, each possibly null.
   */
  public static class IrPropertyReference extends IrCallableReference {
    private final IrSymbol<IrProperty> symbol;
    private final IrSymbol<IrField> field;
    private final IrSymbol<IrSimpleFunction> getter;
    private final IrSymbol<IrSimpleFunction> setter;

    public IrPropertyReference(int startOffset, int endOffset, IrType type,
                  IrSymbol<IrProperty> symbol, int typeArgumentsCount,
                  IrSymbol<IrField> field,
                  IrSymbol<IrSimpleFunction> getter,
                  IrSymbol<IrSimpleFunction> setter) {
      super(startOffset, endOffset, type, 0, typeArgumentsCount);
      this.symbol = symbol;
      this.field = field;
      this.getter = getter;
      this.setter = setter;
    }

    @Override
    public IrSymbol<IrProperty> getSymbol() {
      return symbol;
    }

    public IrSymbol<IrField> getField() {
      return field;
    }

    public IrSymbol<IrSimpleFunction> getGetter() {
      return getter;
    }

    public IrSymbol<IrSimpleFunction> getSetter() {
      return setter;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
      return visitor.visitPropertyReference(this, data);
    }
  }

  /**
   * Read of a parameter or local variable
   */
  public static class IrGetValue extends IrExpression {
    private final IrSymbol<? extends IrValueDeclaration> symbol;

    public IrGetValue(int startOffset, int endOffset, IrType type,
                      IrSymbol<? extends IrValueDeclaration> symbol) {
      super(startOffset, endOffset, type);
      this.symbol = symbol;
    }

    public IrSymbol<? extends IrValueDeclaration> getSymbol() {
      return symbol;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
      return visitor.visitGetValue(this, data);
    }

    @Override
    public <D> void acceptChildren(IrElementVisitor<?, D> visitor, D data) {
      // No children
    }

    @Override
    public <D> void transformChildren(IrElementTransformer<D> transformer,
                                      D data) {
      // No children
    }

    @Override
    public String toString() {
      return "IrGetValue(" + symbol + ")";
    }
  }

  public static class IrGetField extends IrExpression {
    private final IrSymbol<IrField> symbol;
    /** Null for a static field */
    private IrExpression receiver;

    public IrGetField(int startOffset, int endOffset, IrType type,
                      IrSymbol<IrField> symbol, IrExpression receiver) {
      super(startOffset, endOffset, type);
      this.symbol = symbol;
      this.receiver = receiver;
    }

    public IrSymbol<IrField> getSymbol() {
      return symbol;
    }

    public IrExpression getReceiver() {
      return receiver;
    }

    public void setReceiver(IrExpression receiver) {
      this.receiver = receiver;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
      return visitor.visitGetField(this, data);
    }

    @Override
    public <D> void acceptChildren(IrElementVisitor<?, D> visitor, D data) {
      IrTransforms.acceptIfPresent(receiver, visitor, data);
    }

    @Override
    public <D> void transformChildren(IrElementTransformer<D> transformer,
                                      D data) {
      receiver = IrTransforms.transform(receiver, IrExpression.class,
                                        transformer, data);
    }
  }

  public static class IrGetEnumValue extends IrExpression {
    private final IrSymbol<IrEnumEntry> symbol;

    public IrGetEnumValue(int startOffset, int endOffset, IrType type,
                          IrSymbol<IrEnumEntry> symbol) {
      super(startOffset, endOffset, type);
      this.symbol = symbol;
    }

    public IrSymbol<IrEnumEntry> getSymbol() {
      return symbol;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
      return visitor.visitGetEnumValue(this, data);
    }

    @Override
    public <D> void acceptChildren(IrElementVisitor<?, D> visitor, D data) {
      // No children
    }

    @Override
    public <D> void transformChildren(IrElementTransformer<D> transformer,
                                      D data) {
      // No children
    }
  }

  /**
   * Class literal, e.g. an annotation argument
   */
  public static class IrClassReference extends IrExpression {
    private final IrSymbol<IrClass> classSymbol;
    private final IrType classType;

    public IrClassReference(int startOffset, int endOffset, IrType type,
                            IrSymbol<IrClass> classSymbol, IrType classType) {
      super(startOffset, endOffset, type);
      this.classSymbol = classSymbol;
      this.classType = classType;
    }

    public IrSymbol<IrClass> getClassSymbol() {
      return classSymbol;
    }

    public IrType getClassType() {
      return classType;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
      return visitor.visitClassReference(this, data);
    }

    @Override
    public <D> void acceptChildren(IrElementVisitor<?, D> visitor, D data) {
      // No children
    }

    @Override
    public <D> void transformChildren(IrElementTransformer<D> transformer,
                                      D data) {
      // No children
    }
  }

  public static enum ConstKind {
    NULL,
    BOOLEAN,
    CHAR,
    BYTE,
    SHORT,
    INT,
    LONG,
    FLOAT,
    DOUBLE,
    STRING;
  }

  public static class IrConst extends IrExpression {
    private final ConstKind kind;
    /** Boxed value matching kind, null for NULL */
    private final Object value;

    public IrConst(int startOffset, int endOffset, IrType type,
                   ConstKind kind, Object value) {
      super(startOffset, endOffset, type);
      assert((kind == ConstKind.NULL) == (value == null)) :
                                                      kind + " " + value;
      this.kind = kind;
      this.value = value;
    }

    public static IrConst constNull(int startOffset, int endOffset,
                                    IrType type) {
      return new IrConst(startOffset, endOffset, type, ConstKind.NULL, null);
    }

    public static IrConst booleanConst(int startOffset, int endOffset,
                                       IrType type, boolean value) {
      return new IrConst(startOffset, endOffset, type, ConstKind.BOOLEAN,
                         value);
    }

    public static IrConst intConst(int startOffset, int endOffset,
                                   IrType type, int value) {
      return new IrConst(startOffset, endOffset, type, ConstKind.INT, value);
    }

    public static IrConst stringConst(int startOffset, int endOffset,
                                      IrType type, String value) {
      return new IrConst(startOffset, endOffset, type, ConstKind.STRING,
                         value);
    }

    public ConstKind getKind() {
      return kind;
    }

    public Object getValue() {
      return value;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
      return visitor.visitConst(this, data);
    }

    @Override
    public <D> void acceptChildren(IrElementVisitor<?, D> visitor, D data) {
      // No children
    }

    @Override
    public <D> void transformChildren(IrElementTransformer<D> transformer,
                                      D data) {
      // No children
    }

    @Override
    public String toString() {
      return "IrConst(" + kind + ":" + value + ")";
    }
  }

  public static class IrReturn extends IrExpression {
    private final IrSymbol<? extends IrFunction> returnTargetSymbol;
    private IrExpression value;

    public IrReturn(int startOffset, int endOffset, IrType type,
                    IrSymbol<? extends IrFunction> returnTargetSymbol,
                    IrExpression value) {
      super(startOffset, endOffset, type);
      this.returnTargetSymbol = returnTargetSymbol;
      this.value = value;
    }

    public IrSymbol<? extends IrFunction> getReturnTargetSymbol() {
      return returnTargetSymbol;
    }

    public IrExpression getValue() {
      return value;
    }

    public void setValue(IrExpression value) {
      this.value = value;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
      return visitor.visitReturn(this, data);
    }

    @Override
    public <D> void acceptChildren(IrElementVisitor<?, D> visitor, D data) {
      value.accept(visitor, data);
    }

    @Override
    public <D> void transformChildren(IrElementTransformer<D> transformer,
                                      D data) {
      value = IrTransforms.transform(value, IrExpression.class,
                                     transformer, data);
    }
  }
}
