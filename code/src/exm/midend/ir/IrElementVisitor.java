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

import exm.midend.ir.IrDeclarations.IrClass;
import exm.midend.ir.IrDeclarations.IrConstructor;
import exm.midend.ir.IrDeclarations.IrDeclaration;
import exm.midend.ir.IrDeclarations.IrEnumEntry;
import exm.midend.ir.IrDeclarations.IrExternalPackageFragment;
import exm.midend.ir.IrDeclarations.IrField;
import exm.midend.ir.IrDeclarations.IrFile;
import exm.midend.ir.IrDeclarations.IrFunction;
import exm.midend.ir.IrDeclarations.IrModuleFragment;
import exm.midend.ir.IrDeclarations.IrPackageFragment;
import exm.midend.ir.IrDeclarations.IrProperty;
import exm.midend.ir.IrDeclarations.IrSimpleFunction;
import exm.midend.ir.IrDeclarations.IrTypeParameter;
import exm.midend.ir.IrDeclarations.IrValueParameter;
import exm.midend.ir.IrDeclarations.IrVariable;
import exm.midend.ir.IrExpressions.IrBlockBody;
import exm.midend.ir.IrExpressions.IrBody;
import exm.midend.ir.IrExpressions.IrCall;
import exm.midend.ir.IrExpressions.IrCallableReference;
import exm.midend.ir.IrExpressions.IrClassReference;
import exm.midend.ir.IrExpressions.IrConst;
import exm.midend.ir.IrExpressions.IrConstructorCall;
import exm.midend.ir.IrExpressions.IrExpression;
import exm.midend.ir.IrExpressions.IrExpressionBody;
import exm.midend.ir.IrExpressions.IrFunctionAccessExpression;
import exm.midend.ir.IrExpressions.IrFunctionReference;
import exm.midend.ir.IrExpressions.IrGetEnumValue;
import exm.midend.ir.IrExpressions.IrGetField;
import exm.midend.ir.IrExpressions.IrGetValue;
import exm.midend.ir.IrExpressions.IrMemberAccessExpression;
import exm.midend.ir.IrExpressions.IrPropertyReference;
import exm.midend.ir.IrExpressions.IrReturn;

/**
 * Double dispatch over the IR tree.  Each method defaults to the one
 * for the more general element kind, ending at visitElement.
 */
public abstract class IrElementVisitor<R, D> {

  public abstract R visitElement(IrElement element, D data);

  public R visitModuleFragment(IrModuleFragment module, D data) {
    return visitElement(module, data);
  }

  public R visitPackageFragment(IrPackageFragment fragment, D data) {
    return visitElement(fragment, data);
  }

  public R visitFile(IrFile file, D data) {
    return visitPackageFragment(file, data);
  }

  public R visitExternalPackageFragment(IrExternalPackageFragment fragment,
                                        D data) {
    return visitPackageFragment(fragment, data);
  }

  public R visitDeclaration(IrDeclaration declaration, D data) {
    return visitElement(declaration, data);
  }

  public R visitClass(IrClass declaration, D data) {
    return visitDeclaration(declaration, data);
  }

  public R visitFunction(IrFunction declaration, D data) {
    return visitDeclaration(declaration, data);
  }

  public R visitSimpleFunction(IrSimpleFunction declaration, D data) {
    return visitFunction(declaration, data);
  }

  public R visitConstructor(IrConstructor declaration, D data) {
    return visitFunction(declaration, data);
  }

  public R visitProperty(IrProperty declaration, D data) {
    return visitDeclaration(declaration, data);
  }

  public R visitField(IrField declaration, D data) {
    return visitDeclaration(declaration, data);
  }

  public R visitEnumEntry(IrEnumEntry declaration, D data) {
    return visitDeclaration(declaration, data);
  }

  public R visitValueParameter(IrValueParameter declaration, D data) {
    return visitDeclaration(declaration, data);
  }

  public R visitTypeParameter(IrTypeParameter declaration, D data) {
    return visitDeclaration(declaration, data);
  }

  public R visitVariable(IrVariable declaration, D data) {
    return visitDeclaration(declaration, data);
  }

  public R visitBody(IrBody body, D data) {
    return visitElement(body, data);
  }

  public R visitBlockBody(IrBlockBody body, D data) {
    return visitBody(body, data);
  }

  public R visitExpressionBody(IrExpressionBody body, D data) {
    return visitBody(body, data);
  }

  public R visitExpression(IrExpression expression, D data) {
    return visitElement(expression, data);
  }

  public R visitMemberAccess(IrMemberAccessExpression expression, D data) {
    return visitExpression(expression, data);
  }

  public R visitFunctionAccess(IrFunctionAccessExpression expression,
                               D data) {
    return visitMemberAccess(expression, data);
  }

  public R visitCall(IrCall expression, D data) {
    return visitFunctionAccess(expression, data);
  }

  public R visitConstructorCall(IrConstructorCall expression, D data) {
    return visitFunctionAccess(expression, data);
  }

  public R visitCallableReference(IrCallableReference expression, D data) {
    return visitMemberAccess(expression, data);
  }

  public R visitFunctionReference(IrFunctionReference expression, D data) {
    return visitCallableReference(expression, data);
  }

  public R visitPropertyReference(IrPropertyReference expression, D data) {
    return visitCallableReference(expression, data);
  }

  public R visitGetValue(IrGetValue expression, D data) {
    return visitExpression(expression, data);
  }

  public R visitGetField(IrGetField expression, D data) {
    return visitExpression(expression, data);
  }

  public R visitGetEnumValue(IrGetEnumValue expression, D data) {
    return visitExpression(expression, data);
  }

  public R visitClassReference(IrClassReference expression, D data) {
    return visitExpression(expression, data);
  }

  public R visitConst(IrConst expression, D data) {
    return visitExpression(expression, data);
  }

  public R visitReturn(IrReturn expression, D data) {
    return visitExpression(expression, data);
  }
}
