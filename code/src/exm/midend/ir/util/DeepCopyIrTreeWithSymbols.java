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

package exm.midend.ir.util;

import java.util.List;

import exm.midend.common.exceptions.UnsupportedInputError;
import exm.midend.ir.IrElement;
import exm.midend.ir.IrElementVisitor;
import exm.midend.ir.IrStatement;
import exm.midend.ir.IrSymbol;
import exm.midend.ir.IrDeclarations.IrClass;
import exm.midend.ir.IrDeclarations.IrConstructor;
import exm.midend.ir.IrDeclarations.IrDeclaration;
import exm.midend.ir.IrDeclarations.IrEnumEntry;
import exm.midend.ir.IrDeclarations.IrExternalPackageFragment;
import exm.midend.ir.IrDeclarations.IrField;
import exm.midend.ir.IrDeclarations.IrFile;
import exm.midend.ir.IrDeclarations.IrFunction;
import exm.midend.ir.IrDeclarations.IrModuleFragment;
import exm.midend.ir.IrDeclarations.IrProperty;
import exm.midend.ir.IrDeclarations.IrSimpleFunction;
import exm.midend.ir.IrDeclarations.IrTypeParameter;
import exm.midend.ir.IrDeclarations.IrValueParameter;
import exm.midend.ir.IrDeclarations.IrVariable;
import exm.midend.ir.IrExpressions.IrBlockBody;
import exm.midend.ir.IrExpressions.IrBody;
import exm.midend.ir.IrExpressions.IrCall;
import exm.midend.ir.IrExpressions.IrClassReference;
import exm.midend.ir.IrExpressions.IrConst;
import exm.midend.ir.IrExpressions.IrConstructorCall;
import exm.midend.ir.IrExpressions.IrExpression;
import exm.midend.ir.IrExpressions.IrExpressionBody;
import exm.midend.ir.IrExpressions.IrFunctionReference;
import exm.midend.ir.IrExpressions.IrGetEnumValue;
import exm.midend.ir.IrExpressions.IrGetField;
import exm.midend.ir.IrExpressions.IrGetValue;
import exm.midend.ir.IrExpressions.IrMemberAccessExpression;
import exm.midend.ir.IrExpressions.IrPropertyReference;
import exm.midend.ir.IrExpressions.IrReturn;

/**
 * Copies an IR subtree.  Declared symbols come from the remapper's
 * getDeclared, references from its getReferenced.  Parents inside the
 * copy are set as children are added; the parent of the root copy is
 * left for IrUtils.patchDeclarationParents.
 */
public class DeepCopyIrTreeWithSymbols
                  extends IrElementVisitor<IrElement, Void> {
  private final SymbolRemapper symbolRemapper;
  private final DeepCopyTypeRemapper typeRemapper;

  public DeepCopyIrTreeWithSymbols(SymbolRemapper symbolRemapper,
                                   DeepCopyTypeRemapper typeRemapper) {
    this.symbolRemapper = symbolRemapper;
    this.typeRemapper = typeRemapper;
  }

  private <T extends IrElement> T copy(T element, Class<T> expected) {
    if (element == null) {
      return null;
    }
    return expected.cast(element.accept(this, null));
  }

  private <T extends IrElement> void copyAll(List<T> from, List<T> to,
                                             Class<T> expected) {
    for (T element: from) {
      to.add(copy(element, expected));
    }
  }

  private void copyAnnotations(IrDeclaration from, IrDeclaration to) {
    copyAll(from.getAnnotations(), to.getAnnotations(),
            IrConstructorCall.class);
  }

  @Override
  public IrElement visitElement(IrElement element, Void data) {
    throw new UnsupportedInputError("No copy rule for " + element);
  }

  @Override
  public IrElement visitModuleFragment(IrModuleFragment module, Void data) {
    IrModuleFragment result = new IrModuleFragment(module.getName());
    for (IrFile file: module.getFiles()) {
      result.addFile(copy(file, IrFile.class));
    }
    return result;
  }

  @Override
  public IrElement visitFile(IrFile file, Void data) {
    IrFile result = new IrFile(symbolRemapper.getDeclared(file.getSymbol()),
                               file.getFileName(), file.getFqName());
    copyAll(file.getAnnotations(), result.getAnnotations(),
            IrConstructorCall.class);
    for (IrDeclaration decl: file.getDeclarations()) {
      result.addChild(copy(decl, IrDeclaration.class));
    }
    return result;
  }

  @Override
  public IrElement visitExternalPackageFragment(
                      IrExternalPackageFragment fragment, Void data) {
    IrExternalPackageFragment result = new IrExternalPackageFragment(
              symbolRemapper.getDeclared(fragment.getSymbol()),
              fragment.getFqName());
    for (IrDeclaration decl: fragment.getDeclarations()) {
      result.addChild(copy(decl, IrDeclaration.class));
    }
    return result;
  }

  @Override
  public IrElement visitClass(IrClass cls, Void data) {
    IrClass result = new IrClass(cls.getStartOffset(), cls.getEndOffset(),
        cls.getOrigin(), symbolRemapper.getDeclared(cls.getSymbol()),
        cls.getName(), cls.getKind(), cls.getVisibility(), cls.getModality(),
        cls.isCompanion(), cls.isInner(), cls.isData(), cls.isExternal(),
        cls.isInline());
    copyAnnotations(cls, result);
    for (IrTypeParameter tp: cls.getTypeParameters()) {
      IrTypeParameter tpCopy = copy(tp, IrTypeParameter.class);
      tpCopy.setParent(result);
      result.getTypeParameters().add(tpCopy);
    }
    result.getSuperTypes().addAll(
                      typeRemapper.remapTypes(cls.getSuperTypes()));
    IrValueParameter thisReceiver = copy(cls.getThisReceiver(),
                                         IrValueParameter.class);
    if (thisReceiver != null) {
      thisReceiver.setParent(result);
      result.setThisReceiver(thisReceiver);
    }
    for (IrDeclaration decl: cls.getDeclarations()) {
      result.addChild(copy(decl, IrDeclaration.class));
    }
    return result;
  }

  @Override
  public IrElement visitSimpleFunction(IrSimpleFunction fn, Void data) {
    IrSimpleFunction result = new IrSimpleFunction(fn.getStartOffset(),
        fn.getEndOffset(), fn.getOrigin(),
        symbolRemapper.getDeclared(fn.getSymbol()), fn.getName(),
        fn.getVisibility(), fn.getModality(),
        typeRemapper.remapType(fn.getReturnType()), fn.isInline(),
        fn.isExternal(), fn.isTailrec(), fn.isSuspend());
    for (IrSymbol<IrSimpleFunction> overridden: fn.getOverriddenSymbols()) {
      result.getOverriddenSymbols().add(
                    symbolRemapper.getReferenced(overridden));
    }
    if (fn.getCorrespondingPropertySymbol() != null) {
      result.setCorrespondingPropertySymbol(symbolRemapper.getReferenced(
                    fn.getCorrespondingPropertySymbol()));
    }
    copyFunctionContents(fn, result);
    return result;
  }

  @Override
  public IrElement visitConstructor(IrConstructor ctor, Void data) {
    IrConstructor result = new IrConstructor(ctor.getStartOffset(),
        ctor.getEndOffset(), ctor.getOrigin(),
        symbolRemapper.getDeclared(ctor.getSymbol()), ctor.getName(),
        ctor.getVisibility(), typeRemapper.remapType(ctor.getReturnType()),
        ctor.isInline(), ctor.isExternal(), ctor.isPrimary());
    copyFunctionContents(ctor, result);
    return result;
  }

  private void copyFunctionContents(IrFunction from, IrFunction to) {
    copyAnnotations(from, to);
    for (IrTypeParameter tp: from.getTypeParameters()) {
      IrTypeParameter tpCopy = copy(tp, IrTypeParameter.class);
      tpCopy.setParent(to);
      to.getTypeParameters().add(tpCopy);
    }
    IrValueParameter dispatch = copy(from.getDispatchReceiverParameter(),
                                     IrValueParameter.class);
    if (dispatch != null) {
      dispatch.setParent(to);
      to.setDispatchReceiverParameter(dispatch);
    }
    IrValueParameter extension = copy(from.getExtensionReceiverParameter(),
                                      IrValueParameter.class);
    if (extension != null) {
      extension.setParent(to);
      to.setExtensionReceiverParameter(extension);
    }
    for (IrValueParameter param: from.getValueParameters()) {
      IrValueParameter paramCopy = copy(param, IrValueParameter.class);
      paramCopy.setParent(to);
      to.getValueParameters().add(paramCopy);
    }
    to.setBody(copy(from.getBody(), IrBody.class));
  }

  @Override
  public IrElement visitProperty(IrProperty prop, Void data) {
    IrProperty result = new IrProperty(prop.getStartOffset(),
        prop.getEndOffset(), prop.getOrigin(),
        symbolRemapper.getDeclared(prop.getSymbol()), prop.getName(),
        prop.getVisibility(), prop.getModality(), prop.isVar(),
        prop.isConst(), prop.isLateinit(), prop.isDelegated(),
        prop.isExternal());
    copyAnnotations(prop, result);
    result.setBackingField(copy(prop.getBackingField(), IrField.class));
    result.setGetter(copy(prop.getGetter(), IrSimpleFunction.class));
    result.setSetter(copy(prop.getSetter(), IrSimpleFunction.class));
    return result;
  }

  @Override
  public IrElement visitField(IrField field, Void data) {
    IrField result = new IrField(field.getStartOffset(),
        field.getEndOffset(), field.getOrigin(),
        symbolRemapper.getDeclared(field.getSymbol()), field.getName(),
        typeRemapper.remapType(field.getType()), field.getVisibility(),
        field.isFinal(), field.isExternal(), field.isStatic());
    copyAnnotations(field, result);
    for (IrSymbol<IrField> overridden: field.getOverriddenSymbols()) {
      result.getOverriddenSymbols().add(
                    symbolRemapper.getReferenced(overridden));
    }
    if (field.getCorrespondingPropertySymbol() != null) {
      result.setCorrespondingPropertySymbol(symbolRemapper.getReferenced(
                    field.getCorrespondingPropertySymbol()));
    }
    result.setInitializer(copy(field.getInitializer(),
                               IrExpressionBody.class));
    return result;
  }

  @Override
  public IrElement visitEnumEntry(IrEnumEntry entry, Void data) {
    IrEnumEntry result = new IrEnumEntry(entry.getStartOffset(),
        entry.getEndOffset(), entry.getOrigin(),
        symbolRemapper.getDeclared(entry.getSymbol()), entry.getName());
    copyAnnotations(entry, result);
    return result;
  }

  @Override
  public IrElement visitValueParameter(IrValueParameter param, Void data) {
    IrValueParameter result = new IrValueParameter(param.getStartOffset(),
        param.getEndOffset(), param.getOrigin(),
        symbolRemapper.getDeclared(param.getSymbol()), param.getName(),
        param.getIndex(), typeRemapper.remapType(param.getType()),
        typeRemapper.remapType(param.getVarargElementType()),
        param.isCrossinline(), param.isNoinline());
    copyAnnotations(param, result);
    result.setDefaultValue(copy(param.getDefaultValue(),
                                IrExpressionBody.class));
    return result;
  }

  @Override
  public IrElement visitTypeParameter(IrTypeParameter tp, Void data) {
    IrTypeParameter result = new IrTypeParameter(tp.getStartOffset(),
        tp.getEndOffset(), tp.getOrigin(),
        symbolRemapper.getDeclared(tp.getSymbol()), tp.getName(),
        tp.getIndex(), tp.isReified());
    copyAnnotations(tp, result);
    result.getSuperTypes().addAll(
                    typeRemapper.remapTypes(tp.getSuperTypes()));
    return result;
  }

  @Override
  public IrElement visitVariable(IrVariable var, Void data) {
    IrVariable result = new IrVariable(var.getStartOffset(),
        var.getEndOffset(), var.getOrigin(),
        symbolRemapper.getDeclared(var.getSymbol()), var.getName(),
        typeRemapper.remapType(var.getType()), var.isVar());
    copyAnnotations(var, result);
    result.setInitializer(copy(var.getInitializer(), IrExpression.class));
    return result;
  }

  @Override
  public IrElement visitBlockBody(IrBlockBody body, Void data) {
    IrBlockBody result = new IrBlockBody(body.getStartOffset(),
                                         body.getEndOffset());
    copyAll(body.getStatements(), result.getStatements(),
            IrStatement.class);
    return result;
  }

  @Override
  public IrElement visitExpressionBody(IrExpressionBody body, Void data) {
    return new IrExpressionBody(body.getStartOffset(), body.getEndOffset(),
                        copy(body.getExpression(), IrExpression.class));
  }

  private void copyArguments(IrMemberAccessExpression from,
                             IrMemberAccessExpression to) {
    to.setDispatchReceiver(copy(from.getDispatchReceiver(),
                                IrExpression.class));
    to.setExtensionReceiver(copy(from.getExtensionReceiver(),
                                 IrExpression.class));
    for (int i = 0; i < from.getValueArgumentsCount(); i++) {
      to.putValueArgument(i, copy(from.getValueArgument(i),
                                  IrExpression.class));
    }
    for (int i = 0; i < from.getTypeArgumentsCount(); i++) {
      to.putTypeArgument(i, typeRemapper.remapType(from.getTypeArgument(i)));
    }
  }

  @Override
  public IrElement visitCall(IrCall call, Void data) {
    IrSymbol<IrClass> superQualifier = call.getSuperQualifierSymbol();
    IrCall result = new IrCall(call.getStartOffset(), call.getEndOffset(),
        typeRemapper.remapType(call.getType()),
        symbolRemapper.getReferenced(call.getSymbol()),
        call.getValueArgumentsCount(), call.getTypeArgumentsCount(),
        superQualifier == null ? null :
                      symbolRemapper.getReferenced(superQualifier));
    copyArguments(call, result);
    return result;
  }

  @Override
  public IrElement visitConstructorCall(IrConstructorCall call, Void data) {
    IrConstructorCall result = new IrConstructorCall(call.getStartOffset(),
        call.getEndOffset(), typeRemapper.remapType(call.getType()),
        symbolRemapper.getReferenced(call.getSymbol()),
        call.getValueArgumentsCount(), call.getTypeArgumentsCount());
    copyArguments(call, result);
    return result;
  }

  @Override
  public IrElement visitFunctionReference(IrFunctionReference ref,
                                          Void data) {
    IrFunctionReference result = new IrFunctionReference(
        ref.getStartOffset(), ref.getEndOffset(),
        typeRemapper.remapType(ref.getType()),
        symbolRemapper.getReferenced(ref.getSymbol()),
        ref.getValueArgumentsCount(), ref.getTypeArgumentsCount());
    copyArguments(ref, result);
    return result;
  }

  @Override
  public IrElement visitPropertyReference(IrPropertyReference ref,
                                          Void data) {
    IrPropertyReference result = new IrPropertyReference(
        ref.getStartOffset(), ref.getEndOffset(),
        typeRemapper.remapType(ref.getType()),
        symbolRemapper.getReferenced(ref.getSymbol()),
        ref.getTypeArgumentsCount(),
        ref.getField() == null ? null :
                  symbolRemapper.getReferenced(ref.getField()),
        ref.getGetter() == null ? null :
                  symbolRemapper.getReferenced(ref.getGetter()),
        ref.getSetter() == null ? null :
                  symbolRemapper.getReferenced(ref.getSetter()));
    copyArguments(ref, result);
    return result;
  }

  @Override
  public IrElement visitGetValue(IrGetValue expr, Void data) {
    return new IrGetValue(expr.getStartOffset(), expr.getEndOffset(),
        typeRemapper.remapType(expr.getType()),
        symbolRemapper.getReferenced(expr.getSymbol()));
  }

  @Override
  public IrElement visitGetField(IrGetField expr, Void data) {
    return new IrGetField(expr.getStartOffset(), expr.getEndOffset(),
        typeRemapper.remapType(expr.getType()),
        symbolRemapper.getReferenced(expr.getSymbol()),
        copy(expr.getReceiver(), IrExpression.class));
  }

  @Override
  public IrElement visitGetEnumValue(IrGetEnumValue expr, Void data) {
    return new IrGetEnumValue(expr.getStartOffset(), expr.getEndOffset(),
        typeRemapper.remapType(expr.getType()),
        symbolRemapper.getReferenced(expr.getSymbol()));
  }

  @Override
  public IrElement visitClassReference(IrClassReference expr, Void data) {
    return new IrClassReference(expr.getStartOffset(), expr.getEndOffset(),
        typeRemapper.remapType(expr.getType()),
        symbolRemapper.getReferenced(expr.getClassSymbol()),
        typeRemapper.remapType(expr.getClassType()));
  }

  @Override
  public IrElement visitConst(IrConst expr, Void data) {
    return new IrConst(expr.getStartOffset(), expr.getEndOffset(),
        typeRemapper.remapType(expr.getType()), expr.getKind(),
        expr.getValue());
  }

  @Override
  public IrElement visitReturn(IrReturn expr, Void data) {
    return new IrReturn(expr.getStartOffset(), expr.getEndOffset(),
        typeRemapper.remapType(expr.getType()),
        symbolRemapper.getReferenced(expr.getReturnTargetSymbol()),
        copy(expr.getValue(), IrExpression.class));
  }
}
