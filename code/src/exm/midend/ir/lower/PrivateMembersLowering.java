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

package exm.midend.ir.lower;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.midend.common.Settings;
import exm.midend.ir.IrConstants;
import exm.midend.ir.IrDeclarationOrigin;
import exm.midend.ir.IrElement;
import exm.midend.ir.IrElementTransformer;
import exm.midend.ir.IrSymbol;
import exm.midend.ir.IrSymbolOwner;
import exm.midend.ir.Visibility;
import exm.midend.ir.IrDeclarations.IrClass;
import exm.midend.ir.IrDeclarations.IrDeclaration;
import exm.midend.ir.IrDeclarations.IrFile;
import exm.midend.ir.IrDeclarations.IrProperty;
import exm.midend.ir.IrDeclarations.IrSimpleFunction;
import exm.midend.ir.IrDeclarations.IrValueParameter;
import exm.midend.ir.IrExpressions.IrCall;
import exm.midend.ir.IrExpressions.IrFunctionReference;
import exm.midend.ir.IrExpressions.IrMemberAccessExpression;
import exm.midend.ir.IrExpressions.IrPropertyReference;
import exm.midend.ir.util.DeepCopySymbolRemapper;
import exm.midend.ir.util.DeepCopyTypeRemapper;
import exm.midend.ir.util.IrUtils;
import exm.midend.ir.util.SymbolRemapper;

/**
 * Turns private member functions into static functions that take the
 * receiver as an explicit first parameter named $this.  Private
 * property accessors are turned into static functions as well.  Calls
 * and references to the old members are redirected to the new
 * functions.
 */
public class PrivateMembersLowering implements FileLoweringPass {

  public static final IrDeclarationOrigin STATIC_THIS_PARAMETER =
                        new IrDeclarationOrigin("STATIC_THIS_PARAMETER");

  public static final String THIS_PARAMETER_NAME = "$this";

  @Override
  public String getPassName() {
    return "Private members to static functions";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.LOWER_PRIVATE_MEMBERS;
  }

  @Override
  public void lower(Logger logger, IrFile file) {
    Map<IrSymbol<IrSimpleFunction>, IrSimpleFunction> memberMap =
              new HashMap<IrSymbol<IrSimpleFunction>, IrSimpleFunction>();
    transformPrivateDeclarations(logger, file, memberMap);
    if (!memberMap.isEmpty()) {
      transformPrivateUseSites(file, memberMap);
    }
    logger.debug("Made " + memberMap.size() + " private members static in "
                 + file.getFileName());
  }

  private void transformPrivateDeclarations(final Logger logger,
      IrFile file,
      final Map<IrSymbol<IrSimpleFunction>, IrSimpleFunction> memberMap) {
    file.transformChildren(new IrElementTransformer<Void>() {
      @Override
      public IrElement visitClass(IrClass declaration, Void data) {
        declaration.transformChildren(this, data);
        List<IrDeclaration> members = declaration.getDeclarations();
        for (int i = 0; i < members.size(); i++) {
          IrDeclaration member = members.get(i);
          if (member instanceof IrSimpleFunction) {
            IrSimpleFunction fn = (IrSimpleFunction)member;
            IrSimpleFunction staticFn = transformMemberToStatic(fn);
            if (staticFn != null) {
              logger.trace("Static replacement for " + fn + " in " +
                           declaration);
              memberMap.put(fn.getSymbol(), staticFn);
              members.set(i, staticFn);
            }
          } else if (member instanceof IrProperty) {
            IrProperty prop = (IrProperty)member;
            if (prop.getGetter() != null) {
              prop.setGetter(transformAccessor(prop.getGetter(), memberMap));
            }
            if (prop.getSetter() != null) {
              prop.setSetter(transformAccessor(prop.getSetter(), memberMap));
            }
          }
        }
        return declaration;
      }
    }, null);
  }

  private IrSimpleFunction transformAccessor(IrSimpleFunction accessor,
      Map<IrSymbol<IrSimpleFunction>, IrSimpleFunction> memberMap) {
    IrSimpleFunction staticFn = transformMemberToStatic(accessor);
    if (staticFn == null) {
      return accessor;
    }
    memberMap.put(accessor.getSymbol(), staticFn);
    return staticFn;
  }

  /**
   * @return static replacement, or null if fn is not a private member
   */
  private IrSimpleFunction transformMemberToStatic(IrSimpleFunction fn) {
    IrValueParameter dispatch = fn.getDispatchReceiverParameter();
    if (fn.getVisibility() != Visibility.PRIVATE || dispatch == null) {
      return null;
    }

    IrSimpleFunction staticFn = new IrSimpleFunction(fn.getStartOffset(),
        fn.getEndOffset(), fn.getOrigin(),
        new IrSymbol<IrSimpleFunction>(IrSymbol.Kind.SIMPLE_FUNCTION),
        fn.getName(), fn.getVisibility(), fn.getModality(),
        fn.getReturnType(), fn.isInline(), fn.isExternal(),
        fn.isTailrec(), fn.isSuspend());
    staticFn.setParent(fn.getParent());
    staticFn.getAnnotations().addAll(fn.getAnnotations());
    staticFn.setCorrespondingPropertySymbol(
                                    fn.getCorrespondingPropertySymbol());

    ParameterRemapper remapper = new ParameterRemapper();
    remapper.put(fn.getSymbol(), staticFn.getSymbol());
    IrUtils.copyTypeParametersFrom(staticFn, fn);
    for (int i = 0; i < fn.getTypeParameters().size(); i++) {
      remapper.put(fn.getTypeParameters().get(i).getSymbol(),
                   staticFn.getTypeParameters().get(i).getSymbol());
    }
    DeepCopyTypeRemapper typeRemapper = new DeepCopyTypeRemapper(remapper);
    staticFn.setReturnType(typeRemapper.remapType(fn.getReturnType()));

    IrValueParameter extension = fn.getExtensionReceiverParameter();
    if (extension != null) {
      IrValueParameter copy = copyParameter(extension, staticFn,
          extension.getOrigin(), extension.getIndex(), extension.getName(),
          typeRemapper);
      staticFn.setExtensionReceiverParameter(copy);
      remapper.put(extension.getSymbol(), copy.getSymbol());
    }

    IrValueParameter thisParam = new IrValueParameter(
        IrConstants.UNDEFINED_OFFSET, IrConstants.UNDEFINED_OFFSET,
        STATIC_THIS_PARAMETER,
        new IrSymbol<IrValueParameter>(IrSymbol.Kind.VALUE_PARAMETER),
        THIS_PARAMETER_NAME, 0, typeRemapper.remapType(dispatch.getType()),
        null, false, false);
    thisParam.setParent(staticFn);
    staticFn.getValueParameters().add(thisParam);
    remapper.put(dispatch.getSymbol(), thisParam.getSymbol());

    for (IrValueParameter param: fn.getValueParameters()) {
      IrValueParameter copy = copyParameter(param, staticFn,
          param.getOrigin(), param.getIndex() + 1, param.getName(),
          typeRemapper);
      staticFn.getValueParameters().add(copy);
      remapper.put(param.getSymbol(), copy.getSymbol());
    }

    // Defaults may refer to earlier parameters
    for (int i = 0; i < fn.getValueParameters().size(); i++) {
      IrValueParameter param = fn.getValueParameters().get(i);
      if (param.getDefaultValue() != null) {
        staticFn.getValueParameters().get(i + 1).setDefaultValue(
            remapper.copy(param.getDefaultValue(), staticFn));
      }
    }

    if (fn.getBody() != null) {
      staticFn.setBody(remapper.copy(fn.getBody(), staticFn));
    }

    if (fn.getCorrespondingPropertySymbol() != null &&
        fn.getCorrespondingPropertySymbol().isBound()) {
      IrProperty prop = fn.getCorrespondingPropertySymbol().getOwner();
      if (prop.getGetter() == fn) {
        prop.setGetter(staticFn);
      } else if (prop.getSetter() == fn) {
        prop.setSetter(staticFn);
      }
    }
    return staticFn;
  }

  private static IrValueParameter copyParameter(IrValueParameter param,
      IrSimpleFunction target, IrDeclarationOrigin origin, int index,
      String name, DeepCopyTypeRemapper typeRemapper) {
    IrValueParameter copy = new IrValueParameter(param.getStartOffset(),
        param.getEndOffset(), origin,
        new IrSymbol<IrValueParameter>(IrSymbol.Kind.VALUE_PARAMETER),
        name, index, typeRemapper.remapType(param.getType()),
        typeRemapper.remapType(param.getVarargElementType()),
        param.isCrossinline(), param.isNoinline());
    copy.setParent(target);
    return copy;
  }

  private void transformPrivateUseSites(IrFile file,
      Map<IrSymbol<IrSimpleFunction>, IrSimpleFunction> memberMap) {
    // Recursive calls in copied bodies already target the static function
    // but still pass a dispatch receiver
    final Map<IrSymbol<IrSimpleFunction>, IrSimpleFunction> targets =
        new HashMap<IrSymbol<IrSimpleFunction>, IrSimpleFunction>(memberMap);
    for (IrSimpleFunction staticFn: memberMap.values()) {
      targets.put(staticFn.getSymbol(), staticFn);
    }
    file.transformChildren(new IrElementTransformer<Void>() {
      @Override
      public IrElement visitCall(IrCall expression, Void data) {
        expression.transformChildren(this, data);
        IrSimpleFunction staticTarget = targets.get(expression.getSymbol());
        if (staticTarget == null || expression.getDispatchReceiver() == null) {
          return expression;
        }
        IrCall call = new IrCall(expression.getStartOffset(),
            expression.getEndOffset(), expression.getType(),
            staticTarget.getSymbol(), staticTarget.getValueParameters().size(),
            expression.getTypeArgumentsCount(),
            expression.getSuperQualifierSymbol());
        call.setExtensionReceiver(expression.getExtensionReceiver());
        call.putValueArgument(0, expression.getDispatchReceiver());
        for (int i = 0; i < expression.getValueArgumentsCount(); i++) {
          call.putValueArgument(i + 1, expression.getValueArgument(i));
        }
        copyTypeArguments(expression, call);
        return call;
      }

      @Override
      public IrElement visitFunctionReference(IrFunctionReference expression,
                                              Void data) {
        expression.transformChildren(this, data);
        IrSimpleFunction staticTarget = targets.get(expression.getSymbol());
        if (staticTarget == null) {
          return expression;
        }
        IrFunctionReference ref = new IrFunctionReference(
            expression.getStartOffset(), expression.getEndOffset(),
            expression.getType(), staticTarget.getSymbol(),
            expression.getValueArgumentsCount(),
            expression.getTypeArgumentsCount());
        copyReferenceArguments(expression, ref);
        return ref;
      }

      @Override
      public IrElement visitPropertyReference(IrPropertyReference expression,
                                              Void data) {
        expression.transformChildren(this, data);
        IrSimpleFunction getter = targets.get(expression.getGetter());
        IrSimpleFunction setter = targets.get(expression.getSetter());
        if (getter == null && setter == null) {
          return expression;
        }
        IrPropertyReference ref = new IrPropertyReference(
            expression.getStartOffset(), expression.getEndOffset(),
            expression.getType(), expression.getSymbol(),
            expression.getTypeArgumentsCount(), expression.getField(),
            getter != null ? getter.getSymbol() : expression.getGetter(),
            setter != null ? setter.getSymbol() : expression.getSetter());
        copyReferenceArguments(expression, ref);
        return ref;
      }
    }, null);
  }

  /**
   * References keep their receivers: the reference is bound the same
   * way, only its target changes
   */
  private static void copyReferenceArguments(IrMemberAccessExpression from,
                                             IrMemberAccessExpression to) {
    to.setDispatchReceiver(from.getDispatchReceiver());
    to.setExtensionReceiver(from.getExtensionReceiver());
    for (int i = 0; i < from.getValueArgumentsCount(); i++) {
      to.putValueArgument(i, from.getValueArgument(i));
    }
    copyTypeArguments(from, to);
  }

  private static void copyTypeArguments(IrMemberAccessExpression from,
                                        IrMemberAccessExpression to) {
    for (int i = 0; i < from.getTypeArgumentsCount(); i++) {
      to.putTypeArgument(i, from.getTypeArgument(i));
    }
  }

  /**
   * Maps the member's parameters, type parameters and symbol to those
   * of the static function.  Declarations inside a copied body get
   * fresh symbols.
   */
  private static class ParameterRemapper implements SymbolRemapper {
    private final Map<IrSymbol<?>, IrSymbol<?>> mapping =
                          new HashMap<IrSymbol<?>, IrSymbol<?>>();
    private DeepCopySymbolRemapper bodyRemapper = null;

    void put(IrSymbol<?> from, IrSymbol<?> to) {
      mapping.put(from, to);
    }

    <T extends IrElement> T copy(T element, IrSimpleFunction parent) {
      bodyRemapper = new DeepCopySymbolRemapper();
      bodyRemapper.walk(element);
      try {
        return IrUtils.deepCopy(element, this, parent);
      } finally {
        bodyRemapper = null;
      }
    }

    @Override
    public <T extends IrSymbolOwner> IrSymbol<T> getDeclared(
                                                IrSymbol<T> symbol) {
      return bodyRemapper.getDeclared(symbol);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T extends IrSymbolOwner> IrSymbol<T> getReferenced(
                                                IrSymbol<T> symbol) {
      IrSymbol<?> mapped = mapping.get(symbol);
      if (mapped != null) {
        return (IrSymbol<T>)mapped;
      }
      return bodyRemapper == null ? symbol :
                                    bodyRemapper.getReferenced(symbol);
    }
  }
}
