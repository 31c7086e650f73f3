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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import exm.midend.common.exceptions.UnresolvedIdentityError;
import exm.midend.ir.FqName;
import exm.midend.ir.IrDeclarationOrigin;
import exm.midend.ir.IrDeclarationParent;
import exm.midend.ir.IrElement;
import exm.midend.ir.IrSymbol;
import exm.midend.ir.IrSymbolOwner;
import exm.midend.ir.IrTreeWalker;
import exm.midend.ir.IrTypeParametersContainer;
import exm.midend.ir.IrDeclarations.IrClass;
import exm.midend.ir.IrDeclarations.IrDeclaration;
import exm.midend.ir.IrDeclarations.IrFunction;
import exm.midend.ir.IrDeclarations.IrPackageFragment;
import exm.midend.ir.IrDeclarations.IrTypeParameter;
import exm.midend.ir.IrDeclarations.IrValueParameter;
import exm.midend.ir.IrTypes.IrSimpleType;
import exm.midend.ir.IrTypes.IrType;

/**
 * Static helpers for building, copying and navigating IR trees
 */
public class IrUtils {

  /**
   * Copy element with fresh symbols for every declaration inside it.
   * References to declarations outside element are kept.
   * @param initialParent parent for the copied root, or null to leave
   *          the root without a parent
   */
  public static <T extends IrElement> T deepCopyWithSymbols(T element,
                                      IrDeclarationParent initialParent) {
    DeepCopySymbolRemapper symbolRemapper = new DeepCopySymbolRemapper();
    symbolRemapper.walk(element);
    return deepCopy(element, symbolRemapper, initialParent);
  }

  /**
   * Copy element using the given remapper for all symbols
   */
  @SuppressWarnings("unchecked")
  public static <T extends IrElement> T deepCopy(T element,
          SymbolRemapper symbolRemapper, IrDeclarationParent initialParent) {
    DeepCopyTypeRemapper typeRemapper =
                              new DeepCopyTypeRemapper(symbolRemapper);
    IrElement copy = element.accept(
        new DeepCopyIrTreeWithSymbols(symbolRemapper, typeRemapper), null);
    patchDeclarationParents(copy, initialParent);
    return (T)copy;
  }

  /**
   * Set the parent of every declaration under element to its innermost
   * enclosing declaration parent.  Properties are not parents: their
   * accessors and field get the property's parent.
   * @param initialParent parent for element itself if it is a
   *          declaration, or null to leave it unchanged
   */
  public static void patchDeclarationParents(IrElement element,
                                    IrDeclarationParent initialParent) {
    new ParentPatcher(initialParent).walk(element);
  }

  private static class ParentPatcher extends IrTreeWalker {
    private final Deque<IrDeclarationParent> parents =
                                  new ArrayDeque<IrDeclarationParent>();

    ParentPatcher(IrDeclarationParent initialParent) {
      if (initialParent != null) {
        parents.push(initialParent);
      }
    }

    @Override
    public Void visitElement(IrElement element, Void data) {
      if (element instanceof IrDeclaration && !parents.isEmpty()) {
        ((IrDeclaration)element).setParent(parents.peek());
      }
      if (element instanceof IrDeclarationParent) {
        parents.push((IrDeclarationParent)element);
        element.acceptChildren(this, null);
        parents.pop();
      } else {
        element.acceptChildren(this, null);
      }
      return null;
    }
  }

  /**
   * @return the outermost declaration enclosing declaration, which is
   *    declaration itself if it is top-level
   */
  public static IrDeclaration findTopLevelDeclaration(
                                            IrDeclaration declaration) {
    IrDeclaration current = declaration;
    while (current.getParent() instanceof IrDeclaration) {
      current = (IrDeclaration)current.getParent();
    }
    return current;
  }

  /**
   * @return package fragment containing the top-level declaration
   *          enclosing declaration
   * @throws UnresolvedIdentityError if the chain of parents doesn't end
   *          in a package fragment
   */
  public static IrPackageFragment findPackageFragment(
                                            IrDeclaration declaration) {
    IrDeclaration top = findTopLevelDeclaration(declaration);
    if (!(top.getParent() instanceof IrPackageFragment)) {
      throw new UnresolvedIdentityError("Top-level declaration " + top +
          " enclosing " + declaration + " is not in a package fragment: "
          + top.getParent());
    }
    return (IrPackageFragment)top.getParent();
  }

  public static FqName fqNameWhenAvailable(IrDeclaration declaration) {
    return declaration.fqNameWhenAvailable();
  }

  /**
   * Add copies of source's type parameters to target.  Bounds that
   * refer to source's type parameters are rewritten to the copies.
   */
  public static void copyTypeParametersFrom(IrTypeParametersContainer target,
                                     IrTypeParametersContainer source) {
    final Map<IrSymbol<?>, IrSymbol<?>> mapping =
                          new HashMap<IrSymbol<?>, IrSymbol<?>>();
    List<IrTypeParameter> copies = new ArrayList<IrTypeParameter>();
    for (IrTypeParameter tp: source.getTypeParameters()) {
      IrTypeParameter copy = new IrTypeParameter(tp.getStartOffset(),
          tp.getEndOffset(), tp.getOrigin(),
          new IrSymbol<IrTypeParameter>(IrSymbol.Kind.TYPE_PARAMETER,
                                        tp.getSymbol().getDescriptor()),
          tp.getName(), tp.getIndex(), tp.isReified());
      copy.setParent(target);
      mapping.put(tp.getSymbol(), copy.getSymbol());
      copies.add(copy);
    }

    DeepCopyTypeRemapper boundRemapper = new DeepCopyTypeRemapper(
                                                new SymbolRemapper() {
      @Override
      public <T extends IrSymbolOwner> IrSymbol<T> getDeclared(
                                                  IrSymbol<T> symbol) {
        return symbol;
      }

      @Override
      @SuppressWarnings("unchecked")
      public <T extends IrSymbolOwner> IrSymbol<T> getReferenced(
                                                  IrSymbol<T> symbol) {
        IrSymbol<?> mapped = mapping.get(symbol);
        return mapped == null ? symbol : (IrSymbol<T>)mapped;
      }
    });
    for (int i = 0; i < copies.size(); i++) {
      IrTypeParameter copy = copies.get(i);
      copy.getSuperTypes().addAll(boundRemapper.remapTypes(
                  source.getTypeParameters().get(i).getSuperTypes()));
      target.getTypeParameters().add(copy);
    }
  }

  /**
   * Add copies of source's type parameters, receivers and value
   * parameters to target
   */
  public static void copyParameterDeclarationsFrom(IrFunction target,
                                                   IrFunction source) {
    copyTypeParametersFrom(target, source);
    IrValueParameter dispatch = source.getDispatchReceiverParameter();
    if (dispatch != null) {
      target.setDispatchReceiverParameter(copyTo(dispatch, target,
                                                 dispatch.getIndex()));
    }
    IrValueParameter extension = source.getExtensionReceiverParameter();
    if (extension != null) {
      target.setExtensionReceiverParameter(copyTo(extension, target,
                                                  extension.getIndex()));
    }
    for (IrValueParameter param: source.getValueParameters()) {
      target.getValueParameters().add(copyTo(param, target,
                                             param.getIndex()));
    }
  }

  /**
   * Create the receiver parameter of cls
   */
  public static void createParameterDeclarations(IrClass cls) {
    List<IrType> args = new ArrayList<IrType>();
    for (IrTypeParameter tp: cls.getTypeParameters()) {
      args.add(new IrSimpleType(tp.getSymbol(), false));
    }
    IrValueParameter thisReceiver = new IrValueParameter(
        cls.getStartOffset(), cls.getEndOffset(),
        IrDeclarationOrigin.INSTANCE_RECEIVER,
        new IrSymbol<IrValueParameter>(IrSymbol.Kind.VALUE_PARAMETER),
        "<this>", -1, new IrSimpleType(cls.getSymbol(), false, args),
        null, false, false);
    thisReceiver.setParent(cls);
    cls.setThisReceiver(thisReceiver);
  }

  /**
   * Copy a value parameter into target, keeping its name and origin
   */
  public static IrValueParameter copyTo(IrValueParameter param,
                                        IrFunction target, int index) {
    return copyTo(param, target, param.getOrigin(), index, param.getName());
  }

  /**
   * Copy a value parameter into target.  The default value, if any, is
   * deep copied.  The copy is not added to any parameter list.
   */
  public static IrValueParameter copyTo(IrValueParameter param,
          IrFunction target, IrDeclarationOrigin origin, int index,
          String name) {
    IrValueParameter copy = new IrValueParameter(param.getStartOffset(),
        param.getEndOffset(), origin,
        new IrSymbol<IrValueParameter>(IrSymbol.Kind.VALUE_PARAMETER),
        name, index, param.getType(), param.getVarargElementType(),
        param.isCrossinline(), param.isNoinline());
    copy.setParent(target);
    if (param.getDefaultValue() != null) {
      copy.setDefaultValue(deepCopyWithSymbols(param.getDefaultValue(),
                                               target));
    }
    return copy;
  }
}
