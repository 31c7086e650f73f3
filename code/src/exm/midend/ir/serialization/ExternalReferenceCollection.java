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

package exm.midend.ir.serialization;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.midend.common.Logging;
import exm.midend.common.exceptions.StructuralInvariantError;
import exm.midend.common.exceptions.UnresolvedIdentityError;
import exm.midend.common.exceptions.UnsupportedInputError;
import exm.midend.ir.FqName;
import exm.midend.ir.IrConstants;
import exm.midend.ir.IrDeclarationContainer;
import exm.midend.ir.IrDeclarationParent;
import exm.midend.ir.IrSymbol;
import exm.midend.ir.IrSymbolOwner;
import exm.midend.ir.IrTypes;
import exm.midend.ir.IrDeclarations.IrClass;
import exm.midend.ir.IrDeclarations.IrConstructor;
import exm.midend.ir.IrDeclarations.IrDeclaration;
import exm.midend.ir.IrDeclarations.IrEnumEntry;
import exm.midend.ir.IrDeclarations.IrExternalPackageFragment;
import exm.midend.ir.IrDeclarations.IrField;
import exm.midend.ir.IrDeclarations.IrFunction;
import exm.midend.ir.IrDeclarations.IrPackageFragment;
import exm.midend.ir.IrDeclarations.IrProperty;
import exm.midend.ir.IrDeclarations.IrSimpleFunction;
import exm.midend.ir.IrDeclarations.IrValueParameter;
import exm.midend.ir.IrExpressions.IrConstructorCall;
import exm.midend.ir.IrExpressions.IrExpression;
import exm.midend.ir.util.IrUtils;

/**
 * Working state for extracting the external references of one unit,
 * i.e. one file or one top-level class.
 *
 * Each declaration outside the unit that is referenced gets one
 * bodiless mirror, holding just enough to refer to it from another
 * unit.  Mirrors are placed in a mirrored parent chain that ends in a
 * placeholder package fragment, one per package name.
 *
 * Use one instance per unit and discard it afterwards.
 */
public class ExternalReferenceCollection {
  private final Logger logger;
  private final IrDeclarationParent toplevel;
  private final boolean undefinedOffsets;

  /** Original symbol to mirror.  Symbols are compared by identity */
  private final Map<IrSymbol<?>, IrSymbolOwner> references =
                              new HashMap<IrSymbol<?>, IrSymbolOwner>();

  /** One placeholder per package name */
  private final Map<FqName, IrExternalPackageFragment> packagePlaceholders =
                  new HashMap<FqName, IrExternalPackageFragment>();

  /** Directly referenced mirrors, in order of first reference */
  private final Map<IrDeclaration, IrPackageFragment>
        referenceToPackageFragment =
            new LinkedHashMap<IrDeclaration, IrPackageFragment>();

  /** Directly referenced mirror to the declaration it mirrors */
  private final Map<IrDeclaration, IrDeclaration> originals =
                            new HashMap<IrDeclaration, IrDeclaration>();

  /**
   * @param toplevel the unit: a file or a top-level class
   * @param undefinedOffsets if true, mirrors get UNDEFINED_OFFSET
   *                         instead of the original offsets
   */
  public ExternalReferenceCollection(Logger logger,
            IrDeclarationParent toplevel, boolean undefinedOffsets) {
    this.logger = logger;
    this.toplevel = toplevel;
    this.undefinedOffsets = undefinedOffsets;
  }

  /**
   * @return distinct package fragments of referenced mirrors, in order
   *         of first reference
   */
  public List<IrPackageFragment> getPackageFragments() {
    return new ArrayList<IrPackageFragment>(new LinkedHashSet<IrPackageFragment>(
                                  referenceToPackageFragment.values()));
  }

  public Map<IrDeclaration, IrPackageFragment>
                                  getReferenceToPackageFragmentMap() {
    return Collections.unmodifiableMap(referenceToPackageFragment);
  }

  /**
   * @return the declaration that a recorded mirror was made from
   */
  public IrDeclaration getOriginal(IrDeclaration mirror) {
    IrDeclaration original = originals.get(mirror);
    if (original == null) {
      throw new UnresolvedIdentityError("Not a recorded mirror: " + mirror);
    }
    return original;
  }

  /**
   * @return true if declaration is the unit or lives inside it
   */
  public boolean isInUnit(IrSymbolOwner owner) {
    if (owner == toplevel) {
      return true;
    }
    if (owner instanceof IrDeclaration) {
      IrDeclaration top = IrUtils.findTopLevelDeclaration(
                                              (IrDeclaration)owner);
      return top == toplevel || top.getParent() == toplevel;
    }
    return false;
  }

  /**
   * Get the mirror of a referenced declaration and record the reference.
   * A declaration inside the unit is returned unchanged and not recorded.
   */
  public <T extends IrDeclaration> T getCopy(T declaration) {
    if (isInUnit(declaration)) {
      return declaration;
    }
    T copy = getCopyInternal(declaration);
    referenceToPackageFragment.put(copy, IrUtils.findPackageFragment(copy));
    originals.put(copy, declaration);
    return copy;
  }

  /**
   * Get or make the mirror of owner without recording a reference
   */
  @SuppressWarnings("unchecked")
  <T extends IrSymbolOwner> T getCopyInternal(T owner) {
    if (isInUnit(owner)) {
      return owner;
    }
    IrSymbolOwner memo = references.get(owner.getSymbol());
    if (memo != null) {
      return (T)memo;
    }

    if (owner instanceof IrPackageFragment) {
      return (T)copyPackageFragment((IrPackageFragment)owner);
    } else if (owner instanceof IrDeclaration) {
      return (T)copyDeclaration((IrDeclaration)owner);
    } else {
      throw new UnsupportedInputError("Can't mirror " + owner);
    }
  }

  private IrExternalPackageFragment copyPackageFragment(
                                        IrPackageFragment fragment) {
    IrExternalPackageFragment placeholder =
                      packagePlaceholders.get(fragment.getFqName());
    if (placeholder == null) {
      placeholder = new IrExternalPackageFragment(
          new IrSymbol<IrExternalPackageFragment>(
                        IrSymbol.Kind.EXTERNAL_PACKAGE_FRAGMENT,
                        fragment.getSymbol().getDescriptor()),
          fragment.getFqName());
      packagePlaceholders.put(fragment.getFqName(), placeholder);
    }
    references.put(fragment.getSymbol(), placeholder);
    return placeholder;
  }

  private IrDeclaration copyDeclaration(IrDeclaration declaration) {
    IrDeclarationParent parent = declaration.getParent();
    if (!(parent instanceof IrSymbolOwner)) {
      throw new UnresolvedIdentityError("Parent chain of " + declaration +
              " does not end in a package fragment: " + parent);
    }
    IrSymbolOwner parentCopy = getCopyInternal((IrSymbolOwner)parent);
    if (!(parentCopy instanceof IrDeclarationContainer)) {
      throw new UnresolvedIdentityError("Can't mirror local declaration "
              + declaration + " inside " + parent);
    }
    IrDeclarationContainer container = (IrDeclarationContainer)parentCopy;

    IrDeclaration copy = bodilessCopyTo(declaration, container);
    // Must be registered before linking properties and accessors
    references.put(declaration.getSymbol(), (IrSymbolOwner)copy);

    if (declaration instanceof IrProperty) {
      linkPropertyCopy((IrProperty)declaration, (IrProperty)copy, container);
      container.getDeclarations().add(copy);
    } else if (declaration instanceof IrSimpleFunction &&
        ((IrSimpleFunction)declaration).getCorrespondingPropertySymbol()
                                                                != null) {
      // Accessors are reached through their property, not the container
      IrProperty property = ((IrSimpleFunction)declaration)
                              .getCorrespondingPropertySymbol().getOwner();
      checkAccessorPairing(property, declaration);
      IrProperty propertyCopy = getCopyInternal(property);
      ((IrSimpleFunction)copy).setCorrespondingPropertySymbol(
                                          propertyCopy.getSymbol());
    } else if (declaration instanceof IrField &&
        ((IrField)declaration).getCorrespondingPropertySymbol() != null) {
      IrProperty property = ((IrField)declaration)
                              .getCorrespondingPropertySymbol().getOwner();
      checkAccessorPairing(property, declaration);
      IrProperty propertyCopy = getCopyInternal(property);
      ((IrField)copy).setCorrespondingPropertySymbol(
                                          propertyCopy.getSymbol());
    } else {
      container.getDeclarations().add(copy);
    }

    copyAnnotations(declaration, copy);
    return copy;
  }

  /**
   * Mirror the accessors and backing field of property, reusing any
   * already mirrored, and link them both ways with the property mirror
   */
  private void linkPropertyCopy(IrProperty property, IrProperty copy,
                                IrDeclarationContainer container) {
    if (property.getGetter() != null) {
      checkPropertyOf(property.getGetter().getCorrespondingPropertySymbol(),
                      property, property.getGetter());
      IrSimpleFunction getter = accessorCopy(property.getGetter(), container);
      getter.setCorrespondingPropertySymbol(copy.getSymbol());
      copy.setGetter(getter);
    }
    if (property.getSetter() != null) {
      checkPropertyOf(property.getSetter().getCorrespondingPropertySymbol(),
                      property, property.getSetter());
      IrSimpleFunction setter = accessorCopy(property.getSetter(), container);
      setter.setCorrespondingPropertySymbol(copy.getSymbol());
      copy.setSetter(setter);
    }
    if (property.getBackingField() != null) {
      IrField field = property.getBackingField();
      checkPropertyOf(field.getCorrespondingPropertySymbol(), property, field);
      IrField fieldCopy = (IrField)references.get(field.getSymbol());
      if (fieldCopy == null) {
        fieldCopy = (IrField)bodilessCopyTo(field, container);
        references.put(field.getSymbol(), fieldCopy);
        copyAnnotations(field, fieldCopy);
      }
      fieldCopy.setCorrespondingPropertySymbol(copy.getSymbol());
      copy.setBackingField(fieldCopy);
    }
  }

  private IrSimpleFunction accessorCopy(IrSimpleFunction accessor,
                                        IrDeclarationContainer container) {
    IrSimpleFunction existing =
                      (IrSimpleFunction)references.get(accessor.getSymbol());
    if (existing != null) {
      return existing;
    }
    IrSimpleFunction copy = (IrSimpleFunction)bodilessCopyTo(accessor,
                                                             container);
    references.put(accessor.getSymbol(), copy);
    copyAnnotations(accessor, copy);
    return copy;
  }

  private void checkPropertyOf(IrSymbol<IrProperty> propertySymbol,
                          IrProperty property, IrDeclaration member) {
    if (propertySymbol != property.getSymbol()) {
      throw new StructuralInvariantError(member + " is an accessor or " +
          "field of " + property + " but refers to property "
          + propertySymbol);
    }
  }

  private void checkAccessorPairing(IrProperty property,
                                    IrDeclaration member) {
    if (property.getGetter() != member && property.getSetter() != member &&
        property.getBackingField() != member) {
      throw new StructuralInvariantError(member + " refers to property " +
          property + " which has no such accessor or field");
    }
  }

  /**
   * Annotations with an error-typed argument are dropped
   */
  private void copyAnnotations(IrDeclaration from, IrDeclaration to) {
    ExternalReferenceSymbolRemapper remapper =
                            new ExternalReferenceSymbolRemapper(this);
    for (IrConstructorCall annotation: from.getAnnotations()) {
      if (hasErrorTypedArgument(annotation)) {
        Logging.uniqueWarn("Dropping annotation " + annotation + " of " +
                           from + ": argument of error type");
        continue;
      }
      to.getAnnotations().add(IrUtils.deepCopy(annotation, remapper, null));
    }
  }

  private static boolean hasErrorTypedArgument(IrConstructorCall annotation) {
    for (int i = 0; i < annotation.getValueArgumentsCount(); i++) {
      IrExpression arg = annotation.getValueArgument(i);
      if (arg != null && IrTypes.isError(arg.getType())) {
        return true;
      }
    }
    return false;
  }

  private int startOffset(IrDeclaration declaration) {
    return undefinedOffsets ? IrConstants.UNDEFINED_OFFSET
                            : declaration.getStartOffset();
  }

  private int endOffset(IrDeclaration declaration) {
    return undefinedOffsets ? IrConstants.UNDEFINED_OFFSET
                            : declaration.getEndOffset();
  }

  /**
   * Make a mirror of declaration with parent newParent.  The mirror is
   * not added to the parent's declarations.  Types are kept as they
   * are: type parameters in return and field types are not remapped.
   */
  private IrDeclaration bodilessCopyTo(IrDeclaration declaration,
                                       IrDeclarationParent newParent) {
    int start = startOffset(declaration);
    int end = endOffset(declaration);
    IrDeclaration copy;
    if (declaration instanceof IrEnumEntry) {
      IrEnumEntry entry = (IrEnumEntry)declaration;
      copy = new IrEnumEntry(start, end, entry.getOrigin(),
          new IrSymbol<IrEnumEntry>(IrSymbol.Kind.ENUM_ENTRY,
                                    entry.getSymbol().getDescriptor()),
          entry.getName());
      copy.setParent(newParent);
    } else if (declaration instanceof IrClass) {
      IrClass cls = (IrClass)declaration;
      IrClass clsCopy = new IrClass(start, end, cls.getOrigin(),
          new IrSymbol<IrClass>(IrSymbol.Kind.CLASS,
                                cls.getSymbol().getDescriptor()),
          cls.getName(), cls.getKind(), cls.getVisibility(),
          cls.getModality(), cls.isCompanion(), cls.isInner(), cls.isData(),
          cls.isExternal(), cls.isInline());
      clsCopy.setParent(newParent);
      IrUtils.createParameterDeclarations(clsCopy);
      IrUtils.copyTypeParametersFrom(clsCopy, cls);
      copy = clsCopy;
    } else if (declaration instanceof IrConstructor) {
      IrConstructor ctor = (IrConstructor)declaration;
      IrConstructor ctorCopy = new IrConstructor(start, end, ctor.getOrigin(),
          new IrSymbol<IrConstructor>(IrSymbol.Kind.CONSTRUCTOR,
                                      ctor.getSymbol().getDescriptor()),
          ctor.getName(), ctor.getVisibility(), ctor.getReturnType(),
          ctor.isInline(), ctor.isExternal(), ctor.isPrimary());
      ctorCopy.setParent(newParent);
      copySignature(ctor, ctorCopy);
      copy = ctorCopy;
    } else if (declaration instanceof IrSimpleFunction) {
      IrSimpleFunction fn = (IrSimpleFunction)declaration;
      IrSimpleFunction fnCopy = new IrSimpleFunction(start, end,
          fn.getOrigin(),
          new IrSymbol<IrSimpleFunction>(IrSymbol.Kind.SIMPLE_FUNCTION,
                                         fn.getSymbol().getDescriptor()),
          fn.getName(), fn.getVisibility(), fn.getModality(),
          fn.getReturnType(), fn.isInline(), fn.isExternal(),
          fn.isTailrec(), fn.isSuspend());
      fnCopy.setParent(newParent);
      copySignature(fn, fnCopy);
      for (IrSymbol<IrSimpleFunction> overridden: fn.getOverriddenSymbols()) {
        fnCopy.getOverriddenSymbols().add(
                  getCopyInternal(overridden.getOwner()).getSymbol());
      }
      copy = fnCopy;
    } else if (declaration instanceof IrProperty) {
      IrProperty prop = (IrProperty)declaration;
      copy = new IrProperty(start, end, prop.getOrigin(),
          new IrSymbol<IrProperty>(IrSymbol.Kind.PROPERTY,
                                   prop.getSymbol().getDescriptor()),
          prop.getName(), prop.getVisibility(), prop.getModality(),
          prop.isVar(), prop.isConst(), prop.isLateinit(),
          prop.isDelegated(), prop.isExternal());
      copy.setParent(newParent);
    } else if (declaration instanceof IrField) {
      IrField field = (IrField)declaration;
      IrField fieldCopy = new IrField(start, end, field.getOrigin(),
          new IrSymbol<IrField>(IrSymbol.Kind.FIELD,
                                field.getSymbol().getDescriptor()),
          field.getName(), field.getType(), field.getVisibility(),
          field.isFinal(), field.isExternal(), field.isStatic());
      fieldCopy.setParent(newParent);
      for (IrSymbol<IrField> overridden: field.getOverriddenSymbols()) {
        fieldCopy.getOverriddenSymbols().add(
                  getCopyInternal(overridden.getOwner()).getSymbol());
      }
      copy = fieldCopy;
    } else {
      throw new UnsupportedInputError("No mirroring rule for declaration "
                                      + declaration);
    }

    if (logger.isTraceEnabled()) {
      logger.trace("Mirrored " + declaration + " into " + newParent);
    }
    return copy;
  }

  /**
   * Copy parameters of a function, without default values
   */
  private void copySignature(IrFunction from, IrFunction to) {
    IrUtils.copyParameterDeclarationsFrom(to, from);
    for (IrValueParameter param: to.getValueParameters()) {
      param.setDefaultValue(null);
    }
  }
}
